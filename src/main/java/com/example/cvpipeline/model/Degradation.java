package com.example.cvpipeline.model;

public record Degradation(DegradationKind kind, String detail) {
}
