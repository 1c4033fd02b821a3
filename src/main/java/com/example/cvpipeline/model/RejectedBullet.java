package com.example.cvpipeline.model;

public record RejectedBullet(CandidateBullet bullet, RejectionReason reason, String detail) {
}
