package com.example.cvpipeline.model;

public enum GradingMethod {
    MODEL,
    RULE_BASED
}
