package com.example.cvpipeline.model;

public enum BudgetStatus {
    WITHIN,
    UNDER_MIN,
    OVER_MAX
}
