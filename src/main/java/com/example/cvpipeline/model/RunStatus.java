package com.example.cvpipeline.model;

public enum RunStatus {
    /** Every guarantee held. */
    COMPLETED,
    /** A CV was produced but at least one guarantee was relaxed; see the degradations. */
    DEGRADED
}
