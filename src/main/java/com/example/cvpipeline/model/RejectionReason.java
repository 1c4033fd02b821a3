package com.example.cvpipeline.model;

/**
 * Why the validator refused a candidate bullet.
 */
public enum RejectionReason {
    EMPTY,
    UNKNOWN_SOURCE,
    UNSUPPORTED_METRIC,
    TOO_LONG,
    GENERIC_OPENING,
    BOILERPLATE_LIST
}
