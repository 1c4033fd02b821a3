package com.example.cvpipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A draft section the grader wants revised.
 * <p>
 * Section ids: {@code header:summary}, {@code header:skills}, {@code role:<roleId>}, {@code bullet:<bulletId>}.
 */
public record FlaggedSection(String sectionId, String reason) {

    public static final String HEADER_SUMMARY = "header:summary";
    public static final String HEADER_SKILLS = "header:skills";
    public static final String ROLE_PREFIX = "role:";
    public static final String BULLET_PREFIX = "bullet:";

    @JsonIgnore
    public boolean isHeader() {
        return sectionId.startsWith("header:");
    }

    @JsonIgnore
    public boolean isRole() {
        return sectionId.startsWith(ROLE_PREFIX);
    }

    @JsonIgnore
    public boolean isBullet() {
        return sectionId.startsWith(BULLET_PREFIX);
    }

    /** Role id or bullet id the flag points at. */
    @JsonIgnore
    public String targetId() {
        int colon = sectionId.indexOf(':');
        return sectionId.substring(colon + 1);
    }
}
