package com.example.cvpipeline.model;

import java.util.List;

/**
 * Target keywords found and missing in a body of text.
 */
public record KeywordCoverage(List<String> found, List<String> missing) {

    public KeywordCoverage {
        found = found != null ? List.copyOf(found) : List.of();
        missing = missing != null ? List.copyOf(missing) : List.of();
    }

    public static KeywordCoverage empty() {
        return new KeywordCoverage(List.of(), List.of());
    }

    /** Share of keywords found; 1.0 when there were no keywords to look for. */
    public double ratio() {
        int total = found.size() + missing.size();
        return total == 0 ? 1.0 : (double) found.size() / total;
    }
}
