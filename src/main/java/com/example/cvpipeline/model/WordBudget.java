package com.example.cvpipeline.model;

/**
 * Inclusive word range for the whole rendered CV.
 */
public record WordBudget(int minWords, int maxWords) {

    public WordBudget {
        if (minWords < 0 || maxWords < minWords) {
            throw new IllegalArgumentException("Invalid word budget [" + minWords + ", " + maxWords + "]");
        }
    }

    public boolean contains(int words) {
        return words >= minWords && words <= maxWords;
    }
}
