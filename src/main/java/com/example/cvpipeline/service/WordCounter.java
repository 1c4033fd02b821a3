package com.example.cvpipeline.service;

/**
 * Counts words the way the budget is measured: whitespace-separated tokens holding at least one
 * letter or digit. Separators such as bullet glyphs, pipes and dashes are not words.
 */
public final class WordCounter {

    private WordCounter() {
    }

    public static int count(String text) {
        if (text == null || text.isBlank()) return 0;
        int words = 0;
        for (String token : text.trim().split("\\s+")) {
            if (token.chars().anyMatch(Character::isLetterOrDigit)) {
                words++;
            }
        }
        return words;
    }
}
