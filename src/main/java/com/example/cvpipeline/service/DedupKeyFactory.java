package com.example.cvpipeline.service;

import com.example.cvpipeline.model.DedupKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds {@link DedupKey}s: lowercase, punctuation stripped (metric symbols kept), stop words
 * removed, whitespace collapsed. Metric spellings are normalized first so "40 percent" and "40%"
 * produce the same key.
 */
public final class DedupKeyFactory {

    private static final Pattern PERCENT_WORD = Pattern.compile("\\s*\\b(per\\s?cent|percent)\\b");
    private static final Pattern THOUSANDS = Pattern.compile("(\\d),(\\d{3})(?!\\d)");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}%$.\\s]");
    private static final Pattern NON_DECIMAL_DOT = Pattern.compile("(?<!\\d)\\.|\\.(?!\\d)");

    private DedupKeyFactory() {
    }

    public static DedupKey keyOf(String text) {
        if (text == null) return new DedupKey("");
        String lower = MarkupSanitizer.strip(text).toLowerCase(Locale.ROOT);
        lower = PERCENT_WORD.matcher(lower).replaceAll("%");
        lower = THOUSANDS.matcher(lower).replaceAll("$1$2");
        lower = PUNCTUATION.matcher(lower).replaceAll(" ");
        // dots survive only inside decimals such as 1.5
        lower = NON_DECIMAL_DOT.matcher(lower).replaceAll(" ");

        List<String> tokens = new ArrayList<>();
        for (String token : lower.trim().split("\\s+")) {
            if (!token.isEmpty() && !TextSimilarity.STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return new DedupKey(String.join(" ", tokens));
    }
}
