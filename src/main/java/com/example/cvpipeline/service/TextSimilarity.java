package com.example.cvpipeline.service;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * String similarity helpers shared by deduplication and header grounding. No model calls.
 */
public final class TextSimilarity {

    /** Words that carry no claim on their own. */
    public static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "of", "to", "in", "on", "for", "with", "by", "at",
            "from", "as", "into", "over", "across", "via", "per", "its", "their", "our", "my", "his",
            "her", "this", "that", "these", "those", "is", "was", "were", "are", "be", "been", "being",
            "while", "through", "within", "using", "which", "who", "whom", "than", "then", "so",
            "it", "they", "we", "i", "also", "both", "more", "most", "all", "any", "each");

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}%$.+#/]+");

    private TextSimilarity() {
    }

    /**
     * Normalizes text: lowercase, strip punctuation, collapse spaces.
     */
    public static String normalize(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("[\\p{Punct}&&[^%$]]", " ")
                .replaceAll("\\s+", " ")
                .strip();
    }

    /**
     * Lower-cased content words (stop words and one-letter tokens removed), in first-seen order.
     */
    public static Set<String> contentWords(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null) return words;
        for (String token : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            String word = trimTrailingDots(token);
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }

    /** Jaccard index of two token collections. */
    public static double jaccard(List<String> a, List<String> b) {
        Set<String> setA = new HashSet<>(a);
        Set<String> setB = new HashSet<>(b);
        if (setA.isEmpty() && setB.isEmpty()) return 1.0;
        Set<String> union = new HashSet<>(setA);
        union.addAll(setB);
        setA.retainAll(setB);
        return (double) setA.size() / union.size();
    }

    /**
     * Levenshtein similarity in [0, 1].
     */
    public static double levenshteinSimilarity(String a, String b) {
        if (a.equals(b)) return 1.0;
        int maxLen = Math.max(a.length(), b.length());
        if (maxLen == 0) return 1.0;
        return 1.0 - ((double) levenshteinDistance(a, b) / maxLen);
    }

    /**
     * Levenshtein distance in O(min(m,n)) space.
     */
    static int levenshteinDistance(String a, String b) {
        if (a.length() > b.length()) { String t = a; a = b; b = t; }

        int[] prev = new int[a.length() + 1];
        int[] curr = new int[a.length() + 1];

        for (int i = 0; i <= a.length(); i++) prev[i] = i;

        for (int j = 1; j <= b.length(); j++) {
            curr[0] = j;
            for (int i = 1; i <= a.length(); i++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[i] = Math.min(Math.min(curr[i - 1] + 1, prev[i] + 1), prev[i - 1] + cost);
            }
            int[] temp = prev; prev = curr; curr = temp;
        }

        return prev[a.length()];
    }

    /**
     * Near-duplicate score of two token lists: the larger of token Jaccard and character
     * Levenshtein similarity over the joined tokens.
     */
    public static double nearDuplicateScore(List<String> a, List<String> b) {
        return Math.max(jaccard(a, b), levenshteinSimilarity(String.join(" ", a), String.join(" ", b)));
    }

    /** Case-insensitive whole-phrase match, so "java" does not match "javascript". */
    public static boolean containsPhrase(String text, String phrase) {
        if (text == null || phrase == null || phrase.isBlank()) return false;
        return phrasePattern(phrase).matcher(text).find();
    }

    public static Pattern phrasePattern(String phrase) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(phrase.strip()) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String trimTrailingDots(String token) {
        int end = token.length();
        while (end > 0 && token.charAt(end - 1) == '.') end--;
        return token.substring(0, end);
    }
}
