package com.example.cvpipeline.service;

import java.util.regex.Pattern;

/**
 * Strips markdown and HTML that models (and some corpus files) slip into plain text.
 */
public final class MarkupSanitizer {

    private static final Pattern LINK = Pattern.compile("\\[([^\\]]*)]\\([^)]*\\)");
    private static final Pattern HTML_TAG = Pattern.compile("</?[a-zA-Z][^>]*>");
    private static final Pattern EMPHASIS = Pattern.compile("(\\*\\*|__|\\*|`+|~~)");
    private static final Pattern HEADING = Pattern.compile("(?m)^\\s{0,3}#{1,6}\\s*");
    private static final Pattern UNDERSCORE_EMPHASIS = Pattern.compile("(?<![\\w])_([^_]+)_(?![\\w])");
    private static final Pattern SPACES = Pattern.compile("[ \\t]+");

    private MarkupSanitizer() {
    }

    public static String strip(String text) {
        if (text == null) return "";
        String result = LINK.matcher(text).replaceAll("$1");
        result = HTML_TAG.matcher(result).replaceAll("");
        result = HEADING.matcher(result).replaceAll("");
        result = EMPHASIS.matcher(result).replaceAll("");
        result = UNDERSCORE_EMPHASIS.matcher(result).replaceAll("$1");
        return SPACES.matcher(result).replaceAll(" ").strip();
    }

    /** True when {@link #strip(String)} would change anything besides whitespace. */
    public static boolean containsMarkup(String text) {
        if (text == null) return false;
        return !SPACES.matcher(text).replaceAll(" ").strip().equals(strip(text));
    }
}
