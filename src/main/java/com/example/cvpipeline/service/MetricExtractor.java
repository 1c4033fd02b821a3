package com.example.cvpipeline.service;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts quantified tokens (percentages, money, multipliers, counts, durations, volumes) and
 * normalizes them so that equivalent spellings compare equal: {@code 40 percent} and {@code 40%},
 * {@code $1.5 million} and {@code $1,500,000}, {@code doubled} and {@code 2x}.
 */
public final class MetricExtractor {

    /**
     * A normalized quantity. {@code unit} is empty for plain counts.
     */
    public record Metric(String value, String unit) {
        @Override
        public String toString() {
            return unit.startsWith("$") || unit.startsWith("€") || unit.startsWith("£")
                    ? unit + value
                    : value + unit;
        }
    }

    private static final Map<String, String> NUMBER_WORDS = Map.ofEntries(
            Map.entry("two", "2"), Map.entry("three", "3"), Map.entry("four", "4"),
            Map.entry("five", "5"), Map.entry("six", "6"), Map.entry("seven", "7"),
            Map.entry("eight", "8"), Map.entry("nine", "9"), Map.entry("ten", "10"),
            Map.entry("eleven", "11"), Map.entry("twelve", "12"), Map.entry("twenty", "20"),
            Map.entry("fifty", "50"), Map.entry("hundred", "100"));

    private static final Map<String, String> MULTIPLIER_WORDS = Map.of(
            "doubled", "2x", "doubling", "2x",
            "tripled", "3x", "tripling", "3x",
            "quadrupled", "4x",
            "halved", "50%", "halving", "50%");

    private static final Pattern HUNDREDS = Pattern.compile(
            "\\b(a|one|two|three|four|five|six|seven|eight|nine|ten|eleven|twelve|twenty|fifty)[\\s-]+hundred\\b");
    private static final Pattern NUMBER_WORD = Pattern.compile(
            "\\b(two|three|four|five|six|seven|eight|nine|ten|eleven|twelve|twenty|fifty|hundred)\\b");
    private static final Pattern MULTIPLIER_WORD = Pattern.compile(
            "\\b(doubled|doubling|tripled|tripling|quadrupled|halved|halving)\\b");
    private static final Pattern THOUSANDS = Pattern.compile("(\\d),(\\d{3})(?!\\d)");
    private static final Pattern PERCENT_WORD = Pattern.compile("\\s*\\b(per\\s?cent|percent|pct)\\b");
    private static final Pattern FOLD = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s?-?\\s?fold\\b");

    private static final Pattern METRIC = Pattern.compile(
            "(?<![\\p{L}\\p{N}.])(?<currency>[$€£])?\\s?(?<num>\\d+(?:\\.\\d+)?)\\s?(?<unit>"
                    + "%|x\\b|k\\b|m\\b|mm\\b|bn\\b|b\\b|million\\b|billion\\b|thousand\\b"
                    + "|ms\\b|milliseconds?\\b|secs?\\b|seconds?\\b|mins?\\b|minutes?\\b|hrs?\\b|hours?\\b"
                    + "|days?\\b|weeks?\\b|months?\\b|yrs?\\b|years?\\b"
                    + "|kb\\b|mb\\b|gb\\b|tb\\b|pb\\b)?");

    private MetricExtractor() {
    }

    /**
     * Extracts the normalized metrics of a text, in order of appearance.
     */
    public static Set<Metric> extract(String text) {
        Set<Metric> metrics = new LinkedHashSet<>();
        if (text == null || text.isBlank()) return metrics;

        Matcher m = METRIC.matcher(prepare(text));
        while (m.find()) {
            BigDecimal value;
            try {
                value = new BigDecimal(m.group("num"));
            } catch (NumberFormatException e) {
                continue;
            }
            String unit = m.group("unit") != null ? m.group("unit") : "";
            String currency = m.group("currency");

            BigDecimal scale = magnitude(unit);
            if (scale != null) {
                value = value.multiply(scale);
                unit = "";
            } else {
                unit = canonicalUnit(unit);
            }
            if (currency != null) {
                unit = currency;
            }
            metrics.add(new Metric(value.stripTrailingZeros().toPlainString(), unit));
        }
        return metrics;
    }

    /**
     * True when {@code metric} appears among {@code evidence}. A unitless count is supported by
     * any evidence metric with the same value.
     */
    public static boolean isSupported(Metric metric, Set<Metric> evidence) {
        for (Metric candidate : evidence) {
            if (candidate.value().equals(metric.value())
                    && (metric.unit().isEmpty() || metric.unit().equals(candidate.unit()))) {
                return true;
            }
        }
        return false;
    }

    /** Metrics of {@code claim} that {@code evidenceText} does not contain. */
    public static Set<Metric> unsupported(String claim, String evidenceText) {
        Set<Metric> evidence = extract(evidenceText);
        Set<Metric> missing = new LinkedHashSet<>();
        for (Metric metric : extract(claim)) {
            if (!isSupported(metric, evidence)) {
                missing.add(metric);
            }
        }
        return missing;
    }

    private static String prepare(String text) {
        String result = text.toLowerCase(Locale.ROOT);
        result = replaceWords(result, MULTIPLIER_WORD, MULTIPLIER_WORDS);
        result = replaceHundreds(result);
        result = replaceWords(result, NUMBER_WORD, NUMBER_WORDS);
        Matcher thousands = THOUSANDS.matcher(result);
        while (thousands.find()) {
            result = thousands.replaceAll("$1$2");
            thousands = THOUSANDS.matcher(result);
        }
        result = PERCENT_WORD.matcher(result).replaceAll("%");
        result = FOLD.matcher(result).replaceAll("$1x");
        return result;
    }

    private static String replaceWords(String text, Pattern pattern, Map<String, String> replacements) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacements.get(m.group(1))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** "two hundred" reads as 200, not as the two numbers 2 and 100. */
    private static String replaceHundreds(String text) {
        Matcher m = HUNDREDS.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String word = m.group(1);
            int base = word.equals("a") || word.equals("one") ? 1 : Integer.parseInt(NUMBER_WORDS.get(word));
            m.appendReplacement(sb, String.valueOf(base * 100));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static BigDecimal magnitude(String unit) {
        return switch (unit) {
            case "k", "thousand" -> BigDecimal.valueOf(1_000);
            case "m", "mm", "million" -> BigDecimal.valueOf(1_000_000);
            case "b", "bn", "billion" -> BigDecimal.valueOf(1_000_000_000);
            default -> null;
        };
    }

    private static String canonicalUnit(String unit) {
        if (unit.isEmpty() || unit.equals("%") || unit.equals("x")) return unit;
        if (unit.equals("ms") || unit.startsWith("millisecond")) return "ms";
        if (unit.startsWith("sec")) return "s";
        if (unit.startsWith("min")) return "min";
        if (unit.startsWith("h")) return "h";
        if (unit.startsWith("day")) return "d";
        if (unit.startsWith("week")) return "wk";
        if (unit.startsWith("month")) return "mo";
        if (unit.startsWith("y")) return "yr";
        return unit;
    }
}
