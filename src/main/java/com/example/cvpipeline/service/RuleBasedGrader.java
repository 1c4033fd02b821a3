package com.example.cvpipeline.service;

import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.CvDraft;
import com.example.cvpipeline.model.DimensionScore;
import com.example.cvpipeline.model.FlaggedSection;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.WordBudget;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic rubric scoring used when the grading model is unavailable.
 * <p>
 * Known dimensions: specificity (metric density), keyword-coverage, grounding (validator review
 * flags), conciseness (budget and bullet length), tone (first person and leftover markup).
 * Dimensions it has no heuristic for get a neutral score.
 */
@Component
public class RuleBasedGrader {

    static final double NEUTRAL_SCORE = 7.0;

    /** Pronouns as whole words; "I/O" and "i.e." are not pronouns. */
    private static final Pattern FIRST_PERSON = Pattern.compile(
            "(?<![\\p{L}\\p{N}/.])(i|me|my|mine|we|our)(?![\\p{L}\\p{N}/]|\\.\\p{L})",
            Pattern.CASE_INSENSITIVE);

    public DimensionScore score(String dimension, double weight, CvDraft draft, JobContext context) {
        List<String> issues = new ArrayList<>();
        double score = switch (normalize(dimension)) {
            case "specificity" -> specificity(draft, issues);
            case "keywordcoverage" -> keywordCoverage(draft, context, issues);
            case "grounding" -> grounding(draft, issues);
            case "conciseness" -> conciseness(draft, issues);
            case "tone" -> tone(draft, issues);
            default -> {
                issues.add("no rule-based heuristic for this dimension");
                yield NEUTRAL_SCORE;
            }
        };
        return new DimensionScore(dimension, clamp(score), weight, issues);
    }

    /**
     * Bullets the validator flagged for unconfirmed claims are handed back for revision.
     */
    public List<FlaggedSection> flags(CvDraft draft) {
        List<FlaggedSection> flags = new ArrayList<>();
        for (CandidateBullet bullet : draft.document().allBullets()) {
            if (!bullet.reviewFlags().isEmpty()) {
                flags.add(new FlaggedSection(FlaggedSection.BULLET_PREFIX + bullet.id(),
                        String.join("; ", bullet.reviewFlags())));
            }
        }
        return flags;
    }

    private static double specificity(CvDraft draft, List<String> issues) {
        List<CandidateBullet> bullets = draft.document().allBullets();
        if (bullets.isEmpty()) {
            issues.add("no bullets");
            return 0;
        }
        long withMetric = bullets.stream().filter(b -> !MetricExtractor.extract(b.text()).isEmpty()).count();
        double ratio = (double) withMetric / bullets.size();
        if (ratio < 0.6) {
            issues.add(String.format(Locale.ROOT, "only %d of %d bullets are quantified", withMetric, bullets.size()));
        }
        return 10.0 * Math.min(1.0, ratio / 0.6);
    }

    private static double keywordCoverage(CvDraft draft, JobContext context, List<String> issues) {
        if (context.targetKeywords().isEmpty()) return 10.0;
        List<String> missing = context.targetKeywords().stream()
                .filter(k -> !TextSimilarity.containsPhrase(draft.text(), k))
                .toList();
        if (!missing.isEmpty()) {
            issues.add("missing keywords: " + String.join(", ", missing));
        }
        return 10.0 * (context.targetKeywords().size() - missing.size()) / context.targetKeywords().size();
    }

    private static double grounding(CvDraft draft, List<String> issues) {
        long flagged = draft.document().allBullets().stream().filter(b -> !b.reviewFlags().isEmpty()).count();
        if (flagged > 0) {
            issues.add(flagged + " bullets carry claims not stated in their source");
        }
        return 10.0 - 2.0 * flagged;
    }

    private static double conciseness(CvDraft draft, List<String> issues) {
        WordBudget budget = draft.document().budget();
        double score = 10.0;
        int words = draft.wordCount();
        if (words > budget.maxWords()) {
            issues.add(words + " words, above the " + budget.maxWords() + " word ceiling");
            score -= 10.0 * (words - budget.maxWords()) / budget.maxWords();
        } else if (words < budget.minWords()) {
            issues.add(words + " words, below the " + budget.minWords() + " word floor");
            score -= 10.0 * (budget.minWords() - words) / Math.max(1, budget.minWords());
        }
        double average = draft.document().allBullets().stream()
                .mapToInt(b -> WordCounter.count(b.text()))
                .average()
                .orElse(0);
        if (average > 30) {
            issues.add(String.format(Locale.ROOT, "bullets average %.0f words", average));
            score -= 1.5;
        }
        return score;
    }

    private static double tone(CvDraft draft, List<String> issues) {
        double score = 10.0;
        Matcher m = FIRST_PERSON.matcher(draft.text());
        int firstPerson = 0;
        while (m.find()) firstPerson++;
        if (firstPerson > 0) {
            issues.add(firstPerson + " first-person pronouns");
            score -= 2.0 * firstPerson;
        }
        if (MarkupSanitizer.containsMarkup(draft.text())) {
            issues.add("markup left in the text");
            score -= 3.0;
        }
        return score;
    }

    private static double clamp(double score) {
        return Math.round(Math.max(0.0, Math.min(10.0, score)) * 100.0) / 100.0;
    }

    private static String normalize(String dimension) {
        return dimension.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
    }
}
