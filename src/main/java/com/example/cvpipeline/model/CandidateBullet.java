package com.example.cvpipeline.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A generated bullet citing exactly one source achievement.
 *
 * @param id               unique within a run, e.g. {@code acme-3}
 * @param roleId           role the bullet was generated for
 * @param text             plain-text bullet
 * @param source           cited achievement
 * @param metric           metric the model says it used (may be null)
 * @param matchedKeyword   target keyword the bullet covers (may be null)
 * @param matchedPainPoint pain point the bullet addresses (may be null)
 * @param relevanceScore   relevance computed by {@code RelevanceScorer}
 * @param reviewFlags      qualitative claims the validator could not confirm
 */
public record CandidateBullet(
        String id,
        String roleId,
        String text,
        AchievementRef source,
        String metric,
        String matchedKeyword,
        String matchedPainPoint,
        double relevanceScore,
        List<String> reviewFlags
) {
    public CandidateBullet {
        reviewFlags = reviewFlags != null ? List.copyOf(reviewFlags) : List.of();
    }

    public CandidateBullet withText(String newText) {
        return new CandidateBullet(id, roleId, newText, source, metric, matchedKeyword,
                matchedPainPoint, relevanceScore, reviewFlags);
    }

    public CandidateBullet withReviewFlag(String flag) {
        List<String> flags = new ArrayList<>(reviewFlags);
        flags.add(flag);
        return new CandidateBullet(id, roleId, text, source, metric, matchedKeyword,
                matchedPainPoint, relevanceScore, flags);
    }

    /** Numeric suffix of the id, or 0 when the id carries none. */
    public int sequence() {
        int dash = id.lastIndexOf('-');
        if (dash < 0) return 0;
        try {
            return Integer.parseInt(id.substring(dash + 1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
