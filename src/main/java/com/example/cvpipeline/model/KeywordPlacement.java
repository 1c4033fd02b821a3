package com.example.cvpipeline.model;

/**
 * Where one target keyword appears in the final CV.
 *
 * @param keyword        the target keyword
 * @param occurrences    whole-phrase matches anywhere in the text
 * @param inSummary      found in the profile summary
 * @param inCompetencies found among the listed skills
 * @param inFirstRole    found in the bullets of the most recent role
 * @param score          0-100, weighted by how early the keyword is seen
 */
public record KeywordPlacement(
        String keyword,
        int occurrences,
        boolean inSummary,
        boolean inCompetencies,
        boolean inFirstRole,
        int score
) {
    public static final int SUMMARY_WEIGHT = 50;
    public static final int COMPETENCIES_WEIGHT = 30;
    public static final int FIRST_ROLE_WEIGHT = 20;

    public static KeywordPlacement of(String keyword, int occurrences,
                                      boolean inSummary, boolean inCompetencies, boolean inFirstRole) {
        int score = (inSummary ? SUMMARY_WEIGHT : 0)
                + (inCompetencies ? COMPETENCIES_WEIGHT : 0)
                + (inFirstRole ? FIRST_ROLE_WEIGHT : 0);
        return new KeywordPlacement(keyword, occurrences, inSummary, inCompetencies, inFirstRole, score);
    }

    /** Seen before the experience section starts. */
    public boolean inTopThird() {
        return inSummary || inCompetencies;
    }
}
