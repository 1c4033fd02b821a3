package com.example.cvpipeline.model;

/**
 * Caller-supplied weighting for a single achievement.
 *
 * @param roleId           role the achievement belongs to
 * @param achievementIndex 1-based achievement index
 * @param boost            additive relevance boost
 * @param coreStrength     whether the candidate marked it as a core strength
 */
public record AchievementAnnotation(String roleId, int achievementIndex, double boost, boolean coreStrength) {

    public boolean matches(String roleId, int index) {
        return this.roleId != null && this.roleId.equals(roleId) && achievementIndex == index;
    }
}
