package com.example.cvpipeline.model;

/**
 * Citation of a single achievement: role id plus 1-based index.
 * Rendered as {@code roleId#index} in citation lists.
 */
public record AchievementRef(String roleId, int index) {

    public String citationId() {
        return roleId + "#" + index;
    }

    /** Parses {@code roleId#index}; returns null when the id is not an achievement citation. */
    public static AchievementRef parse(String citationId) {
        if (citationId == null) return null;
        int hash = citationId.lastIndexOf('#');
        if (hash <= 0 || hash == citationId.length() - 1) return null;
        try {
            return new AchievementRef(citationId.substring(0, hash),
                    Integer.parseInt(citationId.substring(hash + 1).trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
