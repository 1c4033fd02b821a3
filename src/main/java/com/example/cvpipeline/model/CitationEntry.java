package com.example.cvpipeline.model;

/**
 * Maps a bullet of the final CV back to the achievement it was written from.
 */
public record CitationEntry(String bulletId, String roleId, int achievementIndex, String achievementText) {
}
