package com.example.cvpipeline.model;

import java.util.List;

/**
 * One bullet-generation call for a role.
 *
 * @param role          role to write bullets for
 * @param context       job context
 * @param minBullets    fewest bullets accepted from the model
 * @param maxBullets    most bullets accepted from the model
 * @param feedback      grader feedback for a revision, null on first pass
 * @param excludedTexts bullets the model must not repeat
 * @param idOffset      last sequence already used for this role
 */
public record GenerationRequest(
        RoleRecord role,
        JobContext context,
        int minBullets,
        int maxBullets,
        String feedback,
        List<String> excludedTexts,
        int idOffset
) {
    public GenerationRequest {
        excludedTexts = excludedTexts != null ? List.copyOf(excludedTexts) : List.of();
    }
}
