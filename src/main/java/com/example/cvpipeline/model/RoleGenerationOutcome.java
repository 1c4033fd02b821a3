package com.example.cvpipeline.model;

import java.util.List;

/**
 * Raw generator output for one role: candidates or the error that prevented them.
 */
public record RoleGenerationOutcome(String roleId, List<CandidateBullet> bullets, String error) {

    public RoleGenerationOutcome {
        bullets = bullets != null ? List.copyOf(bullets) : List.of();
    }

    public static RoleGenerationOutcome failed(String roleId, String error) {
        return new RoleGenerationOutcome(roleId, List.of(), error);
    }

    public boolean failed() {
        return error != null;
    }
}
