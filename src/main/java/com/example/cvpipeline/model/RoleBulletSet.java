package com.example.cvpipeline.model;

import java.util.List;
import java.util.stream.Stream;

/**
 * Validated bullets for one role. Only {@link #accepted()} ever leaves the validation stage.
 *
 * @param role     the role the bullets belong to
 * @param accepted bullets that passed every grounding and shape check
 * @param rejected refused bullets with their reason
 * @param coverage target keywords found in the accepted bullets
 * @param error    generation error, null when generation succeeded
 */
public record RoleBulletSet(
        RoleRecord role,
        List<CandidateBullet> accepted,
        List<RejectedBullet> rejected,
        KeywordCoverage coverage,
        String error
) {
    public RoleBulletSet {
        accepted = accepted != null ? List.copyOf(accepted) : List.of();
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
        coverage = coverage != null ? coverage : KeywordCoverage.empty();
    }

    public static RoleBulletSet failed(RoleRecord role, String error) {
        return new RoleBulletSet(role, List.of(), List.of(), KeywordCoverage.empty(), error);
    }

    public String roleId() {
        return role.roleId();
    }

    public boolean usable() {
        return !accepted.isEmpty();
    }

    /** Highest bullet sequence used so far for this role, so new ids never collide. */
    public int lastSequence() {
        return Stream.concat(accepted.stream(), rejected.stream().map(RejectedBullet::bullet))
                .mapToInt(CandidateBullet::sequence)
                .max()
                .orElse(0);
    }
}
