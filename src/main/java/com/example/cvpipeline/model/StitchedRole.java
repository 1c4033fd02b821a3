package com.example.cvpipeline.model;

import java.util.List;

/**
 * A role as it appears in the stitched document, with its included bullets in display order.
 */
public record StitchedRole(RoleRecord role, List<CandidateBullet> bullets) {

    public StitchedRole {
        bullets = List.copyOf(bullets);
    }
}
