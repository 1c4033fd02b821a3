package com.example.cvpipeline.model;

import java.util.List;

/**
 * Result of one improver pass: the bullet sets behind the new draft, the draft, and what changed.
 */
public record Revision(List<RoleBulletSet> bulletSets, CvDraft draft, List<String> changes) {

    public Revision {
        bulletSets = List.copyOf(bulletSets);
        changes = List.copyOf(changes);
    }
}
