package com.example.cvpipeline.model;

import java.util.List;
import java.util.Optional;

/**
 * One employment role of the candidate, normalized from the corpus.
 * <p>
 * Role records are the only ground truth the pipeline validates claims against.
 * They are loaded once per run and shared read-only between workers.
 *
 * @param roleId         stable identifier, unique within a corpus
 * @param employer       employer name
 * @param title          job title held
 * @param period         free-form period, e.g. "2020 - 2023"
 * @param location       optional location (may be empty)
 * @param recencyRank    1 = most recent role
 * @param achievements   ordered achievement statements, referenced 1-based
 * @param declaredSkills skills listed on the record itself
 */
public record RoleRecord(
        String roleId,
        String employer,
        String title,
        String period,
        String location,
        int recencyRank,
        List<String> achievements,
        List<String> declaredSkills
) {
    public RoleRecord {
        achievements = achievements != null ? List.copyOf(achievements) : List.of();
        declaredSkills = declaredSkills != null ? List.copyOf(declaredSkills) : List.of();
        location = location != null ? location : "";
        period = period != null ? period : "";
    }

    /** Resolves a 1-based achievement index. */
    public Optional<String> achievement(int index) {
        if (index < 1 || index > achievements.size()) {
            return Optional.empty();
        }
        return Optional.of(achievements.get(index - 1));
    }

    /** All achievements joined, used as the role's evidence text. */
    public String evidenceText() {
        return String.join("\n", achievements);
    }
}
