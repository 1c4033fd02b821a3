package com.example.cvpipeline.model;

import java.util.List;
import java.util.Optional;

/**
 * Deduplicated, budgeted experience section.
 * <p>
 * A new instance is produced for every draft; documents are never edited in place.
 *
 * @param roles             included roles in display order
 * @param droppedDuplicates bullets removed because an equal {@link DedupKey} was kept
 * @param droppedForBudget  bullets left out to respect the word budget
 * @param bodyWordCount     words of the experience section (role headings and bullets)
 * @param reservedWords     words reserved for the header and section titles
 * @param budget            word range for the whole CV
 * @param status            where {@code bodyWordCount + reservedWords} falls against the budget
 */
public record StitchedDocument(
        List<StitchedRole> roles,
        List<CandidateBullet> droppedDuplicates,
        List<CandidateBullet> droppedForBudget,
        int bodyWordCount,
        int reservedWords,
        WordBudget budget,
        BudgetStatus status
) {
    public StitchedDocument {
        roles = List.copyOf(roles);
        droppedDuplicates = List.copyOf(droppedDuplicates);
        droppedForBudget = List.copyOf(droppedForBudget);
    }

    public int totalWordCount() {
        return bodyWordCount + reservedWords;
    }

    public List<CandidateBullet> allBullets() {
        return roles.stream().flatMap(r -> r.bullets().stream()).toList();
    }

    public Optional<CandidateBullet> bullet(String bulletId) {
        return allBullets().stream().filter(b -> b.id().equals(bulletId)).findFirst();
    }

    public Optional<StitchedRole> role(String roleId) {
        return roles.stream().filter(r -> r.role().roleId().equals(roleId)).findFirst();
    }
}
