package com.example.cvpipeline.model;

import java.util.List;

/**
 * Profile summary and categorized skills. Every sentence and skill cites at least one corpus item.
 *
 * @param summary        accepted summary sentences
 * @param skills         skill categories, empty categories omitted
 * @param rejectedClaims claims dropped because no evidence supported them
 * @param fallback       true when the summary was built without the model
 */
public record HeaderSection(
        List<SummarySentence> summary,
        List<SkillCategory> skills,
        List<String> rejectedClaims,
        boolean fallback
) {
    public HeaderSection {
        summary = List.copyOf(summary);
        skills = List.copyOf(skills);
        rejectedClaims = rejectedClaims != null ? List.copyOf(rejectedClaims) : List.of();
    }

    public List<String> skillNames() {
        return skills.stream().flatMap(c -> c.skills().stream()).map(GroundedSkill::name).toList();
    }
}
