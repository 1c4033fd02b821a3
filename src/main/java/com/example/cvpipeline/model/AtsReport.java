package com.example.cvpipeline.model;

import java.util.List;
import java.util.Optional;

/**
 * Keyword coverage and placement of the final CV text, as an applicant tracking system would see it.
 *
 * @param coverage       share of target keywords found anywhere, 1.0 when there are none
 * @param missing        target keywords absent from the text
 * @param placements     one entry per target keyword, in the job context's order
 * @param placementScore mean placement score, 0-100
 * @param warnings       missing, stuffed and buried keywords
 * @param passed         nothing missing, nothing stuffed and every keyword in the summary or competencies
 */
public record AtsReport(
        double coverage,
        List<String> missing,
        List<KeywordPlacement> placements,
        int placementScore,
        List<String> warnings,
        boolean passed
) {
    public AtsReport {
        missing = List.copyOf(missing);
        placements = List.copyOf(placements);
        warnings = List.copyOf(warnings);
    }

    public static AtsReport empty() {
        return new AtsReport(1.0, List.of(), List.of(), 100, List.of(), true);
    }

    public Optional<KeywordPlacement> placement(String keyword) {
        return placements.stream().filter(p -> p.keyword().equalsIgnoreCase(keyword)).findFirst();
    }
}
