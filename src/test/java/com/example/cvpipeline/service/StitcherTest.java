package com.example.cvpipeline.service;

import com.example.cvpipeline.config.CvPipelineProperties;
import com.example.cvpipeline.model.BudgetStatus;
import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.RoleBulletSet;
import com.example.cvpipeline.model.RoleRecord;
import com.example.cvpipeline.model.StitchedDocument;
import com.example.cvpipeline.model.StitchedRole;
import com.example.cvpipeline.model.WordBudget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.cvpipeline.support.TestFixtures.bullet;
import static com.example.cvpipeline.support.TestFixtures.properties;
import static com.example.cvpipeline.support.TestFixtures.role;
import static org.assertj.core.api.Assertions.assertThat;

class StitcherTest {

    private final PlainTextCvRenderer renderer = new PlainTextCvRenderer();
    private Stitcher stitcher;
    private JobContext context;
    private RoleRecord acme;
    private RoleRecord globex;

    @BeforeEach
    void setUp() {
        stitcher = new Stitcher(properties(), renderer);
        context = JobContext.of("Engineering Manager", List.of("platform migration"));
        acme = role("acme", 1,
                "Led migration to new platform, cut costs 30%",
                "Mentored 3 engineers",
                "Consolidated vendors and cut costs 12%");
        globex = role("globex", 2,
                "Consolidated vendors and cut costs 12%",
                "Built the billing service",
                "Ran the incident review process");
    }

    @Nested
    @DisplayName("Deduplication")
    class Deduplication {

        @Test
        @DisplayName("Should keep the duplicate from the more recent role")
        void shouldKeepMoreRecentRole() {
            CandidateBullet recent = bullet("acme", 1, 3, "Consolidated vendors and cut costs 12%.", 1.0);
            CandidateBullet older = bullet("globex", 1, 1, "consolidated the vendors, and cut costs 12 percent", 3.0);

            StitchedDocument doc = stitcher.stitch(List.of(
                    set(globex, older, bullet("globex", 2, 2, "Built the billing service", 1.0)),
                    set(acme, recent, bullet("acme", 2, 2, "Mentored 3 engineers", 1.0))), context, 0);

            assertThat(doc.allBullets()).extracting(CandidateBullet::id).contains("acme-1").doesNotContain("globex-1");
            assertThat(doc.droppedDuplicates()).extracting(CandidateBullet::id).containsExactly("globex-1");
        }

        @Test
        @DisplayName("Should keep the higher relevance bullet within one role")
        void shouldKeepHigherRelevanceWithinRole() {
            StitchedDocument doc = stitcher.stitch(List.of(set(acme,
                    bullet("acme", 1, 2, "Mentored 3 engineers", 1.0),
                    bullet("acme", 2, 2, "Mentored 3 engineers.", 2.5))), context, 0);

            assertThat(doc.allBullets()).extracting(CandidateBullet::id).containsExactly("acme-2");
        }

        @Test
        @DisplayName("Should drop near-duplicate phrasing below a threshold of 1.0 and keep it at 1.0")
        void shouldDropNearDuplicatesBelowThreshold() {
            List<RoleBulletSet> sets = List.of(
                    set(acme, bullet("acme", 1, 1, "Led the platform migration to AWS, cutting costs 30%", 1.0)),
                    set(globex,
                            bullet("globex", 1, 1, "Led platform migration to AWS, cutting hosting costs 30%", 3.0),
                            bullet("globex", 2, 2, "Built the billing service", 1.0)));
            Stitcher loose = new Stitcher(properties(
                    new CvPipelineProperties.Stitching(400, 650, 2, 0.6, 80, 1), 2), renderer);

            StitchedDocument exactOnly = stitcher.stitch(sets, context, 0);
            StitchedDocument nearDup = loose.stitch(sets, context, 0);

            assertThat(exactOnly.allBullets()).extracting(CandidateBullet::id)
                    .contains("acme-1", "globex-1", "globex-2");
            assertThat(nearDup.allBullets()).extracting(CandidateBullet::id)
                    .containsExactlyInAnyOrder("acme-1", "globex-2");
            assertThat(nearDup.droppedDuplicates()).extracting(CandidateBullet::id).containsExactly("globex-1");
        }

        @Test
        @DisplayName("Should produce identical output for identical or reordered input")
        void shouldBeDeterministic() {
            List<RoleBulletSet> sets = sampleSets();
            List<RoleBulletSet> reversed = new ArrayList<>(sets);
            Collections.reverse(reversed);

            StitchedDocument first = stitcher.stitch(sets, context, 40);
            StitchedDocument second = stitcher.stitch(sets, context, 40);
            StitchedDocument third = stitcher.stitch(reversed, context, 40);

            assertThat(second).isEqualTo(first);
            assertThat(third).isEqualTo(first);
            assertThat(renderer.render(third, null)).isEqualTo(renderer.render(first, null));
        }
    }

    @Nested
    @DisplayName("Budget")
    class Budget {

        @ParameterizedTest(name = "[{0}, {1}] with {2} reserved")
        @CsvSource({"10, 20, 0", "20, 40, 5", "30, 60, 10", "40, 80, 0", "60, 90, 20", "90, 200, 30", "150, 300, 0"})
        @DisplayName("Should land within the budget or report where it falls")
        void shouldConformOrReport(int min, int max, int reserved) {
            StitchedDocument doc = stitcher.stitch(sampleSets(), context, reserved, new WordBudget(min, max));

            int total = doc.totalWordCount();
            switch (doc.status()) {
                case WITHIN -> assertThat(total).isBetween(min, max);
                case UNDER_MIN -> assertThat(total).isLessThan(min);
                case OVER_MAX -> assertThat(total).isGreaterThan(max);
            }
            if (doc.status() != BudgetStatus.OVER_MAX) {
                assertThat(total).isLessThanOrEqualTo(max);
            }
        }

        @Test
        @DisplayName("Should never truncate a bullet")
        void shouldNeverTruncate() {
            Set<String> inputTexts = sampleSets().stream()
                    .flatMap(s -> s.accepted().stream())
                    .map(CandidateBullet::text)
                    .collect(Collectors.toSet());

            StitchedDocument doc = stitcher.stitch(sampleSets(), context, 0, new WordBudget(10, 25));

            assertThat(doc.allBullets()).extracting(CandidateBullet::text).allMatch(inputTexts::contains);
        }

        @Test
        @DisplayName("Should reserve the per-role minimum before filling by relevance")
        void shouldReservePerRoleMinimum() {
            StitchedDocument doc = stitcher.stitch(sampleSets(), context, 0, new WordBudget(20, 50));

            Map<String, Integer> perRole = doc.roles().stream()
                    .collect(Collectors.toMap(r -> r.role().roleId(), r -> r.bullets().size()));
            assertThat(perRole).containsEntry("acme", 2).containsEntry("globex", 2);
            assertThat(doc.droppedForBudget()).extracting(CandidateBullet::id).containsExactly("acme-3");
        }

        @Test
        @DisplayName("Should drop the lowest relevance bullets when the reserved minimums overflow")
        void shouldDropLowestRelevanceWhenMinimumsOverflow() {
            StitchedDocument doc = stitcher.stitch(sampleSets(), context, 0, new WordBudget(20, 36));

            assertThat(doc.allBullets()).extracting(CandidateBullet::id)
                    .containsExactly("acme-1", "acme-2", "acme-3");
            assertThat(doc.status()).isEqualTo(BudgetStatus.WITHIN);
        }

        @Test
        @DisplayName("Should report UNDER_MIN when every bullet fits and the floor is still not reached")
        void shouldReportUnderMin() {
            StitchedDocument doc = stitcher.stitch(sampleSets(), context, 0, new WordBudget(400, 650));

            assertThat(doc.status()).isEqualTo(BudgetStatus.UNDER_MIN);
            assertThat(doc.droppedForBudget()).isEmpty();
        }
    }

    @Test
    @DisplayName("Should follow an explicit role order from the job context")
    void shouldFollowExplicitRoleOrder() {
        JobContext ordered = new JobContext("Engineering Manager", List.of(), List.of(), Map.of(), List.of(),
                List.of("globex"));

        StitchedDocument doc = stitcher.stitch(sampleSets(), ordered, 0);

        assertThat(doc.roles()).extracting(StitchedRole::role).extracting(RoleRecord::roleId)
                .containsExactly("globex", "acme");
    }

    private List<RoleBulletSet> sampleSets() {
        return List.of(
                set(acme,
                        bullet("acme", 1, 1, "Led the platform migration to a new platform, cutting costs 30%", 3.0),
                        bullet("acme", 2, 2, "Mentored 3 engineers through weekly design reviews", 2.0),
                        bullet("acme", 3, 3, "Consolidated vendors and cut costs 12%", 1.5)),
                set(globex,
                        bullet("globex", 1, 1, "Consolidated vendors and cut costs 12%", 1.2),
                        bullet("globex", 2, 2, "Built the billing service used by every product team", 1.1),
                        bullet("globex", 3, 3, "Ran the incident review process for the payments group", 1.0)));
    }

    private static RoleBulletSet set(RoleRecord role, CandidateBullet... bullets) {
        return new RoleBulletSet(role, List.of(bullets), List.of(), null, null);
    }
}
