package com.example.cvpipeline.agent;

import com.example.cvpipeline.config.CvPipelineProperties;
import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.CvDraft;
import com.example.cvpipeline.model.DimensionScore;
import com.example.cvpipeline.model.FlaggedSection;
import com.example.cvpipeline.model.GradeResult;
import com.example.cvpipeline.model.GradingMethod;
import com.example.cvpipeline.model.HeaderSection;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.Revision;
import com.example.cvpipeline.model.RoleBulletSet;
import com.example.cvpipeline.model.RoleRecord;
import com.example.cvpipeline.model.SummarySentence;
import com.example.cvpipeline.service.BulletValidator;
import com.example.cvpipeline.service.DraftAssembler;
import com.example.cvpipeline.service.PlainTextCvRenderer;
import com.example.cvpipeline.service.RelevanceScorer;
import com.example.cvpipeline.service.Stitcher;
import com.example.cvpipeline.support.ScriptedTextGenerationClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.example.cvpipeline.support.TestFixtures.bullet;
import static com.example.cvpipeline.support.TestFixtures.caller;
import static com.example.cvpipeline.support.TestFixtures.properties;
import static com.example.cvpipeline.support.TestFixtures.role;
import static org.assertj.core.api.Assertions.assertThat;

class ImproverTest {

    private ExecutorService executor;
    private ScriptedTextGenerationClient client;
    private Improver improver;
    private DraftAssembler assembler;

    private final RoleRecord acme = role("acme", 1,
            "Led migration to new platform, cut costs 30%",
            "Mentored 3 engineers",
            "Automated the release pipeline, cutting deploy time from 2 hours to 15 minutes");
    private final RoleRecord globex = role("globex", 2, "Shipped the billing service used by 40 teams");
    private final JobContext context = JobContext.of("Engineering Manager", List.of("platform migration"));

    private List<RoleBulletSet> sets;
    private HeaderSection header;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        client = new ScriptedTextGenerationClient();
        CvPipelineProperties properties = properties();
        PlainTextCvRenderer renderer = new PlainTextCvRenderer();
        BulletValidator validator = new BulletValidator(properties);
        HeaderComposer headerComposer = new HeaderComposer(client, caller(executor), properties);
        assembler = new DraftAssembler(new Stitcher(properties, renderer), headerComposer, renderer);
        RoleBulletGenerator generator = new RoleBulletGenerator(client, caller(executor), new RelevanceScorer(),
                properties);
        improver = new Improver(generator, validator, headerComposer, assembler, properties);

        sets = List.of(
                validator.validate(acme, List.of(
                        bullet("acme", 1, 1, "Led the platform migration, cutting costs 30%", 2.0),
                        bullet("acme", 2, 2, "Mentored 3 engineers on the team", 1.0)), context),
                validator.validate(globex, List.of(
                        bullet("globex", 1, 1, "Shipped the billing service used by 40 teams", 1.0)), context));
        header = new HeaderSection(
                List.of(new SummarySentence("Staff Engineer at Acme Corp.", List.of("acme"))),
                List.of(), List.of(), false);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private GradeResult gradeFlagging(String sectionId) {
        return new GradeResult("v1", List.of(new DimensionScore("specificity", 6.0, 0.25, List.of())), 6.0, 8.0,
                List.of(new FlaggedSection(sectionId, "Too vague, show the outcome")), GradingMethod.MODEL);
    }

    @Test
    @DisplayName("Should regenerate only the flagged bullet and keep the rest of the draft")
    void shouldReviseFlaggedBullet() {
        client.onSequence(RoleBulletGenerator.AGENT_NAME, """
                {"bullets": [{"text": "Automated the release pipeline, cutting deploy time from 2 hours to 15 minutes",
                              "sourceIndex": 3}]}
                """);
        CvDraft draft = assembler.assemble(sets, List.of(acme, globex), context, header);

        Revision revision = improver.improve(draft, gradeFlagging("bullet:acme-2"), sets, List.of(acme, globex),
                context);

        assertThat(client.callsFor(RoleBulletGenerator.AGENT_NAME + "[acme]")).isEqualTo(1);
        assertThat(client.callsFor(RoleBulletGenerator.AGENT_NAME + "[globex]")).isZero();
        assertThat(client.calls().get(0).userPrompt())
                .contains("Mentored 3 engineers on the team")
                .contains("Too vague, show the outcome")
                .contains("Write between 1 and 2 bullets.");

        RoleBulletSet revisedAcme = revision.bulletSets().get(0);
        assertThat(revisedAcme.accepted()).extracting(CandidateBullet::id).containsExactly("acme-1", "acme-3");
        assertThat(revision.bulletSets().get(1)).isSameAs(sets.get(1));
        assertThat(revision.draft().document().bullet("acme-2")).isEmpty();
        assertThat(revision.draft().document().bullet("acme-3")).isPresent();
        assertThat(revision.draft().text()).contains("deploy time from 2 hours to 15 minutes");
        assertThat(revision.changes()).containsExactly("role acme: replaced 1 bullets with 1");
    }

    @Test
    @DisplayName("Should keep the previous bullets when regeneration fails")
    void shouldKeepPreviousBulletsOnFailure() {
        client.onSequence(RoleBulletGenerator.AGENT_NAME, "{\"bullets\": []}");
        CvDraft draft = assembler.assemble(sets, List.of(acme, globex), context, header);

        Revision revision = improver.improve(draft, gradeFlagging("role:acme"), sets, List.of(acme, globex), context);

        assertThat(revision.bulletSets().get(0)).isSameAs(sets.get(0));
        assertThat(revision.changes()).containsExactly("role acme: regeneration failed, previous bullets kept");
        assertThat(revision.draft().text()).isEqualTo(draft.text());
    }

    @Test
    @DisplayName("Should reject regenerated bullets that invent metrics")
    void shouldValidateRegeneratedBullets() {
        client.onSequence(RoleBulletGenerator.AGENT_NAME, """
                {"bullets": [{"text": "Automated the release pipeline, cutting deploy time by 90%", "sourceIndex": 3}]}
                """);
        CvDraft draft = assembler.assemble(sets, List.of(acme, globex), context, header);

        Revision revision = improver.improve(draft, gradeFlagging("bullet:acme-2"), sets, List.of(acme, globex),
                context);

        assertThat(revision.bulletSets().get(0)).isSameAs(sets.get(0));
        assertThat(revision.changes()).singleElement().asString().contains("no regenerated bullet passed validation");
    }

    @Test
    @DisplayName("Should revise every role against the weakest dimension when nothing is flagged")
    void shouldReviseAllRolesWithoutFlags() {
        client.onSequence(RoleBulletGenerator.AGENT_NAME + "[acme]", """
                {"bullets": [
                  {"text": "Led the platform migration, cutting costs 30%", "sourceIndex": 1},
                  {"text": "Mentored 3 engineers through weekly pairing sessions", "sourceIndex": 2},
                  {"text": "Automated the release pipeline, cutting deploy time from 2 hours to 15 minutes", "sourceIndex": 3}
                ]}
                """);
        client.onSequence(RoleBulletGenerator.AGENT_NAME + "[globex]", """
                {"bullets": [{"text": "Shipped the billing service that 40 teams rely on", "sourceIndex": 1}]}
                """);
        CvDraft draft = assembler.assemble(sets, List.of(acme, globex), context, header);
        GradeResult grade = new GradeResult("v1",
                List.of(new DimensionScore("specificity", 5.0, 0.25, List.of("few numbers")),
                        new DimensionScore("tone", 9.0, 0.15, List.of())),
                6.5, 8.0, List.of(), GradingMethod.MODEL);

        Revision revision = improver.improve(draft, grade, sets, List.of(acme, globex), context);

        assertThat(client.callsFor(RoleBulletGenerator.AGENT_NAME)).isEqualTo(2);
        assertThat(client.calls()).allSatisfy(call -> assertThat(call.userPrompt())
                .contains("Quantify outcomes")
                .contains("Issues: few numbers"));
        assertThat(revision.bulletSets().get(0).accepted()).extracting(CandidateBullet::id)
                .containsExactly("acme-3", "acme-4", "acme-5");
        assertThat(revision.bulletSets().get(1).accepted()).extracting(CandidateBullet::id)
                .containsExactly("globex-2");
    }

    @Test
    @DisplayName("Should fall back to generic guidance for unknown dimensions")
    void shouldDescribeStrategies() {
        assertThat(Improver.strategyFor(null)).isEqualTo("Raise the overall quality of the bullets.");
        assertThat(Improver.strategyFor(new DimensionScore("Impact", 4.0, 0.1, List.of())))
                .isEqualTo("Improve the weakest rubric dimension: Impact.");
        assertThat(Improver.strategyFor(new DimensionScore("Keyword Coverage", 4.0, 0.1, List.of("misses mentorship"))))
                .startsWith("Work the missing target keywords in")
                .endsWith("Issues: misses mentorship");
    }
}
