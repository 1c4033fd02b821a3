package com.example.cvpipeline.agent;

import com.example.cvpipeline.config.CvPipelineProperties;
import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.CvDraft;
import com.example.cvpipeline.model.DimensionScore;
import com.example.cvpipeline.model.FlaggedSection;
import com.example.cvpipeline.model.GradeResult;
import com.example.cvpipeline.model.GradingMethod;
import com.example.cvpipeline.model.GradingResponse;
import com.example.cvpipeline.model.GradingResponse.DimensionDraft;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.StitchedRole;
import com.example.cvpipeline.service.LlmResult;
import com.example.cvpipeline.service.ResilientLlmCaller;
import com.example.cvpipeline.service.RuleBasedGrader;
import com.example.cvpipeline.service.TextGenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Grades a draft against the configured rubric.
 * <p>
 * The model scores each dimension and flags sections; the overall score is the weighted mean
 * computed here. Model grades are memoized per (document, job context, rubric version) in a cache
 * the caller owns for one run, so grading the same draft twice within a run yields the same
 * result. When the model cannot produce a valid grading, the {@link RuleBasedGrader} takes over;
 * such fallback grades are never cached, so the next pass asks the model again.
 */
@Service
public class Grader {

    private static final Logger log = LoggerFactory.getLogger(Grader.class);

    static final String AGENT_NAME = "Grader";

    private static final String SYSTEM_PROMPT = """
            You are a senior recruiter grading a CV against a job description.

            Score every rubric dimension from 0 to 10 and list concrete issues for each.
            Flag the sections that should be rewritten, using ONLY these section ids:
            - "header:summary", "header:skills"
            - "role:<roleId>" for a whole role
            - "bullet:<bulletId>" for a single bullet
            Flag a section only when rewriting it would clearly raise the score. Explain each flag
            in "reason" in one sentence the writer can act on.
            Do not compute an overall score.
            """;

    private final TextGenerationClient client;
    private final ResilientLlmCaller caller;
    private final RuleBasedGrader ruleBasedGrader;
    private final CvPipelineProperties.Grading rubric;

    public Grader(@Qualifier("gradingClient") TextGenerationClient client,
                  ResilientLlmCaller caller,
                  RuleBasedGrader ruleBasedGrader,
                  CvPipelineProperties properties) {
        this.client = client;
        this.caller = caller;
        this.ruleBasedGrader = ruleBasedGrader;
        this.rubric = properties.grading();
    }

    public GradeResult grade(CvDraft draft, JobContext context, Map<String, GradeResult> cache) {
        String key = cacheKey(draft, context);
        GradeResult cached = cache.get(key);
        if (cached != null) {
            log.info("{}: cached grade {} for identical draft", AGENT_NAME, cached.overallScore());
            return cached;
        }

        LlmResult<GradingResponse> result = caller.call(client, AGENT_NAME, SYSTEM_PROMPT,
                userPrompt(draft, context), GradingResponse.class, this::schemaViolations);

        GradeResult grade;
        if (result.isOk()) {
            grade = fromModel(result.payload(), draft);
        } else {
            log.warn("{}: model grading failed ({}), using rule-based grading", AGENT_NAME, result.error());
            grade = gradeRuleBased(draft, context);
        }
        log.info("{}: overall {} (threshold {}), {} sections flagged, method {}", AGENT_NAME,
                grade.overallScore(), grade.passingThreshold(), grade.flaggedSections().size(), grade.method());
        if (grade.method() == GradingMethod.MODEL) {
            cache.put(key, grade);
        }
        return grade;
    }

    /**
     * Deterministic grading without the model.
     */
    public GradeResult gradeRuleBased(CvDraft draft, JobContext context) {
        List<DimensionScore> scores = new ArrayList<>();
        rubric.dimensions().forEach((dimension, weight) ->
                scores.add(ruleBasedGrader.score(dimension, weight, draft, context)));
        return new GradeResult(rubric.rubricVersion(), scores, weightedMean(scores), rubric.passingThreshold(),
                ruleBasedGrader.flags(draft), GradingMethod.RULE_BASED);
    }

    private GradeResult fromModel(GradingResponse response, CvDraft draft) {
        Map<String, DimensionDraft> byName = new LinkedHashMap<>();
        for (DimensionDraft dimension : response.dimensions()) {
            if (dimension != null && dimension.dimension() != null) {
                byName.putIfAbsent(normalize(dimension.dimension()), dimension);
            }
        }
        List<DimensionScore> scores = new ArrayList<>();
        rubric.dimensions().forEach((dimension, weight) -> {
            DimensionDraft draftScore = byName.get(normalize(dimension));
            double score = Math.max(0.0, Math.min(10.0, draftScore.score()));
            scores.add(new DimensionScore(dimension, score, weight, draftScore.issues()));
        });

        Set<String> validIds = sectionIds(draft);
        List<FlaggedSection> flags = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        if (response.flaggedSections() != null) {
            for (FlaggedSection flag : response.flaggedSections()) {
                if (flag == null || flag.sectionId() == null) continue;
                String id = flag.sectionId().strip();
                if (!validIds.contains(id)) {
                    log.debug("{}: dropping flag on unknown section '{}'", AGENT_NAME, id);
                    continue;
                }
                if (seen.add(id)) {
                    flags.add(new FlaggedSection(id, flag.reason() != null ? flag.reason() : ""));
                }
            }
        }
        return new GradeResult(rubric.rubricVersion(), scores, weightedMean(scores), rubric.passingThreshold(),
                flags, GradingMethod.MODEL);
    }

    List<String> schemaViolations(GradingResponse response) {
        List<String> violations = new ArrayList<>();
        if (response.dimensions() == null) {
            violations.add("missing \"dimensions\" array");
            return violations;
        }
        Map<String, DimensionDraft> byName = response.dimensions().stream()
                .filter(d -> d != null && d.dimension() != null)
                .collect(Collectors.toMap(d -> normalize(d.dimension()), d -> d, (a, b) -> a));
        for (String dimension : rubric.dimensions().keySet()) {
            DimensionDraft found = byName.get(normalize(dimension));
            if (found == null) {
                violations.add("missing score for dimension \"" + dimension + "\"");
            } else if (found.score() == null || found.score().isNaN()) {
                violations.add("dimension \"" + dimension + "\" has no numeric score");
            }
        }
        return violations;
    }

    static double weightedMean(List<DimensionScore> scores) {
        double weightSum = scores.stream().mapToDouble(DimensionScore::weight).sum();
        if (weightSum <= 0) return 0.0;
        double total = scores.stream().mapToDouble(s -> s.score() * s.weight()).sum();
        return Math.round(total / weightSum * 100.0) / 100.0;
    }

    private static Set<String> sectionIds(CvDraft draft) {
        Set<String> ids = new LinkedHashSet<>();
        ids.add(FlaggedSection.HEADER_SUMMARY);
        ids.add(FlaggedSection.HEADER_SKILLS);
        for (StitchedRole role : draft.document().roles()) {
            ids.add(FlaggedSection.ROLE_PREFIX + role.role().roleId());
            for (CandidateBullet bullet : role.bullets()) {
                ids.add(FlaggedSection.BULLET_PREFIX + bullet.id());
            }
        }
        return ids;
    }

    private String userPrompt(CvDraft draft, JobContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("RUBRIC (version ").append(rubric.rubricVersion()).append("):\n");
        rubric.dimensions().forEach((dimension, weight) ->
                sb.append("- ").append(dimension).append(" (weight ").append(weight).append(")\n"));
        sb.append("\nTARGET JOB: ").append(context.title()).append('\n');
        if (!context.targetKeywords().isEmpty()) {
            sb.append("TARGET KEYWORDS: ").append(String.join(", ", context.targetKeywords())).append('\n');
        }
        if (!context.painPoints().isEmpty()) {
            sb.append("PAIN POINTS: ").append(String.join("; ", context.painPoints())).append('\n');
        }
        sb.append("WORD BUDGET: ").append(draft.document().budget().minWords()).append('-')
                .append(draft.document().budget().maxWords()).append(" words (current ")
                .append(draft.wordCount()).append(")\n");

        sb.append("\nSECTION IDS:\n");
        for (StitchedRole role : draft.document().roles()) {
            sb.append("role:").append(role.role().roleId()).append(" = ").append(role.role().employer()).append('\n');
            for (CandidateBullet bullet : role.bullets()) {
                sb.append("  bullet:").append(bullet.id()).append(" = ").append(bullet.text()).append('\n');
            }
        }
        sb.append("\nCV:\n---\n").append(draft.text()).append("---\n");
        return sb.toString();
    }

    private String cacheKey(CvDraft draft, JobContext context) {
        String material = rubric.rubricVersion() + '\n' + rubric.dimensions() + '\n' + context + '\n'
                + draft.document().allBullets().stream().map(CandidateBullet::id).collect(Collectors.joining(","))
                + '\n' + draft.text();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String normalize(String dimension) {
        return dimension.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
    }
}
