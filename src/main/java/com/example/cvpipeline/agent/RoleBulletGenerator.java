package com.example.cvpipeline.agent;

import com.example.cvpipeline.config.CvPipelineProperties;
import com.example.cvpipeline.model.AchievementAnnotation;
import com.example.cvpipeline.model.AchievementRef;
import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.GeneratedBulletsResponse;
import com.example.cvpipeline.model.GeneratedBulletsResponse.GeneratedBullet;
import com.example.cvpipeline.model.GenerationRequest;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.RoleGenerationOutcome;
import com.example.cvpipeline.model.RoleRecord;
import com.example.cvpipeline.service.LlmResult;
import com.example.cvpipeline.service.RelevanceScorer;
import com.example.cvpipeline.service.ResilientLlmCaller;
import com.example.cvpipeline.service.TextGenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes tailored STAR bullets for one role.
 * <p>
 * The model only sees the role's own achievements and must cite the one each bullet comes from.
 * Relevance and keyword matches are recomputed in code rather than taken from the model.
 */
@Service
public class RoleBulletGenerator {

    private static final Logger log = LoggerFactory.getLogger(RoleBulletGenerator.class);

    static final String AGENT_NAME = "RoleBulletGenerator";

    private static final String SYSTEM_PROMPT = """
            You are an executive CV writer. You rewrite a candidate's achievements for ONE role into
            concise, tailored CV bullets for a specific job.

            ANTI-HALLUCINATION RULES (CRITICAL):
            - Use ONLY the numbered achievements supplied for this role. Never invent employers,
              technologies, team sizes, dates or outcomes.
            - Every number, percentage, currency amount or multiplier in a bullet MUST appear in the
              achievement it cites. Copy metrics exactly; do not round, convert or combine them.
            - Do not upgrade the candidate's involvement: "contributed to" never becomes "led".
            - Each bullet cites exactly one achievement through "sourceIndex" (1-based).

            STYLE:
            - Plain text only: no markdown, no asterisks, no bullet symbols, no first person.
            - At most 35 words per bullet, ideally 20-30.
            - Start with a strong past-tense action verb. Never start with "Responsible for",
              "Worked on", "Helped" or "Assisted".
            - Follow the STAR shape when the source supports it: action, then scope, then result.
            - Work a target keyword in only where the achievement genuinely supports it, and report
              it in "keyword". Report the pain point a bullet addresses in "painPoint".
            - Prefer achievements marked as core strengths or boosted.
            """;

    private final TextGenerationClient client;
    private final ResilientLlmCaller caller;
    private final RelevanceScorer scorer;
    private final int minBullets;
    private final int maxBullets;

    public RoleBulletGenerator(@Qualifier("generationClient") TextGenerationClient client,
                               ResilientLlmCaller caller,
                               RelevanceScorer scorer,
                               CvPipelineProperties properties) {
        this.client = client;
        this.caller = caller;
        this.scorer = scorer;
        this.minBullets = properties.generation().minBullets();
        this.maxBullets = properties.generation().maxBullets();
    }

    /**
     * First-pass generation with the configured bullet range. The minimum is clamped to the number
     * of achievements the role has.
     */
    public RoleGenerationOutcome generate(RoleRecord role, JobContext context) {
        int min = Math.min(minBullets, role.achievements().size());
        return generate(new GenerationRequest(role, context, min, Math.max(min, maxBullets), null, List.of(), 0));
    }

    /**
     * Extra candidates for a role whose bullets did not fill the word budget.
     */
    public RoleGenerationOutcome generateAdditional(RoleRecord role, JobContext context, int count,
                                                    List<String> existingTexts, int idOffset) {
        return generate(new GenerationRequest(role, context, 1, Math.max(1, count),
                "Write bullets that cover achievements or angles the existing bullets do not.",
                existingTexts, idOffset));
    }

    public RoleGenerationOutcome generate(GenerationRequest request) {
        RoleRecord role = request.role();
        log.info("{}: generating {}-{} bullets for role '{}' ({} achievements){}", AGENT_NAME,
                request.minBullets(), request.maxBullets(), role.roleId(), role.achievements().size(),
                request.feedback() != null ? " with feedback" : "");

        LlmResult<GeneratedBulletsResponse> result = caller.call(client, AGENT_NAME + "[" + role.roleId() + "]",
                SYSTEM_PROMPT, userPrompt(request), GeneratedBulletsResponse.class,
                response -> schemaViolations(response, request));

        if (!result.isOk()) {
            log.warn("{}: role '{}' failed after {} attempts ({}): {}", AGENT_NAME, role.roleId(),
                    result.attempts(), result.status(), result.error());
            return RoleGenerationOutcome.failed(role.roleId(), result.status() + ": " + result.error());
        }

        List<CandidateBullet> bullets = new ArrayList<>();
        List<GeneratedBullet> generated = result.payload().bullets();
        for (int i = 0; i < generated.size(); i++) {
            bullets.add(toCandidate(generated.get(i), role, request, request.idOffset() + i + 1));
        }
        log.info("{}: role '{}' produced {} candidates", AGENT_NAME, role.roleId(), bullets.size());
        return new RoleGenerationOutcome(role.roleId(), bullets, null);
    }

    private CandidateBullet toCandidate(GeneratedBullet generated, RoleRecord role, GenerationRequest request,
                                        int sequence) {
        String text = generated.text().strip();
        int sourceIndex = generated.sourceIndex();
        JobContext context = request.context();
        String painPoint = blankToNull(generated.painPoint());
        return new CandidateBullet(
                role.roleId() + "-" + sequence,
                role.roleId(),
                text,
                new AchievementRef(role.roleId(), sourceIndex),
                blankToNull(generated.metric()),
                scorer.matchedKeyword(text, blankToNull(generated.keyword()), context),
                painPoint,
                scorer.score(role, sourceIndex, text, painPoint, context),
                List.of());
    }

    static List<String> schemaViolations(GeneratedBulletsResponse response, GenerationRequest request) {
        List<String> violations = new ArrayList<>();
        if (response.bullets() == null) {
            violations.add("missing \"bullets\" array");
            return violations;
        }
        int count = response.bullets().size();
        if (count < request.minBullets() || count > request.maxBullets()) {
            violations.add("expected between " + request.minBullets() + " and " + request.maxBullets()
                    + " bullets, got " + count);
        }
        for (int i = 0; i < count; i++) {
            GeneratedBullet bullet = response.bullets().get(i);
            if (bullet == null || bullet.text() == null || bullet.text().isBlank()) {
                violations.add("bullet " + (i + 1) + " has no text");
            } else if (bullet.sourceIndex() == null) {
                violations.add("bullet " + (i + 1) + " has no sourceIndex");
            }
        }
        return violations;
    }

    private static String userPrompt(GenerationRequest request) {
        RoleRecord role = request.role();
        JobContext context = request.context();
        StringBuilder sb = new StringBuilder();

        sb.append("TARGET JOB: ").append(context.title()).append('\n');
        if (!context.targetKeywords().isEmpty()) {
            sb.append("TARGET KEYWORDS: ").append(String.join(", ", context.targetKeywords())).append('\n');
        }
        if (!context.painPoints().isEmpty()) {
            sb.append("PAIN POINTS:\n");
            context.painPoints().forEach(p -> sb.append("- ").append(p).append('\n'));
        }
        if (!context.competencyWeights().isEmpty()) {
            sb.append("COMPETENCIES: ");
            context.competencyWeights().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> sb.append(e.getKey()).append(" (").append(e.getValue()).append(") "));
            sb.append('\n');
        }

        sb.append("\nROLE: ").append(role.title()).append(" at ").append(role.employer());
        if (!role.period().isBlank()) sb.append(" (").append(role.period()).append(')');
        sb.append("\nACHIEVEMENTS:\n");
        for (int i = 1; i <= role.achievements().size(); i++) {
            sb.append('[').append(i).append("] ").append(role.achievements().get(i - 1));
            for (AchievementAnnotation annotation : context.annotations()) {
                if (annotation.matches(role.roleId(), i)) {
                    sb.append(annotation.coreStrength() ? "  (CORE STRENGTH)" : "  (BOOSTED)");
                }
            }
            sb.append('\n');
        }
        if (!role.declaredSkills().isEmpty()) {
            sb.append("SKILLS USED IN THIS ROLE: ").append(String.join(", ", role.declaredSkills())).append('\n');
        }

        if (!request.excludedTexts().isEmpty()) {
            sb.append("\nDO NOT REPEAT THESE EXISTING BULLETS:\n");
            request.excludedTexts().forEach(t -> sb.append("- ").append(t).append('\n'));
        }
        if (request.feedback() != null && !request.feedback().isBlank()) {
            sb.append("\nREVIEWER FEEDBACK TO ADDRESS:\n").append(request.feedback()).append('\n');
        }

        sb.append("\nWrite between ").append(request.minBullets()).append(" and ").append(request.maxBullets())
                .append(" bullets.");
        return sb.toString();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
