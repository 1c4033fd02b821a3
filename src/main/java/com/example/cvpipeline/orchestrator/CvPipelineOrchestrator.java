package com.example.cvpipeline.orchestrator;

import com.example.cvpipeline.agent.HeaderComposer;
import com.example.cvpipeline.agent.RoleBulletGenerator;
import com.example.cvpipeline.config.CvPipelineProperties;
import com.example.cvpipeline.exception.LoadException;
import com.example.cvpipeline.exception.PipelineException;
import com.example.cvpipeline.model.AtsReport;
import com.example.cvpipeline.model.BudgetStatus;
import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.CitationEntry;
import com.example.cvpipeline.model.CvDraft;
import com.example.cvpipeline.model.CvGenerationResult;
import com.example.cvpipeline.model.DegradationKind;
import com.example.cvpipeline.model.HeaderSection;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.PipelinePhase;
import com.example.cvpipeline.model.PipelineState;
import com.example.cvpipeline.model.PipelineTimings;
import com.example.cvpipeline.model.RejectedBullet;
import com.example.cvpipeline.model.RoleBulletSet;
import com.example.cvpipeline.model.RoleGenerationOutcome;
import com.example.cvpipeline.model.RoleRecord;
import com.example.cvpipeline.model.RunStatus;
import com.example.cvpipeline.model.StitchedDocument;
import com.example.cvpipeline.model.StitchedRole;
import com.example.cvpipeline.model.TokenUsage;
import com.example.cvpipeline.model.WordBudget;
import com.example.cvpipeline.service.AchievementLoader;
import com.example.cvpipeline.service.AtsKeywordChecker;
import com.example.cvpipeline.service.BulletValidator;
import com.example.cvpipeline.service.DraftAssembler;
import com.example.cvpipeline.service.RunDeadline;
import com.example.cvpipeline.service.TokenUsageAccumulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * CV generation pipeline orchestrator.
 * Pipeline:
 * 1. Load role records
 * 2. Parallel per-role bullet generation + validation (bounded worker pool, barrier)
 * 3. Stitching with budget top-up (NO LLM)
 * 4. Header composition, then re-fit with the real header size
 * 5. Grade/improve loop
 * 6. Result assembly (ATS keyword report, citations, timings, token usage)
 * <p>
 * Only the calling thread touches {@link PipelineState}; workers return values.
 */
@Service
public class CvPipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CvPipelineOrchestrator.class);

    private final AchievementLoader loader;
    private final RoleBulletGenerator generator;
    private final BulletValidator validator;
    private final DraftAssembler assembler;
    private final HeaderComposer headerComposer;
    private final GradeImproveLoop loop;
    private final AtsKeywordChecker atsChecker;
    private final ExecutorService roleWorkerExecutor;
    private final Clock clock;
    private final CvPipelineProperties properties;

    public CvPipelineOrchestrator(AchievementLoader loader,
                                  RoleBulletGenerator generator,
                                  BulletValidator validator,
                                  DraftAssembler assembler,
                                  HeaderComposer headerComposer,
                                  GradeImproveLoop loop,
                                  AtsKeywordChecker atsChecker,
                                  @Qualifier("roleWorkerExecutor") ExecutorService roleWorkerExecutor,
                                  Clock clock,
                                  CvPipelineProperties properties) {
        this.loader = loader;
        this.generator = generator;
        this.validator = validator;
        this.assembler = assembler;
        this.headerComposer = headerComposer;
        this.loop = loop;
        this.atsChecker = atsChecker;
        this.roleWorkerExecutor = roleWorkerExecutor;
        this.clock = clock;
        this.properties = properties;
    }

    public CvGenerationResult generate(JobContext context) {
        TokenUsageAccumulator usage = TokenUsageAccumulator.start();
        RunDeadline deadline = RunDeadline.after(clock, properties.runDeadline()).bind();
        try {
            return run(context, usage, deadline);
        } finally {
            RunDeadline.unbind();
            TokenUsageAccumulator.clear();
        }
    }

    private CvGenerationResult run(JobContext context, TokenUsageAccumulator usage, RunDeadline deadline) {
        PipelineState state = new PipelineState();
        log.info("═══════════════════════════════════════════════");
        log.info("Starting CV pipeline for '{}' ({} keywords, deadline {})", context.title(),
                context.targetKeywords().size(), deadline.expiresAt());
        log.info("═══════════════════════════════════════════════");

        // ── Step 1: Load role records ──
        Instant start = clock.instant();
        state.advanceTo(PipelinePhase.LOADING);
        log.info("[1/6] Loading role records...");
        List<RoleRecord> roles;
        try {
            roles = loader.load();
        } catch (LoadException e) {
            if (e.getKind() == LoadException.Kind.NO_ROLE_RECORDS) {
                throw new PipelineException(PipelineException.Kind.NO_ROLE_RECORDS, e.getMessage(), e);
            }
            throw e;
        }
        state.setRoles(roles);
        log.info("[1/6] Loaded {} roles", roles.size());
        Instant loaded = clock.instant();

        // ── Step 2: Parallel generation + validation ──
        state.advanceTo(PipelinePhase.GENERATING);
        checkDeadline(deadline, state, "before bullet generation");
        log.info("[2/6] Generating bullets for {} roles on {} workers...", roles.size(),
                properties.concurrency().roleWorkers());
        Map<String, RoleBulletSet> sets = onWorkers(roles, role -> generateRole(role, context), deadline, state);
        sets.values().forEach(state::putBulletSet);
        for (RoleBulletSet set : sets.values()) {
            if (!set.usable()) {
                String reason = set.error() != null ? set.error() : "no bullet passed validation";
                state.addDegradation(DegradationKind.ROLE_SKIPPED, set.roleId() + ": " + reason);
                log.warn("[2/6] Role '{}' skipped: {}", set.roleId(), reason);
            }
        }
        long usable = sets.values().stream().filter(RoleBulletSet::usable).count();
        if (usable == 0) {
            if (deadline.expired()) {
                throw new PipelineException(PipelineException.Kind.DEADLINE_EXCEEDED,
                        "Run deadline passed before any role produced bullets");
            }
            throw new PipelineException(PipelineException.Kind.ALL_ROLES_FAILED,
                    "No role produced a usable bullet (" + roles.size() + " roles tried)");
        }
        log.info("[2/6] {} of {} roles produced accepted bullets ({} accepted, {} rejected)", usable, roles.size(),
                sets.values().stream().mapToInt(s -> s.accepted().size()).sum(),
                sets.values().stream().mapToInt(s -> s.rejected().size()).sum());
        Instant generated = clock.instant();

        // ── Step 3: Stitching + top-up ──
        state.advanceTo(PipelinePhase.STITCHING);
        log.info("[3/6] Stitching...");
        int reserve = properties.stitching().headerReserveWords();
        StitchedDocument document = assembler.stitch(state.bulletSets(), context, reserve);
        int round = 0;
        while (document.status() == BudgetStatus.UNDER_MIN && round < properties.stitching().topUpRounds()) {
            if (deadline.expired()) {
                state.addDegradationOnce(DegradationKind.DEADLINE_EXCEEDED, "run deadline passed during top-up");
                break;
            }
            round++;
            log.info("[3/6] Under the {}-word floor ({} words), top-up round {}", document.budget().minWords(),
                    document.totalWordCount(), round);
            Map<String, RoleBulletSet> current = new LinkedHashMap<>();
            state.bulletSets().stream().filter(RoleBulletSet::usable).forEach(s -> current.put(s.roleId(), s));
            Map<String, RoleBulletSet> toppedUp = onWorkers(
                    current.values().stream().map(RoleBulletSet::role).toList(),
                    role -> topUp(current.get(role.roleId()), context), deadline, state);
            toppedUp.values().forEach(state::putBulletSet);
            document = assembler.stitch(state.bulletSets(), context, reserve);
        }
        state.setDocument(document);
        log.info("[3/6] Stitched {} roles, {} words ({})", document.roles().size(), document.totalWordCount(),
                document.status());

        // ── Step 4: Header + re-fit ──
        state.advanceTo(PipelinePhase.COMPOSING_HEADER);
        HeaderSection header;
        if (deadline.expired()) {
            state.addDegradationOnce(DegradationKind.DEADLINE_EXCEEDED, "run deadline passed before the header");
            log.warn("[4/6] Deadline passed, composing fallback header");
            header = headerComposer.composeFallback(document, roles, context);
        } else {
            log.info("[4/6] Composing header...");
            header = headerComposer.compose(document, roles, context);
        }
        state.setHeader(header);
        CvDraft draft = assembler.assemble(state.bulletSets(), roles, context, header);
        state.setDraft(draft);
        log.info("[4/6] Draft assembled: {} words, {} summary sentences, {} skills", draft.wordCount(),
                draft.header().summary().size(), draft.header().skillNames().size());
        Instant stitched = clock.instant();

        // ── Step 5: Grade/improve loop ──
        state.advanceTo(PipelinePhase.GRADING);
        log.info("[5/6] Grading (cap {} revisions)...", loop.iterationCap());
        loop.run(state, context, deadline);
        log.info("[5/6] Loop finished: {} after {} revisions, score {}", state.loopState(), state.iterations(),
                state.lastGrade().overallScore());
        Instant graded = clock.instant();

        // ── Step 6: Result ──
        state.advanceTo(PipelinePhase.COMPLETED);
        CvDraft finalDraft = state.gradedDraft();
        if (finalDraft.header().fallback()) {
            state.addDegradationOnce(DegradationKind.HEADER_FALLBACK, "summary built without the model");
        }
        WordBudget budget = finalDraft.document().budget();
        if (!budget.contains(finalDraft.wordCount())) {
            state.addDegradationOnce(DegradationKind.BUDGET_UNATTAINABLE, finalDraft.wordCount()
                    + " words, outside [" + budget.minWords() + ", " + budget.maxWords() + "]");
        }

        AtsReport ats = atsChecker.check(finalDraft, context);

        PipelineTimings timings = new PipelineTimings(seconds(start, loaded), seconds(loaded, generated),
                seconds(generated, stitched), seconds(stitched, graded));
        TokenUsage tokens = new TokenUsage(usage.getGenerationTokens(), usage.getGradingTokens());
        RunStatus status = state.hasDegradations() ? RunStatus.DEGRADED : RunStatus.COMPLETED;

        log.info("═══════════════════════════════════════════════");
        log.info("Pipeline {}: {} words, score {}, {} degradations, {} tokens, {}s", status, finalDraft.wordCount(),
                state.lastGrade().overallScore(), state.degradations().size(), tokens.totalTokens(),
                timings.totalSeconds());
        state.degradations().forEach(d -> log.warn("Degradation {}: {}", d.kind(), d.detail()));
        log.info("═══════════════════════════════════════════════");

        return new CvGenerationResult(status, finalDraft.text(), finalDraft.wordCount(), state.lastGrade(),
                state.loopState(), state.iterations(), state.degradations(), citations(finalDraft, roles),
                ats, timings, tokens);
    }

    private RoleBulletSet generateRole(RoleRecord role, JobContext context) {
        RoleGenerationOutcome outcome = generator.generate(role, context);
        if (outcome.failed()) {
            return RoleBulletSet.failed(role, outcome.error());
        }
        return validator.validate(role, outcome.bullets(), context);
    }

    private RoleBulletSet topUp(RoleBulletSet set, JobContext context) {
        int wanted = Math.max(2, properties.generation().maxBullets() - set.accepted().size());
        RoleGenerationOutcome outcome = generator.generateAdditional(set.role(), context, wanted,
                set.accepted().stream().map(CandidateBullet::text).toList(), set.lastSequence());
        if (outcome.failed()) {
            log.warn("Top-up for role '{}' failed: {}", set.roleId(), outcome.error());
            return set;
        }
        RoleBulletSet added = validator.validate(set.role(), outcome.bullets(), context);
        List<CandidateBullet> accepted = new ArrayList<>(set.accepted());
        accepted.addAll(added.accepted());
        List<RejectedBullet> rejected = new ArrayList<>(set.rejected());
        rejected.addAll(added.rejected());
        return new RoleBulletSet(set.role(), accepted, rejected, BulletValidator.coverage(accepted, context), null);
    }

    /**
     * Runs one task per role on the worker pool and waits for all of them. Results come back in
     * role order whatever order the workers finish in. Roles still running when the deadline
     * passes are interrupted and come back as failed sets; their model calls stop retrying.
     */
    private Map<String, RoleBulletSet> onWorkers(List<RoleRecord> roles, Function<RoleRecord, RoleBulletSet> task,
                                                 RunDeadline deadline, PipelineState state) {
        Map<String, Future<RoleBulletSet>> futures = new LinkedHashMap<>();
        for (RoleRecord role : roles) {
            Supplier<RoleBulletSet> work = RunDeadline.propagate(
                    TokenUsageAccumulator.propagate(() -> task.apply(role)));
            futures.put(role.roleId(), roleWorkerExecutor.submit(work::get));
        }

        Map<String, RoleBulletSet> results = new LinkedHashMap<>();
        for (RoleRecord role : roles) {
            Future<RoleBulletSet> future = futures.get(role.roleId());
            try {
                results.put(role.roleId(), future.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                state.addDegradationOnce(DegradationKind.DEADLINE_EXCEEDED,
                        "run deadline passed while waiting for role workers");
                log.warn("Role '{}' still running at the deadline, interrupted", role.roleId());
                results.put(role.roleId(), RoleBulletSet.failed(role, "cancelled at run deadline"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Worker for role '{}' failed", role.roleId(), cause);
                results.put(role.roleId(), RoleBulletSet.failed(role, cause.getClass().getSimpleName() + ": "
                        + cause.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                throw new PipelineException(PipelineException.Kind.DEADLINE_EXCEEDED,
                        "Interrupted while waiting for role workers", e);
            }
        }
        return results;
    }

    private static void checkDeadline(RunDeadline deadline, PipelineState state, String where) {
        if (deadline.expired()) {
            throw new PipelineException(PipelineException.Kind.DEADLINE_EXCEEDED,
                    "Run deadline passed " + where + " (phase " + state.phase() + ")");
        }
    }

    private static List<CitationEntry> citations(CvDraft draft, List<RoleRecord> roles) {
        Map<String, RoleRecord> byId = new LinkedHashMap<>();
        roles.forEach(r -> byId.put(r.roleId(), r));
        List<CitationEntry> entries = new ArrayList<>();
        for (StitchedRole role : draft.document().roles()) {
            for (CandidateBullet bullet : role.bullets()) {
                int index = bullet.source().index();
                RoleRecord record = byId.get(bullet.roleId());
                String text = record != null ? record.achievement(index).orElse("") : "";
                entries.add(new CitationEntry(bullet.id(), bullet.roleId(), index, text));
            }
        }
        return entries;
    }

    private static double seconds(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0;
    }
}
