package com.example.cvpipeline.agent;

import com.example.cvpipeline.config.CvPipelineProperties;
import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.CvDraft;
import com.example.cvpipeline.model.DimensionScore;
import com.example.cvpipeline.model.FlaggedSection;
import com.example.cvpipeline.model.GenerationRequest;
import com.example.cvpipeline.model.GradeResult;
import com.example.cvpipeline.model.HeaderSection;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.RejectedBullet;
import com.example.cvpipeline.model.Revision;
import com.example.cvpipeline.model.RoleBulletSet;
import com.example.cvpipeline.model.RoleGenerationOutcome;
import com.example.cvpipeline.model.RoleRecord;
import com.example.cvpipeline.model.StitchedDocument;
import com.example.cvpipeline.model.StitchedRole;
import com.example.cvpipeline.service.BulletValidator;
import com.example.cvpipeline.service.DraftAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Revises the sections a grade flagged.
 * <p>
 * Flagged bullets and roles are regenerated from their source achievements with the grader's
 * feedback, then pass through the same validator as first-pass bullets. A flagged header is
 * recomposed from the revised document. Unflagged bullets are kept as they are. When the draft
 * scored below the threshold without any flag, every role is revised against the weakest
 * rubric dimension.
 */
@Service
public class Improver {

    private static final Logger log = LoggerFactory.getLogger(Improver.class);

    static final String AGENT_NAME = "Improver";

    /** Rewrite guidance per rubric dimension, keyed by normalized dimension name. */
    private static final Map<String, String> STRATEGIES = Map.of(
            "specificity", "Quantify outcomes with the metrics the cited achievement states. Never add new numbers.",
            "keywordcoverage", "Work the missing target keywords in where the cited achievement supports them.",
            "grounding", "Remove any claim, technology or leadership wording the cited achievement does not state.",
            "conciseness", "Tighten each bullet to 20-30 words and drop filler.",
            "tone", "Use a plain, confident voice with no first person and no markup."
    );

    private final RoleBulletGenerator generator;
    private final BulletValidator validator;
    private final HeaderComposer headerComposer;
    private final DraftAssembler assembler;
    private final int minBullets;
    private final int maxBullets;

    public Improver(RoleBulletGenerator generator,
                    BulletValidator validator,
                    HeaderComposer headerComposer,
                    DraftAssembler assembler,
                    CvPipelineProperties properties) {
        this.generator = generator;
        this.validator = validator;
        this.headerComposer = headerComposer;
        this.assembler = assembler;
        this.minBullets = properties.generation().minBullets();
        this.maxBullets = properties.generation().maxBullets();
    }

    public Revision improve(CvDraft draft, GradeResult grade, List<RoleBulletSet> sets, List<RoleRecord> roles,
                            JobContext context) {
        StitchedDocument document = draft.document();
        Map<String, List<FlaggedSection>> roleFlags = new LinkedHashMap<>();
        Set<String> flaggedBulletIds = new HashSet<>();
        List<FlaggedSection> headerFlags = new ArrayList<>();

        for (FlaggedSection flag : grade.flaggedSections()) {
            if (flag.isHeader()) {
                headerFlags.add(flag);
            } else if (flag.isRole()) {
                roleFlags.computeIfAbsent(flag.targetId(), k -> new ArrayList<>()).add(flag);
            } else if (flag.isBullet()) {
                document.bullet(flag.targetId()).ifPresent(bullet -> {
                    flaggedBulletIds.add(bullet.id());
                    roleFlags.computeIfAbsent(bullet.roleId(), k -> new ArrayList<>()).add(flag);
                });
            }
        }

        String strategy = strategyFor(grade.lowestDimension());
        if (roleFlags.isEmpty() && headerFlags.isEmpty()) {
            log.info("{}: no flagged sections at score {}, revising all roles ({})", AGENT_NAME,
                    grade.overallScore(), strategy);
            for (StitchedRole role : document.roles()) {
                roleFlags.put(role.role().roleId(), List.of());
            }
        }

        Map<String, RoleBulletSet> updated = new LinkedHashMap<>();
        sets.forEach(set -> updated.put(set.roleId(), set));
        List<String> changes = new ArrayList<>();

        roleFlags.forEach((roleId, flags) -> {
            RoleBulletSet set = updated.get(roleId);
            if (set == null) {
                log.debug("{}: flag on unknown role '{}' ignored", AGENT_NAME, roleId);
                return;
            }
            RoleBulletSet revised = reviseRole(set, flags, flaggedBulletIds, strategy, context, changes);
            updated.put(roleId, revised);
        });

        List<RoleBulletSet> revisedSets = new ArrayList<>(updated.values());
        HeaderSection header = draft.header();
        if (!headerFlags.isEmpty()) {
            StitchedDocument revisedDocument = assembler.stitchFor(revisedSets, context, header);
            String feedback = strategy + "\n" + reasons(headerFlags);
            header = headerComposer.compose(revisedDocument, roles, context, feedback);
            changes.add("header recomposed: " + headerFlags.stream()
                    .map(FlaggedSection::sectionId).collect(Collectors.joining(", ")));
        }

        CvDraft revisedDraft = assembler.assemble(revisedSets, roles, context, header);
        log.info("{}: {} changes, draft now {} words", AGENT_NAME, changes.size(), revisedDraft.wordCount());
        return new Revision(revisedSets, revisedDraft, changes);
    }

    private RoleBulletSet reviseRole(RoleBulletSet set, List<FlaggedSection> flags, Set<String> flaggedBulletIds,
                                     String strategy, JobContext context, List<String> changes) {
        RoleRecord role = set.role();
        boolean wholeRole = flags.isEmpty() || flags.stream().anyMatch(FlaggedSection::isRole);

        List<CandidateBullet> kept = wholeRole ? List.of()
                : set.accepted().stream().filter(b -> !flaggedBulletIds.contains(b.id())).toList();
        List<CandidateBullet> replaced = wholeRole ? set.accepted()
                : set.accepted().stream().filter(b -> flaggedBulletIds.contains(b.id())).toList();

        int min;
        int max;
        if (wholeRole) {
            min = Math.min(minBullets, role.achievements().size());
            max = Math.max(min, maxBullets);
        } else {
            min = Math.max(1, replaced.size());
            max = min + 1;
        }

        String feedback = flags.isEmpty() ? strategy : strategy + "\n" + reasons(flags);
        List<String> excluded = new ArrayList<>(replaced.stream().map(CandidateBullet::text).toList());
        kept.forEach(b -> excluded.add(b.text()));

        RoleGenerationOutcome outcome = generator.generate(
                new GenerationRequest(role, context, min, max, feedback, excluded, set.lastSequence()));
        if (outcome.failed()) {
            changes.add("role " + role.roleId() + ": regeneration failed, previous bullets kept");
            return set;
        }

        RoleBulletSet validated = validator.validate(role, outcome.bullets(), context);
        if (validated.accepted().isEmpty()) {
            changes.add("role " + role.roleId() + ": no regenerated bullet passed validation, previous bullets kept");
            return set;
        }

        List<CandidateBullet> accepted = new ArrayList<>(kept);
        accepted.addAll(validated.accepted());
        List<RejectedBullet> rejected = new ArrayList<>(set.rejected());
        rejected.addAll(validated.rejected());

        changes.add("role " + role.roleId() + ": replaced " + replaced.size() + " bullets with "
                + validated.accepted().size() + (wholeRole ? " (whole role)" : ""));
        return new RoleBulletSet(role, accepted, rejected, BulletValidator.coverage(accepted, context), null);
    }

    static String strategyFor(DimensionScore lowest) {
        if (lowest == null) {
            return "Raise the overall quality of the bullets.";
        }
        String key = lowest.dimension().toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
        String strategy = STRATEGIES.getOrDefault(key, "Improve the weakest rubric dimension: " + lowest.dimension() + ".");
        if (lowest.issues().isEmpty()) {
            return strategy;
        }
        return strategy + " Issues: " + String.join("; ", lowest.issues());
    }

    private static String reasons(List<FlaggedSection> flags) {
        return flags.stream()
                .map(f -> "- " + f.sectionId() + ": " + f.reason())
                .collect(Collectors.joining("\n"));
    }
}
