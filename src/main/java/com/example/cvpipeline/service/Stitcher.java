package com.example.cvpipeline.service;

import com.example.cvpipeline.config.CvPipelineProperties;
import com.example.cvpipeline.model.BudgetStatus;
import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.DedupKey;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.RoleBulletSet;
import com.example.cvpipeline.model.RoleRecord;
import com.example.cvpipeline.model.StitchedDocument;
import com.example.cvpipeline.model.StitchedRole;
import com.example.cvpipeline.model.WordBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the validated bullet sets into one experience section (no LLM).
 * <p>
 * Pipeline:
 * 1. Order roles (recency, or the job context's explicit order)
 * 2. Deduplicate by {@link DedupKey}: more recent role, then higher relevance, then earlier bullet wins
 * 3. Reserve the per-role minimum, trim to the word ceiling, greedily fill by relevance
 * <p>
 * The result depends only on the inputs: identical inputs give an identical document.
 * Bullets are dropped whole, never truncated.
 */
@Service
public class Stitcher {

    private static final Logger log = LoggerFactory.getLogger(Stitcher.class);

    /** Selection priority: relevance first, then the more recent role, then the earlier bullet. */
    private static final Comparator<Candidate> PRIORITY = Comparator
            .comparingDouble((Candidate c) -> -c.bullet().relevanceScore())
            .thenComparingInt(Candidate::roleRank)
            .thenComparingInt(Candidate::position);

    /** Dedup order: the more recent role first, then relevance, then position. */
    private static final Comparator<Candidate> DEDUP_ORDER = Comparator
            .comparingInt(Candidate::roleRank)
            .thenComparingDouble(c -> -c.bullet().relevanceScore())
            .thenComparingInt(Candidate::position);

    private final PlainTextCvRenderer renderer;
    private final WordBudget defaultBudget;
    private final int minBulletsPerRole;
    private final double nearDuplicateThreshold;

    public Stitcher(CvPipelineProperties properties, PlainTextCvRenderer renderer) {
        this.renderer = renderer;
        this.defaultBudget = properties.stitching().budget();
        this.minBulletsPerRole = properties.stitching().minBulletsPerRole();
        this.nearDuplicateThreshold = properties.stitching().nearDuplicateThreshold();
    }

    public StitchedDocument stitch(List<RoleBulletSet> sets, JobContext context, int reservedWords) {
        return stitch(sets, context, reservedWords, defaultBudget);
    }

    /**
     * @param sets          validated sets; sets without accepted bullets are ignored
     * @param context       job context (only its role order is used)
     * @param reservedWords words the header and section titles will add
     * @param budget        word range for the whole CV
     */
    public StitchedDocument stitch(List<RoleBulletSet> sets, JobContext context, int reservedWords, WordBudget budget) {
        List<RoleBulletSet> byRecency = sets.stream()
                .filter(RoleBulletSet::usable)
                .sorted(Comparator.comparingInt((RoleBulletSet s) -> s.role().recencyRank())
                        .thenComparing(RoleBulletSet::roleId))
                .toList();

        // ── Step 1: candidates with keys ──
        List<Candidate> pool = new ArrayList<>();
        Map<String, RoleRecord> roles = new LinkedHashMap<>();
        for (int rank = 0; rank < byRecency.size(); rank++) {
            RoleBulletSet set = byRecency.get(rank);
            roles.put(set.roleId(), set.role());
            for (int pos = 0; pos < set.accepted().size(); pos++) {
                CandidateBullet bullet = set.accepted().get(pos);
                pool.add(new Candidate(bullet, set.roleId(), rank, pos, DedupKeyFactory.keyOf(bullet.text()),
                        WordCounter.count(MarkupSanitizer.strip(bullet.text()))));
            }
        }

        // ── Step 2: deduplication ──
        List<Candidate> kept = new ArrayList<>();
        List<CandidateBullet> duplicates = new ArrayList<>();
        Set<DedupKey> seen = new HashSet<>();
        for (Candidate candidate : pool.stream().sorted(DEDUP_ORDER).toList()) {
            if (seen.contains(candidate.key()) || isNearDuplicate(candidate, kept)) {
                duplicates.add(candidate.bullet());
                log.debug("Duplicate dropped: {} ({})", candidate.bullet().id(), candidate.key().signature());
                continue;
            }
            seen.add(candidate.key());
            kept.add(candidate);
        }

        // ── Step 3: budget ──
        List<String> displayOrder = displayOrder(roles, context);
        Map<String, Integer> headingWords = new HashMap<>();
        roles.forEach((id, role) -> headingWords.put(id, WordCounter.count(renderer.roleHeading(role))));

        int max = budget.maxWords() - reservedWords;
        Map<String, List<Candidate>> selected = new HashMap<>();
        roles.keySet().forEach(id -> selected.put(id, new ArrayList<>()));

        List<Candidate> byPriority = kept.stream().sorted(PRIORITY).toList();
        for (Candidate candidate : byPriority) {
            List<Candidate> forRole = selected.get(candidate.roleId());
            if (forRole.size() < minBulletsPerRole) {
                forRole.add(candidate);
            }
        }
        int words = bodyWords(selected, headingWords);

        while (words > max) {
            Candidate victim = selected.values().stream()
                    .flatMap(List::stream)
                    .max(PRIORITY)
                    .orElse(null);
            if (victim == null) break;
            List<Candidate> forRole = selected.get(victim.roleId());
            forRole.remove(victim);
            words -= victim.words() + (forRole.isEmpty() ? headingWords.get(victim.roleId()) : 0);
        }

        for (Candidate candidate : byPriority) {
            List<Candidate> forRole = selected.get(candidate.roleId());
            if (forRole.contains(candidate)) continue;
            int cost = candidate.words() + (forRole.isEmpty() ? headingWords.get(candidate.roleId()) : 0);
            if (words + cost <= max) {
                forRole.add(candidate);
                words += cost;
            }
        }

        // ── Step 4: assemble ──
        List<StitchedRole> stitchedRoles = new ArrayList<>();
        Set<Candidate> included = new HashSet<>();
        for (String roleId : displayOrder) {
            List<Candidate> forRole = selected.get(roleId);
            if (forRole.isEmpty()) continue;
            List<Candidate> ordered = forRole.stream().sorted(PRIORITY).toList();
            included.addAll(ordered);
            stitchedRoles.add(new StitchedRole(roles.get(roleId),
                    ordered.stream().map(Candidate::bullet).toList()));
        }
        List<CandidateBullet> droppedForBudget = byPriority.stream()
                .filter(c -> !included.contains(c))
                .map(Candidate::bullet)
                .toList();

        int total = words + reservedWords;
        BudgetStatus status = total > budget.maxWords() ? BudgetStatus.OVER_MAX
                : total < budget.minWords() ? BudgetStatus.UNDER_MIN
                : BudgetStatus.WITHIN;

        log.info("Stitched {} roles, {} bullets, {} words (+{} reserved) against [{}, {}]: {} "
                        + "({} duplicates, {} dropped for budget)",
                stitchedRoles.size(), included.size(), words, reservedWords, budget.minWords(),
                budget.maxWords(), status, duplicates.size(), droppedForBudget.size());

        return new StitchedDocument(stitchedRoles, duplicates, droppedForBudget, words, reservedWords, budget, status);
    }

    private boolean isNearDuplicate(Candidate candidate, List<Candidate> kept) {
        if (nearDuplicateThreshold >= 1.0) return false;
        List<String> tokens = candidate.key().tokens();
        for (Candidate other : kept) {
            if (TextSimilarity.nearDuplicateScore(tokens, other.key().tokens()) >= nearDuplicateThreshold) {
                return true;
            }
        }
        return false;
    }

    private static List<String> displayOrder(Map<String, RoleRecord> roles, JobContext context) {
        List<String> order = new ArrayList<>();
        for (String roleId : context.roleOrder()) {
            if (roles.containsKey(roleId) && !order.contains(roleId)) {
                order.add(roleId);
            }
        }
        for (String roleId : roles.keySet()) {
            if (!order.contains(roleId)) {
                order.add(roleId);
            }
        }
        return order;
    }

    private static int bodyWords(Map<String, List<Candidate>> selected, Map<String, Integer> headingWords) {
        int words = 0;
        for (Map.Entry<String, List<Candidate>> entry : selected.entrySet()) {
            if (entry.getValue().isEmpty()) continue;
            words += headingWords.get(entry.getKey());
            words += entry.getValue().stream().mapToInt(Candidate::words).sum();
        }
        return words;
    }

    private record Candidate(CandidateBullet bullet, String roleId, int roleRank, int position,
                             DedupKey key, int words) {
    }
}
