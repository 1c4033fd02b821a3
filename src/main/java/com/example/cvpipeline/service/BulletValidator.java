package com.example.cvpipeline.service;

import com.example.cvpipeline.config.CvPipelineProperties;
import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.KeywordCoverage;
import com.example.cvpipeline.model.RejectedBullet;
import com.example.cvpipeline.model.RejectionReason;
import com.example.cvpipeline.model.RoleBulletSet;
import com.example.cvpipeline.model.RoleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Grounding gate between generation and stitching (no LLM).
 * <p>
 * Checks, in order, for every candidate bullet:
 * <ol>
 *   <li>the cited achievement exists in the role</li>
 *   <li>every metric in the bullet occurs in the cited achievement</li>
 *   <li>shape: length, generic openings, keyword-list boilerplate</li>
 *   <li>leadership and technology claims absent from the source (flagged, not rejected)</li>
 * </ol>
 * No accepted bullet carries a metric its source does not contain.
 */
@Service
public class BulletValidator {

    private static final Logger log = LoggerFactory.getLogger(BulletValidator.class);

    static final List<String> GENERIC_OPENINGS = List.of(
            "responsible for", "worked on", "helped", "assisted", "participated in",
            "involved in", "tasked with", "duties included", "various");

    static final List<String> LEADERSHIP_CLAIMS = List.of(
            "led", "managed", "directed", "headed", "founded", "spearheaded", "oversaw",
            "supervised", "built and led", "hired", "owned");

    static final List<String> TECHNOLOGY_TERMS = List.of(
            "java", "kotlin", "python", "golang", "rust", "scala", "typescript", "javascript",
            "react", "angular", "spring", "kafka", "spark", "flink", "kubernetes", "docker", "terraform",
            "aws", "gcp", "azure", "postgresql", "mysql", "mongodb", "redis", "elasticsearch",
            "graphql", "grpc", "airflow", "snowflake", "tensorflow", "pytorch", "llm", "microservices");

    static final Set<String> ACTION_VERBS = Set.of(
            "led", "built", "designed", "delivered", "launched", "drove", "cut", "reduced", "increased",
            "grew", "improved", "migrated", "mentored", "architected", "automated", "scaled", "shipped",
            "created", "developed", "implemented", "established", "negotiated", "optimized", "owned",
            "spearheaded", "transformed", "streamlined", "accelerated", "managed", "hired", "coached");

    private final int maxWordsPerBullet;

    public BulletValidator(CvPipelineProperties properties) {
        this.maxWordsPerBullet = properties.generation().maxWordsPerBullet();
    }

    /**
     * Partitions candidates into accepted and rejected bullets and computes keyword coverage of
     * the accepted ones.
     */
    public RoleBulletSet validate(RoleRecord role, List<CandidateBullet> candidates, JobContext context) {
        List<CandidateBullet> accepted = new ArrayList<>();
        List<RejectedBullet> rejected = new ArrayList<>();

        for (CandidateBullet raw : candidates) {
            CandidateBullet bullet = raw.withText(MarkupSanitizer.strip(raw.text()));
            Optional<RejectedBullet> rejection = check(role, bullet);
            if (rejection.isPresent()) {
                rejected.add(rejection.get());
                log.debug("[{}] rejected {} ({}): {}", role.roleId(), bullet.id(),
                        rejection.get().reason(), rejection.get().detail());
                continue;
            }
            accepted.add(flagUnverifiedClaims(role, bullet, context));
        }

        KeywordCoverage coverage = coverage(accepted, context);
        log.info("[{}] QA: {} accepted, {} rejected, keywords {}/{}", role.roleId(), accepted.size(),
                rejected.size(), coverage.found().size(), coverage.found().size() + coverage.missing().size());
        return new RoleBulletSet(role, accepted, rejected, coverage, null);
    }

    private Optional<RejectedBullet> check(RoleRecord role, CandidateBullet bullet) {
        String text = bullet.text();
        if (text.isBlank()) {
            return reject(bullet, RejectionReason.EMPTY, "bullet has no text");
        }

        Optional<String> source = bullet.source() != null && role.roleId().equals(bullet.source().roleId())
                ? role.achievement(bullet.source().index())
                : Optional.empty();
        if (source.isEmpty()) {
            return reject(bullet, RejectionReason.UNKNOWN_SOURCE,
                    "cited achievement " + (bullet.source() != null ? bullet.source().citationId() : "none")
                            + " does not exist in role " + role.roleId());
        }

        Set<MetricExtractor.Metric> unsupported = MetricExtractor.unsupported(text, source.get());
        if (bullet.metric() != null && !bullet.metric().isBlank()) {
            unsupported.addAll(MetricExtractor.unsupported(bullet.metric(), source.get()));
        }
        if (!unsupported.isEmpty()) {
            return reject(bullet, RejectionReason.UNSUPPORTED_METRIC,
                    "metrics " + unsupported + " not found in " + bullet.source().citationId());
        }

        int words = WordCounter.count(text);
        if (words > maxWordsPerBullet) {
            return reject(bullet, RejectionReason.TOO_LONG, words + " words, limit " + maxWordsPerBullet);
        }

        String lower = text.toLowerCase(Locale.ROOT);
        for (String opening : GENERIC_OPENINGS) {
            if (lower.startsWith(opening)) {
                return reject(bullet, RejectionReason.GENERIC_OPENING, "opens with '" + opening + "'");
            }
        }

        if (isBoilerplateList(text)) {
            return reject(bullet, RejectionReason.BOILERPLATE_LIST, "reads as a keyword list");
        }
        return Optional.empty();
    }

    private CandidateBullet flagUnverifiedClaims(RoleRecord role, CandidateBullet bullet, JobContext context) {
        String source = role.achievement(bullet.source().index()).orElse("");
        CandidateBullet result = bullet;
        for (String claim : LEADERSHIP_CLAIMS) {
            if (TextSimilarity.containsPhrase(bullet.text(), claim) && !TextSimilarity.containsPhrase(source, claim)) {
                result = result.withReviewFlag("leadership claim '" + claim + "' not stated in source");
            }
        }
        for (String term : technologyTerms(context)) {
            if (TextSimilarity.containsPhrase(bullet.text(), term) && !TextSimilarity.containsPhrase(source, term)) {
                result = result.withReviewFlag("'" + term + "' not mentioned in source");
            }
        }
        return result;
    }

    private static List<String> technologyTerms(JobContext context) {
        List<String> terms = new ArrayList<>(TECHNOLOGY_TERMS);
        context.targetKeywords().stream()
                .map(k -> k.toLowerCase(Locale.ROOT).strip())
                .filter(k -> !terms.contains(k))
                .forEach(terms::add);
        return terms;
    }

    /**
     * Four or more short comma/semicolon segments with no action verb up front.
     */
    static boolean isBoilerplateList(String text) {
        String[] segments = text.split("[,;]");
        if (segments.length < 4) return false;
        for (String segment : segments) {
            if (WordCounter.count(segment.replaceFirst("(?i)^\\s*(and|or)\\s+", "")) > 3) {
                return false;
            }
        }
        String first = text.strip().split("\\s+")[0].toLowerCase(Locale.ROOT);
        return !ACTION_VERBS.contains(first);
    }

    public static KeywordCoverage coverage(List<CandidateBullet> bullets, JobContext context) {
        String text = bullets.stream().map(CandidateBullet::text).collect(Collectors.joining("\n"));
        List<String> found = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String keyword : context.targetKeywords()) {
            if (TextSimilarity.containsPhrase(text, keyword)) {
                found.add(keyword);
            } else {
                missing.add(keyword);
            }
        }
        return new KeywordCoverage(found, missing);
    }

    private static Optional<RejectedBullet> reject(CandidateBullet bullet, RejectionReason reason, String detail) {
        return Optional.of(new RejectedBullet(bullet, reason, detail));
    }
}
