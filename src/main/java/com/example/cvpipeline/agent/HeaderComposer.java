package com.example.cvpipeline.agent;

import com.example.cvpipeline.config.CvPipelineProperties;
import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.GroundedSkill;
import com.example.cvpipeline.model.HeaderDraftResponse;
import com.example.cvpipeline.model.HeaderDraftResponse.DraftSentence;
import com.example.cvpipeline.model.HeaderSection;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.RoleRecord;
import com.example.cvpipeline.model.SkillCategory;
import com.example.cvpipeline.model.StitchedDocument;
import com.example.cvpipeline.model.StitchedRole;
import com.example.cvpipeline.model.SummarySentence;
import com.example.cvpipeline.service.EvidenceIndex;
import com.example.cvpipeline.service.LlmResult;
import com.example.cvpipeline.service.MarkupSanitizer;
import com.example.cvpipeline.service.MetricExtractor;
import com.example.cvpipeline.service.ResilientLlmCaller;
import com.example.cvpipeline.service.TextGenerationClient;
import com.example.cvpipeline.service.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Composes the profile summary and the categorized skills list.
 * <p>
 * The model drafts the summary; every sentence it proposes is checked here against the evidence it
 * cites (citations resolve, metrics present, content words overlap). Skills are only listed when a
 * bullet or raw achievement mentions them. When the model fails or nothing survives the checks, a
 * deterministic summary is built from the document itself.
 */
@Service
public class HeaderComposer {

    private static final Logger log = LoggerFactory.getLogger(HeaderComposer.class);

    static final String AGENT_NAME = "HeaderComposer";

    private static final int MAX_SKILLS_PER_CATEGORY = 8;
    private static final int MAX_CITATIONS = 3;

    static final List<String> CATEGORY_ORDER = List.of("Leadership", "Technical", "Platform", "Delivery");

    private static final Map<String, List<String>> CATEGORY_CLASSIFIERS = Map.of(
            "Leadership", List.of("leadership", "mentor", "coach", "hiring", "team", "stakeholder",
                    "management", "people", "strategy", "executive"),
            "Platform", List.of("platform", "infrastructure", "cloud", "kubernetes", "aws", "gcp", "azure",
                    "devops", "migration", "terraform", "docker", "observability", "reliability", "sre",
                    "scalab", "distributed"),
            "Delivery", List.of("agile", "scrum", "kanban", "delivery", "release", "ci/cd", "roadmap",
                    "program", "project", "process", "incident"));

    static final List<String> SKILL_TAXONOMY = List.of(
            "Java", "Kotlin", "Python", "Golang", "TypeScript", "Kubernetes", "Docker", "Terraform", "AWS",
            "GCP", "Azure", "Kafka", "Spark", "PostgreSQL", "MongoDB", "Redis", "Microservices", "CI/CD",
            "Machine Learning", "Data Engineering", "System Design", "Distributed Systems", "Observability",
            "Agile", "Scrum", "Stakeholder Management", "Mentoring", "Hiring", "Roadmap Planning",
            "Cost Optimization", "Incident Management", "Platform Engineering", "Cloud Migration");

    private static final String SYSTEM_PROMPT = """
            You write the profile summary at the top of a CV.

            RULES (CRITICAL):
            - Write 2 or 3 sentences, plain text, no markdown, no first person.
            - Every sentence MUST list in "citations" the ids (shown in square brackets) of the
              evidence items it is based on.
            - Every number, percentage or amount in a sentence must appear in the cited items.
            - Use the vocabulary of the cited items; do not claim anything they do not state.
            - In "skills", list skills the evidence explicitly mentions. Do not add skills that only
              appear in the job description.
            """;

    private final TextGenerationClient client;
    private final ResilientLlmCaller caller;
    private final double overlapRatio;

    public HeaderComposer(@Qualifier("generationClient") TextGenerationClient client,
                          ResilientLlmCaller caller,
                          CvPipelineProperties properties) {
        this.client = client;
        this.caller = caller;
        this.overlapRatio = properties.validation().headerOverlapRatio();
    }

    public HeaderSection compose(StitchedDocument document, List<RoleRecord> roles, JobContext context) {
        return compose(document, roles, context, null);
    }

    /**
     * @param feedback grader feedback when the header is being revised, null on first pass
     */
    public HeaderSection compose(StitchedDocument document, List<RoleRecord> roles, JobContext context,
                                 String feedback) {
        EvidenceIndex evidence = EvidenceIndex.of(document, roles);
        log.info("{}: composing header from {} bullets{}", AGENT_NAME, document.allBullets().size(),
                feedback != null ? " with feedback" : "");

        LlmResult<HeaderDraftResponse> result = caller.call(client, AGENT_NAME, SYSTEM_PROMPT,
                userPrompt(evidence, context, feedback), HeaderDraftResponse.class, HeaderComposer::schemaViolations);

        List<String> rejected = new ArrayList<>();
        List<SummarySentence> summary = new ArrayList<>();
        List<String> proposedSkills = List.of();

        if (result.isOk()) {
            for (DraftSentence draft : result.payload().sentences()) {
                SummarySentence sentence = new SummarySentence(MarkupSanitizer.strip(draft.text()),
                        draft.citations() != null ? draft.citations().stream().map(String::strip).toList() : List.of());
                String problem = checkSentence(sentence, evidence);
                if (problem == null) {
                    summary.add(sentence);
                } else {
                    rejected.add("summary: \"" + sentence.text() + "\" (" + problem + ")");
                    log.warn("{}: summary sentence rejected ({}): {}", AGENT_NAME, problem, sentence.text());
                }
            }
            if (result.payload().skills() != null) {
                proposedSkills = result.payload().skills();
            }
        } else {
            log.warn("{}: model failed ({}), using fallback summary", AGENT_NAME, result.error());
        }

        boolean fallback = summary.isEmpty();
        if (fallback) {
            summary = fallbackSummary(document, roles, context, evidence);
        }
        List<SkillCategory> skills = groundSkills(evidence, roles, context, proposedSkills, rejected);

        log.info("{}: {} summary sentences{}, {} skills, {} claims rejected", AGENT_NAME, summary.size(),
                fallback ? " (fallback)" : "", skills.stream().mapToInt(c -> c.skills().size()).sum(),
                rejected.size());
        return new HeaderSection(summary, skills, rejected, fallback);
    }

    /**
     * Header built without the model. Grounded by construction.
     */
    public HeaderSection composeFallback(StitchedDocument document, List<RoleRecord> roles, JobContext context) {
        EvidenceIndex evidence = EvidenceIndex.of(document, roles);
        List<String> rejected = new ArrayList<>();
        return new HeaderSection(fallbackSummary(document, roles, context, evidence),
                groundSkills(evidence, roles, context, List.of(), rejected), rejected, true);
    }

    /**
     * Re-checks an existing header against a new document: sentences and skills whose evidence no
     * longer holds are removed and recorded as rejected claims.
     */
    public HeaderSection revalidate(HeaderSection header, StitchedDocument document, List<RoleRecord> roles) {
        EvidenceIndex evidence = EvidenceIndex.of(document, roles);
        List<String> rejected = new ArrayList<>(header.rejectedClaims());

        List<SummarySentence> summary = new ArrayList<>();
        for (SummarySentence sentence : header.summary()) {
            String problem = checkSentence(sentence, evidence);
            if (problem == null) {
                summary.add(sentence);
            } else {
                rejected.add("summary: \"" + sentence.text() + "\" (" + problem + " after revision)");
            }
        }

        List<SkillCategory> skills = new ArrayList<>();
        for (SkillCategory category : header.skills()) {
            List<GroundedSkill> kept = new ArrayList<>();
            for (GroundedSkill skill : category.skills()) {
                List<String> citations = limit(evidence.evidenceFor(skill.name()));
                if (citations.isEmpty()) {
                    rejected.add("skill: " + skill.name() + " (no evidence after revision)");
                } else {
                    kept.add(new GroundedSkill(skill.name(), citations));
                }
            }
            if (!kept.isEmpty()) {
                skills.add(new SkillCategory(category.name(), kept));
            }
        }
        return new HeaderSection(summary, skills, rejected, header.fallback());
    }

    /**
     * Returns why a sentence is not grounded, or null when it is.
     */
    String checkSentence(SummarySentence sentence, EvidenceIndex evidence) {
        if (sentence.text() == null || sentence.text().isBlank()) {
            return "empty sentence";
        }
        if (sentence.citations().isEmpty()) {
            return "no citation";
        }
        for (String citation : sentence.citations()) {
            if (evidence.resolve(citation).isEmpty()) {
                return "unknown citation " + citation;
            }
        }
        String cited = evidence.textOf(sentence.citations());
        Set<MetricExtractor.Metric> unsupported = MetricExtractor.unsupported(sentence.text(), cited);
        if (!unsupported.isEmpty()) {
            return "metrics " + unsupported + " not in cited evidence";
        }
        Set<String> words = TextSimilarity.contentWords(sentence.text());
        if (words.isEmpty()) {
            return null;
        }
        Set<String> evidenceWords = TextSimilarity.contentWords(cited);
        long overlap = words.stream().filter(evidenceWords::contains).count();
        double ratio = (double) overlap / words.size();
        if (ratio < overlapRatio) {
            return String.format(Locale.ROOT, "only %.0f%% of its words appear in the cited evidence", ratio * 100);
        }
        return null;
    }

    private List<SkillCategory> groundSkills(EvidenceIndex evidence, List<RoleRecord> roles, JobContext context,
                                             List<String> proposedSkills, List<String> rejected) {
        Map<String, String> vocabulary = new LinkedHashMap<>();
        Set<String> fromModelOnly = new LinkedHashSet<>();
        context.targetKeywords().forEach(k -> vocabulary.putIfAbsent(key(k), k.strip()));
        for (String skill : proposedSkills) {
            if (skill == null || skill.isBlank()) continue;
            if (vocabulary.putIfAbsent(key(skill), MarkupSanitizer.strip(skill)) == null) {
                fromModelOnly.add(key(skill));
            }
        }
        roles.forEach(r -> r.declaredSkills().forEach(s -> {
            vocabulary.putIfAbsent(key(s), s.strip());
            fromModelOnly.remove(key(s));
        }));
        SKILL_TAXONOMY.forEach(s -> vocabulary.putIfAbsent(key(s), s));

        Set<String> keywordKeys = new LinkedHashSet<>();
        context.targetKeywords().forEach(k -> keywordKeys.add(key(k)));

        Map<String, List<GroundedSkill>> byCategory = new LinkedHashMap<>();
        CATEGORY_ORDER.forEach(c -> byCategory.put(c, new ArrayList<>()));

        for (Map.Entry<String, String> entry : vocabulary.entrySet()) {
            List<String> citations = limit(evidence.evidenceFor(entry.getValue()));
            if (citations.isEmpty()) {
                if (fromModelOnly.contains(entry.getKey())) {
                    rejected.add("skill: " + entry.getValue() + " (no evidence in bullets or achievements)");
                    log.warn("{}: ungrounded skill rejected: {}", AGENT_NAME, entry.getValue());
                }
                continue;
            }
            byCategory.get(categorize(entry.getValue())).add(new GroundedSkill(entry.getValue(), citations));
        }

        Comparator<GroundedSkill> order = Comparator
                .comparingInt((GroundedSkill s) -> keywordRank(s, keywordKeys, context))
                .thenComparing(s -> s.name().toLowerCase(Locale.ROOT));

        List<SkillCategory> categories = new ArrayList<>();
        byCategory.forEach((name, skills) -> {
            if (!skills.isEmpty()) {
                categories.add(new SkillCategory(name,
                        skills.stream().sorted(order).limit(MAX_SKILLS_PER_CATEGORY).toList()));
            }
        });
        return categories;
    }

    private List<SummarySentence> fallbackSummary(StitchedDocument document, List<RoleRecord> roles,
                                                  JobContext context, EvidenceIndex evidence) {
        List<RoleRecord> shown = document.roles().isEmpty()
                ? roles
                : document.roles().stream().map(StitchedRole::role).toList();
        List<SummarySentence> summary = new ArrayList<>();
        if (shown.isEmpty()) {
            return summary;
        }

        RoleRecord latest = shown.get(0);
        List<RoleRecord> employers = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (RoleRecord role : shown) {
            if (seen.add(role.employer().toLowerCase(Locale.ROOT)) && employers.size() < 3) {
                employers.add(role);
            }
        }
        summary.add(new SummarySentence(
                latest.title() + " with experience at "
                        + joinNatural(employers.stream().map(RoleRecord::employer).toList()) + ".",
                employers.stream().map(RoleRecord::roleId).toList()));

        List<String> strengths = new ArrayList<>();
        List<String> citations = new ArrayList<>();
        for (String keyword : context.targetKeywords()) {
            List<String> found = evidence.evidenceFor(keyword);
            if (!found.isEmpty() && strengths.size() < 3) {
                strengths.add(keyword.strip());
                found.stream().limit(1).filter(id -> !citations.contains(id)).forEach(citations::add);
            }
        }
        if (!strengths.isEmpty()) {
            summary.add(new SummarySentence("Track record in " + joinNatural(strengths) + ".", citations));
        } else {
            document.allBullets().stream()
                    .max(Comparator.comparingDouble(CandidateBullet::relevanceScore))
                    .ifPresent(b -> summary.add(new SummarySentence(withPeriod(b.text()), List.of(b.id()))));
        }
        return summary;
    }

    static List<String> schemaViolations(HeaderDraftResponse response) {
        List<String> violations = new ArrayList<>();
        if (response.sentences() == null || response.sentences().isEmpty()) {
            violations.add("missing \"sentences\" array");
            return violations;
        }
        for (int i = 0; i < response.sentences().size(); i++) {
            DraftSentence sentence = response.sentences().get(i);
            if (sentence == null || sentence.text() == null || sentence.text().isBlank()) {
                violations.add("sentence " + (i + 1) + " has no text");
            }
        }
        return violations;
    }

    private static String userPrompt(EvidenceIndex evidence, JobContext context, String feedback) {
        StringBuilder sb = new StringBuilder();
        sb.append("TARGET JOB: ").append(context.title()).append('\n');
        if (!context.targetKeywords().isEmpty()) {
            sb.append("TARGET KEYWORDS: ").append(String.join(", ", context.targetKeywords())).append('\n');
        }
        sb.append("\nEVIDENCE (cite by the id in brackets):\n").append(evidence.describe());
        if (feedback != null && !feedback.isBlank()) {
            sb.append("\nREVIEWER FEEDBACK TO ADDRESS:\n").append(feedback).append('\n');
        }
        return sb.toString();
    }

    static String categorize(String skill) {
        String lower = skill.toLowerCase(Locale.ROOT);
        for (String category : List.of("Leadership", "Platform", "Delivery")) {
            if (CATEGORY_CLASSIFIERS.get(category).stream().anyMatch(lower::contains)) {
                return category;
            }
        }
        return "Technical";
    }

    private static int keywordRank(GroundedSkill skill, Set<String> keywordKeys, JobContext context) {
        if (!keywordKeys.contains(key(skill.name()))) {
            return Integer.MAX_VALUE;
        }
        for (int i = 0; i < context.targetKeywords().size(); i++) {
            if (key(context.targetKeywords().get(i)).equals(key(skill.name()))) {
                return i;
            }
        }
        return Integer.MAX_VALUE;
    }

    private static List<String> limit(List<String> citations) {
        return citations.stream().limit(MAX_CITATIONS).toList();
    }

    private static String key(String skill) {
        return skill.strip().toLowerCase(Locale.ROOT);
    }

    private static String joinNatural(List<String> items) {
        if (items.size() <= 1) return String.join("", items);
        return String.join(", ", items.subList(0, items.size() - 1)) + " and " + items.get(items.size() - 1);
    }

    private static String withPeriod(String text) {
        String stripped = text.strip();
        return stripped.endsWith(".") ? stripped : stripped + ".";
    }
}
