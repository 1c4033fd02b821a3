package com.example.cvpipeline.config;

import com.example.cvpipeline.model.WordBudget;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the CV pipeline, bound from the {@code cv} prefix.
 * Missing sections fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "cv")
public record CvPipelineProperties(
        Corpus corpus,
        Generation generation,
        Llm llm,
        Validation validation,
        Stitching stitching,
        Grading grading,
        Loop loop,
        Concurrency concurrency,
        Duration runDeadline
) {

    public CvPipelineProperties {
        corpus = corpus != null ? corpus : new Corpus(null, null);
        generation = generation != null ? generation : new Generation(0, 0, 0);
        llm = llm != null ? llm : new Llm(0, null, 0, null, null);
        validation = validation != null ? validation : new Validation(0);
        stitching = stitching != null ? stitching : new Stitching(0, 0, 0, 0, 0, -1);
        grading = grading != null ? grading : new Grading(null, 0, null);
        loop = loop != null ? loop : new Loop(-1);
        concurrency = concurrency != null ? concurrency : new Concurrency(0);
        runDeadline = runDeadline != null ? runDeadline : Duration.ofMinutes(5);
    }

    public static CvPipelineProperties defaults() {
        return new CvPipelineProperties(null, null, null, null, null, null, null, null, null);
    }

    /**
     * Where role records are read from.
     *
     * @param source    {@code filesystem} or {@code mongo} (collection role_records)
     * @param directory directory of per-role files for the file-system source
     */
    public record Corpus(String source, String directory) {
        public Corpus {
            source = source != null ? source : "filesystem";
            directory = directory != null ? directory : "./corpus";
        }
    }

    /**
     * @param minBullets        fewest bullets requested per role
     * @param maxBullets        most bullets requested per role
     * @param maxWordsPerBullet hard word limit per bullet
     */
    public record Generation(int minBullets, int maxBullets, int maxWordsPerBullet) {
        public Generation {
            minBullets = minBullets > 0 ? minBullets : 3;
            maxBullets = maxBullets > 0 ? maxBullets : 5;
            maxWordsPerBullet = maxWordsPerBullet > 0 ? maxWordsPerBullet : 35;
        }
    }

    /**
     * Retry and timeout policy for model calls.
     */
    public record Llm(int maxAttempts, Duration initialBackoff, double backoffMultiplier,
                      Duration maxBackoff, Duration callTimeout) {
        public Llm {
            maxAttempts = maxAttempts > 0 ? maxAttempts : 3;
            initialBackoff = initialBackoff != null ? initialBackoff : Duration.ofSeconds(1);
            backoffMultiplier = backoffMultiplier > 0 ? backoffMultiplier : 2.0;
            maxBackoff = maxBackoff != null ? maxBackoff : Duration.ofSeconds(10);
            callTimeout = callTimeout != null ? callTimeout : Duration.ofSeconds(60);
        }
    }

    /**
     * @param headerOverlapRatio share of a summary sentence's content words that must appear in its evidence
     */
    public record Validation(double headerOverlapRatio) {
        public Validation {
            headerOverlapRatio = headerOverlapRatio > 0 ? headerOverlapRatio : 0.3;
        }
    }

    /**
     * @param minWords               lower bound of the whole CV
     * @param maxWords               upper bound of the whole CV
     * @param minBulletsPerRole      bullets reserved for every included role
     * @param nearDuplicateThreshold token similarity at which two keys count as duplicates; 1.0 means exact keys only
     * @param headerReserveWords     header allowance used before the header exists
     * @param topUpRounds            extra generation rounds when the document is under budget
     */
    public record Stitching(int minWords, int maxWords, int minBulletsPerRole,
                            double nearDuplicateThreshold, int headerReserveWords,
                            @DefaultValue("1") int topUpRounds) {
        public Stitching {
            minWords = minWords > 0 ? minWords : 400;
            maxWords = maxWords > 0 ? maxWords : 650;
            minBulletsPerRole = minBulletsPerRole > 0 ? minBulletsPerRole : 2;
            nearDuplicateThreshold = nearDuplicateThreshold > 0 ? nearDuplicateThreshold : 1.0;
            headerReserveWords = headerReserveWords > 0 ? headerReserveWords : 80;
            topUpRounds = topUpRounds >= 0 ? topUpRounds : 1;
        }

        public WordBudget budget() {
            return new WordBudget(minWords, maxWords);
        }
    }

    /**
     * Grading rubric. Dimension weights need not sum to one; the overall score is the weighted mean.
     */
    public record Grading(String rubricVersion, double passingThreshold, Map<String, Double> dimensions) {
        public Grading {
            rubricVersion = rubricVersion != null ? rubricVersion : "v1";
            passingThreshold = passingThreshold > 0 ? passingThreshold : 8.0;
            if (dimensions == null || dimensions.isEmpty()) {
                dimensions = new LinkedHashMap<>();
                dimensions.put("specificity", 0.25);
                dimensions.put("keyword-coverage", 0.20);
                dimensions.put("grounding", 0.25);
                dimensions.put("conciseness", 0.15);
                dimensions.put("tone", 0.15);
            }
            dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        }
    }

    /**
     * @param iterationCap most revisions the improver may make
     */
    public record Loop(@DefaultValue("2") int iterationCap) {
        public Loop {
            iterationCap = iterationCap >= 0 ? iterationCap : 2;
        }
    }

    /**
     * @param roleWorkers size of the per-role worker pool
     */
    public record Concurrency(int roleWorkers) {
        public Concurrency {
            roleWorkers = roleWorkers > 0 ? roleWorkers : 4;
        }
    }
}
