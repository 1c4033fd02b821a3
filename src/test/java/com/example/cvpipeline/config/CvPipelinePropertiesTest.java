package com.example.cvpipeline.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CvPipelinePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class);

    @Configuration
    @EnableConfigurationProperties(CvPipelineProperties.class)
    static class PropertiesConfig {
    }

    @Test
    @DisplayName("Should fall back to defaults when nothing is configured")
    void shouldApplyDefaults() {
        runner.run(context -> {
            CvPipelineProperties properties = context.getBean(CvPipelineProperties.class);

            assertThat(properties.stitching().minWords()).isEqualTo(400);
            assertThat(properties.stitching().maxWords()).isEqualTo(650);
            assertThat(properties.stitching().topUpRounds()).isEqualTo(1);
            assertThat(properties.generation().minBullets()).isEqualTo(3);
            assertThat(properties.generation().maxBullets()).isEqualTo(5);
            assertThat(properties.loop().iterationCap()).isEqualTo(2);
            assertThat(properties.grading().passingThreshold()).isEqualTo(8.0);
            assertThat(properties.grading().dimensions())
                    .containsOnlyKeys("specificity", "keyword-coverage", "grounding", "conciseness", "tone");
            assertThat(properties.corpus().source()).isEqualTo("filesystem");
            assertThat(properties.runDeadline()).isEqualTo(Duration.ofMinutes(5));
        });
    }

    @Test
    @DisplayName("Should bind configured values and keep explicit zeros where they are meaningful")
    void shouldBindValues() {
        runner.withPropertyValues(
                        "cv.stitching.min-words=300",
                        "cv.stitching.max-words=500",
                        "cv.stitching.top-up-rounds=0",
                        "cv.loop.iteration-cap=0",
                        "cv.grading.passing-threshold=7.5",
                        "cv.grading.dimensions.impact=0.6",
                        "cv.grading.dimensions.tone=0.4",
                        "cv.llm.call-timeout=20s",
                        "cv.concurrency.role-workers=8",
                        "cv.run-deadline=90s")
                .run(context -> {
                    CvPipelineProperties properties = context.getBean(CvPipelineProperties.class);

                    assertThat(properties.stitching().budget().minWords()).isEqualTo(300);
                    assertThat(properties.stitching().budget().maxWords()).isEqualTo(500);
                    assertThat(properties.stitching().topUpRounds()).isZero();
                    assertThat(properties.stitching().minBulletsPerRole()).isEqualTo(2);
                    assertThat(properties.loop().iterationCap()).isZero();
                    assertThat(properties.grading().passingThreshold()).isEqualTo(7.5);
                    assertThat(properties.grading().dimensions()).containsOnlyKeys("impact", "tone");
                    assertThat(properties.llm().callTimeout()).isEqualTo(Duration.ofSeconds(20));
                    assertThat(properties.llm().maxAttempts()).isEqualTo(3);
                    assertThat(properties.concurrency().roleWorkers()).isEqualTo(8);
                    assertThat(properties.runDeadline()).isEqualTo(Duration.ofSeconds(90));
                });
    }

    @Test
    @DisplayName("Should keep section defaults for keys left out of a partially configured section")
    void shouldKeepDefaultsInPartialSection() {
        runner.withPropertyValues("cv.stitching.min-words=300", "cv.loop.iteration-cap=1")
                .run(context -> {
                    CvPipelineProperties properties = context.getBean(CvPipelineProperties.class);

                    assertThat(properties.stitching().minWords()).isEqualTo(300);
                    assertThat(properties.stitching().maxWords()).isEqualTo(650);
                    assertThat(properties.stitching().topUpRounds()).isEqualTo(1);
                    assertThat(properties.stitching().headerReserveWords()).isEqualTo(80);
                    assertThat(properties.loop().iterationCap()).isEqualTo(1);
                });
    }
}
