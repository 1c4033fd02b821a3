package com.example.cvpipeline.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DedupKeyFactoryTest {

    @Test
    @DisplayName("Should ignore case, punctuation, markup and stop words")
    void shouldIgnoreSurfaceDifferences() {
        assertThat(DedupKeyFactory.keyOf("Led the migration to a **new platform**, cutting costs 30%."))
                .isEqualTo(DedupKeyFactory.keyOf("led migration to new platform; cutting costs 30%"));
    }

    @Test
    @DisplayName("Should treat percent spellings and thousands separators as equal")
    void shouldNormalizeMetricSpellings() {
        assertThat(DedupKeyFactory.keyOf("Served 1,200 customers, churn down 5 percent"))
                .isEqualTo(DedupKeyFactory.keyOf("Served 1200 customers, churn down 5%"));
    }

    @Test
    @DisplayName("Should keep decimals intact")
    void shouldKeepDecimals() {
        assertThat(DedupKeyFactory.keyOf("Grew ARR to $1.5m.").signature()).contains("1.5m");
        assertThat(DedupKeyFactory.keyOf("Grew ARR to $1.5m"))
                .isNotEqualTo(DedupKeyFactory.keyOf("Grew ARR to $15m"));
    }

    @Test
    @DisplayName("Should keep bullets with different facts apart")
    void shouldSeparateDifferentFacts() {
        assertThat(DedupKeyFactory.keyOf("Cut costs 30%"))
                .isNotEqualTo(DedupKeyFactory.keyOf("Cut costs 20%"));
    }
}
