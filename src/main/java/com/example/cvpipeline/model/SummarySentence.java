package com.example.cvpipeline.model;

import java.util.List;

/**
 * Profile sentence with the corpus items it rests on (bullet ids, {@code roleId#n}, or role ids).
 */
public record SummarySentence(String text, List<String> citations) {

    public SummarySentence {
        citations = citations != null ? List.copyOf(citations) : List.of();
    }
}
