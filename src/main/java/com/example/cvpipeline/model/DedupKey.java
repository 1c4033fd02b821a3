package com.example.cvpipeline.model;

import java.util.List;

/**
 * Normalized bullet signature. Equal keys mean duplicate bullets, whatever role they came from.
 */
public record DedupKey(String signature) {

    public List<String> tokens() {
        return signature.isEmpty() ? List.of() : List.of(signature.split(" "));
    }
}
