package com.example.cvpipeline.model;

import java.util.List;

public record GroundedSkill(String name, List<String> citations) {

    public GroundedSkill {
        citations = List.copyOf(citations);
    }
}
