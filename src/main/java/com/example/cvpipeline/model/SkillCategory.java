package com.example.cvpipeline.model;

import java.util.List;

public record SkillCategory(String name, List<GroundedSkill> skills) {

    public SkillCategory {
        skills = List.copyOf(skills);
    }
}
