package com.example.cvpipeline.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Role record as stored in MongoDB (collection role_records).
 * The content uses the same text format as the per-role corpus files.
 */
@Document(collection = "role_records")
public record RoleRecordDocument(
        @Id String id,
        String roleId,
        int recencyRank,
        String content,
        Instant updatedAt
) {}
