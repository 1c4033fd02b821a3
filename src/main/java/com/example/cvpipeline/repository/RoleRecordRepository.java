package com.example.cvpipeline.repository;

import com.example.cvpipeline.model.RoleRecordDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Repository for role records kept in MongoDB (collection role_records).
 */
public interface RoleRecordRepository extends MongoRepository<RoleRecordDocument, String> {

    List<RoleRecordDocument> findAllByOrderByRecencyRankAsc();
}
