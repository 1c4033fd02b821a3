package com.example.cvpipeline.repository;

import com.example.cvpipeline.model.RawRoleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads role records from MongoDB, ordered by their stored recency rank.
 */
@Component
@ConditionalOnProperty(prefix = "cv.corpus", name = "source", havingValue = "mongo")
public class MongoRoleRecordSource implements RoleRecordSource {

    private static final Logger log = LoggerFactory.getLogger(MongoRoleRecordSource.class);

    private final RoleRecordRepository repository;

    public MongoRoleRecordSource(RoleRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<RawRoleRecord> fetchAll() {
        List<RawRoleRecord> records = repository.findAllByOrderByRecencyRankAsc().stream()
                .map(doc -> new RawRoleRecord(
                        doc.roleId() != null ? doc.roleId() : doc.id(),
                        doc.recencyRank(),
                        doc.content()))
                .toList();
        log.info("Read {} role records from MongoDB", records.size());
        return records;
    }
}
