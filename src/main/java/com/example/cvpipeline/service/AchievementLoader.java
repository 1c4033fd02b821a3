package com.example.cvpipeline.service;

import com.example.cvpipeline.exception.LoadException;
import com.example.cvpipeline.model.RawRoleRecord;
import com.example.cvpipeline.model.RoleRecord;
import com.example.cvpipeline.repository.RoleRecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the candidate's role records from the configured {@link RoleRecordSource}.
 * Records come back ordered by recency, most recent first, with unique role ids.
 */
@Service
public class AchievementLoader {

    private static final Logger log = LoggerFactory.getLogger(AchievementLoader.class);

    private final RoleRecordSource source;
    private final RoleRecordParser parser;

    public AchievementLoader(RoleRecordSource source, RoleRecordParser parser) {
        this.source = source;
        this.parser = parser;
    }

    public List<RoleRecord> load() {
        List<RawRoleRecord> raw = source.fetchAll();
        if (raw == null || raw.isEmpty()) {
            throw new LoadException(LoadException.Kind.NO_ROLE_RECORDS, "The corpus contains no role records");
        }

        List<RoleRecord> records = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (RawRoleRecord entry : raw) {
            RoleRecord record = parser.parse(entry);
            if (!seenIds.add(record.roleId())) {
                String unique = record.roleId() + "_" + record.recencyRank();
                log.warn("Duplicate role id '{}' in '{}', using '{}'", record.roleId(), entry.sourceName(), unique);
                record = new RoleRecord(unique, record.employer(), record.title(), record.period(),
                        record.location(), record.recencyRank(), record.achievements(), record.declaredSkills());
                seenIds.add(unique);
            }
            records.add(record);
        }

        records.sort(Comparator.comparingInt(RoleRecord::recencyRank).thenComparing(RoleRecord::roleId));
        log.info("Loaded {} roles, {} achievements", records.size(),
                records.stream().mapToInt(r -> r.achievements().size()).sum());
        return List.copyOf(records);
    }
}
