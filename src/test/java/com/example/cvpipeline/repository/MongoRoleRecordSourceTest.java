package com.example.cvpipeline.repository;

import com.example.cvpipeline.model.RawRoleRecord;
import com.example.cvpipeline.model.RoleRecordDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MongoRoleRecordSourceTest {

    @Test
    @DisplayName("Should map stored documents to raw records, naming them by role id when present")
    void shouldMapDocuments() {
        RoleRecordRepository repository = mock(RoleRecordRepository.class);
        when(repository.findAllByOrderByRecencyRankAsc()).thenReturn(List.of(
                new RoleRecordDocument("665f1", "acme", 1, "Employer: Acme", Instant.EPOCH),
                new RoleRecordDocument("665f2", null, 2, "Employer: Globex", Instant.EPOCH)));

        List<RawRoleRecord> records = new MongoRoleRecordSource(repository).fetchAll();

        assertThat(records).containsExactly(
                new RawRoleRecord("acme", 1, "Employer: Acme"),
                new RawRoleRecord("665f2", 2, "Employer: Globex"));
    }
}
