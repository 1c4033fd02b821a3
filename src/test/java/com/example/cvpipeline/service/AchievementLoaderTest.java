package com.example.cvpipeline.service;

import com.example.cvpipeline.exception.LoadException;
import com.example.cvpipeline.model.RoleRecord;
import com.example.cvpipeline.repository.FileSystemRoleRecordSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AchievementLoaderTest {

    @TempDir
    Path corpus;

    @Test
    @DisplayName("Should load roles in file-name order as recency order")
    void shouldLoadInRecencyOrder() throws IOException {
        Files.writeString(corpus.resolve("02_globex.md"), "Employer: Globex\nTitle: Engineer\n- Built the billing service\n");
        Files.writeString(corpus.resolve("01_acme.md"), "Employer: Acme\nTitle: Staff Engineer\n- Mentored 3 engineers\n");
        Files.writeString(corpus.resolve("notes.json"), "{}");

        List<RoleRecord> roles = loader().load();

        assertThat(roles).extracting(RoleRecord::roleId).containsExactly("acme", "globex");
        assertThat(roles).extracting(RoleRecord::recencyRank).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should make duplicate role ids unique")
    void shouldMakeDuplicateIdsUnique() throws IOException {
        Files.writeString(corpus.resolve("01_acme.md"), "Employer: Acme\nTitle: Staff Engineer\n- Led the platform team\n");
        Files.writeString(corpus.resolve("02-acme.md"), "Employer: Acme\nTitle: Engineer\n- Built the billing service\n");

        List<RoleRecord> roles = loader().load();

        assertThat(roles).extracting(RoleRecord::roleId).containsExactly("acme", "acme_2");
    }

    @Test
    @DisplayName("Should fail with NO_ROLE_RECORDS on an empty corpus")
    void shouldFailOnEmptyCorpus() {
        assertThatThrownBy(() -> loader().load())
                .isInstanceOf(LoadException.class)
                .extracting(e -> ((LoadException) e).getKind())
                .isEqualTo(LoadException.Kind.NO_ROLE_RECORDS);
    }

    @Test
    @DisplayName("Should fail with SOURCE_UNAVAILABLE when the directory is missing")
    void shouldFailOnMissingDirectory() {
        AchievementLoader loader = new AchievementLoader(
                new FileSystemRoleRecordSource(corpus.resolve("missing")), new RoleRecordParser());

        assertThatThrownBy(loader::load)
                .isInstanceOf(LoadException.class)
                .extracting(e -> ((LoadException) e).getKind())
                .isEqualTo(LoadException.Kind.SOURCE_UNAVAILABLE);
    }

    private AchievementLoader loader() {
        return new AchievementLoader(new FileSystemRoleRecordSource(corpus), new RoleRecordParser());
    }
}
