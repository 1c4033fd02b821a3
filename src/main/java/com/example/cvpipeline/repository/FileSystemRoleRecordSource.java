package com.example.cvpipeline.repository;

import com.example.cvpipeline.config.CvPipelineProperties;
import com.example.cvpipeline.exception.LoadException;
import com.example.cvpipeline.model.RawRoleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads one role per {@code .md} or {@code .txt} file. File-name order is recency order,
 * so a corpus is laid out as {@code 01_current.md}, {@code 02_previous.md}, ...
 */
@Component
@ConditionalOnProperty(prefix = "cv.corpus", name = "source", havingValue = "filesystem", matchIfMissing = true)
public class FileSystemRoleRecordSource implements RoleRecordSource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRoleRecordSource.class);

    private final Path directory;

    @Autowired
    public FileSystemRoleRecordSource(CvPipelineProperties properties) {
        this(Path.of(properties.corpus().directory()));
    }

    public FileSystemRoleRecordSource(Path directory) {
        this.directory = directory;
    }

    @Override
    public List<RawRoleRecord> fetchAll() {
        if (!Files.isDirectory(directory)) {
            throw new LoadException(LoadException.Kind.SOURCE_UNAVAILABLE,
                    "Corpus directory not found: " + directory.toAbsolutePath());
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString().toLowerCase();
                        return name.endsWith(".md") || name.endsWith(".txt");
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new LoadException(LoadException.Kind.SOURCE_UNAVAILABLE,
                    "Cannot list corpus directory " + directory + ": " + e.getMessage(), e);
        }

        List<RawRoleRecord> records = new ArrayList<>();
        int rank = 1;
        for (Path file : files) {
            try {
                records.add(new RawRoleRecord(file.getFileName().toString(), rank++,
                        Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                throw new LoadException(LoadException.Kind.SOURCE_UNAVAILABLE,
                        "Cannot read role file " + file + ": " + e.getMessage(), e);
            }
        }
        log.info("Read {} role files from {}", records.size(), directory);
        return records;
    }
}
