package com.cronhook.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JobStore backed by a single JSON file holding an array of job records.
 * Every save rewrites the whole file through a temporary sibling so readers
 * never observe a partially written array.
 */
public class FileJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(FileJobStore.class);

    private final Path path;
    private final ObjectMapper mapper = Json.newMapper();

    public FileJobStore(Path path) {
        this.path = path;
    }

    @Override
    public synchronized List<Job> load() throws IOException {
        if (!Files.exists(path)) {
            log.info("Job file {} does not exist, creating an empty one", path);
            write("[]");
            return new ArrayList<>();
        }
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new StoreCorruptException("Job file " + path + " is not valid UTF-8 (copy kept at "
                    + backupCorrupt() + ")", e);
        }
        if (raw.isBlank()) {
            return new ArrayList<>();
        }
        JsonNode root;
        try {
            root = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new StoreCorruptException("Job file " + path + " is not valid JSON (copy kept at "
                    + backupCorrupt() + ")", e);
        }
        if (root == null || !root.isArray()) {
            throw new StoreCorruptException("Job file " + path + " does not contain a JSON array (copy kept at "
                    + backupCorrupt() + ")");
        }

        List<Job> jobs = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            Job job = readRecord(node, index++);
            if (job != null) {
                jobs.add(job);
            }
        }
        return jobs;
    }

    private Job readRecord(JsonNode node, int index) {
        Job job;
        try {
            job = mapper.treeToValue(node, Job.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping unreadable job record #{} in {}: {}", index, path, e.getMessage());
            return null;
        }
        if (job == null || isBlank(job.id()) || job.name() == null || job.schedule() == null) {
            log.warn("Skipping incomplete job record #{} in {}", index, path);
            return null;
        }
        return job;
    }

    // the next save overwrites the file, keep what was there
    private Path backupCorrupt() throws IOException {
        Path backup = path.resolveSibling(path.getFileName() + ".corrupt-" + System.currentTimeMillis());
        Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
        return backup;
    }

    @Override
    public synchronized void save(List<Job> jobs) throws IOException {
        write(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(jobs));
    }

    private void write(String content) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
