package io.kairo.core.cron;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores all jobs in a single {@code {"version": 1, "jobs": [...]}} document.
 */
public final class FileCronStore implements CronStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileCronStore.class);
    static final int VERSION = 1;

    private final Path path;
    private final ObjectMapper mapper = new ObjectMapper();

    public FileCronStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized List<CronJob> load() {
        if (!Files.exists(path)) {
            return List.of();
        }

        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(path));
        } catch (Exception e) {
            LOG.warn("Failed to read cron store {}, starting with no jobs: {}", path, e.getMessage());
            return List.of();
        }

        JsonNode jobsNode = root == null ? null : root.get("jobs");
        if (jobsNode == null || !jobsNode.isArray()) {
            return List.of();
        }

        List<CronJob> jobs = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (JsonNode node : jobsNode) {
            CronJob job;
            try {
                job = mapper.treeToValue(node, CronJob.class);
            } catch (Exception e) {
                LOG.warn("Dropping unreadable cron job record {}: {}", node.path("id").asText("<no id>"), e.getMessage());
                continue;
            }
            if (!seenIds.add(job.id())) {
                LOG.warn("Dropping duplicate cron job record {}", job.id());
                continue;
            }
            jobs.add(job);
        }
        return jobs;
    }

    @Override
    public synchronized void save(List<CronJob> jobs) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String json = mapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(new CronStoreDocument(VERSION, List.copyOf(jobs)));
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, json + System.lineSeparator());
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (Exception e) {
            LOG.error("Failed to save cron store {}", path, e);
        }
    }
}
