package io.cronkeeper.cron;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * JSON file store for scheduled jobs.
 *
 * <p>Jobs are indexed in memory in insertion order. Mutations only set a dirty flag;
 * {@link #persist()} writes the whole file when dirty, through a temp file and an atomic
 * rename, then copies it to a {@code .bak} sibling.</p>
 *
 * <p>A missing, unreadable or unversioned file loads as an empty store. Unreadable state is
 * discarded rather than failing startup.</p>
 *
 * <p>Not thread-safe: {@link CronService} is the single writer and serializes every call.</p>
 */
public class CronStore {

    private static final Logger log = LoggerFactory.getLogger(CronStore.class);
    static final int MAX_WRITE_ATTEMPTS = 3;

    private final Path storePath;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();
    private boolean dirty;

    public CronStore(Path storePath, ObjectMapper objectMapper, Clock clock) {
        this.storePath = storePath;
        this.objectMapper = objectMapper.copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
        load();
    }

    /**
     * Replaces the in-memory index with the file contents.
     */
    public void load() {
        jobs.clear();
        for (ScheduledJob job : readFile().jobs()) {
            jobs.put(job.id(), job);
        }
        dirty = false;
        log.debug("Loaded {} cron jobs from {}", jobs.size(), storePath);
    }

    /**
     * Discards unsaved changes and re-reads the file.
     */
    public void reload() {
        load();
    }

    public List<ScheduledJob> getAll() {
        return List.copyOf(jobs.values());
    }

    public Optional<ScheduledJob> getById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    /**
     * Returns the first job with the given name.
     */
    public Optional<ScheduledJob> getByName(String name) {
        return jobs.values().stream()
                .filter(job -> job.name() != null && job.name().equals(name))
                .findFirst();
    }

    public List<ScheduledJob> getEnabled() {
        return jobs.values().stream().filter(ScheduledJob::enabled).toList();
    }

    public int size() {
        return jobs.size();
    }

    /**
     * Adds a job, replacing any job with the same id in place.
     */
    public void add(ScheduledJob job) {
        jobs.put(job.id(), job);
        dirty = true;
    }

    /**
     * Applies {@code mutator} to the job and stamps {@code updatedAtMs}.
     *
     * @return the stored result, or empty if no job has this id
     */
    public Optional<ScheduledJob> update(String id, UnaryOperator<ScheduledJob> mutator) {
        ScheduledJob current = jobs.get(id);
        if (current == null) {
            return Optional.empty();
        }
        ScheduledJob updated = mutator.apply(current).withUpdatedAtMs(clock.millis());
        jobs.put(id, updated);
        dirty = true;
        return Optional.of(updated);
    }

    public boolean remove(String id) {
        boolean removed = jobs.remove(id) != null;
        if (removed) {
            dirty = true;
        }
        return removed;
    }

    public void clear() {
        jobs.clear();
        dirty = true;
    }

    public boolean isDirty() {
        return dirty;
    }

    public Path getStorePath() {
        return storePath;
    }

    /**
     * Writes the store if it has unsaved changes.
     *
     * @return false if the write failed; the store then stays dirty so the next call retries
     */
    public boolean persist() {
        if (!dirty) {
            return true;
        }
        return write();
    }

    /**
     * Writes the store unconditionally.
     */
    public boolean forcePersist() {
        return write();
    }

    private boolean write() {
        CronStoreFile file = new CronStoreFile(CronStoreFile.CURRENT_VERSION, new ArrayList<>(jobs.values()));
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            try {
                writeAtomically(file);
                dirty = false;
                backup();
                return true;
            } catch (IOException e) {
                if (attempt == MAX_WRITE_ATTEMPTS) {
                    log.error("Failed to persist cron store {} after {} attempts", storePath, attempt, e);
                } else {
                    log.warn("Failed to persist cron store {} (attempt {}): {}", storePath, attempt, e.getMessage());
                }
            }
        }
        dirty = true;
        return false;
    }

    private void writeAtomically(CronStoreFile file) throws IOException {
        Path target = storePath.toAbsolutePath();
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString() + ".", ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), file);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing in place", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private void backup() {
        Path target = storePath.toAbsolutePath();
        Path backup = target.resolveSibling(target.getFileName() + ".bak");
        try {
            Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.debug("Could not back up cron store to {}: {}", backup, e.getMessage());
        }
    }

    private CronStoreFile readFile() {
        if (!Files.exists(storePath)) {
            log.debug("Cron store {} does not exist, starting empty", storePath);
            return CronStoreFile.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(storePath.toFile());
            if (root == null || !root.isObject()) {
                log.warn("Cron store {} is not a JSON object, starting empty", storePath);
                return CronStoreFile.empty();
            }
            JsonNode version = root.get("version");
            JsonNode jobsNode = root.get("jobs");
            if (version == null || !version.canConvertToInt() || version.asInt() != CronStoreFile.CURRENT_VERSION
                    || jobsNode == null || !jobsNode.isArray()) {
                log.warn("Cron store {} has unsupported version or layout, starting empty", storePath);
                return CronStoreFile.empty();
            }
            List<ScheduledJob> loaded = objectMapper.convertValue(jobsNode, new TypeReference<List<ScheduledJob>>() {});
            List<ScheduledJob> valid = loaded.stream()
                    .filter(job -> job != null && job.id() != null && job.schedule() != null && job.payload() != null)
                    .toList();
            if (valid.size() != loaded.size()) {
                log.warn("Dropped {} incomplete job entries from {}", loaded.size() - valid.size(), storePath);
            }
            return new CronStoreFile(CronStoreFile.CURRENT_VERSION, valid);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Cron store {} is unreadable, starting empty: {}", storePath, e.getMessage());
            return CronStoreFile.empty();
        }
    }
}
