package io.cronkeeper.cron;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CronStoreTest {

    private static final long NOW = 1_700_000_000_000L;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private Path storePath;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        storePath = tempDir.resolve("cron").resolve("jobs.json");
    }

    @Test
    void shouldStartEmptyWhenFileIsMissing() {
        CronStore store = new CronStore(storePath, objectMapper, clock);

        assertEquals(0, store.size());
        assertFalse(store.isDirty());
        assertFalse(Files.exists(storePath));
    }

    @Test
    void shouldRoundTripJobsThroughFile() {
        CronStore store = new CronStore(storePath, objectMapper, clock);
        ScheduledJob every = job("a", new Schedule.Every(60_000, NOW), new Payload.SystemEvent("ping"));
        ScheduledJob cron = job("b", new Schedule.Cron("0 9 * * *", "Europe/Berlin"),
                new Payload.AgentTurn("summarize inbox", "gpt-4o", 30, true, "telegram", "42"));
        ScheduledJob once = job("c", new Schedule.At(NOW + 5_000), new Payload.SystemEvent("once"))
                .withState(new JobRunState(NOW + 5_000, NOW - 1_000, RunStatus.ERROR, 12L, "boom", null, 3));
        store.add(every);
        store.add(cron);
        store.add(once);

        assertTrue(store.persist());
        assertFalse(store.isDirty());

        CronStore reloaded = new CronStore(storePath, objectMapper, clock);
        assertEquals(3, reloaded.size());
        assertEquals(every, reloaded.getById("a").orElseThrow());
        assertEquals(cron, reloaded.getById("b").orElseThrow());
        assertEquals(once, reloaded.getById("c").orElseThrow());
    }

    @Test
    void shouldWriteVersionedLayoutWithKindDiscriminators() throws IOException {
        CronStore store = new CronStore(storePath, objectMapper, clock);
        store.add(job("a", new Schedule.Cron("*/5 * * * *", null), Payload.AgentTurn.of("hi")));
        store.persist();

        JsonNode root = objectMapper.readTree(storePath.toFile());
        assertEquals(1, root.get("version").asInt());
        JsonNode job = root.get("jobs").get(0);
        assertEquals("cron", job.get("schedule").get("kind").asText());
        assertEquals("*/5 * * * *", job.get("schedule").get("expression").asText());
        assertEquals("agentTurn", job.get("payload").get("kind").asText());
        assertEquals("hi", job.get("payload").get("message").asText());
    }

    @Test
    void shouldKeepBackupOfLastGoodWrite() {
        CronStore store = new CronStore(storePath, objectMapper, clock);
        store.add(job("a", Schedule.every(1_000), new Payload.SystemEvent("ping")));
        store.persist();

        assertTrue(Files.exists(storePath.resolveSibling("jobs.json.bak")));
    }

    @Test
    void shouldLeaveNoTemporaryFilesBehind() throws IOException {
        CronStore store = new CronStore(storePath, objectMapper, clock);
        store.add(job("a", Schedule.every(1_000), new Payload.SystemEvent("ping")));
        store.persist();

        try (var files = Files.list(storePath.getParent())) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void shouldOnlyWriteWhenDirty() throws IOException {
        CronStore store = new CronStore(storePath, objectMapper, clock);
        assertTrue(store.persist());
        assertFalse(Files.exists(storePath));

        assertTrue(store.forcePersist());
        assertTrue(Files.exists(storePath));
    }

    @Test
    void shouldResetCorruptFileToEmpty() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, "{not json");

        CronStore store = new CronStore(storePath, objectMapper, clock);

        assertEquals(0, store.size());
    }

    @Test
    void shouldResetUnknownVersionToEmpty() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, """
                {"version": 2, "jobs": [{"id": "x", "name": "x", "enabled": true,
                  "schedule": {"kind": "every", "intervalMs": 1000},
                  "payload": {"kind": "systemEvent", "message": "hi"}}]}
                """);

        CronStore store = new CronStore(storePath, objectMapper, clock);

        assertEquals(0, store.size());
    }

    @Test
    void shouldDropIncompleteEntriesAndIgnoreUnknownFields() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, """
                {"version": 1, "extra": true, "jobs": [
                  {"id": "x", "name": "keep", "enabled": true, "futureField": 7,
                   "schedule": {"kind": "every", "intervalMs": 1000},
                   "payload": {"kind": "systemEvent", "message": "hi"}},
                  {"id": "y", "name": "no schedule", "enabled": true,
                   "payload": {"kind": "systemEvent", "message": "hi"}}
                ]}
                """);

        CronStore store = new CronStore(storePath, objectMapper, clock);

        assertEquals(1, store.size());
        ScheduledJob job = store.getById("x").orElseThrow();
        assertEquals(new Schedule.Every(1000, null), job.schedule());
        assertEquals(JobRunState.empty(), job.state());
    }

    @Test
    void shouldStampUpdatedAtOnUpdate() {
        CronStore store = new CronStore(storePath, objectMapper, clock);
        store.add(job("a", Schedule.every(1_000), new Payload.SystemEvent("ping")));
        clock.advance(5_000);

        ScheduledJob updated = store.update("a", j -> j.withEnabled(false)).orElseThrow();

        assertFalse(updated.enabled());
        assertEquals(NOW + 5_000, updated.updatedAtMs());
        assertTrue(store.update("missing", j -> j).isEmpty());
    }

    @Test
    void shouldLookUpByNameAndFilterEnabled() {
        CronStore store = new CronStore(storePath, objectMapper, clock);
        store.add(job("a", Schedule.every(1_000), new Payload.SystemEvent("ping")));
        store.add(job("b", Schedule.every(1_000), new Payload.SystemEvent("ping")).withEnabled(false));

        assertEquals("a", store.getByName("job-a").orElseThrow().id());
        assertTrue(store.getByName("nope").isEmpty());
        assertEquals(1, store.getEnabled().size());
    }

    @Test
    void shouldPersistClearedStore() {
        CronStore store = new CronStore(storePath, objectMapper, clock);
        store.add(job("a", Schedule.every(1_000), new Payload.SystemEvent("ping")));
        store.persist();

        store.clear();
        assertTrue(store.isDirty());
        assertTrue(store.persist());

        assertEquals(0, new CronStore(storePath, objectMapper, clock).size());
    }

    @Test
    void shouldDiscardUnsavedChangesOnReload() {
        CronStore store = new CronStore(storePath, objectMapper, clock);
        store.add(job("a", Schedule.every(1_000), new Payload.SystemEvent("ping")));
        store.persist();
        store.remove("a");
        assertTrue(store.isDirty());

        store.reload();

        assertEquals(1, store.size());
        assertFalse(store.isDirty());
    }

    @Test
    void shouldStayDirtyWhenWriteFails() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        CronStore store = new CronStore(blocker.resolve("jobs.json"), objectMapper, clock);
        store.add(job("a", Schedule.every(1_000), new Payload.SystemEvent("ping")));

        assertFalse(store.persist());
        assertTrue(store.isDirty());
        assertEquals(1, store.size());
    }

    private static ScheduledJob job(String id, Schedule schedule, Payload payload) {
        return new ScheduledJob(id, "job-" + id, null, true, schedule, payload, null, NOW, NOW, JobRunState.empty());
    }
}
