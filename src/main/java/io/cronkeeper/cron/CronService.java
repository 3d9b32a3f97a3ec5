package io.cronkeeper.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Schedules and runs jobs held in a {@link CronStore}.
 *
 * <p>A single timer is armed for the earliest {@code nextRunAtMs} of all enabled jobs that are not
 * running. When it fires, every due job is executed serially, run statistics are recorded, and the
 * timer is armed again. Delays are capped at {@link #MAX_TIMEOUT_MS}; a job further out is reached by re-arming
 * on each wake-up.</p>
 *
 * <p>All store access is serialized behind one lock, which is never held while an executor runs.
 * A job whose {@code runningAtMs} is set is never started a second time. A run marker left by
 * another process is cleared once it is older than {@link CronTimes#STUCK_RUN_MS}.</p>
 *
 * <p>The public API reports bad input through {@link CronResult} and {@link RunResult} rather than
 * exceptions.</p>
 */
public class CronService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CronService.class);

    /** Longest single timer delay (~24.8 days), the range of a signed 32-bit millisecond timer. */
    public static final long MAX_TIMEOUT_MS = Integer.MAX_VALUE;

    private final CronStore store;
    private final JobExecutor executor;
    private final CronEventListener listener;
    private final Clock clock;
    private final boolean enabled;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean sweeping = new AtomicBoolean();
    private final ScheduledExecutorService timer;
    private final Set<String> inFlight = new HashSet<>();

    private volatile boolean started;
    private ScheduledFuture<?> pendingTick;
    private Long nextWakeAtMs;
    private long armedDelayMs = -1;

    public CronService(CronStore store, JobExecutor executor, CronEventListener listener,
                       Clock clock, boolean enabled) {
        this.store = store;
        this.executor = executor;
        this.listener = listener != null ? listener : CronEventListener.NOOP;
        this.clock = clock;
        this.enabled = enabled;
        this.timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cron-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Reconciles all jobs against the clock and arms the timer. Only the first call has an effect.
     */
    public void start() {
        lock.lock();
        try {
            if (started) {
                return;
            }
            started = true;
            reconcile();
            armTimer();
            log.info("Cron service started with {} jobs (timer {})", store.size(), enabled ? "enabled" : "disabled");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the pending timer. A sweep already in progress finishes normally.
     */
    public void stop() {
        lock.lock();
        try {
            if (!started) {
                return;
            }
            started = false;
            cancelPendingTick();
            nextWakeAtMs = null;
            armedDelayMs = -1;
            log.info("Cron service stopped");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        stop();
        timer.shutdown();
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * Lists enabled jobs ordered by next run, jobs without a next run last.
     */
    public List<ScheduledJob> list() {
        return list(false);
    }

    public List<ScheduledJob> list(boolean includeDisabled) {
        lock.lock();
        try {
            return store.getAll().stream()
                    .filter(job -> includeDisabled || job.enabled())
                    .sorted(Comparator.comparing((ScheduledJob job) -> job.state().nextRunAtMs(),
                            Comparator.nullsLast(Comparator.naturalOrder())))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public Optional<ScheduledJob> get(String id) {
        lock.lock();
        try {
            return store.getById(id);
        } finally {
            lock.unlock();
        }
    }

    public Optional<ScheduledJob> getByName(String name) {
        lock.lock();
        try {
            return store.getByName(name);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creates a job, computes its first run and persists it.
     */
    public CronResult<ScheduledJob> add(JobCreate input) {
        if (input == null || input.name() == null || input.name().isBlank()) {
            return CronResult.failure(CronError.Code.INVALID_INPUT, "Job name is required");
        }
        if (input.payload() == null || !input.payload().hasMessage()) {
            return CronResult.failure(CronError.Code.INVALID_INPUT, "Payload with a message is required");
        }
        ScheduleValidation validation = Schedules.validate(input.schedule(), clock.millis());
        if (!validation.valid()) {
            return CronResult.failure(CronError.Code.INVALID_SCHEDULE, validation.error());
        }

        ScheduledJob job;
        lock.lock();
        try {
            long now = clock.millis();
            ScheduledJob created = new ScheduledJob(
                    UUID.randomUUID().toString(),
                    input.name(),
                    input.description(),
                    input.enabled() == null || input.enabled(),
                    input.schedule(),
                    input.payload(),
                    input.deleteAfterRun(),
                    now,
                    now,
                    JobRunState.empty());
            job = created.withState(created.state().withNextRunAtMs(Schedules.nextRunOrNull(created, now)));
            store.add(job);
            store.persist();
            armTimer();
        } finally {
            lock.unlock();
        }

        log.info("Added cron job '{}' ({}): {}", job.name(), job.id(), Schedules.format(job.schedule()));
        emit(CronEvent.of(job.id(), CronEvent.Action.ADDED, clock.millis(), job.state().nextRunAtMs()));
        return CronResult.ok(job);
    }

    /**
     * Applies a patch and recomputes the next run.
     */
    public CronResult<ScheduledJob> update(String id, JobPatch patch) {
        if (patch == null) {
            return CronResult.failure(CronError.Code.INVALID_INPUT, "Patch is required");
        }
        if (patch.name() != null && patch.name().isBlank()) {
            return CronResult.failure(CronError.Code.INVALID_INPUT, "Job name must not be blank");
        }
        if (patch.schedule() != null) {
            ScheduleValidation validation = Schedules.validate(patch.schedule(), clock.millis());
            if (!validation.valid()) {
                return CronResult.failure(CronError.Code.INVALID_SCHEDULE, validation.error());
            }
        }

        ScheduledJob updated;
        lock.lock();
        try {
            Optional<ScheduledJob> existing = store.getById(id);
            if (existing.isEmpty()) {
                return CronResult.failure(CronError.notFound(id));
            }
            ScheduledJob job = existing.get();
            CronResult<Payload> payload = mergePayload(job, patch.payload());
            if (!payload.succeeded()) {
                return CronResult.failure(payload.error());
            }

            long now = clock.millis();
            ScheduledJob merged = new ScheduledJob(
                    job.id(),
                    patch.name() != null ? patch.name() : job.name(),
                    patch.description() != null ? patch.description() : job.description(),
                    patch.enabled() != null ? patch.enabled() : job.enabled(),
                    patch.schedule() != null ? patch.schedule() : job.schedule(),
                    payload.value(),
                    patch.deleteAfterRun() != null ? patch.deleteAfterRun() : job.deleteAfterRun(),
                    job.createdAtMs(),
                    now,
                    job.state());
            ScheduledJob withNextRun = merged.withState(merged.state().withNextRunAtMs(Schedules.nextRunOrNull(merged, now)));
            updated = store.update(id, current -> withNextRun).orElse(withNextRun);
            store.persist();
            armTimer();
        } finally {
            lock.unlock();
        }

        log.info("Updated cron job '{}' ({})", updated.name(), updated.id());
        emit(CronEvent.of(updated.id(), CronEvent.Action.UPDATED, clock.millis(), updated.state().nextRunAtMs()));
        return CronResult.ok(updated);
    }

    /**
     * Removes a job.
     *
     * @return false if no job has this id
     */
    public boolean remove(String id) {
        lock.lock();
        try {
            if (!store.remove(id)) {
                return false;
            }
            store.persist();
            armTimer();
        } finally {
            lock.unlock();
        }
        log.info("Removed cron job {}", id);
        emit(CronEvent.of(id, CronEvent.Action.REMOVED, clock.millis(), null));
        return true;
    }

    /**
     * Runs a job now without touching its schedule.
     */
    public RunResult run(String id) {
        return run(id, true, CancellationToken.none());
    }

    public RunResult run(String id, boolean forced) {
        return run(id, forced, CancellationToken.none());
    }

    /**
     * Runs a job now.
     *
     * @param forced       when true the job's {@code nextRunAtMs} is left as it was
     * @param cancellation marks the run {@code cancelled} if triggered before the executor returns
     */
    public RunResult run(String id, boolean forced, CancellationToken cancellation) {
        return executeJob(id, forced, cancellation, false);
    }

    /**
     * Re-reads the store file, reconciles and re-arms. Picks up external edits.
     */
    public void reload() {
        lock.lock();
        try {
            store.reload();
            reconcile();
            armTimer();
            log.info("Reloaded {} cron jobs from {}", store.size(), store.getStorePath());
        } finally {
            lock.unlock();
        }
    }

    public CronStatus status() {
        lock.lock();
        try {
            return new CronStatus(enabled, started, store.getStorePath().toString(), store.size(), nextWakeAtMs);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Delay the timer was last armed with, or -1 when disarmed.
     */
    long armedDelayMs() {
        lock.lock();
        try {
            return armedDelayMs;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Timer callback: runs every due job unless a sweep is already in progress, then re-arms.
     */
    void onTimer() {
        if (!sweeping.compareAndSet(false, true)) {
            log.debug("Cron sweep already in progress, skipping tick");
            return;
        }
        try {
            runDueJobs();
        } catch (RuntimeException e) {
            log.error("Cron sweep failed", e);
        } finally {
            sweeping.set(false);
            lock.lock();
            try {
                armTimer();
            } finally {
                lock.unlock();
            }
        }
    }

    private void runDueJobs() {
        List<String> due = new ArrayList<>();
        lock.lock();
        try {
            long now = clock.millis();
            if (clearAbandonedRuns(now)) {
                store.persist();
            }
            for (ScheduledJob job : store.getEnabled()) {
                Long next = job.state().nextRunAtMs();
                if (job.state().runningAtMs() == null && next != null && now >= next) {
                    due.add(job.id());
                }
            }
        } finally {
            lock.unlock();
        }

        if (!due.isEmpty()) {
            log.debug("Cron sweep found {} due jobs", due.size());
        }
        for (String id : due) {
            executeJob(id, false, CancellationToken.none(), true);
        }
    }

    /**
     * @param scheduled true when called from the timer sweep; the job must still be due and the
     *                  sweep re-arms once at the end
     */
    private RunResult executeJob(String id, boolean forced, CancellationToken cancellation, boolean scheduled) {
        ScheduledJob job;
        long startMs;
        lock.lock();
        try {
            Optional<ScheduledJob> current = store.getById(id);
            if (current.isEmpty()) {
                return RunResult.notFound(id);
            }
            if (current.get().state().runningAtMs() != null) {
                log.debug("Cron job {} is already running, not starting it again", id);
                return RunResult.skipped("already running");
            }
            if (!forced && !current.get().enabled()) {
                return RunResult.skipped("disabled");
            }
            if (scheduled) {
                Long next = current.get().state().nextRunAtMs();
                if (next == null || next > clock.millis()) {
                    log.debug("Cron job {} is no longer due, not running it", id);
                    return RunResult.skipped("not due");
                }
            }
            if (cancellation.isCancellationRequested()) {
                return RunResult.cancelled(null);
            }
            startMs = clock.millis();
            job = store.update(id, j -> j.withState(j.state().withRunningAtMs(startMs))).orElseThrow();
            inFlight.add(id);
            store.persist();
        } finally {
            lock.unlock();
        }

        emit(CronEvent.started(id, startMs));

        RunResult result = RunResult.error("Run aborted");
        try {
            result = invokeExecutor(job);
            if (cancellation.isCancellationRequested()) {
                result = RunResult.cancelled(result.summary());
            }
        } finally {
            finishRun(job, startMs, result, forced, !scheduled);
        }
        return result;
    }

    private RunResult invokeExecutor(ScheduledJob job) {
        try {
            RunResult result = executor.execute(job);
            return result != null ? result : RunResult.ok(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Cron job '{}' ({}) was interrupted", job.name(), job.id());
            return RunResult.error("interrupted");
        } catch (Exception e) {
            log.warn("Cron job '{}' ({}) failed: {}", job.name(), job.id(), e.toString());
            return RunResult.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void finishRun(ScheduledJob job, long startMs, RunResult result, boolean forced, boolean rearm) {
        long endMs = clock.millis();
        long durationMs = Math.max(0, endMs - startMs);
        Long nextRunAtMs = null;

        lock.lock();
        try {
            inFlight.remove(job.id());
            Optional<ScheduledJob> current = store.getById(job.id());
            if (current.isPresent()) {
                ScheduledJob finished = current.get()
                        .withState(current.get().state().withCompletedRun(startMs, durationMs, result));
                boolean deleted = false;

                if (finished.schedule() instanceof Schedule.At) {
                    if (finished.deletesAfterRun()) {
                        store.remove(job.id());
                        deleted = true;
                    } else {
                        finished = finished.withEnabled(false).withState(finished.state().withNextRunAtMs(null));
                    }
                }

                if (!deleted) {
                    if (!forced && finished.enabled()) {
                        finished = finished.withState(finished.state().withNextRunAtMs(Schedules.nextRunOrNull(finished, endMs)));
                    }
                    ScheduledJob stored = finished;
                    store.update(job.id(), j -> stored);
                    nextRunAtMs = stored.state().nextRunAtMs();
                }
            }
            store.persist();
            if (rearm) {
                armTimer();
            }
        } finally {
            lock.unlock();
        }

        log.info("Cron job '{}' ({}) finished: {} in {} ms", job.name(), job.id(), result.status().key(), durationMs);
        emit(CronEvent.finished(job.id(), clock.millis(), startMs, durationMs, result, nextRunAtMs));
    }

    /**
     * Clears abandoned runs and recomputes every job's next run. Caller holds the lock.
     */
    private void reconcile() {
        long now = clock.millis();
        boolean changed = false;
        for (ScheduledJob job : store.getAll()) {
            JobRunState state = job.state();
            if (isAbandoned(job, now)) {
                log.warn("Clearing stuck run of cron job '{}' ({}) started at {}", job.name(), job.id(), state.runningAtMs());
                state = state.withRunningAtMs(null);
            }
            Long next = Schedules.nextRunOrNull(job, now);
            if (!Objects.equals(next, state.nextRunAtMs())) {
                state = state.withNextRunAtMs(next);
            }
            if (!state.equals(job.state())) {
                store.add(job.withState(state));
                changed = true;
            }
        }
        if (changed) {
            store.persist();
        }
    }

    /**
     * Clears run markers this process does not own once they pass the stuck threshold, and
     * schedules those jobs from now. Caller holds the lock.
     */
    private boolean clearAbandonedRuns(long now) {
        boolean changed = false;
        for (ScheduledJob job : store.getAll()) {
            if (isAbandoned(job, now)) {
                log.warn("Clearing stuck run of cron job '{}' ({}) started at {}", job.name(), job.id(), job.state().runningAtMs());
                JobRunState state = job.state().withRunningAtMs(null).withNextRunAtMs(Schedules.nextRunOrNull(job, now));
                store.add(job.withState(state));
                changed = true;
            }
        }
        return changed;
    }

    private boolean isAbandoned(ScheduledJob job, long now) {
        Long running = job.state().runningAtMs();
        return running != null && !inFlight.contains(job.id()) && now - running > CronTimes.STUCK_RUN_MS;
    }

    /**
     * Arms the timer for the nearest due job. A running job is left out, since finishing it
     * re-arms; a marker left by another process wakes the timer when it turns stuck. Caller holds
     * the lock.
     */
    private void armTimer() {
        cancelPendingTick();
        nextWakeAtMs = null;
        armedDelayMs = -1;
        if (!started || !enabled) {
            return;
        }

        Long nearest = null;
        for (ScheduledJob job : store.getEnabled()) {
            Long running = job.state().runningAtMs();
            Long wake;
            if (running == null) {
                wake = job.state().nextRunAtMs();
            } else if (inFlight.contains(job.id())) {
                continue;
            } else {
                wake = running + CronTimes.STUCK_RUN_MS + 1;
            }
            if (wake != null && (nearest == null || wake < nearest)) {
                nearest = wake;
            }
        }
        if (nearest == null) {
            log.debug("No scheduled cron jobs, timer disarmed");
            return;
        }

        long delay = Math.min(Math.max(nearest - clock.millis(), 0), MAX_TIMEOUT_MS);
        nextWakeAtMs = nearest;
        armedDelayMs = delay;
        pendingTick = timer.schedule(this::onTimer, delay, TimeUnit.MILLISECONDS);
        log.debug("Cron timer armed for {} ms", delay);
    }

    private void cancelPendingTick() {
        if (pendingTick != null) {
            pendingTick.cancel(false);
            pendingTick = null;
        }
    }

    private CronResult<Payload> mergePayload(ScheduledJob job, Payload patch) {
        Payload current = job.payload();
        if (patch == null) {
            return CronResult.ok(current);
        }
        if (patch.getClass() == current.getClass()) {
            return CronResult.ok(current.mergedWith(patch));
        }
        if (!patch.hasMessage()) {
            return CronResult.failure(CronError.Code.PAYLOAD_MISMATCH,
                    "Payload kind changes from " + current.kind() + " to " + patch.kind()
                            + " but the replacement has no message");
        }
        log.info("Replacing {} payload of cron job {} with {}", current.kind(), job.id(), patch.kind());
        return CronResult.ok(patch);
    }

    private void emit(CronEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Cron event listener failed on {} for job {}: {}", event.action().key(), event.jobId(), e.toString());
        }
    }
}
