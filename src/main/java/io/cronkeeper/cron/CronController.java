package io.cronkeeper.cron;

import io.cronkeeper.security.InputSanitizer;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for managing scheduled jobs.
 */
@RestController
@RequestMapping("/api/cron")
public class CronController {

    private final CronService cronService;
    private final InputSanitizer inputSanitizer;

    public CronController(CronService cronService, InputSanitizer inputSanitizer) {
        this.cronService = cronService;
        this.inputSanitizer = inputSanitizer;
    }

    /**
     * Lists jobs ordered by next run.
     */
    @GetMapping
    public ResponseEntity<List<ScheduledJob>> listJobs(
            @RequestParam(defaultValue = "false") boolean includeDisabled) {
        return ResponseEntity.ok(cronService.list(includeDisabled));
    }

    @GetMapping("/status")
    public ResponseEntity<CronStatus> status() {
        return ResponseEntity.ok(cronService.status());
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<ScheduledJob> getJob(@PathVariable String jobId) {
        return cronService.get(jobId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Creates a job. The body carries a {@code schedule} and a {@code payload}, each tagged by {@code kind}.
     */
    @PostMapping
    public ResponseEntity<?> addJob(@RequestBody JobCreate request) {
        JobCreate sanitized = new JobCreate(
                inputSanitizer.sanitizeName(request.name()),
                inputSanitizer.sanitizeOptional(request.description()),
                request.enabled(),
                request.schedule(),
                sanitize(request.payload()),
                request.deleteAfterRun());
        return toResponse(cronService.add(sanitized));
    }

    /**
     * Applies a partial update; absent fields are left unchanged.
     */
    @PatchMapping("/{jobId}")
    public ResponseEntity<?> updateJob(@PathVariable String jobId, @RequestBody JobPatch request) {
        if (request.isEmpty()) {
            return ResponseEntity.badRequest().body(new CronError(CronError.Code.INVALID_INPUT, "Nothing to update"));
        }
        JobPatch sanitized = new JobPatch(
                request.name() != null ? inputSanitizer.sanitizeName(request.name()) : null,
                inputSanitizer.sanitizeOptional(request.description()),
                request.enabled(),
                request.schedule(),
                sanitize(request.payload()),
                request.deleteAfterRun());
        return toResponse(cronService.update(jobId, sanitized));
    }

    @DeleteMapping("/{jobId}")
    public ResponseEntity<Map<String, String>> removeJob(@PathVariable String jobId) {
        boolean removed = cronService.remove(jobId);
        if (!removed) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "removed", "id", jobId));
    }

    /**
     * Runs a job now. A forced run (the default) does not move the job's next scheduled run.
     */
    @PostMapping("/{jobId}/run")
    public ResponseEntity<RunResult> runJob(@PathVariable String jobId,
                                            @RequestParam(defaultValue = "true") boolean forced) {
        RunResult result = cronService.run(jobId, forced);
        if (result.status() == RunStatus.NOT_FOUND) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
        }
        return ResponseEntity.ok(result);
    }

    /**
     * Re-reads the store file and re-arms the timer.
     */
    @PostMapping("/reload")
    public ResponseEntity<CronStatus> reload() {
        cronService.reload();
        return ResponseEntity.ok(cronService.status());
    }

    private Payload sanitize(Payload payload) {
        if (payload == null || payload.message() == null) {
            return payload;
        }
        return payload.withMessage(inputSanitizer.sanitize(payload.message()));
    }

    private static ResponseEntity<?> toResponse(CronResult<ScheduledJob> result) {
        if (result.succeeded()) {
            return ResponseEntity.ok(result.value());
        }
        HttpStatus status = result.error().code() == CronError.Code.NOT_FOUND
                ? HttpStatus.NOT_FOUND
                : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(result.error());
    }
}
