package io.cronkeeper.cron;

import io.cronkeeper.core.ToolRegistry;
import io.cronkeeper.core.ToolResult;
import io.cronkeeper.security.InputSanitizer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Registers the scheduler tools with the ToolRegistry so the model can manage jobs
 * through natural language.
 */
@Component
public class CronTools {

    private static final Logger log = LoggerFactory.getLogger(CronTools.class);

    private static final Map<String, Long> UNITS = Map.of(
            "seconds", CronTimes.SECOND,
            "minutes", CronTimes.MINUTE,
            "hours", CronTimes.HOUR,
            "days", CronTimes.DAY);

    private final ToolRegistry toolRegistry;
    private final CronService cronService;
    private final InputSanitizer inputSanitizer;

    public CronTools(ToolRegistry toolRegistry, CronService cronService, InputSanitizer inputSanitizer) {
        this.toolRegistry = toolRegistry;
        this.cronService = cronService;
        this.inputSanitizer = inputSanitizer;
    }

    @PostConstruct
    public void registerTools() {
        toolRegistry.register("cron_list",
                "List scheduled jobs with their schedule, next run, last run and run count.",
                """
                {"type":"object","properties":{"includeDisabled":{"type":"boolean","description":"Include disabled jobs (default false)"}}}""",
                this::listJobs);
        toolRegistry.register("cron_add",
                "Add a scheduled job. scheduleType 'at' runs once at 'atTime'; 'every' repeats every 'everyMs' milliseconds (or 'everyValue' 'everyUnit'); 'cron' follows a 5 or 6 field cron expression 'cronExpr' in optional timezone 'cronTz'. 'message' is delivered when the job fires.",
                """
                {"type":"object","properties":{"name":{"type":"string","description":"Job name"},"scheduleType":{"type":"string","enum":["at","every","cron"]},"atTime":{"type":"string","description":"ISO-8601 time for a one-shot job, e.g. 2024-01-01T10:00:00"},"everyMs":{"type":"integer","description":"Interval in milliseconds"},"everyValue":{"type":"integer","description":"Interval value, used with everyUnit"},"everyUnit":{"type":"string","enum":["seconds","minutes","hours","days"]},"cronExpr":{"type":"string","description":"Cron expression, e.g. '0 9 * * *' for 09:00 daily"},"cronTz":{"type":"string","description":"IANA timezone, e.g. Europe/Berlin"},"message":{"type":"string","description":"Message sent when the job fires"}},"required":["name","scheduleType","message"]}""",
                this::addJob);
        toolRegistry.register("cron_remove",
                "Remove a scheduled job by its ID.",
                """
                {"type":"object","properties":{"jobId":{"type":"string","description":"The job ID"}},"required":["jobId"]}""",
                this::removeJob);
        toolRegistry.register("cron_run",
                "Run a scheduled job now without changing its schedule.",
                """
                {"type":"object","properties":{"jobId":{"type":"string","description":"The job ID"}},"required":["jobId"]}""",
                this::runJob);
        toolRegistry.register("cron_update",
                "Rename a scheduled job or enable/disable it.",
                """
                {"type":"object","properties":{"jobId":{"type":"string","description":"The job ID"},"name":{"type":"string","description":"New name"},"enabled":{"type":"boolean","description":"Enable or disable the job"}},"required":["jobId"]}""",
                this::updateJob);
        log.info("Registered 5 cron tools");
    }

    ToolResult listJobs(Map<String, Object> args) {
        boolean includeDisabled = Boolean.TRUE.equals(firstBoolean(args, "includeDisabled"));
        List<ScheduledJob> jobs = cronService.list(includeDisabled);
        if (jobs.isEmpty()) {
            return ToolResult.of("No scheduled jobs.");
        }

        String listing = jobs.stream()
                .map(job -> "- %s %s (id: %s)\n  schedule: %s\n  next run: %s\n  last run: %s\n  runs: %d".formatted(
                        job.enabled() ? "[enabled]" : "[disabled]",
                        job.name(),
                        job.id(),
                        Schedules.format(job.schedule()),
                        formatTime(job.state().nextRunAtMs(), "none"),
                        formatTime(job.state().lastRunAtMs(), "never"),
                        job.state().runCount()))
                .collect(Collectors.joining("\n"));

        return ToolResult.of("Scheduled jobs (%d):\n%s".formatted(jobs.size(), listing));
    }

    ToolResult addJob(Map<String, Object> args) {
        String name = inputSanitizer.sanitizeName(firstString(args, "name"));
        String message = inputSanitizer.sanitize(firstString(args, "message"));
        String scheduleType = firstString(args, "scheduleType");
        if (name.isBlank()) {
            return ToolResult.error("'name' is required.");
        }
        if (message.isBlank()) {
            return ToolResult.error("'message' is required.");
        }
        if (scheduleType == null) {
            return ToolResult.error("'scheduleType' must be one of at, every, cron.");
        }

        Schedule schedule;
        switch (scheduleType) {
            case "at" -> {
                String atTime = firstString(args, "atTime");
                if (atTime == null) {
                    return ToolResult.error("an 'at' job needs 'atTime'.");
                }
                Long atMs = parseTime(atTime);
                if (atMs == null) {
                    return ToolResult.error("'atTime' is not a valid ISO-8601 time: " + atTime);
                }
                schedule = new Schedule.At(atMs);
            }
            case "every" -> {
                Long intervalMs = firstLong(args, "everyMs");
                Long value = firstLong(args, "everyValue");
                String unit = firstString(args, "everyUnit");
                if ((intervalMs == null || intervalMs == 0) && value != null && unit != null && UNITS.containsKey(unit)) {
                    try {
                        intervalMs = Math.multiplyExact(value, UNITS.get(unit));
                    } catch (ArithmeticException e) {
                        return ToolResult.error("'everyValue' is too large.");
                    }
                }
                if (intervalMs == null || intervalMs <= 0) {
                    return ToolResult.error("an 'every' job needs a positive interval.");
                }
                schedule = new Schedule.Every(intervalMs, null);
            }
            case "cron" -> {
                String cronExpr = firstString(args, "cronExpr");
                if (cronExpr == null) {
                    return ToolResult.error("a 'cron' job needs 'cronExpr'.");
                }
                schedule = new Schedule.Cron(cronExpr, firstString(args, "cronTz"));
            }
            default -> {
                return ToolResult.error("'scheduleType' must be one of at, every, cron.");
            }
        }

        CronResult<ScheduledJob> result = cronService.add(JobCreate.of(name, schedule, new Payload.SystemEvent(message)));
        if (!result.succeeded()) {
            return ToolResult.error(result.error().message());
        }
        ScheduledJob job = result.value();
        return ToolResult.of("Scheduled job created:\n- id: %s\n- name: %s\n- schedule: %s\n- next run: %s".formatted(
                job.id(), job.name(), Schedules.format(job.schedule()),
                formatTime(job.state().nextRunAtMs(), "not scheduled")));
    }

    ToolResult removeJob(Map<String, Object> args) {
        String jobId = firstString(args, "jobId", "id");
        if (jobId == null) {
            return ToolResult.error("'jobId' is required.");
        }
        var job = cronService.get(jobId);
        if (job.isEmpty() || !cronService.remove(jobId)) {
            return ToolResult.error("No job with id " + jobId);
        }
        return ToolResult.of("Removed scheduled job: %s (id: %s)".formatted(job.get().name(), jobId));
    }

    ToolResult runJob(Map<String, Object> args) {
        String jobId = firstString(args, "jobId", "id");
        if (jobId == null) {
            return ToolResult.error("'jobId' is required.");
        }
        RunResult result = cronService.run(jobId);
        return switch (result.status()) {
            case OK -> ToolResult.of(result.summary() != null ? "Job ran: " + result.summary() : "Job ran.");
            case NOT_FOUND -> ToolResult.error("No job with id " + jobId);
            case ERROR -> ToolResult.error("Job failed: " + result.error());
            case SKIPPED -> ToolResult.of("Job skipped: " + result.error());
            case CANCELLED -> ToolResult.of("Job cancelled.");
        };
    }

    ToolResult updateJob(Map<String, Object> args) {
        String jobId = firstString(args, "jobId", "id");
        if (jobId == null) {
            return ToolResult.error("'jobId' is required.");
        }
        String name = firstString(args, "name");
        Boolean enabled = firstBoolean(args, "enabled");
        if (name == null && enabled == null) {
            return ToolResult.error("nothing to update, provide 'name' or 'enabled'.");
        }

        JobPatch patch = new JobPatch(name != null ? inputSanitizer.sanitizeName(name) : null,
                null, enabled, null, null, null);
        CronResult<ScheduledJob> result = cronService.update(jobId, patch);
        if (!result.succeeded()) {
            return ToolResult.error(result.error().message());
        }
        ScheduledJob job = result.value();
        return ToolResult.of("Scheduled job updated:\n- id: %s\n- name: %s\n- status: %s".formatted(
                job.id(), job.name(), job.enabled() ? "enabled" : "disabled"));
    }

    /**
     * Parses an instant with offset, or a local date-time in the system zone.
     */
    private static Long parseTime(String text) {
        try {
            return Instant.parse(text).toEpochMilli();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static String formatTime(Long epochMs, String fallback) {
        return epochMs != null ? Instant.ofEpochMilli(epochMs).toString() : fallback;
    }

    private static String firstString(Map<String, Object> args, String... keys) {
        for (String key : keys) {
            Object val = args.get(key);
            if (val != null && !val.toString().isBlank()) return val.toString();
        }
        return null;
    }

    private static Long firstLong(Map<String, Object> args, String... keys) {
        for (String key : keys) {
            Object val = args.get(key);
            if (val == null) continue;
            if (val instanceof Number n) return n.longValue();
            try {
                return Long.parseLong(val.toString().trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric tool argument {}={}", key, val);
            }
        }
        return null;
    }

    private static Boolean firstBoolean(Map<String, Object> args, String... keys) {
        for (String key : keys) {
            Object val = args.get(key);
            if (val instanceof Boolean b) return b;
            if (val != null) return Boolean.parseBoolean(val.toString());
        }
        return null;
    }
}
