package io.cronkeeper.cron;

import io.cronkeeper.security.InputSanitizer;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CronController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(InputSanitizer.class)
class CronControllerTest {

    private static final long NOW = 1_704_103_200_000L;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CronService cronService;

    private static ScheduledJob job(String id, String name, Schedule schedule) {
        return new ScheduledJob(id, name, null, true, schedule, new Payload.SystemEvent("report"), null,
                NOW, NOW, JobRunState.empty().withNextRunAtMs(NOW + 60_000));
    }

    @Test
    void shouldCreateCronJob() throws Exception {
        when(cronService.add(any())).thenReturn(CronResult.ok(job("abc", "Daily", new Schedule.Cron("0 9 * * *", null))));

        mockMvc.perform(post("/api/cron")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Daily",
                                 "schedule": {"kind": "cron", "expression": "0 9 * * *"},
                                 "payload": {"kind": "systemEvent", "message": "report\\u0000"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("abc"))
                .andExpect(jsonPath("$.schedule.kind").value("cron"))
                .andExpect(jsonPath("$.state.nextRunAtMs").value(NOW + 60_000));

        ArgumentCaptor<JobCreate> captor = ArgumentCaptor.forClass(JobCreate.class);
        verify(cronService).add(captor.capture());
        assertEquals("Daily", captor.getValue().name());
        assertEquals(new Schedule.Cron("0 9 * * *", null), captor.getValue().schedule());
        assertEquals(new Payload.SystemEvent("report"), captor.getValue().payload());
    }

    @Test
    void shouldCreateIntervalJobWithAgentTurn() throws Exception {
        when(cronService.add(any())).thenReturn(CronResult.ok(job("def", "Poller", Schedule.every(300_000))));

        mockMvc.perform(post("/api/cron")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Poller",
                                 "schedule": {"kind": "every", "intervalMs": 300000},
                                 "payload": {"kind": "agentTurn", "message": "check", "timeoutSeconds": 30}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("def"));

        ArgumentCaptor<JobCreate> captor = ArgumentCaptor.forClass(JobCreate.class);
        verify(cronService).add(captor.capture());
        assertEquals(new Payload.AgentTurn("check", null, 30, null, null, null), captor.getValue().payload());
    }

    @Test
    void shouldMapInvalidInputToBadRequest() throws Exception {
        when(cronService.add(any())).thenReturn(CronResult.failure(CronError.Code.INVALID_SCHEDULE, "Expected 5 or 6 fields, got 3"));

        mockMvc.perform(post("/api/cron")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Bad", "schedule": {"kind": "cron", "expression": "* * *"},
                                 "payload": {"kind": "systemEvent", "message": "x"}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_SCHEDULE"))
                .andExpect(jsonPath("$.message").value("Expected 5 or 6 fields, got 3"));
    }

    @Test
    void shouldListJobs() throws Exception {
        when(cronService.list(true)).thenReturn(List.of(
                job("a", "A", Schedule.every(60_000)),
                job("b", "B", new Schedule.At(NOW + 1_000))
        ));

        mockMvc.perform(get("/api/cron").param("includeDisabled", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].schedule.kind").value("at"));
    }

    @Test
    void shouldGetJobOr404() throws Exception {
        when(cronService.get("abc")).thenReturn(Optional.of(job("abc", "Daily", Schedule.every(60_000))));
        when(cronService.get("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/cron/abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Daily"));
        mockMvc.perform(get("/api/cron/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldPatchJob() throws Exception {
        when(cronService.update(eq("abc"), any())).thenReturn(CronResult.ok(job("abc", "Renamed", Schedule.every(60_000))));

        mockMvc.perform(patch("/api/cron/abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Renamed", "enabled": false}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Renamed"));

        ArgumentCaptor<JobPatch> captor = ArgumentCaptor.forClass(JobPatch.class);
        verify(cronService).update(eq("abc"), captor.capture());
        assertEquals(new JobPatch("Renamed", null, false, null, null, null), captor.getValue());
    }

    @Test
    void shouldRejectEmptyPatch() throws Exception {
        mockMvc.perform(patch("/api/cron/abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
        verifyNoInteractions(cronService);
    }

    @Test
    void shouldReturn404WhenPatchingMissingJob() throws Exception {
        when(cronService.update(eq("nope"), any())).thenReturn(CronResult.failure(CronError.notFound("nope")));

        mockMvc.perform(patch("/api/cron/nope")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled\": true}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldDeleteJob() throws Exception {
        when(cronService.remove("abc")).thenReturn(true);

        mockMvc.perform(delete("/api/cron/abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("removed"));
    }

    @Test
    void shouldReturn404ForNonexistentDelete() throws Exception {
        when(cronService.remove("nope")).thenReturn(false);

        mockMvc.perform(delete("/api/cron/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRunJob() throws Exception {
        when(cronService.run("abc", true)).thenReturn(RunResult.ok("sent"));

        mockMvc.perform(post("/api/cron/abc/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.summary").value("sent"));
    }

    @Test
    void shouldReturn404WhenRunningNonexistentJob() throws Exception {
        when(cronService.run("nope", false)).thenReturn(RunResult.notFound("nope"));

        mockMvc.perform(post("/api/cron/nope/run").param("forced", "false"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("not_found"));
    }

    @Test
    void shouldReloadAndReportStatus() throws Exception {
        when(cronService.status()).thenReturn(new CronStatus(true, true, "/tmp/jobs.json", 2, NOW + 60_000));

        mockMvc.perform(post("/api/cron/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobs").value(2));
        verify(cronService).reload();

        mockMvc.perform(get("/api/cron/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.started").value(true))
                .andExpect(jsonPath("$.nextWakeAtMs").value(NOW + 60_000));
    }
}
