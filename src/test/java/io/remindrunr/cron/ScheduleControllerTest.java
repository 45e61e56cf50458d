package io.remindrunr.cron;

import io.remindrunr.dispatch.DispatchOutcome;
import io.remindrunr.schedule.InvalidScheduleException;
import io.remindrunr.schedule.NotificationPayload;
import io.remindrunr.schedule.ScheduleDefinition;
import io.remindrunr.security.InputSanitizer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ScheduleController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(InputSanitizer.class)
class ScheduleControllerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScheduleService scheduleService;

    @Test
    void shouldCreateReminder() throws Exception {
        when(scheduleService.createDefinition(any())).thenReturn(reminder("abc"));

        mockMvc.perform(post("/api/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "Stand-up", "notificationDateTime": "2025/1/6 09:00", "notificationMethod": "webhook"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("abc"))
                .andExpect(jsonPath("$.kind").value("one-shot"))
                .andExpect(jsonPath("$.trigger.type").value("at"))
                .andExpect(jsonPath("$.payload.type").value("notification"))
                .andExpect(jsonPath("$.status").value("pending"));

        verify(scheduleService).createDefinition(argThat(r ->
                "2025/1/6 09:00".equals(r.at()) && "webhook".equals(r.channel()) && "Stand-up".equals(r.title())));
    }

    @Test
    void shouldPassLocationThroughToWeatherDefinition() throws Exception {
        when(scheduleService.createDefinition(any())).thenReturn(reminder("w1"));

        mockMvc.perform(post("/api/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Tokyo", "latitude": 35.68, "longitude": 139.77}
                                """))
                .andExpect(status().isCreated());

        verify(scheduleService).createDefinition(argThat(r ->
                "Tokyo".equals(r.name()) && Double.valueOf(35.68).equals(r.latitude())
                        && Double.valueOf(139.77).equals(r.longitude())));
    }

    @Test
    void shouldListCategoriesAndTags() throws Exception {
        when(scheduleService.listCategories()).thenReturn(List.of("news", "work"));
        when(scheduleService.listTags()).thenReturn(List.of("daily"));

        mockMvc.perform(get("/api/schedules/meta/categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0]").value("news"))
                .andExpect(jsonPath("$[1]").value("work"));

        mockMvc.perform(get("/api/schedules/meta/tags"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("daily"));
    }

    @Test
    void shouldMapValidationErrorTo400() throws Exception {
        when(scheduleService.createDefinition(any()))
                .thenThrow(new InvalidScheduleException("Notification date time must be in the future"));

        mockMvc.perform(post("/api/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "Late", "at": "2020-01-01T00:00:00Z"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Notification date time must be in the future"));
    }

    @Test
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldSanitizeTitle() throws Exception {
        when(scheduleService.createDefinition(any())).thenReturn(reminder("abc"));

        mockMvc.perform(post("/api/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "Stand\\u0000-up\\nnow", "at": "2025-01-06T09:00:00Z"}
                                """))
                .andExpect(status().isCreated());

        verify(scheduleService).createDefinition(argThat(r -> "Stand-up now".equals(r.title())));
    }

    @Test
    void shouldReturn404ForUnknownDefinition() throws Exception {
        when(scheduleService.getDefinition("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/schedules/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldListWithFilter() throws Exception {
        when(scheduleService.listDefinitions(any())).thenReturn(List.of(reminder("a"), reminder("b")));

        mockMvc.perform(get("/api/schedules").param("channel", "webhook").param("upcoming", "24"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));

        verify(scheduleService).listDefinitions(new ScheduleFilter(null, null, "webhook", null, 24));
    }

    @Test
    void shouldUpdateDefinition() throws Exception {
        when(scheduleService.updateDefinition(eq("abc"), any())).thenReturn(Optional.of(reminder("abc")));

        mockMvc.perform(put("/api/schedules/abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"enabled": false}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("abc"));
    }

    @Test
    void shouldReturn404WhenUpdatingUnknownDefinition() throws Exception {
        when(scheduleService.updateDefinition(eq("missing"), any())).thenReturn(Optional.empty());

        mockMvc.perform(put("/api/schedules/missing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldDeleteDefinition() throws Exception {
        when(scheduleService.deleteDefinition("abc")).thenReturn(true);

        mockMvc.perform(delete("/api/schedules/abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("removed"));
    }

    @Test
    void shouldReturn404WhenDeletingUnknownDefinition() throws Exception {
        when(scheduleService.deleteDefinition("missing")).thenReturn(false);

        mockMvc.perform(delete("/api/schedules/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldReportRunFailure() throws Exception {
        when(scheduleService.runNow("abc")).thenReturn(Optional.of(DispatchOutcome.failure("WEBHOOK_URL not configured")));

        mockMvc.perform(post("/api/schedules/abc/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error").value("WEBHOOK_URL not configured"));
    }

    @Test
    void shouldListActiveJobs() throws Exception {
        CancellableTimer timer = mock(CancellableTimer.class);
        when(timer.key()).thenReturn("k1");
        when(timer.nextFireTime()).thenReturn(Optional.of(Instant.parse("2025-01-06T09:00:00Z")));
        when(scheduleService.activeJobs()).thenReturn(List.of(new ActiveJob("abc", List.of(timer))));

        mockMvc.perform(get("/api/schedules/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.jobs[0].definitionId").value("abc"))
                .andExpect(jsonPath("$.jobs[0].timers[0].key").value("k1"));
    }

    private static ScheduleDefinition reminder(String id) {
        return ScheduleDefinition.oneShot(id, Instant.parse("2025-01-06T09:00:00Z"),
                new NotificationPayload("Stand-up", null, null, "webhook", null, null), null, "UTC", NOW);
    }
}
