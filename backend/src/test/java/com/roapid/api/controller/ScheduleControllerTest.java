package com.roapid.api.controller;

import com.roapid.MutableClock;
import com.roapid.domain.InvalidCategoryException;
import com.roapid.sync.loop.SyncOrchestrator;
import com.roapid.sync.schedule.ScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.time.Instant;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleControllerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    @Mock
    private SyncOrchestrator orchestrator;

    private ScheduleStore scheduleStore;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(T0);
        scheduleStore = new ScheduleStore(clock);
        webTestClient = WebTestClient
                .bindToController(new ScheduleController(scheduleStore, orchestrator, clock))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /schedule lists entries ordered by due time with a due flag")
    void listSchedule() {
        scheduleStore.upsert("Category:roapid-users-2", "users", T0.plusSeconds(60), type -> Duration.ofMinutes(5));
        scheduleStore.upsert("Category:roapid-badges-1", "badges", T0, type -> Duration.ofMinutes(10));

        webTestClient.get().uri("/api/v1/schedule")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].category").isEqualTo("Category:roapid-badges-1")
                .jsonPath("$[0].endpointType").isEqualTo("badges")
                .jsonPath("$[0].intervalSeconds").isEqualTo(600)
                .jsonPath("$[0].due").isEqualTo(true)
                .jsonPath("$[1].category").isEqualTo("Category:roapid-users-2")
                .jsonPath("$[1].due").isEqualTo(false);
    }

    @Test
    @DisplayName("POST /jobs/refresh returns 202 when dispatched")
    void refreshAccepted() {
        when(orchestrator.requestRefresh("Category:roapid-badges-1")).thenReturn(true);

        webTestClient.post().uri("/api/v1/jobs/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"category\":\"Category:roapid-badges-1\"}")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.category").isEqualTo("Category:roapid-badges-1");
    }

    @Test
    @DisplayName("POST /jobs/refresh with a bad label returns 400 INVALID_CATEGORY")
    void refreshInvalidCategory() {
        when(orchestrator.requestRefresh("Category:other-x"))
                .thenThrow(new InvalidCategoryException("Category:other-x"));

        webTestClient.post().uri("/api/v1/jobs/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"category\":\"Category:other-x\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_CATEGORY")
                .jsonPath("$.timestamp").exists();
    }

    @Test
    @DisplayName("POST /jobs/refresh with a blank category fails validation")
    void refreshBlankCategory() {
        webTestClient.post().uri("/api/v1/jobs/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"category\":\" \"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_CATEGORY");
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("POST /jobs/refresh during shutdown returns 503 SHUTTING_DOWN")
    void refreshDuringShutdown() {
        when(orchestrator.requestRefresh("Category:roapid-badges-1")).thenReturn(false);

        webTestClient.post().uri("/api/v1/jobs/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"category\":\"Category:roapid-badges-1\"}")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("SHUTTING_DOWN");
    }
}
