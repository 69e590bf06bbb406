package com.roapid.api.controller;

import com.roapid.api.dto.ErrorBody;
import com.roapid.api.dto.RefreshJobRequest;
import com.roapid.api.dto.RefreshJobResponse;
import com.roapid.api.dto.ScheduleEntryResponse;
import com.roapid.sync.loop.SyncOrchestrator;
import com.roapid.sync.schedule.ScheduleStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * GET /api/v1/schedule, POST /api/v1/jobs/refresh.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleStore scheduleStore;
    private final SyncOrchestrator orchestrator;
    private final Clock clock;

    @GetMapping("/schedule")
    public List<ScheduleEntryResponse> schedule() {
        Instant now = clock.instant();
        return scheduleStore.snapshotAll().entrySet().stream()
                .map(e -> ScheduleEntryResponse.from(e.getKey(), e.getValue(), now))
                .sorted(Comparator.comparing(ScheduleEntryResponse::nextEligibleRun)
                        .thenComparing(ScheduleEntryResponse::category))
                .toList();
    }

    /**
     * 202 when dispatched, 400 INVALID_CATEGORY for a label that names no job, 503 SHUTTING_DOWN during shutdown.
     */
    @PostMapping("/jobs/refresh")
    public ResponseEntity<?> refresh(@Valid @RequestBody RefreshJobRequest request) {
        if (!orchestrator.requestRefresh(request.category())) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ErrorBody.of("SHUTTING_DOWN", "Sync is shutting down; refresh not dispatched"));
        }
        return ResponseEntity.accepted().body(new RefreshJobResponse(request.category(), "Refresh dispatched"));
    }
}
