package com.roapid.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/jobs/refresh request body.
 */
public record RefreshJobRequest(@NotBlank(message = "INVALID_CATEGORY") String category) {
}
