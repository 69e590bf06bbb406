package com.roapid.api.dto;

public record RefreshJobResponse(String category, String message) {
}
