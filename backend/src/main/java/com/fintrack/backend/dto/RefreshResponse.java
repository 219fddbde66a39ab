package com.fintrack.backend.dto;

public record RefreshResponse(String access, String refreshToken) {
}
