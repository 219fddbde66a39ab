package com.fintrack.backend.dto;

import lombok.Data;

@Data
public class MessageResponse {
    private final String message;
    private final long timestamp = System.currentTimeMillis();
}
