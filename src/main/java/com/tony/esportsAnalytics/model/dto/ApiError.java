package com.tony.esportsAnalytics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class ApiError {
    private String code;
    private String message;
    private String path;
    private Instant timestamp;

    public ApiError(String code, String message, String path) {
        this(code, message, path, Instant.now());
    }
}
