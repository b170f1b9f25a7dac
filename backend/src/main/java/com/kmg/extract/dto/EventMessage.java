package com.kmg.extract.dto;

public record EventMessage(
        String type,
        String runId,
        String message,
        String timestamp,
        Object payload
) {
}
