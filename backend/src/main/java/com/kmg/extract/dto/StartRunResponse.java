package com.kmg.extract.dto;

public record StartRunResponse(String runId) {
}
