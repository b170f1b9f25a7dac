package com.kmg.extract.dto;

public record QuotaResetResponse(int restored) {
}
