package com.kmg.extract.dto;

import com.kmg.extract.model.UsageStats;

public record CredentialPoolView(
        UsageStats usage,
        int usableCredentials,
        String quotaTimezone,
        String nextQuotaResetAt
) {
}
