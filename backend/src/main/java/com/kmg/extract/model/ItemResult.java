package com.kmg.extract.model;

import java.util.Map;

public record ItemResult(
        String itemKey,
        int index,
        String sourceRef,
        WorkItemStatus status,
        int attempts,
        Map<String, String> payload,
        ClassifiedError error,
        String credentialId,
        String completedAt
) {
}
