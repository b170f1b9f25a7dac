package com.kmg.extract.model;

import java.nio.file.Path;
import java.util.List;

public record BatchRun(
        int startIndex,
        Integer limit,
        Path outputLocation,
        RunSummary summary,
        List<WorkItem> items
) {
}
