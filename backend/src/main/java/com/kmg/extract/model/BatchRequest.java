package com.kmg.extract.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A contiguous slice of the backlog to process. A null {@code limit} means all remaining items.
 */
public record BatchRequest(
        List<BacklogEntry> backlog,
        int startIndex,
        Integer limit,
        Path outputLocation,
        InsurerProfile profile,
        int workers
) {
    public int sliceEnd() {
        int size = backlog.size();
        int start = Math.min(Math.max(0, startIndex), size);
        if (limit == null) {
            return size;
        }
        return (int) Math.min((long) start + Math.max(0, limit), size);
    }
}
