package com.kmg.extract.repo;

import com.kmg.extract.model.ItemResult;
import com.kmg.extract.model.RunSummary;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Per-item results and run summaries under an output location. Items are keyed by their stable item key,
 * so concurrent workers never write the same entry.
 */
public interface ResultStore {

    void writeItemResult(Path outputLocation, ItemResult result);

    Optional<ItemResult> readItemResult(Path outputLocation, String itemKey);

    void writeSummary(Path outputLocation, RunSummary summary);
}
