package com.kmg.extract.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.extract.model.ItemResult;
import com.kmg.extract.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores each item as {@code items/<itemKey>.json} and the run summary as {@code summary.json}.
 * Files are written to a temp file first and moved into place.
 */
@Repository
public class FileResultStore implements ResultStore {
    private static final Logger log = LoggerFactory.getLogger(FileResultStore.class);
    static final String ITEMS_DIR = "items";
    static final String SUMMARY_FILE = "summary.json";

    private final ObjectMapper objectMapper;

    public FileResultStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void writeItemResult(Path outputLocation, ItemResult result) {
        writeAtomically(itemPath(outputLocation, result.itemKey()), result);
    }

    @Override
    public Optional<ItemResult> readItemResult(Path outputLocation, String itemKey) {
        Path path = itemPath(outputLocation, itemKey);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), ItemResult.class));
        } catch (IOException e) {
            log.warn("Unreadable item result ignored: {} ({})", path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void writeSummary(Path outputLocation, RunSummary summary) {
        writeAtomically(outputLocation.resolve(SUMMARY_FILE), summary);
    }

    private Path itemPath(Path outputLocation, String itemKey) {
        return outputLocation.resolve(ITEMS_DIR).resolve(itemKey + ".json");
    }

    private void writeAtomically(Path target, Object value) {
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write " + target, e);
        }
    }
}
