package com.kmg.extract.service;

import com.kmg.extract.model.BacklogEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BacklogServiceTest {
    private final BacklogService service = new BacklogService();

    @TempDir
    Path dir;

    @Test
    void listsPdfsInNaturalOrderWithStableKeys() throws Exception {
        Files.writeString(dir.resolve("policy 10.pdf"), "x");
        Files.writeString(dir.resolve("policy 2.PDF"), "x");
        Files.writeString(dir.resolve("policy 1.pdf"), "x");
        Files.writeString(dir.resolve("notes.txt"), "x");

        List<BacklogEntry> entries = service.listBacklog(dir.toString());

        assertThat(entries).extracting(e -> Path.of(e.sourceRef()).getFileName().toString())
                .containsExactly("policy 1.pdf", "policy 2.PDF", "policy 10.pdf");
        assertThat(entries).extracting(BacklogEntry::index).containsExactly(0, 1, 2);
        assertThat(entries.get(0).itemKey()).matches("policy_1-[0-9a-f]{10}");

        assertThat(service.listBacklog(dir.toString())).isEqualTo(entries);
    }

    @Test
    void sameFileNameInDifferentFoldersGetsDistinctKeys() throws Exception {
        Files.createDirectories(dir.resolve("a"));
        Files.createDirectories(dir.resolve("b"));
        Files.writeString(dir.resolve("a/policy.pdf"), "x");
        Files.writeString(dir.resolve("b/policy.pdf"), "x");

        List<BacklogEntry> entries = service.listBacklog(dir.toString());

        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).itemKey()).isNotEqualTo(entries.get(1).itemKey());
    }

    @Test
    void missingFolderIsRejected() {
        assertThatThrownBy(() -> service.listBacklog(dir.resolve("nope").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void filePathResolvesToItsFolder() throws Exception {
        Path file = Files.writeString(dir.resolve("one.pdf"), "x");

        assertThat(service.normalizeFolderPath(file.toString())).isEqualTo(dir.toAbsolutePath().normalize());
    }
}
