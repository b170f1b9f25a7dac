package com.kmg.extract.service;

import com.kmg.extract.model.BacklogEntry;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Enumerates the PDF documents of a backlog folder in natural file-name order.
 */
@Service
public class BacklogService {
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern UNSAFE_KEY_CHARS = Pattern.compile("[^A-Za-z0-9._-]+");

    public List<BacklogEntry> listBacklog(String dirStr) {
        Path dir = normalizeFolderPath(dirStr);
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Backlog folder not found: " + dir);
        }

        List<Path> documents;
        try (Stream<Path> stream = Files.walk(dir)) {
            documents = stream.filter(Files::isRegularFile)
                    .filter(this::isPdf)
                    .sorted(Comparator.comparing((Path p) -> naturalKey(dir.relativize(p)))
                            .thenComparing(Path::toString))
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to list backlog: " + e.getMessage(), e);
        }

        List<BacklogEntry> entries = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            Path document = documents.get(i);
            entries.add(new BacklogEntry(i, itemKey(dir, document), document.toString()));
        }
        return entries;
    }

    public Path normalizeFolderPath(String pathStr) {
        Path path = Path.of(pathStr).toAbsolutePath().normalize();
        if (Files.isRegularFile(path)) {
            Path parent = path.getParent();
            if (parent != null && Files.isDirectory(parent)) {
                return parent;
            }
        }
        return path;
    }

    static String itemKey(Path backlogDir, Path document) {
        String relative = backlogDir.relativize(document).toString().replace('\\', '/');
        String name = document.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String safe = UNSAFE_KEY_CHARS.matcher(base).replaceAll("_");
        if (safe.length() > 60) {
            safe = safe.substring(0, 60);
        }
        return safe + "-" + Hashing.sha256Hex(relative).substring(0, 10);
    }

    private boolean isPdf(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String naturalKey(Path path) {
        String name = path.toString().toLowerCase(Locale.ROOT);
        Matcher matcher = DIGITS.matcher(name);
        StringBuilder key = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            key.append(name, last, matcher.start());
            String digits = matcher.group();
            if (digits.length() <= 12) {
                key.append(String.format("%012d", Long.parseLong(digits)));
            } else {
                key.append(digits);
            }
            last = matcher.end();
        }
        key.append(name.substring(last));
        return key.toString();
    }
}
