package com.kmg.extract.service;

import com.kmg.extract.config.ExtractorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Collects the ordered list of API keys once at startup: configured keys, then keys files, then the
 * environment variable. Duplicates keep their first position.
 */
@Service
public class CredentialSourceService {
    private static final Logger log = LoggerFactory.getLogger(CredentialSourceService.class);

    private final ExtractorProperties properties;
    private final ApplicationArguments applicationArguments;
    private final Environment environment;

    public CredentialSourceService(
            ExtractorProperties properties,
            ApplicationArguments applicationArguments,
            Environment environment
    ) {
        this.properties = properties;
        this.applicationArguments = applicationArguments;
        this.environment = environment;
    }

    public List<String> loadSecrets() {
        Set<String> secrets = new LinkedHashSet<>();
        properties.getCredentials().getKeys().stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(key -> !key.isEmpty())
                .forEach(secrets::add);

        for (Path file : resolveKeysFiles()) {
            secrets.addAll(readKeysFile(file));
        }

        String envVar = properties.getCredentials().getEnvVar();
        if (envVar != null && !envVar.isBlank()) {
            String value = environment.getProperty(envVar);
            if (value != null) {
                secrets.addAll(splitKeys(value));
            }
        }

        if (secrets.isEmpty()) {
            log.warn("No API keys configured; every dispatch will pause until keys are added and the service restarted");
        } else {
            log.info("Loaded {} API key(s)", secrets.size());
        }
        return new ArrayList<>(secrets);
    }

    private Set<Path> resolveKeysFiles() {
        Set<Path> files = new LinkedHashSet<>();
        String configured = properties.getCredentials().getKeysFile();
        if (configured != null && !configured.isBlank()) {
            files.add(Path.of(configured));
        }

        List<String> cliFiles = applicationArguments.getOptionValues("keys-file");
        if (cliFiles != null) {
            cliFiles.stream()
                    .filter(Objects::nonNull)
                    .flatMap(v -> Arrays.stream(v.split(",")))
                    .map(String::trim)
                    .filter(v -> !v.isBlank())
                    .map(Path::of)
                    .forEach(files::add);
        }
        return files;
    }

    private List<String> readKeysFile(Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("Keys file not present: {}", file);
            return List.of();
        }
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                    .map(String::strip)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read keys file: " + file, e);
        }
    }

    static List<String> splitKeys(String value) {
        return Arrays.stream(value.split("[,\\s]+"))
                .map(String::strip)
                .filter(key -> !key.isEmpty())
                .toList();
    }
}
