package com.kmg.extract.config;

import com.kmg.extract.repo.RunRepository;
import com.kmg.extract.service.CredentialPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final ExtractorProperties properties;
    private final JdbcTemplate jdbcTemplate;
    private final RunRepository runRepository;
    private final CredentialPool credentialPool;

    public StartupInitializer(
            ExtractorProperties properties,
            JdbcTemplate jdbcTemplate,
            RunRepository runRepository,
            CredentialPool credentialPool
    ) {
        this.properties = properties;
        this.jdbcTemplate = jdbcTemplate;
        this.runRepository = runRepository;
        this.credentialPool = credentialPool;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        configureSqlitePragmas();
        runRepository.ensureSchema();

        int recovered = runRepository.recoverRunningRunsAfterRestart();
        if (recovered > 0) {
            log.warn("Marked {} interrupted run(s) as failed; resume them from their next index", recovered);
        }
        log.info("Credential pool ready with {} key(s), model {}",
                credentialPool.size(), properties.getInference().getModel());
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(properties.baseDirPath());
        Files.createDirectories(Path.of(properties.getOutput().getDir()));
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
        Path dbPath = Path.of(properties.getState().getDbPath());
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
    }

    private void configureSqlitePragmas() {
        try {
            jdbcTemplate.queryForObject("PRAGMA journal_mode=WAL", String.class);
            jdbcTemplate.execute("PRAGMA synchronous=NORMAL");
            jdbcTemplate.execute("PRAGMA busy_timeout=30000");
        } catch (Exception e) {
            log.warn("Failed to configure SQLite pragmas: {}", e.getMessage());
        }
    }
}
