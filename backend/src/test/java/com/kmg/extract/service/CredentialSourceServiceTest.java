package com.kmg.extract.service;

import com.kmg.extract.config.ExtractorProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialSourceServiceTest {

    @TempDir
    Path dir;

    @Test
    void mergesAllSourcesInOrderWithoutDuplicates() throws Exception {
        Path keysFile = Files.writeString(dir.resolve("keys.txt"), """
                # team keys
                key-b

                key-c
                """);
        Path cliFile = Files.writeString(dir.resolve("more.txt"), "key-d\nkey-a\n");

        ExtractorProperties properties = new ExtractorProperties();
        properties.getCredentials().setKeys(List.of("key-a", " key-b "));
        properties.getCredentials().setKeysFile(keysFile.toString());
        MockEnvironment environment = new MockEnvironment().withProperty("GEMINI_API_KEY", "key-e, key-c");

        CredentialSourceService service = new CredentialSourceService(
                properties,
                new DefaultApplicationArguments("--keys-file=" + cliFile),
                environment
        );

        assertThat(service.loadSecrets()).containsExactly("key-a", "key-b", "key-c", "key-d", "key-e");
    }

    @Test
    void missingSourcesYieldAnEmptyList() {
        ExtractorProperties properties = new ExtractorProperties();
        properties.getCredentials().setKeysFile(dir.resolve("absent.txt").toString());

        CredentialSourceService service = new CredentialSourceService(
                properties, new DefaultApplicationArguments(), new MockEnvironment());

        assertThat(service.loadSecrets()).isEmpty();
    }
}
