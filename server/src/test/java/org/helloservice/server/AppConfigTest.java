package org.helloservice.server;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsWhenNoFileAndNoEnv() throws IOException {
        AppConfig config = AppConfig.load(tempDir.resolve("config.yaml"), false, Map.of());

        assertEquals("0.0.0.0", config.server().host());
        assertEquals(3000, config.server().port());
        assertEquals("Hello World!", config.greeting().message());
        assertEquals("1.0.0", config.greeting().version());
    }

    @Test
    void portComesFromEnvironment() throws IOException {
        AppConfig config = AppConfig.load(tempDir.resolve("config.yaml"), false, Map.of("PORT", "8081"));

        assertEquals(8081, config.server().port());
    }

    @Test
    void invalidPortFallsBackToDefault() {
        assertEquals(3000, AppConfig.resolvePort("abc", 3000));
        assertEquals(3000, AppConfig.resolvePort("   ", 3000));
        assertEquals(3000, AppConfig.resolvePort("70000", 3000));
        assertEquals(3000, AppConfig.resolvePort("-1", 3000));
        assertEquals(3000, AppConfig.resolvePort(null, 3000));
        assertEquals(0, AppConfig.resolvePort("0", 3000));
        assertEquals(9000, AppConfig.resolvePort(" 9000 ", 3000));
    }

    @Test
    void readsYamlFile() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                server:
                  host: 127.0.0.1
                  port: 4000
                """);

        AppConfig config = AppConfig.load(file, true, Map.of());

        assertEquals("127.0.0.1", config.server().host());
        assertEquals(4000, config.server().port());
    }

    @Test
    void environmentOverridesYamlPort() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                server:
                  port: 4000
                """);

        AppConfig config = AppConfig.load(file, true, Map.of("PORT", "5000"));

        assertEquals("0.0.0.0", config.server().host());
        assertEquals(5000, config.server().port());
    }

    @Test
    void emptyYamlUsesDefaults() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, "");

        assertEquals(3000, AppConfig.load(file, true, Map.of()).server().port());
    }

    @Test
    void missingRequiredFileFails() {
        Path missing = tempDir.resolve("absent.yaml");

        IOException e = assertThrows(IOException.class, () -> AppConfig.load(missing, true, Map.of()));
        assertTrue(e.getMessage().contains("absent.yaml"));
    }

    @Test
    void unusablePortKeepsYamlPort() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                server:
                  port: 4000
                """);

        assertEquals(4000, AppConfig.load(file, true, Map.of("PORT", "abc")).server().port());
        assertEquals(4000, AppConfig.load(file, true, Map.of("PORT", " ")).server().port());
        assertEquals(4000, AppConfig.load(file, true, Map.of("PORT", "99999")).server().port());
    }

    @Test
    void unusablePortWithoutFileUsesDefault() throws IOException {
        AppConfig config = AppConfig.load(tempDir.resolve("config.yaml"), false, Map.of("PORT", "abc"));

        assertEquals(3000, config.server().port());
    }

    @Test
    void readsGreetingSection() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                greeting:
                  message: Hi there
                  version: 2.1.0
                """);

        AppConfig config = AppConfig.load(file, true, Map.of());

        assertEquals("Hi there", config.greeting().message());
        assertEquals("2.1.0", config.greeting().version());
    }

    @Test
    void partialGreetingSectionKeepsDefaults() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                greeting:
                  message: Hi there
                """);

        AppConfig.GreetingConfig greeting = AppConfig.load(file, true, Map.of()).greeting();

        assertEquals("Hi there", greeting.message());
        assertEquals("1.0.0", greeting.version());
    }
}
