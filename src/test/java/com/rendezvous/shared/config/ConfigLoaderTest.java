package com.rendezvous.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsWhenFileMissing() {
        var cfg = ConfigLoader.load(tempDir.resolve("absent.yaml"), name -> null);
        assertEquals(RelayConfig.defaults(), cfg);
    }

    @Test
    void parsesFullConfig() throws IOException {
        var yaml = """
            server:
              port: 4100
              log-requests: true
            welcome:
              current-version: 0.12.0
              motd: Scheduled maintenance tonight
              error: This server is retired
            """;
        var cfg = writeAndLoad(yaml, Map.of());
        assertEquals(4100, cfg.serverPort());
        assertTrue(cfg.logRequests());
        assertEquals("0.12.0", cfg.welcome().currentVersion());
        assertEquals("Scheduled maintenance tonight", cfg.welcome().motd());
        assertEquals("This server is retired", cfg.welcome().error());
    }

    @Test
    void partialConfigFallsBackToDefaults() throws IOException {
        var yaml = """
            welcome:
              motd: hi
            """;
        var cfg = writeAndLoad(yaml, Map.of());
        assertEquals(4000, cfg.serverPort());
        assertFalse(cfg.logRequests());
        assertEquals("hi", cfg.welcome().motd());
        assertNull(cfg.welcome().currentVersion());
        assertNull(cfg.welcome().error());
    }

    @Test
    void environmentOverridesFile() throws IOException {
        var yaml = """
            server:
              port: 4100
            welcome:
              motd: from file
            """;
        var cfg = writeAndLoad(yaml, Map.of(
            "RENDEZVOUS_PORT", "5000",
            "RENDEZVOUS_LOG_REQUESTS", "true",
            "RENDEZVOUS_MOTD", "from env"));
        assertEquals(5000, cfg.serverPort());
        assertTrue(cfg.logRequests());
        assertEquals("from env", cfg.welcome().motd());
    }

    @Test
    void emptyFileMeansDefaults() throws IOException {
        assertEquals(RelayConfig.defaults(), writeAndLoad("", Map.of()));
    }

    private RelayConfig writeAndLoad(String yaml, Map<String, String> env) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file, env::get);
    }
}
