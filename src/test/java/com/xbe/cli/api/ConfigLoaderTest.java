package com.xbe.cli.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.xbe.cli.render.OutputFormat;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {
    @TempDir
    Path tempDir;

    private Path writeConfig(String toml) throws Exception {
        var path = tempDir.resolve("config.toml");
        Files.writeString(path, toml);
        return path;
    }

    @Test
    void readsFileValues() throws Exception {
        var file = ConfigLoader.load(writeConfig(String.join("\n",
            "base_url = \"https://staging.example.com\"",
            "token = \"file-token\"",
            "timeout = \"45s\"",
            "",
            "[output]",
            "format = \"yaml\"",
            "omit_null = true",
            "")));

        var config = ConfigLoader.resolve(ConfigOverrides.none(), Map.of(), file);

        assertEquals("https://staging.example.com", config.baseUrl());
        assertEquals("file-token", config.token());
        assertEquals(OutputFormat.YAML, config.outputFormat());
        assertTrue(config.omitNull());
        assertEquals(Optional.of(Duration.ofSeconds(45)), config.timeout());
    }

    @Test
    void flagsBeatEnvironmentBeatFile() throws Exception {
        var file = ConfigLoader.load(writeConfig("base_url = \"https://file.example.com\"\ntoken = \"file-token\"\n"));
        var env = Map.of(ConfigLoader.ENV_BASE_URL, "https://env.example.com", ConfigLoader.ENV_TOKEN, "env-token");
        var overrides = new ConfigOverrides("https://flag.example.com", null, false, null, false, false, null);

        var config = ConfigLoader.resolve(overrides, env, file);

        assertEquals("https://flag.example.com", config.baseUrl());
        assertEquals("env-token", config.token());
    }

    @Test
    void missingFileFallsBackToDefaults() {
        var file = ConfigLoader.load(tempDir.resolve("absent.toml"));

        var config = ConfigLoader.resolve(ConfigOverrides.none(), Map.of(), file);

        assertEquals(ConfigLoader.DEFAULT_BASE_URL, config.baseUrl());
        assertEquals("", config.token());
        assertEquals(OutputFormat.TABLE, config.outputFormat());
        assertFalse(config.omitNull());
        assertTrue(config.timeout().isEmpty());
    }

    @Test
    void noAuthDropsToken() {
        var overrides = new ConfigOverrides(null, "flag-token", true, "csv", true, false, null);

        var config = ConfigLoader.resolve(overrides, Map.of(ConfigLoader.ENV_TOKEN, "env-token"), ConfigFile.empty());

        assertEquals("", config.token());
        assertEquals(OutputFormat.JSON, config.outputFormat());
    }

    @Test
    void invalidTomlIsReported() throws Exception {
        var path = writeConfig("base_url = \n");

        assertThrows(ConfigException.class, () -> ConfigLoader.load(path));
    }

    @Test
    void honoursXdgConfigHome() {
        var path = ConfigLoader.defaultPath(Map.of("XDG_CONFIG_HOME", tempDir.toString()));

        assertEquals(tempDir.resolve("xbe").resolve("config.toml"), path);
    }
}
