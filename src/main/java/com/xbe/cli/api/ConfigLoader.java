package com.xbe.cli.api;

import com.xbe.cli.render.OutputFormat;
import com.xbe.cli.shared.DurationParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;

/**
 * Reads {@code config.toml} and merges it with flags and environment.
 *
 * <p>Precedence per setting: command-line flag, then environment ({@code XBE_BASE_URL},
 * {@code XBE_API_TOKEN}), then config file, then built-in default.
 */
public final class ConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_BASE_URL = "https://app.x-b-e.com";
    public static final String ENV_BASE_URL = "XBE_BASE_URL";
    public static final String ENV_TOKEN = "XBE_API_TOKEN";

    private ConfigLoader() {}

    public static Path defaultPath(Map<String, String> env) {
        var xdg = env.get("XDG_CONFIG_HOME");
        if (xdg != null && !xdg.isBlank()) {
            return Path.of(xdg, "xbe", "config.toml");
        }
        var home = System.getProperty("user.home");
        if (home == null || home.isBlank()) {
            throw new IllegalStateException("Unable to determine user home directory");
        }
        return Path.of(home, ".config", "xbe", "config.toml");
    }

    /**
     * Loads a config file; a missing file yields {@link ConfigFile#empty()}.
     *
     * @throws ConfigException when the file cannot be read or is not valid TOML
     */
    public static ConfigFile load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            LOG.debug("No config file at {}", path);
            return ConfigFile.empty();
        }
        TomlParseResult result;
        try {
            result = Toml.parse(path);
        } catch (IOException ex) {
            throw new ConfigException("Unable to read config file " + path + ": " + ex.getMessage(), ex);
        }
        if (result.hasErrors()) {
            throw new ConfigException("Invalid config file " + path + ": " + result.errors().get(0).toString());
        }
        return new ConfigFile(
            string(result, "base_url"),
            string(result, "token"),
            string(result, "output.format"),
            result.isBoolean("output.omit_null")
                ? Optional.ofNullable(result.getBoolean("output.omit_null"))
                : Optional.empty(),
            string(result, "timeout")
        );
    }

    public static CliConfiguration resolve(ConfigOverrides overrides, Map<String, String> env, ConfigFile file) {
        var builder = CliConfiguration.builder()
            .baseUrl(first(overrides.baseUrl(), env.get(ENV_BASE_URL), file.baseUrl(), DEFAULT_BASE_URL));
        if (!overrides.noAuth()) {
            builder.token(first(overrides.token(), env.get(ENV_TOKEN), file.token(), ""));
        }
        OutputFormat format;
        if (overrides.json()) {
            format = OutputFormat.JSON;
        } else {
            format = OutputFormat.from(first(overrides.format(), null, file.format(), "table"));
        }
        return builder
            .outputFormat(format)
            .omitNull(overrides.omitNull() || file.omitNull().orElse(false))
            .timeout(DurationParser.parse(first(overrides.timeout(), null, file.timeout(), "")))
            .build();
    }

    private static Optional<String> string(TomlParseResult result, String key) {
        if (!result.isString(key)) {
            return Optional.empty();
        }
        var value = result.getString(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static String first(String option, String envValue, Optional<String> fileValue, String fallback) {
        if (option != null && !option.isBlank()) {
            return option.trim();
        }
        if (envValue != null && !envValue.isBlank()) {
            return envValue.trim();
        }
        return fileValue.orElse(fallback);
    }
}
