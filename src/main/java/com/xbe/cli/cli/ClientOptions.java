package com.xbe.cli.cli;

import com.xbe.cli.api.CliConfiguration;
import com.xbe.cli.api.ConfigFile;
import com.xbe.cli.api.ConfigLoader;
import com.xbe.cli.api.ConfigOverrides;
import com.xbe.cli.jsonapi.SparseSelection;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import picocli.CommandLine;

/**
 * Connection, output and fieldset options shared by every subcommand.
 */
final class ClientOptions {
    @CommandLine.Option(
        names = "--base-url",
        description = "API base URL (default: $XBE_BASE_URL, config file, or " + ConfigLoader.DEFAULT_BASE_URL + ").",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String baseUrl;

    @CommandLine.Option(
        names = "--token",
        description = "API token (default: $XBE_API_TOKEN or config file).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String token;

    @CommandLine.Option(
        names = "--no-auth",
        description = "Disable auth token lookup."
    )
    boolean noAuth;

    @CommandLine.Option(
        names = "--json",
        description = "Output JSON (same as --format json)."
    )
    boolean json;

    @CommandLine.Option(
        names = "--format",
        paramLabel = "table|json|yaml|csv",
        description = "Output format.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String format;

    @CommandLine.Option(
        names = "--omit-null",
        description = "Omit null values in JSON/YAML output."
    )
    boolean omitNull;

    @CommandLine.Option(
        names = "--fields",
        paramLabel = "TYPE=FIELD[,FIELD...]",
        description = "Sparse fieldset sent as fields[TYPE]; repeatable. Switches output to the raw projection."
    )
    List<String> fields = new ArrayList<>();

    @CommandLine.Option(
        names = "--include",
        paramLabel = "PATH[,PATH...]",
        description = "Relationships to side-load. Switches output to the raw projection.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String include;

    @CommandLine.Option(
        names = "--sparse",
        description = "Render the raw id/type/attributes/relationships projection even without --fields/--include."
    )
    boolean sparse;

    @CommandLine.Option(
        names = "--timeout",
        description = "Request timeout (e.g. 30s, 2m, 1500).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String timeout;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "PATH",
        description = "Config file (default: ~/.config/xbe/config.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path config;

    CliConfiguration resolve(Map<String, String> env) {
        var path = config != null ? config : ConfigLoader.defaultPath(env);
        ConfigFile file = ConfigLoader.load(path);
        var overrides = new ConfigOverrides(baseUrl, token, noAuth, format, json, omitNull, timeout);
        return ConfigLoader.resolve(overrides, env, file);
    }

    SparseSelection selection() {
        return SparseSelection.parse(fields, include);
    }

    boolean sparseRequested(SparseSelection selection) {
        return sparse || selection.isRequested();
    }
}
