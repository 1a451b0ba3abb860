package com.xbe.cli.api;

import com.xbe.cli.render.OutputFormat;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings for one command invocation, after flags, environment and config file have
 * been merged.
 */
public record CliConfiguration(
    String baseUrl,
    String token,
    OutputFormat outputFormat,
    boolean omitNull,
    Optional<Duration> timeout
) {
    public CliConfiguration {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(outputFormat, "outputFormat");
        Objects.requireNonNull(timeout, "timeout");
    }

    public static Builder builder() {
        return new Builder();
    }

    public ApiClient newClient() {
        return new ApiClient(baseUrl, token, timeout);
    }

    public static final class Builder {
        private String baseUrl = ConfigLoader.DEFAULT_BASE_URL;
        private String token = "";
        private OutputFormat outputFormat = OutputFormat.TABLE;
        private boolean omitNull;
        private Optional<Duration> timeout = Optional.empty();

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder omitNull(boolean omitNull) {
            this.omitNull = omitNull;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public CliConfiguration build() {
            return new CliConfiguration(baseUrl, token, outputFormat, omitNull, timeout);
        }
    }
}
