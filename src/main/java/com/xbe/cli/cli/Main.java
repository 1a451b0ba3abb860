package com.xbe.cli.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        // slf4j-simple reads its level once, when the first logger is created
        if (isVerbose(args)) {
            System.setProperty(LOG_LEVEL_PROPERTY, "debug");
        }
        return newCommandLine().execute(args);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new XbeCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    static boolean isVerbose(String... args) {
        for (var arg : args) {
            if ("--".equals(arg)) {
                return false;
            }
            if ("-v".equals(arg) || "--verbose".equals(arg)) {
                return true;
            }
        }
        return false;
    }
}
