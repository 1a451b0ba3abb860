package com.xbe.cli.cli;

import picocli.CommandLine;

/**
 * Reports the jar's implementation version ({@code development} when run from classes).
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        var version = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "xbe " + (version != null ? version : "development"),
            "JVM: ${java.version} (${java.vendor})"
        };
    }
}
