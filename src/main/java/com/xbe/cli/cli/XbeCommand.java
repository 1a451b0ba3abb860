package com.xbe.cli.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "xbe",
    description = "Query the XBE API and render JSON:API responses as tables or JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        ListCommand.class,
        ShowCommand.class,
        RenderCommand.class
    }
)
final class XbeCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        scope = CommandLine.ScopeType.INHERIT,
        description = "Log requests and engine decisions to stderr."
    )
    private boolean verbose;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
