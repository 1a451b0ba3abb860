package com.xbe.cli.cli;

import com.xbe.cli.jsonapi.DocumentShape;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import picocli.CommandLine;

@CommandLine.Command(
    name = "render",
    description = "Render a saved JSON:API response without calling the API.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class RenderCommand extends ResourceCommand {
    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-",
        description = "Response body file; '-' reads stdin.",
        defaultValue = "-"
    )
    String input;

    @CommandLine.Option(
        names = "--shape",
        paramLabel = "single|collection|any",
        description = "Expected form of the data member.",
        defaultValue = "any"
    )
    String shape;

    @CommandLine.Option(
        names = "--resource",
        paramLabel = "TYPE",
        description = "View to render with (default: type of the first primary resource).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String resource;

    @Override
    public Integer call() throws Exception {
        var documentShape = parseShape();
        var type = resource == null ? null : requireResourceType(resource);
        var configuration = configuration();
        var selection = selection();
        return present(readInput(), documentShape, type, options.sparseRequested(selection), configuration);
    }

    private DocumentShape parseShape() {
        try {
            return DocumentShape.valueOf(shape.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Unsupported shape: " + shape);
        }
    }

    private byte[] readInput() {
        if (input == null || "-".equals(input.trim())) {
            try {
                return System.in.readAllBytes();
            } catch (IOException ex) {
                throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
            }
        }
        var path = Path.of(input).toAbsolutePath().normalize();
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read input file: " + path);
        }
    }
}
