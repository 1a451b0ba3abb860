package com.xbe.cli.cli;

import com.xbe.cli.jsonapi.DocumentShape;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import picocli.CommandLine;

@CommandLine.Command(
    name = "show",
    description = "Show one resource.",
    mixinStandardHelpOptions = true
)
final class ShowCommand extends ResourceCommand {
    @CommandLine.Parameters(index = "0", paramLabel = "RESOURCE", description = "Resource type, e.g. follows.")
    String resource;

    @CommandLine.Parameters(index = "1", paramLabel = "ID", description = "Resource id.")
    String id;

    @Override
    public Integer call() throws Exception {
        var type = requireResourceType(resource);
        if (id == null || id.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(), type + " id is required");
        }
        var configuration = configuration();
        var selection = selection();
        var query = baseQuery(views.forType(type), selection);
        var path = "/v1/" + type + "/" + URLEncoder.encode(id.trim(), StandardCharsets.UTF_8).replace("+", "%20");

        var response = configuration.newClient().get(path, query);
        return present(response.body(), DocumentShape.SINGLE, type, options.sparseRequested(selection), configuration);
    }
}
