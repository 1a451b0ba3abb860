package com.xbe.cli.cli;

import com.xbe.cli.jsonapi.DocumentShape;
import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine;

@CommandLine.Command(
    name = "list",
    description = "List resources of one type.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class ListCommand extends ResourceCommand {
    @CommandLine.Parameters(
        index = "0",
        paramLabel = "RESOURCE",
        description = "Resource type, e.g. follows or broker-memberships."
    )
    String resource;

    @CommandLine.Option(
        names = "--filter",
        paramLabel = "KEY=VALUE",
        description = "Sent as filter[KEY]=VALUE; repeatable."
    )
    Map<String, String> filters = new LinkedHashMap<>();

    @CommandLine.Option(names = "--limit", description = "Page size.", defaultValue = "50")
    int limit;

    @CommandLine.Option(names = "--offset", description = "Page offset.", defaultValue = "0")
    int offset;

    @CommandLine.Option(
        names = "--sort",
        description = "Sort by field (prefix with - for descending).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String sort;

    @Override
    public Integer call() throws Exception {
        var type = requireResourceType(resource);
        var configuration = configuration();
        var selection = selection();
        var query = baseQuery(views.forType(type), selection);
        if (limit > 0) {
            query.put("page[limit]", Integer.toString(limit));
        }
        if (offset > 0) {
            query.put("page[offset]", Integer.toString(offset));
        }
        if (sort != null && !sort.isBlank()) {
            query.put("sort", sort.trim());
        }
        filters.forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                query.put("filter[" + key.trim() + "]", value);
            }
        });

        var response = configuration.newClient().get("/v1/" + type, query);
        return present(response.body(), DocumentShape.COLLECTION, type, options.sparseRequested(selection), configuration);
    }
}
