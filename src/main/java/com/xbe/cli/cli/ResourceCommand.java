package com.xbe.cli.cli;

import com.xbe.cli.api.CliConfiguration;
import com.xbe.cli.jsonapi.DocumentShape;
import com.xbe.cli.jsonapi.ParseException;
import com.xbe.cli.jsonapi.SparseSelection;
import com.xbe.cli.render.Renderer;
import com.xbe.cli.view.ResourceView;
import com.xbe.cli.view.ResourceViews;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;
import picocli.CommandLine;

/**
 * Shared plumbing for subcommands that render one JSON:API response.
 */
abstract class ResourceCommand implements Callable<Integer> {
    private static final Pattern RESOURCE_TYPE = Pattern.compile("[A-Za-z0-9_-]+");

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    ClientOptions options = new ClientOptions();

    ResourceViews views = ResourceViews.defaults();

    CliConfiguration configuration() {
        try {
            return options.resolve(System.getenv());
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }
    }

    SparseSelection selection() {
        try {
            return options.selection();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }
    }

    /**
     * The caller's fieldset when one was given, otherwise what the fixed view needs.
     */
    Map<String, String> baseQuery(ResourceView view, SparseSelection selection) {
        var query = new LinkedHashMap<String, String>();
        if (selection.isRequested()) {
            query.putAll(selection.toQuery());
        } else {
            query.putAll(view.defaultQuery());
        }
        return query;
    }

    String requireResourceType(String resourceType) {
        if (resourceType == null || !RESOURCE_TYPE.matcher(resourceType.trim()).matches()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid resource type: " + resourceType);
        }
        return resourceType.trim();
    }

    /**
     * Renders {@code body}. A body that does not parse is echoed to stderr before the error surfaces.
     */
    int present(byte[] body, DocumentShape shape, String resourceType, boolean sparse, CliConfiguration configuration)
        throws IOException {
        var commandLine = spec.commandLine();
        var renderer = new Renderer(configuration.outputFormat(), configuration.omitNull(), commandLine.getOut());
        try {
            new ResponsePresenter(renderer, views).present(body, shape, resourceType, sparse);
            return 0;
        } catch (ParseException ex) {
            if (body.length > 0) {
                var err = commandLine.getErr();
                err.println(new String(body, StandardCharsets.UTF_8));
                err.flush();
            }
            throw new CommandLine.ExecutionException(commandLine, ex.getMessage(), ex);
        }
    }
}
