package com.xbe.cli.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * Writes view rows, detail records and projected trees in the configured {@link OutputFormat}.
 */
public final class Renderer {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();
    private static final ObjectWriter YAML_WRITER = new ObjectMapper(new YAMLFactory()).writer();
    private static final String GUTTER = "  ";

    private final OutputFormat format;
    private final boolean omitNull;
    private final PrintWriter out;

    public Renderer(OutputFormat format, boolean omitNull, PrintWriter out) {
        this.format = Objects.requireNonNull(format, "format");
        this.omitNull = omitNull;
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Collection output. {@code noun} is used for the empty-table message ({@code No follows found.}).
     */
    public void renderRows(String noun, List<Column> columns, List<Map<String, Object>> rows) throws IOException {
        switch (format) {
            case JSON, YAML -> writeStructured(JSON.valueToTree(rows));
            case CSV -> writeCsv(columns, rows);
            default -> {
                if (rows.isEmpty()) {
                    out.println("No " + noun + " found.");
                } else {
                    writeTable(columns, rows);
                }
            }
        }
        out.flush();
    }

    /**
     * Single-resource output: one {@code Label: value} line per column in table mode.
     */
    public void renderDetail(List<Column> columns, Map<String, Object> row) throws IOException {
        switch (format) {
            case JSON, YAML -> writeStructured(JSON.valueToTree(row));
            case CSV -> writeCsv(columns, List.of(row));
            default -> {
                for (var column : columns) {
                    var value = column.render(row);
                    if (!value.isEmpty()) {
                        out.println(column.header() + ": " + value);
                    }
                }
            }
        }
        out.flush();
    }

    /**
     * Projected trees have no tabular form; table and CSV modes fall back to JSON.
     */
    public void renderTree(JsonNode tree) throws IOException {
        writeStructured(tree);
        out.flush();
    }

    void writeTable(List<Column> columns, List<Map<String, Object>> rows) {
        var cells = new ArrayList<List<String>>(rows.size() + 1);
        var header = new ArrayList<String>(columns.size());
        for (var column : columns) {
            header.add(column.header());
        }
        cells.add(header);
        for (var row : rows) {
            var line = new ArrayList<String>(columns.size());
            for (var column : columns) {
                line.add(column.render(row));
            }
            cells.add(line);
        }
        var widths = new int[columns.size()];
        for (var line : cells) {
            for (int i = 0; i < line.size(); i++) {
                widths[i] = Math.max(widths[i], line.get(i).length());
            }
        }
        for (var line : cells) {
            var text = new StringBuilder();
            for (int i = 0; i < line.size(); i++) {
                var cell = line.get(i);
                text.append(cell);
                if (i < line.size() - 1) {
                    text.append(" ".repeat(widths[i] - cell.length())).append(GUTTER);
                }
            }
            out.println(text.toString().stripTrailing());
        }
    }

    private void writeCsv(List<Column> columns, List<Map<String, Object>> rows) throws IOException {
        var headers = new String[columns.size()];
        for (int i = 0; i < headers.length; i++) {
            headers[i] = columns.get(i).header();
        }
        var csvFormat = CSVFormat.DEFAULT.builder().setHeader(headers).build();
        var printer = new CSVPrinter(out, csvFormat);
        for (var row : rows) {
            var values = new ArrayList<String>(columns.size());
            for (var column : columns) {
                values.add(column.render(row));
            }
            printer.printRecord(values);
        }
        printer.flush();
    }

    private void writeStructured(JsonNode tree) throws JsonProcessingException {
        var value = omitNull ? pruneNulls(tree.deepCopy()) : tree;
        if (format == OutputFormat.YAML) {
            out.print(YAML_WRITER.writeValueAsString(value));
        } else {
            out.println(JSON_WRITER.writeValueAsString(value));
        }
    }

    /**
     * Removes object members whose value is JSON null, recursively. Array elements are kept so
     * positions stay meaningful.
     */
    static JsonNode pruneNulls(JsonNode node) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                if (entry.getValue() == null || entry.getValue().isNull()) {
                    fields.remove();
                } else {
                    pruneNulls(entry.getValue());
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (var element : array) {
                pruneNulls(element);
            }
        }
        return node;
    }
}
