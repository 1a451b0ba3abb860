package com.xbe.cli.jsonapi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-chosen {@code fields[TYPE]} / {@code include} selection. When present it is sent upstream
 * as-is and switches rendering to {@link SparseProjector}.
 */
public record SparseSelection(Map<String, List<String>> fields, List<String> include) {
    private static final SparseSelection NONE = new SparseSelection(Map.of(), List.of());

    public SparseSelection {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(include, "include");
        var copy = new LinkedHashMap<String, List<String>>();
        fields.forEach((type, names) -> copy.put(type, List.copyOf(names)));
        fields = Collections.unmodifiableMap(copy);
        include = List.copyOf(include);
    }

    public static SparseSelection none() {
        return NONE;
    }

    /**
     * Parses command-line specs: each field spec is {@code TYPE=attr,attr}; the include spec is a
     * comma-separated relationship path list. Repeated specs for one type are merged.
     *
     * @throws IllegalArgumentException when a field spec has no {@code =} or an empty type
     */
    public static SparseSelection parse(List<String> fieldSpecs, String includeSpec) {
        var fields = new LinkedHashMap<String, LinkedHashSet<String>>();
        if (fieldSpecs != null) {
            for (var spec : fieldSpecs) {
                if (spec == null || spec.isBlank()) {
                    continue;
                }
                int eq = spec.indexOf('=');
                if (eq <= 0) {
                    throw new IllegalArgumentException("Invalid --fields value '" + spec + "' (expected TYPE=field,field)");
                }
                var type = spec.substring(0, eq).trim();
                if (type.isEmpty()) {
                    throw new IllegalArgumentException("Invalid --fields value '" + spec + "' (missing type)");
                }
                fields.computeIfAbsent(type, ignored -> new LinkedHashSet<>()).addAll(splitCsv(spec.substring(eq + 1)));
            }
        }
        var normalized = new LinkedHashMap<String, List<String>>();
        fields.forEach((type, names) -> normalized.put(type, new ArrayList<>(names)));
        return new SparseSelection(normalized, splitCsv(includeSpec));
    }

    public boolean isRequested() {
        return !fields.isEmpty() || !include.isEmpty();
    }

    /**
     * Query parameters for this selection ({@code fields[TYPE]=a,b} and {@code include=x,y}).
     */
    public Map<String, String> toQuery() {
        var query = new LinkedHashMap<String, String>();
        fields.forEach((type, names) -> query.put("fields[" + type + "]", String.join(",", names)));
        if (!include.isEmpty()) {
            query.put("include", String.join(",", include));
        }
        return query;
    }

    private static List<String> splitCsv(String raw) {
        var values = new ArrayList<String>();
        if (raw == null) {
            return values;
        }
        for (var part : raw.split(",")) {
            var trimmed = part.trim();
            if (!trimmed.isEmpty() && !values.contains(trimmed)) {
                values.add(trimmed);
            }
        }
        return values;
    }
}
