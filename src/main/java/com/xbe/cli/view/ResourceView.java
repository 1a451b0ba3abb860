package com.xbe.cli.view;

import com.xbe.cli.jsonapi.Resource;
import com.xbe.cli.jsonapi.ResourceIndex;
import com.xbe.cli.render.Cells;
import com.xbe.cli.render.Column;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed view of one resource type: the query it needs and how a resource becomes a row.
 */
public interface ResourceView {
    String resourceType();

    /**
     * {@code fields[...]} / {@code include} parameters the view relies on.
     */
    Map<String, String> defaultQuery();

    /**
     * Builds one row. Keys are the JSON field names; values are strings, booleans, lists or raw JSON.
     */
    Map<String, Object> row(Resource resource, ResourceIndex index);

    default String noun() {
        return resourceType().replace('-', ' ');
    }

    default List<Column> listColumns(List<Map<String, Object>> rows) {
        return columnsFromKeys(rows, true);
    }

    default List<Column> detailColumns(Map<String, Object> row) {
        return columnsFromKeys(List.of(row), false);
    }

    /**
     * One column per distinct row key, in first-seen order.
     */
    static List<Column> columnsFromKeys(List<Map<String, Object>> rows, boolean upperCase) {
        var keys = new LinkedHashSet<String>();
        for (var row : rows) {
            keys.addAll(row.keySet());
        }
        var columns = new ArrayList<Column>(keys.size());
        for (var key : keys) {
            var header = upperCase ? Cells.label(key).toUpperCase(Locale.ROOT) : Cells.label(key);
            columns.add(Column.of(header, key));
        }
        return columns;
    }
}
