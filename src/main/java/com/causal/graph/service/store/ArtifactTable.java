package com.causal.graph.service.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Flat table of string cells, the common shape of every persisted stage output.
 */
public record ArtifactTable(List<String> columns, List<List<String>> rows) {

    /**
     * Cell value for an unreachable distance or unbounded length.
     */
    public static final String INFINITY = "Inf";

    /**
     * Separator for list-valued cells.
     */
    public static final String LIST_SEPARATOR = ";";

    public ArtifactTable {
        columns = List.copyOf(columns);
        var copied = new ArrayList<List<String>>(rows.size());
        for (List<String> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row has %d cells, expected %d: %s"
                        .formatted(row.size(), columns.size(), row));
            }
            copied.add(List.copyOf(row));
        }
        rows = List.copyOf(copied);
    }

    public static Builder builder(String... columns) {
        return new Builder(List.of(columns));
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<String> column(String name) {
        int index = columns.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column '%s', have %s".formatted(name, columns));
        }
        return rows.stream().map(row -> row.get(index)).toList();
    }

    public List<Map<String, String>> asMaps() {
        return rows.stream().map(row -> {
            var map = new LinkedHashMap<String, String>();
            for (int i = 0; i < columns.size(); i++) {
                map.put(columns.get(i), row.get(i));
            }
            return (Map<String, String>) map;
        }).toList();
    }

    public static final class Builder {

        private final List<String> columns;
        private final List<List<String>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = columns;
        }

        /**
         * Adds a row. {@code null} becomes {@link #INFINITY}, collections are joined with
         * {@link #LIST_SEPARATOR}, doubles are rounded to six decimals.
         */
        public Builder row(Object... values) {
            var cells = new ArrayList<String>(values.length);
            for (Object value : values) {
                cells.add(format(value));
            }
            rows.add(cells);
            return this;
        }

        public ArtifactTable build() {
            return new ArtifactTable(columns, rows);
        }

        private static String format(Object value) {
            if (value == null) {
                return INFINITY;
            }
            if (value instanceof Double d) {
                if (d.isInfinite()) return INFINITY;
                return Double.toString(Math.round(d * 1_000_000d) / 1_000_000d);
            }
            if (value instanceof Collection<?> collection) {
                return collection.stream().map(Objects::toString).collect(Collectors.joining(LIST_SEPARATOR));
            }
            return value.toString();
        }
    }
}
