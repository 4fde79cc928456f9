package io.lighting.weave.fragment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

final class UnnestBuilder {
    private static final ObjectMapper JSON = new ObjectMapper();

    private UnnestBuilder() {
    }

    static Fragment unnest(Iterable<? extends List<?>> rows, List<String> columnTypes) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(columnTypes, "columnTypes");
        int width = columnTypes.size();
        List<List<Object>> columns = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            columns.add(new ArrayList<>());
        }
        int rowIndex = 0;
        for (List<?> row : rows) {
            Objects.requireNonNull(row, "row");
            if (row.size() != width) {
                throw new ArityMismatchException(
                    "Row " + rowIndex + " does not match the unnest column count",
                    width,
                    row.size()
                );
            }
            for (int i = 0; i < width; i++) {
                columns.get(i).add(row.get(i));
            }
            rowIndex++;
        }
        FragmentBuilder builder = new FragmentBuilder().text("UNNEST(");
        for (int i = 0; i < width; i++) {
            if (i > 0) {
                builder.text(", ");
            }
            appendColumn(builder, columns.get(i), Objects.requireNonNull(columnTypes.get(i), "columnType"));
        }
        return builder.text(")").build();
    }

    private static void appendColumn(FragmentBuilder builder, List<Object> column, String typeName) {
        if (isJsonType(typeName)) {
            // JSON arrays travel as TEXT[]; null stays SQL NULL and strings pass through as-is.
            List<Object> encoded = new ArrayList<>(column.size());
            for (Object value : column) {
                encoded.add(value == null || value instanceof String ? value : toJson(value));
            }
            builder.part(new Part.Placeholder(freeze(encoded)));
            builder.text("::TEXT[]::" + typeName + "[]");
        } else {
            builder.part(new Part.Placeholder(freeze(column)));
            builder.text("::" + typeName + "[]");
        }
    }

    private static boolean isJsonType(String typeName) {
        String upper = typeName.toUpperCase(Locale.ROOT);
        return upper.equals("JSON") || upper.equals("JSONB");
    }

    private static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                "Failed to serialize unnest value of type " + value.getClass().getName(), e);
        }
    }

    private static List<Object> freeze(List<Object> values) {
        return Collections.unmodifiableList(Arrays.asList(values.toArray()));
    }
}
