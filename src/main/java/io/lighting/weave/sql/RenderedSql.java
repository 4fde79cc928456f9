package io.lighting.weave.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 渲染结果：最终 SQL 文本与按占位符顺序排列的绑定值。
 * <p>
 * 迭代时先产出 SQL 文本，再依次产出每个绑定值，便于直接展开为驱动调用的参数列表。
 */
public record RenderedSql(String text, List<Object> values) implements Iterable<Object> {
    public RenderedSql {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(values, "values");
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public List<Object> toArguments() {
        List<Object> arguments = new ArrayList<>(values.size() + 1);
        arguments.add(text);
        arguments.addAll(values);
        return Collections.unmodifiableList(arguments);
    }

    /**
     * 适用于 JDBC {@code setObject} 的绑定值。
     * <p>
     * JDBC 驱动不接受 {@link List} 作为参数，因此列表值（例如 unnest 的各列）转换为 {@code Object[]}，
     * 嵌套列表同样转换；其余值保持不变。{@link #values()} 本身不受影响。
     */
    public List<Object> jdbcValues() {
        List<Object> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            converted.add(toJdbcValue(value));
        }
        return Collections.unmodifiableList(converted);
    }

    private static Object toJdbcValue(Object value) {
        if (value instanceof List<?> list) {
            Object[] array = new Object[list.size()];
            for (int i = 0; i < array.length; i++) {
                array[i] = toJdbcValue(list.get(i));
            }
            return array;
        }
        return value;
    }

    @Override
    public Iterator<Object> iterator() {
        return toArguments().iterator();
    }
}
