package io.lighting.weave.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 命名参数集合。
 * <p>
 * 按插入顺序保存名称到值的映射，值允许为 {@code null}（渲染为 SQL NULL 绑定）。
 * 构建后不可变，可在多个模板、填充或预编译调用之间共享。
 */
public final class Bindings {
    private static final Bindings EMPTY = new Bindings(Map.of());

    private final Map<String, Object> values;

    private Bindings(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Bindings empty() {
        return EMPTY;
    }

    public static Bindings of(String name, Object value, Object... more) {
        Objects.requireNonNull(name, "name");
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(name, value);
        if (more.length % 2 != 0) {
            throw new IllegalArgumentException("Bindings must be name/value pairs");
        }
        for (int i = 0; i < more.length; i += 2) {
            Object key = more[i];
            if (!(key instanceof String keyName)) {
                throw new IllegalArgumentException("Binding name must be a String");
            }
            if (entries.containsKey(keyName)) {
                throw new IllegalArgumentException("Duplicate binding: " + keyName);
            }
            entries.put(keyName, more[i + 1]);
        }
        return new Bindings(entries);
    }

    public static Bindings from(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            return EMPTY;
        }
        for (String name : values.keySet()) {
            Objects.requireNonNull(name, "name");
        }
        return new Bindings(new LinkedHashMap<>(values));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * 返回名称对应的值；未绑定时返回 {@code null}，与绑定值本身为 {@code null} 的情况需通过
     * {@link #contains(String)} 区分。
     */
    public Object get(String name) {
        return values.get(name);
    }

    public Object require(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("Missing binding: " + name);
        }
        return values.get(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "Bindings" + values;
    }
}
