package io.lighting.weave.render;

import io.lighting.weave.fragment.Fragment;
import io.lighting.weave.sql.RenderedSql;
import java.lang.reflect.Array;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 渲染日志观察器。
 * <p>
 * 在片段渲染完成或失败时输出可读日志，便于排查模板拼接结果。
 * 通过 {@link Builder} 配置，构建后不可变、线程安全。默认输出到 SLF4J 的 debug 级别。
 * <p>
 * 内联模式仅用于日志展示，不会修改真实的 SQL 或绑定值；参数标记按渲染器回调传入的风格识别。
 */
public final class RenderLog implements RenderObserver {
    private static final Logger LOGGER = LoggerFactory.getLogger(RenderLog.class);

    /**
     * 日志输出模式。
     */
    public enum Mode {
        /**
         * SQL 与绑定值分离输出，例如：SQL | values=[...]
         */
        SEPARATE,
        /**
         * 将参数标记替换为格式化后的绑定值。
         */
        INLINE
    }

    private final boolean enabled;
    private final boolean includeElapsed;
    private final boolean logErrors;
    private final Mode mode;
    private final String prefix;
    private final Consumer<String> sink;

    private RenderLog(Builder builder) {
        this.enabled = builder.enabled;
        this.includeElapsed = builder.includeElapsed;
        this.logErrors = builder.logErrors;
        this.mode = builder.mode;
        this.prefix = builder.prefix;
        this.sink = builder.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void afterRender(Fragment source, RenderedSql rendered, PlaceholderStyle style, long elapsedNanos) {
        if (!enabled) {
            return;
        }
        String content = mode == Mode.INLINE ? inlineSql(rendered, style) : separateSql(rendered);
        if (includeElapsed) {
            content = content + " | elapsed=" + elapsedNanos + "ns";
        }
        sink.accept(prefix + " " + content);
    }

    @Override
    public void onRenderError(Fragment source, RuntimeException error, long elapsedNanos) {
        if (!enabled || !logErrors) {
            return;
        }
        sink.accept(prefix + " render failed: " + error.getMessage());
    }

    private String separateSql(RenderedSql rendered) {
        return rendered.text() + " | values=" + formatValues(rendered.values());
    }

    private String inlineSql(RenderedSql rendered, PlaceholderStyle style) {
        List<Object> values = rendered.values();
        String text = rendered.text();
        if (values.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length() + values.size() * 8);
        int next = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (style == PlaceholderStyle.JDBC && ch == '?' && next < values.size()) {
                out.append(formatValue(values.get(next++)));
            } else if (style == PlaceholderStyle.DOLLAR_NUMBERED && ch == '$' && isDigit(text, i + 1)) {
                int end = i + 1;
                while (isDigit(text, end)) {
                    end++;
                }
                int number = Integer.parseInt(text.substring(i + 1, end));
                if (number >= 1 && number <= values.size()) {
                    out.append(formatValue(values.get(number - 1)));
                } else {
                    out.append(text, i, end);
                }
                i = end - 1;
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }

    private static boolean isDigit(String text, int index) {
        return index < text.length() && Character.isDigit(text.charAt(index));
    }

    private String formatValues(List<Object> values) {
        StringBuilder out = new StringBuilder();
        out.append('[');
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            out.append(formatValue(values.get(i)));
        }
        out.append(']');
        return out.toString();
    }

    private String formatValue(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Boolean bool) {
            return bool ? "TRUE" : "FALSE";
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return quote(value.toString());
        }
        if (value instanceof Enum<?> enumValue) {
            return quote(enumValue.name());
        }
        if (value instanceof TemporalAccessor || value instanceof java.util.Date) {
            return quote(value.toString());
        }
        if (value instanceof byte[] bytes) {
            return "'\\x" + toHex(bytes) + "'";
        }
        if (value instanceof Iterable<?> iterable) {
            StringBuilder out = new StringBuilder("ARRAY[");
            boolean first = true;
            for (Object item : iterable) {
                if (!first) {
                    out.append(", ");
                }
                out.append(formatValue(item));
                first = false;
            }
            return out.append(']').toString();
        }
        if (value.getClass().isArray()) {
            StringBuilder out = new StringBuilder("ARRAY[");
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                if (i > 0) {
                    out.append(", ");
                }
                out.append(formatValue(Array.get(value, i)));
            }
            return out.append(']').toString();
        }
        return quote(value.toString());
    }

    private static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static String toHex(byte[] bytes) {
        StringBuilder out = new StringBuilder(bytes.length * 2);
        for (byte value : bytes) {
            out.append(String.format("%02x", value));
        }
        return out.toString();
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean includeElapsed = false;
        private boolean logErrors = true;
        private Mode mode = Mode.SEPARATE;
        private String prefix = "SQL:";
        private Consumer<String> sink = LOGGER::debug;

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder includeElapsed(boolean enabled) {
            this.includeElapsed = enabled;
            return this;
        }

        /**
         * 是否记录渲染失败（例如存在未绑定槽位）。
         */
        public Builder logErrors(boolean enabled) {
            this.logErrors = enabled;
            return this;
        }

        public Builder mode(Mode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = Objects.requireNonNull(prefix, "prefix");
            return this;
        }

        public Builder sink(Consumer<String> sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public RenderLog build() {
            return new RenderLog(this);
        }
    }
}
