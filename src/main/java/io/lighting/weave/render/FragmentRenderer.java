package io.lighting.weave.render;

import io.lighting.weave.fragment.Fragment;
import io.lighting.weave.fragment.Part;
import io.lighting.weave.fragment.UnfilledSlotException;
import io.lighting.weave.sql.Bindings;
import io.lighting.weave.sql.RenderedSql;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 将片段展开为最终 SQL 文本与绑定值。
 * <p>
 * 原样文本直接拼接；每个占位值按出现顺序分配从 1 开始的参数序号，其值按同样顺序追加到绑定列表；
 * 遇到槽位时抛出 {@link UnfilledSlotException}。渲染是纯函数，同一片段多次渲染结果相同。
 * <p>
 * 通过 {@link #builder()} 配置参数风格与观察器；{@link #defaults()} 使用 {@code $n} 风格且不带观察器。
 * 由 {@link #prepare(Fragment)} 得到的预渲染片段在每次 {@link PreparedFragment#bind(Bindings)} 时同样通知观察器。
 */
public final class FragmentRenderer {
    private static final FragmentRenderer DEFAULTS = builder().build();

    private final PlaceholderStyle style;
    private final List<RenderObserver> observers;

    private FragmentRenderer(Builder builder) {
        this.style = builder.style;
        this.observers = List.copyOf(builder.observers);
    }

    public static FragmentRenderer defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PlaceholderStyle style() {
        return style;
    }

    public RenderedSql render(Fragment fragment) {
        Objects.requireNonNull(fragment, "fragment");
        long start = System.nanoTime();
        RenderedSql rendered;
        try {
            rendered = renderParts(fragment.parts());
        } catch (RuntimeException e) {
            failed(fragment, e, System.nanoTime() - start);
            throw e;
        }
        rendered(fragment, rendered, System.nanoTime() - start);
        return rendered;
    }

    /**
     * 一次性渲染片段文本，并为每个占位值与剩余槽位固定参数位置。
     * <p>
     * {@code $n} 风格下同名槽位共享一个序号；JDBC 风格下每次出现各占一个位置。
     */
    public PreparedFragment prepare(Fragment fragment) {
        Objects.requireNonNull(fragment, "fragment");
        StringBuilder text = new StringBuilder();
        List<Object> baked = new ArrayList<>();
        Map<Part.Placeholder, Integer> numbers = new IdentityHashMap<>();
        Map<String, List<Integer>> slots = new LinkedHashMap<>();
        for (Part part : fragment.parts()) {
            if (part instanceof Part.LiteralText literal) {
                text.append(literal.text());
            } else if (part instanceof Part.Placeholder placeholder) {
                text.append(style.marker(number(placeholder, baked, numbers)));
            } else if (part instanceof Part.Slot slot) {
                List<Integer> positions = slots.computeIfAbsent(slot.name(), name -> new ArrayList<>());
                if (style.reusesNumbers() && !positions.isEmpty()) {
                    text.append(style.marker(positions.get(0) + 1));
                } else {
                    baked.add(null);
                    positions.add(baked.size() - 1);
                    text.append(style.marker(baked.size()));
                }
            }
        }
        String[] names = slots.keySet().toArray(new String[0]);
        int[][] positions = new int[names.length][];
        for (int i = 0; i < names.length; i++) {
            positions[i] = slots.get(names[i]).stream().mapToInt(Integer::intValue).toArray();
        }
        return new PreparedFragment(this, fragment, text.toString(), baked.toArray(), names, positions);
    }

    void rendered(Fragment source, RenderedSql rendered, long elapsedNanos) {
        for (RenderObserver observer : observers) {
            observer.afterRender(source, rendered, style, elapsedNanos);
        }
    }

    /**
     * 通知渲染失败；观察器自身抛出的异常附加到原始异常上，不会替换它。
     */
    void failed(Fragment source, RuntimeException error, long elapsedNanos) {
        for (RenderObserver observer : observers) {
            try {
                observer.onRenderError(source, error, elapsedNanos);
            } catch (RuntimeException observerError) {
                error.addSuppressed(observerError);
            }
        }
    }

    private RenderedSql renderParts(List<Part> parts) {
        StringBuilder text = new StringBuilder();
        List<Object> values = new ArrayList<>();
        Map<Part.Placeholder, Integer> numbers = new IdentityHashMap<>();
        for (Part part : parts) {
            if (part instanceof Part.LiteralText literal) {
                text.append(literal.text());
            } else if (part instanceof Part.Placeholder placeholder) {
                text.append(style.marker(number(placeholder, values, numbers)));
            } else if (part instanceof Part.Slot slot) {
                throw new UnfilledSlotException(slot.name());
            }
        }
        return new RenderedSql(text.toString(), values);
    }

    private int number(Part.Placeholder placeholder, List<Object> values, Map<Part.Placeholder, Integer> numbers) {
        if (style.reusesNumbers()) {
            Integer existing = numbers.get(placeholder);
            if (existing != null) {
                return existing;
            }
        }
        values.add(placeholder.value());
        int number = values.size();
        numbers.put(placeholder, number);
        return number;
    }

    public static final class Builder {
        private PlaceholderStyle style = PlaceholderStyle.DOLLAR_NUMBERED;
        private final List<RenderObserver> observers = new ArrayList<>();

        private Builder() {
        }

        public Builder style(PlaceholderStyle style) {
            this.style = Objects.requireNonNull(style, "style");
            return this;
        }

        public Builder observer(RenderObserver observer) {
            observers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        public FragmentRenderer build() {
            return new FragmentRenderer(this);
        }
    }
}
