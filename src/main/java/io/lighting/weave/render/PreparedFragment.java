package io.lighting.weave.render;

import io.lighting.weave.fragment.Fragment;
import io.lighting.weave.fragment.FragmentCompositionException;
import io.lighting.weave.fragment.UnfilledSlotException;
import io.lighting.weave.sql.Bindings;
import io.lighting.weave.sql.RenderedSql;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 预渲染片段。
 * <p>
 * SQL 文本在创建时已经完全渲染，每个已绑定值与每个槽位的参数位置都已固定；
 * 之后每次调用只需把槽位值写入对应位置，不会重新遍历片段。
 * 由于文本不可再变化，槽位值不能是 {@link Fragment}。实例不可变，可并发调用。
 */
public final class PreparedFragment {
    private final FragmentRenderer renderer;
    private final Fragment source;
    private final String text;
    private final Object[] baked;
    private final String[] slotNames;
    private final int[][] slotPositions;

    PreparedFragment(
        FragmentRenderer renderer,
        Fragment source,
        String text,
        Object[] baked,
        String[] slotNames,
        int[][] slotPositions
    ) {
        this.renderer = renderer;
        this.source = source;
        this.text = text;
        this.baked = baked;
        this.slotNames = slotNames;
        this.slotPositions = slotPositions;
    }

    public String text() {
        return text;
    }

    public Set<String> slotNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(slotNames)));
    }

    /**
     * 生成与 {@link #text()} 参数位置一一对应的绑定值列表。
     *
     * @param bindings 槽位名称到值的映射；多余的名称被忽略
     * @throws UnfilledSlotException         缺少某个槽位的值（按从左到右首个缺失的名称报告）
     * @throws FragmentCompositionException 槽位值为片段
     */
    public List<Object> values(Bindings bindings) {
        Objects.requireNonNull(bindings, "bindings");
        Object[] values = baked.clone();
        for (int i = 0; i < slotNames.length; i++) {
            String name = slotNames[i];
            if (!bindings.contains(name)) {
                throw new UnfilledSlotException(name);
            }
            Object value = bindings.get(name);
            if (value instanceof Fragment) {
                throw new FragmentCompositionException(name);
            }
            for (int position : slotPositions[i]) {
                values[position] = value;
            }
        }
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    public List<Object> values(String name, Object value, Object... more) {
        return values(Bindings.of(name, value, more));
    }

    /**
     * 绑定槽位值并得到完整的渲染结果，成功或失败都会通知所属渲染器的观察器。
     */
    public RenderedSql bind(Bindings bindings) {
        long start = System.nanoTime();
        RenderedSql rendered;
        try {
            rendered = new RenderedSql(text, values(bindings));
        } catch (RuntimeException e) {
            renderer.failed(source, e, System.nanoTime() - start);
            throw e;
        }
        renderer.rendered(source, rendered, System.nanoTime() - start);
        return rendered;
    }

    public RenderedSql bind(String name, Object value, Object... more) {
        return bind(Bindings.of(name, value, more));
    }
}
