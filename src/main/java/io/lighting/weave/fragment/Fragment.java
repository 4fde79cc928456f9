package io.lighting.weave.fragment;

import io.lighting.weave.render.FragmentRenderer;
import io.lighting.weave.render.PreparedFragment;
import io.lighting.weave.sql.Bindings;
import io.lighting.weave.sql.RenderedSql;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * SQL 片段。
 * <p>
 * 片段是不可变的有序 {@link Part} 序列：原样文本、绑定值占位与未绑定的命名槽位。
 * 作为参数传入的其他片段会在构造时被展开（splice）到当前位置，因此片段内部永远不会嵌套片段，
 * 同一片段可以安全地被多个父片段共享。
 * <p>
 * 通过 {@link Sql#sql(String, Object...)} 或 {@link Sql} 中的组合函数创建，
 * 通过 {@link #query()} 渲染为带 {@code $1, $2, ...} 占位符的 SQL 与绑定值列表。
 */
public final class Fragment {
    static final Fragment EMPTY = new Fragment(List.of());

    private final List<Part> parts;

    Fragment(List<Part> parts) {
        this.parts = List.copyOf(parts);
    }

    public List<Part> parts() {
        return parts;
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    /**
     * 返回仍未绑定的槽位名称，按首次出现的顺序排列；同名槽位只出现一次。
     */
    public Set<String> slotNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Part part : parts) {
            if (part instanceof Part.Slot slot) {
                names.add(slot.name());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * 绑定部分或全部槽位，返回新的片段。
     * <p>
     * 名称存在于 {@code bindings} 中的槽位会被替换：片段值直接展开，其他值包装为占位值，
     * 同名的多个槽位共享同一个占位值。未出现的名称保持为槽位；没有对应槽位的名称被忽略。
     *
     * @param bindings 名称到值的映射
     * @return 新片段；若没有任何槽位被替换则返回当前片段
     */
    public Fragment fill(Bindings bindings) {
        Objects.requireNonNull(bindings, "bindings");
        return new SlotFiller(bindings).fill(this);
    }

    public Fragment fill(String name, Object value, Object... more) {
        return fill(Bindings.of(name, value, more));
    }

    /**
     * 预先计算固定部分与槽位位置，返回可重复调用的填充函数。
     */
    public CompiledFragment compile() {
        return new CompiledFragment(this);
    }

    /**
     * 预先渲染 SQL 文本并为每个占位值与槽位固定参数编号。
     */
    public PreparedFragment prepare() {
        return FragmentRenderer.defaults().prepare(this);
    }

    /**
     * 渲染为最终 SQL 与绑定值。
     *
     * @throws UnfilledSlotException 若仍有未绑定的槽位
     */
    public RenderedSql query() {
        return FragmentRenderer.defaults().render(this);
    }

    /**
     * 以当前片段为分隔符连接给定片段。
     */
    public Fragment join(Iterable<Fragment> fragments) {
        Objects.requireNonNull(fragments, "fragments");
        FragmentBuilder builder = new FragmentBuilder();
        Iterator<Fragment> iterator = fragments.iterator();
        boolean first = true;
        while (iterator.hasNext()) {
            Fragment fragment = Objects.requireNonNull(iterator.next(), "fragment");
            if (!first) {
                builder.splice(this);
            }
            builder.splice(fragment);
            first = false;
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "Fragment" + parts;
    }
}
