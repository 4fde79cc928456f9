package io.lighting.weave.fragment;

import io.lighting.weave.sql.Bindings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * 已编译片段。
 * <p>
 * 编译时一次性记录槽位之间的固定部分以及每个槽位对应的名称序号；调用时只需按序号替换槽位，
 * 无需重新遍历或解析原片段。调用结果与 {@link Fragment#fill(Bindings)} 相同，
 * 可继续填充、编译或渲染。
 */
public final class CompiledFragment implements Function<Bindings, Fragment> {
    private final Fragment source;
    private final List<List<Part>> runs;
    private final Part.Slot[] slots;
    private final int[] slotIds;
    private final List<String> names;

    CompiledFragment(Fragment source) {
        this.source = Objects.requireNonNull(source, "source");
        List<List<Part>> fixedRuns = new ArrayList<>();
        List<Part.Slot> slotParts = new ArrayList<>();
        List<Integer> ids = new ArrayList<>();
        Map<String, Integer> nameIds = new HashMap<>();
        List<String> distinct = new ArrayList<>();
        List<Part> current = new ArrayList<>();
        for (Part part : source.parts()) {
            if (part instanceof Part.Slot slot) {
                fixedRuns.add(List.copyOf(current));
                current.clear();
                slotParts.add(slot);
                Integer id = nameIds.get(slot.name());
                if (id == null) {
                    id = distinct.size();
                    nameIds.put(slot.name(), id);
                    distinct.add(slot.name());
                }
                ids.add(id);
            } else {
                current.add(part);
            }
        }
        fixedRuns.add(List.copyOf(current));
        this.runs = List.copyOf(fixedRuns);
        this.slots = slotParts.toArray(new Part.Slot[0]);
        this.slotIds = ids.stream().mapToInt(Integer::intValue).toArray();
        this.names = List.copyOf(distinct);
    }

    @Override
    public Fragment apply(Bindings bindings) {
        Objects.requireNonNull(bindings, "bindings");
        if (names.isEmpty() || bindings.isEmpty()) {
            return source;
        }
        SlotFiller filler = new SlotFiller(bindings);
        Object[] resolved = new Object[names.size()];
        boolean bound = false;
        for (int i = 0; i < resolved.length; i++) {
            String name = names.get(i);
            if (!bindings.contains(name)) {
                continue;
            }
            Object value = bindings.get(name);
            resolved[i] = value instanceof Fragment fragment
                ? filler.expand(name, fragment)
                : filler.placeholder(name);
            bound = true;
        }
        if (!bound) {
            return source;
        }
        FragmentBuilder builder = new FragmentBuilder();
        builder.run(runs.get(0));
        for (int i = 0; i < slots.length; i++) {
            Object replacement = resolved[slotIds[i]];
            if (replacement == null) {
                builder.part(slots[i]);
            } else if (replacement instanceof Fragment fragment) {
                builder.splice(fragment);
            } else {
                builder.part((Part) replacement);
            }
            builder.run(runs.get(i + 1));
        }
        return builder.build();
    }

    public Fragment apply(String name, Object value, Object... more) {
        return apply(Bindings.of(name, value, more));
    }

    public Set<String> slotNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }
}
