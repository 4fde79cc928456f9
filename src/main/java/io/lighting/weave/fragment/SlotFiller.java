package io.lighting.weave.fragment;

import io.lighting.weave.sql.Bindings;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves named slots against one set of bindings. A single filler instance hands out one
 * placeholder per name, so every occurrence of a slot shares its value.
 */
final class SlotFiller {
    private final Bindings bindings;
    private final Map<String, Part.Placeholder> placeholders = new HashMap<>();

    SlotFiller(Bindings bindings) {
        this.bindings = bindings;
    }

    Fragment fill(Fragment fragment) {
        if (bindings.isEmpty() || !hasBoundSlot(fragment.parts())) {
            return fragment;
        }
        FragmentBuilder builder = new FragmentBuilder();
        fillInto(fragment.parts(), builder, Set.of());
        return builder.build();
    }

    Part.Placeholder placeholder(String name) {
        return placeholders.computeIfAbsent(name, key -> new Part.Placeholder(bindings.get(key)));
    }

    /**
     * Fills a fragment value bound to {@code name}; slots of that name inside it stay open.
     */
    Fragment expand(String name, Fragment value) {
        FragmentBuilder builder = new FragmentBuilder();
        fillInto(value.parts(), builder, Set.of(name));
        return builder.build();
    }

    private void fillInto(List<Part> parts, FragmentBuilder builder, Set<String> expanding) {
        for (Part part : parts) {
            if (part instanceof Part.Slot slot
                && bindings.contains(slot.name())
                && !expanding.contains(slot.name())) {
                Object value = bindings.get(slot.name());
                if (value instanceof Fragment fragment) {
                    Set<String> nested = new HashSet<>(expanding);
                    nested.add(slot.name());
                    fillInto(fragment.parts(), builder, nested);
                } else {
                    builder.part(placeholder(slot.name()));
                }
            } else {
                builder.part(part);
            }
        }
    }

    private boolean hasBoundSlot(List<Part> parts) {
        for (Part part : parts) {
            if (part instanceof Part.Slot slot && bindings.contains(slot.name())) {
                return true;
            }
        }
        return false;
    }
}
