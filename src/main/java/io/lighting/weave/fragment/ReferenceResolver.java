package io.lighting.weave.fragment;

import io.lighting.weave.sql.Bindings;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class ReferenceResolver {
    private final Object[] positional;
    private final Bindings named;
    private final Map<String, Part.Placeholder> placeholders = new HashMap<>();

    ReferenceResolver(Object[] positional, Bindings named) {
        this.positional = positional;
        this.named = named;
    }

    Fragment resolve(List<TemplateToken> tokens) {
        FragmentBuilder builder = new FragmentBuilder();
        for (TemplateToken token : tokens) {
            if (token instanceof TextToken text) {
                builder.text(text.text());
            } else if (token instanceof PositionalToken positionalToken) {
                appendValue(builder, positional[positionalToken.index()]);
            } else if (token instanceof NamedToken namedToken) {
                appendNamed(builder, namedToken.name());
            }
        }
        return builder.build();
    }

    private void appendNamed(FragmentBuilder builder, String name) {
        if (!named.contains(name)) {
            builder.part(new Part.Slot(name));
            return;
        }
        Object value = named.get(name);
        if (value instanceof Fragment fragment) {
            builder.splice(fragment);
        } else {
            builder.part(placeholders.computeIfAbsent(name, key -> new Part.Placeholder(value)));
        }
    }

    static void appendValue(FragmentBuilder builder, Object value) {
        if (value instanceof Fragment fragment) {
            builder.splice(fragment);
        } else {
            builder.part(new Part.Placeholder(value));
        }
    }
}
