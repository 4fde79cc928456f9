package io.lighting.weave.fragment;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates parts for a new {@link Fragment}, merging adjacent literal text and dropping empty
 * literals.
 */
final class FragmentBuilder {
    private final List<Part> parts = new ArrayList<>();
    private final StringBuilder text = new StringBuilder();

    FragmentBuilder text(String literal) {
        text.append(literal);
        return this;
    }

    FragmentBuilder part(Part part) {
        if (part instanceof Part.LiteralText literal) {
            return text(literal.text());
        }
        flushText();
        parts.add(part);
        return this;
    }

    /**
     * Appends an already normalized run of parts. Only the edge literals are merged with the
     * surrounding text; interior parts are added in one step.
     */
    FragmentBuilder run(List<Part> run) {
        int size = run.size();
        if (size == 0) {
            return this;
        }
        int from = 0;
        if (run.get(0) instanceof Part.LiteralText head) {
            text.append(head.text());
            from = 1;
        }
        if (from == size) {
            return this;
        }
        Part tail = run.get(size - 1);
        int to = tail instanceof Part.LiteralText ? size - 1 : size;
        if (from < to) {
            flushText();
            parts.addAll(run.subList(from, to));
        }
        if (to < size) {
            text.append(((Part.LiteralText) tail).text());
        }
        return this;
    }

    FragmentBuilder splice(Fragment fragment) {
        return run(fragment.parts());
    }

    Fragment build() {
        flushText();
        if (parts.isEmpty()) {
            return Fragment.EMPTY;
        }
        return new Fragment(parts);
    }

    private void flushText() {
        if (text.length() > 0) {
            parts.add(new Part.LiteralText(text.toString()));
            text.setLength(0);
        }
    }
}
