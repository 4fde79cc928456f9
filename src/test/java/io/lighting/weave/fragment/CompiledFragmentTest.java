package io.lighting.weave.fragment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import io.lighting.weave.sql.Bindings;
import io.lighting.weave.sql.RenderedSql;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class CompiledFragmentTest {

    @Test
    void matchesFill() {
        Fragment fragment = Sql.sql("SELECT * FROM t WHERE a = {a} AND b = {b} AND c = {}", 3);
        Bindings bindings = Bindings.of("a", 1, "b", Sql.sql("lower({})", "X"));

        RenderedSql compiled = fragment.compile().apply(bindings).query();

        assertEquals(
            new RenderedSql("SELECT * FROM t WHERE a = $1 AND b = lower($2) AND c = $3", List.of(1, "X", 3)),
            compiled
        );
        assertEquals(fragment.fill(bindings).query(), compiled);
    }

    @Test
    void sharesPlaceholderBetweenSlotAndSplicedValue() {
        Fragment fragment = Sql.sql("{x} AND y = {y}");
        Bindings bindings = Bindings.of("x", Sql.sql("z = {y}"), "y", 4);

        RenderedSql compiled = fragment.compile().apply(bindings).query();

        assertEquals(new RenderedSql("z = $1 AND y = $1", List.of(4)), compiled);
        assertEquals(fragment.fill(bindings).query(), compiled);
    }

    @Test
    void leavesUnboundSlotsOpen() {
        CompiledFragment compiled = Sql.sql("a = {a} AND b = {b} AND a2 = {a}").compile();

        assertEquals(List.of("a", "b"), new ArrayList<>(compiled.slotNames()));
        Fragment partial = compiled.apply("a", 1);
        assertEquals(List.of("b"), new ArrayList<>(partial.slotNames()));
        assertEquals(
            new RenderedSql("a = $1 AND b = $2 AND a2 = $1", List.of(1, 2)),
            partial.compile().apply("b", 2).query()
        );
    }

    @Test
    void callsAreIndependent() {
        CompiledFragment compiled = Sql.sql("SELECT * FROM t WHERE id = {id} LIMIT {}", 10).compile();

        assertEquals(
            new RenderedSql("SELECT * FROM t WHERE id = $1 LIMIT $2", List.of(1, 10)),
            compiled.apply("id", 1).query()
        );
        assertEquals(
            new RenderedSql("SELECT * FROM t WHERE id = $1 LIMIT $2", List.of(2, 10)),
            compiled.apply("id", 2).query()
        );
    }

    @Test
    void mergesLiteralsAcrossSlotBoundaries() {
        CompiledFragment compiled = Sql.sql("a {x} b {y} c").compile();

        assertEquals(
            List.of(new Part.LiteralText("a mid b end c")),
            compiled.apply(Bindings.of("x", Sql.literal("mid"), "y", Sql.literal("end"))).parts()
        );
        List<Part> parts = compiled.apply(Bindings.of("x", Sql.sql("{} + {}", 1, 2), "y", 3)).parts();
        assertEquals(
            List.of("a ", " + ", " b ", " c"),
            parts.stream()
                .filter(part -> part instanceof Part.LiteralText)
                .map(part -> ((Part.LiteralText) part).text())
                .collect(Collectors.toList())
        );
        assertEquals(7, parts.size());
    }

    @Test
    void appliesConcurrently() {
        CompiledFragment compiled = Sql.sql("SELECT * FROM t WHERE id = {id} OR parent = {id}").compile();

        List<RenderedSql> rendered = IntStream.range(0, 200)
            .parallel()
            .mapToObj(i -> compiled.apply("id", i).query())
            .collect(Collectors.toList());

        for (int i = 0; i < rendered.size(); i++) {
            assertEquals(
                new RenderedSql("SELECT * FROM t WHERE id = $1 OR parent = $1", List.of(i)),
                rendered.get(i)
            );
        }
    }

    @Test
    void returnsSourceWhenNothingIsBound() {
        Fragment fragment = Sql.sql("a = {a}");
        Fragment withoutSlots = Sql.sql("a = {}", 1);

        assertSame(fragment, fragment.compile().apply(Bindings.of("other", 1)));
        assertSame(withoutSlots, withoutSlots.compile().apply("a", 2));
    }
}
