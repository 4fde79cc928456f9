package io.lighting.weave.fragment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.weave.sql.Bindings;
import io.lighting.weave.sql.RenderedSql;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SqlTest {

    private static Fragment orders(Map<String, Object> query) {
        List<Fragment> where = new ArrayList<>();
        where.add(Sql.sql("TRUE"));
        if (query.containsKey("id")) {
            where.add(Sql.sql("id = {}", query.get("id")));
        }
        if (query.containsKey("eventId")) {
            where.add(Sql.sql("event_id = {}", query.get("eventId")));
        }
        if (query.containsKey("from")) {
            where.add(Sql.sql("start_time >= {}", query.get("from")));
        }
        if (query.containsKey("until")) {
            where.add(Sql.sql("start_time < {}", query.get("until")));
        }
        return Sql.sql("SELECT * FROM orders WHERE {}", Sql.literal(" AND ").join(where));
    }

    @Test
    void buildsConditionalWhereClauses() {
        assertEquals(
            new RenderedSql("SELECT * FROM orders WHERE TRUE", List.of()),
            orders(Map.of()).query()
        );
        assertEquals(
            new RenderedSql("SELECT * FROM orders WHERE TRUE AND id = $1", List.of("xyzzy")),
            orders(Map.of("id", "xyzzy")).query()
        );
        assertEquals(
            new RenderedSql(
                "SELECT * FROM orders WHERE TRUE AND event_id = $1 AND start_time >= $2 AND start_time < $3",
                List.of("plugh", "2019-05-01", "2019-08-26")
            ),
            orders(Map.of("eventId", "plugh", "from", "2019-05-01", "until", "2019-08-26")).query()
        );
    }

    @Test
    void renumbersSplicedSubquery() {
        String template = """
            SELECT *
              FROM ({subquery}) sq
              WHERE sq.foo = {foo}
              LIMIT {limit}
            """;
        Fragment query = Sql.sql(
            template,
            Bindings.of("subquery", orders(Map.of("id", "xyzzy")), "foo", "bork", "limit", 50)
        );

        assertEquals(
            new RenderedSql(
                """
                SELECT *
                  FROM (SELECT * FROM orders WHERE TRUE AND id = $1) sq
                  WHERE sq.foo = $2
                  LIMIT $3
                """,
                List.of("xyzzy", "bork", 50)
            ),
            query.query()
        );
    }

    @Test
    void splicesFragmentWithoutParentheses() {
        Fragment query = Sql.sql("A {x} B", Bindings.of("x", Sql.sql("C {} D", 5)));

        assertEquals(new RenderedSql("A C $1 D B", List.of(5)), query.query());
    }

    @Test
    void keepsPositionalOrderAroundNamedMarkers() {
        Fragment query = Sql.sql(
            "a = {} AND b = {name} AND c = {}",
            Bindings.of("name", "n"),
            1,
            2
        );

        assertEquals(
            new RenderedSql("a = $1 AND b = $2 AND c = $3", List.of(1, "n", 2)),
            query.query()
        );
    }

    @Test
    void reusesRepeatedNamedValue() {
        Fragment query = Sql.sql("SELECT {a}, {b}, {a}", Bindings.of("a", "a", "b", "b"));

        assertEquals(new RenderedSql("SELECT $1, $2, $1", List.of("a", "b")), query.query());
    }

    @Test
    void reusesNumbersOfFragmentSplicedTwice() {
        Fragment a = orders(Map.of("id", "a"));
        Fragment b = orders(Map.of("id", "b"));
        String template = "({x}) x, ({y}) y";

        assertEquals(
            new RenderedSql(
                "(SELECT * FROM orders WHERE TRUE AND id = $1) x, (SELECT * FROM orders WHERE TRUE AND id = $2) y",
                List.of("a", "b")
            ),
            Sql.sql(template, Bindings.of("x", a, "y", b)).query()
        );
        assertEquals(
            new RenderedSql(
                "(SELECT * FROM orders WHERE TRUE AND id = $1) x, (SELECT * FROM orders WHERE TRUE AND id = $1) y",
                List.of("a")
            ),
            Sql.sql(template, Bindings.of("x", a, "y", a)).query()
        );
    }

    @Test
    void bindsNullValues() {
        assertEquals(
            new RenderedSql("x = $1", Arrays.asList((Object) null)),
            Sql.sql("x = {}", (Object) null).query()
        );
    }

    @Test
    void failsOnUnfilledSlotUntilFilled() {
        Fragment fragment = Sql.sql("x={y}");

        UnfilledSlotException error = assertThrows(UnfilledSlotException.class, fragment::query);
        assertEquals("y", error.slotName());
        assertEquals(new RenderedSql("x=$1", List.of(5)), fragment.fill("y", 5).query());
    }

    @Test
    void renderingIsRepeatable() {
        Fragment fragment = Sql.sql("a = {} AND b = {b}", Bindings.of("b", 2), 1);

        assertEquals(fragment.query(), fragment.query());
    }

    @Test
    void iteratesTextThenValues() {
        List<Object> arguments = new ArrayList<>();
        for (Object argument : orders(Map.of("id", "xyzzy")).query()) {
            arguments.add(argument);
        }

        assertEquals(List.of("SELECT * FROM orders WHERE TRUE AND id = $1", "xyzzy"), arguments);
        assertEquals(List.of("SELECT * FROM orders WHERE TRUE"), orders(Map.of()).query().toArguments());
    }

    @Test
    void mergesAdjacentLiteralText() {
        Fragment fragment = Sql.sql("a{}b", Sql.literal("X"));

        assertEquals(List.of(new Part.LiteralText("aXb")), fragment.parts());
    }

    @Test
    void combinatorsHandleEmptyInput() {
        assertEquals(new RenderedSql("TRUE", List.of()), Sql.all(List.of()).query());
        assertEquals(new RenderedSql("FALSE", List.of()), Sql.any(List.of()).query());
        assertEquals(new RenderedSql("", List.of()), Sql.list(List.of()).query());
        assertTrue(Sql.list(List.of()).isEmpty());
    }

    @Test
    void allAndAnyWrapEachPart() {
        List<Fragment> conditions = List.of(Sql.sql("a={}", 1), Sql.sql("b={}", 2));

        assertEquals(new RenderedSql("(a=$1) AND (b=$2)", List.of(1, 2)), Sql.all(conditions).query());
        assertEquals(new RenderedSql("(a=$1) OR (b=$2)", List.of(1, 2)), Sql.any(conditions).query());
        assertEquals(
            new RenderedSql("(a) AND (b) AND (c)", List.of()),
            Sql.all(List.of(Sql.sql("a"), Sql.sql("b"), Sql.sql("c"))).query()
        );
    }

    @Test
    void listJoinsWithComma() {
        assertEquals(
            new RenderedSql("a, b, c", List.of()),
            Sql.list(List.of(Sql.sql("a"), Sql.sql("b"), Sql.sql("c"))).query()
        );
    }

    @Test
    void joinInterleavesSeparator() {
        Fragment separator = Sql.sql(" {} ", "sep");

        assertTrue(separator.join(List.of()).isEmpty());
        Fragment single = Sql.sql("x = {}", 1);
        assertEquals(single.query(), separator.join(List.of(single)).query());
        assertEquals(
            new RenderedSql("a $1 b $1 c", List.of("sep")),
            separator.join(List.of(Sql.literal("a"), Sql.literal("b"), Sql.literal("c"))).query()
        );
    }

    @Test
    void quotesIdentifiers() {
        assertEquals("\"user\"", Sql.identifier("user").query().text());
        assertEquals("\"we\"\"ird\"", Sql.identifier("we\"ird").query().text());
        assertEquals("\"t\".\"id\"", Sql.identifier("id", "t").query().text());
        assertEquals("\"id\"", Sql.identifier("id", "").query().text());
    }

    @Test
    void buildsSingleParts() {
        assertEquals(List.of(new Part.LiteralText("NOW()")), Sql.literal("NOW()").parts());
        assertEquals(List.of(new Part.Slot("limit")), Sql.slot("limit").parts());
        assertEquals(new RenderedSql("$1", List.of(42)), Sql.value(42).query());
        assertEquals(new RenderedSql("'it''s'", List.of()), Sql.escape("it's").query());
    }

    @Test
    void slotBuilderValidatesName() {
        assertThrows(TemplateSyntaxException.class, () -> Sql.slot("bad name"));
        assertThrows(TemplateSyntaxException.class, () -> Sql.slot(""));
    }

    @Test
    void slotNamesListOpenSlotsOnce() {
        Fragment fragment = Sql.sql("{b} {a} {b} {}", 1);

        assertEquals(List.of("b", "a"), new ArrayList<>(fragment.slotNames()));
    }
}
