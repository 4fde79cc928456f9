package io.lighting.weave.fragment;

import io.lighting.weave.sql.Bindings;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 片段构造入口。
 * <p>
 * 模板语法：
 * <ul>
 *   <li><code>&#123;&#125;</code>：位置参数，按从左到右的顺序依次消费位置参数。</li>
 *   <li><code>&#123;name&#125;</code>：命名参数，名称须匹配 {@code [A-Za-z_][A-Za-z0-9_]*}；
 *   未在 {@link Bindings} 中提供的名称成为槽位，可稍后通过 {@link Fragment#fill(Bindings)} 绑定。</li>
 *   <li><code>&#123;&#123;</code> 与 <code>&#125;&#125;</code>：转义后的字面花括号。</li>
 * </ul>
 * 参数值若为 {@link Fragment} 则原样展开（不自动加括号），否则作为绑定值。
 * <pre>{@code
 * Fragment where = Sql.all(List.of(Sql.sql("a = {}", 1), Sql.sql("b = {}", 2)));
 * RenderedSql rendered = Sql.sql("SELECT * FROM t WHERE {}", where).query();
 * // SELECT * FROM t WHERE (a = $1) AND (b = $2) | [1, 2]
 * }</pre>
 */
public final class Sql {
    private static final Fragment TRUE = literal("TRUE");
    private static final Fragment FALSE = literal("FALSE");
    private static final Fragment COMMA = literal(", ");

    private Sql() {
    }

    public static Fragment sql(String template, Object... positional) {
        return sql(template, Bindings.empty(), positional);
    }

    /**
     * 解析模板并绑定参数。
     *
     * @param template   模板文本
     * @param named      命名参数；缺失的名称成为槽位，多余的名称被忽略
     * @param positional 位置参数，数量必须与 <code>&#123;&#125;</code> 标记数一致
     * @throws TemplateSyntaxException 花括号不匹配或名称非法
     * @throws ArityMismatchException  位置参数数量不匹配
     */
    public static Fragment sql(String template, Bindings named, Object... positional) {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(named, "named");
        Object[] arguments = positional == null ? new Object[] {null} : positional;
        List<TemplateToken> tokens = new TemplateParser(template).parse(arguments.length);
        return new ReferenceResolver(arguments, named).resolve(tokens);
    }

    public static Fragment literal(String text) {
        Objects.requireNonNull(text, "text");
        return new FragmentBuilder().text(text).build();
    }

    public static Fragment value(Object value) {
        return new FragmentBuilder().part(new Part.Placeholder(value)).build();
    }

    public static Fragment slot(String name) {
        if (!TemplateParser.isValidName(name)) {
            throw new TemplateSyntaxException("Invalid slot name '" + name + "'", 0);
        }
        return new FragmentBuilder().part(new Part.Slot(name)).build();
    }

    public static Fragment identifier(String name) {
        return identifier(name, null);
    }

    public static Fragment identifier(String name, String prefix) {
        Objects.requireNonNull(name, "name");
        if (prefix == null || prefix.isEmpty()) {
            return literal(quoteIdentifier(name));
        }
        return literal(quoteIdentifier(prefix) + "." + quoteIdentifier(name));
    }

    public static Fragment escape(Object value) {
        return literal(SqlLiterals.escape(value));
    }

    public static Fragment list(Iterable<Fragment> fragments) {
        return COMMA.join(fragments);
    }

    public static Fragment all(Iterable<Fragment> fragments) {
        return wrapAndJoin(fragments, ") AND (", TRUE);
    }

    public static Fragment any(Iterable<Fragment> fragments) {
        return wrapAndJoin(fragments, ") OR (", FALSE);
    }

    /**
     * 构造 {@code UNNEST($1::T1[], $2::T2[], ...)}：按列转置行数据，每列绑定为一个数组参数。
     * JSON/JSONB 列中的非字符串值会先序列化为 JSON 文本，并以 {@code ::TEXT[]::JSONB[]} 形式转换。
     *
     * @throws ArityMismatchException 某行的长度与列类型数量不一致
     */
    public static Fragment unnest(Iterable<? extends List<?>> rows, List<String> columnTypes) {
        return UnnestBuilder.unnest(rows, columnTypes);
    }

    static String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    private static Fragment wrapAndJoin(Iterable<Fragment> fragments, String infix, Fragment empty) {
        Objects.requireNonNull(fragments, "fragments");
        Iterator<Fragment> iterator = fragments.iterator();
        if (!iterator.hasNext()) {
            return empty;
        }
        FragmentBuilder builder = new FragmentBuilder().text("(");
        boolean first = true;
        while (iterator.hasNext()) {
            Fragment fragment = Objects.requireNonNull(iterator.next(), "fragment");
            if (!first) {
                builder.text(infix);
            }
            builder.splice(fragment);
            first = false;
        }
        return builder.text(")").build();
    }
}
