package io.lighting.weave.fragment;

import java.util.Objects;

/**
 * 片段中的单个组成部分：原样 SQL 文本、已绑定的占位值，或尚未绑定的命名槽位。
 */
public sealed interface Part permits Part.LiteralText, Part.Placeholder, Part.Slot {

    record LiteralText(String text) implements Part {
        public LiteralText {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * 绑定值占位。按对象身份区分：同一实例在一个片段中出现多次时只占用一个参数编号。
     */
    final class Placeholder implements Part {
        private final Object value;

        public Placeholder(Object value) {
            this.value = value;
        }

        public Object value() {
            return value;
        }

        @Override
        public String toString() {
            return "Placeholder[" + value + "]";
        }
    }

    record Slot(String name) implements Part {
        public Slot {
            Objects.requireNonNull(name, "name");
        }
    }
}
