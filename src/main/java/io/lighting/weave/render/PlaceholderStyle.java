package io.lighting.weave.render;

/**
 * 绑定参数在 SQL 文本中的书写方式。
 */
public enum PlaceholderStyle {
    /**
     * {@code $1, $2, ...}，同一占位值多次出现时复用同一编号。
     */
    DOLLAR_NUMBERED {
        @Override
        public String marker(int number) {
            return "$" + number;
        }

        @Override
        public boolean reusesNumbers() {
            return true;
        }
    },
    /**
     * JDBC 风格的 {@code ?}，每次出现都占用一个参数位置，绑定值按出现次数重复。
     */
    JDBC {
        @Override
        public String marker(int number) {
            return "?";
        }

        @Override
        public boolean reusesNumbers() {
            return false;
        }
    };

    /**
     * @param number 从 1 开始的参数序号
     */
    public abstract String marker(int number);

    public abstract boolean reusesNumbers();
}
