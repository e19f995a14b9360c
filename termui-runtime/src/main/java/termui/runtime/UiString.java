package termui.runtime;

import java.util.regex.Pattern;

/**
 * 字符串值
 */
public final class UiString extends UiValue {

    public static final UiString EMPTY = new UiString("");

    private static final Pattern NUMBER_LITERAL = Pattern.compile("[+-]?[0-9]+(\\.[0-9]+)?");

    private final String value;

    private UiString(String value) {
        this.value = value;
    }

    public static UiString of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        return value.isEmpty() ? EMPTY : new UiString(value);
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    @Override
    public String getTypeName() {
        return "string";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }

    /**
     * 只接受与脚本数字字面量相同的写法（可带符号和小数部分），其余文本按 0 处理
     */
    @Override
    public double asDouble() {
        String trimmed = value.trim();
        if (!NUMBER_LITERAL.matcher(trimmed).matches()) {
            return 0;
        }
        return Double.parseDouble(trimmed);
    }

    @Override
    public String asString() {
        return value;
    }

    @Override
    public boolean isString() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UiString)) return false;
        return value.equals(((UiString) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
