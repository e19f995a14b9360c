package termui.runtime;

/**
 * 布尔值
 */
public final class UiBoolean extends UiValue {

    public static final UiBoolean TRUE = new UiBoolean(true);

    public static final UiBoolean FALSE = new UiBoolean(false);

    private final boolean value;

    private UiBoolean(boolean value) {
        this.value = value;
    }

    public static UiBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "boolean";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return value;
    }

    @Override
    public double asDouble() {
        return value ? 1 : 0;
    }

    @Override
    public String asString() {
        return String.valueOf(value);
    }

    @Override
    public boolean isBoolean() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UiBoolean)) return false;
        return value == ((UiBoolean) o).value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }
}
