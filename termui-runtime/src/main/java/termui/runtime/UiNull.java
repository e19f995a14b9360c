package termui.runtime;

/**
 * null 值（单例）
 */
public final class UiNull extends UiValue {

    public static final UiNull NULL = new UiNull();

    private UiNull() {
    }

    @Override
    public String getTypeName() {
        return "null";
    }

    @Override
    public Object toJavaValue() {
        return null;
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public double asDouble() {
        return 0;
    }

    @Override
    public String asString() {
        return "null";
    }

    @Override
    public boolean isNull() {
        return true;
    }
}
