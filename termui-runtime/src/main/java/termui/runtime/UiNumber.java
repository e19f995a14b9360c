package termui.runtime;

/**
 * 数值（双精度浮点）
 */
public final class UiNumber extends UiValue {

    // 缓存 -128 ~ 1023 的整数值
    private static final int CACHE_LOW = -128;
    private static final int CACHE_HIGH = 1023;
    private static final UiNumber[] CACHE = new UiNumber[CACHE_HIGH - CACHE_LOW + 1];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new UiNumber(i + CACHE_LOW);
        }
    }

    public static final UiNumber ZERO = of(0);
    public static final UiNumber ONE = of(1);

    private final double value;

    private UiNumber(double value) {
        this.value = value;
    }

    public static UiNumber of(double value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH && value == (int) value
                && !(value == 0 && 1 / value < 0)) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new UiNumber(value);
    }

    public double getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "number";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        // NaN != 0 成立，NaN 为真
        return value != 0;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public String asString() {
        return formatNumber(value);
    }

    @Override
    public boolean isNumber() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UiNumber)) return false;
        return value == ((UiNumber) o).value;
    }

    @Override
    public int hashCode() {
        // 0.0 与 -0.0 相等，哈希也要一致
        return value == 0 ? 0 : Double.hashCode(value);
    }
}
