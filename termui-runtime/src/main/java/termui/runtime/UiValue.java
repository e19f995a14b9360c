package termui.runtime;

/**
 * 脚本运行时值的基类
 *
 * <p>值的集合是封闭的：{@link UiNumber}、{@link UiString}、{@link UiBoolean}、
 * {@link UiNull} 和 {@link UiHandle}。类型转换规则集中在这里。</p>
 */
public abstract class UiValue {

    UiValue() {
    }

    /**
     * 将 Java 值转换为 UiValue
     *
     * @param javaValue null、Number、Boolean、CharSequence 或 UiValue
     * @return 对应的 UiValue
     */
    public static UiValue fromJava(Object javaValue) {
        if (javaValue == null) {
            return UiNull.NULL;
        }
        if (javaValue instanceof UiValue) {
            return (UiValue) javaValue;
        }
        if (javaValue instanceof Number) {
            return UiNumber.of(((Number) javaValue).doubleValue());
        }
        if (javaValue instanceof Boolean) {
            return UiBoolean.of((Boolean) javaValue);
        }
        if (javaValue instanceof CharSequence) {
            return UiString.of(javaValue.toString());
        }
        if (javaValue instanceof Character) {
            return UiString.of(String.valueOf(javaValue));
        }
        throw new TermUiException("Cannot convert Java object to UiValue: " + javaValue.getClass().getName());
    }

    /**
     * 值的类型名（与 typeof 返回值一致）
     */
    public abstract String getTypeName();

    /**
     * 获取底层 Java 值
     */
    public abstract Object toJavaValue();

    /**
     * 转换为布尔值（用于条件判断）：null、false、0、空串为假
     */
    public abstract boolean isTruthy();

    /**
     * 数值转换：布尔为 1/0，null 为 0，字符串解析失败为 0
     */
    public abstract double asDouble();

    /**
     * 字符串转换（用于拼接和输出）
     */
    public abstract String asString();

    public boolean isNumber() {
        return false;
    }

    public boolean isString() {
        return false;
    }

    public boolean isBoolean() {
        return false;
    }

    public boolean isNull() {
        return false;
    }

    public boolean isHandle() {
        return false;
    }

    @Override
    public String toString() {
        return asString();
    }

    /**
     * 数值格式化：整数值不带小数部分
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
