package termui.runtime;

import java.util.Objects;

/**
 * 宿主对象的不透明句柄
 *
 * <p>VM 只持有 (type, id) 两个字符串，由内置函数表把句柄解析为真实的宿主状态。
 * 注册对象本身的句柄 type 与 id 相同，例如 {@code Canvas}；实例句柄
 * 例如 {@code (SoundInstance, "beep")} 按 type 分派方法。</p>
 */
public final class UiHandle extends UiValue {
    private final String type;
    private final String id;

    public UiHandle(String type, String id) {
        this.type = Objects.requireNonNull(type, "type");
        this.id = Objects.requireNonNull(id, "id");
    }

    /** 注册对象自身的句柄 */
    public static UiHandle of(String objectName) {
        return new UiHandle(objectName, objectName);
    }

    public String getType() {
        return type;
    }

    public String getId() {
        return id;
    }

    @Override
    public String getTypeName() {
        return "object";
    }

    @Override
    public Object toJavaValue() {
        return this;
    }

    @Override
    public boolean isTruthy() {
        return true;
    }

    @Override
    public double asDouble() {
        return 0;
    }

    @Override
    public String asString() {
        return id;
    }

    @Override
    public boolean isHandle() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UiHandle)) return false;
        UiHandle other = (UiHandle) o;
        return type.equalsIgnoreCase(other.type) && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return 31 * type.toLowerCase(java.util.Locale.ROOT).hashCode() + id.hashCode();
    }
}
