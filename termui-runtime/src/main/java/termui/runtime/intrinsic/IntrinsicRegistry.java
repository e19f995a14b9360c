package termui.runtime.intrinsic;

import termui.runtime.TermUiException;
import termui.runtime.UiHandle;
import termui.runtime.UiNull;
import termui.runtime.UiString;
import termui.runtime.UiValue;
import termui.runtime.vm.VMContext;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 宿主调用分派表
 *
 * <p>虚拟机通过它调用宿主提供的自由函数和具名对象的方法/属性。
 * 名字查找不区分大小写。构建后不可变，可在多个虚拟机之间共享。</p>
 *
 * <p>对象通过句柄寻址：{@link UiHandle} 按 type 分派；
 * 恰好是已注册对象名的 {@link UiString} 也被当作该对象的句柄。</p>
 */
public final class IntrinsicRegistry {

    private final Map<String, IntrinsicFunction> functions;
    private final Map<String, IntrinsicObject> objects;

    private IntrinsicRegistry(Builder builder) {
        this.functions = Collections.unmodifiableMap(copy(builder.functions));
        this.objects = Collections.unmodifiableMap(copy(builder.objects));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 只含内置函数的分派表 */
    public static IntrinsicRegistry withBuiltinsOnly() {
        return builder().withBuiltins().build();
    }

    // ============ 查询 ============

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    public boolean hasObject(String name) {
        return objects.containsKey(name);
    }

    public IntrinsicObject getObject(String name) {
        return objects.get(name);
    }

    public Set<String> getFunctionNames() {
        return functions.keySet();
    }

    public Collection<IntrinsicObject> getObjects() {
        return objects.values();
    }

    // ============ 分派 ============

    /**
     * 调用自由函数。名字形如 {@code Object.method} 时转为方法调用。
     */
    public UiValue callFunction(String name, List<UiValue> args, VMContext context) {
        IntrinsicFunction function = functions.get(name);
        if (function != null) {
            return normalize(function.call(args, context));
        }
        int dot = name.indexOf('.');
        if (dot > 0 && dot < name.length() - 1) {
            IntrinsicObject object = objects.get(name.substring(0, dot));
            if (object != null) {
                return callMethod(UiHandle.of(object.getName()), name.substring(dot + 1), args, context);
            }
        }
        throw new TermUiException("Unknown function: " + name);
    }

    public UiValue callMethod(UiValue target, String name, List<UiValue> args, VMContext context) {
        UiHandle handle = resolveHandle(target);
        if (handle == null) {
            throw new TermUiException("Cannot call method '" + name + "' on " + target.getTypeName());
        }
        IntrinsicObject object = objects.get(handle.getType());
        IntrinsicMethod method = object != null ? object.getMethod(name) : null;
        if (method == null) {
            throw new TermUiException("Unknown method: " + displayName(handle, object) + "." + name);
        }
        return normalize(method.invoke(handle, args, context));
    }

    /**
     * 读取成员：先找 getter；成员是方法名时返回可调用的 {@code "Object.method"} 字符串。
     */
    public UiValue getMember(UiValue target, String name, VMContext context) {
        UiHandle handle = resolveHandle(target);
        if (handle == null) {
            throw new TermUiException("Cannot get member '" + name + "' on " + target.getTypeName());
        }
        IntrinsicObject object = objects.get(handle.getType());
        if (object != null) {
            IntrinsicGetter getter = object.getGetter(name);
            if (getter != null) {
                return normalize(getter.get(handle, context));
            }
            if (object.hasMethod(name)) {
                return UiString.of(object.getName() + "." + name);
            }
        }
        throw new TermUiException("Unknown member: " + displayName(handle, object) + "." + name);
    }

    public void setMember(UiValue target, String name, UiValue value, VMContext context) {
        UiHandle handle = resolveHandle(target);
        IntrinsicObject object = handle != null ? objects.get(handle.getType()) : null;
        IntrinsicSetter setter = object != null ? object.getSetter(name) : null;
        if (setter == null) {
            String typeName = handle != null ? displayName(handle, object) : target.getTypeName();
            throw new TermUiException("Cannot set member '" + name + "' on " + typeName);
        }
        setter.set(handle, value, context);
    }

    /**
     * 把值解析为对象句柄；不能作为句柄时返回 null
     */
    public UiHandle resolveHandle(UiValue target) {
        if (target instanceof UiHandle) {
            return (UiHandle) target;
        }
        if (target instanceof UiString) {
            IntrinsicObject object = objects.get(((UiString) target).getValue());
            if (object != null) {
                return UiHandle.of(object.getName());
            }
        }
        return null;
    }

    private static String displayName(UiHandle handle, IntrinsicObject object) {
        return object != null ? object.getName() : handle.getType();
    }

    private static UiValue normalize(UiValue value) {
        return value != null ? value : UiNull.NULL;
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        Map<String, V> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        map.putAll(source);
        return map;
    }

    // ============ Builder ============

    public static final class Builder {
        private final Map<String, IntrinsicFunction> functions = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, IntrinsicObject> objects = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        Builder() {
        }

        /** 注册自由函数，同名覆盖 */
        public Builder function(String name, IntrinsicFunction function) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Function name must not be empty");
            }
            functions.put(name, function);
            return this;
        }

        /** 注册具名对象，同名覆盖 */
        public Builder object(IntrinsicObject object) {
            objects.put(object.getName(), object);
            return this;
        }

        /** 注册内置函数（print、typeof、floor 等） */
        public Builder withBuiltins() {
            Builtins.registerAll(this);
            return this;
        }

        public IntrinsicRegistry build() {
            return new IntrinsicRegistry(this);
        }
    }
}
