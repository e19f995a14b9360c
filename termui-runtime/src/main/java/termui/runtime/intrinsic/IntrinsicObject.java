package termui.runtime.intrinsic;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 宿主注册的具名对象：方法、getter、setter 三张表，名字不区分大小写。
 *
 * <pre>
 * IntrinsicObject canvas = IntrinsicObject.builder("Canvas")
 *     .method("clear", (target, args, ctx) -&gt; { surface.clear(); return null; })
 *     .getter("width", (target, ctx) -&gt; UiNumber.of(surface.getWidth()))
 *     .build();
 * </pre>
 */
public final class IntrinsicObject {
    private final String name;
    private final Map<String, IntrinsicMethod> methods;
    private final Map<String, IntrinsicGetter> getters;
    private final Map<String, IntrinsicSetter> setters;

    private IntrinsicObject(Builder builder) {
        this.name = builder.name;
        this.methods = Collections.unmodifiableMap(copy(builder.methods));
        this.getters = Collections.unmodifiableMap(copy(builder.getters));
        this.setters = Collections.unmodifiableMap(copy(builder.setters));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public IntrinsicMethod getMethod(String methodName) {
        return methods.get(methodName);
    }

    public IntrinsicGetter getGetter(String property) {
        return getters.get(property);
    }

    public IntrinsicSetter getSetter(String property) {
        return setters.get(property);
    }

    public boolean hasMethod(String methodName) {
        return methods.containsKey(methodName);
    }

    @Override
    public String toString() {
        return "IntrinsicObject{" + name + ", methods=" + methods.keySet() + "}";
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        Map<String, V> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        map.putAll(source);
        return map;
    }

    // ============ Builder ============

    public static final class Builder {
        private final String name;
        private final Map<String, IntrinsicMethod> methods = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, IntrinsicGetter> getters = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, IntrinsicSetter> setters = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        Builder(String name) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Object name must not be empty");
            }
            if (name.indexOf('.') >= 0) {
                throw new IllegalArgumentException("Object name must not contain '.': " + name);
            }
            this.name = name;
        }

        public Builder method(String methodName, IntrinsicMethod method) {
            methods.put(methodName, method);
            return this;
        }

        public Builder getter(String property, IntrinsicGetter getter) {
            getters.put(property, getter);
            return this;
        }

        public Builder setter(String property, IntrinsicSetter setter) {
            setters.put(property, setter);
            return this;
        }

        /** 同时注册 getter 和 setter */
        public Builder property(String property, IntrinsicGetter getter, IntrinsicSetter setter) {
            return getter(property, getter).setter(property, setter);
        }

        public IntrinsicObject build() {
            return new IntrinsicObject(this);
        }
    }
}
