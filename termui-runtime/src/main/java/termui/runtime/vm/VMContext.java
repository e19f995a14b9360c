package termui.runtime.vm;

import termui.runtime.UiString;
import termui.runtime.UiValue;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 持久的会话变量存储
 *
 * <p>三个命名空间：
 * <ul>
 *   <li>variables - 脚本变量，受个数和字符串长度限制</li>
 *   <li>globals - 宿主注入的只读绑定，查找顺序在 variables 之后</li>
 *   <li>internal - 宿主内部状态，脚本不可见</li>
 * </ul>
 *
 * <p>非线程安全：同一时刻只允许一个执行或宿主线程访问。</p>
 */
public class VMContext {

    private final ExecutionLimits limits;
    private final Map<String, UiValue> variables = new LinkedHashMap<>();
    private final Map<String, UiValue> globals = new HashMap<>();
    private final Map<String, Object> internal = new HashMap<>();

    public VMContext() {
        this(ExecutionLimits.defaults());
    }

    public VMContext(ExecutionLimits limits) {
        this.limits = limits;
    }

    public ExecutionLimits getLimits() {
        return limits;
    }

    // ============ 脚本变量 ============

    /**
     * 写入脚本变量
     *
     * @throws VMException 字符串超长，或新变量超出个数上限
     */
    public void setVariable(String name, UiValue value) {
        checkString(value);
        if (!variables.containsKey(name) && variables.size() >= limits.getMaxVariables()) {
            throw new VMException("Variable limit exceeded (max " + limits.getMaxVariables() + ")");
        }
        variables.put(name, value);
    }

    /** 先查变量，再查全局；都没有返回 null */
    public UiValue getVariable(String name) {
        UiValue value = variables.get(name);
        if (value != null) {
            return value;
        }
        return globals.get(name);
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name) || globals.containsKey(name);
    }

    /** 脚本变量快照（按写入顺序） */
    public Map<String, UiValue> getVariables() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public int getVariableCount() {
        return variables.size();
    }

    public void clearVariables() {
        variables.clear();
    }

    // ============ 全局绑定 ============

    public void setGlobal(String name, UiValue value) {
        globals.put(name, value);
    }

    public UiValue getGlobal(String name) {
        return globals.get(name);
    }

    public Map<String, UiValue> getGlobals() {
        return Collections.unmodifiableMap(globals);
    }

    // ============ 内部状态 ============

    public void setInternal(String key, Object value) {
        internal.put(key, value);
    }

    public Object getInternal(String key) {
        return internal.get(key);
    }

    @SuppressWarnings("unchecked")
    public <T> T getInternal(String key, Class<T> type) {
        Object value = internal.get(key);
        return type.isInstance(value) ? (T) value : null;
    }

    /** 清空脚本变量和内部状态，全局绑定保留 */
    public void reset() {
        variables.clear();
        internal.clear();
    }

    /**
     * 检查字符串长度
     *
     * @throws VMException 超出 maxStringLength
     */
    public void checkString(UiValue value) {
        if (value instanceof UiString && ((UiString) value).length() > limits.getMaxStringLength()) {
            throw new VMException("String too large (max " + limits.getMaxStringLength() + " characters)");
        }
    }
}
