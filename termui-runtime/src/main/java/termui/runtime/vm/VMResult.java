package termui.runtime.vm;

import termui.runtime.UiNull;
import termui.runtime.UiValue;

/**
 * 单次执行的结果，要么成功（可带返回值），要么失败（带错误信息）。
 */
public final class VMResult {
    private final boolean success;
    private final UiValue returnValue;
    private final String error;
    private final long iterations;

    private VMResult(boolean success, UiValue returnValue, String error, long iterations) {
        this.success = success;
        this.returnValue = returnValue;
        this.error = error;
        this.iterations = iterations;
    }

    public static VMResult success(UiValue returnValue, long iterations) {
        return new VMResult(true, returnValue, null, iterations);
    }

    public static VMResult failure(String error, long iterations) {
        return new VMResult(false, null, error != null ? error : "Unknown error", iterations);
    }

    public boolean isSuccess() {
        return success;
    }

    /** 返回值；执行没有留下值或失败时为 null */
    public UiValue getReturnValue() {
        return returnValue;
    }

    /** 返回值，缺省时为 {@link UiNull#NULL} */
    public UiValue getReturnValueOrNull() {
        return returnValue != null ? returnValue : UiNull.NULL;
    }

    public boolean hasReturnValue() {
        return returnValue != null;
    }

    public String getError() {
        return error;
    }

    /** 已执行的指令数 */
    public long getIterations() {
        return iterations;
    }

    @Override
    public String toString() {
        if (success) {
            return "VMResult{success" + (returnValue != null ? ", value=" + returnValue : "") + "}";
        }
        return "VMResult{failure, error=" + error + "}";
    }
}
