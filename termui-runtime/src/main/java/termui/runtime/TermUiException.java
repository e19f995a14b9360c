package termui.runtime;

/**
 * 运行时基础异常。
 *
 * <p>{@code termui.runtime.vm.VMException} 继承此类表示脚本执行中的故障；
 * 宿主注册的内置函数也可以直接抛出此类。</p>
 */
public class TermUiException extends RuntimeException {

    public TermUiException(String message) {
        super(message);
    }

    public TermUiException(String message, Throwable cause) {
        super(message, cause);
    }
}
