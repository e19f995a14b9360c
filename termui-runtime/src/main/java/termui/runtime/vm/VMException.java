package termui.runtime.vm;

import termui.runtime.TermUiException;

/**
 * 虚拟机运行时故障：除零、栈溢出、超出资源限制、停止请求等。
 *
 * <p>只在 {@link VirtualMachine} 内部传播，最终转换为失败的 {@link VMResult}。</p>
 */
public class VMException extends TermUiException {

    public VMException(String message) {
        super(message);
    }

    public VMException(String message, Throwable cause) {
        super(message, cause);
    }
}
