package termui.runtime.intrinsic;

import termui.runtime.UiHandle;
import termui.runtime.UiValue;
import termui.runtime.vm.VMContext;

/**
 * 宿主对象属性写入
 */
@FunctionalInterface
public interface IntrinsicSetter {

    void set(UiHandle target, UiValue value, VMContext context);
}
