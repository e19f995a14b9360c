package termui.runtime.intrinsic;

import termui.runtime.UiHandle;
import termui.runtime.UiValue;
import termui.runtime.vm.VMContext;

/**
 * 宿主对象属性读取
 */
@FunctionalInterface
public interface IntrinsicGetter {

    UiValue get(UiHandle target, VMContext context);
}
