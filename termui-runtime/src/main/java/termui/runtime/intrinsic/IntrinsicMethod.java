package termui.runtime.intrinsic;

import termui.runtime.UiHandle;
import termui.runtime.UiValue;
import termui.runtime.vm.VMContext;

import java.util.List;

/**
 * 宿主对象方法
 */
@FunctionalInterface
public interface IntrinsicMethod {

    UiValue invoke(UiHandle target, List<UiValue> args, VMContext context);
}
