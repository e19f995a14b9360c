package termui.runtime.intrinsic;

import termui.runtime.UiValue;
import termui.runtime.vm.VMContext;

import java.util.List;

/**
 * 宿主自由函数。参数个数和类型由实现自行检查，返回 null 视为脚本 null。
 */
@FunctionalInterface
public interface IntrinsicFunction {

    UiValue call(List<UiValue> args, VMContext context);
}
