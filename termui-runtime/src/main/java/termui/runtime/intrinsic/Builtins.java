package termui.runtime.intrinsic;

import termui.runtime.UiBoolean;
import termui.runtime.UiNull;
import termui.runtime.UiNumber;
import termui.runtime.UiString;
import termui.runtime.UiValue;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleUnaryOperator;
import java.util.logging.Logger;

/**
 * 内置函数
 *
 * <p>缺少参数时返回中性值（0、""、false），不报错。</p>
 */
public final class Builtins {

    private static final Logger LOG = Logger.getLogger(Builtins.class.getName());

    private Builtins() {
    }

    static void registerAll(IntrinsicRegistry.Builder builder) {
        // ============ 上下文与输出 ============

        builder.function("hasInContext", (args, ctx) -> {
            if (args.isEmpty()) {
                return UiBoolean.FALSE;
            }
            return UiBoolean.of(ctx.hasVariable(args.get(0).asString()));
        });

        // 默认实现只记日志，宿主可以用同名函数覆盖
        builder.function("print", (args, ctx) -> {
            if (!args.isEmpty()) {
                LOG.fine("print: " + args.get(0).asString());
            }
            return UiNull.NULL;
        });

        // ============ 类型转换 ============

        builder.function("typeof", (args, ctx) ->
                UiString.of(args.isEmpty() ? "null" : args.get(0).getTypeName()));

        builder.function("toNumber", (args, ctx) ->
                args.isEmpty() ? UiNumber.ZERO : UiNumber.of(args.get(0).asDouble()));

        builder.function("toString", (args, ctx) ->
                args.isEmpty() ? UiString.EMPTY : UiString.of(args.get(0).asString()));

        // ============ 数学 ============

        unary(builder, "floor", Math::floor);
        unary(builder, "ceil", Math::ceil);
        unary(builder, "round", Math::rint);  // 四舍六入五成双
        unary(builder, "abs", Math::abs);
        unary(builder, "sin", Math::sin);
        unary(builder, "cos", Math::cos);

        builder.function("min", (args, ctx) -> {
            if (args.size() < 2) {
                return UiNumber.ZERO;
            }
            return UiNumber.of(Math.min(args.get(0).asDouble(), args.get(1).asDouble()));
        });

        builder.function("max", (args, ctx) -> {
            if (args.size() < 2) {
                return UiNumber.ZERO;
            }
            return UiNumber.of(Math.max(args.get(0).asDouble(), args.get(1).asDouble()));
        });

        builder.function("random", (args, ctx) -> UiNumber.of(ThreadLocalRandom.current().nextDouble()));

        builder.function("randomRange", (args, ctx) -> {
            if (args.size() < 2) {
                return UiNumber.ZERO;
            }
            double min = args.get(0).asDouble();
            double max = args.get(1).asDouble();
            return UiNumber.of(min + ThreadLocalRandom.current().nextDouble() * (max - min));
        });
    }

    private static void unary(IntrinsicRegistry.Builder builder, String name, DoubleUnaryOperator op) {
        builder.function(name, (args, ctx) -> {
            if (args.isEmpty()) {
                return UiNumber.ZERO;
            }
            return UiNumber.of(op.applyAsDouble(firstNumber(args)));
        });
    }

    private static double firstNumber(List<UiValue> args) {
        return args.get(0).asDouble();
    }
}
