package com.termui.cli;

import termui.runtime.UiNumber;
import termui.runtime.UiValue;
import termui.runtime.intrinsic.IntrinsicObject;
import termui.runtime.intrinsic.IntrinsicRegistry;

import java.io.PrintStream;
import java.util.List;

/**
 * 命令行宿主提供的内置对象：print 输出到控制台，Console 对象提供日志、清屏和计时。
 */
final class ConsoleIntrinsics {

    private ConsoleIntrinsics() {
    }

    /**
     * 创建命令行使用的分派表
     */
    static IntrinsicRegistry createRegistry(PrintStream out) {
        long started = System.currentTimeMillis();

        IntrinsicObject console = IntrinsicObject.builder("Console")
                .method("log", (target, args, ctx) -> {
                    out.println(join(args));
                    return null;
                })
                .method("clear", (target, args, ctx) -> {
                    out.print("\033[H\033[2J");
                    out.flush();
                    return null;
                })
                .getter("time", (target, ctx) -> UiNumber.of(System.currentTimeMillis() - started))
                .build();

        return IntrinsicRegistry.builder()
                .withBuiltins()
                .function("print", (args, ctx) -> {
                    out.println(args.isEmpty() ? "" : args.get(0).asString());
                    return null;
                })
                .object(console)
                .build();
    }

    private static String join(List<UiValue> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(args.get(i).asString());
        }
        return sb.toString();
    }
}
