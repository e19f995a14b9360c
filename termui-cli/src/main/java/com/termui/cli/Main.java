package com.termui.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import termui.runtime.vm.ExecutionLimits;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * TermUI CLI 入口点（picocli）
 */
@Command(name = "termui", version = "TermUI v0.1.0",
         mixinStandardHelpOptions = true,
         description = "执行文本中的 #UI{...} 脚本块")
public class Main implements Callable<Integer> {

    @Option(names = "-e", description = "执行代码片段（没有块标记时自动包装为一个块）")
    String expression;

    @Option(names = "--limits", description = "资源限制级别（default, strict, relaxed）")
    String limits;

    @Option(names = "--max-iterations", description = "单次执行的最大指令数")
    Long maxIterations;

    @Option(names = "--timeout", description = "单次执行的最大耗时（毫秒）")
    Long timeout;

    @Option(names = "--disasm", description = "打印每个块的字节码")
    boolean disasm;

    @Option(names = "--json", description = "以 JSON 输出执行报告")
    boolean json;

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志")
    boolean verbose;

    @Parameters(description = "输入文件")
    List<String> files;

    private final PrintStream out;
    private final PrintStream err;

    public Main() {
        this(System.out, System.err);
    }

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        configureLogging(verbose);

        ExecutionLimits resolved;
        try {
            resolved = resolveLimits(limits, maxIterations, timeout);
        } catch (IllegalArgumentException e) {
            err.println("错误: " + e.getMessage());
            return 2;
        }

        if (expression != null) {
            return new ScriptRunner(resolved, out, err, disasm, json).runSnippet(expression);
        }
        if (files != null && !files.isEmpty()) {
            return new ScriptRunner(resolved, out, err, disasm, json).runFiles(files);
        }
        new ReplRunner(resolved, out, err).run();
        return 0;
    }

    static ExecutionLimits resolveLimits(String level, Long maxIterations, Long timeout) {
        ExecutionLimits base;
        if (level == null) {
            base = ExecutionLimits.defaults();
        } else {
            switch (level.toLowerCase(Locale.ROOT)) {
                case "default": base = ExecutionLimits.defaults(); break;
                case "strict":  base = ExecutionLimits.strict(); break;
                case "relaxed": base = ExecutionLimits.relaxed(); break;
                default:
                    throw new IllegalArgumentException("未知限制级别 '" + level + "'（可选: default, strict, relaxed）");
            }
        }
        if (maxIterations == null && timeout == null) {
            return base;
        }
        ExecutionLimits.Builder builder = base.toBuilder();
        if (maxIterations != null) {
            builder.maxIterations(maxIterations);
        }
        if (timeout != null) {
            builder.maxExecutionTime(timeout);
        }
        return builder.build();
    }

    /**
     * 日志输出到 stderr；默认只显示严重错误，verbose 时显示调试日志
     */
    static void configureLogging(boolean verbose) {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        Level level = verbose ? Level.FINE : Level.SEVERE;
        stderrHandler.setLevel(level);
        rootLogger.setLevel(level);
        rootLogger.addHandler(stderrHandler);
    }

    public static void main(String[] args) {
        // Windows 控制台可能不是 UTF-8，按操作系统原生编码输出
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main(out, err));
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
