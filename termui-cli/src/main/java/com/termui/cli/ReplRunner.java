package com.termui.cli;

import com.termui.compiler.lexer.BlockDetector;
import com.termui.compiler.lexer.Lexer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import termui.runtime.UiNull;
import termui.runtime.UiString;
import termui.runtime.UiValue;
import termui.runtime.cache.ChunkCache;
import termui.runtime.session.BlockOutcome;
import termui.runtime.session.ScriptSession;
import termui.runtime.session.SessionConfig;
import termui.runtime.vm.ExecutionLimits;
import termui.runtime.vm.VMResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * jline REPL 交互模式
 *
 * <p>每行输入作为一个块在同一个会话中执行，变量跨行保留。</p>
 */
public class ReplRunner {

    private static final String VERSION = "0.1.0";

    private final ExecutionLimits limits;
    private final PrintStream out;
    private final PrintStream err;
    private ScriptSession session;
    private boolean showDisasm;

    public ReplRunner(ExecutionLimits limits, PrintStream out, PrintStream err) {
        this.limits = limits;
        this.out = out;
        this.err = err;
        this.session = newSession();
    }

    private ScriptSession newSession() {
        return new ScriptSession("repl", ConsoleIntrinsics.createRegistry(out),
                SessionConfig.builder().limits(limits).build(), new ChunkCache(64), Runnable::run, null);
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        out.println("TermUI v" + VERSION + " - 输入 :help 获取帮助，:quit 退出");
        out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, "... ")
                    .build();

            runLoop(reader);
        } catch (IOException e) {
            err.println("终端初始化失败: " + e.getMessage());
            // 回退到简单模式
            runFallbackLoop();
        }

        out.println("\n再见！");
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        StringBuilder buffer = new StringBuilder();
        while (true) {
            try {
                String line = reader.readLine(buffer.length() > 0 ? "... " : "ui> ");
                if (line == null) break;
                if (!accept(line, buffer)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                buffer.setLength(0);
            } catch (EndOfFileException e) {
                // Ctrl+D: 退出
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    private void runFallbackLoop() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        StringBuilder buffer = new StringBuilder();
        while (true) {
            try {
                out.print(buffer.length() > 0 ? "... " : "ui> ");
                out.flush();
                String line = reader.readLine();
                if (line == null) break;
                if (!accept(line, buffer)) break;
            } catch (IOException e) {
                err.println("读取输入时出错: " + e.getMessage());
                break;
            }
        }
    }

    /**
     * 处理一行输入：命令、续行或求值
     *
     * @return false 表示退出
     */
    boolean accept(String line, StringBuilder buffer) {
        if (buffer.length() == 0 && line.startsWith(":")) {
            return handleReplCommand(line.trim());
        }

        // 反斜杠续行
        if (line.endsWith("\\")) {
            buffer.append(line, 0, line.length() - 1).append('\n');
            return true;
        }

        // 未闭合的括号或控制结构自动续行
        String pending = buffer.toString() + line;
        if (needsMoreInput(pending)) {
            buffer.append(line).append('\n');
            return true;
        }
        buffer.setLength(0);

        if (!pending.trim().isEmpty()) {
            evaluateAndPrint(pending);
        }
        return true;
    }

    /**
     * 括号未闭合，或 if/while 多于 end if/end while 时需要继续输入
     */
    static boolean needsMoreInput(String text) {
        int parens = 0;
        int braces = 0;
        boolean inString = false;
        char stringChar = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == stringChar) {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"':
                case '\'':
                    inString = true;
                    stringChar = c;
                    break;
                case '(': parens++; break;
                case ')': parens--; break;
                case '{': braces++; break;
                case '}': braces--; break;
                default: break;
            }
        }
        if (parens > 0 || braces > 0) {
            return true;
        }

        String lower = " " + stripStrings(text).toLowerCase(java.util.Locale.ROOT).replaceAll("\\s+", " ") + " ";
        int ifs = count(lower, " if ") - count(lower, " else if ") - count(lower, " end if ");
        int whiles = count(lower, " while ") - count(lower, " end while ");
        return ifs > count(lower, " end if ") || whiles > count(lower, " end while ");
    }

    private static String stripStrings(String text) {
        return text.replaceAll("\"([^\"\\\\]|\\\\.)*\"|'([^'\\\\]|\\\\.)*'", "\"\"");
    }

    private static int count(String text, String word) {
        int n = 0;
        int from = 0;
        while ((from = text.indexOf(word, from)) >= 0) {
            n++;
            from += word.length() - 1;
        }
        return n;
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    boolean handleReplCommand(String command) {
        if (":quit".equals(command) || ":q".equals(command) || ":exit".equals(command)) {
            return false;
        }

        if (":help".equals(command) || ":h".equals(command)) {
            printReplHelp();
            return true;
        }

        if (":vars".equals(command)) {
            Map<String, UiValue> variables = session.getContext().getVariables();
            if (variables.isEmpty()) {
                out.println("(无变量)");
            }
            for (Map.Entry<String, UiValue> entry : variables.entrySet()) {
                out.println(entry.getKey() + " = " + display(entry.getValue()));
            }
            return true;
        }

        if (":reset".equals(command)) {
            session.destroy();
            session = newSession();
            out.println("上下文已重置");
            return true;
        }

        if (":disasm".equals(command)) {
            showDisasm = !showDisasm;
            out.println("字节码输出: " + (showDisasm ? "开" : "关"));
            return true;
        }

        out.println("未知命令: " + command);
        out.println("输入 :help 获取帮助");
        return true;
    }

    /**
     * 求值并打印结果
     */
    private void evaluateAndPrint(String input) {
        String text = BlockDetector.containsBlock(input) ? input : Lexer.BLOCK_START + input + "}";
        for (String block : BlockDetector.extractBlocks(text)) {
            if (showDisasm) {
                String listing = ScriptRunner.disassemble(block, "<repl>");
                if (listing != null) {
                    out.print(listing);
                }
            }
            session.enqueue(block);
        }

        for (BlockOutcome outcome : session.executeNow()) {
            if (!outcome.isSuccess()) {
                err.println("错误: " + outcome.getError());
                continue;
            }
            VMResult result = outcome.getResult();
            if (result.hasReturnValue() && result.getReturnValue() != UiNull.NULL) {
                out.println(display(result.getReturnValue()));
            }
        }

        String visible = BlockDetector.stripBlocks(text);
        if (!visible.isEmpty()) {
            out.println(visible);
        }
    }

    private static String display(UiValue value) {
        if (value instanceof UiString) {
            return "\"" + value.asString() + "\"";
        }
        return value.asString();
    }

    ScriptSession getSession() {
        return session;
    }

    private void printReplHelp() {
        out.println("REPL 命令:");
        out.println("  :help, :h        显示此帮助");
        out.println("  :quit, :q, :exit 退出 REPL");
        out.println("  :vars            显示当前变量");
        out.println("  :reset           重置上下文");
        out.println("  :disasm          切换字节码输出");
        out.println();
        out.println("示例:");
        out.println("  var x = 10 + 5 * 2");
        out.println("  if x > 10 then print('big') end if");
        out.println("  return floor(3.7)");
        out.println();
        out.println("提示:");
        out.println("  - 行尾使用 \\ 可以输入多行");
        out.println("  - 未闭合的 if/while 和括号会自动进入多行模式");
    }
}
