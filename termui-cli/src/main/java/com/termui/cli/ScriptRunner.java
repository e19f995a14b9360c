package com.termui.cli;

import com.termui.compiler.codegen.CompileException;
import com.termui.compiler.codegen.Compiler;
import com.termui.compiler.codegen.Disassembler;
import com.termui.compiler.lexer.BlockDetector;
import com.termui.compiler.lexer.Lexer;
import com.termui.compiler.lexer.Token;
import com.termui.compiler.parser.ParseException;
import com.termui.compiler.parser.Parser;
import termui.runtime.UiNull;
import termui.runtime.cache.ChunkCache;
import termui.runtime.session.BlockOutcome;
import termui.runtime.session.ScriptSession;
import termui.runtime.session.SessionConfig;
import termui.runtime.vm.ExecutionLimits;
import termui.runtime.vm.VMResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 文件和代码片段执行器
 *
 * <p>所有输入共享一个会话，后面的文件可以读取前面文件定义的变量。</p>
 */
public class ScriptRunner {

    private final PrintStream out;
    private final PrintStream err;
    private final boolean disasm;
    private final JsonReport report;
    private final ScriptSession session;

    public ScriptRunner(ExecutionLimits limits, PrintStream out, PrintStream err, boolean disasm, boolean json) {
        this.out = out;
        this.err = err;
        this.disasm = disasm;
        this.report = json ? new JsonReport() : null;
        this.session = new ScriptSession("cli", ConsoleIntrinsics.createRegistry(out),
                SessionConfig.builder().limits(limits).build(), new ChunkCache(64), Runnable::run, null);
    }

    /**
     * 依次执行文件
     *
     * @return 退出码：0 成功，1 读取失败或有块出错
     */
    public int runFiles(List<String> filePaths) {
        boolean ok = true;
        for (String filePath : filePaths) {
            Path path = Paths.get(filePath);
            if (!Files.isRegularFile(path)) {
                err.println("错误: 文件不存在 - " + filePath);
                return 1;
            }
            String text;
            try {
                text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("错误: 无法读取文件 - " + filePath + " (" + e.getMessage() + ")");
                return 1;
            }
            ok &= runText(text, filePath, false);
        }
        return finish(ok);
    }

    /**
     * 执行代码片段，没有块标记时包装为一个块。块的返回值打印到标准输出。
     */
    public int runSnippet(String code) {
        String text = BlockDetector.containsBlock(code) ? code : Lexer.BLOCK_START + code + "}";
        return finish(runText(text, "<cmdline>", true));
    }

    ScriptSession getSession() {
        return session;
    }

    private boolean runText(String text, String sourceName, boolean printReturnValue) {
        List<String> blocks = BlockDetector.extractBlocks(text);
        if (disasm) {
            for (String block : blocks) {
                String listing = disassemble(block, sourceName);
                if (listing != null) {
                    out.print(listing);
                }
            }
        }

        session.enqueueAll(blocks);
        List<BlockOutcome> outcomes = session.executeNow();

        boolean ok = true;
        for (BlockOutcome outcome : outcomes) {
            if (report != null) {
                report.addOutcome(sourceName, outcome);
            }
            if (!outcome.isSuccess()) {
                ok = false;
                if (report == null) {
                    err.println("脚本错误 (" + sourceName + " #" + outcome.getIndex() + "): " + outcome.getError());
                }
            } else if (printReturnValue && report == null) {
                VMResult result = outcome.getResult();
                if (result.hasReturnValue() && result.getReturnValue() != UiNull.NULL) {
                    out.println(result.getReturnValue().asString());
                }
            }
        }

        String visible = BlockDetector.stripBlocks(text);
        if (report != null) {
            report.addOutput(sourceName, visible);
        } else if (!visible.isEmpty()) {
            out.println(visible);
        }
        return ok;
    }

    private int finish(boolean ok) {
        if (report != null) {
            out.println(report.toJson(session.getContext().getVariables()));
        }
        return ok ? 0 : 1;
    }

    /**
     * 编译一个块并返回字节码清单；有语法或编译错误时返回 null
     */
    static String disassemble(String blockSource, String sourceName) {
        List<Token> tokens = new Lexer(blockSource).nextBlock();
        if (tokens == null) {
            return null;
        }
        try {
            return Disassembler.disassemble(new Compiler().compile(new Parser(tokens, sourceName).parse(), sourceName));
        } catch (ParseException | CompileException e) {
            // 错误由执行结果报告
            return null;
        }
    }
}
