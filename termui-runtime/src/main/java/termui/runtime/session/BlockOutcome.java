package termui.runtime.session;

import com.termui.compiler.parser.ParseError;
import termui.runtime.vm.VMResult;

import java.util.Collections;
import java.util.List;

/**
 * 单个脚本块的处理结果
 *
 * <p>有语法错误的块仍会执行已解析的语句，此时 {@link #getResult()} 和
 * {@link #getParseErrors()} 同时存在；编译失败的块不执行，只有 {@link #getError()}。</p>
 */
public final class BlockOutcome {

    private final int index;
    private final String source;
    private final List<ParseError> parseErrors;
    private final VMResult result;
    private final String compileError;

    private BlockOutcome(int index, String source, List<ParseError> parseErrors,
                         VMResult result, String compileError) {
        this.index = index;
        this.source = source;
        this.parseErrors = parseErrors != null
                ? Collections.unmodifiableList(parseErrors) : Collections.<ParseError>emptyList();
        this.result = result;
        this.compileError = compileError;
    }

    static BlockOutcome executed(int index, String source, List<ParseError> parseErrors, VMResult result) {
        return new BlockOutcome(index, source, parseErrors, result, null);
    }

    static BlockOutcome compileFailed(int index, String source, List<ParseError> parseErrors, String error) {
        return new BlockOutcome(index, source, parseErrors, null, error);
    }

    /** 块在本批次中的序号（从 0 开始） */
    public int getIndex() {
        return index;
    }

    /** 块原始文本 */
    public String getSource() {
        return source;
    }

    public List<ParseError> getParseErrors() {
        return parseErrors;
    }

    public boolean hasParseErrors() {
        return !parseErrors.isEmpty();
    }

    /** 执行结果；未执行时为 null */
    public VMResult getResult() {
        return result;
    }

    public boolean isExecuted() {
        return result != null;
    }

    public boolean isSuccess() {
        return result != null && result.isSuccess() && parseErrors.isEmpty();
    }

    /**
     * 第一条错误信息：编译错误、运行时故障、语法错误依次优先
     */
    public String getError() {
        if (compileError != null) {
            return compileError;
        }
        if (result != null && !result.isSuccess()) {
            return result.getError();
        }
        if (!parseErrors.isEmpty()) {
            return parseErrors.get(0).getMessage();
        }
        return null;
    }

    @Override
    public String toString() {
        return "BlockOutcome{#" + index + (isSuccess() ? ", ok" : ", error=" + getError()) + "}";
    }
}
