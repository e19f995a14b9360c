package com.termui.compiler.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * 脚本块检测与剥离工具
 *
 * <p>块边界与 {@link Lexer} 完全一致（字符串和注释中的括号不计数），
 * 因此剥离结果与逐块执行的范围对应。</p>
 */
public final class BlockDetector {

    private BlockDetector() {
    }

    /** 文本中是否包含块起始标记 */
    public static boolean containsBlock(String text) {
        return text != null && text.contains(Lexer.BLOCK_START);
    }

    /**
     * 移除文本中的所有脚本块，保留块外文本并去除首尾空白
     */
    public static String stripBlocks(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        Lexer lexer = new Lexer(text);
        int last = 0;
        while (lexer.nextBlock() != null) {
            sb.append(text, last, lexer.getConsumedStart());
            last = lexer.getConsumedEnd();
        }
        sb.append(text, last, text.length());
        return sb.toString().trim();
    }

    /**
     * 按出现顺序返回每个块的原始文本（含起始标记和结束括号）
     */
    public static List<String> extractBlocks(String text) {
        List<String> blocks = new ArrayList<String>();
        if (!containsBlock(text)) {
            return blocks;
        }
        Lexer lexer = new Lexer(text);
        while (lexer.nextBlock() != null) {
            blocks.add(lexer.getBlockSource());
        }
        return blocks;
    }
}
