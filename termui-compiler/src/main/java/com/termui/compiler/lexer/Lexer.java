package com.termui.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * UI 脚本块词法分析器
 *
 * <p>在任意文本中查找 {@link #BLOCK_START} 标记，每次调用 {@link #nextBlock()}
 * 提取一个括号平衡的脚本块并转换为 token 列表。块外文本原样跳过。</p>
 *
 * <pre>
 * Lexer lexer = new Lexer(output);
 * List&lt;Token&gt; block;
 * while ((block = lexer.nextBlock()) != null) {
 *     ...
 * }
 * </pre>
 */
public class Lexer {

    /** 块起始标记 */
    public static final String BLOCK_START = "#UI{";

    private final String input;
    private List<Token> tokens = new ArrayList<Token>();

    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 起点
    private int start;
    private int startLine;
    private int startColumn;

    private int blockStart = -1;
    private int braceDepth;
    private TokenType lastType;

    // 关键词映射表（小写查找，保留字不区分大小写）
    private static final Map<String, TokenType> KEYWORDS;

    // 双词关键词: 首词 -> (次词 -> 类型)
    private static final Map<String, Map<String, TokenType>> COMPOUND_KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("var", TokenType.KW_VAR);
        map.put("if", TokenType.KW_IF);
        map.put("then", TokenType.KW_THEN);
        map.put("else", TokenType.KW_ELSE);
        map.put("while", TokenType.KW_WHILE);
        map.put("do", TokenType.KW_DO);
        map.put("return", TokenType.KW_RETURN);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("null", TokenType.KW_NULL);
        // "end" 单独出现时是普通标识符，只在 end if / end while 中构成关键词
        KEYWORDS = Collections.unmodifiableMap(map);

        Map<String, Map<String, TokenType>> compound = new HashMap<>();
        Map<String, TokenType> afterEnd = new HashMap<>();
        afterEnd.put("if", TokenType.KW_END_IF);
        afterEnd.put("while", TokenType.KW_END_WHILE);
        compound.put("end", Collections.unmodifiableMap(afterEnd));
        compound.put("else", Collections.singletonMap("if", TokenType.KW_ELSE_IF));
        COMPOUND_KEYWORDS = Collections.unmodifiableMap(compound);
    }

    /** 获取所有保留字集合（不含双词关键词） */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String input) {
        this.input = input != null ? input : "";
    }

    /**
     * 提取下一个脚本块
     *
     * @return 块的 token 列表（以 BLOCK_START 开头、EOF 结尾，不含块末尾的 '}'），
     *         输入中没有更多块时返回 null
     */
    public List<Token> nextBlock() {
        int found = input.indexOf(BLOCK_START, current);
        if (found < 0) {
            return null;
        }

        advanceTo(found);
        blockStart = found;
        tokens = new ArrayList<Token>();
        tokens.add(new Token(TokenType.BLOCK_START, BLOCK_START, line, column, current));
        advanceTo(found + BLOCK_START.length());

        braceDepth = 1;
        lastType = TokenType.BLOCK_START;

        while (braceDepth > 0) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }

            Token token = scanToken();
            if (token.getType() == TokenType.ERROR) {
                tokens.add(token);
                skipToBlockEnd();
                break;
            }

            if (token.getType() == TokenType.LBRACE) {
                braceDepth++;
            } else if (token.getType() == TokenType.RBRACE) {
                braceDepth--;
                if (braceDepth == 0) {
                    // 块末尾的 '}' 只标记结束，不作为 token
                    break;
                }
            }
            tokens.add(token);
            lastType = token.getType();
        }

        tokens.add(new Token(TokenType.EOF, "", line, column, current));
        return tokens;
    }

    /** 最近一个块在输入中的起始偏移（含标记） */
    public int getConsumedStart() {
        return blockStart;
    }

    /** 最近一个块在输入中的结束偏移（不含） */
    public int getConsumedEnd() {
        return current;
    }

    /** 最近一个块的原始文本 */
    public String getBlockSource() {
        if (blockStart < 0) {
            return null;
        }
        return input.substring(blockStart, current);
    }

    // ============ 扫描 ============

    private Token scanToken() {
        start = current;
        startLine = line;
        startColumn = column;

        char c = advance();
        switch (c) {
            case '{': return makeToken(TokenType.LBRACE);
            case '}': return makeToken(TokenType.RBRACE);
            case '(': return makeToken(TokenType.LPAREN);
            case ')': return makeToken(TokenType.RPAREN);
            case ',': return makeToken(TokenType.COMMA);
            case ';': return makeToken(TokenType.SEMICOLON);
            case '.': return makeToken(TokenType.DOT);
            case '*': return makeToken(TokenType.MUL);
            case '/': return makeToken(TokenType.DIV);
            case '%': return makeToken(TokenType.MOD);
            case '+':
            case '-':
                if (isDigit(peek()) && !lastType.endsOperand()) {
                    return scanNumber();
                }
                return makeToken(c == '+' ? TokenType.PLUS : TokenType.MINUS);
            case '=':
                return makeToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
            case '!':
                return makeToken(match('=') ? TokenType.NE : TokenType.NOT);
            case '<':
                return makeToken(match('=') ? TokenType.LE : TokenType.LT);
            case '>':
                return makeToken(match('=') ? TokenType.GE : TokenType.GT);
            case '&':
                if (match('&')) return makeToken(TokenType.AND);
                return errorToken("Unexpected character '&'");
            case '|':
                if (match('|')) return makeToken(TokenType.OR);
                return errorToken("Unexpected character '|'");
            case '"':
            case '\'':
                return scanString(c);
            default:
                break;
        }

        if (isDigit(c)) {
            return scanNumber();
        }
        if (isIdentifierStart(c)) {
            return scanIdentifier();
        }
        return errorToken("Unexpected character '" + c + "'");
    }

    private Token scanString(char quote) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd()) {
            char c = advance();
            if (c == quote) {
                // 双写引号转义
                if (peek() == quote) {
                    advance();
                    sb.append(quote);
                    continue;
                }
                String value = sb.toString();
                return new Token(TokenType.STRING_LITERAL, value, value, startLine, startColumn, start);
            }
            if (c == '\\') {
                if (isAtEnd()) {
                    break;
                }
                char escaped = advance();
                switch (escaped) {
                    case 'n': sb.append('\n'); break;
                    case 'r': sb.append('\r'); break;
                    case 't': sb.append('\t'); break;
                    default: sb.append(escaped); break;  // \\ \" \' 以及其他字符
                }
                continue;
            }
            sb.append(c);
        }
        return new Token(TokenType.ERROR, input.substring(start, current), "Unterminated string",
                startLine, startColumn, start);
    }

    private Token scanNumber() {
        // 起始字符（数字或符号）已被消费
        while (isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        String text = input.substring(start, current);
        return new Token(TokenType.NUMBER_LITERAL, text, Double.parseDouble(text),
                startLine, startColumn, start);
    }

    private Token scanIdentifier() {
        while (isIdentifierPart(peek())) {
            advance();
        }
        String text = input.substring(start, current);
        String lower = text.toLowerCase(Locale.ROOT);

        Token compound = tryCompoundKeyword(lower);
        if (compound != null) {
            return compound;
        }

        TokenType type = KEYWORDS.get(lower);
        return makeToken(type != null ? type : TokenType.IDENTIFIER);
    }

    /**
     * 推测性读取双词关键词：跳过空白和注释后查看下一个单词，
     * 不构成已知组合时把游标精确回退到查看之前的位置。
     */
    private Token tryCompoundKeyword(String firstWord) {
        Map<String, TokenType> seconds = COMPOUND_KEYWORDS.get(firstWord);
        if (seconds == null) {
            return null;
        }

        int savedCurrent = current;
        int savedLine = line;
        int savedColumn = column;

        skipWhitespaceAndComments();
        String next = peekWord();
        if (next != null) {
            TokenType type = seconds.get(next.toLowerCase(Locale.ROOT));
            if (type != null) {
                for (int i = 0; i < next.length(); i++) {
                    advance();
                }
                return new Token(type, firstWord + " " + next.toLowerCase(Locale.ROOT),
                        startLine, startColumn, start);
            }
        }

        current = savedCurrent;
        line = savedLine;
        column = savedColumn;
        return null;
    }

    private String peekWord() {
        if (isAtEnd() || !isIdentifierStart(peek())) {
            return null;
        }
        int end = current;
        while (end < input.length() && isIdentifierPart(input.charAt(end))) {
            end++;
        }
        return input.substring(current, end);
    }

    // ============ 空白与注释 ============

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && peekNext() == '*') {
                advance();
                advance();
                while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
                    advance();
                }
                if (!isAtEnd()) {
                    advance();
                    advance();
                }
            } else {
                return;
            }
        }
    }

    /**
     * 词法错误后按原始文本跳到块的平衡 '}' 之后，保证游标总是停在块外。
     * 字符串和注释中的括号不计数。
     */
    private void skipToBlockEnd() {
        while (!isAtEnd() && braceDepth > 0) {
            char c = peek();
            if (c == '"' || c == '\'') {
                advance();
                skipRawString(c);
            } else if (c == '/' && (peekNext() == '/' || peekNext() == '*')) {
                skipWhitespaceAndComments();
            } else {
                advance();
                if (c == '{') {
                    braceDepth++;
                } else if (c == '}') {
                    braceDepth--;
                }
            }
        }
    }

    private void skipRawString(char quote) {
        while (!isAtEnd()) {
            char c = advance();
            if (c == '\\') {
                if (!isAtEnd()) advance();
            } else if (c == quote) {
                if (peek() == quote) {
                    advance();
                } else {
                    return;
                }
            }
        }
    }

    // ============ 基础方法 ============

    private Token makeToken(TokenType type) {
        return new Token(type, input.substring(start, current), startLine, startColumn, start);
    }

    private Token errorToken(String message) {
        return new Token(TokenType.ERROR, input.substring(start, current), message,
                startLine, startColumn, start);
    }

    private boolean isAtEnd() {
        return current >= input.length();
    }

    private char peek() {
        return isAtEnd() ? '\0' : input.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= input.length() ? '\0' : input.charAt(current + 1);
    }

    private boolean match(char expected) {
        if (peek() != expected) {
            return false;
        }
        advance();
        return true;
    }

    private char advance() {
        char c = input.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private void advanceTo(int target) {
        while (current < target && !isAtEnd()) {
            advance();
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
