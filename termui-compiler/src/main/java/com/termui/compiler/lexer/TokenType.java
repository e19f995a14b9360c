package com.termui.compiler.lexer;

/**
 * UI 脚本词法单元类型
 */
public enum TokenType {
    // === 块标记 ===
    BLOCK_START,    // #UI{
    LBRACE,         // { (块内嵌套)
    RBRACE,         // }

    // === 字面量 ===
    NUMBER_LITERAL,
    STRING_LITERAL,

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 ===
    KW_VAR,
    KW_IF, KW_THEN, KW_ELSE, KW_ELSE_IF, KW_END_IF,
    KW_WHILE, KW_DO, KW_END_WHILE,
    KW_RETURN,
    KW_TRUE, KW_FALSE, KW_NULL,

    // === 操作符 - 逻辑（and / &&, or / ||, not / !） ===
    AND,
    OR,
    NOT,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 赋值 ===
    ASSIGN,         // =

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    COMMA,          // ,
    DOT,            // .
    SEMICOLON,      // ;

    // === 特殊 ===
    EOF,
    ERROR;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为双词关键词（end if / end while / else if）
     */
    public boolean isCompoundKeyword() {
        return this == KW_ELSE_IF || this == KW_END_IF || this == KW_END_WHILE;
    }

    /**
     * 该 token 之后出现的 '-' 视为二元减号而不是数值符号
     */
    public boolean endsOperand() {
        switch (this) {
            case NUMBER_LITERAL:
            case STRING_LITERAL:
            case IDENTIFIER:
            case KW_TRUE:
            case KW_FALSE:
            case KW_NULL:
            case RPAREN:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为比较操作符
     */
    public boolean isComparisonOp() {
        switch (this) {
            case LT:
            case GT:
            case LE:
            case GE:
                return true;
            default:
                return false;
        }
    }
}
