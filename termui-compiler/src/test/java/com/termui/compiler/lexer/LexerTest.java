package com.termui.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 把代码包进一个块并扫描，返回去掉 BLOCK_START 和 EOF 的 token */
    private List<Token> tokens(String body) {
        List<Token> block = new Lexer(Lexer.BLOCK_START + body + "}").nextBlock();
        assertNotNull(block, "Expected a block");
        return block.stream()
                .filter(t -> t.getType() != TokenType.BLOCK_START && t.getType() != TokenType.EOF)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String body) {
        return tokens(body).stream().map(Token::getType).collect(Collectors.toList());
    }

    /** 断言单个 token 的类型 */
    private void assertSingleToken(String body, TokenType expected) {
        List<Token> toks = tokens(body);
        assertEquals(1, toks.size(), "Expected single token from: " + body);
        assertEquals(expected, toks.get(0).getType());
    }

    /** 断言单个 token 的类型和字面量 */
    private void assertSingleToken(String body, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = tokens(body);
        assertEquals(1, toks.size(), "Expected single token from: " + body);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    // ================================================================
    // 块提取
    // ================================================================

    @Nested
    @DisplayName("块提取")
    class BlockExtractionTests {

        @Test
        @DisplayName("没有块时返回 null")
        void testNoBlock() {
            assertNull(new Lexer("just some terminal output").nextBlock());
            assertNull(new Lexer("").nextBlock());
            assertNull(new Lexer(null).nextBlock());
        }

        @Test
        @DisplayName("块以 BLOCK_START 开头、EOF 结尾，末尾的 '}' 不输出")
        void testBlockShape() {
            List<Token> block = new Lexer("#UI{ x }").nextBlock();
            assertEquals(3, block.size());
            assertEquals(TokenType.BLOCK_START, block.get(0).getType());
            assertEquals(TokenType.IDENTIFIER, block.get(1).getType());
            assertEquals(TokenType.EOF, block.get(2).getType());
        }

        @Test
        @DisplayName("多个块按出现顺序逐个提取")
        void testMultipleBlocks() {
            Lexer lexer = new Lexer("a #UI{ first } b #UI{ second } c");
            List<Token> one = lexer.nextBlock();
            List<Token> two = lexer.nextBlock();
            assertEquals("first", one.get(1).getLexeme());
            assertEquals("second", two.get(1).getLexeme());
            assertNull(lexer.nextBlock());
        }

        @Test
        @DisplayName("嵌套括号成对输出，外层结束括号不输出")
        void testNestedBraces() {
            String input = "#UI{ { x } }after";
            Lexer lexer = new Lexer(input);
            List<Token> block = lexer.nextBlock();
            assertEquals(TokenType.LBRACE, block.get(1).getType());
            assertEquals(TokenType.IDENTIFIER, block.get(2).getType());
            assertEquals(TokenType.RBRACE, block.get(3).getType());
            assertEquals(TokenType.EOF, block.get(4).getType());
            assertEquals(input.indexOf("after"), lexer.getConsumedEnd());
        }

        @Test
        @DisplayName("字符串中的括号不影响块边界")
        void testBraceInsideString() {
            String input = "#UI{ var s = \"}{\" }rest";
            Lexer lexer = new Lexer(input);
            List<Token> block = lexer.nextBlock();
            assertEquals(TokenType.STRING_LITERAL, block.get(4).getType());
            assertEquals("}{", block.get(4).getLexeme());
            assertEquals(input.indexOf("rest"), lexer.getConsumedEnd());
        }

        @Test
        @DisplayName("块范围与原始文本")
        void testConsumedRange() {
            String input = "pre #UI{ x = 1 } post";
            Lexer lexer = new Lexer(input);
            lexer.nextBlock();
            assertEquals(4, lexer.getConsumedStart());
            assertEquals("#UI{ x = 1 }", lexer.getBlockSource());
        }

        @Test
        @DisplayName("未闭合的块读到输入末尾")
        void testUnterminatedBlock() {
            String input = "#UI{ x";
            Lexer lexer = new Lexer(input);
            List<Token> block = lexer.nextBlock();
            assertEquals(TokenType.IDENTIFIER, block.get(1).getType());
            assertEquals(TokenType.EOF, block.get(2).getType());
            assertEquals(input.length(), lexer.getConsumedEnd());
        }

        @Test
        @DisplayName("行号列号")
        void testLineAndColumn() {
            List<Token> block = new Lexer("#UI{\n  var x }").nextBlock();
            Token var = block.get(1);
            assertEquals(TokenType.KW_VAR, var.getType());
            assertEquals(2, var.getLine());
            assertEquals(3, var.getColumn());
        }
    }

    // ================================================================
    // 操作符与分隔符
    // ================================================================

    @Nested
    @DisplayName("操作符与分隔符")
    class OperatorTests {

        @Test
        @DisplayName("单字符 token")
        void testSingleChars() {
            assertSingleToken("(", TokenType.LPAREN);
            assertSingleToken(")", TokenType.RPAREN);
            assertSingleToken(",", TokenType.COMMA);
            assertSingleToken(";", TokenType.SEMICOLON);
            assertSingleToken(".", TokenType.DOT);
            assertSingleToken("*", TokenType.MUL);
            assertSingleToken("/", TokenType.DIV);
            assertSingleToken("%", TokenType.MOD);
            assertSingleToken("=", TokenType.ASSIGN);
        }

        @Test
        @DisplayName("比较操作符")
        void testComparison() {
            assertSingleToken("==", TokenType.EQ);
            assertSingleToken("!=", TokenType.NE);
            assertSingleToken("<", TokenType.LT);
            assertSingleToken(">", TokenType.GT);
            assertSingleToken("<=", TokenType.LE);
            assertSingleToken(">=", TokenType.GE);
        }

        @Test
        @DisplayName("逻辑操作符的两种写法")
        void testLogicalAliases() {
            assertSingleToken("&&", TokenType.AND);
            assertSingleToken("and", TokenType.AND);
            assertSingleToken("||", TokenType.OR);
            assertSingleToken("OR", TokenType.OR);
            assertSingleToken("!", TokenType.NOT);
            assertSingleToken("not", TokenType.NOT);
        }

        @Test
        @DisplayName("单独的 & 和 | 是词法错误")
        void testLoneAmpersand() {
            List<Token> toks = tokens("a & b");
            assertEquals(TokenType.ERROR, toks.get(toks.size() - 1).getType());
            assertEquals("Unexpected character '&'", toks.get(toks.size() - 1).getLiteral());

            toks = tokens("a | b");
            assertEquals(TokenType.ERROR, toks.get(toks.size() - 1).getType());
        }
    }

    // ================================================================
    // 字面量
    // ================================================================

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数与小数")
        void testNumbers() {
            assertSingleToken("42", TokenType.NUMBER_LITERAL, 42.0);
            assertSingleToken("3.14", TokenType.NUMBER_LITERAL, 3.14);
        }

        @Test
        @DisplayName("小数点后没有数字时是成员访问的点")
        void testTrailingDot() {
            assertEquals(List.of(TokenType.NUMBER_LITERAL, TokenType.DOT), types("1."));
        }

        @Test
        @DisplayName("负号在操作数之后是减法，否则是数值符号")
        void testSignedNumbers() {
            List<Token> assign = tokens("x = -1");
            assertEquals(TokenType.NUMBER_LITERAL, assign.get(2).getType());
            assertEquals(-1.0, assign.get(2).getLiteral());

            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.MINUS, TokenType.NUMBER_LITERAL), types("i -1"));
            assertEquals(List.of(TokenType.NUMBER_LITERAL, TokenType.MINUS, TokenType.NUMBER_LITERAL), types("5-3"));
            assertEquals(List.of(TokenType.LPAREN, TokenType.NUMBER_LITERAL, TokenType.RPAREN), types("(-2)"));
            assertEquals(List.of(TokenType.RPAREN, TokenType.PLUS, TokenType.NUMBER_LITERAL), types(")+2"));
        }

        @Test
        @DisplayName("双引号与单引号字符串")
        void testStrings() {
            assertSingleToken("\"hello\"", TokenType.STRING_LITERAL, "hello");
            assertSingleToken("'hello'", TokenType.STRING_LITERAL, "hello");
        }

        @Test
        @DisplayName("反斜杠转义")
        void testBackslashEscapes() {
            assertSingleToken("\"a\\nb\"", TokenType.STRING_LITERAL, "a\nb");
            assertSingleToken("\"tab\\there\"", TokenType.STRING_LITERAL, "tab\there");
            assertSingleToken("\"q\\\"q\"", TokenType.STRING_LITERAL, "q\"q");
            assertSingleToken("'it\\'s'", TokenType.STRING_LITERAL, "it's");
            assertSingleToken("\"back\\\\slash\"", TokenType.STRING_LITERAL, "back\\slash");
        }

        @Test
        @DisplayName("双写引号转义")
        void testDoubledQuotes() {
            assertSingleToken("'it''s'", TokenType.STRING_LITERAL, "it's");
            assertSingleToken("\"say \"\"hi\"\"\"", TokenType.STRING_LITERAL, "say \"hi\"");
        }

        @Test
        @DisplayName("未闭合的字符串是词法错误")
        void testUnterminatedString() {
            List<Token> block = new Lexer("#UI{ \"abc").nextBlock();
            Token error = block.get(1);
            assertEquals(TokenType.ERROR, error.getType());
            assertEquals("Unterminated string", error.getLiteral());
            assertEquals(TokenType.EOF, block.get(2).getType());
        }
    }

    // ================================================================
    // 关键词
    // ================================================================

    @Nested
    @DisplayName("关键词")
    class KeywordTests {

        @Test
        @DisplayName("保留字不区分大小写")
        void testCaseInsensitiveKeywords() {
            assertSingleToken("var", TokenType.KW_VAR);
            assertSingleToken("VAR", TokenType.KW_VAR);
            assertSingleToken("If", TokenType.KW_IF);
            assertSingleToken("THEN", TokenType.KW_THEN);
            assertSingleToken("While", TokenType.KW_WHILE);
            assertSingleToken("do", TokenType.KW_DO);
            assertSingleToken("return", TokenType.KW_RETURN);
            assertSingleToken("TRUE", TokenType.KW_TRUE);
            assertSingleToken("false", TokenType.KW_FALSE);
            assertSingleToken("Null", TokenType.KW_NULL);
        }

        @Test
        @DisplayName("标识符区分大小写并保留原文")
        void testIdentifiers() {
            List<Token> toks = tokens("myVar _tmp x2");
            assertEquals("myVar", toks.get(0).getLexeme());
            assertEquals("_tmp", toks.get(1).getLexeme());
            assertEquals("x2", toks.get(2).getLexeme());
        }

        @Test
        @DisplayName("end if / end while / else if 识别为单个 token")
        void testCompoundKeywords() {
            assertSingleToken("end if", TokenType.KW_END_IF);
            assertSingleToken("END   WHILE", TokenType.KW_END_WHILE);
            assertSingleToken("else if", TokenType.KW_ELSE_IF);
            assertSingleToken("end\n  if", TokenType.KW_END_IF);
            assertSingleToken("end /* gap */ if", TokenType.KW_END_IF);
        }

        @Test
        @DisplayName("双词关键词的 lexeme 为规范形式")
        void testCompoundLexeme() {
            assertEquals("end if", tokens("END IF").get(0).getLexeme());
        }

        @Test
        @DisplayName("单独的 end 是普通标识符，不吞掉后续单词")
        void testBareEnd() {
            assertSingleToken("end", TokenType.IDENTIFIER);
            List<Token> toks = tokens("end x");
            assertEquals(2, toks.size());
            assertEquals(TokenType.IDENTIFIER, toks.get(0).getType());
            assertEquals("x", toks.get(1).getLexeme());
        }

        @Test
        @DisplayName("else 后不是 if 时回退")
        void testElseNotFollowedByIf() {
            assertEquals(List.of(TokenType.KW_ELSE, TokenType.KW_VAR, TokenType.IDENTIFIER), types("else var y"));
            assertEquals(List.of(TokenType.KW_ELSE, TokenType.IDENTIFIER), types("else iffy"));
        }

        @Test
        @DisplayName("回退后位置信息精确")
        void testRewindKeepsPositions() {
            List<Token> toks = tokens("end x");
            assertEquals(1, toks.get(1).getLine());
            assertEquals(9, toks.get(1).getColumn());
        }

        @Test
        @DisplayName("关键词集合")
        void testKeywordSet() {
            assertTrue(Lexer.getKeywords().contains("while"));
            assertFalse(Lexer.getKeywords().contains("end"));
        }
    }

    // ================================================================
    // 注释与错误恢复
    // ================================================================

    @Nested
    @DisplayName("注释与错误")
    class CommentAndErrorTests {

        @Test
        @DisplayName("行注释和块注释被跳过")
        void testComments() {
            assertSingleToken("// comment\n x", TokenType.IDENTIFIER);
            assertSingleToken("/* { not a brace */ x", TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("未知字符产生错误 token 并终止该块")
        void testUnknownCharacter() {
            List<Token> block = new Lexer("#UI{ x @ y }").nextBlock();
            assertEquals(TokenType.IDENTIFIER, block.get(1).getType());
            assertEquals(TokenType.ERROR, block.get(2).getType());
            assertEquals("Unexpected character '@'", block.get(2).getLiteral());
            assertEquals(TokenType.EOF, block.get(3).getType());
        }

        @Test
        @DisplayName("错误后仍跳到块结束，后续块正常提取")
        void testErrorSkipsToBlockEnd() {
            String input = "#UI{ x @ { \"}\" } y } tail #UI{ ok }";
            Lexer lexer = new Lexer(input);
            lexer.nextBlock();
            assertEquals(input.indexOf(" tail"), lexer.getConsumedEnd());
            List<Token> next = lexer.nextBlock();
            assertEquals("ok", next.get(1).getLexeme());
        }
    }
}
