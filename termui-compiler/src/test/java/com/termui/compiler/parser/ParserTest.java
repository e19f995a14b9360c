package com.termui.compiler.parser;

import com.termui.compiler.ast.Program;
import com.termui.compiler.ast.expr.*;
import com.termui.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.termui.compiler.ast.stmt.*;
import com.termui.compiler.lexer.Lexer;
import com.termui.compiler.lexer.Token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private List<Token> lex(String body) {
        return new Lexer(Lexer.BLOCK_START + body + "}").nextBlock();
    }

    private Program parse(String body) {
        return new Parser(lex(body), "<test>").parse();
    }

    private ParseResult parseTolerant(String body) {
        return new Parser(lex(body), "<test>").parseTolerant();
    }

    private Statement single(String body) {
        Program program = parse(body);
        assertEquals(1, program.getStatements().size(), "Expected single statement from: " + body);
        return program.getStatements().get(0);
    }

    private Expression expr(String body) {
        Statement stmt = single(body);
        assertTrue(stmt instanceof ExpressionStmt, "Expected expression statement");
        return ((ExpressionStmt) stmt).getExpression();
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("带初始值的变量声明")
        void testVarDecl() {
            VarDeclStmt decl = (VarDeclStmt) single("var x = 10");
            assertEquals("x", decl.getName());
            assertTrue(decl.getInitializer() instanceof Literal);
        }

        @Test
        @DisplayName("无初始值的变量声明")
        void testVarDeclWithoutInit() {
            VarDeclStmt decl = (VarDeclStmt) single("var x;");
            assertFalse(decl.hasInitializer());
        }

        @Test
        @DisplayName("分号可选，语句在关键词边界结束")
        void testOptionalTerminators() {
            Program program = parse("var a = 1 var b = 2; a = b");
            assertEquals(3, program.getStatements().size());
            assertTrue(program.getStatements().get(2) instanceof AssignStmt);
        }

        @Test
        @DisplayName("标识符赋值")
        void testAssignIdentifier() {
            AssignStmt assign = (AssignStmt) single("x = x + 1");
            assertTrue(assign.getTarget() instanceof Identifier);
            assertTrue(assign.getValue() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("成员赋值")
        void testAssignMember() {
            AssignStmt assign = (AssignStmt) single("Canvas.title = \"hi\"");
            MemberExpr target = (MemberExpr) assign.getTarget();
            assertEquals("title", target.getMember());
        }

        @Test
        @DisplayName("非法赋值目标是语法错误")
        void testInvalidAssignTarget() {
            ParseException e = assertThrows(ParseException.class, () -> parse("f() = 1"));
            assertEquals("Invalid assignment target", e.getRawMessage());
            assertThrows(ParseException.class, () -> parse("1 = 2"));
        }

        @Test
        @DisplayName("if / else if / else")
        void testIfChain() {
            IfStmt stmt = (IfStmt) single(
                    "if x > 1 then a = 1 else if x > 0 then a = 2 else if x == 0 then a = 3 else a = 4 end if");
            assertEquals(1, stmt.getThenBranch().size());
            assertEquals(2, stmt.getElseIfBranches().size());
            assertTrue(stmt.hasElse());
            assertEquals(1, stmt.getElseBranch().size());
        }

        @Test
        @DisplayName("if 条件的括号可选")
        void testIfParenthesized() {
            IfStmt stmt = (IfStmt) single("if (x > 1) then y = 1 end if");
            assertTrue(stmt.getCondition() instanceof GroupExpr);
            assertFalse(stmt.hasElse());
        }

        @Test
        @DisplayName("缺少 end if 是语法错误")
        void testMissingEndIf() {
            ParseException e = assertThrows(ParseException.class, () -> parse("if x then y = 1"));
            assertEquals("Expected 'end if'", e.getRawMessage());
        }

        @Test
        @DisplayName("缺少 then 是语法错误")
        void testMissingThen() {
            ParseException e = assertThrows(ParseException.class, () -> parse("if x y = 1 end if"));
            assertEquals("Expected 'then' after if condition", e.getRawMessage());
        }

        @Test
        @DisplayName("while 循环")
        void testWhile() {
            WhileStmt stmt = (WhileStmt) single("while i < 5 do i = i + 1 end while");
            assertTrue(stmt.getCondition() instanceof BinaryExpr);
            assertEquals(1, stmt.getBody().size());
        }

        @Test
        @DisplayName("缺少 do / end while 是语法错误")
        void testMalformedWhile() {
            assertThrows(ParseException.class, () -> parse("while i < 5 i = 1 end while"));
            assertThrows(ParseException.class, () -> parse("while i < 5 do i = 1"));
        }

        @Test
        @DisplayName("嵌套控制结构")
        void testNested() {
            WhileStmt loop = (WhileStmt) single("while a do if b then c() end if end while");
            assertTrue(loop.getBody().get(0) instanceof IfStmt);
        }

        @Test
        @DisplayName("return 的值可选")
        void testReturn() {
            ReturnStmt withValue = (ReturnStmt) single("return 1 + 2");
            assertTrue(withValue.hasValue());

            Program program = parse("return var x = 1");
            ReturnStmt bare = (ReturnStmt) program.getStatements().get(0);
            assertFalse(bare.hasValue());
            assertEquals(2, program.getStatements().size());
        }

        @Test
        @DisplayName("return 在 end if 前不带值")
        void testReturnBeforeEndIf() {
            IfStmt stmt = (IfStmt) single("if x then return end if");
            assertFalse(((ReturnStmt) stmt.getThenBranch().get(0)).hasValue());
        }

        @Test
        @DisplayName("空块")
        void testEmpty() {
            assertTrue(parse("").isEmpty());
            assertTrue(parse(" ; ; ").isEmpty());
        }

        @Test
        @DisplayName("没有前导 BLOCK_START 的 token 列表也可解析")
        void testWithoutBlockStart() {
            List<Token> tokens = lex("x = 1");
            Program program = new Parser(tokens.subList(1, tokens.size())).parse();
            assertEquals(1, program.getStatements().size());
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr add = (BinaryExpr) expr("10 + 5 * 2");
            assertEquals(BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryOp.MUL, ((BinaryExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("左结合")
        void testLeftAssociative() {
            BinaryExpr sub = (BinaryExpr) expr("10 - 3 - 2");
            assertTrue(sub.getLeft() instanceof BinaryExpr);
            assertTrue(sub.getRight() instanceof Literal);
        }

        @Test
        @DisplayName("逻辑运算优先级: or 最低，and 次之")
        void testLogicalPrecedence() {
            BinaryExpr or = (BinaryExpr) expr("a or b and c == d");
            assertEquals(BinaryOp.OR, or.getOperator());
            BinaryExpr and = (BinaryExpr) or.getRight();
            assertEquals(BinaryOp.AND, and.getOperator());
            assertEquals(BinaryOp.EQ, ((BinaryExpr) and.getRight()).getOperator());
        }

        @Test
        @DisplayName("比较高于相等")
        void testComparisonOverEquality() {
            BinaryExpr eq = (BinaryExpr) expr("a < b == c >= d");
            assertEquals(BinaryOp.EQ, eq.getOperator());
            assertEquals(BinaryOp.LT, ((BinaryExpr) eq.getLeft()).getOperator());
            assertEquals(BinaryOp.GE, ((BinaryExpr) eq.getRight()).getOperator());
        }

        @Test
        @DisplayName("一元运算")
        void testUnary() {
            UnaryExpr not = (UnaryExpr) expr("not x");
            assertEquals(UnaryExpr.UnaryOp.NOT, not.getOperator());
            UnaryExpr neg = (UnaryExpr) expr("-x");
            assertEquals(UnaryExpr.UnaryOp.NEGATE, neg.getOperator());
            UnaryExpr bang = (UnaryExpr) expr("!!x");
            assertTrue(bang.getOperand() instanceof UnaryExpr);
        }

        @Test
        @DisplayName("括号改变优先级")
        void testGrouping() {
            BinaryExpr mul = (BinaryExpr) expr("(1 + 2) * 3");
            assertEquals(BinaryOp.MUL, mul.getOperator());
            assertTrue(mul.getLeft() instanceof GroupExpr);
        }

        @Test
        @DisplayName("字面量")
        void testLiterals() {
            assertEquals(42.0, ((Literal) expr("42")).getValue());
            assertEquals("s", ((Literal) expr("'s'")).getValue());
            assertEquals(Boolean.TRUE, ((Literal) expr("true")).getValue());
            assertEquals(Literal.LiteralKind.NULL, ((Literal) expr("null")).getKind());
        }

        @Test
        @DisplayName("后缀链 a.b.c(x).d")
        void testPostfixChain() {
            MemberExpr d = (MemberExpr) expr("a.b.c(x).d");
            assertEquals("d", d.getMember());
            CallExpr call = (CallExpr) d.getTarget();
            assertTrue(call.isMethodCall());
            assertEquals(1, call.getArgs().size());
            MemberExpr c = (MemberExpr) call.getCallee();
            assertEquals("c", c.getMember());
            MemberExpr b = (MemberExpr) c.getTarget();
            assertEquals("b", b.getMember());
            assertEquals("a", ((Identifier) b.getTarget()).getName());
        }

        @Test
        @DisplayName("自由函数调用与多参数")
        void testFreeCall() {
            CallExpr call = (CallExpr) expr("max(1, 2, 3)");
            assertFalse(call.isMethodCall());
            assertEquals(3, call.getArgs().size());
            assertEquals(0, ((CallExpr) expr("f()")).getArgs().size());
        }

        @Test
        @DisplayName("成员名可以是关键词")
        void testKeywordMemberName() {
            MemberExpr member = (MemberExpr) expr("Sound.do");
            assertEquals("do", member.getMember());
        }

        @Test
        @DisplayName("节点携带位置信息")
        void testLocations() {
            Statement stmt = parse("\n  var x = 1").getStatements().get(0);
            assertEquals(2, stmt.getLocation().getLine());
            assertEquals(3, stmt.getLocation().getColumn());
            assertEquals("<test>", stmt.getLocation().getFile());
            assertEquals("<test>", stmt.getSourceName());
        }
    }

    // ============ 嵌套深度 ============

    @Nested
    @DisplayName("嵌套深度")
    class NestingTests {

        private String nested(String open, String inner, String close, int depth) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < depth; i++) sb.append(open);
            sb.append(inner);
            for (int i = 0; i < depth; i++) sb.append(close);
            return sb.toString();
        }

        @Test
        @DisplayName("适度嵌套的括号正常解析")
        void testModerateNesting() {
            Expression e = expr(nested("(", "1", ")", 100));
            assertTrue(e instanceof GroupExpr);
        }

        @Test
        @DisplayName("过深的括号报语法错误而不是栈溢出")
        void testDeepParens() {
            String body = "x = " + nested("(", "1", ")", 20000);
            ParseException e = assertThrows(ParseException.class, () -> parse(body));
            assertEquals("Expression nested too deeply", e.getRawMessage());
        }

        @Test
        @DisplayName("过长的一元运算符链同样受限")
        void testDeepUnary() {
            StringBuilder sb = new StringBuilder("x = ");
            for (int i = 0; i < 20000; i++) sb.append("not ");
            sb.append("true");
            String body = sb.toString();
            ParseException e = assertThrows(ParseException.class, () -> parse(body));
            assertEquals("Expression nested too deeply", e.getRawMessage());
        }

        @Test
        @DisplayName("过深的 if 嵌套同样受限")
        void testDeepIf() {
            String body = nested("if true then ", "x = 1 ", "end if ", 5000);
            ParseException e = assertThrows(ParseException.class, () -> parse(body));
            assertEquals("Expression nested too deeply", e.getRawMessage());
        }

        @Test
        @DisplayName("容错解析在深度错误后继续下一条语句")
        void testTolerantRecovery() {
            ParseResult result = parseTolerant("var p = " + nested("(", "1", ")", 5000) + "; var q = 2");
            assertEquals(1, result.getErrors().size());
            assertThat(result.getErrors().get(0).getMessage()).startsWith("Expression nested too deeply");
            assertEquals(1, result.getProgram().getStatements().size());
            assertEquals("q", ((VarDeclStmt) result.getProgram().getStatements().get(0)).getName());
        }

        @Test
        @DisplayName("长的左结合链不计入嵌套深度")
        void testLongChainIsFlat() {
            StringBuilder sb = new StringBuilder("x = 1");
            for (int i = 0; i < 5000; i++) sb.append(" + 1");
            AssignStmt stmt = (AssignStmt) single(sb.toString());
            assertTrue(stmt.getValue() instanceof BinaryExpr);
        }
    }

    // ============ 容错解析 ============

    @Nested
    @DisplayName("容错解析")
    class TolerantParsingTests {

        @Test
        @DisplayName("单条错误语句不影响后续语句")
        void testRecoversAfterBadStatement() {
            ParseResult result = parseTolerant("var a = 1 var = 2 var b = 3");
            assertTrue(result.hasErrors());
            assertEquals(1, result.getErrors().size());
            assertThat(result.getProgram().getStatements())
                    .hasSize(2)
                    .allMatch(s -> s instanceof VarDeclStmt);
        }

        @Test
        @DisplayName("同步到分号之后")
        void testSyncOnSemicolon() {
            ParseResult result = parseTolerant("x = ) ; y = 2");
            assertEquals(1, result.getErrors().size());
            assertEquals(1, result.getProgram().getStatements().size());
            assertTrue(result.getProgram().getStatements().get(0) instanceof AssignStmt);
        }

        @Test
        @DisplayName("错误包含位置")
        void testErrorLocation() {
            ParseResult result = parseTolerant("\nvar = 1");
            ParseError error = result.getErrors().get(0);
            assertEquals(2, error.getLine());
            assertThat(error.getMessage()).contains("Expected variable name");
            assertEquals("<test>", error.getSourceName());
            assertEquals(Lexer.BLOCK_START.length() + 5, error.getOffset());
            assertThat(error.toString()).startsWith("<test>:2:5: Expected variable name");
        }

        @Test
        @DisplayName("词法错误作为语法错误报告")
        void testLexicalErrorReported() {
            ParseResult result = parseTolerant("var a = 1 var b = @");
            assertEquals(1, result.getErrors().size());
            assertThat(result.getErrors().get(0).getMessage()).startsWith("Unexpected character '@'");
            assertEquals(1, result.getProgram().getStatements().size());
        }

        @Test
        @DisplayName("严格解析遇到错误即抛出")
        void testStrictThrows() {
            assertThrows(ParseException.class, () -> parse("var a = 1 var = 2"));
        }

        @Test
        @DisplayName("无错误时结果为空错误列表")
        void testNoErrors() {
            ParseResult result = parseTolerant("var a = 1");
            assertFalse(result.hasErrors());
        }
    }
}
