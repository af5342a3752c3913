package com.lambdacalc.compiler.parser;

import com.lambdacalc.compiler.ast.Abstraction;
import com.lambdacalc.compiler.ast.Application;
import com.lambdacalc.compiler.ast.ChurchNumerals;
import com.lambdacalc.compiler.ast.Term;
import com.lambdacalc.compiler.ast.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.lambdacalc.compiler.ast.Term.apply;
import static com.lambdacalc.compiler.ast.Term.lambda;
import static com.lambdacalc.compiler.ast.Term.var;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Term parse(String source) {
        return Parser.parse(source);
    }

    @Nested
    @DisplayName("基本结构")
    class StructureTests {

        @Test
        @DisplayName("变量")
        void testVariable() {
            assertEquals(var("x"), parse("x"));
        }

        @Test
        @DisplayName("抽象体尽量向右延伸")
        void testAbstractionBody() {
            assertEquals(lambda("x", apply(var("x"), var("y"))), parse("λx.x y"));
        }

        @Test
        @DisplayName("嵌套抽象")
        void testNestedAbstraction() {
            assertEquals(lambda("x", lambda("y", var("x"))), parse("λx.λy.x"));
        }

        @Test
        @DisplayName("应用左结合")
        void testLeftAssociative() {
            Term t = parse("a b c");
            assertEquals(new Application(new Application(var("a"), var("b")), var("c")), t);
        }

        @Test
        @DisplayName("括号改变结合")
        void testParentheses() {
            assertEquals(new Application(var("a"), new Application(var("b"), var("c"))), parse("a (b c)"));
        }

        @Test
        @DisplayName("反斜杠是 λ 的别名")
        void testBackslash() {
            assertEquals(parse("λx.λy.x"), parse("\\x.\\y.x"));
        }

        @Test
        @DisplayName("末尾参数可以是不加括号的抽象")
        void testTrailingAbstraction() {
            assertEquals(apply(var("f"), lambda("x", var("x"))), parse("f λx.x"));
        }

        @Test
        @DisplayName("空白不影响结果")
        void testWhitespace() {
            assertEquals(parse("(λx.x) y"), parse("  (  λ x .  x )\n\ty "));
        }

        @Test
        @DisplayName("多余的括号被去掉")
        void testRedundantParens() {
            assertEquals(var("x"), parse("((x))"));
        }
    }

    @Nested
    @DisplayName("数字字面量")
    class NumberTests {

        @Test
        @DisplayName("数字解析为 Church 数")
        void testNumeral() {
            assertEquals(ChurchNumerals.encode(3), parse("3"));
            assertEquals(ChurchNumerals.encode(0), parse("0"));
        }

        @Test
        @DisplayName("数字可以作为参数")
        void testNumeralArgument() {
            Term t = parse("+ 2 3");
            assertEquals(apply(var("+"), ChurchNumerals.encode(2), ChurchNumerals.encode(3)), t);
        }

        @Test
        @DisplayName("- 是名字而不是负号")
        void testMinusIsName() {
            assertEquals(apply(var("-"), ChurchNumerals.encode(1)), parse("- 1"));
        }
    }

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @ParameterizedTest
        @ValueSource(strings = {"λ", "λx", "λx x", "(λx.x", "", ")", "x )", "λ.x", "()"})
        @DisplayName("非法输入抛出 ParseException")
        void testMalformed(String source) {
            assertThrows(ParseException.class, () -> parse(source));
        }

        @Test
        @DisplayName("错误包含位置和期望内容")
        void testErrorLocation() {
            ParseException e = assertThrows(ParseException.class, () -> parse("(λx.x"));
            assertEquals(1, e.getLine());
            assertEquals(6, e.getColumn());
            assertEquals("')'", e.getExpected());
            assertTrue(e.getMessage().contains("end of input"));
        }

        @Test
        @DisplayName("缺少点号")
        void testMissingDot() {
            ParseException e = assertThrows(ParseException.class, () -> parse("λx x"));
            assertEquals("'.' after λ parameter", e.getExpected());
            assertEquals("x", e.getToken().getLexeme());
            assertEquals(4, e.getColumn());
        }

        @Test
        @DisplayName("空输入")
        void testEmpty() {
            ParseException e = assertThrows(ParseException.class, () -> parse(""));
            assertTrue(e.getMessage().startsWith("Expected expression"));
        }

        @Test
        @DisplayName("完整表达式后多余的输入")
        void testTrailingInput() {
            ParseException e = assertThrows(ParseException.class, () -> parse("x )"));
            assertTrue(e.getMessage().startsWith("Unexpected input after expression"));
        }

        @Test
        @DisplayName("过大的数字")
        void testNumberTooLarge() {
            ParseException e = assertThrows(ParseException.class, () -> parse("f 99999999999"));
            assertTrue(e.getMessage().contains("too large"));
        }
    }

    @Test
    @DisplayName("解析结果与打印结果一致")
    void testPrintParseAgreement() {
        String[] sources = {"λx.x", "(λx.x) y", "f (g x)", "λf.λx.f (f x)", "λx.(λy.x)"};
        for (String s : sources) {
            Term t = parse(s);
            assertEquals(t, parse(t.toString()), s);
            assertTrue(t instanceof Variable || t instanceof Abstraction || t instanceof Application);
        }
    }
}
