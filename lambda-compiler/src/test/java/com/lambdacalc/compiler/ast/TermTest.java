package com.lambdacalc.compiler.ast;

import com.lambdacalc.compiler.InvariantViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.lambdacalc.compiler.ast.Term.apply;
import static com.lambdacalc.compiler.ast.Term.lambda;
import static com.lambdacalc.compiler.ast.Term.var;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Term 值语义测试
 */
class TermTest {

    @Test
    @DisplayName("结构相等与哈希一致")
    void testStructuralEquality() {
        Term a = lambda("x", apply(var("x"), var("y")));
        Term b = lambda("x", apply(var("x"), var("y")));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, lambda("z", apply(var("z"), var("y"))));
    }

    @Test
    @DisplayName("空名字和 null 子项违反约束")
    void testInvariants() {
        assertThrows(InvariantViolationException.class, () -> var(""));
        assertThrows(InvariantViolationException.class, () -> var(null));
        assertThrows(InvariantViolationException.class, () -> lambda("", var("x")));
        assertThrows(InvariantViolationException.class, () -> lambda("x", null));
        assertThrows(InvariantViolationException.class, () -> new Application(var("f"), null));
    }

    @Test
    @DisplayName("β-redex 判定")
    void testBetaRedex() {
        assertTrue(new Application(lambda("x", var("x")), var("y")).isBetaRedex());
        assertFalse(new Application(var("f"), var("y")).isBetaRedex());
    }

    @Test
    @DisplayName("深层项的相等比较不会栈溢出")
    void testDeepEquality() {
        Term a = var("x");
        Term b = var("x");
        for (int i = 0; i < 100_000; i++) {
            a = lambda("x" + (i % 7), a);
            b = lambda("x" + (i % 7), b);
        }
        assertEquals(a, b);
    }
}
