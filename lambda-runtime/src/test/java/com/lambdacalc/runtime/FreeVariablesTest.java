package com.lambdacalc.runtime;

import com.lambdacalc.compiler.ast.Term;
import com.lambdacalc.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.lambdacalc.compiler.ast.Term.lambda;
import static com.lambdacalc.compiler.ast.Term.var;
import static org.assertj.core.api.Assertions.assertThat;

class FreeVariablesTest {

    @Test
    @DisplayName("抽象绑定的变量不自由")
    void boundVariablesAreRemoved() {
        assertThat(FreeVariables.of(Parser.parse("λx.λy.x y z"))).containsExactly("z");
    }

    @Test
    @DisplayName("同名变量在绑定外仍是自由的")
    void freeOutsideBinder() {
        assertThat(FreeVariables.of(Parser.parse("x (λx.x) y")))
                .containsExactlyInAnyOrder("x", "y");
    }

    @Test
    @DisplayName("内层遮蔽结束后恢复外层绑定")
    void shadowing() {
        assertThat(FreeVariables.of(Parser.parse("λx.(λx.x) x w"))).containsExactly("w");
    }

    @Test
    @DisplayName("闭项与 occursFree")
    void closedTerms() {
        assertThat(FreeVariables.isClosed(Parser.parse("λx.λy.x"))).isTrue();
        assertThat(FreeVariables.isClosed(Parser.parse("λx.y"))).isFalse();
        assertThat(FreeVariables.occursFree("y", Parser.parse("λx.y"))).isTrue();
        assertThat(FreeVariables.occursFree("x", Parser.parse("λx.y"))).isFalse();
    }

    @Test
    @DisplayName("深层嵌套不会栈溢出")
    void deepTerm() {
        Term t = var("free");
        for (int i = 0; i < 100_000; i++) {
            t = lambda("v" + i, t);
        }
        assertThat(FreeVariables.of(t)).containsExactly("free");
    }
}
