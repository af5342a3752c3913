package com.lambdacalc.cli;

import com.lambdacalc.cli.config.ConfigStore;
import com.lambdacalc.cli.config.LambdaConfig;
import com.lambdacalc.runtime.PrimitiveTable;
import com.lambdacalc.runtime.Reducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ReplRunnerTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();
    private LambdaConfig config;
    private ConfigStore store;
    private ReplRunner repl;

    @BeforeEach
    void setUp() {
        config = new LambdaConfig();
        config.setColorParens(false);
        store = new ConfigStore(tempDir.resolve("config.json"));
        repl = new ReplRunner(config, store, new Reducer(PrimitiveTable.standard()),
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("求值")
    class Evaluation {

        @Test
        @DisplayName("输入表达式打印归约过程")
        void evaluatesExpression() {
            assertThat(repl.handleLine("(λx.x) y")).isTrue();
            assertThat(out()).contains("Step 1 (β): y");
        }

        @Test
        @DisplayName("未闭合括号进入多行模式")
        void multiline() {
            assertThat(repl.handleLine("((λx.x)")).isTrue();
            assertThat(out()).isEmpty();
            repl.handleLine(" y)");
            assertThat(out()).contains("Step 1 (β): y");
        }

        @Test
        @DisplayName("语法错误不退出")
        void syntaxError() {
            assertThat(repl.handleLine("λx x")).isTrue();
            assertThat(err()).contains("语法错误");
        }

        @Test
        @DisplayName("空行被忽略")
        void blankLine() {
            assertThat(repl.handleLine("   ")).isTrue();
            assertThat(out()).isEmpty();
        }
    }

    @Nested
    @DisplayName("命令")
    class Commands {

        @Test
        @DisplayName(":quit 退出")
        void quit() {
            assertThat(repl.handleLine(":quit")).isFalse();
            assertThat(repl.handleLine(":q")).isFalse();
        }

        @Test
        @DisplayName(":eq 判断 α 等价")
        void alphaEquivalence() {
            repl.handleLine(":eq λx.x ; λy.y");
            repl.handleLine(":eq λx.λy.x ; λx.λy.y");
            assertThat(out()).contains("α-等价", "不等价");
        }

        @Test
        @DisplayName(":eq 缺少分隔符")
        void alphaEquivalenceUsage() {
            repl.handleLine(":eq λx.x");
            assertThat(err()).contains("用法");
        }

        @Test
        @DisplayName("开关命令修改配置")
        void toggles() {
            repl.handleLine(":compact");
            repl.handleLine(":color");
            repl.handleLine(":diff");
            assertThat(config.isCompact()).isFalse();
            assertThat(config.isColorParens()).isTrue();
            assertThat(config.isColorDiff()).isTrue();
        }

        @Test
        @DisplayName(":limit 设置步数上限")
        void limit() {
            repl.handleLine(":limit 3");
            assertThat(config.getRecursionLimit()).isEqualTo(3);
            assertThat(out()).contains("步数上限: 3");

            repl.handleLine(":limit many");
            assertThat(err()).contains("无效的步数上限");
            assertThat(config.getRecursionLimit()).isEqualTo(3);
        }

        @Test
        @DisplayName(":defs 列出原语")
        void definitions() {
            repl.handleLine(":defs");
            assertThat(out()).contains("⊤ = λx.(λy.x)", "+ = λm.(λn.m ↑ n)");
        }

        @Test
        @DisplayName(":config save 写入配置文件")
        void saveConfig() {
            repl.handleLine(":limit 42");
            repl.handleLine(":config save");
            assertThat(Files.exists(store.getFile())).isTrue();
            assertThat(store.load().getRecursionLimit()).isEqualTo(42);
        }

        @Test
        @DisplayName("未知命令")
        void unknownCommand() {
            assertThat(repl.handleLine(":nope")).isTrue();
            assertThat(out()).contains("未知命令: :nope");
        }
    }

    @Test
    @DisplayName("括号计数")
    void unclosedParens() {
        assertThat(ReplRunner.hasUnclosedParens("((x)")).isTrue();
        assertThat(ReplRunner.hasUnclosedParens("(x)")).isFalse();
        assertThat(ReplRunner.hasUnclosedParens("x)")).isFalse();
    }
}
