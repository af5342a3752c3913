package com.lambdacalc.cli;

import com.lambdacalc.cli.config.ConfigStore;
import com.lambdacalc.cli.config.LambdaConfig;
import com.lambdacalc.compiler.ast.Term;
import com.lambdacalc.compiler.ast.TermPrinter;
import com.lambdacalc.runtime.AlphaEquivalence;
import com.lambdacalc.runtime.PrimitiveTable;
import com.lambdacalc.runtime.Reducer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.logging.Logger;

/**
 * jline REPL 交互模式
 */
public class ReplRunner {
    private static final Logger LOG = Logger.getLogger(ReplRunner.class.getName());

    static final String PROMPT = "λ> ";
    static final String CONTINUATION_PROMPT = "... ";

    private final LambdaConfig config;
    private final ConfigStore store;
    private final Reducer reducer;
    private final PrintStream out;
    private final PrintStream err;
    private final ExpressionRunner runner;

    private final StringBuilder multilineBuffer = new StringBuilder();

    public ReplRunner(LambdaConfig config, ConfigStore store, Reducer reducer, PrintStream out, PrintStream err) {
        this.config = config;
        this.store = store;
        this.reducer = reducer;
        this.out = out;
        this.err = err;
        this.runner = new ExpressionRunner(config, reducer, out, err);
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        out.println("λ-calculus 归约器");
        out.println("输入 :help 获取帮助，:quit 退出");
        out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, CONTINUATION_PROMPT)
                    .build();

            runLoop(reader);
        } catch (IOException e) {
            LOG.fine("终端初始化失败，回退到简单模式: " + e.getMessage());
            runFallbackLoop();
        }

        out.println("\n再见！");
    }

    private String currentPrompt() {
        return multilineBuffer.length() > 0 ? CONTINUATION_PROMPT : PROMPT;
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        while (true) {
            try {
                String line = reader.readLine(currentPrompt());
                if (line == null || !handleLine(line)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                multilineBuffer.setLength(0);
            } catch (EndOfFileException e) {
                // Ctrl+D: 退出
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    private void runFallbackLoop() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        while (true) {
            try {
                out.print(currentPrompt());
                out.flush();
                String line = reader.readLine();
                if (line == null || !handleLine(line)) break;
            } catch (IOException e) {
                err.println("读取输入时出错: " + e.getMessage());
                break;
            }
        }
    }

    /**
     * 处理一行输入
     *
     * @return true 继续循环，false 退出
     */
    boolean handleLine(String line) {
        if (multilineBuffer.length() == 0 && line.trim().startsWith(":")) {
            return handleReplCommand(line.trim());
        }

        // 反斜杠续行；单独的 \ 是 λ 的别名，只认行尾空白后的 \
        if (line.endsWith(" \\")) {
            multilineBuffer.append(line, 0, line.length() - 1).append("\n");
            return true;
        }

        // 未闭合括号自动续行
        String text = multilineBuffer + line;
        if (hasUnclosedParens(text)) {
            multilineBuffer.append(line).append("\n");
            return true;
        }
        multilineBuffer.setLength(0);

        if (text.trim().isEmpty()) return true;

        runner.runExpression(text, "<repl>", false);
        return true;
    }

    static boolean hasUnclosedParens(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
        }
        return depth > 0;
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    private boolean handleReplCommand(String command) {
        String name = command;
        String argument = "";
        int space = command.indexOf(' ');
        if (space > 0) {
            name = command.substring(0, space);
            argument = command.substring(space + 1).trim();
        }

        switch (name) {
            case ":quit":
            case ":q":
            case ":exit":
                return false;
            case ":help":
            case ":h":
                printReplHelp();
                return true;
            case ":defs":
                printDefinitions(reducer.getPrimitives(), out);
                return true;
            case ":eq":
                checkEquivalence(argument);
                return true;
            case ":limit":
                setLimit(argument);
                return true;
            case ":compact":
                config.setCompact(!config.isCompact());
                out.println("紧凑模式: " + onOff(config.isCompact()));
                return true;
            case ":color":
                config.setColorParens(!config.isColorParens());
                out.println("括号着色: " + onOff(config.isColorParens()));
                return true;
            case ":diff":
                config.setColorDiff(!config.isColorDiff());
                out.println("差异高亮: " + onOff(config.isColorDiff()));
                return true;
            case ":config":
                handleConfig(argument);
                return true;
            default:
                out.println("未知命令: " + command);
                out.println("输入 :help 获取帮助");
                return true;
        }
    }

    private void checkEquivalence(String argument) {
        int separator = argument.indexOf(';');
        if (separator < 0) {
            err.println("用法: :eq <表达式> ; <表达式>");
            return;
        }
        Term left = runner.parse(argument.substring(0, separator), "<repl>", 0);
        if (left == null) return;
        Term right = runner.parse(argument.substring(separator + 1), "<repl>", 0);
        if (right == null) return;
        out.println(AlphaEquivalence.equivalent(left, right) ? "α-等价" : "不等价");
    }

    private void setLimit(String argument) {
        if (argument.isEmpty()) {
            long limit = config.getRecursionLimit();
            out.println("步数上限: " + (limit <= 0 ? "无" : String.valueOf(limit)));
            return;
        }
        try {
            config.setRecursionLimit(Long.parseLong(argument));
            setLimit("");
        } catch (NumberFormatException e) {
            err.println("错误: 无效的步数上限 '" + argument + "'");
        }
    }

    private void handleConfig(String argument) {
        if ("save".equals(argument)) {
            try {
                store.save(config);
                out.println("配置已保存: " + store.getFile());
            } catch (IOException e) {
                err.println("错误: 无法保存配置 - " + e.getMessage());
            }
            return;
        }
        out.println(config);
    }

    static void printDefinitions(PrimitiveTable table, PrintStream out) {
        for (Map.Entry<String, Term> def : table.asMap().entrySet()) {
            out.println(def.getKey() + " = " + TermPrinter.print(def.getValue()));
        }
    }

    private static String onOff(boolean value) {
        return value ? "开" : "关";
    }

    private void printReplHelp() {
        out.println("REPL 命令:");
        out.println("  :help, :h        显示此帮助");
        out.println("  :quit, :q, :exit 退出 REPL");
        out.println("  :defs            列出原语定义");
        out.println("  :eq a ; b        判断两个项是否 α-等价");
        out.println("  :limit [N]       查看或设置步数上限（≤ 0 表示不限）");
        out.println("  :compact         切换紧凑模式");
        out.println("  :color           切换括号着色");
        out.println("  :diff            切换差异高亮");
        out.println("  :config [save]   显示当前配置，save 写入配置文件");
        out.println();
        out.println("示例:");
        out.println("  (λx.x) y         恒等函数");
        out.println("  + 2 3            Church 数加法");
        out.println("  ≤ 2 5            比较");
        out.println("  \\x.\\y.x        \\ 可代替 λ");
        out.println();
        out.println("提示:");
        out.println("  - 行尾使用空格加 \\ 可以输入多行");
        out.println("  - 未闭合的括号会自动进入多行模式");
    }
}
