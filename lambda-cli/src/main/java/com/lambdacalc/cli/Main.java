package com.lambdacalc.cli;

import com.lambdacalc.cli.config.ConfigStore;
import com.lambdacalc.cli.config.LambdaConfig;
import com.lambdacalc.runtime.PrimitiveTable;
import com.lambdacalc.runtime.Reducer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * λ 演算归约器 CLI 入口点（picocli）
 */
@Command(name = "lambda", version = "lambda-calculus 1.0.0",
         mixinStandardHelpOptions = true,
         description = "按正规序归约无类型 λ 演算表达式并逐步打印",
         subcommands = {DefsCommand.class})
public class Main implements Callable<Integer> {

    @Option(names = {"-e", "--expr"}, description = "求值表达式")
    String expression;

    @Option(names = {"-f", "--file"}, description = "逐行求值文件（跳过空行和 # 注释）")
    String file;

    @Option(names = "--json", description = "输出 JSON 轨迹")
    boolean json;

    @Option(names = "--limit", description = "最大归约步数（≤ 0 表示不限）")
    Long limit;

    @Option(names = "--compact", negatable = true, description = "去掉输出中的空格")
    Boolean compact;

    @Option(names = "--color", negatable = true, description = "按嵌套深度给括号着色")
    Boolean color;

    @Option(names = "--diff", description = "高亮每一步变化的部分")
    boolean diff;

    @Option(names = "--no-step-type", description = "不显示 β/δ 规则标记")
    boolean noStepType;

    @Option(names = "--no-abstract", description = "不输出 δ-抽象后的结果")
    boolean noAbstract;

    @Option(names = "--config", description = "配置文件路径（默认 ~/.lambdacalc/config.json）")
    Path configPath;

    @Option(names = "--save-config", description = "把当前选项写入配置文件")
    boolean saveConfig;

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志")
    boolean verbose;

    @Parameters(description = "表达式（多个词以空格连接）")
    String[] words;

    final PrintStream out;
    final PrintStream err;

    public Main() {
        this(System.out, System.err);
    }

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        configureLogging(verbose ? Level.FINE : Level.WARNING, err);

        ConfigStore store = configPath != null ? new ConfigStore(configPath) : ConfigStore.defaultStore();
        LambdaConfig config = applyOverrides(store.load());

        if (saveConfig) {
            try {
                store.save(config);
                out.println("配置已保存: " + store.getFile());
            } catch (IOException e) {
                err.println("错误: 无法保存配置 - " + e.getMessage());
                return 1;
            }
        }

        Reducer reducer = new Reducer(PrimitiveTable.standard());
        ExpressionRunner runner = new ExpressionRunner(config, reducer, out, err);

        if (expression != null) {
            return runner.runExpression(expression, "<cmdline>", json);
        } else if (file != null) {
            return runner.runFile(file, json);
        } else if (words != null && words.length > 0) {
            return runner.runExpression(String.join(" ", words), "<cmdline>", json);
        } else if (saveConfig) {
            return 0;
        }
        new ReplRunner(config, store, reducer, out, err).run();
        return 0;
    }

    /**
     * 命令行选项覆盖配置文件中的值（仅本次运行，除非 --save-config）
     */
    LambdaConfig applyOverrides(LambdaConfig config) {
        if (limit != null) config.setRecursionLimit(limit);
        if (compact != null) config.setCompact(compact);
        if (color != null) config.setColorParens(color);
        if (diff) config.setColorDiff(true);
        if (noStepType) config.setShowStepType(false);
        if (noAbstract) config.setDeltaAbstract(false);
        return config;
    }

    /**
     * 日志输出到 stderr，不干扰 stdout 上的归约输出
     */
    static void configureLogging(Level level, PrintStream stream) {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(stream, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(level);
        rootLogger.addHandler(stderrHandler);
        rootLogger.setLevel(level);
    }

    public static void main(String[] args) {
        // Windows 控制台可能不是 UTF-8，使用 native.encoding 确保 λ、β 等字符正确显示
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main(out, err));
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名（native.encoding，JDK 17+）
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
