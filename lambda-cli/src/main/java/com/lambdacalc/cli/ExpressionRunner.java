package com.lambdacalc.cli;

import com.lambdacalc.cli.config.LambdaConfig;
import com.lambdacalc.cli.render.TraceJson;
import com.lambdacalc.cli.render.TracePrinter;
import com.lambdacalc.compiler.ast.Term;
import com.lambdacalc.compiler.lexer.Lexer;
import com.lambdacalc.compiler.parser.ParseException;
import com.lambdacalc.compiler.parser.Parser;
import com.lambdacalc.runtime.Reducer;
import com.lambdacalc.runtime.Trace;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 表达式和文件求值器
 *
 * <p>返回进程退出码：0 成功，1 语法错误或文件无法读取。配置在每次求值时读取，
 * REPL 中的开关立即生效。</p>
 */
public class ExpressionRunner {

    /** JSON 输出需保留整条轨迹，未设上限时用这个步数兜底 */
    static final long JSON_DEFAULT_LIMIT = 10_000;

    private final LambdaConfig config;
    private final Reducer reducer;
    private final PrintStream out;
    private final PrintStream err;

    public ExpressionRunner(LambdaConfig config, Reducer reducer, PrintStream out, PrintStream err) {
        this.config = config;
        this.reducer = reducer;
        this.out = out;
        this.err = err;
    }

    /**
     * 求值单个表达式
     */
    public int runExpression(String source, String fileName, boolean json) {
        return evaluate(source, fileName, 0, json);
    }

    /**
     * 逐行求值文件，跳过空行和 # 注释行；某一行出错不影响后续行
     */
    public int runFile(String filePath, boolean json) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return 1;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + filePath + " (" + e.getMessage() + ")");
            return 1;
        }

        int exitCode = 0;
        boolean first = true;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            if (!first && !json) {
                out.println();
            }
            first = false;
            if (!json) {
                out.println("# " + trimmed);
            }
            if (evaluate(line, filePath, i, json) != 0) {
                exitCode = 1;
            }
        }
        return exitCode;
    }

    /**
     * 解析表达式，出错时打印位置并返回 null
     */
    Term parse(String source, String fileName, int lineOffset) {
        try {
            return new Parser(new Lexer(source, fileName), fileName).parse();
        } catch (ParseException e) {
            err.println("语法错误: " + e.getMessage());
            if (e.getToken() != null) {
                printSourceLocation(source, fileName, e.getLine(), e.getColumn(),
                        e.getToken().getLexeme().length(), lineOffset);
            }
            return null;
        }
    }

    private int evaluate(String source, String fileName, int lineOffset, boolean json) {
        Term term = parse(source, fileName, lineOffset);
        if (term == null) {
            return 1;
        }
        long maxSteps = config.getMaxSteps();
        if (json) {
            if (maxSteps == Reducer.UNLIMITED) {
                err.println("警告: JSON 输出未设置步数上限，按 " + JSON_DEFAULT_LIMIT + " 步截断");
                maxSteps = JSON_DEFAULT_LIMIT;
            }
            Trace trace = reducer.normalize(term, maxSteps);
            out.println(TraceJson.toJsonString(trace, config.isCompact(), config.isDeltaAbstract()));
        } else {
            new TracePrinter(out, config).print(reducer, term, maxSteps);
        }
        return 0;
    }

    /**
     * 打印源码位置指示（文件名:行:列 + 源码行 + 下划线指针）
     */
    void printSourceLocation(String source, String fileName, int line, int column, int length, int lineOffset) {
        int displayLine = line + lineOffset;
        err.println("  --> " + fileName + ":" + displayLine + ":" + column);
        String[] lines = source.split("\n", -1);
        if (line >= 1 && line <= lines.length) {
            String lineText = lines[line - 1];
            String lineNum = String.valueOf(displayLine);
            err.println("   |");
            err.println(" " + lineNum + " | " + lineText);
            StringBuilder pointer = new StringBuilder();
            for (int i = 0; i < lineNum.length() + 1; i++) pointer.append(' ');
            pointer.append("| ");
            for (int i = 1; i < column; i++) pointer.append(' ');
            for (int i = 0; i < Math.max(1, length); i++) pointer.append('^');
            err.println(pointer.toString());
        }
    }
}
