package com.lambdacalc.cli.render;

import org.jline.utils.AttributedString;

/**
 * ANSI SGR 转义序列
 */
public final class AnsiStyles {
    public static final String ESC = "\u001b[";
    public static final String RESET = ESC + "0m";
    /** 差异高亮（黄色） */
    public static final String HIGHLIGHT = rgb(255, 255, 0);

    private AnsiStyles() {}

    /**
     * 24 位前景色
     */
    public static String rgb(int r, int g, int b) {
        return ESC + "38;2;" + r + ";" + g + ";" + b + "m";
    }

    /**
     * 去掉所有 ANSI 转义序列
     */
    public static String strip(String text) {
        return AttributedString.stripAnsi(text);
    }
}
