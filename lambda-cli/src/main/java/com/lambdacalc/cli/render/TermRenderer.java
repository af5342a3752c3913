package com.lambdacalc.cli.render;

import com.lambdacalc.compiler.ast.Term;
import com.lambdacalc.compiler.ast.TermPrinter;

/**
 * 终端显示用的项渲染：紧凑模式 + 按嵌套深度着色括号
 *
 * <p>括号颜色从外层的 (0,128,128) 渐变到最内层的 (0,255,255)。</p>
 */
public final class TermRenderer {
    private final boolean compact;
    private final boolean colorParens;

    public TermRenderer(boolean compact, boolean colorParens) {
        this.compact = compact;
        this.colorParens = colorParens;
    }

    public String render(Term term) {
        String text = plain(term);
        return colorParens ? colorParens(text) : text;
    }

    /**
     * 不带任何 ANSI 序列的文本
     */
    public String plain(Term term) {
        return TermPrinter.print(term, compact);
    }

    static String colorParens(String text) {
        int depth = 0;
        int maxDepth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
                maxDepth = Math.max(maxDepth, depth);
            } else if (c == ')') {
                depth--;
            }
        }
        if (maxDepth == 0) {
            return text;
        }

        StringBuilder sb = new StringBuilder(text.length() * 4);
        depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
                sb.append(parenColor(depth, maxDepth)).append(c).append(AnsiStyles.RESET);
            } else if (c == ')') {
                sb.append(parenColor(depth, maxDepth)).append(c).append(AnsiStyles.RESET);
                depth--;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String parenColor(int depth, int maxDepth) {
        double ratio = maxDepth > 1 ? (double) (depth - 1) / (maxDepth - 1) : 0.0;
        int g = (int) (128 * (1 - ratio) + 255 * ratio);
        int b = (int) (128 * (1 - ratio) + 255 * ratio);
        return AnsiStyles.rgb(0, g, b);
    }
}
