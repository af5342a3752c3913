package com.lambdacalc.cli.render;

/**
 * 高亮相邻两步渲染结果之间变化的中间段
 *
 * <p>公共前缀与后缀在去掉 ANSI 序列后的文本上计算，再映射回带颜色的文本。</p>
 */
public final class DiffHighlighter {

    private DiffHighlighter() {}

    public static String highlight(String previous, String current) {
        String o = AnsiStyles.strip(previous);
        String n = AnsiStyles.strip(current);
        int limit = Math.min(o.length(), n.length());

        int prefix = 0;
        while (prefix < limit && o.charAt(prefix) == n.charAt(prefix)) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < limit - prefix
                && o.charAt(o.length() - 1 - suffix) == n.charAt(n.length() - 1 - suffix)) {
            suffix++;
        }
        if (prefix + suffix >= n.length()) {
            return current;
        }

        int start = rawIndex(current, prefix);
        int end = rawIndex(current, n.length() - suffix);
        // 中段内的括号颜色会以 RESET 结束，之后需要恢复高亮
        String middle = current.substring(start, end)
                .replace(AnsiStyles.RESET, AnsiStyles.RESET + AnsiStyles.HIGHLIGHT);
        return current.substring(0, start) + AnsiStyles.HIGHLIGHT + middle + AnsiStyles.RESET
                + current.substring(end);
    }

    /**
     * 第 visible 个可见字符在原始文本中的下标
     */
    static int rawIndex(String text, int visible) {
        int pos = 0;
        int seen = 0;
        while (pos < text.length() && seen < visible) {
            if (text.startsWith(AnsiStyles.ESC, pos)) {
                int m = text.indexOf('m', pos);
                pos = m < 0 ? text.length() : m + 1;
            } else {
                pos++;
                seen++;
            }
        }
        return pos;
    }
}
