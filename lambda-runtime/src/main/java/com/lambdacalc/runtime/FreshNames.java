package com.lambdacalc.runtime;

import com.lambdacalc.compiler.InvariantViolationException;

import java.util.Set;

/**
 * 新鲜变量名生成
 *
 * <p>去掉 base 末尾的数字得到词根，依次尝试 {@code 词根1}、{@code 词根2}……
 * 结果只取决于输入，保证归约轨迹可复现。</p>
 */
public final class FreshNames {

    private FreshNames() {}

    /**
     * 返回不在 avoid 中的名字；base 本身未被占用时直接返回 base
     */
    public static String fresh(String base, Set<String> avoid) {
        InvariantViolationException.requireName(base, "变量名");
        if (!avoid.contains(base)) {
            return base;
        }
        String root = stem(base);
        for (long i = 1; ; i++) {
            String candidate = root + i;
            if (!avoid.contains(candidate)) {
                return candidate;
            }
        }
    }

    /**
     * 去掉末尾数字后的词根；全是数字时返回原名
     */
    static String stem(String name) {
        int end = name.length();
        while (end > 0 && Character.isDigit(name.charAt(end - 1))) {
            end--;
        }
        return end == 0 ? name : name.substring(0, end);
    }
}
