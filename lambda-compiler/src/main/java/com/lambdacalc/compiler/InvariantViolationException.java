package com.lambdacalc.compiler;

/**
 * 编程契约被破坏（空变量名、负数 Church 数、负步数上限等）。
 *
 * <p>合法输入永远不会触发此异常，调用方不应尝试在本地恢复。</p>
 */
public class InvariantViolationException extends LambdaException {

    public InvariantViolationException(String message) {
        super(message);
    }

    /**
     * 检查名称非空，否则抛出异常
     */
    public static String requireName(String name, String what) {
        if (name == null || name.isEmpty()) {
            throw new InvariantViolationException(what + " 不能为空");
        }
        return name;
    }

    /**
     * 检查引用非 null，否则抛出异常
     */
    public static <T> T requireNonNull(T value, String what) {
        if (value == null) {
            throw new InvariantViolationException(what + " 不能为 null");
        }
        return value;
    }
}
