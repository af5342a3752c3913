package com.lambdacalc.compiler;

/**
 * λ 演算求值器的基础异常。
 *
 * <p>解析错误（{@code ParseException}）与契约违例（{@link InvariantViolationException}）均继承此类。</p>
 */
public class LambdaException extends RuntimeException {

    public LambdaException(String message) {
        super(message);
    }

    public LambdaException(String message, Throwable cause) {
        super(message, cause);
    }
}
