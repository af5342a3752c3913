package com.lambdacalc.compiler.parser;

import com.lambdacalc.compiler.LambdaException;
import com.lambdacalc.compiler.lexer.Token;

/**
 * 解析异常（语法错误）
 */
public class ParseException extends LambdaException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            sb.append(" (found ").append(token.describe()).append(")");
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
