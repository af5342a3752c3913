package com.lambdacalc.compiler.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * λ 演算词法分析器
 *
 * <p>标识符是除空白和 {@code ( ) . λ \} 之外的任意字符序列，不能以数字开头，
 * 因此 {@code ⊤}、{@code +}、{@code is0} 都是合法标识符。</p>
 */
public class Lexer {
    public static final char LAMBDA = 'λ';
    public static final char LAMBDA_ASCII = '\\';

    private final String source;
    private final String fileName;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 获取下一个 Token（流式接口），输入结束后持续返回 EOF
     */
    public Token nextToken() {
        skipWhitespace();

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", null, line, column);
        }

        start = current;
        return scanToken();
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    private Token scanToken() {
        char c = advance();
        switch (c) {
            case LAMBDA:
            case LAMBDA_ASCII:
                return makeToken(TokenType.LAMBDA, null);
            case '.':
                return makeToken(TokenType.DOT, null);
            case '(':
                return makeToken(TokenType.LPAREN, null);
            case ')':
                return makeToken(TokenType.RPAREN, null);
            default:
                if (isDigit(c)) {
                    return number();
                }
                return identifier();
        }
    }

    // === 复杂 Token 扫描 ===

    private Token number() {
        while (isDigit(peek())) advance();

        String text = source.substring(start, current);
        try {
            return makeToken(TokenType.NUMBER, Integer.valueOf(text));
        } catch (NumberFormatException e) {
            return makeToken(TokenType.ERROR, "Number literal too large: " + text);
        }
    }

    private Token identifier() {
        while (!isAtEnd() && isNameChar(peek())) advance();
        return makeToken(TokenType.IDENTIFIER, null);
    }

    // === 辅助方法 ===

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                current++;
                line++;
                column = 1;
            } else if (Character.isWhitespace(c)) {
                advance();
            } else {
                break;
            }
        }
    }

    private Token makeToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        int tokenColumn = column - (current - start);
        return new Token(type, lexeme, literal, line, tokenColumn);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /**
     * 是否可以出现在标识符中
     */
    public static boolean isNameChar(char c) {
        return !Character.isWhitespace(c)
                && c != '(' && c != ')' && c != '.'
                && c != LAMBDA && c != LAMBDA_ASCII;
    }
}
