package com.lambdacalc.compiler.lexer;

/**
 * λ 演算词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER,                 // 十进制数字，解析为 Church 数

    // === 标识符 ===
    IDENTIFIER,             // 变量名或原语名（⊤、+、is0 ...）

    // === 符号 ===
    LAMBDA,                 // λ 或 \
    DOT,                    // .
    LPAREN,                 // (
    RPAREN,                 // )

    // === 特殊 ===
    ERROR,
    EOF
}
