package com.lambdacalc.runtime;

/**
 * 归约规则种类
 */
public enum RuleKind {
    /** β 归约：(λp.b) a → b[p := a] */
    BETA("β"),
    /** δ 归约：原语名展开为其定义 */
    DELTA("δ"),
    /** 未发生归约（范式，或归约在此停止） */
    NONE("");

    private final String symbol;

    RuleKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
