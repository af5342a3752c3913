package com.lambdacalc.runtime;

import com.lambdacalc.compiler.ast.Term;

/**
 * 单步归约的结果：归约后的项及所用规则
 *
 * <p>{@link RuleKind#NONE} 表示输入已是范式，此时 term 就是输入本身。</p>
 */
public final class ReductionStep {
    private final Term term;
    private final RuleKind rule;

    public ReductionStep(Term term, RuleKind rule) {
        this.term = term;
        this.rule = rule;
    }

    static ReductionStep normalForm(Term term) {
        return new ReductionStep(term, RuleKind.NONE);
    }

    public Term getTerm() {
        return term;
    }

    public RuleKind getRule() {
        return rule;
    }

    public boolean isReduced() {
        return rule != RuleKind.NONE;
    }

    @Override
    public String toString() {
        return isReduced() ? "(" + rule.getSymbol() + ") " + term : "(normal) " + term;
    }
}
