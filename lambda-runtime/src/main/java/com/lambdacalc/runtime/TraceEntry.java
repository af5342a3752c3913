package com.lambdacalc.runtime;

import com.lambdacalc.compiler.ast.Term;

/**
 * 轨迹中的一项：第 i 个项，以及作用在它上面得到第 i+1 项的规则
 *
 * <p>最后一项的规则为 {@link RuleKind#NONE}。</p>
 */
public final class TraceEntry {
    private final Term term;
    private final RuleKind rule;

    public TraceEntry(Term term, RuleKind rule) {
        this.term = term;
        this.rule = rule;
    }

    public Term getTerm() {
        return term;
    }

    public RuleKind getRule() {
        return rule;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceEntry)) return false;
        TraceEntry that = (TraceEntry) o;
        return rule == that.rule && term.equals(that.term);
    }

    @Override
    public int hashCode() {
        return 31 * term.hashCode() + rule.hashCode();
    }

    @Override
    public String toString() {
        return rule == RuleKind.NONE ? term.toString() : term + " -" + rule.getSymbol() + "->";
    }
}
