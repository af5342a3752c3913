package com.lambdacalc.runtime;

import com.lambdacalc.compiler.InvariantViolationException;
import com.lambdacalc.compiler.ast.Term;

import java.util.Collections;
import java.util.List;

/**
 * 一次规约的完整轨迹
 *
 * <p>第 0 项是输入，最后一项规则为 {@link RuleKind#NONE}。由 {@link Reducer#normalize} 为每次调用新建，归调用方所有。</p>
 */
public final class Trace {
    private final List<TraceEntry> entries;
    private final Outcome outcome;

    public Trace(List<TraceEntry> entries, Outcome outcome) {
        if (entries.isEmpty()) {
            throw new InvariantViolationException("轨迹至少包含初始项");
        }
        this.entries = Collections.unmodifiableList(entries);
        this.outcome = outcome;
    }

    public List<TraceEntry> getEntries() {
        return entries;
    }

    public TraceEntry get(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isNormalForm() {
        return outcome == Outcome.NORMAL_FORM;
    }

    public Term getInitialTerm() {
        return entries.get(0).getTerm();
    }

    public Term getFinalTerm() {
        return entries.get(entries.size() - 1).getTerm();
    }

    /**
     * 实际执行的归约步数
     */
    public int getStepCount() {
        return entries.size() - 1;
    }

    /**
     * 某种规则被使用的次数
     */
    public int count(RuleKind rule) {
        int n = 0;
        for (TraceEntry entry : entries) {
            if (entry.getRule() == rule) n++;
        }
        return n;
    }

    /**
     * 产生第 step 个项所用的规则（step ≥ 1）
     */
    public RuleKind ruleProducing(int step) {
        return entries.get(step - 1).getRule();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Trace)) return false;
        Trace that = (Trace) o;
        return outcome == that.outcome && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return 31 * entries.hashCode() + outcome.hashCode();
    }

    @Override
    public String toString() {
        return "Trace[" + outcome + ", " + getStepCount() + " steps, final=" + getFinalTerm() + "]";
    }
}
