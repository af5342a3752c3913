package com.lambdacalc.runtime;

import com.lambdacalc.compiler.ast.Term;

/**
 * 流式规约的汇总结果（不保留中间项）
 */
public final class ReductionResult {
    private final Term initialTerm;
    private final Term finalTerm;
    private final long betaSteps;
    private final long deltaSteps;
    private final Outcome outcome;

    public ReductionResult(Term initialTerm, Term finalTerm, long betaSteps, long deltaSteps, Outcome outcome) {
        this.initialTerm = initialTerm;
        this.finalTerm = finalTerm;
        this.betaSteps = betaSteps;
        this.deltaSteps = deltaSteps;
        this.outcome = outcome;
    }

    public Term getInitialTerm() {
        return initialTerm;
    }

    public Term getFinalTerm() {
        return finalTerm;
    }

    public long getSteps() {
        return betaSteps + deltaSteps;
    }

    public long getBetaSteps() {
        return betaSteps;
    }

    public long getDeltaSteps() {
        return deltaSteps;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isNormalForm() {
        return outcome == Outcome.NORMAL_FORM;
    }

    @Override
    public String toString() {
        return outcome + " after " + getSteps() + " steps (β=" + betaSteps + ", δ=" + deltaSteps + "): " + finalTerm;
    }
}
