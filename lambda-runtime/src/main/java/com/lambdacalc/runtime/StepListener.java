package com.lambdacalc.runtime;

import com.lambdacalc.compiler.ast.Term;

/**
 * 逐步观察归约过程
 */
@FunctionalInterface
public interface StepListener {

    StepListener NONE = (index, before, rule, after) -> { };

    /**
     * 每完成一步归约调用一次
     *
     * @param index  步序号，从 1 开始
     * @param before 归约前的项
     * @param rule   使用的规则（BETA 或 DELTA）
     * @param after  归约后的项
     */
    void onStep(long index, Term before, RuleKind rule, Term after);
}
