package com.lambdacalc.runtime;

/**
 * 规约的终止状态
 */
public enum Outcome {
    /** 到达范式 */
    NORMAL_FORM,
    /** 达到步数上限仍未到达范式（疑似发散），不是错误 */
    LIMIT_EXCEEDED
}
