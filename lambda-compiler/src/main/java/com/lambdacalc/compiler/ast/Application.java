package com.lambdacalc.compiler.ast;

import com.lambdacalc.compiler.InvariantViolationException;

/**
 * 应用：function argument
 */
public final class Application extends Term {
    private final Term function;
    private final Term argument;

    public Application(Term function, Term argument) {
        super(37 * InvariantViolationException.requireNonNull(function, "应用的函数部分").hashCode()
                + InvariantViolationException.requireNonNull(argument, "应用的参数部分").hashCode() + 2);
        this.function = function;
        this.argument = argument;
    }

    public Term getFunction() {
        return function;
    }

    public Term getArgument() {
        return argument;
    }

    /**
     * 是否为 β-redex（函数部分是抽象）
     */
    public boolean isBetaRedex() {
        return function.isAbstraction();
    }

    @Override
    public Kind getKind() {
        return Kind.APPLICATION;
    }
}
