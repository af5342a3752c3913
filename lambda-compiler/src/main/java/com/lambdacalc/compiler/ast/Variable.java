package com.lambdacalc.compiler.ast;

import com.lambdacalc.compiler.InvariantViolationException;

/**
 * 变量
 */
public final class Variable extends Term {
    private final String name;

    public Variable(String name) {
        super(InvariantViolationException.requireName(name, "变量名").hashCode());
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public Kind getKind() {
        return Kind.VARIABLE;
    }
}
