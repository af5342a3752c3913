package com.lambdacalc.compiler.ast;

import com.lambdacalc.compiler.InvariantViolationException;

/**
 * λ 抽象：λparam.body
 */
public final class Abstraction extends Term {
    private final String param;
    private final Term body;

    public Abstraction(String param, Term body) {
        super(31 * InvariantViolationException.requireName(param, "抽象参数名").hashCode()
                + InvariantViolationException.requireNonNull(body, "抽象体").hashCode() + 1);
        this.param = param;
        this.body = body;
    }

    public String getParam() {
        return param;
    }

    public Term getBody() {
        return body;
    }

    @Override
    public Kind getKind() {
        return Kind.ABSTRACTION;
    }
}
