package com.lambdacalc.compiler.ast;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * λ 项基类
 *
 * <p>只有三种形态：{@link Variable}、{@link Abstraction}、{@link Application}。
 * 构造器包私有，外部无法扩展。所有项都是不可变值，结构相等，子树可在归约步骤间共享。</p>
 */
public abstract class Term {

    /**
     * 项的形态标签，用于 switch 穷举
     */
    public enum Kind {
        VARIABLE,
        ABSTRACTION,
        APPLICATION
    }

    private final int hash;

    Term(int hash) {
        this.hash = hash;
    }

    public abstract Kind getKind();

    public boolean isVariable() {
        return getKind() == Kind.VARIABLE;
    }

    public boolean isAbstraction() {
        return getKind() == Kind.ABSTRACTION;
    }

    public boolean isApplication() {
        return getKind() == Kind.APPLICATION;
    }

    // ============ 工厂方法 ============

    public static Variable var(String name) {
        return new Variable(name);
    }

    public static Abstraction lambda(String param, Term body) {
        return new Abstraction(param, body);
    }

    /**
     * 左结合的多参数应用：apply(f, a, b) = (f a) b
     */
    public static Term apply(Term fn, Term... args) {
        Term result = fn;
        for (Term arg : args) {
            result = new Application(result, arg);
        }
        return result;
    }

    // ============ 值语义 ============

    @Override
    public final int hashCode() {
        return hash;
    }

    /**
     * 结构相等（不做 α 等价），显式栈遍历以支持深层嵌套
     */
    @Override
    public final boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Term)) return false;

        Deque<Term[]> stack = new ArrayDeque<>();
        stack.push(new Term[]{this, (Term) obj});
        while (!stack.isEmpty()) {
            Term[] pair = stack.pop();
            Term a = pair[0];
            Term b = pair[1];
            if (a == b) continue;
            if (a.hash != b.hash || a.getKind() != b.getKind()) return false;

            switch (a.getKind()) {
                case VARIABLE:
                    if (!((Variable) a).getName().equals(((Variable) b).getName())) return false;
                    break;
                case ABSTRACTION: {
                    Abstraction x = (Abstraction) a;
                    Abstraction y = (Abstraction) b;
                    if (!x.getParam().equals(y.getParam())) return false;
                    stack.push(new Term[]{x.getBody(), y.getBody()});
                    break;
                }
                case APPLICATION: {
                    Application x = (Application) a;
                    Application y = (Application) b;
                    stack.push(new Term[]{x.getArgument(), y.getArgument()});
                    stack.push(new Term[]{x.getFunction(), y.getFunction()});
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown term kind: " + a.getKind());
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return TermPrinter.print(this);
    }
}
