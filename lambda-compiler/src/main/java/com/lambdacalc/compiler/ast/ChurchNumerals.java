package com.lambdacalc.compiler.ast;

import com.lambdacalc.compiler.InvariantViolationException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalInt;

/**
 * Church 数编码与解码
 *
 * <p>n 编码为 {@code λf.λx.f (f (... (f x)))}，其中 f 应用 n 次。
 * 解码只做结构匹配，仅供显示层使用，归约过程从不调用。</p>
 */
public final class ChurchNumerals {

    public static final String FUNCTION_PARAM = "f";
    public static final String VALUE_PARAM = "x";

    private ChurchNumerals() {}

    /**
     * 编码非负整数
     *
     * @throws InvariantViolationException n 为负数
     */
    public static Abstraction encode(int n) {
        if (n < 0) {
            throw new InvariantViolationException("Church 数不能为负数: " + n);
        }
        Variable f = new Variable(FUNCTION_PARAM);
        Term body = new Variable(VALUE_PARAM);
        for (int i = 0; i < n; i++) {
            body = new Application(f, body);
        }
        return new Abstraction(FUNCTION_PARAM, new Abstraction(VALUE_PARAM, body));
    }

    /**
     * 解码 Church 数，不符合 {@code λf.λx.f(...(f x))} 形状时返回空
     */
    public static OptionalInt decode(Term term) {
        if (!term.isAbstraction()) return OptionalInt.empty();
        Abstraction outer = (Abstraction) term;
        if (!outer.getBody().isAbstraction()) return OptionalInt.empty();
        Abstraction inner = (Abstraction) outer.getBody();

        String f = outer.getParam();
        String x = inner.getParam();
        Term current = inner.getBody();

        // 内层参数遮蔽外层时，f 不可见，只能是 0
        if (f.equals(x)) {
            return isVariableNamed(current, x) ? OptionalInt.of(0) : OptionalInt.empty();
        }

        int count = 0;
        while (current.isApplication()) {
            Application app = (Application) current;
            if (!isVariableNamed(app.getFunction(), f)) {
                return OptionalInt.empty();
            }
            count++;
            current = app.getArgument();
        }
        return isVariableNamed(current, x) ? OptionalInt.of(count) : OptionalInt.empty();
    }

    public static boolean isNumeral(Term term) {
        return decode(term).isPresent();
    }

    /**
     * δ-抽象：把所有 Church 数子项替换为以十进制值命名的变量，仅用于显示
     */
    public static Term abstractNumerals(Term term) {
        // 栈元素：Term 表示待访问；Rebuild 表示子结果已就绪，需要重建
        Deque<Object> work = new ArrayDeque<>();
        Deque<Term> results = new ArrayDeque<>();
        work.push(term);

        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item instanceof Rebuild) {
                results.push(((Rebuild) item).build(results));
                continue;
            }
            Term t = (Term) item;
            OptionalInt value = decode(t);
            if (value.isPresent()) {
                results.push(new Variable(Integer.toString(value.getAsInt())));
                continue;
            }
            switch (t.getKind()) {
                case VARIABLE:
                    results.push(t);
                    break;
                case ABSTRACTION:
                    work.push(new Rebuild(t));
                    work.push(((Abstraction) t).getBody());
                    break;
                case APPLICATION:
                    work.push(new Rebuild(t));
                    work.push(((Application) t).getArgument());
                    work.push(((Application) t).getFunction());
                    break;
                default:
                    throw new IllegalStateException("Unknown term kind: " + t.getKind());
            }
        }
        return results.pop();
    }

    private static boolean isVariableNamed(Term term, String name) {
        return term.isVariable() && ((Variable) term).getName().equals(name);
    }

    /**
     * 用已算出的子结果重建节点，子结果未变化时复用原节点
     */
    private static final class Rebuild {
        private final Term original;

        Rebuild(Term original) {
            this.original = original;
        }

        Term build(Deque<Term> results) {
            if (original.isAbstraction()) {
                Abstraction abs = (Abstraction) original;
                Term body = results.pop();
                return body == abs.getBody() ? abs : new Abstraction(abs.getParam(), body);
            }
            Application app = (Application) original;
            Term arg = results.pop();
            Term fn = results.pop();
            return fn == app.getFunction() && arg == app.getArgument() ? app : new Application(fn, arg);
        }
    }
}
