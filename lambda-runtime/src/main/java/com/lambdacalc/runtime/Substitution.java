package com.lambdacalc.runtime;

import com.lambdacalc.compiler.InvariantViolationException;
import com.lambdacalc.compiler.ast.Abstraction;
import com.lambdacalc.compiler.ast.Application;
import com.lambdacalc.compiler.ast.Term;
import com.lambdacalc.compiler.ast.Variable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 避免捕获的替换：subst(term, x, r) 把 term 中 x 的所有自由出现替换为 r
 *
 * <pre>
 * subst(n, x, r)    = r              若 n == x
 *                   = n              否则
 * subst(f a, x, r)  = subst(f) subst(a)
 * subst(λp.b, x, r) = λp.b           若 p == x
 *                   = λp.subst(b)    若 p ∉ fv(r)
 *                   = λp'.subst(b[p := p'])
 *                                    否则，p' = fresh(p, fv(b) ∪ fv(r) ∪ {x})
 * </pre>
 *
 * <p>α 换名只在会发生捕获时进行。未变化的子树按引用原样返回。</p>
 */
public final class Substitution {

    private Substitution() {}

    public static Term subst(Term term, String target, Term replacement) {
        InvariantViolationException.requireNonNull(term, "被替换的项");
        InvariantViolationException.requireName(target, "替换目标");
        InvariantViolationException.requireNonNull(replacement, "替换值");

        if (!FreeVariables.occursFree(target, term)) {
            return term;
        }

        Set<String> replacementFree = FreeVariables.of(replacement);
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
            switch (t.getKind()) {
                case VARIABLE:
                    results.push(((Variable) t).getName().equals(target) ? replacement : t);
                    break;
                case APPLICATION: {
                    Application app = (Application) t;
                    work.push(new Rebuild(app, null));
                    work.push(app.getArgument());
                    work.push(app.getFunction());
                    break;
                }
                case ABSTRACTION: {
                    Abstraction abs = (Abstraction) t;
                    String param = abs.getParam();
                    if (param.equals(target)) {
                        // x 被遮蔽，下方没有自由出现
                        results.push(abs);
                    } else if (!replacementFree.contains(param)) {
                        work.push(new Rebuild(abs, param));
                        work.push(abs.getBody());
                    } else {
                        Set<String> avoid = new LinkedHashSet<>(FreeVariables.of(abs.getBody()));
                        avoid.addAll(replacementFree);
                        avoid.add(target);
                        String renamed = FreshNames.fresh(param, avoid);
                        Term body = subst(abs.getBody(), param, new Variable(renamed));
                        work.push(new Rebuild(abs, renamed));
                        work.push(body);
                    }
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown term kind: " + t.getKind());
            }
        }
        return results.pop();
    }

    /**
     * 子结果就绪后重建节点；参数名与子项都未变时复用原节点
     */
    private static final class Rebuild {
        private final Term original;
        private final String param;

        Rebuild(Term original, String param) {
            this.original = original;
            this.param = param;
        }

        Term build(Deque<Term> results) {
            if (original.isAbstraction()) {
                Abstraction abs = (Abstraction) original;
                Term body = results.pop();
                if (body == abs.getBody() && param.equals(abs.getParam())) {
                    return abs;
                }
                return new Abstraction(param, body);
            }
            Application app = (Application) original;
            Term arg = results.pop();
            Term fn = results.pop();
            if (fn == app.getFunction() && arg == app.getArgument()) {
                return app;
            }
            return new Application(fn, arg);
        }
    }
}
