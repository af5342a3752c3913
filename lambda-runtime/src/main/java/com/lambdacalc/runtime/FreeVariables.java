package com.lambdacalc.runtime;

import com.lambdacalc.compiler.ast.Abstraction;
import com.lambdacalc.compiler.ast.Application;
import com.lambdacalc.compiler.ast.Term;
import com.lambdacalc.compiler.ast.Variable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 自由变量分析
 *
 * <pre>
 * fv(x)    = {x}
 * fv(λp.b) = fv(b) \ {p}
 * fv(f a)  = fv(f) ∪ fv(a)
 * </pre>
 */
public final class FreeVariables {

    private FreeVariables() {}

    /**
     * 计算自由变量集合（按首次出现顺序）
     */
    public static Set<String> of(Term term) {
        Set<String> result = new LinkedHashSet<>();
        // 每个名字当前被多少层抽象绑定
        Map<String, Integer> bound = new HashMap<>();
        Deque<Object> work = new ArrayDeque<>();
        work.push(term);

        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item instanceof LeaveScope) {
                String name = ((LeaveScope) item).name;
                int depth = bound.get(name);
                if (depth == 1) {
                    bound.remove(name);
                } else {
                    bound.put(name, depth - 1);
                }
                continue;
            }
            Term t = (Term) item;
            switch (t.getKind()) {
                case VARIABLE: {
                    String name = ((Variable) t).getName();
                    if (!bound.containsKey(name)) {
                        result.add(name);
                    }
                    break;
                }
                case ABSTRACTION: {
                    Abstraction abs = (Abstraction) t;
                    bound.merge(abs.getParam(), 1, Integer::sum);
                    work.push(new LeaveScope(abs.getParam()));
                    work.push(abs.getBody());
                    break;
                }
                case APPLICATION: {
                    Application app = (Application) t;
                    work.push(app.getArgument());
                    work.push(app.getFunction());
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown term kind: " + t.getKind());
            }
        }
        return result;
    }

    /**
     * name 是否在 term 中自由出现
     */
    public static boolean occursFree(String name, Term term) {
        return of(term).contains(name);
    }

    /**
     * 是否为闭项
     */
    public static boolean isClosed(Term term) {
        return of(term).isEmpty();
    }

    private static final class LeaveScope {
        final String name;

        LeaveScope(String name) {
            this.name = name;
        }
    }
}
