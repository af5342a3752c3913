package com.lambdacalc.runtime;

import com.lambdacalc.compiler.ast.Abstraction;
import com.lambdacalc.compiler.ast.Application;
import com.lambdacalc.compiler.ast.Term;
import com.lambdacalc.compiler.ast.Variable;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * α 等价判定：忽略约束变量的命名差异
 *
 * <p>约束变量按到绑定点的距离（de Bruijn 下标）比较，自由变量按名字比较。</p>
 */
public final class AlphaEquivalence {

    private AlphaEquivalence() {}

    public static boolean equivalent(Term left, Term right) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(left, right, null, null));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Term a = frame.left;
            Term b = frame.right;
            if (a.getKind() != b.getKind()) return false;

            switch (a.getKind()) {
                case VARIABLE: {
                    String x = ((Variable) a).getName();
                    String y = ((Variable) b).getName();
                    int i = Scope.indexOf(frame.leftScope, x);
                    int j = Scope.indexOf(frame.rightScope, y);
                    if (i != j) return false;
                    if (i < 0 && !x.equals(y)) return false;
                    break;
                }
                case ABSTRACTION: {
                    Abstraction x = (Abstraction) a;
                    Abstraction y = (Abstraction) b;
                    stack.push(new Frame(x.getBody(), y.getBody(),
                            new Scope(x.getParam(), frame.leftScope),
                            new Scope(y.getParam(), frame.rightScope)));
                    break;
                }
                case APPLICATION: {
                    Application x = (Application) a;
                    Application y = (Application) b;
                    stack.push(new Frame(x.getArgument(), y.getArgument(), frame.leftScope, frame.rightScope));
                    stack.push(new Frame(x.getFunction(), y.getFunction(), frame.leftScope, frame.rightScope));
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown term kind: " + a.getKind());
            }
        }
        return true;
    }

    private static final class Frame {
        final Term left;
        final Term right;
        final Scope leftScope;
        final Scope rightScope;

        Frame(Term left, Term right, Scope leftScope, Scope rightScope) {
            this.left = left;
            this.right = right;
            this.leftScope = leftScope;
            this.rightScope = rightScope;
        }
    }

    /**
     * 不可变的绑定链，最内层在前
     */
    private static final class Scope {
        final String name;
        final Scope outer;

        Scope(String name, Scope outer) {
            this.name = name;
            this.outer = outer;
        }

        /** 名字到最近绑定点的距离，自由变量返回 -1 */
        static int indexOf(Scope scope, String name) {
            int index = 0;
            for (Scope s = scope; s != null; s = s.outer) {
                if (s.name.equals(name)) return index;
                index++;
            }
            return -1;
        }
    }
}
