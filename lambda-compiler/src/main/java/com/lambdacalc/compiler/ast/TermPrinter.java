package com.lambdacalc.compiler.ast;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * λ 项的规范文本形式
 *
 * <ul>
 *   <li>抽象：{@code λp.body}，body 为抽象时加括号</li>
 *   <li>应用：{@code fn arg}，fn 为抽象时加括号；arg 为抽象或应用时加括号</li>
 *   <li>紧凑模式去掉所有空格</li>
 * </ul>
 */
public final class TermPrinter {

    public static final char LAMBDA = 'λ';

    private TermPrinter() {}

    public static String print(Term term) {
        return print(term, false);
    }

    public static String print(Term term, boolean compact) {
        String separator = compact ? "" : " ";
        StringBuilder sb = new StringBuilder();

        // 栈中元素为 Term 或待输出的 String，按逆序压栈
        Deque<Object> stack = new ArrayDeque<>();
        stack.push(term);
        while (!stack.isEmpty()) {
            Object item = stack.pop();
            if (item instanceof String) {
                sb.append((String) item);
                continue;
            }
            Term t = (Term) item;
            switch (t.getKind()) {
                case VARIABLE:
                    sb.append(((Variable) t).getName());
                    break;
                case ABSTRACTION: {
                    Abstraction abs = (Abstraction) t;
                    pushOperand(stack, abs.getBody(), abs.getBody().isAbstraction());
                    stack.push(LAMBDA + abs.getParam() + ".");
                    break;
                }
                case APPLICATION: {
                    Application app = (Application) t;
                    Term arg = app.getArgument();
                    pushOperand(stack, arg, arg.isAbstraction() || arg.isApplication());
                    stack.push(separator);
                    pushOperand(stack, app.getFunction(), app.getFunction().isAbstraction());
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown term kind: " + t.getKind());
            }
        }
        return sb.toString();
    }

    private static void pushOperand(Deque<Object> stack, Term operand, boolean parenthesize) {
        if (parenthesize) {
            stack.push(")");
            stack.push(operand);
            stack.push("(");
        } else {
            stack.push(operand);
        }
    }
}
