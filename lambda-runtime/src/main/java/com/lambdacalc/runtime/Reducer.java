package com.lambdacalc.runtime;

import com.lambdacalc.compiler.InvariantViolationException;
import com.lambdacalc.compiler.ast.Abstraction;
import com.lambdacalc.compiler.ast.Application;
import com.lambdacalc.compiler.ast.Term;
import com.lambdacalc.compiler.ast.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 正规序（最左最外）归约引擎
 *
 * <p>前序遍历寻找第一个 redex：函数位置先于参数，抽象体在其上方无 redex 时才进入。
 * 访问到的节点若是原语名变量则做 δ 展开；若是函数部分为抽象的应用则做 β 归约。</p>
 *
 * <p>引擎无状态，原语表只读，同一实例可被多个线程同时使用。</p>
 */
public final class Reducer {
    private static final Logger LOG = Logger.getLogger(Reducer.class.getName());

    /** "无上限"，仍是有限值，保证调用本身总会返回 */
    public static final long UNLIMITED = Long.MAX_VALUE;

    private final PrimitiveTable primitives;

    public Reducer(PrimitiveTable primitives) {
        this.primitives = InvariantViolationException.requireNonNull(primitives, "原语表");
    }

    /**
     * 使用标准原语表
     */
    public Reducer() {
        this(PrimitiveTable.standard());
    }

    public PrimitiveTable getPrimitives() {
        return primitives;
    }

    // ============ 单步 ============

    /**
     * 执行一步正规序归约；已是范式时返回原项和 {@link RuleKind#NONE}
     */
    public ReductionStep reduceOnce(Term term) {
        InvariantViolationException.requireNonNull(term, "待归约的项");

        Deque<Position> stack = new ArrayDeque<>();
        stack.push(new Position(term, null, Direction.ROOT));

        while (!stack.isEmpty()) {
            Position pos = stack.pop();
            Term t = pos.term;
            switch (t.getKind()) {
                case VARIABLE: {
                    Term definition = primitives.get(((Variable) t).getName());
                    if (definition != null) {
                        return new ReductionStep(pos.plugInto(definition), RuleKind.DELTA);
                    }
                    break;
                }
                case APPLICATION: {
                    Application app = (Application) t;
                    if (app.isBetaRedex()) {
                        Abstraction fn = (Abstraction) app.getFunction();
                        Term reduced = Substitution.subst(fn.getBody(), fn.getParam(), app.getArgument());
                        return new ReductionStep(pos.plugInto(reduced), RuleKind.BETA);
                    }
                    stack.push(new Position(app.getArgument(), pos, Direction.ARGUMENT));
                    stack.push(new Position(app.getFunction(), pos, Direction.FUNCTION));
                    break;
                }
                case ABSTRACTION:
                    stack.push(new Position(((Abstraction) t).getBody(), pos, Direction.BODY));
                    break;
                default:
                    throw new IllegalStateException("Unknown term kind: " + t.getKind());
            }
        }
        return ReductionStep.normalForm(term);
    }

    // ============ 驱动循环 ============

    /**
     * 归约到范式或达到步数上限，返回完整轨迹
     *
     * @param maxSteps 最多执行的归约步数，{@link #UNLIMITED} 表示不限
     */
    public Trace normalize(Term term, long maxSteps) {
        List<TraceEntry> entries = new ArrayList<>();
        ReductionResult result = run(term, maxSteps,
                (index, before, rule, after) -> entries.add(new TraceEntry(before, rule)));
        entries.add(new TraceEntry(result.getFinalTerm(), RuleKind.NONE));
        return new Trace(entries, result.getOutcome());
    }

    public Trace normalize(Term term) {
        return normalize(term, UNLIMITED);
    }

    /**
     * 流式归约：每一步通知 listener，不保留中间项
     */
    public ReductionResult run(Term term, long maxSteps, StepListener listener) {
        InvariantViolationException.requireNonNull(term, "待归约的项");
        InvariantViolationException.requireNonNull(listener, "listener");
        if (maxSteps < 0) {
            throw new InvariantViolationException("步数上限不能为负数: " + maxSteps);
        }

        Term current = term;
        long beta = 0;
        long delta = 0;
        Outcome outcome;

        while (true) {
            ReductionStep step = reduceOnce(current);
            if (!step.isReduced()) {
                outcome = Outcome.NORMAL_FORM;
                break;
            }
            if (beta + delta >= maxSteps) {
                outcome = Outcome.LIMIT_EXCEEDED;
                break;
            }
            if (step.getRule() == RuleKind.BETA) {
                beta++;
            } else {
                delta++;
            }
            listener.onStep(beta + delta, current, step.getRule(), step.getTerm());
            current = step.getTerm();
        }

        if (outcome == Outcome.LIMIT_EXCEEDED) {
            LOG.fine("达到步数上限 " + maxSteps + "，停止归约");
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("归约结束: " + outcome + ", β=" + beta + ", δ=" + delta);
        }
        return new ReductionResult(term, current, beta, delta, outcome);
    }

    // ============ 位置路径 ============

    private enum Direction {
        ROOT,
        FUNCTION,
        ARGUMENT,
        BODY
    }

    /**
     * 子项及其到根的路径，用于把归约结果重新嵌回原项（兄弟子树共享）
     */
    private static final class Position {
        final Term term;
        final Position parent;
        final Direction direction;

        Position(Term term, Position parent, Direction direction) {
            this.term = term;
            this.parent = parent;
            this.direction = direction;
        }

        Term plugInto(Term replacement) {
            Term result = replacement;
            Position pos = this;
            while (pos.parent != null) {
                Term parentTerm = pos.parent.term;
                switch (pos.direction) {
                    case FUNCTION:
                        result = new Application(result, ((Application) parentTerm).getArgument());
                        break;
                    case ARGUMENT:
                        result = new Application(((Application) parentTerm).getFunction(), result);
                        break;
                    case BODY:
                        result = new Abstraction(((Abstraction) parentTerm).getParam(), result);
                        break;
                    default:
                        throw new IllegalStateException("Unexpected direction: " + pos.direction);
                }
                pos = pos.parent;
            }
            return result;
        }
    }
}
