package com.lambdacalc.runtime;

import com.lambdacalc.compiler.InvariantViolationException;
import com.lambdacalc.compiler.ast.Term;
import com.lambdacalc.compiler.parser.Parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * δ 归约使用的原语表：名字 → λ 项定义
 *
 * <p>构建后只读，可在多个 {@link Reducer} 和线程之间共享。
 * 定义中出现的其他原语名是自由变量，归约到时再展开。</p>
 */
public final class PrimitiveTable {
    private static final Logger LOG = Logger.getLogger(PrimitiveTable.class.getName());

    // 布尔
    public static final String TRUE = "⊤";
    public static final String FALSE = "⊥";
    public static final String AND = "∧";
    public static final String OR = "∨";
    public static final String NOT = "¬";
    // 算术
    public static final String PRED = "↓";
    public static final String SUCC = "↑";
    public static final String ADD = "+";
    public static final String MUL = "*";
    public static final String SUB = "-";
    // 比较
    public static final String IS_ZERO = "is0";
    public static final String LEQ = "≤";
    // 序对
    public static final String PAIR = "pair";
    public static final String FIRST = "fst";
    public static final String SECOND = "snd";

    private static final PrimitiveTable EMPTY = new PrimitiveTable(Collections.<String, Term>emptyMap());

    private final Map<String, Term> definitions;

    private PrimitiveTable(Map<String, Term> definitions) {
        this.definitions = definitions;
    }

    /**
     * 标准原语表
     */
    public static PrimitiveTable standard() {
        PrimitiveTable table = builder()
                .define(TRUE, "λx.λy.x")
                .define(FALSE, "λx.λy.y")
                .define(AND, "λp.λq.p q p")
                .define(OR, "λp.λq.p p q")
                .define(NOT, "λp.p ⊥ ⊤")
                .define(PRED, "λn.λf.λx.n (λg.λh.h (g f)) (λu.x) (λu.u)")
                .define(SUCC, "λn.λf.λx.f (n f x)")
                .define(ADD, "λm.λn.m ↑ n")
                .define(MUL, "λm.λn.m (+ n) 0")
                .define(SUB, "λm.λn.n ↓ m")
                .define(IS_ZERO, "λn.n (λx.⊥) ⊤")
                .define(LEQ, "λm.λn.is0 (- m n)")
                .define(PAIR, "λx.λy.λf.f x y")
                .define(FIRST, "λp.p ⊤")
                .define(SECOND, "λp.p ⊥")
                .build();
        LOG.fine("标准原语表已构建: " + table.size() + " 个定义");
        return table;
    }

    /**
     * 空表：所有名字都是普通自由变量，只做 β 归约
     */
    public static PrimitiveTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    /**
     * 获取定义，不存在时返回 null
     */
    public Term get(String name) {
        return definitions.get(name);
    }

    public Set<String> names() {
        return definitions.keySet();
    }

    /**
     * 按定义顺序的只读视图
     */
    public Map<String, Term> asMap() {
        return definitions;
    }

    public int size() {
        return definitions.size();
    }

    @Override
    public String toString() {
        return "PrimitiveTable" + definitions.keySet();
    }

    public static final class Builder {
        private final Map<String, Term> definitions = new LinkedHashMap<>();

        private Builder() {}

        /**
         * 从源码定义原语
         *
         * @throws com.lambdacalc.compiler.parser.ParseException 定义源码语法错误
         */
        public Builder define(String name, String source) {
            return define(name, Parser.parse(source));
        }

        public Builder define(String name, Term definition) {
            InvariantViolationException.requireName(name, "原语名");
            InvariantViolationException.requireNonNull(definition, "原语定义");
            definitions.put(name, definition);
            return this;
        }

        public PrimitiveTable build() {
            return new PrimitiveTable(Collections.unmodifiableMap(new LinkedHashMap<>(definitions)));
        }
    }
}
