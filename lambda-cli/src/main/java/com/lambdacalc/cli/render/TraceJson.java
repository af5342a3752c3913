package com.lambdacalc.cli.render;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.lambdacalc.compiler.ast.ChurchNumerals;
import com.lambdacalc.compiler.ast.TermPrinter;
import com.lambdacalc.runtime.Trace;

/**
 * 归约轨迹的 JSON 表示
 *
 * <pre>
 * {"steps":[{"step":0,"expression":"…","type":"initial"}, …],
 *  "final_expression":"…", "abstracted":"…"|null, "total_steps":N, "outcome":"NORMAL_FORM"}
 * </pre>
 */
public final class TraceJson {
    public static final String INITIAL = "initial";

    private static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    private TraceJson() {}

    /**
     * @param compact       是否去掉空格
     * @param deltaAbstract 是否附带 δ-抽象后的结果，否则 abstracted 为 null
     */
    public static JsonObject toJson(Trace trace, boolean compact, boolean deltaAbstract) {
        JsonArray steps = new JsonArray();
        for (int i = 0; i < trace.size(); i++) {
            JsonObject step = new JsonObject();
            step.addProperty("step", i);
            step.addProperty("expression", TermPrinter.print(trace.get(i).getTerm(), compact));
            step.addProperty("type", i == 0 ? INITIAL : trace.ruleProducing(i).getSymbol());
            steps.add(step);
        }

        JsonObject root = new JsonObject();
        root.add("steps", steps);
        root.addProperty("final_expression", TermPrinter.print(trace.getFinalTerm(), compact));
        if (deltaAbstract) {
            root.addProperty("abstracted",
                    TermPrinter.print(ChurchNumerals.abstractNumerals(trace.getFinalTerm()), compact));
        } else {
            root.add("abstracted", JsonNull.INSTANCE);
        }
        root.addProperty("total_steps", trace.getStepCount());
        root.addProperty("outcome", trace.getOutcome().name());
        return root;
    }

    public static String toJsonString(Trace trace, boolean compact, boolean deltaAbstract) {
        return GSON.toJson(toJson(trace, compact, deltaAbstract));
    }
}
