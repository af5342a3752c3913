package com.lambdacalc.cli.render;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.lambdacalc.compiler.parser.Parser;
import com.lambdacalc.runtime.PrimitiveTable;
import com.lambdacalc.runtime.Reducer;
import com.lambdacalc.runtime.Trace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TraceJsonTest {

    private final Reducer reducer = new Reducer(PrimitiveTable.standard());

    @Test
    @DisplayName("步骤列表与汇总字段")
    void documentShape() {
        Trace trace = reducer.normalize(Parser.parse("(λx.⊤) y"));
        JsonObject json = TraceJson.toJson(trace, false, true);

        JsonArray steps = json.getAsJsonArray("steps");
        assertThat(steps).hasSize(3);
        JsonObject first = steps.get(0).getAsJsonObject();
        assertThat(first.get("step").getAsInt()).isZero();
        assertThat(first.get("expression").getAsString()).isEqualTo("(λx.⊤) y");
        assertThat(first.get("type").getAsString()).isEqualTo("initial");
        assertThat(steps.get(1).getAsJsonObject().get("type").getAsString()).isEqualTo("β");
        assertThat(steps.get(2).getAsJsonObject().get("type").getAsString()).isEqualTo("δ");

        assertThat(json.get("final_expression").getAsString()).isEqualTo("λx.(λy.x)");
        assertThat(json.get("total_steps").getAsInt()).isEqualTo(2);
        assertThat(json.get("outcome").getAsString()).isEqualTo("NORMAL_FORM");
    }

    @Test
    @DisplayName("δ-抽象关闭时 abstracted 为 null")
    void abstractedNull() {
        Trace trace = reducer.normalize(Parser.parse("+ 1 2"));
        String text = TraceJson.toJsonString(trace, true, false);
        assertThat(text).contains("\"abstracted\":null");
        JsonObject json = JsonParser.parseString(text).getAsJsonObject();
        assertThat(json.get("abstracted").isJsonNull()).isTrue();
    }

    @Test
    @DisplayName("δ-抽象开启时给出数字")
    void abstractedNumeral() {
        Trace trace = reducer.normalize(Parser.parse("+ 1 2"));
        assertThat(TraceJson.toJson(trace, true, true).get("abstracted").getAsString()).isEqualTo("3");
    }

    @Test
    @DisplayName("达到上限时的 outcome")
    void limitOutcome() {
        Trace trace = reducer.normalize(Parser.parse("(λx.x x) (λx.x x)"), 4);
        JsonObject json = TraceJson.toJson(trace, true, false);
        assertThat(json.get("outcome").getAsString()).isEqualTo("LIMIT_EXCEEDED");
        assertThat(json.get("total_steps").getAsInt()).isEqualTo(4);
    }
}
