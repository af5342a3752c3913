package com.lambdacalc.cli.render;

import com.lambdacalc.cli.config.LambdaConfig;
import com.lambdacalc.compiler.ast.ChurchNumerals;
import com.lambdacalc.compiler.ast.Term;
import com.lambdacalc.runtime.Outcome;
import com.lambdacalc.runtime.Reducer;
import com.lambdacalc.runtime.ReductionResult;
import com.lambdacalc.runtime.RuleKind;
import com.lambdacalc.runtime.StepListener;

import java.io.PrintStream;

/**
 * 逐步打印归约过程
 *
 * <pre>
 * Step 0: (λx.x)y
 * Step 1 (β): y
 * → normal form reached.
 * </pre>
 *
 * 每一步在产生时立即输出，发散的项也能看到进展。
 */
public class TracePrinter {
    private final PrintStream out;
    private final TermRenderer renderer;
    private final boolean colorDiff;
    private final boolean showStepType;
    private final boolean deltaAbstract;

    public TracePrinter(PrintStream out, LambdaConfig config) {
        this.out = out;
        this.renderer = new TermRenderer(config.isCompact(), config.isColorParens());
        this.colorDiff = config.isColorDiff();
        this.showStepType = config.isShowStepType();
        this.deltaAbstract = config.isDeltaAbstract();
    }

    public ReductionResult print(Reducer reducer, Term term, long maxSteps) {
        StepPrinter printer = new StepPrinter(renderer.render(term));
        out.println("Step 0: " + printer.previous);

        ReductionResult result = reducer.run(term, maxSteps, printer);

        if (result.getOutcome() == Outcome.NORMAL_FORM) {
            out.println("→ normal form reached.");
        } else {
            out.println(limitMessage(maxSteps));
        }
        if (deltaAbstract) {
            out.println();
            out.println("δ-abstracted: " + renderer.render(ChurchNumerals.abstractNumerals(result.getFinalTerm())));
            out.println();
        }
        return result;
    }

    static String limitMessage(long maxSteps) {
        if (maxSteps == Reducer.UNLIMITED) {
            return "→ step limit reached (无上限); reduction stopped.";
        }
        return "→ step limit of " + maxSteps + " reached; reduction stopped.";
    }

    private final class StepPrinter implements StepListener {
        private String previous;

        StepPrinter(String initial) {
            this.previous = initial;
        }

        @Override
        public void onStep(long index, Term before, RuleKind rule, Term after) {
            String rendered = renderer.render(after);
            if (colorDiff) {
                rendered = DiffHighlighter.highlight(previous, rendered);
            }
            String label = showStepType ? " (" + rule.getSymbol() + ")" : "";
            out.println("Step " + index + label + ": " + rendered);
            previous = rendered;
        }
    }
}
