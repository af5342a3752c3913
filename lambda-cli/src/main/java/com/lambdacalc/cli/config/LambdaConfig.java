package com.lambdacalc.cli.config;

import com.lambdacalc.runtime.Reducer;

/**
 * 显示与归约配置
 */
public class LambdaConfig {
    private boolean colorParens = true;
    private boolean colorDiff = false;
    private boolean showStepType = true;
    private boolean compact = true;
    private boolean deltaAbstract = true;
    private long recursionLimit = -1;

    public LambdaConfig() {
    }

    public boolean isColorParens() {
        return colorParens;
    }

    public void setColorParens(boolean colorParens) {
        this.colorParens = colorParens;
    }

    public boolean isColorDiff() {
        return colorDiff;
    }

    public void setColorDiff(boolean colorDiff) {
        this.colorDiff = colorDiff;
    }

    public boolean isShowStepType() {
        return showStepType;
    }

    public void setShowStepType(boolean showStepType) {
        this.showStepType = showStepType;
    }

    public boolean isCompact() {
        return compact;
    }

    public void setCompact(boolean compact) {
        this.compact = compact;
    }

    public boolean isDeltaAbstract() {
        return deltaAbstract;
    }

    public void setDeltaAbstract(boolean deltaAbstract) {
        this.deltaAbstract = deltaAbstract;
    }

    /** ≤ 0 表示不限步数 */
    public long getRecursionLimit() {
        return recursionLimit;
    }

    public void setRecursionLimit(long recursionLimit) {
        this.recursionLimit = recursionLimit;
    }

    /**
     * 传给 {@link Reducer} 的步数上限
     */
    public long getMaxSteps() {
        return recursionLimit <= 0 ? Reducer.UNLIMITED : recursionLimit;
    }

    public LambdaConfig copy() {
        LambdaConfig c = new LambdaConfig();
        c.colorParens = colorParens;
        c.colorDiff = colorDiff;
        c.showStepType = showStepType;
        c.compact = compact;
        c.deltaAbstract = deltaAbstract;
        c.recursionLimit = recursionLimit;
        return c;
    }

    @Override
    public String toString() {
        return "colorParens=" + colorParens
                + ", colorDiff=" + colorDiff
                + ", showStepType=" + showStepType
                + ", compact=" + compact
                + ", deltaAbstract=" + deltaAbstract
                + ", recursionLimit=" + recursionLimit;
    }
}
