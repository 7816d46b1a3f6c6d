package com.delta.creatorscout.discovery.engine;

public final class ProgressCalculator {
    static final double CALL_WEIGHT = 0.3;
    static final double RESULT_WEIGHT = 0.7;
    static final int MAX_BEFORE_FINALIZE = 99;

    private ProgressCalculator() {}

    public static int calculate(int apiCallsMade, int apiCallBudget, int resultsCollected, int targetResultCount) {
        double callShare = apiCallBudget <= 0 ? 0.0 : (double) Math.max(0, apiCallsMade) / apiCallBudget;
        double resultShare = targetResultCount <= 0 ? 0.0 : (double) Math.max(0, resultsCollected) / targetResultCount;
        double progress = callShare * 100 * CALL_WEIGHT + resultShare * 100 * RESULT_WEIGHT;
        return (int) Math.min(100, Math.floor(progress));
    }

    // Never decreases and never shows 100 before finalize.
    public static int intermediate(int previous, int apiCallsMade, int apiCallBudget, int resultsCollected, int targetResultCount) {
        int computed = calculate(apiCallsMade, apiCallBudget, resultsCollected, targetResultCount);
        return Math.min(MAX_BEFORE_FINALIZE, Math.max(Math.max(0, previous), computed));
    }
}
