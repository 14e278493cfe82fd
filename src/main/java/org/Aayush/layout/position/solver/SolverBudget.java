package org.Aayush.layout.position.solver;

import lombok.Value;

/**
 * Caller-imposed limits for one solver invocation.
 *
 * <p>Non-positive limits mean unbounded.</p>
 */
@Value
public class SolverBudget {
    public static final long UNBOUNDED_MILLIS = Long.MAX_VALUE;
    public static final int UNBOUNDED_ITERATIONS = Integer.MAX_VALUE;

    static final String PROP_TIME_LIMIT_MILLIS = "sugikey.layout.solver.timeLimitMillis";
    static final String PROP_ITERATION_LIMIT = "sugikey.layout.solver.iterationLimit";

    long timeLimitMillis;
    int iterationLimit;

    private SolverBudget(long timeLimitMillis, int iterationLimit) {
        this.timeLimitMillis = timeLimitMillis <= 0L ? UNBOUNDED_MILLIS : timeLimitMillis;
        this.iterationLimit = iterationLimit <= 0 ? UNBOUNDED_ITERATIONS : iterationLimit;
    }

    /**
     * Creates a budget with explicit limits.
     */
    public static SolverBudget of(long timeLimitMillis, int iterationLimit) {
        return new SolverBudget(timeLimitMillis, iterationLimit);
    }

    /**
     * Creates a time-only budget.
     */
    public static SolverBudget ofMillis(long timeLimitMillis) {
        return new SolverBudget(timeLimitMillis, 0);
    }

    public static SolverBudget unbounded() {
        return new SolverBudget(0L, 0);
    }

    /**
     * Loads limits from system properties; missing or unparsable values mean unbounded.
     */
    public static SolverBudget defaults() {
        long iterations = Math.max(0L, Math.min(Integer.MAX_VALUE, readLong(PROP_ITERATION_LIMIT)));
        return new SolverBudget(readLong(PROP_TIME_LIMIT_MILLIS), (int) iterations);
    }

    public boolean hasTimeLimit() {
        return timeLimitMillis != UNBOUNDED_MILLIS;
    }

    public boolean hasIterationLimit() {
        return iterationLimit != UNBOUNDED_ITERATIONS;
    }

    private static long readLong(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }
}
