package org.Aayush.layout.position.solver;

/**
 * Numeric LP/MILP capability consumed by the optimizing vertical positioner.
 *
 * <p>Implementations are invoked synchronously once per layout run and must honour the
 * budget: when it runs out without a feasible assignment they throw
 * {@link OptimizationTimeoutException}.</p>
 */
@FunctionalInterface
public interface OptimizationSolver {

    /**
     * Minimizes the program's objective.
     *
     * @param program problem to solve.
     * @param budget time and iteration limits.
     * @return one value per variable, in variable index order.
     * @throws OptimizationInfeasibleException when no feasible assignment exists or the
     * solver gives up without one.
     * @throws OptimizationTimeoutException when the budget is exhausted first.
     */
    double[] minimize(LinearProgram program, SolverBudget budget);
}
