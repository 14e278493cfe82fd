package org.Aayush.layout.position.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OjAlgoOptimizationSolver Tests")
class OjAlgoOptimizationSolverTest {
    private final OptimizationSolver solver = new OjAlgoOptimizationSolver();

    @Test
    @DisplayName("Continuous program reaches its optimum")
    void testLinearOptimum() {
        LinearProgram program = new LinearProgram("lp");
        int x = program.addContinuous("x", 0.5d, Double.POSITIVE_INFINITY);
        int y = program.addContinuous("y", 0.0d, Double.POSITIVE_INFINITY);
        program.setObjective(x, 1.0d);
        program.setObjective(y, 2.0d);
        program.addConstraint("cover", 2.0d, Double.POSITIVE_INFINITY)
                .setCoefficient(x, 1.0d)
                .setCoefficient(y, 1.0d);

        double[] values = solver.minimize(program, SolverBudget.unbounded());

        assertEquals(2.0d, values[x], 1e-6);
        assertEquals(0.0d, values[y], 1e-6);
        assertEquals(2.0d, program.objectiveValue(values), 1e-6);
        assertTrue(program.isFeasible(values, 1e-6));
    }

    @Test
    @DisplayName("Binary program picks the better single item")
    void testMixedIntegerOptimum() {
        LinearProgram program = new LinearProgram("knapsack");
        int a = program.addBinary("a");
        int b = program.addBinary("b");
        program.setObjective(a, -5.0d);
        program.setObjective(b, -4.0d);
        program.addConstraint("capacity", Double.NEGATIVE_INFINITY, 4.0d)
                .setCoefficient(a, 3.0d)
                .setCoefficient(b, 2.0d);

        double[] values = solver.minimize(program, SolverBudget.ofMillis(10_000L));

        assertEquals(1.0d, values[a], 1e-6);
        assertEquals(0.0d, values[b], 1e-6);
        assertTrue(program.isMixedInteger());
    }

    @Test
    @DisplayName("Contradicting bounds surface as infeasible")
    void testInfeasible() {
        LinearProgram program = new LinearProgram("impossible");
        int x = program.addContinuous("x", 0.0d, 1.0d);
        program.setObjective(x, 1.0d);
        program.addConstraint("too-high", 2.0d, Double.POSITIVE_INFINITY).setCoefficient(x, 1.0d);

        OptimizationInfeasibleException ex = assertThrows(
                OptimizationInfeasibleException.class,
                () -> solver.minimize(program, SolverBudget.unbounded())
        );
        assertEquals(OptimizationInfeasibleException.REASON_INFEASIBLE, ex.reasonCode());
    }
}
