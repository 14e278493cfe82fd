package org.Aayush.layout.position.solver;

import lombok.extern.slf4j.Slf4j;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import java.util.Objects;

/**
 * {@link OptimizationSolver} backed by ojalgo's {@link ExpressionsBasedModel}.
 *
 * <p>Pure LPs go to ojalgo's simplex solver, programs with integer variables to its
 * branch-and-bound integer solver. The budget maps onto the model's abort options.</p>
 */
@Slf4j
public final class OjAlgoOptimizationSolver implements OptimizationSolver {

    @Override
    public double[] minimize(LinearProgram program, SolverBudget budget) {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(budget, "budget");

        ExpressionsBasedModel model = new ExpressionsBasedModel();
        int variableCount = program.variableCount();
        Variable[] variables = new Variable[variableCount];
        for (int i = 0; i < variableCount; i++) {
            LinearProgram.Variable definition = program.variable(i);
            Variable variable = model.addVariable(definition.name());
            if (Double.isFinite(definition.lower())) {
                variable.lower(definition.lower());
            }
            if (Double.isFinite(definition.upper())) {
                variable.upper(definition.upper());
            }
            if (definition.integer()) {
                variable.integer(true);
            }
            double weight = program.objectiveCoefficient(i);
            if (weight != 0.0d) {
                variable.weight(weight);
            }
            variables[i] = variable;
        }
        for (LinearProgram.Constraint constraint : program.constraints()) {
            Expression expression = model.addExpression(constraint.name());
            for (int term = 0; term < constraint.termCount(); term++) {
                expression.set(variables[constraint.termVariable(term)], constraint.termCoefficient(term));
            }
            if (Double.isFinite(constraint.lower())) {
                expression.lower(constraint.lower());
            }
            if (Double.isFinite(constraint.upper())) {
                expression.upper(constraint.upper());
            }
        }
        if (budget.hasTimeLimit()) {
            model.options.time_abort = budget.getTimeLimitMillis();
        }
        if (budget.hasIterationLimit()) {
            model.options.iterations_abort = budget.getIterationLimit();
        }

        long started = System.currentTimeMillis();
        Optimisation.Result result = model.minimise();
        long elapsed = System.currentTimeMillis() - started;
        Optimisation.State state = result.getState();
        log.debug("Solved {} ({} variables, {} constraints, integer={}): state {} in {} ms",
                program.name(), variableCount, program.constraints().size(), program.isMixedInteger(), state, elapsed);

        if (state.isFeasible()) {
            double[] values = new double[variableCount];
            for (int i = 0; i < variableCount; i++) {
                values[i] = result.doubleValue(i);
                if (!Double.isFinite(values[i])) {
                    throw new OptimizationInfeasibleException(
                            program.name() + ": solver returned non-finite value for " + program.variable(i).name()
                    );
                }
            }
            return values;
        }
        if (budget.hasTimeLimit() && elapsed >= budget.getTimeLimitMillis()) {
            throw new OptimizationTimeoutException(
                    program.name() + ": no feasible solution within " + budget.getTimeLimitMillis() + " ms (state " + state + ")"
            );
        }
        if (state != Optimisation.State.INFEASIBLE && state != Optimisation.State.UNBOUNDED && budget.hasIterationLimit()) {
            throw new OptimizationTimeoutException(
                    program.name() + ": no feasible solution within " + budget.getIterationLimit() + " iterations (state " + state + ")"
            );
        }
        throw new OptimizationInfeasibleException(program.name() + ": solver finished with state " + state);
    }
}
