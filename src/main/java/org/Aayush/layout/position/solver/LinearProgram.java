package org.Aayush.layout.position.solver;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Solver-neutral minimization problem: bounded (optionally integer) variables, a linear
 * objective and ranged linear constraints {@code lower <= sum(coef * var) <= upper}.
 *
 * <p>Infinite bounds mean "no bound". Variables are referenced by the dense index
 * returned when they are added.</p>
 */
public final class LinearProgram {
    @Getter
    @Accessors(fluent = true)
    private final String name;
    private final List<Variable> variables = new ArrayList<>();
    private final DoubleArrayList objective = new DoubleArrayList();
    private final List<Constraint> constraints = new ArrayList<>();

    public LinearProgram(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Adds a continuous variable.
     *
     * @return variable index.
     */
    public int addContinuous(String name, double lower, double upper) {
        return addVariable(new Variable(name, lower, upper, false));
    }

    /**
     * Adds a 0/1 integer variable.
     *
     * @return variable index.
     */
    public int addBinary(String name) {
        return addVariable(new Variable(name, 0.0d, 1.0d, true));
    }

    private int addVariable(Variable variable) {
        if (variable.lower() > variable.upper()) {
            throw new IllegalArgumentException("empty bounds for variable " + variable.name());
        }
        variables.add(variable);
        objective.add(0.0d);
        return variables.size() - 1;
    }

    /**
     * Sets the objective coefficient of a variable (minimized).
     */
    public void setObjective(int variable, double coefficient) {
        checkVariable(variable);
        objective.set(variable, coefficient);
    }

    /**
     * Adds a ranged constraint; fill it with {@link Constraint#setCoefficient}.
     */
    public Constraint addConstraint(String name, double lower, double upper) {
        Constraint constraint = new Constraint(this, name, lower, upper);
        constraints.add(constraint);
        return constraint;
    }

    public int variableCount() {
        return variables.size();
    }

    public Variable variable(int index) {
        return variables.get(index);
    }

    public double objectiveCoefficient(int index) {
        return objective.getDouble(index);
    }

    public List<Constraint> constraints() {
        return Collections.unmodifiableList(constraints);
    }

    /**
     * Returns whether any variable is integer.
     */
    public boolean isMixedInteger() {
        for (Variable variable : variables) {
            if (variable.integer()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Evaluates the objective for an assignment.
     */
    public double objectiveValue(double[] values) {
        checkAssignment(values);
        double total = 0.0d;
        for (int i = 0; i < values.length; i++) {
            total += objective.getDouble(i) * values[i];
        }
        return total;
    }

    /**
     * Checks bounds, integrality and constraints of an assignment within {@code tolerance}.
     */
    public boolean isFeasible(double[] values, double tolerance) {
        checkAssignment(values);
        for (int i = 0; i < values.length; i++) {
            Variable variable = variables.get(i);
            double value = values[i];
            if (!Double.isFinite(value)
                    || value < variable.lower() - tolerance
                    || value > variable.upper() + tolerance) {
                return false;
            }
            if (variable.integer() && Math.abs(value - Math.rint(value)) > tolerance) {
                return false;
            }
        }
        for (Constraint constraint : constraints) {
            double activity = constraint.activity(values);
            if (activity < constraint.lower() - tolerance || activity > constraint.upper() + tolerance) {
                return false;
            }
        }
        return true;
    }

    private void checkAssignment(double[] values) {
        if (values.length != variables.size()) {
            throw new IllegalArgumentException(
                    "assignment has " + values.length + " values for " + variables.size() + " variables"
            );
        }
    }

    void checkVariable(int variable) {
        if (variable < 0 || variable >= variables.size()) {
            throw new IndexOutOfBoundsException("unknown variable " + variable);
        }
    }

    /**
     * Variable definition.
     *
     * @param name diagnostic name.
     * @param lower lower bound, {@code -INF} when free.
     * @param upper upper bound, {@code +INF} when free.
     * @param integer whether the variable must take integer values.
     */
    public record Variable(String name, double lower, double upper, boolean integer) {
    }

    /**
     * Ranged linear constraint.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class Constraint {
        private final String name;
        private final double lower;
        private final double upper;
        @Getter(AccessLevel.NONE)
        private final LinearProgram owner;
        @Getter(AccessLevel.NONE)
        private final IntArrayList variables = new IntArrayList();
        @Getter(AccessLevel.NONE)
        private final DoubleArrayList coefficients = new DoubleArrayList();

        private Constraint(LinearProgram owner, String name, double lower, double upper) {
            if (lower > upper) {
                throw new IllegalArgumentException("empty range for constraint " + name);
            }
            this.owner = owner;
            this.name = name;
            this.lower = lower;
            this.upper = upper;
        }

        /**
         * Adds {@code coefficient * variable} to this constraint.
         */
        public Constraint setCoefficient(int variable, double coefficient) {
            owner.checkVariable(variable);
            variables.add(variable);
            coefficients.add(coefficient);
            return this;
        }

        public int termCount() {
            return variables.size();
        }

        public int termVariable(int term) {
            return variables.getInt(term);
        }

        public double termCoefficient(int term) {
            return coefficients.getDouble(term);
        }

        double activity(double[] values) {
            double activity = 0.0d;
            for (int term = 0; term < variables.size(); term++) {
                activity += coefficients.getDouble(term) * values[variables.getInt(term)];
            }
            return activity;
        }
    }
}
