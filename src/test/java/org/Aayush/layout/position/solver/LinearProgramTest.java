package org.Aayush.layout.position.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LinearProgram Tests")
class LinearProgramTest {

    @Test
    @DisplayName("Feasibility checks bounds, integrality and constraints")
    void testFeasibility() {
        LinearProgram program = new LinearProgram("check");
        int x = program.addContinuous("x", 0.0d, 10.0d);
        int b = program.addBinary("b");
        program.addConstraint("link", Double.NEGATIVE_INFINITY, 0.0d)
                .setCoefficient(x, 1.0d)
                .setCoefficient(b, -10.0d);

        assertTrue(program.isFeasible(new double[]{5.0d, 1.0d}, 1e-9));
        assertFalse(program.isFeasible(new double[]{5.0d, 0.0d}, 1e-9));
        assertFalse(program.isFeasible(new double[]{5.0d, 0.5d}, 1e-9));
        assertFalse(program.isFeasible(new double[]{11.0d, 1.0d}, 1e-9));
        assertThrows(IllegalArgumentException.class, () -> program.isFeasible(new double[]{1.0d}, 1e-9));
    }

    @Test
    @DisplayName("Malformed variables and constraints are refused")
    void testValidation() {
        LinearProgram program = new LinearProgram("bad");
        assertThrows(IllegalArgumentException.class, () -> program.addContinuous("x", 2.0d, 1.0d));
        assertThrows(IllegalArgumentException.class, () -> program.addConstraint("c", 1.0d, 0.0d));
        assertThrows(IndexOutOfBoundsException.class, () -> program.setObjective(3, 1.0d));
        assertThrows(IndexOutOfBoundsException.class,
                () -> program.addConstraint("d", 0.0d, 1.0d).setCoefficient(7, 1.0d));
    }
}
