/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.solver;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.ProductEquationTerm;
import com.powsybl.openunitops.equations.Variable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NewtonRaphsonTest {

    /**
     * x * x = c and x * y = d, with c and d fixed.
     */
    private static EquationBlock createBlock(double x0) {
        EquationBlock block = new EquationBlock("block");
        Variable x = block.createVariable("x", x0);
        Variable y = block.createVariable("y", 1);
        Variable c = block.createVariable("c", 4).fix();
        Variable d = block.createVariable("d", 6).fix();
        block.createEquation("square")
                .addTerm(new ProductEquationTerm(x, x))
                .addTerm(c.createTerm().minus());
        block.createEquation("product")
                .addTerm(new ProductEquationTerm(x, y))
                .addTerm(d.createTerm().minus());
        return block;
    }

    @Test
    void testSolve() {
        EquationBlock block = createBlock(1);
        SolverResult result = new NewtonRaphson().solve(block, new SolverParameters());
        assertEquals(SolverStatus.OPTIMAL, result.getStatus());
        assertTrue(result.getIterations() > 0);
        assertTrue(result.getMismatchNorm() < 1e-7);
        assertEquals(2, block.getVariable("x").getValue(), 1e-6);
        assertEquals(3, block.getVariable("y").getValue(), 1e-6);
        assertEquals(4, block.getVariable("c").getValue(), 0);
    }

    @Test
    void testAlreadySolved() {
        EquationBlock block = createBlock(2);
        block.getVariable("y").setValue(3);
        SolverResult result = new NewtonRaphson().solve(block, new SolverParameters());
        assertEquals(SolverStatus.OPTIMAL, result.getStatus());
        assertEquals(0, result.getIterations());
    }

    @Test
    void testMaxIterations() {
        EquationBlock block = createBlock(1);
        SolverResult result = new NewtonRaphson().solve(block, new SolverParameters().setMaxIterations(1));
        assertEquals(SolverStatus.MAX_ITERATION_REACHED, result.getStatus());
        assertEquals(1, result.getIterations());
        assertFalse(result.isOptimal());
    }

    @Test
    void testBounds() {
        EquationBlock block = createBlock(1);
        block.getVariable("x").setBounds(0, 1.5);
        SolverResult result = new NewtonRaphson().solve(block, new SolverParameters().setMaxIterations(20));
        assertFalse(result.isOptimal());
        assertTrue(block.getVariable("x").getValue() <= 1.5);
    }

    @Test
    void testNonSquareBlock() {
        EquationBlock block = createBlock(1);
        block.getVariable("c").unfix();
        SolverParameters parameters = new SolverParameters();
        NewtonRaphson solver = new NewtonRaphson();
        PowsyblException e = assertThrows(PowsyblException.class, () -> solver.solve(block, parameters));
        assertEquals("Expected to have same number of equations (2) and variables (3) in block 'block'", e.getMessage());
    }
}
