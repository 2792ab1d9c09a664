/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.equations;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EquationTest {

    @Test
    void testEvalAndDer() {
        EquationBlock block = new EquationBlock("block");
        Variable f = block.createVariable("f", 2);
        Variable h = block.createVariable("h", 1500);
        Variable q = block.createVariable("q", 1000);

        // f * h - q
        Equation equation = block.createEquation("energy")
                .addTerm(new ProductEquationTerm(f, h))
                .addTerm(q.createTerm().minus());
        assertEquals(2000, equation.eval(), 0);
        assertEquals(3000, equation.getScale(), 0);
        assertEquals(List.of(f, h, q), List.copyOf(equation.getVariables()));

        Map<Variable, Double> ders = new LinkedHashMap<>();
        equation.der(ders::put);
        assertEquals(Map.of(f, 1500.0, h, 2.0, q, -1.0), ders);
    }

    @Test
    void testScaleIsAtLeastOne() {
        EquationBlock block = new EquationBlock("block");
        Variable x = block.createVariable("x", 1e-3);
        Equation equation = block.createEquation("small").addTerm(x.createTerm());
        assertEquals(1, equation.getScale(), 0);
    }

    @Test
    void testSquareProduct() {
        EquationBlock block = new EquationBlock("block");
        Variable x = block.createVariable("x", 3);
        EquationTerm term = new ProductEquationTerm(2, x, x);
        assertEquals(18, term.eval(), 0);
        assertEquals(12, term.der(x), 0);
        assertEquals(-12, term.minus().der(x), 0);
        assertEquals(36, term.multiply(2).eval(), 0);
        assertThrows(IllegalArgumentException.class, () -> new ProductEquationTerm(2));
    }

    @Test
    void testSameVariableInSeveralTerms() {
        EquationBlock block = new EquationBlock("block");
        Variable x = block.createVariable("x", 3);
        Equation equation = block.createEquation("e")
                .addTerm(x.createTerm())
                .addTerm(new ProductEquationTerm(x, x));
        Map<Variable, Double> ders = new LinkedHashMap<>();
        equation.der(ders::put);
        assertEquals(7, ders.get(x), 0);
    }
}
