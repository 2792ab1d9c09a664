/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.equations;

import com.powsybl.commons.PowsyblException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EquationBlockTest {

    @Test
    void testPaths() {
        EquationBlock root = new EquationBlock("fwh");
        EquationBlock condense = root.createBlock("condense");
        Variable area = condense.createVariable("area", 10);
        Equation equation = condense.createEquation("heat_transfer_equation");

        assertEquals("fwh.condense.area", area.getPath());
        assertEquals("fwh.condense.heat_transfer_equation", equation.getPath());
        assertEquals("condense.area", root.getRelativePath(area.getPath()));
        assertSame(area, root.findVariable("condense.area").orElseThrow());
        assertSame(equation, root.findEquation("condense.heat_transfer_equation").orElseThrow());
        assertTrue(root.findVariable("cooling.area").isEmpty());
        assertTrue(root.findVariable("condense.heat_transfer_equation").isEmpty());
        assertSame(root, condense.getParent().orElseThrow());
        assertTrue(root.getParent().isEmpty());
        assertThrows(PowsyblException.class, () -> condense.getRelativePath("fwh.cooling.area"));
    }

    @Test
    void testNames() {
        EquationBlock block = new EquationBlock("block");
        block.createVariable("x", 0);
        PowsyblException e = assertThrows(PowsyblException.class, () -> block.createEquation("x"));
        assertEquals("Component 'x' already exists in block 'block'", e.getMessage());
        e = assertThrows(PowsyblException.class, () -> block.createBlock("a.b"));
        assertEquals("Invalid component name 'a.b'", e.getMessage());
        e = assertThrows(PowsyblException.class, () -> block.getVariable("y"));
        assertEquals("Variable 'y' not found in block 'block'", e.getMessage());
    }

    @Test
    void testDegreesOfFreedom() {
        EquationBlock root = new EquationBlock("root");
        Variable x = root.createVariable("x", 1);
        Variable y = root.createVariable("y", 2);
        EquationBlock child = root.createBlock("child");
        Variable z = child.createVariable("z", 3);
        child.createVariable("unused", 4);

        Equation sum = root.createEquation("sum")
                .addTerm(x.createTerm())
                .addTerm(y.createTerm())
                .addTerm(z.createTerm().minus());
        assertEquals(2, root.getDegreesOfFreedom());
        assertEquals(List.of(x, y, z, child.getVariable("unused")), root.getAllVariables());

        child.createEquation("product").addTerm(new ProductEquationTerm(x, z)).addTerm(y.createTerm().minus());
        assertEquals(1, root.getDegreesOfFreedom());
        // the child block alone only sees its own equation
        assertEquals(2, child.getDegreesOfFreedom());

        x.fix();
        assertEquals(0, root.getDegreesOfFreedom());
        sum.setActive(false);
        assertEquals(1, root.getDegreesOfFreedom());
        assertEquals(1, root.getActiveEquations().size());
    }

    @Test
    void testVariable() {
        EquationBlock block = new EquationBlock("block");
        Variable x = block.createVariable("x", Double.NaN);
        PowsyblException e = assertThrows(PowsyblException.class, x::fix);
        assertEquals("Cannot fix variable 'block.x' without a value", e.getMessage());
        x.fix(2);
        assertTrue(x.isFixed());
        assertThrows(PowsyblException.class, () -> x.setValue(Double.NaN));
        assertEquals("Variable(path=block.x, value=2.0, fixed=true)", x.toString());

        x.setBounds(0, 1);
        assertEquals(1, x.clamp(3), 0);
        assertEquals(0, x.clamp(-3), 0);
        assertThrows(IllegalArgumentException.class, () -> x.setBounds(1, 0));
    }
}
