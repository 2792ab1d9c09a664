/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openunitops.config.UnitConfig;
import com.powsybl.openunitops.equations.Equation;
import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.Variable;
import com.powsybl.openunitops.properties.StateBlock;
import com.powsybl.openunitops.properties.WaterSteamPropertyPackage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArcTest {

    private EquationBlock parent;

    private Mixer upstream;

    private Mixer downstream;

    @BeforeEach
    void setUp() {
        parent = new EquationBlock("plant");
        UnitConfig config = Mixer.SCHEMA.create(Map.of(AbstractSubUnit.PROPERTY_PACKAGE, new WaterSteamPropertyPackage()));
        upstream = new Mixer("upstream", parent, config);
        downstream = new Mixer("downstream", parent, config);
    }

    @Test
    void testPropagate() {
        Port source = upstream.getOutlet();
        Port destination = downstream.getPort("steam");
        source.getVariable(StateBlock.FLOW_MOL).setValue(12);
        source.getVariable(StateBlock.ENTH_MOL).setValue(45000);
        source.getVariable(StateBlock.PRESSURE).fix(150000);

        Arc arc = new Arc("link", source, destination);
        assertFalse(arc.isTear());
        arc.propagate();
        assertEquals(12, destination.getVariable(StateBlock.FLOW_MOL).getValue(), 0);
        assertEquals(45000, destination.getVariable(StateBlock.ENTH_MOL).getValue(), 0);
        assertEquals(150000, destination.getVariable(StateBlock.PRESSURE).getValue(), 0);
        assertFalse(destination.isFixed());
        assertFalse(destination.getVariable(StateBlock.PRESSURE).isFixed());

        arc.propagate();
        assertEquals(12, destination.getVariable(StateBlock.FLOW_MOL).getValue(), 0);
        assertEquals(45000, source.getVariable(StateBlock.ENTH_MOL).getValue(), 0);
        assertEquals("Arc(link: plant.upstream.outlet -> plant.downstream.steam)", arc.toString());
    }

    @Test
    void testExpand() {
        Arc arc = new Arc("link", upstream.getOutlet(), downstream.getPort("steam"), true);
        assertTrue(arc.isTear());
        EquationBlock expanded = arc.expand(parent);
        assertEquals("plant.link_expanded", expanded.getPath());
        assertEquals(List.of("flow_mol_equality", "enth_mol_equality", "pressure_equality"),
                expanded.getEquations().stream().map(Equation::getName).toList());

        Variable sourceFlow = upstream.getOutlet().getVariable(StateBlock.FLOW_MOL);
        Variable destinationFlow = downstream.getPort("steam").getVariable(StateBlock.FLOW_MOL);
        sourceFlow.setValue(3);
        destinationFlow.setValue(5);
        assertEquals(2, expanded.getEquation("flow_mol_equality").eval(), 0);
    }

    @Test
    void testPorts() {
        Port steam = downstream.getPort("steam");
        assertEquals("plant.downstream.steam", steam.getPath());
        assertTrue(steam.isInlet());
        assertSame(downstream, steam.getUnit());
        assertEquals(List.of(StateBlock.FLOW_MOL, StateBlock.ENTH_MOL, StateBlock.PRESSURE), List.copyOf(steam.getVariables().keySet()));

        steam.fix();
        assertTrue(steam.isFixed());
        steam.unfix();
        assertFalse(steam.getVariable(StateBlock.FLOW_MOL).isFixed());

        PowsyblException e = assertThrows(PowsyblException.class, () -> steam.getVariable(StateBlock.TEMPERATURE));
        assertEquals("Port 'plant.downstream.steam' has no member 'temperature'", e.getMessage());
    }
}
