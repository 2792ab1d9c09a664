/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit;

import com.powsybl.openunitops.config.ConfigurationException;
import com.powsybl.openunitops.config.UnitConfig;
import com.powsybl.openunitops.initialization.InitializationParameters;
import com.powsybl.openunitops.initialization.InitializationResult;
import com.powsybl.openunitops.initialization.InitializationStep;
import com.powsybl.openunitops.properties.StateBlock;
import com.powsybl.openunitops.properties.WaterSteamProperties;
import com.powsybl.openunitops.properties.WaterSteamPropertyPackage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HeatExchangerTest {

    private static UnitConfig createConfig(HeatExchanger.DeltaTemperatureRule rule) {
        WaterSteamPropertyPackage propertyPackage = new WaterSteamPropertyPackage();
        return HeatExchanger.SCHEMA.create(Map.of(
                HeatExchanger.DELTA_TEMPERATURE_RULE, rule,
                HeatExchanger.SIDE_1, Map.of(AbstractSubUnit.PROPERTY_PACKAGE, propertyPackage),
                HeatExchanger.SIDE_2, Map.of(AbstractSubUnit.PROPERTY_PACKAGE, propertyPackage)));
    }

    private static void fixInlet(Port port, double flow, double enthalpy, double pressure) {
        port.getVariable(StateBlock.FLOW_MOL).fix(flow);
        port.getVariable(StateBlock.ENTH_MOL).fix(enthalpy);
        port.getVariable(StateBlock.PRESSURE).fix(pressure);
    }

    private static HeatExchanger createCooler(HeatExchanger.DeltaTemperatureRule rule) {
        HeatExchanger hx = new HeatExchanger("hx", createConfig(rule));
        // subcooled hot water cooled by colder water
        fixInlet(hx.getInlet1(), 10, 6000, 201325);
        fixInlet(hx.getInlet2(), 20, 2000, 101325);
        hx.getArea().fix(50);
        hx.getOverallHeatTransferCoefficient().fix(100);
        return hx;
    }

    @Test
    void testStructure() {
        HeatExchanger hx = new HeatExchanger("hx", createConfig(HeatExchanger.DeltaTemperatureRule.UNDERWOOD));
        assertEquals(List.of("inlet_1", "inlet_2"), hx.getInletPorts().stream().map(Port::getName).toList());
        assertEquals(List.of("outlet_1", "outlet_2"), hx.getOutletPorts().stream().map(Port::getName).toList());
        assertEquals(HeatExchanger.DEFAULT_AREA, hx.getArea().getValue(), 0);
        assertTrue(hx.getSpecialConstraints().isEmpty());
        assertTrue(hx.getDeterminedVariables().isEmpty());
        // 4 states x 4 variables + 4 unit variables, 4 temperature equations + 8 unit equations
        assertEquals(20 - 12, hx.getDegreesOfFreedom());

        List<InitializationStep> steps = hx.getInitializationPlan().getSteps();
        assertEquals(1, steps.size());
        assertEquals(InitializationStep.Kind.SOLVE, steps.get(0).getKind());
        assertSame(hx, steps.get(0).getTarget());
    }

    @Test
    void testMissingSidePropertyPackage() {
        UnitConfig config = HeatExchanger.SCHEMA.createDefault();
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new HeatExchanger("hx", config));
        assertEquals("No property package given for 'hx.side_1'", e.getMessage());
    }

    @Test
    void testInitialization() {
        for (HeatExchanger.DeltaTemperatureRule rule : HeatExchanger.DeltaTemperatureRule.values()) {
            HeatExchanger hx = createCooler(rule);
            assertEquals(0, hx.getDegreesOfFreedom());

            InitializationResult result = hx.initialize(new InitializationParameters());

            assertTrue(result.isOptimal(), rule.name());
            double q = hx.getHeatDuty().getValue();
            assertTrue(q > 0);
            assertEquals(10 * 6000 - q, 10 * hx.getOutlet1().getVariable(StateBlock.ENTH_MOL).getValue(), 1e-2);
            assertEquals(20 * 2000 + q, 20 * hx.getOutlet2().getVariable(StateBlock.ENTH_MOL).getValue(), 1e-2);
            assertEquals(q, 100 * 50 * hx.getDeltaTemperature().getValue(), 1e-2);
            assertEquals(201325, hx.getOutlet1().getVariable(StateBlock.PRESSURE).getValue(), 1e-6);

            // inlets fixed by the caller are still fixed, nothing else is
            assertTrue(hx.getInlet1().isFixed());
            assertFalse(hx.getOutlet1().getVariable(StateBlock.FLOW_MOL).isFixed());
            assertEquals(0, hx.getDegreesOfFreedom());
        }
    }

    @Test
    void testCondensingInitialization() {
        CondensingHeatExchanger hx = new CondensingHeatExchanger("condense",
                createConfig(HeatExchanger.DeltaTemperatureRule.UNDERWOOD));
        Port steam = hx.getInlet1();
        steam.getVariable(StateBlock.FLOW_MOL).setValue(100);
        steam.getVariable(StateBlock.ENTH_MOL).fix(60000);
        steam.getVariable(StateBlock.PRESSURE).fix(201325);
        fixInlet(hx.getInlet2(), 400, 3000, 101325);
        hx.getArea().fix(1000);
        hx.getOverallHeatTransferCoefficient().fix(100);
        assertEquals(List.of(steam.getVariable(StateBlock.FLOW_MOL)), List.copyOf(hx.getDeterminedVariables()));
        assertEquals(0, hx.getDegreesOfFreedom());

        InitializationResult result = hx.initialize(new InitializationParameters());

        assertTrue(result.isOptimal());
        assertEquals(332.169, steam.getVariable(StateBlock.FLOW_MOL).getValue(), 1e-2);
        StateBlock condensate = hx.getOutlet1().getStateBlock();
        assertEquals(WaterSteamProperties.saturatedLiquidEnthalpy(201325), condensate.getEnthMol().getValue(), 1e-3);
        assertFalse(steam.getVariable(StateBlock.FLOW_MOL).isFixed());
        assertTrue(hx.getExtractionRateConstraint().isActive());
    }
}
