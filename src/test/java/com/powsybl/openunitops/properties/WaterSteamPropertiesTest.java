/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.properties;

import com.powsybl.openunitops.config.ConfigurationException;
import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.EquationTerm;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.powsybl.openunitops.properties.WaterSteamProperties.*;
import static org.junit.jupiter.api.Assertions.*;

class WaterSteamPropertiesTest {

    private static final double EPS = 1e-3;

    @Test
    void testSaturation() {
        assertEquals(NORMAL_BOILING_TEMPERATURE, saturationTemperature(NORMAL_BOILING_PRESSURE), 1e-9);
        assertTrue(saturationTemperature(201325) > NORMAL_BOILING_TEMPERATURE);
        assertEquals(LIQUID_HEAT_CAPACITY * 100, saturatedLiquidEnthalpy(NORMAL_BOILING_PRESSURE), 1e-6);
        assertEquals(saturatedLiquidEnthalpy(201325) + VAPORIZATION_ENTHALPY, saturatedVaporEnthalpy(201325), 1e-9);
    }

    @Test
    void testTemperatureRegions() {
        double p = NORMAL_BOILING_PRESSURE;
        double hl = saturatedLiquidEnthalpy(p);
        // subcooled
        assertEquals(REFERENCE_TEMPERATURE + 3000 / LIQUID_HEAT_CAPACITY, temperature(3000, p), 1e-9);
        // two-phase
        assertEquals(NORMAL_BOILING_TEMPERATURE, temperature(hl + VAPORIZATION_ENTHALPY / 2, p), 1e-9);
        // superheated
        assertEquals(NORMAL_BOILING_TEMPERATURE + 360 / VAPOR_HEAT_CAPACITY, temperature(hl + VAPORIZATION_ENTHALPY + 360, p), 1e-9);
    }

    @Test
    void testDerivatives() {
        for (double p : new double[] {50000, 101325, 201325}) {
            assertEquals((saturationTemperature(p + EPS) - saturationTemperature(p - EPS)) / (2 * EPS),
                    saturationTemperatureDerivative(p), 1e-6);
            assertEquals((saturatedLiquidEnthalpy(p + EPS) - saturatedLiquidEnthalpy(p - EPS)) / (2 * EPS),
                    saturatedLiquidEnthalpyDerivative(p), 1e-4);
            for (double h : new double[] {3000, 30000, 60000}) {
                assertEquals((temperature(h + EPS, p) - temperature(h - EPS, p)) / (2 * EPS),
                        dTemperatureOverDEnthalpy(h, p), 1e-6);
                assertEquals((temperature(h, p + EPS) - temperature(h, p - EPS)) / (2 * EPS),
                        dTemperatureOverDPressure(h, p), 1e-6);
            }
        }
    }

    @Test
    void testStateBlock() {
        EquationBlock parent = new EquationBlock("unit");
        StateBlock state = new WaterSteamPropertyPackage()
                .buildStateBlock(parent, "inlet", Map.of(WaterSteamPropertyPackage.PRESSURE_INITIAL, 201325));
        assertEquals("unit.inlet", state.getBlock().getPath());
        assertEquals(WaterSteamPropertyPackage.DEFAULT_FLOW_MOL, state.getFlowMol().getValue(), 0);
        assertEquals(201325, state.getPressure().getValue(), 0);
        assertEquals(3, state.getPortMembers().size());
        assertFalse(state.getPortMembers().containsKey(StateBlock.TEMPERATURE));
        // enthalpy, pressure and temperature linked by the temperature equation
        assertEquals(2, state.getBlock().getDegreesOfFreedom());

        state.getEnthMol().setValue(3000);
        state.initialize();
        assertEquals(temperature(3000, 201325), state.getTemperature().getValue(), 1e-9);

        EquationTerm hl = state.createSaturatedLiquidEnthalpyTerm();
        assertEquals(saturatedLiquidEnthalpy(201325), hl.eval(), 1e-9);
        assertEquals(saturatedLiquidEnthalpyDerivative(201325), hl.der(state.getPressure()), 1e-12);
    }

    @Test
    void testInvalidArguments() {
        WaterSteamPropertyPackage propertyPackage = new WaterSteamPropertyPackage();
        EquationBlock parent = new EquationBlock("unit");
        Map<String, Object> unknown = Map.of("temperature_initial", 300);
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> propertyPackage.buildStateBlock(parent, "inlet", unknown));
        assertEquals("Unknown argument 'temperature_initial' for property package 'water-steam'", e.getMessage());
        Map<String, Object> notANumber = Map.of(WaterSteamPropertyPackage.PRESSURE_INITIAL, "high");
        e = assertThrows(ConfigurationException.class, () -> propertyPackage.buildStateBlock(parent, "outlet", notANumber));
        assertEquals("Property package argument 'pressure_initial' must be a number: high", e.getMessage());
    }
}
