/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.properties;

import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.EquationTerm;
import com.powsybl.openunitops.equations.Variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class WaterSteamStateBlock implements StateBlock {

    public static final String TEMPERATURE_EQUATION = "temperature_equation";

    private final EquationBlock block;

    private final Variable flowMol;

    private final Variable enthMol;

    private final Variable pressure;

    private final Variable temperature;

    private final Map<String, Variable> portMembers;

    WaterSteamStateBlock(EquationBlock block, double initialFlowMol, double initialEnthMol, double initialPressure) {
        this.block = Objects.requireNonNull(block);
        flowMol = block.createVariable(FLOW_MOL, initialFlowMol).setBounds(0, Double.POSITIVE_INFINITY);
        enthMol = block.createVariable(ENTH_MOL, initialEnthMol);
        pressure = block.createVariable(PRESSURE, initialPressure).setBounds(1, Double.POSITIVE_INFINITY);
        temperature = block.createVariable(TEMPERATURE, WaterSteamPropertyPackage.DEFAULT_TEMPERATURE)
                .setBounds(1, Double.POSITIVE_INFINITY);

        block.createEquation(TEMPERATURE_EQUATION)
                .addTerm(temperature.createTerm())
                .addTerm(new TemperatureEquationTerm(enthMol, pressure).minus());

        Map<String, Variable> members = new LinkedHashMap<>();
        members.put(FLOW_MOL, flowMol);
        members.put(ENTH_MOL, enthMol);
        members.put(PRESSURE, pressure);
        portMembers = Collections.unmodifiableMap(members);
    }

    @Override
    public EquationBlock getBlock() {
        return block;
    }

    @Override
    public Variable getFlowMol() {
        return flowMol;
    }

    @Override
    public Variable getEnthMol() {
        return enthMol;
    }

    @Override
    public Variable getPressure() {
        return pressure;
    }

    @Override
    public Variable getTemperature() {
        return temperature;
    }

    @Override
    public Map<String, Variable> getPortMembers() {
        return portMembers;
    }

    @Override
    public EquationTerm createSaturatedLiquidEnthalpyTerm() {
        return new SaturatedLiquidEnthalpyEquationTerm(pressure);
    }

    @Override
    public void initialize() {
        if (!temperature.isFixed()) {
            temperature.setValue(WaterSteamProperties.temperature(enthMol.getValue(), pressure.getValue()));
        }
    }
}
