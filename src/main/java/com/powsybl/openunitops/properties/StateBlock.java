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

import java.util.Map;

/**
 * State of a material stream: molar flow, molar enthalpy and pressure define it, temperature is derived.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public interface StateBlock {

    String FLOW_MOL = "flow_mol";
    String ENTH_MOL = "enth_mol";
    String PRESSURE = "pressure";
    String TEMPERATURE = "temperature";

    EquationBlock getBlock();

    Variable getFlowMol();

    Variable getEnthMol();

    Variable getPressure();

    Variable getTemperature();

    /**
     * Variables exposed through a port, by member name, in port order.
     */
    Map<String, Variable> getPortMembers();

    /**
     * Saturated liquid molar enthalpy at the pressure of this state.
     */
    EquationTerm createSaturatedLiquidEnthalpyTerm();

    /**
     * Set the derived variables consistently with the current state variables.
     */
    void initialize();
}
