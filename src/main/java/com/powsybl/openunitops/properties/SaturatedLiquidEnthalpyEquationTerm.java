/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.properties;

import com.powsybl.openunitops.equations.AbstractEquationTerm;
import com.powsybl.openunitops.equations.Variable;

import java.util.List;
import java.util.Objects;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class SaturatedLiquidEnthalpyEquationTerm extends AbstractEquationTerm {

    private final Variable pressure;

    public SaturatedLiquidEnthalpyEquationTerm(Variable pressure) {
        super(List.of(pressure));
        this.pressure = Objects.requireNonNull(pressure);
    }

    @Override
    public double eval() {
        return WaterSteamProperties.saturatedLiquidEnthalpy(pressure.getValue());
    }

    @Override
    public double der(Variable variable) {
        if (variable != pressure) {
            throw new IllegalStateException("Unknown variable: " + variable);
        }
        return WaterSteamProperties.saturatedLiquidEnthalpyDerivative(pressure.getValue());
    }
}
