/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit;

import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.Variable;
import com.powsybl.openunitops.initialization.InitializationParameters;
import com.powsybl.openunitops.initialization.InitializationPlan;
import com.powsybl.openunitops.initialization.InitializationResult;
import com.powsybl.openunitops.initialization.InitializationScheduler;

import java.util.List;
import java.util.Set;

/**
 * A steady-state unit operation: either a sub-unit owning its equations, or a composite of sub-units
 * linked by arcs.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public interface UnitModel {

    String getName();

    EquationBlock getBlock();

    Port getPort(String name);

    /**
     * Inlet ports fed from outside of this unit.
     */
    List<Port> getInletPorts();

    /**
     * Outlet ports not consumed inside of this unit.
     */
    List<Port> getOutletPorts();

    List<SpecialConstraint> getSpecialConstraints();

    /**
     * Inlet variables left free for the final solve of the initialization, because a special constraint
     * determines them.
     */
    Set<Variable> getDeterminedVariables();

    InitializationPlan getInitializationPlan();

    default int getDegreesOfFreedom() {
        return getBlock().getDegreesOfFreedom();
    }

    default InitializationResult initialize(InitializationParameters parameters) {
        return new InitializationScheduler().initialize(this, parameters);
    }
}
