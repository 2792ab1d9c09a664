/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openunitops.equations.Variable;
import com.powsybl.openunitops.properties.StateBlock;

import java.util.Map;
import java.util.Objects;

/**
 * Named flow interface of a sub-unit: the port members of one of its state blocks.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class Port {

    public enum Direction {
        INLET,
        OUTLET
    }

    private final UnitModel unit;

    private final String name;

    private final Direction direction;

    private final StateBlock stateBlock;

    Port(UnitModel unit, String name, Direction direction, StateBlock stateBlock) {
        this.unit = Objects.requireNonNull(unit);
        this.name = Objects.requireNonNull(name);
        this.direction = Objects.requireNonNull(direction);
        this.stateBlock = Objects.requireNonNull(stateBlock);
    }

    public UnitModel getUnit() {
        return unit;
    }

    public String getName() {
        return name;
    }

    public String getPath() {
        return unit.getBlock().getPath() + "." + name;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean isInlet() {
        return direction == Direction.INLET;
    }

    public StateBlock getStateBlock() {
        return stateBlock;
    }

    public Map<String, Variable> getVariables() {
        return stateBlock.getPortMembers();
    }

    public Variable getVariable(String member) {
        Variable variable = getVariables().get(member);
        if (variable == null) {
            throw new PowsyblException("Port '" + getPath() + "' has no member '" + member + "'");
        }
        return variable;
    }

    public Port fix() {
        getVariables().values().forEach(Variable::fix);
        return this;
    }

    public Port unfix() {
        getVariables().values().forEach(Variable::unfix);
        return this;
    }

    public boolean isFixed() {
        return getVariables().values().stream().allMatch(Variable::isFixed);
    }

    @Override
    public String toString() {
        return "Port(" + getPath() + ")";
    }
}
