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

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Water and steam property package based on {@link WaterSteamProperties}.
 * <p>
 * Accepted arguments are the initial values of the state variables: {@value #FLOW_MOL_INITIAL},
 * {@value #ENTH_MOL_INITIAL} and {@value #PRESSURE_INITIAL}.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class WaterSteamPropertyPackage implements PropertyPackage {

    public static final String FLOW_MOL_INITIAL = "flow_mol_initial";
    public static final String ENTH_MOL_INITIAL = "enth_mol_initial";
    public static final String PRESSURE_INITIAL = "pressure_initial";

    public static final double DEFAULT_FLOW_MOL = 1;
    public static final double DEFAULT_ENTH_MOL = 1000;
    public static final double DEFAULT_PRESSURE = 101325;
    public static final double DEFAULT_TEMPERATURE = 300;

    private static final Set<String> ARGUMENT_NAMES = Set.of(FLOW_MOL_INITIAL, ENTH_MOL_INITIAL, PRESSURE_INITIAL);

    @Override
    public String getName() {
        return "water-steam";
    }

    private static double getArgument(Map<String, Object> arguments, String name, double defaultValue) {
        Object value = arguments.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new ConfigurationException("Property package argument '" + name + "' must be a number: " + value);
    }

    @Override
    public StateBlock buildStateBlock(EquationBlock parent, String name, Map<String, Object> arguments) {
        Objects.requireNonNull(parent);
        Objects.requireNonNull(arguments);
        for (String argumentName : arguments.keySet()) {
            if (!ARGUMENT_NAMES.contains(argumentName)) {
                throw new ConfigurationException("Unknown argument '" + argumentName + "' for property package '"
                        + getName() + "'");
            }
        }
        return new WaterSteamStateBlock(parent.createBlock(name),
                getArgument(arguments, FLOW_MOL_INITIAL, DEFAULT_FLOW_MOL),
                getArgument(arguments, ENTH_MOL_INITIAL, DEFAULT_ENTH_MOL),
                getArgument(arguments, PRESSURE_INITIAL, DEFAULT_PRESSURE));
    }

    @Override
    public String toString() {
        return getName();
    }
}
