/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.properties;

import com.powsybl.openunitops.equations.EquationBlock;

import java.util.Map;

/**
 * Thermodynamic property package. Unit models only use it to build the state blocks of their material streams.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public interface PropertyPackage {

    String getName();

    /**
     * Build a state block as a child of the given block.
     *
     * @param arguments property package arguments of the unit configuration
     */
    StateBlock buildStateBlock(EquationBlock parent, String name, Map<String, Object> arguments);
}
