/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit;

import com.powsybl.openunitops.equations.Equation;
import com.powsybl.openunitops.equations.Variable;

import java.util.Objects;

/**
 * An equation that determines a variable which would otherwise be an input, like a steam extraction flow
 * computed so that the outlet is saturated liquid. It is relaxed while sub-units are solved one by one.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public record SpecialConstraint(Equation equation, Variable determinedVariable) {

    public SpecialConstraint {
        Objects.requireNonNull(equation);
        Objects.requireNonNull(determinedVariable);
    }
}
