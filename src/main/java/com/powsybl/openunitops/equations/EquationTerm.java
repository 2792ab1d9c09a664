/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.equations;

import java.util.List;

/**
 * A differentiable term of an {@link Equation}, evaluated on the current values of its variables.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public interface EquationTerm {

    /**
     * Get the list of variable this equation term depends on.
     * @return the list of variable this equation term depends on.
     */
    List<Variable> getVariables();

    double eval();

    /**
     * Partial derivative of this term with respect to one of its variables.
     */
    double der(Variable variable);

    EquationTerm multiply(double scalar);

    EquationTerm minus();
}
