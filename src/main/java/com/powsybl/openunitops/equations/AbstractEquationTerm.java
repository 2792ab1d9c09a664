/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.equations;

import java.util.List;
import java.util.Objects;

/**
 * Base class of equation terms defined over a fixed list of variables.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public abstract class AbstractEquationTerm implements EquationTerm {

    protected final List<Variable> variables;

    protected AbstractEquationTerm(List<Variable> variables) {
        this.variables = List.copyOf(Objects.requireNonNull(variables));
    }

    @Override
    public List<Variable> getVariables() {
        return variables;
    }

    @Override
    public EquationTerm multiply(double scalar) {
        return new MultiplyByScalarEquationTerm(this, scalar);
    }

    @Override
    public EquationTerm minus() {
        return multiply(-1);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + variables.stream().map(Variable::getPath).toList();
    }
}
