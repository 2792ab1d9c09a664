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
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class MultiplyByScalarEquationTerm implements EquationTerm {

    private final EquationTerm term;

    private final double scalar;

    MultiplyByScalarEquationTerm(EquationTerm term, double scalar) {
        this.term = Objects.requireNonNull(term);
        this.scalar = scalar;
    }

    @Override
    public List<Variable> getVariables() {
        return term.getVariables();
    }

    @Override
    public double eval() {
        return scalar * term.eval();
    }

    @Override
    public double der(Variable variable) {
        return scalar * term.der(variable);
    }

    @Override
    public EquationTerm multiply(double scalar) {
        return new MultiplyByScalarEquationTerm(term, this.scalar * scalar);
    }

    @Override
    public EquationTerm minus() {
        return multiply(-1);
    }

    @Override
    public String toString() {
        return scalar + " * " + term;
    }
}
