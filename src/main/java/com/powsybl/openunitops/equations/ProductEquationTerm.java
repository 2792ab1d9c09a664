/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.equations;

import java.util.Arrays;

/**
 * Product of a constant coefficient and any number of variables, as found in
 * enthalpy flows (F * h) or heat transfer (U * A * dT).
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class ProductEquationTerm extends AbstractEquationTerm {

    private final double coefficient;

    public ProductEquationTerm(double coefficient, Variable... variables) {
        super(Arrays.asList(variables));
        if (variables.length == 0) {
            throw new IllegalArgumentException("Product term needs at least one variable");
        }
        this.coefficient = coefficient;
    }

    public ProductEquationTerm(Variable... variables) {
        this(1, variables);
    }

    @Override
    public double eval() {
        double product = coefficient;
        for (Variable v : variables) {
            product *= v.getValue();
        }
        return product;
    }

    @Override
    public double der(Variable variable) {
        // sum over each occurrence so that x * x derives to 2 * x
        double der = 0;
        for (int i = 0; i < variables.size(); i++) {
            if (variables.get(i) == variable) {
                double product = coefficient;
                for (int j = 0; j < variables.size(); j++) {
                    if (j != i) {
                        product *= variables.get(j).getValue();
                    }
                }
                der += product;
            }
        }
        return der;
    }
}
