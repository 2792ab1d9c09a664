/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit.equations;

import com.powsybl.openunitops.equations.Variable;

/**
 * Underwood approximation of the log mean temperature difference: ((cbrt(a) + cbrt(b)) / 2)^3. It stays
 * defined when the end differences are equal or of opposite signs.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class UnderwoodDeltaTemperatureEquationTerm extends AbstractDeltaTemperatureEquationTerm {

    /**
     * Stands for the infinite slope of the cube root at zero.
     */
    private static final double ZERO_ROOT_DERIVATIVE = 1e12;

    public UnderwoodDeltaTemperatureEquationTerm(Variable t1In, Variable t1Out, Variable t2In, Variable t2Out) {
        super(t1In, t1Out, t2In, t2Out);
    }

    private static double halfSum(double a, double b) {
        return (Math.cbrt(a) + Math.cbrt(b)) / 2;
    }

    private static double der(double m, double x) {
        double root = Math.cbrt(x);
        if (root == 0) {
            return ZERO_ROOT_DERIVATIVE;
        }
        return 0.5 * m * m / (root * root);
    }

    @Override
    protected double mean(double a, double b) {
        double m = halfSum(a, b);
        return m * m * m;
    }

    @Override
    protected double dMeanOverDa(double a, double b) {
        return der(halfSum(a, b), a);
    }

    @Override
    protected double dMeanOverDb(double a, double b) {
        return der(halfSum(a, b), b);
    }
}
