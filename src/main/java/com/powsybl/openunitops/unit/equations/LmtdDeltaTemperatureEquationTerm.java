/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit.equations;

import com.powsybl.openunitops.equations.Variable;
import net.jafama.FastMath;

/**
 * Log mean temperature difference (a - b) / ln(a / b), replaced by the arithmetic mean when both end
 * differences are nearly equal. Only defined when a and b have the same sign.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class LmtdDeltaTemperatureEquationTerm extends AbstractDeltaTemperatureEquationTerm {

    private static final double EQUAL_DIFFERENCES_EPS = 1e-6;

    public LmtdDeltaTemperatureEquationTerm(Variable t1In, Variable t1Out, Variable t2In, Variable t2Out) {
        super(t1In, t1Out, t2In, t2Out);
    }

    private static boolean nearlyEqual(double a, double b) {
        return Math.abs(a - b) <= EQUAL_DIFFERENCES_EPS * Math.max(1, Math.abs(a));
    }

    @Override
    protected double mean(double a, double b) {
        if (nearlyEqual(a, b)) {
            return (a + b) / 2;
        }
        return (a - b) / FastMath.log(a / b);
    }

    @Override
    protected double dMeanOverDa(double a, double b) {
        if (nearlyEqual(a, b)) {
            return 0.5;
        }
        double l = FastMath.log(a / b);
        return (l - (a - b) / a) / (l * l);
    }

    @Override
    protected double dMeanOverDb(double a, double b) {
        if (nearlyEqual(a, b)) {
            return 0.5;
        }
        double l = FastMath.log(a / b);
        return (-l + (a - b) / b) / (l * l);
    }
}
