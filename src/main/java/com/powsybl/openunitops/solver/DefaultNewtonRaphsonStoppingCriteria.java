/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.solver;

import net.jafama.FastMath;

/**
 * Stops when every scaled residual is below the epsilon. The reported norm is the L2 norm of the scaled
 * residuals, which is what the line search compares.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class DefaultNewtonRaphsonStoppingCriteria implements NewtonRaphsonStoppingCriteria {

    public static final double DEFAULT_CONV_EPS_PER_EQ = Math.pow(10, -8);

    private final double convEpsPerEq;

    public DefaultNewtonRaphsonStoppingCriteria() {
        this(DEFAULT_CONV_EPS_PER_EQ);
    }

    public DefaultNewtonRaphsonStoppingCriteria(double convEpsPerEq) {
        this.convEpsPerEq = convEpsPerEq;
    }

    public double getConvEpsPerEq() {
        return convEpsPerEq;
    }

    @Override
    public TestResult test(double[] fx, double[] scales) {
        double sum = 0;
        double max = 0;
        for (int i = 0; i < fx.length; i++) {
            double scaled = fx[i] / scales[i];
            sum += scaled * scaled;
            // Math.max propagates NaN, so a NaN residual never passes the test
            max = Math.max(max, Math.abs(scaled));
        }
        return new TestResult(max < convEpsPerEq, FastMath.sqrt(sum));
    }
}
