/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.solver;

import java.util.Objects;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class SolverResult {

    private final SolverStatus status;

    private final int iterations;

    private final double mismatchNorm;

    public SolverResult(SolverStatus status, int iterations, double mismatchNorm) {
        if (iterations < 0) {
            throw new IllegalArgumentException("Invalid iteration value: " + iterations);
        }
        this.status = Objects.requireNonNull(status);
        this.iterations = iterations;
        this.mismatchNorm = mismatchNorm;
    }

    public SolverStatus getStatus() {
        return status;
    }

    public boolean isOptimal() {
        return status == SolverStatus.OPTIMAL;
    }

    public int getIterations() {
        return iterations;
    }

    /**
     * L2 norm of the scaled equation mismatches at the returned iterate.
     */
    public double getMismatchNorm() {
        return mismatchNorm;
    }

    @Override
    public String toString() {
        return "SolverResult(status=" + status + ", iterations=" + iterations + ", mismatchNorm=" + mismatchNorm + ")";
    }
}
