/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.initialization;

import com.powsybl.openunitops.solver.NewtonRaphson;
import com.powsybl.openunitops.solver.SolverAdapter;
import com.powsybl.openunitops.solver.SolverParameters;

import java.util.Map;
import java.util.Objects;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class InitializationParameters {

    public static final int DEFAULT_OUTLVL = 0;

    /**
     * Minimal output level for a successful initialization to be logged at info level.
     */
    public static final int SUCCESS_OUTLVL = 2;

    private int outlvl = DEFAULT_OUTLVL;

    private SolverAdapter solverAdapter = new NewtonRaphson();

    private SolverParameters solverParameters = new SolverParameters();

    public int getOutlvl() {
        return outlvl;
    }

    public InitializationParameters setOutlvl(int outlvl) {
        if (outlvl < 0) {
            throw new IllegalArgumentException("Invalid output level: " + outlvl);
        }
        this.outlvl = outlvl;
        return this;
    }

    public SolverAdapter getSolverAdapter() {
        return solverAdapter;
    }

    public InitializationParameters setSolverAdapter(SolverAdapter solverAdapter) {
        this.solverAdapter = Objects.requireNonNull(solverAdapter);
        return this;
    }

    public SolverParameters getSolverParameters() {
        return solverParameters;
    }

    public InitializationParameters setSolverParameters(SolverParameters solverParameters) {
        this.solverParameters = Objects.requireNonNull(solverParameters);
        return this;
    }

    /**
     * Apply solver options given by name, like {@code max_iter} or {@code tol}.
     */
    public InitializationParameters setSolverOptions(Map<String, String> options) {
        solverParameters.update(options);
        return this;
    }

    @Override
    public String toString() {
        return "InitializationParameters(outlvl=" + outlvl
                + ", solverAdapter=" + solverAdapter.getName()
                + ", solverParameters=" + solverParameters
                + ")";
    }
}
