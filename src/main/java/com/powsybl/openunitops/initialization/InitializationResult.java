/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.initialization;

import com.powsybl.openunitops.solver.SolverResult;
import com.powsybl.openunitops.solver.SolverStatus;

import java.util.List;
import java.util.Objects;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class InitializationResult {

    private final SolverResult solverResult;

    private final List<InitializationState> states;

    private final int degreesOfFreedom;

    private final List<SolverResult> stepResults;

    public InitializationResult(SolverResult solverResult, List<InitializationState> states, int degreesOfFreedom,
                                List<SolverResult> stepResults) {
        this.solverResult = Objects.requireNonNull(solverResult);
        this.states = List.copyOf(states);
        this.degreesOfFreedom = degreesOfFreedom;
        this.stepResults = List.copyOf(stepResults);
    }

    /**
     * Result of the final coupled solve.
     */
    public SolverResult getSolverResult() {
        return solverResult;
    }

    public SolverStatus getStatus() {
        return solverResult.getStatus();
    }

    public boolean isOptimal() {
        return solverResult.isOptimal();
    }

    /**
     * States reached, in order.
     */
    public List<InitializationState> getStates() {
        return states;
    }

    /**
     * Degrees of freedom of the unit measured just before the coupled solve.
     */
    public int getDegreesOfFreedom() {
        return degreesOfFreedom;
    }

    public List<SolverResult> getStepResults() {
        return stepResults;
    }

    public List<SolverStatus> getNonOptimalStepStatuses() {
        return stepResults.stream()
                .filter(result -> !result.isOptimal())
                .map(SolverResult::getStatus)
                .toList();
    }

    @Override
    public String toString() {
        return "InitializationResult(status=" + solverResult.getStatus()
                + ", iterations=" + solverResult.getIterations()
                + ", degreesOfFreedom=" + degreesOfFreedom
                + ", nonOptimalSteps=" + getNonOptimalStepStatuses()
                + ")";
    }
}
