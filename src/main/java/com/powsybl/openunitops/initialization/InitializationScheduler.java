/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.initialization;

import com.google.common.base.Stopwatch;
import com.powsybl.openunitops.equations.Equation;
import com.powsybl.openunitops.equations.Variable;
import com.powsybl.openunitops.snapshot.Snapshot;
import com.powsybl.openunitops.snapshot.SnapshotStore;
import com.powsybl.openunitops.snapshot.StoreSpec;
import com.powsybl.openunitops.solver.SolverResult;
import com.powsybl.openunitops.unit.Arc;
import com.powsybl.openunitops.unit.Port;
import com.powsybl.openunitops.unit.SpecialConstraint;
import com.powsybl.openunitops.unit.UnitModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

import static com.powsybl.openunitops.util.Markers.PERFORMANCE_MARKER;

/**
 * Sequential-modular initialization of a unit.
 * <p>
 * Special constraints are relaxed, the steps of the unit plan are run in order, each one with the inlets of its
 * target temporarily fixed, then the special constraints are restored and the whole unit is solved with its
 * determined variables free. A unit initialized by a direct solve also has its inlets fixed for that solve, a
 * composite unit must have zero degrees of freedom as specified by the caller. The fixed flags, values of fixed variables and
 * active flags the caller had before are restored in every case, so only the values of free variables are
 * changed.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class InitializationScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(InitializationScheduler.class);

    private static final StoreSpec STORE_SPEC = StoreSpec.valueIsFixedIsActive(true);

    public InitializationResult initialize(UnitModel unit, InitializationParameters parameters) {
        Objects.requireNonNull(unit);
        Objects.requireNonNull(parameters);
        Stopwatch stopwatch = Stopwatch.createStarted();
        String path = unit.getBlock().getPath();

        List<InitializationState> states = new ArrayList<>();
        List<SolverResult> stepResults = new ArrayList<>();
        SolverResult result;
        int degreesOfFreedom;

        Snapshot snapshot = SnapshotStore.capture(unit.getBlock(), STORE_SPEC);
        advance(states, InitializationState.UNSOLVED, path);
        try {
            List<Equation> relaxedEquations = new ArrayList<>();
            for (SpecialConstraint specialConstraint : unit.getSpecialConstraints()) {
                specialConstraint.equation().setActive(false);
                relaxedEquations.add(specialConstraint.equation());
            }
            advance(states, InitializationState.CONSTRAINTS_RELAXED, path);

            for (InitializationStep step : unit.getInitializationPlan().getSteps()) {
                stepResults.add(runStep(step, parameters));
            }
            advance(states, InitializationState.SUB_UNITS_SEQUENCED, path);

            relaxedEquations.forEach(equation -> equation.setActive(true));
            advance(states, InitializationState.CONSTRAINTS_RESTORED, path);

            // a leaf fixes its own inlets, a composite is solved as its caller specified it
            if (unit.getInitializationPlan().isDirectSolveOf(unit)) {
                for (Port port : unit.getInletPorts()) {
                    port.fix();
                }
            }
            unit.getDeterminedVariables().forEach(Variable::unfix);
            degreesOfFreedom = unit.getDegreesOfFreedom();
            if (degreesOfFreedom != 0) {
                throw new AssemblyInvariantException("Unit '" + path + "' has " + degreesOfFreedom
                        + " degrees of freedom before its coupled solve, 0 expected");
            }

            result = parameters.getSolverAdapter().solve(unit.getBlock(), parameters.getSolverParameters());
            advance(states, InitializationState.COUPLED_SOLVED, path);
            if (result.isOptimal()) {
                if (parameters.getOutlvl() >= InitializationParameters.SUCCESS_OUTLVL) {
                    LOGGER.info("Initialization of '{}' complete ({} iterations)", path, result.getIterations());
                }
            } else {
                LOGGER.warn("Initialization of '{}' ended with solver status {}", path, result.getStatus());
            }
        } finally {
            SnapshotStore.restore(unit.getBlock(), snapshot);
            advance(states, InitializationState.SNAPSHOT_RESTORED, path);
        }

        stopwatch.stop();
        LOGGER.debug(PERFORMANCE_MARKER, "Initialization of '{}' done in {} ms", path, stopwatch.elapsed(TimeUnit.MILLISECONDS));

        return new InitializationResult(result, states, degreesOfFreedom, stepResults);
    }

    private static void advance(List<InitializationState> states, InitializationState state, String path) {
        states.add(state);
        LOGGER.trace("'{}' initialization state: {}", path, state);
    }

    private static SolverResult runStep(InitializationStep step, InitializationParameters parameters) {
        step.getSeeds().forEach(Arc::propagate);
        UnitModel target = step.getTarget();

        Set<Variable> keptFree = step.getKind() == InitializationStep.Kind.INITIALIZE
                ? target.getDeterminedVariables()
                : Collections.emptySet();
        List<Variable> fixedVariables = new ArrayList<>();
        for (Port port : target.getInletPorts()) {
            for (Variable variable : port.getVariables().values()) {
                if (!variable.isFixed() && !keptFree.contains(variable)) {
                    variable.fix();
                    fixedVariables.add(variable);
                }
            }
        }

        try {
            if (step.getKind() == InitializationStep.Kind.INITIALIZE) {
                return target.initialize(parameters).getSolverResult();
            }
            int degreesOfFreedom = target.getDegreesOfFreedom();
            if (degreesOfFreedom != 0) {
                throw new AssemblyInvariantException("Unit '" + target.getBlock().getPath() + "' has " + degreesOfFreedom
                        + " degrees of freedom with its inlets fixed, 0 expected");
            }
            step.getGuess().run();
            SolverResult result = parameters.getSolverAdapter().solve(target.getBlock(), parameters.getSolverParameters());
            if (!result.isOptimal()) {
                LOGGER.warn("Solve of '{}' with fixed inlets ended with solver status {}", target.getBlock().getPath(),
                        result.getStatus());
            }
            return result;
        } finally {
            fixedVariables.forEach(Variable::unfix);
        }
    }
}
