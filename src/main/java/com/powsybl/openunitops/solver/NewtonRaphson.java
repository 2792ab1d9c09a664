/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.solver;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.PowsyblException;
import com.powsybl.math.matrix.DenseMatrixFactory;
import com.powsybl.math.matrix.MatrixException;
import com.powsybl.math.matrix.MatrixFactory;
import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.EquationBlockIndex;
import com.powsybl.openunitops.equations.JacobianMatrix;
import org.apache.commons.lang3.mutable.MutableInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.powsybl.openunitops.util.Markers.PERFORMANCE_MARKER;

/**
 * Damped Newton-Raphson with a backtracking line search on the L2 norm of the scaled residuals.
 * New iterates are clamped to the variable bounds.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class NewtonRaphson implements SolverAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(NewtonRaphson.class);

    private final MatrixFactory matrixFactory;

    public NewtonRaphson() {
        this(new DenseMatrixFactory());
    }

    public NewtonRaphson(MatrixFactory matrixFactory) {
        this.matrixFactory = Objects.requireNonNull(matrixFactory);
    }

    @Override
    public String getName() {
        return "Newton-Raphson";
    }

    private static final class Iterate {

        private final double[] fx;

        private final double[] scales;

        private NewtonRaphsonStoppingCriteria.TestResult testResult;

        private Iterate(int size) {
            fx = new double[size];
            scales = new double[size];
        }

        private void update(EquationBlockIndex index, NewtonRaphsonStoppingCriteria stoppingCriteria) {
            index.eval(fx, scales);
            testResult = stoppingCriteria.test(fx, scales);
        }
    }

    /**
     * @return false if the jacobian could not be factorized
     */
    private boolean runIteration(EquationBlockIndex index, SolverParameters parameters, Iterate iterate, MutableInt iterations) {
        LOGGER.debug("Start iteration {}", iterations);

        // solve f(x) = j * dx
        double[] dx = iterate.fx.clone();
        try (JacobianMatrix j = new JacobianMatrix(index, matrixFactory)) {
            j.solveTransposed(dx);
        } catch (MatrixException e) {
            LOGGER.error(e.toString(), e);
            return false;
        }

        // x(i+1) = x(i) - dx * mu, mu divided by the step fold until the norm decreases
        double[] x = index.getValues();
        double lastNorm = iterate.testResult.getNorm();
        double stepSize = 1;
        int lineSearchIteration = 0;
        while (true) {
            double[] newX = x.clone();
            for (int i = 0; i < newX.length; i++) {
                newX[i] -= stepSize * dx[i];
            }
            index.setValues(newX);
            iterate.update(index, parameters.getStoppingCriteria());
            if (iterate.testResult.getNorm() < lastNorm || lineSearchIteration >= parameters.getLineSearchMaxIterations()) {
                break;
            }
            stepSize /= parameters.getLineSearchStepFold();
            lineSearchIteration++;
        }
        LOGGER.debug("Step size: {}, |f(x)|={}", stepSize, iterate.testResult.getNorm());
        return true;
    }

    @Override
    public SolverResult solve(EquationBlock block, SolverParameters parameters) {
        Objects.requireNonNull(block);
        Objects.requireNonNull(parameters);
        Stopwatch stopwatch = Stopwatch.createStarted();

        EquationBlockIndex index = new EquationBlockIndex(block);
        if (index.getRowCount() != index.getColumnCount()) {
            throw new PowsyblException("Expected to have same number of equations (" + index.getColumnCount()
                    + ") and variables (" + index.getRowCount() + ") in block '" + block.getPath() + "'");
        }

        Iterate iterate = new Iterate(index.getColumnCount());
        iterate.update(index, parameters.getStoppingCriteria());
        LOGGER.debug("|f(x0)|={}", iterate.testResult.getNorm());

        SolverStatus status;
        MutableInt iterations = new MutableInt();
        while (true) {
            if (iterate.testResult.isStop()) {
                status = SolverStatus.OPTIMAL;
                break;
            }
            if (!Double.isFinite(iterate.testResult.getNorm())) {
                LOGGER.debug("Non finite residual norm at iteration {}", iterations);
                status = SolverStatus.SOLVER_FAILED;
                break;
            }
            if (iterations.intValue() >= parameters.getMaxIterations()) {
                status = SolverStatus.MAX_ITERATION_REACHED;
                break;
            }
            if (!runIteration(index, parameters, iterate, iterations)) {
                status = SolverStatus.SOLVER_FAILED;
                break;
            }
            iterations.increment();
        }

        LOGGER.debug(PERFORMANCE_MARKER, "{} on block '{}' ({} equations) done in {} ms: {} after {} iterations",
                getName(), block.getPath(), index.getColumnCount(), stopwatch.elapsed(TimeUnit.MILLISECONDS), status, iterations);

        return new SolverResult(status, iterations.intValue(), iterate.testResult.getNorm());
    }
}
