/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.equations;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.PowsyblException;
import com.powsybl.math.matrix.LUDecomposition;
import com.powsybl.math.matrix.Matrix;
import com.powsybl.math.matrix.MatrixFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.powsybl.openunitops.util.Markers.PERFORMANCE_MARKER;

/**
 * Jacobian of the equations to solve of an index, one row per variable and one column per equation.
 * The Newton step J dx = f is therefore solved with the transposed LU decomposition.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class JacobianMatrix implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JacobianMatrix.class);

    private final EquationBlockIndex index;

    private final MatrixFactory matrixFactory;

    private Matrix matrix;

    private LUDecomposition lu;

    public JacobianMatrix(EquationBlockIndex index, MatrixFactory matrixFactory) {
        this.index = Objects.requireNonNull(index);
        this.matrixFactory = Objects.requireNonNull(matrixFactory);
    }

    private void initDer() {
        Stopwatch stopwatch = Stopwatch.createStarted();

        int rowCount = index.getRowCount();
        int columnCount = index.getColumnCount();
        if (rowCount != columnCount) {
            throw new PowsyblException("Expected to have same number of equations (" + columnCount
                    + ") and variables (" + rowCount + ")");
        }

        int estimatedNonZeroValueCount = rowCount * 4;
        matrix = matrixFactory.create(rowCount, columnCount, estimatedNonZeroValueCount);

        List<Equation> equations = index.getEquationsToSolve();
        for (int column = 0; column < equations.size(); column++) {
            int eqColumn = column;
            equations.get(column).der((variable, value) -> {
                int row = index.getRow(variable);
                if (row != -1) {
                    matrix.add(row, eqColumn, value);
                }
            });
        }

        LOGGER.debug(PERFORMANCE_MARKER, "Jacobian matrix built in {} us", stopwatch.elapsed(TimeUnit.MICROSECONDS));
    }

    public Matrix getMatrix() {
        if (matrix == null) {
            initDer();
        }
        return matrix;
    }

    private LUDecomposition getLUDecomposition() {
        Matrix m = getMatrix();
        if (lu == null) {
            Stopwatch stopwatch = Stopwatch.createStarted();

            lu = m.decomposeLU();

            LOGGER.debug(PERFORMANCE_MARKER, "LU decomposition done in {} us", stopwatch.elapsed(TimeUnit.MICROSECONDS));
        }
        return lu;
    }

    /**
     * Solve J x = b in place.
     */
    public void solveTransposed(double[] b) {
        getLUDecomposition().solveTransposed(b);
    }

    @Override
    public void close() {
        matrix = null;
        if (lu != null) {
            lu.close();
        }
        lu = null;
    }
}
