/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.equations;

import java.util.*;

/**
 * Numbering of the equations to solve and of the variables to find of a block, frozen at creation.
 * Equations are the active ones of the subtree, variables the unfixed ones they read.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class EquationBlockIndex {

    private final EquationBlock block;

    private final List<Equation> equationsToSolve;

    private final List<Variable> variablesToFind;

    private final Map<Variable, Integer> rowByVariable = new HashMap<>();

    public EquationBlockIndex(EquationBlock block) {
        this.block = Objects.requireNonNull(block);
        equationsToSolve = block.getActiveEquations();
        List<Variable> variables = new ArrayList<>();
        for (Equation equation : equationsToSolve) {
            for (Variable variable : equation.getVariables()) {
                if (!variable.isFixed() && !rowByVariable.containsKey(variable)) {
                    rowByVariable.put(variable, variables.size());
                    variables.add(variable);
                }
            }
        }
        variablesToFind = Collections.unmodifiableList(variables);
    }

    public EquationBlock getBlock() {
        return block;
    }

    public List<Equation> getEquationsToSolve() {
        return equationsToSolve;
    }

    public List<Variable> getVariablesToFind() {
        return variablesToFind;
    }

    public int getRowCount() {
        return variablesToFind.size();
    }

    public int getColumnCount() {
        return equationsToSolve.size();
    }

    /**
     * Row of the variable in the jacobian matrix, -1 if the variable is not to be found.
     */
    public int getRow(Variable variable) {
        Integer row = rowByVariable.get(variable);
        return row != null ? row : -1;
    }

    public double[] getValues() {
        double[] x = new double[variablesToFind.size()];
        for (int i = 0; i < x.length; i++) {
            x[i] = variablesToFind.get(i).getValue();
        }
        return x;
    }

    /**
     * Write x into the variables to find, clamped to their bounds.
     */
    public void setValues(double[] x) {
        if (x.length != variablesToFind.size()) {
            throw new IllegalArgumentException("Bad state vector length: " + x.length
                    + " (expected " + variablesToFind.size() + ")");
        }
        for (int i = 0; i < x.length; i++) {
            Variable variable = variablesToFind.get(i);
            variable.setValue(variable.clamp(x[i]));
        }
    }

    /**
     * Evaluate residuals and scales of every equation to solve.
     */
    public void eval(double[] fx, double[] scales) {
        for (int i = 0; i < equationsToSolve.size(); i++) {
            Equation equation = equationsToSolve.get(i);
            fx[i] = equation.eval();
            scales[i] = equation.getScale();
        }
    }
}
