/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.equations;

import com.powsybl.commons.PowsyblException;

import java.util.Objects;

/**
 * A scalar unknown of an {@link EquationBlock}: current value, fixed flag and bounds.
 * <p>
 * A fixed variable always has a value, {@link Double#NaN} meaning unset.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class Variable {

    private final EquationBlock block;

    private final String name;

    private double value;

    private boolean fixed = false;

    private double lowerBound = Double.NEGATIVE_INFINITY;

    private double upperBound = Double.POSITIVE_INFINITY;

    Variable(EquationBlock block, String name, double value) {
        this.block = Objects.requireNonNull(block);
        this.name = Objects.requireNonNull(name);
        this.value = value;
    }

    public EquationBlock getBlock() {
        return block;
    }

    public String getName() {
        return name;
    }

    public String getPath() {
        return block.getPath() + EquationBlock.PATH_SEPARATOR + name;
    }

    public double getValue() {
        return value;
    }

    public Variable setValue(double value) {
        if (fixed && Double.isNaN(value)) {
            throw new PowsyblException("Cannot unset value of fixed variable '" + getPath() + "'");
        }
        this.value = value;
        return this;
    }

    public boolean isFixed() {
        return fixed;
    }

    public Variable fix() {
        if (Double.isNaN(value)) {
            throw new PowsyblException("Cannot fix variable '" + getPath() + "' without a value");
        }
        fixed = true;
        return this;
    }

    public Variable fix(double value) {
        this.value = value;
        return fix();
    }

    public Variable unfix() {
        fixed = false;
        return this;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public Variable setBounds(double lowerBound, double upperBound) {
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException("Invalid bounds for variable '" + getPath() + "': ["
                    + lowerBound + ", " + upperBound + "]");
        }
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        return this;
    }

    /**
     * Project a candidate value onto the bounds of this variable.
     */
    public double clamp(double candidate) {
        return Math.min(Math.max(candidate, lowerBound), upperBound);
    }

    public EquationTerm createTerm() {
        return new VariableEquationTerm(this);
    }

    @Override
    public String toString() {
        return "Variable(path=" + getPath() + ", value=" + value + ", fixed=" + fixed + ")";
    }
}
