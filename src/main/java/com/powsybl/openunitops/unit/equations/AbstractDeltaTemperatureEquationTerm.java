/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit.equations;

import com.powsybl.openunitops.equations.AbstractEquationTerm;
import com.powsybl.openunitops.equations.Variable;

import java.util.List;
import java.util.Objects;

/**
 * Mean temperature difference of a counter-current exchanger, as a function of the hot end difference
 * a = T1in - T2out and of the cold end difference b = T1out - T2in.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public abstract class AbstractDeltaTemperatureEquationTerm extends AbstractEquationTerm {

    protected final Variable t1In;

    protected final Variable t1Out;

    protected final Variable t2In;

    protected final Variable t2Out;

    protected AbstractDeltaTemperatureEquationTerm(Variable t1In, Variable t1Out, Variable t2In, Variable t2Out) {
        super(List.of(t1In, t1Out, t2In, t2Out));
        this.t1In = Objects.requireNonNull(t1In);
        this.t1Out = Objects.requireNonNull(t1Out);
        this.t2In = Objects.requireNonNull(t2In);
        this.t2Out = Objects.requireNonNull(t2Out);
    }

    protected double hotEndDifference() {
        return t1In.getValue() - t2Out.getValue();
    }

    protected double coldEndDifference() {
        return t1Out.getValue() - t2In.getValue();
    }

    protected abstract double mean(double a, double b);

    protected abstract double dMeanOverDa(double a, double b);

    protected abstract double dMeanOverDb(double a, double b);

    @Override
    public double eval() {
        return mean(hotEndDifference(), coldEndDifference());
    }

    @Override
    public double der(Variable variable) {
        double a = hotEndDifference();
        double b = coldEndDifference();
        if (variable == t1In) {
            return dMeanOverDa(a, b);
        } else if (variable == t2Out) {
            return -dMeanOverDa(a, b);
        } else if (variable == t1Out) {
            return dMeanOverDb(a, b);
        } else if (variable == t2In) {
            return -dMeanOverDb(a, b);
        } else {
            throw new IllegalStateException("Unknown variable: " + variable);
        }
    }
}
