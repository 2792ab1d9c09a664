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
 * An equality constraint: the sum of its terms must be zero. Only active equations take part in a solve.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class Equation {

    private final EquationBlock block;

    private final String name;

    private final List<EquationTerm> terms = new ArrayList<>();

    private boolean active = true;

    Equation(EquationBlock block, String name) {
        this.block = Objects.requireNonNull(block);
        this.name = Objects.requireNonNull(name);
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

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Equation addTerm(EquationTerm term) {
        terms.add(Objects.requireNonNull(term));
        return this;
    }

    public Equation addTerms(List<? extends EquationTerm> terms) {
        Objects.requireNonNull(terms).forEach(this::addTerm);
        return this;
    }

    public List<EquationTerm> getTerms() {
        return Collections.unmodifiableList(terms);
    }

    /**
     * Distinct variables read by the terms, in order of first appearance.
     */
    public Set<Variable> getVariables() {
        Set<Variable> variables = new LinkedHashSet<>();
        for (EquationTerm term : terms) {
            variables.addAll(term.getVariables());
        }
        return variables;
    }

    /**
     * Residual of the equation at the current variable values.
     */
    public double eval() {
        double value = 0;
        for (EquationTerm term : terms) {
            value += term.eval();
        }
        return value;
    }

    /**
     * Magnitude the residual is compared with: the largest absolute term value, at least 1.
     */
    public double getScale() {
        double scale = 1;
        for (EquationTerm term : terms) {
            scale = Math.max(scale, Math.abs(term.eval()));
        }
        return scale;
    }

    public interface DerHandler {
        void onDer(Variable variable, double value);
    }

    public void der(DerHandler handler) {
        Objects.requireNonNull(handler);
        for (Variable variable : getVariables()) {
            double value = 0;
            for (EquationTerm term : terms) {
                if (term.getVariables().contains(variable)) {
                    value += term.der(variable);
                }
            }
            handler.onDer(variable, value);
        }
    }

    @Override
    public String toString() {
        return "Equation(path=" + getPath() + ", active=" + active + ")";
    }
}
