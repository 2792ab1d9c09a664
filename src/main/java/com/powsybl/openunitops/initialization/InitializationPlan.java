/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.initialization;

import com.powsybl.openunitops.unit.UnitModel;

import java.util.List;
import java.util.Objects;

/**
 * Ordered steps run by the {@link InitializationScheduler} before the coupled solve of a unit.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class InitializationPlan {

    private final List<InitializationStep> steps;

    public InitializationPlan(List<InitializationStep> steps) {
        this.steps = List.copyOf(Objects.requireNonNull(steps));
    }

    public static InitializationPlan directSolve(UnitModel unit, Runnable guess) {
        return new InitializationPlan(List.of(InitializationStep.solve(unit, guess)));
    }

    public List<InitializationStep> getSteps() {
        return steps;
    }

    /**
     * True if this plan is the single direct solve of the given unit.
     */
    public boolean isDirectSolveOf(UnitModel unit) {
        return steps.size() == 1
                && steps.get(0).getKind() == InitializationStep.Kind.SOLVE
                && steps.get(0).getTarget() == unit;
    }

    /**
     * Index of the first step targeting the given unit, -1 if none.
     */
    public int indexOf(UnitModel unit) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).getTarget() == unit) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "InitializationPlan" + steps;
    }
}
