/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.initialization;

import com.powsybl.openunitops.unit.Arc;
import com.powsybl.openunitops.unit.UnitModel;

import java.util.List;
import java.util.Objects;

/**
 * One step of an initialization plan: seed some inlets of a target unit, then either initialize the target
 * recursively or guess and solve it directly.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class InitializationStep {

    public enum Kind {
        /**
         * Recursive initialization of a sub-unit, the variables it determines stay free.
         */
        INITIALIZE,
        /**
         * Guess then solve of the target block with all its inlets fixed.
         */
        SOLVE
    }

    private final Kind kind;

    private final UnitModel target;

    private final List<Arc> seeds;

    private final Runnable guess;

    private InitializationStep(Kind kind, UnitModel target, List<Arc> seeds, Runnable guess) {
        this.kind = Objects.requireNonNull(kind);
        this.target = Objects.requireNonNull(target);
        this.seeds = List.copyOf(Objects.requireNonNull(seeds));
        this.guess = guess;
    }

    public static InitializationStep initialize(UnitModel target, List<Arc> seeds) {
        return new InitializationStep(Kind.INITIALIZE, target, seeds, null);
    }

    public static InitializationStep solve(UnitModel target, Runnable guess) {
        return new InitializationStep(Kind.SOLVE, target, List.of(), Objects.requireNonNull(guess));
    }

    public Kind getKind() {
        return kind;
    }

    public UnitModel getTarget() {
        return target;
    }

    /**
     * Arcs propagated, in order, before the step runs.
     */
    public List<Arc> getSeeds() {
        return seeds;
    }

    public Runnable getGuess() {
        return guess;
    }

    @Override
    public String toString() {
        return "InitializationStep(" + kind + ", " + target.getName() + ")";
    }
}
