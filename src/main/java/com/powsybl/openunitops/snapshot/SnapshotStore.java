/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.snapshot;

import com.powsybl.openunitops.equations.Equation;
import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Captures and restores the fixed, active and optionally value state of a block subtree.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class SnapshotStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotStore.class);

    private SnapshotStore() {
    }

    public static Snapshot capture(EquationBlock block, StoreSpec spec) {
        Objects.requireNonNull(block);
        Objects.requireNonNull(spec);
        LOGGER.trace("Capturing state of block '{}' ({})", block.getPath(), spec);
        List<StateRecord> records = new ArrayList<>();
        for (Variable variable : block.getAllVariables()) {
            double value = spec.includesValueOf(variable.isFixed()) ? variable.getValue() : Double.NaN;
            records.add(StateRecord.variable(block.getRelativePath(variable.getPath()), value, variable.isFixed()));
        }
        for (Equation equation : block.getAllEquations()) {
            records.add(StateRecord.equation(block.getRelativePath(equation.getPath()), equation.isActive()));
        }
        return new Snapshot(block.getPath(), spec, records);
    }

    private record Target(StateRecord stateRecord, Variable variable, Equation equation) {
    }

    /**
     * Write every record of the snapshot back into the block. All paths are resolved before anything is
     * written, so an unresolvable path leaves the block untouched.
     *
     * @throws SnapshotRestoreException if a path of the snapshot is not found in the block
     */
    public static void restore(EquationBlock block, Snapshot snapshot) {
        Objects.requireNonNull(block);
        Objects.requireNonNull(snapshot);
        LOGGER.trace("Restoring state of block '{}' ({} records)", block.getPath(), snapshot.size());

        List<Target> targets = new ArrayList<>(snapshot.size());
        for (StateRecord stateRecord : snapshot.getRecords()) {
            if (stateRecord.kind() == StateRecord.Kind.VARIABLE) {
                Variable variable = block.findVariable(stateRecord.path())
                        .orElseThrow(() -> notFound(block, stateRecord));
                targets.add(new Target(stateRecord, variable, null));
            } else {
                Equation equation = block.findEquation(stateRecord.path())
                        .orElseThrow(() -> notFound(block, stateRecord));
                targets.add(new Target(stateRecord, null, equation));
            }
        }

        for (Target target : targets) {
            StateRecord stateRecord = target.stateRecord();
            if (target.variable() != null) {
                Variable variable = target.variable();
                if (stateRecord.hasValue()) {
                    variable.setValue(stateRecord.value());
                }
                if (stateRecord.fixed()) {
                    variable.fix();
                } else {
                    variable.unfix();
                }
            } else {
                target.equation().setActive(stateRecord.active());
            }
        }
    }

    private static SnapshotRestoreException notFound(EquationBlock block, StateRecord stateRecord) {
        String kind = stateRecord.kind() == StateRecord.Kind.VARIABLE ? "variable" : "equation";
        return new SnapshotRestoreException("Cannot restore " + kind + " '" + stateRecord.path() + "': not found in block '" + block.getPath() + "'");
    }
}
