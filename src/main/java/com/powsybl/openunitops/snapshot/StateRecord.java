/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.snapshot;

import java.util.Objects;

/**
 * State of one variable or equation, addressed by its path relative to the captured block.
 *
 * @param value NaN if the value was not recorded
 * @param fixed always false for an equation
 * @param active always true for a variable
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public record StateRecord(String path, Kind kind, double value, boolean fixed, boolean active) {

    public enum Kind {
        VARIABLE,
        EQUATION
    }

    public StateRecord {
        Objects.requireNonNull(path);
        Objects.requireNonNull(kind);
    }

    public static StateRecord variable(String path, double value, boolean fixed) {
        return new StateRecord(path, Kind.VARIABLE, value, fixed, true);
    }

    public static StateRecord equation(String path, boolean active) {
        return new StateRecord(path, Kind.EQUATION, Double.NaN, false, active);
    }

    public boolean hasValue() {
        return !Double.isNaN(value);
    }
}
