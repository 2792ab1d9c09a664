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
 * Selects what a {@link Snapshot} records. Fixed flags of all variables and active flags of all equations are
 * always recorded. Values are recorded if requested, possibly for fixed variables only.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class StoreSpec {

    private final boolean includeValues;

    private final boolean onlyFixed;

    private StoreSpec(boolean includeValues, boolean onlyFixed) {
        this.includeValues = includeValues;
        this.onlyFixed = onlyFixed;
    }

    public static StoreSpec valueIsFixedIsActive(boolean onlyFixed) {
        return new StoreSpec(true, onlyFixed);
    }

    public static StoreSpec isFixedIsActive() {
        return new StoreSpec(false, false);
    }

    public boolean isIncludeValues() {
        return includeValues;
    }

    public boolean isOnlyFixed() {
        return onlyFixed;
    }

    public boolean includesValueOf(boolean fixed) {
        return includeValues && (fixed || !onlyFixed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o instanceof StoreSpec other) {
            return includeValues == other.includeValues && onlyFixed == other.onlyFixed;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(includeValues, onlyFixed);
    }

    @Override
    public String toString() {
        return "StoreSpec(includeValues=" + includeValues + ", onlyFixed=" + onlyFixed + ")";
    }
}
