/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.snapshot;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered state records captured from a block at one instant.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class Snapshot {

    private final String blockPath;

    private final StoreSpec spec;

    private final List<StateRecord> records;

    public Snapshot(String blockPath, StoreSpec spec, List<StateRecord> records) {
        this.blockPath = Objects.requireNonNull(blockPath);
        this.spec = Objects.requireNonNull(spec);
        this.records = List.copyOf(records);
    }

    /**
     * Path of the block the snapshot was captured from.
     */
    public String getBlockPath() {
        return blockPath;
    }

    public StoreSpec getSpec() {
        return spec;
    }

    public List<StateRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o instanceof Snapshot other) {
            return blockPath.equals(other.blockPath) && spec.equals(other.spec) && records.equals(other.records);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(blockPath, spec, records);
    }

    @Override
    public String toString() {
        return "Snapshot(block=" + blockPath + ", spec=" + spec + ", records=" + records.size() + ")";
    }
}
