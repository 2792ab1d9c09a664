/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.initialization;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public enum InitializationState {
    UNSOLVED,
    CONSTRAINTS_RELAXED,
    SUB_UNITS_SEQUENCED,
    CONSTRAINTS_RESTORED,
    COUPLED_SOLVED,
    SNAPSHOT_RESTORED
}
