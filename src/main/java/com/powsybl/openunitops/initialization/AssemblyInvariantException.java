/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.initialization;

import com.powsybl.commons.PowsyblException;

/**
 * Structural defect of a unit: inconsistent wiring, cyclic ordering or a non square problem where a square one
 * is required.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class AssemblyInvariantException extends PowsyblException {

    public AssemblyInvariantException(String message) {
        super(message);
    }
}
