/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.snapshot;

import com.powsybl.commons.PowsyblException;

/**
 * A snapshot no longer matches the structure of the block it is restored into.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class SnapshotRestoreException extends PowsyblException {

    public SnapshotRestoreException(String message) {
        super(message);
    }
}
