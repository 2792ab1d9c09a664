/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.config;

import com.powsybl.commons.PowsyblException;

/**
 * Invalid or missing unit configuration option, raised before anything is built.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class ConfigurationException extends PowsyblException {

    public ConfigurationException(String message) {
        super(message);
    }
}
