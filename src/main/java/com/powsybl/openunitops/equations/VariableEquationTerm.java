/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.equations;

import java.util.List;
import java.util.Objects;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class VariableEquationTerm extends AbstractEquationTerm {

    public VariableEquationTerm(Variable variable) {
        super(List.of(Objects.requireNonNull(variable)));
    }

    private Variable getVariable() {
        return variables.get(0);
    }

    @Override
    public double eval() {
        return getVariable().getValue();
    }

    @Override
    public double der(Variable variable) {
        return variable == getVariable() ? 1 : 0;
    }
}
