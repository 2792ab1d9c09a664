/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.solver;

import com.powsybl.openunitops.equations.EquationBlock;

/**
 * Synchronous solve of the active equations of a block for its unfixed variables.
 * <p>
 * Whatever the returned status, the values of the unfixed variables are left at the last iterate.
 * Fixed flags are never modified.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public interface SolverAdapter {

    String getName();

    SolverResult solve(EquationBlock block, SolverParameters parameters);
}
