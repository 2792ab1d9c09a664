/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.initialization;

import com.powsybl.openunitops.config.ConfigurationException;
import com.powsybl.openunitops.solver.NewtonRaphson;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InitializationParametersTest {

    @Test
    void testDefaults() {
        InitializationParameters parameters = new InitializationParameters();
        assertEquals(InitializationParameters.DEFAULT_OUTLVL, parameters.getOutlvl());
        assertInstanceOf(NewtonRaphson.class, parameters.getSolverAdapter());
        assertEquals(100, parameters.getSolverParameters().getMaxIterations());
    }

    @Test
    void testSolverOptions() {
        InitializationParameters parameters = new InitializationParameters()
                .setSolverOptions(Map.of("max_iter", "30", "line_search_max_iter", "5"));
        assertEquals(30, parameters.getSolverParameters().getMaxIterations());
        assertEquals(5, parameters.getSolverParameters().getLineSearchMaxIterations());

        Map<String, String> options = Map.of("unknown", "1");
        assertThrows(ConfigurationException.class, () -> parameters.setSolverOptions(options));
        assertThrows(IllegalArgumentException.class, () -> parameters.setOutlvl(-1));
    }
}
