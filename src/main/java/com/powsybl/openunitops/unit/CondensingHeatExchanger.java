/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit;

import com.powsybl.openunitops.config.UnitConfig;
import com.powsybl.openunitops.equations.Equation;
import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.properties.StateBlock;

/**
 * Heat exchanger whose hot side leaves as saturated liquid. The steam flow entering side 1 is not an input
 * but the unknown of the extraction rate constraint.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class CondensingHeatExchanger extends HeatExchanger {

    public static final String EXTRACTION_RATE_CONSTRAINT = "extraction_rate_constraint";

    private final Equation extractionRateConstraint;

    public CondensingHeatExchanger(String name, UnitConfig config) {
        this(name, null, config);
    }

    public CondensingHeatExchanger(String name, EquationBlock parent, UnitConfig config) {
        super(name, parent, config);
        StateBlock out1 = outlet1.getStateBlock();
        extractionRateConstraint = block.createEquation(EXTRACTION_RATE_CONSTRAINT)
                .addTerm(out1.getEnthMol().createTerm())
                .addTerm(out1.createSaturatedLiquidEnthalpyTerm().minus());
        addSpecialConstraint(extractionRateConstraint, inlet1.getStateBlock().getFlowMol());
    }

    public Equation getExtractionRateConstraint() {
        return extractionRateConstraint;
    }
}
