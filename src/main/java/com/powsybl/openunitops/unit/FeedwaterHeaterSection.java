/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit;

import com.powsybl.openunitops.config.UnitConfig;

import java.util.EnumSet;
import java.util.Set;

/**
 * Sections of a feedwater heater, declared in initialization order: the steam side is traversed from the
 * desuperheater down to the drain cooler.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public enum FeedwaterHeaterSection {
    DESUPERHEAT("desuperheat", FeedwaterHeater.HAS_DESUPERHEAT),
    DRAIN_MIXER("drain_mix", FeedwaterHeater.HAS_DRAIN_MIXER),
    CONDENSING("condense", null),
    DRAIN_COOLING("cooling", FeedwaterHeater.HAS_DRAIN_COOLING);

    private final String unitName;

    private final String flagName;

    FeedwaterHeaterSection(String unitName, String flagName) {
        this.unitName = unitName;
        this.flagName = flagName;
    }

    public String getUnitName() {
        return unitName;
    }

    public boolean isOptional() {
        return flagName != null;
    }

    public boolean isPresent(UnitConfig config) {
        return flagName == null || config.getBoolean(flagName);
    }

    public static Set<FeedwaterHeaterSection> of(UnitConfig config) {
        Set<FeedwaterHeaterSection> sections = EnumSet.noneOf(FeedwaterHeaterSection.class);
        for (FeedwaterHeaterSection section : values()) {
            if (section.isPresent(config)) {
                sections.add(section);
            }
        }
        return sections;
    }
}
