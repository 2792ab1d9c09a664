/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.config;

import com.google.common.testing.EqualsTester;
import com.powsybl.openunitops.properties.WaterSteamPropertyPackage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PropertyPackageOptionTest {

    @Test
    void testInherit() {
        PropertyPackageOption water = PropertyPackageOption.of(new WaterSteamPropertyPackage());
        PropertyPackageOption other = PropertyPackageOption.of(new WaterSteamPropertyPackage());
        PropertyPackageOption useDefault = PropertyPackageOption.useDefault();

        assertSame(water, water.orInherit(other, "fwh.condense.side_1"));
        assertSame(water, useDefault.orInherit(water, "fwh.condense.side_1"));
        assertSame(water, water.orInherit(useDefault, "fwh.condense.side_1"));

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> useDefault.orInherit(PropertyPackageOption.useDefault(), "fwh.condense.side_1"));
        assertEquals("No property package given for 'fwh.condense.side_1' nor for its parent unit", e.getMessage());
        e = assertThrows(ConfigurationException.class, useDefault::getPropertyPackage);
        assertEquals("Property package has not been resolved", e.getMessage());
    }

    @Test
    void testEquals() {
        WaterSteamPropertyPackage propertyPackage = new WaterSteamPropertyPackage();
        new EqualsTester()
                .addEqualityGroup(PropertyPackageOption.useDefault(), PropertyPackageOption.useDefault())
                .addEqualityGroup(PropertyPackageOption.of(propertyPackage), PropertyPackageOption.of(propertyPackage))
                .addEqualityGroup(PropertyPackageOption.of(new WaterSteamPropertyPackage()))
                .testEquals();
        assertEquals("useDefault", PropertyPackageOption.useDefault().toString());
        assertEquals("water-steam", PropertyPackageOption.of(propertyPackage).toString());
    }
}
