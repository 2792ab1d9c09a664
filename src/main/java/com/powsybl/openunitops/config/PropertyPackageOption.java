/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.config;

import com.powsybl.openunitops.properties.PropertyPackage;

import java.util.Objects;

/**
 * Value of a property package option: either an explicit package or "use default", meaning the package of
 * the enclosing unit.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class PropertyPackageOption {

    private static final PropertyPackageOption USE_DEFAULT = new PropertyPackageOption(null);

    private final PropertyPackage propertyPackage;

    private PropertyPackageOption(PropertyPackage propertyPackage) {
        this.propertyPackage = propertyPackage;
    }

    public static PropertyPackageOption useDefault() {
        return USE_DEFAULT;
    }

    public static PropertyPackageOption of(PropertyPackage propertyPackage) {
        return new PropertyPackageOption(Objects.requireNonNull(propertyPackage));
    }

    public boolean isUseDefault() {
        return propertyPackage == null;
    }

    public PropertyPackage getPropertyPackage() {
        if (propertyPackage == null) {
            throw new ConfigurationException("Property package has not been resolved");
        }
        return propertyPackage;
    }

    /**
     * This option if explicit, else the parent one if explicit.
     *
     * @throws ConfigurationException if neither is explicit
     */
    public PropertyPackageOption orInherit(PropertyPackageOption parent, String path) {
        Objects.requireNonNull(parent);
        if (!isUseDefault()) {
            return this;
        }
        if (!parent.isUseDefault()) {
            return parent;
        }
        throw new ConfigurationException("No property package given for '" + path + "' nor for its parent unit");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o instanceof PropertyPackageOption other) {
            return propertyPackage == other.propertyPackage;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(propertyPackage);
    }

    @Override
    public String toString() {
        return isUseDefault() ? "useDefault" : propertyPackage.getName();
    }
}
