/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.config;

import java.util.*;

/**
 * A validated, read-only set of option values of a {@link ConfigSchema}. Every declared option has a value,
 * defaults included. Derived configurations are obtained with {@link #with(String, Object)}.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class UnitConfig {

    private final ConfigSchema schema;

    private final Map<String, Object> values;

    UnitConfig(ConfigSchema schema, Map<String, Object> values) {
        this.schema = Objects.requireNonNull(schema);
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public ConfigSchema getSchema() {
        return schema;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    private <T> T get(String name, Class<T> type) {
        Object value = values.get(name);
        if (value == null && !values.containsKey(name)) {
            throw new ConfigurationException("Unknown option '" + name + "' in '" + schema.getName() + "'");
        }
        if (!type.isInstance(value)) {
            throw new ConfigurationException("Option '" + name + "' of '" + schema.getName() + "' is not a "
                    + type.getSimpleName());
        }
        return type.cast(value);
    }

    public boolean getBoolean(String name) {
        return get(name, Boolean.class);
    }

    public String getString(String name) {
        return get(name, String.class);
    }

    public <E extends Enum<E>> E getEnum(String name, Class<E> enumClass) {
        return Enum.valueOf(enumClass, getString(name));
    }

    public double getDouble(String name) {
        return get(name, Double.class);
    }

    @SuppressWarnings("unchecked")
    public List<String> getStringList(String name) {
        return get(name, List.class);
    }

    public PropertyPackageOption getPropertyPackage(String name) {
        return get(name, PropertyPackageOption.class);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getArguments(String name) {
        return get(name, Map.class);
    }

    public UnitConfig getBlock(String name) {
        return get(name, UnitConfig.class);
    }

    /**
     * A copy of this configuration with one option changed, validated against the same schema.
     */
    public UnitConfig with(String name, Object value) {
        Map<String, Object> newValues = new LinkedHashMap<>(values);
        newValues.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
        return schema.create(newValues);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o instanceof UnitConfig other) {
            return schema == other.schema && values.equals(other.values);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema.getName(), values);
    }

    @Override
    public String toString() {
        return schema.getName() + values;
    }
}
