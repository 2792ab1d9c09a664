/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.config;

import com.powsybl.commons.parameters.Parameter;
import com.powsybl.openunitops.properties.PropertyPackage;

import java.util.*;

/**
 * Declarative option table of a unit model. Scalar options are described by a powsybl {@link Parameter},
 * next to property package options, free argument maps and nested option blocks.
 * <p>
 * {@link #create(Map)} fails closed: unknown names, wrong types and out of domain values raise a
 * {@link ConfigurationException}.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class ConfigSchema {

    public enum OptionType {
        PARAMETER,
        PROPERTY_PACKAGE,
        ARGUMENTS,
        BLOCK
    }

    /**
     * @param parameter only for {@link OptionType#PARAMETER}
     * @param domain allowed values of a parameter, null if any value of the right type is allowed
     * @param schema only for {@link OptionType#BLOCK}
     */
    public record Option(String name, OptionType type, String description, Parameter parameter, List<Object> domain,
                         ConfigSchema schema) {
    }

    private final String name;

    private final Map<String, Option> options;

    private ConfigSchema(String name, Map<String, Option> options) {
        this.name = Objects.requireNonNull(name);
        this.options = Collections.unmodifiableMap(options);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {

        private final String name;

        private final Map<String, Option> options = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name);
        }

        private Builder add(Option option) {
            if (options.containsKey(option.name())) {
                throw new IllegalArgumentException("Option '" + option.name() + "' declared twice in schema '" + name + "'");
            }
            options.put(option.name(), option);
            return this;
        }

        public Builder parameter(Parameter parameter) {
            return add(new Option(parameter.getName(), OptionType.PARAMETER, parameter.getDescription(), parameter,
                    parameter.getPossibleValues(), null));
        }

        /**
         * Declare a parameter whose values are restricted to the given domain.
         */
        public Builder parameter(Parameter parameter, Object... domain) {
            List<Object> values = List.of(domain);
            if (!values.contains(parameter.getDefaultValue())) {
                throw new IllegalArgumentException("Domain " + values + " of option '" + parameter.getName()
                        + "' does not contain its default value");
            }
            return add(new Option(parameter.getName(), OptionType.PARAMETER, parameter.getDescription(), parameter,
                    values, null));
        }

        public Builder propertyPackage(String name, String description) {
            return add(new Option(name, OptionType.PROPERTY_PACKAGE, description, null, null, null));
        }

        public Builder arguments(String name, String description) {
            return add(new Option(name, OptionType.ARGUMENTS, description, null, null, null));
        }

        public Builder block(String name, ConfigSchema schema, String description) {
            return add(new Option(name, OptionType.BLOCK, description, null, null, Objects.requireNonNull(schema)));
        }

        public ConfigSchema build() {
            return new ConfigSchema(name, new LinkedHashMap<>(options));
        }
    }

    public String getName() {
        return name;
    }

    public Collection<Option> getOptions() {
        return options.values();
    }

    public Optional<Option> getOption(String name) {
        return Optional.ofNullable(options.get(name));
    }

    public UnitConfig createDefault() {
        return create(Collections.emptyMap());
    }

    public UnitConfig create(Map<String, ?> values) {
        return create(values, name);
    }

    UnitConfig create(Map<String, ?> values, String path) {
        Objects.requireNonNull(values);
        for (String optionName : values.keySet()) {
            if (!options.containsKey(optionName)) {
                throw new ConfigurationException("Unknown option '" + optionName + "' in '" + path
                        + "', expected one of " + options.keySet());
            }
        }
        Map<String, Object> validated = new LinkedHashMap<>();
        for (Option option : options.values()) {
            String optionPath = path + "." + option.name();
            Object value = values.get(option.name());
            validated.put(option.name(), value != null ? convert(option, value, optionPath) : getDefaultValue(option));
        }
        return new UnitConfig(this, validated);
    }

    private static Object getDefaultValue(Option option) {
        return switch (option.type()) {
            case PARAMETER -> option.parameter().getDefaultValue();
            case PROPERTY_PACKAGE -> PropertyPackageOption.useDefault();
            case ARGUMENTS -> Collections.emptyMap();
            case BLOCK -> option.schema().createDefault();
        };
    }

    private static Object convert(Option option, Object value, String path) {
        return switch (option.type()) {
            case PARAMETER -> checkDomain(option, convertParameterValue(option.parameter(), value, path), path);
            case PROPERTY_PACKAGE -> convertPropertyPackage(value, path);
            case ARGUMENTS -> convertArguments(value, path);
            case BLOCK -> convertBlock(option.schema(), value, path);
        };
    }

    private static Object convertParameterValue(Parameter parameter, Object value, String path) {
        switch (parameter.getType()) {
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                if (value instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
                    return Boolean.parseBoolean(s);
                }
                break;
            case STRING:
                if (value instanceof String) {
                    return value;
                }
                if (value instanceof Enum<?> e) {
                    return e.name();
                }
                break;
            case STRING_LIST:
                if (value instanceof List<?> list && list.stream().allMatch(String.class::isInstance)) {
                    return List.copyOf(list);
                }
                break;
            case INTEGER:
                if (value instanceof Integer) {
                    return value;
                }
                break;
            case DOUBLE:
                if (value instanceof Number n) {
                    return n.doubleValue();
                }
                break;
            default:
                break;
        }
        throw new ConfigurationException("Invalid value '" + value + "' for option '" + path + "': "
                + parameter.getType() + " expected");
    }

    private static Object checkDomain(Option option, Object value, String path) {
        if (option.domain() != null && !option.domain().contains(value)) {
            throw new ConfigurationException("Value '" + value + "' of option '" + path + "' is not in domain "
                    + option.domain());
        }
        return value;
    }

    private static PropertyPackageOption convertPropertyPackage(Object value, String path) {
        if (value instanceof PropertyPackageOption option) {
            return option;
        }
        if (value instanceof PropertyPackage propertyPackage) {
            return PropertyPackageOption.of(propertyPackage);
        }
        throw new ConfigurationException("Invalid value '" + value + "' for option '" + path
                + "': property package expected");
    }

    private static Map<String, Object> convertArguments(Object value, String path) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> arguments = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String key) || e.getValue() == null) {
                    throw new ConfigurationException("Invalid argument '" + e.getKey() + "' in '" + path + "'");
                }
                arguments.put(key, e.getValue());
            }
            return Collections.unmodifiableMap(arguments);
        }
        throw new ConfigurationException("Invalid value '" + value + "' for option '" + path + "': map expected");
    }

    private static UnitConfig convertBlock(ConfigSchema schema, Object value, String path) {
        if (value instanceof UnitConfig config) {
            if (config.getSchema() != schema) {
                throw new ConfigurationException("Option '" + path + "' expects a '" + schema.getName()
                        + "' configuration, got '" + config.getSchema().getName() + "'");
            }
            return config;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new ConfigurationException("Invalid option name '" + e.getKey() + "' in '" + path + "'");
                }
                values.put(key, e.getValue());
            }
            return schema.create(values, path);
        }
        throw new ConfigurationException("Invalid value '" + value + "' for option '" + path
                + "': configuration block expected");
    }

    @Override
    public String toString() {
        return "ConfigSchema(" + name + ", " + options.keySet() + ")";
    }
}
