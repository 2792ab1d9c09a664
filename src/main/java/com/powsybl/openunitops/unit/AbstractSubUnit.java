/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit;

import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.parameters.Parameter;
import com.powsybl.commons.parameters.ParameterType;
import com.powsybl.openunitops.config.ConfigSchema;
import com.powsybl.openunitops.config.ConfigurationException;
import com.powsybl.openunitops.config.UnitConfig;
import com.powsybl.openunitops.equations.Equation;
import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.Variable;
import com.powsybl.openunitops.initialization.InitializationPlan;
import com.powsybl.openunitops.properties.PropertyPackage;
import com.powsybl.openunitops.properties.StateBlock;

import java.util.*;

/**
 * Base class of the sub-units, the unit models owning their own balance equations.
 * <p>
 * A sub-unit is initialized by a single direct solve step: a unit specific guess of the outlet state followed
 * by a solve of its block with all inlets fixed.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public abstract class AbstractSubUnit implements UnitModel {

    public static final String DYNAMIC = "dynamic";
    public static final String HAS_HOLDUP = "has_holdup";
    public static final String PROPERTY_PACKAGE = "property_package";
    public static final String PROPERTY_PACKAGE_ARGS = "property_package_args";

    public static final Parameter DYNAMIC_PARAMETER = new Parameter(DYNAMIC, ParameterType.BOOLEAN,
            "Dynamic model flag, only steady state models are supported", Boolean.FALSE);

    public static final Parameter HAS_HOLDUP_PARAMETER = new Parameter(HAS_HOLDUP, ParameterType.BOOLEAN,
            "Holdup terms flag, only models without holdup are supported", Boolean.FALSE);

    protected final UnitConfig config;

    protected final EquationBlock block;

    private final Map<String, Port> ports = new LinkedHashMap<>();

    private final List<SpecialConstraint> specialConstraints = new ArrayList<>();

    private InitializationPlan initializationPlan;

    protected AbstractSubUnit(String name, EquationBlock parent, UnitConfig config, ConfigSchema schema) {
        Objects.requireNonNull(name);
        this.config = Objects.requireNonNull(config);
        if (config.getSchema() != schema) {
            throw new ConfigurationException("Unit '" + name + "' expects a '" + schema.getName()
                    + "' configuration, got '" + config.getSchema().getName() + "'");
        }
        block = parent != null ? parent.createBlock(name) : new EquationBlock(name);
    }

    protected static PropertyPackage getPropertyPackage(UnitConfig config, String path) {
        if (config.getPropertyPackage(PROPERTY_PACKAGE).isUseDefault()) {
            throw new ConfigurationException("No property package given for '" + path + "'");
        }
        return config.getPropertyPackage(PROPERTY_PACKAGE).getPropertyPackage();
    }

    protected Port addPort(String name, Port.Direction direction, PropertyPackage propertyPackage,
                           Map<String, Object> arguments) {
        if (ports.containsKey(name)) {
            throw new PowsyblException("Port '" + name + "' already exists in unit '" + block.getPath() + "'");
        }
        StateBlock stateBlock = propertyPackage.buildStateBlock(block, name, arguments);
        Port port = new Port(this, name, direction, stateBlock);
        ports.put(name, port);
        return port;
    }

    protected SpecialConstraint addSpecialConstraint(Equation equation, Variable determinedVariable) {
        SpecialConstraint specialConstraint = new SpecialConstraint(equation, determinedVariable);
        specialConstraints.add(specialConstraint);
        return specialConstraint;
    }

    public UnitConfig getConfig() {
        return config;
    }

    @Override
    public String getName() {
        return block.getName();
    }

    @Override
    public EquationBlock getBlock() {
        return block;
    }

    @Override
    public Port getPort(String name) {
        Port port = ports.get(name);
        if (port == null) {
            throw new PowsyblException("Port '" + name + "' not found in unit '" + block.getPath() + "'");
        }
        return port;
    }

    public Collection<Port> getPorts() {
        return Collections.unmodifiableCollection(ports.values());
    }

    @Override
    public List<Port> getInletPorts() {
        return ports.values().stream().filter(Port::isInlet).toList();
    }

    @Override
    public List<Port> getOutletPorts() {
        return ports.values().stream().filter(port -> !port.isInlet()).toList();
    }

    @Override
    public List<SpecialConstraint> getSpecialConstraints() {
        return Collections.unmodifiableList(specialConstraints);
    }

    @Override
    public Set<Variable> getDeterminedVariables() {
        Set<Variable> determinedVariables = new LinkedHashSet<>();
        specialConstraints.forEach(specialConstraint -> determinedVariables.add(specialConstraint.determinedVariable()));
        return determinedVariables;
    }

    @Override
    public InitializationPlan getInitializationPlan() {
        if (initializationPlan == null) {
            initializationPlan = InitializationPlan.directSolve(this, this::guess);
        }
        return initializationPlan;
    }

    /**
     * Set a starting point of the unshared variables from the current inlet values.
     */
    protected abstract void guess();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + block.getPath() + ")";
    }
}
