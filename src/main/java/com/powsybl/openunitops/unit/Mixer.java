/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit;

import com.powsybl.commons.parameters.Parameter;
import com.powsybl.commons.parameters.ParameterType;
import com.powsybl.openunitops.config.ConfigSchema;
import com.powsybl.openunitops.config.ConfigurationException;
import com.powsybl.openunitops.config.UnitConfig;
import com.powsybl.openunitops.equations.Equation;
import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.ProductEquationTerm;
import com.powsybl.openunitops.equations.Variable;
import com.powsybl.openunitops.properties.PropertyPackage;
import com.powsybl.openunitops.properties.StateBlock;

import java.util.*;

/**
 * Adiabatic mixer of several inlets into a single outlet. The outlet pressure is the pressure of the first
 * inlet.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class Mixer extends AbstractSubUnit {

    public static final String INLET_LIST = "inlet_list";

    public static final String OUTLET = "outlet";

    public static final String MATERIAL_MIXING_EQUATION = "material_mixing_equation";
    public static final String ENTHALPY_MIXING_EQUATION = "enthalpy_mixing_equation";
    public static final String MIXER_PRESSURE_CONSTRAINT = "mixer_pressure_constraint";

    public static final List<String> DEFAULT_INLET_LIST = List.of("steam", "drain");

    public static final ConfigSchema SCHEMA = ConfigSchema.builder("mixer")
            .parameter(DYNAMIC_PARAMETER, Boolean.FALSE)
            .parameter(HAS_HOLDUP_PARAMETER, Boolean.FALSE)
            .propertyPackage(PROPERTY_PACKAGE, "Property package of all the streams")
            .arguments(PROPERTY_PACKAGE_ARGS, "Arguments given to the property package when building the stream states")
            .parameter(new Parameter(INLET_LIST, ParameterType.STRING_LIST,
                    "Inlet port names, the first one sets the outlet pressure", DEFAULT_INLET_LIST))
            .build();

    private final List<Port> inlets;

    private final Port outlet;

    private final Equation pressureConstraint;

    public Mixer(String name, UnitConfig config) {
        this(name, null, config);
    }

    public Mixer(String name, EquationBlock parent, UnitConfig config) {
        super(name, parent, config, SCHEMA);
        List<String> inletNames = config.getStringList(INLET_LIST);
        if (inletNames.isEmpty() || new HashSet<>(inletNames).size() != inletNames.size()
                || inletNames.contains(OUTLET)) {
            throw new ConfigurationException("Invalid inlet list for mixer '" + name + "': " + inletNames);
        }
        PropertyPackage propertyPackage = getPropertyPackage(config, block.getPath());
        Map<String, Object> arguments = config.getArguments(PROPERTY_PACKAGE_ARGS);

        List<Port> ports = new ArrayList<>(inletNames.size());
        for (String inletName : inletNames) {
            ports.add(addPort(inletName, Port.Direction.INLET, propertyPackage, arguments));
        }
        inlets = Collections.unmodifiableList(ports);
        outlet = addPort(OUTLET, Port.Direction.OUTLET, propertyPackage, arguments);
        StateBlock out = outlet.getStateBlock();

        Equation materialMixing = block.createEquation(MATERIAL_MIXING_EQUATION);
        Equation enthalpyMixing = block.createEquation(ENTHALPY_MIXING_EQUATION);
        for (Port inlet : inlets) {
            StateBlock in = inlet.getStateBlock();
            materialMixing.addTerm(in.getFlowMol().createTerm());
            enthalpyMixing.addTerm(new ProductEquationTerm(in.getFlowMol(), in.getEnthMol()));
        }
        materialMixing.addTerm(out.getFlowMol().createTerm().minus());
        enthalpyMixing.addTerm(new ProductEquationTerm(-1, out.getFlowMol(), out.getEnthMol()));

        pressureConstraint = block.createEquation(MIXER_PRESSURE_CONSTRAINT)
                .addTerm(out.getPressure().createTerm())
                .addTerm(inlets.get(0).getStateBlock().getPressure().createTerm().minus());
    }

    @Override
    protected void guess() {
        double flow = 0;
        double enthalpyFlow = 0;
        double pressure = Double.POSITIVE_INFINITY;
        for (Port inlet : inlets) {
            StateBlock in = inlet.getStateBlock();
            flow += in.getFlowMol().getValue();
            enthalpyFlow += in.getFlowMol().getValue() * in.getEnthMol().getValue();
            pressure = Math.min(pressure, in.getPressure().getValue());
        }
        StateBlock out = outlet.getStateBlock();
        setIfUnfixed(out.getFlowMol(), flow);
        setIfUnfixed(out.getEnthMol(), flow != 0 ? enthalpyFlow / flow : inlets.get(0).getStateBlock().getEnthMol().getValue());
        setIfUnfixed(out.getPressure(), pressure);
        for (Port inlet : inlets) {
            inlet.getStateBlock().initialize();
        }
        out.initialize();
    }

    private static void setIfUnfixed(Variable variable, double value) {
        if (!variable.isFixed()) {
            variable.setValue(value);
        }
    }

    public List<Port> getInlets() {
        return inlets;
    }

    public Port getOutlet() {
        return outlet;
    }

    public Equation getPressureConstraint() {
        return pressureConstraint;
    }
}
