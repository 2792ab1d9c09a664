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
import com.powsybl.openunitops.config.UnitConfig;
import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.EquationTerm;
import com.powsybl.openunitops.equations.ProductEquationTerm;
import com.powsybl.openunitops.equations.Variable;
import com.powsybl.openunitops.properties.PropertyPackage;
import com.powsybl.openunitops.properties.StateBlock;
import com.powsybl.openunitops.unit.equations.LmtdDeltaTemperatureEquationTerm;
import com.powsybl.openunitops.unit.equations.UnderwoodDeltaTemperatureEquationTerm;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Counter-current heat exchanger. Side 1 is the hot side, side 2 the cold one.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class HeatExchanger extends AbstractSubUnit {

    public enum DeltaTemperatureRule {
        UNDERWOOD {
            @Override
            EquationTerm createTerm(Variable t1In, Variable t1Out, Variable t2In, Variable t2Out) {
                return new UnderwoodDeltaTemperatureEquationTerm(t1In, t1Out, t2In, t2Out);
            }
        },
        LMTD {
            @Override
            EquationTerm createTerm(Variable t1In, Variable t1Out, Variable t2In, Variable t2Out) {
                return new LmtdDeltaTemperatureEquationTerm(t1In, t1Out, t2In, t2Out);
            }
        };

        abstract EquationTerm createTerm(Variable t1In, Variable t1Out, Variable t2In, Variable t2Out);
    }

    public static final String DELTA_TEMPERATURE_RULE = "delta_temperature_rule";
    public static final String SIDE_1 = "side_1";
    public static final String SIDE_2 = "side_2";

    public static final String INLET_1 = "inlet_1";
    public static final String OUTLET_1 = "outlet_1";
    public static final String INLET_2 = "inlet_2";
    public static final String OUTLET_2 = "outlet_2";

    public static final String HEAT_DUTY = "heat_duty";
    public static final String AREA = "area";
    public static final String OVERALL_HEAT_TRANSFER_COEFFICIENT = "overall_heat_transfer_coefficient";
    public static final String DELTA_TEMPERATURE = "delta_temperature";

    public static final double DEFAULT_AREA = 10;
    public static final double DEFAULT_OVERALL_HEAT_TRANSFER_COEFFICIENT = 100;
    public static final double DEFAULT_DELTA_TEMPERATURE = 10;

    public static final ConfigSchema SIDE_SCHEMA = ConfigSchema.builder("heat_exchanger_side")
            .propertyPackage(PROPERTY_PACKAGE, "Property package of the side, the one of the enclosing unit if not given")
            .arguments(PROPERTY_PACKAGE_ARGS, "Arguments given to the property package when building the side states")
            .build();

    public static final ConfigSchema SCHEMA = ConfigSchema.builder("heat_exchanger")
            .parameter(DYNAMIC_PARAMETER, Boolean.FALSE)
            .parameter(HAS_HOLDUP_PARAMETER, Boolean.FALSE)
            .parameter(new Parameter(DELTA_TEMPERATURE_RULE, ParameterType.STRING, "Mean temperature difference rule",
                    DeltaTemperatureRule.UNDERWOOD.name(),
                    Arrays.stream(DeltaTemperatureRule.values()).map(Enum::name).map(Object.class::cast).toList()))
            .block(SIDE_1, SIDE_SCHEMA, "Hot side")
            .block(SIDE_2, SIDE_SCHEMA, "Cold side")
            .build();

    protected final Port inlet1;
    protected final Port outlet1;
    protected final Port inlet2;
    protected final Port outlet2;

    protected final Variable heatDuty;
    protected final Variable area;
    protected final Variable overallHeatTransferCoefficient;
    protected final Variable deltaTemperature;

    private final EquationTerm deltaTemperatureTerm;

    public HeatExchanger(String name, UnitConfig config) {
        this(name, null, config);
    }

    public HeatExchanger(String name, EquationBlock parent, UnitConfig config) {
        super(name, parent, config, SCHEMA);
        UnitConfig side1 = config.getBlock(SIDE_1);
        UnitConfig side2 = config.getBlock(SIDE_2);
        PropertyPackage propertyPackage1 = getPropertyPackage(side1, block.getPath() + "." + SIDE_1);
        PropertyPackage propertyPackage2 = getPropertyPackage(side2, block.getPath() + "." + SIDE_2);
        Map<String, Object> arguments1 = side1.getArguments(PROPERTY_PACKAGE_ARGS);
        Map<String, Object> arguments2 = side2.getArguments(PROPERTY_PACKAGE_ARGS);

        inlet1 = addPort(INLET_1, Port.Direction.INLET, propertyPackage1, arguments1);
        outlet1 = addPort(OUTLET_1, Port.Direction.OUTLET, propertyPackage1, arguments1);
        inlet2 = addPort(INLET_2, Port.Direction.INLET, propertyPackage2, arguments2);
        outlet2 = addPort(OUTLET_2, Port.Direction.OUTLET, propertyPackage2, arguments2);

        heatDuty = block.createVariable(HEAT_DUTY, 0);
        area = block.createVariable(AREA, DEFAULT_AREA).setBounds(0, Double.POSITIVE_INFINITY);
        overallHeatTransferCoefficient = block.createVariable(OVERALL_HEAT_TRANSFER_COEFFICIENT,
                DEFAULT_OVERALL_HEAT_TRANSFER_COEFFICIENT).setBounds(0, Double.POSITIVE_INFINITY);
        deltaTemperature = block.createVariable(DELTA_TEMPERATURE, DEFAULT_DELTA_TEMPERATURE);

        StateBlock in1 = inlet1.getStateBlock();
        StateBlock out1 = outlet1.getStateBlock();
        StateBlock in2 = inlet2.getStateBlock();
        StateBlock out2 = outlet2.getStateBlock();

        createMaterialBalance("material_balance_1", in1, out1);
        createMaterialBalance("material_balance_2", in2, out2);

        // heat leaves side 1 and enters side 2
        block.createEquation("energy_balance_1")
                .addTerm(new ProductEquationTerm(in1.getFlowMol(), in1.getEnthMol()))
                .addTerm(new ProductEquationTerm(-1, out1.getFlowMol(), out1.getEnthMol()))
                .addTerm(heatDuty.createTerm().minus());
        block.createEquation("energy_balance_2")
                .addTerm(new ProductEquationTerm(in2.getFlowMol(), in2.getEnthMol()))
                .addTerm(new ProductEquationTerm(-1, out2.getFlowMol(), out2.getEnthMol()))
                .addTerm(heatDuty.createTerm());

        createPressureEquality("pressure_equality_1", in1, out1);
        createPressureEquality("pressure_equality_2", in2, out2);

        block.createEquation("heat_transfer_equation")
                .addTerm(heatDuty.createTerm())
                .addTerm(new ProductEquationTerm(-1, overallHeatTransferCoefficient, area, deltaTemperature));

        deltaTemperatureTerm = config.getEnum(DELTA_TEMPERATURE_RULE, DeltaTemperatureRule.class)
                .createTerm(in1.getTemperature(), out1.getTemperature(), in2.getTemperature(), out2.getTemperature());
        block.createEquation("delta_temperature_equation")
                .addTerm(deltaTemperature.createTerm())
                .addTerm(deltaTemperatureTerm.minus());
    }

    private void createMaterialBalance(String name, StateBlock in, StateBlock out) {
        block.createEquation(name)
                .addTerm(in.getFlowMol().createTerm())
                .addTerm(out.getFlowMol().createTerm().minus());
    }

    private void createPressureEquality(String name, StateBlock in, StateBlock out) {
        block.createEquation(name)
                .addTerm(out.getPressure().createTerm())
                .addTerm(in.getPressure().createTerm().minus());
    }

    @Override
    protected void guess() {
        copyUnfixed(inlet1, outlet1);
        copyUnfixed(inlet2, outlet2);
        for (Port port : List.of(inlet1, outlet1, inlet2, outlet2)) {
            port.getStateBlock().initialize();
        }
        if (!deltaTemperature.isFixed()) {
            deltaTemperature.setValue(deltaTemperatureTerm.eval());
        }
    }

    private static void copyUnfixed(Port source, Port destination) {
        for (Map.Entry<String, Variable> e : destination.getVariables().entrySet()) {
            if (!e.getValue().isFixed()) {
                e.getValue().setValue(source.getVariable(e.getKey()).getValue());
            }
        }
    }

    public Port getInlet1() {
        return inlet1;
    }

    public Port getOutlet1() {
        return outlet1;
    }

    public Port getInlet2() {
        return inlet2;
    }

    public Port getOutlet2() {
        return outlet2;
    }

    public Variable getHeatDuty() {
        return heatDuty;
    }

    public Variable getArea() {
        return area;
    }

    public Variable getOverallHeatTransferCoefficient() {
        return overallHeatTransferCoefficient;
    }

    public Variable getDeltaTemperature() {
        return deltaTemperature;
    }
}
