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
import com.powsybl.openunitops.config.PropertyPackageOption;
import com.powsybl.openunitops.config.UnitConfig;
import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.Variable;
import com.powsybl.openunitops.initialization.InitializationPlan;
import com.powsybl.openunitops.initialization.InitializationStep;
import com.powsybl.openunitops.properties.StateBlock;

import java.util.*;

import static com.powsybl.openunitops.unit.AbstractSubUnit.*;

/**
 * Feedwater heater: a condensing section, optionally preceded on the steam side by a desuperheater and a drain
 * mixer, and optionally followed by a drain cooler.
 * <p>
 * Extraction steam enters the first section of the steam side and its flow is computed so that the condensate
 * leaves the condensing section as saturated liquid. Feedwater enters the drain cooler, or the condensing
 * section without it, and flows the other way.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class FeedwaterHeater extends CompositeUnit {

    public static final String HAS_DESUPERHEAT = "has_desuperheat";
    public static final String HAS_DRAIN_MIXER = "has_drain_mixer";
    public static final String HAS_DRAIN_COOLING = "has_drain_cooling";

    public static final String CONDENSE = "condense";
    public static final String DESUPERHEAT = "desuperheat";
    public static final String COOLING = "cooling";

    public static final String STEAM = "steam";
    public static final String DRAIN = "drain";

    public static final String MIX_OUT_ARC = "mix_out_arc";
    public static final String DESUPERHEAT_DRAIN_ARC = "desuperheat_drain_arc";
    public static final String CONDENSE_OUT2_ARC = "condense_out2_arc";
    public static final String COOLING_OUT2_ARC = "cooling_out2_arc";
    public static final String CONDENSE_OUT1_ARC = "condense_out1_arc";

    public static final ConfigSchema SCHEMA = ConfigSchema.builder("feedwater_heater")
            .parameter(DYNAMIC_PARAMETER, Boolean.FALSE)
            .parameter(HAS_HOLDUP_PARAMETER, Boolean.FALSE)
            .parameter(new Parameter(HAS_DESUPERHEAT, ParameterType.BOOLEAN, "Add a desuperheating section", Boolean.TRUE))
            .parameter(new Parameter(HAS_DRAIN_MIXER, ParameterType.BOOLEAN, "Add a mixer of the drain of an upstream heater", Boolean.TRUE))
            .parameter(new Parameter(HAS_DRAIN_COOLING, ParameterType.BOOLEAN, "Add a drain cooling section", Boolean.TRUE))
            .propertyPackage(PROPERTY_PACKAGE, "Property package used by the sections not giving their own")
            .arguments(PROPERTY_PACKAGE_ARGS, "Property package arguments used by the sections not giving their own package")
            .block(CONDENSE, HeatExchanger.SCHEMA, "Condensing section configuration")
            .block(DESUPERHEAT, HeatExchanger.SCHEMA, "Desuperheating section configuration")
            .block(COOLING, HeatExchanger.SCHEMA, "Drain cooling section configuration")
            .build();

    private final Set<FeedwaterHeaterSection> sections;

    private final HeatExchanger desuperheat;

    private final Mixer drainMix;

    private final CondensingHeatExchanger condense;

    private final HeatExchanger cooling;

    private final Port steamInlet;

    private final Port feedwaterInlet;

    private final Port drainInlet;

    public static FeedwaterHeater build(String name, UnitConfig config) {
        return new FeedwaterHeater(name, null, config);
    }

    public FeedwaterHeater(String name, EquationBlock parent, UnitConfig config) {
        super(name, parent, config, SCHEMA);
        sections = Collections.unmodifiableSet(FeedwaterHeaterSection.of(config));

        // all options are resolved before anything is built
        UnitConfig desuperheatConfig = hasSection(FeedwaterHeaterSection.DESUPERHEAT) ? resolveSectionConfig(DESUPERHEAT) : null;
        UnitConfig drainMixConfig = hasSection(FeedwaterHeaterSection.DRAIN_MIXER) ? createDrainMixConfig() : null;
        UnitConfig condenseConfig = resolveSectionConfig(CONDENSE);
        UnitConfig coolingConfig = hasSection(FeedwaterHeaterSection.DRAIN_COOLING) ? resolveSectionConfig(COOLING) : null;

        desuperheat = desuperheatConfig != null
                ? addSubUnit(new HeatExchanger(FeedwaterHeaterSection.DESUPERHEAT.getUnitName(), block, desuperheatConfig))
                : null;
        drainMix = drainMixConfig != null
                ? addSubUnit(new Mixer(FeedwaterHeaterSection.DRAIN_MIXER.getUnitName(), block, drainMixConfig))
                : null;
        condense = addSubUnit(new CondensingHeatExchanger(FeedwaterHeaterSection.CONDENSING.getUnitName(), block, condenseConfig));
        cooling = coolingConfig != null
                ? addSubUnit(new HeatExchanger(FeedwaterHeaterSection.DRAIN_COOLING.getUnitName(), block, coolingConfig))
                : null;

        if (drainMix != null) {
            connect(MIX_OUT_ARC, drainMix.getOutlet(), condense.getInlet1());
        }
        if (desuperheat != null) {
            connect(DESUPERHEAT_DRAIN_ARC, desuperheat.getOutlet1(),
                    drainMix != null ? drainMix.getPort(STEAM) : condense.getInlet1());
            connectTear(CONDENSE_OUT2_ARC, condense.getOutlet2(), desuperheat.getInlet2());
        }
        if (cooling != null) {
            connectTear(COOLING_OUT2_ARC, cooling.getOutlet2(), condense.getInlet2());
            connect(CONDENSE_OUT1_ARC, condense.getOutlet1(), cooling.getInlet1());
        }

        if (desuperheat != null) {
            steamInlet = desuperheat.getInlet1();
        } else if (drainMix != null) {
            steamInlet = drainMix.getPort(STEAM);
        } else {
            steamInlet = condense.getInlet1();
        }
        feedwaterInlet = cooling != null ? cooling.getInlet2() : condense.getInlet2();
        drainInlet = drainMix != null ? drainMix.getPort(DRAIN) : null;
        declareInlet(steamInlet);
        if (drainInlet != null) {
            declareInlet(drainInlet);
        }
        declareInlet(feedwaterInlet);

        assemble();
    }

    private boolean hasSection(FeedwaterHeaterSection section) {
        return sections.contains(section);
    }

    /**
     * Sides of a section left without property package get the one of the heater and its arguments.
     */
    private UnitConfig resolveSectionConfig(String sectionName) {
        PropertyPackageOption propertyPackage = config.getPropertyPackage(PROPERTY_PACKAGE);
        Map<String, Object> arguments = config.getArguments(PROPERTY_PACKAGE_ARGS);
        UnitConfig sectionConfig = config.getBlock(sectionName);
        for (String side : List.of(HeatExchanger.SIDE_1, HeatExchanger.SIDE_2)) {
            UnitConfig sideConfig = sectionConfig.getBlock(side);
            PropertyPackageOption sidePropertyPackage = sideConfig.getPropertyPackage(PROPERTY_PACKAGE);
            if (sidePropertyPackage.isUseDefault()) {
                String path = block.getPath() + "." + sectionName + "." + side;
                sideConfig = sideConfig.with(PROPERTY_PACKAGE, sidePropertyPackage.orInherit(propertyPackage, path))
                        .with(PROPERTY_PACKAGE_ARGS, arguments);
                sectionConfig = sectionConfig.with(side, sideConfig);
            }
        }
        return sectionConfig;
    }

    private UnitConfig createDrainMixConfig() {
        if (config.getPropertyPackage(PROPERTY_PACKAGE).isUseDefault()) {
            throw new ConfigurationException("No property package given for '" + block.getPath()
                    + "', it is required by its drain mixer");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(DYNAMIC, config.getBoolean(DYNAMIC));
        values.put(HAS_HOLDUP, config.getBoolean(HAS_HOLDUP));
        values.put(PROPERTY_PACKAGE, config.getPropertyPackage(PROPERTY_PACKAGE));
        values.put(PROPERTY_PACKAGE_ARGS, config.getArguments(PROPERTY_PACKAGE_ARGS));
        values.put(Mixer.INLET_LIST, List.of(STEAM, DRAIN));
        return Mixer.SCHEMA.create(values);
    }

    @Override
    protected InitializationPlan createInitializationPlan() {
        List<InitializationStep> steps = new ArrayList<>();
        for (FeedwaterHeaterSection section : sections) {
            steps.add(createStep(section));
        }
        return new InitializationPlan(steps);
    }

    private InitializationStep createStep(FeedwaterHeaterSection section) {
        switch (section) {
            case DESUPERHEAT:
                // feedwater leaving the condensing section is not known yet, start from the heater inlet
                return InitializationStep.initialize(desuperheat,
                        List.of(new Arc("desuperheat_inlet_2_seed", feedwaterInlet, desuperheat.getInlet2())));
            case DRAIN_MIXER:
                return InitializationStep.initialize(drainMix, arcsTo(drainMix.getPort(STEAM)));
            case CONDENSING:
                List<Arc> seeds = new ArrayList<>(arcsTo(condense.getInlet1()));
                if (cooling != null) {
                    seeds.add(new Arc("condense_inlet_2_seed", feedwaterInlet, condense.getInlet2()));
                }
                return InitializationStep.initialize(condense, seeds);
            case DRAIN_COOLING:
                return InitializationStep.initialize(cooling, arcsTo(cooling.getInlet1()));
            default:
                throw new IllegalStateException("Unknown feedwater heater section: " + section);
        }
    }

    private List<Arc> arcsTo(Port destination) {
        return getArcs().stream()
                .filter(arc -> !arc.isTear() && arc.getDestination() == destination)
                .toList();
    }

    @Override
    public Set<Variable> getDeterminedVariables() {
        return Set.of(steamInlet.getVariable(StateBlock.FLOW_MOL));
    }

    public Set<FeedwaterHeaterSection> getSections() {
        return sections;
    }

    public CondensingHeatExchanger getCondense() {
        return condense;
    }

    public Optional<HeatExchanger> getDesuperheat() {
        return Optional.ofNullable(desuperheat);
    }

    public Optional<Mixer> getDrainMix() {
        return Optional.ofNullable(drainMix);
    }

    public Optional<HeatExchanger> getCooling() {
        return Optional.ofNullable(cooling);
    }

    /**
     * Extraction steam inlet, whose flow is computed by the heater.
     */
    public Port getSteamInlet() {
        return steamInlet;
    }

    public Port getFeedwaterInlet() {
        return feedwaterInlet;
    }

    /**
     * Inlet of the drain of an upstream heater, only with a drain mixer.
     */
    public Optional<Port> getDrainInlet() {
        return Optional.ofNullable(drainInlet);
    }

    public Port getFeedwaterOutlet() {
        return desuperheat != null ? desuperheat.getOutlet2() : condense.getOutlet2();
    }

    public Port getCondensateOutlet() {
        return cooling != null ? cooling.getOutlet1() : condense.getOutlet1();
    }
}
