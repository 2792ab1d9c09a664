/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openunitops.config.ConfigSchema;
import com.powsybl.openunitops.config.ConfigurationException;
import com.powsybl.openunitops.config.UnitConfig;
import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.initialization.AssemblyInvariantException;
import com.powsybl.openunitops.initialization.InitializationPlan;
import com.powsybl.openunitops.initialization.InitializationStep;
import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DirectedPseudograph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Unit made of sub-units linked by arcs, inside a single equation block.
 * <p>
 * A subclass creates its sub-units, arcs and boundary inlets in its constructor, then calls {@link #assemble()}
 * which checks the wiring and the initialization plan, and expands the arcs into equality equations.
 *
 * @author Florian Dupuy {@literal <florian.dupuy at rte-france.com>}
 */
public abstract class CompositeUnit implements UnitModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompositeUnit.class);

    protected final UnitConfig config;

    protected final EquationBlock block;

    private final Map<String, UnitModel> subUnits = new LinkedHashMap<>();

    private final Map<String, Arc> arcs = new LinkedHashMap<>();

    private final List<Port> boundaryInlets = new ArrayList<>();

    private InitializationPlan initializationPlan;

    protected CompositeUnit(String name, EquationBlock parent, UnitConfig config, ConfigSchema schema) {
        Objects.requireNonNull(name);
        this.config = Objects.requireNonNull(config);
        if (config.getSchema() != schema) {
            throw new ConfigurationException("Unit '" + name + "' expects a '" + schema.getName()
                    + "' configuration, got '" + config.getSchema().getName() + "'");
        }
        block = parent != null ? parent.createBlock(name) : new EquationBlock(name);
    }

    protected <U extends UnitModel> U addSubUnit(U subUnit) {
        if (subUnit.getBlock().getParent().orElse(null) != block) {
            throw new AssemblyInvariantException("Sub-unit '" + subUnit.getBlock().getPath()
                    + "' is not built in the block of '" + block.getPath() + "'");
        }
        subUnits.put(subUnit.getName(), subUnit);
        return subUnit;
    }

    protected Arc connect(String name, Port source, Port destination) {
        return addArc(new Arc(name, source, destination, false));
    }

    /**
     * Connect two ports by an arc closing a recycle loop.
     */
    protected Arc connectTear(String name, Port source, Port destination) {
        return addArc(new Arc(name, source, destination, true));
    }

    private Arc addArc(Arc arc) {
        if (arcs.containsKey(arc.getName())) {
            throw new AssemblyInvariantException("Arc '" + arc.getName() + "' already exists in '" + block.getPath() + "'");
        }
        arcs.put(arc.getName(), arc);
        return arc;
    }

    /**
     * Declare a sub-unit inlet as fed from outside of this unit.
     */
    protected Port declareInlet(Port port) {
        boundaryInlets.add(Objects.requireNonNull(port));
        return port;
    }

    protected abstract InitializationPlan createInitializationPlan();

    protected void assemble() {
        if (initializationPlan != null) {
            throw new IllegalStateException("Unit '" + block.getPath() + "' already assembled");
        }
        checkWiring();
        InitializationPlan plan = createInitializationPlan();
        checkOrdering(plan);
        for (Arc arc : arcs.values()) {
            arc.expand(block);
        }
        initializationPlan = plan;
        LOGGER.debug("Unit '{}' assembled: {} sub-units, {} arcs, boundary inlets {}", block.getPath(),
                subUnits.size(), arcs.size(), boundaryInlets.stream().map(Port::getPath).toList());
    }

    private boolean isSubUnit(UnitModel unit) {
        return subUnits.get(unit.getName()) == unit;
    }

    private void checkWiring() {
        Set<Port> destinations = new HashSet<>();
        for (Arc arc : arcs.values()) {
            for (Port port : List.of(arc.getSource(), arc.getDestination())) {
                if (!isSubUnit(port.getUnit())) {
                    throw new AssemblyInvariantException("Arc '" + arc.getName() + "' is connected to '"
                            + port.getPath() + "' which is not a sub-unit port of '" + block.getPath() + "'");
                }
            }
            if (!destinations.add(arc.getDestination())) {
                throw new AssemblyInvariantException("Port '" + arc.getDestination().getPath()
                        + "' is the destination of several arcs");
            }
        }
        for (Port port : boundaryInlets) {
            if (!isSubUnit(port.getUnit()) || !port.isInlet()) {
                throw new AssemblyInvariantException("Boundary inlet '" + port.getPath()
                        + "' is not a sub-unit inlet of '" + block.getPath() + "'");
            }
            if (destinations.contains(port)) {
                throw new AssemblyInvariantException("Boundary inlet '" + port.getPath() + "' is also fed by an arc");
            }
        }
        for (UnitModel subUnit : subUnits.values()) {
            for (Port port : subUnit.getInletPorts()) {
                if (!destinations.contains(port) && !boundaryInlets.contains(port)) {
                    throw new AssemblyInvariantException("Inlet '" + port.getPath()
                            + "' is neither connected nor a boundary inlet");
                }
            }
        }
    }

    private void checkOrdering(InitializationPlan plan) {
        for (InitializationStep step : plan.getSteps()) {
            if (!isSubUnit(step.getTarget())) {
                throw new AssemblyInvariantException("Initialization step " + step + " of '" + block.getPath()
                        + "' does not target one of its sub-units");
            }
        }
        for (UnitModel subUnit : subUnits.values()) {
            if (plan.indexOf(subUnit) < 0) {
                throw new AssemblyInvariantException("Sub-unit '" + subUnit.getBlock().getPath()
                        + "' is not initialized by the plan of '" + block.getPath() + "'");
            }
        }

        Graph<UnitModel, Arc> graph = new DirectedPseudograph<>(Arc.class);
        subUnits.values().forEach(graph::addVertex);
        for (Arc arc : arcs.values()) {
            if (!arc.isTear()) {
                graph.addEdge(arc.getSource().getUnit(), arc.getDestination().getUnit(), arc);
            }
        }
        CycleDetector<UnitModel, Arc> cycleDetector = new CycleDetector<>(graph);
        if (cycleDetector.detectCycles()) {
            throw new AssemblyInvariantException("Arcs of '" + block.getPath() + "' form a cycle through "
                    + cycleDetector.findCycles().stream().map(UnitModel::getName).toList() + ", a tear arc is missing");
        }

        for (Arc arc : graph.edgeSet()) {
            if (plan.indexOf(arc.getSource().getUnit()) > plan.indexOf(arc.getDestination().getUnit())) {
                throw new AssemblyInvariantException("Initialization plan of '" + block.getPath() + "' visits '"
                        + arc.getDestination().getUnit().getName() + "' before '" + arc.getSource().getUnit().getName()
                        + "' although arc '" + arc.getName() + "' links them");
            }
        }
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

    public Collection<UnitModel> getSubUnits() {
        return Collections.unmodifiableCollection(subUnits.values());
    }

    public Optional<UnitModel> getSubUnit(String name) {
        return Optional.ofNullable(subUnits.get(name));
    }

    public Collection<Arc> getArcs() {
        return Collections.unmodifiableCollection(arcs.values());
    }

    public Optional<Arc> getArc(String name) {
        return Optional.ofNullable(arcs.get(name));
    }

    /**
     * Port of a sub-unit, named by sub-unit and port names, like {@code condense.inlet_1}.
     */
    @Override
    public Port getPort(String name) {
        int i = name.indexOf('.');
        UnitModel subUnit = i > 0 ? subUnits.get(name.substring(0, i)) : null;
        if (subUnit == null) {
            throw new PowsyblException("Port '" + name + "' not found in unit '" + block.getPath() + "'");
        }
        return subUnit.getPort(name.substring(i + 1));
    }

    @Override
    public List<Port> getInletPorts() {
        return Collections.unmodifiableList(boundaryInlets);
    }

    @Override
    public List<Port> getOutletPorts() {
        Set<Port> sources = new HashSet<>();
        arcs.values().forEach(arc -> sources.add(arc.getSource()));
        List<Port> outlets = new ArrayList<>();
        for (UnitModel subUnit : subUnits.values()) {
            for (Port port : subUnit.getOutletPorts()) {
                if (!sources.contains(port)) {
                    outlets.add(port);
                }
            }
        }
        return outlets;
    }

    @Override
    public List<SpecialConstraint> getSpecialConstraints() {
        List<SpecialConstraint> specialConstraints = new ArrayList<>();
        subUnits.values().forEach(subUnit -> specialConstraints.addAll(subUnit.getSpecialConstraints()));
        return specialConstraints;
    }

    @Override
    public InitializationPlan getInitializationPlan() {
        if (initializationPlan == null) {
            throw new IllegalStateException("Unit '" + block.getPath() + "' is not assembled");
        }
        return initializationPlan;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + block.getPath() + ")";
    }
}
