/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.equations;

import com.powsybl.commons.PowsyblException;

import java.util.*;
import java.util.regex.Pattern;

/**
 * A named node of the model tree owning variables, equations and child blocks.
 * <p>
 * Every variable or equation of the subtree is reachable through a dotted path relative to this block,
 * e.g. {@code condense.inlet_1.flow_mol}.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class EquationBlock {

    public static final String PATH_SEPARATOR = ".";

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_\\-]+");

    private final String name;

    private final EquationBlock parent;

    private final Map<String, Variable> variables = new LinkedHashMap<>();

    private final Map<String, Equation> equations = new LinkedHashMap<>();

    private final Map<String, EquationBlock> blocks = new LinkedHashMap<>();

    public EquationBlock(String name) {
        this(name, null);
    }

    private EquationBlock(String name, EquationBlock parent) {
        this.name = checkName(name);
        this.parent = parent;
    }

    private static String checkName(String name) {
        Objects.requireNonNull(name);
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new PowsyblException("Invalid component name '" + name + "'");
        }
        return name;
    }

    private void checkNameIsFree(String name) {
        if (variables.containsKey(name) || equations.containsKey(name) || blocks.containsKey(name)) {
            throw new PowsyblException("Component '" + name + "' already exists in block '" + getPath() + "'");
        }
    }

    public String getName() {
        return name;
    }

    public Optional<EquationBlock> getParent() {
        return Optional.ofNullable(parent);
    }

    public String getPath() {
        return parent == null ? name : parent.getPath() + PATH_SEPARATOR + name;
    }

    public EquationBlock createBlock(String name) {
        checkNameIsFree(checkName(name));
        EquationBlock block = new EquationBlock(name, this);
        blocks.put(name, block);
        return block;
    }

    public Variable createVariable(String name, double initialValue) {
        checkNameIsFree(checkName(name));
        Variable variable = new Variable(this, name, initialValue);
        variables.put(name, variable);
        return variable;
    }

    public Equation createEquation(String name) {
        checkNameIsFree(checkName(name));
        Equation equation = new Equation(this, name);
        equations.put(name, equation);
        return equation;
    }

    public Variable getVariable(String name) {
        Variable variable = variables.get(name);
        if (variable == null) {
            throw new PowsyblException("Variable '" + name + "' not found in block '" + getPath() + "'");
        }
        return variable;
    }

    public Equation getEquation(String name) {
        Equation equation = equations.get(name);
        if (equation == null) {
            throw new PowsyblException("Equation '" + name + "' not found in block '" + getPath() + "'");
        }
        return equation;
    }

    public EquationBlock getBlock(String name) {
        EquationBlock block = blocks.get(name);
        if (block == null) {
            throw new PowsyblException("Block '" + name + "' not found in block '" + getPath() + "'");
        }
        return block;
    }

    public Collection<Variable> getVariables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public Collection<Equation> getEquations() {
        return Collections.unmodifiableCollection(equations.values());
    }

    public Collection<EquationBlock> getBlocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    /**
     * Variables of the whole subtree, own variables first then child blocks in creation order.
     */
    public List<Variable> getAllVariables() {
        List<Variable> all = new ArrayList<>(variables.values());
        for (EquationBlock block : blocks.values()) {
            all.addAll(block.getAllVariables());
        }
        return all;
    }

    public List<Equation> getAllEquations() {
        List<Equation> all = new ArrayList<>(equations.values());
        for (EquationBlock block : blocks.values()) {
            all.addAll(block.getAllEquations());
        }
        return all;
    }

    public List<Equation> getActiveEquations() {
        return getAllEquations().stream().filter(Equation::isActive).toList();
    }

    /**
     * Path of a component of this subtree relative to this block.
     */
    public String getRelativePath(String absolutePath) {
        String prefix = getPath() + PATH_SEPARATOR;
        if (!absolutePath.startsWith(prefix)) {
            throw new PowsyblException("'" + absolutePath + "' is not part of block '" + getPath() + "'");
        }
        return absolutePath.substring(prefix.length());
    }

    private Optional<EquationBlock> findOwner(String[] names) {
        EquationBlock block = this;
        for (int i = 0; i < names.length - 1; i++) {
            block = block.blocks.get(names[i]);
            if (block == null) {
                return Optional.empty();
            }
        }
        return Optional.of(block);
    }

    public Optional<Variable> findVariable(String relativePath) {
        String[] names = Objects.requireNonNull(relativePath).split(Pattern.quote(PATH_SEPARATOR));
        return findOwner(names).map(block -> block.variables.get(names[names.length - 1]));
    }

    public Optional<Equation> findEquation(String relativePath) {
        String[] names = Objects.requireNonNull(relativePath).split(Pattern.quote(PATH_SEPARATOR));
        return findOwner(names).map(block -> block.equations.get(names[names.length - 1]));
    }

    /**
     * Unfixed variables appearing in at least one active equation of the subtree, minus the number of active
     * equations of the subtree.
     */
    public int getDegreesOfFreedom() {
        List<Equation> activeEquations = getActiveEquations();
        Set<Variable> freeVariables = new LinkedHashSet<>();
        for (Equation equation : activeEquations) {
            for (Variable variable : equation.getVariables()) {
                if (!variable.isFixed()) {
                    freeVariables.add(variable);
                }
            }
        }
        return freeVariables.size() - activeEquations.size();
    }

    @Override
    public String toString() {
        return "EquationBlock(" + getPath() + ")";
    }
}
