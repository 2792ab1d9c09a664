/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.unit;

import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.Variable;
import com.powsybl.openunitops.initialization.AssemblyInvariantException;

import java.util.Map;
import java.util.Objects;

/**
 * Directed link from a source port to a destination port with the same members.
 * <p>
 * During initialization an arc only copies values forward ({@link #propagate()}). Once a composite unit is
 * assembled, each of its arcs is also expanded into one equality equation per member ({@link #expand}).
 * A tear arc closes a recycle loop: it is expanded like any other arc but ignored when ordering sub-units.
 *
 * @author Florian Dupuy {@literal <florian.dupuy at rte-france.com>}
 */
public class Arc {

    public static final String EXPANDED_BLOCK_SUFFIX = "_expanded";

    public static final String EQUALITY_SUFFIX = "_equality";

    private final String name;

    private final Port source;

    private final Port destination;

    private final boolean tear;

    public Arc(String name, Port source, Port destination, boolean tear) {
        this.name = Objects.requireNonNull(name);
        this.source = Objects.requireNonNull(source);
        this.destination = Objects.requireNonNull(destination);
        this.tear = tear;
        if (!source.getVariables().keySet().equals(destination.getVariables().keySet())) {
            throw new AssemblyInvariantException("Arc '" + name + "' links ports with different members: "
                    + source.getVariables().keySet() + " and " + destination.getVariables().keySet());
        }
    }

    public Arc(String name, Port source, Port destination) {
        this(name, source, destination, false);
    }

    public String getName() {
        return name;
    }

    public Port getSource() {
        return source;
    }

    public Port getDestination() {
        return destination;
    }

    public boolean isTear() {
        return tear;
    }

    /**
     * Copy the value of every source member into the same member of the destination. Fixed flags are not
     * copied.
     */
    public void propagate() {
        for (Map.Entry<String, Variable> e : destination.getVariables().entrySet()) {
            e.getValue().setValue(source.getVariable(e.getKey()).getValue());
        }
    }

    /**
     * Add the equations destination.x - source.x = 0 in a child block of the given block.
     */
    public EquationBlock expand(EquationBlock parent) {
        EquationBlock block = parent.createBlock(name + EXPANDED_BLOCK_SUFFIX);
        for (Map.Entry<String, Variable> e : destination.getVariables().entrySet()) {
            block.createEquation(e.getKey() + EQUALITY_SUFFIX)
                    .addTerm(e.getValue().createTerm())
                    .addTerm(source.getVariable(e.getKey()).createTerm().minus());
        }
        return block;
    }

    @Override
    public String toString() {
        return "Arc(" + name + ": " + source.getPath() + " -> " + destination.getPath() + (tear ? ", tear" : "") + ")";
    }
}
