/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.initialization;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.powsybl.openunitops.equations.Equation;
import com.powsybl.openunitops.equations.EquationBlock;
import com.powsybl.openunitops.equations.Variable;
import com.powsybl.openunitops.solver.SolverAdapter;
import com.powsybl.openunitops.solver.SolverParameters;
import com.powsybl.openunitops.solver.SolverResult;
import com.powsybl.openunitops.solver.SolverStatus;
import com.powsybl.openunitops.unit.FeedwaterHeater;
import com.powsybl.openunitops.unit.FeedwaterHeaterFactory;
import com.powsybl.openunitops.unit.Port;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class InitializationSchedulerTest {

    private Logger logger;

    private ListAppender<ILoggingEvent> listAppender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(InitializationScheduler.class);
        listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);
        logger.setLevel(Level.INFO);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(listAppender);
        logger.setLevel(null);
    }

    private static Map<String, Boolean> getFixedFlags(EquationBlock block) {
        return block.getAllVariables().stream().collect(Collectors.toMap(Variable::getPath, Variable::isFixed));
    }

    private static Map<String, Boolean> getActiveFlags(EquationBlock block) {
        return block.getAllEquations().stream().collect(Collectors.toMap(Equation::getPath, Equation::isActive));
    }

    private List<String> getMessages(Level level) {
        return listAppender.list.stream()
                .filter(event -> event.getLevel() == level)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    @Test
    void testInfeasibleSolver() {
        FeedwaterHeater fwh = FeedwaterHeaterFactory.create(true, true, true);
        Map<String, Boolean> fixedFlags = getFixedFlags(fwh.getBlock());
        Map<String, Boolean> activeFlags = getActiveFlags(fwh.getBlock());
        double extractionFlow = FeedwaterHeaterFactory.getExtractionFlow(fwh);

        SolverAdapter solverAdapter = mock(SolverAdapter.class);
        when(solverAdapter.getName()).thenReturn("stub");
        when(solverAdapter.solve(any(EquationBlock.class), any(SolverParameters.class)))
                .thenReturn(new SolverResult(SolverStatus.INFEASIBLE, 0, 1));

        InitializationResult result = fwh.initialize(new InitializationParameters().setSolverAdapter(solverAdapter));

        assertFalse(result.isOptimal());
        assertEquals(SolverStatus.INFEASIBLE, result.getStatus());
        assertEquals(InitializationState.SNAPSHOT_RESTORED, result.getStates().get(result.getStates().size() - 1));
        assertEquals(List.of(SolverStatus.INFEASIBLE, SolverStatus.INFEASIBLE, SolverStatus.INFEASIBLE, SolverStatus.INFEASIBLE),
                result.getNonOptimalStepStatuses());
        assertEquals(fixedFlags, getFixedFlags(fwh.getBlock()));
        assertEquals(activeFlags, getActiveFlags(fwh.getBlock()));
        assertEquals(extractionFlow, FeedwaterHeaterFactory.getExtractionFlow(fwh), 0);

        // one direct solve and one coupled solve per sub-unit, then the heater coupled solve
        verify(solverAdapter, times(9)).solve(any(EquationBlock.class), any(SolverParameters.class));
        assertTrue(getMessages(Level.WARN).contains("Initialization of 'fwh' ended with solver status INFEASIBLE"));
        assertTrue(getMessages(Level.WARN).contains("Solve of 'fwh.condense' with fixed inlets ended with solver status INFEASIBLE"));
    }

    @Test
    void testSuccessLogLevel() {
        FeedwaterHeater fwh = FeedwaterHeaterFactory.create(true, false, true);
        assertTrue(fwh.initialize(new InitializationParameters()).isOptimal());
        assertTrue(getMessages(Level.INFO).isEmpty());
        assertTrue(getMessages(Level.WARN).isEmpty());

        assertTrue(fwh.initialize(new InitializationParameters().setOutlvl(2)).isOptimal());
        List<String> messages = getMessages(Level.INFO);
        assertEquals(4, messages.size());
        assertTrue(messages.get(messages.size() - 1).startsWith("Initialization of 'fwh' complete"));
    }

    @Test
    void testDegreesOfFreedomMismatch() {
        FeedwaterHeater fwh = FeedwaterHeaterFactory.create(true, false, true);
        fwh.getCondense().getArea().unfix();
        Map<String, Boolean> fixedFlags = getFixedFlags(fwh.getBlock());
        Map<String, Boolean> activeFlags = getActiveFlags(fwh.getBlock());

        InitializationParameters parameters = new InitializationParameters();
        AssemblyInvariantException e = assertThrows(AssemblyInvariantException.class, () -> fwh.initialize(parameters));
        assertEquals("Unit 'fwh.condense' has 1 degrees of freedom with its inlets fixed, 0 expected", e.getMessage());

        assertEquals(fixedFlags, getFixedFlags(fwh.getBlock()));
        assertEquals(activeFlags, getActiveFlags(fwh.getBlock()));
    }

    @Test
    void testOverSpecifiedUnit() {
        FeedwaterHeater fwh = FeedwaterHeaterFactory.create(true, false, true);
        // the extraction flow is determined by the heater, fixing it leaves one equation too many
        fwh.getDesuperheat().orElseThrow().getOutlet1().getVariable("flow_mol").fix(100);
        Map<String, Boolean> fixedFlags = getFixedFlags(fwh.getBlock());

        InitializationParameters parameters = new InitializationParameters();
        AssemblyInvariantException e = assertThrows(AssemblyInvariantException.class, () -> fwh.initialize(parameters));
        assertTrue(e.getMessage().startsWith("Unit 'fwh.desuperheat' has -1 degrees of freedom"));
        assertEquals(fixedFlags, getFixedFlags(fwh.getBlock()));
    }

    private static void assertUnderSpecified(FeedwaterHeater fwh, Port freeInlet) {
        Map<String, Boolean> fixedFlags = getFixedFlags(fwh.getBlock());
        Map<String, Boolean> activeFlags = getActiveFlags(fwh.getBlock());
        assertEquals(3, fwh.getDegreesOfFreedom());

        InitializationParameters parameters = new InitializationParameters();
        AssemblyInvariantException e = assertThrows(AssemblyInvariantException.class, () -> fwh.initialize(parameters));
        assertEquals("Unit 'fwh' has 3 degrees of freedom before its coupled solve, 0 expected", e.getMessage());

        // the heater never fixes a boundary inlet the caller left free
        assertEquals(fixedFlags, getFixedFlags(fwh.getBlock()));
        assertEquals(activeFlags, getActiveFlags(fwh.getBlock()));
        assertTrue(freeInlet.getVariables().values().stream().noneMatch(Variable::isFixed));
        assertEquals(3, fwh.getDegreesOfFreedom());
    }

    @Test
    void testFreeFeedwaterInlet() {
        FeedwaterHeater fwh = FeedwaterHeaterFactory.create(true, false, true);
        fwh.getFeedwaterInlet().unfix();
        assertUnderSpecified(fwh, fwh.getFeedwaterInlet());
    }

    @Test
    void testFreeDrainInlet() {
        FeedwaterHeater fwh = FeedwaterHeaterFactory.create(false, true, true);
        Port drain = fwh.getDrainInlet().orElseThrow();
        drain.unfix();
        assertUnderSpecified(fwh, drain);
    }

    @Test
    void testLeafStepsRunAsDirectSolve() {
        FeedwaterHeater fwh = FeedwaterHeaterFactory.create(false, false, false);
        InitializationPlan plan = fwh.getCondense().getInitializationPlan();
        assertEquals(1, plan.getSteps().size());
        assertEquals(InitializationStep.Kind.SOLVE, plan.getSteps().get(0).getKind());
        assertEquals(0, plan.indexOf(fwh.getCondense()));
        assertEquals(-1, plan.indexOf(fwh));
        assertTrue(plan.isDirectSolveOf(fwh.getCondense()));
        assertFalse(fwh.getInitializationPlan().isDirectSolveOf(fwh));

        InitializationResult result = fwh.getCondense().initialize(new InitializationParameters());
        assertTrue(result.isOptimal());
        assertEquals(1, result.getStepResults().size());
        assertEquals(0, result.getDegreesOfFreedom());
    }
}
