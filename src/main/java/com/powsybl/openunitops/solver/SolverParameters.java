/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.solver;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.commons.parameters.Parameter;
import com.powsybl.commons.parameters.ParameterScope;
import com.powsybl.commons.parameters.ParameterType;
import com.powsybl.openunitops.config.ConfigurationException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Options of the default Newton-Raphson solver adapter.
 * <p>
 * Defaults can be overridden from the {@value #MODULE_NAME} platform config module, and per call from a
 * solver options map using the same names.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class SolverParameters {

    public static final String MODULE_NAME = "open-unitops-solver-default-parameters";

    public static final String MAX_ITERATIONS_PARAM_NAME = "max_iter";
    public static final String CONV_EPS_PER_EQ_PARAM_NAME = "tol";
    public static final String LINE_SEARCH_MAX_ITERATIONS_PARAM_NAME = "line_search_max_iter";
    public static final String LINE_SEARCH_STEP_FOLD_PARAM_NAME = "line_search_step_fold";

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_CONV_EPS_PER_EQ = DefaultNewtonRaphsonStoppingCriteria.DEFAULT_CONV_EPS_PER_EQ;
    public static final int DEFAULT_LINE_SEARCH_MAX_ITERATIONS = 10;
    public static final double DEFAULT_LINE_SEARCH_STEP_FOLD = 2;

    private static final String SOLVER_CATEGORY_KEY = "Solver";

    public static final List<Parameter> SPECIFIC_PARAMETERS = List.of(
        new Parameter(MAX_ITERATIONS_PARAM_NAME, ParameterType.INTEGER, "Maximum number of Newton-Raphson iterations", DEFAULT_MAX_ITERATIONS, ParameterScope.FUNCTIONAL, SOLVER_CATEGORY_KEY),
        new Parameter(CONV_EPS_PER_EQ_PARAM_NAME, ParameterType.DOUBLE, "Convergence epsilon on each scaled equation residual", DEFAULT_CONV_EPS_PER_EQ, ParameterScope.FUNCTIONAL, SOLVER_CATEGORY_KEY),
        new Parameter(LINE_SEARCH_MAX_ITERATIONS_PARAM_NAME, ParameterType.INTEGER, "Maximum number of step reductions of the line search", DEFAULT_LINE_SEARCH_MAX_ITERATIONS, ParameterScope.TECHNICAL, SOLVER_CATEGORY_KEY),
        new Parameter(LINE_SEARCH_STEP_FOLD_PARAM_NAME, ParameterType.DOUBLE, "Factor the step is divided by at each line search iteration", DEFAULT_LINE_SEARCH_STEP_FOLD, ParameterScope.TECHNICAL, SOLVER_CATEGORY_KEY)
    );

    private static final Set<String> PARAMETER_NAMES = SPECIFIC_PARAMETERS.stream()
            .map(Parameter::getName)
            .collect(Collectors.toUnmodifiableSet());

    private int maxIterations = DEFAULT_MAX_ITERATIONS;

    private NewtonRaphsonStoppingCriteria stoppingCriteria = new DefaultNewtonRaphsonStoppingCriteria();

    private int lineSearchMaxIterations = DEFAULT_LINE_SEARCH_MAX_ITERATIONS;

    private double lineSearchStepFold = DEFAULT_LINE_SEARCH_STEP_FOLD;

    public static double checkParameterValue(double parameterValue, boolean condition, String parameterName) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid value for parameter " + parameterName + ": " + parameterValue);
        }
        return parameterValue;
    }

    public static int checkParameterValue(int parameterValue, boolean condition, String parameterName) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid value for parameter " + parameterName + ": " + parameterValue);
        }
        return parameterValue;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public SolverParameters setMaxIterations(int maxIterations) {
        this.maxIterations = checkParameterValue(maxIterations, maxIterations >= 1, MAX_ITERATIONS_PARAM_NAME);
        return this;
    }

    public NewtonRaphsonStoppingCriteria getStoppingCriteria() {
        return stoppingCriteria;
    }

    public SolverParameters setStoppingCriteria(NewtonRaphsonStoppingCriteria stoppingCriteria) {
        this.stoppingCriteria = Objects.requireNonNull(stoppingCriteria);
        return this;
    }

    public SolverParameters setConvEpsPerEq(double convEpsPerEq) {
        checkParameterValue(convEpsPerEq, convEpsPerEq > 0, CONV_EPS_PER_EQ_PARAM_NAME);
        return setStoppingCriteria(new DefaultNewtonRaphsonStoppingCriteria(convEpsPerEq));
    }

    public int getLineSearchMaxIterations() {
        return lineSearchMaxIterations;
    }

    public SolverParameters setLineSearchMaxIterations(int lineSearchMaxIterations) {
        this.lineSearchMaxIterations = checkParameterValue(lineSearchMaxIterations, lineSearchMaxIterations >= 0,
                LINE_SEARCH_MAX_ITERATIONS_PARAM_NAME);
        return this;
    }

    public double getLineSearchStepFold() {
        return lineSearchStepFold;
    }

    public SolverParameters setLineSearchStepFold(double lineSearchStepFold) {
        this.lineSearchStepFold = checkParameterValue(lineSearchStepFold, lineSearchStepFold > 1,
                LINE_SEARCH_STEP_FOLD_PARAM_NAME);
        return this;
    }

    public static SolverParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static SolverParameters load(PlatformConfig platformConfig) {
        SolverParameters parameters = new SolverParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setMaxIterations(config.getIntProperty(MAX_ITERATIONS_PARAM_NAME, DEFAULT_MAX_ITERATIONS))
                .setConvEpsPerEq(config.getDoubleProperty(CONV_EPS_PER_EQ_PARAM_NAME, DEFAULT_CONV_EPS_PER_EQ))
                .setLineSearchMaxIterations(config.getIntProperty(LINE_SEARCH_MAX_ITERATIONS_PARAM_NAME, DEFAULT_LINE_SEARCH_MAX_ITERATIONS))
                .setLineSearchStepFold(config.getDoubleProperty(LINE_SEARCH_STEP_FOLD_PARAM_NAME, DEFAULT_LINE_SEARCH_STEP_FOLD)));
        return parameters;
    }

    /**
     * Apply a solver options map. Unknown option names are rejected.
     */
    public SolverParameters update(Map<String, String> properties) {
        Objects.requireNonNull(properties);
        for (String name : properties.keySet()) {
            if (!PARAMETER_NAMES.contains(name)) {
                throw new ConfigurationException("Unknown solver option '" + name + "', expected one of "
                        + new TreeSet<>(PARAMETER_NAMES));
            }
        }
        Optional.ofNullable(properties.get(MAX_ITERATIONS_PARAM_NAME))
                .ifPresent(prop -> this.setMaxIterations(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(CONV_EPS_PER_EQ_PARAM_NAME))
                .ifPresent(prop -> this.setConvEpsPerEq(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(LINE_SEARCH_MAX_ITERATIONS_PARAM_NAME))
                .ifPresent(prop -> this.setLineSearchMaxIterations(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(LINE_SEARCH_STEP_FOLD_PARAM_NAME))
                .ifPresent(prop -> this.setLineSearchStepFold(Double.parseDouble(prop)));
        return this;
    }

    public SolverParameters copy() {
        return new SolverParameters()
                .setMaxIterations(maxIterations)
                .setStoppingCriteria(stoppingCriteria)
                .setLineSearchMaxIterations(lineSearchMaxIterations)
                .setLineSearchStepFold(lineSearchStepFold);
    }

    @Override
    public String toString() {
        return "SolverParameters(" +
                "maxIterations=" + maxIterations +
                ", stoppingCriteria=" + stoppingCriteria.getClass().getSimpleName() +
                ", lineSearchMaxIterations=" + lineSearchMaxIterations +
                ", lineSearchStepFold=" + lineSearchStepFold +
                ')';
    }
}
