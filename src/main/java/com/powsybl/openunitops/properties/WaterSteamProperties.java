/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openunitops.properties;

import net.jafama.FastMath;

/**
 * Simplified pure water correlations: constant heat capacities, constant vaporization enthalpy and a
 * Clausius-Clapeyron saturation curve through the normal boiling point. Enthalpies are zero for liquid at
 * the reference temperature.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class WaterSteamProperties {

    /** J/mol/K */
    public static final double LIQUID_HEAT_CAPACITY = 75.3;
    /** J/mol/K */
    public static final double VAPOR_HEAT_CAPACITY = 36.0;
    /** J/mol */
    public static final double VAPORIZATION_ENTHALPY = 40650.0;
    /** K */
    public static final double REFERENCE_TEMPERATURE = 273.15;
    /** Pa */
    public static final double NORMAL_BOILING_PRESSURE = 101325.0;
    /** K */
    public static final double NORMAL_BOILING_TEMPERATURE = 373.15;
    /** J/mol/K */
    public static final double GAS_CONSTANT = 8.314462618;

    private WaterSteamProperties() {
    }

    public static double saturationTemperature(double pressure) {
        return 1 / (1 / NORMAL_BOILING_TEMPERATURE
                - GAS_CONSTANT * FastMath.log(pressure / NORMAL_BOILING_PRESSURE) / VAPORIZATION_ENTHALPY);
    }

    public static double saturationTemperatureDerivative(double pressure) {
        double tsat = saturationTemperature(pressure);
        return tsat * tsat * GAS_CONSTANT / (VAPORIZATION_ENTHALPY * pressure);
    }

    public static double saturatedLiquidEnthalpy(double pressure) {
        return LIQUID_HEAT_CAPACITY * (saturationTemperature(pressure) - REFERENCE_TEMPERATURE);
    }

    public static double saturatedLiquidEnthalpyDerivative(double pressure) {
        return LIQUID_HEAT_CAPACITY * saturationTemperatureDerivative(pressure);
    }

    public static double saturatedVaporEnthalpy(double pressure) {
        return saturatedLiquidEnthalpy(pressure) + VAPORIZATION_ENTHALPY;
    }

    public static double temperature(double enthalpy, double pressure) {
        double hl = saturatedLiquidEnthalpy(pressure);
        if (enthalpy <= hl) {
            return REFERENCE_TEMPERATURE + enthalpy / LIQUID_HEAT_CAPACITY;
        }
        double hv = hl + VAPORIZATION_ENTHALPY;
        if (enthalpy < hv) {
            return saturationTemperature(pressure);
        }
        return saturationTemperature(pressure) + (enthalpy - hv) / VAPOR_HEAT_CAPACITY;
    }

    public static double dTemperatureOverDEnthalpy(double enthalpy, double pressure) {
        double hl = saturatedLiquidEnthalpy(pressure);
        if (enthalpy <= hl) {
            return 1 / LIQUID_HEAT_CAPACITY;
        }
        if (enthalpy < hl + VAPORIZATION_ENTHALPY) {
            return 0;
        }
        return 1 / VAPOR_HEAT_CAPACITY;
    }

    public static double dTemperatureOverDPressure(double enthalpy, double pressure) {
        double hl = saturatedLiquidEnthalpy(pressure);
        if (enthalpy <= hl) {
            return 0;
        }
        if (enthalpy < hl + VAPORIZATION_ENTHALPY) {
            return saturationTemperatureDerivative(pressure);
        }
        // superheated: the vapor enthalpy reference moves with pressure
        return saturationTemperatureDerivative(pressure) - saturatedLiquidEnthalpyDerivative(pressure) / VAPOR_HEAT_CAPACITY;
    }
}
