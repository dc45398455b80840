/*******************************************************************************
 *     ___                  _   ____  ____
 *    / _ \ _   _  ___  ___| |_|  _ \| __ )
 *   | | | | | | |/ _ \/ __| __| | | |  _ \
 *   | |_| | |_| |  __/\__ \ |_| |_| | |_) |
 *    \__\_\\__,_|\___||___/\__|____/|____/
 *
 *  Copyright (c) 2014-2019 Appsicle
 *  Copyright (c) 2019-2026 QuestDB
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 ******************************************************************************/

package io.hugenumber.std;

/**
 * Named mathematical and physical constants, SI prefixes and common fractions.
 * <p>
 * All values are built once, on first use of this class, from the public factories and operators of
 * {@link HugeNumber}. Physical constants are in SI units.
 */
public final class HugeNumberConstants {
    // fractions
    public static final HugeNumber HALF = HugeNumber.ofRational(1, 2);
    public static final HugeNumber THIRD = HugeNumber.ofRational(1, 3);
    public static final HugeNumber FOURTH = HugeNumber.ofRational(1, 4);
    public static final HugeNumber EIGHTH = HugeNumber.ofRational(1, 8);
    public static final HugeNumber THREE_FOURTHS = HugeNumber.ofRational(3, 4);
    public static final HugeNumber THREE_HALVES = HugeNumber.ofRational(3, 2);

    // SI prefixes
    public static final HugeNumber YOCTO = HugeNumber.of(1, -24);
    public static final HugeNumber ZEPTO = HugeNumber.of(1, -21);
    public static final HugeNumber ATTO = HugeNumber.of(1, -18);
    public static final HugeNumber FEMTO = HugeNumber.of(1, -15);
    public static final HugeNumber PICO = HugeNumber.of(1, -12);
    public static final HugeNumber NANO = HugeNumber.of(1, -9);
    public static final HugeNumber MICRO = HugeNumber.of(1, -6);
    public static final HugeNumber MILLI = HugeNumber.ofRational(1, 1000);
    public static final HugeNumber CENTI = HugeNumber.ofRational(1, 100);
    public static final HugeNumber DECI = HugeNumber.ofRational(1, 10);
    public static final HugeNumber DECA = HugeNumber.of(10);
    public static final HugeNumber HECTO = HugeNumber.of(100);
    public static final HugeNumber KILO = HugeNumber.of(1000);
    public static final HugeNumber MEGA = HugeNumber.of(1, 6);
    public static final HugeNumber GIGA = HugeNumber.of(1, 9);
    public static final HugeNumber TERA = HugeNumber.of(1, 12);
    public static final HugeNumber PETA = HugeNumber.of(1, 15);
    public static final HugeNumber EXA = HugeNumber.of(1, 18);
    public static final HugeNumber ZETTA = HugeNumber.of(1, 21);
    public static final HugeNumber YOTTA = HugeNumber.of(1, 24);

    // mathematics
    public static final HugeNumber E = HugeNumber.of(271828182845904524L, -17);
    public static final HugeNumber INVERSE_E = HugeNumber.ONE.divide(E);
    public static final HugeNumber LN2 = HugeNumber.of(693147180559945309L, -18);
    public static final HugeNumber LN10 = HugeNumber.of(230258509299404568L, -17);
    public static final HugeNumber PHI = HugeNumber.of(161803398874989485L, -17);
    public static final HugeNumber ROOT2 = HugeNumber.of(141421356237309505L, -17);
    public static final HugeNumber PI = HugeNumber.of(314159265358979324L, -17);
    public static final HugeNumber TAU = HugeNumber.of(628318530717958648L, -17);
    public static final HugeNumber TWO_PI = TAU;
    public static final HugeNumber THREE_PI = TAU.add(PI);
    public static final HugeNumber FOUR_PI = TAU.multiply(HugeNumber.TWO);
    public static final HugeNumber HALF_PI = PI.multiply(HALF);
    public static final HugeNumber THIRD_PI = PI.multiply(THIRD);
    public static final HugeNumber QUARTER_PI = PI.divide(HugeNumber.of(4));
    public static final HugeNumber SIXTH_PI = PI.divide(HugeNumber.of(6));
    public static final HugeNumber EIGHTH_PI = PI.divide(HugeNumber.of(8));
    public static final HugeNumber THREE_HALVES_PI = THREE_PI.multiply(HALF);
    public static final HugeNumber THREE_QUARTERS_PI = THREE_PI.divide(HugeNumber.of(4));
    public static final HugeNumber FOUR_THIRDS_PI = FOUR_PI.multiply(THIRD);
    public static final HugeNumber INVERSE_PI = HugeNumber.ONE.divide(PI);
    public static final HugeNumber PI_SQUARED = PI.square();
    public static final HugeNumber TWO_PI_SQUARED = HugeNumber.TWO.multiply(PI_SQUARED);
    public static final HugeNumber PI_OVER_180 = PI.divide(HugeNumber.of(180));
    public static final HugeNumber ONE_EIGHTY_OVER_PI = HugeNumber.of(180).divide(PI);

    // physics and chemistry
    public static final HugeNumber AVOGADRO_CONSTANT = HugeNumber.of(602214076, 15);
    public static final HugeNumber BOLTZMANN_CONSTANT = HugeNumber.of(1380649, -29);
    public static final HugeNumber ELECTRON_MASS = HugeNumber.of(910938356, -39);
    public static final HugeNumber ELEMENTARY_CHARGE = HugeNumber.of(1602176634, -28);
    public static final HugeNumber GRAVITATIONAL_CONSTANT = HugeNumber.of(667408, -16);
    public static final HugeNumber TWO_G = HugeNumber.TWO.multiply(GRAVITATIONAL_CONSTANT);
    public static final HugeNumber HEAT_OF_VAPORIZATION_OF_WATER = HugeNumber.of(2501000);
    public static final HugeNumber HEAT_OF_VAPORIZATION_OF_WATER_SQUARED = HEAT_OF_VAPORIZATION_OF_WATER.square();
    public static final HugeNumber LIGHT_YEAR = HugeNumber.of(9460730472580800L);
    public static final HugeNumber MOLAR_MASS_OF_AIR = HugeNumber.of(289644, -7);
    public static final HugeNumber NEUTRON_MASS = HugeNumber.of(1674927471, -36);
    public static final HugeNumber PLANCK_CONSTANT = HugeNumber.of(662607015, -42);
    public static final HugeNumber PROTON_MASS = HugeNumber.of(1672621898, -36);
    public static final HugeNumber SPECIFIC_GAS_CONSTANT_OF_DRY_AIR = HugeNumber.of(287);
    public static final HugeNumber SPECIFIC_GAS_CONSTANT_OF_WATER = HugeNumber.of(4615, -1);
    public static final HugeNumber SPECIFIC_GAS_CONSTANT_RATIO_OF_DRY_AIR_TO_WATER = SPECIFIC_GAS_CONSTANT_OF_DRY_AIR.divide(SPECIFIC_GAS_CONSTANT_OF_WATER);
    public static final HugeNumber SPECIFIC_HEAT_OF_DRY_AIR = HugeNumber.of(10035, -1);
    public static final HugeNumber SPECIFIC_HEAT_TIMES_GAS_CONSTANT_OF_DRY_AIR = SPECIFIC_HEAT_OF_DRY_AIR.multiply(SPECIFIC_GAS_CONSTANT_OF_DRY_AIR);
    public static final HugeNumber GAS_CONSTANT_OVER_SPECIFIC_HEAT_OF_DRY_AIR = SPECIFIC_GAS_CONSTANT_OF_DRY_AIR.divide(SPECIFIC_HEAT_OF_DRY_AIR);
    public static final HugeNumber SPEED_OF_LIGHT = HugeNumber.of(299792458);
    public static final HugeNumber SPEED_OF_LIGHT_SQUARED = SPEED_OF_LIGHT.square();
    public static final HugeNumber STANDARD_ATMOSPHERIC_PRESSURE = HugeNumber.of(101325, -3);
    public static final HugeNumber STEFAN_BOLTZMANN_CONSTANT = HugeNumber.of(5670367, -14);
    public static final HugeNumber FOUR_SIGMA = HugeNumber.of(4).multiply(STEFAN_BOLTZMANN_CONSTANT);
    public static final HugeNumber UNIVERSAL_GAS_CONSTANT = HugeNumber.of(83144598, -7);
    public static final HugeNumber MOLAR_MASS_OF_AIR_OVER_GAS_CONSTANT = MOLAR_MASS_OF_AIR.divide(UNIVERSAL_GAS_CONSTANT);

    private HugeNumberConstants() {
    }
}
