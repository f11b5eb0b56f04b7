/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.spectra.units;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The table of units the engine knows, looked up by symbol.  Symbols are case-sensitive ("mm" is not "Mm"), but a
 * few common spellings (e.g. "um" for micrometer, "cm-1" for inverse centimeter) are registered as aliases.
 */
public class PhysicalUnits {
  private static final Map<String, PhysicalUnit> UNITS = new LinkedHashMap<>();

  public static final PhysicalUnit METER = define("m", "meter", UnitCategory.LENGTH, 1.0);
  public static final PhysicalUnit CENTIMETER = define("cm", "centimeter", UnitCategory.LENGTH, 1e-2);
  public static final PhysicalUnit MILLIMETER = define("mm", "millimeter", UnitCategory.LENGTH, 1e-3);
  public static final PhysicalUnit MICROMETER = define("µm", "micrometer", UnitCategory.LENGTH, 1e-6);
  public static final PhysicalUnit NANOMETER = define("nm", "nanometer", UnitCategory.LENGTH, 1e-9);
  public static final PhysicalUnit ANGSTROM = define("Å", "angstrom", UnitCategory.LENGTH, 1e-10);

  public static final PhysicalUnit RECIPROCAL_METER = define("1/m", "reciprocal meter", UnitCategory.WAVENUMBER, 1.0);
  public static final PhysicalUnit RECIPROCAL_CENTIMETER =
      define("1/cm", "reciprocal centimeter", UnitCategory.WAVENUMBER, 1e2);

  public static final PhysicalUnit HERTZ = define("Hz", "hertz", UnitCategory.FREQUENCY, 1.0);
  public static final PhysicalUnit KILOHERTZ = define("kHz", "kilohertz", UnitCategory.FREQUENCY, 1e3);
  public static final PhysicalUnit MEGAHERTZ = define("MHz", "megahertz", UnitCategory.FREQUENCY, 1e6);
  public static final PhysicalUnit GIGAHERTZ = define("GHz", "gigahertz", UnitCategory.FREQUENCY, 1e9);

  public static final PhysicalUnit SECOND = define("s", "second", UnitCategory.TIME, 1.0);
  public static final PhysicalUnit MILLISECOND = define("ms", "millisecond", UnitCategory.TIME, 1e-3);
  public static final PhysicalUnit MICROSECOND = define("µs", "microsecond", UnitCategory.TIME, 1e-6);
  public static final PhysicalUnit NANOSECOND = define("ns", "nanosecond", UnitCategory.TIME, 1e-9);
  public static final PhysicalUnit MINUTE = define("min", "minute", UnitCategory.TIME, 60.0);

  public static final PhysicalUnit RATIO = define("", "ratio", UnitCategory.DIMENSIONLESS, 1.0);
  public static final PhysicalUnit PERCENT = define("%", "percent", UnitCategory.DIMENSIONLESS, 1e-2);
  public static final PhysicalUnit PPM = define("ppm", "parts per million", UnitCategory.DIMENSIONLESS, 1e-6);
  public static final PhysicalUnit PPB = define("ppb", "parts per billion", UnitCategory.DIMENSIONLESS, 1e-9);

  public static final PhysicalUnit MZ = define("m/z", "mass-to-charge ratio", UnitCategory.MASS_TO_CHARGE, 1.0);
  public static final PhysicalUnit THOMSON = define("Th", "thomson", UnitCategory.MASS_TO_CHARGE, 1.0);

  public static final PhysicalUnit DALTON = define("Da", "dalton", UnitCategory.MASS, 1.0);
  public static final PhysicalUnit KILODALTON = define("kDa", "kilodalton", UnitCategory.MASS, 1e3);

  public static final PhysicalUnit ARBITRARY = define("arbitrary", "arbitrary unit", UnitCategory.INTENSITY, 1.0);
  public static final PhysicalUnit COUNTS = define("counts", "counts", UnitCategory.INTENSITY, 1.0);
  public static final PhysicalUnit ABSORBANCE = define("absorbance", "absorbance", UnitCategory.ABSORBANCE, 1.0);
  public static final PhysicalUnit TRANSMITTANCE =
      define("transmittance", "transmittance", UnitCategory.TRANSMITTANCE, 1.0);

  static {
    alias("um", MICROMETER);
    alias("micrometer", MICROMETER);
    alias("A", ANGSTROM);
    alias("us", MICROSECOND);
    alias("cm-1", RECIPROCAL_CENTIMETER);
    alias("m-1", RECIPROCAL_METER);
    alias("a.u.", ARBITRARY);
  }

  private PhysicalUnits() {

  }

  private static PhysicalUnit define(String symbol, String name, UnitCategory category, double factor) {
    PhysicalUnit unit = new PhysicalUnit(symbol, name, category, factor);
    UNITS.put(symbol, unit);
    return unit;
  }

  private static void alias(String symbol, PhysicalUnit unit) {
    UNITS.put(symbol, unit);
  }

  /**
   * Find a unit by symbol.  A null symbol is read as the dimensionless ratio.
   */
  public static Optional<PhysicalUnit> get(String symbol) {
    return Optional.ofNullable(UNITS.get(symbol == null ? "" : StringUtils.trim(symbol)));
  }

  /**
   * Return the distinct units of a category, in definition order (aliases excluded).
   */
  public static List<PhysicalUnit> ofCategory(UnitCategory category) {
    List<PhysicalUnit> result = new ArrayList<>();
    for (PhysicalUnit unit : UNITS.values()) {
      if (unit.getCategory() == category && !result.contains(unit)) {
        result.add(unit);
      }
    }
    return Collections.unmodifiableList(result);
  }

  public static boolean isCategory(String symbol, UnitCategory category) {
    return get(symbol).map(u -> u.getCategory() == category).orElse(false);
  }
}
