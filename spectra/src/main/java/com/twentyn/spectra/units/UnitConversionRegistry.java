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

import com.twentyn.spectra.model.DataSection;
import com.twentyn.spectra.model.SpectrumData;
import com.twentyn.spectra.model.VariableDefinition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered chain of unit converters.  The most recently registered converter is asked first, and the first one
 * that can convert a value does so; registering a converter therefore overrides the ones registered before it for
 * the conversions it accepts.
 *
 * Every dataset owns a registry (see {@link SpectrumData#getUnitConversionRegistry()}); there is no global one.
 */
public class UnitConversionRegistry {
  private static final Logger LOGGER = LogManager.getFormatterLogger(UnitConversionRegistry.class);

  // Head of the list = highest priority.
  private final LinkedList<UnitConverter> converters = new LinkedList<>();

  public UnitConversionRegistry() {

  }

  /**
   * Build a registry holding the built-in converters.  In priority order (first asked first): IR wavelength to
   * wavenumber, NMR frequency to ratio, generic same-category scaling.
   */
  public static UnitConversionRegistry createDefault() {
    UnitConversionRegistry registry = new UnitConversionRegistry();
    registry.register(new GenericUnitConverter());
    registry.register(new NmrFrequencyRatioConverter());
    registry.register(new IrWavelengthWavenumberConverter());
    return registry;
  }

  /**
   * Add a converter with the highest priority.
   */
  public UnitConversionRegistry register(UnitConverter converter) {
    converters.addFirst(converter);
    return this;
  }

  public boolean unregister(UnitConverter converter) {
    return converters.remove(converter);
  }

  /**
   * Return the converters in the order they are asked.
   */
  public List<UnitConverter> getConverters() {
    return Collections.unmodifiableList(new ArrayList<>(converters));
  }

  /**
   * Return the converter that would convert the value, or null if none can.
   */
  public UnitConverter findConverter(double value, VariableDefinition varDef, String fromUnit, String toUnit,
                                     DataSection section, SpectrumData dataset) {
    for (UnitConverter converter : converters) {
      if (converter.canConvert(value, varDef, fromUnit, toUnit, section, dataset)) {
        return converter;
      }
    }
    return null;
  }

  public boolean canConvert(double value, VariableDefinition varDef, String fromUnit, String toUnit,
                            DataSection section, SpectrumData dataset) {
    return Objects.equals(fromUnit, toUnit) ||
        findConverter(value, varDef, fromUnit, toUnit, section, dataset) != null;
  }

  /**
   * Convert a value between two units.  Converting a unit to itself returns the value as is.
   * @throws ConversionUnavailableException if no registered converter can do the conversion.
   */
  public double convert(double value, VariableDefinition varDef, String fromUnit, String toUnit,
                        DataSection section, SpectrumData dataset) {
    if (Objects.equals(fromUnit, toUnit)) {
      return value;
    }
    UnitConverter converter = findConverter(value, varDef, fromUnit, toUnit, section, dataset);
    if (converter == null) {
      throw new ConversionUnavailableException(varDef == null ? null : varDef.getSymbol(), fromUnit, toUnit);
    }
    double result = converter.convert(value, varDef, fromUnit, toUnit, section, dataset);
    LOGGER.trace("Converted %f %s to %f %s with %s", value, fromUnit, result, toUnit,
        converter.getClass().getSimpleName());
    return result;
  }

  /**
   * Collect the units every converter suggests for values in fromUnit, without duplicates, in priority order.  This
   * is a hint for user interfaces only; a suggested unit is not guaranteed to be convertible for every value.
   */
  public List<String> getAltUnits(VariableDefinition varDef, String fromUnit, DataSection section,
                                  SpectrumData dataset) {
    Set<String> result = new LinkedHashSet<>();
    for (UnitConverter converter : converters) {
      List<String> units = converter.getAltUnits(varDef, fromUnit, section, dataset);
      if (units != null) {
        result.addAll(units);
      }
    }
    result.remove(fromUnit);
    return new ArrayList<>(result);
  }
}
