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

import java.util.List;

/**
 * A strategy for converting variable values between two units.  Converters may use the context of the value (its
 * variable, section and dataset) to decide whether and how they convert, e.g. an NMR converter needs the dataset's
 * observe frequency.  Section and dataset may be null.
 */
public interface UnitConverter {

  /**
   * Test whether this converter can convert value of varDef from fromUnit to toUnit in the given context.
   */
  boolean canConvert(double value, VariableDefinition varDef, String fromUnit, String toUnit,
                     DataSection section, SpectrumData dataset);

  /**
   * Convert a value.  Only valid if {@link #canConvert} returned true for the same arguments.
   */
  double convert(double value, VariableDefinition varDef, String fromUnit, String toUnit,
                 DataSection section, SpectrumData dataset);

  /**
   * Suggest the units this converter could convert fromUnit into, e.g. to fill a unit picker.
   */
  List<String> getAltUnits(VariableDefinition varDef, String fromUnit, DataSection section, SpectrumData dataset);
}
