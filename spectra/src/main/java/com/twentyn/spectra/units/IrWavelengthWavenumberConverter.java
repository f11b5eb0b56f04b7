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

import java.util.ArrayList;
import java.util.List;

/**
 * Converts IR axes between wavelength and wavenumber: wavenumber [1/m] = 1 / wavelength [m].  A zero value has no
 * reciprocal and cannot be converted.
 */
public class IrWavelengthWavenumberConverter implements UnitConverter {

  @Override
  public boolean canConvert(double value, VariableDefinition varDef, String fromUnit, String toUnit,
                            DataSection section, SpectrumData dataset) {
    if (value == 0.0) {
      return false;
    }
    return (PhysicalUnits.isCategory(fromUnit, UnitCategory.LENGTH) &&
        PhysicalUnits.isCategory(toUnit, UnitCategory.WAVENUMBER)) ||
        (PhysicalUnits.isCategory(fromUnit, UnitCategory.WAVENUMBER) &&
            PhysicalUnits.isCategory(toUnit, UnitCategory.LENGTH));
  }

  @Override
  public double convert(double value, VariableDefinition varDef, String fromUnit, String toUnit,
                        DataSection section, SpectrumData dataset) {
    PhysicalUnit from = PhysicalUnits.get(fromUnit).get();
    PhysicalUnit to = PhysicalUnits.get(toUnit).get();
    // The reciprocal of a standard length is a standard wavenumber and vice versa.
    return to.fromStandard(1.0 / from.toStandard(value));
  }

  @Override
  public List<String> getAltUnits(VariableDefinition varDef, String fromUnit, DataSection section,
                                  SpectrumData dataset) {
    List<String> result = new ArrayList<>();
    UnitCategory target;
    if (PhysicalUnits.isCategory(fromUnit, UnitCategory.LENGTH)) {
      target = UnitCategory.WAVENUMBER;
    } else if (PhysicalUnits.isCategory(fromUnit, UnitCategory.WAVENUMBER)) {
      target = UnitCategory.LENGTH;
    } else {
      return result;
    }
    for (PhysicalUnit unit : PhysicalUnits.ofCategory(target)) {
      result.add(unit.getSymbol());
    }
    return result;
  }
}
