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
import java.util.Optional;

/**
 * Converts between two units of the same category by their scale factors, e.g. nm to cm or MHz to Hz.
 */
public class GenericUnitConverter implements UnitConverter {

  @Override
  public boolean canConvert(double value, VariableDefinition varDef, String fromUnit, String toUnit,
                            DataSection section, SpectrumData dataset) {
    Optional<PhysicalUnit> from = PhysicalUnits.get(fromUnit);
    Optional<PhysicalUnit> to = PhysicalUnits.get(toUnit);
    return from.isPresent() && to.isPresent() && from.get().getCategory() == to.get().getCategory();
  }

  @Override
  public double convert(double value, VariableDefinition varDef, String fromUnit, String toUnit,
                        DataSection section, SpectrumData dataset) {
    PhysicalUnit from = PhysicalUnits.get(fromUnit).get();
    PhysicalUnit to = PhysicalUnits.get(toUnit).get();
    return to.fromStandard(from.toStandard(value));
  }

  @Override
  public List<String> getAltUnits(VariableDefinition varDef, String fromUnit, DataSection section,
                                  SpectrumData dataset) {
    List<String> result = new ArrayList<>();
    Optional<PhysicalUnit> from = PhysicalUnits.get(fromUnit);
    if (from.isPresent()) {
      for (PhysicalUnit unit : PhysicalUnits.ofCategory(from.get().getCategory())) {
        if (!unit.equals(from.get())) {
          result.add(unit.getSymbol());
        }
      }
    }
    return result;
  }
}
