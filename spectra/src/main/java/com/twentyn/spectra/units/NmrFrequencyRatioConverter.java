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
import com.twentyn.spectra.model.SpectrumParameter;
import com.twentyn.spectra.model.VariableDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Converts NMR shifts between frequency units (Hz) and dimensionless ratios (ppm).  The shift ratio is the frequency
 * offset divided by the spectrometer's observe frequency, so the conversion is only possible when the dataset carries
 * an {@link SpectrumParameter#OBSERVE_FREQUENCY} parameter in a frequency unit.
 *
 * Example: at 400 MHz, an offset of 400 Hz is 400 / 400e6 = 1e-6, i.e. 1 ppm.
 */
public class NmrFrequencyRatioConverter implements UnitConverter {

  @Override
  public boolean canConvert(double value, VariableDefinition varDef, String fromUnit, String toUnit,
                            DataSection section, SpectrumData dataset) {
    boolean frequencyToRatio = PhysicalUnits.isCategory(fromUnit, UnitCategory.FREQUENCY) &&
        PhysicalUnits.isCategory(toUnit, UnitCategory.DIMENSIONLESS);
    boolean ratioToFrequency = PhysicalUnits.isCategory(fromUnit, UnitCategory.DIMENSIONLESS) &&
        PhysicalUnits.isCategory(toUnit, UnitCategory.FREQUENCY);
    return (frequencyToRatio || ratioToFrequency) && getObserveFrequencyInHz(dataset).isPresent();
  }

  @Override
  public double convert(double value, VariableDefinition varDef, String fromUnit, String toUnit,
                        DataSection section, SpectrumData dataset) {
    double observeFrequency = getObserveFrequencyInHz(dataset).get();
    PhysicalUnit from = PhysicalUnits.get(fromUnit).get();
    PhysicalUnit to = PhysicalUnits.get(toUnit).get();
    if (from.getCategory() == UnitCategory.FREQUENCY) {
      double ratio = from.toStandard(value) / observeFrequency;
      return to.fromStandard(ratio);
    }
    double frequency = from.toStandard(value) * observeFrequency;
    return to.fromStandard(frequency);
  }

  @Override
  public List<String> getAltUnits(VariableDefinition varDef, String fromUnit, DataSection section,
                                  SpectrumData dataset) {
    if (!getObserveFrequencyInHz(dataset).isPresent()) {
      return new ArrayList<>();
    }
    if (PhysicalUnits.isCategory(fromUnit, UnitCategory.FREQUENCY)) {
      return new ArrayList<>(Arrays.asList(PhysicalUnits.PPM.getSymbol()));
    }
    if (PhysicalUnits.isCategory(fromUnit, UnitCategory.DIMENSIONLESS)) {
      return new ArrayList<>(Arrays.asList(PhysicalUnits.HERTZ.getSymbol()));
    }
    return new ArrayList<>();
  }

  /**
   * Read the observe frequency of a dataset in Hz.  Empty if the dataset is null, lacks the parameter, or gives it
   * without a frequency unit.
   */
  static Optional<Double> getObserveFrequencyInHz(SpectrumData dataset) {
    if (dataset == null) {
      return Optional.empty();
    }
    Optional<SpectrumParameter> parameter = dataset.getParameter(SpectrumParameter.OBSERVE_FREQUENCY);
    if (!parameter.isPresent() || parameter.get().getValue() == null) {
      return Optional.empty();
    }
    Optional<PhysicalUnit> unit = PhysicalUnits.get(parameter.get().getUnit());
    if (!unit.isPresent() || unit.get().getCategory() != UnitCategory.FREQUENCY) {
      return Optional.empty();
    }
    double hz = unit.get().toStandard(parameter.get().getValue());
    return hz == 0.0 ? Optional.empty() : Optional.of(hz);
  }
}
