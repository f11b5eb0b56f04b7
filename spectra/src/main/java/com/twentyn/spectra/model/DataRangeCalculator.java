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

package com.twentyn.spectra.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Single pass computations of variable ranges and averages over the substituted items of a section.
 */
final class DataRangeCalculator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DataRangeCalculator.class);

  private DataRangeCalculator() {

  }

  /**
   * @param includeRoot If set, the variable's peak root value is part of the range even if no item reaches it.
   * @return The range, or null if no item has a value for the variable (and the root is not included).
   */
  static ValueRange calcRange(DataSection section, int varIndex, boolean includeRoot) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    int count = section.getItemCount();
    for (int i = 0; i < count; i++) {
      double v = section.getValueAt(i, varIndex);
      if (Double.isNaN(v)) {
        continue;
      }
      if (v < min) min = v;
      if (v > max) max = v;
    }
    if (includeRoot && count > 0) {
      double root = section.getPeakRootValue(section.getLocalVarSymbols().get(varIndex));
      min = Math.min(min, root);
      max = Math.max(max, root);
    }
    if (min > max) {
      return null;
    }
    LOGGER.debug("Computed range [%f, %f] of %s in section %s",
        min, max, section.getLocalVarSymbols().get(varIndex), section.getName());
    return new ValueRange(min, max);
  }

  static Double calcAverage(DataSection section, int varIndex) {
    double sum = 0.0;
    int n = 0;
    for (int i = 0; i < section.getItemCount(); i++) {
      double v = section.getValueAt(i, varIndex);
      if (!Double.isNaN(v)) {
        sum += v;
        n++;
      }
    }
    return n == 0 ? null : sum / n;
  }
}
