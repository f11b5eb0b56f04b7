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

package com.twentyn.spectra.compare;

import com.twentyn.spectra.model.DataSection;
import com.twentyn.spectra.model.ExtraInfo;
import com.twentyn.spectra.model.SpectrumData;
import com.twentyn.spectra.model.SpectrumUtils;
import com.twentyn.spectra.model.VariableDefinition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Structural, tolerance aware comparison of sections and datasets.  Values are compared relative to their
 * magnitude; two omitted values are equal; an empty ExtraInfo is the same as none.
 */
public class SectionComparator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SectionComparator.class);

  public static final double DEFAULT_TOLERANCE = 5e-8;

  private final double tolerance;

  public SectionComparator() {
    this(DEFAULT_TOLERANCE);
  }

  public SectionComparator(double tolerance) {
    if (tolerance < 0) {
      throw new IllegalArgumentException("Comparison tolerance must not be negative");
    }
    this.tolerance = tolerance;
  }

  public double getTolerance() {
    return tolerance;
  }

  public ComparisonResult compare(DataSection a, DataSection b) {
    ComparisonResult result = new ComparisonResult();
    if (a.getMode() != b.getMode()) {
      result.addDifference("mode %s != %s", a.getMode(), b.getMode());
    }
    compareVariables(a.getLocalVariables(), b.getLocalVariables(), result);
    if (a.getItemCount() != b.getItemCount()) {
      result.addDifference("item count %d != %d", a.getItemCount(), b.getItemCount());
    }
    // Item by item comparison only makes sense over the same variables.
    if (result.isEqual()) {
      for (int i = 0; i < a.getItemCount(); i++) {
        compareItems(i, a.getItemAt(i), b.getItemAt(i), result);
        if (!extraInfoEquals(a.getExtraInfoAt(i), b.getExtraInfoAt(i))) {
          result.addDifference("item %d: extra info %s != %s", i, a.getExtraInfoAt(i), b.getExtraInfoAt(i));
        }
      }
    }
    if (!result.isEqual()) {
      LOGGER.debug("Sections %s and %s differ: %s", a.getName(), b.getName(), result);
    }
    return result;
  }

  public ComparisonResult compare(SpectrumData a, SpectrumData b) {
    ComparisonResult result = new ComparisonResult();
    compareVariables(a.getVariables(), b.getVariables(), result);
    if (a.getSectionCount() != b.getSectionCount()) {
      result.addDifference("section count %d != %d", a.getSectionCount(), b.getSectionCount());
      return result;
    }
    for (int i = 0; i < a.getSectionCount(); i++) {
      result.addAll(String.format("section %d: ", i), compare(a.getSectionAt(i), b.getSectionAt(i)));
    }
    return result;
  }

  private void compareVariables(List<VariableDefinition> a, List<VariableDefinition> b, ComparisonResult result) {
    if (a.size() != b.size()) {
      result.addDifference("variable count %d != %d", a.size(), b.size());
      return;
    }
    for (int i = 0; i < a.size(); i++) {
      VariableDefinition va = a.get(i);
      VariableDefinition vb = b.get(i);
      if (!va.getSymbol().equals(vb.getSymbol()) ||
          va.getDependency() != vb.getDependency() ||
          !Objects.equals(va.getInternalUnit(), vb.getInternalUnit()) ||
          !Objects.equals(va.getActualExternalUnit(), vb.getActualExternalUnit())) {
        result.addDifference("variable %d: %s != %s", i, va, vb);
      }
    }
  }

  private void compareItems(int index, double[] a, double[] b, ComparisonResult result) {
    for (int j = 0; j < a.length; j++) {
      if (!SpectrumUtils.floatEquals(a[j], b[j], tolerance)) {
        result.addDifference("item %d, value %d: %s != %s", index, j, a[j], b[j]);
      }
    }
  }

  static boolean extraInfoEquals(ExtraInfo a, ExtraInfo b) {
    boolean aEmpty = a == null || a.isEmpty();
    boolean bEmpty = b == null || b.isEmpty();
    if (aEmpty || bEmpty) {
      return aEmpty == bEmpty;
    }
    return a.equals(b);
  }
}
