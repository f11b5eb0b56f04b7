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

package com.twentyn.spectra.lookup;

import com.twentyn.spectra.SpectrumConfigurationException;
import com.twentyn.spectra.model.DataSection;
import com.twentyn.spectra.model.ValueRange;
import com.twentyn.spectra.model.VariableDefinition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tolerance based matching of independent coordinates against the items of a (peak) section.
 */
public final class PeakLocator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakLocator.class);

  private PeakLocator() {

  }

  /**
   * Find the item nearest to the queried independent values.  A query value outside its variable's data range
   * matches nothing.  An item matches if, for every queried variable, it lies within tolerance * (max - min) of the
   * query (tolerance * |query| if all items share one value); among the matches the one with the smallest sum of
   * squared normalized distances wins, the first one on ties.
   * @param independentValues Symbol to value, in internal units.
   * @param tolerance Relative tolerance.
   * @return The index of the nearest matching item, or -1.
   */
  public static int findNearestItemIndex(DataSection section, Map<String, Double> independentValues,
                                         double tolerance) {
    if (section.isEmpty() || independentValues.isEmpty()) {
      return -1;
    }
    int n = independentValues.size();
    int[] varIndexes = new int[n];
    double[] queries = new double[n];
    double[] allowed = new double[n];
    double[] scales = new double[n];

    int k = 0;
    for (Map.Entry<String, Double> entry : independentValues.entrySet()) {
      VariableDefinition varDef = section.getLocalVariable(entry.getKey());
      if (!varDef.isIndependent()) {
        throw new SpectrumConfigurationException("Variable '%s' of section %s is not independent",
            entry.getKey(), section.getName());
      }
      Double query = entry.getValue();
      if (query == null || Double.isNaN(query)) {
        return -1;
      }
      ValueRange range = section.getDataRange(entry.getKey());
      if (range == null || !range.contains(query)) {
        LOGGER.debug("Query %s=%f is outside the data range %s of section %s",
            entry.getKey(), query, range, section.getName());
        return -1;
      }
      double span = range.getLength();
      varIndexes[k] = section.indexOfLocalVariable(entry.getKey());
      queries[k] = query;
      allowed[k] = span > 0 ? tolerance * span : tolerance * Math.abs(query);
      // Distances are normalized by the span so that variables of different magnitude weigh the same.
      scales[k] = span > 0 ? span : (allowed[k] > 0 ? allowed[k] : 1.0);
      k++;
    }

    int best = -1;
    double bestScore = Double.POSITIVE_INFINITY;
    for (int i = 0; i < section.getItemCount(); i++) {
      double score = 0.0;
      boolean matches = true;
      for (int j = 0; j < n && matches; j++) {
        double v = section.getValueAt(i, varIndexes[j]);
        double delta = Math.abs(v - queries[j]);
        if (Double.isNaN(v) || delta > allowed[j]) {
          matches = false;
        } else {
          double normalized = delta / scales[j];
          score += normalized * normalized;
        }
      }
      if (matches && score < bestScore) {
        best = i;
        bestScore = score;
      }
    }
    return best;
  }

  /**
   * Return the item matching the independent values or, when nothing matches, the peak root point at those
   * coordinates: queried independent values (NaN for the ones not queried) and the root value of every dependent
   * variable.
   */
  public static double[] getValueFromIndependent(DataSection section, Map<String, Double> independentValues,
                                                 double tolerance) {
    int index = findNearestItemIndex(section, independentValues, tolerance);
    if (index >= 0) {
      return section.getItemAt(index);
    }
    List<VariableDefinition> variables = section.getLocalVariables();
    double[] result = new double[variables.size()];
    for (int i = 0; i < result.length; i++) {
      VariableDefinition varDef = variables.get(i);
      if (varDef.isIndependent()) {
        Double q = independentValues.get(varDef.getSymbol());
        result[i] = q == null ? Double.NaN : q;
      } else {
        result[i] = section.getPeakRootValue(varDef.getSymbol());
      }
    }
    return result;
  }

  /**
   * Collect the items whose value of an independent variable lies in [from, to].
   * @param reverse Walk the items from last to first, e.g. when the data is known to be descending.
   * @param rankByCenter Order the result by distance to (from + to) / 2, nearest first; ties keep scan order.
   */
  public static IndependentRangeResult scanRange(DataSection section, String symbol, double from, double to,
                                                 boolean reverse, boolean rankByCenter) {
    int varIndex = section.indexOfLocalVariable(symbol);
    int count = section.getItemCount();
    List<Integer> indexes = new ArrayList<>();
    for (int step = 0; step < count; step++) {
      int i = reverse ? count - 1 - step : step;
      double v = section.getValueAt(i, varIndex);
      if (v >= from && v <= to) {
        indexes.add(i);
      }
    }
    if (rankByCenter) {
      double center = (from + to) / 2.0;
      indexes.sort((a, b) -> Double.compare(
          Math.abs(section.getValueAt(a, varIndex) - center), Math.abs(section.getValueAt(b, varIndex) - center)));
    }
    List<double[]> items = new ArrayList<>(indexes.size());
    for (Integer i : indexes) {
      items.add(section.getItemAt(i));
    }
    return new IndependentRangeResult(indexes, items, null, null);
  }
}
