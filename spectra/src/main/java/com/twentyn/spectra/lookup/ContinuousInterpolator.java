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
import com.twentyn.spectra.model.ContinuousRange;
import com.twentyn.spectra.model.DataSection;
import com.twentyn.spectra.model.ValueRange;
import com.twentyn.spectra.model.VariableDefinition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Linear interpolation of continuous sections along their primary independent variable.
 */
public final class ContinuousInterpolator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ContinuousInterpolator.class);

  private ContinuousInterpolator() {

  }

  /**
   * Interpolate every variable of the section at the queried value of its primary independent variable.
   * @param independentValues Must contain the primary independent variable; other entries are ignored.
   * @return The interpolated item, or empty if the query lies outside the data or no bracketing items exist.
   */
  public static Optional<double[]> getValueFromIndependent(DataSection section, Map<String, Double> independentValues) {
    VariableDefinition axis = section.getPrimaryIndependentVariable();
    Double query = independentValues.get(axis.getSymbol());
    if (query == null) {
      throw new SpectrumConfigurationException("Query on section %s needs a value for '%s'",
          section.getName(), axis.getSymbol());
    }
    return interpolateAt(section, section.indexOfLocalVariable(axis.getSymbol()), query);
  }

  /**
   * Collect the items with axis value in [from, to] along with the values interpolated at both ends of the range,
   * clamped to the data.
   */
  public static IndependentRangeResult valueRange(DataSection section, String symbol, double from, double to) {
    ValueRange dataRange = section.getDataRange(symbol);
    if (dataRange == null || to < dataRange.getMin() || from > dataRange.getMax()) {
      return IndependentRangeResult.empty();
    }
    int axis = section.indexOfLocalVariable(symbol);
    double lo = Math.max(from, dataRange.getMin());
    double hi = Math.min(to, dataRange.getMax());

    List<Integer> indexes = new ArrayList<>();
    List<double[]> items = new ArrayList<>();
    for (int i = 0; i < section.getItemCount(); i++) {
      double v = section.getValueAt(i, axis);
      if (v >= lo && v <= hi) {
        indexes.add(i);
        items.add(section.getItemAt(i));
      }
    }
    double[] lower = interpolateAt(section, axis, lo).orElse(null);
    double[] upper = interpolateAt(section, axis, hi).orElse(null);
    return new IndependentRangeResult(indexes, items, lower, upper);
  }

  private static Optional<double[]> interpolateAt(DataSection section, int axis, double x) {
    if (section.isEmpty() || Double.isNaN(x)) {
      return Optional.empty();
    }
    String symbol = section.getLocalVariables().get(axis).getSymbol();
    ValueRange dataRange = section.getDataRange(symbol);
    if (dataRange == null || !dataRange.contains(x)) {
      return Optional.empty();
    }
    int[] bracket = locate(section, axis, symbol, x);
    if (bracket == null) {
      return Optional.empty();
    }

    double[] result = new double[section.getLocalVariableCount()];
    for (int var = 0; var < result.length; var++) {
      result[var] = var == axis ? x : interpolate(section, axis, var, bracket[0], bracket[1], x);
    }
    return Optional.of(result);
  }

  /**
   * Find two items whose axis values enclose x: {i, i} on an exact hit, otherwise two items with no valid axis value
   * between them.
   */
  static int[] locate(DataSection section, int axis, String symbol, double x) {
    int count = section.getItemCount();
    ContinuousRange continuousRange = section.getContinuousVarRange(symbol);
    if (continuousRange != null) {
      double position = continuousRange.positionOf(x, count);
      int lo = Math.max(0, Math.min(count - 1, (int) Math.floor(position)));
      int hi = Math.max(0, Math.min(count - 1, (int) Math.ceil(position)));
      return new int[] {lo, hi};
    }
    if (!section.isSorted()) {
      return scanBracket(section, axis, x, 0, count - 1);
    }

    int first = nextValid(section, axis, 0, count - 1);
    int last = previousValid(section, axis, count - 1, 0);
    if (first < 0) {
      return null;
    }
    boolean ascending = section.getValueAt(first, axis) <= section.getValueAt(last, axis);
    int[] bracket = binaryBracket(section, axis, x, first, last, ascending);
    if (bracket == null || !encloses(section, axis, bracket, x)) {
      assert false : "Sorted section " + section.getName() + " is not monotonic along " + symbol;
      LOGGER.warn("Section %s is marked sorted but is not monotonic along %s, falling back to a linear scan",
          section.getName(), symbol);
      return scanBracket(section, axis, x, 0, count - 1);
    }
    return bracket;
  }

  private static int[] binaryBracket(DataSection section, int axis, double x, int from, int to, boolean ascending) {
    if (to - from <= 2) {
      return scanBracket(section, axis, x, from, to);
    }
    int mid = nextValid(section, axis, (from + to) >>> 1, to - 1);
    if (mid < 0) {
      mid = previousValid(section, axis, (from + to) >>> 1, from + 1);
    }
    if (mid < 0) {
      return scanBracket(section, axis, x, from, to);
    }
    double midValue = section.getValueAt(mid, axis);
    if (midValue == x) {
      return new int[] {mid, mid};
    }
    boolean left = ascending ? x < midValue : x > midValue;
    return left ?
        binaryBracket(section, axis, x, from, mid, ascending) :
        binaryBracket(section, axis, x, mid, to, ascending);
  }

  private static int[] scanBracket(DataSection section, int axis, double x, int from, int to) {
    int previous = -1;
    for (int i = from; i <= to; i++) {
      double v = section.getValueAt(i, axis);
      if (Double.isNaN(v)) {
        continue;
      }
      if (v == x) {
        return new int[] {i, i};
      }
      if (previous >= 0) {
        double pv = section.getValueAt(previous, axis);
        if (Math.min(pv, v) <= x && x <= Math.max(pv, v)) {
          return new int[] {previous, i};
        }
      }
      previous = i;
    }
    return null;
  }

  private static boolean encloses(DataSection section, int axis, int[] bracket, double x) {
    double a = section.getValueAt(bracket[0], axis);
    double b = section.getValueAt(bracket[1], axis);
    return Math.min(a, b) <= x && x <= Math.max(a, b);
  }

  /**
   * Interpolate one variable between the bracket ends.  An end whose value is omitted moves outward to the nearest
   * item that has one.
   */
  private static double interpolate(DataSection section, int axis, int var, int lo, int hi, double x) {
    int a = Double.isNaN(section.getValueAt(lo, var)) ? previousValid(section, var, lo - 1, 0) : lo;
    int b = Double.isNaN(section.getValueAt(hi, var)) ?
        nextValid(section, var, hi + 1, section.getItemCount() - 1) : hi;
    if (a < 0 || b < 0) {
      return Double.NaN;
    }
    double ya = section.getValueAt(a, var);
    double yb = section.getValueAt(b, var);
    double xa = section.getValueAt(a, axis);
    double xb = section.getValueAt(b, axis);
    if (a == b || xa == xb) {
      return ya;
    }
    return ya + (yb - ya) * (x - xa) / (xb - xa);
  }

  private static int nextValid(DataSection section, int var, int from, int limit) {
    for (int i = Math.max(from, 0); i <= limit; i++) {
      if (!Double.isNaN(section.getValueAt(i, var))) {
        return i;
      }
    }
    return -1;
  }

  private static int previousValid(DataSection section, int var, int from, int limit) {
    for (int i = Math.min(from, section.getItemCount() - 1); i >= limit; i--) {
      if (!Double.isNaN(section.getValueAt(i, var))) {
        return i;
      }
    }
    return -1;
  }
}
