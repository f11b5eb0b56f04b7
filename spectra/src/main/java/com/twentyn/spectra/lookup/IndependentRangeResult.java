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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * The items of a section that fall in a range of an independent variable.  Continuous sections also report the
 * values interpolated at the lower and upper end of the (clamped) range; peak sections leave those null.
 */
public class IndependentRangeResult {
  private static final IndependentRangeResult EMPTY =
      new IndependentRangeResult(Collections.emptyList(), Collections.emptyList(), null, null);

  private final List<Integer> indexes;
  private final List<double[]> items;
  private final double[] lowerBoundary;
  private final double[] upperBoundary;

  public IndependentRangeResult(List<Integer> indexes, List<double[]> items,
                                double[] lowerBoundary, double[] upperBoundary) {
    if (indexes.size() != items.size()) {
      throw new IllegalArgumentException("Each item of a range result needs its index");
    }
    this.indexes = Collections.unmodifiableList(new ArrayList<>(indexes));
    this.items = Collections.unmodifiableList(new ArrayList<>(items));
    this.lowerBoundary = lowerBoundary;
    this.upperBoundary = upperBoundary;
  }

  public static IndependentRangeResult empty() {
    return EMPTY;
  }

  /**
   * The indexes of the enclosed items, in the order the items were collected.
   */
  public List<Integer> getIndexes() {
    return indexes;
  }

  public List<double[]> getItems() {
    return items;
  }

  public double[] getLowerBoundary() {
    return lowerBoundary;
  }

  public double[] getUpperBoundary() {
    return upperBoundary;
  }

  public boolean isEmpty() {
    return items.isEmpty() && lowerBoundary == null && upperBoundary == null;
  }

  /**
   * Return the lower boundary, the enclosed items and the upper boundary as one list, skipping absent boundaries.
   */
  public List<double[]> getValues() {
    List<double[]> result = new ArrayList<>(items.size() + 2);
    if (lowerBoundary != null) {
      result.add(lowerBoundary);
    }
    result.addAll(items);
    if (upperBoundary != null) {
      result.add(upperBoundary);
    }
    return result;
  }

  /**
   * Apply a transformation (e.g. a unit conversion) to every item and boundary.
   */
  public IndependentRangeResult map(UnaryOperator<double[]> transform) {
    if (isEmpty()) {
      return this;
    }
    List<double[]> mapped = new ArrayList<>(items.size());
    for (double[] item : items) {
      mapped.add(transform.apply(item));
    }
    return new IndependentRangeResult(indexes, mapped,
        lowerBoundary == null ? null : transform.apply(lowerBoundary),
        upperBoundary == null ? null : transform.apply(upperBoundary));
  }
}
