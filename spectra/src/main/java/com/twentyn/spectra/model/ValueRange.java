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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An immutable, closed [min, max] interval of variable values.
 */
public class ValueRange {

  @JsonProperty("min")
  private final double min;

  @JsonProperty("max")
  private final double max;

  @JsonCreator
  public ValueRange(@JsonProperty("min") double min, @JsonProperty("max") double max) {
    this.min = min;
    this.max = max;
  }

  /**
   * Build a range from two bounds given in either order.
   */
  public static ValueRange between(double a, double b) {
    return a <= b ? new ValueRange(a, b) : new ValueRange(b, a);
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  @JsonIgnore
  public double getLength() {
    return max - min;
  }

  @JsonIgnore
  public double getCenter() {
    return (min + max) / 2.0;
  }

  public boolean contains(double value) {
    return value >= min && value <= max;
  }

  /**
   * Return the smallest range that covers both this range and the other one.  A null argument is ignored.
   */
  public ValueRange merge(ValueRange other) {
    if (other == null) {
      return this;
    }
    return new ValueRange(Math.min(min, other.min), Math.max(max, other.max));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    ValueRange that = (ValueRange) o;
    return Double.compare(that.min, min) == 0 && Double.compare(that.max, max) == 0;
  }

  @Override
  public int hashCode() {
    long bits = Double.doubleToLongBits(min);
    int result = (int) (bits ^ (bits >>> 32));
    bits = Double.doubleToLongBits(max);
    return 31 * result + (int) (bits ^ (bits >>> 32));
  }

  @Override
  public String toString() {
    return String.format("[%f, %f]", min, max);
  }
}
