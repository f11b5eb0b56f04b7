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
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The first and last value of an evenly spaced variable in a continuous section.  Items may omit the variable and
 * have its value computed from their position.  fromValue may be greater than toValue (descending data).
 */
public class ContinuousRange {

  @JsonProperty("from")
  private final double fromValue;

  @JsonProperty("to")
  private final double toValue;

  @JsonCreator
  public ContinuousRange(@JsonProperty("from") double fromValue, @JsonProperty("to") double toValue) {
    this.fromValue = fromValue;
    this.toValue = toValue;
  }

  public double getFromValue() {
    return fromValue;
  }

  public double getToValue() {
    return toValue;
  }

  /**
   * Compute the value at position index of a section holding itemCount items.
   */
  public double valueAt(int index, int itemCount) {
    if (itemCount <= 1) {
      return fromValue;
    }
    return fromValue + (toValue - fromValue) * index / (itemCount - 1);
  }

  /**
   * Project a value onto the (fractional) item position it would have in a section holding itemCount items.
   */
  public double positionOf(double value, int itemCount) {
    if (itemCount <= 1 || toValue == fromValue) {
      return 0.0;
    }
    return (value - fromValue) / (toValue - fromValue) * (itemCount - 1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    ContinuousRange that = (ContinuousRange) o;
    return Double.compare(that.fromValue, fromValue) == 0 && Double.compare(that.toValue, toValue) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(fromValue) + Double.hashCode(toValue);
  }

  @Override
  public String toString() {
    return String.format("%f -> %f", fromValue, toValue);
  }
}
