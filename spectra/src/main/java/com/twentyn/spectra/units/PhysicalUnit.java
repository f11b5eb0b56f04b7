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

import java.util.Objects;

/**
 * A unit of measurement.  A value v in this unit equals v * factor in its category's standard unit.
 */
public class PhysicalUnit {
  private final String symbol;
  private final String name;
  private final UnitCategory category;
  private final double factor;

  public PhysicalUnit(String symbol, String name, UnitCategory category, double factor) {
    this.symbol = symbol;
    this.name = name;
    this.category = category;
    this.factor = factor;
  }

  public String getSymbol() {
    return symbol;
  }

  public String getName() {
    return name;
  }

  public UnitCategory getCategory() {
    return category;
  }

  public double getFactor() {
    return factor;
  }

  public double toStandard(double value) {
    return value * factor;
  }

  public double fromStandard(double value) {
    return value / factor;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PhysicalUnit that = (PhysicalUnit) o;
    return symbol.equals(that.symbol) && category == that.category;
  }

  @Override
  public int hashCode() {
    return Objects.hash(symbol, category);
  }

  @Override
  public String toString() {
    return symbol.isEmpty() ? name : symbol;
  }
}
