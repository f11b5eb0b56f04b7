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

/**
 * Physical quantity a unit measures.  Units of one category convert into each other by a constant factor; the
 * standard unit of each category has factor 1.
 */
public enum UnitCategory {
  LENGTH("m"),
  WAVENUMBER("1/m"), // Inverse length.
  FREQUENCY("Hz"),
  TIME("s"),
  DIMENSIONLESS(""), // Pure ratios, e.g. NMR chemical shifts.
  MASS_TO_CHARGE("m/z"),
  MASS("Da"),
  INTENSITY("arbitrary"),
  ABSORBANCE("absorbance"),
  TRANSMITTANCE("transmittance"),
  ;

  private String standardUnit;

  UnitCategory(String standardUnit) {
    this.standardUnit = standardUnit;
  }

  public String getStandardUnit() {
    return standardUnit;
  }
}
