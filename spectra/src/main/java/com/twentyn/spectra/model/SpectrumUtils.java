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

import java.util.LinkedHashMap;
import java.util.Map;

public class SpectrumUtils {

  private SpectrumUtils() {

  }

  /**
   * Merge two maps of variable ranges.  Variables present in both get the union of their ranges; variables present
   * in only one map are copied.  Neither argument is modified; null arguments count as empty.
   */
  public static Map<String, ValueRange> mergeDataRange(Map<String, ValueRange> r1, Map<String, ValueRange> r2) {
    Map<String, ValueRange> result = new LinkedHashMap<>();
    if (r1 != null) {
      result.putAll(r1);
    }
    if (r2 != null) {
      for (Map.Entry<String, ValueRange> entry : r2.entrySet()) {
        result.merge(entry.getKey(), entry.getValue(), ValueRange::merge);
      }
    }
    return result;
  }

  /**
   * Compare two values with a relative tolerance.  Two NaNs are equal; NaN never equals a number.
   * @param tolerance Allowed relative error, measured against the larger magnitude of the two values.
   */
  public static boolean floatEquals(double a, double b, double tolerance) {
    if (Double.isNaN(a) || Double.isNaN(b)) {
      return Double.isNaN(a) && Double.isNaN(b);
    }
    if (a == b) {
      return true;
    }
    double scale = Math.max(Math.abs(a), Math.abs(b));
    return Math.abs(a - b) <= tolerance * scale;
  }
}
