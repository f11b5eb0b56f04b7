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

import java.util.HashMap;
import java.util.Map;

/**
 * Memoized ranges and averages of one section, in internal units.  Owned by exactly one section, which drops the
 * whole cache on every mutation.
 */
class SectionStatsCache {
  private final Map<String, ValueRange> rangesWithRoot = new HashMap<>();
  private final Map<String, ValueRange> rangesWithoutRoot = new HashMap<>();
  private final Map<String, Double> averages = new HashMap<>();

  ValueRange getRange(String symbol, boolean includeRoot) {
    return (includeRoot ? rangesWithRoot : rangesWithoutRoot).get(symbol);
  }

  void putRange(String symbol, boolean includeRoot, ValueRange range) {
    (includeRoot ? rangesWithRoot : rangesWithoutRoot).put(symbol, range);
  }

  Double getAverage(String symbol) {
    return averages.get(symbol);
  }

  void putAverage(String symbol, Double average) {
    averages.put(symbol, average);
  }

  void invalidate() {
    rangesWithRoot.clear();
    rangesWithoutRoot.clear();
    averages.clear();
  }

  boolean isEmpty() {
    return rangesWithRoot.isEmpty() && rangesWithoutRoot.isEmpty() && averages.isEmpty();
  }
}
