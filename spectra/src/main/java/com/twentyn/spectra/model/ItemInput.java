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

import com.twentyn.spectra.SpectrumConfigurationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A data item as handed in by a caller: either a positional vector in local-variable order, or a map from variable
 * symbol to value.  Sections resolve either form into the positional vector they store; omitted values (null in a
 * map, a missing key, or NaN) are stored as NaN.
 */
public abstract class ItemInput {

  public static ItemInput of(double... values) {
    return new Positional(values);
  }

  public static ItemInput of(Map<String, Double> values) {
    return new Keyed(values);
  }

  /**
   * Resolve this input against the ordered list of variable symbols of a section.
   * @param symbols The local variable symbols of the receiving section.
   * @return A fresh positional vector of length symbols.size().
   * @throws SpectrumConfigurationException if the input does not fit the variables.
   */
  public abstract double[] resolve(List<String> symbols);

  public static class Positional extends ItemInput {
    private final double[] values;

    Positional(double[] values) {
      if (values == null) {
        throw new IllegalArgumentException("Positional item values must not be null");
      }
      this.values = values;
    }

    public double[] getValues() {
      return Arrays.copyOf(values, values.length);
    }

    @Override
    public double[] resolve(List<String> symbols) {
      if (values.length != symbols.size()) {
        throw new SpectrumConfigurationException("Item has %d values but the section declares %d variables %s",
            values.length, symbols.size(), symbols);
      }
      return Arrays.copyOf(values, values.length);
    }
  }

  public static class Keyed extends ItemInput {
    private final Map<String, Double> values;

    Keyed(Map<String, Double> values) {
      if (values == null) {
        throw new IllegalArgumentException("Keyed item values must not be null");
      }
      // Null values mark omitted ones.
      this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Double> getValues() {
      return values;
    }

    @Override
    public double[] resolve(List<String> symbols) {
      Set<String> known = new HashSet<>(symbols);
      for (String key : values.keySet()) {
        if (!known.contains(key)) {
          throw new SpectrumConfigurationException("Unknown variable '%s' in item, section variables are %s",
              key, symbols);
        }
      }
      double[] result = new double[symbols.size()];
      for (int i = 0; i < result.length; i++) {
        Double v = values.get(symbols.get(i));
        result[i] = v == null ? Double.NaN : v;
      }
      return result;
    }
  }
}
