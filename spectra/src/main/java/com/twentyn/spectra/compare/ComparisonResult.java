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

package com.twentyn.spectra.compare;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The differences found by a {@link SectionComparator}, as human readable descriptions in the order found.
 */
public class ComparisonResult {
  private final List<String> differences = new ArrayList<>();

  void addDifference(String format, Object... args) {
    differences.add(String.format(format, args));
  }

  void addAll(String prefix, ComparisonResult other) {
    for (String difference : other.differences) {
      differences.add(prefix + difference);
    }
  }

  public boolean isEqual() {
    return differences.isEmpty();
  }

  public List<String> getDifferences() {
    return Collections.unmodifiableList(differences);
  }

  @Override
  public String toString() {
    return isEqual() ? "equal" : StringUtils.join(differences, "; ");
  }
}
