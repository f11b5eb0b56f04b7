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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Describes one mutation of a data section.  The indexes and items are those the mutation touched: the appended,
 * inserted or overwritten items, the removed ones (with their index before removal), or none for a clear or sort.
 */
public class DataChangeEvent {
  public enum Type {
    APPEND,
    INSERT,
    SET,
    REMOVE,
    CLEAR,
    SORT,
    EXTRA_INFO,
    SETTINGS, // Section level settings (mode, ranges, defaults, peak roots) changed.
  }

  private final DataSection section;
  private final Type type;
  private final List<Integer> indexes;
  private final List<double[]> items;

  public DataChangeEvent(DataSection section, Type type, List<Integer> indexes, List<double[]> items) {
    this.section = section;
    this.type = type;
    this.indexes = Collections.unmodifiableList(new ArrayList<>(indexes));
    this.items = Collections.unmodifiableList(new ArrayList<>(items));
  }

  public DataChangeEvent(DataSection section, Type type) {
    this(section, type, Collections.emptyList(), Collections.emptyList());
  }

  public DataSection getSection() {
    return section;
  }

  public Type getType() {
    return type;
  }

  public List<Integer> getIndexes() {
    return indexes;
  }

  public List<double[]> getItems() {
    return items;
  }

  @Override
  public String toString() {
    return String.format("DataChangeEvent{section=%s, type=%s, indexes=%s}", section.getName(), type, indexes);
  }
}
