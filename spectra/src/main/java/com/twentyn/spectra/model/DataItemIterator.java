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

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A lazy, restartable iterator over the items of a section.  Items are produced one at a time as copies, so
 * exporters and renderers can stream a section without materializing it.  Mutating the section while iterating
 * makes the next call fail; {@link #restart()} picks up the current state again.
 */
public class DataItemIterator implements Iterator<double[]> {
  private final DataSection section;
  private final boolean substituteOmitted;
  private int index = 0;
  private int expectedModificationCount;

  DataItemIterator(DataSection section, boolean substituteOmitted) {
    this.section = section;
    this.substituteOmitted = substituteOmitted;
    this.expectedModificationCount = section.getModificationCount();
  }

  @Override
  public boolean hasNext() {
    return index < section.getItemCount();
  }

  @Override
  public double[] next() {
    if (section.getModificationCount() != expectedModificationCount) {
      throw new ConcurrentModificationException(
          String.format("Section %s changed during iteration", section.getName()));
    }
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    double[] result = substituteOmitted ? section.getItemAt(index) : section.getRawItemAt(index);
    index++;
    return result;
  }

  /**
   * The index of the item the next call to {@link #next()} returns.
   */
  public int nextIndex() {
    return index;
  }

  /**
   * Go back to the first item.
   */
  public void restart() {
    index = 0;
    expectedModificationCount = section.getModificationCount();
  }
}
