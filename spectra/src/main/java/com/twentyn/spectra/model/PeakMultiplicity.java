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

/**
 * Multiplicity of an NMR peak.  The numbered multiplicities know how many lines they split into.
 */
public enum PeakMultiplicity {
  SINGLET(1),
  DOUBLET(2),
  TRIPLET(3),
  QUARTET(4),
  QUINTET(5),
  SEXTUPLET(6),
  MULTIPLET(null),
  UNKNOWN(null),
  ;

  private Integer lineCount;

  PeakMultiplicity(Integer lineCount) {
    this.lineCount = lineCount;
  }

  /**
   * Return the number of lines a peak of this multiplicity is split into, or null if it is not a fixed number.
   */
  public Integer getLineCount() {
    return lineCount;
  }

  public static PeakMultiplicity fromLineCount(int lineCount) {
    for (PeakMultiplicity m : values()) {
      if (m.lineCount != null && m.lineCount == lineCount) {
        return m;
      }
    }
    return MULTIPLET;
  }
}
