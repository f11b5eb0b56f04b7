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
 * Per-call switches of range, average and lookup queries.  Instances are mutable and meant to be built inline:
 * <pre>new DataQueryOptions().setUseExternalUnit(true).setTolerance(0.01)</pre>
 */
public class DataQueryOptions {
  private Double tolerance;
  private boolean useExternalUnit = false;
  private boolean excludePeakRoot = false;
  private boolean reverseOrder = false;
  private boolean rankByCenter = false;

  public static DataQueryOptions defaults() {
    return new DataQueryOptions();
  }

  /**
   * Relative peak match tolerance; null means the section's own tolerance.
   */
  public Double getTolerance() {
    return tolerance;
  }

  public DataQueryOptions setTolerance(Double tolerance) {
    this.tolerance = tolerance;
    return this;
  }

  /**
   * If set, query values are given in and results returned in each variable's external unit.
   */
  public boolean isUseExternalUnit() {
    return useExternalUnit;
  }

  public DataQueryOptions setUseExternalUnit(boolean useExternalUnit) {
    this.useExternalUnit = useExternalUnit;
    return this;
  }

  /**
   * If set, peak root values do not widen the range of dependent variables in PEAK sections.
   */
  public boolean isExcludePeakRoot() {
    return excludePeakRoot;
  }

  public DataQueryOptions setExcludePeakRoot(boolean excludePeakRoot) {
    this.excludePeakRoot = excludePeakRoot;
    return this;
  }

  /**
   * If set, peak range scans walk the items from last to first.
   */
  public boolean isReverseOrder() {
    return reverseOrder;
  }

  public DataQueryOptions setReverseOrder(boolean reverseOrder) {
    this.reverseOrder = reverseOrder;
    return this;
  }

  /**
   * If set, peak range scan results are ordered by their distance to the center of the queried range.
   */
  public boolean isRankByCenter() {
    return rankByCenter;
  }

  public DataQueryOptions setRankByCenter(boolean rankByCenter) {
    this.rankByCenter = rankByCenter;
    return this;
  }
}
