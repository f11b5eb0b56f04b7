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
 * A spectrum: what kind of measurement it is, its title, and its data.
 */
public class Spectrum {
  private SpectrumType spectrumType;
  private String title;
  private final SpectrumData data;

  public Spectrum(SpectrumType spectrumType, SpectrumData data) {
    this.spectrumType = spectrumType == null ? SpectrumType.GENERAL : spectrumType;
    this.data = data == null ? new SpectrumData() : data;
  }

  public Spectrum(SpectrumType spectrumType) {
    this(spectrumType, null);
  }

  public SpectrumType getSpectrumType() {
    return spectrumType;
  }

  public void setSpectrumType(SpectrumType spectrumType) {
    this.spectrumType = spectrumType;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public SpectrumData getData() {
    return data;
  }

  public boolean isEmpty() {
    return data.isEmpty();
  }

  /**
   * Shortcut for setting the NMR observe frequency, e.g. setObserveFrequency(400.0, "MHz").
   */
  public void setObserveFrequency(double value, String unit) {
    data.setParameter(SpectrumParameter.OBSERVE_FREQUENCY, value, unit);
  }
}
