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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * Describes one measured axis of a spectrum: its symbol, whether it is set by the measurement (independent) or
 * measured (dependent), the unit values are stored in and, optionally, the unit values should be shown in.
 *
 * The symbol is the identity of a variable inside a dataset; everything but the symbol and dependency may be changed
 * after construction.
 */
public class VariableDefinition {

  @JsonProperty("symbol")
  private String symbol;

  @JsonProperty("name")
  private String name;

  @JsonProperty("dependency")
  private VarDependency dependency;

  @JsonProperty("internal_unit")
  private String internalUnit;

  @JsonProperty("external_unit")
  private String externalUnit;

  public VariableDefinition(String symbol, VarDependency dependency, String internalUnit, String externalUnit) {
    if (StringUtils.isBlank(symbol)) {
      throw new IllegalArgumentException("Variable symbol must not be blank");
    }
    this.symbol = symbol;
    this.dependency = dependency == null ? VarDependency.INDEPENDENT : dependency;
    this.internalUnit = internalUnit;
    this.externalUnit = externalUnit;
  }

  public VariableDefinition(String symbol, VarDependency dependency, String internalUnit) {
    this(symbol, dependency, internalUnit, null);
  }

  private VariableDefinition() { // For de/serialization.

  }

  public static VariableDefinition independent(String symbol, String unit) {
    return new VariableDefinition(symbol, VarDependency.INDEPENDENT, unit);
  }

  public static VariableDefinition dependent(String symbol, String unit) {
    return new VariableDefinition(symbol, VarDependency.DEPENDENT, unit);
  }

  public String getSymbol() {
    return symbol;
  }

  /**
   * Return the display name of this variable, or the symbol if no name was given.
   */
  public String getName() {
    return name == null ? symbol : name;
  }

  public VariableDefinition setName(String name) {
    this.name = name;
    return this;
  }

  public VarDependency getDependency() {
    return dependency;
  }

  @JsonIgnore
  public boolean isIndependent() {
    return dependency == VarDependency.INDEPENDENT;
  }

  public String getInternalUnit() {
    return internalUnit;
  }

  public VariableDefinition setInternalUnit(String internalUnit) {
    this.internalUnit = internalUnit;
    return this;
  }

  public String getExternalUnit() {
    return externalUnit;
  }

  public VariableDefinition setExternalUnit(String externalUnit) {
    this.externalUnit = externalUnit;
    return this;
  }

  /**
   * The unit values of this variable are shown in: the external unit if one was set, the internal unit otherwise.
   */
  @JsonIgnore
  public String getActualExternalUnit() {
    return externalUnit == null ? internalUnit : externalUnit;
  }

  /**
   * True if showing values of this variable requires a unit conversion.
   */
  @JsonIgnore
  public boolean hasUnitConversion() {
    return !Objects.equals(getActualExternalUnit(), internalUnit);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    VariableDefinition that = (VariableDefinition) o;

    if (!symbol.equals(that.symbol)) return false;
    if (dependency != that.dependency) return false;
    if (!Objects.equals(internalUnit, that.internalUnit)) return false;
    return Objects.equals(externalUnit, that.externalUnit);
  }

  @Override
  public int hashCode() {
    int result = symbol.hashCode();
    result = 31 * result + dependency.hashCode();
    result = 31 * result + (internalUnit != null ? internalUnit.hashCode() : 0);
    result = 31 * result + (externalUnit != null ? externalUnit.hashCode() : 0);
    return result;
  }

  @Override
  public String toString() {
    return String.format("%s[%s, %s]", symbol, dependency, getActualExternalUnit());
  }
}
