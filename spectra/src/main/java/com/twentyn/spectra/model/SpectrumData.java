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
import com.twentyn.spectra.units.UnitConversionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.ObjIntConsumer;

/**
 * The data of a spectrum: the canonical list of variables, the sections holding the items, and the measurement
 * parameters converters may need (e.g. {@link SpectrumParameter#OBSERVE_FREQUENCY}).
 *
 * Most spectra hold one section.  The single-section operations here (appendItem, getItemAt, ...) work on the
 * active section, which is created on demand when the dataset has none.
 */
public class SpectrumData {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumData.class);

  private final List<VariableDefinition> variables = new ArrayList<>();
  private final List<DataSection> sections = new ArrayList<>();
  private final Map<String, SpectrumParameter> parameters = new LinkedHashMap<>();
  private final List<DataChangeListener> listeners = new ArrayList<>();
  // Forwards the events of every owned section to the dataset listeners.
  private final DataChangeListener sectionForwarder = this::fireDataChanged;

  private int activeSectionIndex = 0;
  private DataMode defaultMode = DataMode.CONTINUOUS;
  private UnitConversionRegistry unitConversionRegistry;

  public SpectrumData() {
    this(Collections.emptyList());
  }

  public SpectrumData(List<VariableDefinition> variables) {
    this(variables, UnitConversionRegistry.createDefault());
  }

  public SpectrumData(List<VariableDefinition> variables, UnitConversionRegistry registry) {
    for (VariableDefinition varDef : variables) {
      appendVariable(varDef);
    }
    this.unitConversionRegistry = registry;
  }

  public UnitConversionRegistry getUnitConversionRegistry() {
    return unitConversionRegistry;
  }

  public void setUnitConversionRegistry(UnitConversionRegistry unitConversionRegistry) {
    this.unitConversionRegistry = unitConversionRegistry;
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Variables.
   */

  public List<VariableDefinition> getVariables() {
    return Collections.unmodifiableList(variables);
  }

  public int getVariableCount() {
    return variables.size();
  }

  public List<String> getVarSymbols() {
    List<String> result = new ArrayList<>(variables.size());
    for (VariableDefinition varDef : variables) {
      result.add(varDef.getSymbol());
    }
    return result;
  }

  /**
   * @throws SpectrumConfigurationException if no variable has this symbol.
   */
  public VariableDefinition getVariable(String symbol) {
    int index = indexOfVariable(symbol);
    if (index < 0) {
      throw new SpectrumConfigurationException("Unknown variable '%s', dataset variables are %s",
          symbol, getVarSymbols());
    }
    return variables.get(index);
  }

  public VariableDefinition getVariable(int index) {
    return variables.get(index);
  }

  public int indexOfVariable(String symbol) {
    for (int i = 0; i < variables.size(); i++) {
      if (variables.get(i).getSymbol().equals(symbol)) {
        return i;
      }
    }
    return -1;
  }

  public List<VariableDefinition> getVariables(VarDependency dependency) {
    List<VariableDefinition> result = new ArrayList<>();
    for (VariableDefinition varDef : variables) {
      if (varDef.getDependency() == dependency) {
        result.add(varDef);
      }
    }
    return result;
  }

  public void appendVariable(VariableDefinition varDef) {
    insertVariableAt(varDef, -1);
  }

  /**
   * Insert a variable definition at index; a negative index appends it.
   */
  public void insertVariableAt(VariableDefinition varDef, int index) {
    if (indexOfVariable(varDef.getSymbol()) >= 0) {
      throw new SpectrumConfigurationException("Variable '%s' already exists", varDef.getSymbol());
    }
    if (index < 0 || index >= variables.size()) {
      variables.add(varDef);
    } else {
      variables.add(index, varDef);
    }
  }

  /**
   * Remove a variable that no section uses.
   */
  public void removeVariable(String symbol) {
    VariableDefinition varDef = getVariable(symbol);
    for (DataSection section : sections) {
      if (section.indexOfLocalVariable(symbol) >= 0) {
        throw new SpectrumConfigurationException("Variable '%s' is still used by section %s",
            symbol, section.getName());
      }
    }
    variables.remove(varDef);
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Parameters.
   */

  public Optional<SpectrumParameter> getParameter(String key) {
    return Optional.ofNullable(parameters.get(key));
  }

  public void setParameter(String key, Double value, String unit) {
    setParameter(key, new SpectrumParameter(value, unit));
  }

  public void setParameter(String key, SpectrumParameter parameter) {
    if (parameter == null) {
      parameters.remove(key);
    } else {
      parameters.put(key, parameter);
    }
  }

  public Map<String, SpectrumParameter> getParameters() {
    return Collections.unmodifiableMap(parameters);
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Sections.
   */

  public DataMode getDefaultMode() {
    return defaultMode;
  }

  /**
   * The mode of sections created on demand by the single-section operations.
   */
  public void setDefaultMode(DataMode defaultMode) {
    this.defaultMode = defaultMode;
  }

  /**
   * Create and append a section using some of the dataset's variables.
   * @param symbols The local variables of the section in item order; all dataset variables if null or empty.
   * @param mode The section mode.
   * @throws SpectrumConfigurationException if a symbol is not a variable of this dataset.
   */
  public DataSection createSection(List<String> symbols, DataMode mode) {
    List<String> targets = symbols == null || symbols.isEmpty() ? getVarSymbols() : symbols;
    List<VariableDefinition> localVariables = new ArrayList<>(targets.size());
    for (String symbol : targets) {
      localVariables.add(getVariable(symbol));
    }
    DataSection section = new DataSection(nextSectionName(), mode, localVariables, this);
    sections.add(section);
    section.addDataChangeListener(sectionForwarder);
    LOGGER.debug("Created %s section %s with variables %s", section.getMode(), section.getName(), targets);
    return section;
  }

  public DataSection createSection(DataMode mode) {
    return createSection(null, mode);
  }

  private String nextSectionName() {
    Set<String> used = new HashSet<>();
    for (DataSection section : sections) {
      used.add(section.getName());
    }
    int i = sections.size();
    while (used.contains("section" + i)) {
      i++;
    }
    return "section" + i;
  }

  public int getSectionCount() {
    return sections.size();
  }

  public List<DataSection> getSections() {
    return Collections.unmodifiableList(sections);
  }

  public DataSection getSectionAt(int index) {
    if (index < 0 || index >= sections.size()) {
      throw new SpectrumConfigurationException("Section index %d out of bounds for %d sections",
          index, sections.size());
    }
    return sections.get(index);
  }

  public int indexOfSection(DataSection section) {
    return sections.indexOf(section);
  }

  public boolean hasSection(DataSection section) {
    return sections.contains(section);
  }

  /**
   * Remove a section; it becomes standalone and stops forwarding events to this dataset.
   */
  public void removeSection(DataSection section) {
    int index = sections.indexOf(section);
    if (index < 0) {
      throw new SpectrumConfigurationException("Section %s does not belong to this dataset", section.getName());
    }
    sections.remove(index);
    section.removeDataChangeListener(sectionForwarder);
    section.detachFromParent();
    if (activeSectionIndex > index || activeSectionIndex >= sections.size()) {
      activeSectionIndex = Math.max(0, activeSectionIndex - 1);
    }
  }

  public void clearSections() {
    for (DataSection section : new ArrayList<>(sections)) {
      removeSection(section);
    }
    activeSectionIndex = 0;
  }

  public int getActiveSectionIndex() {
    return sections.size() == 1 ? 0 : activeSectionIndex;
  }

  public void setActiveSectionIndex(int index) {
    getSectionAt(index);
    this.activeSectionIndex = index;
  }

  public void setActiveSection(DataSection section) {
    int index = sections.indexOf(section);
    if (index < 0) {
      throw new SpectrumConfigurationException("Section %s does not belong to this dataset", section.getName());
    }
    this.activeSectionIndex = index;
  }

  /**
   * Return the active section.  A lone section is always active.
   * @return The active section, or null if the dataset has no section.
   */
  public DataSection getActiveSection() {
    if (sections.isEmpty()) {
      return null;
    }
    return sections.get(getActiveSectionIndex());
  }

  /**
   * Return the active section, creating one over all variables in the default mode if there is none.
   */
  public DataSection getActiveSection(boolean autoCreate) {
    DataSection section = getActiveSection();
    if (section == null && autoCreate) {
      section = createSection(defaultMode);
    }
    return section;
  }

  private DataSection requireActiveSection() {
    DataSection section = getActiveSection();
    if (section == null) {
      throw new SpectrumConfigurationException("Dataset has no section");
    }
    return section;
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Single-section operations, delegated to the active section.
   */

  public DataMode getMode() {
    DataSection section = getActiveSection();
    return section == null ? defaultMode : section.getMode();
  }

  public void setMode(DataMode mode) {
    DataSection section = getActiveSection();
    if (section == null) {
      defaultMode = mode;
    } else {
      section.setMode(mode);
    }
  }

  public double[] appendItem(ItemInput input) {
    return getActiveSection(true).appendItem(input);
  }

  public double[] appendItem(ItemInput input, ExtraInfo extraInfo) {
    return getActiveSection(true).appendItem(input, extraInfo);
  }

  public double[] insertItemAt(int index, ItemInput input) {
    return getActiveSection(true).insertItemAt(index, input);
  }

  public double[] setItemAt(int index, ItemInput input) {
    return requireActiveSection().setItemAt(index, input);
  }

  public double[] removeItemAt(int index) {
    return requireActiveSection().removeItemAt(index);
  }

  public double[] getItemAt(int index) {
    return requireActiveSection().getItemAt(index);
  }

  public double[] getRawItemAt(int index) {
    return requireActiveSection().getRawItemAt(index);
  }

  public Map<String, Double> getHashValueAt(int index) {
    return requireActiveSection().getHashValueAt(index);
  }

  public int getItemCount() {
    DataSection section = getActiveSection();
    return section == null ? 0 : section.getItemCount();
  }

  public boolean isEmpty() {
    for (DataSection section : sections) {
      if (!section.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  public ExtraInfo getExtraInfoAt(int index) {
    return requireActiveSection().getExtraInfoAt(index);
  }

  public void setExtraInfoAt(int index, ExtraInfo extraInfo) {
    requireActiveSection().setExtraInfoAt(index, extraInfo);
  }

  public void sort(Comparator<double[]> comparator) {
    requireActiveSection().sort(comparator);
  }

  public void sort() {
    sort(null);
  }

  public void clear() {
    DataSection section = getActiveSection();
    if (section != null) {
      section.clear();
    }
  }

  public DataItemIterator iterator() {
    return requireActiveSection().iterator();
  }

  public void forEach(ObjIntConsumer<double[]> visitor, boolean substituteOmitted) {
    requireActiveSection().forEach(visitor, substituteOmitted);
  }

  public void setContinuousVarRange(String symbol, double fromValue, double toValue) {
    getActiveSection(true).setContinuousVarRange(symbol, fromValue, toValue);
  }

  public void setDefaultVarValue(String symbol, double value) {
    getActiveSection(true).setDefaultVarValue(symbol, value);
  }

  public void setPeakRootValue(String symbol, double value) {
    getActiveSection(true).setPeakRootValue(symbol, value);
  }

  public ValueRange getDataRange(String symbol, DataQueryOptions options) {
    return requireActiveSection().getDataRange(symbol, options);
  }

  public Double calcDataAverage(String symbol, DataQueryOptions options) {
    return requireActiveSection().calcDataAverage(symbol, options);
  }

  public Optional<double[]> getDataValueFromIndependent(Map<String, Double> independentValues,
                                                        DataQueryOptions options) {
    return requireActiveSection().getDataValueFromIndependent(independentValues, options);
  }

  public Optional<double[]> valueAt(double independentValue) {
    return requireActiveSection().valueAt(independentValue);
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Ranges over several sections.
   */

  /**
   * Merge the data ranges of the given sections.
   * @param sections The sections to cover; all sections if null.
   * @param symbols The variables to cover; every variable if null or empty.  Sections without a variable are
   *                skipped for it.
   */
  public Map<String, ValueRange> calcDataRangeOfSections(List<DataSection> sections, List<String> symbols,
                                                         DataQueryOptions options) {
    Map<String, ValueRange> result = new LinkedHashMap<>();
    for (DataSection section : sections == null ? this.sections : sections) {
      List<String> local = localSymbolsOf(section, symbols);
      if (!local.isEmpty()) {
        result = SpectrumUtils.mergeDataRange(result, section.calcDataRange(local, options));
      }
    }
    return result;
  }

  /**
   * Merge the display ranges (explicit overrides, or data ranges if autoCalc is set) of the given sections.
   */
  public Map<String, ValueRange> getDisplayRangeOfSections(List<DataSection> sections, List<String> symbols,
                                                           boolean autoCalc) {
    Map<String, ValueRange> result = new LinkedHashMap<>();
    for (DataSection section : sections == null ? this.sections : sections) {
      result = SpectrumUtils.mergeDataRange(result, getDisplayRangeOfSection(section, symbols, autoCalc));
    }
    return result;
  }

  public Map<String, ValueRange> getDisplayRangeOfSection(DataSection section, List<String> symbols,
                                                          boolean autoCalc) {
    Map<String, ValueRange> result = new LinkedHashMap<>();
    for (String symbol : localSymbolsOf(section, symbols)) {
      ValueRange range = section.getDisplayRange(symbol, autoCalc);
      if (range != null) {
        result.put(symbol, range);
      }
    }
    return result;
  }

  private List<String> localSymbolsOf(DataSection section, List<String> symbols) {
    if (symbols == null || symbols.isEmpty()) {
      return section.getLocalVarSymbols();
    }
    List<String> result = new ArrayList<>();
    for (String symbol : symbols) {
      getVariable(symbol);
      if (section.indexOfLocalVariable(symbol) >= 0) {
        result.add(symbol);
      }
    }
    return result;
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Listeners.
   */

  /**
   * Listen to the mutations of every section of this dataset, including sections created later.
   */
  public void addDataChangeListener(DataChangeListener listener) {
    if (!listeners.contains(listener)) {
      listeners.add(listener);
    }
  }

  public void removeDataChangeListener(DataChangeListener listener) {
    listeners.remove(listener);
  }

  private void fireDataChanged(DataChangeEvent event) {
    for (DataChangeListener listener : new ArrayList<>(listeners)) {
      listener.onDataChanged(event);
    }
  }
}
