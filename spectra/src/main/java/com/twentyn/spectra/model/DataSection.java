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
import com.twentyn.spectra.lookup.ContinuousInterpolator;
import com.twentyn.spectra.lookup.IndependentRangeResult;
import com.twentyn.spectra.lookup.PeakLocator;
import com.twentyn.spectra.units.UnitConversionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.joda.time.DateTime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.ObjIntConsumer;

/**
 * An ordered sequence of data items that share one list of local variables.  Each item is a double[] with one slot
 * per local variable; NaN marks an omitted value that is filled in on read (see {@link #getItemAt(int)}).
 *
 * A section is either a sampled curve ({@link DataMode#CONTINUOUS}) or a peak table ({@link DataMode#PEAK}); the
 * mode decides how values are looked up from independent coordinates.  Range and average queries are cached and the
 * cache is dropped by every mutation.
 *
 * Sections are not thread-safe: hosts that share one between threads must guard it externally.
 */
public class DataSection implements Iterable<double[]> {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DataSection.class);

  /* The relative error within which two values are considered equal, both for peak matching and for comparing
   * sections. */
  public static final double DEFAULT_TOLERANCE = 5e-8;

  private String name;
  private String title;
  private DataMode mode;
  private SpectrumData parent;

  private final List<VariableDefinition> localVariables;
  private final List<String> localSymbols;

  // Items and their extra info are kept in parallel: extraInfos.get(i) belongs to dataItems.get(i) (or is null).
  private final List<double[]> dataItems = new ArrayList<>();
  private final List<ExtraInfo> extraInfos = new ArrayList<>();

  private final Map<String, Double> peakRootValues = new HashMap<>();
  private final Map<String, ContinuousRange> continuousRanges = new HashMap<>();
  private final Map<String, Double> defaultValues = new HashMap<>();
  private final Map<String, ValueRange> displayRanges = new HashMap<>();

  private boolean sorted = true;
  private Comparator<double[]> sortComparator;
  private double peakMatchTolerance = DEFAULT_TOLERANCE;
  private DateTime lastModified = DateTime.now();
  // Bumped on every mutation so that iterators can detect changes under their feet.
  private int modificationCount = 0;

  private UnitConversionRegistry ownRegistry;
  private final SectionStatsCache statsCache = new SectionStatsCache();
  private final List<DataChangeListener> listeners = new ArrayList<>();

  /**
   * Create a standalone section.
   * @param name The name of the section.
   * @param mode Continuous curve or peak table.
   * @param localVariables The variables of every item, in item order.  Symbols must be unique.
   */
  public DataSection(String name, DataMode mode, List<VariableDefinition> localVariables) {
    this(name, mode, localVariables, null);
  }

  DataSection(String name, DataMode mode, List<VariableDefinition> localVariables, SpectrumData parent) {
    if (localVariables == null || localVariables.isEmpty()) {
      throw new SpectrumConfigurationException("A data section needs at least one variable");
    }
    Set<String> seen = new HashSet<>();
    List<String> symbols = new ArrayList<>(localVariables.size());
    for (VariableDefinition varDef : localVariables) {
      if (!seen.add(varDef.getSymbol())) {
        throw new SpectrumConfigurationException("Duplicate variable symbol '%s' in section %s",
            varDef.getSymbol(), name);
      }
      symbols.add(varDef.getSymbol());
    }
    this.name = name;
    this.mode = mode == null ? DataMode.CONTINUOUS : mode;
    this.localVariables = Collections.unmodifiableList(new ArrayList<>(localVariables));
    this.localSymbols = Collections.unmodifiableList(symbols);
    this.parent = parent;
    this.sortComparator = defaultItemComparator();
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Basic properties.
   */

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public DataMode getMode() {
    return mode;
  }

  public void setMode(DataMode mode) {
    if (mode == null || mode == this.mode) {
      return;
    }
    this.mode = mode;
    settingsChanged();
  }

  /**
   * The dataset this section belongs to, or null for a standalone section.
   */
  public SpectrumData getParent() {
    return parent;
  }

  void detachFromParent() {
    this.parent = null;
  }

  public double getPeakMatchTolerance() {
    return peakMatchTolerance;
  }

  public void setPeakMatchTolerance(double peakMatchTolerance) {
    if (peakMatchTolerance < 0) {
      throw new IllegalArgumentException("Peak match tolerance must not be negative");
    }
    this.peakMatchTolerance = peakMatchTolerance;
    lookupSettingsChanged();
  }

  public DateTime getLastModified() {
    return lastModified;
  }

  /**
   * The registry used to convert between internal and external units: the parent dataset's registry, or a default
   * one for standalone sections.
   */
  public UnitConversionRegistry getUnitConversionRegistry() {
    if (parent != null) {
      return parent.getUnitConversionRegistry();
    }
    if (ownRegistry == null) {
      ownRegistry = UnitConversionRegistry.createDefault();
    }
    return ownRegistry;
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Variables.
   */

  public List<VariableDefinition> getLocalVariables() {
    return localVariables;
  }

  public List<String> getLocalVarSymbols() {
    return localSymbols;
  }

  public int getLocalVariableCount() {
    return localVariables.size();
  }

  /**
   * Return the position of a variable in this section's items, or -1 if the section does not have it.
   */
  public int indexOfLocalVariable(String symbol) {
    return localSymbols.indexOf(symbol);
  }

  /**
   * Return a local variable by symbol.
   * @throws SpectrumConfigurationException if the section does not have a variable with that symbol.
   */
  public VariableDefinition getLocalVariable(String symbol) {
    return localVariables.get(requireVarIndex(symbol));
  }

  public List<VariableDefinition> getLocalVariables(VarDependency dependency) {
    List<VariableDefinition> result = new ArrayList<>();
    for (VariableDefinition varDef : localVariables) {
      if (varDef.getDependency() == dependency) {
        result.add(varDef);
      }
    }
    return result;
  }

  /**
   * Return the first independent local variable, which is the axis continuous lookups work on.
   */
  public VariableDefinition getPrimaryIndependentVariable() {
    for (VariableDefinition varDef : localVariables) {
      if (varDef.isIndependent()) {
        return varDef;
      }
    }
    throw new SpectrumConfigurationException("Section %s has no independent variable", name);
  }

  int requireVarIndex(String symbol) {
    int index = localSymbols.indexOf(symbol);
    if (index < 0) {
      throw new SpectrumConfigurationException("Unknown variable '%s' in section %s, local variables are %s",
          symbol, name, localSymbols);
    }
    return index;
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Section level settings used to fill in omitted values.
   */

  /**
   * Declare a variable as evenly spaced between fromValue (first item) and toValue (last item).  Only used in
   * continuous mode.
   */
  public void setContinuousVarRange(String symbol, double fromValue, double toValue) {
    requireVarIndex(symbol);
    continuousRanges.put(symbol, new ContinuousRange(fromValue, toValue));
    settingsChanged();
  }

  public void clearContinuousVarRange(String symbol) {
    if (continuousRanges.remove(symbol) != null) {
      settingsChanged();
    }
  }

  /**
   * Return the continuous range of a variable, or null if it has none or the section is not continuous.
   */
  public ContinuousRange getContinuousVarRange(String symbol) {
    return mode == DataMode.CONTINUOUS ? continuousRanges.get(symbol) : null;
  }

  public void setDefaultVarValue(String symbol, double value) {
    requireVarIndex(symbol);
    defaultValues.put(symbol, value);
    settingsChanged();
  }

  public Double getDefaultVarValue(String symbol) {
    return defaultValues.get(symbol);
  }

  /**
   * Set the root value of a variable in a peak table, e.g. the baseline intensity peaks rise from.
   */
  public void setPeakRootValue(String symbol, double value) {
    requireVarIndex(symbol);
    peakRootValues.put(symbol, value);
    settingsChanged();
  }

  /**
   * Return the root value of a variable; 0 unless one was set.
   */
  public double getPeakRootValue(String symbol) {
    Double v = peakRootValues.get(symbol);
    return v == null ? 0.0 : v;
  }

  public Map<String, Double> getPeakRootValues() {
    return Collections.unmodifiableMap(peakRootValues);
  }

  public Map<String, ContinuousRange> getContinuousVarRanges() {
    return Collections.unmodifiableMap(continuousRanges);
  }

  public Map<String, Double> getDefaultVarValues() {
    return Collections.unmodifiableMap(defaultValues);
  }

  /**
   * Override the automatically computed display range of a variable.  A null range removes the override.
   */
  public void setDisplayRange(String symbol, ValueRange range) {
    requireVarIndex(symbol);
    if (range == null) {
      displayRanges.remove(symbol);
    } else {
      displayRanges.put(symbol, range);
    }
    lookupSettingsChanged();
  }

  public Map<String, ValueRange> getDisplayRanges() {
    return Collections.unmodifiableMap(displayRanges);
  }

  /**
   * Return the explicit display range of a variable, or (if autoCalc is set) its data range.
   * @return The range, or null if there is no override and autoCalc is off or the section holds no value.
   */
  public ValueRange getDisplayRange(String symbol, boolean autoCalc) {
    requireVarIndex(symbol);
    ValueRange explicit = displayRanges.get(symbol);
    if (explicit != null || !autoCalc) {
      return explicit;
    }
    return getDataRange(symbol, DataQueryOptions.defaults());
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Item access.
   */

  public int getItemCount() {
    return dataItems.size();
  }

  public boolean isEmpty() {
    return dataItems.isEmpty();
  }

  /**
   * Return a copy of the item at index with omitted values filled in.  An omitted value is taken, in order, from
   * the variable's continuous range (continuous mode only), its default value, or its peak root value (peak mode
   * only); if none applies it stays NaN.
   */
  public double[] getItemAt(int index) {
    checkIndex(index);
    double[] raw = dataItems.get(index);
    double[] result = Arrays.copyOf(raw, raw.length);
    for (int i = 0; i < result.length; i++) {
      if (Double.isNaN(result[i])) {
        result[i] = substituteOmitted(index, i);
      }
    }
    return result;
  }

  /**
   * Return a copy of the item at index exactly as stored, omitted values included.
   */
  public double[] getRawItemAt(int index) {
    checkIndex(index);
    double[] raw = dataItems.get(index);
    return Arrays.copyOf(raw, raw.length);
  }

  /**
   * Return one (substituted) value of the item at index.
   */
  public double getValueAt(int index, int varIndex) {
    checkIndex(index);
    double v = dataItems.get(index)[varIndex];
    return Double.isNaN(v) ? substituteOmitted(index, varIndex) : v;
  }

  public double getValueAt(int index, String symbol) {
    return getValueAt(index, requireVarIndex(symbol));
  }

  /**
   * Return the item at index as a map from variable symbol to (substituted) value.
   */
  public Map<String, Double> getHashValueAt(int index) {
    double[] values = getItemAt(index);
    Map<String, Double> result = new LinkedHashMap<>();
    for (int i = 0; i < values.length; i++) {
      result.put(localSymbols.get(i), values[i]);
    }
    return result;
  }

  /**
   * Return a copy of item with every dependent value replaced by that variable's peak root value: the point a peak
   * is drawn from.
   */
  public double[] getPeakRootValueOf(double[] item) {
    double[] result = Arrays.copyOf(item, item.length);
    for (int i = 0; i < localVariables.size(); i++) {
      VariableDefinition varDef = localVariables.get(i);
      if (!varDef.isIndependent()) {
        result[i] = getPeakRootValue(varDef.getSymbol());
      }
    }
    return result;
  }

  private double substituteOmitted(int index, int varIndex) {
    String symbol = localSymbols.get(varIndex);
    if (mode == DataMode.CONTINUOUS) {
      ContinuousRange range = continuousRanges.get(symbol);
      if (range != null) {
        return range.valueAt(index, dataItems.size());
      }
    }
    Double defaultValue = defaultValues.get(symbol);
    if (defaultValue != null) {
      return defaultValue;
    }
    if (mode == DataMode.PEAK) {
      Double root = peakRootValues.get(symbol);
      if (root != null) {
        return root;
      }
    }
    return Double.NaN;
  }

  public ExtraInfo getExtraInfoAt(int index) {
    checkIndex(index);
    return extraInfos.get(index);
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Mutation.  Each method validates its input before touching any state, so a failed call leaves the section as it
   * was.
   */

  public double[] appendItem(ItemInput input) {
    return appendItem(input, null);
  }

  /**
   * Append an item (and optionally its extra info) at the end of the section.
   * @return A copy of the stored (raw) item.
   * @throws SpectrumConfigurationException if the input does not fit the local variables.
   */
  public double[] appendItem(ItemInput input, ExtraInfo extraInfo) {
    double[] item = input.resolve(localSymbols);
    boolean wasSorted = isSorted();
    dataItems.add(item);
    extraInfos.add(extraInfo);
    int index = dataItems.size() - 1;

    boolean keepsOrder = wasSorted &&
        (index == 0 || sortComparator.compare(getItemAt(index - 1), getItemAt(index)) <= 0);
    itemsChanged(keepsOrder);
    fireDataChanged(DataChangeEvent.Type.APPEND, index, item);
    return Arrays.copyOf(item, item.length);
  }

  public double[] appendItem(double... values) {
    return appendItem(ItemInput.of(values));
  }

  public double[] appendItem(Map<String, Double> values) {
    return appendItem(ItemInput.of(values));
  }

  public double[] insertItemAt(int index, ItemInput input) {
    return insertItemAt(index, input, null);
  }

  public double[] insertItemAt(int index, ItemInput input, ExtraInfo extraInfo) {
    if (index < 0 || index > dataItems.size()) {
      throw new SpectrumConfigurationException("Cannot insert at %d in section %s of %d items",
          index, name, dataItems.size());
    }
    double[] item = input.resolve(localSymbols);
    dataItems.add(index, item);
    extraInfos.add(index, extraInfo);
    itemsChanged(false);
    fireDataChanged(DataChangeEvent.Type.INSERT, index, item);
    return Arrays.copyOf(item, item.length);
  }

  /**
   * Overwrite the item at index.  The extra info of the old item is dropped.
   */
  public double[] setItemAt(int index, ItemInput input) {
    return setItemAt(index, input, null);
  }

  public double[] setItemAt(int index, ItemInput input, ExtraInfo extraInfo) {
    checkIndex(index);
    double[] item = input.resolve(localSymbols);
    dataItems.set(index, item);
    extraInfos.set(index, extraInfo);
    itemsChanged(false);
    fireDataChanged(DataChangeEvent.Type.SET, index, item);
    return Arrays.copyOf(item, item.length);
  }

  /**
   * Remove the item at index together with its extra info.
   * @return The removed (raw) item.
   */
  public double[] removeItemAt(int index) {
    checkIndex(index);
    double[] removed = dataItems.remove(index);
    extraInfos.remove(index);
    // Removing from an ordered sequence leaves it ordered, unless positions define values (continuous ranges).
    itemsChanged(sorted && continuousRanges.isEmpty());
    fireDataChanged(DataChangeEvent.Type.REMOVE, index, removed);
    return removed;
  }

  public void clear() {
    if (dataItems.isEmpty()) {
      return;
    }
    dataItems.clear();
    extraInfos.clear();
    itemsChanged(true);
    fireDataChanged(new DataChangeEvent(this, DataChangeEvent.Type.CLEAR));
  }

  /**
   * Attach extra info to the item at index, replacing (and detaching) any previous one.  Null removes it.
   */
  public void setExtraInfoAt(int index, ExtraInfo extraInfo) {
    checkIndex(index);
    extraInfos.set(index, extraInfo);
    itemsChanged(false);
    fireDataChanged(DataChangeEvent.Type.EXTRA_INFO, index, dataItems.get(index));
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Ordering.
   */

  /**
   * True if the section has at most one item or its items are known to be ordered.
   */
  public boolean isSorted() {
    return sorted || dataItems.size() <= 1;
  }

  /**
   * Sort the items with the default order: independent variables first, then dependent ones, each compared
   * numerically with omitted values last.
   */
  public void sort() {
    sort(null);
  }

  /**
   * Stable-sort the items (with their extra info) by comparing their substituted values.  Does nothing if the
   * section is already sorted.  A section whose primary independent variable has a continuous range is ordered by
   * construction and is only marked sorted.
   * @param comparator The item order, or null for the default order.
   */
  public void sort(Comparator<double[]> comparator) {
    if (isSorted()) {
      return;
    }
    Comparator<double[]> order = comparator == null ? defaultItemComparator() : comparator;
    if (hasContinuousPrimaryAxis()) {
      sorted = true;
      sortComparator = order;
      return;
    }

    int count = dataItems.size();
    List<Integer> positions = new ArrayList<>(count);
    List<double[]> substituted = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      positions.add(i);
      substituted.add(getItemAt(i));
    }
    // List.sort is a stable merge sort.
    positions.sort((a, b) -> order.compare(substituted.get(a), substituted.get(b)));

    List<double[]> newItems = new ArrayList<>(count);
    List<ExtraInfo> newExtras = new ArrayList<>(count);
    for (Integer p : positions) {
      newItems.add(dataItems.get(p));
      newExtras.add(extraInfos.get(p));
    }
    dataItems.clear();
    dataItems.addAll(newItems);
    extraInfos.clear();
    extraInfos.addAll(newExtras);

    sortComparator = order;
    itemsChanged(true);
    LOGGER.debug("Sorted %d items of section %s", count, name);
    fireDataChanged(new DataChangeEvent(this, DataChangeEvent.Type.SORT));
  }

  private boolean hasContinuousPrimaryAxis() {
    for (VariableDefinition varDef : localVariables) {
      if (varDef.isIndependent()) {
        return getContinuousVarRange(varDef.getSymbol()) != null;
      }
    }
    return false;
  }

  private Comparator<double[]> defaultItemComparator() {
    List<Integer> order = new ArrayList<>(localVariables.size());
    for (int i = 0; i < localVariables.size(); i++) {
      if (localVariables.get(i).isIndependent()) {
        order.add(i);
      }
    }
    for (int i = 0; i < localVariables.size(); i++) {
      if (!localVariables.get(i).isIndependent()) {
        order.add(i);
      }
    }
    return (a, b) -> {
      for (Integer i : order) {
        // Double.compare puts NaN after every number.
        int c = Double.compare(a[i], b[i]);
        if (c != 0) {
          return c;
        }
      }
      return 0;
    };
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Iteration.
   */

  /**
   * Return a restartable iterator over the substituted items.
   */
  @Override
  public DataItemIterator iterator() {
    return new DataItemIterator(this, true);
  }

  public DataItemIterator iterator(boolean substituteOmitted) {
    return new DataItemIterator(this, substituteOmitted);
  }

  /**
   * Call visitor with every item and its index.
   * @param visitor Receives a copy of each item and its index.
   * @param substituteOmitted If false the raw items are visited.
   */
  public void forEach(ObjIntConsumer<double[]> visitor, boolean substituteOmitted) {
    DataItemIterator iter = iterator(substituteOmitted);
    while (iter.hasNext()) {
      int index = iter.nextIndex();
      visitor.accept(iter.next(), index);
    }
  }

  int getModificationCount() {
    return modificationCount;
  }

  boolean hasCachedStats() {
    return !statsCache.isEmpty();
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Ranges and averages.
   */

  /**
   * Return the [min, max] of each given variable over all items.
   * @param symbols The variables to compute; all local variables if empty.
   * @return A map from symbol to range; variables without any value are left out.
   */
  public Map<String, ValueRange> calcDataRange(List<String> symbols, DataQueryOptions options) {
    List<String> targets = symbols == null || symbols.isEmpty() ? localSymbols : symbols;
    Map<String, ValueRange> result = new LinkedHashMap<>();
    for (String symbol : targets) {
      ValueRange range = getDataRange(symbol, options);
      if (range != null) {
        result.put(symbol, range);
      }
    }
    return result;
  }

  public Map<String, ValueRange> calcDataRange(String... symbols) {
    return calcDataRange(Arrays.asList(symbols), DataQueryOptions.defaults());
  }

  /**
   * Return the [min, max] of one variable over all items, or null if no item has a value for it.  In peak mode the
   * root values of dependent variables are part of the range unless the options exclude them.
   */
  public ValueRange getDataRange(String symbol, DataQueryOptions options) {
    DataQueryOptions opts = options == null ? DataQueryOptions.defaults() : options;
    int varIndex = requireVarIndex(symbol);
    boolean includeRoot = mode == DataMode.PEAK && !opts.isExcludePeakRoot() &&
        !localVariables.get(varIndex).isIndependent();

    ValueRange range = statsCache.getRange(symbol, includeRoot);
    if (range == null) {
      range = DataRangeCalculator.calcRange(this, varIndex, includeRoot);
      if (range != null) {
        statsCache.putRange(symbol, includeRoot, range);
      }
    }
    if (range == null || !opts.isUseExternalUnit()) {
      return range;
    }
    VariableDefinition varDef = localVariables.get(varIndex);
    return ValueRange.between(toExternalValue(varDef, range.getMin()), toExternalValue(varDef, range.getMax()));
  }

  public ValueRange getDataRange(String symbol) {
    return getDataRange(symbol, DataQueryOptions.defaults());
  }

  /**
   * Return the mean of a variable's (substituted) values, or null if no item has a value for it.
   */
  public Double calcDataAverage(String symbol, DataQueryOptions options) {
    DataQueryOptions opts = options == null ? DataQueryOptions.defaults() : options;
    int varIndex = requireVarIndex(symbol);
    Double average = statsCache.getAverage(symbol);
    if (average == null) {
      average = DataRangeCalculator.calcAverage(this, varIndex);
      if (average != null) {
        statsCache.putAverage(symbol, average);
      }
    }
    if (average == null || !opts.isUseExternalUnit()) {
      return average;
    }
    return toExternalValue(localVariables.get(varIndex), average);
  }

  public Double calcDataAverage(String symbol) {
    return calcDataAverage(symbol, DataQueryOptions.defaults());
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Lookups from independent coordinates.
   */

  /**
   * Return the index of the item nearest to the given independent values, if it lies within the tolerance.
   * @param independentValues Values of (some of) the independent variables, in internal units.
   * @param tolerance Relative tolerance (fraction of each variable's data range), or null for the section default.
   * @return The item index, or -1 if no item matches.
   */
  public int findNearestItemIndex(Map<String, Double> independentValues, Double tolerance) {
    return PeakLocator.findNearestItemIndex(this, independentValues,
        tolerance == null ? peakMatchTolerance : tolerance);
  }

  /**
   * Compute the item at the given independent coordinates.  Continuous sections interpolate between the bracketing
   * items and return nothing outside their data; peak sections return the matching peak or, when none matches, the
   * peak root point at the queried coordinates.
   */
  public Optional<double[]> getDataValueFromIndependent(Map<String, Double> independentValues,
                                                        DataQueryOptions options) {
    DataQueryOptions opts = options == null ? DataQueryOptions.defaults() : options;
    Map<String, Double> query = opts.isUseExternalUnit() ? toInternalValues(independentValues) : independentValues;

    Optional<double[]> result;
    if (mode == DataMode.PEAK) {
      double tolerance = opts.getTolerance() == null ? peakMatchTolerance : opts.getTolerance();
      result = Optional.of(PeakLocator.getValueFromIndependent(this, query, tolerance));
    } else {
      result = ContinuousInterpolator.getValueFromIndependent(this, query);
    }
    return opts.isUseExternalUnit() ? result.map(this::toExternalItem) : result;
  }

  /**
   * Shortcut of {@link #getDataValueFromIndependent} for the primary independent variable, in internal units.
   */
  public Optional<double[]> valueAt(double independentValue) {
    return getDataValueFromIndependent(
        Collections.singletonMap(getPrimaryIndependentVariable().getSymbol(), independentValue),
        DataQueryOptions.defaults());
  }

  /**
   * Collect the items whose value of an independent variable lies in [from, to].  For continuous sections the result
   * also holds the values interpolated at both (clamped) ends of the range.
   */
  public IndependentRangeResult valueRangeFromIndependentRange(String symbol, double from, double to,
                                                               DataQueryOptions options) {
    DataQueryOptions opts = options == null ? DataQueryOptions.defaults() : options;
    VariableDefinition varDef = getLocalVariable(symbol);
    if (!varDef.isIndependent()) {
      throw new SpectrumConfigurationException("Variable '%s' of section %s is not independent", symbol, name);
    }
    double lo = from;
    double hi = to;
    if (opts.isUseExternalUnit()) {
      lo = toInternalValue(varDef, from);
      hi = toInternalValue(varDef, to);
    }
    if (lo > hi) {
      double t = lo;
      lo = hi;
      hi = t;
    }
    IndependentRangeResult result = mode == DataMode.PEAK ?
        PeakLocator.scanRange(this, symbol, lo, hi, opts.isReverseOrder(), opts.isRankByCenter()) :
        ContinuousInterpolator.valueRange(this, symbol, lo, hi);
    return opts.isUseExternalUnit() ? result.map(this::toExternalItem) : result;
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Unit conversion at the query boundary.
   */

  public double toExternalValue(VariableDefinition varDef, double value) {
    if (!varDef.hasUnitConversion() || Double.isNaN(value)) {
      return value;
    }
    return getUnitConversionRegistry().convert(value, varDef, varDef.getInternalUnit(),
        varDef.getActualExternalUnit(), this, parent);
  }

  public double toInternalValue(VariableDefinition varDef, double value) {
    if (!varDef.hasUnitConversion() || Double.isNaN(value)) {
      return value;
    }
    return getUnitConversionRegistry().convert(value, varDef, varDef.getActualExternalUnit(),
        varDef.getInternalUnit(), this, parent);
  }

  /**
   * Convert every value of an item (in local variable order) from internal to external units.
   */
  public double[] toExternalItem(double[] item) {
    double[] result = new double[item.length];
    for (int i = 0; i < item.length; i++) {
      result[i] = toExternalValue(localVariables.get(i), item[i]);
    }
    return result;
  }

  private Map<String, Double> toInternalValues(Map<String, Double> externalValues) {
    Map<String, Double> result = new LinkedHashMap<>();
    for (Map.Entry<String, Double> entry : externalValues.entrySet()) {
      VariableDefinition varDef = getLocalVariable(entry.getKey());
      result.put(entry.getKey(), toInternalValue(varDef, entry.getValue()));
    }
    return result;
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Listeners and mutation bookkeeping.
   */

  public void addDataChangeListener(DataChangeListener listener) {
    if (!listeners.contains(listener)) {
      listeners.add(listener);
    }
  }

  public void removeDataChangeListener(DataChangeListener listener) {
    listeners.remove(listener);
  }

  private void checkIndex(int index) {
    if (index < 0 || index >= dataItems.size()) {
      throw new SpectrumConfigurationException("Item index %d out of bounds for section %s of %d items",
          index, name, dataItems.size());
    }
  }

  private void itemsChanged(boolean orderPreserved) {
    sorted = orderPreserved;
    touch();
  }

  // Settings change how omitted values are filled in, which may reorder items.
  private void settingsChanged() {
    sorted = dataItems.size() <= 1;
    touch();
    fireDataChanged(new DataChangeEvent(this, DataChangeEvent.Type.SETTINGS));
  }

  // Settings that leave item values and order untouched; open iterators and cached stats stay valid.
  private void lookupSettingsChanged() {
    lastModified = DateTime.now();
    fireDataChanged(new DataChangeEvent(this, DataChangeEvent.Type.SETTINGS));
  }

  private void touch() {
    modificationCount++;
    lastModified = DateTime.now();
    statsCache.invalidate();
  }

  private void fireDataChanged(DataChangeEvent.Type type, int index, double[] item) {
    fireDataChanged(new DataChangeEvent(this, type, Collections.singletonList(index),
        Collections.singletonList(Arrays.copyOf(item, item.length))));
  }

  private void fireDataChanged(DataChangeEvent event) {
    // Copy, so listeners may unregister themselves while being notified.
    for (DataChangeListener listener : new ArrayList<>(listeners)) {
      listener.onDataChanged(event);
    }
  }

  @Override
  public String toString() {
    return String.format("DataSection{name=%s, mode=%s, variables=%s, items=%d}",
        name, mode, localSymbols, dataItems.size());
  }
}
