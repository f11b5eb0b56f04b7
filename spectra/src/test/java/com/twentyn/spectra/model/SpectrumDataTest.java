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
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class SpectrumDataTest {
  private static final double DELTA = 1e-9;

  private SpectrumData data;

  @Before
  public void setUp() throws Exception {
    data = new SpectrumData(Arrays.asList(
        VariableDefinition.independent("x", "s"),
        VariableDefinition.dependent("y", "arbitrary"),
        VariableDefinition.dependent("z", "arbitrary")));
  }

  @Test
  public void testSingleSectionDelegation() throws Exception {
    assertNull("No section yet", data.getActiveSection());
    assertTrue(data.isEmpty());

    data.setMode(DataMode.CONTINUOUS);
    data.appendItem(ItemInput.of(0, 0, 1));
    data.appendItem(ItemInput.of(2, 20, 1));
    assertEquals("Appending creates a section on demand", 1, data.getSectionCount());
    assertSame(data.getSectionAt(0), data.getActiveSection());
    assertEquals(2, data.getItemCount());
    assertFalse(data.isEmpty());

    assertArrayEquals(new double[]{1, 10, 1}, data.valueAt(1.0).get(), DELTA);
    assertEquals(new ValueRange(0, 20), data.getDataRange("y", DataQueryOptions.defaults()));
    assertEquals(10.0, data.calcDataAverage("y", DataQueryOptions.defaults()), DELTA);
  }

  @Test
  public void testActiveSection() throws Exception {
    DataSection first = data.createSection(DataMode.CONTINUOUS);
    data.setActiveSectionIndex(0);
    DataSection second = data.createSection(Arrays.asList("x", "y"), DataMode.PEAK);
    assertEquals("Sections get distinct names", "section1", second.getName());
    assertSame(first, data.getActiveSection());

    data.setActiveSection(second);
    assertSame(second, data.getActiveSection());
    assertEquals(DataMode.PEAK, data.getMode());
    data.appendItem(ItemInput.of(1, 2));
    assertEquals(1, second.getItemCount());
    assertEquals(0, first.getItemCount());

    data.removeSection(second);
    assertSame("The lone remaining section is active", first, data.getActiveSection());
    assertNull("Removed sections are standalone", second.getParent());

    try {
      data.setActiveSectionIndex(3);
      fail("Unknown section index");
    } catch (SpectrumConfigurationException e) {
      // Expected.
    }
  }

  @Test
  public void testVariables() throws Exception {
    assertEquals(Arrays.asList("x", "y", "z"), data.getVarSymbols());
    assertEquals(2, data.getVariables(VarDependency.DEPENDENT).size());
    try {
      data.appendVariable(VariableDefinition.dependent("y", "counts"));
      fail("Duplicate symbols are rejected");
    } catch (SpectrumConfigurationException e) {
      // Expected.
    }

    data.insertVariableAt(VariableDefinition.dependent("w", "counts"), 1);
    assertEquals(Arrays.asList("x", "w", "y", "z"), data.getVarSymbols());

    data.createSection(Arrays.asList("x", "y"), DataMode.PEAK);
    data.removeVariable("w");
    try {
      data.removeVariable("y");
      fail("Variables in use cannot be removed");
    } catch (SpectrumConfigurationException e) {
      // Expected.
    }
    try {
      data.createSection(Arrays.asList("x", "q"), DataMode.PEAK);
      fail("Sections can only use dataset variables");
    } catch (SpectrumConfigurationException e) {
      // Expected.
    }
  }

  @Test
  public void testParameters() throws Exception {
    assertFalse(data.getParameter(SpectrumParameter.OBSERVE_FREQUENCY).isPresent());
    Spectrum spectrum = new Spectrum(SpectrumType.NMR, data);
    spectrum.setObserveFrequency(400.0, "MHz");
    assertEquals(new SpectrumParameter(400.0, "MHz"), data.getParameter(SpectrumParameter.OBSERVE_FREQUENCY).get());
    data.setParameter(SpectrumParameter.OBSERVE_FREQUENCY, null);
    assertFalse(data.getParameter(SpectrumParameter.OBSERVE_FREQUENCY).isPresent());
    assertTrue(spectrum.isEmpty());
  }

  @Test
  public void testRangesOfSeveralSections() throws Exception {
    DataSection curve = data.createSection(DataMode.CONTINUOUS);
    curve.appendItem(0, 1, 5);
    curve.appendItem(10, 2, 6);
    DataSection peaks = data.createSection(Arrays.asList("x", "y"), DataMode.PEAK);
    peaks.appendItem(20, 3);
    peaks.setDisplayRange("x", new ValueRange(-5, 30));

    Map<String, ValueRange> ranges = data.calcDataRangeOfSections(null, null, DataQueryOptions.defaults());
    assertEquals(new ValueRange(0, 20), ranges.get("x"));
    assertEquals("Peak roots extend the peak range", new ValueRange(0, 3), ranges.get("y"));
    assertEquals(new ValueRange(5, 6), ranges.get("z"));

    Map<String, ValueRange> onlyZ = data.calcDataRangeOfSections(null, Collections.singletonList("z"),
        DataQueryOptions.defaults());
    assertEquals("Sections without the variable are skipped", 1, onlyZ.size());

    Map<String, ValueRange> display = data.getDisplayRangeOfSections(null, Collections.singletonList("x"), true);
    assertEquals(new ValueRange(-5, 30), display.get("x"));
  }

  @Test
  public void testListenersSeeEverySection() throws Exception {
    DataChangeListener listener = mock(DataChangeListener.class);
    data.addDataChangeListener(listener);
    DataSection first = data.createSection(DataMode.CONTINUOUS);
    DataSection second = data.createSection(DataMode.PEAK);
    first.appendItem(0, 0, 0);
    second.appendItem(0, 0, 0);
    verify(listener, times(2)).onDataChanged(any());

    data.removeSection(second);
    second.appendItem(1, 1, 1);
    verify(listener, times(2)).onDataChanged(any());

    data.removeDataChangeListener(listener);
    first.appendItem(1, 1, 1);
    verify(listener, times(2)).onDataChanged(any());
  }

  @Test
  public void testMergeDataRange() throws Exception {
    Map<String, ValueRange> r1 = Collections.singletonMap("x", new ValueRange(1, 2));
    Map<String, ValueRange> r2 = new LinkedHashMap<>();
    r2.put("x", new ValueRange(0, 1.5));
    r2.put("z", new ValueRange(-1, 0));
    Map<String, ValueRange> r3 = new LinkedHashMap<>();
    r3.put("x", new ValueRange(0.5, 3));
    r3.put("y", new ValueRange(0, 1));

    Map<String, ValueRange> r12 = SpectrumUtils.mergeDataRange(r1, r2);
    assertEquals(new ValueRange(0, 2), r12.get("x"));
    assertEquals(new ValueRange(-1, 0), r12.get("z"));

    Map<String, ValueRange> r13 = SpectrumUtils.mergeDataRange(r1, r3);
    assertEquals(new ValueRange(0.5, 3), r13.get("x"));
    assertEquals(new ValueRange(0, 1), r13.get("y"));

    Map<String, ValueRange> r23 = SpectrumUtils.mergeDataRange(r2, r3);
    assertEquals(3, r23.size());
    assertEquals(new ValueRange(0, 3), r23.get("x"));
    assertEquals("Inputs are not modified", new ValueRange(1, 2), r1.get("x"));
  }
}
