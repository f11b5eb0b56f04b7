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
import org.joda.time.DateTime;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class DataSectionTest {
  private static final double DELTA = 1e-9;

  private List<VariableDefinition> xyzdr;

  @Before
  public void setUp() throws Exception {
    xyzdr = Arrays.asList(
        VariableDefinition.independent("x", "unitX"),
        VariableDefinition.dependent("y", "unitY"),
        VariableDefinition.dependent("z", "unitZ"),
        VariableDefinition.dependent("d", "unitR"),
        VariableDefinition.dependent("r", "unitR")
    );
  }

  private static Map<String, Double> keyed(Object... symbolsAndValues) {
    Map<String, Double> result = new HashMap<>();
    for (int i = 0; i < symbolsAndValues.length; i += 2) {
      result.put((String) symbolsAndValues[i], ((Number) symbolsAndValues[i + 1]).doubleValue());
    }
    return result;
  }

  @Test
  public void testDefaultValuesSortingAndExtraInfo() throws Exception {
    DataSection section = new DataSection("peaks", DataMode.PEAK, xyzdr);
    section.setDefaultVarValue("d", 20);

    section.appendItem(ItemInput.of(keyed("x", 1, "y", 1, "z", 1, "r", -1)),
        new ExtraInfo().setDetail("extra1", "extra1Value0").setDetail("extra2", "extra2Value0"));
    section.appendItem(3, 3, 3, Double.NaN, -3);
    section.appendItem(2, 2, 2, Double.NaN, -2);
    section.appendItem(ItemInput.of(4, 4, 4, Double.NaN, -4), new ExtraInfo().setDetail("extra1", "extra1Value3"));
    assertFalse("Appending out of order clears the sorted flag", section.isSorted());

    section.sort();
    assertTrue("Section is sorted after sort()", section.isSorted());
    section.appendItem(ItemInput.of(keyed("x", 5, "y", 5, "z", 5, "r", -5)),
        new ExtraInfo().setDetail("extra1", "extra1Value4"));
    section.appendItem(ItemInput.of(keyed("x", 6, "y", 6, "z", 6, "r", -6)));
    assertTrue("Appending in order keeps the sorted flag", section.isSorted());
    section.setExtraInfoAt(1, new ExtraInfo().setDetail("extra2", "extra2Value1"));

    section.forEach((item, index) -> {
      double v = index + 1;
      assertArrayEquals(String.format("Item %d has the expected substituted values", index),
          new double[]{v, v, v, 20, -v}, item, DELTA);
    }, true);

    assertEquals("Extra info travels with its item on sort", "extra1Value0", section.getExtraInfoAt(0).getDetail("extra1"));
    assertEquals("Extra info travels with its item on sort", "extra2Value0", section.getExtraInfoAt(0).getDetail("extra2"));
    assertEquals("Extra info of the former fourth item is now at index 3", "extra1Value3",
        section.getExtraInfoAt(3).getDetail("extra1"));
    assertEquals("Replaced extra info", "extra2Value1", section.getExtraInfoAt(1).getDetail("extra2"));
    assertNull("Item without extra info", section.getExtraInfoAt(5));
    assertTrue("Raw item keeps the omitted value", Double.isNaN(section.getRawItemAt(2)[3]));
    assertEquals("Hash value is keyed by symbol", Double.valueOf(-5.0), section.getHashValueAt(4).get("r"));
  }

  @Test
  public void testContinuousRangeSubstitution() throws Exception {
    DataSection section = new DataSection("curve", DataMode.CONTINUOUS, Arrays.asList(
        VariableDefinition.independent("x", "unitX"),
        VariableDefinition.dependent("y", "unitY"),
        VariableDefinition.dependent("z", "unitZ"),
        VariableDefinition.dependent("d", "unitR")));
    assertTrue(section.isEmpty());
    section.setContinuousVarRange("x", 0, 10);
    section.setContinuousVarRange("z", 5, 0);
    section.setDefaultVarValue("d", 10);
    for (int i = 0; i <= 5; i++) {
      section.appendItem(ItemInput.of(keyed("y", i)), i == 2 ? new ExtraInfo().setDetail("extra", "extraValue") : null);
    }
    assertFalse(section.isEmpty());

    for (int i = 0; i <= 5; i++) {
      Map<String, Double> item = section.getHashValueAt(i);
      assertEquals("x is spread evenly over its range", 2.0 * i, item.get("x"), DELTA);
      assertEquals("z runs backwards over its range", 5.0 - i, item.get("z"), DELTA);
      assertEquals("d takes the default value", 10.0, item.get("d"), DELTA);
    }
    assertEquals("extraValue", section.getExtraInfoAt(2).getDetail("extra"));

    section.setMode(DataMode.PEAK);
    assertTrue("Continuous ranges do not apply to peak sections", Double.isNaN(section.getItemAt(1)[0]));
  }

  @Test
  public void testPeakRootSubstitution() throws Exception {
    DataSection section = new DataSection("peaks", DataMode.PEAK, Arrays.asList(
        VariableDefinition.independent("x", "ppm"), VariableDefinition.dependent("y", "arbitrary")));
    section.setPeakRootValue("y", 0.5);
    section.appendItem(1.0, Double.NaN);
    assertEquals("Omitted peak value takes the root value", 0.5, section.getItemAt(0)[1], DELTA);
    assertArrayEquals("Peak root point of an item", new double[]{7.0, 0.5},
        section.getPeakRootValueOf(new double[]{7.0, 3.0}), DELTA);

    section.setDefaultVarValue("y", 2.0);
    assertEquals("Default values win over root values", 2.0, section.getItemAt(0)[1], DELTA);
  }

  @Test
  public void testConfigurationErrors() throws Exception {
    try {
      new DataSection("empty", DataMode.PEAK, Arrays.asList());
      fail("A section without variables is rejected");
    } catch (SpectrumConfigurationException e) {
      // Expected.
    }
    try {
      new DataSection("dup", DataMode.PEAK, Arrays.asList(
          VariableDefinition.independent("x", "m"), VariableDefinition.dependent("x", "m")));
      fail("Duplicate symbols are rejected");
    } catch (SpectrumConfigurationException e) {
      // Expected.
    }

    DataSection section = new DataSection("s", DataMode.CONTINUOUS, xyzdr);
    section.appendItem(1, 1, 1, 1, 1);
    try {
      section.appendItem(1, 2, 3);
      fail("Item length must match the variables");
    } catch (SpectrumConfigurationException e) {
      // Expected.
    }
    try {
      section.appendItem(keyed("x", 1, "w", 2));
      fail("Unknown symbols are rejected");
    } catch (SpectrumConfigurationException e) {
      // Expected.
    }
    try {
      section.setItemAt(3, ItemInput.of(1, 1, 1, 1, 1));
      fail("Index out of bounds is rejected");
    } catch (SpectrumConfigurationException e) {
      // Expected.
    }
    try {
      section.getLocalVariable("w");
      fail("Unknown symbols are rejected");
    } catch (SpectrumConfigurationException e) {
      // Expected.
    }
    assertEquals("Failed mutations leave the section unchanged", 1, section.getItemCount());
    assertArrayEquals(new double[]{1, 1, 1, 1, 1}, section.getItemAt(0), DELTA);
  }

  @Test
  public void testMutationsDetachExtraInfo() throws Exception {
    DataSection section = new DataSection("s", DataMode.PEAK, Arrays.asList(
        VariableDefinition.independent("x", "m"), VariableDefinition.dependent("y", "m")));
    ExtraInfo first = new ExtraInfo(PeakShape.SHARP, PeakMultiplicity.SINGLET);
    ExtraInfo second = new ExtraInfo(PeakShape.BROAD, PeakMultiplicity.DOUBLET);
    section.appendItem(ItemInput.of(1, 10), first);
    section.appendItem(ItemInput.of(2, 20), second);
    section.insertItemAt(1, ItemInput.of(1.5, 15));

    assertSame("Inserting shifts extra infos with their items", second, section.getExtraInfoAt(2));
    assertNull(section.getExtraInfoAt(1));

    section.setItemAt(0, ItemInput.of(0.5, 5));
    assertNull("Overwriting an item drops its extra info", section.getExtraInfoAt(0));

    double[] removed = section.removeItemAt(2);
    assertArrayEquals(new double[]{2, 20}, removed, DELTA);
    assertEquals(2, section.getItemCount());
    for (int i = 0; i < section.getItemCount(); i++) {
      assertNotSame("Removed extra info is gone", second, section.getExtraInfoAt(i));
    }

    section.clear();
    assertTrue(section.isEmpty());
    assertTrue("An empty section is sorted", section.isSorted());
  }

  @Test
  public void testSortIsStable() throws Exception {
    DataSection section = new DataSection("s", DataMode.PEAK, Arrays.asList(
        VariableDefinition.independent("x", "m"), VariableDefinition.dependent("y", "m")));
    section.appendItem(ItemInput.of(2, 1), new ExtraInfo().setDetail("tag", "a"));
    section.appendItem(ItemInput.of(1, 1), new ExtraInfo().setDetail("tag", "b"));
    section.appendItem(ItemInput.of(2, 1), new ExtraInfo().setDetail("tag", "c"));

    section.sort();
    assertEquals("b", section.getExtraInfoAt(0).getDetail("tag"));
    assertEquals("Equal items keep their relative order", "a", section.getExtraInfoAt(1).getDetail("tag"));
    assertEquals("Equal items keep their relative order", "c", section.getExtraInfoAt(2).getDetail("tag"));

    section.appendItem(0.5, 1);
    assertFalse("Appending an item that sorts earlier clears the flag", section.isSorted());
    section.sort((a, b) -> Double.compare(b[0], a[0]));
    assertEquals("Custom comparator orders descending", 2.0, section.getItemAt(0)[0], DELTA);
    assertEquals(0.5, section.getItemAt(3)[0], DELTA);
  }

  @Test
  public void testIteratorRestartAndConcurrentModification() throws Exception {
    DataSection section = new DataSection("s", DataMode.CONTINUOUS, Arrays.asList(
        VariableDefinition.independent("x", "m"), VariableDefinition.dependent("y", "m")));
    section.appendItem(0, 0);
    section.appendItem(1, 10);

    DataItemIterator iter = section.iterator();
    int count = 0;
    while (iter.hasNext()) {
      iter.next();
      count++;
    }
    assertEquals(2, count);
    iter.restart();
    assertEquals("Restarted iterator starts over", 0, iter.nextIndex());
    assertArrayEquals(new double[]{0, 0}, iter.next(), DELTA);

    section.appendItem(2, 20);
    try {
      iter.next();
      fail("Mutating the section invalidates running iterators");
    } catch (ConcurrentModificationException e) {
      // Expected.
    }
  }

  @Test
  public void testListenersAreNotified() throws Exception {
    DataSection section = new DataSection("s", DataMode.PEAK, Arrays.asList(
        VariableDefinition.independent("x", "m"), VariableDefinition.dependent("y", "m")));
    DataChangeListener listener = mock(DataChangeListener.class);
    section.addDataChangeListener(listener);

    section.appendItem(1, 10);
    ArgumentCaptor<DataChangeEvent> captor = ArgumentCaptor.forClass(DataChangeEvent.class);
    verify(listener).onDataChanged(captor.capture());
    assertEquals(DataChangeEvent.Type.APPEND, captor.getValue().getType());
    assertEquals(Arrays.asList(0), captor.getValue().getIndexes());
    assertArrayEquals(new double[]{1, 10}, captor.getValue().getItems().get(0), DELTA);
    assertSame(section, captor.getValue().getSection());

    section.removeItemAt(0);
    verify(listener, times(2)).onDataChanged(captor.capture());
    assertEquals(DataChangeEvent.Type.REMOVE, captor.getValue().getType());

    try {
      section.removeItemAt(0);
    } catch (SpectrumConfigurationException e) {
      // Expected; no event for a failed mutation.
    }
    verify(listener, times(2)).onDataChanged(captor.capture());

    section.removeDataChangeListener(listener);
    section.appendItem(2, 20);
    verify(listener, never()).onDataChanged(argThat(
        e -> e.getType() == DataChangeEvent.Type.APPEND && e.getIndexes().get(0) == 0 &&
            e.getItems().get(0)[0] == 2.0));
  }

  @Test
  public void testMutationsUpdateLastModified() throws Exception {
    DataSection section = new DataSection("s", DataMode.PEAK, Arrays.asList(
        VariableDefinition.independent("x", "m"), VariableDefinition.dependent("y", "m")));
    DateTime before = section.getLastModified();
    section.appendItem(1, 10);
    assertFalse("Last modified never goes back", section.getLastModified().isBefore(before));
  }

  @Test
  public void testLookupSettingsNotifyWithoutResettingOrder() throws Exception {
    DataSection section = new DataSection("s", DataMode.PEAK, Arrays.asList(
        VariableDefinition.independent("x", "m"), VariableDefinition.dependent("y", "m")));
    section.appendItem(1, 10);
    section.appendItem(2, 20);
    section.appendItem(3, 30);
    assertTrue(section.isSorted());
    DataItemIterator iterator = section.iterator();
    iterator.next();

    DataChangeListener listener = mock(DataChangeListener.class);
    section.addDataChangeListener(listener);
    DateTime before = section.getLastModified();

    section.setPeakMatchTolerance(0.02);
    section.setDisplayRange("x", new ValueRange(0, 5));
    section.setDisplayRange("x", null);

    verify(listener, times(3)).onDataChanged(argThat(e -> e.getType() == DataChangeEvent.Type.SETTINGS));
    assertFalse("Last modified never goes back", section.getLastModified().isBefore(before));
    assertTrue("Item order is unaffected", section.isSorted());
    assertArrayEquals("Open iterators stay valid", new double[]{2, 20}, iterator.next(), DELTA);
  }
}
