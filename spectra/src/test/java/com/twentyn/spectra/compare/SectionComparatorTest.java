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

package com.twentyn.spectra.compare;

import com.twentyn.spectra.model.DataMode;
import com.twentyn.spectra.model.DataSection;
import com.twentyn.spectra.model.ExtraInfo;
import com.twentyn.spectra.model.PeakMultiplicity;
import com.twentyn.spectra.model.SpectrumData;
import com.twentyn.spectra.model.VariableDefinition;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SectionComparatorTest {
  private static final List<VariableDefinition> VARIABLES = Arrays.asList(
      VariableDefinition.independent("x", "ppm"), VariableDefinition.dependent("y", "arbitrary"));

  private static DataSection makeSection(DataMode mode, double... ys) {
    DataSection section = new DataSection("s", mode, VARIABLES);
    for (int i = 0; i < ys.length; i++) {
      section.appendItem(i, ys[i]);
    }
    return section;
  }

  @Test
  public void testEqualSections() throws Exception {
    SectionComparator comparator = new SectionComparator();
    ComparisonResult result = comparator.compare(makeSection(DataMode.PEAK, 1, 2, 3), makeSection(DataMode.PEAK, 1, 2, 3));
    assertTrue(result.toString(), result.isEqual());
  }

  @Test
  public void testValuesWithinTolerance() throws Exception {
    SectionComparator comparator = new SectionComparator();
    assertTrue("Relative error below 5e-8 is equal",
        comparator.compare(makeSection(DataMode.PEAK, 1000.0), makeSection(DataMode.PEAK, 1000.00001)).isEqual());
    assertFalse("Relative error above 5e-8 differs",
        comparator.compare(makeSection(DataMode.PEAK, 1000.0), makeSection(DataMode.PEAK, 1000.001)).isEqual());
    assertTrue("A looser tolerance accepts it",
        new SectionComparator(1e-3).compare(makeSection(DataMode.PEAK, 1000.0), makeSection(DataMode.PEAK, 1000.001))
            .isEqual());
    assertTrue("Omitted values equal each other",
        comparator.compare(makeSection(DataMode.PEAK, Double.NaN), makeSection(DataMode.PEAK, Double.NaN)).isEqual());
    assertFalse(comparator.compare(makeSection(DataMode.PEAK, Double.NaN), makeSection(DataMode.PEAK, 0)).isEqual());
  }

  @Test
  public void testStructuralDifferences() throws Exception {
    SectionComparator comparator = new SectionComparator();
    ComparisonResult mode = comparator.compare(makeSection(DataMode.PEAK, 1), makeSection(DataMode.CONTINUOUS, 1));
    assertEquals(1, mode.getDifferences().size());

    assertFalse("Item counts differ",
        comparator.compare(makeSection(DataMode.PEAK, 1, 2), makeSection(DataMode.PEAK, 1)).isEqual());

    DataSection otherUnits = new DataSection("s", DataMode.PEAK, Arrays.asList(
        VariableDefinition.independent("x", "Hz"), VariableDefinition.dependent("y", "arbitrary")));
    otherUnits.appendItem(0, 1);
    assertFalse("Variable units differ", comparator.compare(makeSection(DataMode.PEAK, 1), otherUnits).isEqual());
  }

  @Test
  public void testExtraInfo() throws Exception {
    SectionComparator comparator = new SectionComparator();
    DataSection a = makeSection(DataMode.PEAK, 1, 2);
    DataSection b = makeSection(DataMode.PEAK, 1, 2);

    a.setExtraInfoAt(0, new ExtraInfo());
    assertTrue("Empty extra info is the same as none", comparator.compare(a, b).isEqual());

    a.setExtraInfoAt(1, new ExtraInfo().setMultiplicity(PeakMultiplicity.TRIPLET).addAssignment("H3"));
    assertFalse(comparator.compare(a, b).isEqual());
    b.setExtraInfoAt(1, new ExtraInfo().setMultiplicity(PeakMultiplicity.TRIPLET).addAssignment("H3"));
    assertTrue(comparator.compare(a, b).isEqual());

    b.getExtraInfoAt(1).setDetail("J", 7.2);
    assertFalse("Details are compared too", comparator.compare(a, b).isEqual());
  }

  @Test
  public void testCompareDatasets() throws Exception {
    SpectrumData a = new SpectrumData(VARIABLES);
    SpectrumData b = new SpectrumData(VARIABLES);
    a.createSection(DataMode.PEAK).appendItem(1, 2);
    b.createSection(DataMode.PEAK).appendItem(1, 2);
    SectionComparator comparator = new SectionComparator();
    assertTrue(comparator.compare(a, b).isEqual());

    b.createSection(DataMode.PEAK);
    assertFalse("Section counts differ", comparator.compare(a, b).isEqual());

    a.createSection(DataMode.PEAK).appendItem(3, 4);
    ComparisonResult result = comparator.compare(a, b);
    assertFalse(result.isEqual());
    assertTrue("Differences name their section", result.getDifferences().get(0).startsWith("section 1: "));
  }
}
