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

package com.twentyn.spectra.tools;

import com.twentyn.spectra.SpectrumConfigurationException;
import com.twentyn.spectra.model.DataMode;
import com.twentyn.spectra.model.DataSection;
import com.twentyn.spectra.model.SpectrumData;
import com.twentyn.spectra.model.SpectrumParameter;
import com.twentyn.spectra.model.VarDependency;
import com.twentyn.spectra.model.VariableDefinition;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.MissingOptionException;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SpectrumInspectorTest {
  private CLIUtil cliUtil;
  private SpectrumData data;

  @Before
  public void setUp() throws Exception {
    cliUtil = new CLIUtil(SpectrumInspector.class, SpectrumInspector.HELP_MESSAGE, SpectrumInspector.OPTION_BUILDERS);

    data = new SpectrumData(Arrays.asList(
        new VariableDefinition("x", VarDependency.INDEPENDENT, "Hz", "ppm"),
        VariableDefinition.dependent("y", "arbitrary")));
    data.setParameter(SpectrumParameter.OBSERVE_FREQUENCY, 400.0, "MHz");
    DataSection curve = data.createSection(DataMode.CONTINUOUS);
    for (int i = 0; i <= 10; i++) {
      curve.appendItem(400.0 * i, 10.0 * i);
    }
  }

  @Test
  public void testReportsRangesAndLookups() throws Exception {
    CommandLine cl = cliUtil.parse(new String[]{"-i", "unused.json", "-x", "600", "-r", "400,1200"});
    List<String> lines = SpectrumInspector.inspect(data, cl);

    assertEquals("Section section0 (CONTINUOUS): 11 items", lines.get(0));
    assertTrue(lines.get(1), lines.get(1).startsWith("x [Hz]: range [0.000000, 4000.000000]"));
    assertEquals("Value at x=600.0: [600.0, 15.0]", lines.get(3));
    assertEquals("Items with x in [400.0, 1200.0]: 3", lines.get(4));
    assertEquals("Boundaries and enclosed items are listed", 10, lines.size());
  }

  @Test
  public void testExternalUnits() throws Exception {
    CommandLine cl = cliUtil.parse(new String[]{"-i", "unused.json", "-e", "-v", "x"});
    List<String> lines = SpectrumInspector.inspect(data, cl);
    assertEquals(2, lines.size());
    assertTrue(lines.get(1), lines.get(1).startsWith("x [ppm]: "));
  }

  @Test
  public void testSectionIndexSelectsSection() throws Exception {
    data.createSection(DataMode.PEAK).appendItem(1200, 3);
    CommandLine cl = cliUtil.parse(new String[]{"-i", "unused.json", "-s", "1", "-v", "y"});
    List<String> lines = SpectrumInspector.inspect(data, cl);
    assertEquals("Section section1 (PEAK): 1 items", lines.get(0));
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testUnknownSectionIndex() throws Exception {
    SpectrumInspector.inspect(data, cliUtil.parse(new String[]{"-i", "unused.json", "-s", "4"}));
  }

  @Test
  public void testRangeNeedsTwoBounds() throws Exception {
    CommandLine cl = cliUtil.parse(new String[]{"-i", "unused.json", "-r", "400"});
    try {
      SpectrumInspector.inspect(data, cl);
      fail("A single bound is not a range");
    } catch (IllegalArgumentException e) {
      assertEquals("Option -r expects two comma-separated values, got 1", e.getMessage());
    }
  }

  @Test(expected = MissingOptionException.class)
  public void testInputIsRequired() throws Exception {
    cliUtil.parse(new String[]{"-x", "600"});
  }
}
