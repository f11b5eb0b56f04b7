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

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CLIUtilTest {
  private static final double DELTA = 1e-9;

  private static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder("n").hasArg().longOpt("number"));
    add(Option.builder("c").hasArg().longOpt("count"));
    add(Option.builder("r").hasArgs().valueSeparator(',').longOpt("range"));
    add(Option.builder("f").hasArg().longOpt("file"));
  }};

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private CLIUtil cliUtil;

  @Before
  public void setUp() throws Exception {
    cliUtil = new CLIUtil(CLIUtilTest.class, "Test tool", OPTION_BUILDERS);
  }

  private static void assertRejected(String expectedMessagePart, Runnable read) {
    try {
      read.run();
      fail("Expected the option value to be rejected");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage(), e.getMessage().contains(expectedMessagePart));
    }
  }

  @Test
  public void testHelpOptionIsRegistered() throws Exception {
    assertTrue(cliUtil.getOptions().hasOption("h"));
    assertTrue(cliUtil.parse(new String[]{"--help"}).hasOption("help"));
  }

  @Test
  public void testNumericValues() throws Exception {
    CommandLine cl = cliUtil.parse(new String[]{"-n", "2.5e-3", "-c", "3", "-r", "400, 1200"});
    assertEquals(0.0025, CLIUtil.getDoubleValue(cl, "n"), DELTA);
    assertEquals(3, CLIUtil.getIntValue(cl, "c"));
    assertArrayEquals("Blanks around the separator are ignored", new double[]{400, 1200},
        CLIUtil.getDoublePair(cl, "r"), DELTA);
  }

  @Test
  public void testMalformedValuesNameTheOption() throws Exception {
    CommandLine cl = cliUtil.parse(new String[]{"-n", "abc", "-c", "1.5", "-r", "1,2,3"});
    assertRejected("Option -n expects a number, got 'abc'", () -> CLIUtil.getDoubleValue(cl, "n"));
    assertRejected("Option -c expects an integer, got '1.5'", () -> CLIUtil.getIntValue(cl, "c"));
    assertRejected("Option -r expects two comma-separated values, got 3", () -> CLIUtil.getDoublePair(cl, "r"));

    CommandLine single = cliUtil.parse(new String[]{"-r", "7"});
    assertRejected("got 1", () -> CLIUtil.getDoublePair(single, "r"));
    assertRejected("got 0", () -> CLIUtil.getDoublePair(single, "n"));

    CommandLine notNumbers = cliUtil.parse(new String[]{"-r", "1,x"});
    assertRejected("Option -r expects a number, got 'x'", () -> CLIUtil.getDoublePair(notNumbers, "r"));
  }

  @Test
  public void testExistingFile() throws Exception {
    File file = tempFolder.newFile("data.json");
    CommandLine cl = cliUtil.parse(new String[]{"-f", file.getAbsolutePath()});
    assertEquals(file, CLIUtil.getExistingFile(cl, "f"));

    CommandLine missing = cliUtil.parse(new String[]{"-f", new File(tempFolder.getRoot(), "nope.json").getPath()});
    assertRejected("does not exist", () -> CLIUtil.getExistingFile(missing, "f"));
  }
}
