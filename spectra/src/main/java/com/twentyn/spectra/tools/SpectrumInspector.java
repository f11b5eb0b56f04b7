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
import com.twentyn.spectra.io.SpectrumInterchangeModel;
import com.twentyn.spectra.lookup.IndependentRangeResult;
import com.twentyn.spectra.model.DataQueryOptions;
import com.twentyn.spectra.model.DataSection;
import com.twentyn.spectra.model.SpectrumData;
import com.twentyn.spectra.model.ValueRange;
import com.twentyn.spectra.model.VariableDefinition;
import com.twentyn.spectra.units.ConversionUnavailableException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Loads a dataset snapshot and reports the ranges and averages of one of its sections, optionally with the value at
 * an independent coordinate and the items inside an independent range.
 */
public class SpectrumInspector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumInspector.class);

  public static final String OPTION_INPUT_FILE = "i";
  public static final String OPTION_SECTION = "s";
  public static final String OPTION_VARIABLES = "v";
  public static final String OPTION_VALUE_AT = "x";
  public static final String OPTION_RANGE = "r";
  public static final String OPTION_EXTERNAL_UNITS = "e";
  public static final String OPTION_TOLERANCE = "t";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class loads a spectrum dataset written as JSON and prints the data range and average of the variables ",
      "of one section.  Given a coordinate of the primary independent variable it also prints the (interpolated or ",
      "matched) item there; given a range it lists the items inside it."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT_FILE)
        .argName("input file")
        .desc("A JSON file holding the dataset")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_SECTION)
        .argName("section index")
        .desc("The index of the section to inspect (default: the active section)")
        .hasArg()
        .longOpt("section")
    );
    add(Option.builder(OPTION_VARIABLES)
        .argName("symbols")
        .desc("The variables to report (default: all variables of the section)")
        .hasArgs().valueSeparator(',')
        .longOpt("variables")
    );
    add(Option.builder(OPTION_VALUE_AT)
        .argName("value")
        .desc("A value of the primary independent variable to look up")
        .hasArg()
        .longOpt("value-at")
    );
    add(Option.builder(OPTION_RANGE)
        .argName("from,to")
        .desc("A range of the primary independent variable whose items should be listed")
        .hasArgs().valueSeparator(',')
        .longOpt("range")
    );
    add(Option.builder(OPTION_TOLERANCE)
        .argName("tolerance")
        .desc("The relative tolerance of peak matching (default: the section's)")
        .hasArg()
        .longOpt("tolerance")
    );
    add(Option.builder(OPTION_EXTERNAL_UNITS)
        .argName("external units")
        .desc("Read and report values in the external units of the variables")
        .longOpt("external-units")
    );
  }};

  private static final CLIUtil CLI_UTIL = new CLIUtil(SpectrumInspector.class, HELP_MESSAGE, OPTION_BUILDERS);

  public static void main(String[] args) throws Exception {
    CommandLine cl = CLI_UTIL.parseCommandLine(args);
    try {
      File inputFile = CLIUtil.getExistingFile(cl, OPTION_INPUT_FILE);
      SpectrumData data = SpectrumInterchangeModel.loadFromJsonFile(inputFile).toSpectrumData();
      for (String line : inspect(data, cl)) {
        LOGGER.info(line);
      }
    } catch (SpectrumConfigurationException | ConversionUnavailableException | IllegalArgumentException e) {
      CLI_UTIL.failWithMessage(e.getMessage());
    }
  }

  /**
   * Produce the report lines for the section and queries named on the command line.
   */
  public static List<String> inspect(SpectrumData data, CommandLine cl) {
    if (data.getSectionCount() == 0) {
      return Collections.singletonList("The dataset has no sections");
    }
    DataSection section = cl.hasOption(OPTION_SECTION) ?
        data.getSectionAt(CLIUtil.getIntValue(cl, OPTION_SECTION)) :
        data.getActiveSection();

    DataQueryOptions options = DataQueryOptions.defaults().setUseExternalUnit(cl.hasOption(OPTION_EXTERNAL_UNITS));
    if (cl.hasOption(OPTION_TOLERANCE)) {
      options.setTolerance(CLIUtil.getDoubleValue(cl, OPTION_TOLERANCE));
    }

    List<String> symbols = cl.hasOption(OPTION_VARIABLES) ?
        Arrays.asList(cl.getOptionValues(OPTION_VARIABLES)) : section.getLocalVarSymbols();

    List<String> lines = new ArrayList<>();
    lines.add(String.format("Section %s (%s): %d items", section.getName(), section.getMode(),
        section.getItemCount()));
    for (String symbol : symbols) {
      VariableDefinition varDef = section.getLocalVariable(symbol);
      String unit = cl.hasOption(OPTION_EXTERNAL_UNITS) ? varDef.getActualExternalUnit() : varDef.getInternalUnit();
      ValueRange range = section.getDataRange(symbol, options);
      Double average = section.calcDataAverage(symbol, options);
      lines.add(String.format("%s [%s]: range %s, average %s", symbol, StringUtils.defaultString(unit),
          range == null ? "n/a" : range, average == null ? "n/a" : average));
    }

    String axis = section.getPrimaryIndependentVariable().getSymbol();
    if (cl.hasOption(OPTION_VALUE_AT)) {
      double x = CLIUtil.getDoubleValue(cl, OPTION_VALUE_AT);
      Optional<double[]> value =
          section.getDataValueFromIndependent(Collections.singletonMap(axis, x), options);
      lines.add(String.format("Value at %s=%s: %s", axis, x,
          value.map(SpectrumInspector::formatItem).orElse("outside of the data")));
    }

    if (cl.hasOption(OPTION_RANGE)) {
      double[] bounds = CLIUtil.getDoublePair(cl, OPTION_RANGE);
      double from = bounds[0];
      double to = bounds[1];
      IndependentRangeResult result = section.valueRangeFromIndependentRange(axis, from, to, options);
      lines.add(String.format("Items with %s in [%s, %s]: %d", axis, from, to, result.getItems().size()));
      for (double[] item : result.getValues()) {
        lines.add("  " + formatItem(item));
      }
    }
    return lines;
  }

  static String formatItem(double[] item) {
    return Arrays.toString(item);
  }
}
