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
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared command line handling of the spectra tools: builds the options (plus -h/--help), converts option values
 * to numbers and files, prints usage and exits on bad input.
 */
public class CLIUtil {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CLIUtil.class);

  public static final HelpFormatter HELP_FORMATTER = new HelpFormatter();
  static {
    HELP_FORMATTER.setWidth(100);
  }

  private final Class<?> callingClass;
  private final String helpMessage;
  private final Options opts;
  private CommandLine commandLine;

  public CLIUtil(Class<?> callingClass, String helpMessage, List<Option.Builder> optionBuilders) {
    this.callingClass = callingClass;
    this.helpMessage = helpMessage;

    List<Option.Builder> options = new ArrayList<>(optionBuilders);
    options.add(Option.builder("h")
        .argName("help")
        .desc("Prints this help message")
        .longOpt("help")
    );

    opts = new Options();
    for (Option.Builder b : options) {
      opts.addOption(b.build());
    }
  }

  /**
   * Parse the arguments without exiting on failure.
   */
  public CommandLine parse(String[] args) throws ParseException {
    CommandLineParser parser = new DefaultParser();
    commandLine = parser.parse(opts, args);
    return commandLine;
  }

  /**
   * Parse the arguments, printing usage and exiting on bad arguments or when help was asked for.
   */
  public CommandLine parseCommandLine(String[] args) {
    CommandLine cl = null;
    try {
      cl = parse(args);
    } catch (ParseException e) {
      LOGGER.error("Argument parsing failed: %s\n", e.getMessage());
      printHelp();
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      printHelp();
      System.exit(0);
    }

    return cl;
  }

  public CommandLine getCommandLine() {
    return this.commandLine;
  }

  public Options getOptions() {
    return opts;
  }

  /**
   * Read the value of a numeric option.
   * @throws IllegalArgumentException If the value is not a number.
   */
  public static double getDoubleValue(CommandLine cl, String option) {
    return parseDouble(option, cl.getOptionValue(option));
  }

  /**
   * Read the value of an integer option.
   * @throws IllegalArgumentException If the value is not an integer.
   */
  public static int getIntValue(CommandLine cl, String option) {
    String value = cl.getOptionValue(option);
    try {
      return Integer.parseInt(StringUtils.trim(value));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format("Option -%s expects an integer, got '%s'", option, value), e);
    }
  }

  /**
   * Read a "from,to" option as two numbers.
   * @throws IllegalArgumentException If the option does not hold exactly two numbers.
   */
  public static double[] getDoublePair(CommandLine cl, String option) {
    String[] values = cl.getOptionValues(option);
    int count = values == null ? 0 : values.length;
    if (count != 2) {
      throw new IllegalArgumentException(
          String.format("Option -%s expects two comma-separated values, got %d", option, count));
    }
    return new double[] {parseDouble(option, values[0]), parseDouble(option, values[1])};
  }

  /**
   * Resolve an option naming a file that must already exist.
   * @throws IllegalArgumentException If there is no such file.
   */
  public static File getExistingFile(CommandLine cl, String option) {
    File file = new File(cl.getOptionValue(option));
    if (!file.isFile()) {
      throw new IllegalArgumentException(
          String.format("File %s given by -%s does not exist", file.getAbsolutePath(), option));
    }
    return file;
  }

  private static double parseDouble(String option, String value) {
    try {
      return Double.parseDouble(StringUtils.trim(value));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format("Option -%s expects a number, got '%s'", option, value), e);
    }
  }

  public void failWithMessage(String formatStr, Object... args) {
    failWithMessage(String.format(formatStr, args));
  }

  public void failWithMessage(String msg) {
    System.out.println(msg);
    printHelp();
    System.exit(1);
  }

  private void printHelp() {
    HELP_FORMATTER.printHelp(callingClass.getCanonicalName(), helpMessage, opts, null, true);
  }
}
