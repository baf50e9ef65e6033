/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package hep.dec.ui;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import hep.dec.common.Logging;
import hep.dec.common.Settings;
import hep.dec.common.exceptions.DecFatal;
import hep.dec.common.exceptions.DecUserException;
import hep.dec.common.exceptions.InvalidOptionException;
import hep.dec.common.exceptions.InvalidSyntaxException;
import hep.dec.common.lang.DecayChain;
import hep.dec.frontend.DecFileParser;

/**
 * Command line interface to the decay file parser.  Some options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String NO_CC_FLAG = "n";
  private static final String STABLE_FLAG = "s";
  private static final String CHAIN_FLAG = "c";
  private static final String MODES_FLAG = "m";

  public static void main(String[] args) {
    try {
      Settings.initProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    try {
      Args decArgs = processArgs(args);
      Logger logger = setupLogging();
      run(logger, decArgs, System.out);
    } catch (DecFatal ex) {
      System.exit(ex.exitCode);
    }
  }

  static Options initOptions() {
    Options opts = new Options();
    opts.addOption(NO_CC_FLAG, "no-cdecay", false,
                   "Do not create the decays requested with CDecay");

    opts.addOption(STABLE_FLAG, "stable", true,
                   "Comma-separated particles not to expand in decay chains");

    opts.addOption(CHAIN_FLAG, "chain", true,
                   "Print the decay chain of this particle");
    opts.addOption(MODES_FLAG, "modes", true,
                   "Print the decay modes of this particle");
    return opts;
  }

  /**
   * @throws DecFatal with ERROR_COMMAND on bad arguments
   */
  static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      throw new DecFatal(ExitCode.ERROR_COMMAND.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      System.err.println("Expected one input file, but got "
              + remainingArgs.length + " arguments");
      usage(opts);
      throw new DecFatal(ExitCode.ERROR_COMMAND.code());
    }

    List<String> stable = new ArrayList<String>();
    if (cmd.hasOption(STABLE_FLAG)) {
      for (String list: cmd.getOptionValues(STABLE_FLAG)) {
        for (String p: StringUtils.split(list, ',')) {
          if (p.trim().length() > 0) {
            stable.add(p.trim());
          }
        }
      }
    }

    Args result = new Args(remainingArgs[0], !cmd.hasOption(NO_CC_FLAG),
              stable, cmd.getOptionValue(CHAIN_FLAG),
              cmd.getOptionValue(MODES_FLAG));
    Settings.set(Settings.INPUT_FILENAME, result.inputFilename);
    return result;
  }

  /**
   * Parse the file and print what was asked for
   * @throws DecFatal carrying the exit code on any error
   */
  static void run(Logger logger, Args args, PrintStream out) {
    try {
      DecFileParser parser = DecFileParser.fromFile(args.inputFilename);
      parser.parse(args.includeChargeConjugates);

      if (args.modesOf != null) {
        DecReport.modes(parser, args.modesOf, out);
      }
      if (args.chainOf != null) {
        DecayChain chain = parser.buildDecayChain(args.chainOf, args.stable);
        DecReport.chain(chain, out);
      }
      if (args.modesOf == null && args.chainOf == null) {
        DecReport.summary(parser, out);
      }
    } catch (FileNotFoundException ex) {
      System.err.println("Input file not found: " + ex.getMessage());
      throw new DecFatal(ExitCode.ERROR_IO.code());
    } catch (IOException ex) {
      System.err.println("Error reading " + args.inputFilename + ": " +
                         ex.getMessage());
      throw new DecFatal(ExitCode.ERROR_IO.code());
    } catch (InvalidSyntaxException ex) {
      System.err.println(ex.getMessage());
      throw new DecFatal(ExitCode.ERROR_PARSER.code());
    } catch (DecUserException ex) {
      System.err.println("Error: " + ex.getMessage());
      throw new DecFatal(ExitCode.ERROR_USER.code());
    } catch (DecFatal ex) {
      throw ex;
    } catch (Throwable t) {
      reportInternalError(logger, t);
      throw new DecFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  static void reportInternalError(Logger logger, Throwable t) {
    logger.debug("internal error", t);
    System.err.println("INTERNAL ERROR while processing " +
                       Settings.get(Settings.INPUT_FILENAME) + ": " + t);
    t.printStackTrace();
  }

  private static Logger setupLogging() {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace;
    try {
      trace = Settings.getBoolean(Settings.LOG_TRACE);
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      throw new DecFatal(ExitCode.ERROR_COMMAND.code());
    }
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("decfile [options] <file.dec>", opts);
    System.err.println("other settings via Java properties: " +
                       StringUtils.join(Settings.getKeys(), ", "));
  }

  static class Args {
    public final String inputFilename;
    public final boolean includeChargeConjugates;
    public final List<String> stable;
    /** Null if not requested */
    public final String chainOf;
    public final String modesOf;

    public Args(String inputFilename, boolean includeChargeConjugates,
                List<String> stable, String chainOf, String modesOf) {
      this.inputFilename = inputFilename;
      this.includeChargeConjugates = includeChargeConjugates;
      this.stable = stable;
      this.chainOf = chainOf;
      this.modesOf = modesOf;
    }
  }
}
