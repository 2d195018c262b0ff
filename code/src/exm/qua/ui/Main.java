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
package exm.qua.ui;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.qua.common.Logging;
import exm.qua.common.Settings;
import exm.qua.common.exceptions.InvalidOptionException;
import exm.qua.common.exceptions.ProgramLoadException;
import exm.qua.common.exceptions.QuaException;
import exm.qua.common.exceptions.QuaRuntimeError;
import exm.qua.ir.tree.IRTree.Program;
import exm.qua.persist.ProgramSerializer;
import exm.qua.script.QuaScriptGenerator;

/**
 * Command line interface: prints the script of a persisted program.
 * Generator options not on the command line are passed through Java
 * properties.  See Settings.java for handling of these options.
 */
public class Main {
  private static final String OUTPUT_FLAG = "o";
  private static final String NO_VERIFY_FLAG = "n";

  public static void main(String[] args) {
    System.exit(run(args, System.out).code());
  }

  /**
   * Run the command with output going to out
   */
  static ExitCode run(String[] args, PrintStream out) {
    Options opts = initOptions();
    CommandLine cmd;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      return ExitCode.ERROR_COMMAND;
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      System.err.println("Expected one input file, but got " +
                         remainingArgs.length + " arguments");
      usage(opts);
      return ExitCode.ERROR_COMMAND;
    }

    Logger logger;
    QuaScriptGenerator generator;
    try {
      Settings.initQuaProperties();
      logger = setupLogging();
      boolean verify = Settings.getBoolean(Settings.SCRIPT_VERIFY) &&
                       !cmd.hasOption(NO_VERIFY_FLAG);
      generator = new QuaScriptGenerator(
          Settings.getInt(Settings.SCRIPT_INDENT), verify,
          Settings.getInt(Settings.SCRIPT_COMPACT_MIN_RUN));
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND;
    }

    File input = new File(remainingArgs[0]);
    if (!input.isFile() || !input.canRead()) {
      System.err.println("Input file \"" + input + "\" is not readable");
      return ExitCode.ERROR_IO;
    }

    Program program;
    try {
      program = ProgramSerializer.load(input);
    } catch (ProgramLoadException ex) {
      System.err.println(ex.getMessage());
      return ExitCode.ERROR_LOAD;
    }

    String script;
    try {
      script = generator.generate(program);
    } catch (QuaException ex) {
      System.err.println(ex.getMessage());
      return ExitCode.ERROR_USER;
    } catch (QuaRuntimeError ex) {
      logger.error("Internal error while generating script", ex);
      System.err.println("qua-stc internal error: " + ex.getMessage());
      return ExitCode.ERROR_INTERNAL;
    }

    if (cmd.hasOption(OUTPUT_FLAG)) {
      File output = new File(cmd.getOptionValue(OUTPUT_FLAG));
      try {
        FileUtils.writeStringToFile(output, script, StandardCharsets.UTF_8);
      } catch (IOException ex) {
        System.err.println("Error writing " + output + ": " +
                           ex.getMessage());
        return ExitCode.ERROR_IO;
      }
      logger.debug("Wrote script to " + output);
    } else {
      out.print(script);
      out.flush();
    }
    return ExitCode.SUCCESS;
  }

  private static Options initOptions() {
    Options opts = new Options();

    Option output = new Option(OUTPUT_FLAG, "output", true,
                               "Write the script to this file");
    opts.addOption(output);

    opts.addOption(NO_VERIFY_FLAG, "no-verify", false,
                   "Do not check that the script rebuilds the program");
    return opts;
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("qua-script [options] <program.bin>", opts);
  }
}
