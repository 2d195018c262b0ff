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
package exm.qua.script;

import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.qua.common.Logging;
import exm.qua.common.Settings;
import exm.qua.common.exceptions.ConfigSerializationException;
import exm.qua.common.exceptions.InvalidSyntaxException;
import exm.qua.common.exceptions.QuaException;
import exm.qua.common.exceptions.QuaRuntimeError;
import exm.qua.ir.tree.IRTree.Program;
import exm.qua.script.tree.CommentBlock;
import exm.qua.script.tree.Sequence;
import exm.qua.verify.RoundTripVerifier;
import exm.qua.verify.RoundTripVerifier.Result;

/**
 * Turns a built program into a QUA script.
 *
 * The script is checked by rebuilding a program from it.  If that fails,
 * or the rebuilt program differs, the script is still returned but
 * carries a comment block describing the problem.  A program the
 * renderer does not understand raises {@link QuaRuntimeError}.
 */
public class QuaScriptGenerator {

  public static final String HEADER = "# QUA script generated by qua-stc ";
  public static final String SETUP = "use qua";

  public static final String NOT_COMPLETE =
                                "SERIALIZATION WAS NOT COMPLETE";
  public static final String VALIDATION_ERROR =
                                "SERIALIZATION VALIDATION ERROR";
  public static final String CONFIG_ERROR = "CONFIG SERIALIZATION ERROR";

  private static final String DUMP_INDENT = "    ";

  private final Logger logger = Logging.getQuaLogger();

  private final int indentWidth;
  private final boolean verify;
  private final ConfigPrinter configPrinter;

  /**
   * Generator configured from {@link Settings}
   */
  public QuaScriptGenerator() {
    this(Settings.getIntOrFail(Settings.SCRIPT_INDENT),
         Settings.getBooleanOrFail(Settings.SCRIPT_VERIFY),
         Settings.getIntOrFail(Settings.SCRIPT_COMPACT_MIN_RUN));
  }

  public QuaScriptGenerator(int indentWidth, boolean verify,
                            int compactMinRun) {
    this.indentWidth = indentWidth;
    this.verify = verify;
    this.configPrinter = new ConfigPrinter(indentWidth, compactMinRun);
  }

  public String generate(Program program) {
    return generate(program, null);
  }

  /**
   * @param config configuration printed after the program, or null
   */
  public String generate(Program program, Map<String, ?> config) {
    if (!program.isFrozen()) {
      throw new QuaException("Can not generate script inside the qua " +
                             "program scope");
    }
    logger.debug("Generating script for program with " +
                 program.body().size() + " top level statements");
    Sequence script = new Sequence();
    script.setIndentation(0, indentWidth);
    script.add(HEADER + Settings.get(Settings.QUA_VERSION));
    script.add(SETUP);
    script.add("");
    script.add(new ProgramRenderer().render(program));

    if (verify) {
      CommentBlock problem = check(program, script.toString());
      if (problem != null) {
        script.add("");
        script.add(problem);
      }
    }

    if (config != null) {
      script.add("");
      try {
        script.add("config = " + configPrinter.print(config));
      } catch (ConfigSerializationException e) {
        logger.warn("Could not serialize configuration: " + e.getMessage());
        CommentBlock error = new CommentBlock(CONFIG_ERROR);
        error.add(e.getMessage());
        script.add(error);
      }
    }
    return script.toString();
  }

  /**
   * Rebuild program from text
   * @return diagnostic if the rebuilt program differs, null if it matches
   */
  private CommentBlock check(Program program, String text) {
    Result result;
    try {
      result = RoundTripVerifier.verify(program, text);
    } catch (InvalidSyntaxException e) {
      return validationError(e);
    } catch (QuaException e) {
      return validationError(e);
    } catch (QuaRuntimeError e) {
      return validationError(e);
    } catch (StackOverflowError e) {
      // Deeply nested blocks can exhaust the parser's stack
      return validationError(e);
    }
    if (result.matches()) {
      logger.debug("Generated script rebuilds the same program");
      return null;
    }
    logger.warn("Generated script does not rebuild the same program");
    CommentBlock block = new CommentBlock(NOT_COMPLETE);
    block.add("Original");
    block.add(indentDump(result.original().dump()));
    block.add("Serialized");
    block.add(indentDump(result.rebuilt().dump()));
    return block;
  }

  private CommentBlock validationError(Throwable e) {
    logger.warn("Could not rebuild program from generated script: " +
                e.getMessage());
    CommentBlock block = new CommentBlock(VALIDATION_ERROR);
    block.add("Rebuilding the program from this script failed:");
    block.add(e.getClass().getSimpleName() + ": " + e.getMessage());
    return block;
  }

  private static String indentDump(String dump) {
    String[] lines = StringUtils.split(StringUtils.stripEnd(dump, "\n"),
                                       '\n');
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) {
        sb.append('\n');
      }
      sb.append(DUMP_INDENT).append(lines[i]);
    }
    return sb.toString();
  }
}
