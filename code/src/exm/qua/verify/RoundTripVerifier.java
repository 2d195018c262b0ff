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
package exm.qua.verify;

import org.apache.log4j.Logger;

import exm.qua.common.Logging;
import exm.qua.common.exceptions.InvalidSyntaxException;
import exm.qua.ir.tree.IRTree.Program;
import exm.qua.script.parse.ScriptInterpreter;

/**
 * Checks that a generated script rebuilds the program it was generated
 * from, by running the script and comparing canonical forms.
 */
public class RoundTripVerifier {

  private static final Logger logger = Logging.getQuaLogger();

  private RoundTripVerifier() {
  }

  /**
   * Outcome of a verification.  Both programs are canonical.
   */
  public static class Result {
    private final Program original;
    private final Program rebuilt;

    Result(Program original, Program rebuilt) {
      this.original = original;
      this.rebuilt = rebuilt;
    }

    public Program original() {
      return original;
    }

    public Program rebuilt() {
      return rebuilt;
    }

    public boolean matches() {
      return original.equals(rebuilt);
    }
  }

  /**
   * Rebuild program from script and compare
   * @throws InvalidSyntaxException if script does not parse
   */
  public static Result verify(Program program, String script)
      throws InvalidSyntaxException {
    Program rebuilt = ScriptInterpreter.run(script);
    Result res = new Result(Canonicalizer.canonicalize(program),
                            Canonicalizer.canonicalize(rebuilt));
    logger.debug("Round trip " + (res.matches() ? "matches" : "differs"));
    return res;
  }
}
