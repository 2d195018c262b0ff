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
package exm.qua.script.parse;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.apache.commons.lang3.StringUtils;

import exm.qua.common.exceptions.InvalidSyntaxException;
import exm.qua.script.parse.QuaScriptParser.ScriptContext;

/**
 * Parses script text into a parse tree.  The first lexing or parsing
 * error aborts the parse.
 */
public class ScriptParser {

  private ScriptParser() {
  }

  public static ScriptContext parse(String text)
      throws InvalidSyntaxException {
    String laidOut = ScriptLayout.layout(text);
    QuaScriptLexer lexer = new QuaScriptLexer(
                                  CharStreams.fromString(laidOut));
    lexer.removeErrorListeners();
    lexer.addErrorListener(ThrowingErrorListener.INSTANCE);
    QuaScriptParser parser = new QuaScriptParser(
                                  new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(ThrowingErrorListener.INSTANCE);
    try {
      return parser.script();
    } catch (SyntaxError e) {
      throw new InvalidSyntaxException(e.line, e.charPositionInLine,
                                       e.getMessage());
    }
  }

  /**
   * Marker characters as they should appear in messages
   */
  static String describeMarkers(String msg) {
    return StringUtils.replaceEach(msg,
        new String[] {String.valueOf(ScriptLayout.INDENT),
                      String.valueOf(ScriptLayout.DEDENT),
                      String.valueOf(ScriptLayout.EOS)},
        new String[] {"<indent>", "<dedent>", "<end of line>"});
  }

  private static class SyntaxError extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final int line;
    private final int charPositionInLine;

    SyntaxError(int line, int charPositionInLine, String msg) {
      super(msg);
      this.line = line;
      this.charPositionInLine = charPositionInLine;
    }
  }

  private static class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer,
        Object offendingSymbol, int line, int charPositionInLine,
        String msg, RecognitionException e) {
      throw new SyntaxError(line, charPositionInLine, describeMarkers(msg));
    }
  }
}
