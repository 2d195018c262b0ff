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

import java.util.ArrayDeque;
import java.util.Deque;

import exm.qua.common.exceptions.InvalidSyntaxException;

/**
 * Makes the block structure of a script explicit for the lexer.
 *
 * Every logical line is terminated by an EOS marker.  A line indented
 * deeper than the one before it starts with an INDENT marker; a line
 * indented less starts with one DEDENT marker per block it closes.
 * Lines inside brackets continue the logical line and their
 * indentation is ignored.  Blank and comment lines are kept, so line
 * numbers in error messages refer to the original text.
 */
public class ScriptLayout {

  public static final char INDENT = '\u0001';
  public static final char DEDENT = '\u0002';
  public static final char EOS = '\u0003';

  /** Deepest bracket nesting accepted in a script */
  public static final int MAX_NESTING = 200;

  private ScriptLayout() {
  }

  public static String layout(String text) throws InvalidSyntaxException {
    StringBuilder out = new StringBuilder(text.length() + 256);
    Deque<Integer> indents = new ArrayDeque<Integer>();
    indents.push(0);
    int depth = 0;
    String[] lines = text.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      int lineNo = i + 1;
      String line = lines[i];
      if (line.endsWith("\r")) {
        line = line.substring(0, line.length() - 1);
      }
      int start = firstNonBlank(line);
      boolean code = depth > 0 ||
              (start < line.length() && line.charAt(start) != '#');
      if (depth == 0 && code) {
        String leading = line.substring(0, start);
        if (leading.indexOf('\t') >= 0) {
          throw new InvalidSyntaxException(lineNo, 0,
              "tabs are not allowed in indentation");
        }
        int level = leading.length();
        if (level > indents.peek()) {
          indents.push(level);
          out.append(INDENT);
        } else {
          while (level < indents.peek()) {
            indents.pop();
            out.append(DEDENT);
          }
          if (level != indents.peek()) {
            throw new InvalidSyntaxException(lineNo, level,
                "unindent does not match any outer indentation level");
          }
        }
      }
      out.append(line);
      if (code) {
        depth = scanDepth(line, depth, lineNo);
        if (depth == 0) {
          out.append(EOS);
        }
      }
      if (i < lines.length - 1) {
        out.append('\n');
      }
    }
    if (depth > 0) {
      throw new InvalidSyntaxException(lines.length, 0,
          "unexpected end of script: unclosed bracket");
    }
    while (indents.size() > 1) {
      indents.pop();
      out.append(DEDENT);
    }
    return out.toString();
  }

  private static int firstNonBlank(String line) {
    int i = 0;
    while (i < line.length() &&
           (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
      i++;
    }
    return i;
  }

  /**
   * @return bracket depth after line, given depth before it
   */
  private static int scanDepth(String line, int depth, int lineNo)
      throws InvalidSyntaxException {
    boolean inString = false;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (inString) {
        if (c == '\\') {
          i++;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      switch (c) {
      case '#':
        return depth;
      case '"':
        inString = true;
        break;
      case '(':
      case '[':
      case '{':
        depth++;
        if (depth > MAX_NESTING) {
          throw new InvalidSyntaxException(lineNo, i,
              "brackets nested deeper than " + MAX_NESTING + " levels");
        }
        break;
      case ')':
      case ']':
      case '}':
        depth--;
        if (depth < 0) {
          throw new InvalidSyntaxException(lineNo, i,
                                  "unmatched closing bracket '" + c + "'");
        }
        break;
      default:
        break;
      }
    }
    if (inString) {
      throw new InvalidSyntaxException(lineNo, line.length(),
                                       "unterminated string literal");
    }
    return depth;
  }
}
