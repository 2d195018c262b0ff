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

import exm.qua.common.exceptions.InvalidSyntaxException;

/**
 * String literals of QUA scripts: double quoted with c-style escapes
 */
public class ScriptStrings {

  private ScriptStrings() {
  }

  public static String quote(String unescaped) {
    StringBuilder sb = new StringBuilder(unescaped.length() + 2);
    sb.append('"');
    escape(unescaped, sb);
    sb.append('"');
    return sb.toString();
  }

  private static void escape(String unescaped, StringBuilder escaped) {
    for (int i = 0; i < unescaped.length(); i++) {
      char c = unescaped.charAt(i);
      switch (c) {
      case '\n':
        escaped.append("\\n");
        break;
      case '\r':
        escaped.append("\\r");
        break;
      case '\t':
        escaped.append("\\t");
        break;
      case '\\':
        escaped.append("\\\\");
        break;
      case '"':
        escaped.append("\\\"");
        break;
      default:
        if (c < 0x20) {
          escaped.append(String.format("\\x%02x", (int)c));
        } else {
          escaped.append(c);
        }
      }
    }
  }

  /**
   * Strip the quotes from a string token
   */
  public static String unquote(String s) {
    if (s.length() < 2 || s.charAt(0) != '"' ||
        s.charAt(s.length() - 1) != '"') {
      throw new IllegalArgumentException("String not quoted: " + s);
    }
    return s.substring(1, s.length() - 1);
  }

  /**
   * Take the body of a string literal and unescape it
   */
  public static String unescape(String escapedString)
      throws InvalidSyntaxException {
    StringBuilder realString = new StringBuilder();
    for (int i = 0; i < escapedString.length(); i++) {
      char c = escapedString.charAt(i);
      if (c != '\\') {
        realString.append(c);
        continue;
      }
      i++;
      if (i >= escapedString.length()) {
        throw new InvalidSyntaxException("'\\' cannot appear "
            + "at end of string: it must be followed by escape code");
      }
      c = escapedString.charAt(i);
      if (c == 'x') {
        // Hex escape code e.g. \x7 \x1f
        int next = i + 1;
        int digits = 0;
        while (digits < 2 && next < escapedString.length() &&
               Character.digit(escapedString.charAt(next), 16) >= 0) {
          digits++;
          next++;
        }
        if (digits == 0) {
          throw new InvalidSyntaxException("Hex escape code \\x was not "
                                           + "followed by hex digit");
        }
        realString.append((char)Integer.parseInt(
                          escapedString.substring(i + 1, next), 16));
        i = next - 1;
        continue;
      }
      switch (c) {
      case 'n':
        realString.append('\n');
        break;
      case 'r':
        realString.append('\r');
        break;
      case 't':
        realString.append('\t');
        break;
      case '\\':
      case '"':
      case '\'':
        realString.append(c);
        break;
      default:
        throw new InvalidSyntaxException("Unknown escape code in string: \\"
                                         + c);
      }
    }
    return realString.toString();
  }
}
