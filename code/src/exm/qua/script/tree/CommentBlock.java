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
package exm.qua.script.tree;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Delimited block of comments reporting a problem found while
 * generating the script:
 * <pre>
 *   ####     TITLE     ####
 *   #
 *   #  text
 *   #
 *   ##########################
 * </pre>
 */
public class CommentBlock extends ScriptTree
{
  private final String title;
  private final List<String> lines = new ArrayList<String>();

  public CommentBlock(String title)
  {
    this.title = title;
  }

  /**
   * Add text, which may span several lines
   */
  public void add(String text)
  {
    for (String line: StringUtils.splitPreserveAllTokens(text, '\n')) {
      lines.add(line);
    }
  }

  public String title()
  {
    return title;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    String head = "####     " + title + "     ####";
    indent(sb);
    sb.append(head).append("\n");
    indent(sb);
    sb.append("#\n");
    for (String line: lines) {
      indent(sb);
      sb.append(StringUtils.stripEnd("#  " + line, null)).append("\n");
    }
    indent(sb);
    sb.append("#\n");
    indent(sb);
    sb.append(StringUtils.repeat('#', head.length())).append("\n");
  }
}
