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
import java.util.Collections;
import java.util.List;

/**
 * Lines of one block, all at the same indentation.  An empty sequence
 * is written as pass, since an indented block can not be empty.
 */
public class Sequence extends ScriptTree
{
  public static final String PASS = "pass";

  private final List<ScriptTree> members = new ArrayList<ScriptTree>();

  public void add(ScriptTree member)
  {
    members.add(member);
  }

  public void add(String line)
  {
    members.add(new Line(line));
  }

  public List<ScriptTree> members()
  {
    return Collections.unmodifiableList(members);
  }

  public boolean isEmpty()
  {
    return members.isEmpty();
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    if (members.isEmpty()) {
      indent(sb);
      sb.append(PASS);
      sb.append("\n");
      return;
    }
    for (ScriptTree member: members) {
      member.setIndentation(indentation, indentWidth);
      member.appendTo(sb);
    }
  }
}
