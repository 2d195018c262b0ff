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

/**
 * Block statement: a header line ending in a colon followed by an
 * indented body, e.g.
 * <pre>
 *   while_((v1<10)):
 *       play("pi", "q1")
 * </pre>
 */
public class Compound extends ScriptTree
{
  private final String header;
  private final Sequence body;

  public Compound(String header)
  {
    this(header, new Sequence());
  }

  public Compound(String header, Sequence body)
  {
    this.header = header;
    this.body = body;
  }

  public String header()
  {
    return header;
  }

  public Sequence body()
  {
    return body;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append(header);
    sb.append(":\n");
    nest(body);
    body.appendTo(sb);
  }
}
