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

package exm.qua.ir.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.qua.ir.tree.IRTree.Block;

/**
 * A statement in a QUA program block.
 *
 * The location records where in the host program the statement was
 * built.  It is part of equality, so canonical copies set it to null.
 */
public abstract class Statement extends IRNode {

  private static final long serialVersionUID = 1L;

  private final String loc;

  protected Statement(String loc) {
    this.loc = loc;
  }

  public String loc() {
    return loc;
  }

  public abstract <T> T accept(IRVisitor<T> visitor);

  /**
   * @return fields particular to the statement kind
   */
  protected abstract List<Object> statementFields();

  @Override
  protected final List<Object> fields() {
    List<Object> res = new ArrayList<Object>();
    res.add(loc);
    res.addAll(statementFields());
    return res;
  }

  /**
   * @return blocks nested directly inside this statement
   */
  public List<Block> childBlocks() {
    return Collections.emptyList();
  }
}
