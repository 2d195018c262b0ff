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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.qua.common.exceptions.QuaRuntimeError;
import exm.qua.ir.tree.IRTree.Block;

public class Conditionals {

  /**
   * If statement with its chain of elif branches and an optional else.
   * Branches can be added until the program is frozen.
   */
  public static final class IfStatement extends Statement {
    private static final long serialVersionUID = 1L;
    private final Expr condition;
    private final boolean unsafe;
    private final Block thenBlock;
    private final List<ElseIf> elseIfs;
    private Block elseBlock;

    public IfStatement(String loc, Expr condition, boolean unsafe) {
      this(loc, condition, unsafe, new Block(),
           Collections.<ElseIf>emptyList(), null);
    }

    public IfStatement(String loc, Expr condition, boolean unsafe,
        Block thenBlock, List<ElseIf> elseIfs, Block elseBlock) {
      super(loc);
      this.condition = condition;
      this.unsafe = unsafe;
      this.thenBlock = thenBlock;
      this.elseIfs = new ArrayList<ElseIf>(elseIfs);
      this.elseBlock = elseBlock;
    }

    public Expr condition() {
      return condition;
    }

    /**
     * @return true if the branches may have unequal durations
     */
    public boolean isUnsafe() {
      return unsafe;
    }

    public Block thenBlock() {
      return thenBlock;
    }

    public List<ElseIf> elseIfs() {
      return Collections.unmodifiableList(elseIfs);
    }

    public boolean hasElse() {
      return elseBlock != null;
    }

    /**
     * @return else block, or null if none
     */
    public Block elseBlock() {
      return elseBlock;
    }

    public ElseIf addElseIf(String loc, Expr condition) {
      checkOpen();
      ElseIf elseIf = new ElseIf(loc, condition, new Block());
      elseIfs.add(elseIf);
      return elseIf;
    }

    public Block addElse() {
      checkOpen();
      if (elseBlock != null) {
        throw new QuaRuntimeError("if already has an else block");
      }
      elseBlock = new Block();
      return elseBlock;
    }

    private void checkOpen() {
      if (thenBlock.isFrozen()) {
        throw new QuaRuntimeError("Modifying if statement of frozen program");
      }
    }

    @Override
    public List<Block> childBlocks() {
      List<Block> res = new ArrayList<Block>();
      res.add(thenBlock);
      for (ElseIf elseIf: elseIfs) {
        res.add(elseIf.body());
      }
      if (elseBlock != null) {
        res.add(elseBlock);
      }
      return res;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(condition, unsafe, thenBlock, elseIfs,
                                   elseBlock);
    }
  }

  public static final class ElseIf extends IRNode {
    private static final long serialVersionUID = 1L;
    private final String loc;
    private final Expr condition;
    private final Block body;

    public ElseIf(String loc, Expr condition, Block body) {
      this.loc = loc;
      this.condition = condition;
      this.body = body;
    }

    public String loc() {
      return loc;
    }

    public Expr condition() {
      return condition;
    }

    public Block body() {
      return body;
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(loc, condition, body);
    }
  }
}
