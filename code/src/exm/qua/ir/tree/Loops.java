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

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.qua.common.exceptions.QuaRuntimeError;
import exm.qua.ir.tree.Expr.ArrayVar;
import exm.qua.ir.tree.Expr.Variable;
import exm.qua.ir.tree.IRTree.Block;

public class Loops {

  /**
   * Loop with init, condition, update and body.  A while loop has empty
   * init and update; an infinite loop has the literal true as condition.
   */
  public static final class ForStatement extends Statement {
    private static final long serialVersionUID = 1L;
    private final Block init;
    private Expr condition;
    private final Block update;
    private final Block body;

    public ForStatement(String loc, Expr condition) {
      this(loc, new Block(), condition, new Block(), new Block());
    }

    public ForStatement(String loc, Block init, Expr condition, Block update,
                        Block body) {
      super(loc);
      this.init = init;
      this.condition = condition;
      this.update = update;
      this.body = body;
    }

    public Block init() {
      return init;
    }

    /**
     * @return loop condition, null if not yet set
     */
    public Expr condition() {
      return condition;
    }

    public void setCondition(Expr condition) {
      if (body.isFrozen()) {
        throw new QuaRuntimeError("Modifying loop of frozen program");
      }
      this.condition = condition;
    }

    public Block update() {
      return update;
    }

    public Block body() {
      return body;
    }

    public boolean isInfinite() {
      return init.isEmpty() && update.isEmpty() &&
          condition instanceof Expr.Literal &&
          ((Expr.Literal)condition).isTrue();
    }

    public boolean isWhile() {
      return init.isEmpty() && update.isEmpty() && condition != null;
    }

    @Override
    public List<Block> childBlocks() {
      return ImmutableList.of(init, update, body);
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitFor(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(init, condition, update, body);
    }
  }

  /**
   * One variable stepping through one array
   */
  public static final class ForEachIterator extends IRNode {
    private static final long serialVersionUID = 1L;
    private final Variable variable;
    private final ArrayVar array;

    public ForEachIterator(Variable variable, ArrayVar array) {
      this.variable = variable;
      this.array = array;
    }

    public Variable variable() {
      return variable;
    }

    public ArrayVar array() {
      return array;
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(variable, array);
    }
  }

  /**
   * Loop over arrays in lock-step
   */
  public static final class ForEachStatement extends Statement {
    private static final long serialVersionUID = 1L;
    private final ImmutableList<ForEachIterator> iterators;
    private final Block body;

    public ForEachStatement(String loc, List<ForEachIterator> iterators,
                            Block body) {
      super(loc);
      this.iterators = ImmutableList.copyOf(iterators);
      this.body = body;
    }

    public ImmutableList<ForEachIterator> iterators() {
      return iterators;
    }

    public Block body() {
      return body;
    }

    @Override
    public List<Block> childBlocks() {
      return ImmutableList.of(body);
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitForEach(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(iterators, body);
    }
  }

  /**
   * Block whose statements must run without gaps
   */
  public static final class StrictTiming extends Statement {
    private static final long serialVersionUID = 1L;
    private final Block body;

    public StrictTiming(String loc, Block body) {
      super(loc);
      this.body = body;
    }

    public Block body() {
      return body;
    }

    @Override
    public List<Block> childBlocks() {
      return ImmutableList.of(body);
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitStrictTiming(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(body);
    }
  }
}
