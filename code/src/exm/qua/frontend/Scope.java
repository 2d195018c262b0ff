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

package exm.qua.frontend;

import exm.qua.common.exceptions.ScopeException;
import exm.qua.ir.tree.IRTree.Block;

/**
 * Handle on an open DSL block.  Statements are appended to the block of
 * the innermost open scope.  Closing a scope pops it from the stack; it
 * must be the innermost one.
 *
 * <pre>
 *   try (Scope s = q.if_(x.gt(0))) {
 *     q.play("pi", "q1");
 *   }
 * </pre>
 */
public abstract class Scope implements AutoCloseable {

  public static enum ScopeKind {
    PROGRAM, BODY, FOR, SWITCH, RESULT_ANALYSIS
  }

  protected final ScopeStack stack;

  private boolean closed = false;

  protected Scope(ScopeStack stack) {
    this.stack = stack;
  }

  public abstract ScopeKind kind();

  /**
   * @return block statements are appended to
   * @throws ScopeException if this kind of scope holds no statements
   */
  public Block block() {
    throw new ScopeException("Expecting scope with body.");
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      throw new ScopeException(kind() + " scope closed twice");
    }
    stack.pop(this);
    closed = true;
    onExit();
  }

  /**
   * Called after the scope was popped
   */
  protected void onExit() {
    // Nothing by default
  }

  @Override
  public String toString() {
    return kind().toString().toLowerCase() + " scope";
  }
}
