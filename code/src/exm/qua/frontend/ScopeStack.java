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

import java.util.ArrayList;

import org.apache.log4j.Logger;

import exm.qua.common.Logging;
import exm.qua.common.exceptions.ScopeException;
import exm.qua.ir.tree.IRTree.Block;

/**
 * Stack of open scopes of one construction session.  The base is always
 * a program scope; pushes and pops are strictly nested.
 */
public class ScopeStack {

  private final ArrayList<Scope> stack = new ArrayList<Scope>();

  private final Logger logger = Logging.getQuaLogger();

  public void push(Scope scope) {
    if (stack.isEmpty() && scope.kind() != Scope.ScopeKind.PROGRAM) {
      throw new ScopeException("Expecting program scope");
    }
    stack.add(scope);
    if (logger.isTraceEnabled()) {
      logger.trace(indent() + "enter " + scope);
    }
  }

  /**
   * Pop scope, which must be the innermost one
   */
  public void pop(Scope scope) {
    if (stack.isEmpty() || peek() != scope) {
      throw new ScopeException("Unexpected stack structure: closing " + scope +
                              " but innermost open scope is " +
                              (stack.isEmpty() ? "none" : peek().toString()));
    }
    if (logger.isTraceEnabled()) {
      logger.trace(indent() + "exit " + scope);
    }
    stack.remove(stack.size() - 1);
  }

  public Scope peek() {
    if (stack.isEmpty()) {
      throw new ScopeException("Expecting program scope: no program is " +
                               "under construction");
    }
    return stack.get(stack.size() - 1);
  }

  public boolean isEmpty() {
    return stack.isEmpty();
  }

  public int depth() {
    return stack.size();
  }

  /**
   * Push body scope for block, checking expected is innermost
   */
  public BodyScope pushBody(Scope expected, Block block) {
    checkTop(expected, "Expecting " + expected.kind().toString().toLowerCase()
                       + " scope");
    BodyScope body = new BodyScope(this, block);
    push(body);
    return body;
  }

  public void checkTop(Scope expected, String message) {
    if (stack.isEmpty() || peek() != expected) {
      throw new ScopeException(message);
    }
  }

  public ProgramScope programScope() {
    if (stack.isEmpty() || !(stack.get(0) instanceof ProgramScope)) {
      throw new ScopeException("Expecting program scope");
    }
    return (ProgramScope)stack.get(0);
  }

  /**
   * @return block of innermost scope
   */
  public Block currentBlock() {
    return peek().block();
  }

  public SwitchScope switchScope() {
    Scope top = peek();
    if (!(top instanceof SwitchScope)) {
      throw new ScopeException("Expecting switch scope: 'case' and " +
          "'default' must be directly inside a 'switch'");
    }
    return (SwitchScope)top;
  }

  public ForScope forScope() {
    Scope top = peek();
    if (!(top instanceof ForScope)) {
      throw new ScopeException("Expecting for scope");
    }
    return (ForScope)top;
  }

  public ResultAnalysisScope resultAnalysisScope() {
    Scope top = stack.isEmpty() ? null : peek();
    if (!(top instanceof ResultAnalysisScope)) {
      throw new ScopeException("Expecting result analysis scope: streams " +
                               "are saved inside stream_processing()");
    }
    return (ResultAnalysisScope)top;
  }

  private String indent() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < stack.size(); i++) {
      sb.append("  ");
    }
    return sb.toString();
  }
}
