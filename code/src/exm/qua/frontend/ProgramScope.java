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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.qua.common.Logging;
import exm.qua.frontend.stream.ResultSource;
import exm.qua.ir.tree.IRTree.Block;
import exm.qua.ir.tree.IRTree.Program;

/**
 * Root scope of a program under construction.  Holds the state shared by
 * the whole program: symbol counters, input stream names and streams
 * declared for string tags.
 */
public class ProgramScope extends Scope {

  private final Program program;

  private final SymbolAllocator symbols = new SymbolAllocator();

  private final Set<String> inputStreams = new HashSet<String>();

  /** Streams auto-declared for string tags, by tag */
  private final Map<String, ResultSource> taggedStreams =
                                  new HashMap<String, ResultSource>();

  private final Logger logger = Logging.getQuaLogger();

  public ProgramScope(ScopeStack stack, Program program) {
    super(stack);
    this.program = program;
  }

  @Override
  public ScopeKind kind() {
    return ScopeKind.PROGRAM;
  }

  @Override
  public Block block() {
    return program.body();
  }

  public Program program() {
    return program;
  }

  public SymbolAllocator symbols() {
    return symbols;
  }

  /**
   * @return false if an input stream of this name already exists
   */
  boolean addInputStream(String name) {
    return inputStreams.add(name);
  }

  ResultSource taggedStream(String tag) {
    return taggedStreams.get(tag);
  }

  void addTaggedStream(String tag, ResultSource source) {
    taggedStreams.put(tag, source);
  }

  @Override
  protected void onExit() {
    program.freeze();
    logger.debug("Program built: " + program.variables().size() +
                 " variables, " + program.body().size() +
                 " top level statements, " +
                 program.results().model().size() + " saves");
  }
}
