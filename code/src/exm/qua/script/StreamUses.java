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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import exm.qua.frontend.stream.ResultSource;
import exm.qua.ir.stream.ResultAnalysis;
import exm.qua.ir.stream.StreamToken;
import exm.qua.ir.tree.IRInstructions.Measure;
import exm.qua.ir.tree.IRInstructions.Play;
import exm.qua.ir.tree.IRInstructions.Save;
import exm.qua.ir.tree.IRTree.Block;
import exm.qua.ir.tree.IRTree.Program;
import exm.qua.ir.tree.Statement;

/**
 * Where a program refers to result streams.  Statements refer to streams
 * by name; terminals of the result analysis read from them.
 */
public class StreamUses {

  private static final Comparator<StreamToken.Array> BY_TAG =
      new Comparator<StreamToken.Array>() {
    @Override
    public int compare(StreamToken.Array a, StreamToken.Array b) {
      return ResultAnalysis.tagOf(a).compareTo(ResultAnalysis.tagOf(b));
    }
  };

  private StreamUses() {
  }

  /**
   * @return stream names referred to directly by stmt, in field order
   */
  public static List<String> streamsOf(Statement stmt) {
    List<String> res = new ArrayList<String>(2);
    if (stmt instanceof Measure) {
      Measure measure = (Measure)stmt;
      addIfPresent(res, measure.streamAs());
      addIfPresent(res, measure.timestampLabel());
    } else if (stmt instanceof Play) {
      addIfPresent(res, ((Play)stmt).timestampLabel());
    } else if (stmt instanceof Save) {
      addIfPresent(res, ((Save)stmt).tag());
    }
    return res;
  }

  /**
   * All streams of program, ordered by first use: depth first through
   * the body, then through the terminals in tag order
   */
  public static List<String> inFirstUseOrder(Program program) {
    Set<String> res = new LinkedHashSet<String>();
    collect(program.body(), res);
    for (StreamToken.Array terminal: terminalsByTag(program)) {
      res.addAll(ResultSource.sourceNames(
                    ResultAnalysis.pipelineOf(terminal)));
    }
    return new ArrayList<String>(res);
  }

  private static void collect(Block block, Set<String> res) {
    for (Statement stmt: block.statements()) {
      res.addAll(streamsOf(stmt));
      for (Block child: stmt.childBlocks()) {
        collect(child, res);
      }
    }
  }

  public static List<StreamToken.Array> terminalsByTag(Program program) {
    List<StreamToken.Array> res = new ArrayList<StreamToken.Array>(
                                          program.results().model());
    Collections.sort(res, BY_TAG);
    return res;
  }

  private static void addIfPresent(List<String> res, String name) {
    if (name != null) {
      res.add(name);
    }
  }
}
