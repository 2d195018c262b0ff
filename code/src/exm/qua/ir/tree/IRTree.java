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

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.qua.common.exceptions.QuaRuntimeError;
import exm.qua.common.lang.VarType;
import exm.qua.ir.stream.ResultAnalysis;
import exm.qua.ir.stream.StreamToken;
import exm.qua.ir.tree.Conditionals.ElseIf;
import exm.qua.ir.tree.Conditionals.IfStatement;
import exm.qua.ir.tree.Expr.Literal;

/**
 * Root structures of the QUA IR.
 *
 * A program is built while its scope is open and frozen when the scope
 * closes.  Nothing is appended to a frozen program.
 */
public class IRTree {

  public static final String INPUT_STREAM_PREFIX = "input_stream_";

  public static class Program extends IRNode {

    private static final long serialVersionUID = 1L;

    private final List<VarDeclaration> variables =
                                  new ArrayList<VarDeclaration>();
    private final Block body;
    private final ResultAnalysis results;

    private boolean usesCommandTimestamps = false;
    private boolean usesFastFrameRotation = false;

    private boolean frozen = false;

    public Program() {
      this(new Block(), new ResultAnalysis());
    }

    public Program(Block body, ResultAnalysis results) {
      this.body = body;
      this.results = results;
    }

    public void addVariable(VarDeclaration decl) {
      checkOpen();
      variables.add(decl);
    }

    public List<VarDeclaration> variables() {
      return Collections.unmodifiableList(variables);
    }

    public VarDeclaration lookupVariable(String name) {
      for (VarDeclaration decl: variables) {
        if (decl.name().equals(name)) {
          return decl;
        }
      }
      return null;
    }

    public Block body() {
      return body;
    }

    public ResultAnalysis results() {
      return results;
    }

    public boolean usesCommandTimestamps() {
      return usesCommandTimestamps;
    }

    public void setUsesCommandTimestamps() {
      checkOpen();
      usesCommandTimestamps = true;
    }

    public boolean usesFastFrameRotation() {
      return usesFastFrameRotation;
    }

    public void setUsesFastFrameRotation() {
      checkOpen();
      usesFastFrameRotation = true;
    }

    /**
     * Copy the metadata flags of another program
     */
    public void copyMetadata(Program other) {
      checkOpen();
      usesCommandTimestamps = other.usesCommandTimestamps;
      usesFastFrameRotation = other.usesFastFrameRotation;
    }

    public boolean isFrozen() {
      return frozen;
    }

    public void freeze() {
      frozen = true;
      body.freeze();
      results.freeze();
    }

    private void checkOpen() {
      if (frozen) {
        throw new QuaRuntimeError("Modifying frozen program");
      }
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(variables, body, results,
                usesCommandTimestamps, usesFastFrameRotation);
    }

    /**
     * Readable multi-line dump for diagnostics
     */
    @Override
    public String dump() {
      StringBuilder sb = new StringBuilder();
      for (VarDeclaration decl: variables) {
        sb.append(decl.dump()).append('\n');
      }
      body.dumpTo(sb, 0);
      for (StreamToken.Array terminal: results.model()) {
        sb.append(terminal.toString()).append('\n');
      }
      if (usesCommandTimestamps || usesFastFrameRotation) {
        sb.append("metadata: commandTimestamps=" + usesCommandTimestamps +
                  " fastFrameRotation=" + usesFastFrameRotation + "\n");
      }
      return sb.toString();
    }
  }

  /**
   * Ordered, append-only list of statements
   */
  public static class Block extends IRNode {

    private static final long serialVersionUID = 1L;

    private final List<Statement> statements = new ArrayList<Statement>();

    private boolean frozen = false;

    public Block() {
    }

    public Block(List<Statement> statements) {
      this.statements.addAll(statements);
    }

    public void add(Statement stmt) {
      if (frozen) {
        throw new QuaRuntimeError("Adding statement to frozen block: " +
                                  stmt.dump());
      }
      statements.add(stmt);
    }

    public List<Statement> statements() {
      return Collections.unmodifiableList(statements);
    }

    public boolean isEmpty() {
      return statements.isEmpty();
    }

    public int size() {
      return statements.size();
    }

    /**
     * @return most recently added statement, or null if empty
     */
    public Statement last() {
      if (statements.isEmpty()) {
        return null;
      }
      return statements.get(statements.size() - 1);
    }

    public boolean isFrozen() {
      return frozen;
    }

    public void freeze() {
      frozen = true;
      for (Statement stmt: statements) {
        for (Block child: stmt.childBlocks()) {
          child.freeze();
        }
      }
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(statements);
    }

    void dumpTo(StringBuilder sb, int indent) {
      for (Statement stmt: statements) {
        sb.append(StringUtils.repeat(' ', indent));
        if (stmt instanceof IfStatement) {
          IfStatement ifStmt = (IfStatement)stmt;
          sb.append("IfStatement[" + ifStmt.loc() + ", " +
                    ifStmt.condition().dump() + ", " + ifStmt.isUnsafe() +
                    "]\n");
          ifStmt.thenBlock().dumpTo(sb, indent + 2);
          for (ElseIf elseIf: ifStmt.elseIfs()) {
            sb.append(StringUtils.repeat(' ', indent));
            sb.append("ElseIf[" + elseIf.loc() + ", " +
                      elseIf.condition().dump() + "]\n");
            elseIf.body().dumpTo(sb, indent + 2);
          }
          if (ifStmt.hasElse()) {
            sb.append(StringUtils.repeat(' ', indent)).append("Else\n");
            ifStmt.elseBlock().dumpTo(sb, indent + 2);
          }
        } else if (stmt.childBlocks().isEmpty()) {
          sb.append(stmt.dump()).append('\n');
        } else {
          sb.append(stmt.getClass().getSimpleName()).append('[')
            .append(stmt.loc()).append("]\n");
          for (Block child: stmt.childBlocks()) {
            child.dumpTo(sb, indent + 2);
            sb.append(StringUtils.repeat(' ', indent + 2)).append("--\n");
          }
        }
      }
    }
  }

  /**
   * Declaration of a scalar, array or input stream variable
   */
  public static final class VarDeclaration extends IRNode {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final VarType type;
    private final boolean array;
    private final int size;
    private final ImmutableList<Literal> values;
    private final boolean inputStream;

    public VarDeclaration(String name, VarType type, boolean array, int size,
        List<Literal> values, boolean inputStream) {
      this.name = name;
      this.type = type;
      this.array = array;
      this.size = size;
      this.values = ImmutableList.copyOf(values);
      this.inputStream = inputStream;
    }

    public String name() {
      return name;
    }

    public VarType type() {
      return type;
    }

    public boolean isArray() {
      return array;
    }

    /**
     * @return array size, 0 for scalars
     */
    public int size() {
      return size;
    }

    /**
     * @return initial values, empty if not initialized
     */
    public ImmutableList<Literal> values() {
      return values;
    }

    public boolean isInputStream() {
      return inputStream;
    }

    /**
     * @return name given when the input stream was declared
     */
    public String inputStreamName() {
      if (!inputStream) {
        throw new QuaRuntimeError(name + " is not an input stream");
      }
      return StringUtils.removeStart(name, INPUT_STREAM_PREFIX);
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(name, type, array, size, values,
                                   inputStream);
    }
  }
}
