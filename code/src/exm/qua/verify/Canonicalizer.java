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
package exm.qua.verify;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.qua.common.Logging;
import exm.qua.ir.stream.ResultAnalysis;
import exm.qua.ir.stream.StreamToken;
import exm.qua.ir.tree.Conditionals.ElseIf;
import exm.qua.ir.tree.Conditionals.IfStatement;
import exm.qua.ir.tree.IRInstructions.AdvanceInputStream;
import exm.qua.ir.tree.IRInstructions.Align;
import exm.qua.ir.tree.IRInstructions.Assign;
import exm.qua.ir.tree.IRInstructions.FastFrameRotation;
import exm.qua.ir.tree.IRInstructions.Measure;
import exm.qua.ir.tree.IRInstructions.Pause;
import exm.qua.ir.tree.IRInstructions.Play;
import exm.qua.ir.tree.IRInstructions.RampToZero;
import exm.qua.ir.tree.IRInstructions.ResetFrame;
import exm.qua.ir.tree.IRInstructions.ResetPhase;
import exm.qua.ir.tree.IRInstructions.Save;
import exm.qua.ir.tree.IRInstructions.SetDcOffset;
import exm.qua.ir.tree.IRInstructions.UpdateCorrection;
import exm.qua.ir.tree.IRInstructions.UpdateFrequency;
import exm.qua.ir.tree.IRInstructions.Wait;
import exm.qua.ir.tree.IRInstructions.WaitForTrigger;
import exm.qua.ir.tree.IRInstructions.ZRotation;
import exm.qua.ir.tree.IRTree.Block;
import exm.qua.ir.tree.IRTree.Program;
import exm.qua.ir.tree.IRTree.VarDeclaration;
import exm.qua.ir.tree.IRVisitor;
import exm.qua.ir.tree.Loops.ForEachStatement;
import exm.qua.ir.tree.Loops.ForStatement;
import exm.qua.ir.tree.Loops.StrictTiming;
import exm.qua.ir.tree.Statement;
import exm.qua.script.StreamUses;

/**
 * Produces the canonical form of a program, in which two programs that
 * mean the same thing are equal.
 *
 * The canonical form drops the host source locations, and renames result
 * streams by their first use, keeping the name's prefix: the first
 * stream used becomes r1 (or atr_r1 for an ADC trace), the second r2,
 * and so on.  Terminals are registered in tag order.  Canonicalizing a
 * canonical program gives an equal program.
 */
public class Canonicalizer implements IRVisitor<Statement> {

  private static final Logger logger = Logging.getQuaLogger();

  private final Map<String, String> streamNames;

  private Canonicalizer(Map<String, String> streamNames) {
    this.streamNames = streamNames;
  }

  /**
   * @return frozen canonical copy of program
   */
  public static Program canonicalize(Program program) {
    Canonicalizer c = new Canonicalizer(streamRenaming(program));

    Program res = new Program(c.block(program.body()),
                              new ResultAnalysis());
    for (VarDeclaration decl: program.variables()) {
      res.addVariable(decl);
    }
    for (StreamToken.Array terminal: StreamUses.terminalsByTag(program)) {
      res.results().add(c.renameSources(terminal).asArray());
    }
    res.copyMetadata(program);
    res.freeze();
    if (logger.isTraceEnabled()) {
      logger.trace("Canonical stream names: " + c.streamNames);
    }
    return res;
  }

  /**
   * Map from stream name to canonical name
   */
  static Map<String, String> streamRenaming(Program program) {
    Map<String, String> res = new HashMap<String, String>();
    int counter = 0;
    for (String name: StreamUses.inFirstUseOrder(program)) {
      counter++;
      res.put(name, stripCounter(name) + counter);
    }
    return res;
  }

  /**
   * @return name without trailing digits
   */
  static String stripCounter(String name) {
    int end = name.length();
    while (end > 0 && Character.isDigit(name.charAt(end - 1))) {
      end--;
    }
    return name.substring(0, end);
  }

  private String stream(String name) {
    if (name == null) {
      return null;
    }
    String renamed = streamNames.get(name);
    return renamed != null ? renamed : name;
  }

  private StreamToken renameSources(StreamToken token) {
    if (token.isAtom()) {
      return token;
    }
    StreamToken.Array arr = token.asArray();
    if (arr.size() == 3 && arr.get(0).isAtom() && arr.head().equals("@re")) {
      return arr.with(2, StreamToken.atom(stream(
                                arr.get(2).asAtom().value())));
    }
    List<StreamToken> items = new ArrayList<StreamToken>(arr.size());
    for (StreamToken item: arr.items()) {
      items.add(renameSources(item));
    }
    return StreamToken.array(items);
  }

  private Block block(Block block) {
    if (block == null) {
      return null;
    }
    List<Statement> stmts = new ArrayList<Statement>(block.size());
    for (Statement stmt: block.statements()) {
      stmts.add(stmt.accept(this));
    }
    return new Block(stmts);
  }

  @Override
  public Statement visitPlay(Play play) {
    return new Play(null, play.pulse(), play.element(), play.duration(),
        play.condition(), play.chirp(), play.truncate(),
        stream(play.timestampLabel()), play.continueChirp(), play.target());
  }

  @Override
  public Statement visitMeasure(Measure measure) {
    return new Measure(null, measure.pulse(), measure.element(),
        stream(measure.streamAs()), measure.processes(),
        stream(measure.timestampLabel()));
  }

  @Override
  public Statement visitWait(Wait wait) {
    return new Wait(null, wait.duration(), wait.elements());
  }

  @Override
  public Statement visitWaitForTrigger(WaitForTrigger wait) {
    return new WaitForTrigger(null, wait.element(), wait.pulse(),
        wait.triggerElement(), wait.triggerOutput(), wait.timeTagTarget());
  }

  @Override
  public Statement visitAlign(Align align) {
    return new Align(null, align.elements());
  }

  @Override
  public Statement visitAssign(Assign assign) {
    return new Assign(null, assign.target(), assign.value());
  }

  @Override
  public Statement visitSave(Save save) {
    return new Save(null, save.source(), stream(save.tag()));
  }

  @Override
  public Statement visitPause(Pause pause) {
    return new Pause(null);
  }

  @Override
  public Statement visitUpdateFrequency(UpdateFrequency update) {
    return new UpdateFrequency(null, update.element(), update.value(),
                               update.units(), update.keepPhase());
  }

  @Override
  public Statement visitUpdateCorrection(UpdateCorrection update) {
    return new UpdateCorrection(null, update.element(), update.matrix());
  }

  @Override
  public Statement visitSetDcOffset(SetDcOffset offset) {
    return new SetDcOffset(null, offset.element(), offset.elementInput(),
                           offset.offset());
  }

  @Override
  public Statement visitAdvanceInputStream(AdvanceInputStream advance) {
    return new AdvanceInputStream(null, advance.stream());
  }

  @Override
  public Statement visitResetPhase(ResetPhase reset) {
    return new ResetPhase(null, reset.element());
  }

  @Override
  public Statement visitResetFrame(ResetFrame reset) {
    return new ResetFrame(null, reset.element());
  }

  @Override
  public Statement visitRampToZero(RampToZero ramp) {
    return new RampToZero(null, ramp.element(), ramp.duration());
  }

  @Override
  public Statement visitZRotation(ZRotation rotation) {
    return new ZRotation(null, rotation.angle(), rotation.element());
  }

  @Override
  public Statement visitFastFrameRotation(FastFrameRotation rotation) {
    return new FastFrameRotation(null, rotation.cosine(), rotation.sine(),
                                 rotation.element());
  }

  @Override
  public Statement visitIf(IfStatement stmt) {
    List<ElseIf> elseIfs = new ArrayList<ElseIf>();
    for (ElseIf elseIf: stmt.elseIfs()) {
      elseIfs.add(new ElseIf(null, elseIf.condition(),
                             block(elseIf.body())));
    }
    return new IfStatement(null, stmt.condition(), stmt.isUnsafe(),
        block(stmt.thenBlock()), elseIfs, block(stmt.elseBlock()));
  }

  @Override
  public Statement visitFor(ForStatement loop) {
    return new ForStatement(null, block(loop.init()), loop.condition(),
                            block(loop.update()), block(loop.body()));
  }

  @Override
  public Statement visitForEach(ForEachStatement loop) {
    return new ForEachStatement(null, loop.iterators(), block(loop.body()));
  }

  @Override
  public Statement visitStrictTiming(StrictTiming block) {
    return new StrictTiming(null, block(block.body()));
  }
}
