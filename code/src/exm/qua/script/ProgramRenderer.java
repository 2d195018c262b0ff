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
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.qua.common.Logging;
import exm.qua.common.exceptions.QuaRuntimeError;
import exm.qua.ir.stream.StreamToken;
import exm.qua.ir.tree.Conditionals.ElseIf;
import exm.qua.ir.tree.Conditionals.IfStatement;
import exm.qua.ir.tree.Expr;
import exm.qua.ir.tree.IRInstructions.AdvanceInputStream;
import exm.qua.ir.tree.IRInstructions.Align;
import exm.qua.ir.tree.IRInstructions.Assign;
import exm.qua.ir.tree.IRInstructions.Chirp;
import exm.qua.ir.tree.IRInstructions.FastFrameRotation;
import exm.qua.ir.tree.IRInstructions.Measure;
import exm.qua.ir.tree.IRInstructions.Pause;
import exm.qua.ir.tree.IRInstructions.Play;
import exm.qua.ir.tree.IRInstructions.Pulse;
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
import exm.qua.ir.tree.Loops.ForEachIterator;
import exm.qua.ir.tree.Loops.ForEachStatement;
import exm.qua.ir.tree.Loops.ForStatement;
import exm.qua.ir.tree.Loops.StrictTiming;
import exm.qua.ir.tree.MeasureProcess;
import exm.qua.ir.tree.Statement;
import exm.qua.script.tree.Compound;
import exm.qua.script.tree.Sequence;

/**
 * Renders a program as the body of a QUA script, one line or block per
 * IR node.  Elif and else branches are written as siblings of their if.
 */
public class ProgramRenderer implements IRVisitor<Void> {

  public static final String PROGRAM_HEADER = "program prog";
  public static final String STREAM_PROCESSING = "stream_processing()";

  private final Logger logger = Logging.getQuaLogger();

  private StreamDeclarations streams;

  /** Block currently being written */
  private Sequence current;

  public Compound render(Program program) {
    streams = new StreamDeclarations(program);
    Compound root = new Compound(PROGRAM_HEADER);
    current = root.body();
    for (VarDeclaration decl: program.variables()) {
      current.add(declaration(decl));
    }
    for (String stream: streams.declared()) {
      current.add(StreamDeclarations.declaration(stream));
    }
    renderBlock(program.body());

    List<StreamToken.Array> processing = streams.processing();
    if (!processing.isEmpty()) {
      Compound sp = new Compound(STREAM_PROCESSING);
      for (StreamToken.Array terminal: processing) {
        sp.body().add(StreamRenderer.renderTerminal(terminal));
      }
      root.body().add(sp);
    }
    logger.debug("rendered " + program.variables().size() + " declarations, "
                 + streams.declared().size() + " streams, " +
                 processing.size() + " stream processing terminals");
    return root;
  }

  private void renderBlock(Block block) {
    for (Statement stmt: block.statements()) {
      stmt.accept(this);
    }
  }

  /**
   * Render block as body of header, added to the current sequence
   */
  private void renderNested(String header, Block block) {
    Compound compound = new Compound(header);
    current.add(compound);
    Sequence outer = current;
    current = compound.body();
    renderBlock(block);
    current = outer;
  }

  static String declaration(VarDeclaration decl) {
    List<String> args = new ArrayList<String>();
    args.add(decl.type().scriptName());
    String fn = "declare";
    if (decl.isInputStream()) {
      fn = "declare_input_stream";
      args.add(ScriptStrings.quote(decl.inputStreamName()));
    }
    if (decl.isArray()) {
      if (decl.values().isEmpty()) {
        args.add("size=" + decl.size());
      } else {
        args.add("value=" + list(decl.values()));
      }
    } else if (!decl.values().isEmpty()) {
      args.add("value=" + decl.values().get(0));
    }
    return decl.name() + " = " + call(fn, args);
  }

  @Override
  public Void visitPlay(Play play) {
    List<String> args = new ArrayList<String>();
    args.add(pulse(play.pulse()));
    args.add(ScriptStrings.quote(play.element()));
    addKeyword(args, "duration", play.duration());
    addKeyword(args, "condition", play.condition());
    if (play.chirp() != null) {
      args.add("chirp=" + chirp(play.chirp()));
    }
    addKeyword(args, "truncate", play.truncate());
    if (play.timestampLabel() != null) {
      args.add("timestamp_stream=" +
               streams.reference(play.timestampLabel()));
    }
    if (play.continueChirp()) {
      args.add("continue_chirp=true");
    }
    if (play.target() != null) {
      args.add("target=" + ScriptStrings.quote(play.target()));
    }
    current.add(call("play", args));
    return null;
  }

  @Override
  public Void visitMeasure(Measure measure) {
    List<String> args = new ArrayList<String>();
    args.add(pulse(measure.pulse()));
    args.add(ScriptStrings.quote(measure.element()));
    args.add(measure.streamAs() == null ? "null" :
             streams.reference(measure.streamAs()));
    for (MeasureProcess process: measure.processes()) {
      args.add(process(process));
    }
    if (measure.timestampLabel() != null) {
      args.add("timestamp_stream=" +
               streams.reference(measure.timestampLabel()));
    }
    current.add(call("measure", args));
    return null;
  }

  @Override
  public Void visitWait(Wait wait) {
    List<String> args = new ArrayList<String>();
    args.add(wait.duration().toString());
    args.addAll(quoteAll(wait.elements()));
    current.add(call("wait", args));
    return null;
  }

  @Override
  public Void visitWaitForTrigger(WaitForTrigger wait) {
    List<String> args = new ArrayList<String>();
    args.add(ScriptStrings.quote(wait.element()));
    addKeyword(args, "pulse", wait.pulse());
    addKeyword(args, "trigger_element", wait.triggerElement());
    addKeyword(args, "trigger_output", wait.triggerOutput());
    addKeyword(args, "time_tag_target", wait.timeTagTarget());
    current.add(call("wait_for_trigger", args));
    return null;
  }

  @Override
  public Void visitAlign(Align align) {
    current.add(call("align", quoteAll(align.elements())));
    return null;
  }

  @Override
  public Void visitAssign(Assign assign) {
    current.add(call("assign", assign.target(), assign.value()));
    return null;
  }

  @Override
  public Void visitSave(Save save) {
    current.add(call("save", save.source().toString(),
                     streams.reference(save.tag())));
    return null;
  }

  @Override
  public Void visitPause(Pause pause) {
    current.add("pause()");
    return null;
  }

  @Override
  public Void visitUpdateFrequency(UpdateFrequency update) {
    current.add(call("update_frequency",
        ScriptStrings.quote(update.element()), update.value().toString(),
        ScriptStrings.quote(update.units().text()),
        Boolean.toString(update.keepPhase())));
    return null;
  }

  @Override
  public Void visitUpdateCorrection(UpdateCorrection update) {
    List<String> args = new ArrayList<String>();
    args.add(ScriptStrings.quote(update.element()));
    for (Expr c: update.matrix()) {
      args.add(c.toString());
    }
    current.add(call("update_correction", args));
    return null;
  }

  @Override
  public Void visitSetDcOffset(SetDcOffset offset) {
    current.add(call("set_dc_offset", ScriptStrings.quote(offset.element()),
        ScriptStrings.quote(offset.elementInput()),
        offset.offset().toString()));
    return null;
  }

  @Override
  public Void visitAdvanceInputStream(AdvanceInputStream advance) {
    current.add(call("advance_input_stream", advance.stream()));
    return null;
  }

  @Override
  public Void visitResetPhase(ResetPhase reset) {
    current.add(call("reset_phase", ScriptStrings.quote(reset.element())));
    return null;
  }

  @Override
  public Void visitResetFrame(ResetFrame reset) {
    current.add(call("reset_frame", ScriptStrings.quote(reset.element())));
    return null;
  }

  @Override
  public Void visitRampToZero(RampToZero ramp) {
    if (ramp.duration() == null) {
      current.add(call("ramp_to_zero", ScriptStrings.quote(ramp.element())));
    } else {
      current.add(call("ramp_to_zero", ScriptStrings.quote(ramp.element()),
                       ramp.duration().toString()));
    }
    return null;
  }

  @Override
  public Void visitZRotation(ZRotation rotation) {
    current.add(call("frame_rotation_2pi", rotation.angle().toString(),
                     ScriptStrings.quote(rotation.element())));
    return null;
  }

  @Override
  public Void visitFastFrameRotation(FastFrameRotation rotation) {
    current.add(call("fast_frame_rotation", rotation.cosine().toString(),
        rotation.sine().toString(), ScriptStrings.quote(rotation.element())));
    return null;
  }

  @Override
  public Void visitIf(IfStatement stmt) {
    if (stmt.isUnsafe()) {
      renderNested(call("if_", stmt.condition().toString(), "unsafe=true"),
                   stmt.thenBlock());
    } else {
      renderNested(call("if_", stmt.condition()), stmt.thenBlock());
    }
    for (ElseIf elseIf: stmt.elseIfs()) {
      renderNested(call("elif_", elseIf.condition()), elseIf.body());
    }
    if (stmt.hasElse()) {
      renderNested("else_()", stmt.elseBlock());
    }
    return null;
  }

  @Override
  public Void visitFor(ForStatement loop) {
    if (loop.condition() == null) {
      throw new QuaRuntimeError("for loop without condition");
    }
    if (loop.isInfinite()) {
      renderNested("infinite_loop_()", loop.body());
    } else if (loop.isWhile()) {
      renderNested(call("while_", loop.condition()), loop.body());
    } else {
      Assign init = singleAssign(loop.init());
      Assign update = singleAssign(loop.update());
      if (init == null || update == null ||
          !init.target().equals(update.target())) {
        throw new QuaRuntimeError("Can not render for loop: init and " +
            "update must each be a single assignment to the loop " +
            "variable");
      }
      renderNested(call("for_", init.target().toString(),
          init.value().toString(), loop.condition().toString(),
          update.value().toString()), loop.body());
    }
    return null;
  }

  private static Assign singleAssign(Block block) {
    if (block.size() != 1 || !(block.last() instanceof Assign)) {
      return null;
    }
    return (Assign)block.last();
  }

  @Override
  public Void visitForEach(ForEachStatement loop) {
    List<String> vars = new ArrayList<String>();
    List<String> arrays = new ArrayList<String>();
    for (ForEachIterator it: loop.iterators()) {
      vars.add(it.variable().toString());
      arrays.add(it.array().toString());
    }
    String header;
    if (vars.size() == 1) {
      header = call("for_each_", vars.get(0), arrays.get(0));
    } else {
      header = call("for_each_", "(" + StringUtils.join(vars, ", ") + ")",
                    "(" + StringUtils.join(arrays, ", ") + ")");
    }
    renderNested(header, loop.body());
    return null;
  }

  @Override
  public Void visitStrictTiming(StrictTiming block) {
    renderNested("strict_timing_()", block.body());
    return null;
  }

  /*
   * Pieces of statements
   */

  private static String pulse(Pulse pulse) {
    if (pulse.isRamp()) {
      return call("ramp", pulse.rampValue());
    }
    String name = ScriptStrings.quote(pulse.name());
    if (pulse.amp().isEmpty()) {
      return name;
    }
    return name + " * " + call("amp", toStrings(pulse.amp()));
  }

  /**
   * (rate, null, units) for a constant chirp, otherwise
   * ([rates], [times], units)
   */
  private static String chirp(Chirp chirp) {
    String units = ScriptStrings.quote(chirp.units().text());
    if (chirp.rates().size() == 1 && chirp.times().isEmpty()) {
      return "(" + chirp.rates().get(0) + ", null, " + units + ")";
    }
    String times = chirp.times().isEmpty() ? "null" : list(chirp.times());
    return "(" + list(chirp.rates()) + ", " + times + ", " + units + ")";
  }

  private static String process(MeasureProcess process) {
    List<String> args = new ArrayList<String>();
    for (Object arg: process.args()) {
      if (arg == null) {
        args.add("null");
      } else if (arg instanceof String) {
        args.add(ScriptStrings.quote((String)arg));
      } else if (arg instanceof Integer || arg instanceof Expr) {
        args.add(arg.toString());
      } else {
        throw new QuaRuntimeError("Can not render measure process " +
                                  "argument " + arg);
      }
    }
    return process.family().scriptName() + "." +
           call(process.method(), args);
  }

  private static void addKeyword(List<String> args, String key, Object value) {
    if (value == null) {
      return;
    }
    if (value instanceof String) {
      args.add(key + "=" + ScriptStrings.quote((String)value));
    } else {
      args.add(key + "=" + value);
    }
  }

  private static List<String> quoteAll(List<String> values) {
    List<String> res = new ArrayList<String>(values.size());
    for (String v: values) {
      res.add(ScriptStrings.quote(v));
    }
    return res;
  }

  private static List<String> toStrings(List<?> values) {
    List<String> res = new ArrayList<String>(values.size());
    for (Object v: values) {
      res.add(v.toString());
    }
    return res;
  }

  private static String list(List<?> values) {
    return "[" + StringUtils.join(toStrings(values), ", ") + "]";
  }

  private static String call(String fn, Object... args) {
    return call(fn, toStrings(Arrays.asList(args)));
  }

  private static String call(String fn, List<String> args) {
    return fn + "(" + StringUtils.join(args, ", ") + ")";
  }
}
