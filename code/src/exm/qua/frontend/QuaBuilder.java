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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.apache.log4j.Logger;

import exm.qua.common.Logging;
import exm.qua.common.exceptions.InvalidDeclarationException;
import exm.qua.common.exceptions.QuaException;
import exm.qua.common.exceptions.ScopeException;
import exm.qua.common.exceptions.TypeMismatchException;
import exm.qua.common.lang.Library;
import exm.qua.common.lang.Operators.BinaryOp;
import exm.qua.common.lang.Units.FrequencyUnits;
import exm.qua.common.lang.VarType;
import exm.qua.frontend.lib.QuaCast;
import exm.qua.frontend.lib.QuaMath;
import exm.qua.frontend.lib.QuaRandom;
import exm.qua.frontend.lib.QuaUtil;
import exm.qua.frontend.stream.ResultSource;
import exm.qua.frontend.stream.ResultStream;
import exm.qua.ir.stream.ResultAnalysis;
import exm.qua.ir.tree.Conditionals.ElseIf;
import exm.qua.ir.tree.Conditionals.IfStatement;
import exm.qua.ir.tree.Expr;
import exm.qua.ir.tree.Expr.ArrayVar;
import exm.qua.ir.tree.Expr.Binary;
import exm.qua.ir.tree.Expr.ExprKind;
import exm.qua.ir.tree.Expr.LibCall;
import exm.qua.ir.tree.Expr.Literal;
import exm.qua.ir.tree.Expr.Variable;
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
import exm.qua.ir.tree.IRTree;
import exm.qua.ir.tree.IRTree.Block;
import exm.qua.ir.tree.IRTree.Program;
import exm.qua.ir.tree.IRTree.VarDeclaration;
import exm.qua.ir.tree.Loops.ForEachIterator;
import exm.qua.ir.tree.Loops.ForEachStatement;
import exm.qua.ir.tree.Loops.ForStatement;
import exm.qua.ir.tree.Loops.StrictTiming;
import exm.qua.ir.tree.MeasureProcess;
import exm.qua.ir.tree.Statement;

/**
 * Session that builds one QUA program.  Each DSL call appends to the
 * block of the innermost open scope.  Block constructs return a scope
 * that must be closed, normally with try-with-resources:
 * <pre>
 *   QuaBuilder q = new QuaBuilder();
 *   try (Scope prog = q.program()) {
 *     QuaExpression n = q.declare(VarType.INT);
 *     try (Scope loop = q.for_(n, 0, n.lt(10), n.add(1))) {
 *       q.play("pi", "q1");
 *     }
 *   }
 *   Program p = q.getProgram();
 * </pre>
 * A builder is not thread safe, but builders share no state, so
 * separate threads may build separate programs.
 */
public class QuaBuilder {

  /** 1 / (2 pi): converts radians to the units of frame_rotation_2pi */
  private static final double RADIANS_TO_2PI = 0.15915494309189535;

  /** Upper bound of random seeds, exclusive */
  private static final int MAX_RANDOM_SEED = (1 << 28) - 1;

  private static final String TIMESTAMPS_SUFFIX = "_timestamps";

  private static final String ADC_WARNING = "Streaming adc data without " +
      "declaring the stream with declare_stream(adc_trace=true) might " +
      "cause performance issues";

  private final ScopeStack stack = new ScopeStack();

  private final Logger logger = Logging.getQuaLogger();

  private ProgramScope programScope = null;

  /**
   * Open the program root.  A builder builds a single program.
   */
  public Scope program() {
    if (programScope != null) {
      throw new ScopeException("This builder already built a program: " +
                               "use a new QuaBuilder for each program");
    }
    programScope = new ProgramScope(stack, new Program());
    stack.push(programScope);
    logger.debug("Building program at " + SourceLocations.capture());
    return programScope;
  }

  /**
   * @return the program, complete once its scope is closed
   */
  public Program getProgram() {
    if (programScope == null) {
      throw new ScopeException("Expecting program scope: no program was " +
                               "built");
    }
    return programScope.program();
  }

  /*
   * Declarations
   */

  public QuaExpression declare(VarType type) {
    return declareVariable(type, null, nextScalar(), false);
  }

  /**
   * @param value initial value; a host list or array declares an array
   */
  public QuaExpression declare(VarType type, Object value) {
    if (Literals.isHostList(value)) {
      return declareArray(type, Literals.toHostList(value));
    }
    return declareVariable(type, value, nextScalar(), false);
  }

  public QuaExpression declareArray(VarType type, int size) {
    return declareArrayVariable(type, size, nextArray(), false);
  }

  public QuaExpression declareArray(VarType type, List<?> values) {
    return declareArrayVariable(type, values, nextArray(), false);
  }

  /**
   * Variable the host can push values to while the program runs
   */
  public QuaExpression declareInputStream(VarType type, String name) {
    return declareVariable(type, null, inputStreamName(name), true);
  }

  public QuaExpression declareInputStream(VarType type, String name,
                                          Object value) {
    String varName = inputStreamName(name);
    if (Literals.isHostList(value)) {
      return declareArrayVariable(type, Literals.toHostList(value), varName,
                                  true);
    }
    return declareVariable(type, value, varName, true);
  }

  public QuaExpression declareInputStreamArray(VarType type, String name,
                                               int size) {
    return declareArrayVariable(type, size, inputStreamName(name), true);
  }

  public ResultSource declareStream() {
    return declareStream(false);
  }

  /**
   * @param adcTrace true for a stream of raw ADC samples from measure
   */
  public ResultSource declareStream(boolean adcTrace) {
    ProgramScope prog = stack.programScope();
    return new ResultSource(this, prog.symbols().nextStream(adcTrace),
                            adcTrace);
  }

  private String nextScalar() {
    return stack.programScope().symbols().nextScalar();
  }

  private String nextArray() {
    return stack.programScope().symbols().nextArray();
  }

  private QuaExpression declareVariable(VarType type, Object value,
                                        String name, boolean inputStream) {
    List<Literal> values = new ArrayList<Literal>();
    if (value != null) {
      values.add(castLiteral(type, value));
    }
    addDeclaration(new VarDeclaration(name, type, false, 0, values,
                                      inputStream));
    return new QuaExpression(new Variable(name));
  }

  private QuaExpression declareArrayVariable(VarType type, int size,
                                    String name, boolean inputStream) {
    if (size <= 0) {
      throw new InvalidDeclarationException(
                          "size must be a positive integer, but was " + size);
    }
    addDeclaration(new VarDeclaration(name, type, true, size,
                            Collections.<Literal>emptyList(), inputStream));
    return new QuaExpression(new ArrayVar(name));
  }

  private QuaExpression declareArrayVariable(VarType type, List<?> values,
                                    String name, boolean inputStream) {
    if (values.isEmpty()) {
      throw new InvalidDeclarationException("values cannot be empty");
    }
    List<Literal> literals = new ArrayList<Literal>(values.size());
    for (Object v: values) {
      literals.add(castLiteral(type, v));
    }
    addDeclaration(new VarDeclaration(name, type, true, literals.size(),
                                      literals, inputStream));
    return new QuaExpression(new ArrayVar(name));
  }

  private void addDeclaration(VarDeclaration decl) {
    stack.programScope().program().addVariable(decl);
    if (logger.isTraceEnabled()) {
      logger.trace("declared " + decl.dump());
    }
  }

  private String inputStreamName(String name) {
    if (name == null || name.isEmpty()) {
      throw new InvalidDeclarationException(
                                  "input stream declared without a name");
    }
    if (!stack.programScope().addInputStream(name)) {
      throw new InvalidDeclarationException("input stream already " +
                                            "declared: " + name);
    }
    return IRTree.INPUT_STREAM_PREFIX + name;
  }

  /**
   * Initial value of a variable of type.  Ints widen to fixed.
   */
  private static Literal castLiteral(VarType type, Object value) {
    VarType valueType = VarType.ofHostValue(value);
    if (valueType == type) {
      return Literals.toLiteral(value);
    } else if (type == VarType.FIXED && valueType == VarType.INT) {
      return Literal.createFixed(((Integer)value).doubleValue());
    }
    throw new TypeMismatchException("can not initialize " +
        type.scriptName() + " variable with " + Literals.describe(value));
  }

  /*
   * Statements
   */

  public void play(Object pulse, String element) {
    play(pulse, element, PlayOptions.options());
  }

  /**
   * @param pulse pulse name or {@link PlayPulse}
   */
  public void play(Object pulse, String element, PlayOptions options) {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    String timestampLabel = timestampLabel(options.timestampStream());
    block.add(new Play(loc, PlayPulse.from(pulse).toPulse(), element,
        Literals.toScalarOrNull(options.duration(), "duration"),
        Literals.toScalarOrNull(options.condition(), "condition"),
        options.chirp(),
        Literals.toScalarOrNull(options.truncate(), "truncate"),
        timestampLabel, options.continueChirp(), options.target()));
  }

  /**
   * @param stream declared stream, tag or null.  Raw ADC samples are
   *        streamed to it.
   */
  public void measure(Object pulse, String element, Object stream,
                      MeasureProcess... processes) {
    measure(pulse, element, stream, Arrays.asList(processes), null);
  }

  /**
   * @param timestampStream declared stream, tag or null
   */
  public void measure(Object pulse, String element, Object stream,
                      List<MeasureProcess> processes,
                      Object timestampStream) {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    ResultSource adcStream;
    if (stream == null) {
      adcStream = null;
    } else if (stream instanceof String) {
      adcStream = declareLegacyAdc((String)stream);
    } else if (stream instanceof ResultSource) {
      adcStream = (ResultSource)stream;
    } else {
      throw new TypeMismatchException("stream object is not of the right " +
                                      "type: " + Literals.describe(stream));
    }
    if (adcStream != null && !adcStream.isAdcTrace()) {
      Logging.uniqueWarn(ADC_WARNING);
    }
    String timestampLabel = timestampLabel(timestampStream);
    block.add(new Measure(loc, PlayPulse.from(pulse).toPulse(), element,
        adcStream == null ? null : adcStream.name(), processes,
        timestampLabel));
  }

  public void wait(Object duration, String... elements) {
    String loc = SourceLocations.capture();
    stack.currentBlock().add(new Wait(loc,
        Literals.toScalar(duration, "duration"), Arrays.asList(elements)));
  }

  public void waitForTrigger(String element) {
    waitForTrigger(element, null, null, null, null);
  }

  /**
   * @param pulse played while waiting, or null
   * @param triggerElement element whose digital input triggers, or null
   * @param triggerOutput output of the trigger element, or null
   * @param timeTagTarget variable receiving the trigger time, or null
   */
  public void waitForTrigger(String element, String pulse,
      String triggerElement, String triggerOutput, QuaExpression timeTagTarget) {
    String loc = SourceLocations.capture();
    Expr target = null;
    if (timeTagTarget != null) {
      target = assignTarget(timeTagTarget);
    }
    stack.currentBlock().add(new WaitForTrigger(loc, element, pulse,
                              triggerElement, triggerOutput, target));
  }

  /**
   * Align elements.  No elements aligns all elements of the program.
   */
  public void align(String... elements) {
    String loc = SourceLocations.capture();
    stack.currentBlock().add(new Align(loc, Arrays.asList(elements)));
  }

  /**
   * @param target variable, array cell or IO register
   */
  public void assign(QuaExpression target, Object value) {
    String loc = SourceLocations.capture();
    stack.currentBlock().add(new Assign(loc, assignTarget(target),
                              Literals.toScalar(value, "assigned value")));
  }

  /**
   * Stream a value: a variable, array cell or constant.
   * @param streamOrTag declared stream or tag.  A tag is saved directly
   *        under its name along with timestamps.
   */
  public void save(Object source, Object streamOrTag) {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    ResultSource stream;
    if (streamOrTag instanceof String) {
      stream = declareLegacySave((String)streamOrTag);
    } else if (streamOrTag instanceof ResultSource) {
      stream = (ResultSource)streamOrTag;
    } else {
      throw new TypeMismatchException("stream object is not of the right " +
          "type: " + Literals.describe(streamOrTag));
    }
    if (stream.isAdcTrace()) {
      throw new QuaException("adc_trace can't be used in save");
    }
    block.add(new Save(loc, saveSource(source), stream.name()));
  }

  public void pause() {
    stack.currentBlock().add(new Pause(SourceLocations.capture()));
  }

  public void updateFrequency(String element, Object value) {
    updateFrequency(element, value, FrequencyUnits.HZ, false);
  }

  /**
   * @param keepPhase if true, keep the accumulated phase
   */
  public void updateFrequency(String element, Object value,
                              FrequencyUnits units, boolean keepPhase) {
    String loc = SourceLocations.capture();
    stack.currentBlock().add(new UpdateFrequency(loc, element,
        Literals.toScalar(value, "frequency"), units, keepPhase));
  }

  /**
   * Set the 2x2 mixer correction matrix of element
   */
  public void updateCorrection(String element, Object c00, Object c01,
                               Object c10, Object c11) {
    String loc = SourceLocations.capture();
    List<Expr> matrix = new ArrayList<Expr>(4);
    for (Object c: new Object[] {c00, c01, c10, c11}) {
      matrix.add(Literals.toScalar(c, "correction matrix element"));
    }
    stack.currentBlock().add(new UpdateCorrection(loc, element, matrix));
  }

  /**
   * @param elementInput "single", "I" or "Q"
   */
  public void setDcOffset(String element, String elementInput,
                          Object offset) {
    String loc = SourceLocations.capture();
    stack.currentBlock().add(new SetDcOffset(loc, element, elementInput,
        Literals.toScalar(offset, "offset")));
  }

  /**
   * Wait for and read the next value pushed to an input stream
   */
  public void advanceInputStream(QuaExpression inputStream) {
    String loc = SourceLocations.capture();
    Expr expr = inputStream.expr();
    String name;
    if (expr.kind() == ExprKind.VARIABLE) {
      name = ((Variable)expr).name();
    } else if (expr.kind() == ExprKind.ARRAY_VAR) {
      name = ((ArrayVar)expr).name();
    } else {
      throw new TypeMismatchException(expr + " is not an input stream");
    }
    VarDeclaration decl =
          stack.programScope().program().lookupVariable(name);
    if (decl == null || !decl.isInputStream()) {
      throw new TypeMismatchException(expr + " is not an input stream");
    }
    stack.currentBlock().add(new AdvanceInputStream(loc, expr));
  }

  public void resetPhase(String element) {
    String loc = SourceLocations.capture();
    stack.currentBlock().add(new ResetPhase(loc, element));
  }

  public void resetFrame(String... elements) {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    for (String element: elements) {
      block.add(new ResetFrame(loc, element));
    }
  }

  public void rampToZero(String element) {
    rampToZero(element, null);
  }

  /**
   * @param duration ramp duration in ns, or null for the shortest
   */
  public void rampToZero(String element, Integer duration) {
    String loc = SourceLocations.capture();
    stack.currentBlock().add(new RampToZero(loc, element, duration));
  }

  /**
   * Shift the frame of elements by angle in radians
   */
  public void frameRotation(Object angle, String... elements) {
    if (angle instanceof Integer || angle instanceof Double) {
      // Host angles are converted here, not on the controller
      double turns = ((Number)angle).doubleValue() * RADIANS_TO_2PI;
      frameRotation2pi(turns, elements);
      return;
    }
    Expr turns = new Binary(BinaryOp.MUL,
                            Literals.toScalar(angle, "angle"),
                            Literal.createFixed(RADIANS_TO_2PI));
    frameRotation2pi(new QuaExpression(turns), elements);
  }

  /**
   * Shift the frame of elements by angle in units of 2 pi
   */
  public void frameRotation2pi(Object angle, String... elements) {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    Expr angleExpr = Literals.toScalar(angle, "angle");
    for (String element: elements) {
      block.add(new ZRotation(loc, angleExpr, element));
    }
  }

  public void fastFrameRotation(Object cosine, Object sine,
                                String... elements) {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    Expr cos = Literals.toScalar(cosine, "cosine");
    Expr sin = Literals.toScalar(sine, "sine");
    stack.programScope().program().setUsesFastFrameRotation();
    for (String element: elements) {
      block.add(new FastFrameRotation(loc, cos, sin, element));
    }
  }

  /*
   * Control flow
   */

  public Scope if_(Object condition) {
    return if_(condition, false);
  }

  /**
   * @param unsafe allow branches of different durations
   */
  public Scope if_(Object condition, boolean unsafe) {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    IfStatement ifStmt = new IfStatement(loc,
        Literals.toScalar(condition, "if condition"), unsafe);
    block.add(ifStmt);
    return pushBody(ifStmt.thenBlock());
  }

  /**
   * Must directly follow an if statement in the same block
   */
  public Scope elif_(Object condition) {
    IfStatement ifStmt = precedingIf("'elif' statement must directly " +
        "follow 'if' statement - Please make sure it is aligned with the " +
        "corresponding if statement.");
    if (ifStmt.hasElse()) {
      throw new ScopeException("'elif' must come before 'else' statement");
    }
    ElseIf elseIf = ifStmt.addElseIf(ifStmt.loc(),
        Literals.toScalar(condition, "elif condition"));
    return pushBody(elseIf.body());
  }

  public Scope else_() {
    IfStatement ifStmt = precedingIf("'else' statement must directly " +
        "follow 'if' statement - Please make sure it is aligned with the " +
        "corresponding if statement.");
    if (ifStmt.hasElse()) {
      throw new ScopeException("only a single 'else' statement can follow " +
                               "an 'if' statement");
    }
    return pushBody(ifStmt.addElse());
  }

  private IfStatement precedingIf(String message) {
    Block block = stack.currentBlock();
    Statement last = block.isEmpty() ? null : block.last();
    if (!(last instanceof IfStatement)) {
      throw new ScopeException(message);
    }
    return (IfStatement)last;
  }

  public Scope switch_(Object expression) {
    return switch_(expression, false);
  }

  /**
   * Only case_ and default_ may be called directly inside a switch.
   * The cases become an if/elif/else chain.
   */
  public Scope switch_(Object expression, boolean unsafe) {
    Block block = stack.currentBlock();
    SwitchScope sw = new SwitchScope(stack,
        Literals.toScalar(expression, "switch expression"), unsafe, block);
    stack.push(sw);
    return sw;
  }

  public Scope case_(Object value) {
    String loc = SourceLocations.capture();
    SwitchScope sw = stack.switchScope();
    if (sw.hasDefault()) {
      throw new ScopeException("'case' must come before 'default'");
    }
    Expr condition = new Binary(BinaryOp.EQ, sw.expression(),
                                Literals.toScalar(value, "case value"));
    IfStatement ifStmt = sw.ifStatement();
    if (ifStmt == null) {
      ifStmt = new IfStatement(loc, condition, sw.isUnsafe());
      sw.target().add(ifStmt);
      sw.setIfStatement(ifStmt);
      return stack.pushBody(sw, ifStmt.thenBlock());
    }
    ElseIf elseIf = ifStmt.addElseIf(ifStmt.loc(), condition);
    return stack.pushBody(sw, elseIf.body());
  }

  public Scope default_() {
    SwitchScope sw = stack.switchScope();
    if (sw.ifStatement() == null) {
      throw new ScopeException("must specify at least one case before " +
                               "'default'.");
    }
    if (sw.hasDefault()) {
      throw new ScopeException("only a single 'default' statement can " +
                               "follow a 'switch' statement");
    }
    sw.setHasDefault();
    return stack.pushBody(sw, sw.ifStatement().addElse());
  }

  /**
   * Loop assigning init to variable, then update after each iteration,
   * while condition holds
   */
  public Scope for_(QuaExpression variable, Object init, Object condition,
                    Object update) {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    Expr target = assignTarget(variable);
    ForStatement loop = new ForStatement(loc,
        Literals.toScalar(condition, "loop condition"));
    loop.init().add(new Assign(loc, target,
                               Literals.toScalar(init, "loop init")));
    loop.update().add(new Assign(loc, target,
                                 Literals.toScalar(update, "loop update")));
    block.add(loop);
    return pushBody(loop.body());
  }

  /**
   * Loop with separately built sections:
   * <pre>
   *   try (ForScope f = q.for_()) {
   *     try (Scope s = f.init()) { q.assign(i, 0); }
   *     f.condition(i.lt(10));
   *     try (Scope s = f.update()) { q.assign(i, i.add(1)); }
   *     try (Scope s = f.body()) { ... }
   *   }
   * </pre>
   */
  public ForScope for_() {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    ForStatement loop = new ForStatement(loc, null);
    block.add(loop);
    ForScope scope = new ForScope(stack, loop);
    stack.push(scope);
    return scope;
  }

  public Scope while_(Object condition) {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    ForStatement loop = new ForStatement(loc,
        Literals.toScalar(condition, "loop condition"));
    block.add(loop);
    return pushBody(loop.body());
  }

  /**
   * Loop forever.  Has no latency between iterations if only one
   * element is used inside.
   */
  public Scope infiniteLoop_() {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    ForStatement loop = new ForStatement(loc, Literal.createBool(true));
    block.add(loop);
    return pushBody(loop.body());
  }

  /**
   * Iterate variable over an array or a host list
   */
  public Scope forEach_(QuaExpression variable, Object values) {
    List<QuaExpression> vars = new ArrayList<QuaExpression>();
    vars.add(variable);
    List<Object> valueLists = new ArrayList<Object>();
    valueLists.add(values);
    return forEach_(vars, valueLists);
  }

  /**
   * Iterate several variables in lock step, each over its own array
   * or host list
   */
  public Scope forEach_(List<QuaExpression> variables, List<?> values) {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    for (int i = 0; i < variables.size(); i++) {
      if (variables.get(i) == null || !variables.get(i).isVariable()) {
        throw new TypeMismatchException("for_each_ var " + i +
                                        " must be a variable");
      }
    }
    if (values.isEmpty()) {
      throw new InvalidDeclarationException("values cannot be empty");
    }
    if (variables.size() != values.size()) {
      throw new TypeMismatchException("number of variables does not match " +
                                      "number of array values");
    }
    List<ForEachIterator> iterators = new ArrayList<ForEachIterator>();
    for (int i = 0; i < values.size(); i++) {
      Object value = values.get(i);
      ArrayVar array;
      if (value instanceof QuaExpression &&
          ((QuaExpression)value).isArray()) {
        array = (ArrayVar)((QuaExpression)value).expr();
      } else if (Literals.isHostList(value)) {
        List<?> list = Literals.toHostList(value);
        VarType type = Literals.inferArrayType(list);
        array = (ArrayVar)declareArray(type, list).expr();
      } else {
        throw new TypeMismatchException("value is not a QUA array neither " +
                                        "iterable: " + value);
      }
      iterators.add(new ForEachIterator(
                        (Variable)variables.get(i).expr(), array));
    }
    ForEachStatement forEach = new ForEachStatement(loc, iterators,
                                                    new Block());
    block.add(forEach);
    return pushBody(forEach.body());
  }

  /**
   * Statements inside run with exact timing, or the program fails
   */
  public Scope strictTiming_() {
    String loc = SourceLocations.capture();
    Block block = stack.currentBlock();
    StrictTiming strict = new StrictTiming(loc, new Block());
    block.add(strict);
    return pushBody(strict.body());
  }

  /**
   * Open the stream processing section, where streams are transformed
   * and saved.  Must be directly inside the program.
   */
  public Scope streamProcessing() {
    ProgramScope prog = stack.programScope();
    stack.checkTop(prog, "Expecting program scope: stream_processing() " +
                         "must be directly inside the program");
    ResultAnalysisScope scope = new ResultAnalysisScope(stack,
                                        prog.program().results());
    stack.push(scope);
    return scope;
  }

  private BodyScope pushBody(Block block) {
    BodyScope scope = new BodyScope(stack, block);
    stack.push(scope);
    return scope;
  }

  /*
   * Libraries
   */

  public QuaMath math() {
    return new QuaMath(this);
  }

  public QuaCast cast() {
    return new QuaCast(this);
  }

  public QuaUtil util() {
    return new QuaUtil(this);
  }

  /**
   * Random generator with a seed chosen on the host
   */
  public QuaRandom random() {
    return random(new Random().nextInt(MAX_RANDOM_SEED));
  }

  public QuaRandom random(int seed) {
    return new QuaRandom(this, seed);
  }

  /**
   * Call a library function.  Host lists among the arguments are
   * declared as arrays first.
   */
  public QuaExpression callLibraryFunction(Library library, String function,
                                           Object... args) {
    library.checkFunction(function);
    List<Expr> exprs = new ArrayList<Expr>(args.length);
    for (Object arg: args) {
      if (Literals.isHostList(arg)) {
        List<?> list = Literals.toHostList(arg);
        exprs.add(declareArray(Literals.inferArrayType(list), list).expr());
      } else {
        exprs.add(Literals.toExpr(arg));
      }
    }
    return new QuaExpression(new LibCall(library, function, exprs));
  }

  /*
   * Streams
   */

  /**
   * Register a save of stream under tag.  Called by
   * {@link ResultStream#save(String)} and {@link ResultStream#saveAll(String)}.
   */
  public void saveStream(ResultStream stream, String tag, boolean all) {
    ResultAnalysis results = stack.resultAnalysisScope().results();
    if (all) {
      results.saveAll(tag, stream.toTokens());
    } else {
      results.save(tag, stream.toTokens());
    }
  }

  /**
   * Stream for save(x, tag): saved under tag, timestamps under
   * tag_timestamps
   */
  private ResultSource declareLegacySave(String tag) {
    ProgramScope prog = stack.programScope();
    ResultSource stream = prog.taggedStream(tag);
    if (stream == null) {
      stream = declareStream(false);
      prog.addTaggedStream(tag, stream);
      ResultAnalysis results = prog.program().results();
      results.autoSaveAll(tag, stream.toTokens());
      results.autoSaveAll(tag + TIMESTAMPS_SUFFIX,
                          stream.timestamps().toTokens());
    }
    return stream;
  }

  /**
   * Stream for a timestamp tag: saved under tag
   */
  private ResultSource declareSave(String tag) {
    ProgramScope prog = stack.programScope();
    ResultSource stream = prog.taggedStream(tag);
    if (stream == null) {
      stream = declareStream(false);
      prog.addTaggedStream(tag, stream);
      prog.program().results().autoSaveAll(tag, stream.toTokens());
    }
    return stream;
  }

  /**
   * ADC stream for measure(..., tag): each input and its timestamps
   * saved under tag_input1, tag_input1_timestamps, ...
   */
  private ResultSource declareLegacyAdc(String tag) {
    ProgramScope prog = stack.programScope();
    ResultSource stream = prog.taggedStream(tag);
    if (stream == null) {
      stream = declareStream(true);
      prog.addTaggedStream(tag, stream);
      ResultAnalysis results = prog.program().results();
      results.autoSaveAll(tag + "_input1", stream.input1().toTokens());
      results.autoSaveAll(tag + "_input1" + TIMESTAMPS_SUFFIX,
                          stream.input1().timestamps().toTokens());
      results.autoSaveAll(tag + "_input2", stream.input2().toTokens());
      results.autoSaveAll(tag + "_input2" + TIMESTAMPS_SUFFIX,
                          stream.input2().timestamps().toTokens());
    }
    return stream;
  }

  private String timestampLabel(Object timestampStream) {
    if (timestampStream == null) {
      return null;
    }
    ResultSource stream;
    if (timestampStream instanceof String) {
      stream = declareSave((String)timestampStream);
    } else if (timestampStream instanceof ResultSource) {
      stream = (ResultSource)timestampStream;
    } else {
      throw new TypeMismatchException("timestamp stream must be a stream " +
          "or tag, but got " + Literals.describe(timestampStream));
    }
    stack.programScope().program().setUsesCommandTimestamps();
    return stream.name();
  }

  private static Expr assignTarget(QuaExpression target) {
    if (target == null) {
      throw new TypeMismatchException("invalid target expression: null");
    }
    Expr expr = target.expr();
    if (expr.kind() != ExprKind.VARIABLE &&
        expr.kind() != ExprKind.ARRAY_CELL) {
      throw new TypeMismatchException("invalid target expression: " + expr);
    }
    return expr;
  }

  private static Expr saveSource(Object source) {
    Expr expr = Literals.toScalar(source, "saved value");
    if (expr.kind() != ExprKind.VARIABLE &&
        expr.kind() != ExprKind.ARRAY_CELL &&
        expr.kind() != ExprKind.LITERAL) {
      throw new TypeMismatchException("invalid source expression: " + expr);
    }
    return expr;
  }
}
