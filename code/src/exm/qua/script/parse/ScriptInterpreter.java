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
package exm.qua.script.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.antlr.v4.runtime.ParserRuleContext;
import org.apache.log4j.Logger;

import exm.qua.common.Logging;
import exm.qua.common.exceptions.InvalidDeclarationException;
import exm.qua.common.exceptions.InvalidSyntaxException;
import exm.qua.common.exceptions.QuaException;
import exm.qua.common.exceptions.TypeMismatchException;
import exm.qua.common.lang.Library;
import exm.qua.common.lang.Units.FrequencyUnits;
import exm.qua.common.lang.VarType;
import exm.qua.frontend.MeasureProcesses;
import exm.qua.frontend.MeasureProcesses.Accumulation;
import exm.qua.frontend.MeasureProcesses.DualAccumulation;
import exm.qua.frontend.PlayOptions;
import exm.qua.frontend.PlayPulse;
import exm.qua.frontend.QuaBuilder;
import exm.qua.frontend.QuaExpression;
import exm.qua.frontend.Scope;
import exm.qua.frontend.stream.ResultSource;
import exm.qua.frontend.stream.ResultStream;
import exm.qua.frontend.stream.StreamFunctions;
import exm.qua.ir.stream.StreamToken;
import exm.qua.ir.tree.IRTree.Program;
import exm.qua.ir.tree.MeasureProcess;
import exm.qua.ir.tree.MeasureProcess.Family;
import exm.qua.script.ScriptStrings;
import exm.qua.script.parse.QuaScriptParser.ArgumentContext;
import exm.qua.script.parse.QuaScriptParser.ArgumentsContext;
import exm.qua.script.parse.QuaScriptParser.AssignStatementContext;
import exm.qua.script.parse.QuaScriptParser.BinaryContext;
import exm.qua.script.parse.QuaScriptParser.CallContext;
import exm.qua.script.parse.QuaScriptParser.CallHeaderContext;
import exm.qua.script.parse.QuaScriptParser.CompoundStatementContext;
import exm.qua.script.parse.QuaScriptParser.DictContext;
import exm.qua.script.parse.QuaScriptParser.EntryContext;
import exm.qua.script.parse.QuaScriptParser.ExprContext;
import exm.qua.script.parse.QuaScriptParser.ExprStatementContext;
import exm.qua.script.parse.QuaScriptParser.FalseLiteralContext;
import exm.qua.script.parse.QuaScriptParser.FloatLiteralContext;
import exm.qua.script.parse.QuaScriptParser.IndexContext;
import exm.qua.script.parse.QuaScriptParser.IntLiteralContext;
import exm.qua.script.parse.QuaScriptParser.ListContext;
import exm.qua.script.parse.QuaScriptParser.MethodCallContext;
import exm.qua.script.parse.QuaScriptParser.NameContext;
import exm.qua.script.parse.QuaScriptParser.NegateContext;
import exm.qua.script.parse.QuaScriptParser.NullLiteralContext;
import exm.qua.script.parse.QuaScriptParser.ParensContext;
import exm.qua.script.parse.QuaScriptParser.PassStatementContext;
import exm.qua.script.parse.QuaScriptParser.PrimaryExprContext;
import exm.qua.script.parse.QuaScriptParser.ProgramHeaderContext;
import exm.qua.script.parse.QuaScriptParser.ScriptContext;
import exm.qua.script.parse.QuaScriptParser.StatementContext;
import exm.qua.script.parse.QuaScriptParser.StringLiteralContext;
import exm.qua.script.parse.QuaScriptParser.TrueLiteralContext;
import exm.qua.script.parse.QuaScriptParser.TupleContext;
import exm.qua.script.parse.QuaScriptParser.UseStatementContext;

/**
 * Rebuilds a program from a QUA script.
 *
 * Each script runs in a fresh {@link QuaBuilder} with an empty namespace,
 * and every statement goes through the public builder API, the same
 * calls a Java program would make.  Names resolve to variables bound by
 * assignments in the script, then to the builtin types and namespaces.
 */
public class ScriptInterpreter extends QuaScriptBaseVisitor<Object> {

  public static final String MODULE = "qua";

  private final Logger logger = Logging.getQuaLogger();

  private final QuaBuilder builder = new QuaBuilder();

  /** Names bound by the script */
  private final Map<String, Object> env = new HashMap<String, Object>();

  private final Map<String, Object> builtins = new HashMap<String, Object>();

  private boolean programBuilt = false;

  private ScriptInterpreter() {
    for (VarType t: VarType.values()) {
      builtins.put(t.scriptName(), t);
    }
    for (Library l: Library.values()) {
      builtins.put(l.scriptName(), new LibraryNamespace(l));
    }
    for (Family f: Family.values()) {
      builtins.put(f.scriptName(), new ProcessNamespace(f));
    }
    builtins.put("FUNCTIONS", FunctionNamespace.INSTANCE);
    builtins.put("IO1", QuaExpression.IO1);
    builtins.put("IO2", QuaExpression.IO2);
  }

  /**
   * Parse and run script
   * @return the program the script builds
   * @throws InvalidSyntaxException if the text is not a valid script
   * @throws QuaException if the script misuses the DSL
   */
  public static Program run(String script) throws InvalidSyntaxException {
    ScriptContext tree = ScriptParser.parse(script);
    ScriptInterpreter interpreter = new ScriptInterpreter();
    try {
      interpreter.visit(tree);
    } catch (BadLiteral e) {
      throw e.error;
    }
    if (!interpreter.programBuilt) {
      throw new InvalidSyntaxException("script does not define a program");
    }
    return interpreter.builder.getProgram();
  }

  /**
   * Script values bound at top level, e.g. a configuration
   */
  public static Map<String, Object> bindings(String script)
      throws InvalidSyntaxException {
    ScriptContext tree = ScriptParser.parse(script);
    ScriptInterpreter interpreter = new ScriptInterpreter();
    try {
      interpreter.visit(tree);
    } catch (BadLiteral e) {
      throw e.error;
    }
    return Collections.unmodifiableMap(interpreter.env);
  }

  /*
   * Statements
   */

  @Override
  public Object visitScript(ScriptContext ctx) {
    for (StatementContext stmt: ctx.statement()) {
      visit(stmt);
    }
    logger.debug("Interpreted script of " + ctx.statement().size() +
                 " top level statements");
    return null;
  }

  @Override
  public Object visitStatement(StatementContext ctx) {
    if (ctx.simpleStatement() != null) {
      return visit(ctx.simpleStatement());
    }
    return visit(ctx.compoundStatement());
  }

  @Override
  public Object visitCompoundStatement(CompoundStatementContext ctx) {
    if (ctx.blockHeader() instanceof ProgramHeaderContext) {
      programBuilt = true;
      try (Scope s = builder.program()) {
        visitBody(ctx.statement());
      }
      return null;
    }
    Object opened = visit(((CallHeaderContext)ctx.blockHeader()).expr());
    if (!(opened instanceof Scope)) {
      throw new QuaException(at(ctx), "'" + ctx.blockHeader().getText() +
                             "' does not open a block");
    }
    try (Scope s = (Scope)opened) {
      visitBody(ctx.statement());
    }
    return null;
  }

  private void visitBody(List<StatementContext> statements) {
    for (StatementContext stmt: statements) {
      visit(stmt);
    }
  }

  @Override
  public Object visitUseStatement(UseStatementContext ctx) {
    String module = ctx.IDENT().getText();
    if (!module.equals(MODULE)) {
      throw new QuaException(at(ctx), "unknown module " + module);
    }
    return null;
  }

  @Override
  public Object visitPassStatement(PassStatementContext ctx) {
    return null;
  }

  @Override
  public Object visitAssignStatement(AssignStatementContext ctx) {
    env.put(ctx.IDENT().getText(), visit(ctx.expr()));
    return null;
  }

  @Override
  public Object visitExprStatement(ExprStatementContext ctx) {
    return visit(ctx.expr());
  }

  /*
   * Expressions
   */

  @Override
  public Object visitPrimaryExpr(PrimaryExprContext ctx) {
    return visit(ctx.primary());
  }

  @Override
  public Object visitIntLiteral(IntLiteralContext ctx) {
    String text = ctx.INT().getText();
    try {
      return Integer.valueOf(text);
    } catch (NumberFormatException e) {
      // Only the negation of this can fit an int
      try {
        return Long.valueOf(text);
      } catch (NumberFormatException e2) {
        throw new BadLiteral(new InvalidSyntaxException(
            ctx.getStart().getLine(), ctx.getStart().getCharPositionInLine(),
            "integer literal out of range: " + text));
      }
    }
  }

  @Override
  public Object visitFloatLiteral(FloatLiteralContext ctx) {
    return Double.valueOf(ctx.FLOAT().getText());
  }

  @Override
  public Object visitStringLiteral(StringLiteralContext ctx) {
    return string(ctx, ctx.STRING().getText());
  }

  private String string(ParserRuleContext ctx, String token) {
    try {
      return ScriptStrings.unescape(ScriptStrings.unquote(token));
    } catch (InvalidSyntaxException e) {
      throw new BadLiteral(new InvalidSyntaxException(
          ctx.getStart().getLine(), ctx.getStart().getCharPositionInLine(),
          e.getMessage()));
    }
  }

  @Override
  public Object visitTrueLiteral(TrueLiteralContext ctx) {
    return Boolean.TRUE;
  }

  @Override
  public Object visitFalseLiteral(FalseLiteralContext ctx) {
    return Boolean.FALSE;
  }

  @Override
  public Object visitNullLiteral(NullLiteralContext ctx) {
    return null;
  }

  @Override
  public Object visitName(NameContext ctx) {
    String name = ctx.IDENT().getText();
    if (env.containsKey(name)) {
      return env.get(name);
    } else if (builtins.containsKey(name)) {
      return builtins.get(name);
    }
    throw new QuaException(at(ctx), "name '" + name + "' is not defined");
  }

  @Override
  public Object visitParens(ParensContext ctx) {
    return visit(ctx.expr());
  }

  @Override
  public Object visitTuple(TupleContext ctx) {
    return Collections.unmodifiableList(evalAll(ctx.expr()));
  }

  @Override
  public Object visitList(ListContext ctx) {
    return evalAll(ctx.expr());
  }

  @Override
  public Object visitDict(DictContext ctx) {
    Map<String, Object> res = new LinkedHashMap<String, Object>();
    for (EntryContext entry: ctx.entry()) {
      res.put(string(entry, entry.STRING().getText()), visit(entry.expr()));
    }
    return res;
  }

  private List<Object> evalAll(List<ExprContext> exprs) {
    List<Object> res = new ArrayList<Object>(exprs.size());
    for (ExprContext e: exprs) {
      res.add(visit(e));
    }
    return res;
  }

  @Override
  public Object visitNegate(NegateContext ctx) {
    Object v = visit(ctx.expr());
    if (v instanceof Integer) {
      return -(Integer)v;
    } else if (v instanceof Long) {
      long l = -(Long)v;
      if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
        return (int)l;
      }
      return l;
    } else if (v instanceof Double) {
      return -(Double)v;
    } else if (v instanceof QuaExpression) {
      return ((QuaExpression)v).neg();
    }
    throw new TypeMismatchException("bad operand for unary -: " +
                                    describe(v));
  }

  @Override
  public Object visitIndex(IndexContext ctx) {
    Object target = visit(ctx.expr(0));
    Object index = visit(ctx.expr(1));
    if (target instanceof QuaExpression) {
      return ((QuaExpression)target).get(index);
    } else if (target instanceof List && index instanceof Integer) {
      return ((List<?>)target).get((Integer)index);
    }
    throw new TypeMismatchException(describe(target) +
                                    " can not be indexed");
  }

  @Override
  public Object visitBinary(BinaryContext ctx) {
    Object left = visit(ctx.expr(0));
    Object right = visit(ctx.expr(1));
    return binary(ctx.op.getText(), left, right);
  }

  /**
   * Operators are never evaluated on the host: even two numbers give a
   * QUA expression, as they did in the program the script came from
   */
  private Object binary(String op, Object left, Object right) {
    if (left instanceof ResultStream) {
      return ((ResultStream)left).binary(op, right);
    } else if (left instanceof String && right instanceof Amp &&
               op.equals("*")) {
      return ((Amp)right).scale((String)left);
    } else if (left instanceof List && right instanceof List &&
               op.equals("+")) {
      List<Object> res = new ArrayList<Object>((List<?>)left);
      res.addAll((List<?>)right);
      return res;
    } else if (left instanceof List && right instanceof Integer &&
               op.equals("*")) {
      List<Object> res = new ArrayList<Object>();
      for (int i = 0; i < (Integer)right; i++) {
        res.addAll((List<?>)left);
      }
      return res;
    } else if (left instanceof QuaExpression) {
      return ((QuaExpression)left).binary(op, right);
    } else if (isHostScalar(left) &&
               (isHostScalar(right) || right instanceof QuaExpression)) {
      return QuaExpression.literal(left).binary(op, right);
    }
    throw new TypeMismatchException("unsupported operand types for " + op +
        ": " + describe(left) + " and " + describe(right));
  }

  private static boolean isHostScalar(Object v) {
    return v instanceof Boolean || v instanceof Integer ||
           v instanceof Double;
  }

  private CallArgs arguments(String function, ArgumentsContext ctx) {
    CallArgs args = new CallArgs(function);
    if (ctx == null) {
      return args;
    }
    for (ArgumentContext arg: ctx.argument()) {
      Object value = visit(arg.expr());
      if (arg.IDENT() != null) {
        args.add(arg.IDENT().getText(), value);
      } else {
        args.add(value);
      }
    }
    return args;
  }

  @Override
  public Object visitMethodCall(MethodCallContext ctx) {
    Object target = visit(ctx.expr());
    String method = ctx.IDENT().getText();
    CallArgs args = arguments(method, ctx.arguments());
    if (target instanceof LibraryNamespace) {
      args.expect(0, -1);
      return builder.callLibraryFunction(((LibraryNamespace)target).library,
                                         method, args.positional().toArray());
    } else if (target instanceof ProcessNamespace) {
      return measureProcess(((ProcessNamespace)target).family, method, args);
    } else if (target instanceof FunctionNamespace) {
      return streamFunction(method, args);
    } else if (target instanceof ResultSource &&
               isSourceModifier(method)) {
      args.expect(0, 0);
      return sourceModifier((ResultSource)target, method);
    } else if (target instanceof ResultStream) {
      return streamOperator((ResultStream)target, method, args);
    } else if (target instanceof QuaExpression && method.equals("length")) {
      args.expect(0, 0);
      return ((QuaExpression)target).length();
    }
    throw new QuaException(at(ctx), describe(target) + " has no method " +
                           method + "()");
  }

  @Override
  public Object visitCall(CallContext ctx) {
    String name = ctx.IDENT().getText();
    CallArgs args = arguments(name, ctx.arguments());
    return call(name, args, ctx);
  }

  /*
   * Builtin functions
   */

  private Object call(String name, CallArgs args, ParserRuleContext ctx) {
    if (name.equals("declare")) {
      args.expect(1, 2, "value", "size");
      return declare(args);
    } else if (name.equals("declare_input_stream")) {
      args.expect(2, 3, "value", "size");
      return declareInputStream(args);
    } else if (name.equals("declare_stream")) {
      args.expect(0, 0, "adc_trace");
      return builder.declareStream(args.bool(-1, "adc_trace", false));
    } else if (name.equals("play")) {
      args.expect(2, 2, "duration", "condition", "chirp", "truncate",
                  "timestamp_stream", "continue_chirp", "target");
      builder.play(args.get(0), args.string(1), playOptions(args));
    } else if (name.equals("measure")) {
      args.expect(3, -1, "timestamp_stream");
      List<MeasureProcess> processes = new ArrayList<MeasureProcess>();
      for (Object p: args.rest(3)) {
        if (!(p instanceof MeasureProcess)) {
          throw new TypeMismatchException("measure(): " + describe(p) +
                                          " is not a measure process");
        }
        processes.add((MeasureProcess)p);
      }
      builder.measure(args.get(0), args.string(1), args.get(2), processes,
                      args.get(-1, "timestamp_stream"));
    } else if (name.equals("wait")) {
      args.expect(1, -1);
      builder.wait(args.get(0), strings(args, 1));
    } else if (name.equals("wait_for_trigger")) {
      args.expect(1, 1, "pulse", "trigger_element", "trigger_output",
                  "time_tag_target");
      builder.waitForTrigger(args.string(0),
          args.optionalString(-1, "pulse"),
          args.optionalString(-1, "trigger_element"),
          args.optionalString(-1, "trigger_output"),
          args.expression(-1, "time_tag_target"));
    } else if (name.equals("align")) {
      builder.align(strings(args, 0));
    } else if (name.equals("assign")) {
      args.expect(2, 2);
      builder.assign(args.expression(0), args.get(1));
    } else if (name.equals("save")) {
      args.expect(2, 2);
      builder.save(args.get(0), args.get(1));
    } else if (name.equals("pause")) {
      args.expect(0, 0);
      builder.pause();
    } else if (name.equals("update_frequency")) {
      args.expect(2, 4, "units", "keep_phase");
      FrequencyUnits units = args.has(2, "units") ?
          FrequencyUnits.parse(args.string(2, "units")) : FrequencyUnits.HZ;
      builder.updateFrequency(args.string(0), args.get(1), units,
                              args.bool(3, "keep_phase", false));
    } else if (name.equals("update_correction")) {
      args.expect(5, 5);
      builder.updateCorrection(args.string(0), args.get(1), args.get(2),
                               args.get(3), args.get(4));
    } else if (name.equals("set_dc_offset")) {
      args.expect(3, 3);
      builder.setDcOffset(args.string(0), args.string(1), args.get(2));
    } else if (name.equals("advance_input_stream")) {
      args.expect(1, 1);
      builder.advanceInputStream(args.expression(0));
    } else if (name.equals("reset_phase")) {
      args.expect(1, 1);
      builder.resetPhase(args.string(0));
    } else if (name.equals("reset_frame")) {
      args.expect(1, -1);
      builder.resetFrame(strings(args, 0));
    } else if (name.equals("ramp_to_zero")) {
      args.expect(1, 2, "duration");
      Object duration = args.get(1, "duration");
      if (duration == null) {
        builder.rampToZero(args.string(0));
      } else {
        builder.rampToZero(args.string(0), args.asInt(duration, "duration"));
      }
    } else if (name.equals("frame_rotation")) {
      args.expect(2, -1);
      builder.frameRotation(args.get(0), strings(args, 1));
    } else if (name.equals("frame_rotation_2pi")) {
      args.expect(2, -1);
      builder.frameRotation2pi(args.get(0), strings(args, 1));
    } else if (name.equals("fast_frame_rotation")) {
      args.expect(3, -1);
      builder.fastFrameRotation(args.get(0), args.get(1), strings(args, 2));
    } else if (name.equals("if_")) {
      args.expect(1, 2, "unsafe");
      return builder.if_(args.get(0), args.bool(1, "unsafe", false));
    } else if (name.equals("elif_")) {
      args.expect(1, 1);
      return builder.elif_(args.get(0));
    } else if (name.equals("else_")) {
      args.expect(0, 0);
      return builder.else_();
    } else if (name.equals("switch_")) {
      args.expect(1, 2, "unsafe");
      return builder.switch_(args.get(0), args.bool(1, "unsafe", false));
    } else if (name.equals("case_")) {
      args.expect(1, 1);
      return builder.case_(args.get(0));
    } else if (name.equals("default_")) {
      args.expect(0, 0);
      return builder.default_();
    } else if (name.equals("for_")) {
      args.expect(4, 4);
      return builder.for_(args.expression(0), args.get(1), args.get(2),
                          args.get(3));
    } else if (name.equals("while_")) {
      args.expect(1, 1);
      return builder.while_(args.get(0));
    } else if (name.equals("infinite_loop_")) {
      args.expect(0, 0);
      return builder.infiniteLoop_();
    } else if (name.equals("for_each_")) {
      args.expect(2, 2);
      return forEach(args.get(0), args.get(1));
    } else if (name.equals("strict_timing_")) {
      args.expect(0, 0);
      return builder.strictTiming_();
    } else if (name.equals("stream_processing")) {
      args.expect(0, 0);
      return builder.streamProcessing();
    } else if (name.equals("amp")) {
      args.expect(1, 4);
      return new Amp(args.positional());
    } else if (name.equals("ramp")) {
      args.expect(1, 1);
      return PlayPulse.ramp(args.get(0));
    } else if (name.equals("bins")) {
      args.expect(3, 3);
      return StreamFunctions.bins(args.integer(0), args.integer(1),
                                  args.integer(2));
    } else {
      throw new QuaException(at(ctx), "name '" + name + "' is not defined");
    }
    return null;
  }

  private QuaExpression declare(CallArgs args) {
    VarType type = varType(args.get(0));
    Object value = args.get(1, "value");
    Object size = args.get(-1, "size");
    if (value != null && size != null) {
      throw new InvalidDeclarationException("declare() takes a value or " +
                                            "a size, not both");
    }
    if (size != null) {
      return builder.declareArray(type, args.asInt(size, "size"));
    } else if (value != null) {
      return builder.declare(type, value);
    }
    return builder.declare(type);
  }

  private QuaExpression declareInputStream(CallArgs args) {
    VarType type = varType(args.get(0));
    String name = args.string(1, "name");
    Object value = args.get(2, "value");
    Object size = args.get(-1, "size");
    if (value != null && size != null) {
      throw new InvalidDeclarationException("declare_input_stream() takes " +
                                            "a value or a size, not both");
    }
    if (size != null) {
      return builder.declareInputStreamArray(type, name,
                                             args.asInt(size, "size"));
    } else if (value != null) {
      return builder.declareInputStream(type, name, value);
    }
    return builder.declareInputStream(type, name);
  }

  private static VarType varType(Object v) {
    if (!(v instanceof VarType)) {
      throw new TypeMismatchException("expected a QUA type (int, fixed or " +
                                      "bool), got " + describe(v));
    }
    return (VarType)v;
  }

  private PlayOptions playOptions(CallArgs args) {
    PlayOptions options = PlayOptions.options();
    if (args.get(-1, "duration") != null) {
      options.duration(args.get(-1, "duration"));
    }
    if (args.get(-1, "condition") != null) {
      options.condition(args.get(-1, "condition"));
    }
    Object chirp = args.get(-1, "chirp");
    if (chirp != null) {
      if (!(chirp instanceof List) || ((List<?>)chirp).size() != 3) {
        throw new TypeMismatchException("chirp must be (rates, times, " +
                                        "units), got " + describe(chirp));
      }
      List<?> parts = (List<?>)chirp;
      Object rates = parts.get(0);
      String units = args.asString(parts.get(2), "chirp units");
      if (rates instanceof List) {
        options.chirp((List<?>)rates, intList(parts.get(1), "chirp times"),
                      units);
      } else {
        if (parts.get(1) != null) {
          throw new TypeMismatchException("chirp times need a list of " +
                                          "rates");
        }
        options.chirp(rates, units);
      }
    }
    if (args.get(-1, "truncate") != null) {
      options.truncate(args.get(-1, "truncate"));
    }
    if (args.get(-1, "timestamp_stream") != null) {
      options.timestampStream(args.get(-1, "timestamp_stream"));
    }
    options.continueChirp(args.bool(-1, "continue_chirp", false));
    options.target(args.optionalString(-1, "target"));
    return options;
  }

  private Scope forEach(Object variables, Object values) {
    if (variables instanceof List) {
      List<QuaExpression> vars = new ArrayList<QuaExpression>();
      for (Object v: (List<?>)variables) {
        vars.add(v instanceof QuaExpression ? (QuaExpression)v : null);
      }
      if (!(values instanceof List)) {
        throw new TypeMismatchException("for_each_ over several variables " +
                                        "needs a tuple of arrays");
      }
      return builder.forEach_(vars, (List<?>)values);
    }
    return builder.forEach_(variables instanceof QuaExpression ?
                            (QuaExpression)variables : null, values);
  }

  /*
   * Measure processes: demod.full("cos", v1, "out1") etc.
   * Arguments are positional, in the order the factories take them.
   */

  private MeasureProcess measureProcess(Family family, String method,
                                        CallArgs args) {
    switch (family) {
      case DEMOD:
        return accumulation(MeasureProcesses.DEMOD, family, method, args);
      case INTEGRATION:
        return accumulation(MeasureProcesses.INTEGRATION, family, method,
                            args);
      case DUAL_DEMOD:
        return dualAccumulation(MeasureProcesses.DUAL_DEMOD, family, method,
                                args);
      case DUAL_INTEGRATION:
        return dualAccumulation(MeasureProcesses.DUAL_INTEGRATION, family,
                                method, args);
      case TIME_TAGGING:
        return timeTagging(method, args);
      case COUNTING:
        if (method.equals("digital")) {
          args.expect(2, 3);
          if (args.size() == 2) {
            return MeasureProcesses.COUNTING.digital(args.expression(0),
                                                     args.get(1));
          }
          return MeasureProcesses.COUNTING.digital(args.expression(0),
                                          args.get(1), args.string(2));
        }
        break;
      default:
        break;
    }
    throw unknownMethod(family.scriptName(), method);
  }

  private MeasureProcess accumulation(Accumulation acc, Family family,
                                      String method, CallArgs args) {
    if (method.equals("full")) {
      args.expect(2, 3);
      if (args.size() == 2) {
        return acc.full(args.string(0), args.expression(1));
      }
      return acc.full(args.string(0), args.expression(1), args.string(2));
    } else if (method.equals("sliced") || method.equals("accumulated")) {
      args.expect(3, 4);
      boolean sliced = method.equals("sliced");
      String output = args.size() == 4 ? args.string(3) : "";
      return sliced ?
          acc.sliced(args.string(0), args.expression(1), args.integer(2),
                     output) :
          acc.accumulated(args.string(0), args.expression(1),
                          args.integer(2), output);
    } else if (method.equals("moving_window")) {
      args.expect(4, 5);
      String output = args.size() == 5 ? args.string(4) : "";
      return acc.movingWindow(args.string(0), args.expression(1),
                              args.integer(2), args.integer(3), output);
    }
    throw unknownMethod(family.scriptName(), method);
  }

  private MeasureProcess dualAccumulation(DualAccumulation acc,
      Family family, String method, CallArgs args) {
    if (method.equals("full")) {
      args.expect(5, 5);
      return acc.full(args.string(0), args.string(1), args.string(2),
                      args.string(3), args.expression(4));
    } else if (method.equals("sliced")) {
      args.expect(6, 6);
      return acc.sliced(args.string(0), args.string(1), args.string(2),
                        args.string(3), args.integer(4), args.expression(5));
    } else if (method.equals("accumulated")) {
      args.expect(6, 6);
      return acc.accumulated(args.string(0), args.string(1), args.string(2),
                        args.string(3), args.integer(4), args.expression(5));
    } else if (method.equals("moving_window")) {
      args.expect(7, 7);
      return acc.movingWindow(args.string(0), args.string(1),
          args.string(2), args.string(3), args.integer(4), args.integer(5),
          args.expression(6));
    }
    throw unknownMethod(family.scriptName(), method);
  }

  private MeasureProcess timeTagging(String method, CallArgs args) {
    args.expect(2, 4);
    QuaExpression target = args.expression(0);
    Object maxTime = args.get(1);
    QuaExpression targetLen = args.expression(2);
    String output = args.size() == 4 ? args.string(3) : "";
    if (method.equals("analog")) {
      return MeasureProcesses.TIME_TAGGING.analog(target, maxTime, targetLen,
                                                  output);
    } else if (method.equals("digital")) {
      return MeasureProcesses.TIME_TAGGING.digital(target, maxTime,
                                                   targetLen, output);
    } else if (method.equals("high_res")) {
      return MeasureProcesses.TIME_TAGGING.highRes(target, maxTime,
                                                   targetLen, output);
    }
    throw unknownMethod("time_tagging", method);
  }

  /*
   * Stream processing
   */

  private static boolean isSourceModifier(String method) {
    return method.equals("timestamps") || method.equals("with_timestamps") ||
        method.equals("input1") || method.equals("input2") ||
        method.equals("auto_reshape");
  }

  private static ResultSource sourceModifier(ResultSource source,
                                             String method) {
    if (method.equals("timestamps")) {
      return source.timestamps();
    } else if (method.equals("with_timestamps")) {
      return source.withTimestamps();
    } else if (method.equals("input1")) {
      return source.input1();
    } else if (method.equals("input2")) {
      return source.input2();
    }
    return source.autoReshape();
  }

  private Object streamOperator(ResultStream stream, String method,
                                CallArgs args) {
    if (method.equals("save") || method.equals("save_all")) {
      args.expect(1, 1);
      if (method.equals("save")) {
        stream.save(args.string(0));
      } else {
        stream.saveAll(args.string(0));
      }
      return null;
    } else if (method.equals("average")) {
      args.expect(0, 0);
      return stream.average();
    } else if (method.equals("buffer")) {
      args.expect(1, -1);
      int[] dims = new int[args.size()];
      for (int i = 0; i < dims.length; i++) {
        dims[i] = args.integer(i);
      }
      return stream.buffer(dims);
    } else if (method.equals("buffer_and_skip")) {
      args.expect(2, 2);
      return stream.bufferAndSkip(args.integer(0), args.integer(1));
    } else if (method.equals("map")) {
      args.expect(1, 1);
      if (!(args.get(0) instanceof StreamToken.Array)) {
        throw new TypeMismatchException("map() needs a FUNCTIONS entry, " +
                                        "got " + describe(args.get(0)));
      }
      return stream.map((StreamToken.Array)args.get(0));
    } else if (method.equals("flatten")) {
      args.expect(0, 0);
      return stream.flatten();
    } else if (method.equals("skip")) {
      args.expect(1, 1);
      return stream.skip(args.integer(0));
    } else if (method.equals("skip_last")) {
      args.expect(1, 1);
      return stream.skipLast(args.integer(0));
    } else if (method.equals("take")) {
      args.expect(1, 1);
      return stream.take(args.integer(0));
    } else if (method.equals("histogram")) {
      args.expect(1, 1);
      List<List<Number>> bins = new ArrayList<List<Number>>();
      for (Object bin: list(args.get(0), "histogram bins")) {
        bins.add(numberList(bin, "histogram bin"));
      }
      return stream.histogram(bins);
    } else if (method.equals("zip")) {
      args.expect(1, 1);
      if (!(args.get(0) instanceof ResultStream)) {
        throw new TypeMismatchException("zip() needs a stream, got " +
                                        describe(args.get(0)));
      }
      return stream.zip((ResultStream)args.get(0));
    } else if (method.equals("add") || method.equals("subtract") ||
               method.equals("multiply") || method.equals("divide")) {
      args.expect(1, 1);
      Object other = args.get(0);
      if (method.equals("add")) {
        return stream.add(other);
      } else if (method.equals("subtract")) {
        return stream.subtract(other);
      } else if (method.equals("multiply")) {
        return stream.multiply(other);
      }
      return stream.divide(other);
    }
    // Shortcuts for map(FUNCTIONS.x(...))
    return stream.map(streamFunction(method, args));
  }

  private StreamToken.Array streamFunction(String method, CallArgs args) {
    if (method.equals("average")) {
      args.expect(0, 1);
      if (args.size() == 0) {
        return StreamFunctions.average();
      } else if (args.get(0) instanceof List) {
        return StreamFunctions.average(intList(args.get(0), "axes"));
      }
      return StreamFunctions.average(args.integer(0));
    } else if (method.equals("dot_product")) {
      args.expect(1, 1);
      return StreamFunctions.dotProduct(numberList(args.get(0), "vector"));
    } else if (method.equals("tuple_dot_product")) {
      args.expect(0, 0);
      return StreamFunctions.tupleDotProduct();
    } else if (method.equals("multiply_by")) {
      args.expect(1, 1);
      if (args.get(0) instanceof List) {
        return StreamFunctions.multiplyBy(numberList(args.get(0),
                                                     "vector"));
      }
      return StreamFunctions.multiplyBy(number(args.get(0), "scalar"));
    } else if (method.equals("tuple_multiply")) {
      args.expect(0, 0);
      return StreamFunctions.tupleMultiply();
    } else if (method.equals("convolution")) {
      args.expect(1, 2, "mode");
      return StreamFunctions.convolution(numberList(args.get(0), "vector"),
                                         args.optionalString(1, "mode"));
    } else if (method.equals("tuple_convolution")) {
      args.expect(0, 1, "mode");
      return StreamFunctions.tupleConvolution(
                                     args.optionalString(0, "mode"));
    } else if (method.equals("fft")) {
      args.expect(0, 1, "output");
      return StreamFunctions.fft(args.optionalString(0, "output"));
    } else if (method.equals("boolean_to_int")) {
      args.expect(0, 0);
      return StreamFunctions.booleanToInt();
    } else if (method.equals("demod")) {
      args.expect(3, 4, "integrate");
      Object integrate = args.get(3, "integrate");
      return StreamFunctions.demod(number(args.get(0), "frequency"),
          args.get(1), args.get(2),
          integrate == null ? null : args.bool(3, "integrate", true));
    }
    throw unknownMethod("FUNCTIONS", method);
  }

  /*
   * Host values
   */

  private static String[] strings(CallArgs args, int start) {
    List<Object> values = args.rest(start);
    String[] res = new String[values.size()];
    for (int i = 0; i < res.length; i++) {
      res[i] = args.asString(values.get(i), "element");
    }
    return res;
  }

  private static List<?> list(Object v, String what) {
    if (!(v instanceof List)) {
      throw new TypeMismatchException(what + " must be a list, not " +
                                      describe(v));
    }
    return (List<?>)v;
  }

  private static Number number(Object v, String what) {
    if (v instanceof Integer || v instanceof Long || v instanceof Double) {
      return (Number)v;
    }
    throw new TypeMismatchException(what + " must be a number, not " +
                                    describe(v));
  }

  private static List<Number> numberList(Object v, String what) {
    List<Number> res = new ArrayList<Number>();
    for (Object o: list(v, what)) {
      res.add(number(o, what));
    }
    return res;
  }

  /**
   * @return list of ints, null for null
   */
  private static List<Integer> intList(Object v, String what) {
    if (v == null) {
      return null;
    }
    List<Integer> res = new ArrayList<Integer>();
    for (Object o: list(v, what)) {
      if (!(o instanceof Integer)) {
        throw new TypeMismatchException(what + " must be ints, not " +
                                        describe(o));
      }
      res.add((Integer)o);
    }
    return res;
  }

  private static QuaException unknownMethod(String namespace,
                                            String method) {
    return new QuaException(namespace + " has no function " + method);
  }

  private static String at(ParserRuleContext ctx) {
    return "line " + ctx.getStart().getLine();
  }

  private static String describe(Object v) {
    if (v == null) {
      return "null";
    }
    return v + " of type " + v.getClass().getSimpleName();
  }

  /*
   * Script values with no Java counterpart in the builder API
   */

  private static final class LibraryNamespace {
    private final Library library;

    LibraryNamespace(Library library) {
      this.library = library;
    }

    @Override
    public String toString() {
      return library.scriptName();
    }
  }

  private static final class ProcessNamespace {
    private final Family family;

    ProcessNamespace(Family family) {
      this.family = family;
    }

    @Override
    public String toString() {
      return family.scriptName();
    }
  }

  private static final class FunctionNamespace {
    static final FunctionNamespace INSTANCE = new FunctionNamespace();

    @Override
    public String toString() {
      return "FUNCTIONS";
    }
  }

  /**
   * Result of amp(...): scales the pulse name it is multiplied with
   */
  private static final class Amp {
    private final List<Object> values;

    Amp(List<Object> values) {
      this.values = new ArrayList<Object>(values);
    }

    PlayPulse scale(String pulse) {
      if (values.size() == 1) {
        return PlayPulse.of(pulse).amp(values.get(0));
      } else if (values.size() == 4) {
        return PlayPulse.of(pulse).amp(values.get(0), values.get(1),
                                       values.get(2), values.get(3));
      }
      throw new QuaException("amp() takes 1 or 4 values, got " +
                             values.size());
    }
  }

  /**
   * Carries a syntax error found while evaluating a literal out of the
   * visitor
   */
  private static final class BadLiteral extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final InvalidSyntaxException error;

    BadLiteral(InvalidSyntaxException error) {
      super(error.getMessage(), error);
      this.error = error;
    }
  }
}
