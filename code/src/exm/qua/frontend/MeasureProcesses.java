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

import exm.qua.common.exceptions.TypeMismatchException;
import exm.qua.ir.tree.Expr;
import exm.qua.ir.tree.MeasureProcess;
import exm.qua.ir.tree.MeasureProcess.Family;

/**
 * Factories for the processes a measure statement applies to its input.
 * <pre>
 *   q.measure("readout", "rr", null,
 *             MeasureProcesses.DEMOD.full("cos", i, "out1"),
 *             MeasureProcesses.INTEGRATION.sliced("w", arr, 10));
 * </pre>
 * Element outputs default to "".
 */
public class MeasureProcesses {

  public static final Accumulation DEMOD = new Accumulation(Family.DEMOD);
  public static final Accumulation INTEGRATION =
                                    new Accumulation(Family.INTEGRATION);
  public static final DualAccumulation DUAL_DEMOD =
                                    new DualAccumulation(Family.DUAL_DEMOD);
  public static final DualAccumulation DUAL_INTEGRATION =
                              new DualAccumulation(Family.DUAL_INTEGRATION);
  public static final TimeTagging TIME_TAGGING = new TimeTagging();
  public static final Counting COUNTING = new Counting();

  private static final String NO_OUTPUT = "";

  private MeasureProcesses() {
  }

  /**
   * Demodulation or integration over a single element output
   */
  public static class Accumulation {
    private final Family family;

    private Accumulation(Family family) {
      this.family = family;
    }

    public MeasureProcess full(String iw, QuaExpression target) {
      return full(iw, target, NO_OUTPUT);
    }

    public MeasureProcess full(String iw, QuaExpression target,
                               String elementOutput) {
      return new MeasureProcess(family, "full", iw,
                                scalarTarget(target), elementOutput);
    }

    public MeasureProcess sliced(String iw, QuaExpression target,
                                 int samplesPerChunk) {
      return sliced(iw, target, samplesPerChunk, NO_OUTPUT);
    }

    public MeasureProcess sliced(String iw, QuaExpression target,
                                 int samplesPerChunk, String elementOutput) {
      return new MeasureProcess(family, "sliced", iw, arrayTarget(target),
                                samplesPerChunk, elementOutput);
    }

    public MeasureProcess accumulated(String iw, QuaExpression target,
                                      int samplesPerChunk) {
      return accumulated(iw, target, samplesPerChunk, NO_OUTPUT);
    }

    public MeasureProcess accumulated(String iw, QuaExpression target,
                               int samplesPerChunk, String elementOutput) {
      return new MeasureProcess(family, "accumulated", iw,
                  arrayTarget(target), samplesPerChunk, elementOutput);
    }

    public MeasureProcess movingWindow(String iw, QuaExpression target,
                              int samplesPerChunk, int chunksPerWindow) {
      return movingWindow(iw, target, samplesPerChunk, chunksPerWindow,
                          NO_OUTPUT);
    }

    public MeasureProcess movingWindow(String iw, QuaExpression target,
        int samplesPerChunk, int chunksPerWindow, String elementOutput) {
      return new MeasureProcess(family, "moving_window", iw,
          arrayTarget(target), samplesPerChunk, chunksPerWindow,
          elementOutput);
    }
  }

  /**
   * Demodulation or integration summed over two element outputs
   */
  public static class DualAccumulation {
    private final Family family;

    private DualAccumulation(Family family) {
      this.family = family;
    }

    public MeasureProcess full(String iw1, String elementOutput1,
        String iw2, String elementOutput2, QuaExpression target) {
      return new MeasureProcess(family, "full", iw1, elementOutput1, iw2,
                                elementOutput2, scalarTarget(target));
    }

    public MeasureProcess sliced(String iw1, String elementOutput1,
        String iw2, String elementOutput2, int samplesPerChunk,
        QuaExpression target) {
      return new MeasureProcess(family, "sliced", iw1, elementOutput1, iw2,
          elementOutput2, samplesPerChunk, arrayTarget(target));
    }

    public MeasureProcess accumulated(String iw1, String elementOutput1,
        String iw2, String elementOutput2, int samplesPerChunk,
        QuaExpression target) {
      return new MeasureProcess(family, "accumulated", iw1, elementOutput1,
          iw2, elementOutput2, samplesPerChunk, arrayTarget(target));
    }

    public MeasureProcess movingWindow(String iw1, String elementOutput1,
        String iw2, String elementOutput2, int samplesPerChunk,
        int chunksPerWindow, QuaExpression target) {
      return new MeasureProcess(family, "moving_window", iw1,
          elementOutput1, iw2, elementOutput2, samplesPerChunk,
          chunksPerWindow, arrayTarget(target));
    }
  }

  public static class TimeTagging {

    private TimeTagging() {
    }

    /**
     * @param target int array receiving detection times in ns
     * @param targetLen variable receiving the number of pulses, or null
     */
    public MeasureProcess analog(QuaExpression target, Object maxTime,
                                 QuaExpression targetLen) {
      return analog(target, maxTime, targetLen, NO_OUTPUT);
    }

    public MeasureProcess analog(QuaExpression target, Object maxTime,
        QuaExpression targetLen, String elementOutput) {
      return tag("analog", target, maxTime, targetLen, elementOutput);
    }

    public MeasureProcess digital(QuaExpression target, Object maxTime,
                                  QuaExpression targetLen) {
      return digital(target, maxTime, targetLen, NO_OUTPUT);
    }

    public MeasureProcess digital(QuaExpression target, Object maxTime,
        QuaExpression targetLen, String elementOutput) {
      return tag("digital", target, maxTime, targetLen, elementOutput);
    }

    /** Detection times in ps */
    public MeasureProcess highRes(QuaExpression target, Object maxTime,
                                  QuaExpression targetLen) {
      return highRes(target, maxTime, targetLen, NO_OUTPUT);
    }

    public MeasureProcess highRes(QuaExpression target, Object maxTime,
        QuaExpression targetLen, String elementOutput) {
      return tag("high_res", target, maxTime, targetLen, elementOutput);
    }

    private MeasureProcess tag(String method, QuaExpression target,
        Object maxTime, QuaExpression targetLen, String elementOutput) {
      return new MeasureProcess(Family.TIME_TAGGING, method,
          arrayTarget(target), Literals.toScalar(maxTime, "max_time"),
          targetLen == null ? null : scalarTarget(targetLen),
          elementOutput);
    }
  }

  public static class Counting {

    private Counting() {
    }

    public MeasureProcess digital(QuaExpression target, Object maxTime) {
      return digital(target, maxTime, NO_OUTPUT);
    }

    public MeasureProcess digital(QuaExpression target, Object maxTime,
                                  String elementOutputs) {
      return new MeasureProcess(Family.COUNTING, "digital",
          scalarTarget(target), Literals.toScalar(maxTime, "max_time"),
          elementOutputs);
    }
  }

  private static Expr scalarTarget(QuaExpression target) {
    if (target == null || target.isArray()) {
      throw new TypeMismatchException("measure target " + target +
                                      " must be a variable");
    }
    return target.expr();
  }

  private static Expr arrayTarget(QuaExpression target) {
    if (target == null || !target.isArray()) {
      throw new TypeMismatchException("measure target " + target +
                                      " must be an array");
    }
    return target.expr();
  }
}
