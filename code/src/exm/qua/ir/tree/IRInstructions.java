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

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.qua.common.lang.Units.ChirpUnits;
import exm.qua.common.lang.Units.FrequencyUnits;

/**
 * Leaf statements of the QUA IR and the values they carry.
 * Optional fields are null when absent.
 */
public class IRInstructions {

  /**
   * Pulse operation reference: either a named pulse or a ramp, optionally
   * scaled by one amplitude or a 2x2 amplitude matrix
   */
  public static final class Pulse extends IRNode {
    private static final long serialVersionUID = 1L;
    private final String name;
    private final Expr ramp;
    private final ImmutableList<Expr> amp;

    private Pulse(String name, Expr ramp, List<Expr> amp) {
      this.name = name;
      this.ramp = ramp;
      this.amp = ImmutableList.copyOf(amp);
    }

    public static Pulse named(String name, List<Expr> amp) {
      return new Pulse(name, null, amp);
    }

    public static Pulse ramp(Expr ramp) {
      return new Pulse(null, ramp, ImmutableList.<Expr>of());
    }

    public boolean isRamp() {
      return ramp != null;
    }

    public String name() {
      return name;
    }

    public Expr rampValue() {
      return ramp;
    }

    public ImmutableList<Expr> amp() {
      return amp;
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(name, ramp, amp);
    }
  }

  /**
   * Frequency chirp applied while playing.  A single rate, or piecewise
   * rates switching at the given times.
   */
  public static final class Chirp extends IRNode {
    private static final long serialVersionUID = 1L;
    private final ImmutableList<Expr> rates;
    private final ImmutableList<Integer> times;
    private final ChirpUnits units;

    public Chirp(List<Expr> rates, List<Integer> times, ChirpUnits units) {
      this.rates = ImmutableList.copyOf(rates);
      this.times = ImmutableList.copyOf(times);
      this.units = units;
    }

    public ImmutableList<Expr> rates() {
      return rates;
    }

    public ImmutableList<Integer> times() {
      return times;
    }

    public ChirpUnits units() {
      return units;
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(rates, times, units);
    }
  }

  public static final class Play extends Statement {
    private static final long serialVersionUID = 1L;
    private final Pulse pulse;
    private final String element;
    private final Expr duration;
    private final Expr condition;
    private final Chirp chirp;
    private final Expr truncate;
    private final String timestampLabel;
    private final boolean continueChirp;
    private final String target;

    public Play(String loc, Pulse pulse, String element, Expr duration,
        Expr condition, Chirp chirp, Expr truncate, String timestampLabel,
        boolean continueChirp, String target) {
      super(loc);
      this.pulse = pulse;
      this.element = element;
      this.duration = duration;
      this.condition = condition;
      this.chirp = chirp;
      this.truncate = truncate;
      this.timestampLabel = timestampLabel;
      this.continueChirp = continueChirp;
      this.target = target;
    }

    public Pulse pulse() {
      return pulse;
    }

    public String element() {
      return element;
    }

    public Expr duration() {
      return duration;
    }

    public Expr condition() {
      return condition;
    }

    public Chirp chirp() {
      return chirp;
    }

    public Expr truncate() {
      return truncate;
    }

    public String timestampLabel() {
      return timestampLabel;
    }

    public boolean continueChirp() {
      return continueChirp;
    }

    public String target() {
      return target;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitPlay(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(pulse, element, duration, condition, chirp,
          truncate, timestampLabel, continueChirp, target);
    }
  }

  public static final class Measure extends Statement {
    private static final long serialVersionUID = 1L;
    private final Pulse pulse;
    private final String element;
    private final String streamAs;
    private final ImmutableList<MeasureProcess> processes;
    private final String timestampLabel;

    public Measure(String loc, Pulse pulse, String element, String streamAs,
        List<MeasureProcess> processes, String timestampLabel) {
      super(loc);
      this.pulse = pulse;
      this.element = element;
      this.streamAs = streamAs;
      this.processes = ImmutableList.copyOf(processes);
      this.timestampLabel = timestampLabel;
    }

    public Pulse pulse() {
      return pulse;
    }

    public String element() {
      return element;
    }

    /**
     * @return name of stream raw samples go to, or null
     */
    public String streamAs() {
      return streamAs;
    }

    public ImmutableList<MeasureProcess> processes() {
      return processes;
    }

    public String timestampLabel() {
      return timestampLabel;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitMeasure(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(pulse, element, streamAs, processes,
                                   timestampLabel);
    }
  }

  public static final class Wait extends Statement {
    private static final long serialVersionUID = 1L;
    private final Expr duration;
    private final ImmutableList<String> elements;

    public Wait(String loc, Expr duration, List<String> elements) {
      super(loc);
      this.duration = duration;
      this.elements = ImmutableList.copyOf(elements);
    }

    public Expr duration() {
      return duration;
    }

    public ImmutableList<String> elements() {
      return elements;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitWait(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(duration, elements);
    }
  }

  public static final class WaitForTrigger extends Statement {
    private static final long serialVersionUID = 1L;
    private final String element;
    private final String pulse;
    private final String triggerElement;
    private final String triggerOutput;
    private final Expr timeTagTarget;

    public WaitForTrigger(String loc, String element, String pulse,
        String triggerElement, String triggerOutput, Expr timeTagTarget) {
      super(loc);
      this.element = element;
      this.pulse = pulse;
      this.triggerElement = triggerElement;
      this.triggerOutput = triggerOutput;
      this.timeTagTarget = timeTagTarget;
    }

    public String element() {
      return element;
    }

    public String pulse() {
      return pulse;
    }

    public String triggerElement() {
      return triggerElement;
    }

    public String triggerOutput() {
      return triggerOutput;
    }

    public Expr timeTagTarget() {
      return timeTagTarget;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitWaitForTrigger(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(element, pulse, triggerElement,
                                   triggerOutput, timeTagTarget);
    }
  }

  public static final class Align extends Statement {
    private static final long serialVersionUID = 1L;
    private final ImmutableList<String> elements;

    public Align(String loc, List<String> elements) {
      super(loc);
      this.elements = ImmutableList.copyOf(elements);
    }

    /**
     * @return elements to align, empty for all elements
     */
    public ImmutableList<String> elements() {
      return elements;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitAlign(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(elements);
    }
  }

  public static final class Assign extends Statement {
    private static final long serialVersionUID = 1L;
    private final Expr target;
    private final Expr value;

    public Assign(String loc, Expr target, Expr value) {
      super(loc);
      this.target = target;
      this.value = value;
    }

    public Expr target() {
      return target;
    }

    public Expr value() {
      return value;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitAssign(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(target, value);
    }
  }

  public static final class Save extends Statement {
    private static final long serialVersionUID = 1L;
    private final Expr source;
    private final String tag;

    public Save(String loc, Expr source, String tag) {
      super(loc);
      this.source = source;
      this.tag = tag;
    }

    public Expr source() {
      return source;
    }

    /**
     * @return name of the stream saved to
     */
    public String tag() {
      return tag;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitSave(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(source, tag);
    }
  }

  public static final class Pause extends Statement {
    private static final long serialVersionUID = 1L;

    public Pause(String loc) {
      super(loc);
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitPause(this);
    }

    @Override
    protected List<Object> statementFields() {
      return ImmutableList.of();
    }
  }

  public static final class UpdateFrequency extends Statement {
    private static final long serialVersionUID = 1L;
    private final String element;
    private final Expr value;
    private final FrequencyUnits units;
    private final boolean keepPhase;

    public UpdateFrequency(String loc, String element, Expr value,
                           FrequencyUnits units, boolean keepPhase) {
      super(loc);
      this.element = element;
      this.value = value;
      this.units = units;
      this.keepPhase = keepPhase;
    }

    public String element() {
      return element;
    }

    public Expr value() {
      return value;
    }

    public FrequencyUnits units() {
      return units;
    }

    public boolean keepPhase() {
      return keepPhase;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitUpdateFrequency(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(element, value, units, keepPhase);
    }
  }

  public static final class UpdateCorrection extends Statement {
    private static final long serialVersionUID = 1L;
    private final String element;
    private final ImmutableList<Expr> matrix;

    /**
     * @param matrix c00, c01, c10, c11
     */
    public UpdateCorrection(String loc, String element, List<Expr> matrix) {
      super(loc);
      assert(matrix.size() == 4);
      this.element = element;
      this.matrix = ImmutableList.copyOf(matrix);
    }

    public String element() {
      return element;
    }

    public ImmutableList<Expr> matrix() {
      return matrix;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitUpdateCorrection(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(element, matrix);
    }
  }

  public static final class SetDcOffset extends Statement {
    private static final long serialVersionUID = 1L;
    private final String element;
    private final String elementInput;
    private final Expr offset;

    public SetDcOffset(String loc, String element, String elementInput,
                       Expr offset) {
      super(loc);
      this.element = element;
      this.elementInput = elementInput;
      this.offset = offset;
    }

    public String element() {
      return element;
    }

    public String elementInput() {
      return elementInput;
    }

    public Expr offset() {
      return offset;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitSetDcOffset(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(element, elementInput, offset);
    }
  }

  public static final class AdvanceInputStream extends Statement {
    private static final long serialVersionUID = 1L;
    private final Expr stream;

    public AdvanceInputStream(String loc, Expr stream) {
      super(loc);
      this.stream = stream;
    }

    public Expr stream() {
      return stream;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitAdvanceInputStream(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(stream);
    }
  }

  public static final class ResetPhase extends Statement {
    private static final long serialVersionUID = 1L;
    private final String element;

    public ResetPhase(String loc, String element) {
      super(loc);
      this.element = element;
    }

    public String element() {
      return element;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitResetPhase(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(element);
    }
  }

  public static final class ResetFrame extends Statement {
    private static final long serialVersionUID = 1L;
    private final String element;

    public ResetFrame(String loc, String element) {
      super(loc);
      this.element = element;
    }

    public String element() {
      return element;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitResetFrame(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(element);
    }
  }

  public static final class RampToZero extends Statement {
    private static final long serialVersionUID = 1L;
    private final String element;
    private final Integer duration;

    public RampToZero(String loc, String element, Integer duration) {
      super(loc);
      this.element = element;
      this.duration = duration;
    }

    public String element() {
      return element;
    }

    /**
     * @return ramp duration in ns, or null for the fastest ramp
     */
    public Integer duration() {
      return duration;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitRampToZero(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(element, duration);
    }
  }

  /**
   * Frame rotation of one element by an angle in units of 2pi
   */
  public static final class ZRotation extends Statement {
    private static final long serialVersionUID = 1L;
    private final Expr angle;
    private final String element;

    public ZRotation(String loc, Expr angle, String element) {
      super(loc);
      this.angle = angle;
      this.element = element;
    }

    public Expr angle() {
      return angle;
    }

    public String element() {
      return element;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitZRotation(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(angle, element);
    }
  }

  public static final class FastFrameRotation extends Statement {
    private static final long serialVersionUID = 1L;
    private final Expr cosine;
    private final Expr sine;
    private final String element;

    public FastFrameRotation(String loc, Expr cosine, Expr sine,
                             String element) {
      super(loc);
      this.cosine = cosine;
      this.sine = sine;
      this.element = element;
    }

    public Expr cosine() {
      return cosine;
    }

    public Expr sine() {
      return sine;
    }

    public String element() {
      return element;
    }

    @Override
    public <T> T accept(IRVisitor<T> visitor) {
      return visitor.visitFastFrameRotation(this);
    }

    @Override
    protected List<Object> statementFields() {
      return Arrays.<Object>asList(cosine, sine, element);
    }
  }
}
