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
import java.util.List;

import exm.qua.common.exceptions.QuaException;
import exm.qua.ir.tree.Expr;
import exm.qua.ir.tree.IRInstructions.Pulse;

/**
 * Pulse to play or measure: a named pulse, optionally scaled, or a ramp.
 */
public final class PlayPulse {

  private final Pulse pulse;

  private PlayPulse(Pulse pulse) {
    this.pulse = pulse;
  }

  public static PlayPulse of(String name) {
    if (name == null || name.isEmpty()) {
      throw new QuaException("pulse name can not be empty");
    }
    return new PlayPulse(Pulse.named(name, new ArrayList<Expr>()));
  }

  /**
   * Ramp with given slope (volts per ns)
   */
  public static PlayPulse ramp(Object value) {
    return new PlayPulse(Pulse.ramp(Literals.toScalar(value, "ramp")));
  }

  /**
   * Accept a pulse name or an already built pulse
   */
  public static PlayPulse from(Object pulse) {
    if (pulse instanceof PlayPulse) {
      return (PlayPulse)pulse;
    } else if (pulse instanceof String) {
      return of((String)pulse);
    }
    throw new QuaException("pulse must be a name or a pulse, but got " +
                           Literals.describe(pulse));
  }

  /**
   * Scale by a single amplitude
   */
  public PlayPulse amp(Object value) {
    return scaled(value);
  }

  /**
   * Scale by a 2x2 amplitude matrix
   */
  public PlayPulse amp(Object v00, Object v01, Object v10, Object v11) {
    return scaled(v00, v01, v10, v11);
  }

  private PlayPulse scaled(Object... values) {
    if (pulse.isRamp()) {
      throw new QuaException("you can multiply only a pulse");
    }
    if (!pulse.amp().isEmpty()) {
      throw new QuaException("pulse " + pulse.name() + " is already scaled");
    }
    List<Expr> amp = new ArrayList<Expr>(values.length);
    for (Object v: values) {
      amp.add(Literals.toScalar(v, "amp"));
    }
    return new PlayPulse(Pulse.named(pulse.name(), amp));
  }

  public Pulse toPulse() {
    return pulse;
  }

  @Override
  public String toString() {
    return pulse.dump();
  }
}
