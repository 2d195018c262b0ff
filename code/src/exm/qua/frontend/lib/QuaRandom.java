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
package exm.qua.frontend.lib;

import exm.qua.common.lang.Library;
import exm.qua.common.lang.VarType;
import exm.qua.frontend.QuaBuilder;
import exm.qua.frontend.QuaExpression;

/**
 * Pseudo-random numbers generated on the controller.  The seed lives
 * in an int variable declared when the generator is created.
 */
public class QuaRandom {

  private final QuaBuilder builder;
  private final QuaExpression seed;

  public QuaRandom(QuaBuilder builder, int seed) {
    this.builder = builder;
    this.seed = builder.declare(VarType.INT, seed);
  }

  public QuaExpression seed() {
    return seed;
  }

  public void setSeed(Object value) {
    builder.assign(seed, value);
  }

  /** Integer in [0, maxInt) */
  public QuaExpression randInt(Object maxInt) {
    return builder.callLibraryFunction(Library.RANDOM, "rand_int", seed,
                                       maxInt);
  }

  /** Fixed in [0.0, 1.0) */
  public QuaExpression randFixed() {
    return builder.callLibraryFunction(Library.RANDOM, "rand_fixed", seed);
  }
}
