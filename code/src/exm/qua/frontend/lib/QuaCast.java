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
import exm.qua.frontend.QuaBuilder;
import exm.qua.frontend.QuaExpression;

/**
 * Conversions between int, fixed and bool.
 */
public class QuaCast {

  private final QuaBuilder builder;

  public QuaCast(QuaBuilder builder) {
    this.builder = builder;
  }

  public QuaExpression mulIntByFixed(Object x, Object y) {
    return builder.callLibraryFunction(Library.CAST, "mul_int_by_fixed", x, y);
  }

  public QuaExpression mulFixedByInt(Object x, Object y) {
    return builder.callLibraryFunction(Library.CAST, "mul_fixed_by_int", x, y);
  }

  public QuaExpression toInt(Object x) {
    return builder.callLibraryFunction(Library.CAST, "to_int", x);
  }

  public QuaExpression toFixed(Object x) {
    return builder.callLibraryFunction(Library.CAST, "to_fixed", x);
  }

  public QuaExpression toBool(Object x) {
    return builder.callLibraryFunction(Library.CAST, "to_bool", x);
  }

  public QuaExpression unsafeCastInt(Object x) {
    return builder.callLibraryFunction(Library.CAST, "unsafe_cast_int", x);
  }

  public QuaExpression unsafeCastFixed(Object x) {
    return builder.callLibraryFunction(Library.CAST, "unsafe_cast_fixed", x);
  }

  public QuaExpression unsafeCastBool(Object x) {
    return builder.callLibraryFunction(Library.CAST, "unsafe_cast_bool", x);
  }
}
