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

package exm.qua.common.lang;

import exm.qua.common.exceptions.TypeMismatchException;

/**
 * Scalar types of QUA variables and literals
 */
public enum VarType {
  INT("int"),
  BOOL("bool"),
  /** fixed point real */
  FIXED("fixed");

  private final String scriptName;

  private VarType(String scriptName) {
    this.scriptName = scriptName;
  }

  public String scriptName() {
    return scriptName;
  }

  public static VarType fromScriptName(String name) {
    for (VarType t: values()) {
      if (t.scriptName.equals(name)) {
        return t;
      }
    }
    throw new TypeMismatchException("unknown QUA type: " + name);
  }

  /**
   * @return the type a host value is held in
   */
  public static VarType ofHostValue(Object value) {
    if (value instanceof Boolean) {
      return BOOL;
    } else if (value instanceof Integer) {
      return INT;
    } else if (value instanceof Double) {
      return FIXED;
    }
    throw new TypeMismatchException("value " + value + " of " +
        (value == null ? "null" : value.getClass().getSimpleName()) +
        " is not a boolean, int or double");
  }
}
