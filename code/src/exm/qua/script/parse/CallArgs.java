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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.qua.common.exceptions.QuaException;
import exm.qua.common.exceptions.TypeMismatchException;
import exm.qua.frontend.QuaExpression;

/**
 * Evaluated arguments of one call in a script: positional arguments in
 * order, then keyword arguments by name.  Typed getters fail with a
 * message naming the function.
 */
class CallArgs {

  private final String function;
  private final List<Object> positional = new ArrayList<Object>();
  private final Map<String, Object> keywords =
                                  new LinkedHashMap<String, Object>();

  CallArgs(String function) {
    this.function = function;
  }

  void add(Object value) {
    positional.add(value);
  }

  void add(String keyword, Object value) {
    if (keywords.containsKey(keyword)) {
      throw new QuaException(function + "() got multiple values for " +
                             "argument '" + keyword + "'");
    }
    keywords.put(keyword, value);
  }

  String function() {
    return function;
  }

  int size() {
    return positional.size();
  }

  List<Object> positional() {
    return positional;
  }

  /**
   * Positional arguments from index start on
   */
  List<Object> rest(int start) {
    if (start >= positional.size()) {
      return new ArrayList<Object>();
    }
    return positional.subList(start, positional.size());
  }

  /**
   * Check count of positional arguments and names of keywords
   */
  CallArgs expect(int min, int max, String... allowedKeywords) {
    if (positional.size() < min) {
      throw new QuaException(function + "() takes at least " + min +
          " arguments (" + positional.size() + " given)");
    }
    if (max >= 0 && positional.size() > max) {
      throw new QuaException(function + "() takes at most " + max +
          " arguments (" + positional.size() + " given)");
    }
    List<String> allowed = Arrays.asList(allowedKeywords);
    for (String k: keywords.keySet()) {
      if (!allowed.contains(k)) {
        throw new QuaException(function + "() got an unexpected keyword " +
                               "argument '" + k + "'");
      }
    }
    return this;
  }

  /**
   * Argument given at position i or by keyword, null if absent
   */
  Object get(int i, String keyword) {
    boolean hasPositional = i >= 0 && i < positional.size();
    if (keyword != null && keywords.containsKey(keyword)) {
      if (hasPositional) {
        throw new QuaException(function + "() got multiple values for " +
                               "argument '" + keyword + "'");
      }
      return keywords.get(keyword);
    }
    return hasPositional ? positional.get(i) : null;
  }

  Object get(int i) {
    return get(i, null);
  }

  boolean has(int i, String keyword) {
    return (i >= 0 && i < positional.size()) ||
           (keyword != null && keywords.containsKey(keyword));
  }

  String string(int i, String keyword) {
    return asString(get(i, keyword), keyword);
  }

  String string(int i) {
    return string(i, null);
  }

  /**
   * String argument, null if absent or null
   */
  String optionalString(int i, String keyword) {
    Object v = get(i, keyword);
    return v == null ? null : asString(v, keyword);
  }

  int integer(int i, String keyword) {
    return asInt(get(i, keyword), keyword == null ? "argument " + (i + 1) :
                                                    keyword);
  }

  int integer(int i) {
    return integer(i, null);
  }

  boolean bool(int i, String keyword, boolean defaultValue) {
    Object v = get(i, keyword);
    if (v == null) {
      return defaultValue;
    }
    if (v instanceof QuaExpression) {
      // Raises the error for QUA values used as host booleans
      return ((QuaExpression)v).booleanValue();
    }
    if (!(v instanceof Boolean)) {
      throw new TypeMismatchException(function + "(): " + keyword +
                                      " must be true or false, not " + v);
    }
    return (Boolean)v;
  }

  QuaExpression expression(int i, String keyword) {
    Object v = get(i, keyword);
    if (v == null) {
      return null;
    }
    if (!(v instanceof QuaExpression)) {
      throw new TypeMismatchException(function + "(): expected a QUA " +
          "variable for " + describe(i, keyword) + ", got " + v);
    }
    return (QuaExpression)v;
  }

  QuaExpression expression(int i) {
    return expression(i, null);
  }

  String asString(Object v, String keyword) {
    if (!(v instanceof String)) {
      throw new TypeMismatchException(function + "(): expected a string" +
          (keyword == null ? "" : " for " + keyword) + ", got " + v);
    }
    return (String)v;
  }

  int asInt(Object v, String what) {
    if (v instanceof Integer) {
      return (Integer)v;
    }
    throw new TypeMismatchException(function + "(): " + what +
                                    " must be an int, not " + v);
  }

  private String describe(int i, String keyword) {
    return keyword != null ? keyword : "argument " + (i + 1);
  }
}
