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

package exm.qua.common;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.io.IOUtils;

import exm.qua.common.exceptions.InvalidOptionException;
import exm.qua.common.exceptions.QuaRuntimeError;

/**
 * General QUA settings
 *
 * Defaults are overridden by Java system properties of the same name
 * in {@link #initQuaProperties()}.
 * */
public class Settings
{
  public static final String LOG_FILE = "qua.log.file";
  public static final String LOG_TRACE = "qua.log.trace";

  /** Spaces per block level in generated scripts */
  public static final String SCRIPT_INDENT = "qua.script.indent";
  /** Rebuild the program from generated text and compare */
  public static final String SCRIPT_VERIFY = "qua.script.verify";
  /** Shortest run of repeated numbers compacted as [v] * n */
  public static final String SCRIPT_COMPACT_MIN_RUN =
                                          "qua.script.compact-min-run";
  public static final String QUA_VERSION = "qua.version";

  private static final String VERSION_RESOURCE = "/version.txt";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(SCRIPT_INDENT, "4");
    defaults.setProperty(SCRIPT_VERIFY, "true");
    defaults.setProperty(SCRIPT_COMPACT_MIN_RUN, "2");
    defaults.setProperty(QUA_VERSION, loadVersionNumber());
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initQuaProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop overrides, going back to the defaults
   */
  public static void reset() {
    properties.clear();
  }

  private static String loadVersionNumber() {
    InputStream in = Settings.class.getResourceAsStream(VERSION_RESOURCE);
    if (in == null) {
      return "unknown";
    }
    try {
      return IOUtils.toString(in, StandardCharsets.UTF_8).trim();
    } catch (IOException e) {
      throw new QuaRuntimeError("IOException while reading version resource: "
                              + VERSION_RESOURCE, e);
    } finally {
      IOUtils.closeQuietly(in);
    }
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(SCRIPT_VERIFY);
    if (getInt(SCRIPT_INDENT) < 1) {
      throw new InvalidOptionException(SCRIPT_INDENT + " must be positive");
    }
    if (getInt(SCRIPT_COMPACT_MIN_RUN) < 2) {
      throw new InvalidOptionException(SCRIPT_COMPACT_MIN_RUN +
                                       " must be at least 2");
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }

  /**
   * Integer setting for callers that can not recover from a bad value
   */
  public static int getIntOrFail(String key) {
    try {
      return getInt(key);
    } catch (InvalidOptionException e) {
      throw new QuaRuntimeError(e.getMessage(), e);
    }
  }

  public static boolean getBooleanOrFail(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new QuaRuntimeError(e.getMessage(), e);
    }
  }
}
