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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.qua.common.exceptions.InvalidOptionException;
import exm.qua.common.exceptions.QuaRuntimeError;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    System.clearProperty(Settings.SCRIPT_INDENT);
    Settings.reset();
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(4, Settings.getInt(Settings.SCRIPT_INDENT));
    assertEquals(2, Settings.getInt(Settings.SCRIPT_COMPACT_MIN_RUN));
    assertTrue(Settings.getBoolean(Settings.SCRIPT_VERIFY));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertTrue(Settings.getKeys().contains(Settings.QUA_VERSION));
  }

  @Test
  public void testSystemPropertyOverrides() throws InvalidOptionException {
    System.setProperty(Settings.SCRIPT_INDENT, "2");
    Settings.initQuaProperties();
    assertEquals(2, Settings.getInt(Settings.SCRIPT_INDENT));
  }

  @Test
  public void testResetRestoresDefaults() throws InvalidOptionException {
    Settings.set(Settings.SCRIPT_VERIFY, "false");
    assertFalse(Settings.getBoolean(Settings.SCRIPT_VERIFY));
    Settings.reset();
    assertTrue(Settings.getBoolean(Settings.SCRIPT_VERIFY));
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, "maybe");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.LOG_TRACE);
  }

  @Test
  public void testBadIndentRejected() throws InvalidOptionException {
    System.setProperty(Settings.SCRIPT_INDENT, "0");
    exception.expect(InvalidOptionException.class);
    Settings.initQuaProperties();
  }

  @Test
  public void testIntOrFail() {
    Settings.set(Settings.SCRIPT_INDENT, "four");
    exception.expect(QuaRuntimeError.class);
    Settings.getIntOrFail(Settings.SCRIPT_INDENT);
  }
}
