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
package exm.qua.persist;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.ObjectOutputStream;
import java.util.ArrayList;

import org.apache.commons.io.FileUtils;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import exm.qua.common.Logging;
import exm.qua.common.exceptions.ProgramLoadException;
import exm.qua.common.exceptions.QuaException;
import exm.qua.common.lang.VarType;
import exm.qua.frontend.MeasureProcesses;
import exm.qua.frontend.QuaBuilder;
import exm.qua.frontend.QuaExpression;
import exm.qua.frontend.Scope;
import exm.qua.frontend.stream.ResultSource;
import exm.qua.ir.tree.Expr;
import exm.qua.ir.tree.IRTree.Program;

public class ProgramSerializerTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ProgramSerializerTest.qua.log", true);
  }

  private static Program program() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression i = q.declare(VarType.FIXED);
      QuaExpression n = q.declare(VarType.INT);
      ResultSource r = q.declareStream();
      try (Scope loop = q.for_(n, 0, n.lt(10), n.add(1))) {
        q.measure("readout", "rr", null,
                  MeasureProcesses.DEMOD.full("cos", i));
        q.save(i, r);
        q.save(n, "n");
      }
      try (Scope sp = q.streamProcessing()) {
        r.buffer(10).average().save("i");
      }
    }
    return q.getProgram();
  }

  @Test
  public void testFileRoundTrip() throws Exception {
    Program p = program();
    File file = tmp.newFile("prog.bin");
    ProgramSerializer.save(p, file);
    Program loaded = ProgramSerializer.load(file);
    assertEquals(p, loaded);
    assertTrue(loaded.isFrozen());
  }

  @Test
  public void testDeepestExpression() throws Exception {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.FIXED);
      QuaExpression e = v;
      for (int i = 1; i < Expr.MAX_DEPTH; i++) {
        e = e.mul(v);
      }
      q.assign(v, e);
    }
    Program p = q.getProgram();
    assertEquals(p, ProgramSerializer.deserialize(
                                      ProgramSerializer.serialize(p)));
  }

  @Test
  public void testUnfinishedProgram() {
    exception.expect(QuaException.class);
    ProgramSerializer.serialize(new Program());
  }

  @Test
  public void testMissingFile() throws Exception {
    exception.expect(ProgramLoadException.class);
    exception.expectMessage("missing.bin");
    ProgramSerializer.load(new File(tmp.getRoot(), "missing.bin"));
  }

  @Test
  public void testCorruptData() throws Exception {
    File file = tmp.newFile("corrupt.bin");
    FileUtils.writeByteArrayToFile(file, new byte[] {1, 2, 3, 4});
    exception.expect(ProgramLoadException.class);
    exception.expectMessage("Corrupt QUA program data");
    ProgramSerializer.load(file);
  }

  @Test
  public void testNotAProgram() throws Exception {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    ObjectOutputStream out = new ObjectOutputStream(bytes);
    out.writeObject(new ArrayList<String>());
    out.close();
    exception.expect(ProgramLoadException.class);
    exception.expectMessage("does not hold a QUA program");
    ProgramSerializer.deserialize(bytes.toByteArray());
  }
}
