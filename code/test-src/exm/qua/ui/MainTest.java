package exm.qua.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.qua.common.lang.VarType;
import exm.qua.frontend.QuaBuilder;
import exm.qua.frontend.QuaExpression;
import exm.qua.frontend.Scope;
import exm.qua.persist.ProgramSerializer;

public class MainTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(bytes, true);

  private File savedProgram() throws Exception {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      try (Scope loop = q.while_(v.lt(3))) {
        q.assign(v, v.add(1));
      }
    }
    File file = tmp.newFile("prog.bin");
    ProgramSerializer.save(q.getProgram(), file);
    return file;
  }

  private String output() {
    return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  public void testPrintsScript() throws Exception {
    File file = savedProgram();
    assertEquals(ExitCode.SUCCESS,
                 Main.run(new String[] {file.getPath()}, out));
    assertTrue(output(), output().endsWith("program prog:\n" +
        "    v1 = declare(int)\n" +
        "    while_((v1<3)):\n" +
        "        assign(v1, (v1+1))\n"));
  }

  @Test
  public void testOutputFile() throws Exception {
    File file = savedProgram();
    File script = new File(tmp.getRoot(), "prog.qua");
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"-n", "-o",
                             script.getPath(), file.getPath()}, out));
    assertEquals("", output());
    assertTrue(FileUtils.readFileToString(script, StandardCharsets.UTF_8)
                        .contains("while_((v1<3)):"));
  }

  @Test
  public void testNoInput() {
    assertEquals(ExitCode.ERROR_COMMAND, Main.run(new String[0], out));
  }

  @Test
  public void testBadOption() {
    assertEquals(ExitCode.ERROR_COMMAND,
                 Main.run(new String[] {"--frobnicate", "x"}, out));
  }

  @Test
  public void testMissingInput() {
    File missing = new File(tmp.getRoot(), "missing.bin");
    assertEquals(ExitCode.ERROR_IO,
                 Main.run(new String[] {missing.getPath()}, out));
  }

  @Test
  public void testCorruptInput() throws Exception {
    File file = tmp.newFile("bad.bin");
    FileUtils.writeStringToFile(file, "not a program",
                                StandardCharsets.UTF_8);
    assertEquals(ExitCode.ERROR_LOAD,
                 Main.run(new String[] {file.getPath()}, out));
  }
}
