package exm.qua.script.parse;

import static org.junit.Assert.assertEquals;

import org.apache.commons.lang3.StringUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.qua.common.exceptions.InvalidSyntaxException;

public class ScriptLayoutTest {

  private static final String I = String.valueOf(ScriptLayout.INDENT);
  private static final String D = String.valueOf(ScriptLayout.DEDENT);
  private static final String E = String.valueOf(ScriptLayout.EOS);

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testBlocks() throws Exception {
    String text = "program prog:\n" +
                  "    if_(x):\n" +
                  "        pause()\n" +
                  "    pause()\n";
    assertEquals("program prog:" + E + "\n" +
                 I + "    if_(x):" + E + "\n" +
                 I + "        pause()" + E + "\n" +
                 D + "    pause()" + E + "\n" + D,
                 ScriptLayout.layout(text));
  }

  @Test
  public void testCommentsAndBlankLines() throws Exception {
    String text = "# header\n" +
                  "\n" +
                  "x = 1  # trailing\n" +
                  "   # indented comment\n";
    assertEquals("# header\n\nx = 1  # trailing" + E + "\n" +
                 "   # indented comment\n",
                 ScriptLayout.layout(text));
  }

  @Test
  public void testContinuationInsideBrackets() throws Exception {
    String text = "config = {\n" +
                  "    \"a\": 1,\n" +
                  "}\n";
    assertEquals("config = {\n    \"a\": 1,\n}" + E + "\n",
                 ScriptLayout.layout(text));
  }

  @Test
  public void testBracketInString() throws Exception {
    assertEquals("x = \"(\"" + E, ScriptLayout.layout("x = \"(\""));
  }

  @Test
  public void testBadDedent() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("line 3");
    ScriptLayout.layout("a:\n    b\n  c\n");
  }

  @Test
  public void testTabs() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("tabs");
    ScriptLayout.layout("a:\n\tb\n");
  }

  @Test
  public void testUnclosedBracket() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("unclosed bracket");
    ScriptLayout.layout("play(\"pi\",\n");
  }

  @Test
  public void testUnmatchedBracket() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("unmatched closing bracket ')'");
    ScriptLayout.layout("pause())\n");
  }

  @Test
  public void testUnterminatedString() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("unterminated string");
    ScriptLayout.layout("x = \"abc\n");
  }

  @Test
  public void testNestingLimit() throws Exception {
    String shallow = StringUtils.repeat("(", ScriptLayout.MAX_NESTING) +
                     "1" + StringUtils.repeat(")", ScriptLayout.MAX_NESTING);
    ScriptLayout.layout("x = " + shallow + "\n");

    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("nested deeper than 200");
    ScriptLayout.layout("x = (" + shallow + ")\n");
  }
}
