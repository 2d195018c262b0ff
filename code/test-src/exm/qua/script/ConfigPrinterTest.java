package exm.qua.script;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.qua.common.exceptions.ConfigSerializationException;

public class ConfigPrinterTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private final ConfigPrinter printer = new ConfigPrinter(4, 3);

  @Test
  public void testScalars() throws Exception {
    assertEquals("\"a\\\"b\"", printer.print("a\"b"));
    assertEquals("5", printer.print(5L));
    assertEquals("0.25", printer.print(0.25));
    assertEquals("true", printer.print(true));
    assertEquals("null", printer.print(null));
  }

  @Test
  public void testNestedMap() throws Exception {
    Map<String, Object> inner = new LinkedHashMap<String, Object>();
    inner.put("port", 1);
    inner.put("offset", 0.0);
    Map<String, Object> outer = new LinkedHashMap<String, Object>();
    outer.put("analog", inner);
    outer.put("empty", Collections.emptyMap());
    outer.put("none", Collections.emptyList());
    assertEquals("{\n" +
                 "    \"analog\": {\n" +
                 "        \"port\": 1,\n" +
                 "        \"offset\": 0.0,\n" +
                 "    },\n" +
                 "    \"empty\": {},\n" +
                 "    \"none\": [],\n" +
                 "}", printer.print(outer));
  }

  @Test
  public void testCompactUniform() throws Exception {
    assertEquals("[0.0] * 5", printer.print(new double[5]));
    assertEquals("[1]", printer.print(new int[] {1}));
  }

  @Test
  public void testCompactRuns() throws Exception {
    assertEquals("[0.0] * 5 + [0.1, 0.2]", printer.print(
        Arrays.asList(0.0, 0.0, 0.0, 0.0, 0.0, 0.1, 0.2)));
    assertEquals("[1, 1, 2] + [3] * 3", printer.print(
        Arrays.asList(1, 1, 2, 3, 3, 3)));
  }

  @Test
  public void testCompactPairs() throws Exception {
    ConfigPrinter pairs = new ConfigPrinter(4, 2);
    assertEquals("[1] * 2 + [2] + [3] * 3", pairs.print(
        Arrays.asList(1, 1, 2, 3, 3, 3)));
    assertEquals("[1, 2] + [3] * 2", pairs.print(
        Arrays.asList(1, 2, 3, 3)));
  }

  @Test
  public void testNestedLists() throws Exception {
    List<Object> rows = new ArrayList<Object>();
    rows.add(Arrays.asList(1, 2));
    rows.add(Arrays.asList(3, 4));
    assertEquals("[\n    [1, 2],\n    [3, 4],\n]", printer.print(rows));
  }

  @Test
  public void testNonFinite() throws Exception {
    exception.expect(ConfigSerializationException.class);
    printer.print(Arrays.asList(1.0, Double.POSITIVE_INFINITY));
  }

  @Test
  public void testUnsupportedValue() throws Exception {
    exception.expect(ConfigSerializationException.class);
    printer.print(new Object());
  }

  @Test
  public void testTooDeep() throws Exception {
    Object value = 1;
    for (int i = 0; i <= ConfigPrinter.MAX_DEPTH + 1; i++) {
      value = Collections.singletonList(value);
    }
    exception.expect(ConfigSerializationException.class);
    exception.expectMessage("nested deeper");
    printer.print(value);
  }
}
