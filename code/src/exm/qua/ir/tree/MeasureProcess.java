package exm.qua.ir.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.qua.common.exceptions.QuaRuntimeError;

/**
 * Processing applied to a measured signal: demodulation, integration,
 * time tagging or counting.
 *
 * The arguments are kept in the order the matching factory method takes
 * them.  Each is a String, an Integer, an {@link Expr} or null.
 */
public final class MeasureProcess extends IRNode {

  private static final long serialVersionUID = 1L;

  public static enum Family {
    DEMOD("demod"),
    INTEGRATION("integration"),
    DUAL_DEMOD("dual_demod"),
    DUAL_INTEGRATION("dual_integration"),
    TIME_TAGGING("time_tagging"),
    COUNTING("counting");

    private final String scriptName;

    private Family(String scriptName) {
      this.scriptName = scriptName;
    }

    public String scriptName() {
      return scriptName;
    }

    public static Family fromScriptName(String name) {
      for (Family f: values()) {
        if (f.scriptName.equals(name)) {
          return f;
        }
      }
      return null;
    }
  }

  private final Family family;
  private final String method;
  private final List<Object> args;

  public MeasureProcess(Family family, String method, Object... args) {
    this.family = family;
    this.method = method;
    for (Object arg: args) {
      if (arg != null && !(arg instanceof String) &&
          !(arg instanceof Integer) && !(arg instanceof Expr)) {
        throw new QuaRuntimeError("bad measure process argument: " + arg);
      }
    }
    this.args = Collections.unmodifiableList(
                        new ArrayList<Object>(Arrays.asList(args)));
  }

  public Family family() {
    return family;
  }

  public String method() {
    return method;
  }

  public List<Object> args() {
    return args;
  }

  @Override
  protected List<Object> fields() {
    return Arrays.<Object>asList(family, method, args);
  }
}
