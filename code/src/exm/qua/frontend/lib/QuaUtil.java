package exm.qua.frontend.lib;

import exm.qua.common.lang.Library;
import exm.qua.frontend.QuaBuilder;
import exm.qua.frontend.QuaExpression;

public class QuaUtil {

  private final QuaBuilder builder;

  public QuaUtil(QuaBuilder builder) {
    this.builder = builder;
  }

  /**
   * Select a value by condition, evaluated on the controller
   */
  public QuaExpression cond(Object condition, Object trueResult,
                            Object falseResult) {
    return builder.callLibraryFunction(Library.UTIL, "cond", condition,
                                       trueResult, falseResult);
  }
}
