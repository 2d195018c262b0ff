package exm.qua.frontend;

import exm.qua.ir.tree.Conditionals.IfStatement;
import exm.qua.ir.tree.Expr;
import exm.qua.ir.tree.IRTree.Block;

/**
 * Open switch: cases become an if/elif chain on the switch expression,
 * the default becomes its else.
 */
public class SwitchScope extends Scope {

  private final Expr expression;
  private final boolean unsafe;
  /** block the generated if statement goes into */
  private final Block target;
  private IfStatement ifStatement = null;
  private boolean hasDefault = false;

  public SwitchScope(ScopeStack stack, Expr expression, boolean unsafe,
                     Block target) {
    super(stack);
    this.expression = expression;
    this.unsafe = unsafe;
    this.target = target;
  }

  @Override
  public ScopeKind kind() {
    return ScopeKind.SWITCH;
  }

  public Expr expression() {
    return expression;
  }

  public boolean isUnsafe() {
    return unsafe;
  }

  Block target() {
    return target;
  }

  /**
   * @return if statement built by the first case, null before it
   */
  IfStatement ifStatement() {
    return ifStatement;
  }

  void setIfStatement(IfStatement ifStatement) {
    this.ifStatement = ifStatement;
  }

  boolean hasDefault() {
    return hasDefault;
  }

  void setHasDefault() {
    this.hasDefault = true;
  }
}
