package exm.qua.frontend;

import exm.qua.ir.tree.Loops.ForStatement;

/**
 * For loop written section by section:
 * <pre>
 *   try (ForScope f = q.for_()) {
 *     try (Scope s = f.init()) { q.assign(i, 0); }
 *     f.condition(i.lt(10));
 *     try (Scope s = f.update()) { q.assign(i, i.add(1)); }
 *     try (Scope s = f.body()) { ... }
 *   }
 * </pre>
 */
public class ForScope extends Scope {

  private final ForStatement loop;

  public ForScope(ScopeStack stack, ForStatement loop) {
    super(stack);
    this.loop = loop;
  }

  @Override
  public ScopeKind kind() {
    return ScopeKind.FOR;
  }

  public ForStatement loop() {
    return loop;
  }

  public Scope init() {
    return stack.pushBody(this, loop.init());
  }

  public Scope update() {
    return stack.pushBody(this, loop.update());
  }

  public Scope body() {
    return stack.pushBody(this, loop.body());
  }

  public void condition(Object condition) {
    stack.checkTop(this, "Expecting for scope");
    loop.setCondition(Literals.toScalar(condition, "loop condition"));
  }
}
