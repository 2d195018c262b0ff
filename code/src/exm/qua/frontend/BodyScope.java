package exm.qua.frontend;

import exm.qua.ir.tree.IRTree.Block;

/**
 * Scope of a block owned by a control flow statement
 */
public class BodyScope extends Scope {

  private final Block body;

  public BodyScope(ScopeStack stack, Block body) {
    super(stack);
    this.body = body;
  }

  @Override
  public ScopeKind kind() {
    return ScopeKind.BODY;
  }

  @Override
  public Block block() {
    return body;
  }
}
