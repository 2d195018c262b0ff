package exm.qua.frontend;

import exm.qua.ir.stream.ResultAnalysis;

/**
 * Scope in which result streams are transformed and saved
 */
public class ResultAnalysisScope extends Scope {

  private final ResultAnalysis results;

  public ResultAnalysisScope(ScopeStack stack, ResultAnalysis results) {
    super(stack);
    this.results = results;
  }

  @Override
  public ScopeKind kind() {
    return ScopeKind.RESULT_ANALYSIS;
  }

  public ResultAnalysis results() {
    return results;
  }
}
