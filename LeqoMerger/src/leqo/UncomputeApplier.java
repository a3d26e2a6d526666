package leqo;

final class UncomputeApplier extends StatementTransformer {
  private final boolean enable;

  UncomputeApplier(boolean enable) {
    this.enable = enable;
  }

  @Override
  protected Edit visitBranching(Statement.BranchingStatement branch) throws CompilerException {
    if (!branch.isUncomputeBlock()) return visitChildren(branch);
    return enable ? Edit.replace(branch.ifBlock()) : Edit.remove();
  }
}
