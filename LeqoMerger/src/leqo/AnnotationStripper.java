package leqo;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

final class AnnotationStripper extends StatementTransformer {
  private static final ImmutableSet<String> ANCILLA_KEYWORDS =
      ImmutableSet.of(Annotation.DIRTY, Annotation.REUSABLE, Annotation.UNCOMPUTE);

  private final ImmutableSet<String> keywords;

  private AnnotationStripper(ImmutableSet<String> keywords) {
    this.keywords = keywords;
  }

  static Program stripAll(Program program) {
    return strip(program, Annotation.LEQO_KEYWORDS);
  }

  // Ancilla annotations always go; input and output annotations on request.
  static Program strip(Program program, boolean inputs, boolean outputs) {
    ImmutableSet.Builder<String> keywords = ImmutableSet.<String>builder().addAll(ANCILLA_KEYWORDS);
    if (inputs) keywords.add(Annotation.INPUT);
    if (outputs) keywords.add(Annotation.OUTPUT);
    return strip(program, keywords.build());
  }

  private static Program strip(Program program, ImmutableSet<String> keywords) {
    try {
      return new AnnotationStripper(keywords).transform(program);
    } catch (CompilerException ex) {
      throw new AssertionError(ex);
    }
  }

  private Statement stripped(Statement statement) {
    ImmutableList<Annotation> kept =
        statement
            .annotations()
            .stream()
            .filter(a -> !keywords.contains(a.keyword()))
            .collect(ImmutableList.toImmutableList());
    return kept.size() == statement.annotations().size()
        ? statement
        : statement.withAnnotations(kept);
  }

  private Edit strip(Statement statement) {
    Statement result = stripped(statement);
    return result == statement ? Edit.keep() : Edit.replace(result);
  }

  @Override
  protected Edit visitQubitDeclaration(Statement.QubitDeclaration declaration) {
    return strip(declaration);
  }

  @Override
  protected Edit visitClassicalDeclaration(Statement.ClassicalDeclaration declaration) {
    return strip(declaration);
  }

  @Override
  protected Edit visitAlias(Statement.AliasStatement alias) {
    return strip(alias);
  }

  @Override
  protected Edit visitBranching(Statement.BranchingStatement branch) throws CompilerException {
    Statement.BranchingStatement result = stripped(branch).cast();
    Edit children = visitChildren(result);
    if (children.kind() == Edit.Kind.REPLACE || result == branch) return children;
    return Edit.replace(result);
  }

  @Override
  protected Edit visitOther(Statement statement) {
    return strip(statement);
  }
}
