package leqo;

import java.util.List;
import java.util.Map;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

// Qubit declarations become aliases into the register, connected classical inputs become aliases
// of the output feeding them. Only input and output annotations move to the alias.
final class ConnectionApplier extends StatementTransformer {
  private final ProgramNode node;
  private final AnnotationModel model;
  private final String registerName;
  private final Map<SingleQubit, Integer> qubitToIndex;
  private final Map<String, String> classicalInputToOutput;

  ConnectionApplier(
      ProgramNode node,
      AnnotationModel model,
      String registerName,
      Map<SingleQubit, Integer> qubitToIndex,
      Map<String, String> classicalInputToOutput) {
    this.node = node;
    this.model = model;
    this.registerName = registerName;
    this.qubitToIndex = qubitToIndex;
    this.classicalInputToOutput = classicalInputToOutput;
  }

  @Override
  protected Edit visitQubitDeclaration(Statement.QubitDeclaration declaration) {
    List<Integer> ids = model.declarationToIds().get(declaration.name());
    Verify.verifyNotNull(ids, "%s: declaration %s was not parsed", node, declaration.name());

    ImmutableList.Builder<Integer> indices = ImmutableList.builder();
    for (int id : ids) {
      Integer index = qubitToIndex.get(SingleQubit.create(node, id));
      Verify.verifyNotNull(index, "%s: qubit %s has no register index", node, id);
      indices.add(index);
    }

    Expression register = Expression.identifier(registerName);
    Expression value;
    if (declaration.size().isPresent()) {
      value =
          Expression.IndexExpression.create(
              register, Expression.DiscreteSet.ofIntegers(indices.build()));
    } else {
      Verify.verify(ids.size() == 1, "%s: single qubit %s with %s ids", node, declaration, ids);
      value =
          Expression.IndexExpression.create(register, Expression.integer(indices.build().get(0)));
    }
    return Edit.replace(
        Statement.AliasStatement.create(
            ioAnnotations(declaration), declaration.name(), value));
  }

  @Override
  protected Edit visitClassicalDeclaration(Statement.ClassicalDeclaration declaration) {
    String output = classicalInputToOutput.get(declaration.name());
    if (output == null) return Edit.keep();

    return Edit.replace(
        Statement.AliasStatement.create(
            ioAnnotations(declaration), declaration.name(), Expression.identifier(output)));
  }

  private static ImmutableList<Annotation> ioAnnotations(Statement declaration) {
    return declaration
        .annotations()
        .stream()
        .filter(a -> a.keyword().equals(Annotation.INPUT) || a.keyword().equals(Annotation.OUTPUT))
        .collect(ImmutableList.toImmutableList());
  }
}
