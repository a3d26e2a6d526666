package leqo;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.primitives.Ints;

// Shorthands for building fragment ASTs in tests.
final class Fragments {
  private Fragments() {}

  static Program program(Statement... statements) {
    return Program.of(statements);
  }

  static Statement.QubitDeclaration qubits(String name, int size, Annotation... annotations) {
    return Statement.QubitDeclaration.create(
        Arrays.asList(annotations), name, Optional.of(Expression.integer(size)));
  }

  static Statement.QubitDeclaration qubit(String name, Annotation... annotations) {
    return Statement.QubitDeclaration.create(Arrays.asList(annotations), name, Optional.empty());
  }

  static Statement.ClassicalDeclaration classical(
      ClassicalType type, String name, Annotation... annotations) {
    return Statement.ClassicalDeclaration.create(
        Arrays.asList(annotations), type, name, Optional.empty());
  }

  static Statement.AliasStatement alias(String name, Expression value, Annotation... annotations) {
    return Statement.AliasStatement.create(Arrays.asList(annotations), name, value);
  }

  static Statement.AliasStatement alias(String name, String source, Annotation... annotations) {
    return alias(name, Expression.identifier(source), annotations);
  }

  // name[{p0, p1, ...}]
  static Expression select(String name, int... positions) {
    return Expression.IndexExpression.create(
        Expression.identifier(name), Expression.DiscreteSet.ofIntegers(Ints.asList(positions)));
  }

  // name[position]
  static Expression at(String name, int position) {
    return Expression.IndexExpression.create(name, position);
  }

  static Expression concat(Expression first, Expression... rest) {
    Expression result = first;
    for (Expression next : rest) {
      result = Expression.Concatenation.create(result, next);
    }
    return result;
  }

  static Statement.GateCall gate(String name, Expression... qubits) {
    return Statement.GateCall.create(name, qubits);
  }

  static Statement.GateCall gate(String name, String qubit) {
    return gate(name, Expression.identifier(qubit));
  }

  static Statement.BranchingStatement uncompute(Statement... body) {
    return Statement.BranchingStatement.uncompute(Arrays.asList(body));
  }

  static Annotation dirty(String positions) {
    return Annotation.create(Annotation.DIRTY, positions);
  }

  static Annotation reusable(String positions) {
    return Annotation.create(Annotation.REUSABLE, positions);
  }

  static String qasm(String... lines) {
    return String.join("\n", lines) + "\n";
  }
}
