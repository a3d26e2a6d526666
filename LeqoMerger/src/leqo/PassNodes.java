package leqo;

import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

// Border node fragments handing every input on as the output with the same index.
public final class PassNodes {
  private PassNodes() {}

  @AutoValue
  public abstract static class RequestedInput {
    // Absent for a single, unsized qubit.
    public abstract Optional<Integer> qubitCount();

    public abstract Optional<ClassicalType> classicalType();

    public final boolean isQubit() {
      return !classicalType().isPresent();
    }

    public static RequestedInput qubit() {
      return new AutoValue_PassNodes_RequestedInput(Optional.empty(), Optional.empty());
    }

    public static RequestedInput qubits(int count) {
      return new AutoValue_PassNodes_RequestedInput(Optional.of(count), Optional.empty());
    }

    public static RequestedInput classical(ClassicalType type) {
      return new AutoValue_PassNodes_RequestedInput(Optional.empty(), Optional.of(type));
    }
  }

  public static String declarationName(int index) {
    return "pass_node_declaration_" + index;
  }

  public static String aliasName(int index) {
    return "pass_node_alias_" + index;
  }

  public static Program implementation(Map<Integer, RequestedInput> requestedInputs) {
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    ImmutableSortedMap.copyOf(requestedInputs)
        .forEach(
            (index, input) -> {
              ImmutableList<Annotation> inputAnnotation = ImmutableList.of(Annotation.input(index));
              if (input.isQubit()) {
                statements.add(
                    Statement.QubitDeclaration.create(
                        inputAnnotation,
                        declarationName(index),
                        input.qubitCount().<Expression>map(Expression::integer)));
              } else {
                statements.add(
                    Statement.ClassicalDeclaration.create(
                        inputAnnotation,
                        input.classicalType().get(),
                        declarationName(index),
                        Optional.empty()));
              }
              statements.add(
                  Statement.AliasStatement.create(
                      ImmutableList.of(Annotation.output(index)),
                      aliasName(index),
                      Expression.identifier(declarationName(index))));
            });
    return Program.of(statements.build());
  }
}
