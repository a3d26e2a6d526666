package leqo;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

// A top-level or nested statement of a fragment. The set of statement kinds is closed; passes
// dispatch on type() instead of relying on virtual methods per pass.
public abstract class Statement {

  public enum Type {
    QUBIT_DECLARATION,
    CLASSICAL_DECLARATION,
    ALIAS,
    BRANCHING,
    GATE_CALL,
    MEASUREMENT,
    INCLUDE,
    COMMENT;
  }

  Statement() {}

  public abstract Type type();

  public abstract ImmutableList<Annotation> annotations();

  public abstract Statement withAnnotations(List<Annotation> annotations);

  @SuppressWarnings("unchecked")
  public <T extends Statement> T cast() {
    return (T) this;
  }

  public boolean hasAnnotation(String keyword) {
    return annotations().stream().anyMatch(a -> a.keyword().equals(keyword));
  }

  @Override
  public String toString() {
    return QasmPrinter.printStatement(this);
  }

  @AutoValue
  public abstract static class QubitDeclaration extends Statement {
    public abstract String name();

    public abstract Optional<Expression> size();

    @Override
    public final Type type() {
      return Type.QUBIT_DECLARATION;
    }

    @Override
    public QubitDeclaration withAnnotations(List<Annotation> annotations) {
      return create(annotations, name(), size());
    }

    public static QubitDeclaration create(
        List<Annotation> annotations, String name, Optional<Expression> size) {
      return new AutoValue_Statement_QubitDeclaration(
          ImmutableList.copyOf(annotations), name, size);
    }

    public static QubitDeclaration create(String name, int size) {
      return create(ImmutableList.of(), name, Optional.of(Expression.integer(size)));
    }

    public static QubitDeclaration single(String name) {
      return create(ImmutableList.of(), name, Optional.empty());
    }
  }

  @AutoValue
  public abstract static class ClassicalDeclaration extends Statement {
    public abstract ClassicalType classicalType();

    public abstract String name();

    public abstract Optional<Expression> initializer();

    @Override
    public final Type type() {
      return Type.CLASSICAL_DECLARATION;
    }

    @Override
    public ClassicalDeclaration withAnnotations(List<Annotation> annotations) {
      return create(annotations, classicalType(), name(), initializer());
    }

    public static ClassicalDeclaration create(
        List<Annotation> annotations,
        ClassicalType classicalType,
        String name,
        Optional<Expression> initializer) {
      return new AutoValue_Statement_ClassicalDeclaration(
          ImmutableList.copyOf(annotations), classicalType, name, initializer);
    }

    public static ClassicalDeclaration create(ClassicalType classicalType, String name) {
      return create(ImmutableList.of(), classicalType, name, Optional.empty());
    }
  }

  @AutoValue
  public abstract static class AliasStatement extends Statement {
    public abstract String name();

    public abstract Expression value();

    @Override
    public final Type type() {
      return Type.ALIAS;
    }

    @Override
    public AliasStatement withAnnotations(List<Annotation> annotations) {
      return create(annotations, name(), value());
    }

    public static AliasStatement create(
        List<Annotation> annotations, String name, Expression value) {
      return new AutoValue_Statement_AliasStatement(ImmutableList.copyOf(annotations), name, value);
    }

    public static AliasStatement create(String name, Expression value) {
      return create(ImmutableList.of(), name, value);
    }
  }

  @AutoValue
  public abstract static class BranchingStatement extends Statement {
    public abstract Expression condition();

    public abstract ImmutableList<Statement> ifBlock();

    public abstract ImmutableList<Statement> elseBlock();

    @Override
    public final Type type() {
      return Type.BRANCHING;
    }

    public boolean hasElseBlock() {
      return !elseBlock().isEmpty();
    }

    public boolean isUncomputeBlock() {
      return hasAnnotation(Annotation.UNCOMPUTE);
    }

    @Override
    public BranchingStatement withAnnotations(List<Annotation> annotations) {
      return create(annotations, condition(), ifBlock(), elseBlock());
    }

    public BranchingStatement withBlocks(List<Statement> ifBlock, List<Statement> elseBlock) {
      return create(annotations(), condition(), ifBlock, elseBlock);
    }

    public static BranchingStatement create(
        List<Annotation> annotations,
        Expression condition,
        List<Statement> ifBlock,
        List<Statement> elseBlock) {
      return new AutoValue_Statement_BranchingStatement(
          ImmutableList.copyOf(annotations),
          condition,
          ImmutableList.copyOf(ifBlock),
          ImmutableList.copyOf(elseBlock));
    }

    public static BranchingStatement create(
        Expression condition, List<Statement> ifBlock, List<Statement> elseBlock) {
      return create(ImmutableList.of(), condition, ifBlock, elseBlock);
    }

    // @leqo.uncompute if (false) { body }
    public static BranchingStatement uncompute(List<Statement> body) {
      return create(
          ImmutableList.of(Annotation.uncompute()),
          Expression.BooleanLiteral.create(false),
          body,
          ImmutableList.of());
    }
  }

  @AutoValue
  public abstract static class GateCall extends Statement {
    public abstract String name();

    public abstract ImmutableList<Expression> parameters();

    public abstract ImmutableList<Expression> qubits();

    @Override
    public final Type type() {
      return Type.GATE_CALL;
    }

    @Override
    public GateCall withAnnotations(List<Annotation> annotations) {
      return create(annotations, name(), parameters(), qubits());
    }

    public static GateCall create(
        List<Annotation> annotations,
        String name,
        List<Expression> parameters,
        List<Expression> qubits) {
      return new AutoValue_Statement_GateCall(
          ImmutableList.copyOf(annotations),
          name,
          ImmutableList.copyOf(parameters),
          ImmutableList.copyOf(qubits));
    }

    public static GateCall create(String name, Expression... qubits) {
      return create(ImmutableList.of(), name, ImmutableList.of(), ImmutableList.copyOf(qubits));
    }
  }

  @AutoValue
  public abstract static class Measurement extends Statement {
    public abstract Optional<Expression> target();

    public abstract Expression qubit();

    @Override
    public final Type type() {
      return Type.MEASUREMENT;
    }

    @Override
    public Measurement withAnnotations(List<Annotation> annotations) {
      return create(annotations, target(), qubit());
    }

    public static Measurement create(
        List<Annotation> annotations, Optional<Expression> target, Expression qubit) {
      return new AutoValue_Statement_Measurement(
          ImmutableList.copyOf(annotations), target, qubit);
    }

    public static Measurement create(Expression target, Expression qubit) {
      return create(ImmutableList.of(), Optional.of(target), qubit);
    }
  }

  @AutoValue
  public abstract static class Include extends Statement {
    public abstract String path();

    @Override
    public final Type type() {
      return Type.INCLUDE;
    }

    @Override
    public Include withAnnotations(List<Annotation> annotations) {
      return new AutoValue_Statement_Include(ImmutableList.copyOf(annotations), path());
    }

    public static Include create(String path) {
      return new AutoValue_Statement_Include(ImmutableList.of(), path);
    }
  }

  @AutoValue
  public abstract static class Comment extends Statement {
    public abstract String text();

    @Override
    public final Type type() {
      return Type.COMMENT;
    }

    @Override
    public Comment withAnnotations(List<Annotation> annotations) {
      return new AutoValue_Statement_Comment(ImmutableList.copyOf(annotations), text());
    }

    public static Comment create(String text) {
      return new AutoValue_Statement_Comment(ImmutableList.of(), text);
    }
  }
}
