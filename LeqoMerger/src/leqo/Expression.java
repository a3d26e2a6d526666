package leqo;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

// Expressions that appear inside fragments: alias values, sizes, indices and branch conditions.
public abstract class Expression {

  public enum Type {
    IDENTIFIER,
    INTEGER_LITERAL,
    BOOLEAN_LITERAL,
    INDEX,
    DISCRETE_SET,
    RANGE,
    CONCATENATION,
    UNARY,
    BINARY;
  }

  Expression() {}

  public abstract Type type();

  @SuppressWarnings("unchecked")
  public <T extends Expression> T cast() {
    return (T) this;
  }

  @Override
  public String toString() {
    return QasmPrinter.printExpression(this);
  }

  public static Identifier identifier(String name) {
    return Identifier.create(name);
  }

  public static IntegerLiteral integer(long value) {
    return IntegerLiteral.create(value);
  }

  @AutoValue
  public abstract static class Identifier extends Expression {
    public abstract String name();

    @Override
    public final Type type() {
      return Type.IDENTIFIER;
    }

    public static Identifier create(String name) {
      return new AutoValue_Expression_Identifier(name);
    }
  }

  @AutoValue
  public abstract static class IntegerLiteral extends Expression {
    public abstract long value();

    @Override
    public final Type type() {
      return Type.INTEGER_LITERAL;
    }

    public static IntegerLiteral create(long value) {
      return new AutoValue_Expression_IntegerLiteral(value);
    }
  }

  @AutoValue
  public abstract static class BooleanLiteral extends Expression {
    public abstract boolean value();

    @Override
    public final Type type() {
      return Type.BOOLEAN_LITERAL;
    }

    public static BooleanLiteral create(boolean value) {
      return new AutoValue_Expression_BooleanLiteral(value);
    }
  }

  // collection[i0][i1]...; each index is a set, a range or a scalar.
  @AutoValue
  public abstract static class IndexExpression extends Expression {
    public abstract Expression collection();

    public abstract ImmutableList<Expression> indices();

    @Override
    public final Type type() {
      return Type.INDEX;
    }

    public static IndexExpression create(
        Expression collection, List<? extends Expression> indices) {
      Preconditions.checkArgument(!indices.isEmpty(), "index expression without index");
      return new AutoValue_Expression_IndexExpression(collection, ImmutableList.copyOf(indices));
    }

    public static IndexExpression create(Expression collection, Expression index) {
      return create(collection, ImmutableList.of(index));
    }

    public static IndexExpression create(String collection, long index) {
      return create(Identifier.create(collection), IntegerLiteral.create(index));
    }
  }

  @AutoValue
  public abstract static class DiscreteSet extends Expression {
    public abstract ImmutableList<Expression> values();

    @Override
    public final Type type() {
      return Type.DISCRETE_SET;
    }

    public static DiscreteSet create(List<? extends Expression> values) {
      return new AutoValue_Expression_DiscreteSet(ImmutableList.copyOf(values));
    }

    public static DiscreteSet ofIntegers(Iterable<Integer> values) {
      ImmutableList.Builder<Expression> builder = ImmutableList.builder();
      for (int value : values) {
        builder.add(IntegerLiteral.create(value));
      }
      return create(builder.build());
    }
  }

  // start:step:end, all parts optional; the end is inclusive.
  @AutoValue
  public abstract static class RangeDefinition extends Expression {
    public abstract Optional<Expression> start();

    public abstract Optional<Expression> end();

    public abstract Optional<Expression> step();

    @Override
    public final Type type() {
      return Type.RANGE;
    }

    public static RangeDefinition create(
        Optional<Expression> start, Optional<Expression> end, Optional<Expression> step) {
      return new AutoValue_Expression_RangeDefinition(start, end, step);
    }

    public static RangeDefinition of(long start, long end) {
      return create(
          Optional.of(IntegerLiteral.create(start)),
          Optional.of(IntegerLiteral.create(end)),
          Optional.empty());
    }
  }

  @AutoValue
  public abstract static class Concatenation extends Expression {
    public abstract Expression lhs();

    public abstract Expression rhs();

    @Override
    public final Type type() {
      return Type.CONCATENATION;
    }

    public static Concatenation create(Expression lhs, Expression rhs) {
      return new AutoValue_Expression_Concatenation(lhs, rhs);
    }
  }

  @AutoValue
  public abstract static class UnaryExpression extends Expression {
    public abstract String op();

    public abstract Expression operand();

    @Override
    public final Type type() {
      return Type.UNARY;
    }

    public static UnaryExpression create(String op, Expression operand) {
      return new AutoValue_Expression_UnaryExpression(op, operand);
    }
  }

  @AutoValue
  public abstract static class BinaryExpression extends Expression {
    public abstract String op();

    public abstract Expression lhs();

    public abstract Expression rhs();

    @Override
    public final Type type() {
      return Type.BINARY;
    }

    public static BinaryExpression create(String op, Expression lhs, Expression rhs) {
      return new AutoValue_Expression_BinaryExpression(op, lhs, rhs);
    }
  }
}
