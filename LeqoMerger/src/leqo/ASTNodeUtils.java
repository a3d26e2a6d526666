package leqo;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.primitives.Ints;

public final class ASTNodeUtils {
  private static final Splitter POSITION_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings();

  // Folds integer literals and unary minus.
  public static int exprToInt(Expression expr) throws CompilerException {
    switch (expr.type()) {
      case INTEGER_LITERAL:
        {
          long value = expr.<Expression.IntegerLiteral>cast().value();
          if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new CompilerException(String.format("integer %d out of range", value));
          }
          return (int) value;
        }
      case UNARY:
        {
          Expression.UnaryExpression unary = expr.cast();
          if (unary.op().equals("-")) return -exprToInt(unary.operand());
          throw new CompilerException(String.format("unsupported operator '%s'", unary.op()));
        }
      default:
        throw new CompilerException(String.format("could not resolve '%s' to an integer", expr));
    }
  }

  // Each index dimension applies to the result of the previous one.
  public static ImmutableList<Integer> resolveIndices(List<Expression> indices, int length)
      throws CompilerException {
    List<Integer> current = new ArrayList<>();
    for (int i = 0; i < length; i++) {
      current.add(i);
    }

    boolean scalar = false;
    for (Expression index : indices) {
      if (scalar) throw new CompilerException("can't further index a single instance");

      List<Integer> next = new ArrayList<>();
      switch (index.type()) {
        case DISCRETE_SET:
          for (Expression value : index.<Expression.DiscreteSet>cast().values()) {
            next.add(current.get(checkedPosition(exprToInt(value), current.size())));
          }
          break;
        case RANGE:
          for (int position : resolveRange(index.cast(), current.size())) {
            next.add(current.get(checkedPosition(position, current.size())));
          }
          break;
        default:
          next.add(current.get(checkedPosition(exprToInt(index), current.size())));
          scalar = true;
          break;
      }
      current = next;
    }
    return ImmutableList.copyOf(current);
  }

  // OpenQASM ranges include the end; negative bounds count from the end of the register.
  static ImmutableList<Integer> resolveRange(Expression.RangeDefinition range, int length)
      throws CompilerException {
    int start = range.start().isPresent() ? exprToInt(range.start().get()) : 0;
    int end = range.end().isPresent() ? exprToInt(range.end().get()) : -1;
    int step = range.step().isPresent() ? exprToInt(range.step().get()) : 1;
    if (step == 0) throw new CompilerException("range step must not be zero");
    if (start < 0) start += length;
    if (end < 0) end += length;

    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    if (step > 0) {
      for (int i = start; i <= end; i += step) {
        builder.add(i);
      }
    } else {
      for (int i = start; i >= end; i += step) {
        builder.add(i);
      }
    }
    return builder.build();
  }

  private static int checkedPosition(int position, int length) throws CompilerException {
    int resolved = position < 0 ? position + length : position;
    if (resolved < 0 || resolved >= length) {
      throw new CompilerException(
          String.format("index %d out of range for register of size %d", position, length));
    }
    return resolved;
  }

  public static int parseIoIndex(Annotation annotation) throws CompilerException {
    if (!annotation.hasCommand()) {
      throw new CompilerException(
          String.format("@%s annotation without index", annotation.keyword()));
    }
    Integer index = Ints.tryParse(annotation.command());
    if (index == null || index < 0) {
      throw new CompilerException(
          String.format(
              "@%s expects a single non-negative index, found '%s'",
              annotation.keyword(), annotation.command()));
    }
    return index;
  }

  // Payloads like 1,3,5-7; an empty payload selects every position.
  public static ImmutableSortedSet<Integer> parsePositions(Annotation annotation, int length)
      throws CompilerException {
    if (!annotation.hasCommand()) {
      return ImmutableSortedSet.copyOf(resolveRange(Expression.RangeDefinition.of(0, -1), length));
    }

    TreeSet<Integer> positions = new TreeSet<>();
    for (String part : POSITION_SPLITTER.split(annotation.command())) {
      int dash = part.indexOf('-');
      String first = dash < 0 ? part : part.substring(0, dash).trim();
      Optional<Integer> from = Optional.ofNullable(Ints.tryParse(first));
      Optional<Integer> to =
          dash < 0 ? from : Optional.ofNullable(Ints.tryParse(part.substring(dash + 1).trim()));
      if (!from.isPresent() || !to.isPresent() || from.get() > to.get()) {
        throw new CompilerException(
            String.format(
                "malformed position list '%s' in @%s", annotation.command(), annotation.keyword()));
      }
      for (int position = from.get(); position <= to.get(); position++) {
        if (position >= length) {
          throw new CompilerException(
              String.format(
                  "position %d of @%s is out of range for size %d",
                  position, annotation.keyword(), length));
        }
        positions.add(position);
      }
    }
    return ImmutableSortedSet.copyOf(positions);
  }

  public static Optional<String> someIdentifier(Expression value) {
    switch (value.type()) {
      case IDENTIFIER:
        return Optional.of(value.<Expression.Identifier>cast().name());
      case INDEX:
        return someIdentifier(value.<Expression.IndexExpression>cast().collection());
      case CONCATENATION:
        return someIdentifier(value.<Expression.Concatenation>cast().lhs());
      default:
        return Optional.empty();
    }
  }

  private ASTNodeUtils() {}
}
