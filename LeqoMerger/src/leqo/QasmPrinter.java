package leqo;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;

public final class QasmPrinter {
  private static final String INDENT = "  ";
  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private final StringBuilder out = new StringBuilder();

  private QasmPrinter() {}

  public static String print(Program program) {
    QasmPrinter printer = new QasmPrinter();
    printer.out.append("OPENQASM ").append(program.version()).append(";\n");
    printer.printBlock(program.statements(), 0);
    return printer.out.toString();
  }

  // Without trailing newline.
  public static String printStatement(Statement statement) {
    QasmPrinter printer = new QasmPrinter();
    printer.printStatement(statement, 0);
    return printer.out.toString().trim();
  }

  public static String printExpression(Expression expr) {
    switch (expr.type()) {
      case IDENTIFIER:
        return expr.<Expression.Identifier>cast().name();
      case INTEGER_LITERAL:
        return Long.toString(expr.<Expression.IntegerLiteral>cast().value());
      case BOOLEAN_LITERAL:
        return Boolean.toString(expr.<Expression.BooleanLiteral>cast().value());
      case INDEX:
        {
          Expression.IndexExpression index = expr.cast();
          StringBuilder sb = new StringBuilder(printOperand(index.collection()));
          for (Expression dimension : index.indices()) {
            sb.append('[').append(printExpression(dimension)).append(']');
          }
          return sb.toString();
        }
      case DISCRETE_SET:
        return "{" + printAll(expr.<Expression.DiscreteSet>cast().values()) + "}";
      case RANGE:
        {
          Expression.RangeDefinition range = expr.cast();
          StringBuilder sb = new StringBuilder();
          range.start().ifPresent(e -> sb.append(printExpression(e)));
          sb.append(':');
          range.step().ifPresent(e -> sb.append(printExpression(e)).append(':'));
          range.end().ifPresent(e -> sb.append(printExpression(e)));
          return sb.toString();
        }
      case CONCATENATION:
        {
          Expression.Concatenation concat = expr.cast();
          return printExpression(concat.lhs()) + " ++ " + printExpression(concat.rhs());
        }
      case UNARY:
        {
          Expression.UnaryExpression unary = expr.cast();
          return unary.op() + printOperand(unary.operand());
        }
      case BINARY:
        {
          Expression.BinaryExpression binary = expr.cast();
          return printOperand(binary.lhs()) + " " + binary.op() + " " + printOperand(binary.rhs());
        }
    }
    throw new AssertionError(expr.type());
  }

  // Compound operands are parenthesized so that precedence never matters.
  private static String printOperand(Expression expr) {
    switch (expr.type()) {
      case BINARY:
      case CONCATENATION:
      case UNARY:
        return "(" + printExpression(expr) + ")";
      default:
        return printExpression(expr);
    }
  }

  private static String printAll(List<Expression> exprs) {
    return COMMA_JOINER.join(exprs.stream().map(QasmPrinter::printExpression).iterator());
  }

  private void printBlock(List<Statement> statements, int depth) {
    for (Statement statement : statements) {
      printStatement(statement, depth);
    }
  }

  private void line(int depth, String text) {
    out.append(Strings.repeat(INDENT, depth)).append(text).append('\n');
  }

  private void printStatement(Statement statement, int depth) {
    for (Annotation annotation : statement.annotations()) {
      line(depth, annotation.toString());
    }

    switch (statement.type()) {
      case QUBIT_DECLARATION:
        {
          Statement.QubitDeclaration decl = statement.cast();
          String type =
              decl.size().map(s -> "qubit[" + printExpression(s) + "]").orElse("qubit");
          line(depth, type + " " + decl.name() + ";");
          return;
        }
      case CLASSICAL_DECLARATION:
        {
          Statement.ClassicalDeclaration decl = statement.cast();
          String init = decl.initializer().map(e -> " = " + printExpression(e)).orElse("");
          line(depth, decl.classicalType() + " " + decl.name() + init + ";");
          return;
        }
      case ALIAS:
        {
          Statement.AliasStatement alias = statement.cast();
          line(depth, "let " + alias.name() + " = " + printExpression(alias.value()) + ";");
          return;
        }
      case BRANCHING:
        {
          Statement.BranchingStatement branch = statement.cast();
          line(depth, "if (" + printExpression(branch.condition()) + ") {");
          printBlock(branch.ifBlock(), depth + 1);
          if (branch.hasElseBlock()) {
            line(depth, "} else {");
            printBlock(branch.elseBlock(), depth + 1);
          }
          line(depth, "}");
          return;
        }
      case GATE_CALL:
        {
          Statement.GateCall call = statement.cast();
          String params =
              call.parameters().isEmpty() ? "" : "(" + printAll(call.parameters()) + ")";
          line(depth, call.name() + params + " " + printAll(call.qubits()) + ";");
          return;
        }
      case MEASUREMENT:
        {
          Statement.Measurement measure = statement.cast();
          String target = measure.target().map(t -> printExpression(t) + " = ").orElse("");
          line(depth, target + "measure " + printExpression(measure.qubit()) + ";");
          return;
        }
      case INCLUDE:
        line(depth, "include \"" + statement.<Statement.Include>cast().path() + "\";");
        return;
      case COMMENT:
        line(depth, "/* " + statement.<Statement.Comment>cast().text() + " */");
        return;
    }
    throw new AssertionError(statement.type());
  }
}
