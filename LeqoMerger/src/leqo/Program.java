package leqo;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class Program {
  public static final String DEFAULT_VERSION = "3.1";

  public abstract String version();

  public abstract ImmutableList<Statement> statements();

  public Program withStatements(List<Statement> statements) {
    return create(version(), statements);
  }

  public static Program create(String version, List<Statement> statements) {
    return new AutoValue_Program(version, ImmutableList.copyOf(statements));
  }

  public static Program of(Statement... statements) {
    return create(DEFAULT_VERSION, ImmutableList.copyOf(statements));
  }

  public static Program of(List<Statement> statements) {
    return create(DEFAULT_VERSION, statements);
  }

  @Override
  public String toString() {
    return QasmPrinter.print(this);
  }
}
