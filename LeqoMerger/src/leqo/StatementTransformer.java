package leqo;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ForOverride;

/**
 * Rewrites the statements of a program. Every hook returns an {@link Edit}; branches recurse
 * into their bodies by default.
 */
public abstract class StatementTransformer {

  public static final class Edit {
    public enum Kind {
      KEEP,
      REPLACE,
      REMOVE;
    }

    private static final Edit KEEP = new Edit(Kind.KEEP, ImmutableList.of());
    private static final Edit REMOVE = new Edit(Kind.REMOVE, ImmutableList.of());

    private final Kind kind;
    private final ImmutableList<Statement> replacement;

    private Edit(Kind kind, ImmutableList<Statement> replacement) {
      this.kind = kind;
      this.replacement = replacement;
    }

    public static Edit keep() {
      return KEEP;
    }

    public static Edit remove() {
      return REMOVE;
    }

    public static Edit replace(Statement... statements) {
      return replace(ImmutableList.copyOf(statements));
    }

    public static Edit replace(List<Statement> statements) {
      return new Edit(Kind.REPLACE, ImmutableList.copyOf(statements));
    }

    public Kind kind() {
      return kind;
    }

    public ImmutableList<Statement> replacement() {
      Preconditions.checkState(kind == Kind.REPLACE, "no replacement for %s", kind);
      return replacement;
    }
  }

  public Program transform(Program program) throws CompilerException {
    return program.withStatements(transformAll(program.statements()));
  }

  public final ImmutableList<Statement> transformAll(List<Statement> statements)
      throws CompilerException {
    ImmutableList.Builder<Statement> builder = ImmutableList.builder();
    for (Statement statement : statements) {
      Edit edit = visit(statement);
      switch (edit.kind()) {
        case KEEP:
          builder.add(statement);
          break;
        case REPLACE:
          builder.addAll(edit.replacement());
          break;
        case REMOVE:
          break;
      }
    }
    return builder.build();
  }

  public final Edit visit(Statement statement) throws CompilerException {
    switch (statement.type()) {
      case QUBIT_DECLARATION:
        return visitQubitDeclaration(statement.cast());
      case CLASSICAL_DECLARATION:
        return visitClassicalDeclaration(statement.cast());
      case ALIAS:
        return visitAlias(statement.cast());
      case BRANCHING:
        return visitBranching(statement.cast());
      case GATE_CALL:
      case MEASUREMENT:
      case INCLUDE:
      case COMMENT:
        return visitOther(statement);
    }
    throw new AssertionError(statement.type());
  }

  protected final Edit visitChildren(Statement.BranchingStatement branch)
      throws CompilerException {
    ImmutableList<Statement> ifBlock = transformAll(branch.ifBlock());
    ImmutableList<Statement> elseBlock = transformAll(branch.elseBlock());
    if (ifBlock.equals(branch.ifBlock()) && elseBlock.equals(branch.elseBlock())) {
      return Edit.keep();
    }
    return Edit.replace(branch.withBlocks(ifBlock, elseBlock));
  }

  @ForOverride
  protected Edit visitQubitDeclaration(Statement.QubitDeclaration declaration)
      throws CompilerException {
    return Edit.keep();
  }

  @ForOverride
  protected Edit visitClassicalDeclaration(Statement.ClassicalDeclaration declaration)
      throws CompilerException {
    return Edit.keep();
  }

  @ForOverride
  protected Edit visitAlias(Statement.AliasStatement alias) throws CompilerException {
    return Edit.keep();
  }

  @ForOverride
  protected Edit visitBranching(Statement.BranchingStatement branch) throws CompilerException {
    return visitChildren(branch);
  }

  @ForOverride
  protected Edit visitOther(Statement statement) throws CompilerException {
    return Edit.keep();
  }
}
