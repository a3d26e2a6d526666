package leqo;

import java.util.Optional;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Optional<ProgramNode> node;
  private final String errorMsg;

  public CompilerException(ProgramNode node, String errorMsg) {
    this(Optional.of(node), errorMsg);
  }

  public CompilerException(String errorMsg) {
    this(Optional.empty(), errorMsg);
  }

  private CompilerException(Optional<ProgramNode> node, String errorMsg) {
    super(node.map(n -> n.name() + ": " + errorMsg).orElse(errorMsg));
    this.node = node;
    this.errorMsg = errorMsg;
  }

  public Optional<ProgramNode> node() {
    return node;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public CompilerException attributeTo(ProgramNode node) {
    if (this.node.isPresent()) return this;

    CompilerException attributed = new CompilerException(node, errorMsg);
    attributed.setStackTrace(getStackTrace());
    return attributed;
  }
}
