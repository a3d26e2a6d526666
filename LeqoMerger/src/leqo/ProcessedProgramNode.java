package leqo;

// The model stays valid when the fragment is rewritten; rewriting never adds or drops qubits.
public final class ProcessedProgramNode {
  private final ProgramNode raw;
  private final AnnotationModel model;
  private Program implementation;

  ProcessedProgramNode(ProgramNode raw, Program implementation, AnnotationModel model) {
    this.raw = raw;
    this.implementation = implementation;
    this.model = model;
  }

  public static ProcessedProgramNode parse(ProgramNode raw, Program implementation)
      throws CompilerException {
    return new ProcessedProgramNode(
        raw, implementation, AnnotationParser.parse(raw, implementation));
  }

  public ProgramNode raw() {
    return raw;
  }

  public Program implementation() {
    return implementation;
  }

  public AnnotationModel model() {
    return model;
  }

  void replaceImplementation(Program implementation) {
    this.implementation = implementation;
  }

  @Override
  public String toString() {
    return raw.name();
  }
}
