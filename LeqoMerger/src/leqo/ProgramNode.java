package leqo;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class ProgramNode implements Comparable<ProgramNode> {

  public abstract String name();

  // Its own clean demand goes to fresh register slots.
  public abstract boolean ancillaNode();

  @Override
  public int compareTo(ProgramNode other) {
    return name().compareTo(other.name());
  }

  @Override
  public final String toString() {
    return name();
  }

  public static ProgramNode create(String name) {
    return new AutoValue_ProgramNode(name, false);
  }

  public static ProgramNode ancilla(String name) {
    return new AutoValue_ProgramNode(name, true);
  }
}
