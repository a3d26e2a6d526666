package leqo;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

public abstract class Connection {

  public enum Type {
    IO,
    ANCILLA;
  }

  Connection() {}

  public abstract ProgramNode source();

  public abstract ProgramNode target();

  public abstract Type type();

  @SuppressWarnings("unchecked")
  public <T extends Connection> T cast() {
    return (T) this;
  }

  @AutoValue
  public abstract static class IOConnection extends Connection {
    public abstract int outputIndex();

    public abstract int inputIndex();

    // Width announced by the frontend; only checked against, never trusted.
    public abstract Optional<Integer> sizeHint();

    @Override
    public final Type type() {
      return Type.IO;
    }

    @Override
    public final String toString() {
      return String.format("%s.%d -> %s.%d", source(), outputIndex(), target(), inputIndex());
    }

    public static IOConnection create(
        ProgramNode source, int outputIndex, ProgramNode target, int inputIndex) {
      return create(source, outputIndex, target, inputIndex, Optional.empty());
    }

    public static IOConnection create(
        ProgramNode source,
        int outputIndex,
        ProgramNode target,
        int inputIndex,
        Optional<Integer> sizeHint) {
      Preconditions.checkArgument(outputIndex >= 0 && inputIndex >= 0, "negative index");
      return new AutoValue_Connection_IOConnection(
          source, target, outputIndex, inputIndex, sizeHint);
    }
  }

  // sourceIds.get(i) of the source pairs with targetIds.get(i) of the target.
  @AutoValue
  public abstract static class AncillaConnection extends Connection {
    public abstract ImmutableList<Integer> sourceIds();

    public abstract ImmutableList<Integer> targetIds();

    @Override
    public final Type type() {
      return Type.ANCILLA;
    }

    public int size() {
      return sourceIds().size();
    }

    @Override
    public final String toString() {
      return String.format("%s%s ~> %s%s", source(), sourceIds(), target(), targetIds());
    }

    public static AncillaConnection create(
        ProgramNode source, List<Integer> sourceIds, ProgramNode target, List<Integer> targetIds) {
      Preconditions.checkArgument(
          sourceIds.size() == targetIds.size(),
          "ancilla connection %s -> %s pairs %s ids with %s ids",
          source,
          target,
          sourceIds.size(),
          targetIds.size());
      return new AutoValue_Connection_AncillaConnection(
          source, target, ImmutableList.copyOf(sourceIds), ImmutableList.copyOf(targetIds));
    }
  }
}
