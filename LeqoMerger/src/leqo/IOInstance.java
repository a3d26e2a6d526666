package leqo;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

public abstract class IOInstance {

  public enum Type {
    QUBIT,
    CLASSICAL;
  }

  IOInstance() {}

  public abstract Type type();

  // The declaration for inputs, the alias for outputs.
  public abstract String name();

  public abstract int size();

  @SuppressWarnings("unchecked")
  public <T extends IOInstance> T cast() {
    return (T) this;
  }

  @AutoValue
  public abstract static class QubitIOInstance extends IOInstance {
    public abstract ImmutableList<Integer> ids();

    @Override
    public final Type type() {
      return Type.QUBIT;
    }

    @Override
    public int size() {
      return ids().size();
    }

    public static QubitIOInstance create(String name, ImmutableList<Integer> ids) {
      return new AutoValue_IOInstance_QubitIOInstance(name, ids);
    }
  }

  @AutoValue
  public abstract static class ClassicalIOInstance extends IOInstance {
    public abstract ClassicalType classicalType();

    @Override
    public final Type type() {
      return Type.CLASSICAL;
    }

    @Override
    public int size() {
      return classicalType().size();
    }

    public static ClassicalIOInstance create(String name, ClassicalType classicalType) {
      return new AutoValue_IOInstance_ClassicalIOInstance(name, classicalType);
    }
  }
}
