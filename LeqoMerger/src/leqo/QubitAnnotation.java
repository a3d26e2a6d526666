package leqo;

import java.util.Optional;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class QubitAnnotation {

  @AutoValue
  public abstract static class IOPosition {
    public abstract int index();

    public abstract int position();

    public static IOPosition create(int index, int position) {
      return new AutoValue_QubitAnnotation_IOPosition(index, position);
    }

    @Override
    public final String toString() {
      return index() + "[" + position() + "]";
    }
  }

  public abstract Optional<IOPosition> input();

  public abstract Optional<IOPosition> output();

  public abstract boolean dirty();

  public abstract boolean reusable();

  // Reusable only if the fragment's uncompute block runs.
  public abstract boolean uncomputable();

  public static Builder builder() {
    return new AutoValue_QubitAnnotation.Builder()
        .setDirty(false)
        .setReusable(false)
        .setUncomputable(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setInput(IOPosition input);

    public abstract Builder setOutput(IOPosition output);

    public abstract Builder setDirty(boolean dirty);

    public abstract Builder setReusable(boolean reusable);

    public abstract Builder setUncomputable(boolean uncomputable);

    public abstract QubitAnnotation build();
  }
}
