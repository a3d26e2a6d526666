package leqo;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;

@AutoValue
public abstract class Annotation {
  public static final String INPUT = "leqo.input";
  public static final String OUTPUT = "leqo.output";
  public static final String DIRTY = "leqo.dirty";
  public static final String REUSABLE = "leqo.reusable";
  public static final String UNCOMPUTE = "leqo.uncompute";

  public static final ImmutableSet<String> LEQO_KEYWORDS =
      ImmutableSet.of(INPUT, OUTPUT, DIRTY, REUSABLE, UNCOMPUTE);

  public abstract String keyword();

  // Raw payload, empty when the annotation has none.
  public abstract String command();

  public boolean hasCommand() {
    return !command().trim().isEmpty();
  }

  public static Annotation create(String keyword, String command) {
    return new AutoValue_Annotation(keyword.trim(), command == null ? "" : command.trim());
  }

  public static Annotation create(String keyword) {
    return create(keyword, "");
  }

  public static Annotation input(int index) {
    return create(INPUT, Integer.toString(index));
  }

  public static Annotation output(int index) {
    return create(OUTPUT, Integer.toString(index));
  }

  public static Annotation dirty() {
    return create(DIRTY);
  }

  public static Annotation reusable() {
    return create(REUSABLE);
  }

  public static Annotation uncompute() {
    return create(UNCOMPUTE);
  }

  @Override
  public String toString() {
    return hasCommand() ? "@" + keyword() + " " + command() : "@" + keyword();
  }
}
