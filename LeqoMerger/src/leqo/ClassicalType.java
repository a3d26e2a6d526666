package leqo;

import java.util.Optional;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class ClassicalType {
  public static final int DEFAULT_INT_SIZE = 32;
  public static final int DEFAULT_FLOAT_SIZE = 32;

  public enum Kind {
    BIT("bit"),
    INT("int"),
    FLOAT("float"),
    BOOL("bool");

    private final String keyword;

    Kind(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() {
      return keyword;
    }
  }

  public abstract Kind kind();

  public abstract Optional<Integer> declaredSize();

  // Falls back to the default width of the kind.
  public int size() {
    switch (kind()) {
      case BIT:
        return declaredSize().orElse(1);
      case INT:
        return declaredSize().orElse(DEFAULT_INT_SIZE);
      case FLOAT:
        return declaredSize().orElse(DEFAULT_FLOAT_SIZE);
      case BOOL:
        return 1;
    }
    throw new AssertionError(kind());
  }

  public boolean isCompatible(ClassicalType other) {
    return kind() == other.kind() && size() == other.size();
  }

  public static ClassicalType create(Kind kind, Optional<Integer> declaredSize) {
    if (kind == Kind.BOOL) declaredSize = Optional.empty();
    return new AutoValue_ClassicalType(kind, declaredSize);
  }

  public static ClassicalType bit(int size) {
    return create(Kind.BIT, Optional.of(size));
  }

  public static ClassicalType integer(int size) {
    return create(Kind.INT, Optional.of(size));
  }

  public static ClassicalType floating(int size) {
    return create(Kind.FLOAT, Optional.of(size));
  }

  public static ClassicalType bool() {
    return create(Kind.BOOL, Optional.empty());
  }

  @Override
  public String toString() {
    return declaredSize().map(s -> kind().keyword() + "[" + s + "]").orElse(kind().keyword());
  }
}
