package leqo;

import java.util.Comparator;

import com.google.auto.value.AutoValue;

// Ordered by node name, then id.
@AutoValue
public abstract class SingleQubit implements Comparable<SingleQubit> {
  private static final Comparator<SingleQubit> ORDER =
      Comparator.comparing(SingleQubit::node).thenComparingInt(SingleQubit::id);

  public abstract ProgramNode node();

  public abstract int id();

  @Override
  public int compareTo(SingleQubit other) {
    return ORDER.compare(this, other);
  }

  @Override
  public final String toString() {
    return node().name() + "#" + id();
  }

  public static SingleQubit create(ProgramNode node, int id) {
    return new AutoValue_SingleQubit(node, id);
  }
}
