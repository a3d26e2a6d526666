package leqo;

import java.util.Collection;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class AvailableSupply {
  public abstract int dirty();

  public abstract int reusable();

  public abstract int uncomputable();

  // Uncomputable qubits count for both demands.
  public final boolean canSatisfy(AncillaSupply node) {
    int needDirty = node.requiredDirty().size();
    int needReusable = node.requiredReusable().size();
    return needReusable <= reusable() + uncomputable()
        && needDirty + needReusable <= dirty() + reusable() + uncomputable();
  }

  public static AvailableSupply create(int dirty, int reusable, int uncomputable) {
    return new AutoValue_AvailableSupply(dirty, reusable, uncomputable);
  }

  static AvailableSupply of(
      Collection<AncillaSupply> dirtyPool,
      Collection<AncillaSupply> reusablePool,
      Collection<AncillaSupply> uncomputablePool) {
    return create(
        total(dirtyPool, AncillaSupply.Kind.DIRTY),
        total(reusablePool, AncillaSupply.Kind.REUSABLE),
        total(uncomputablePool, AncillaSupply.Kind.UNCOMPUTABLE));
  }

  private static int total(Collection<AncillaSupply> pool, AncillaSupply.Kind kind) {
    return pool.stream().mapToInt(s -> s.remaining(kind)).sum();
  }
}
