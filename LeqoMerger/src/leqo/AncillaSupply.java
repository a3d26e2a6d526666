package leqo;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

// Scheduling state of one node, shrunk as qubits are handed to later nodes.
public final class AncillaSupply {

  public enum Kind {
    DIRTY,
    REUSABLE,
    UNCOMPUTABLE;
  }

  private final ProgramNode node;
  private final ImmutableList<Integer> requiredDirty;
  private final ImmutableList<Integer> requiredReusable;
  private final List<Integer> dirty;
  private final List<Integer> reusable;
  private final List<Integer> uncomputable;

  private AncillaSupply(
      ProgramNode node,
      ImmutableList<Integer> requiredDirty,
      ImmutableList<Integer> requiredReusable,
      List<Integer> dirty,
      List<Integer> reusable,
      List<Integer> uncomputable) {
    this.node = node;
    this.requiredDirty = requiredDirty;
    this.requiredReusable = requiredReusable;
    this.dirty = new ArrayList<>(dirty);
    this.reusable = new ArrayList<>(reusable);
    this.uncomputable = new ArrayList<>(uncomputable);
  }

  // Ancilla nodes bring their own clean qubits.
  public static AncillaSupply of(ProgramNode node, AnnotationModel model) {
    return new AncillaSupply(
        node,
        model.requiredDirtyIds(),
        node.ancillaNode() ? ImmutableList.of() : model.requiredReusableIds(),
        model.returnedDirtyIds(),
        model.returnedReusableIds(),
        model.returnedUncomputableIds());
  }

  public ProgramNode node() {
    return node;
  }

  public ImmutableList<Integer> requiredDirty() {
    return requiredDirty;
  }

  public ImmutableList<Integer> requiredReusable() {
    return requiredReusable;
  }

  public int remaining(Kind kind) {
    return pool(kind).size();
  }

  // Lowest ids first.
  ImmutableList<Integer> take(Kind kind, int count) {
    Preconditions.checkArgument(count >= 0);
    List<Integer> pool = pool(kind);
    List<Integer> head = pool.subList(0, Math.min(count, pool.size()));
    ImmutableList<Integer> taken = ImmutableList.copyOf(head);
    head.clear();
    return taken;
  }

  void uncompute() {
    reusable.addAll(uncomputable);
    uncomputable.clear();
  }

  private List<Integer> pool(Kind kind) {
    switch (kind) {
      case DIRTY:
        return dirty;
      case REUSABLE:
        return reusable;
      case UNCOMPUTABLE:
        return uncomputable;
    }
    throw new AssertionError(kind);
  }

  @Override
  public String toString() {
    return String.format(
        "%s(needs %d dirty %d reusable, has %d dirty %d reusable %d uncomputable)",
        node,
        requiredDirty.size(),
        requiredReusable.size(),
        dirty.size(),
        reusable.size(),
        uncomputable.size());
  }
}
