package leqo;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

// Nothing of it is applied to the graph yet.
@AutoValue
public abstract class SchedulingResult {
  public abstract ImmutableList<Connection.AncillaConnection> ancillaConnections();

  public abstract ImmutableMap<ProgramNode, Boolean> uncompute();

  public abstract ImmutableList<ProgramNode> processingOrder();

  // Number of ancilla qubits per node that no earlier node could supply.
  public abstract ImmutableMap<ProgramNode, Integer> unsatisfiedDemand();

  public final boolean uncomputes(ProgramNode node) {
    return uncompute().getOrDefault(node, false);
  }

  static SchedulingResult create(
      ImmutableList<Connection.AncillaConnection> ancillaConnections,
      ImmutableMap<ProgramNode, Boolean> uncompute,
      ImmutableList<ProgramNode> processingOrder,
      ImmutableMap<ProgramNode, Integer> unsatisfiedDemand) {
    return new AutoValue_SchedulingResult(
        ancillaConnections, uncompute, processingOrder, unsatisfiedDemand);
  }
}
