package leqo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

// Greedy ancilla reuse over a topological walk. Dirty demand drains the dirty pool first, then
// uncomputable, then reusable. Reusable demand drains the reusable pool, then uncomputes the
// cheapest uncomputable node. The graph is only read.
public final class AncillaScheduler {
  private static final Logger LOG = LoggerFactory.getLogger(AncillaScheduler.class);

  private final ProgramGraph graph;
  private final NodeSelector selector;
  private final boolean strict;

  private final Map<ProgramNode, Integer> remainingPredecessors = new HashMap<>();
  private final List<AncillaSupply> noPredecessor = new ArrayList<>();
  private final List<AncillaSupply> dirty = new ArrayList<>();
  private final List<AncillaSupply> reusable = new ArrayList<>();
  private final List<AncillaSupply> uncomputable = new ArrayList<>();

  private final ImmutableList.Builder<Connection.AncillaConnection> connections =
      ImmutableList.builder();
  private final Map<ProgramNode, Boolean> uncompute = new LinkedHashMap<>();
  private final ImmutableList.Builder<ProgramNode> processingOrder = ImmutableList.builder();
  private final Map<ProgramNode, Integer> unsatisfied = new LinkedHashMap<>();

  private boolean scheduled = false;

  private AncillaScheduler(ProgramGraph graph, NodeSelector selector, boolean strict) {
    this.graph = graph;
    this.selector = selector;
    this.strict = strict;
  }

  public static AncillaScheduler create(ProgramGraph graph, NodeSelector selector, boolean strict) {
    return new AncillaScheduler(graph, selector, strict);
  }

  public static AncillaScheduler create(ProgramGraph graph, MergeOptions options) {
    return create(graph, options.nodeSelector(), options.strictAncillaDemand());
  }

  /**
   * @throws CompilerException in strict mode, for the first node whose demand can't be met
   * @throws IllegalStateException if the graph has a cycle
   */
  public SchedulingResult schedule() throws CompilerException {
    Preconditions.checkState(!scheduled, "scheduler already ran");
    scheduled = true;

    Map<ProgramNode, AncillaSupply> supplies = new HashMap<>();
    for (ProgramNode node : graph.nodes()) {
      AncillaSupply supply = AncillaSupply.of(node, graph.payload(node).model());
      supplies.put(node, supply);
      uncompute.put(node, false);
      int predecessors = graph.inConnections(node).size();
      remainingPredecessors.put(node, predecessors);
      if (predecessors == 0) noPredecessor.add(supply);
    }

    int processed = 0;
    while (!noPredecessor.isEmpty()) {
      AvailableSupply available = AvailableSupply.of(dirty, reusable, uncomputable);
      AncillaSupply current = noPredecessor.remove(selector.select(noPredecessor, available));
      LOG.debug("processing {} with {} available", current, available);
      processingOrder.add(current.node());
      processed++;

      for (Connection out : graph.outConnections(current.node())) {
        ProgramNode successor = out.target();
        int left = remainingPredecessors.merge(successor, -1, Integer::sum);
        if (left == 0) noPredecessor.add(supplies.get(successor));
      }

      List<Integer> missingDirty = satisfyDirty(current);
      List<Integer> missingReusable = satisfyReusable(current);
      int missing = missingDirty.size() + missingReusable.size();
      if (missing > 0) {
        if (strict) {
          throw new CompilerException(
              current.node(),
              String.format(
                  "%d dirty and %d reusable ancilla qubits can't be supplied by earlier nodes,"
                      + " add an ancilla node",
                  missingDirty.size(),
                  missingReusable.size()));
        }
        LOG.debug("{}: {} ancilla qubits left to fresh register slots", current.node(), missing);
        unsatisfied.put(current.node(), missing);
      }

      if (current.remaining(AncillaSupply.Kind.DIRTY) > 0) dirty.add(current);
      if (current.remaining(AncillaSupply.Kind.REUSABLE) > 0) reusable.add(current);
      if (current.remaining(AncillaSupply.Kind.UNCOMPUTABLE) > 0) uncomputable.add(current);
    }

    if (processed != supplies.size()) {
      throw new IllegalStateException(
          String.format(
              "program graph has a cycle, scheduled %d of %d nodes", processed, supplies.size()));
    }

    SchedulingResult result =
        SchedulingResult.create(
            connections.build(),
            ImmutableMap.copyOf(uncompute),
            processingOrder.build(),
            ImmutableMap.copyOf(unsatisfied));
    LOG.info(
        "scheduled {} nodes with {} ancilla connections, {} uncomputed, {} short of ancillae",
        processed,
        result.ancillaConnections().size(),
        uncompute.values().stream().filter(b -> b).count(),
        unsatisfied.size());
    return result;
  }

  private List<Integer> satisfyDirty(AncillaSupply current) {
    List<Integer> need = current.requiredDirty();
    need = drain(dirty, AncillaSupply.Kind.DIRTY, need, current);
    need = drain(uncomputable, AncillaSupply.Kind.UNCOMPUTABLE, need, current);
    need = drain(reusable, AncillaSupply.Kind.REUSABLE, need, current);
    return need;
  }

  private List<Integer> satisfyReusable(AncillaSupply current) {
    List<Integer> need = current.requiredReusable();
    while (!need.isEmpty() && (!reusable.isEmpty() || !uncomputable.isEmpty())) {
      need = drain(reusable, AncillaSupply.Kind.REUSABLE, need, current);
      if (!need.isEmpty() && !uncomputable.isEmpty()) {
        AncillaSupply cheapest = popCheapestUncomputable();
        LOG.debug(
            "uncomputing {} to free {} qubits for {}",
            cheapest.node(),
            cheapest.remaining(AncillaSupply.Kind.UNCOMPUTABLE),
            current.node());
        cheapest.uncompute();
        if (!reusable.contains(cheapest)) reusable.add(cheapest);
        uncompute.put(cheapest.node(), true);
      }
    }
    return need;
  }

  private AncillaSupply popCheapestUncomputable() {
    int cheapest = 0;
    for (int i = 1; i < uncomputable.size(); i++) {
      if (uncomputable.get(i).remaining(AncillaSupply.Kind.UNCOMPUTABLE)
          < uncomputable.get(cheapest).remaining(AncillaSupply.Kind.UNCOMPUTABLE)) {
        cheapest = i;
      }
    }
    return uncomputable.remove(cheapest);
  }

  private List<Integer> drain(
      List<AncillaSupply> pool,
      AncillaSupply.Kind kind,
      List<Integer> need,
      AncillaSupply current) {
    while (!need.isEmpty() && !pool.isEmpty()) {
      AncillaSupply source = pool.get(0);
      ImmutableList<Integer> sourceIds = source.take(kind, need.size());
      List<Integer> targetIds = need.subList(0, sourceIds.size());
      need = need.subList(sourceIds.size(), need.size());

      Connection.AncillaConnection connection =
          Connection.AncillaConnection.create(
              source.node(), sourceIds, current.node(), targetIds);
      LOG.debug("{} {} ancilla: {}", kind, sourceIds.size(), connection);
      connections.add(connection);

      if (source.remaining(kind) == 0) pool.remove(0);
    }
    return need;
  }
}
