package leqo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

// Lets later nodes borrow the ancillae of earlier ones. plan() leaves the graph alone; commit()
// adds the ancilla connections and swaps in fragments with uncompute blocks inlined or dropped.
public final class WidthOptimizer {
  private static final Logger LOG = LoggerFactory.getLogger(WidthOptimizer.class);

  private WidthOptimizer() {}

  @AutoValue
  public abstract static class Plan {
    public abstract SchedulingResult result();

    public abstract ImmutableMap<ProgramNode, Program> implementations();

    static Plan create(
        SchedulingResult result, ImmutableMap<ProgramNode, Program> implementations) {
      return new AutoValue_WidthOptimizer_Plan(result, implementations);
    }
  }

  public static Plan plan(ProgramGraph graph, MergeOptions options) throws CompilerException {
    SchedulingResult result = AncillaScheduler.create(graph, options).schedule();

    ImmutableMap.Builder<ProgramNode, Program> implementations = ImmutableMap.builder();
    for (ProgramNode node : graph.nodes()) {
      UncomputeApplier applier = new UncomputeApplier(result.uncomputes(node));
      try {
        implementations.put(node, applier.transform(graph.payload(node).implementation()));
      } catch (CompilerException ex) {
        throw ex.attributeTo(node);
      }
    }
    return Plan.create(result, implementations.build());
  }

  public static void commit(ProgramGraph graph, Plan plan) {
    plan.implementations()
        .forEach((node, program) -> graph.payload(node).replaceImplementation(program));
    for (Connection.AncillaConnection connection : plan.result().ancillaConnections()) {
      graph.addConnection(connection);
    }

    LOG.info(
        "added {} ancilla connections to {} nodes",
        plan.result().ancillaConnections().size(),
        graph.nodes().size());
  }

  public static SchedulingResult optimize(ProgramGraph graph, MergeOptions options)
      throws CompilerException {
    Plan plan = plan(graph, options);
    commit(graph, plan);
    return plan.result();
  }
}
