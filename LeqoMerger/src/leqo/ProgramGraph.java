package leqo;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.graph.MutableNetwork;
import com.google.common.graph.NetworkBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

// Fragments live in a side table next to the network. Iteration follows insertion order.
public final class ProgramGraph {
  private final MutableNetwork<ProgramNode, Connection> network =
      NetworkBuilder.directed().allowsParallelEdges(true).allowsSelfLoops(false).build();
  private final LinkedHashMap<ProgramNode, ProcessedProgramNode> payloads = new LinkedHashMap<>();

  @CanIgnoreReturnValue
  public ProcessedProgramNode addNode(ProgramNode node, Program implementation)
      throws CompilerException {
    return addNode(ProcessedProgramNode.parse(node, implementation));
  }

  @CanIgnoreReturnValue
  public ProcessedProgramNode addNode(ProcessedProgramNode processed) {
    ProgramNode node = processed.raw();
    Preconditions.checkArgument(
        !node(node.name()).isPresent(), "duplicate node name %s", node.name());
    network.addNode(node);
    payloads.put(node, processed);
    return processed;
  }

  public void addConnection(Connection connection) {
    Preconditions.checkArgument(
        payloads.containsKey(connection.source()), "unknown node %s", connection.source());
    Preconditions.checkArgument(
        payloads.containsKey(connection.target()), "unknown node %s", connection.target());
    network.addEdge(connection.source(), connection.target(), connection);
  }

  public ImmutableList<ProgramNode> nodes() {
    return ImmutableList.copyOf(payloads.keySet());
  }

  public boolean contains(ProgramNode node) {
    return payloads.containsKey(node);
  }

  public Optional<ProgramNode> node(String name) {
    return payloads.keySet().stream().filter(n -> n.name().equals(name)).findFirst();
  }

  public ProcessedProgramNode payload(ProgramNode node) {
    ProcessedProgramNode processed = payloads.get(node);
    Preconditions.checkArgument(processed != null, "unknown node %s", node);
    return processed;
  }

  public ImmutableList<Connection> connections() {
    return ImmutableList.copyOf(network.edges());
  }

  public ImmutableList<Connection.IOConnection> ioConnections() {
    return connections()
        .stream()
        .filter(c -> c.type() == Connection.Type.IO)
        .map(c -> c.<Connection.IOConnection>cast())
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Connection.AncillaConnection> ancillaConnections() {
    return connections()
        .stream()
        .filter(c -> c.type() == Connection.Type.ANCILLA)
        .map(c -> c.<Connection.AncillaConnection>cast())
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Connection> inConnections(ProgramNode node) {
    return ImmutableList.copyOf(network.inEdges(node));
  }

  public ImmutableList<Connection> outConnections(ProgramNode node) {
    return ImmutableList.copyOf(network.outEdges(node));
  }

  /**
   * Kahn's algorithm; among nodes that are ready at the same time the one added first wins.
   *
   * @throws IllegalStateException if the graph has a cycle
   */
  public ImmutableList<ProgramNode> topologicalOrder() {
    Map<ProgramNode, Integer> insertionIndex = new HashMap<>();
    Map<ProgramNode, Integer> remainingIn = new HashMap<>();
    PriorityQueue<ProgramNode> ready =
        new PriorityQueue<>(
            (a, b) -> Integer.compare(insertionIndex.get(a), insertionIndex.get(b)));
    for (ProgramNode node : payloads.keySet()) {
      insertionIndex.put(node, insertionIndex.size());
      int inDegree = network.inDegree(node);
      remainingIn.put(node, inDegree);
      if (inDegree == 0) ready.add(node);
    }

    ImmutableList.Builder<ProgramNode> order = ImmutableList.builder();
    int visited = 0;
    while (!ready.isEmpty()) {
      ProgramNode node = ready.poll();
      order.add(node);
      visited++;
      for (Connection out : network.outEdges(node)) {
        ProgramNode target = out.target();
        int left = remainingIn.merge(target, -1, Integer::sum);
        if (left == 0) ready.add(target);
      }
    }
    if (visited != payloads.size()) {
      throw new IllegalStateException("program graph has a cycle");
    }
    return order.build();
  }
}
