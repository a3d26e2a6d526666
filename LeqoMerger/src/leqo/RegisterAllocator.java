package leqo;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

// Joins connected qubits into equivalence classes and gives each class one index of the shared
// register. A pinned input node takes the first indices and keeps its fragment.
public final class RegisterAllocator {
  private static final Logger LOG = LoggerFactory.getLogger(RegisterAllocator.class);

  private final ProgramGraph graph;
  private final String registerName;
  private final Optional<ProgramNode> pinnedInput;
  private final ImmutableList<Connection> pendingConnections;
  private final ImmutableMap<ProgramNode, Program> pendingImplementations;

  private boolean planned = false;
  private boolean committed = false;

  private RegisterAllocator(
      ProgramGraph graph,
      String registerName,
      Optional<ProgramNode> pinnedInput,
      ImmutableList<Connection> pendingConnections,
      ImmutableMap<ProgramNode, Program> pendingImplementations) {
    this.graph = graph;
    this.registerName = registerName;
    this.pinnedInput = pinnedInput;
    this.pendingConnections = pendingConnections;
    this.pendingImplementations = pendingImplementations;
  }

  public static RegisterAllocator create(ProgramGraph graph, String registerName) {
    return new RegisterAllocator(
        graph, registerName, Optional.empty(), ImmutableList.of(), ImmutableMap.of());
  }

  // Plans against the graph as it will look once the width plan is committed.
  public static RegisterAllocator afterWidthPlan(
      ProgramGraph graph, String registerName, WidthOptimizer.Plan widthPlan) {
    return new RegisterAllocator(
        graph,
        registerName,
        Optional.empty(),
        ImmutableList.<Connection>copyOf(widthPlan.result().ancillaConnections()),
        widthPlan.implementations());
  }

  public static RegisterAllocator withPinnedInput(
      ProgramGraph graph, String registerName, ProgramNode input) {
    Preconditions.checkArgument(graph.contains(input), "pinned node %s not in graph", input);
    return new RegisterAllocator(
        graph, registerName, Optional.of(input), ImmutableList.of(), ImmutableMap.of());
  }

  // Returns the register size.
  public int allocate() throws CompilerException {
    RegisterLayout layout = plan();
    commit(layout);
    return layout.size();
  }

  public RegisterLayout plan() throws CompilerException {
    Preconditions.checkState(!planned, "register allocation already planned");
    planned = true;

    QubitEquivalence equivalence = new QubitEquivalence();
    for (ProgramNode node : graph.nodes()) {
      for (int id : graph.payload(node).model().idToInfo().keySet()) {
        equivalence.add(SingleQubit.create(node, id));
      }
    }

    ImmutableList<Connection> connections =
        ImmutableList.<Connection>builder()
            .addAll(graph.connections())
            .addAll(pendingConnections)
            .build();
    Map<ProgramNode, Map<String, String>> classicalInputToOutput = new HashMap<>();
    for (Connection connection : connections) {
      switch (connection.type()) {
        case IO:
          applyIOConnection(connection.cast(), equivalence, classicalInputToOutput);
          break;
        case ANCILLA:
          applyAncillaConnection(connection.cast(), equivalence);
          break;
      }
    }

    ImmutableMap<SingleQubit, Integer> qubitToIndex = assignIndices(equivalence);
    int size = equivalence.classes().size();

    ImmutableMap.Builder<ProgramNode, Program> rewritten = ImmutableMap.builder();
    for (ProgramNode node : graph.nodes()) {
      if (pinnedInput.isPresent() && pinnedInput.get().equals(node)) continue;

      ProcessedProgramNode processed = graph.payload(node);
      ConnectionApplier applier =
          new ConnectionApplier(
              node,
              processed.model(),
              registerName,
              qubitToIndex,
              classicalInputToOutput.getOrDefault(node, ImmutableMap.of()));
      try {
        rewritten.put(
            node,
            applier.transform(
                pendingImplementations.getOrDefault(node, processed.implementation())));
      } catch (CompilerException ex) {
        throw ex.attributeTo(node);
      }
    }

    LOG.info(
        "planned register {} of size {} for {} nodes and {} connections",
        registerName,
        size,
        graph.nodes().size(),
        connections.size());
    return RegisterLayout.create(registerName, size, qubitToIndex, rewritten.build());
  }

  public void commit(RegisterLayout layout) {
    Preconditions.checkState(planned, "commit without plan");
    Preconditions.checkState(!committed, "register allocation already committed");
    Preconditions.checkArgument(
        layout.registerName().equals(registerName), "layout of another allocation");
    committed = true;

    layout
        .rewritten()
        .forEach((node, program) -> graph.payload(node).replaceImplementation(program));
  }

  private void applyIOConnection(
      Connection.IOConnection connection,
      QubitEquivalence equivalence,
      Map<ProgramNode, Map<String, String>> classicalInputToOutput)
      throws CompilerException {
    ProgramNode source = connection.source();
    ProgramNode target = connection.target();
    Optional<IOInstance> output = graph.payload(source).model().output(connection.outputIndex());
    Optional<IOInstance> input = graph.payload(target).model().input(connection.inputIndex());
    if (!output.isPresent()) {
      throw new CompilerException(
          source,
          String.format(
              "no output with index %d, but connection %s uses it",
              connection.outputIndex(), connection));
    }
    if (!input.isPresent()) {
      throw new CompilerException(
          target,
          String.format(
              "no input with index %d, but connection %s uses it",
              connection.inputIndex(), connection));
    }
    if (connection.sizeHint().isPresent() && connection.sizeHint().get() != output.get().size()) {
      LOG.debug(
          "size hint {} of {} disagrees with actual size {}",
          connection.sizeHint().get(),
          connection,
          output.get().size());
    }

    if (output.get().type() != input.get().type()) {
      throw new CompilerException(
          target,
          String.format(
              "can't connect %s output %d of %s to %s input %d of %s",
              describe(output.get()),
              connection.outputIndex(),
              source,
              describe(input.get()),
              connection.inputIndex(),
              target));
    }

    switch (output.get().type()) {
      case QUBIT:
        {
          ImmutableList<Integer> outputIds =
              output.get().<IOInstance.QubitIOInstance>cast().ids();
          ImmutableList<Integer> inputIds = input.get().<IOInstance.QubitIOInstance>cast().ids();
          if (outputIds.size() != inputIds.size()) {
            throw new CompilerException(
                target,
                String.format(
                    "size mismatch: output %d of %s has %d qubits, input %d of %s has %d",
                    connection.outputIndex(),
                    source,
                    outputIds.size(),
                    connection.inputIndex(),
                    target,
                    inputIds.size()));
          }
          unionAll(equivalence, source, outputIds, target, inputIds);
          break;
        }
      case CLASSICAL:
        {
          IOInstance.ClassicalIOInstance out = output.get().cast();
          IOInstance.ClassicalIOInstance in = input.get().cast();
          if (!out.classicalType().isCompatible(in.classicalType())) {
            throw new CompilerException(
                target,
                String.format(
                    "type mismatch: output %d of %s is %s, input %d of %s is %s",
                    connection.outputIndex(),
                    source,
                    out.classicalType(),
                    connection.inputIndex(),
                    target,
                    in.classicalType()));
          }
          Map<String, String> mapping =
              classicalInputToOutput.computeIfAbsent(target, n -> new HashMap<>());
          String previous = mapping.putIfAbsent(in.name(), out.name());
          if (previous != null) {
            throw new CompilerException(
                target,
                String.format(
                    "both %s and %s feed classical input %s, only one is allowed",
                    previous, out.name(), in.name()));
          }
          break;
        }
    }
  }

  private static String describe(IOInstance instance) {
    return instance.type() == IOInstance.Type.QUBIT
        ? "qubit"
        : "classical " + instance.<IOInstance.ClassicalIOInstance>cast().classicalType();
  }

  private static void applyAncillaConnection(
      Connection.AncillaConnection connection, QubitEquivalence equivalence) {
    unionAll(
        equivalence,
        connection.source(),
        connection.sourceIds(),
        connection.target(),
        connection.targetIds());
  }

  private static void unionAll(
      QubitEquivalence equivalence,
      ProgramNode source,
      List<Integer> sourceIds,
      ProgramNode target,
      List<Integer> targetIds) {
    Verify.verify(sourceIds.size() == targetIds.size());
    for (int i = 0; i < sourceIds.size(); i++) {
      SingleQubit from = SingleQubit.create(source, sourceIds.get(i));
      SingleQubit to = SingleQubit.create(target, targetIds.get(i));
      Verify.verify(equivalence.contains(from), "unknown qubit %s", from);
      Verify.verify(equivalence.contains(to), "unknown qubit %s", to);
      LOG.debug("joining {} and {}", from, to);
      equivalence.union(from, to);
    }
  }

  private ImmutableMap<SingleQubit, Integer> assignIndices(QubitEquivalence equivalence) {
    Map<SingleQubit, Integer> rootToIndex = new HashMap<>();
    if (pinnedInput.isPresent()) {
      ProgramNode input = pinnedInput.get();
      for (ImmutableList<Integer> ids :
          graph.payload(input).model().declarationToIds().values()) {
        for (int id : ids) {
          SingleQubit root = equivalence.find(SingleQubit.create(input, id));
          Verify.verify(
              rootToIndex.putIfAbsent(root, rootToIndex.size()) == null,
              "two qubits of input node %s share a register slot",
              input);
        }
      }
    }

    ImmutableMap.Builder<SingleQubit, Integer> qubitToIndex = ImmutableMap.builder();
    for (ImmutableSortedSet<SingleQubit> equivalent : equivalence.classes()) {
      SingleQubit root = equivalence.find(equivalent.first());
      Integer index = rootToIndex.get(root);
      if (index == null) {
        index = rootToIndex.size();
        rootToIndex.put(root, index);
      }
      for (SingleQubit qubit : equivalent) {
        qubitToIndex.put(qubit, index);
      }
    }
    return qubitToIndex.build();
  }
}
