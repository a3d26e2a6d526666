package leqo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

// Both arms are allocated onto a branch-local register whose first slots are the if node's
// declarations. The arms must leave the endif node on the same slots; qubits are never swapped.
public final class BranchMerger {
  private static final Logger LOG = LoggerFactory.getLogger(BranchMerger.class);

  private final String branchId;
  private final ProgramNode ifNode;
  private final ProgramNode endifNode;
  private final ProgramGraph thenGraph;
  private final ProgramGraph elseGraph;

  private BranchMerger(
      String branchId,
      ProgramNode ifNode,
      ProgramNode endifNode,
      ProgramGraph thenGraph,
      ProgramGraph elseGraph) {
    this.branchId = branchId;
    this.ifNode = ifNode;
    this.endifNode = endifNode;
    this.thenGraph = thenGraph;
    this.elseGraph = elseGraph;
  }

  public static BranchMerger create(
      String branchId,
      ProgramNode ifNode,
      ProgramNode endifNode,
      ProgramGraph thenGraph,
      ProgramGraph elseGraph) {
    for (ProgramGraph graph : ImmutableList.of(thenGraph, elseGraph)) {
      Preconditions.checkArgument(graph.contains(ifNode), "arm without if node %s", ifNode);
      Preconditions.checkArgument(
          graph.contains(endifNode), "arm without endif node %s", endifNode);
    }
    return new BranchMerger(branchId, ifNode, endifNode, thenGraph, elseGraph);
  }

  public String registerName() {
    return "leqo_" + branchId + "_if_reg";
  }

  public String ancillaRegisterName() {
    return "leqo_" + branchId + "_ancillae";
  }

  public MergedFragment merge(Expression condition) throws CompilerException {
    rejectClassicalOutputs(thenGraph);
    rejectClassicalOutputs(elseGraph);

    RegisterAllocator thenAllocator =
        RegisterAllocator.withPinnedInput(thenGraph, registerName(), ifNode);
    RegisterAllocator elseAllocator =
        RegisterAllocator.withPinnedInput(elseGraph, registerName(), ifNode);
    RegisterLayout thenLayout = thenAllocator.plan();
    RegisterLayout elseLayout = elseAllocator.plan();

    Map<String, List<Integer>> thenBinding = endifBinding(thenGraph, thenLayout);
    Map<String, List<Integer>> elseBinding = endifBinding(elseGraph, elseLayout);
    if (!thenBinding.equals(elseBinding)) {
      throw new CompilerException(
          endifNode,
          String.format(
              "outputs of then and else arms don't line up: then binds %s, else binds %s",
              thenBinding, elseBinding));
    }
    thenAllocator.commit(thenLayout);
    elseAllocator.commit(elseLayout);

    Program ifProgram = thenGraph.payload(ifNode).implementation();
    List<Statement> statements =
        new ArrayList<>(AnnotationStripper.strip(ifProgram, false, true).statements());

    int requiredSize = Math.max(thenLayout.size(), elseLayout.size());
    int inputSize = thenGraph.payload(ifNode).model().qubitCount();
    if (requiredSize > inputSize) {
      statements.add(
          Statement.QubitDeclaration.create(ancillaRegisterName(), requiredSize - inputSize));
    }

    Optional<Expression> register = Optional.empty();
    for (Statement statement : statements) {
      if (statement.type() != Statement.Type.QUBIT_DECLARATION) continue;
      Expression declared =
          Expression.identifier(statement.<Statement.QubitDeclaration>cast().name());
      register =
          Optional.of(
              register.isPresent()
                  ? Expression.Concatenation.create(register.get(), declared)
                  : declared);
    }
    if (register.isPresent()) {
      statements.add(Statement.AliasStatement.create(registerName(), register.get()));
    }

    statements.add(
        Statement.BranchingStatement.create(
            condition, armStatements(thenGraph), armStatements(elseGraph)));

    Program endifProgram = thenGraph.payload(endifNode).implementation();
    statements.addAll(AnnotationStripper.strip(endifProgram, true, false).statements());

    LOG.info(
        "merged branch {}: then uses {} qubits, else {}, register {} of size {}",
        branchId,
        thenLayout.size(),
        elseLayout.size(),
        registerName(),
        requiredSize);
    return MergedFragment.create(Program.create(ifProgram.version(), statements), requiredSize);
  }

  private void rejectClassicalOutputs(ProgramGraph graph) throws CompilerException {
    AnnotationModel endif = graph.payload(endifNode).model();
    for (Connection connection : graph.inConnections(endifNode)) {
      if (connection.type() != Connection.Type.IO) continue;

      int inputIndex = connection.<Connection.IOConnection>cast().inputIndex();
      Optional<IOInstance> input = endif.input(inputIndex);
      if (input.isPresent() && input.get().type() == IOInstance.Type.CLASSICAL) {
        throw new CompilerException(
            endifNode,
            String.format(
                "classical value can't leave the branch through input %d (%s)",
                inputIndex, connection));
      }
    }
  }

  private Map<String, List<Integer>> endifBinding(ProgramGraph graph, RegisterLayout layout) {
    Map<String, List<Integer>> binding = new LinkedHashMap<>();
    graph
        .payload(endifNode)
        .model()
        .declarationToIds()
        .forEach((name, ids) -> binding.put(name, layout.indices(endifNode, ids)));
    return binding;
  }

  private ImmutableList<Statement> armStatements(ProgramGraph graph) {
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    for (ProgramNode node : graph.topologicalOrder()) {
      if (node.equals(ifNode) || node.equals(endifNode)) continue;
      Program stripped = AnnotationStripper.stripAll(graph.payload(node).implementation());
      statements.addAll(stripped.statements());
    }
    return statements.build();
  }
}
