package leqo;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

// One register declaration, then every fragment in topological order between Start node and
// End node comments. Nothing is written to the graph until every pass has planned successfully.
public final class ProgramMerger {
  private static final Logger LOG = LoggerFactory.getLogger(ProgramMerger.class);

  private ProgramMerger() {}

  public static MergedFragment merge(ProgramGraph graph) throws CompilerException {
    return merge(graph, MergeOptions.defaults());
  }

  public static MergedFragment merge(ProgramGraph graph, MergeOptions options)
      throws CompilerException {
    Optional<MergedFragment> merged = alreadyMerged(graph, options.globalRegisterName());
    if (merged.isPresent()) {
      LOG.info("graph is already merged, register size {}", merged.get().registerSize());
      return merged.get();
    }

    // Rejects cycles before any pass plans.
    graph.topologicalOrder();
    Optional<WidthOptimizer.Plan> widthPlan =
        options.optimizeWidth()
            ? Optional.of(WidthOptimizer.plan(graph, options))
            : Optional.empty();
    RegisterAllocator allocator =
        widthPlan.isPresent()
            ? RegisterAllocator.afterWidthPlan(
                graph, options.globalRegisterName(), widthPlan.get())
            : RegisterAllocator.create(graph, options.globalRegisterName());
    RegisterLayout layout = allocator.plan();

    if (widthPlan.isPresent()) {
      WidthOptimizer.commit(graph, widthPlan.get());
    }
    allocator.commit(layout);
    int size = layout.size();

    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    statements.add(Statement.QubitDeclaration.create(options.globalRegisterName(), size));
    for (ProgramNode node : graph.topologicalOrder()) {
      statements.add(Statement.Comment.create("Start node " + node.name()));
      statements.addAll(graph.payload(node).implementation().statements());
      statements.add(Statement.Comment.create("End node " + node.name()));
    }

    LOG.info(
        "merged {} nodes into register {} of size {}",
        graph.nodes().size(),
        options.globalRegisterName(),
        size);
    return MergedFragment.create(
        Program.create(options.openqasmVersion(), statements.build()), size);
  }

  private static Optional<MergedFragment> alreadyMerged(ProgramGraph graph, String registerName) {
    if (graph.nodes().size() != 1 || !graph.connections().isEmpty()) return Optional.empty();

    Program program = graph.payload(graph.nodes().get(0)).implementation();
    List<Statement.QubitDeclaration> declarations =
        program
            .statements()
            .stream()
            .filter(s -> s.type() == Statement.Type.QUBIT_DECLARATION)
            .map(s -> s.<Statement.QubitDeclaration>cast())
            .collect(ImmutableList.toImmutableList());
    if (declarations.size() != 1 || !declarations.get(0).name().equals(registerName)) {
      return Optional.empty();
    }

    Optional<Expression> size = declarations.get(0).size();
    if (!size.isPresent() || size.get().type() != Expression.Type.INTEGER_LITERAL) {
      return Optional.empty();
    }
    int registerSize = (int) size.get().<Expression.IntegerLiteral>cast().value();
    return Optional.of(MergedFragment.create(program, registerSize));
  }
}
