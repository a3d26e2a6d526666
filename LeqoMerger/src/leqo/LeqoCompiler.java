package leqo;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LeqoCompiler {
  private static final Logger LOG = LoggerFactory.getLogger(LeqoCompiler.class);

  private final MergeOptions options;

  public LeqoCompiler(MergeOptions options) {
    this.options = options;
  }

  public static LeqoCompiler create() {
    return new LeqoCompiler(MergeOptions.defaults());
  }

  public MergeOptions options() {
    return options;
  }

  public ProgramGraph buildGraph(CompileRequest request) throws CompilerException {
    ProgramGraph graph = new ProgramGraph();
    for (ProgramNode node : request.nodes().keySet()) {
      if (graph.node(node.name()).isPresent()) {
        throw new CompilerException(node, "duplicate node id");
      }
      graph.addNode(node, request.nodes().get(node));
    }

    for (CompileRequest.Edge edge : request.edges()) {
      ProgramNode source = lookup(graph, edge.sourceId(), edge);
      ProgramNode target = lookup(graph, edge.targetId(), edge);
      if (source.equals(target)) {
        throw new CompilerException(source, String.format("edge %s connects node to itself", edge));
      }
      graph.addConnection(
          Connection.IOConnection.create(
              source, edge.outputIndex(), target, edge.inputIndex(), edge.size()));
    }
    LOG.debug(
        "built graph of {} nodes and {} edges", graph.nodes().size(), request.edges().size());
    return graph;
  }

  private static ProgramNode lookup(ProgramGraph graph, String id, CompileRequest.Edge edge)
      throws CompilerException {
    Optional<ProgramNode> node = graph.node(id);
    if (!node.isPresent()) {
      throw new CompilerException(String.format("edge %s references unknown node %s", edge, id));
    }
    return node.get();
  }

  public MergedFragment compile(CompileRequest request) throws CompilerException {
    return ProgramMerger.merge(buildGraph(request), options);
  }

  public String compileToQasm(CompileRequest request) throws CompilerException {
    return compile(request).toQasm();
  }
}
