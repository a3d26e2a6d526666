package leqo;

import static com.google.common.truth.Truth.assertThat;
import static leqo.AncillaSchedulerTest.chain;
import static leqo.AncillaSchedulerTest.producer;
import static leqo.Fragments.alias;
import static leqo.Fragments.at;
import static leqo.Fragments.program;
import static leqo.Fragments.qasm;
import static leqo.Fragments.qubits;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ProgramMergerTest {
  private static final ProgramNode A = ProgramNode.create("A");
  private static final ProgramNode B = ProgramNode.create("B");

  // B is added before A, but consumes A's output.
  private static ProgramGraph connected() throws CompilerException {
    ProgramGraph graph = new ProgramGraph();
    graph.addNode(B, program(qubits("b", 2, Annotation.input(0)), Fragments.gate("h", at("b", 0))));
    graph.addNode(A, program(qubits("a", 2), alias("a_out", "a", Annotation.output(0))));
    graph.addConnection(Connection.IOConnection.create(A, 0, B, 0));
    return graph;
  }

  private static ProgramGraph single(Program program) throws CompilerException {
    ProgramGraph graph = new ProgramGraph();
    graph.addNode(ProgramNode.create("merged"), program);
    return graph;
  }

  @Test
  public void disjointNodes() throws CompilerException {
    ProgramGraph graph = new ProgramGraph();
    graph.addNode(A, program(qubits("a", 3)));
    graph.addNode(B, program(qubits("b", 3)));

    MergedFragment merged = ProgramMerger.merge(graph);

    assertThat(merged.registerSize()).isEqualTo(6);
    assertThat(merged.toQasm())
        .isEqualTo(
            qasm(
                "OPENQASM 3.1;",
                "qubit[6] leqo_reg;",
                "/* Start node A */",
                "let a = leqo_reg[{0, 1, 2}];",
                "/* End node A */",
                "/* Start node B */",
                "let b = leqo_reg[{3, 4, 5}];",
                "/* End node B */"));
  }

  @Test
  public void nodesFollowDataFlow() throws CompilerException {
    MergedFragment merged = ProgramMerger.merge(connected());

    assertThat(merged.registerSize()).isEqualTo(2);
    assertThat(merged.toQasm())
        .isEqualTo(
            qasm(
                "OPENQASM 3.1;",
                "qubit[2] leqo_reg;",
                "/* Start node A */",
                "let a = leqo_reg[{0, 1}];",
                "@leqo.output 0",
                "let a_out = a;",
                "/* End node A */",
                "/* Start node B */",
                "@leqo.input 0",
                "let b = leqo_reg[{0, 1}];",
                "h b[0];",
                "/* End node B */"));
  }

  @Test
  public void mergingTwiceIsIdempotent() throws CompilerException {
    ProgramGraph graph = new ProgramGraph();
    graph.addNode(A, program(qubits("a", 3)));
    graph.addNode(B, program(qubits("b", 3)));
    MergedFragment first = ProgramMerger.merge(graph);

    MergedFragment second = ProgramMerger.merge(single(first.program()));

    assertThat(second).isEqualTo(first);
  }

  @Test
  public void mergingStrippedResultIsIdempotent() throws CompilerException {
    Program stripped = AnnotationStripper.stripAll(ProgramMerger.merge(connected()).program());

    MergedFragment again = ProgramMerger.merge(single(stripped));

    assertThat(again.program()).isEqualTo(stripped);
    assertThat(again.registerSize()).isEqualTo(2);
  }

  @Test
  public void options() throws CompilerException {
    MergeOptions options =
        MergeOptions.builder().setGlobalRegisterName("q").setOpenqasmVersion("3.0").build();

    MergedFragment merged = ProgramMerger.merge(connected(), options);

    assertThat(merged.toQasm()).startsWith(qasm("OPENQASM 3.0;", "qubit[2] q;"));
    assertThat(merged.toQasm()).contains("let b = q[{0, 1}];");
  }

  @Test
  public void cycleIsRejected() throws CompilerException {
    ProgramGraph graph = new ProgramGraph();
    graph.addNode(
        A,
        program(qubits("a", 1, Annotation.input(0)), alias("a_out", "a", Annotation.output(0))));
    graph.addNode(
        B,
        program(qubits("b", 1, Annotation.input(0)), alias("b_out", "b", Annotation.output(0))));
    graph.addConnection(Connection.IOConnection.create(A, 0, B, 0));
    graph.addConnection(Connection.IOConnection.create(B, 0, A, 0));

    assertThrows(IllegalStateException.class, () -> ProgramMerger.merge(graph));
  }

  @Test
  public void failedOptimizedMergeLeavesGraphUntouched() throws CompilerException {
    // A hands out one qubit, B wants two.
    ProgramGraph graph =
        chain(producer(true), program(qubits("i", 2, Annotation.input(0)), qubits("b", 2)));
    ImmutableList<Connection> connections = graph.connections();
    Program producerBefore = graph.payload(graph.node("A").get()).implementation();
    Program consumerBefore = graph.payload(graph.node("B").get()).implementation();

    MergeOptions optimized = MergeOptions.builder().setOptimizeWidth(true).build();

    CompilerException ex =
        assertThrows(CompilerException.class, () -> ProgramMerger.merge(graph, optimized));

    assertThat(ex).hasMessageThat().contains("size mismatch");
    assertThat(graph.connections()).isEqualTo(connections);
    assertThat(graph.payload(graph.node("A").get()).implementation()).isEqualTo(producerBefore);
    assertThat(graph.payload(graph.node("B").get()).implementation()).isEqualTo(consumerBefore);
  }
}
