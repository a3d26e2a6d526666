package leqo;

import static com.google.common.truth.Truth.assertThat;
import static leqo.Fragments.alias;
import static leqo.Fragments.program;
import static leqo.Fragments.qasm;
import static leqo.Fragments.qubit;
import static leqo.Fragments.qubits;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class LeqoCompilerTest {

  private static Program prepare() {
    return program(qubit("q"), Fragments.gate("h", "q"), alias("q_out", "q", Annotation.output(0)));
  }

  private static Program measureAndRelease() {
    return program(
        qubit("in", Annotation.input(0)),
        qubits("tmp", 2),
        Fragments.gate("cx", Expression.identifier("in"), Fragments.at("tmp", 0)),
        alias("done", "tmp", Annotation.reusable()),
        Statement.Measurement.create(
            ImmutableList.of(), Optional.empty(), Expression.identifier("in")));
  }

  private static void assertCompileErrors(String errorSubstr, CompileRequest request) {
    CompilerException ex =
        assertThrows(CompilerException.class, () -> LeqoCompiler.create().compile(request));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  @Test
  public void compilesRequest() throws CompilerException {
    CompileRequest request =
        CompileRequest.builder()
            .addNode("prep", prepare())
            .addNode("use", program(qubit("x", Annotation.input(0)), Fragments.gate("x", "x")))
            .addEdge("prep", 0, "use", 0)
            .build();

    String qasm = LeqoCompiler.create().compileToQasm(request);

    assertThat(qasm)
        .isEqualTo(
            qasm(
                "OPENQASM 3.1;",
                "qubit[1] leqo_reg;",
                "/* Start node prep */",
                "let q = leqo_reg[0];",
                "h q;",
                "@leqo.output 0",
                "let q_out = q;",
                "/* End node prep */",
                "/* Start node use */",
                "@leqo.input 0",
                "let x = leqo_reg[0];",
                "x x;",
                "/* End node use */"));
  }

  @Test
  public void buildGraphKeepsRequestOrder() throws CompilerException {
    CompileRequest request =
        CompileRequest.builder()
            .addNode("use", measureAndRelease())
            .addNode("prep", prepare())
            .addEdge(CompileRequest.Edge.create("prep", 0, "use", 0).withSize(1))
            .build();

    ProgramGraph graph = LeqoCompiler.create().buildGraph(request);

    assertThat(graph.nodes())
        .containsExactly(ProgramNode.create("use"), ProgramNode.create("prep"))
        .inOrder();
    assertThat(graph.ioConnections()).hasSize(1);
    assertThat(graph.ioConnections().get(0).sizeHint()).isEqualTo(Optional.of(1));
    assertThat(graph.topologicalOrder())
        .containsExactly(ProgramNode.create("prep"), ProgramNode.create("use"))
        .inOrder();
  }

  @Test
  public void sizeHintMismatchIsNotFatal() throws CompilerException {
    CompileRequest request =
        CompileRequest.builder()
            .addNode("prep", prepare())
            .addNode("use", measureAndRelease())
            .addEdge(CompileRequest.Edge.create("prep", 0, "use", 0).withSize(7))
            .build();

    assertThat(LeqoCompiler.create().compile(request).registerSize()).isEqualTo(3);
  }

  @Test
  public void optimizeWidth() throws CompilerException {
    CompileRequest request =
        CompileRequest.builder()
            .addNode("first", measureAndRelease())
            .addNode("second", program(qubits("b", 2), Fragments.gate("x", "b")))
            .build();
    LeqoCompiler optimizing =
        new LeqoCompiler(MergeOptions.builder().setOptimizeWidth(true).build());

    assertThat(LeqoCompiler.create().compile(request).registerSize()).isEqualTo(5);
    assertThat(optimizing.compile(request).registerSize()).isEqualTo(3);
    assertThat(optimizing.options().optimizeWidth()).isTrue();
  }

  @Test
  public void requestErrors() {
    assertCompileErrors(
        "edge prep.0 -> missing.0 references unknown node missing",
        CompileRequest.builder()
            .addNode("prep", prepare())
            .addEdge("prep", 0, "missing", 0)
            .build());
    assertCompileErrors(
        "prep: edge prep.0 -> prep.0 connects node to itself",
        CompileRequest.builder().addNode("prep", prepare()).addEdge("prep", 0, "prep", 0).build());
    assertCompileErrors(
        "prep: duplicate node id",
        CompileRequest.builder()
            .addNode("prep", prepare())
            .addNode(ProgramNode.ancilla("prep"), prepare())
            .build());
  }

  @Test
  public void fragmentErrorsNameTheNode() {
    assertCompileErrors(
        "bad: @leqo.output is only valid over an alias",
        CompileRequest.builder()
            .addNode("bad", program(qubit("q", Annotation.output(0))))
            .build());
    assertCompileErrors(
        "use: size mismatch: output 0 of prep has 1 qubits, input 0 of use has 2",
        CompileRequest.builder()
            .addNode("prep", prepare())
            .addNode("use", program(qubits("x", 2, Annotation.input(0))))
            .addEdge("prep", 0, "use", 0)
            .build());
  }

  @Test
  public void fragmentErrorsCarryTheNode() {
    CompileRequest request =
        CompileRequest.builder()
            .addNode("bad", program(qubit("q", Annotation.output(0))))
            .build();

    CompilerException ex =
        assertThrows(CompilerException.class, () -> LeqoCompiler.create().compile(request));

    assertThat(ex.node().map(ProgramNode::name)).isEqualTo(Optional.of("bad"));
    assertThat(ex.errorMsg()).startsWith("@leqo.output is only valid over an alias");
  }
}
