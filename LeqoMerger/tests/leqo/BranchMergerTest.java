package leqo;

import static com.google.common.truth.Truth.assertThat;
import static leqo.Fragments.alias;
import static leqo.Fragments.at;
import static leqo.Fragments.classical;
import static leqo.Fragments.program;
import static leqo.Fragments.qasm;
import static leqo.Fragments.qubit;
import static leqo.Fragments.qubits;
import static leqo.Fragments.select;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;

public class BranchMergerTest {
  private static final ProgramNode IF = ProgramNode.create("if");
  private static final ProgramNode ENDIF = ProgramNode.create("endif");
  private static final Expression CONDITION = Expression.identifier("c");

  private static Program passThrough(String prefix, int size) {
    return program(
        qubits(prefix + "_in", size, Annotation.input(0)),
        alias(prefix + "_out", prefix + "_in", Annotation.output(0)));
  }

  // if -> arm -> endif, all on input and output 0.
  private static ProgramGraph arm(ProgramNode node, Program body) throws CompilerException {
    ProgramGraph graph = new ProgramGraph();
    graph.addNode(IF, passThrough("if", 2));
    graph.addNode(node, body);
    graph.addNode(ENDIF, passThrough("endif", 2));
    graph.addConnection(Connection.IOConnection.create(IF, 0, node, 0));
    graph.addConnection(Connection.IOConnection.create(node, 0, ENDIF, 0));
    return graph;
  }

  private static ProgramGraph thenArm() throws CompilerException {
    return arm(
        ProgramNode.create("t"),
        program(
            qubits("t_in", 2, Annotation.input(0)),
            Fragments.gate("h", at("t_in", 0)),
            alias("t_out", "t_in", Annotation.output(0))));
  }

  private static ProgramGraph elseArm() throws CompilerException {
    return arm(
        ProgramNode.create("e"),
        program(
            qubits("e_in", 2, Annotation.input(0)),
            qubit("e_anc"),
            Fragments.gate("x", "e_anc"),
            alias("e_out", "e_in", Annotation.output(0))));
  }

  private static BranchMerger merger(ProgramGraph thenGraph, ProgramGraph elseGraph) {
    return BranchMerger.create("b", IF, ENDIF, thenGraph, elseGraph);
  }

  @Test
  public void failingElseArmLeavesThenArmUntouched() throws CompilerException {
    ProgramGraph thenGraph = thenArm();
    ProgramNode t = thenGraph.node("t").get();
    Program thenBefore = thenGraph.payload(t).implementation();
    Program ifBefore = thenGraph.payload(IF).implementation();
    // The if node hands over two qubits, the else body wants three.
    ProgramGraph elseGraph =
        arm(
            ProgramNode.create("e"),
            program(
                qubits("e_in", 3, Annotation.input(0)),
                alias("e_out", select("e_in", 0, 1), Annotation.output(0))));

    CompilerException ex =
        assertThrows(
            CompilerException.class, () -> merger(thenGraph, elseGraph).merge(CONDITION));

    assertThat(ex).hasMessageThat().contains("size mismatch");
    assertThat(thenGraph.payload(t).implementation()).isEqualTo(thenBefore);
    assertThat(thenGraph.payload(IF).implementation()).isEqualTo(ifBefore);
  }

  @Test
  public void mergesArmsIntoOneBranch() throws CompilerException {
    MergedFragment merged = merger(thenArm(), elseArm()).merge(CONDITION);

    assertThat(merged.registerSize()).isEqualTo(3);
    assertThat(merged.toQasm())
        .isEqualTo(
            qasm(
                "OPENQASM 3.1;",
                "@leqo.input 0",
                "qubit[2] if_in;",
                "let if_out = if_in;",
                "qubit[1] leqo_b_ancillae;",
                "let leqo_b_if_reg = if_in ++ leqo_b_ancillae;",
                "if (c) {",
                "  let t_in = leqo_b_if_reg[{0, 1}];",
                "  h t_in[0];",
                "  let t_out = t_in;",
                "} else {",
                "  let e_in = leqo_b_if_reg[{0, 1}];",
                "  let e_anc = leqo_b_if_reg[2];",
                "  x e_anc;",
                "  let e_out = e_in;",
                "}",
                "let endif_in = leqo_b_if_reg[{0, 1}];",
                "@leqo.output 0",
                "let endif_out = endif_in;"));
  }

  @Test
  public void noAncillaeWhenInputsSuffice() throws CompilerException {
    MergedFragment merged = merger(thenArm(), thenArm()).merge(CONDITION);

    assertThat(merged.registerSize()).isEqualTo(2);
    assertThat(merged.toQasm()).doesNotContain("leqo_b_ancillae");
    assertThat(merged.toQasm()).contains("let leqo_b_if_reg = if_in;");
  }

  @Test
  public void mergedBranchParsesAsFragment() throws CompilerException {
    MergedFragment merged = merger(thenArm(), elseArm()).merge(CONDITION);

    AnnotationModel model = AnnotationParser.parse(ProgramNode.create("branch"), merged.program());

    assertThat(model.inputToIds()).containsKey(0);
    assertThat(model.outputToIds()).containsKey(0);
    assertThat(model.qubitCount()).isEqualTo(3);
  }

  @Test
  public void armsMustAgreeOnOutputs() throws CompilerException {
    ProgramGraph swapped =
        arm(
            ProgramNode.create("t"),
            program(
                qubits("t_in", 2, Annotation.input(0)),
                alias("t_out", select("t_in", 1, 0), Annotation.output(0))));

    CompilerException ex =
        assertThrows(CompilerException.class, () -> merger(swapped, elseArm()).merge(CONDITION));

    assertThat(ex).hasMessageThat().contains("endif: outputs of then and else arms don't line up");
    assertThat(ex).hasMessageThat().contains("then binds {endif_in=[1, 0]}");
  }

  @Test
  public void classicalValuesCantLeaveBranch() throws CompilerException {
    ProgramNode t = ProgramNode.create("t");
    ProgramGraph graph = new ProgramGraph();
    graph.addNode(IF, passThrough("if", 2));
    graph.addNode(
        t,
        program(
            qubits("t_in", 2, Annotation.input(0)),
            alias("t_out", "t_in", Annotation.output(0)),
            classical(ClassicalType.bit(1), "flag"),
            alias("flag_out", "flag", Annotation.output(1))));
    graph.addNode(
        ENDIF,
        program(
            qubits("endif_in", 2, Annotation.input(0)),
            classical(ClassicalType.bit(1), "endif_flag", Annotation.input(1))));
    graph.addConnection(Connection.IOConnection.create(IF, 0, t, 0));
    graph.addConnection(Connection.IOConnection.create(t, 0, ENDIF, 0));
    graph.addConnection(Connection.IOConnection.create(t, 1, ENDIF, 1));

    CompilerException ex =
        assertThrows(CompilerException.class, () -> merger(graph, elseArm()).merge(CONDITION));

    assertThat(ex)
        .hasMessageThat()
        .contains("classical value can't leave the branch through input 1");
  }

  @Test
  public void bordersMustBeInBothArms() throws CompilerException {
    ProgramGraph missingEndif = new ProgramGraph();
    missingEndif.addNode(IF, passThrough("if", 2));

    assertThrows(IllegalArgumentException.class, () -> merger(thenArm(), missingEndif));
  }

  @Test
  public void passNodeImplementation() {
    Program program =
        PassNodes.implementation(
            ImmutableMap.of(
                1, PassNodes.RequestedInput.classical(ClassicalType.bit(2)),
                0, PassNodes.RequestedInput.qubits(2)));

    assertThat(QasmPrinter.print(program))
        .isEqualTo(
            qasm(
                "OPENQASM 3.1;",
                "@leqo.input 0",
                "qubit[2] pass_node_declaration_0;",
                "@leqo.output 0",
                "let pass_node_alias_0 = pass_node_declaration_0;",
                "@leqo.input 1",
                "bit[2] pass_node_declaration_1;",
                "@leqo.output 1",
                "let pass_node_alias_1 = pass_node_declaration_1;"));
    assertThat(
            QasmPrinter.print(
                PassNodes.implementation(ImmutableMap.of(0, PassNodes.RequestedInput.qubit()))))
        .contains("qubit pass_node_declaration_0;");
  }

  @Test
  public void passNodesAsBorders() throws CompilerException {
    Program border =
        PassNodes.implementation(ImmutableMap.of(0, PassNodes.RequestedInput.qubits(2)));
    ProgramNode t = ProgramNode.create("t");
    ProgramGraph graph = new ProgramGraph();
    graph.addNode(IF, border);
    graph.addNode(t, passThrough("t", 2));
    graph.addNode(
        ENDIF,
        program(
            qubits("endif_in", 2, Annotation.input(0)),
            alias("endif_out", "endif_in", Annotation.output(0))));
    graph.addConnection(Connection.IOConnection.create(IF, 0, t, 0));
    graph.addConnection(Connection.IOConnection.create(t, 0, ENDIF, 0));
    ProgramGraph elseGraph = new ProgramGraph();
    elseGraph.addNode(IF, border);
    elseGraph.addNode(
        ENDIF,
        program(
            qubits("endif_in", 2, Annotation.input(0)),
            alias("endif_out", "endif_in", Annotation.output(0))));
    elseGraph.addConnection(Connection.IOConnection.create(IF, 0, ENDIF, 0));

    MergedFragment merged = merger(graph, elseGraph).merge(CONDITION);

    assertThat(merged.registerSize()).isEqualTo(2);
    assertThat(merged.toQasm())
        .contains("let leqo_b_if_reg = pass_node_declaration_0;\nif (c) {\n  let t_in");
    // The else arm holds only border nodes.
    assertThat(merged.toQasm()).doesNotContain("else");
  }
}
