package leqo;

import static com.google.common.truth.Truth.assertThat;
import static leqo.AncillaSchedulerTest.chain;
import static leqo.AncillaSchedulerTest.consumer;
import static leqo.AncillaSchedulerTest.producer;
import static leqo.Fragments.alias;
import static leqo.Fragments.program;
import static leqo.Fragments.qubits;
import static leqo.Fragments.uncompute;

import org.junit.jupiter.api.Test;

public class WidthOptimizerTest {
  private static final MergeOptions OPTIMIZED =
      MergeOptions.builder().setOptimizeWidth(true).build();

  private static boolean hasBranch(Program program) {
    return program.statements().stream().anyMatch(s -> s.type() == Statement.Type.BRANCHING);
  }

  @Test
  public void ancillaConnectionsAreAdded() throws CompilerException {
    ProgramGraph graph = chain(producer(false), consumer());

    SchedulingResult result = WidthOptimizer.optimize(graph, MergeOptions.defaults());

    assertThat(graph.ancillaConnections()).containsExactlyElementsIn(result.ancillaConnections());
    assertThat(graph.ioConnections()).hasSize(1);
  }

  @Test
  public void planLeavesGraphUntouched() throws CompilerException {
    ProgramGraph graph = chain(producer(true), consumer());
    ProgramNode a = graph.node("A").get();
    Program before = graph.payload(a).implementation();

    WidthOptimizer.Plan plan = WidthOptimizer.plan(graph, MergeOptions.defaults());

    assertThat(graph.ancillaConnections()).isEmpty();
    assertThat(graph.payload(a).implementation()).isEqualTo(before);
    assertThat(hasBranch(plan.implementations().get(a))).isFalse();

    WidthOptimizer.commit(graph, plan);

    assertThat(graph.ancillaConnections())
        .containsExactlyElementsIn(plan.result().ancillaConnections());
    assertThat(graph.payload(a).implementation()).isEqualTo(plan.implementations().get(a));
  }

  @Test
  public void neededUncomputeIsInlined() throws CompilerException {
    ProgramGraph graph = chain(producer(true), consumer());
    ProgramNode a = graph.node("A").get();

    WidthOptimizer.optimize(graph, MergeOptions.defaults());

    Program resolved = graph.payload(a).implementation();
    assertThat(hasBranch(resolved)).isFalse();
    assertThat(QasmPrinter.print(resolved)).contains("@leqo.reusable\nlet r = a;");
  }

  @Test
  public void unneededUncomputeIsDropped() throws CompilerException {
    ProgramGraph graph = new ProgramGraph();
    ProgramNode node = ProgramNode.create("A");
    graph.addNode(
        node,
        program(qubits("a", 2), uncompute(alias("r", "a", Annotation.reusable()))));

    SchedulingResult result = WidthOptimizer.optimize(graph, MergeOptions.defaults());

    assertThat(result.uncomputes(node)).isFalse();
    assertThat(graph.payload(node).implementation()).isEqualTo(program(qubits("a", 2)));
  }

  @Test
  public void reuseShrinksRegister() throws CompilerException {
    MergedFragment plain = ProgramMerger.merge(chain(producer(false), consumer()));
    MergedFragment optimized = ProgramMerger.merge(chain(producer(false), consumer()), OPTIMIZED);

    assertThat(plain.registerSize()).isEqualTo(5);
    assertThat(optimized.registerSize()).isEqualTo(3);
    assertThat(optimized.toQasm()).contains("let b = leqo_reg[{1, 2}];");
  }

  @Test
  public void uncomputedQubitsAreReused() throws CompilerException {
    MergedFragment optimized = ProgramMerger.merge(chain(producer(true), consumer()), OPTIMIZED);

    assertThat(optimized.registerSize()).isEqualTo(3);
    assertThat(optimized.toQasm()).doesNotContain("if (false)");
  }
}
