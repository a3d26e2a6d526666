package leqo;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

@AutoValue
public abstract class CompileRequest {

  @AutoValue
  public abstract static class Edge {
    public abstract String sourceId();

    public abstract int outputIndex();

    public abstract String targetId();

    public abstract int inputIndex();

    public abstract Optional<Integer> size();

    public static Edge create(String sourceId, int outputIndex, String targetId, int inputIndex) {
      return new AutoValue_CompileRequest_Edge(
          sourceId, outputIndex, targetId, inputIndex, Optional.empty());
    }

    public Edge withSize(int size) {
      return new AutoValue_CompileRequest_Edge(
          sourceId(), outputIndex(), targetId(), inputIndex(), Optional.of(size));
    }

    @Override
    public final String toString() {
      return String.format("%s.%d -> %s.%d", sourceId(), outputIndex(), targetId(), inputIndex());
    }
  }

  public abstract ImmutableMap<ProgramNode, Program> nodes();

  public abstract ImmutableList<Edge> edges();

  public static Builder builder() {
    return new AutoValue_CompileRequest.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract ImmutableMap.Builder<ProgramNode, Program> nodesBuilder();

    abstract ImmutableList.Builder<Edge> edgesBuilder();

    @CanIgnoreReturnValue
    public final Builder addNode(ProgramNode node, Program implementation) {
      nodesBuilder().put(node, implementation);
      return this;
    }

    @CanIgnoreReturnValue
    public final Builder addNode(String name, Program implementation) {
      return addNode(ProgramNode.create(name), implementation);
    }

    @CanIgnoreReturnValue
    public final Builder addEdge(Edge edge) {
      edgesBuilder().add(edge);
      return this;
    }

    @CanIgnoreReturnValue
    public final Builder addEdge(
        String sourceId, int outputIndex, String targetId, int inputIndex) {
      return addEdge(Edge.create(sourceId, outputIndex, targetId, inputIndex));
    }

    public abstract CompileRequest build();
  }
}
