package leqo;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

@AutoValue
public abstract class RegisterLayout {
  public abstract String registerName();

  public abstract int size();

  public abstract ImmutableMap<SingleQubit, Integer> qubitToIndex();

  public abstract ImmutableMap<ProgramNode, Program> rewritten();

  public final int index(ProgramNode node, int id) {
    Integer index = qubitToIndex().get(SingleQubit.create(node, id));
    if (index == null) {
      throw new IllegalArgumentException(String.format("no qubit %d in %s", id, node));
    }
    return index;
  }

  public final ImmutableList<Integer> indices(ProgramNode node, List<Integer> ids) {
    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    for (int id : ids) {
      builder.add(index(node, id));
    }
    return builder.build();
  }

  public final Optional<Program> rewritten(ProgramNode node) {
    return Optional.ofNullable(rewritten().get(node));
  }

  static RegisterLayout create(
      String registerName,
      int size,
      ImmutableMap<SingleQubit, Integer> qubitToIndex,
      ImmutableMap<ProgramNode, Program> rewritten) {
    return new AutoValue_RegisterLayout(registerName, size, qubitToIndex, rewritten);
  }
}
