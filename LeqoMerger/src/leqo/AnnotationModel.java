package leqo;

import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

// Local ids follow declaration order. Required reusable means neither input nor dirty; returned
// dirty is everything that is neither output nor reusable.
@AutoValue
public abstract class AnnotationModel {

  public abstract ImmutableMap<String, ImmutableList<Integer>> declarationToIds();

  public abstract ImmutableMap<Integer, QubitAnnotation> idToInfo();

  public abstract ImmutableMap<Integer, IOInstance> inputs();

  public abstract ImmutableMap<Integer, IOInstance> outputs();

  public final int qubitCount() {
    return idToInfo().size();
  }

  public final Optional<IOInstance> input(int index) {
    return Optional.ofNullable(inputs().get(index));
  }

  public final Optional<IOInstance> output(int index) {
    return Optional.ofNullable(outputs().get(index));
  }

  @Memoized
  public ImmutableMap<Integer, ImmutableList<Integer>> inputToIds() {
    return qubitIds(inputs());
  }

  @Memoized
  public ImmutableMap<Integer, ImmutableList<Integer>> outputToIds() {
    return qubitIds(outputs());
  }

  @Memoized
  public ImmutableList<Integer> requiredDirtyIds() {
    return idsWhere(info -> info.dirty());
  }

  @Memoized
  public ImmutableList<Integer> requiredReusableIds() {
    return idsWhere(info -> !info.dirty() && !info.input().isPresent());
  }

  @Memoized
  public ImmutableList<Integer> returnedReusableIds() {
    return idsWhere(info -> info.reusable());
  }

  @Memoized
  public ImmutableList<Integer> returnedUncomputableIds() {
    return idsWhere(info -> info.uncomputable());
  }

  @Memoized
  public ImmutableList<Integer> returnedDirtyIds() {
    return idsWhere(
        info -> !info.reusable() && !info.uncomputable() && !info.output().isPresent());
  }

  private ImmutableList<Integer> idsWhere(Predicate<QubitAnnotation> predicate) {
    return idToInfo()
        .entrySet()
        .stream()
        .filter(e -> predicate.test(e.getValue()))
        .map(Map.Entry::getKey)
        .sorted()
        .collect(ImmutableList.toImmutableList());
  }

  private static ImmutableMap<Integer, ImmutableList<Integer>> qubitIds(
      ImmutableMap<Integer, IOInstance> instances) {
    ImmutableMap.Builder<Integer, ImmutableList<Integer>> builder = ImmutableMap.builder();
    instances.forEach(
        (index, instance) -> {
          if (instance.type() == IOInstance.Type.QUBIT) {
            builder.put(index, instance.<IOInstance.QubitIOInstance>cast().ids());
          }
        });
    return builder.build();
  }

  public static Builder builder() {
    return new AutoValue_AnnotationModel.Builder();
  }

  public static AnnotationModel empty() {
    return builder().build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract ImmutableMap.Builder<String, ImmutableList<Integer>>
        declarationToIdsBuilder();

    public abstract ImmutableMap.Builder<Integer, QubitAnnotation> idToInfoBuilder();

    public abstract ImmutableMap.Builder<Integer, IOInstance> inputsBuilder();

    public abstract ImmutableMap.Builder<Integer, IOInstance> outputsBuilder();

    public abstract AnnotationModel build();
  }
}
