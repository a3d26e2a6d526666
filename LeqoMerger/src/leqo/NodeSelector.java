package leqo;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.ForOverride;

// Picks which ready node the scheduler processes next.
public abstract class NodeSelector {
  static final int WEIGHT_REUSABLE = 2;
  static final int WEIGHT_UNCOMPUTABLE = 2;
  static final int WEIGHT_DIRTY = 1;

  public final int select(List<AncillaSupply> candidates, AvailableSupply available) {
    Preconditions.checkArgument(!candidates.isEmpty(), "no candidates to select from");
    int choice = choose(candidates, available);
    Preconditions.checkState(
        choice >= 0 && choice < candidates.size(), "%s chose %s", this, choice);
    return choice;
  }

  @ForOverride
  protected abstract int choose(List<AncillaSupply> candidates, AvailableSupply available);

  // Clean qubits weigh double.
  public static int score(AncillaSupply node) {
    return node.remaining(AncillaSupply.Kind.REUSABLE) * WEIGHT_REUSABLE
        + node.remaining(AncillaSupply.Kind.UNCOMPUTABLE) * WEIGHT_UNCOMPUTABLE
        + node.remaining(AncillaSupply.Kind.DIRTY) * WEIGHT_DIRTY
        - node.requiredReusable().size() * WEIGHT_REUSABLE
        - node.requiredDirty().size() * WEIGHT_DIRTY;
  }

  public static NodeSelector lastIn() {
    return LastIn.INSTANCE;
  }

  public static NodeSelector greatestSurplus() {
    return GreatestSurplus.INSTANCE;
  }

  public static NodeSelector satisfiableFirst() {
    return SatisfiableFirst.INSTANCE;
  }

  private static final class LastIn extends NodeSelector {
    static final LastIn INSTANCE = new LastIn();

    @Override
    protected int choose(List<AncillaSupply> candidates, AvailableSupply available) {
      return candidates.size() - 1;
    }

    @Override
    public String toString() {
      return "lastIn";
    }
  }

  private static final class GreatestSurplus extends NodeSelector {
    static final GreatestSurplus INSTANCE = new GreatestSurplus();

    @Override
    protected int choose(List<AncillaSupply> candidates, AvailableSupply available) {
      int best = 0;
      for (int i = 1; i < candidates.size(); i++) {
        if (score(candidates.get(i)) > score(candidates.get(best))) best = i;
      }
      return best;
    }

    @Override
    public String toString() {
      return "greatestSurplus";
    }
  }

  private static final class SatisfiableFirst extends NodeSelector {
    static final SatisfiableFirst INSTANCE = new SatisfiableFirst();

    @Override
    protected int choose(List<AncillaSupply> candidates, AvailableSupply available) {
      int best = 0;
      boolean bestSatisfiable = available.canSatisfy(candidates.get(0));
      int bestScore = score(candidates.get(0));
      for (int i = 1; i < candidates.size(); i++) {
        AncillaSupply candidate = candidates.get(i);
        boolean satisfiable = available.canSatisfy(candidate);
        int candidateScore = score(candidate);
        if ((satisfiable && !bestSatisfiable)
            || (satisfiable == bestSatisfiable && candidateScore > bestScore)) {
          best = i;
          bestSatisfiable = satisfiable;
          bestScore = candidateScore;
        }
      }
      return best;
    }

    @Override
    public String toString() {
      return "satisfiableFirst";
    }
  }
}
