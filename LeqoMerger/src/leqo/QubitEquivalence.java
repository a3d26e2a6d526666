package leqo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

// Union-find over the qubits of a graph.
final class QubitEquivalence {
  private final Map<SingleQubit, SingleQubit> parent = new HashMap<>();
  private final Map<SingleQubit, Integer> rank = new HashMap<>();

  void add(SingleQubit qubit) {
    Verify.verify(parent.putIfAbsent(qubit, qubit) == null, "qubit %s added twice", qubit);
    rank.put(qubit, 0);
  }

  boolean contains(SingleQubit qubit) {
    return parent.containsKey(qubit);
  }

  SingleQubit find(SingleQubit qubit) {
    SingleQubit p = parent.get(qubit);
    Preconditions.checkArgument(p != null, "unknown qubit %s", qubit);
    if (p.equals(qubit)) return qubit;

    SingleQubit root = find(p);
    parent.put(qubit, root);
    return root;
  }

  void union(SingleQubit a, SingleQubit b) {
    SingleQubit rootA = find(a);
    SingleQubit rootB = find(b);
    if (rootA.equals(rootB)) return;

    int rankA = rank.get(rootA);
    int rankB = rank.get(rootB);
    if (rankA < rankB) {
      parent.put(rootA, rootB);
    } else if (rankA > rankB) {
      parent.put(rootB, rootA);
    } else {
      parent.put(rootB, rootA);
      rank.put(rootA, rankA + 1);
    }
  }

  // Ordered by smallest member.
  ImmutableList<ImmutableSortedSet<SingleQubit>> classes() {
    Map<SingleQubit, List<SingleQubit>> byRoot = new HashMap<>();
    for (SingleQubit qubit : ImmutableList.copyOf(parent.keySet())) {
      byRoot.computeIfAbsent(find(qubit), r -> new ArrayList<>()).add(qubit);
    }

    TreeMap<SingleQubit, ImmutableSortedSet<SingleQubit>> byMin = new TreeMap<>();
    for (List<SingleQubit> members : byRoot.values()) {
      ImmutableSortedSet<SingleQubit> sorted = ImmutableSortedSet.copyOf(members);
      byMin.put(sorted.first(), sorted);
    }
    return ImmutableList.copyOf(byMin.values());
  }
}
