package io.b2mash.b2b.artifactvault.classification;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Injected total order over {@link ClassificationLabel}. Rank is the index in the configured list;
 * access is granted iff the clearance rank is at least the label rank.
 */
public class LabelOrdering {

  private final List<ClassificationLabel> order;
  private final Map<ClassificationLabel, Integer> ranks;

  public LabelOrdering(List<ClassificationLabel> order) {
    if (order == null || order.size() != ClassificationLabel.values().length) {
      throw new IllegalArgumentException(
          "Label ordering must list every classification label exactly once: " + order);
    }
    if (!EnumSet.copyOf(order).equals(EnumSet.allOf(ClassificationLabel.class))) {
      throw new IllegalArgumentException(
          "Label ordering must list every classification label exactly once: " + order);
    }
    this.order = List.copyOf(order);
    this.ranks = new EnumMap<>(ClassificationLabel.class);
    for (int i = 0; i < this.order.size(); i++) {
      ranks.put(this.order.get(i), i);
    }
  }

  public static LabelOrdering defaultOrdering() {
    return new LabelOrdering(List.of(ClassificationLabel.values()));
  }

  public int rank(ClassificationLabel label) {
    return ranks.get(label);
  }

  public boolean checkAccess(ClassificationLabel label, ClassificationLabel clearance) {
    return rank(clearance) >= rank(label);
  }

  public List<ClassificationLabel> order() {
    return order;
  }
}
