package io.b2mash.b2b.artifactvault.storage;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Storage tiers in decreasing access frequency and cost. Artifacts enter at {@link #HOT} and only
 * ever move one step forward; {@link #COLD} is terminal and its window ends in a purge.
 */
public enum Tier {
  HOT("hot"),
  WARM("warm"),
  COLD("cold");

  private final String value;

  Tier(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public boolean isTerminal() {
    return this == COLD;
  }

  /** The tier an artifact is promoted to from this one. */
  public Tier next() {
    return switch (this) {
      case HOT -> WARM;
      case WARM -> COLD;
      case COLD -> throw new IllegalStateException("cold is the terminal tier");
    };
  }

  public static Tier fromValue(String value) {
    for (Tier tier : values()) {
      if (tier.value.equalsIgnoreCase(value)) {
        return tier;
      }
    }
    throw new IllegalArgumentException("Unknown tier: " + value);
  }
}
