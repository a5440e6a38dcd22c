package io.b2mash.b2b.artifactvault.classification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sensitivity tag on an artifact, and the clearance level held by an actor. The declaration order
 * is only the default; effective ranking comes from {@link LabelOrdering}.
 */
public enum ClassificationLabel {
  PUBLIC("Public"),
  INTERNAL("Internal"),
  CONFIDENTIAL("Confidential"),
  RESTRICTED("Restricted");

  private final String value;

  ClassificationLabel(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ClassificationLabel fromValue(String value) {
    for (ClassificationLabel label : values()) {
      if (label.value.equalsIgnoreCase(value) || label.name().equalsIgnoreCase(value)) {
        return label;
      }
    }
    throw new IllegalArgumentException("Unknown classification label: " + value);
  }
}
