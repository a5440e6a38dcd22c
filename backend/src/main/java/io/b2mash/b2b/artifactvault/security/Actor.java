package io.b2mash.b2b.artifactvault.security;

import io.b2mash.b2b.artifactvault.classification.ClassificationLabel;
import java.util.Objects;

/**
 * The principal on whose behalf an operation runs.
 *
 * @param id stable actor identifier, recorded in audit events
 * @param clearance highest classification label the actor may read
 */
public record Actor(String id, ClassificationLabel clearance) {

  public static final String SYSTEM_ID = "system";

  public Actor {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(clearance, "clearance must not be null");
  }

  /** Actor used by scheduled jobs. Holds no capabilities unless granted by configuration. */
  public static Actor system() {
    return new Actor(SYSTEM_ID, ClassificationLabel.RESTRICTED);
  }
}
