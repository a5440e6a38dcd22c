package io.b2mash.b2b.artifactvault.security;

import io.b2mash.b2b.artifactvault.exception.CapabilityDeniedException;

/**
 * Yes/no decision function over the surrounding system's role hierarchy. Consulted before every
 * compliance operation and classification mutation.
 */
public interface CapabilityChecker {

  boolean hasCapability(Actor actor, Capability capability);

  /** Throws {@link CapabilityDeniedException} unless the actor holds the capability. */
  default void require(Actor actor, Capability capability) {
    if (!hasCapability(actor, capability)) {
      throw new CapabilityDeniedException(actor.id(), capability);
    }
  }
}
