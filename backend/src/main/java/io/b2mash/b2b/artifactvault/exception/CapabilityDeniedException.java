package io.b2mash.b2b.artifactvault.exception;

import io.b2mash.b2b.artifactvault.security.Capability;

/** The acting principal lacks the capability an operation requires. */
public class CapabilityDeniedException extends VaultException {

  public CapabilityDeniedException(String actorId, Capability capability) {
    super(
        "Capability denied",
        "Actor " + actorId + " does not hold the " + capability.value() + " capability");
  }
}
