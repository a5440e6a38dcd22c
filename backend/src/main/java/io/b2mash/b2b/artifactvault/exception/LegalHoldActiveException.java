package io.b2mash.b2b.artifactvault.exception;

/**
 * Deletion was vetoed by an active legal hold. Kept distinct from other failures so automation can
 * route it to a human sign-off instead of treating it as breakage.
 */
public class LegalHoldActiveException extends VaultException {

  private final String tenantId;

  public LegalHoldActiveException(String tenantId, String reason) {
    super("Legal hold active", "Tenant " + tenantId + " is under legal hold: " + reason);
    this.tenantId = tenantId;
  }

  public String getTenantId() {
    return tenantId;
  }
}
