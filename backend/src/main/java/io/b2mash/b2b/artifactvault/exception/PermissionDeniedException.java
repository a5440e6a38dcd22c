package io.b2mash.b2b.artifactvault.exception;

/**
 * The actor's clearance ranks below the artifact's classification label. Never collapsed into
 * {@link ResourceNotFoundException} on direct reads.
 */
public class PermissionDeniedException extends VaultException {

  public PermissionDeniedException(String title, String detail) {
    super(title, detail);
  }
}
