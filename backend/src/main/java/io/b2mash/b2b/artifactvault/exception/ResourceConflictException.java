package io.b2mash.b2b.artifactvault.exception;

public class ResourceConflictException extends VaultException {

  public ResourceConflictException(String title, String detail) {
    super(title, detail);
  }
}
