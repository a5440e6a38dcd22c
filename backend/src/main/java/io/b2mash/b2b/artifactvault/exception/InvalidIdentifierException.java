package io.b2mash.b2b.artifactvault.exception;

public class InvalidIdentifierException extends VaultException {

  private final String component;

  public InvalidIdentifierException(String component, String reason) {
    super("Invalid identifier", "Identifier component '" + component + "' rejected: " + reason);
    this.component = component;
  }

  public String getComponent() {
    return component;
  }
}
