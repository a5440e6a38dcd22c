package io.b2mash.b2b.artifactvault.exception;

public class ResourceNotFoundException extends VaultException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        resourceType + " not found", "No " + resourceType.toLowerCase() + " found with id " + id);
  }

  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(title, detail, null);
  }

  private ResourceNotFoundException(String title, String detail, Throwable cause) {
    super(title, detail, cause);
  }
}
