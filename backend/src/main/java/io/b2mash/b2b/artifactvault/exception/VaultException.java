package io.b2mash.b2b.artifactvault.exception;

/**
 * Base type of every failure raised by the vault. Mirrors a problem document: a short {@code title}
 * naming the failure class and a human-readable {@code detail} for the specific occurrence.
 */
public abstract class VaultException extends RuntimeException {

  private final String title;
  private final String detail;

  protected VaultException(String title, String detail) {
    this(title, detail, null);
  }

  protected VaultException(String title, String detail, Throwable cause) {
    super(title + ": " + detail, cause);
    this.title = title;
    this.detail = detail;
  }

  public String getTitle() {
    return title;
  }

  public String getDetail() {
    return detail;
  }
}
