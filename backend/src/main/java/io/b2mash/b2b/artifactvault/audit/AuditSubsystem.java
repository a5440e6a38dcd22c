package io.b2mash.b2b.artifactvault.audit;

/** Each subsystem writes its own audit log. */
public enum AuditSubsystem {
  STORAGE("storage"),
  LIFECYCLE("lifecycle"),
  COMPLIANCE("compliance"),
  CRYPTO("crypto"),
  CLASSIFICATION("classification");

  private final String value;

  AuditSubsystem(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
