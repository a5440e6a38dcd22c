package io.b2mash.b2b.artifactvault.classification;

/** What a tenant export does with an artifact the exporting actor is not cleared to read. */
public enum ExportPolicy {
  /** Skip the artifact and record the denial. */
  DENY,
  /** Include the artifact's metadata, omit its content. */
  REDACT
}
