package io.b2mash.b2b.artifactvault.artifact;

/**
 * Tenant-scoped identity of an artifact. Construction validates every component, so an instance
 * can always be turned into a filesystem path safely.
 *
 * @param tenantId owning tenant
 * @param workflowId workflow that produced the artifact
 * @param artifactId artifact name within the workflow
 */
public record ArtifactIdentifier(String tenantId, String workflowId, String artifactId) {

  public ArtifactIdentifier {
    PathValidator.validate(tenantId, workflowId, artifactId);
  }

  public static ArtifactIdentifier of(String tenantId, String workflowId, String artifactId) {
    return new ArtifactIdentifier(tenantId, workflowId, artifactId);
  }

  @Override
  public String toString() {
    return tenantId + "/" + workflowId + "/" + artifactId;
  }
}
