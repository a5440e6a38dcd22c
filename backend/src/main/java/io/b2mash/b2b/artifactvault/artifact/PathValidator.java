package io.b2mash.b2b.artifactvault.artifact;

import io.b2mash.b2b.artifactvault.exception.InvalidIdentifierException;
import java.util.regex.Pattern;

/**
 * Single choke point for identifier safety. Every tenant, workflow and artifact component passes
 * through here before any filesystem path is built from it. Rejections are reported, never
 * sanitized.
 */
public final class PathValidator {

  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_.-]+");
  private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:.*");
  private static final String FORBIDDEN_CHARACTERS = "/\\:*?\"<>|";
  private static final int MAX_LENGTH = 255;

  private PathValidator() {}

  /**
   * Validates one identifier component.
   *
   * @throws InvalidIdentifierException if the component is null, empty, too long, is {@code .},
   *     contains a parent reference, a separator, a glob/special character, an absolute prefix, or
   *     anything outside {@code [A-Za-z0-9_.-]}
   */
  public static void validate(String component) {
    if (component == null || component.isEmpty()) {
      throw new InvalidIdentifierException(String.valueOf(component), "must not be empty");
    }
    if (component.length() > MAX_LENGTH) {
      throw new InvalidIdentifierException(component, "longer than " + MAX_LENGTH + " characters");
    }
    if (component.contains("..")) {
      throw new InvalidIdentifierException(component, "contains a parent reference");
    }
    if (component.equals(".")) {
      throw new InvalidIdentifierException(component, "is a current-directory reference");
    }
    if (component.startsWith("/") || component.startsWith("\\") || component.startsWith("~")) {
      throw new InvalidIdentifierException(component, "is an absolute path");
    }
    if (DRIVE_PREFIX.matcher(component).matches()) {
      throw new InvalidIdentifierException(component, "is an absolute path");
    }
    for (int i = 0; i < component.length(); i++) {
      if (FORBIDDEN_CHARACTERS.indexOf(component.charAt(i)) >= 0) {
        throw new InvalidIdentifierException(
            component, "contains forbidden character '" + component.charAt(i) + "'");
      }
    }
    if (!ALLOWED.matcher(component).matches()) {
      throw new InvalidIdentifierException(component, "contains characters outside [A-Za-z0-9_.-]");
    }
  }

  /** Validates every component of an identifier. */
  public static void validate(String tenantId, String workflowId, String artifactId) {
    validate(tenantId);
    validate(workflowId);
    validate(artifactId);
  }

  /** Non-throwing variant for filtering directory listings. */
  public static boolean isValid(String component) {
    try {
      validate(component);
      return true;
    } catch (InvalidIdentifierException e) {
      return false;
    }
  }
}
