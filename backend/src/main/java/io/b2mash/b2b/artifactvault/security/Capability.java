package io.b2mash.b2b.artifactvault.security;

import java.util.Locale;

/** Operations gated by the external role-hierarchy decision function. */
public enum Capability {
  EXPORT("export"),
  DELETE("delete"),
  RELABEL("relabel"),
  ROTATE_KEY("rotateKey"),
  LEGAL_HOLD("legalHold");

  private final String value;

  Capability(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** Accepts the wire value ({@code rotateKey}) or the constant name ({@code ROTATE_KEY}). */
  public static Capability fromValue(String value) {
    for (Capability capability : values()) {
      if (capability.value.equalsIgnoreCase(value)
          || capability.name().equals(value.toUpperCase(Locale.ROOT).replace('-', '_'))) {
        return capability;
      }
    }
    throw new IllegalArgumentException("Unknown capability: " + value);
  }
}
