package io.b2mash.b2b.artifactvault.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.artifactvault.classification.ClassificationLabel;
import io.b2mash.b2b.artifactvault.exception.CapabilityDeniedException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GrantsCapabilityCheckerTest {

  private static final Actor KEY_ADMIN = new Actor("key-admin", ClassificationLabel.INTERNAL);
  private static final Actor STRANGER = new Actor("stranger", ClassificationLabel.RESTRICTED);

  private final GrantsCapabilityChecker checker =
      new GrantsCapabilityChecker(
          Map.of("key-admin", List.of("rotateKey", " LEGAL_HOLD "), "auditor", List.of()));

  @Test
  void grantedCapabilitiesAcceptWireOrConstantNames() {
    assertThat(checker.hasCapability(KEY_ADMIN, Capability.ROTATE_KEY)).isTrue();
    assertThat(checker.hasCapability(KEY_ADMIN, Capability.LEGAL_HOLD)).isTrue();
    assertThat(checker.hasCapability(KEY_ADMIN, Capability.EXPORT)).isFalse();
  }

  @Test
  void clearanceDoesNotImplyCapabilities() {
    assertThat(checker.hasCapability(STRANGER, Capability.EXPORT)).isFalse();
    assertThat(checker.hasCapability(Actor.system(), Capability.DELETE)).isFalse();
  }

  @Test
  void requireThrowsForMissingCapability() {
    assertThatCode(() -> checker.require(KEY_ADMIN, Capability.ROTATE_KEY))
        .doesNotThrowAnyException();
    assertThatThrownBy(() -> checker.require(KEY_ADMIN, Capability.DELETE))
        .isInstanceOf(CapabilityDeniedException.class)
        .hasMessageContaining("key-admin");
  }

  @Test
  void unknownCapabilityNameFailsFast() {
    assertThatThrownBy(() -> new GrantsCapabilityChecker(Map.of("x", List.of("launchMissiles"))))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
