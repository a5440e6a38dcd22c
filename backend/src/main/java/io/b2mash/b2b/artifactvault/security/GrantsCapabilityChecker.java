package io.b2mash.b2b.artifactvault.security;

import io.b2mash.b2b.artifactvault.config.VaultProperties;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Default {@link CapabilityChecker} backed by the static {@code vault.security.grants} map.
 * Replaced by the host application's role-hierarchy adapter when one is registered as a bean.
 */
public class GrantsCapabilityChecker implements CapabilityChecker {

  private final Map<String, Set<Capability>> grants;

  public GrantsCapabilityChecker(Map<String, List<String>> configuredGrants) {
    var resolved = new HashMap<String, Set<Capability>>();
    configuredGrants.forEach(
        (actorId, values) -> {
          var capabilities = EnumSet.noneOf(Capability.class);
          values.forEach(v -> capabilities.add(Capability.fromValue(v.trim())));
          resolved.put(actorId, Set.copyOf(capabilities));
        });
    this.grants = Map.copyOf(resolved);
  }

  public static GrantsCapabilityChecker from(VaultProperties properties) {
    return new GrantsCapabilityChecker(properties.security().grants());
  }

  @Override
  public boolean hasCapability(Actor actor, Capability capability) {
    return grants.getOrDefault(actor.id(), Set.of()).contains(capability);
  }
}
