package com.guildperms.config;

import com.google.common.base.MoreObjects;
import java.util.Objects;

/**
 * Configuration record for a {@link com.guildperms.resolver.PermissionResolver}.
 *
 * @param continueOnMissingItems When true, roles missing from the role map are logged and treated
 *     as granting nothing instead of failing the calculation. Results may then be incomplete.
 * @param dependencies Policy table applied as the last step of channel evaluation
 */
public record ResolverConfig(boolean continueOnMissingItems, PermissionDependencies dependencies) {

  public ResolverConfig {
    Objects.requireNonNull(dependencies, "dependencies");
  }

  /** Strict mode with the bundled dependency table. */
  public static ResolverConfig defaults() {
    return new ResolverConfig(false, PermissionDependencies.defaults());
  }

  /** Returns a copy with the given missing-item handling. */
  public ResolverConfig withContinueOnMissingItems(boolean continueOnMissingItems) {
    return new ResolverConfig(continueOnMissingItems, dependencies);
  }

  /** Returns a copy with the given dependency table. */
  public ResolverConfig withDependencies(PermissionDependencies dependencies) {
    return new ResolverConfig(continueOnMissingItems, dependencies);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("continueOnMissingItems", continueOnMissingItems)
        .add("dependencies", dependencies)
        .toString();
  }
}
