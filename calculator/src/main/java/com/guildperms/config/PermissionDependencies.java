package com.guildperms.config;

import com.guildperms.common.status.Status;
import com.guildperms.common.status.StatusOr;
import com.guildperms.permission.Permission;
import com.guildperms.permission.PermissionGroups;
import com.guildperms.permission.Permissions;
import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.io.Resources;
import java.io.IOException;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Policy table of permissions that are meaningless without a gating permission.
 *
 * <p>When a channel result lacks a gating permission, every dependent permission is cleared as
 * well. The table is data, not logic: the bundled default lives in
 * {@value #DEFAULT_RESOURCE} and can be replaced with {@link #load(URL)} or {@link #of(Map)}.
 *
 * <p>Resource format, one entry per gate:
 * <pre>
 * # gate=dependent,dependent,...   ('*' means every channel flag except the gate)
 * VIEW_CHANNEL=*
 * SEND_MESSAGES=ATTACH_FILES,EMBED_LINKS,MENTION_EVERYONE,SEND_TTS_MESSAGES
 * </pre>
 */
public final class PermissionDependencies {

  /** Classpath location of the bundled table. */
  public static final String DEFAULT_RESOURCE = "permission-dependencies.properties";

  private static final String WILDCARD = "*";
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private static final PermissionDependencies NONE = new PermissionDependencies(ImmutableMap.of());

  private final ImmutableMap<Permission, Permissions> dependents;

  private PermissionDependencies(ImmutableMap<Permission, Permissions> dependents) {
    this.dependents = dependents;
  }

  /** Returns a table with no rules. */
  public static PermissionDependencies none() {
    return NONE;
  }

  /**
   * Returns the bundled table.
   *
   * @throws IllegalStateException if the bundled resource is missing or malformed
   */
  public static PermissionDependencies defaults() {
    URL resource = PermissionDependencies.class.getClassLoader().getResource(DEFAULT_RESOURCE);
    if (resource == null) {
      throw new IllegalStateException(DEFAULT_RESOURCE + " could not be loaded.");
    }
    StatusOr<PermissionDependencies> loaded = load(resource);
    if (loaded.isNotOk()) {
      throw new IllegalStateException(
          "Bundled " + DEFAULT_RESOURCE + " is invalid: " + loaded.getStatus());
    }
    return loaded.getValue();
  }

  /**
   * Builds a table from an explicit mapping. A gate is never treated as its own dependent.
   *
   * @param rules gate to dependents
   */
  public static PermissionDependencies of(@Nonnull Map<Permission, Permissions> rules) {
    EnumMap<Permission, Permissions> copy = new EnumMap<>(Permission.class);
    rules.forEach((gate, deps) -> copy.put(gate, deps.without(gate)));
    return new PermissionDependencies(Maps.immutableEnumMap(copy));
  }

  /**
   * Loads a table in properties format from the given URL.
   *
   * @param source location of the table
   * @return the table, INVALID_ARGUMENT for unknown permission names, or INTERNAL on read failure
   */
  public static StatusOr<PermissionDependencies> load(@Nonnull URL source) {
    Properties properties = new Properties();
    try (Reader reader =
        Resources.asCharSource(source, StandardCharsets.UTF_8).openBufferedStream()) {
      properties.load(reader);
    } catch (IOException e) {
      Logger.error(e, "Failed to read permission dependencies from {}", source);
      return StatusOr.ofStatus(
          Status.internal("Failed to read permission dependencies: " + e.getMessage()));
    }

    EnumMap<Permission, Permissions> rules = new EnumMap<>(Permission.class);
    for (String gateName : properties.stringPropertyNames()) {
      StatusOr<Permission> gateOr = parsePermission(gateName);
      if (gateOr.isNotOk()) {
        return StatusOr.ofStatus(gateOr.getStatus());
      }
      StatusOr<Permissions> depsOr = parseDependents(properties.getProperty(gateName));
      if (depsOr.isNotOk()) {
        return StatusOr.ofStatus(depsOr.getStatus());
      }
      rules.put(gateOr.getValue(), depsOr.getValue());
    }
    Logger.debug("Loaded {} permission dependency rules from {}", rules.size(), source);
    return StatusOr.ofValue(of(rules));
  }

  private static StatusOr<Permissions> parseDependents(String value) {
    if (WILDCARD.equals(value.trim())) {
      return StatusOr.ofValue(PermissionGroups.ANY_CHANNEL);
    }
    Permissions deps = Permissions.empty();
    for (String name : LIST_SPLITTER.split(value)) {
      StatusOr<Permission> depOr = parsePermission(name);
      if (depOr.isNotOk()) {
        return StatusOr.ofStatus(depOr.getStatus());
      }
      deps = deps.with(depOr.getValue());
    }
    return StatusOr.ofValue(deps);
  }

  private static StatusOr<Permission> parsePermission(String name) {
    try {
      return StatusOr.ofValue(Permission.valueOf(name.trim()));
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(Status.invalidArgument("Unknown permission name: " + name));
    }
  }

  /** Returns the dependents registered for {@code gate}, or an empty set. */
  public Permissions dependentsOf(Permission gate) {
    return dependents.getOrDefault(gate, Permissions.empty());
  }

  /** Returns the rules as an immutable gate to dependents map. */
  public Map<Permission, Permissions> rules() {
    return dependents;
  }

  /**
   * Clears the dependents of every gate absent from {@code permissions}. Rules are re-applied
   * until the result is stable, so a gate cleared by another rule also clears its own dependents.
   */
  public Permissions apply(Permissions permissions) {
    Permissions current = permissions;
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Map.Entry<Permission, Permissions> rule : dependents.entrySet()) {
        if (!current.contains(rule.getKey()) && current.intersects(rule.getValue())) {
          current = current.difference(rule.getValue());
          changed = true;
        }
      }
    }
    return current;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return dependents.equals(((PermissionDependencies) obj).dependents);
  }

  @Override
  public int hashCode() {
    return dependents.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("gates", dependents.keySet()).toString();
  }
}
