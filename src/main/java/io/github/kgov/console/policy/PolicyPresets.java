package io.github.kgov.console.policy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Built-in naming and guardrail presets. Contents are loaded from {@code presets/*.yaml}
 * on the classpath.
 */
public final class PolicyPresets {

  private static final List<PolicyPreset> PRESETS = List.of(
    preset(PresetKind.NAMING, "permissive", "Permissive", "Free format - Startup/Small teams"),
    preset(PresetKind.NAMING, "balanced", "Balanced", "{env}.{domain}.{resource}[.{action}]"),
    preset(PresetKind.NAMING, "strict", "Strict", "{env}.{classification}.{domain}.{resource}.{version}"),
    preset(PresetKind.GUARDRAIL, "dev", "DEV", "Development environment"),
    preset(PresetKind.GUARDRAIL, "stg", "STG", "Staging environment"),
    preset(PresetKind.GUARDRAIL, "prod", "PROD", "Production environment")
  );

  private PolicyPresets() {}

  public static List<PolicyPreset> all() {
    return PRESETS;
  }

  public static List<PolicyPreset> of(PresetKind kind) {
    return PRESETS.stream().filter(p -> p.kind() == kind).toList();
  }

  /**
   * Looks up a preset by key. Keys are unique across kinds.
   */
  public static Optional<PolicyPreset> find(String key) {
    return PRESETS.stream().filter(p -> p.key().equalsIgnoreCase(key)).findFirst();
  }

  private static PolicyPreset preset(PresetKind kind, String key, String name, String description) {
    String resource = "presets/" + kind.policyType() + "-" + key + ".yaml";
    try (InputStream is = PolicyPresets.class.getClassLoader().getResourceAsStream(resource)) {
      if (is == null) {
        throw new IllegalStateException("Preset resource not found on classpath: " + resource);
      }
      return new PolicyPreset(kind, key, name, description, new String(is.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read preset " + resource, e);
    }
  }
}
