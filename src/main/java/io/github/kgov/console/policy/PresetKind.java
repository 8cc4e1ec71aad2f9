package io.github.kgov.console.policy;

public enum PresetKind {
  NAMING("naming"),
  GUARDRAIL("guardrail");

  private final String policyType;

  PresetKind(String policyType) {
    this.policyType = policyType;
  }

  /**
   * Value of {@code policy_type} for policies created from presets of this kind.
   */
  public String policyType() {
    return policyType;
  }
}
