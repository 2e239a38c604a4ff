package com.acme.editor.runtime.container;

public class PhaseViolationException extends ServiceRegistryException {
  private final ServicePhase requiredPhase;
  private final ServicePhase currentPhase;

  public PhaseViolationException(
      String token, ServicePhase requiredPhase, ServicePhase currentPhase) {
    super(
        token,
        "Service '"
            + token
            + "' belongs to phase "
            + requiredPhase
            + " but the registry is still in phase "
            + currentPhase);
    this.requiredPhase = requiredPhase;
    this.currentPhase = currentPhase;
  }

  public ServicePhase getRequiredPhase() {
    return requiredPhase;
  }

  public ServicePhase getCurrentPhase() {
    return currentPhase;
  }
}
