package com.tradingcore.domain.common;

public class InvalidStateTransitionException extends DomainException {
  private final String entityType;
  private final String currentState;
  private final String attemptedTransition;

  public InvalidStateTransitionException(
      String entityType, Enum<?> currentState, String attemptedTransition) {
    this(entityType, String.valueOf(currentState), attemptedTransition);
  }

  public InvalidStateTransitionException(
      String entityType, String currentState, String attemptedTransition) {
    super(
        String.format(
            "Cannot transition %s from %s state: %s",
            entityType, currentState, attemptedTransition));
    this.entityType = entityType;
    this.currentState = currentState;
    this.attemptedTransition = attemptedTransition;
  }

  public String entityType() {
    return entityType;
  }

  public String currentState() {
    return currentState;
  }

  public String attemptedTransition() {
    return attemptedTransition;
  }

  @Override
  public String errorCode() {
    return "invalid-state-transition";
  }
}
