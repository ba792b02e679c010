package com.aiadvent.ci.annotation;

/** What {@link AnnotationSync#reconcile} did to the resource. */
public record ReconcileResult(Action action, ManagedComment comment) {

  public enum Action {
    CREATED,
    UPDATED
  }

  public boolean created() {
    return action == Action.CREATED;
  }
}
