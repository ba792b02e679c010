package com.aiadvent.ci.annotation;

/** A comment as seen by the pipeline; the id is assigned by the hosting service. */
public record ManagedComment(long id, String body) {

  public ManagedComment {
    body = body == null ? "" : body;
  }
}
