package com.aiadvent.ci.annotation;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Keeps one marker-tagged comment per resource in sync with the latest generated content.
 *
 * <p>The comment list is scanned page by page for the first body containing the marker. If one
 * is found it is overwritten, otherwise a new comment is created. Repeated sequential calls
 * therefore leave a single managed comment holding the latest body.
 *
 * <p>There is no mutual exclusion: two runs reconciling the same empty thread at the same time
 * can both create a comment. Listing, create and update failures propagate to the caller as they
 * are; nothing is retried.
 */
public class AnnotationSync {

  private static final Logger log = LoggerFactory.getLogger(AnnotationSync.class);

  private final CommentStore commentStore;
  private final MeterRegistry meterRegistry;

  public AnnotationSync(CommentStore commentStore, @Nullable MeterRegistry meterRegistry) {
    this.commentStore = Objects.requireNonNull(commentStore, "commentStore");
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
  }

  public ReconcileResult reconcile(ResourceRef resource, AnnotationMarker marker, String newBody) {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(marker, "marker");

    Optional<ManagedComment> existing = findManagedComment(resource, marker);
    String fullBody = marker.decorate(newBody);

    ReconcileResult result;
    if (existing.isPresent()) {
      ManagedComment updated =
          commentStore.updateComment(resource, existing.get().id(), fullBody);
      log.info("Updated existing comment {} on {}", updated.id(), resource);
      result = new ReconcileResult(ReconcileResult.Action.UPDATED, updated);
    } else {
      ManagedComment created = commentStore.createComment(resource, fullBody);
      log.info("Created new comment {} on {}", created.id(), resource);
      result = new ReconcileResult(ReconcileResult.Action.CREATED, created);
    }
    String action = result.action().name().toLowerCase(Locale.ROOT);
    meterRegistry.counter("ci_annotation_reconcile_total", "action", action).increment();
    return result;
  }

  /** First comment in listing order whose body carries the marker; later pages are not read. */
  public Optional<ManagedComment> findManagedComment(ResourceRef resource, AnnotationMarker marker) {
    return commentStore
        .listComments(resource)
        .items()
        .filter(comment -> marker.isPresentIn(comment.body()))
        .findFirst();
  }
}
