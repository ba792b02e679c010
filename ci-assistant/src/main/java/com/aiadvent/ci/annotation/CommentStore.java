package com.aiadvent.ci.annotation;

/**
 * Comment thread of a hosted resource. Implementations wrap a remote API; every method blocks
 * and failures surface as {@link com.aiadvent.ci.shared.UpstreamServiceException}.
 */
public interface CommentStore {

  /** All comments of the resource in listing order, fetched page by page. */
  PagedSequence<ManagedComment> listComments(ResourceRef resource);

  ManagedComment createComment(ResourceRef resource, String body);

  ManagedComment updateComment(ResourceRef resource, long commentId, String body);
}
