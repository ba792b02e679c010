package com.aiadvent.ci.github;

/** Outcome of publishing a draft release: which release and whether it was new. */
public record ReleasePublication(long releaseId, String tag, boolean created) {}
