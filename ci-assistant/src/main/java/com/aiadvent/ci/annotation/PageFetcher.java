package com.aiadvent.ci.annotation;

import java.util.List;

/** Fetches one page of a listing; pages are numbered from 1 and an empty page ends the listing. */
@FunctionalInterface
public interface PageFetcher<T> {

  List<T> fetch(int pageNumber);
}
