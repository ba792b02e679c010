package com.aiadvent.ci.annotation;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finite, lazy sequence of pages.
 *
 * <p>Each traversal asks the supplier for a fresh {@link PageFetcher} and starts again at page 1,
 * so the sequence can be iterated more than once. A page is fetched only when the iterator needs
 * it. Iteration ends at the first empty page or after {@code maxPages} pages, whichever comes
 * first. Hitting the page cap is logged as a warning.
 */
public final class PagedSequence<T> implements Iterable<List<T>> {

  private static final Logger log = LoggerFactory.getLogger(PagedSequence.class);

  private final Supplier<PageFetcher<T>> fetchers;
  private final int maxPages;

  private PagedSequence(Supplier<PageFetcher<T>> fetchers, int maxPages) {
    this.fetchers = Objects.requireNonNull(fetchers, "fetchers");
    if (maxPages <= 0) {
      throw new IllegalArgumentException("maxPages must be positive");
    }
    this.maxPages = maxPages;
  }

  /** Sequence over a stateless fetcher that can serve any page number. */
  public static <T> PagedSequence<T> of(PageFetcher<T> fetcher, int maxPages) {
    Objects.requireNonNull(fetcher, "fetcher");
    return new PagedSequence<>(() -> fetcher, maxPages);
  }

  /**
   * Sequence over cursor-style fetchers; the supplier is invoked once per traversal and the
   * fetcher it returns is called with consecutive page numbers.
   */
  public static <T> PagedSequence<T> restartable(Supplier<PageFetcher<T>> fetchers, int maxPages) {
    return new PagedSequence<>(fetchers, maxPages);
  }

  public int maxPages() {
    return maxPages;
  }

  @Override
  public Iterator<List<T>> iterator() {
    return new PageIterator<>(fetchers.get(), maxPages);
  }

  /** Elements of all pages in listing order; pages are fetched as the stream is consumed. */
  public Stream<T> items() {
    Spliterator<List<T>> pages =
        Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
    return StreamSupport.stream(pages, false).flatMap(List::stream);
  }

  private static final class PageIterator<T> implements Iterator<List<T>> {

    private final PageFetcher<T> fetcher;
    private final int maxPages;
    private int nextPage = 1;
    private List<T> buffered;
    private boolean exhausted;

    private PageIterator(PageFetcher<T> fetcher, int maxPages) {
      this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
      this.maxPages = maxPages;
    }

    @Override
    public boolean hasNext() {
      if (buffered != null) {
        return true;
      }
      if (exhausted) {
        return false;
      }
      if (nextPage > maxPages) {
        exhausted = true;
        log.warn("Stopped after {} pages without reaching the end of the listing", maxPages);
        return false;
      }
      List<T> page = fetcher.fetch(nextPage++);
      if (page == null || page.isEmpty()) {
        exhausted = true;
        return false;
      }
      buffered = List.copyOf(page);
      return true;
    }

    @Override
    public List<T> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      List<T> page = buffered;
      buffered = null;
      return page;
    }
  }
}
