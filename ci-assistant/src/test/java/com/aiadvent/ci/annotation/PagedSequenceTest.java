package com.aiadvent.ci.annotation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class PagedSequenceTest {

  @Test
  void stopsAtFirstEmptyPage() {
    List<Integer> requested = new ArrayList<>();
    PagedSequence<String> sequence =
        PagedSequence.of(
            page -> {
              requested.add(page);
              return page <= 2 ? List.of("p" + page + "a", "p" + page + "b") : List.of();
            },
            10);

    assertThat(sequence.items()).containsExactly("p1a", "p1b", "p2a", "p2b");
    assertThat(requested).containsExactly(1, 2, 3);
  }

  @Test
  void stopsAfterMaxPages() {
    AtomicInteger calls = new AtomicInteger();
    PagedSequence<Integer> sequence =
        PagedSequence.of(
            page -> {
              calls.incrementAndGet();
              return List.of(page);
            },
            3);

    assertThat(sequence.items()).containsExactly(1, 2, 3);
    assertThat(calls).hasValue(3);
  }

  @Test
  void warnsOnlyWhenPageCapCutsTheListingShort() {
    Logger logger = (Logger) LoggerFactory.getLogger(PagedSequence.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      PagedSequence.of(page -> page <= 2 ? List.of(page) : List.of(), 5).items().toList();
      assertThat(appender.list).isEmpty();

      PagedSequence.of(page -> List.of(page), 2).items().toList();
      assertThat(appender.list)
          .singleElement()
          .satisfies(
              event -> {
                assertThat(event.getLevel()).isEqualTo(Level.WARN);
                assertThat(event.getFormattedMessage()).contains("Stopped after 2 pages");
              });
    } finally {
      logger.detachAppender(appender);
    }
  }

  @Test
  void treatsNullPageAsEnd() {
    PagedSequence<String> sequence = PagedSequence.of(page -> page == 1 ? List.of("x") : null, 5);

    assertThat(sequence.items()).containsExactly("x");
  }

  @Test
  void restartableSequenceOpensNewCursorPerTraversal() {
    AtomicInteger cursors = new AtomicInteger();
    PagedSequence<String> sequence =
        PagedSequence.restartable(
            () -> {
              int cursor = cursors.incrementAndGet();
              return page -> page == 1 ? List.of("cursor" + cursor) : List.of();
            },
            5);

    assertThat(sequence.items()).containsExactly("cursor1");
    assertThat(sequence.items()).containsExactly("cursor2");
  }

  @Test
  void fetchesLazily() {
    List<Integer> requested = new ArrayList<>();
    PagedSequence<Integer> sequence =
        PagedSequence.of(
            page -> {
              requested.add(page);
              return List.of(page * 10, page * 10 + 1);
            },
            50);

    assertThat(sequence.items().filter(value -> value == 21).findFirst()).contains(21);
    assertThat(requested).containsExactly(1, 2);
  }

  @Test
  void iteratorSignalsExhaustion() {
    Iterator<List<String>> pages = PagedSequence.<String>of(page -> List.of(), 3).iterator();

    assertThat(pages.hasNext()).isFalse();
    assertThatThrownBy(pages::next).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void rejectsNonPositiveMaxPages() {
    assertThatThrownBy(() -> PagedSequence.of(page -> List.of(), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
