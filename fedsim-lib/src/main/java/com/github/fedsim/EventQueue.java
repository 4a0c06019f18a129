// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim;

import java.util.Comparator;
import java.util.OptionalLong;
import java.util.PriorityQueue;
import java.util.function.Consumer;

/// The future events of one node ordered by `(timeUs, insertionSequence)`. The insertion sequence is a plain counter
/// owned by the queue so that two events with the same timestamp always come out in the order they were scheduled,
/// run after run and process after process.
///
/// The queue also owns the node's virtual clock. [#advance(long, Consumer)] processes every event strictly before the
/// target. An event exactly at the target stays queued for the next cycle. This class is not thread safe.
public final class EventQueue {

  private record Entry(Event event, long sequence) {
  }

  private static final Comparator<Entry> ORDER = Comparator
      .comparingLong((Entry e) -> e.event().timeUs())
      .thenComparingLong(Entry::sequence);

  private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);

  private long nextSequence = 0;

  private long nowUs;

  public EventQueue() {
    this(0L);
  }

  public EventQueue(long startTimeUs) {
    if (startTimeUs < 0) {
      throw new IllegalArgumentException("startTimeUs must be non-negative: " + startTimeUs);
    }
    this.nowUs = startTimeUs;
  }

  /// @return the current virtual time of the owning node.
  public long now() {
    return nowUs;
  }

  /// @throws SchedulingException if the event is timestamped before [#now()].
  public void schedule(Event event) {
    if (event.timeUs() < nowUs) {
      throw new SchedulingException("cannot schedule " + event + " in the past of now=" + nowUs);
    }
    queue.add(new Entry(event, nextSequence++));
  }

  /// Pops and handles every queued event with `timeUs < targetTimeUs`, setting [#now()] to each event's timestamp
  /// before its handler runs. Handlers may schedule more events which are processed in the same call when they fall
  /// before the target. Finally [#now()] is set to exactly `targetTimeUs`.
  ///
  /// @return the number of events handled.
  /// @throws SchedulingException if the target is before [#now()].
  public int advance(long targetTimeUs, Consumer<Event> handler) {
    if (targetTimeUs < nowUs) {
      throw new SchedulingException("cannot advance backwards from " + nowUs + " to " + targetTimeUs);
    }
    int handled = 0;
    while (!queue.isEmpty() && queue.peek().event().timeUs() < targetTimeUs) {
      final var entry = queue.poll();
      nowUs = entry.event().timeUs();
      handler.accept(entry.event());
      handled++;
    }
    nowUs = targetTimeUs;
    return handled;
  }

  public OptionalLong peekTimeUs() {
    final var head = queue.peek();
    return head == null ? OptionalLong.empty() : OptionalLong.of(head.event().timeUs());
  }

  public int size() {
    return queue.size();
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }
}
