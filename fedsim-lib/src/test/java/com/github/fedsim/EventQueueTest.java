// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EventQueueTest {

  private static Event at(String type, long timeUs) {
    return Event.of(type, timeUs, "n1", "n1");
  }

  @Test
  public void eventExactlyAtTargetIsDeferredToTheNextCycle() {
    EventQueue queue = new EventQueue();
    queue.schedule(at("EDGE", 1_000));
    List<Event> handled = new ArrayList<>();

    assertThat(queue.advance(1_000, handled::add)).isZero();
    assertThat(handled).isEmpty();
    assertThat(queue.now()).isEqualTo(1_000);

    assertThat(queue.advance(2_000, handled::add)).isEqualTo(1);
    assertThat(handled).extracting(Event::eventType).containsExactly("EDGE");
  }

  @Test
  public void equalTimestampsComeOutInSchedulingOrder() {
    EventQueue queue = new EventQueue();
    queue.schedule(at("B", 500));
    queue.schedule(at("first", 100));
    queue.schedule(at("C", 500));
    queue.schedule(at("A", 500));
    List<String> order = new ArrayList<>();

    queue.advance(1_000, e -> order.add(e.eventType()));

    assertThat(order).containsExactly("first", "B", "C", "A");
  }

  @Test
  public void clockFollowsEachEventThenSettlesOnTheTarget() {
    EventQueue queue = new EventQueue();
    queue.schedule(at("X", 300));
    queue.schedule(at("Y", 700));
    List<Long> seen = new ArrayList<>();

    queue.advance(900, e -> seen.add(queue.now()));

    assertThat(seen).containsExactly(300L, 700L);
    assertThat(queue.now()).isEqualTo(900);
  }

  @Test
  public void handlersMayScheduleIntoTheSameCycle() {
    EventQueue queue = new EventQueue();
    queue.schedule(at("PING", 100));
    List<Long> times = new ArrayList<>();

    queue.advance(1_000, e -> {
      times.add(e.timeUs());
      if (e.timeUs() + 400 < 2_000) {
        queue.schedule(at("PING", e.timeUs() + 400));
      }
    });

    assertThat(times).containsExactly(100L, 500L, 900L);
    assertThat(queue.peekTimeUs()).hasValue(1_300L);
    assertThat(queue.size()).isEqualTo(1);
  }

  @Test
  public void handlerMayScheduleAtNow() {
    EventQueue queue = new EventQueue();
    queue.schedule(at("FIRST", 100));
    List<String> order = new ArrayList<>();

    queue.advance(200, e -> {
      order.add(e.eventType());
      if (e.eventType().equals("FIRST")) {
        queue.schedule(at("SECOND", queue.now()));
      }
    });

    assertThat(order).containsExactly("FIRST", "SECOND");
  }

  @Test
  public void schedulingInThePastFailsLoudly() {
    EventQueue queue = new EventQueue();
    queue.advance(1_000, e -> {
    });
    assertThatThrownBy(() -> queue.schedule(at("LATE", 999)))
        .isInstanceOf(SchedulingException.class);
    assertThat(queue.isEmpty()).isTrue();
  }

  @Test
  public void advancingBackwardsFails() {
    EventQueue queue = new EventQueue(5_000);
    assertThatThrownBy(() -> queue.advance(4_999, e -> {
    })).isInstanceOf(SchedulingException.class);
    assertThat(queue.now()).isEqualTo(5_000);
  }

  @Test
  public void advancingToNowIsANoOp() {
    EventQueue queue = new EventQueue(5_000);
    queue.schedule(at("NOW", 5_000));
    assertThat(queue.advance(5_000, e -> {
    })).isZero();
    assertThat(queue.size()).isEqualTo(1);
  }

  @Test
  public void emptyQueueHasNoHead() {
    assertThat(new EventQueue().peekTimeUs()).isEmpty();
  }
}
