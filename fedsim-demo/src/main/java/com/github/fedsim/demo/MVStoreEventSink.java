// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.demo;

import com.github.fedsim.Event;
import com.github.fedsim.coordinator.EventSink;
import com.github.fedsim.protocol.ProtocolCodec;
import com.github.fedsim.protocol.ProtocolException;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Persists sink events in an H2 MVStore map keyed by arrival sequence, each value being the event in its wire JSON
/// form. Appends continue after the highest key so a store can collect several runs.
public class MVStoreEventSink implements EventSink {
  static final String MAP_NAME = "com.github.fedsim.demo#events";

  private final MVStore store;
  private final MVMap<Long, String> events;
  private long nextKey;

  public MVStoreEventSink(MVStore store) {
    this.store = store;
    this.events = store.openMap(MAP_NAME);
    this.nextKey = events.isEmpty() ? 0L : events.lastKey() + 1;
  }

  @Override
  public void accept(Event event) {
    events.put(nextKey++, ProtocolCodec.encodeEvent(event));
  }

  public void sync() {
    store.commit();
  }

  public long size() {
    return events.sizeAsLong();
  }

  public List<Event> readAll() throws ProtocolException {
    final List<Event> all = new ArrayList<>(events.size());
    for (Map.Entry<Long, String> entry : events.entrySet()) {
      all.add(ProtocolCodec.decodeEvent(entry.getValue()));
    }
    return all;
  }

  @Override
  public void close() {
    if (!store.isClosed()) {
      store.commit();
      store.close();
    }
  }
}
