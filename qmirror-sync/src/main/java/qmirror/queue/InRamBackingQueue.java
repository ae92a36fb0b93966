/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package qmirror.queue;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;
import qmirror.interfaces.queue.BackingQueue;
import qmirror.interfaces.queue.MessageProperties;
import qmirror.interfaces.queue.QueueMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * BackingQueue hosted in memory, e.g. for running sync rounds in-memory in unit tests. Holds messages
 * in publish order and nothing else.
 */
public class InRamBackingQueue implements BackingQueue {

  private static final class Entry {
    final QueueMessage message;
    final MessageProperties properties;
    final boolean delivered;

    Entry(QueueMessage message, MessageProperties properties, boolean delivered) {
      this.message = message;
      this.properties = properties;
      this.delivered = delivered;
    }
  }

  private final List<Entry> entries = new ArrayList<>();
  private double ramDurationTarget = Double.POSITIVE_INFINITY;

  public InRamBackingQueue() {
  }

  @Override
  public <A, E extends Exception> A fold(FoldFunction<A, E> function, A initial) throws E {
    List<Entry> snapshot;
    synchronized (this) {
      snapshot = new ArrayList<>(entries);
    }

    A accumulator = initial;
    for (Entry entry : snapshot) {
      accumulator = function.apply(entry.message, entry.properties, accumulator);
    }
    return accumulator;
  }

  @Override
  public synchronized int purge() {
    int purged = entries.size();
    entries.clear();
    return purged;
  }

  @Override
  public synchronized void publish(QueueMessage message,
                                   MessageProperties properties,
                                   boolean delivered,
                                   @Nullable String publisher) {
    entries.add(new Entry(message, properties, delivered));
  }

  @Override
  public synchronized void setRamDurationTarget(double durationSeconds) {
    ramDurationTarget = durationSeconds;
  }

  @Override
  public synchronized int len() {
    return entries.size();
  }

  public synchronized List<QueueMessage> getMessages() {
    return entries.stream()
        .map((entry) -> entry.message)
        .collect(Collectors.toList());
  }

  public synchronized List<MessageProperties> getProperties() {
    return ImmutableList.copyOf(entries.stream()
        .map((entry) -> entry.properties)
        .collect(Collectors.toList()));
  }

  /**
   * @return true if the message at the given position was published as possibly delivered already.
   */
  public synchronized boolean isDelivered(int position) {
    return entries.get(position).delivered;
  }

  public synchronized double getRamDurationTarget() {
    return ramDurationTarget;
  }
}
