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

package qmirror.interfaces.queue;

import org.jetbrains.annotations.Nullable;

/**
 * The message store underlying a single queue replica. Implementations hold messages in queue order;
 * they are not expected to be safe for concurrent modification, since each replica's store is owned
 * by exactly one process at a time.
 */
public interface BackingQueue {

  /**
   * Visitor applied to each message by {@link BackingQueue#fold}.
   *
   * @param <A> accumulator type
   * @param <E> checked exception the visitor may throw to abandon the fold
   */
  interface FoldFunction<A, E extends Exception> {
    A apply(QueueMessage message, MessageProperties properties, A accumulator) throws E;
  }

  /**
   * Visit every message currently held, in queue order, threading an accumulator through the visits.
   * An exception thrown by the visitor stops the fold and propagates to the caller; the store is left
   * as it was.
   *
   * @return the accumulator returned by the last visit, or {@code initial} if the queue is empty.
   */
  <A, E extends Exception> A fold(FoldFunction<A, E> function, A initial) throws E;

  /**
   * Discard all messages.
   *
   * @return the number of messages discarded.
   */
  int purge();

  /**
   * Append a message at the tail of the queue.
   *
   * @param delivered true if the message must be treated as possibly seen by a consumer already
   * @param publisher identity of the publishing channel, or null if there is none to confirm to
   */
  void publish(QueueMessage message, MessageProperties properties, boolean delivered, @Nullable String publisher);

  /**
   * Tune how many seconds' worth of messages the store should try to keep in memory.
   */
  void setRamDurationTarget(double durationSeconds);

  /**
   * Number of messages currently held.
   */
  int len();
}
