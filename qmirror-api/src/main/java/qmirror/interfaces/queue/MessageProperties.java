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

import java.util.Objects;

/**
 * Delivery properties that travel with a queue message.
 */
public final class MessageProperties {
  public static final long NO_EXPIRY = -1;

  public static final MessageProperties DEFAULT = new MessageProperties(NO_EXPIRY, false, false);

  /**
   * Absolute expiry time in milliseconds, or {@link #NO_EXPIRY}.
   */
  public final long expiry;

  /**
   * True if the publisher asked for a confirm once the message is safely enqueued.
   */
  public final boolean needsConfirming;

  public final boolean persistent;

  public MessageProperties(long expiry, boolean needsConfirming, boolean persistent) {
    this.expiry = expiry;
    this.needsConfirming = needsConfirming;
    this.persistent = persistent;
  }

  public MessageProperties withNeedsConfirming(boolean needsConfirming) {
    if (needsConfirming == this.needsConfirming) {
      return this;
    }
    return new MessageProperties(expiry, needsConfirming, persistent);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MessageProperties that = (MessageProperties) o;
    return expiry == that.expiry
        && needsConfirming == that.needsConfirming
        && persistent == that.persistent;
  }

  @Override
  public int hashCode() {
    return Objects.hash(expiry, needsConfirming, persistent);
  }

  @Override
  public String toString() {
    return "MessageProperties{" +
        "expiry=" + expiry +
        ", needsConfirming=" + needsConfirming +
        ", persistent=" + persistent +
        '}';
  }
}
