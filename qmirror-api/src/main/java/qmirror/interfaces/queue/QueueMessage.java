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

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * A single message held by a queue: its identity plus an opaque payload. Instances are immutable;
 * the payload is exposed as a read-only view.
 */
public final class QueueMessage {
  private final String messageId;
  private final ByteBuffer payload;

  public QueueMessage(String messageId, ByteBuffer payload) {
    this.messageId = Objects.requireNonNull(messageId, "messageId");
    this.payload = payload.asReadOnlyBuffer();
  }

  public String getMessageId() {
    return messageId;
  }

  public ByteBuffer getPayload() {
    return payload.duplicate();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    QueueMessage that = (QueueMessage) o;
    return messageId.equals(that.messageId)
        && payload.equals(that.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(messageId, payload);
  }

  @Override
  public String toString() {
    return "QueueMessage{" +
        "messageId='" + messageId + '\'' +
        ", payloadSize=" + payload.remaining() +
        '}';
  }
}
