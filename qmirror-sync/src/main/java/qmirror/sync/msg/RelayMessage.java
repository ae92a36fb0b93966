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

package qmirror.sync.msg;

import qmirror.interfaces.queue.MessageProperties;
import qmirror.interfaces.queue.QueueMessage;
import qmirror.sync.SyncRef;

/**
 * One message of the master's backlog, handed from the master to the syncer for fan-out.
 */
public class RelayMessage extends RoundSignal {
  public final QueueMessage message;
  public final MessageProperties properties;

  public RelayMessage(SyncRef ref, QueueMessage message, MessageProperties properties) {
    super(ref);
    this.message = message;
    this.properties = properties;
  }

  @Override
  public String toString() {
    return "RelayMessage{ref=" + ref + ", message=" + message + '}';
  }
}
