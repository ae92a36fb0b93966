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

package qmirror.sync;

import org.jetbrains.annotations.Nullable;

/**
 * How a sync round ended for one slave.
 */
public class SlaveSyncResult {
  public enum Outcome {
    /**
     * The slave's store now holds exactly the backlog streamed during the round.
     */
    COMPLETED,
    /**
     * The syncer went away mid-round; the slave purged and must be synced again.
     */
    FAILED,
    /**
     * The slave itself was told to exit; the round was abandoned.
     */
    STOPPED,
  }

  public final Outcome outcome;
  public final SyncRef ref;
  public final long messagesReceived;
  @Nullable
  public final ExitReason reason;

  public SlaveSyncResult(Outcome outcome, SyncRef ref, long messagesReceived, @Nullable ExitReason reason) {
    this.outcome = outcome;
    this.ref = ref;
    this.messagesReceived = messagesReceived;
    this.reason = reason;
  }

  @Override
  public String toString() {
    return "SlaveSyncResult{" +
        "outcome=" + outcome +
        ", ref=" + ref +
        ", messagesReceived=" + messagesReceived +
        ", reason=" + reason +
        '}';
  }
}
