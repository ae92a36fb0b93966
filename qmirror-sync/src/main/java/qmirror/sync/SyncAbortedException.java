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

/**
 * Thrown by the master side of a sync round when the round had to be abandoned, for instance because
 * the syncer died. The queue itself is not necessarily affected; the slaves of the round will have
 * purged and need another round.
 */
public class SyncAbortedException extends Exception {
  private final ExitReason reason;

  public SyncAbortedException(ExitReason reason) {
    super("sync round aborted, shutting down: " + reason, reason.getCause());
    this.reason = reason;
  }

  public SyncAbortedException(String message, Throwable cause) {
    super(message, cause);
    this.reason = ExitReason.crashed(cause);
  }

  public ExitReason getReason() {
    return reason;
  }
}
