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

package qmirror;

public class SyncConstants {
  /**
   * Minimum wall-clock time between two progress lines logged by a master during a sync round.
   */
  public static final long SYNC_PROGRESS_INTERVAL_MILLISECONDS = 1000;

  /**
   * Credit bound for sync traffic to a slave: the number of messages a sender may have outstanding
   * to one peer, and how many messages the peer consumes before granting that many back.
   */
  public static final int SYNC_CREDIT_INITIAL = 2000;
  public static final int SYNC_CREDIT_MORE_AFTER = 500;

  public static final String SYNCER_FIBER_NAME_PREFIX = "syncer-";
  public static final String MASTER_ENDPOINT_NAME_PREFIX = "sync-master-";
}
