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

import qmirror.sync.ExitReason;
import qmirror.sync.MonitorRef;
import qmirror.sync.SyncEndpoint;

/**
 * Delivered to a watcher when an endpoint it monitors terminates.
 */
public class PeerDown extends SyncSignal {
  public final MonitorRef monitorRef;
  public final SyncEndpoint endpoint;
  public final ExitReason reason;

  public PeerDown(MonitorRef monitorRef, SyncEndpoint endpoint, ExitReason reason) {
    this.monitorRef = monitorRef;
    this.endpoint = endpoint;
    this.reason = reason;
  }

  @Override
  public String toString() {
    return "PeerDown{endpoint=" + endpoint + ", reason=" + reason + '}';
  }
}
