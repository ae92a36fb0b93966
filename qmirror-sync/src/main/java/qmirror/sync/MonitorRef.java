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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Handle for one monitor installed by {@link SyncEndpoint#monitor}. A PeerDown signal carries the
 * MonitorRef of the monitor that produced it.
 */
public final class MonitorRef {
  private static final AtomicLong REF_GEN = new AtomicLong(1);

  private final long id = REF_GEN.getAndIncrement();
  public final SyncEndpoint watcher;
  public final SyncEndpoint target;

  MonitorRef(SyncEndpoint watcher, SyncEndpoint target) {
    this.watcher = watcher;
    this.target = target;
  }

  @Override
  public String toString() {
    return "MonitorRef{" +
        "id=" + id +
        ", watcher=" + watcher +
        ", target=" + target +
        '}';
  }
}
