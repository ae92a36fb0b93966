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

import com.google.common.collect.ImmutableList;
import qmirror.sync.SyncEndpoint;
import qmirror.sync.SyncRef;

import java.util.List;

/**
 * Broadcast by a syncer over the ordered group channel to announce a round. Only the listed slaves
 * take part.
 */
public class SyncStart extends RoundSignal {
  public final SyncEndpoint syncer;
  public final List<SyncEndpoint> slaves;

  public SyncStart(SyncRef ref, SyncEndpoint syncer, List<SyncEndpoint> slaves) {
    super(ref);
    this.syncer = syncer;
    this.slaves = ImmutableList.copyOf(slaves);
  }

  public boolean includes(SyncEndpoint slave) {
    return slaves.contains(slave);
  }

  @Override
  public String toString() {
    return "SyncStart{" +
        "ref=" + ref +
        ", syncer=" + syncer +
        ", slaves=" + slaves +
        '}';
  }
}
