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

import qmirror.sync.msg.SyncSignal;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Group channel over in-process endpoints. Broadcasts are serialized, so every member sees them in
 * the same order.
 */
public class InRamGroupMulticast implements GroupMulticast {
  private final List<SyncEndpoint> members = new CopyOnWriteArrayList<>();

  public void addMember(SyncEndpoint member) {
    members.add(member);
  }

  public void removeMember(SyncEndpoint member) {
    members.remove(member);
  }

  public List<SyncEndpoint> getMembers() {
    return members;
  }

  @Override
  public synchronized void broadcast(SyncSignal signal) {
    for (SyncEndpoint member : members) {
      member.send(signal);
    }
  }
}
