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

import qmirror.sync.msg.BumpCredit;
import qmirror.util.FiberOnly;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Credit-based flow control between one owner endpoint and its peers. Each endpoint that takes part
 * owns exactly one CreditFlow and uses it only from its own fiber; there is no shared state between
 * different owners.
 * <p>
 * As a sender, the owner calls {@link #send} once for each message sent to a peer. Each call consumes a
 * credit; a peer starts with {@link CreditSpec#initialCredit}. When the credit for a peer runs out the
 * owner is blocked on it, and {@link #blocked()} stays true until the peer grants more credit with a
 * {@link BumpCredit} (see {@link #handleBumpMsg}) or goes away (see {@link #peerDown}).
 * <p>
 * As a receiver, the owner calls {@link #ack} once for each message it consumes from a peer. After every
 * {@link CreditSpec#moreCreditAfter} acks, it grants that much credit back to the peer. A grant is held
 * back while the owner is itself blocked, so that a blocked process passes backpressure upstream; held
 * grants go out as soon as it unblocks.
 */
public class CreditFlow {
  private final SyncEndpoint owner;
  private final CreditSpec spec;

  // Remaining credit for each peer we send to
  private final Map<SyncEndpoint, Integer> creditFrom = new HashMap<>();
  // Acks remaining before we grant more credit to each peer we receive from
  private final Map<SyncEndpoint, Integer> creditTo = new HashMap<>();
  // Sends to each peer not yet matched by credit granted back
  private final Map<SyncEndpoint, Integer> outstanding = new HashMap<>();

  private final Set<SyncEndpoint> blockedOn = new HashSet<>();
  private final List<Runnable> deferredGrants = new ArrayList<>();

  public CreditFlow(SyncEndpoint owner, CreditSpec spec) {
    this.owner = owner;
    this.spec = spec;
  }

  @FiberOnly
  public void send(SyncEndpoint to) {
    final int credit = creditFrom.getOrDefault(to, spec.initialCredit);
    if (credit <= 1) {
      blockedOn.add(to);
      creditFrom.put(to, 0);
    } else {
      creditFrom.put(to, credit - 1);
    }
    outstanding.merge(to, 1, Integer::sum);
  }

  @FiberOnly
  public void ack(SyncEndpoint from) {
    final int remaining = creditTo.getOrDefault(from, spec.moreCreditAfter);
    if (remaining <= 1) {
      grant(from, spec.moreCreditAfter);
      creditTo.put(from, spec.moreCreditAfter);
    } else {
      creditTo.put(from, remaining - 1);
    }
  }

  @FiberOnly
  public void handleBumpMsg(BumpCredit bump) {
    final SyncEndpoint from = bump.from;
    if (!creditFrom.containsKey(from)) {
      // Never sent to, or forgotten by peerDown
      return;
    }
    final int credit = creditFrom.get(from);
    final int newCredit = credit + bump.credit;
    creditFrom.put(from, newCredit);
    outstanding.computeIfPresent(from, (peer, count) -> Math.max(0, count - bump.credit));

    if (credit <= 0 && newCredit > 0) {
      unblock(from);
    }
  }

  @FiberOnly
  public boolean blocked() {
    return !blockedOn.isEmpty();
  }

  @FiberOnly
  public boolean isBlockedOn(SyncEndpoint peer) {
    return blockedOn.contains(peer);
  }

  /**
   * Number of messages sent to the peer that it has not yet granted credit back for.
   */
  @FiberOnly
  public int outstanding(SyncEndpoint peer) {
    return outstanding.getOrDefault(peer, 0);
  }

  /**
   * Forget everything about the peer, including any block on it.
   */
  @FiberOnly
  public void peerDown(SyncEndpoint peer) {
    unblock(peer);
    creditFrom.remove(peer);
    creditTo.remove(peer);
    outstanding.remove(peer);
  }

  private void grant(SyncEndpoint to, int quantity) {
    final BumpCredit bump = new BumpCredit(owner, quantity);
    if (blocked()) {
      deferredGrants.add(() -> to.send(bump));
    } else {
      to.send(bump);
    }
  }

  private void unblock(SyncEndpoint peer) {
    blockedOn.remove(peer);
    if (!blocked() && !deferredGrants.isEmpty()) {
      final List<Runnable> grants = new ArrayList<>(deferredGrants);
      deferredGrants.clear();
      grants.forEach(Runnable::run);
    }
  }
}
