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

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.jetlang.core.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qmirror.interfaces.queue.BackingQueue;
import qmirror.sync.msg.BumpCredit;
import qmirror.sync.msg.ExitSignal;
import qmirror.sync.msg.PeerDown;
import qmirror.sync.msg.SetRamDurationTarget;
import qmirror.sync.msg.SyncComplete;
import qmirror.sync.msg.SyncCompleteOk;
import qmirror.sync.msg.SyncData;
import qmirror.sync.msg.SyncReady;
import qmirror.sync.msg.SyncSignal;
import qmirror.sync.msg.UpdateRamDuration;
import qmirror.util.FiberOnly;

import java.util.ArrayList;
import java.util.List;

/**
 * The slave's side of one sync round. While the round lasts the receiver takes over its host
 * endpoint's handler; signals unrelated to the round are set aside and handed back to the host, in
 * arrival order, once the round ends.
 * <p>
 * The store is purged before the first message of the round is appended, so that when the round
 * completes it holds exactly the master's backlog. If the syncer goes away the store is purged again
 * and the slave is left empty, to be synced by a later round.
 * <p>
 * A round that ends because the slave was told to exit hands nothing back to the host; the signals
 * set aside during the round are discarded with the slave.
 */
public class SlaveReceiver {
  private final SyncEndpoint self;
  private final BackingQueue backingQueue;
  private final CreditFlow creditFlow;
  private final RamDurationUpdater ramDurationUpdater;
  private final Logger logger;

  private final SettableFuture<SlaveSyncResult> result = SettableFuture.create();
  private final List<SyncSignal> deferred = new ArrayList<>();

  private SyncRef ref;
  private SyncEndpoint syncer;
  private MonitorRef syncerMonitor;
  private Callback<SyncSignal> hostHandler;
  private long messagesReceived = 0;

  public SlaveReceiver(SyncEndpoint self,
                       BackingQueue backingQueue,
                       CreditFlow creditFlow,
                       RamDurationUpdater ramDurationUpdater) {
    this.self = self;
    this.backingQueue = backingQueue;
    this.creditFlow = creditFlow;
    this.ramDurationUpdater = ramDurationUpdater;
    this.logger = LoggerFactory.getLogger("(" + getClass().getSimpleName() + " - " + self.getName() + ")");
  }

  /**
   * Join the round identified by ref. Must be called on the host endpoint's fiber, from within its
   * handler, and only once per receiver.
   *
   * @return a future set, on the host's fiber, once the round is over for this slave.
   */
  @FiberOnly
  public ListenableFuture<SlaveSyncResult> sync(SyncRef ref, SyncEndpoint syncer) {
    Preconditions.checkState(this.ref == null, "receiver already used for round %s", this.ref);

    this.ref = ref;
    this.syncer = syncer;
    this.syncerMonitor = syncer.monitor(self);

    syncer.send(new SyncReady(ref, self));
    int purged = backingQueue.purge();
    logger.debug("{} joining round {}; purged {} messages", self, ref, purged);

    hostHandler = self.become(this::onSignal);
    return result;
  }

  @FiberOnly
  private void onSignal(SyncSignal signal) {
    if (signal instanceof SyncData && ((SyncData) signal).isFor(ref)) {
      SyncData data = (SyncData) signal;
      creditFlow.ack(syncer);
      backingQueue.publish(data.message, data.properties.withNeedsConfirming(false), true, null);
      messagesReceived++;

    } else if (signal instanceof SyncComplete && ((SyncComplete) signal).isFor(ref)) {
      syncer.send(new SyncCompleteOk(ref, self));
      syncer.demonitor(syncerMonitor);
      creditFlow.peerDown(syncer);
      logger.info("{} completed round {} with {} messages", self, ref, messagesReceived);
      finish(new SlaveSyncResult(SlaveSyncResult.Outcome.COMPLETED, ref, messagesReceived, null));

    } else if (signal instanceof PeerDown && ((PeerDown) signal).monitorRef == syncerMonitor) {
      PeerDown down = (PeerDown) signal;
      int purged = backingQueue.purge();
      creditFlow.peerDown(syncer);
      logger.warn("{} lost syncer {} during round {} ({}); discarded {} partial messages",
          self, syncer, ref, down.reason, purged);
      finish(new SlaveSyncResult(SlaveSyncResult.Outcome.FAILED, ref, messagesReceived, down.reason));

    } else if (signal instanceof BumpCredit) {
      creditFlow.handleBumpMsg((BumpCredit) signal);

    } else if (signal instanceof SetRamDurationTarget) {
      backingQueue.setRamDurationTarget(((SetRamDurationTarget) signal).durationSeconds);

    } else if (signal instanceof UpdateRamDuration) {
      ramDurationUpdater.updateRamDuration(backingQueue);

    } else if (signal instanceof ExitSignal) {
      ExitSignal exit = (ExitSignal) signal;
      syncer.demonitor(syncerMonitor);
      logger.info("{} told to exit by {} during round {}: {}", self, exit.from, ref, exit.reason);
      finish(new SlaveSyncResult(SlaveSyncResult.Outcome.STOPPED, ref, messagesReceived, exit.reason));

    } else {
      logger.trace("{} setting aside {} until round {} is over", self, signal, ref);
      deferred.add(signal);
    }
  }

  @FiberOnly
  private void finish(SlaveSyncResult syncResult) {
    self.become(hostHandler);
    result.set(syncResult);

    if (syncResult.outcome == SlaveSyncResult.Outcome.STOPPED) {
      logger.debug("{} discarding {} set-aside signals", self, deferred.size());
    } else {
      for (SyncSignal signal : deferred) {
        self.deliver(signal);
      }
    }
    deferred.clear();
  }
}
