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

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import org.jetlang.channels.Channel;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.channels.Subscriber;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qmirror.interfaces.queue.BackingQueue;
import qmirror.sync.msg.BumpCredit;
import qmirror.sync.msg.ExitSignal;
import qmirror.sync.msg.SetRamDurationTarget;
import qmirror.sync.msg.SyncSignal;
import qmirror.sync.msg.SyncStart;
import qmirror.sync.msg.UpdateRamDuration;
import qmirror.util.FiberOnly;
import qmirror.util.FiberSupplier;

/**
 * A slave replica of one queue: the host process that owns the slave's store, credit flow and
 * endpoint, and that hands over to a {@link SlaveReceiver} whenever a sync round it takes part in
 * starts.
 */
public class MirrorSlave {
  private final BackingQueue backingQueue;
  private final RamDurationUpdater ramDurationUpdater;
  private final Fiber fiber;
  private final SyncEndpoint endpoint;
  private final CreditFlow creditFlow;
  private final Logger logger;

  private final Channel<SlaveSyncResult> syncResultChannel = new MemoryChannel<>();

  public MirrorSlave(String name,
                     BackingQueue backingQueue,
                     FiberSupplier fiberSupplier,
                     CreditSpec creditSpec,
                     RamDurationUpdater ramDurationUpdater) {
    this.backingQueue = backingQueue;
    this.ramDurationUpdater = ramDurationUpdater;
    this.logger = LoggerFactory.getLogger("(" + getClass().getSimpleName() + " - " + name + ")");
    this.fiber = fiberSupplier.getNewFiber(this::failSlave);
    this.endpoint = new SyncEndpoint(name, fiber, this::onSignal);
    this.creditFlow = new CreditFlow(endpoint, creditSpec);
  }

  public void start() {
    fiber.start();
  }

  public void dispose() {
    endpoint.terminate(ExitReason.SHUTDOWN);
    fiber.dispose();
  }

  public SyncEndpoint getEndpoint() {
    return endpoint;
  }

  public BackingQueue getBackingQueue() {
    return backingQueue;
  }

  /**
   * The outcome of every sync round this slave takes part in.
   */
  public Subscriber<SlaveSyncResult> getSyncResultChannel() {
    return syncResultChannel;
  }

  @FiberOnly
  private void onSignal(SyncSignal signal) {
    if (signal instanceof SyncStart) {
      SyncStart start = (SyncStart) signal;
      if (start.includes(endpoint)) {
        joinRound(start);
      } else {
        logger.debug("{} not part of round {}", endpoint, start.ref);
      }

    } else if (signal instanceof BumpCredit) {
      creditFlow.handleBumpMsg((BumpCredit) signal);

    } else if (signal instanceof SetRamDurationTarget) {
      backingQueue.setRamDurationTarget(((SetRamDurationTarget) signal).durationSeconds);

    } else if (signal instanceof UpdateRamDuration) {
      ramDurationUpdater.updateRamDuration(backingQueue);

    } else if (signal instanceof ExitSignal) {
      ExitSignal exit = (ExitSignal) signal;
      logger.info("{} told to exit by {}: {}", endpoint, exit.from, exit.reason);
      stop(exit.reason);

    } else {
      logger.debug("{} ignoring {}", endpoint, signal);
    }
  }

  @FiberOnly
  private void joinRound(SyncStart start) {
    SlaveReceiver receiver = new SlaveReceiver(endpoint, backingQueue, creditFlow, ramDurationUpdater);
    ListenableFuture<SlaveSyncResult> result = receiver.sync(start.ref, start.syncer);

    // The receiver completes the future on this fiber, so a direct callback runs before the slave
    // handles anything else in its inbox.
    Futures.addCallback(result, new FutureCallback<SlaveSyncResult>() {
      @Override
      public void onSuccess(SlaveSyncResult syncResult) {
        syncResultChannel.publish(syncResult);
        if (syncResult.outcome == SlaveSyncResult.Outcome.STOPPED) {
          stop(syncResult.reason == null ? ExitReason.SHUTDOWN : syncResult.reason);
        }
      }

      @Override
      public void onFailure(Throwable t) {
        failSlave(t);
      }
    }, MoreExecutors.directExecutor());
  }

  private void stop(ExitReason reason) {
    endpoint.terminate(reason);
    fiber.dispose();
  }

  private void failSlave(Throwable throwable) {
    logger.error("{} failed", endpoint, throwable);
    stop(ExitReason.crashed(throwable));
  }
}
