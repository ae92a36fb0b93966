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

import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qmirror.SyncConstants;
import qmirror.interfaces.queue.BackingQueue;
import qmirror.interfaces.queue.MessageProperties;
import qmirror.interfaces.queue.QueueMessage;
import qmirror.sync.msg.Done;
import qmirror.sync.msg.ExitSignal;
import qmirror.sync.msg.RelayAck;
import qmirror.sync.msg.RelayMessage;
import qmirror.sync.msg.SyncSignal;
import qmirror.util.FiberSupplier;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * The master's side of sync rounds for one queue. {@link #prepare} spawns a {@link Syncer} linked to
 * this driver; {@link #run} then streams the master's backlog through it, one message at a time,
 * blocking the calling thread until the syncer has acked each message.
 * <p>
 * Keeping a single message in flight bounds the master's own memory use and lets it notice a dead
 * syncer within one message: the link turns the syncer's death into an exit signal that the blocked
 * {@link #run} observes immediately.
 * <p>
 * {@link #run} must not be called from a fiber the syncer or the slaves depend on.
 */
public class MasterDriver {
  private static final class Progress {
    final long count;
    final long lastLogged;

    Progress(long count, long lastLogged) {
      this.count = count;
      this.lastLogged = lastLogged;
    }
  }

  private final GroupMulticast groupMulticast;
  private final FiberSupplier fiberSupplier;
  private final SyncClock clock;
  private final CreditSpec creditSpec;

  private final Fiber fiber;
  private final SyncEndpoint endpoint;
  private final BlockingQueue<SyncSignal> inbox = new LinkedBlockingQueue<>();
  private final Logger logger;

  public MasterDriver(String queueName,
                      GroupMulticast groupMulticast,
                      FiberSupplier fiberSupplier,
                      SyncClock clock,
                      CreditSpec creditSpec) {
    this.groupMulticast = groupMulticast;
    this.fiberSupplier = fiberSupplier;
    this.clock = clock;
    this.creditSpec = creditSpec;
    this.logger = getNewLogger(queueName);

    this.fiber = fiberSupplier.getNewFiber(this::failDriver);
    this.endpoint = new SyncEndpoint(SyncConstants.MASTER_ENDPOINT_NAME_PREFIX + queueName, fiber, inbox::add);
    fiber.start();
  }

  public SyncEndpoint getEndpoint() {
    return endpoint;
  }

  /**
   * Spawn and start the syncer for a round, linked to this driver.
   *
   * @param ref    token of the new round
   * @param slaves slaves to sync, in fan-out order
   */
  public Syncer prepare(SyncRef ref, List<SyncEndpoint> slaves) {
    Syncer syncer = new Syncer(ref, endpoint, slaves, groupMulticast, creditSpec, fiberSupplier);
    syncer.getEndpoint().link(endpoint);
    syncer.start();
    return syncer;
  }

  /**
   * Stream every message of the backing queue, in queue order, through the syncer, then tell it the
   * round is done.
   *
   * @return the number of messages streamed.
   * @throws SyncAbortedException if the syncer died, or this thread was interrupted, mid-round. The
   *                              syncer is told to exit in that case.
   */
  public long run(Syncer syncer, SyncRef ref, String queueName, BackingQueue backingQueue)
      throws SyncAbortedException {
    final SyncEndpoint syncerEndpoint = syncer.getEndpoint();
    logger.info("Synchronising {}: {} messages to sync", queueName, backingQueue.len());

    try {
      Progress progress = backingQueue.fold(
          (message, properties, soFar) -> send(syncerEndpoint, ref, queueName, soFar, message, properties),
          new Progress(0, clock.currentTimeMillis()));

      syncerEndpoint.send(new Done(ref));
      logger.info("Synchronising {}: all {} messages relayed", queueName, progress.count);
      return progress.count;

    } catch (SyncAbortedException e) {
      logger.warn("Synchronising {}: round aborted: {}", queueName, e.getReason());
      endpoint.unlink(syncerEndpoint);
      syncerEndpoint.signalExit(endpoint, e.getReason());
      throw e;
    }
  }

  /**
   * Terminate this driver. A syncer still linked to it will exit as well.
   */
  public void dispose() {
    endpoint.terminate(ExitReason.SHUTDOWN);
    fiber.dispose();
  }

  private Progress send(SyncEndpoint syncer,
                        SyncRef ref,
                        String queueName,
                        Progress soFar,
                        QueueMessage message,
                        MessageProperties properties) throws SyncAbortedException {
    syncer.send(new RelayMessage(ref, message, properties));
    awaitAck(syncer, ref);

    final long count = soFar.count + 1;
    final long now = clock.currentTimeMillis();
    if (now - soFar.lastLogged > clock.progressLogInterval()) {
      logger.info("Synchronising {}: {} messages", queueName, count);
      return new Progress(count, now);
    }
    return new Progress(count, soFar.lastLogged);
  }

  private void awaitAck(SyncEndpoint syncer, SyncRef ref) throws SyncAbortedException {
    while (true) {
      final SyncSignal signal;
      try {
        signal = inbox.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new SyncAbortedException("interrupted while waiting for the syncer", e);
      }

      if (signal instanceof RelayAck && ((RelayAck) signal).isFor(ref)) {
        return;
      }

      if (signal instanceof ExitSignal) {
        ExitSignal exit = (ExitSignal) signal;
        if (exit.from == null || exit.from == syncer) {
          throw new SyncAbortedException(exit.reason);
        }
      }

      logger.debug("ignoring {} while waiting for the syncer", signal);
    }
  }

  private Logger getNewLogger(String queueName) {
    return LoggerFactory.getLogger("(" + getClass().getSimpleName() + " - " + queueName + ")");
  }

  private void failDriver(Throwable throwable) {
    logger.error("master sync endpoint failed", throwable);
    endpoint.terminate(ExitReason.crashed(throwable));
    fiber.dispose();
  }
}
