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

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qmirror.SyncConstants;
import qmirror.sync.msg.BumpCredit;
import qmirror.sync.msg.Done;
import qmirror.sync.msg.ExitSignal;
import qmirror.sync.msg.PeerDown;
import qmirror.sync.msg.RelayAck;
import qmirror.sync.msg.RelayMessage;
import qmirror.sync.msg.RoundSignal;
import qmirror.sync.msg.SyncComplete;
import qmirror.sync.msg.SyncCompleteOk;
import qmirror.sync.msg.SyncData;
import qmirror.sync.msg.SyncReady;
import qmirror.sync.msg.SyncSignal;
import qmirror.sync.msg.SyncStart;
import qmirror.util.FiberOnly;
import qmirror.util.FiberSupplier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

/**
 * Intermediary between a master and the slaves it is syncing, for the duration of one round. The
 * syncer is linked to the master but keeps its own monitors and credit flow, so the round never
 * disturbs the master's.
 * <p>
 * Interactions ('*' marks repeated signals; credit bumps flow back from the slaves every so often):
 * <pre>
 *   Master               Syncer                    Slave(s)
 *     || -- (prepare) --> ||                          ||
 *     ||                  || -- SyncStart (group) --> ||
 *     ||                  || <----- SyncReady ------- ||
 *     || - RelayMessage*->||                          ||  }
 *     || <--- RelayAck* - ||                          ||  } loop
 *     ||                  || ------ SyncData* ------> ||  }
 *     ||                  || <---- BumpCredit* ------ ||  }
 *     || ---- Done -----> ||                          ||
 *     ||                  || ---- SyncComplete -----> ||
 *     ||               (exits)                        ||
 * </pre>
 * The master is acked as soon as a message arrives; if the syncer is then blocked on credit it holds
 * that one message, and leaves later master signals unacked, until enough slaves have granted credit
 * or gone away.
 */
public class Syncer {
  enum State {
    AWAITING_READY,
    RELAYING,
    FINISHED,
  }

  private static class Participant {
    final SyncEndpoint slave;
    final MonitorRef monitorRef;
    boolean ready = false;

    Participant(SyncEndpoint slave, MonitorRef monitorRef) {
      this.slave = slave;
      this.monitorRef = monitorRef;
    }
  }

  private final SyncRef ref;
  private final SyncEndpoint master;
  private final List<SyncEndpoint> candidates;
  private final GroupMulticast groupMulticast;
  private final Fiber fiber;
  private final SyncEndpoint endpoint;
  private final CreditFlow creditFlow;
  private final Logger logger;

  private final List<Participant> participants = new ArrayList<>();
  private final Queue<RoundSignal> fromMaster = new ArrayDeque<>();
  @Nullable
  private RelayMessage awaitingCredit = null;
  private long messagesRelayed = 0;
  private State state = State.AWAITING_READY;

  private volatile List<SyncEndpoint> participantSnapshot = ImmutableList.of();

  /**
   * The syncer's fiber and endpoint are created here but nothing runs until {@link #start()}.
   */
  public Syncer(SyncRef ref,
                SyncEndpoint master,
                List<SyncEndpoint> slaves,
                GroupMulticast groupMulticast,
                CreditSpec creditSpec,
                FiberSupplier fiberSupplier) {
    this.ref = ref;
    this.master = master;
    this.candidates = ImmutableList.copyOf(slaves);
    this.groupMulticast = groupMulticast;
    this.fiber = fiberSupplier.getNewFiber(this::crash);
    this.endpoint = new SyncEndpoint(SyncConstants.SYNCER_FIBER_NAME_PREFIX + master.getName(), fiber, this::onSignal);
    this.creditFlow = new CreditFlow(endpoint, creditSpec);
    this.logger = LoggerFactory.getLogger("(" + getClass().getSimpleName() + " - " + master.getName() + ")");
  }

  public void start() {
    fiber.execute(this::startRound);
    fiber.start();
  }

  public SyncEndpoint getEndpoint() {
    return endpoint;
  }

  public SyncRef getRef() {
    return ref;
  }

  /**
   * The slaves still taking part in the round, in fan-out order.
   */
  public List<SyncEndpoint> getParticipants() {
    return participantSnapshot;
  }

  @Override
  public String toString() {
    return "Syncer{" +
        "ref=" + ref +
        ", endpoint=" + endpoint +
        ", state=" + state +
        ", participants=" + participantSnapshot +
        ", messagesRelayed=" + messagesRelayed +
        '}';
  }

  @FiberOnly
  private void startRound() {
    for (SyncEndpoint slave : candidates) {
      participants.add(new Participant(slave, slave.monitor(endpoint)));
    }
    updateSnapshot();

    // Sent over the group channel rather than directly, so that it reaches each slave only after
    // anything the master already broadcast to it.
    groupMulticast.broadcast(new SyncStart(ref, endpoint, candidates));
    logger.debug("round {} started with candidates {}", ref, candidates);

    startRelayingIfAllReady();
  }

  @FiberOnly
  private void onSignal(SyncSignal signal) {
    if (signal instanceof PeerDown) {
      onPeerDown((PeerDown) signal);

    } else if (signal instanceof BumpCredit) {
      creditFlow.handleBumpMsg((BumpCredit) signal);
      resumeIfUnblocked();

    } else if (signal instanceof SyncReady) {
      onReady((SyncReady) signal);

    } else if (signal instanceof RelayMessage || signal instanceof Done) {
      onMasterSignal((RoundSignal) signal);

    } else if (signal instanceof ExitSignal) {
      ExitSignal exit = (ExitSignal) signal;
      logger.warn("exit signal from {} during round {}: {}", exit.from, ref, exit.reason);
      terminate(exit.reason);

    } else if (signal instanceof SyncCompleteOk) {
      logger.debug("slave {} confirmed completion", ((SyncCompleteOk) signal).slave);

    } else {
      logger.debug("ignoring unexpected signal {}", signal);
    }
  }

  @FiberOnly
  private void onReady(SyncReady ready) {
    if (!ready.isFor(ref)) {
      logger.debug("ignoring {} from another round", ready);
      return;
    }

    Participant participant = findParticipant(ready.slave);
    if (participant == null || state != State.AWAITING_READY) {
      logger.debug("ignoring {}", ready);
      return;
    }

    participant.ready = true;
    startRelayingIfAllReady();
  }

  @FiberOnly
  private void onPeerDown(PeerDown down) {
    Participant participant = null;
    for (Participant p : participants) {
      if (p.monitorRef == down.monitorRef) {
        participant = p;
        break;
      }
    }

    if (participant == null) {
      logger.debug("ignoring {}", down);
      return;
    }

    participants.remove(participant);
    creditFlow.peerDown(participant.slave);
    updateSnapshot();
    logger.info("slave {} went away during round {} ({}); {} slaves remain",
        participant.slave, ref, down.reason, participants.size());

    if (state == State.AWAITING_READY) {
      startRelayingIfAllReady();
    } else {
      resumeIfUnblocked();
    }
  }

  @FiberOnly
  private void onMasterSignal(RoundSignal signal) {
    if (!signal.isFor(ref)) {
      logger.warn("ignoring {} from another round", signal);
      return;
    }

    fromMaster.add(signal);
    processMasterSignals();
  }

  @FiberOnly
  private void startRelayingIfAllReady() {
    if (state != State.AWAITING_READY) {
      return;
    }

    for (Participant p : participants) {
      if (!p.ready) {
        return;
      }
    }

    state = State.RELAYING;
    logger.debug("all {} remaining slaves are ready for round {}", participants.size(), ref);
    processMasterSignals();
  }

  @FiberOnly
  private void processMasterSignals() {
    while (state == State.RELAYING && awaitingCredit == null && !fromMaster.isEmpty()) {
      RoundSignal signal = fromMaster.poll();
      if (signal instanceof RelayMessage) {
        relay((RelayMessage) signal);
      } else {
        finish();
      }
    }
  }

  @FiberOnly
  private void relay(RelayMessage message) {
    master.send(new RelayAck(ref));

    if (creditFlow.blocked()) {
      logger.trace("blocked on credit; holding {}", message);
      awaitingCredit = message;
    } else {
      fanOut(message);
    }
  }

  @FiberOnly
  private void resumeIfUnblocked() {
    if (state != State.RELAYING || awaitingCredit == null || creditFlow.blocked()) {
      return;
    }

    RelayMessage message = awaitingCredit;
    awaitingCredit = null;
    fanOut(message);
    processMasterSignals();
  }

  @FiberOnly
  private void fanOut(RelayMessage message) {
    for (Participant p : participants) {
      creditFlow.send(p.slave);
      p.slave.send(new SyncData(ref, message.message, message.properties));
    }
    messagesRelayed++;
  }

  @FiberOnly
  private void finish() {
    for (Participant p : participants) {
      p.slave.send(new SyncComplete(ref));
    }
    endpoint.unlink(master);
    logger.info("round {} finished: relayed {} messages to {}", ref, messagesRelayed, participantSnapshot);
    terminate(ExitReason.NORMAL);
  }

  private void crash(Throwable throwable) {
    logger.error("syncer failed during round {}", ref, throwable);
    terminate(ExitReason.crashed(throwable));
  }

  private void terminate(ExitReason reason) {
    state = State.FINISHED;
    endpoint.terminate(reason);
    fiber.dispose();
  }

  @Nullable
  private Participant findParticipant(SyncEndpoint slave) {
    for (Participant p : participants) {
      if (p.slave == slave) {
        return p;
      }
    }
    return null;
  }

  private void updateSnapshot() {
    List<SyncEndpoint> slaves = new ArrayList<>(participants.size());
    for (Participant p : participants) {
      slaves.add(p.slave);
    }
    participantSnapshot = ImmutableList.copyOf(slaves);
  }
}
