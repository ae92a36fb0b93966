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

import com.google.common.collect.Lists;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import qmirror.interfaces.queue.MessageProperties;
import qmirror.interfaces.queue.QueueMessage;
import qmirror.queue.InRamBackingQueue;
import qmirror.util.ThrowFiberExceptions;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;
import static qmirror.sync.SyncMatchers.aSyncResult;
import static qmirror.sync.SyncMatchers.holdsExactly;
import static qmirror.sync.SyncMatchers.isEmptyStore;

/**
 * Tests of whole sync rounds between a master and several slaves, all in memory.
 */
public class InRamSyncTest {
  private static final String QUEUE_NAME = "orders";
  private static final long QUIET_MILLIS = 200;

  @Rule
  public ThrowFiberExceptions fiberExceptions = new ThrowFiberExceptions();

  private final ScriptedBackingQueue masterQueue = new ScriptedBackingQueue();
  private InRamSyncSim sim;

  @After
  public void disposeSim() {
    if (sim != null) {
      sim.dispose();
    }
  }

  @Test
  public void everySlaveEndsUpWithExactlyTheMastersBacklog() throws Exception {
    List<QueueMessage> backlog = havingMessagesOnTheMaster(3);
    havingASimWithCredit(CreditSpec.DISC_BOUND);
    MirrorSlave slaveA = sim.addSlave("a", new InRamBackingQueue());
    MirrorSlave slaveB = sim.addSlave("b", new InRamBackingQueue());

    assertThat(sim.syncMirrors(slaveA, slaveB), is(equalTo(3L)));

    assertThat(sim.awaitResult(slaveA), is(aSyncResult(SlaveSyncResult.Outcome.COMPLETED, 3)));
    assertThat(sim.awaitResult(slaveB), is(aSyncResult(SlaveSyncResult.Outcome.COMPLETED, 3)));
    assertThat(slaveQueue(slaveA), holdsExactly(backlog));
    assertThat(slaveQueue(slaveB), holdsExactly(backlog));
  }

  @Test
  public void preservesQueueOrderOverALongBacklogWithATightCreditBound() throws Exception {
    List<QueueMessage> backlog = havingMessagesOnTheMaster(500);
    havingASimWithCredit(new CreditSpec(4, 2));
    MirrorSlave slaveA = sim.addSlave("a", new InRamBackingQueue());
    MirrorSlave slaveB = sim.addSlave("b", new InRamBackingQueue());

    assertThat(sim.syncMirrors(slaveA, slaveB), is(equalTo(500L)));

    assertThat(sim.awaitResult(slaveA), is(aSyncResult(SlaveSyncResult.Outcome.COMPLETED, 500)));
    assertThat(sim.awaitResult(slaveB), is(aSyncResult(SlaveSyncResult.Outcome.COMPLETED, 500)));
    assertThat(slaveQueue(slaveA), holdsExactly(backlog));
    assertThat(slaveQueue(slaveB), holdsExactly(backlog));
  }

  @Test
  public void replacesWhateverTheSlaveHeldBeforeTheRound() throws Exception {
    List<QueueMessage> backlog = havingMessagesOnTheMaster(2);
    havingASimWithCredit(CreditSpec.DISC_BOUND);
    InRamBackingQueue staleQueue = new InRamBackingQueue();
    staleQueue.publish(message("stale"), MessageProperties.DEFAULT, false, null);
    MirrorSlave slave = sim.addSlave("a", staleQueue);

    sim.syncMirrors(slave);

    sim.awaitResult(slave);
    assertThat(staleQueue, holdsExactly(backlog));
  }

  @Test
  public void aSlaveDyingMidRoundDoesNotDisturbTheOthers() throws Exception {
    List<QueueMessage> backlog = havingMessagesOnTheMaster(3);
    havingASimWithCredit(CreditSpec.DISC_BOUND);
    MirrorSlave slaveA = sim.addSlave("a", new InRamBackingQueue());
    MirrorSlave slaveB = sim.addSlave("b", new ScriptedBackingQueue()
        .afterPublishing(2, () -> {
          throw new IllegalStateException("slave b lost its disk");
        }));
    SignalProbe observer = new SignalProbe("observer", sim.getFiberSupplier(), fiberExceptions);
    MonitorRef slaveBMonitor = observer.watch(slaveB.getEndpoint());

    assertThat(sim.syncMirrors(slaveA, slaveB), is(equalTo(3L)));

    assertThat(sim.awaitResult(slaveA), is(aSyncResult(SlaveSyncResult.Outcome.COMPLETED, 3)));
    assertThat(slaveQueue(slaveA), holdsExactly(backlog));
    assertThat(observer.awaitDown(slaveBMonitor).isNormal(), is(false));
    assertThat(sim.hasNoResultFor(slaveB, QUIET_MILLIS), is(true));
  }

  @Test
  public void killingTheSyncerFailsEverySlaveAndAbortsTheMaster() throws Exception {
    havingMessagesOnTheMaster(3);
    havingASimWithCredit(CreditSpec.DISC_BOUND);
    MirrorSlave slaveA = sim.addSlave("a", new InRamBackingQueue());
    MirrorSlave slaveB = sim.addSlave("b", new InRamBackingQueue());

    SyncRef ref = SyncRef.newRef();
    Syncer syncer = sim.getDriver().prepare(ref, InRamSyncSim.endpointsOf(slaveA, slaveB));
    masterQueue.beforeVisiting(3, () -> syncer.getEndpoint().terminate(ExitReason.abnormal("killed")));

    try {
      sim.getDriver().run(syncer, ref, QUEUE_NAME, masterQueue);
      fail("expected the round to be aborted");
    } catch (SyncAbortedException e) {
      assertThat(e.getReason(), is(equalTo(ExitReason.abnormal("killed"))));
    }

    assertThat(sim.awaitResult(slaveA), is(aSyncResult(SlaveSyncResult.Outcome.FAILED)));
    assertThat(sim.awaitResult(slaveB), is(aSyncResult(SlaveSyncResult.Outcome.FAILED)));
    assertThat(slaveQueue(slaveA), is(isEmptyStore()));
    assertThat(slaveQueue(slaveB), is(isEmptyStore()));
    assertThat(masterQueue.len(), is(equalTo(3)));
  }

  @Test
  public void aSlaveToldToExitMidRoundStopsWhileTheOthersComplete() throws Exception {
    List<QueueMessage> backlog = havingMessagesOnTheMaster(3);
    havingASimWithCredit(CreditSpec.DISC_BOUND);
    MirrorSlave slaveA = sim.addSlave("a", new InRamBackingQueue());
    MirrorSlave slaveB = sim.addSlave("b", new InRamBackingQueue());
    // The first message has been acked, so every slave has joined the round by now
    masterQueue.beforeVisiting(2, () -> slaveB.getEndpoint().signalExit(null, ExitReason.SHUTDOWN));

    assertThat(sim.syncMirrors(slaveA, slaveB), is(equalTo(3L)));

    assertThat(sim.awaitResult(slaveA), is(aSyncResult(SlaveSyncResult.Outcome.COMPLETED, 3)));
    assertThat(slaveQueue(slaveA), holdsExactly(backlog));
    SlaveSyncResult stopped = sim.awaitResult(slaveB);
    assertThat(stopped, is(aSyncResult(SlaveSyncResult.Outcome.STOPPED)));
    assertThat(stopped.reason, is(equalTo(ExitReason.SHUTDOWN)));
  }

  @Test
  public void aGroupMemberNotNamedInTheRoundKeepsItsStore() throws Exception {
    havingMessagesOnTheMaster(2);
    havingASimWithCredit(CreditSpec.DISC_BOUND);
    MirrorSlave slaveA = sim.addSlave("a", new InRamBackingQueue());
    InRamBackingQueue bystanderQueue = new InRamBackingQueue();
    bystanderQueue.publish(message("kept"), MessageProperties.DEFAULT, false, null);
    MirrorSlave bystander = sim.addSlave("c", bystanderQueue);

    sim.syncMirrors(slaveA);

    sim.awaitResult(slaveA);
    assertThat(sim.hasNoResultFor(bystander, QUIET_MILLIS), is(true));
    assertThat(bystanderQueue, holdsExactly(Lists.newArrayList(message("kept"))));
  }

  @Test
  public void aSlaveCanBeSyncedAgainInALaterRound() throws Exception {
    havingMessagesOnTheMaster(2);
    havingASimWithCredit(CreditSpec.DISC_BOUND);
    MirrorSlave slave = sim.addSlave("a", new InRamBackingQueue());

    sim.syncMirrors(slave);
    sim.awaitResult(slave);
    masterQueue.publish(message("m3"), MessageProperties.DEFAULT, false, null);
    sim.syncMirrors(slave);

    assertThat(sim.awaitResult(slave), is(aSyncResult(SlaveSyncResult.Outcome.COMPLETED, 3)));
    assertThat(slaveQueue(slave), holdsExactly(masterQueue.getMessages()));
  }

  @Test
  public void aRoundWithNoSlavesStreamsNothing() throws Exception {
    havingMessagesOnTheMaster(2);
    havingASimWithCredit(CreditSpec.DISC_BOUND);

    assertThat(sim.syncMirrors(), is(equalTo(0L)));
  }

  private void havingASimWithCredit(CreditSpec creditSpec) {
    sim = new InRamSyncSim(QUEUE_NAME, masterQueue, creditSpec, fiberExceptions);
  }

  private List<QueueMessage> havingMessagesOnTheMaster(int count) {
    List<QueueMessage> backlog = Lists.newArrayList();
    for (int i = 1; i <= count; i++) {
      QueueMessage message = message("m" + i);
      masterQueue.publish(message, new MessageProperties(MessageProperties.NO_EXPIRY, true, true), false, "pub");
      backlog.add(message);
    }
    return backlog;
  }

  private static InRamBackingQueue slaveQueue(MirrorSlave slave) {
    return (InRamBackingQueue) slave.getBackingQueue();
  }

  private static QueueMessage message(String id) {
    return new QueueMessage(id, ByteBuffer.wrap(id.getBytes(StandardCharsets.UTF_8)));
  }
}
