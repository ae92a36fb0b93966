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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.google.common.collect.Lists;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.slf4j.LoggerFactory;
import qmirror.interfaces.queue.MessageProperties;
import qmirror.interfaces.queue.QueueMessage;
import qmirror.queue.InRamBackingQueue;
import qmirror.sync.msg.SyncComplete;
import qmirror.sync.msg.SyncData;
import qmirror.sync.msg.SyncReady;
import qmirror.sync.msg.SyncStart;
import qmirror.util.PoolFiberSupplier;
import qmirror.util.ThrowFiberExceptions;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

/**
 * Tests the master driver with a probe standing in for the only slave. The driver blocks the thread
 * that runs the round, so each round runs on a separate thread.
 */
public class MasterDriverTest {
  private static final String QUEUE_NAME = "q1";
  private static final int TIMEOUT = 4; // seconds

  @Rule
  public ThrowFiberExceptions fiberExceptions = new ThrowFiberExceptions();

  private final PoolFiberSupplier fiberSupplier = new PoolFiberSupplier();
  private final ExecutorService roundRunner = Executors.newSingleThreadExecutor();
  private final InRamGroupMulticast group = new InRamGroupMulticast();
  private final SignalProbe slave = new SignalProbe("slave", fiberSupplier, fiberExceptions);
  private final InRamBackingQueue backingQueue = new InRamBackingQueue();

  // Each reading of the clock moves it on by 600ms
  private final ManualSyncClock clock = new ManualSyncClock(600, 1000);
  private final ListAppender<ILoggingEvent> logEvents = new ListAppender<>();

  private final SyncRef ref = SyncRef.newRef();
  private MasterDriver driver;

  @Before
  public void setUpDriverAndLogCapture() {
    group.addMember(slave.endpoint());
    driver = new MasterDriver(QUEUE_NAME, group, fiberSupplier, clock, CreditSpec.DISC_BOUND);

    logEvents.start();
    driverLogger().setLevel(Level.INFO);
    driverLogger().addAppender(logEvents);
  }

  @After
  public void disposeResources() {
    driverLogger().detachAppender(logEvents);
    driver.dispose();
    roundRunner.shutdownNow();
    fiberSupplier.dispose();
  }

  @Test
  public void streamsTheWholeStoreInOrderAndReportsHowManyMessagesWent() throws Exception {
    havingMessagesInTheStore(3);

    Syncer syncer = driver.prepare(ref, Lists.newArrayList(slave.endpoint()));
    Future<Long> streamed = roundRunner.submit(() -> driver.run(syncer, ref, QUEUE_NAME, backingQueue));
    havingJoinedAsSlave();

    assertThat(slave.expect(SyncData.class).message, is(equalTo(message(1))));
    assertThat(slave.expect(SyncData.class).message, is(equalTo(message(2))));
    assertThat(slave.expect(SyncData.class).message, is(equalTo(message(3))));
    slave.expect(SyncComplete.class);
    assertThat(streamed.get(TIMEOUT, TimeUnit.SECONDS), is(equalTo(3L)));
  }

  @Test
  public void sendsDoneStraightAwayWhenTheStoreIsEmpty() throws Exception {
    Syncer syncer = driver.prepare(ref, Lists.newArrayList(slave.endpoint()));
    Future<Long> streamed = roundRunner.submit(() -> driver.run(syncer, ref, QUEUE_NAME, backingQueue));
    havingJoinedAsSlave();

    slave.expect(SyncComplete.class);
    assertThat(streamed.get(TIMEOUT, TimeUnit.SECONDS), is(equalTo(0L)));
  }

  @Test
  public void logsProgressAtMostOncePerInterval() throws Exception {
    havingMessagesInTheStore(5);

    Syncer syncer = driver.prepare(ref, Lists.newArrayList(slave.endpoint()));
    Future<Long> streamed = roundRunner.submit(() -> driver.run(syncer, ref, QUEUE_NAME, backingQueue));
    havingJoinedAsSlave();
    streamed.get(TIMEOUT, TimeUnit.SECONDS);

    assertThat(progressLines(), contains(
        "Synchronising q1: 2 messages",
        "Synchronising q1: 4 messages"));
  }

  @Test
  public void abortsTheRoundIfTheSyncerDies() throws Exception {
    havingMessagesInTheStore(3);

    // The slave never reports ready, so the driver waits for the first ack indefinitely
    Syncer syncer = driver.prepare(ref, Lists.newArrayList(slave.endpoint()));
    Future<Long> streamed = roundRunner.submit(() -> driver.run(syncer, ref, QUEUE_NAME, backingQueue));
    slave.expect(SyncStart.class);

    syncer.getEndpoint().terminate(ExitReason.abnormal("syncer killed"));

    SyncAbortedException aborted = abortOf(streamed);
    assertThat(aborted.getReason(), is(equalTo(ExitReason.abnormal("syncer killed"))));
  }

  @Test
  public void ignoresExitSignalsFromEndpointsOtherThanTheSyncer() throws Exception {
    havingMessagesInTheStore(1);
    SignalProbe bystander = new SignalProbe("bystander", fiberSupplier, fiberExceptions);

    Syncer syncer = driver.prepare(ref, Lists.newArrayList(slave.endpoint()));
    Future<Long> streamed = roundRunner.submit(() -> driver.run(syncer, ref, QUEUE_NAME, backingQueue));
    SyncStart start = slave.expect(SyncStart.class);

    driver.getEndpoint().signalExit(bystander.endpoint(), ExitReason.abnormal("not yours"));
    slave.endpoint().send(new SyncReady(start.ref, slave.endpoint()));

    slave.expect(SyncData.class);
    slave.expect(SyncComplete.class);
    assertThat(streamed.get(TIMEOUT, TimeUnit.SECONDS), is(equalTo(1L)));
  }

  @Test
  public void tellsTheSyncerToExitWhenTheDriverIsInterrupted() throws Exception {
    havingMessagesInTheStore(2);
    SignalProbe observer = new SignalProbe("observer", fiberSupplier, fiberExceptions);

    Syncer syncer = driver.prepare(ref, Lists.newArrayList(slave.endpoint()));
    MonitorRef syncerMonitor = observer.watch(syncer.getEndpoint());
    CountDownLatch running = new CountDownLatch(1);
    Future<Long> streamed = roundRunner.submit(() -> {
      running.countDown();
      return driver.run(syncer, ref, QUEUE_NAME, backingQueue);
    });
    slave.expect(SyncStart.class);
    assertThat(running.await(TIMEOUT, TimeUnit.SECONDS), is(true));

    roundRunner.shutdownNow();

    assertThat(roundRunner.awaitTermination(TIMEOUT, TimeUnit.SECONDS), is(true));
    assertThat(observer.awaitDown(syncerMonitor).isNormal(), is(false));
    assertThat(streamed.isDone(), is(true));
  }

  @Test
  public void theSyncerExitsWithTheDriver() throws Exception {
    SignalProbe observer = new SignalProbe("observer", fiberSupplier, fiberExceptions);
    Syncer syncer = driver.prepare(ref, Lists.newArrayList(slave.endpoint()));
    MonitorRef syncerMonitor = observer.watch(syncer.getEndpoint());
    slave.expect(SyncStart.class);

    driver.dispose();

    assertThat(observer.awaitDown(syncerMonitor), is(equalTo(ExitReason.SHUTDOWN)));
  }

  private void havingJoinedAsSlave() throws Exception {
    SyncStart start = slave.expect(SyncStart.class);
    assertThat(start.ref, is(equalTo(ref)));
    slave.endpoint().send(new SyncReady(start.ref, slave.endpoint()));
  }

  private void havingMessagesInTheStore(int count) {
    for (int i = 1; i <= count; i++) {
      backingQueue.publish(message(i), MessageProperties.DEFAULT, false, null);
    }
  }

  private List<String> progressLines() {
    return logEvents.list.stream()
        .filter((event) -> event.getLevel() == Level.INFO)
        .map(ILoggingEvent::getFormattedMessage)
        .filter((line) -> line.matches("Synchronising q1: \\d+ messages"))
        .collect(Collectors.toList());
  }

  private static SyncAbortedException abortOf(Future<Long> streamed) throws Exception {
    try {
      streamed.get(TIMEOUT, TimeUnit.SECONDS);
    } catch (ExecutionException e) {
      assertThat(e.getCause(), is(instanceOf(SyncAbortedException.class)));
      return (SyncAbortedException) e.getCause();
    }
    throw new AssertionError("expected the round to be aborted");
  }

  private static Logger driverLogger() {
    return (Logger) LoggerFactory.getLogger("(MasterDriver - " + QUEUE_NAME + ")");
  }

  private static QueueMessage message(int n) {
    String id = "m" + n;
    return new QueueMessage(id, ByteBuffer.wrap(id.getBytes(StandardCharsets.UTF_8)));
  }
}
