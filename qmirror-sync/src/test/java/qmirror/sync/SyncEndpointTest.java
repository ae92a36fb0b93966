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

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import qmirror.sync.msg.ExitSignal;
import qmirror.sync.msg.PeerDown;
import qmirror.sync.msg.RelayAck;
import qmirror.util.PoolFiberSupplier;
import qmirror.util.ThrowFiberExceptions;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

public class SyncEndpointTest {
  private static final long QUIET_MILLIS = 150;

  @Rule
  public ThrowFiberExceptions fiberExceptions = new ThrowFiberExceptions();

  private final PoolFiberSupplier fiberSupplier = new PoolFiberSupplier();
  private final SignalProbe watcher = new SignalProbe("watcher", fiberSupplier, fiberExceptions);
  private final SignalProbe target = new SignalProbe("target", fiberSupplier, fiberExceptions);

  private final SyncRef ref = SyncRef.newRef();

  @After
  public void disposeFibers() {
    fiberSupplier.dispose();
  }

  @Test
  public void deliversSignalsFromOneSenderInTheOrderTheyWereSent() throws Exception {
    SyncRef first = SyncRef.newRef();
    SyncRef second = SyncRef.newRef();

    target.endpoint().send(new RelayAck(first));
    target.endpoint().send(new RelayAck(second));

    assertThat(target.expect(RelayAck.class).ref, is(equalTo(first)));
    assertThat(target.expect(RelayAck.class).ref, is(equalTo(second)));
  }

  @Test
  public void notifiesAMonitorWhenTheTargetTerminates() throws Exception {
    MonitorRef monitorRef = target.endpoint().monitor(watcher.endpoint());

    target.endpoint().terminate(ExitReason.abnormal("disk on fire"));

    PeerDown down = watcher.expect(PeerDown.class);
    assertThat(down.monitorRef, is(sameInstance(monitorRef)));
    assertThat(down.endpoint, is(sameInstance(target.endpoint())));
    assertThat(down.reason, is(equalTo(ExitReason.abnormal("disk on fire"))));
  }

  @Test
  public void notifiesAMonitorOfANormalExitToo() throws Exception {
    target.endpoint().monitor(watcher.endpoint());

    target.endpoint().terminate(ExitReason.NORMAL);

    assertThat(watcher.expect(PeerDown.class).reason, is(equalTo(ExitReason.NORMAL)));
  }

  @Test
  public void monitoringAnEndpointThatHasAlreadyTerminatedYieldsNoProcess() throws Exception {
    target.endpoint().terminate(ExitReason.NORMAL);

    MonitorRef monitorRef = target.endpoint().monitor(watcher.endpoint());

    PeerDown down = watcher.expect(PeerDown.class);
    assertThat(down.monitorRef, is(sameInstance(monitorRef)));
    assertThat(down.reason, is(equalTo(ExitReason.NO_PROCESS)));
  }

  @Test
  public void aDemonitoredWatcherIsNotNotified() throws Exception {
    MonitorRef monitorRef = target.endpoint().monitor(watcher.endpoint());
    target.endpoint().demonitor(monitorRef);

    target.endpoint().terminate(ExitReason.SHUTDOWN);

    watcher.expectNothingFor(QUIET_MILLIS);
  }

  @Test
  public void anAbnormalExitIsPropagatedAlongALink() throws Exception {
    target.endpoint().link(watcher.endpoint());

    target.endpoint().terminate(ExitReason.SHUTDOWN);

    ExitSignal exit = watcher.expect(ExitSignal.class);
    assertThat(exit.from, is(sameInstance(target.endpoint())));
    assertThat(exit.reason, is(equalTo(ExitReason.SHUTDOWN)));
  }

  @Test
  public void aNormalExitIsNotPropagatedAlongALink() throws Exception {
    target.endpoint().link(watcher.endpoint());

    target.endpoint().terminate(ExitReason.NORMAL);

    watcher.expectNothingFor(QUIET_MILLIS);
  }

  @Test
  public void anUnlinkedEndpointIsNotSignalled() throws Exception {
    watcher.endpoint().link(target.endpoint());
    watcher.endpoint().unlink(target.endpoint());

    target.endpoint().terminate(ExitReason.SHUTDOWN);

    watcher.expectNothingFor(QUIET_MILLIS);
  }

  @Test
  public void linkingToATerminatedEndpointYieldsNoProcess() throws Exception {
    target.endpoint().terminate(ExitReason.NORMAL);

    watcher.endpoint().link(target.endpoint());

    ExitSignal exit = watcher.expect(ExitSignal.class);
    assertThat(exit.from, is(sameInstance(target.endpoint())));
    assertThat(exit.reason, is(equalTo(ExitReason.NO_PROCESS)));
  }

  @Test
  public void signalsSentToATerminatedEndpointAreDropped() throws Exception {
    target.endpoint().terminate(ExitReason.NORMAL);

    target.endpoint().send(new RelayAck(ref));

    target.expectNothingFor(QUIET_MILLIS);
    assertThat(target.endpoint().isAlive(), is(false));
  }

  @Test
  public void onlyTheFirstTerminationCounts() throws Exception {
    target.endpoint().monitor(watcher.endpoint());

    target.endpoint().terminate(ExitReason.NORMAL);
    target.endpoint().terminate(ExitReason.SHUTDOWN);

    assertThat(target.endpoint().getExitReason(), is(equalTo(ExitReason.NORMAL)));
    watcher.expect(PeerDown.class);
    watcher.expectNothingFor(QUIET_MILLIS);
  }

  @Test
  public void aLiveEndpointHasNoExitReason() throws Exception {
    assertThat(target.endpoint().getExitReason(), is(nullValue()));
  }
}
