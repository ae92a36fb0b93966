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

import org.jetbrains.annotations.Nullable;
import org.jetlang.channels.Channel;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.core.Callback;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qmirror.sync.msg.ExitSignal;
import qmirror.sync.msg.PeerDown;
import qmirror.sync.msg.SyncSignal;
import qmirror.util.FiberOnly;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The identity and inbox of one participant in the sync protocol; the unit that can be monitored,
 * linked, and killed.
 * <p>
 * Signals sent to an endpoint are queued on its inbox channel and handed, one at a time, to the
 * endpoint's current handler on the endpoint's fiber. Signals from one sender arrive in the order they
 * were sent. Once an endpoint has terminated, signals sent to it are dropped and signals still queued
 * for it are never handled.
 * <p>
 * Termination fires the endpoint's monitors (each watcher receives a {@link PeerDown}) and, unless the
 * reason is normal, its links (each linked endpoint receives an {@link ExitSignal}). Because both are
 * delivered through the receiver's inbox, they arrive after every signal the terminated endpoint sent
 * to that receiver while it was alive.
 * <p>
 * An endpoint does not own its fiber; whoever created the fiber disposes it.
 */
public class SyncEndpoint {
  private static final Logger LOG = LoggerFactory.getLogger(SyncEndpoint.class);
  private static final AtomicLong ID_GEN = new AtomicLong(1);

  private final long id = ID_GEN.getAndIncrement();
  private final String name;
  private final Channel<SyncSignal> inbox = new MemoryChannel<>();

  private volatile Callback<SyncSignal> handler;

  // Guarded by this
  private boolean alive = true;
  private ExitReason exitReason = null;
  private final Map<MonitorRef, SyncEndpoint> monitors = new LinkedHashMap<>();
  private final Set<SyncEndpoint> links = new HashSet<>();

  public SyncEndpoint(String name, Fiber fiber, Callback<SyncSignal> handler) {
    this.name = name;
    this.handler = handler;
    inbox.subscribe(fiber, this::deliver);
  }

  public String getName() {
    return name;
  }

  public void send(SyncSignal signal) {
    if (isAlive()) {
      inbox.publish(signal);
    } else {
      LOG.trace("{} is gone; dropping {}", this, signal);
    }
  }

  /**
   * Replace the handler that receives this endpoint's signals. Intended to be called from the
   * endpoint's own fiber, from within the current handler.
   *
   * @return the handler that was replaced.
   */
  public Callback<SyncSignal> become(Callback<SyncSignal> newHandler) {
    Callback<SyncSignal> previous = handler;
    handler = newHandler;
    return previous;
  }

  /**
   * Ask to be told when this endpoint terminates. If it has already terminated, the watcher receives
   * a PeerDown with reason {@link ExitReason#NO_PROCESS} straight away.
   */
  public MonitorRef monitor(SyncEndpoint watcher) {
    final MonitorRef monitorRef = new MonitorRef(watcher, this);
    synchronized (this) {
      if (alive) {
        monitors.put(monitorRef, watcher);
        return monitorRef;
      }
    }

    watcher.send(new PeerDown(monitorRef, this, ExitReason.NO_PROCESS));
    return monitorRef;
  }

  public synchronized void demonitor(MonitorRef monitorRef) {
    monitors.remove(monitorRef);
  }

  /**
   * Link this endpoint with another, so that either one terminating abnormally sends an ExitSignal to
   * the other. Linking with an endpoint that has already terminated sends this endpoint an ExitSignal
   * with reason {@link ExitReason#NO_PROCESS}.
   */
  public void link(SyncEndpoint other) {
    if (other == this) {
      return;
    }

    final SyncEndpoint first = id < other.id ? this : other;
    final SyncEndpoint second = first == this ? other : this;
    boolean linked = false;

    synchronized (first) {
      synchronized (second) {
        if (first.alive && second.alive) {
          first.links.add(second);
          second.links.add(first);
          linked = true;
        }
      }
    }

    if (!linked && !other.isAlive()) {
      send(new ExitSignal(other, ExitReason.NO_PROCESS));
    }
  }

  public void unlink(SyncEndpoint other) {
    synchronized (this) {
      links.remove(other);
    }
    synchronized (other) {
      other.links.remove(this);
    }
  }

  /**
   * Deliver an ExitSignal to this endpoint; what happens next is up to its handler.
   *
   * @param from the endpoint asking, or null
   */
  public void signalExit(@Nullable SyncEndpoint from, ExitReason reason) {
    send(new ExitSignal(from, reason));
  }

  /**
   * Mark this endpoint as terminated, then notify its monitors and links. Only the first call has
   * any effect.
   */
  public void terminate(ExitReason reason) {
    final List<Map.Entry<MonitorRef, SyncEndpoint>> monitorsToFire;
    final List<SyncEndpoint> linksToFire;

    synchronized (this) {
      if (!alive) {
        return;
      }
      alive = false;
      exitReason = reason;
      monitorsToFire = new ArrayList<>(monitors.entrySet());
      linksToFire = new ArrayList<>(links);
      monitors.clear();
      links.clear();
    }

    LOG.debug("{} terminated: {}", this, reason);

    for (SyncEndpoint linked : linksToFire) {
      synchronized (linked) {
        linked.links.remove(this);
      }
      if (!reason.isNormal()) {
        linked.send(new ExitSignal(this, reason));
      }
    }

    for (Map.Entry<MonitorRef, SyncEndpoint> monitor : monitorsToFire) {
      monitor.getValue().send(new PeerDown(monitor.getKey(), this, reason));
    }
  }

  public synchronized boolean isAlive() {
    return alive;
  }

  /**
   * @return the reason this endpoint terminated with, or null if it is still alive.
   */
  @Nullable
  public synchronized ExitReason getExitReason() {
    return exitReason;
  }

  @Override
  public String toString() {
    return name + "<" + id + ">";
  }

  /**
   * Hand a signal straight to the current handler, bypassing the inbox. Only for use on the
   * endpoint's own fiber, to replay signals that a previous handler set aside.
   */
  @FiberOnly
  void deliver(SyncSignal signal) {
    if (isAlive()) {
      handler.onMessage(signal);
    }
  }
}
