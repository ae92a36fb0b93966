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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qmirror.interfaces.queue.BackingQueue;

import java.util.List;

/**
 * The master replica of one queue, as far as syncing is concerned: it owns the authoritative store
 * and runs sync rounds for its slaves on demand.
 */
public class MirrorMaster {
  private final String queueName;
  private final BackingQueue backingQueue;
  private final MasterDriver driver;
  private final Logger logger;

  public MirrorMaster(String queueName, BackingQueue backingQueue, MasterDriver driver) {
    this.queueName = queueName;
    this.backingQueue = backingQueue;
    this.driver = driver;
    this.logger = LoggerFactory.getLogger("(" + getClass().getSimpleName() + " - " + queueName + ")");
  }

  public BackingQueue getBackingQueue() {
    return backingQueue;
  }

  public MasterDriver getDriver() {
    return driver;
  }

  /**
   * Run one sync round for the given slaves, blocking until it is over.
   *
   * @return the number of messages streamed.
   * @throws SyncAbortedException if the round had to be abandoned.
   */
  public long syncMirrors(List<SyncEndpoint> slaves) throws SyncAbortedException {
    if (slaves.isEmpty()) {
      logger.info("Synchronising {}: no slaves to sync", queueName);
      return 0;
    }

    SyncRef ref = SyncRef.newRef();
    Syncer syncer = driver.prepare(ref, slaves);
    return driver.run(syncer, ref, queueName, backingQueue);
  }
}
