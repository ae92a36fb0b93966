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

package qmirror.util;

import org.jetlang.core.BatchExecutor;
import org.jetlang.core.EventReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * BatchExecutor that treats an uncaught Throwable as the death of the fiber's owner. The first task
 * in a batch that throws hands its Throwable to the handler; the remaining tasks of that batch are not
 * run, and neither is any task of a later batch. Once a fiber using this executor has failed it stays
 * silent, the way a crashed process no longer consumes its inbox.
 * <p>
 * The handler executes in the context of the failed fiber, so it can take remedial action at once;
 * for instance, terminating the owner's endpoint so that its monitors and links fire.
 */
public class TerminatingBatchExecutor implements BatchExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(TerminatingBatchExecutor.class);

  private final Consumer<Throwable> handler;
  private volatile boolean failed = false;

  public TerminatingBatchExecutor(Consumer<Throwable> handler) {
    this.handler = handler;
  }

  @Override
  public void execute(EventReader toExecute) {
    for (int i = 0; i < toExecute.size(); i++) {
      if (failed) {
        LOG.debug("dropping {} tasks queued behind a failure", toExecute.size() - i);
        return;
      }

      try {
        toExecute.get(i).run();
      } catch (Throwable throwable) {
        failed = true;
        handler.accept(throwable);
      }
    }
  }

  public boolean hasFailed() {
    return failed;
  }
}
