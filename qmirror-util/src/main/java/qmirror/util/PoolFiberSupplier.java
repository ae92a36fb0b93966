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

import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.PoolFiberFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * FiberSupplier whose fibers share a thread pool. Every fiber gets its own
 * {@link qmirror.util.TerminatingBatchExecutor}, so a failure in one fiber stops only that fiber.
 */
public class PoolFiberSupplier implements FiberSupplier {
  private final ExecutorService executorService;
  private final PoolFiberFactory fiberFactory;

  public PoolFiberSupplier() {
    this(Executors.newCachedThreadPool());
  }

  public PoolFiberSupplier(ExecutorService executorService) {
    this.executorService = executorService;
    this.fiberFactory = new PoolFiberFactory(executorService);
  }

  @Override
  public Fiber getNewFiber(Consumer<Throwable> throwableHandler) {
    return fiberFactory.create(new TerminatingBatchExecutor(throwableHandler));
  }

  /**
   * Disposes the fiber factory and shuts down the thread pool; fibers already handed out stop running.
   */
  public void dispose() {
    fiberFactory.dispose();
    executorService.shutdown();
  }
}
