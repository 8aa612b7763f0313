/*
 * Copyright 2016 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.dualbuild.jscomp;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Runs pruning jobs on dedicated threads with a larger stack. */
class CompilerExecutor {
  // We use many recursive algorithms that use O(d) memory in the depth
  // of the tree.
  static final long COMPILER_STACK_SIZE = (1 << 26); // About 64MB

  private final int numThreads;

  CompilerExecutor(int numThreads) {
    checkArgument(numThreads > 0, "numThreads must be positive: %s", numThreads);
    this.numThreads = numThreads;
  }

  /**
   * Deeply nested markup recurses deeply. Rather than increasing the stack size for *every* thread
   * (which is what -Xss does), jobs run on threads created with a larger stack.
   */
  ExecutorService getExecutorService() {
    AtomicInteger threadCount = new AtomicInteger();
    return Executors.newFixedThreadPool(
        numThreads,
        new ThreadFactory() {
          @Override
          public Thread newThread(Runnable r) {
            Thread t =
                new Thread(
                    null, r, "jscompiler-" + threadCount.incrementAndGet(), COMPILER_STACK_SIZE);
            t.setDaemon(true); // Do not prevent the JVM from exiting.
            return t;
          }
        });
  }

  /**
   * Runs every job and returns their results in submission order. Jobs are expected to capture
   * their own failures; anything escaping a job is rethrown here.
   */
  <T> List<T> runAll(List<? extends Callable<T>> jobs) {
    ExecutorService executor = getExecutorService();
    try {
      List<Future<T>> futures = new ArrayList<>();
      for (Callable<T> job : jobs) {
        futures.add(executor.submit(job));
      }
      List<T> results = new ArrayList<>();
      for (Future<T> future : futures) {
        results.add(future.get());
      }
      return results;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    } catch (ExecutionException e) {
      throw new RuntimeException(e.getCause());
    } finally {
      executor.shutdown();
    }
  }
}
