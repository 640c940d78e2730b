/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.fathom.index;


import java.io.IOException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.fathom.index.MergePolicy.OneMerge;
import org.fathom.util.NamedThreadFactory;
import org.fathom.util.ThreadInterruptedException;

/**
 * A {@link MergeScheduler} that runs merges on a pool of background threads.
 *
 * <p>Merges start as soon as a flush makes them eligible while the writer
 * keeps buffering documents. At most {@link #getMaxThreadCount()} merges
 * run at once; once {@link #getMaxMergeCount()} are queued or running, the
 * thread asking for more waits. {@link IndexWriter#commit()} waits for every
 * merge before it publishes a generation.</p>
 */
public class ConcurrentMergeScheduler extends MergeScheduler {

  private int maxThreadCount;
  private int maxMergeCount;
  private ThreadPoolExecutor executor;

  // submitted and not yet finished
  private int inFlight;
  private final Set<Thread> mergeThreads = new HashSet<>();

  /** Creates a scheduler sized from the number of available processors. */
  public ConcurrentMergeScheduler() {
    maxThreadCount = Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors() / 2));
    maxMergeCount = maxThreadCount + 5;
  }

  /**
   * Sets how many merges may be queued or running before callers wait, and
   * how many of them run at once.
   * @param maxMergeCount merges in flight before {@link #merge} blocks
   * @param maxThreadCount merges running at once; at most {@code maxMergeCount}
   */
  public synchronized void setMaxMergesAndThreads(int maxMergeCount, int maxThreadCount) {
    if (maxThreadCount < 1) {
      throw new IllegalArgumentException("maxThreadCount should be at least 1");
    }
    if (maxMergeCount < 1) {
      throw new IllegalArgumentException("maxMergeCount should be at least 1");
    }
    if (maxThreadCount > maxMergeCount) {
      throw new IllegalArgumentException("maxThreadCount should be <= maxMergeCount (= " + maxMergeCount + ")");
    }
    this.maxThreadCount = maxThreadCount;
    this.maxMergeCount = maxMergeCount;
    if (executor != null) {
      // shutting down keeps queued merges; the next merge call builds a pool of the new size
      executor.shutdown();
      executor = null;
    }
  }

  /** Sets the number of merge threads, allowing five more queued merges. */
  public synchronized ConcurrentMergeScheduler setMaxThreadCount(int maxThreadCount) {
    setMaxMergesAndThreads(maxThreadCount + 5, maxThreadCount);
    return this;
  }

  /** @see #setMaxMergesAndThreads */
  public synchronized int getMaxThreadCount() {
    return maxThreadCount;
  }

  /** @see #setMaxMergesAndThreads */
  public synchronized int getMaxMergeCount() {
    return maxMergeCount;
  }

  /** Merges submitted to the pool that have not finished yet. */
  public synchronized int mergesInFlight() {
    return inFlight;
  }

  @Override
  public synchronized void merge(MergeSource mergeSource, MergeTrigger trigger) throws IOException {
    if (verbose()) {
      message("now merge trigger=" + trigger + " inFlight=" + inFlight);
    }
    while (true) {
      if (maybeStall(mergeSource) == false) {
        return;
      }
      final OneMerge merge = mergeSource.getNextMerge();
      if (merge == null) {
        return;
      }
      inFlight++;
      boolean success = false;
      try {
        pool().execute(() -> runMerge(mergeSource, merge));
        success = true;
      } catch (RejectedExecutionException e) {
        throw new IOException("merge scheduler is closed", e);
      } finally {
        if (success == false) {
          inFlight--;
          mergeSource.onMergeFinished(merge);
        }
      }
    }
  }

  /** Waits while too many merges are in flight. Returns false when called
   *  from a merge thread, which must never wait on its own pool. */
  private boolean maybeStall(MergeSource mergeSource) {
    assert Thread.holdsLock(this);
    final long start = System.currentTimeMillis();
    boolean stalled = false;
    while (mergeSource.hasPendingMerges() && inFlight >= maxMergeCount) {
      if (mergeThreads.contains(Thread.currentThread())) {
        return false;
      }
      if (verbose() && stalled == false) {
        message("too many merges; stalling");
      }
      stalled = true;
      try {
        wait(250);
      } catch (InterruptedException ie) {
        throw new ThreadInterruptedException(ie);
      }
    }
    if (stalled && verbose()) {
      message("stalled for " + (System.currentTimeMillis() - start) + " msec");
    }
    return true;
  }

  private ThreadPoolExecutor pool() {
    assert Thread.holdsLock(this);
    if (executor == null) {
      executor = new ThreadPoolExecutor(maxThreadCount, maxThreadCount, 1, TimeUnit.SECONDS,
          new LinkedBlockingQueue<>(), new NamedThreadFactory("merge"));
      executor.allowCoreThreadTimeOut(true);
    }
    return executor;
  }

  private void runMerge(MergeSource mergeSource, OneMerge merge) {
    synchronized (this) {
      mergeThreads.add(Thread.currentThread());
    }
    try {
      mergeSource.merge(merge);
      // the finished merge may have made new ones eligible
      merge(mergeSource, MergeTrigger.MERGE_FINISHED);
    } catch (MergePolicy.MergeAbortedException e) {
      if (verbose()) {
        message("merge aborted: " + merge.segString());
      }
    } catch (Throwable t) {
      // the writer recorded the failure and reports it from commit
      if (verbose()) {
        message("merge failed: " + merge.segString() + " exc=" + t);
      }
    } finally {
      synchronized (this) {
        mergeThreads.remove(Thread.currentThread());
        inFlight--;
        notifyAll();
      }
    }
  }

  /** Waits until every submitted merge has finished. Interrupts are
   *  deferred until then. */
  @Override
  public synchronized void sync() {
    boolean interrupted = false;
    try {
      while (inFlight > 0 && mergeThreads.contains(Thread.currentThread()) == false) {
        try {
          wait();
        } catch (InterruptedException ie) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  @Override
  protected boolean mergeOnFlush() {
    return true;
  }

  @Override
  public synchronized void close() {
    sync();
    if (executor != null) {
      executor.shutdown();
      executor = null;
    }
  }

  @Override
  public synchronized String toString() {
    return getClass().getSimpleName() + ": maxThreadCount=" + maxThreadCount + ", maxMergeCount=" + maxMergeCount;
  }
}
