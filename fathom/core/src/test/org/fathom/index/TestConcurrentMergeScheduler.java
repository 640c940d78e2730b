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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.fathom.index.MergePolicy.OneMerge;
import org.fathom.store.Directory;
import org.fathom.util.FathomTestCase;
import org.fathom.util.InfoStream;
import org.fathom.util.StringHelper;

public class TestConcurrentMergeScheduler extends FathomTestCase {

  /** Hands out queued merges and records the threads that ran them. */
  private static class QueueMergeSource implements MergeScheduler.MergeSource {
    final Deque<OneMerge> pending = new ArrayDeque<>();
    final List<String> threads = Collections.synchronizedList(new ArrayList<>());
    final List<OneMerge> finished = Collections.synchronizedList(new ArrayList<>());
    OneMerge failing;
    CountDownLatch gate;

    @Override
    public synchronized OneMerge getNextMerge() {
      return pending.pollFirst();
    }

    @Override
    public void onMergeFinished(OneMerge merge) {
      finished.add(merge);
    }

    @Override
    public synchronized boolean hasPendingMerges() {
      return pending.isEmpty() == false;
    }

    @Override
    public void merge(OneMerge merge) throws IOException {
      if (gate != null) {
        try {
          gate.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          throw new IOException(e);
        }
      }
      if (merge == failing) {
        throw new IOException("merge failed");
      }
      threads.add(Thread.currentThread().getName());
    }
  }

  private static OneMerge newMerge(Directory dir, String name) {
    final SegmentInfo si = new SegmentInfo(dir, name, 1, Collections.<String,String>emptyMap(), StringHelper.randomId());
    return new OneMerge(Collections.singletonList(new SegmentCommitInfo(si, 0, -1, StringHelper.randomId())));
  }

  public void testMergesRunOnPoolThreads() throws Exception {
    try (Directory dir = newDirectory()) {
      final ConcurrentMergeScheduler cms = new ConcurrentMergeScheduler();
      cms.setMaxMergesAndThreads(10, 2);
      cms.initialize(InfoStream.NO_OUTPUT);
      final QueueMergeSource source = new QueueMergeSource();
      final int numMerges = atLeast(5);
      for (int i = 0; i < numMerges; i++) {
        source.pending.add(newMerge(dir, "_" + i));
      }
      cms.merge(source, MergeTrigger.COMMIT);
      cms.sync();
      assertEquals(0, cms.mergesInFlight());
      assertEquals(numMerges, source.threads.size());
      for (String name : source.threads) {
        assertTrue(name, name.startsWith("fathom-merge-"));
      }
      cms.close();
    }
  }

  public void testFailedMergeDoesNotStopOthers() throws Exception {
    try (Directory dir = newDirectory()) {
      final ConcurrentMergeScheduler cms = new ConcurrentMergeScheduler().setMaxThreadCount(1);
      cms.initialize(InfoStream.NO_OUTPUT);
      final QueueMergeSource source = new QueueMergeSource();
      source.failing = newMerge(dir, "_0");
      source.pending.add(source.failing);
      source.pending.add(newMerge(dir, "_1"));
      cms.merge(source, MergeTrigger.COMMIT);
      cms.sync();
      assertEquals(1, source.threads.size());
      assertEquals(0, cms.mergesInFlight());
      cms.close();
    }
  }

  public void testSyncWaitsForRunningMerges() throws Exception {
    try (Directory dir = newDirectory()) {
      final ConcurrentMergeScheduler cms = new ConcurrentMergeScheduler();
      cms.setMaxMergesAndThreads(3, 1);
      cms.initialize(InfoStream.NO_OUTPUT);
      final QueueMergeSource source = new QueueMergeSource();
      source.gate = new CountDownLatch(1);
      source.pending.add(newMerge(dir, "_0"));
      source.pending.add(newMerge(dir, "_1"));
      cms.merge(source, MergeTrigger.SEGMENT_FLUSH);
      assertEquals(2, cms.mergesInFlight());
      assertTrue(source.threads.isEmpty());

      source.gate.countDown();
      cms.sync();
      assertEquals(2, source.threads.size());
      cms.close();
    }
  }

  public void testIllegalSettings() {
    final ConcurrentMergeScheduler cms = new ConcurrentMergeScheduler();
    assertThrows(IllegalArgumentException.class, () -> cms.setMaxMergesAndThreads(2, 3));
    assertThrows(IllegalArgumentException.class, () -> cms.setMaxMergesAndThreads(0, 0));
    assertThrows(IllegalArgumentException.class, () -> cms.setMaxThreadCount(0));
    cms.setMaxThreadCount(2);
    assertEquals(2, cms.getMaxThreadCount());
    assertEquals(7, cms.getMaxMergeCount());
  }
}
