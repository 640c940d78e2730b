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


import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.fathom.store.Directory;
import org.fathom.util.FathomTestCase;
import org.fathom.util.InfoStream;
import org.fathom.util.StringHelper;

public class TestLogMergePolicy extends FathomTestCase {

  private static class Context implements MergePolicy.MergeContext {
    final Map<SegmentCommitInfo,Integer> deletes = new HashMap<>();
    final Set<SegmentCommitInfo> merging = new HashSet<>();

    @Override
    public int numDeletesToMerge(SegmentCommitInfo info) {
      return numDeletedDocs(info);
    }

    @Override
    public int numDeletedDocs(SegmentCommitInfo info) {
      final Integer count = deletes.get(info);
      return count == null ? 0 : count;
    }

    @Override
    public InfoStream getInfoStream() {
      return InfoStream.NO_OUTPUT;
    }

    @Override
    public Set<SegmentCommitInfo> getMergingSegments() {
      return merging;
    }
  }

  private static SegmentInfos segments(Directory dir, int... maxDocs) {
    final SegmentInfos infos = new SegmentInfos();
    for (int i = 0; i < maxDocs.length; i++) {
      final SegmentInfo si = new SegmentInfo(dir, "_" + i, maxDocs[i], Collections.<String,String>emptyMap(), StringHelper.randomId());
      infos.add(new SegmentCommitInfo(si, 0, -1, StringHelper.randomId()));
    }
    return infos;
  }

  public void testSmallSegmentsMergeInGroupsOfMergeFactor() throws Exception {
    try (Directory dir = newDirectory()) {
      final SegmentInfos infos = segments(dir, 5, 5, 5, 5, 5, 5, 5);
      final LogDocMergePolicy mp = new LogDocMergePolicy().setMinMergeDocs(10);
      mp.setMergeFactor(3);
      final MergePolicy.MergeSpecification spec = mp.findMerges(MergeTrigger.COMMIT, infos, new Context());
      assertNotNull(spec);
      assertEquals(2, spec.merges.size());
      assertEquals(infos.asList().subList(0, 3), spec.merges.get(0).segments);
      assertEquals(infos.asList().subList(3, 6), spec.merges.get(1).segments);
      assertEquals(15, spec.merges.get(0).totalMaxDoc());
    }
  }

  public void testLargeSegmentIsItsOwnTier() throws Exception {
    try (Directory dir = newDirectory()) {
      final SegmentInfos infos = segments(dir, 1000, 10, 10);
      final LogDocMergePolicy mp = new LogDocMergePolicy().setMinMergeDocs(1);
      mp.setMergeFactor(2);
      final MergePolicy.MergeSpecification spec = mp.findMerges(MergeTrigger.COMMIT, infos, new Context());
      assertNotNull(spec);
      assertEquals(1, spec.merges.size());
      assertEquals(Arrays.asList(infos.info(1), infos.info(2)), spec.merges.get(0).segments);
    }
  }

  public void testSegmentsAtMaxMergeDocsAreLeftAlone() throws Exception {
    try (Directory dir = newDirectory()) {
      final SegmentInfos infos = segments(dir, 5, 5, 5);
      final LogDocMergePolicy mp = new LogDocMergePolicy().setMinMergeDocs(10);
      mp.setMergeFactor(3).setMaxMergeDocs(5);
      assertNull(mp.findMerges(MergeTrigger.COMMIT, infos, new Context()));
    }
  }

  public void testSegmentsAlreadyMergingAreSkipped() throws Exception {
    try (Directory dir = newDirectory()) {
      final SegmentInfos infos = segments(dir, 5, 5);
      final LogDocMergePolicy mp = new LogDocMergePolicy().setMinMergeDocs(10);
      mp.setMergeFactor(2);
      final Context context = new Context();
      context.merging.add(infos.info(1));
      assertNull(mp.findMerges(MergeTrigger.COMMIT, infos, context));
    }
  }

  public void testHeavilyDeletedSegmentIsRewrittenAlone() throws Exception {
    try (Directory dir = newDirectory()) {
      final SegmentInfos infos = segments(dir, 10, 100);
      final LogDocMergePolicy mp = new LogDocMergePolicy();
      final Context context = new Context();
      context.deletes.put(infos.info(0), 6);
      context.deletes.put(infos.info(1), 50);
      final MergePolicy.MergeSpecification spec = mp.findMerges(MergeTrigger.COMMIT, infos, context);
      assertNotNull(spec);
      assertEquals(1, spec.merges.size());
      assertEquals(Collections.singletonList(infos.info(0)), spec.merges.get(0).segments);

      mp.setDeletesPctAllowed(100);
      assertNull(mp.findMerges(MergeTrigger.COMMIT, infos, context));
    }
  }

  public void testIllegalSettings() {
    final LogDocMergePolicy mp = new LogDocMergePolicy();
    assertThrows(IllegalArgumentException.class, () -> mp.setMergeFactor(1));
    assertThrows(IllegalArgumentException.class, () -> mp.setDeletesPctAllowed(101));
    assertThrows(IllegalArgumentException.class, () -> mp.setMinMergeDocs(-1));
  }
}
