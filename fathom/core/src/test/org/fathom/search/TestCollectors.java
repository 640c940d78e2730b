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
package org.fathom.search;


import java.util.concurrent.atomic.AtomicLong;

import org.fathom.index.DirectoryReader;
import org.fathom.index.IndexWriter;
import org.fathom.index.Term;
import org.fathom.store.Directory;
import org.fathom.util.FathomTestCase;
import org.fathom.util.FixedBitSet;

public class TestCollectors extends FathomTestCase {

  private static final int NUM_DOCS = 10;

  /** One segment, so that a leaf switch never consumes a clock tick mid-test. */
  private DirectoryReader index() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(1000));
    for (int i = 0; i < NUM_DOCS; i++) {
      writer.addDocument(newDocument(Integer.toString(i), i % 2 == 0 ? "even all" : "odd all"));
    }
    writer.commit();
    return DirectoryReader.open(dir);
  }

  private static Query all() {
    return new TermQuery(new Term("body", "all"));
  }

  public void testTimeLimit() throws Exception {
    try (DirectoryReader reader = index()) {
      IndexSearcher searcher = new IndexSearcher(reader);
      final AtomicLong clock = new AtomicLong();
      TotalHitCountCollector counter = new TotalHitCountCollector();
      // one tick for the baseline, one for the leaf, then one per hit
      TimeLimitingCollector limited = new TimeLimitingCollector(counter, clock::getAndIncrement, 5);
      assertFalse(searcher.search(all(), limited));
      assertEquals(4, counter.getTotalHits());

      TotalHitCountCollector greedyCounter = new TotalHitCountCollector();
      TimeLimitingCollector greedy = new TimeLimitingCollector(greedyCounter, clock::getAndIncrement, 5);
      greedy.setGreedy(true);
      assertFalse(searcher.search(all(), greedy));
      assertEquals(5, greedyCounter.getTotalHits());
    }
  }

  public void testTimeLimitNotReached() throws Exception {
    try (DirectoryReader reader = index()) {
      IndexSearcher searcher = new IndexSearcher(reader);
      final AtomicLong clock = new AtomicLong();
      TopScoreDocCollector top = TopScoreDocCollector.create(3);
      assertTrue(searcher.search(all(), new TimeLimitingCollector(top, clock::get, 0)));
      TopDocs hits = top.topDocs();
      assertEquals(NUM_DOCS, hits.totalHits);
      assertEquals(3, hits.scoreDocs.length);
      assertThrows(IllegalArgumentException.class, () -> new TimeLimitingCollector(top, clock::get, -1));
    }
  }

  public void testTimeExceededDetails() throws Exception {
    try (DirectoryReader reader = index()) {
      final AtomicLong clock = new AtomicLong();
      TimeLimitingCollector limited = new TimeLimitingCollector(new TotalHitCountCollector(), clock::get, 10);
      clock.set(11);
      TimeLimitingCollector.TimeExceededException expected = assertThrows(TimeLimitingCollector.TimeExceededException.class,
          () -> limited.getLeafCollector(reader.leaves().get(0)));
      assertEquals(10, expected.getTimeAllowed());
      assertEquals(11, expected.getTimeElapsed());
      assertEquals(-1, expected.getLastDocCollected());

      // restarting the clock allows the next search
      limited.setBaseline();
      assertTrue(new IndexSearcher(reader).search(all(), limited));
    }
  }

  public void testHitCountLimit() throws Exception {
    try (DirectoryReader reader = index()) {
      IndexSearcher searcher = new IndexSearcher(reader);
      TotalHitCountCollector counter = new TotalHitCountCollector();
      HitCountLimitingCollector limited = new HitCountLimitingCollector(counter, 3);
      assertFalse(searcher.search(all(), limited));
      assertEquals(3, limited.getCount());
      assertEquals(3, counter.getTotalHits());

      // reaching the limit exactly is not an early termination
      HitCountLimitingCollector exact = new HitCountLimitingCollector(new TotalHitCountCollector(), NUM_DOCS / 2);
      assertTrue(searcher.search(new TermQuery(new Term("body", "odd")), exact));
      assertEquals(NUM_DOCS / 2, exact.getCount());

      assertThrows(IllegalArgumentException.class, () -> new HitCountLimitingCollector(counter, 0));
    }
  }

  public void testDocSetCollector() throws Exception {
    try (DirectoryReader reader = index()) {
      IndexSearcher searcher = new IndexSearcher(reader);
      DocSetCollector collector = new DocSetCollector(reader.maxDoc());
      assertTrue(searcher.search(new TermQuery(new Term("body", "odd")), collector));
      FixedBitSet docs = collector.getDocs();
      assertEquals(NUM_DOCS / 2, docs.cardinality());
      for (int i = 0; i < NUM_DOCS; i++) {
        assertEquals(i % 2 == 1, docs.get(i));
      }
    }
  }

  public void testTopScoreDocCollectorAfter() throws Exception {
    try (DirectoryReader reader = index()) {
      IndexSearcher searcher = new IndexSearcher(reader);
      TopDocs first = searcher.search(all(), 4);
      TopDocs second = searcher.searchAfter(first.scoreDocs[3], all(), 4);
      assertEquals(NUM_DOCS, second.totalHits);
      assertEquals(4, second.scoreDocs.length);
      // equal scores page through in index order
      assertEquals(4, second.scoreDocs[0].doc);
      assertEquals(7, second.scoreDocs[3].doc);
    }
  }
}
