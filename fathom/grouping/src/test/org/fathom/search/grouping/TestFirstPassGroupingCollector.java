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
package org.fathom.search.grouping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.fathom.document.Document;
import org.fathom.document.Field;
import org.fathom.index.DirectoryReader;
import org.fathom.index.IndexWriter;
import org.fathom.index.Term;
import org.fathom.search.IndexSearcher;
import org.fathom.search.TermQuery;
import org.fathom.search.similarities.FrequencySimilarity;
import org.fathom.store.Directory;
import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;

public class TestFirstPassGroupingCollector extends FathomTestCase {

  private static Document doc(int id, String tag, int freq) {
    StringBuilder body = new StringBuilder("zulu");
    for (int i = 0; i < freq; i++) {
      body.append(" alfa");
    }
    Document doc = newDocument(Integer.toString(id), body.toString());
    if (tag != null) {
      doc.add(Field.keyword("tag", tag));
    }
    return doc;
  }

  private static IndexSearcher newSearcher(DirectoryReader reader) {
    IndexSearcher searcher = new IndexSearcher(reader);
    // scores are the term frequency
    searcher.setSimilarity(new FrequencySimilarity());
    return searcher;
  }

  public void testTopGroups() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(doc(0, "a", 1));
    writer.addDocument(doc(1, "b", 3));
    writer.addDocument(doc(2, "a", 2));
    writer.addDocument(doc(3, "c", 2));
    writer.addDocument(doc(4, "b", 1));
    writer.addDocument(doc(5, null, 4));
    writer.commit(false, false);

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = newSearcher(reader);
      FirstPassGroupingCollector<BytesRef> collector = new FirstPassGroupingCollector<>(new ColumnGroupSelector("tag"), 3);
      searcher.search(new TermQuery(new Term("body", "alfa")), collector);

      Collection<SearchGroup<BytesRef>> top = collector.getTopGroups(0);
      assertEquals(3, top.size());
      Iterator<SearchGroup<BytesRef>> it = top.iterator();
      assertGroup(it.next(), null, 4f, 5);
      assertGroup(it.next(), new BytesRef("b"), 3f, 1);
      // "a" and "c" tie on score, the lower best doc wins
      assertGroup(it.next(), new BytesRef("a"), 2f, 2);

      Collection<SearchGroup<BytesRef>> page = collector.getTopGroups(1);
      assertEquals(2, page.size());
      assertEquals(new BytesRef("b"), page.iterator().next().groupValue);
      assertNull(collector.getTopGroups(3));
    }
  }

  private static void assertGroup(SearchGroup<BytesRef> group, BytesRef value, float score, int topDoc) {
    assertEquals(value, group.groupValue);
    assertEquals(score, group.score, 0f);
    assertEquals(topDoc, group.topDoc);
  }

  public void testNoHits() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(doc(0, "a", 1));
    writer.commit();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      FirstPassGroupingCollector<BytesRef> collector = new FirstPassGroupingCollector<>(new ColumnGroupSelector("tag"), 10);
      newSearcher(reader).search(new TermQuery(new Term("body", "bravo")), collector);
      assertNull(collector.getTopGroups(0));
    }
  }

  public void testIllegalArguments() {
    try {
      new FirstPassGroupingCollector<>(new ColumnGroupSelector("tag"), 0);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().contains("topNGroups"));
    }
    FirstPassGroupingCollector<BytesRef> collector = new FirstPassGroupingCollector<>(new ColumnGroupSelector("tag"), 1);
    try {
      collector.getTopGroups(-1);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().contains("groupOffset"));
    }
  }

  public void testRandomNumericGroups() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    int numDocs = atLeast(50);
    int numGroups = randomIntBetween(1, 12);
    long[] groupOf = new long[numDocs];
    int[] freqs = new int[numDocs];
    for (int i = 0; i < numDocs; i++) {
      groupOf[i] = random().nextInt(numGroups);
      freqs[i] = randomIntBetween(1, 6);
      Document doc = doc(i, null, freqs[i]);
      doc.add(Field.numeric("num", groupOf[i]));
      writer.addDocument(doc);
    }
    writer.commit(false, false);

    // best (score, doc) per group: a later doc replaces only on a higher score
    Map<Long, int[]> best = new HashMap<>();
    for (int i = 0; i < numDocs; i++) {
      int[] b = best.get(groupOf[i]);
      if (b == null || freqs[i] > b[0]) {
        best.put(groupOf[i], new int[] {freqs[i], i});
      }
    }
    List<Map.Entry<Long, int[]>> expected = new ArrayList<>(best.entrySet());
    expected.sort((x, y) -> {
      int c = Integer.compare(y.getValue()[0], x.getValue()[0]);
      return c != 0 ? c : Integer.compare(x.getValue()[1], y.getValue()[1]);
    });

    int topN = randomIntBetween(1, numGroups + 2);
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      FirstPassGroupingCollector<Long> collector = new FirstPassGroupingCollector<>(new NumericColumnGroupSelector("num"), topN);
      newSearcher(reader).search(new TermQuery(new Term("body", "alfa")), collector);
      Collection<SearchGroup<Long>> top = collector.getTopGroups(0);
      assertEquals(Math.min(topN, expected.size()), top.size());
      int upto = 0;
      for (SearchGroup<Long> group : top) {
        Map.Entry<Long, int[]> e = expected.get(upto++);
        assertEquals(e.getKey(), group.groupValue);
        assertEquals(e.getValue()[0], group.score, 0f);
        assertEquals(e.getValue()[1], group.topDoc);
      }
    }
  }
}
