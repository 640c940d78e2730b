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


import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.fathom.index.DirectoryReader;
import org.fathom.index.IndexWriter;
import org.fathom.index.Term;
import org.fathom.search.similarities.BM25Similarity;
import org.fathom.search.similarities.FrequencySimilarity;
import org.fathom.store.Directory;
import org.fathom.util.FathomTestCase;

public class TestIndexSearcher extends FathomTestCase {

  private DirectoryReader index(int numDocs) throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    for (int i = 0; i < numDocs; i++) {
      StringBuilder body = new StringBuilder("all");
      // varying frequencies give varying scores
      for (int j = 0; j < i % 7; j++) {
        body.append(" hit");
      }
      writer.addDocument(newDocument(Integer.toString(i), body.toString()));
    }
    writer.commit();
    return DirectoryReader.open(dir);
  }

  public void testDefaults() throws Exception {
    try (DirectoryReader reader = index(3)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      assertSame(reader, searcher.getIndexReader());
      assertTrue(searcher.getSimilarity() instanceof BM25Similarity);
      assertSame(IndexSearcher.getDefaultSimilarity(), searcher.getSimilarity());
      assertEquals("1", searcher.doc(1).get("id"));
      assertNull(searcher.doc(1, Collections.singleton("id")).get("body"));
    }
  }

  public void testNumHits() throws Exception {
    try (DirectoryReader reader = index(5)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      Query q = new TermQuery(new Term("body", "all"));
      assertThrows(IllegalArgumentException.class, () -> searcher.search(q, 0));
      assertThrows(IllegalArgumentException.class, () -> searcher.search(q, -1));
      TopDocs hits = searcher.search(q, Integer.MAX_VALUE);
      assertEquals(5, hits.totalHits);
      assertEquals(5, hits.scoreDocs.length);
      assertEquals(2, searcher.search(q, 2).scoreDocs.length);
      assertEquals(5, searcher.search(q, 2).totalHits);
    }
  }

  public void testCount() throws Exception {
    try (DirectoryReader reader = index(20)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      assertEquals(20, searcher.count(new MatchAllDocsQuery()));
      assertEquals(20, searcher.count(new BoostQuery(new MatchAllDocsQuery(), 3f)));
      assertEquals(20, searcher.count(new TermQuery(new Term("body", "all"))));
      // documents 0, 7 and 14 have no "hit"
      assertEquals(17, searcher.count(new TermQuery(new Term("body", "hit"))));
      assertEquals(1, searcher.count(new TermQuery(new Term("id", "13"))));
    }
  }

  public void testCountWithDeletions() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    for (int i = 0; i < 10; i++) {
      writer.addDocument(newDocument(Integer.toString(i), "all"));
    }
    writer.commit(false, false);
    writer = newWriter(dir, newIndexWriterConfig());
    writer.deleteDocuments(new Term("id", "3"));
    writer.deleteDocuments(new Term("id", "4"));
    writer.commit(false, false);
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      assertEquals(8, searcher.count(new MatchAllDocsQuery()));
      assertEquals(8, searcher.count(new TermQuery(new Term("body", "all"))));
      assertEquals(8, searcher.search(new MatchAllDocsQuery(), 100).totalHits);
    }
  }

  public void testPagination() throws Exception {
    try (DirectoryReader reader = index(atLeast(30))) {
      IndexSearcher searcher = new IndexSearcher(reader);
      searcher.setSimilarity(new FrequencySimilarity());
      final Query q = new BooleanQuery.Builder()
          .add(new TermQuery(new Term("body", "all")), BooleanClause.Occur.SHOULD)
          .add(new TermQuery(new Term("body", "hit")), BooleanClause.Occur.SHOULD)
          .build();
      final int total = reader.numDocs();
      final TopDocs all = searcher.search(q, total);
      final int pageLen = randomIntBetween(1, 7);

      int offset = 0;
      for (int pageNum = 1; offset < total; pageNum++) {
        ResultsPage page = searcher.searchPage(q, pageNum, pageLen);
        assertEquals(pageNum, page.getPageNum());
        assertEquals(offset, page.getOffset());
        assertEquals(total, page.getTotal());
        assertEquals((total + pageLen - 1) / pageLen, page.getPageCount());
        assertFalse(page.isPartial());
        ScoreDoc[] docs = page.getScoreDocs();
        assertEquals(Math.min(pageLen, total - offset), docs.length);
        for (int i = 0; i < docs.length; i++) {
          // pages are slices of the complete ranking
          assertEquals(all.scoreDocs[offset + i].doc, docs[i].doc);
        }
        assertEquals(offset + pageLen >= total, page.isLastPage());
        offset += pageLen;
      }

      // a page past the end shows the last page
      ResultsPage past = searcher.searchPage(q, 1000, pageLen);
      assertTrue(past.isLastPage());
      assertEquals(past.getPageCount(), past.getPageNum());
      assertTrue(past.getScoreDocs().length > 0);

      assertThrows(IllegalArgumentException.class, () -> searcher.searchPage(q, 0, 10));
      assertThrows(IllegalArgumentException.class, () -> searcher.searchPage(q, 1, 0));
    }
  }

  public void testEmptyPage() throws Exception {
    try (DirectoryReader reader = index(3)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      ResultsPage page = searcher.searchPage(new TermQuery(new Term("body", "zulu")), 3, 10);
      assertEquals(0, page.getTotal());
      assertEquals(0, page.getPageCount());
      assertEquals(1, page.getPageNum());
      assertEquals(0, page.getScoreDocs().length);
      assertTrue(page.isLastPage());
    }
  }

  public void testSearchAfterVisitsEveryHitOnce() throws Exception {
    try (DirectoryReader reader = index(atLeast(25))) {
      IndexSearcher searcher = new IndexSearcher(reader);
      final Query q = new BooleanQuery.Builder()
          .add(new TermQuery(new Term("body", "all")), BooleanClause.Occur.SHOULD)
          .add(new TermQuery(new Term("body", "hit")), BooleanClause.Occur.SHOULD)
          .build();
      final Set<Integer> seen = new HashSet<>();
      ScoreDoc after = null;
      float lastScore = Float.POSITIVE_INFINITY;
      while (true) {
        TopDocs page = searcher.searchAfter(after, q, randomIntBetween(1, 5));
        if (page.scoreDocs.length == 0) {
          break;
        }
        for (ScoreDoc hit : page.scoreDocs) {
          assertTrue(seen.add(hit.doc));
          assertTrue(hit.score <= lastScore);
          lastScore = hit.score;
        }
        after = page.scoreDocs[page.scoreDocs.length - 1];
      }
      assertEquals(reader.numDocs(), seen.size());
    }
  }

  public void testStatistics() throws Exception {
    try (DirectoryReader reader = index(8)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      CollectionStatistics stats = searcher.collectionStatistics("body");
      assertEquals(8, stats.maxDoc());
      assertEquals(8, stats.docCount());
      // 8 "all" plus 0 + 1 + ... + 6 + 0 "hit"
      assertEquals(8 + 21, stats.sumFieldLength());
      assertEquals(8 + 21, stats.sumTotalWeight(), 0d);
      assertEquals(8 + 6, stats.sumDocFreq());
      assertNull(searcher.collectionStatistics("nofield"));

      TermStatistics termStats = searcher.termStatistics(new Term("body", "hit"), reader.docFreq(new Term("body", "hit")),
          reader.totalWeight(new Term("body", "hit")));
      assertEquals(6, termStats.docFreq());
      assertEquals(21d, termStats.totalWeight(), 0d);
    }
  }

  public void testSimilarityChangesScoresNotMatches() throws Exception {
    try (DirectoryReader reader = index(10)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      Query q = new TermQuery(new Term("body", "hit"));
      TopDocs bm25 = searcher.search(q, 10);
      searcher.setSimilarity(new FrequencySimilarity());
      TopDocs frequency = searcher.search(q, 10);
      assertEquals(bm25.totalHits, frequency.totalHits);
      assertEquals(6, frequency.scoreDocs[0].doc);
      assertEquals(6f, frequency.scoreDocs[0].score, 0f);
      // BM25 saturates the frequency but keeps the order
      assertEquals(6, bm25.scoreDocs[0].doc);
      assertTrue(bm25.scoreDocs[0].score < 6f);
    }
  }
}
