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


import org.fathom.index.DirectoryReader;
import org.fathom.index.IndexWriter;
import org.fathom.index.Term;
import org.fathom.search.similarities.FrequencySimilarity;
import org.fathom.store.Directory;
import org.fathom.util.FathomTestCase;
import org.junit.Before;

public class TestTermQuery extends FathomTestCase {

  private Directory dir;

  @Before
  public void indexDocuments() throws Exception {
    dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("1", "alfa bravo charlie"));
    writer.addDocument(newDocument("2", "alfa bravo delta"));
    writer.addDocument(newDocument("3", "alfa charlie echo alfa"));
    writer.commit();
  }

  public void testBasic() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      Term charlie = new Term("body", "charlie");
      assertEquals(2, reader.docFreq(charlie));
      TopDocs hits = searcher.search(new TermQuery(charlie), 10);
      assertEquals(2, hits.totalHits);
      assertFalse(hits.isPartial());
      // same frequency: the shorter document ranks first
      assertEquals("1", searcher.doc(hits.scoreDocs[0].doc).get("id"));
      assertEquals("3", searcher.doc(hits.scoreDocs[1].doc).get("id"));
      assertTrue(hits.scoreDocs[0].score > hits.scoreDocs[1].score);
    }
  }

  public void testFrequencyScoring() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      searcher.setSimilarity(new FrequencySimilarity());
      TopDocs hits = searcher.search(new TermQuery(new Term("body", "alfa")), 10);
      assertEquals(3, hits.totalHits);
      assertEquals(2, hits.scoreDocs[0].doc);
      assertEquals(2f, hits.scoreDocs[0].score, 0f);
      assertEquals(0, hits.scoreDocs[1].doc);
      assertEquals(1f, hits.scoreDocs[1].score, 0f);

      TopDocs boosted = searcher.search(new BoostQuery(new TermQuery(new Term("body", "alfa")), 3f), 1);
      assertEquals(6f, boosted.scoreDocs[0].score, 0f);
    }
  }

  public void testMissingTermOrField() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      assertEquals(0, searcher.search(new TermQuery(new Term("body", "zulu")), 10).totalHits);
      assertEquals(0, searcher.search(new TermQuery(new Term("nofield", "alfa")), 10).scoreDocs.length);
      assertEquals(0, searcher.count(new TermQuery(new Term("body", "zulu"))));
    }
  }

  public void testDeletedDocumentsDoNotMatch() throws Exception {
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.deleteDocuments(new Term("id", "1"));
    writer.commit(false, false);
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      TermQuery q = new TermQuery(new Term("body", "charlie"));
      TopDocs hits = searcher.search(q, 10);
      assertEquals(1, hits.totalHits);
      assertEquals("3", searcher.doc(hits.scoreDocs[0].doc).get("id"));
      assertEquals(1, searcher.count(q));
      // the statistics still include the deleted document until it is merged away
      assertEquals(2, reader.docFreq(q.getTerm()));
    }
  }

  public void testEquality() {
    assertEquals(new TermQuery(new Term("body", "a")), new TermQuery(new Term("body", "a")));
    assertFalse(new TermQuery(new Term("body", "a")).equals(new TermQuery(new Term("id", "a"))));
    assertEquals("body:a", new TermQuery(new Term("body", "a")).toString());
  }
}
