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


import org.fathom.document.Document;
import org.fathom.document.Field;
import org.fathom.document.FieldType;
import org.fathom.index.DirectoryReader;
import org.fathom.index.IndexOptions;
import org.fathom.index.IndexWriter;
import org.fathom.index.Term;
import org.fathom.search.similarities.FrequencySimilarity;
import org.fathom.store.Directory;
import org.fathom.util.FathomTestCase;

public class TestPhraseQuery extends FathomTestCase {

  private DirectoryReader index(String... bodies) throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    for (int i = 0; i < bodies.length; i++) {
      writer.addDocument(newDocument(Integer.toString(i), bodies[i]));
    }
    writer.commit();
    return DirectoryReader.open(dir);
  }

  private static IndexSearcher newSearcher(DirectoryReader reader) {
    IndexSearcher searcher = new IndexSearcher(reader);
    searcher.setSimilarity(new FrequencySimilarity());
    return searcher;
  }

  public void testExactPhrase() throws Exception {
    try (DirectoryReader reader = index("the quick brown fox", "quick the fox brown", "brown quick", "quick brown quick brown")) {
      IndexSearcher searcher = newSearcher(reader);
      TopDocs hits = searcher.search(new PhraseQuery("body", "quick", "brown"), 10);
      assertEquals(2, hits.totalHits);
      // two occurrences of the phrase
      assertEquals(3, hits.scoreDocs[0].doc);
      assertEquals(2f, hits.scoreDocs[0].score, 0f);
      assertEquals(0, hits.scoreDocs[1].doc);
      assertEquals(1f, hits.scoreDocs[1].score, 0f);

      assertEquals(1, searcher.count(new PhraseQuery("body", "the", "quick", "brown", "fox")));
      assertEquals(0, searcher.count(new PhraseQuery("body", "fox", "quick")));
    }
  }

  public void testSlopIsOrdered() throws Exception {
    try (DirectoryReader reader = index("alfa x bravo", "alfa x y bravo", "bravo alfa", "alfa bravo")) {
      IndexSearcher searcher = newSearcher(reader);
      assertEquals(1, searcher.count(new PhraseQuery(0, "body", "alfa", "bravo")));
      assertEquals(2, searcher.count(new PhraseQuery(1, "body", "alfa", "bravo")));
      assertEquals(3, searcher.count(new PhraseQuery(2, "body", "alfa", "bravo")));
      // the terms must keep their order whatever the slop
      TopDocs hits = searcher.search(new PhraseQuery(10, "body", "bravo", "alfa"), 10);
      assertEquals(1, hits.totalHits);
      assertEquals(2, hits.scoreDocs[0].doc);
    }
  }

  public void testExplicitPositions() throws Exception {
    try (DirectoryReader reader = index("alfa x bravo", "alfa bravo")) {
      IndexSearcher searcher = newSearcher(reader);
      PhraseQuery gap = new PhraseQuery.Builder()
          .add(new Term("body", "alfa"), 0)
          .add(new Term("body", "bravo"), 2)
          .build();
      TopDocs hits = searcher.search(gap, 10);
      assertEquals(1, hits.totalHits);
      assertEquals(0, hits.scoreDocs[0].doc);
    }
  }

  public void testMissingTermsAndRewrite() throws Exception {
    try (DirectoryReader reader = index("alfa bravo")) {
      IndexSearcher searcher = newSearcher(reader);
      assertEquals(0, searcher.count(new PhraseQuery("body", "alfa", "zulu")));
      assertEquals(0, searcher.count(new PhraseQuery("nofield", "alfa", "bravo")));
      assertTrue(searcher.rewrite(new PhraseQuery("body", "alfa")) instanceof TermQuery);
      assertTrue(searcher.rewrite(new PhraseQuery("body")) instanceof MatchNoDocsQuery);
      assertEquals(1, searcher.count(new PhraseQuery("body", "bravo")));
    }
  }

  public void testFieldWithoutPositions() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addField("flat", new FieldType().setIndexOptions(IndexOptions.DOCS_AND_FREQS));
    writer.addDocument(new Document().add(Field.keyword("id", "1")).add(newTextField("flat", "alfa bravo")));
    writer.commit();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = newSearcher(reader);
      assertThrows(IllegalStateException.class, () -> searcher.count(new PhraseQuery("flat", "alfa", "bravo")));
    }
  }

  public void testBuilderRejectsMixedFields() {
    PhraseQuery.Builder builder = new PhraseQuery.Builder().add(new Term("body", "alfa"));
    assertThrows(IllegalArgumentException.class, () -> builder.add(new Term("title", "bravo")));
  }
}
