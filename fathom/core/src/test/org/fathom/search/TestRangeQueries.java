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


import java.util.HashSet;
import java.util.Set;

import org.fathom.document.Document;
import org.fathom.document.Field;
import org.fathom.index.DirectoryReader;
import org.fathom.index.IndexReader;
import org.fathom.index.IndexWriter;
import org.fathom.index.Term;
import org.fathom.store.Directory;
import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;

public class TestRangeQueries extends FathomTestCase {

  private static Set<Long> values(IndexSearcher searcher, Query query) throws Exception {
    final Set<Long> values = new HashSet<>();
    final IndexReader reader = searcher.getIndexReader();
    final TopDocs hits = searcher.search(query, Math.max(1, reader.maxDoc()));
    for (ScoreDoc hit : hits.scoreDocs) {
      assertTrue(values.add(((Number) searcher.doc(hit.doc).getValue("num")).longValue()));
    }
    return values;
  }

  private static Set<Long> range(long from, long to) {
    final Set<Long> values = new HashSet<>();
    for (long v = from; v <= to; v++) {
      values.add(v);
    }
    return values;
  }

  public void testNumericRange() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    for (long i = 0; i < 400; i++) {
      writer.addDocument(new Document().add(Field.keyword("id", Long.toString(i))).add(Field.numeric("num", i)));
    }
    writer.commit();

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      assertEquals(range(10, 390), values(searcher, NumericRangeQuery.newLongRange("num", 10L, 390L, true, true)));
      assertEquals(range(11, 389), values(searcher, NumericRangeQuery.newLongRange("num", 10L, 390L, false, false)));
      assertEquals(range(0, 5), values(searcher, NumericRangeQuery.newLongRange("num", null, 5L, true, true)));
      assertEquals(range(395, 399), values(searcher, NumericRangeQuery.newLongRange("num", 395L, null, true, true)));
      assertEquals(400, searcher.count(NumericRangeQuery.newLongRange("num", null, null, true, true)));
      assertEquals(0, searcher.count(NumericRangeQuery.newLongRange("num", 20L, 10L, true, true)));
      assertEquals(0, searcher.count(NumericRangeQuery.newLongRange("num", 5L, 5L, false, true)));
      assertEquals(1, searcher.count(NumericRangeQuery.newLongRange("num", 5L, 5L, true, true)));
    }
  }

  public void testNegativeNumbersSortBeforePositive() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    final long[] values = {Long.MIN_VALUE, -1000, -1, 0, 1, 1000, Long.MAX_VALUE};
    for (long v : values) {
      writer.addDocument(new Document().add(Field.numeric("num", v)));
    }
    writer.commit();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      Set<Long> expected = new HashSet<>();
      expected.add(-1000L);
      expected.add(-1L);
      expected.add(0L);
      assertEquals(expected, values(searcher, NumericRangeQuery.newLongRange("num", -1000L, 0L, true, true)));
      assertEquals(3, searcher.count(NumericRangeQuery.newLongRange("num", null, -1L, true, true)));
    }
  }

  public void testTermRangeAndPrefix() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    final String[] words = {"apple", "apricot", "banana", "blueberry", "cherry", "citrus", "date"};
    for (int i = 0; i < words.length; i++) {
      writer.addDocument(newDocument(Integer.toString(i), words[i]));
    }
    writer.commit();

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      assertEquals(2, searcher.count(new PrefixQuery(new Term("body", "ap"))));
      assertEquals(1, searcher.count(new PrefixQuery(new Term("body", "apple"))));
      assertEquals(0, searcher.count(new PrefixQuery(new Term("body", "zz"))));
      assertEquals(7, searcher.count(new PrefixQuery(new Term("body", ""))));
      assertEquals(0, searcher.count(new PrefixQuery(new Term("nofield", "a"))));

      assertEquals(4, searcher.count(TermRangeQuery.newStringRange("body", "apricot", "cherry", true, true)));
      assertEquals(2, searcher.count(TermRangeQuery.newStringRange("body", "apricot", "cherry", false, false)));
      assertEquals(2, searcher.count(TermRangeQuery.newStringRange("body", null, "apz", true, true)));
      assertEquals(3, searcher.count(TermRangeQuery.newStringRange("body", "c", null, true, true)));
      assertEquals(0, searcher.count(TermRangeQuery.newStringRange("body", "d", "c", true, true)));
      assertEquals(7, searcher.count(new TermRangeQuery("body", null, null, true, true)));

      // a prefix query expands to the matching terms
      Query rewritten = searcher.rewrite(new PrefixQuery(new Term("body", "b")));
      assertTrue(rewritten instanceof BooleanQuery);
      assertEquals(2, ((BooleanQuery) rewritten).clauses().size());
      assertTrue(searcher.rewrite(new PrefixQuery(new Term("body", "zz"))) instanceof MatchNoDocsQuery);
      assertEquals(new TermRangeQuery("body", new BytesRef("a"), new BytesRef("b"), true, false),
          TermRangeQuery.newStringRange("body", "a", "b", true, false));
    }
  }

  public void testMatchAll() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("0", "alfa"));
    writer.addDocument(new Document().add(Field.keyword("id", "1")));
    writer.addDocument(newDocument("2", "bravo"));
    writer.commit();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      assertEquals(3, searcher.count(new MatchAllDocsQuery()));
      TopDocs hits = searcher.search(new MatchAllDocsQuery("body"), 10);
      assertEquals(2, hits.totalHits);
      assertEquals(0, hits.scoreDocs[0].doc);
      assertEquals(2, hits.scoreDocs[1].doc);
      assertEquals(1f, hits.scoreDocs[0].score, 0f);
      assertEquals(0, searcher.count(new MatchAllDocsQuery("nofield")));
      assertEquals(0, searcher.count(new MatchNoDocsQuery()));
    }
  }
}
