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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.fathom.document.Document;
import org.fathom.document.Field;
import org.fathom.index.DirectoryReader;
import org.fathom.index.IndexWriter;
import org.fathom.index.Term;
import org.fathom.search.IndexSearcher;
import org.fathom.search.MatchAllDocsQuery;
import org.fathom.search.TermQuery;
import org.fathom.store.Directory;
import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;
import org.junit.Before;

public class TestFacetCollector extends FathomTestCase {

  private Directory dir;

  @Before
  public void indexDocuments() throws Exception {
    dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(doc("0", "alfa", "red", 3L));
    writer.addDocument(doc("1", "alfa bravo", "blue", 1L));
    writer.addDocument(doc("2", "alfa", null, null));
    writer.addDocument(doc("3", "bravo", "red", 3L));
    writer.addDocument(doc("4", "alfa", "green", 1L));
    writer.commit(false, false);
  }

  private static Document doc(String id, String body, String tag, Long num) {
    Document doc = newDocument(id, body);
    if (tag != null) {
      doc.add(Field.keyword("tag", tag));
    }
    if (num != null) {
      doc.add(Field.numeric("num", num));
    }
    return doc;
  }

  public void testBucketsInOrderOfFirstHit() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      FacetCollector<BytesRef> facets = new FacetCollector<>(new ColumnGroupSelector("tag"));
      searcher.search(new TermQuery(new Term("body", "alfa")), facets);

      Map<BytesRef, List<Integer>> groups = facets.getGroups();
      assertEquals(Arrays.asList(new BytesRef("red"), new BytesRef("blue"), null, new BytesRef("green")),
          new ArrayList<>(groups.keySet()));
      assertEquals(Collections.singletonList(0), groups.get(new BytesRef("red")));
      assertEquals(Collections.singletonList(2), groups.get(null));
      assertEquals(4, facets.getTotalHits());
    }
  }

  public void testCounts() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      FacetCollector<BytesRef> facets = new FacetCollector<>(new ColumnGroupSelector("tag"));
      searcher.search(new MatchAllDocsQuery(), facets);

      Map<BytesRef, Integer> counts = facets.getGroupCounts();
      assertEquals(4, counts.size());
      assertEquals(Integer.valueOf(2), counts.get(new BytesRef("red")));
      assertEquals(Integer.valueOf(1), counts.get(new BytesRef("blue")));
      assertEquals(Integer.valueOf(1), counts.get(null));
      assertEquals(Arrays.asList(0, 3), facets.getGroups().get(new BytesRef("red")));
      assertEquals(5, facets.getTotalHits());
    }
  }

  public void testExcludeMissing() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      FacetCollector<BytesRef> facets = new FacetCollector<>(new ColumnGroupSelector("tag"), false);
      searcher.search(new TermQuery(new Term("body", "alfa")), facets);
      assertEquals(3, facets.getGroups().size());
      assertFalse(facets.getGroups().containsKey(null));
      assertEquals(3, facets.getTotalHits());
    }
  }

  public void testNumericColumn() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      FacetCollector<Long> facets = new FacetCollector<>(new NumericColumnGroupSelector("num"));
      searcher.search(new TermQuery(new Term("body", "alfa")), facets);

      Map<Long, List<Integer>> groups = facets.getGroups();
      assertEquals(Arrays.asList(3L, 1L, null), new ArrayList<>(groups.keySet()));
      assertEquals(Arrays.asList(1, 4), groups.get(1L));
      assertEquals(Collections.singletonList(2), groups.get(null));
    }
  }

  public void testRestrictedGroups() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      ColumnGroupSelector selector = new ColumnGroupSelector("tag");
      selector.setGroups(Arrays.asList(new BytesRef("red"), new BytesRef("green")));
      FacetCollector<BytesRef> facets = new FacetCollector<>(selector);
      searcher.search(new MatchAllDocsQuery(), facets);

      assertEquals(Arrays.asList(new BytesRef("red"), new BytesRef("green")),
          new ArrayList<>(facets.getGroups().keySet()));
      assertEquals(3, facets.getTotalHits());
    }
  }

  public void testUnknownColumn() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      FacetCollector<BytesRef> facets = new FacetCollector<>(new ColumnGroupSelector("nofield"));
      searcher.search(new MatchAllDocsQuery(), facets);
      assertEquals(Collections.singleton(null), facets.getGroups().keySet());
      assertEquals(Integer.valueOf(5), facets.getGroupCounts().get(null));
    }
  }
}
