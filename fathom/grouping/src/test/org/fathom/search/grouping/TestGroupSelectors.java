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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.fathom.document.Document;
import org.fathom.document.Field;
import org.fathom.index.DirectoryReader;
import org.fathom.index.IndexWriter;
import org.fathom.index.Term;
import org.fathom.search.IndexSearcher;
import org.fathom.search.MatchAllDocsQuery;
import org.fathom.search.Query;
import org.fathom.search.TermQuery;
import org.fathom.store.Directory;
import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;
import org.junit.Before;

public class TestGroupSelectors extends FathomTestCase {

  private Directory dir;

  @Before
  public void indexDocuments() throws Exception {
    dir = newDirectory();
    // small buffers spread the documents over several segments
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(randomIntBetween(2, 4)));
    writer.addDocument(doc("0", "alfa", "small", 200L));
    writer.addDocument(doc("1", "bravo", "medium", 100L));
    writer.addDocument(doc("2", "alfa", "large", null));
    writer.addDocument(doc("3", "bravo", "small", 50L));
    writer.addDocument(doc("4", "alfa charlie", "medium", 500L));
    writer.addDocument(doc("5", "bravo", "medium", 125L));
    writer.addDocument(doc("6", "delta", null, 5000L));
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

  public void testFixedRanges() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      FacetCollector<LongRange> facets = new FacetCollector<>(new NumericRangeGroupSelector("num", 0, 1000, 100));
      new IndexSearcher(reader).search(new MatchAllDocsQuery(), facets);

      Map<LongRange, List<Integer>> groups = facets.getGroups();
      assertEquals(5, groups.size());
      assertEquals(Collections.singletonList(3), groups.get(new LongRange(0, 100)));
      assertEquals(Arrays.asList(1, 5), groups.get(new LongRange(100, 200)));
      assertEquals(Collections.singletonList(0), groups.get(new LongRange(200, 300)));
      assertEquals(Collections.singletonList(4), groups.get(new LongRange(500, 600)));
      // no value, and a value past the end
      assertEquals(Arrays.asList(2, 6), groups.get(null));
    }
  }

  public void testVaryingGaps() {
    NumericRangeGroupSelector selector = new NumericRangeGroupSelector("num", 0, 1000, new long[] {1, 2, 3}, false);
    assertEquals(new LongRange(0, 1), selector.bucket(0));
    assertEquals(new LongRange(1, 3), selector.bucket(2));
    assertEquals(new LongRange(3, 6), selector.bucket(5));
    assertEquals(new LongRange(6, 9), selector.bucket(6));
    assertEquals(new LongRange(9, 12), selector.bucket(9));
    assertEquals(new LongRange(996, 999), selector.bucket(998));
    assertEquals(new LongRange(999, 1002), selector.bucket(999));
    assertNull(selector.bucket(-1));
    assertNull(selector.bucket(1000));
  }

  public void testHardEnd() {
    NumericRangeGroupSelector selector = new NumericRangeGroupSelector("num", 10, 25, new long[] {10}, true);
    assertEquals(new LongRange(10, 20), selector.bucket(19));
    assertEquals(new LongRange(20, 25), selector.bucket(24));
    assertNull(selector.bucket(25));
  }

  public void testInvalidRanges() {
    assertThrows(IllegalArgumentException.class, () -> new NumericRangeGroupSelector("num", 5, 5, 1));
    assertThrows(IllegalArgumentException.class, () -> new NumericRangeGroupSelector("num", 0, 10, 0));
    assertThrows(IllegalArgumentException.class, () -> new NumericRangeGroupSelector("num", 0, 10, new long[0], false));
    assertThrows(IllegalArgumentException.class, () -> new NumericRangeGroupSelector("num", 0, 10, new long[] {2, -1}, false));
  }

  public void testRestrictedRanges() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      NumericRangeGroupSelector selector = new NumericRangeGroupSelector("num", 0, 1000, 100);
      selector.setGroups(Collections.singletonList(new LongRange(100, 200)));
      FacetCollector<LongRange> facets = new FacetCollector<>(selector);
      new IndexSearcher(reader).search(new MatchAllDocsQuery(), facets);
      assertEquals(Collections.singleton(new LongRange(100, 200)), facets.getGroups().keySet());
      assertEquals(2, facets.getTotalHits());
    }
  }

  public void testQueryGroups() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      Map<String, Query> queries = new LinkedHashMap<>();
      queries.put("charlie", new TermQuery(new Term("body", "charlie")));
      queries.put("alfa", new TermQuery(new Term("body", "alfa")));
      queries.put("bravo", new TermQuery(new Term("body", "bravo")));
      queries.put("zulu", new TermQuery(new Term("body", "zulu")));
      QueryGroupSelector selector = new QueryGroupSelector(searcher, queries);
      assertEquals(Arrays.asList("charlie", "alfa", "bravo", "zulu"), selector.getNames());
      FacetCollector<String> facets = new FacetCollector<>(selector);
      searcher.search(new MatchAllDocsQuery(), facets);

      Map<String, List<Integer>> groups = facets.getGroups();
      assertEquals(Arrays.asList("alfa", "bravo", "charlie", null), new ArrayList<>(groups.keySet()));
      // document 4 matches alfa too but charlie comes first
      assertEquals(Arrays.asList(0, 2), groups.get("alfa"));
      assertEquals(Arrays.asList(1, 3, 5), groups.get("bravo"));
      assertEquals(Collections.singletonList(4), groups.get("charlie"));
      assertEquals(Collections.singletonList(6), groups.get(null));
      assertFalse(groups.containsKey("zulu"));
    }
  }

  public void testQueryGroupsOfSubsetOfHits() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexSearcher searcher = new IndexSearcher(reader);
      Map<String, Query> queries = new LinkedHashMap<>();
      queries.put("small", new TermQuery(new Term("tag", "small")));
      queries.put("medium", new TermQuery(new Term("tag", "medium")));
      FacetCollector<String> facets = new FacetCollector<>(new QueryGroupSelector(searcher, queries), false);
      searcher.search(new TermQuery(new Term("body", "bravo")), facets);
      assertEquals(Collections.singletonList(3), facets.getGroups().get("small"));
      assertEquals(Arrays.asList(1, 5), facets.getGroups().get("medium"));
      assertEquals(3, facets.getTotalHits());
    }
  }

  public void testCompositeGroups() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      CompositeGroupSelector selector = new CompositeGroupSelector(
          new ColumnGroupSelector("tag"), new NumericRangeGroupSelector("num", 0, 1000, 100));
      FacetCollector<List<Object>> facets = new FacetCollector<>(selector);
      new IndexSearcher(reader).search(new MatchAllDocsQuery(), facets);

      Map<List<Object>, List<Integer>> groups = facets.getGroups();
      assertEquals(Arrays.asList(1, 5), groups.get(Arrays.<Object>asList(new BytesRef("medium"), new LongRange(100, 200))));
      assertEquals(Collections.singletonList(4), groups.get(Arrays.<Object>asList(new BytesRef("medium"), new LongRange(500, 600))));
      assertEquals(Collections.singletonList(2), groups.get(Arrays.<Object>asList(new BytesRef("large"), null)));
      assertEquals(Collections.singletonList(6), groups.get(Arrays.<Object>asList(null, null)));
      assertEquals(6, groups.size());
      assertEquals(7, facets.getTotalHits());
    }
  }

  public void testCompositeSkipsWhenAnySelectorSkips() throws Exception {
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      ColumnGroupSelector tags = new ColumnGroupSelector("tag");
      tags.setGroups(Collections.singletonList(new BytesRef("small")));
      CompositeGroupSelector selector = new CompositeGroupSelector(tags, new NumericColumnGroupSelector("num"));
      FacetCollector<List<Object>> facets = new FacetCollector<>(selector);
      new IndexSearcher(reader).search(new MatchAllDocsQuery(), facets);
      assertEquals(2, facets.getGroups().size());
      assertEquals(Collections.singletonList(0), facets.getGroups().get(Arrays.<Object>asList(new BytesRef("small"), 200L)));
      assertEquals(Collections.singletonList(3), facets.getGroups().get(Arrays.<Object>asList(new BytesRef("small"), 50L)));
    }
  }
}
