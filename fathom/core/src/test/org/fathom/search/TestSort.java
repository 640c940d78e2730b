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


import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.fathom.document.Document;
import org.fathom.document.Field;
import org.fathom.index.DirectoryReader;
import org.fathom.index.IndexWriter;
import org.fathom.index.Term;
import org.fathom.store.Directory;
import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;

public class TestSort extends FathomTestCase {

  private DirectoryReader reader;
  private IndexSearcher searcher;

  /** id, num (or null), tag (or null) */
  private static final Object[][] DOCS = {
      {"a", 30L, "red"},
      {"b", null, "blue"},
      {"c", 10L, null},
      {"d", 20L, "green"},
      {"e", 10L, "blue"},
  };

  private void index() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(randomIntBetween(2, 5)));
    for (Object[] values : DOCS) {
      Document doc = newDocument((String) values[0], "text");
      if (values[1] != null) {
        doc.add(Field.numeric("num", (Long) values[1]));
      }
      if (values[2] != null) {
        doc.add(Field.keyword("tag", (String) values[2]));
      }
      writer.addDocument(doc);
    }
    writer.commit(false, false);
    reader = DirectoryReader.open(dir);
    searcher = new IndexSearcher(reader);
  }

  private List<String> ids(TopDocs hits) throws Exception {
    final List<String> ids = new ArrayList<>();
    for (ScoreDoc hit : hits.scoreDocs) {
      ids.add(searcher.doc(hit.doc).get("id"));
    }
    return ids;
  }

  private List<String> sorted(SortField... fields) throws Exception {
    return ids(searcher.search(new MatchAllDocsQuery(), 10, new Sort(fields)));
  }

  public void testNumericSort() throws Exception {
    index();
    try {
      assertEquals(Arrays.asList("c", "e", "d", "a", "b"), sorted(new SortField("num", SortField.Type.LONG)));
      // missing values stay last when reversed
      assertEquals(Arrays.asList("a", "d", "c", "e", "b"), sorted(new SortField("num", SortField.Type.LONG, true)));
      assertEquals(Arrays.asList("b", "c", "e", "d", "a"), sorted(new SortField("num", SortField.Type.LONG).setMissingLast(false)));
    } finally {
      reader.close();
    }
  }

  public void testBinarySortAndTieBreak() throws Exception {
    index();
    try {
      assertEquals(Arrays.asList("b", "e", "d", "a", "c"), sorted(new SortField("tag", SortField.Type.BINARY)));
      assertEquals(Arrays.asList("e", "b", "d", "a", "c"),
          sorted(new SortField("tag", SortField.Type.BINARY), new SortField("num", SortField.Type.LONG)));
      assertEquals(Arrays.asList("a", "b", "c", "d", "e"), ids(searcher.search(new MatchAllDocsQuery(), 10, Sort.INDEXORDER)));

      TopDocs hits = searcher.search(new MatchAllDocsQuery(), 1, new Sort(new SortField("tag", SortField.Type.BINARY, true)));
      assertEquals(5, hits.totalHits);
      FieldDoc top = (FieldDoc) hits.scoreDocs[0];
      assertEquals(new BytesRef("red"), top.fields[0]);
      assertTrue(Float.isNaN(top.score));
    } finally {
      reader.close();
    }
  }

  public void testSearchAfterWithSort() throws Exception {
    index();
    try {
      final Sort sort = new Sort(new SortField("num", SortField.Type.LONG));
      final Query query = new MatchAllDocsQuery();
      List<String> paged = new ArrayList<>();
      ScoreDoc after = null;
      while (true) {
        TopDocs page = searcher.searchAfter(after, query, 2, sort);
        if (page.scoreDocs.length == 0) {
          break;
        }
        paged.addAll(ids(page));
        after = page.scoreDocs[page.scoreDocs.length - 1];
      }
      assertEquals(Arrays.asList("c", "e", "d", "a", "b"), paged);
      assertThrows(IllegalArgumentException.class, () -> searcher.searchAfter(new ScoreDoc(0, 1f), query, 2, sort));
      assertThrows(IllegalArgumentException.class, () -> searcher.search(query, 0, sort));
    } finally {
      reader.close();
    }
  }

  public void testRelevanceSort() throws Exception {
    index();
    try {
      Query q = new BooleanQuery.Builder()
          .add(new TermQuery(new Term("body", "text")), BooleanClause.Occur.SHOULD)
          .add(new BoostQuery(new TermQuery(new Term("id", "d")), 5f), BooleanClause.Occur.SHOULD)
          .build();
      TopDocs hits = searcher.search(q, 10, Sort.RELEVANCE);
      assertEquals("d", searcher.doc(hits.scoreDocs[0].doc).get("id"));
      assertFalse(Float.isNaN(hits.scoreDocs[0].score));
      assertEquals(Arrays.asList("d", "a", "b", "c", "e"), ids(hits));
    } finally {
      reader.close();
    }
  }
}
