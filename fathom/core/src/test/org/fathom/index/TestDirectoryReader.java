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
import java.util.List;

import org.fathom.document.Document;
import org.fathom.document.FieldType;
import org.fathom.store.AlreadyClosedException;
import org.fathom.store.Directory;
import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;

public class TestDirectoryReader extends FathomTestCase {

  private Directory dir;

  private void indexBasic() throws Exception {
    dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("1", "alfa bravo charlie"));
    writer.addDocument(newDocument("2", "alfa bravo delta"));
    writer.addDocument(newDocument("3", "alfa charlie echo alfa"));
    writer.commit();
  }

  public void testOpenWithoutCommit() throws Exception {
    Directory empty = newDirectory();
    assertThrows(IndexNotFoundException.class, () -> DirectoryReader.open(empty));
  }

  public void testEmptyIndex() throws Exception {
    Directory empty = newDirectory();
    newWriter(empty, newIndexWriterConfig()).commit();
    try (DirectoryReader reader = DirectoryReader.open(empty)) {
      assertEquals(0, reader.numDocs());
      assertEquals(0, reader.maxDoc());
      assertFalse(reader.hasDeletions());
      assertTrue(reader.fieldNames().contains("body"));
      assertEquals(-1, reader.firstDocID(new Term("body", "alfa")));
    }
  }

  public void testSnapshotIsolation() throws Exception {
    indexBasic();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      final long generation = reader.getGeneration();
      IndexWriter writer = newWriter(dir, newIndexWriterConfig());
      writer.addDocument(newDocument("4", "foxtrot"));
      writer.deleteDocuments(new Term("id", "1"));

      // uncommitted changes are invisible
      assertTrue(reader.isCurrent());
      writer.commit(false, false);
      assertFalse(reader.isCurrent());

      // the open reader keeps its snapshot
      assertEquals(3, reader.numDocs());
      assertFalse(reader.isDeleted(0));
      assertEquals(0, reader.docFreq(new Term("body", "foxtrot")));
      assertEquals(generation, reader.getGeneration());

      try (DirectoryReader latest = DirectoryReader.open(dir)) {
        assertEquals(3, latest.numDocs());
        assertEquals(4, latest.maxDoc());
        assertTrue(latest.isDeleted(0));
        assertEquals(1, latest.docFreq(new Term("body", "foxtrot")));
        assertTrue(latest.getGeneration() > generation);
        assertTrue(latest.getVersion() > reader.getVersion());
      }
    }
  }

  public void testOpenIfChanged() throws Exception {
    indexBasic();
    DirectoryReader reader = DirectoryReader.open(dir);
    assertNull(DirectoryReader.openIfChanged(reader));

    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("4", "foxtrot"));
    writer.commit();

    DirectoryReader changed = DirectoryReader.openIfChanged(reader);
    assertNotNull(changed);
    assertEquals(4, changed.numDocs());
    assertEquals(3, reader.numDocs());
    reader.close();
    assertEquals("foxtrot", changed.document(changed.firstDocID(new Term("id", "4"))).get("body"));
    assertNull(DirectoryReader.openIfChanged(changed));
    changed.close();
  }

  public void testOpenIfChangedAfterSchemaChange() throws Exception {
    indexBasic();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      IndexWriter writer = newWriter(dir, newIndexWriterConfig());
      writer.addField("title", TEXT_TYPE);
      writer.commit();
      try (DirectoryReader changed = DirectoryReader.openIfChanged(reader)) {
        assertNotNull(changed);
        assertTrue(changed.fieldNames().contains("title"));
        assertFalse(reader.fieldNames().contains("title"));
        assertEquals(3, changed.numDocs());
      }
    }
  }

  public void testClosedReader() throws Exception {
    indexBasic();
    DirectoryReader reader = DirectoryReader.open(dir);
    reader.close();
    // closing twice is fine
    reader.close();
    AlreadyClosedException expected = assertThrows(AlreadyClosedException.class, () -> reader.document(0));
    assertEquals("index reader is closed", expected.getMessage());
    assertThrows(AlreadyClosedException.class, () -> reader.docFreq(new Term("body", "alfa")));
    assertThrows(AlreadyClosedException.class, () -> reader.isDeleted(0));
    assertThrows(AlreadyClosedException.class, reader::leaves);
  }

  public void testStoredFields() throws Exception {
    indexBasic();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      Document doc = reader.document(1);
      assertEquals("2", doc.get("id"));
      assertEquals("alfa bravo delta", doc.get("body"));
      Document partial = reader.document(1, Collections.singleton("id"));
      assertEquals("2", partial.get("id"));
      assertNull(partial.get("body"));
      assertThrows(IllegalArgumentException.class, () -> reader.document(3));
      assertThrows(IllegalArgumentException.class, () -> reader.document(-1));
    }
  }

  public void testFieldNames() throws Exception {
    indexBasic();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(Arrays.asList("body", "id", "num", "tag"), Arrays.asList(reader.fieldNames().toArray()));
    }
  }

  public void testTermStatistics() throws Exception {
    indexBasic();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(3, reader.docFreq(new Term("body", "alfa")));
      assertEquals(4f, reader.totalWeight(new Term("body", "alfa")), 0f);
      assertEquals(2, reader.docFreq(new Term("body", "charlie")));
      assertEquals(0f, reader.totalWeight(new Term("body", "zulu")), 0f);
      assertEquals(3, reader.getDocCount("body"));
      assertEquals(0, reader.getDocCount("nofield"));
      assertEquals(0, reader.firstDocID(new Term("body", "alfa")));
      assertEquals(2, reader.firstDocID(new Term("body", "echo")));
      assertEquals(-1, reader.firstDocID(new Term("body", "zulu")));

      PostingsEnum postings = reader.postings(new Term("body", "charlie"));
      assertEquals(0, postings.nextDoc());
      assertEquals(2, postings.nextDoc());
      assertEquals(PostingsEnum.NO_MORE_DOCS, postings.nextDoc());
      assertNull(reader.postings(new Term("body", "zulu")));
    }
  }

  public void testPositions() throws Exception {
    indexBasic();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      PostingsEnum postings = reader.postings(new Term("body", "alfa"));
      assertEquals(0, postings.nextDoc());
      assertArrayEquals(new int[] {0}, postings.positions());
      assertEquals(1, postings.nextDoc());
      assertEquals(2, postings.nextDoc());
      assertArrayEquals(new int[] {0, 3}, postings.positions());
      assertEquals(2f, postings.weight(), 0f);
    }
  }

  public void testFieldLengths() throws Exception {
    indexBasic();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(10, reader.fieldLength("body"));
      assertEquals(3, reader.fieldLength(0, "body"));
      assertEquals(4, reader.fieldLength(2, "body"));
      assertEquals(3, reader.minFieldLength("body"));
      assertEquals(4, reader.maxFieldLength("body"));
      assertEquals(0, reader.fieldLength("nofield"));
      assertEquals(0, reader.minFieldLength("nofield"));
    }
  }

  public void testExpandPrefix() throws Exception {
    dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(2));
    writer.addDocument(newDocument("1", "render rendering"));
    writer.addDocument(newDocument("2", "rent"));
    writer.addDocument(newDocument("3", "renders remote"));
    writer.addDocument(newDocument("4", "rendering"));
    writer.commit(false, false);
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      List<BytesRef> expanded = reader.expandPrefix("body", new BytesRef("rend"));
      assertEquals(Arrays.asList(new BytesRef("render"), new BytesRef("rendering"), new BytesRef("renders")), expanded);
      assertTrue(reader.expandPrefix("body", new BytesRef("x")).isEmpty());
      assertTrue(reader.expandPrefix("nofield", new BytesRef("r")).isEmpty());
      assertEquals(5, reader.expandPrefix("body", new BytesRef("re")).size());
    }
  }

  public void testMostFrequentTerms() throws Exception {
    indexBasic();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      TermStats[] top = HighFreqTerms.mostFrequentTerms(reader, "body", 2, null);
      assertEquals(2, top.length);
      assertEquals(new BytesRef("alfa"), top[0].termtext);
      assertEquals(4f, top[0].totalWeight, 0f);
      assertEquals(3, top[0].docFreq);
      // ties on weight break on the smaller term
      assertEquals(new BytesRef("bravo"), top[1].termtext);

      TermStats[] prefixed = HighFreqTerms.mostFrequentTerms(reader, "body", 10, new BytesRef("d"));
      assertEquals(1, prefixed.length);
      assertEquals(new BytesRef("delta"), prefixed[0].termtext);
      assertEquals(0, HighFreqTerms.mostFrequentTerms(reader, "nofield", 10, null).length);
      assertThrows(IllegalArgumentException.class, () -> HighFreqTerms.mostFrequentTerms(reader, "body", 0, null));
    }
  }

  public void testMostDistinctiveTerms() throws Exception {
    indexBasic();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      TermStats[] top = HighFreqTerms.mostDistinctiveTerms(reader, "body", 5, null);
      assertEquals(5, top.length);
      // alfa occurs in every document, which damps its weight of 4 to 4 * (log(3 / 4) + 1)
      assertEquals(new BytesRef("alfa"), top[0].termtext);
      assertEquals(4 * (Math.log(0.75) + 1), top[0].score, 1e-6);
      assertEquals(new BytesRef("bravo"), top[1].termtext);
      assertEquals(2.0, top[1].score, 1e-6);
      assertEquals(new BytesRef("delta"), top[3].termtext);
      assertEquals(Math.log(1.5) + 1, top[3].score, 1e-6);
      for (int i = 1; i < top.length; i++) {
        assertTrue(top[i - 1].score >= top[i].score);
      }
    }
  }

  public void testTermVectors() throws Exception {
    dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addField("vec", new FieldType().setStored(false)
        .setIndexOptions(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS).setStoreTermVectors(true));
    writer.addDocument(newDocument("1", "alfa").add(newTextField("vec", "zulu yankee zulu")));
    writer.addDocument(newDocument("2", "bravo"));
    writer.commit();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      Terms vector = reader.getTermVector(0, "vec");
      assertNotNull(vector);
      assertEquals(2, vector.size());
      TermsEnum termsEnum = vector.iterator();
      assertEquals(new BytesRef("yankee"), termsEnum.next());
      assertEquals(new BytesRef("zulu"), termsEnum.next());
      PostingsEnum postings = termsEnum.postings();
      assertEquals(0, postings.nextDoc());
      assertArrayEquals(new int[] {0, 2}, postings.positions());
      assertNull(termsEnum.next());
      assertNull(reader.getTermVector(1, "vec"));
      assertNull(reader.getTermVector(0, "body"));
    }
  }
}
