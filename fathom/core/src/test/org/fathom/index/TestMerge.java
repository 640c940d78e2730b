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


import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.fathom.document.Document;
import org.fathom.document.Field;
import org.fathom.store.Directory;
import org.fathom.store.FilterDirectory;
import org.fathom.store.IndexOutput;
import org.fathom.util.Bits;
import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;

public class TestMerge extends FathomTestCase {

  private static final String[] WORDS = {"alfa", "bravo", "charlie", "delta", "echo", "foxtrot", "golf", "hotel"};

  private static String randomBody() {
    final int numTokens = randomIntBetween(1, 6);
    final StringBuilder sb = new StringBuilder();
    for (int i = 0; i < numTokens; i++) {
      if (i > 0) {
        sb.append(' ');
      }
      sb.append(WORDS[random().nextInt(WORDS.length)]);
    }
    return sb.toString();
  }

  public void testReclaimDeletions() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(3).setMergePolicy(NoMergePolicy.INSTANCE));
    for (int i = 0; i < 9; i++) {
      writer.addDocument(newDocument(Integer.toString(i), "doc" + i));
    }
    writer.commit(false, false);
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(3, reader.leaves().size());
    }

    writer = new IndexWriter(dir, newIndexWriterConfig().setMergePolicy(new LogDocMergePolicy()));
    for (String id : new String[] {"1", "3", "4", "8"}) {
      assertEquals(1, writer.deleteDocuments(new Term("id", id)));
    }
    writer.commit(true, true);

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.leaves().size());
      assertEquals(5, reader.maxDoc());
      assertEquals(5, reader.numDocs());
      assertFalse(reader.hasDeletions());
      // merging keeps the relative order of the documents
      String[] expected = {"0", "2", "5", "6", "7"};
      for (int i = 0; i < expected.length; i++) {
        assertEquals(expected[i], reader.document(i).get("id"));
        assertEquals("doc" + expected[i], reader.document(i).get("body"));
      }
      assertEquals(0, reader.docFreq(new Term("body", "doc4")));
      assertEquals(1, reader.docFreq(new Term("body", "doc7")));
    }
  }

  /** Fails every postings file it is asked to create while {@link #full} is set. */
  private static final class DiskFullDirectory extends FilterDirectory {
    volatile boolean full;

    DiskFullDirectory(Directory in) {
      super(in);
    }

    @Override
    public IndexOutput createOutput(String name) throws IOException {
      if (full && name.endsWith("." + IndexFileNames.POSTINGS_EXTENSION)) {
        throw new IOException("disk full");
      }
      return super.createOutput(name);
    }
  }

  /** Commits nine documents as three segments of three. */
  private static void addThreeSegments(Directory dir) throws IOException {
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(3).setMergePolicy(NoMergePolicy.INSTANCE));
    for (int i = 0; i < 9; i++) {
      writer.addDocument(newDocument(Integer.toString(i), "doc" + i));
    }
    writer.commit(false, false);
  }

  private static void deleteFour(IndexWriter writer) throws IOException {
    for (String id : new String[] {"1", "3", "4", "8"}) {
      assertEquals(1, writer.deleteDocuments(new Term("id", id)));
    }
  }

  private static List<String> indexFiles(Directory dir) throws IOException {
    final List<String> files = new ArrayList<>();
    for (String file : dir.listAll()) {
      if (file.equals(IndexFileNames.WRITE_LOCK_NAME) == false) {
        files.add(file);
      }
    }
    return files;
  }

  private static boolean causedBy(Throwable t, String message) {
    for (; t != null; t = t.getCause()) {
      if (message.equals(t.getMessage())) {
        return true;
      }
    }
    return false;
  }

  public void testOptimizeWithNoMergePolicy() throws Exception {
    Directory dir = newDirectory();
    addThreeSegments(dir);
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig().setMergePolicy(NoMergePolicy.INSTANCE));
    deleteFour(writer);
    writer.commit(true, true);
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.leaves().size());
      assertEquals(5, reader.maxDoc());
      assertEquals(5, reader.numDocs());
    }

    // a single segment without deletions is left as it is
    writer = new IndexWriter(dir, newIndexWriterConfig().setMergePolicy(NoMergePolicy.INSTANCE));
    writer.commit(true, true);
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.leaves().size());
      assertEquals(5, reader.numDocs());
    }
  }

  public void testFailedOptimizeThenCancelKeepsLastCommit() throws Exception {
    DiskFullDirectory dir = new DiskFullDirectory(newDirectory());
    addThreeSegments(dir);
    final List<String> committed = indexFiles(dir);

    final IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig());
    deleteFour(writer);
    dir.full = true;
    IOException expected = assertThrows(IOException.class, () -> writer.commit(true, true));
    assertTrue(causedBy(expected, "disk full"));
    assertTrue(writer.isOpen());

    writer.cancel();
    assertFalse(writer.isOpen());
    assertEquals(committed, indexFiles(dir));
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(3, reader.leaves().size());
      assertEquals(9, reader.numDocs());
    }

    dir.full = false;
    IndexWriter retry = new IndexWriter(dir, newIndexWriterConfig());
    deleteFour(retry);
    retry.commit(true, true);
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.leaves().size());
      assertEquals(5, reader.numDocs());
      assertEquals(Arrays.asList("0", "2", "5", "6", "7"), Arrays.asList(
          reader.document(0).get("id"), reader.document(1).get("id"), reader.document(2).get("id"),
          reader.document(3).get("id"), reader.document(4).get("id")));
    }
  }

  public void testCommitCanBeRetriedAfterFailedMerge() throws Exception {
    DiskFullDirectory dir = new DiskFullDirectory(newDirectory());
    addThreeSegments(dir);

    final IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig());
    deleteFour(writer);
    dir.full = true;
    assertThrows(IOException.class, () -> writer.commit(true, true));
    assertTrue(writer.isOpen());

    dir.full = false;
    writer.commit(true, true);
    assertFalse(writer.isOpen());
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.leaves().size());
      assertEquals(5, reader.maxDoc());
      assertFalse(reader.hasDeletions());
    }
  }

  public void testFullyDeletedSegmentIsDropped() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(2).setMergePolicy(NoMergePolicy.INSTANCE));
    for (int i = 0; i < 4; i++) {
      writer.addDocument(newDocument(Integer.toString(i), i < 2 ? "gone" : "kept"));
    }
    writer.commit(false, false);

    writer = new IndexWriter(dir, newIndexWriterConfig().setMergePolicy(NoMergePolicy.INSTANCE));
    assertEquals(2, writer.deleteDocuments(new Term("body", "gone")));
    writer.commit(false, false);
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.leaves().size());
      assertEquals(2, reader.maxDoc());
      assertEquals("2", reader.document(0).get("id"));
    }
  }

  public void testRandomDeletesAndMerges() throws Exception {
    doTestRandomDeletesAndMerges(false);
  }

  public void testRandomDeletesAndConcurrentMerges() throws Exception {
    doTestRandomDeletesAndMerges(true);
  }

  private void doTestRandomDeletesAndMerges(boolean concurrent) throws Exception {
    Directory dir = newDirectory();
    // id -> body of every live document
    final Map<String,String> expected = new TreeMap<>();
    final int numSessions = randomIntBetween(2, 5);
    int nextID = 0;
    for (int session = 0; session < numSessions; session++) {
      IndexWriter writer = newWriter(dir, concurrent ? newConcurrentIndexWriterConfig() : newIndexWriterConfig());
      final int numOps = atLeast(50);
      for (int op = 0; op < numOps; op++) {
        if (expected.isEmpty() == false && random().nextInt(5) == 0) {
          final List<String> ids = new ArrayList<>(expected.keySet());
          final String id = ids.get(random().nextInt(ids.size()));
          assertEquals(1, writer.deleteDocuments(new Term("id", id)));
          expected.remove(id);
        } else {
          final String id = Integer.toString(nextID++);
          final String body = randomBody();
          writer.addDocument(newDocument(id, body));
          expected.put(id, body);
        }
      }
      writer.commit(randomBoolean(), rarely());
    }

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(expected.size(), reader.numDocs());
      final Map<String,String> actual = new TreeMap<>();
      for (int doc = 0; doc < reader.maxDoc(); doc++) {
        if (reader.isDeleted(doc) == false) {
          Document d = reader.document(doc);
          assertNull(actual.put(d.get("id"), d.get("body")));
        }
      }
      assertEquals(expected, actual);
      checkPostings(reader, expected);
    }

    // force everything into a single clean segment
    IndexWriter writer = newWriter(dir, concurrent ? newConcurrentIndexWriterConfig() : newIndexWriterConfig());
    writer.addDocument(newDocument(Integer.toString(nextID), "final"));
    expected.put(Integer.toString(nextID), "final");
    writer.commit(true, true);
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.leaves().size());
      assertFalse(reader.hasDeletions());
      assertEquals(expected.size(), reader.numDocs());
      checkPostings(reader, expected);
    }
  }

  /** Checks that the postings of every word hold exactly the live documents using it. */
  private static void checkPostings(IndexReader reader, Map<String,String> expected) throws Exception {
    final Map<String,Set<String>> expectedPostings = new HashMap<>();
    for (Map.Entry<String,String> entry : expected.entrySet()) {
      for (String word : entry.getValue().split(" ")) {
        expectedPostings.computeIfAbsent(word, w -> new HashSet<>()).add(entry.getKey());
      }
    }
    for (String word : WORDS) {
      final Set<String> ids = new HashSet<>();
      final PostingsEnum postings = reader.postings(new Term("body", word));
      if (postings != null) {
        int last = -1;
        for (int doc = postings.nextDoc(); doc != PostingsEnum.NO_MORE_DOCS; doc = postings.nextDoc()) {
          assertTrue(doc > last);
          last = doc;
          if (reader.isDeleted(doc) == false) {
            ids.add(reader.document(doc).get("id"));
          }
        }
      }
      assertEquals(word, expectedPostings.getOrDefault(word, new HashSet<>()), ids);
    }
  }

  public void testColumnsSurviveMerge() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(2).setMergePolicy(NoMergePolicy.INSTANCE));
    for (int i = 0; i < 7; i++) {
      Document doc = newDocument(Integer.toString(i), "text");
      if (i % 3 != 0) {
        doc.add(Field.numeric("num", i * 10L)).add(Field.keyword("tag", "t" + i));
      }
      writer.addDocument(doc);
    }
    writer.commit(false, false);

    writer = new IndexWriter(dir, newIndexWriterConfig().setMergePolicy(new LogDocMergePolicy()));
    writer.deleteDocuments(new Term("id", "1"));
    writer.commit(true, true);

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.leaves().size());
      LeafReader leaf = reader.leaves().get(0).reader();
      NumericColumn numbers = leaf.getNumericColumn("num");
      BinaryColumn tags = leaf.getBinaryColumn("tag");
      assertNull(leaf.getNumericColumn("tag"));
      assertNull(leaf.getBinaryColumn("nofield"));
      final Bits liveDocs = leaf.getLiveDocs();
      assertNull(liveDocs);
      for (int doc = 0; doc < leaf.maxDoc(); doc++) {
        final int id = Integer.parseInt(leaf.document(doc).get("id"));
        if (id % 3 == 0) {
          assertFalse(numbers.exists(doc));
          assertFalse(tags.exists(doc));
        } else {
          assertTrue(numbers.exists(doc));
          assertEquals(id * 10L, numbers.get(doc));
          assertEquals(new BytesRef("t" + id), tags.get(doc));
        }
      }
    }
  }
}
