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
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.fathom.analysis.TokenStream;
import org.fathom.document.Document;
import org.fathom.document.Field;
import org.fathom.document.FieldType;
import org.fathom.index.IndexWriterConfig.OpenMode;
import org.fathom.search.IndexSearcher;
import org.fathom.search.TermQuery;
import org.fathom.store.AlreadyClosedException;
import org.fathom.store.Directory;
import org.fathom.store.LockObtainFailedException;
import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;

public class TestIndexWriter extends FathomTestCase {

  public void testAddAndCommit() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    assertEquals(0, writer.addDocument(newDocument("1", "alfa bravo charlie")));
    assertEquals(1, writer.addDocument(newDocument("2", "alfa bravo delta")));
    assertEquals(2, writer.addDocument(newDocument("3", "alfa charlie echo")));
    assertEquals(3, writer.maxDoc());
    writer.commit();
    assertFalse(writer.isOpen());

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(3, reader.numDocs());
      assertEquals(3, reader.maxDoc());
      assertEquals("2", reader.document(1).get("id"));
      assertEquals("alfa charlie echo", reader.document(2).get("body"));
      assertEquals(3, reader.docFreq(new Term("body", "alfa")));
      assertEquals(0, reader.docFreq(new Term("body", "zulu")));
      assertEquals(0, reader.docFreq(new Term("nofield", "alfa")));
    }
  }

  public void testOpenAppendWithoutIndex() throws Exception {
    Directory dir = newDirectory();
    IndexWriterConfig config = newIndexWriterConfig().setOpenMode(OpenMode.APPEND);
    assertThrows(IndexNotFoundException.class, () -> new IndexWriter(dir, config));
    // the failed writer released the lock
    newWriter(dir, newIndexWriterConfig()).commit();
  }

  public void testDocIDsAcrossFlushes() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(3));
    final int numDocs = atLeast(20);
    for (int i = 0; i < numDocs; i++) {
      assertEquals(i, writer.addDocument(newDocument(Integer.toString(i), "text " + i)));
    }
    writer.commit(false, false);
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(numDocs, reader.numDocs());
      assertTrue(reader.leaves().size() > 1);
      for (int i = 0; i < numDocs; i++) {
        assertEquals(Integer.toString(i), reader.document(i).get("id"));
      }
    }
  }

  public void testUnknownField() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    Document doc = newDocument("1", "alfa").add(Field.stored("undeclared", "x"));
    IllegalArgumentException expected = assertThrows(IllegalArgumentException.class, () -> writer.addDocument(doc));
    assertTrue(expected.getMessage().contains("undeclared"));
    assertEquals(0, writer.addDocument(newDocument("2", "bravo")));
    writer.commit();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.numDocs());
      assertEquals(0, reader.docFreq(new Term("body", "alfa")));
    }
  }

  /** Emits two tokens, then fails. */
  private static final class FailingTokenStream extends TokenStream {
    private int count;

    @Override
    public boolean incrementToken() throws IOException {
      if (count == 2) {
        throw new IOException("tokenizer failure");
      }
      token.clear();
      token.setTerm(new BytesRef("partial" + count));
      token.setPosition(count++);
      return true;
    }
  }

  public void testFailingDocumentIsRolledBack() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("1", "alfa"));
    Document bad = new Document()
        .add(Field.keyword("id", "1"))
        .add(Field.text("body", "ignored", new FailingTokenStream()));
    IOException expected = assertThrows(IOException.class, () -> writer.addDocument(bad));
    assertEquals("tokenizer failure", expected.getMessage());
    assertEquals(1, writer.numDocs());
    assertEquals(1, writer.addDocument(newDocument("2", "bravo")));
    writer.commit();

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(2, reader.numDocs());
      // the failed document neither replaced document 1 nor left terms behind
      assertEquals(0, reader.firstDocID(new Term("id", "1")));
      assertEquals(0, reader.docFreq(new Term("body", "partial0")));
    }
  }

  public void testWriterIsSingleUse() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("1", "alfa"));
    writer.commit();
    AlreadyClosedException expected = assertThrows(AlreadyClosedException.class, () -> writer.addDocument(newDocument("2", "bravo")));
    assertTrue(expected.getMessage().contains("no longer usable"));
    assertThrows(AlreadyClosedException.class, writer::commit);
    assertThrows(AlreadyClosedException.class, writer::cancel);
    assertThrows(AlreadyClosedException.class, () -> writer.deleteDocuments(new Term("id", "1")));
    // close is a no-op once committed
    writer.close();

    IndexWriter cancelled = newWriter(dir, newIndexWriterConfig());
    cancelled.cancel();
    assertThrows(AlreadyClosedException.class, () -> cancelled.addField("other", TEXT_TYPE));
  }

  public void testCancelDiscardsSession() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("1", "alfa"));
    writer.addDocument(newDocument("2", "bravo"));
    writer.commit();
    final long generation = writer.getCommittedGeneration();
    final Set<String> committedFiles = indexFiles(dir);

    IndexWriter session = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(2));
    for (int i = 3; i < 10; i++) {
      session.addDocument(newDocument(Integer.toString(i), "charlie"));
    }
    session.deleteDocuments(new Term("id", "1"));
    session.addField("extra", TEXT_TYPE);
    session.cancel();

    assertEquals(committedFiles, indexFiles(dir));
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(generation, reader.getGeneration());
      assertEquals(2, reader.numDocs());
      assertFalse(reader.isDeleted(0));
      assertFalse(reader.fieldNames().contains("extra"));
    }
  }

  private static Set<String> indexFiles(Directory dir) throws IOException {
    Set<String> files = new HashSet<>(Arrays.asList(dir.listAll()));
    files.remove(IndexFileNames.WRITE_LOCK_NAME);
    return files;
  }

  public void testCloseWithoutCommitOnClose() throws Exception {
    Directory dir = newDirectory();
    newWriter(dir, newIndexWriterConfig()).commit();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setCommitOnClose(false));
    writer.addDocument(newDocument("1", "alfa"));
    writer.close();
    assertFalse(writer.isOpen());
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(0, reader.numDocs());
    }

    try (IndexWriter committing = newWriter(dir, newIndexWriterConfig())) {
      committing.addDocument(newDocument("1", "alfa"));
    }
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.numDocs());
    }
  }

  public void testDeleteDocumentByID() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(2));
    for (int i = 0; i < 5; i++) {
      writer.addDocument(newDocument(Integer.toString(i), "alfa"));
    }
    writer.commit(false, false);

    writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(100));
    writer.addDocument(newDocument("5", "alfa"));
    writer.addDocument(newDocument("6", "alfa"));
    // committed segment
    assertTrue(writer.deleteDocument(1));
    assertFalse(writer.deleteDocument(1));
    // still buffered
    assertTrue(writer.deleteDocument(6));
    assertFalse(writer.deleteDocument(6));
    final IndexWriter w = writer;
    IllegalArgumentException expected = assertThrows(IllegalArgumentException.class, () -> w.deleteDocument(7));
    assertTrue(expected.getMessage().contains("no such document"));
    assertThrows(IllegalArgumentException.class, () -> w.deleteDocument(-1));
    assertEquals(5, writer.numDocs());
    writer.commit(false, false);

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(5, reader.numDocs());
      assertEquals(7, reader.maxDoc());
      assertTrue(reader.isDeleted(1));
      assertTrue(reader.isDeleted(6));
      assertFalse(reader.isDeleted(5));
      assertThrows(IllegalArgumentException.class, () -> reader.isDeleted(7));
    }
  }

  public void testDeleteByTermCountsLiveDocuments() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(3));
    for (int i = 0; i < 10; i++) {
      writer.addDocument(newDocument(Integer.toString(i), i % 2 == 0 ? "even" : "odd"));
    }
    assertEquals(5, writer.deleteDocuments(new Term("body", "odd")));
    assertEquals(0, writer.deleteDocuments(new Term("body", "odd")));
    assertEquals(0, writer.deleteDocuments(new Term("body", "missing")));
    assertEquals(0, writer.deleteDocuments(new Term("nofield", "odd")));
    assertEquals(2, writer.deleteDocuments(new TermQuery(new Term("id", "0"))) + writer.deleteDocuments(new Term("id", "2")));
    writer.commit();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(3, reader.numDocs());
      assertEquals(3, new IndexSearcher(reader).count(new TermQuery(new Term("body", "even"))));
    }
  }

  public void testIdempotentDelete() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("1", "alfa"));
    writer.commit();
    final long generation = writer.getCommittedGeneration();
    final Set<String> files = indexFiles(dir);

    writer = newWriter(dir, newIndexWriterConfig());
    assertFalse(writer.hasUncommittedChanges());
    assertEquals(0, writer.deleteDocuments(new Term("body", "nomatch")));
    assertEquals(0, writer.deleteDocuments(new TermQuery(new Term("body", "nomatch"))));
    assertFalse(writer.hasUncommittedChanges());
    writer.commit();
    assertEquals(generation, writer.getCommittedGeneration());
    assertEquals(files, indexFiles(dir));
  }

  public void testUpdateViaUniqueField() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig());
    writer.addField("key", ID_TYPE);
    writer.addDocument(new Document().add(Field.keyword("key", "A")));
    writer.commit();
    for (int i = 0; i < 10; i++) {
      writer = new IndexWriter(dir, newIndexWriterConfig());
      writer.updateDocument(new Document().add(Field.keyword("key", "A")));
      writer.commit();
    }
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.numDocs());
      assertEquals("A", reader.document(reader.firstDocID(new Term("key", "A"))).get("key"));
    }
  }

  public void testUniqueFieldReplacesBufferedDocument() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(100));
    writer.addDocument(newDocument("a", "first"));
    writer.addDocument(newDocument("a", "second"));
    assertEquals(1, writer.numDocs());
    writer.commit();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.numDocs());
      assertEquals("second", reader.document(reader.firstDocID(new Term("id", "a"))).get("body"));
    }
  }

  public void testUpdateDocumentByTerm() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("1", "alfa").add(Field.keyword("tag", "red")));
    writer.addDocument(newDocument("2", "bravo").add(Field.keyword("tag", "red")));
    writer.addDocument(newDocument("3", "charlie").add(Field.keyword("tag", "blue")));
    writer.updateDocument(new Term("tag", "red"), newDocument("4", "delta"));
    writer.commit(false, false);
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(2, reader.numDocs());
      assertEquals(-1, reader.firstDocID(new Term("id", "1")));
      assertEquals(-1, reader.firstDocID(new Term("id", "2")));
      assertEquals(3, reader.firstDocID(new Term("id", "4")));
    }
  }

  public void testWriteLockContention() throws Exception {
    Directory dir = newDirectory();
    IndexWriter first = newWriter(dir, newIndexWriterConfig());
    IndexWriterConfig config = newIndexWriterConfig().setWriteLockTimeout(randomIntBetween(0, 50));
    assertThrows(LockObtainFailedException.class, () -> new IndexWriter(dir, config));
    first.addDocument(newDocument("1", "alfa"));
    first.commit();

    IndexWriter second = newWriter(dir, newIndexWriterConfig());
    second.addDocument(newDocument("2", "bravo"));
    second.commit();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(2, reader.numDocs());
    }
  }

  public void testWriterWaitsForLock() throws Exception {
    Directory dir = newDirectory();
    IndexWriter first = newWriter(dir, newIndexWriterConfig());
    Thread committer = new Thread(() -> {
      try {
        Thread.sleep(50);
        first.commit();
      } catch (Exception e) {
        throw new RuntimeException(e);
      }
    });
    committer.start();
    IndexWriter second = newWriter(dir, newIndexWriterConfig().setWriteLockTimeout(10_000));
    committer.join();
    second.addDocument(newDocument("1", "alfa"));
    second.commit();
  }

  public void testSchemaChanges() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addField("title", TEXT_TYPE);
    // same type again is a no-op
    writer.addField("title", TEXT_TYPE);
    FieldType other = new FieldType().setStored(true);
    assertThrows(IllegalArgumentException.class, () -> writer.addField("title", other));
    writer.addDocument(newDocument("1", "alfa").add(newTextField("title", "the title")));
    writer.commit();

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertTrue(reader.fieldNames().contains("title"));
      assertEquals(1, reader.docFreq(new Term("title", "title")));
    }

    IndexWriter remover = newWriter(dir, newIndexWriterConfig());
    remover.removeField("title");
    assertThrows(IllegalArgumentException.class, () -> remover.removeField("title"));
    assertThrows(IllegalArgumentException.class, () -> remover.addDocument(newDocument("2", "b").add(newTextField("title", "x"))));
    remover.commit();

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertFalse(reader.fieldNames().contains("title"));
      assertNull(reader.terms("title"));
      assertEquals(0, reader.docFreq(new Term("title", "title")));
      assertNull(reader.document(0).get("title"));
      assertEquals("1", reader.document(0).get("id"));
    }
  }

  public void testCreateOverExistingIndex() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("1", "alfa"));
    writer.commit();

    try (DirectoryReader old = DirectoryReader.open(dir)) {
      IndexWriter create = newWriter(dir, newIndexWriterConfig().setOpenMode(OpenMode.CREATE));
      create.addDocument(newDocument("2", "bravo"));
      create.commit();
      // the old snapshot still reads the replaced commit
      assertEquals(1, old.numDocs());
      assertEquals("1", old.document(0).get("id"));
      try (DirectoryReader reader = DirectoryReader.open(dir)) {
        assertEquals(1, reader.numDocs());
        assertEquals("2", reader.document(0).get("id"));
      }
    }
  }

  public void testDeleteAll() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(3));
    for (int i = 0; i < 7; i++) {
      writer.addDocument(newDocument(Integer.toString(i), "alfa"));
    }
    writer.commit(false, false);

    writer = newWriter(dir, randomBoolean() ? newIndexWriterConfig() : newConcurrentIndexWriterConfig());
    for (int i = 7; i < 20; i++) {
      writer.addDocument(newDocument(Integer.toString(i), "bravo"));
    }
    writer.deleteAll();
    assertEquals(0, writer.maxDoc());
    assertEquals(0, writer.numDocs());
    // the unique id of a dropped document is free again
    assertEquals(0, writer.addDocument(newDocument("3", "charlie")));
    writer.commit();

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.maxDoc());
      assertEquals("3", reader.document(0).get("id"));
      assertEquals(0, reader.docFreq(new Term("body", "alfa")));
      assertEquals(0, reader.docFreq(new Term("body", "bravo")));
      assertTrue(reader.fieldNames().contains("body"));
    }
  }

  public void testDeleteAllThenCancel() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("1", "alfa"));
    writer.commit();

    IndexWriter session = newWriter(dir, newIndexWriterConfig());
    session.deleteAll();
    session.cancel();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.numDocs());
      assertEquals("1", reader.document(0).get("id"));
    }
  }

  /** Commits an index whose fields are numbered differently from {@link #newWriter}'s. */
  private Directory newSourceIndex(int numDocs) throws IOException {
    Directory source = newDirectory();
    IndexWriter writer = new IndexWriter(source, newIndexWriterConfig().setMaxBufferedDocs(3));
    writer.addField("title", TEXT_TYPE);
    writer.addField("body", TEXT_TYPE);
    writer.addField("id", ID_TYPE);
    for (int i = 0; i < numDocs; i++) {
      writer.addDocument(newDocument("s" + i, "bravo " + i).add(newTextField("title", "title" + i)));
    }
    writer.commit();
    return source;
  }

  public void testAddIndexes() throws Exception {
    Directory source = newSourceIndex(10);
    IndexWriter deleter = new IndexWriter(source, newIndexWriterConfig().setOpenMode(OpenMode.APPEND));
    assertEquals(1, deleter.deleteDocuments(new Term("id", "s4")));
    deleter.commit();

    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("1", "alfa"));
    writer.addDocument(newDocument("2", "alfa bravo"));
    writer.addIndexes(source);
    assertEquals(11, writer.maxDoc());
    writer.addDocument(newDocument("3", "charlie"));
    writer.commit();

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(12, reader.numDocs());
      assertTrue(reader.fieldNames().contains("title"));
      assertEquals("1", reader.document(0).get("id"));
      assertEquals("s0", reader.document(2).get("id"));
      assertEquals("title0", reader.document(2).get("title"));
      // s4 was deleted and is not carried over
      assertEquals("s5", reader.document(6).get("id"));
      assertEquals("bravo 5", reader.document(6).get("body"));
      assertEquals("3", reader.document(11).get("id"));
      assertEquals(10, reader.docFreq(new Term("body", "bravo")));
      assertEquals(0, reader.docFreq(new Term("id", "s4")));
      assertEquals(1, reader.docFreq(new Term("title", "title9")));
      IndexSearcher searcher = new IndexSearcher(reader);
      assertEquals(1, searcher.count(new TermQuery(new Term("id", "s7"))));
      assertEquals(2, searcher.count(new TermQuery(new Term("body", "alfa"))));
    }
    // the source is unchanged and writable again
    try (DirectoryReader reader = DirectoryReader.open(source)) {
      assertEquals(9, reader.numDocs());
    }
    new IndexWriter(source, newIndexWriterConfig().setOpenMode(OpenMode.APPEND)).commit();
  }

  public void testAddIndexesRejectsConflictingType() throws Exception {
    Directory source = newDirectory();
    IndexWriter other = new IndexWriter(source, newIndexWriterConfig());
    other.addField("body", new FieldType().setStored(true));
    other.commit();

    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addDocument(newDocument("1", "alfa"));
    IllegalArgumentException expected = assertThrows(IllegalArgumentException.class, () -> writer.addIndexes(source));
    assertTrue(expected.getMessage().contains("body"));
    assertThrows(IllegalArgumentException.class, () -> writer.addIndexes(dir));
    writer.addDocument(newDocument("2", "bravo"));
    writer.commit();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(2, reader.numDocs());
      assertEquals(1, reader.docFreq(new Term("body", "alfa")));
    }
  }

  public void testAddIndexesWithoutCommit() throws Exception {
    Directory source = newSourceIndex(3);
    Directory empty = newDirectory();
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    assertThrows(IndexNotFoundException.class, () -> writer.addIndexes(source, empty));
    // the lock taken on the first source was released
    new IndexWriter(source, newIndexWriterConfig().setOpenMode(OpenMode.APPEND)).commit();
    writer.commit();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(0, reader.numDocs());
    }
  }

  public void testAddIndexesSkipsEmptySource() throws Exception {
    Directory source = newSourceIndex(2);
    IndexWriter deleter = new IndexWriter(source, newIndexWriterConfig().setOpenMode(OpenMode.APPEND));
    assertEquals(2, deleter.deleteDocuments(new Term("body", "bravo")));
    deleter.commit();

    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig());
    writer.addIndexes(source);
    assertEquals(0, writer.maxDoc());
    writer.commit();
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(0, reader.maxDoc());
      assertTrue(reader.fieldNames().contains("title"));
    }
  }
}
