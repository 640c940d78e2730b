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


import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.fathom.document.Field;
import org.fathom.search.TermQuery;
import org.fathom.store.AlreadyClosedException;
import org.fathom.store.Directory;
import org.fathom.util.FathomTestCase;

public class TestAsyncIndexWriter extends FathomTestCase {

  private static AsyncIndexWriter.Batch schemaBatch() {
    return new AsyncIndexWriter.Batch()
        .addField("id", ID_TYPE)
        .addField("body", TEXT_TYPE);
  }

  public void testBatchesApplyInOrder() throws Exception {
    Directory dir = newDirectory();
    final List<Future<Long>> futures = new ArrayList<>();
    try (AsyncIndexWriter writer = new AsyncIndexWriter(dir, IndexWriterConfig::new)) {
      futures.add(writer.submit(schemaBatch()));
      for (int i = 0; i < 20; i++) {
        AsyncIndexWriter.Batch batch = new AsyncIndexWriter.Batch()
            .addDocument(newDocument(Integer.toString(i), "batch " + i));
        assertEquals(1, batch.size());
        futures.add(writer.submit(batch));
        assertEquals(0, batch.size());
      }
    }

    long last = -1;
    for (Future<Long> future : futures) {
      assertTrue(future.isDone());
      final long generation = future.get();
      assertTrue(generation > last);
      last = generation;
    }
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(last, reader.getGeneration());
      assertEquals(20, reader.numDocs());
      for (int i = 0; i < 20; i++) {
        assertEquals(Integer.toString(i), reader.document(i).get("id"));
      }
    }
  }

  public void testMixedOperations() throws Exception {
    Directory dir = newDirectory();
    try (AsyncIndexWriter writer = new AsyncIndexWriter(dir, IndexWriterConfig::new)) {
      writer.submit(schemaBatch()
          .addDocument(newDocument("1", "alfa"))
          .addDocument(newDocument("2", "bravo"))
          .addDocument(newDocument("3", "charlie")));
      writer.submit(new AsyncIndexWriter.Batch()
          .deleteDocuments(new Term("id", "1"))
          .deleteDocuments(new TermQuery(new Term("body", "bravo")))
          .updateDocument(new Term("id", "3"), newDocument("4", "delta"))
          .addField("title", TEXT_TYPE)
          .setCommit(true, true)).get();
    }
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.numDocs());
      assertEquals(1, reader.leaves().size());
      assertEquals("4", reader.document(0).get("id"));
      assertTrue(reader.fieldNames().contains("title"));
    }
  }

  public void testFailedBatchLeavesIndexUnchanged() throws Exception {
    Directory dir = newDirectory();
    try (AsyncIndexWriter writer = new AsyncIndexWriter(dir, IndexWriterConfig::new)) {
      final long generation = writer.submit(schemaBatch().addDocument(newDocument("1", "alfa"))).get();
      Future<Long> failed = writer.submit(new AsyncIndexWriter.Batch()
          .addDocument(newDocument("2", "bravo"))
          .addDocument(newDocument("3", "charlie").add(Field.stored("undeclared", "x"))));
      ExecutionException expected = assertThrows(ExecutionException.class, failed::get);
      assertTrue(expected.getCause() instanceof IllegalArgumentException);

      // the worker keeps going after a failed batch
      final long next = writer.submit(new AsyncIndexWriter.Batch().addDocument(newDocument("4", "delta"))).get();
      assertTrue(next > generation);
    }
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(2, reader.numDocs());
      assertEquals(-1, reader.firstDocID(new Term("id", "2")));
      assertEquals(1, reader.firstDocID(new Term("id", "4")));
    }
  }

  public void testSubmitAfterClose() throws Exception {
    Directory dir = newDirectory();
    AsyncIndexWriter writer = new AsyncIndexWriter(dir, IndexWriterConfig::new);
    writer.close();
    assertThrows(AlreadyClosedException.class, () -> writer.submit(schemaBatch()));
  }

  public void testReusedBatchRestoresCommitArguments() throws Exception {
    Directory dir = newDirectory();
    try (AsyncIndexWriter writer = new AsyncIndexWriter(dir,
        () -> new IndexWriterConfig().setMergePolicy(NoMergePolicy.INSTANCE))) {
      writer.submit(schemaBatch().addDocument(newDocument("1", "alfa")));
      writer.submit(new AsyncIndexWriter.Batch().addDocument(newDocument("2", "bravo")));

      AsyncIndexWriter.Batch batch = new AsyncIndexWriter.Batch()
          .addDocument(newDocument("3", "charlie"))
          .setCommit(false, true);
      writer.submit(batch).get();
      try (DirectoryReader reader = DirectoryReader.open(dir)) {
        assertEquals(1, reader.leaves().size());
      }
      // later changes to the batch do not reach the submitted one
      batch.addDocument(newDocument("4", "delta"));
      writer.submit(batch).get();
    }
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(4, reader.numDocs());
      assertEquals(2, reader.leaves().size());
    }
  }

  public void testDeleteAllBatch() throws Exception {
    Directory dir = newDirectory();
    try (AsyncIndexWriter writer = new AsyncIndexWriter(dir, IndexWriterConfig::new)) {
      writer.submit(schemaBatch().addDocument(newDocument("1", "alfa")));
      writer.submit(new AsyncIndexWriter.Batch().deleteAll().addDocument(newDocument("2", "bravo"))).get();
    }
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.maxDoc());
      assertEquals("2", reader.document(0).get("id"));
    }
  }
}
