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


import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.fathom.document.Document;
import org.fathom.document.FieldType;
import org.fathom.search.Query;
import org.fathom.store.AlreadyClosedException;
import org.fathom.store.Directory;
import org.fathom.util.InfoStream;
import org.fathom.util.NamedThreadFactory;
import org.fathom.util.ThreadInterruptedException;

/**
 * Applies batches of changes to an index from a single background thread.
 *
 * <p>Producers fill a {@link Batch} and {@link #submit(Batch) submit} it
 * without waiting for the write lock. The worker opens an
 * {@link IndexWriter} per batch, applies its operations in the order they
 * were added, and commits. Batches are applied strictly in submission
 * order. The returned future completes with the generation of the commit
 * that holds the batch, or with the exception that made the batch fail; a
 * failed batch is cancelled and leaves the index as it was.</p>
 *
 * <p>{@link #close()} waits for every submitted batch, then stops the
 * worker.</p>
 */
public final class AsyncIndexWriter implements Closeable {

  private static final AtomicInteger WORKER_COUNT = new AtomicInteger();

  private final Directory directory;
  private final Supplier<IndexWriterConfig> configFactory;
  private final InfoStream infoStream;
  private final ExecutorService worker;
  private final AtomicInteger batchCount = new AtomicInteger();

  /**
   * Creates an async writer over the given directory.
   * @param configFactory returns a fresh config for each batch; a config
   *        can only serve one {@link IndexWriter}
   */
  public AsyncIndexWriter(Directory directory, Supplier<IndexWriterConfig> configFactory) {
    this.directory = directory;
    this.configFactory = configFactory;
    this.infoStream = configFactory.get().getInfoStream();
    this.worker = Executors.newSingleThreadExecutor(new NamedThreadFactory("async-writer-" + WORKER_COUNT.getAndIncrement()));
  }

  /**
   * Queues the batch. Batches are applied in the order of their submission.
   * @return the generation of the commit holding the batch
   * @throws AlreadyClosedException if this writer was closed
   */
  public Future<Long> submit(Batch batch) {
    final Batch pending = batch.drain();
    final int id = batchCount.getAndIncrement();
    if (infoStream.isEnabled("AIW")) {
      infoStream.message("AIW", "submit batch #" + id + " (" + pending.operations.size() + " operations)");
    }
    try {
      return worker.submit(() -> apply(id, pending.operations, pending.merge, pending.optimize));
    } catch (RejectedExecutionException e) {
      throw new AlreadyClosedException("this AsyncIndexWriter is closed", e);
    }
  }

  private long apply(int id, List<Operation> operations, boolean merge, boolean optimize) throws IOException {
    final IndexWriter writer = new IndexWriter(directory, configFactory.get());
    try {
      for (Operation operation : operations) {
        operation.apply(writer);
      }
      writer.commit(merge, optimize);
    } catch (Throwable t) {
      if (infoStream.isEnabled("AIW")) {
        infoStream.message("AIW", "batch #" + id + " failed: " + t);
      }
      if (writer.isOpen()) {
        try {
          writer.cancel();
        } catch (Throwable t2) {
          t.addSuppressed(t2);
        }
      }
      throw t;
    }
    final long generation = writer.getCommittedGeneration();
    if (infoStream.isEnabled("AIW")) {
      infoStream.message("AIW", "batch #" + id + " committed generation " + generation);
    }
    return generation;
  }

  /** Waits for the submitted batches, then stops the worker. */
  @Override
  public void close() {
    worker.shutdown();
    try {
      while (worker.awaitTermination(1, TimeUnit.SECONDS) == false) {
        if (infoStream.isEnabled("AIW")) {
          infoStream.message("AIW", "close: waiting for pending batches");
        }
      }
    } catch (InterruptedException ie) {
      throw new ThreadInterruptedException(ie);
    }
    if (infoStream.isEnabled("AIW")) {
      infoStream.message("AIW", "closed after " + batchCount.get() + " batches");
    }
  }

  @FunctionalInterface
  private interface Operation {
    void apply(IndexWriter writer) throws IOException;
  }

  /**
   * Changes to apply together in one commit. A batch may be reused after
   * it was submitted; submitting empties it and restores the default
   * commit arguments.
   */
  public static final class Batch {
    private final List<Operation> operations = new ArrayList<>();
    private boolean merge = true;
    private boolean optimize;

    /** @see IndexWriter#addField */
    public Batch addField(String name, FieldType type) {
      return add(w -> w.addField(name, type));
    }

    /** @see IndexWriter#removeField */
    public Batch removeField(String name) {
      return add(w -> w.removeField(name));
    }

    /** @see IndexWriter#addDocument */
    public Batch addDocument(Document doc) {
      return add(w -> w.addDocument(doc));
    }

    /** @see IndexWriter#updateDocument(Document) */
    public Batch updateDocument(Document doc) {
      return add(w -> w.updateDocument(doc));
    }

    /** @see IndexWriter#updateDocument(Term, Document) */
    public Batch updateDocument(Term term, Document doc) {
      return add(w -> w.updateDocument(term, doc));
    }

    /** @see IndexWriter#deleteDocuments(Term) */
    public Batch deleteDocuments(Term term) {
      return add(w -> w.deleteDocuments(term));
    }

    /** @see IndexWriter#deleteDocuments(Query) */
    public Batch deleteDocuments(Query query) {
      return add(w -> w.deleteDocuments(query));
    }

    /** @see IndexWriter#deleteAll() */
    public Batch deleteAll() {
      return add(IndexWriter::deleteAll);
    }

    /** @see IndexWriter#addIndexes(Directory...) */
    public Batch addIndexes(Directory... sources) {
      final Directory[] copy = sources.clone();
      return add(w -> w.addIndexes(copy));
    }

    /** Sets the arguments of the {@link IndexWriter#commit(boolean, boolean) commit} ending the batch. */
    public synchronized Batch setCommit(boolean merge, boolean optimize) {
      this.merge = merge;
      this.optimize = optimize;
      return this;
    }

    /** Number of operations in this batch. */
    public synchronized int size() {
      return operations.size();
    }

    private synchronized Batch add(Operation operation) {
      operations.add(operation);
      return this;
    }

    /** Moves the operations and commit arguments into a new batch, resetting this one. */
    private synchronized Batch drain() {
      final Batch drained = new Batch();
      drained.operations.addAll(operations);
      drained.merge = merge;
      drained.optimize = optimize;
      operations.clear();
      merge = true;
      optimize = false;
      return drained;
    }
  }
}
