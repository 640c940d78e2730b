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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.fathom.codecs.SegmentInfoFormat;
import org.fathom.document.Document;
import org.fathom.document.FieldType;
import org.fathom.index.IndexWriterConfig.OpenMode;
import org.fathom.index.MergePolicy.OneMerge;
import org.fathom.search.DocSetCollector;
import org.fathom.search.IndexSearcher;
import org.fathom.search.Query;
import org.fathom.store.AlreadyClosedException;
import org.fathom.store.Directory;
import org.fathom.store.Lock;
import org.fathom.store.LockObtainFailedException;
import org.fathom.store.TrackingDirectoryWrapper;
import org.fathom.util.Bits;
import org.fathom.util.Constants;
import org.fathom.util.FixedBitSet;
import org.fathom.util.IOUtils;
import org.fathom.util.InfoStream;
import org.fathom.util.StringHelper;
import org.fathom.util.ThreadInterruptedException;

/**
 * The single writer of an index: it adds, updates and deletes documents,
 * evolves the schema and publishes the result as a new commit.
 *
 * <p>{@link IndexWriterConfig#setOpenMode(OpenMode)} chooses between
 * starting a new index and continuing the latest commit. Starting over
 * is allowed while readers are open; they keep their point-in-time view
 * until they reopen.
 *
 * <p>From construction until {@link #commit()} or {@link #cancel()} the
 * writer holds the directory's {@code write.lock}. A second writer waits
 * up to {@link IndexWriterConfig#getWriteLockTimeout()} and then fails
 * with {@link LockObtainFailedException}.
 *
 * <p>Added documents are buffered and written as a new segment every
 * {@link IndexWriterConfig#getMaxBufferedDocs()} documents. Deletions by
 * id, term or query apply to buffered and written documents alike;
 * {@link #deleteAll()} clears the index and {@link #addIndexes(Directory...)}
 * imports other indexes. Readers see none of it until {@link #commit()}
 * publishes the next {@code segments_N} generation, after which the writer
 * is spent and every call throws {@link AlreadyClosedException}.
 *
 * <p>The schema travels with each commit. {@link #addField} and
 * {@link #removeField} change it for the next commit, and documents may
 * only use declared fields.
 *
 * <p>The {@link MergePolicy} picks segments to merge and the
 * {@link MergeScheduler} runs the merges: in the committing thread with
 * {@link SerialMergeScheduler}, or on a thread pool as soon as a flush
 * makes merges eligible with {@link ConcurrentMergeScheduler}. Merging
 * drops deleted documents.
 *
 * <p>All methods may be called from several threads at once.
 */
public class IndexWriter implements Closeable, MergePolicy.MergeContext, MergeScheduler.MergeSource {

  /** Most documents an index may hold; adding more throws {@link IllegalArgumentException}. */
  public static final int MAX_DOCS = Integer.MAX_VALUE - 128;

  /** Key for the source of a segment in the {@link SegmentInfo#getDiagnostics() diagnostics}. */
  public static final String SOURCE = "source";
  /** Source of a segment which results from a merge of other segments. */
  public static final String SOURCE_MERGE = "merge";
  /** Source of a segment which results from a flush. */
  public static final String SOURCE_FLUSH = "flush";
  /** Source of a segment imported by {@link #addIndexes(Directory...)}. */
  public static final String SOURCE_ADD_INDEXES = "addIndexes";

  // how long to sleep between attempts to obtain the write lock
  private static final long WRITE_LOCK_POLL_INTERVAL = 50;

  private enum State { OPEN, COMMITTED, CANCELLED }

  private final Directory directory;
  private final Lock writeLock;
  private final IndexWriterConfig config;
  private final InfoStream infoStream;
  private final MergePolicy mergePolicy;
  private final MergeScheduler mergeScheduler;
  private final IndexFileDeleter deleter;

  // the in-memory view of the index: committed segments plus the ones
  // flushed or merged by this writer
  private final SegmentInfos segmentInfos;
  // segments of the last commit, restored by cancel()
  private List<SegmentCommitInfo> rollbackSegments;
  private FieldInfos rollbackSchema;

  private volatile FieldInfos schema;
  private volatile State state = State.OPEN;

  private IndexingChain chain = new IndexingChain();

  private final Map<SegmentCommitInfo,ReadersAndUpdates> readerMap = new HashMap<>();

  // segments currently being merged
  private final Set<SegmentCommitInfo> mergingSegments = new HashSet<>();
  private final Deque<OneMerge> pendingMerges = new ArrayDeque<>();
  private final Set<OneMerge> runningMerges = new HashSet<>();
  private final List<OneMerge> mergeExceptions = new ArrayList<>();

  // increments every time a change is completed
  private long changeCount;
  private long lastCommitChangeCount;

  // generation of the segments_N file this writer last published or started from
  private final AtomicLong committedGeneration = new AtomicLong(-1);

  // serializes commit() and cancel()
  private final Object commitLock = new Object();

  /**
   * Opens a writer on {@code d}, taking its write lock. The config belongs
   * to this writer from now on and cannot be reused.
   *
   * @throws LockObtainFailedException if another writer holds the write lock
   *           past the configured timeout
   * @throws IndexNotFoundException if the mode is {@link OpenMode#APPEND}
   *           and the directory holds no index
   * @throws IOException if the directory cannot be read or written
   */
  public IndexWriter(Directory d, IndexWriterConfig conf) throws IOException {
    config = conf.setIndexWriter(this);
    infoStream = config.getInfoStream();
    mergePolicy = config.getMergePolicy();
    mergeScheduler = config.getMergeScheduler();
    mergeScheduler.initialize(infoStream);
    directory = d;

    writeLock = obtainWriteLock(d, config.getWriteLockTimeout());

    boolean success = false;
    try {
      final OpenMode mode = config.getOpenMode();
      final String[] files = directory.listAll();
      final boolean indexExists = SegmentInfos.getLastCommitGeneration(files) != -1;

      final SegmentInfos lastCommit = indexExists ? SegmentInfos.readLatestCommit(directory) : null;
      if (lastCommit != null) {
        committedGeneration.set(lastCommit.getGeneration());
      }

      if (mode == OpenMode.CREATE || (mode == OpenMode.CREATE_OR_APPEND && indexExists == false)) {
        // the old commit was read so the new index continues its generations; open readers keep working
        segmentInfos = new SegmentInfos();
        if (lastCommit != null) {
          segmentInfos.updateGenerationVersionAndCounter(lastCommit);
        }
        // a new index is published even when empty
        changeCount = 1;
      } else {
        if (lastCommit == null) {
          throw new IndexNotFoundException("no segments* file found in " + directory + ": files: " + Arrays.toString(files));
        }
        segmentInfos = lastCommit.clone();
      }
      rollbackSegments = segmentInfos.createBackupSegmentInfos();
      schema = segmentInfos.getFieldInfos();
      rollbackSchema = schema;

      synchronized (this) {
        deleter = new IndexFileDeleter(files, directory, lastCommit, segmentInfos, infoStream, this);
        deleter.checkpoint(segmentInfos, false);
      }

      if (infoStream.isEnabled("IW")) {
        messageState();
      }
      success = true;
    } finally {
      if (!success) {
        if (infoStream.isEnabled("IW")) {
          infoStream.message("IW", "init failed, releasing the write lock");
        }
        IOUtils.closeWhileHandlingException(writeLock);
        state = State.CANCELLED;
      }
    }
  }

  private static Lock obtainWriteLock(Directory directory, long timeoutMillis) throws IOException {
    final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
    while (true) {
      try {
        return directory.obtainLock(IndexFileNames.WRITE_LOCK_NAME);
      } catch (LockObtainFailedException e) {
        if (System.nanoTime() - deadline >= 0) {
          throw e;
        }
        try {
          Thread.sleep(WRITE_LOCK_POLL_INTERVAL);
        } catch (InterruptedException ie) {
          throw new ThreadInterruptedException(ie);
        }
      }
    }
  }

  private void messageState() {
    infoStream.message("IW", "\ndir=" + directory + "\n" +
        "index=" + segString() + "\n" +
        "version=" + Constants.FATHOM_VERSION + "\n" +
        config.toString());
  }

  /** @throws AlreadyClosedException once the writer committed or was cancelled */
  protected final void ensureOpen() throws AlreadyClosedException {
    if (state != State.OPEN) {
      throw new AlreadyClosedException("this IndexWriter is no longer usable (" + state.name().toLowerCase(Locale.ROOT) + ")");
    }
  }

  /** Returns true while this writer accepts changes. */
  public boolean isOpen() {
    return state == State.OPEN;
  }

  /** Directory of the index this writer changes. */
  public Directory getDirectory() {
    return directory;
  }

  /** Returns the config this writer was opened with. */
  public IndexWriterConfig getConfig() {
    return config;
  }

  @Override
  public InfoStream getInfoStream() {
    return infoStream;
  }

  /** Returns the schema the next commit will publish. */
  public FieldInfos getFieldInfos() {
    return schema;
  }

  /** Documents of all segments plus the buffered ones, deleted documents included. */
  public synchronized int maxDoc() {
    ensureOpen();
    return segmentInfos.totalMaxDoc() + chain.numDocs();
  }

  /** Returns the number of live documents, the buffered ones included. */
  public synchronized int numDocs() throws IOException {
    ensureOpen();
    int count = chain.numDocs() - chain.numDeleted();
    for (SegmentCommitInfo info : segmentInfos) {
      count += info.info.maxDoc() - numDeletedDocs(info);
    }
    return count;
  }

  /**
   * Returns the generation of the last commit this writer published, or of
   * the commit it was opened on; -1 if the directory holds no commit.
   */
  public long getCommittedGeneration() {
    return committedGeneration.get();
  }

  /** Returns true if this writer holds changes the last commit does not have. */
  public synchronized boolean hasUncommittedChanges() {
    return changeCount != lastCommitChangeCount || chain.numDocs() > 0;
  }

  // ---------------------------------------------------------------- schema

  /**
   * Adds a field to the schema. Adding a field that exists with the same
   * type is a no-op.
   * @throws IllegalArgumentException if the field exists with another type
   */
  public synchronized void addField(String name, FieldType type) {
    ensureOpen();
    final FieldInfos updated = schema.withField(name, type);
    if (updated != schema) {
      schema = updated;
      changeCount++;
      if (infoStream.isEnabled("IW")) {
        infoStream.message("IW", "add field \"" + name + "\" type=" + type);
      }
    }
  }

  /**
   * Removes a field from the schema. Its data stays in existing segments
   * until they are merged, but is no longer visible.
   * @throws IllegalArgumentException if the schema has no such field
   */
  public synchronized void removeField(String name) {
    ensureOpen();
    if (schema.fieldInfo(name) == null) {
      throw new IllegalArgumentException("no field named \"" + name + "\" in the schema");
    }
    schema = schema.withoutField(name);
    changeCount++;
    if (infoStream.isEnabled("IW")) {
      infoStream.message("IW", "remove field \"" + name + "\"");
    }
  }

  // ------------------------------------------------------------- documents

  /**
   * Adds a document.
   *
   * <p>If the schema declares unique fields and the document has a value
   * for one of them, every document holding the same value is deleted
   * first, so the document replaces them.</p>
   *
   * @return the absolute id of the new document: its position after the
   *         documents of all segments and the documents buffered before it
   * @throws IllegalArgumentException if the document uses a field the
   *         schema does not declare, or the index would exceed {@link #MAX_DOCS}
   */
  public int addDocument(Document doc) throws IOException {
    return updateDocument(null, doc);
  }

  /**
   * Same as {@link #addDocument(Document)}; the unique fields of the
   * schema decide which documents are replaced.
   */
  public int updateDocument(Document doc) throws IOException {
    return updateDocument(null, doc);
  }

  /**
   * Deletes the documents containing {@code term}, if it is not null, and
   * adds {@code doc}. No commit can separate the two steps.
   *
   * @return the absolute id of the new document
   */
  public int updateDocument(Term term, Document doc) throws IOException {
    ensureOpen();
    final int docID;
    final boolean flushed;
    synchronized (this) {
      ensureOpen();
      // inverting first leaves the index untouched if the document is invalid
      final IndexingChain.PendingDocument pending = chain.invert(doc, schema);
      final int maxDoc = segmentInfos.totalMaxDoc() + chain.numDocs();
      if (maxDoc >= MAX_DOCS) {
        throw new IllegalArgumentException("number of documents in the index cannot exceed " + MAX_DOCS);
      }
      if (term != null) {
        deleteTerm(term);
      }
      for (Term unique : pending.uniqueTerms) {
        deleteTerm(unique);
      }
      docID = segmentInfos.totalMaxDoc() + chain.add(pending);
      changeCount++;
      flushed = chain.numDocs() >= config.getMaxBufferedDocs() && flush();
    }
    if (flushed) {
      maybeMerge(MergeTrigger.SEGMENT_FLUSH);
    }
    return docID;
  }

  /**
   * Deletes the document with the given absolute id. Deleting a document
   * that is already deleted is a no-op.
   *
   * @return true if the document was live
   * @throws IllegalArgumentException if no document has this id
   */
  public synchronized boolean deleteDocument(int docID) throws IOException {
    ensureOpen();
    if (docID < 0) {
      throw new IllegalArgumentException("no such document: " + docID);
    }
    int docBase = 0;
    for (SegmentCommitInfo info : segmentInfos) {
      final int maxDoc = info.info.maxDoc();
      if (docID < docBase + maxDoc) {
        final boolean deleted = getRld(info).delete(docID - docBase);
        if (deleted) {
          changeCount++;
        }
        return deleted;
      }
      docBase += maxDoc;
    }
    if (docID - docBase >= chain.numDocs()) {
      throw new IllegalArgumentException("no such document: " + docID + " (maxDoc=" + (docBase + chain.numDocs()) + ")");
    }
    final boolean deleted = chain.delete(docID - docBase);
    if (deleted) {
      changeCount++;
    }
    return deleted;
  }

  /** Deletes every document containing {@code term} and returns how many were live. */
  public synchronized int deleteDocuments(Term term) throws IOException {
    ensureOpen();
    final int count = deleteTerm(term);
    if (count > 0) {
      changeCount++;
    }
    return count;
  }

  private int deleteTerm(Term term) throws IOException {
    assert Thread.holdsLock(this);
    final FieldInfo fieldInfo = schema.fieldInfo(term.field());
    if (fieldInfo == null || fieldInfo.isIndexed() == false) {
      return 0;
    }
    int count = 0;
    for (SegmentCommitInfo info : segmentInfos) {
      final ReadersAndUpdates rld = getRld(info);
      final Terms terms = rld.getReader().terms(term.field());
      if (terms == null) {
        continue;
      }
      final TermsEnum termsEnum = terms.iterator();
      if (termsEnum.seekExact(term.bytes()) == false) {
        continue;
      }
      final PostingsEnum postings = termsEnum.postings();
      for (int doc = postings.nextDoc(); doc != PostingsEnum.NO_MORE_DOCS; doc = postings.nextDoc()) {
        if (rld.delete(doc)) {
          count++;
        }
      }
    }
    count += chain.delete(term, schema);
    return count;
  }

  /**
   * Deletes every document matching {@code query} and returns how many
   * were live. Buffered documents are flushed first so the query sees them.
   */
  public int deleteDocuments(Query query) throws IOException {
    ensureOpen();
    final int count;
    final boolean flushed;
    synchronized (this) {
      ensureOpen();
      flushed = flush();
      final List<ReadersAndUpdates> rlds = new ArrayList<>(segmentInfos.size());
      final SegmentReader[] readers = new SegmentReader[segmentInfos.size()];
      try {
        for (int i = 0; i < readers.length; i++) {
          final ReadersAndUpdates rld = getRld(segmentInfos.info(i));
          rlds.add(rld);
          readers[i] = rld.getReadOnlyClone();
        }
      } catch (Throwable t) {
        decRef(Arrays.asList(readers), t);
        throw t;
      }
      final SegmentInfos snapshot = segmentInfos.clone();
      snapshot.setFieldInfos(schema);
      int deleted = 0;
      try (DirectoryReader reader = new DirectoryReader(directory, readers, snapshot)) {
        final DocSetCollector collector = new DocSetCollector(reader.maxDoc());
        new IndexSearcher(reader).search(query, collector);
        final FixedBitSet hits = collector.getDocs();
        for (LeafReaderContext context : reader.leaves()) {
          final ReadersAndUpdates rld = rlds.get(context.ord);
          final int end = context.docBase + context.reader().maxDoc();
          for (int doc = context.docBase; doc < end; doc++) {
            if (hits.get(doc) && rld.delete(doc - context.docBase)) {
              deleted++;
            }
          }
        }
      }
      count = deleted;
      if (count > 0) {
        changeCount++;
      }
      if (infoStream.isEnabled("IW")) {
        infoStream.message("IW", "deleteDocuments query=" + query + " deleted=" + count);
      }
    }
    if (flushed) {
      maybeMerge(MergeTrigger.SEGMENT_FLUSH);
    }
    return count;
  }

  /** Releases the readers, adding any failure to {@code primary}. */
  private static void decRef(List<SegmentReader> readers, Throwable primary) {
    for (SegmentReader reader : readers) {
      if (reader != null) {
        try {
          reader.decRef();
        } catch (Throwable t) {
          primary.addSuppressed(t);
        }
      }
    }
  }

  /**
   * Removes every document: buffered documents, flushed segments and the
   * segments of the last commit. Queued and running merges are aborted.
   * The schema is kept. Like every other change this only becomes visible
   * with the next commit, and {@link #cancel()} undoes it.
   */
  public void deleteAll() throws IOException {
    ensureOpen();
    synchronized (commitLock) {
      ensureOpen();
      abortMerges();
      // aborted merges finish without touching the segment list
      mergeScheduler.sync();
      synchronized (this) {
        abortMerges();
        Throwable th = null;
        for (ReadersAndUpdates rld : readerMap.values()) {
          try {
            rld.dropReaders();
          } catch (Throwable t) {
            th = IOUtils.useOrSuppress(th, t);
          }
        }
        readerMap.clear();
        if (th != null) {
          throw IOUtils.rethrowAlways(th);
        }
        int dropped = segmentInfos.totalMaxDoc() + chain.numDocs();
        chain = new IndexingChain();
        segmentInfos.clear();
        mergeExceptions.clear();
        checkpoint();
        if (infoStream.isEnabled("IW")) {
          infoStream.message("IW", "deleteAll: dropped " + dropped + " documents");
        }
      }
    }
  }

  /** Aborts queued and running merges and releases the segments of the queued ones. */
  private synchronized void abortMerges() {
    for (OneMerge merge : pendingMerges) {
      merge.setAborted();
      mergeFinish(merge);
    }
    pendingMerges.clear();
    for (OneMerge merge : runningMerges) {
      merge.setAborted();
    }
  }

  /**
   * Appends the committed documents of other indexes. Each source is
   * locked against writers while it is read, and its live documents are
   * merged into one new segment of this index, after every document this
   * writer already holds. Fields the schema lacks are added to it before
   * anything is copied, so they stay even if an import fails. Unique
   * fields are not enforced against imported documents.
   *
   * @throws IllegalArgumentException if a source is this writer's directory
   *         or declares a field with a different type, or if the index would
   *         exceed {@link #MAX_DOCS}
   * @throws IndexNotFoundException if a source holds no commit
   * @throws LockObtainFailedException if a writer holds the lock of a source
   */
  public void addIndexes(Directory... sources) throws IOException {
    ensureOpen();
    synchronized (commitLock) {
      ensureOpen();
      List<Lock> locks = new ArrayList<>(sources.length);
      boolean success = false;
      try {
        List<SegmentInfos> commits = new ArrayList<>(sources.length);
        for (Directory source : sources) {
          if (source == directory) {
            throw new IllegalArgumentException("cannot add an index to itself: " + source);
          }
          locks.add(source.obtainLock(IndexFileNames.WRITE_LOCK_NAME));
          commits.add(SegmentInfos.readLatestCommit(source));
        }
        synchronized (this) {
          ensureOpen();
          FieldInfos extended = schema;
          for (SegmentInfos commit : commits) {
            for (FieldInfo field : commit.getFieldInfos()) {
              extended = extended.withField(field.name, field.toFieldType());
            }
          }
          if (extended != schema) {
            schema = extended;
            changeCount++;
          }
          flush();
        }
        for (int i = 0; i < commits.size(); i++) {
          importCommit(sources[i], commits.get(i));
        }
        success = true;
      } finally {
        if (success) {
          IOUtils.close(locks);
        } else {
          IOUtils.closeWhileHandlingException(locks);
        }
      }
    }
    maybeMerge(MergeTrigger.ADD_INDEXES);
  }

  /** Merges the live documents of one source commit into a new segment of this index. */
  private void importCommit(Directory source, SegmentInfos commit) throws IOException {
    List<SegmentReader> readers = new ArrayList<>(commit.size());
    boolean success = false;
    try {
      int live = 0;
      for (SegmentCommitInfo info : commit) {
        SegmentReader reader = new SegmentReader(info, commit.getFieldInfos());
        readers.add(reader);
        live += reader.numDocs();
      }
      if (live > 0) {
        writeImportedSegment(source, commit, readers, live);
      } else if (infoStream.isEnabled("IW")) {
        infoStream.message("IW", "addIndexes: " + source + " has no live documents");
      }
      success = true;
    } finally {
      if (success) {
        IOUtils.close(readers);
      } else {
        IOUtils.closeWhileHandlingException(readers);
      }
    }
  }

  private void writeImportedSegment(Directory source, SegmentInfos commit, List<SegmentReader> readers, int live) throws IOException {
    final SegmentInfo si;
    final FieldInfos target;
    synchronized (this) {
      ensureOpen();
      if ((long) segmentInfos.totalMaxDoc() + chain.numDocs() + live > MAX_DOCS) {
        throw new IllegalArgumentException("number of documents in the index cannot exceed " + MAX_DOCS);
      }
      si = new SegmentInfo(directory, segmentInfos.newSegmentName(), live, diagnostics(SOURCE_ADD_INDEXES), StringHelper.randomId());
      target = schema;
    }
    if (infoStream.isEnabled("IW")) {
      infoStream.message("IW", "addIndexes: import " + live + " docs of " + source + " as segment " + si.name);
    }
    TrackingDirectoryWrapper tracking = new TrackingDirectoryWrapper(directory);
    try {
      OneMerge merge = new OneMerge(commit.asList());
      new SegmentMerger(readers, si, target, infoStream, tracking, merge, true).merge();
      si.setFiles(new HashSet<>(tracking.getCreatedFiles()));
      SegmentInfoFormat.write(tracking, si);
      synchronized (this) {
        ensureOpen();
        segmentInfos.add(new SegmentCommitInfo(si, 0, -1, StringHelper.randomId()));
        checkpoint();
      }
    } catch (Throwable t) {
      synchronized (this) {
        try {
          deleter.deleteNewFiles(tracking.getCreatedFiles());
        } catch (Throwable t2) {
          t.addSuppressed(t2);
        }
      }
      throw t;
    }
  }

  // ----------------------------------------------------------------- flush

  /**
   * Writes the buffered documents as a new segment. The segment is not
   * visible to readers until the next commit.
   * @return true if a segment was written
   */
  private synchronized boolean flush() throws IOException {
    final int numDocs = chain.numDocs();
    if (numDocs == 0) {
      return false;
    }
    if (chain.numDeleted() == numDocs) {
      if (infoStream.isEnabled("IW")) {
        infoStream.message("IW", "drop " + numDocs + " buffered docs: all deleted");
      }
      chain = new IndexingChain();
      return false;
    }

    final String name = segmentInfos.newSegmentName();
    final SegmentInfo si = new SegmentInfo(directory, name, numDocs, diagnostics(SOURCE_FLUSH), StringHelper.randomId());
    final TrackingDirectoryWrapper trackingDir = new TrackingDirectoryWrapper(directory);
    final FieldInfos flushFieldInfos = schema;
    final long t0 = System.nanoTime();
    if (infoStream.isEnabled("IW")) {
      infoStream.message("IW", "flush postings as segment " + name + " numDocs=" + numDocs);
    }

    final SegmentCommitInfo newSegment;
    boolean success = false;
    try {
      chain.flush(new SegmentWriteState(infoStream, trackingDir, si, flushFieldInfos));
      si.setFiles(new HashSet<>(trackingDir.getCreatedFiles()));
      SegmentInfoFormat.write(trackingDir, si);
      newSegment = new SegmentCommitInfo(si, 0, -1, StringHelper.randomId());
      final FixedBitSet liveDocs = chain.liveDocs();
      if (liveDocs != null) {
        readerMap.put(newSegment, ReadersAndUpdates.withPendingDeletes(newSegment, flushFieldInfos, liveDocs));
      }
      segmentInfos.add(newSegment);
      success = true;
    } finally {
      if (success == false) {
        if (infoStream.isEnabled("IW")) {
          infoStream.message("IW", "hit exception flushing segment " + name);
        }
        IOUtils.deleteFilesIgnoringExceptions(directory, trackingDir.getCreatedFiles());
      }
    }

    chain = new IndexingChain();
    checkpoint();
    if (infoStream.isEnabled("IW")) {
      infoStream.message("IW", "flushed " + newSegment + " in " + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0) + " msec");
    }
    return true;
  }

  private static Map<String,String> diagnostics(String source) {
    final Map<String,String> diagnostics = new HashMap<>();
    diagnostics.put(SOURCE, source);
    diagnostics.put("fathom.version", Constants.FATHOM_VERSION);
    diagnostics.put("os", Constants.OS_NAME);
    diagnostics.put("java.version", System.getProperty("java.version"));
    diagnostics.put("timestamp", Long.toString(System.currentTimeMillis()));
    return diagnostics;
  }

  /** Records a change of the segment list; every file it references must already be written. */
  private void checkpoint() throws IOException {
    assert Thread.holdsLock(this);
    changeCount++;
    segmentInfos.changed();
    deleter.checkpoint(segmentInfos, false);
  }

  private ReadersAndUpdates getRld(SegmentCommitInfo info) {
    assert Thread.holdsLock(this);
    ReadersAndUpdates rld = readerMap.get(info);
    if (rld == null) {
      rld = new ReadersAndUpdates(info, schema);
      readerMap.put(info, rld);
    }
    return rld;
  }

  private void dropFullyDeletedSegments() throws IOException {
    assert Thread.holdsLock(this);
    boolean changed = false;
    for (SegmentCommitInfo info : new ArrayList<>(segmentInfos.asList())) {
      if (mergingSegments.contains(info) == false && numDeletedDocs(info) == info.info.maxDoc()) {
        if (infoStream.isEnabled("IW")) {
          infoStream.message("IW", "drop 100% deleted segment " + segString(info));
        }
        segmentInfos.remove(info);
        final ReadersAndUpdates rld = readerMap.remove(info);
        if (rld != null) {
          rld.dropReaders();
        }
        changed = true;
      }
    }
    if (changed) {
      checkpoint();
    }
  }

  // ---------------------------------------------------------------- merges

  @Override
  public synchronized int numDeletesToMerge(SegmentCommitInfo info) {
    return numDeletedDocs(info);
  }

  @Override
  public synchronized int numDeletedDocs(SegmentCommitInfo info) {
    final ReadersAndUpdates rld = readerMap.get(info);
    return rld == null ? info.getDelCount() : rld.getDelCount();
  }

  @Override
  public synchronized Set<SegmentCommitInfo> getMergingSegments() {
    return Collections.unmodifiableSet(new HashSet<>(mergingSegments));
  }

  @Override
  public synchronized OneMerge getNextMerge() {
    if (pendingMerges.isEmpty()) {
      return null;
    }
    final OneMerge merge = pendingMerges.removeFirst();
    runningMerges.add(merge);
    return merge;
  }

  @Override
  public synchronized boolean hasPendingMerges() {
    return pendingMerges.isEmpty() == false;
  }

  @Override
  public synchronized void onMergeFinished(OneMerge merge) {
    mergeFinish(merge);
  }

  private void maybeMerge(MergeTrigger trigger) throws IOException {
    if (mergeScheduler.mergeOnFlush() && updatePendingMerges(trigger)) {
      mergeScheduler.merge(this, trigger);
    }
  }

  private synchronized boolean updatePendingMerges(MergeTrigger trigger) throws IOException {
    if (state != State.OPEN) {
      return false;
    }
    final MergePolicy.MergeSpecification spec = mergePolicy.findMerges(trigger, segmentInfos, this);
    boolean registered = false;
    if (spec != null) {
      for (OneMerge merge : spec.merges) {
        registered |= registerMerge(merge);
      }
    }
    return registered;
  }

  /**
   * Registers one merge of every segment, unless the index already is a
   * single segment without deletions. The merge policy is not consulted.
   */
  private synchronized boolean registerFullMerge() {
    if (state != State.OPEN || mergingSegments.isEmpty() == false || segmentInfos.size() == 0) {
      return false;
    }
    if (segmentInfos.size() == 1 && numDeletedDocs(segmentInfos.info(0)) == 0) {
      return false;
    }
    final OneMerge merge = new OneMerge(new ArrayList<>(segmentInfos.asList()));
    merge.maxNumSegments = 1;
    if (infoStream.isEnabled("IW")) {
      infoStream.message("IW", "optimize: merge all " + segmentInfos.size() + " segments");
    }
    return registerMerge(merge);
  }

  /**
   * Queues a merge and reserves its segments. Returns false, queueing
   * nothing, if a segment is already reserved by another merge or is no
   * longer part of the index.
   */
  private synchronized boolean registerMerge(OneMerge merge) {
    if (merge.registerDone) {
      return true;
    }
    for (SegmentCommitInfo info : merge.segments) {
      if (mergingSegments.contains(info)) {
        if (infoStream.isEnabled("IW")) {
          infoStream.message("IW", "skip merge " + segString(merge.segments) + ": " + segString(info) + " is reserved by another merge");
        }
        return false;
      }
      if (segmentInfos.contains(info) == false) {
        if (infoStream.isEnabled("IW")) {
          infoStream.message("IW", "skip merge " + segString(merge.segments) + ": " + segString(info) + " left the index");
        }
        return false;
      }
    }
    pendingMerges.add(merge);
    mergingSegments.addAll(merge.segments);
    merge.registerDone = true;
    if (infoStream.isEnabled("IW")) {
      infoStream.message("IW", "queued merge " + segString(merge.segments) + ", " + pendingMerges.size() + " queued");
    }
    return true;
  }

  /** Runs one queued merge; on success its segments are replaced by the merged one. */
  @Override
  public void merge(OneMerge merge) throws IOException {
    boolean success = false;
    final long t0 = System.currentTimeMillis();
    try {
      try {
        mergeInit(merge);
        if (infoStream.isEnabled("IW")) {
          infoStream.message("IW", "start merge of " + segString(merge.segments) + " in index " + segString());
        }
        mergeMiddle(merge);
        success = true;
      } catch (Throwable t) {
        handleMergeException(t, merge);
      }
    } finally {
      synchronized (this) {
        try {
          closeMergeReaders(merge, success == false);
        } finally {
          mergeFinish(merge);
        }
        if (success == false) {
          if (infoStream.isEnabled("IW")) {
            infoStream.message("IW", "merge failed");
          }
        } else if (merge.isAborted() == false && mergeScheduler.mergeOnFlush()) {
          // the scheduler picks these up once this merge returns
          updatePendingMerges(MergeTrigger.MERGE_FINISHED);
        }
      }
    }
    if (success && merge.isAborted() == false && merge.info != null && infoStream.isEnabled("IW")) {
      infoStream.message("IW", "merged " + merge.info.info.maxDoc() + " docs in " + (System.currentTimeMillis() - t0) + " msec");
    }
  }

  private void handleMergeException(Throwable t, OneMerge merge) throws IOException {
    if (infoStream.isEnabled("IW")) {
      infoStream.message("IW", "merge of " + segString(merge.segments) + " failed: " + t);
    }
    merge.setException(t);
    if (t instanceof MergePolicy.MergeAbortedException) {
      // cancel() aborted this merge: not a failure
      return;
    }
    synchronized (this) {
      mergeExceptions.add(merge);
    }
    throw IOUtils.rethrowAlways(t);
  }

  /** Snapshots the readers of the merged segments and names the new one. */
  private synchronized void mergeInit(OneMerge merge) throws IOException {
    assert merge.registerDone;
    merge.checkAborted();
    merge.readers = new ArrayList<>(merge.segments.size());
    int liveDocs = 0;
    for (SegmentCommitInfo info : merge.segments) {
      final SegmentReader reader = getRld(info).getReadOnlyClone();
      merge.readers.add(reader);
      liveDocs += reader.numDocs();
    }
    merge.mergeFieldInfos = schema;
    final Map<String,String> diagnostics = diagnostics(SOURCE_MERGE);
    diagnostics.put("mergeMaxNumSegments", Integer.toString(merge.maxNumSegments));
    final SegmentInfo si = new SegmentInfo(directory, segmentInfos.newSegmentName(), liveDocs, diagnostics, StringHelper.randomId());
    merge.setMergeInfo(new SegmentCommitInfo(si, 0, -1, StringHelper.randomId()));
    if (infoStream.isEnabled("IW")) {
      infoStream.message("IW", "merge seg=" + si.name + " " + segString(merge.segments));
    }
  }

  /** Writes the merged segment. Runs without the writer's monitor. */
  private void mergeMiddle(OneMerge merge) throws IOException {
    merge.checkAborted();
    final SegmentInfo si = merge.info.info;
    if (si.maxDoc() == 0) {
      // every document of the merged segments is deleted
      commitMerge(merge, null);
      return;
    }
    final TrackingDirectoryWrapper dirWrapper = new TrackingDirectoryWrapper(directory);
    try {
      final SegmentMerger merger = new SegmentMerger(merge.readers, si, merge.mergeFieldInfos, infoStream, dirWrapper, merge, false);
      final MergeState mergeState = merger.merge();
      si.setFiles(new HashSet<>(dirWrapper.getCreatedFiles()));
      SegmentInfoFormat.write(dirWrapper, si);
      if (infoStream.isEnabled("IW")) {
        infoStream.message("IW", "merged segment size=" + String.format(Locale.ROOT, "%.3f MB", merge.info.sizeInBytes() / 1024. / 1024.));
      }
      commitMerge(merge, mergeState);
    } catch (Throwable t) {
      synchronized (this) {
        try {
          deleter.deleteNewFiles(dirWrapper.getCreatedFiles());
        } catch (Throwable t2) {
          t.addSuppressed(t2);
        }
      }
      throw t;
    }
  }

  /** Replaces the merged segments with the new one, carrying over the
   *  deletes made while the merge ran. */
  private synchronized boolean commitMerge(OneMerge merge, MergeState mergeState) throws IOException {
    if (merge.isAborted()) {
      if (infoStream.isEnabled("IW")) {
        infoStream.message("IW", "commitMerge: merge was aborted, dropping its files");
      }
      if (mergeState != null) {
        deleter.deleteNewFiles(merge.info.files());
      }
      return false;
    }

    final FixedBitSet carriedLiveDocs = mergeState == null ? null : carryOverDeletes(merge, mergeState);
    final boolean dropSegment = mergeState == null || (carriedLiveDocs != null && carriedLiveDocs.cardinality() == 0);

    if (infoStream.isEnabled("IW")) {
      infoStream.message("IW", "commitMerge: " + segString(merge.segments) + " index=" + segString() + (dropSegment ? " (dropped: all deleted)" : ""));
    }

    segmentInfos.applyMergeChanges(merge, dropSegment);
    for (SegmentCommitInfo info : merge.segments) {
      final ReadersAndUpdates rld = readerMap.remove(info);
      if (rld != null) {
        rld.dropReaders();
      }
    }
    if (dropSegment == false && carriedLiveDocs != null) {
      readerMap.put(merge.info, ReadersAndUpdates.withPendingDeletes(merge.info, merge.mergeFieldInfos, carriedLiveDocs));
    }
    checkpoint();
    if (dropSegment && mergeState != null) {
      deleter.deleteNewFiles(merge.info.files());
    }
    return true;
  }

  /** Returns the live docs of the merged segment if documents of the
   *  merged segments were deleted after the merge started, else null. */
  private FixedBitSet carryOverDeletes(OneMerge merge, MergeState mergeState) throws IOException {
    FixedBitSet liveDocs = null;
    for (int i = 0; i < merge.segments.size(); i++) {
      final ReadersAndUpdates rld = readerMap.get(merge.segments.get(i));
      final Bits current = rld == null ? null : rld.getLiveDocs();
      if (current == null) {
        continue;
      }
      final Bits snapshot = mergeState.liveDocs[i];
      for (int doc = 0; doc < mergeState.maxDocs[i]; doc++) {
        if ((snapshot == null || snapshot.get(doc)) && current.get(doc) == false) {
          if (liveDocs == null) {
            liveDocs = new FixedBitSet(merge.info.info.maxDoc());
            liveDocs.set(0, liveDocs.length());
          }
          liveDocs.clear(mergeState.docMaps[i].get(doc));
        }
      }
    }
    if (liveDocs != null && infoStream.isEnabled("IW")) {
      infoStream.message("IW", "commitMerge: carried over " + (liveDocs.length() - liveDocs.cardinality()) + " deletes");
    }
    return liveDocs;
  }

  private void closeMergeReaders(OneMerge merge, boolean suppressExceptions) throws IOException {
    assert Thread.holdsLock(this);
    final List<SegmentReader> readers = merge.readers;
    merge.readers = null;
    if (readers == null) {
      return;
    }
    if (suppressExceptions) {
      final Throwable primary = merge.getException();
      if (primary != null) {
        decRef(readers, primary);
        return;
      }
    }
    Throwable th = null;
    for (SegmentReader reader : readers) {
      try {
        reader.decRef();
      } catch (Throwable t) {
        th = IOUtils.useOrSuppress(th, t);
      }
    }
    if (th != null) {
      throw IOUtils.rethrowAlways(th);
    }
  }

  /** Releases the segments of a finished or aborted merge. */
  private void mergeFinish(OneMerge merge) {
    assert Thread.holdsLock(this);
    if (merge.registerDone) {
      mergingSegments.removeAll(merge.segments);
      merge.registerDone = false;
    }
    runningMerges.remove(merge);
  }

  /**
   * Runs merges until the merge policy finds nothing left to merge, or,
   * when optimizing, until the index is a single segment.
   */
  private void runMerges(boolean optimize) throws IOException {
    if (optimize) {
      // merges started by flushes run to completion first
      mergeScheduler.sync();
      throwIfMergeFailed();
    }
    while (true) {
      final boolean found = optimize ? registerFullMerge() : updatePendingMerges(MergeTrigger.COMMIT);
      if (found == false && hasPendingMerges() == false) {
        break;
      }
      mergeScheduler.merge(this, MergeTrigger.COMMIT);
      mergeScheduler.sync();
      throwIfMergeFailed();
    }
  }

  private synchronized void throwIfMergeFailed() throws IOException {
    if (mergeExceptions.isEmpty()) {
      return;
    }
    final OneMerge merge = mergeExceptions.get(0);
    mergeExceptions.clear();
    throw new IOException("background merge hit exception: " + merge.segString(), merge.getException());
  }

  // ---------------------------------------------------------------- commit

  /**
   * Commits all pending changes and merges by the merge policy, then
   * releases the write lock. Equivalent to {@code commit(true, false)}.
   */
  public void commit() throws IOException {
    commit(true, false);
  }

  /**
   * Flushes the buffered documents, optionally merges segments, and
   * atomically publishes a new commit generation holding every change of
   * this writer. A commit with no change since the last one writes no
   * generation. Afterwards this writer releases the write lock and is no
   * longer usable.
   *
   * <p>If the commit fails the writer stays open: the caller may retry or
   * {@link #cancel()}.</p>
   *
   * @param merge true to run the merges the merge policy selects
   * @param optimize true to merge the whole index into one segment
   * @throws IOException if there is a low-level IO error, or a merge failed
   */
  public void commit(boolean merge, boolean optimize) throws IOException {
    ensureOpen();
    synchronized (commitLock) {
      ensureOpen();
      if (infoStream.isEnabled("IW")) {
        infoStream.message("IW", "commit: start merge=" + merge + " optimize=" + optimize);
      }
      boolean success = false;
      try {
        synchronized (this) {
          flush();
          dropFullyDeletedSegments();
        }
        if (merge || optimize) {
          try {
            runMerges(optimize);
          } catch (Throwable t) {
            synchronized (this) {
              // the exception propagates now; later commits must not report it again
              mergeExceptions.clear();
            }
            throw t;
          }
        }
        mergeScheduler.sync();
        throwIfMergeFailed();
        publishCommit();
        success = true;
      } finally {
        if (success == false && infoStream.isEnabled("IW")) {
          infoStream.message("IW", "hit exception during commit");
        }
      }
      finish(State.COMMITTED);
    }
  }

  private synchronized void publishCommit() throws IOException {
    dropFullyDeletedSegments();
    boolean wroteLiveDocs = false;
    for (SegmentCommitInfo info : segmentInfos) {
      final ReadersAndUpdates rld = readerMap.get(info);
      if (rld != null && rld.writeLiveDocs(directory)) {
        wroteLiveDocs = true;
      }
    }
    if (wroteLiveDocs) {
      checkpoint();
    }

    if (changeCount == lastCommitChangeCount) {
      if (infoStream.isEnabled("IW")) {
        infoStream.message("IW", "commit: skip: no changes pending");
      }
      return;
    }

    segmentInfos.setFieldInfos(schema);
    segmentInfos.changed();
    final Collection<String> files = segmentInfos.files(false);
    if (infoStream.isEnabled("IW")) {
      infoStream.message("IW", "commit: sync " + files.size() + " files; index=" + segString());
    }
    directory.sync(files);
    segmentInfos.prepareCommit(directory);
    final String segmentsFileName = segmentInfos.finishCommit(directory);
    deleter.checkpoint(segmentInfos, true);
    committedGeneration.set(segmentInfos.getGeneration());
    lastCommitChangeCount = changeCount;
    rollbackSegments = segmentInfos.createBackupSegmentInfos();
    rollbackSchema = schema;
    if (infoStream.isEnabled("IW")) {
      infoStream.message("IW", "commit: wrote segments file \"" + segmentsFileName + "\"");
    }
  }

  /**
   * Discards every change made by this writer: buffered documents,
   * flushed and merged segments and deletions. Running merges are aborted.
   * The last commit stays the current generation. Afterwards the write
   * lock is released and this writer is no longer usable.
   *
   * @throws IOException if there is a low-level IO error
   */
  public void cancel() throws IOException {
    ensureOpen();
    synchronized (commitLock) {
      ensureOpen();
      if (infoStream.isEnabled("IW")) {
        infoStream.message("IW", "cancel");
      }
      synchronized (this) {
        abortMerges();
        // no new merges from here on
        state = State.CANCELLED;
      }
      mergeScheduler.sync();

      Throwable th = null;
      synchronized (this) {
        try {
          for (ReadersAndUpdates rld : readerMap.values()) {
            try {
              rld.dropReaders();
            } catch (Throwable t) {
              th = IOUtils.useOrSuppress(th, t);
            }
          }
          readerMap.clear();
          chain = new IndexingChain();
          mergeExceptions.clear();
          segmentInfos.rollbackSegmentInfos(rollbackSegments);
          segmentInfos.setFieldInfos(rollbackSchema);
          schema = rollbackSchema;
          // drops the files of this session
          deleter.checkpoint(segmentInfos, false);
          deleter.refresh();
        } catch (Throwable t) {
          th = IOUtils.useOrSuppress(th, t);
        }
      }
      try {
        finish(State.CANCELLED);
      } catch (Throwable t) {
        th = IOUtils.useOrSuppress(th, t);
      }
      if (th != null) {
        throw IOUtils.rethrowAlways(th);
      }
    }
  }

  /** Closes the readers and the scheduler, and releases the write lock. */
  private void finish(State finalState) throws IOException {
    Throwable th = null;
    try {
      mergeScheduler.close();
    } catch (Throwable t) {
      th = t;
    }
    synchronized (this) {
      state = finalState;
      for (ReadersAndUpdates rld : readerMap.values()) {
        try {
          rld.dropReaders();
        } catch (Throwable t) {
          th = IOUtils.useOrSuppress(th, t);
        }
      }
      readerMap.clear();
      try {
        writeLock.close();
      } catch (Throwable t) {
        th = IOUtils.useOrSuppress(th, t);
      }
    }
    if (infoStream.isEnabled("IW")) {
      infoStream.message("IW", "writer " + finalState.name().toLowerCase(Locale.ROOT) + "; released write lock");
    }
    if (th != null) {
      throw IOUtils.rethrowAlways(th);
    }
  }

  /**
   * Commits if {@link IndexWriterConfig#getCommitOnClose()} is set, else
   * cancels. A no-op once this writer committed or was cancelled.
   */
  @Override
  public void close() throws IOException {
    if (state != State.OPEN) {
      return;
    }
    if (config.getCommitOnClose()) {
      commit();
    } else {
      cancel();
    }
  }

  // -------------------------------------------------------------- messages

  /** Describes every segment, for log messages. */
  public synchronized String segString() {
    return segString(segmentInfos);
  }

  synchronized String segString(Iterable<SegmentCommitInfo> infos) {
    final StringBuilder buffer = new StringBuilder();
    for (final SegmentCommitInfo info : infos) {
      if (buffer.length() > 0) {
        buffer.append(' ');
      }
      buffer.append(segString(info));
    }
    return buffer.toString();
  }

  /** Describes one segment with its pending deletions, for log messages. */
  synchronized String segString(SegmentCommitInfo info) {
    return info.toString(numDeletedDocs(info) - info.getDelCount());
  }

  @Override
  public String toString() {
    return "IndexWriter(" + directory + ", state=" + state.name().toLowerCase(Locale.ROOT) + ")";
  }
}
