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

import org.fathom.codecs.LiveDocsFormat;
import org.fathom.store.Directory;
import org.fathom.store.TrackingDirectoryWrapper;
import org.fathom.util.Bits;
import org.fathom.util.FixedBitSet;
import org.fathom.util.IOUtils;

/** Used by {@link IndexWriter} to hold the open SegmentReader of a segment
 *  and the deletions applied to it since the last commit. */
final class ReadersAndUpdates {

  final SegmentCommitInfo info;
  private final FieldInfos fieldInfos;

  // Set once the segment is opened the first time
  private SegmentReader reader;

  // Live docs including the pending deletes, null until the first delete
  // of a segment that had no deletions
  private FixedBitSet liveDocs;
  private boolean liveDocsShared;

  // Deletes applied since the last write of the live docs
  private int pendingDeleteCount;

  ReadersAndUpdates(SegmentCommitInfo info, FieldInfos fieldInfos) {
    this.info = info;
    this.fieldInfos = fieldInfos;
  }

  /** Creates the holder of a freshly flushed segment whose buffer already
   *  had deletes; they become pending deletes of the segment. */
  static ReadersAndUpdates withPendingDeletes(SegmentCommitInfo info, FieldInfos fieldInfos, FixedBitSet liveDocs) {
    assert info.getDelCount() == 0 && info.hasDeletions() == false;
    assert liveDocs.length() == info.info.maxDoc();
    final ReadersAndUpdates rld = new ReadersAndUpdates(info, fieldInfos);
    rld.liveDocs = liveDocs;
    rld.pendingDeleteCount = liveDocs.length() - liveDocs.cardinality();
    return rld;
  }

  /** Returns the number of deleted docs, the pending ones included. */
  synchronized int getDelCount() {
    return info.getDelCount() + pendingDeleteCount;
  }

  synchronized int getPendingDeleteCount() {
    return pendingDeleteCount;
  }

  synchronized boolean isFullyDeleted() {
    return getDelCount() == info.info.maxDoc();
  }

  /** Returns a reader over the segment as of its last written deletions. */
  synchronized SegmentReader getReader() throws IOException {
    if (reader == null) {
      reader = new SegmentReader(info, fieldInfos);
      if (liveDocs == null && reader.getLiveDocs() != null) {
        liveDocs = copy(reader.getLiveDocs());
      }
    }
    return reader;
  }

  /** Returns the current live docs, or null if the segment has no deletions at all. */
  synchronized Bits getLiveDocs() throws IOException {
    if (liveDocs == null && info.hasDeletions()) {
      getReader();
    }
    return liveDocs;
  }

  /** Returns true if {@code docID} is deleted, by a pending delete or by the segment's live docs. */
  synchronized boolean isDeleted(int docID) throws IOException {
    final Bits bits = getLiveDocs();
    return bits != null && bits.get(docID) == false;
  }

  /** Deletes {@code docID}; returns false if it was already deleted. */
  synchronized boolean delete(int docID) throws IOException {
    if (docID < 0 || docID >= info.info.maxDoc()) {
      throw new IllegalArgumentException("no such document: " + docID + " (maxDoc=" + info.info.maxDoc() + ")");
    }
    getLiveDocs();
    if (liveDocs == null) {
      liveDocs = new FixedBitSet(info.info.maxDoc());
      liveDocs.set(0, info.info.maxDoc());
    } else if (liveDocsShared) {
      // a merge or a query holds the previous instance
      liveDocs = liveDocs.clone();
      liveDocsShared = false;
    }
    if (liveDocs.getAndClear(docID) == false) {
      return false;
    }
    pendingDeleteCount++;
    return true;
  }

  /**
   * Returns a reader sharing the core of {@link #getReader()} that sees
   * every delete applied so far. Later deletes do not change it.
   */
  synchronized SegmentReader getReadOnlyClone() throws IOException {
    final SegmentReader current = getReader();
    if (liveDocs == null) {
      current.incRef();
      return current;
    }
    liveDocsShared = true;
    return new SegmentReader(info, current, liveDocs.asReadOnlyBits(), info.info.maxDoc() - getDelCount());
  }

  /**
   * Writes the pending deletes as a new live docs generation.
   * Returns true if a file was written.
   */
  synchronized boolean writeLiveDocs(Directory dir) throws IOException {
    if (pendingDeleteCount == 0) {
      return false;
    }
    assert liveDocs.length() == info.info.maxDoc();

    // Do this so we can delete any created files on
    // exception
    final TrackingDirectoryWrapper trackingDir = new TrackingDirectoryWrapper(dir);
    boolean success = false;
    try {
      LiveDocsFormat.writeLiveDocs(liveDocs, trackingDir, info, pendingDeleteCount);
      success = true;
    } finally {
      if (!success) {
        // Advance only the nextWriteDelGen so that a 2nd
        // attempt to write will write to a new file
        info.advanceNextWriteDelGen();
        IOUtils.deleteFilesIgnoringExceptions(dir, trackingDir.getCreatedFiles());
      }
    }
    info.advanceDelGen();
    info.setDelCount(info.getDelCount() + pendingDeleteCount);
    pendingDeleteCount = 0;
    return true;
  }

  /** Closes the reader, if one was opened. */
  synchronized void dropReaders() throws IOException {
    try {
      if (reader != null) {
        reader.decRef();
      }
    } finally {
      reader = null;
    }
  }

  private static FixedBitSet copy(Bits bits) {
    final FixedBitSet copy = new FixedBitSet(bits.length());
    for (int doc = 0; doc < bits.length(); doc++) {
      if (bits.get(doc)) {
        copy.set(doc);
      }
    }
    return copy;
  }

  @Override
  public String toString() {
    return "ReadersAndUpdates(seg=" + info + " pendingDeleteCount=" + pendingDeleteCount + ")";
  }
}
