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
import org.fathom.util.Bits;

/**
 * Reads one segment. The per-segment readers (terms, stored fields,
 * columns, lengths, vectors) live in a ref-counted {@link SegmentCoreReaders}
 * that readers of the same segment with different deletions share.
 *
 * @fathom.experimental
 */
public final class SegmentReader extends LeafReader {

  private final SegmentCommitInfo si;
  private final Bits liveDocs;
  // below maxDoc - delCount when the writer holds unflushed deletions
  private final int numDocs;

  final SegmentCoreReaders core;

  /** Opens a new core for {@code si} and reads its committed deletions. */
  SegmentReader(SegmentCommitInfo si, FieldInfos fieldInfos) throws IOException {
    this.si = si.clone();
    core = new SegmentCoreReaders(si.info.dir, si, fieldInfos);
    try {
      liveDocs = si.hasDeletions() ? LiveDocsFormat.readLiveDocs(si.info.dir, si) : null;
    } catch (Throwable t) {
      core.decRef();
      throw t;
    }
    numDocs = si.info.maxDoc() - si.getDelCount();
  }

  /** Shares the core of {@code shared} with the given live docs, of which {@code numDocs} are set. */
  SegmentReader(SegmentCommitInfo si, SegmentReader shared, Bits liveDocs, int numDocs) {
    int maxDoc = si.info.maxDoc();
    if (numDocs > maxDoc) {
      throw new IllegalArgumentException("numDocs=" + numDocs + " exceeds maxDoc=" + maxDoc);
    }
    if (liveDocs != null && liveDocs.length() != maxDoc) {
      throw new IllegalArgumentException("live docs cover " + liveDocs.length() + " docs, segment has " + maxDoc);
    }
    this.si = si.clone();
    this.liveDocs = liveDocs;
    this.numDocs = numDocs;
    this.core = shared.core;
    core.incRef();
  }

  /** Shares the core of {@code shared}, reading the deletions committed for {@code si}. */
  static SegmentReader withDeletions(SegmentCommitInfo si, SegmentReader shared) throws IOException {
    Bits liveDocs = si.hasDeletions() ? LiveDocsFormat.readLiveDocs(si.info.dir, si) : null;
    return new SegmentReader(si, shared, liveDocs, si.info.maxDoc() - si.getDelCount());
  }

  @Override
  public Bits getLiveDocs() {
    ensureOpen();
    return liveDocs;
  }

  @Override
  public FieldInfos getFieldInfos() {
    ensureOpen();
    return core.coreFieldInfos;
  }

  @Override
  public int numDocs() {
    return numDocs;
  }

  @Override
  public int maxDoc() {
    return si.info.maxDoc();
  }

  @Override
  public Terms terms(String field) throws IOException {
    ensureOpen();
    return core.fields.terms(field);
  }

  @Override
  public void document(int docID, StoredFieldVisitor visitor) throws IOException {
    ensureOpen();
    checkDocID(docID);
    core.fieldsReader.visitDocument(docID, visitor);
  }

  @Override
  public Fields getTermVectors(int docID) throws IOException {
    ensureOpen();
    checkDocID(docID);
    return core.termVectorsReader == null ? null : core.termVectorsReader.get(docID);
  }

  /** The field's info if it holds a column of the given type, else null. */
  private FieldInfo columnField(String field, ColumnType type) {
    FieldInfo info = core.coreFieldInfos.fieldInfo(field);
    return info != null && info.getColumnType() == type ? info : null;
  }

  @Override
  public NumericColumn getNumericColumn(String field) throws IOException {
    ensureOpen();
    FieldInfo info = columnField(field, ColumnType.NUMERIC);
    return info == null ? null : core.columnsReader.getNumeric(info);
  }

  @Override
  public BinaryColumn getBinaryColumn(String field) throws IOException {
    ensureOpen();
    FieldInfo info = columnField(field, ColumnType.BINARY);
    return info == null ? null : core.columnsReader.getBinary(info);
  }

  @Override
  public long totalFieldLength(String field) {
    ensureOpen();
    FieldInfo info = core.coreFieldInfos.fieldInfo(field);
    return info == null ? 0 : core.lengths.total(info.number);
  }

  @Override
  public int documentFieldLength(int docID, String field) {
    ensureOpen();
    checkDocID(docID);
    FieldInfo info = core.coreFieldInfos.fieldInfo(field);
    return info == null ? 0 : core.lengths.get(info.number, docID);
  }

  @Override
  public void checkIntegrity() throws IOException {
    ensureOpen();
    core.fields.checkIntegrity();
    core.fieldsReader.checkIntegrity();
    core.columnsReader.checkIntegrity();
    if (core.termVectorsReader != null) {
      core.termVectorsReader.checkIntegrity();
    }
  }

  @Override
  protected void doClose() throws IOException {
    core.decRef();
  }

  public String getSegmentName() {
    return si.info.name;
  }

  public SegmentCommitInfo getSegmentInfo() {
    return si;
  }

  /** The directory of the segment's files. Usable after close. */
  public Directory directory() {
    return si.info.dir;
  }

  @Override
  public String toString() {
    // deletions the writer holds but did not write yet
    int pendingDeletes = si.info.maxDoc() - numDocs - si.getDelCount();
    return si.toString(pendingDeletes);
  }
}
