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
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;

import org.fathom.document.Document;
import org.fathom.document.DocumentStoredFieldVisitor;
import org.fathom.store.AlreadyClosedException;
import org.fathom.util.Bits;
import org.fathom.util.BytesRef;

/**
 * A point-in-time, read-only view of an index. Documents added or deleted
 * through an {@link IndexWriter} after the view was opened stay invisible
 * until a new reader is obtained, usually from
 * {@link DirectoryReader#open(org.fathom.store.Directory)} or
 * {@link DirectoryReader#openIfChanged(DirectoryReader)}.
 *
 * <p>Only two kinds exist. A {@link LeafReader} (in practice a
 * {@link SegmentReader}) reads one segment: stored fields, columns, lengths,
 * terms and postings. A {@link DirectoryReader} stitches the segments of a
 * commit together and answers term statistics across them; per-segment
 * structures such as columns are reached through {@link #leaves()}.
 *
 * <p>Document numbers are only valid within one reader. Merges renumber
 * documents, so a number must not be kept across reopens.
 *
 * <p>Readers are safe for concurrent use. Their lifetime is governed by a
 * reference count that starts at one; {@link #close()} releases the
 * caller's own reference.
 */
public abstract class IndexReader implements Closeable {

  private final AtomicInteger refs = new AtomicInteger(1);
  private boolean closeCalled;

  IndexReader() {
    if ((this instanceof DirectoryReader || this instanceof LeafReader) == false) {
      throw new Error("subclass LeafReader or DirectoryReader, not IndexReader");
    }
  }

  /** Current reference count; 0 once the reader is closed. */
  public final int getRefCount() {
    return refs.get();
  }

  /**
   * Takes another reference, which must later be released with
   * {@link #decRef()}.
   *
   * @throws AlreadyClosedException if the reader is already closed
   */
  public final void incRef() {
    if (tryIncRef() == false) {
      ensureOpen();
    }
  }

  /** Takes another reference unless the reader is already closed. */
  public final boolean tryIncRef() {
    for (int current = refs.get(); current > 0; current = refs.get()) {
      if (refs.compareAndSet(current, current + 1)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Releases a reference. Releasing the last one closes the reader; if
   * closing fails the reference is kept so the close can be retried.
   */
  public final void decRef() throws IOException {
    // checks the count directly so a reader invalidated by a child can still be released
    if (refs.get() <= 0) {
      throw new AlreadyClosedException("index reader is closed");
    }
    int remaining = refs.decrementAndGet();
    if (remaining < 0) {
      throw new IllegalStateException("reference count dropped to " + remaining);
    }
    if (remaining > 0) {
      return;
    }
    closeCalled = true;
    try {
      doClose();
    } catch (Throwable t) {
      refs.incrementAndGet();
      throw t;
    }
  }

  /** @throws AlreadyClosedException if the last reference was released */
  protected final void ensureOpen() throws AlreadyClosedException {
    if (refs.get() <= 0) {
      throw new AlreadyClosedException("index reader is closed");
    }
  }

  /** Live documents: maxDoc minus deletions. */
  public abstract int numDocs();

  /** Number of document slots, deleted ones included; every document number is below it. */
  public abstract int maxDoc();

  public final int numDeletedDocs() {
    return maxDoc() - numDocs();
  }

  public boolean hasDeletions() {
    return numDeletedDocs() > 0;
  }

  /** Returns the schema this reader exposes. Fields removed from the
   *  schema are invisible even if older segments still carry their data. */
  public abstract FieldInfos getFieldInfos();

  /** Returns the names of all fields of the schema, sorted. */
  public final Set<String> fieldNames() {
    ensureOpen();
    final Set<String> names = new TreeSet<>();
    for (FieldInfo fi : getFieldInfos()) {
      names.add(fi.name);
    }
    return Collections.unmodifiableSet(names);
  }

  /**
   * Returns the reader's leaves, or itself if this reader is atomic.
   * The leaves are ordered by {@link LeafReaderContext#docBase}.
   */
  public abstract List<LeafReaderContext> leaves();

  /** Returns the {@link Terms} of {@code field}, or null if the field has no
   *  terms. For composite readers the terms of all leaves are merged. */
  public abstract Terms terms(String field) throws IOException;

  /** Throws {@link IllegalArgumentException} if {@code docID} was never assigned. */
  final void checkDocID(int docID) {
    if (docID < 0 || docID >= maxDoc()) {
      throw new IllegalArgumentException("no such document: docID=" + docID + " maxDoc=" + maxDoc());
    }
  }

  /** Returns true if the document has been deleted. */
  public boolean isDeleted(int docID) {
    ensureOpen();
    checkDocID(docID);
    final List<LeafReaderContext> leaves = leaves();
    final LeafReaderContext ctx = leaves.get(ReaderUtil.subIndex(docID, leaves));
    final Bits liveDocs = ctx.reader().getLiveDocs();
    return liveDocs != null && liveDocs.get(docID - ctx.docBase) == false;
  }

  /** Feeds the stored fields of a document to {@code visitor}, which decides field by field what to load. */
  public abstract void document(int docID, StoredFieldVisitor visitor) throws IOException;

  /**
   * Loads the stored fields of a document. Fields that were not stored are
   * absent from the result.
   *
   * @throws IllegalArgumentException if the document number was never assigned
   */
  public final Document document(int docID) throws IOException {
    DocumentStoredFieldVisitor loader = new DocumentStoredFieldVisitor();
    document(docID, loader);
    return loader.getDocument();
  }

  /** Loads only the named stored fields of a document. */
  public final Document document(int docID, Set<String> fieldsToLoad) throws IOException {
    DocumentStoredFieldVisitor loader = new DocumentStoredFieldVisitor(fieldsToLoad);
    document(docID, loader);
    return loader.getDocument();
  }

  /** Term vectors of a document as a one-document inverted index (its
   *  only document is 0), or null if the document has none. */
  public abstract Fields getTermVectors(int docID) throws IOException;

  /** Term vector of one field of a document, or null. */
  public final Terms getTermVector(int docID, String field) throws IOException {
    Fields vectors = getTermVectors(docID);
    return vectors == null ? null : vectors.terms(field);
  }

  /**
   * Returns the number of documents containing the
   * <code>term</code>, deleted documents included. This method returns 0 if
   * the term or field does not exist.
   * @see TermsEnum#docFreq()
   */
  public final int docFreq(Term term) throws IOException {
    ensureOpen();
    int total = 0;
    for (LeafReaderContext ctx : leaves()) {
      final TermInfo info = termInfo(ctx.reader(), term);
      if (info != null) {
        total += info.docFreq();
      }
    }
    return total;
  }

  /** Returns the sum of the weights of {@code term} over all documents,
   *  deleted documents included. Returns 0 if the term or field does not exist. */
  public final float totalWeight(Term term) throws IOException {
    ensureOpen();
    double total = 0;
    for (LeafReaderContext ctx : leaves()) {
      final TermInfo info = termInfo(ctx.reader(), term);
      if (info != null) {
        total += info.totalWeight();
      }
    }
    return (float) total;
  }

  private static TermInfo termInfo(LeafReader reader, Term term) throws IOException {
    final Terms terms = reader.terms(term.field());
    if (terms == null) {
      return null;
    }
    return terms.get(term.bytes());
  }

  /** Returns the postings of {@code term} with reader-global document ids,
   *  or null if the field or term does not exist. Deleted documents are
   *  not filtered out: check {@link #isDeleted} or the leaves' live docs. */
  public final PostingsEnum postings(Term term) throws IOException {
    ensureOpen();
    return MultiTerms.getTermPostingsEnum(this, term.field(), term.bytes());
  }

  /** Returns the first live document containing {@code term}, or -1. */
  public final int firstDocID(Term term) throws IOException {
    ensureOpen();
    for (LeafReaderContext ctx : leaves()) {
      final Terms terms = ctx.reader().terms(term.field());
      if (terms == null) {
        continue;
      }
      final TermsEnum termsEnum = terms.iterator();
      if (termsEnum.seekExact(term.bytes()) == false) {
        continue;
      }
      final Bits liveDocs = ctx.reader().getLiveDocs();
      final PostingsEnum postings = termsEnum.postings();
      for (int doc = postings.nextDoc(); doc != PostingsEnum.NO_MORE_DOCS; doc = postings.nextDoc()) {
        if (liveDocs == null || liveDocs.get(doc)) {
          return ctx.docBase + doc;
        }
      }
    }
    return -1;
  }

  /** Returns the terms of {@code field} starting with {@code prefix}, in
   *  order. */
  public final List<BytesRef> expandPrefix(String field, BytesRef prefix) throws IOException {
    ensureOpen();
    final List<BytesRef> result = new ArrayList<>();
    final Terms terms = terms(field);
    if (terms == null) {
      return result;
    }
    final TermsEnum termsEnum = terms.prefix(prefix);
    for (BytesRef term = termsEnum.next(); term != null; term = termsEnum.next()) {
      result.add(BytesRef.deepCopyOf(term));
    }
    return result;
  }

  /** Returns the number of documents that have at least one term for
   *  {@code field}, deleted documents included. */
  public final int getDocCount(String field) throws IOException {
    ensureOpen();
    int total = 0;
    for (LeafReaderContext ctx : leaves()) {
      final Terms terms = ctx.reader().terms(field);
      if (terms != null) {
        total += terms.getDocCount();
      }
    }
    return total;
  }

  /** Returns the exact sum of the lengths of {@code field} over all documents,
   *  deleted documents included. */
  public final long fieldLength(String field) throws IOException {
    ensureOpen();
    long total = 0;
    for (LeafReaderContext ctx : leaves()) {
      total += ctx.reader().totalFieldLength(field);
    }
    return total;
  }

  /** Returns the (quantized) length of {@code field} in a document, 0 when
   *  the document has no tokens in that field or the field keeps no lengths. */
  public final int fieldLength(int docID, String field) throws IOException {
    ensureOpen();
    checkDocID(docID);
    final List<LeafReaderContext> leaves = leaves();
    final LeafReaderContext ctx = leaves.get(ReaderUtil.subIndex(docID, leaves));
    return ctx.reader().documentFieldLength(docID - ctx.docBase, field);
  }

  /** Returns the smallest non-zero length of {@code field} over live
   *  documents, or 0 if no live document has the field. */
  public final int minFieldLength(String field) throws IOException {
    ensureOpen();
    int min = Integer.MAX_VALUE;
    for (LeafReaderContext ctx : leaves()) {
      final LeafReader reader = ctx.reader();
      final Bits liveDocs = reader.getLiveDocs();
      for (int doc = 0; doc < reader.maxDoc(); doc++) {
        if (liveDocs != null && liveDocs.get(doc) == false) {
          continue;
        }
        final int length = reader.documentFieldLength(doc, field);
        if (length > 0 && length < min) {
          min = length;
        }
      }
    }
    return min == Integer.MAX_VALUE ? 0 : min;
  }

  /** Returns the largest length of {@code field} over live documents. */
  public final int maxFieldLength(String field) throws IOException {
    ensureOpen();
    int max = 0;
    for (LeafReaderContext ctx : leaves()) {
      final LeafReader reader = ctx.reader();
      final Bits liveDocs = reader.getLiveDocs();
      for (int doc = 0; doc < reader.maxDoc(); doc++) {
        if (liveDocs == null || liveDocs.get(doc)) {
          max = Math.max(max, reader.documentFieldLength(doc, field));
        }
      }
    }
    return max;
  }

  /** Releases the reference taken when the reader was opened; later calls do nothing. */
  @Override
  public final synchronized void close() throws IOException {
    if (closeCalled == false) {
      closeCalled = true;
      decRef();
    }
  }

  /** Releases files and sub-readers once the last reference is gone. */
  protected abstract void doClose() throws IOException;
}
