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
package org.fathom.codecs;


import java.io.Closeable;
import java.io.IOException;

import org.fathom.index.FieldInfo;
import org.fathom.index.FieldInfos;
import org.fathom.index.Fields;
import org.fathom.index.IndexFileNames;
import org.fathom.index.PostingsEnum;
import org.fathom.index.SegmentWriteState;
import org.fathom.index.Terms;
import org.fathom.index.TermsEnum;
import org.fathom.store.ByteBuffersDataOutput;
import org.fathom.store.IndexOutput;
import org.fathom.util.BytesRef;
import org.fathom.util.BytesRefBuilder;
import org.fathom.util.IOUtils;

/**
 * Writes term vectors: for every document, the terms of each field that
 * records vectors, with their weight, positions and value in that document.
 * <ol>
 *   <li>For every document, {@link #startDocument(int)} is called,
 *       informing how many fields will be written.
 *   <li>{@link #startField(FieldInfo, int)} is called for
 *       each field in the document, informing how many terms
 *       will be written for that field.
 *   <li>Within each field, {@link #addTerm} is called
 *       for each term, in term order.
 *   <li>{@link #finishDocument()} ends the document.
 *   <li>After all documents have been written, {@link #finish(int)}
 *       is called for verification/sanity-checks.
 *   <li>Finally the writer is closed ({@link #close()})
 * </ol>
 * <p>
 * The {@code .tvd} file holds, per document: NumFields (VInt), then per field
 * FieldNumber (VInt), NumTerms (VInt), Flags (Byte: 1 = positions,
 * 2 = values) and per term a {@link PrefixCodedTerms} entry, the weight, the
 * positions when flagged (VInt count then deltas) and the value when flagged. The {@code .tvx} file
 * holds the start pointer of every document as an Int64.
 *
 * @fathom.experimental
 */
public final class TermVectorsWriter implements Closeable {

  static final String DATA_CODEC_NAME = "FathomTermVectorsData";
  static final String INDEX_CODEC_NAME = "FathomTermVectorsIndex";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  static final byte HAS_POSITIONS = 0x1;
  static final byte HAS_VALUES = 0x2;

  private final IndexOutput vectorsStream;
  private final IndexOutput indexStream;
  private final ByteBuffersDataOutput bufferedDoc = new ByteBuffersDataOutput();
  private int numDocs;
  private int fieldsLeft = -1;
  private int termsLeft;
  private FieldInfo field;
  private final BytesRefBuilder lastTerm = new BytesRefBuilder();
  private boolean firstTerm;

  /** Creates the term vectors files of the segment described by {@code state}. */
  public TermVectorsWriter(SegmentWriteState state) throws IOException {
    final String segment = state.segmentInfo.name;
    boolean success = false;
    IndexOutput vectorsStream = null;
    IndexOutput indexStream = null;
    try {
      vectorsStream = state.directory.createOutput(IndexFileNames.segmentFileName(segment, "", IndexFileNames.VECTORS_EXTENSION));
      CodecUtil.writeIndexHeader(vectorsStream, DATA_CODEC_NAME, VERSION_CURRENT, state.segmentInfo.getId(), "");
      indexStream = state.directory.createOutput(IndexFileNames.segmentFileName(segment, "", IndexFileNames.VECTORS_INDEX_EXTENSION));
      CodecUtil.writeIndexHeader(indexStream, INDEX_CODEC_NAME, VERSION_CURRENT, state.segmentInfo.getId(), "");
      this.vectorsStream = vectorsStream;
      this.indexStream = indexStream;
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(vectorsStream, indexStream);
      }
    }
  }

  /** Called before writing the term vectors of the document.
   *  {@link #startField(FieldInfo, int)} will
   *  be called <code>numVectorFields</code> times. This is called
   *  even if the document has no vector fields, in this case
   *  <code>numVectorFields</code> is zero. */
  public void startDocument(int numVectorFields) throws IOException {
    if (fieldsLeft != -1) {
      throw new IllegalStateException("previous document was not finished");
    }
    bufferedDoc.reset();
    bufferedDoc.writeVInt(numVectorFields);
    fieldsLeft = numVectorFields;
    field = null;
  }

  /** Called before writing the terms of the field.
   *  {@link #addTerm} will be called <code>numTerms</code> times. */
  public void startField(FieldInfo info, int numTerms) throws IOException {
    if (fieldsLeft <= 0 || termsLeft != 0) {
      throw new IllegalStateException("unexpected field " + info.name);
    }
    if (info.hasVectors() == false) {
      throw new IllegalArgumentException("field \"" + info.name + "\" does not record term vectors");
    }
    fieldsLeft--;
    termsLeft = numTerms;
    field = info;
    lastTerm.clear();
    firstTerm = true;
    bufferedDoc.writeVInt(info.number);
    bufferedDoc.writeVInt(numTerms);
    byte flags = 0;
    if (info.getIndexOptions().hasPositions()) {
      flags |= HAS_POSITIONS;
    }
    if (info.getIndexOptions().hasPayloads()) {
      flags |= HAS_VALUES;
    }
    bufferedDoc.writeByte(flags);
  }

  /**
   * Adds a term of the current field. {@code positions} is ignored unless the
   * field indexes positions, {@code value} unless it keeps values.
   */
  public void addTerm(BytesRef term, float weight, int[] positions, BytesRef value) throws IOException {
    if (termsLeft <= 0) {
      throw new IllegalStateException("too many terms for field " + (field == null ? null : field.name));
    }
    if (firstTerm == false && lastTerm.get().compareTo(term) >= 0) {
      throw new IllegalArgumentException("terms out of order: " + term + " after " + lastTerm.get());
    }
    termsLeft--;
    firstTerm = false;
    PrefixCodedTerms.writeEntry(bufferedDoc, lastTerm.get(), term);
    lastTerm.copyBytes(term);
    BlockPostingsWriter.writeWeight(bufferedDoc, weight);
    if (field.getIndexOptions().hasPositions()) {
      final int count = positions == null ? 0 : positions.length;
      bufferedDoc.writeVInt(count);
      int last = 0;
      for (int i = 0; i < count; i++) {
        if (positions[i] < last) {
          throw new IllegalArgumentException("positions must be ascending, got " + positions[i] + " after " + last);
        }
        bufferedDoc.writeVInt(positions[i] - last);
        last = positions[i];
      }
    }
    if (field.getIndexOptions().hasPayloads()) {
      bufferedDoc.writeBytesRef(value == null ? new BytesRef() : value);
    }
  }

  /** Called when all fields of the document were written. */
  public void finishDocument() throws IOException {
    if (fieldsLeft != 0 || termsLeft != 0) {
      throw new IllegalStateException("document is incomplete: fieldsLeft=" + fieldsLeft + " termsLeft=" + termsLeft);
    }
    fieldsLeft = -1;
    indexStream.writeLong(vectorsStream.getFilePointer());
    bufferedDoc.copyTo(vectorsStream);
    numDocs++;
  }

  /** Called before {@link #close()}, passing in the number
   *  of documents that were written. */
  public void finish(int numDocs) throws IOException {
    if (this.numDocs != numDocs) {
      throw new IllegalStateException("Wrote " + this.numDocs + " docs, finish called with numDocs=" + numDocs);
    }
    CodecUtil.writeFooter(indexStream);
    CodecUtil.writeFooter(vectorsStream);
  }

  /** Safe (but, slowish) method to write every
   *  vector field in the document, used when merging.
   *  {@code vectors} may be null if the document has none. */
  public void addAllDocVectors(Fields vectors, FieldInfos fieldInfos) throws IOException {
    if (vectors == null) {
      startDocument(0);
      finishDocument();
      return;
    }
    int numFields = 0;
    for (String fieldName : vectors) {
      final FieldInfo info = fieldInfos.fieldInfo(fieldName);
      if (info != null && info.hasVectors() && vectors.terms(fieldName) != null) {
        numFields++;
      }
    }
    startDocument(numFields);
    for (String fieldName : vectors) {
      final FieldInfo info = fieldInfos.fieldInfo(fieldName);
      final Terms terms = vectors.terms(fieldName);
      if (info == null || info.hasVectors() == false || terms == null) {
        continue;
      }
      startField(info, (int) terms.size());
      final TermsEnum termsEnum = terms.iterator();
      BytesRef term;
      while ((term = termsEnum.next()) != null) {
        final PostingsEnum postings = termsEnum.postings();
        postings.nextDoc();
        addTerm(term, postings.weight(), postings.positions(), postings.value());
      }
    }
    finishDocument();
  }

  @Override
  public void close() throws IOException {
    IOUtils.close(vectorsStream, indexStream);
  }
}
