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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.fathom.analysis.Token;
import org.fathom.analysis.TokenStream;
import org.fathom.codecs.BlockPostingsWriter;
import org.fathom.codecs.BlockTermsWriter;
import org.fathom.codecs.ColumnsWriter;
import org.fathom.codecs.FieldLengths;
import org.fathom.codecs.FieldLengthsFormat;
import org.fathom.codecs.StoredFieldsWriter;
import org.fathom.codecs.TermVectorsWriter;
import org.fathom.document.Document;
import org.fathom.document.Field;
import org.fathom.util.ArrayUtil;
import org.fathom.util.BytesRef;
import org.fathom.util.FixedBitSet;
import org.fathom.util.IOUtils;

/**
 * Buffers the documents added to an {@link IndexWriter} in memory and
 * writes them as one new segment on flush.
 * <p>
 * A document is first inverted into a {@link PendingDocument} without
 * touching the buffer; only a document that passed every check is then
 * added. A failing document therefore leaves no trace.
 */
final class IndexingChain {

  // indexed by field number
  private final Map<Integer,PerField> fields = new TreeMap<>();
  private final List<List<StoredValue>> storedDocs = new ArrayList<>();
  private final List<List<PendingVector>> vectorDocs = new ArrayList<>();
  private FixedBitSet deleted = new FixedBitSet(64);
  private int numDeleted;
  private int numDocs;

  /** Number of buffered documents, deleted ones included. */
  int numDocs() {
    return numDocs;
  }

  /** Number of buffered documents that were deleted before the flush. */
  int numDeleted() {
    return numDeleted;
  }

  /**
   * Inverts {@code doc} under {@code schema}. Nothing is buffered yet.
   *
   * @throws IllegalArgumentException if the document names a field unknown to
   *         the schema or carries values its field type cannot hold
   */
  PendingDocument invert(Document doc, FieldInfos schema) throws IOException {
    final PendingDocument pending = new PendingDocument();
    final Map<Integer,InvertedField> inverted = new LinkedHashMap<>();
    for (Field field : doc) {
      final FieldInfo fi = schema.fieldInfo(field.name());
      if (fi == null) {
        throw new IllegalArgumentException("unknown field \"" + field.name() + "\": add it to the schema first");
      }
      if (fi.isIndexed()) {
        InvertedField inv = inverted.get(fi.number);
        if (inv == null) {
          inv = new InvertedField(fi);
          inverted.put(fi.number, inv);
        }
        invertField(field, inv);
      }
      if (fi.isStored() && field.storedValue() != null) {
        pending.stored.add(new StoredValue(fi, field.storedValue()));
      }
      if (fi.getColumnType() != ColumnType.NONE && field.columnValue() != null) {
        final Object value = field.columnValue();
        if (fi.getColumnType() == ColumnType.NUMERIC && value instanceof Long == false) {
          throw new IllegalArgumentException("field \"" + fi.name + "\" keeps a numeric column, cannot hold a binary value");
        }
        if (fi.getColumnType() == ColumnType.BINARY && value instanceof BytesRef == false) {
          throw new IllegalArgumentException("field \"" + fi.name + "\" keeps a binary column, cannot hold a numeric value");
        }
        if (pending.columns.put(fi, value) != null) {
          throw new IllegalArgumentException("column field \"" + fi.name + "\" appears more than once in this document");
        }
      }
    }
    for (InvertedField inv : inverted.values()) {
      pending.inverted.add(inv);
      if (inv.fieldInfo.isUnique()) {
        for (BytesRef term : inv.terms.keySet()) {
          pending.uniqueTerms.add(new Term(inv.fieldInfo.name, term));
        }
      }
      if (inv.fieldInfo.hasVectors() && inv.terms.isEmpty() == false) {
        pending.vectors.add(inv.toVector());
      }
    }
    return pending;
  }

  private static void invertField(Field field, InvertedField inv) throws IOException {
    final FieldInfo fi = inv.fieldInfo;
    if (field.tokenStream() == null) {
      throw new IllegalArgumentException("field \"" + fi.name + "\" is indexed but carries no tokens");
    }
    final IndexOptions options = fi.getIndexOptions();
    // a repeated field continues after the last position of the previous value
    final int positionBase = inv.length == 0 ? 0 : inv.lastPosition + 1;
    final int offsetBase = inv.lastEndOffset;
    try (TokenStream stream = field.tokenStream()) {
      stream.reset();
      while (stream.incrementToken()) {
        final Token token = stream.token();
        final int position = positionBase + token.position();
        if (position < 0) {
          throw new IllegalArgumentException("position overflowed Integer.MAX_VALUE for field \"" + fi.name + "\"");
        }
        if (position < inv.lastPosition) {
          throw new IllegalArgumentException("position " + position + " is before the previous position "
              + inv.lastPosition + " for field \"" + fi.name + "\"");
        }
        inv.lastPosition = position;
        try {
          inv.length = Math.addExact(inv.length, 1);
        } catch (ArithmeticException ae) {
          throw new IllegalArgumentException("too many tokens for field \"" + fi.name + "\"");
        }
        TermOccurrences occurrences = inv.terms.get(token.term());
        if (occurrences == null) {
          occurrences = new TermOccurrences(options);
          inv.terms.put(BytesRef.deepCopyOf(token.term()), occurrences);
        }
        occurrences.add(position, token.boost(), offsetBase + token.startOffset(), offsetBase + token.endOffset(), token.payload());
        inv.lastEndOffset = Math.max(inv.lastEndOffset, offsetBase + token.endOffset());
      }
      stream.end();
    }
  }

  /** Buffers an inverted document and returns its buffer-local id. */
  int add(PendingDocument doc) {
    final int docID = numDocs;
    for (InvertedField inv : doc.inverted) {
      final PerField perField = perField(inv.fieldInfo);
      for (Map.Entry<BytesRef,TermOccurrences> entry : inv.terms.entrySet()) {
        PostingsList postings = perField.terms.get(entry.getKey());
        if (postings == null) {
          postings = new PostingsList();
          perField.terms.put(entry.getKey(), postings);
        }
        final TermOccurrences occurrences = entry.getValue();
        postings.add(docID, occurrences.weight, occurrences.positions(), occurrences.value());
      }
      if (inv.fieldInfo.hasLengths()) {
        perField.lengths = ArrayUtil.grow(perField.lengths, docID + 1);
        perField.lengths[docID] = FieldLengths.encode(inv.length);
        perField.totalLength += inv.length;
      }
    }
    for (Map.Entry<FieldInfo,Object> entry : doc.columns.entrySet()) {
      final PerField perField = perField(entry.getKey());
      if (entry.getKey().getColumnType() == ColumnType.NUMERIC) {
        perField.numericValues = ArrayUtil.grow(perField.numericValues, docID + 1);
        perField.numericValues[docID] = (Long) entry.getValue();
      } else {
        perField.binaryValues = ArrayUtil.grow(perField.binaryValues, docID + 1);
        perField.binaryValues[docID] = BytesRef.deepCopyOf((BytesRef) entry.getValue());
      }
      perField.docsWithValue = FixedBitSet.ensureCapacity(perField.docsWithValue, docID + 1);
      perField.docsWithValue.set(docID);
    }
    storedDocs.add(doc.stored);
    vectorDocs.add(doc.vectors);
    numDocs++;
    return docID;
  }

  private PerField perField(FieldInfo fieldInfo) {
    PerField perField = fields.get(fieldInfo.number);
    if (perField == null) {
      perField = new PerField(fieldInfo);
      fields.put(fieldInfo.number, perField);
    }
    return perField;
  }

  /** Marks a buffered document deleted; returns false if it already was. */
  boolean delete(int docID) {
    if (docID < 0 || docID >= numDocs) {
      throw new IllegalArgumentException("no such document: " + docID + " (buffered docs=" + numDocs + ")");
    }
    deleted = FixedBitSet.ensureCapacity(deleted, docID + 1);
    if (deleted.getAndSet(docID)) {
      return false;
    }
    numDeleted++;
    return true;
  }

  /** Deletes the buffered documents containing {@code term}; returns how many were live. */
  int delete(Term term, FieldInfos schema) {
    final FieldInfo fi = schema.fieldInfo(term.field());
    if (fi == null || fi.isIndexed() == false) {
      return 0;
    }
    final PerField perField = fields.get(fi.number);
    if (perField == null) {
      return 0;
    }
    final PostingsList postings = perField.terms.get(term.bytes());
    if (postings == null) {
      return 0;
    }
    int count = 0;
    for (int i = 0; i < postings.count; i++) {
      if (delete(postings.docs[i])) {
        count++;
      }
    }
    return count;
  }

  /** Returns the live documents of the buffer, or null if none was deleted. */
  FixedBitSet liveDocs() {
    if (numDeleted == 0) {
      return null;
    }
    final FixedBitSet liveDocs = new FixedBitSet(numDocs);
    liveDocs.set(0, numDocs);
    for (int doc = 0; doc < numDocs; doc++) {
      if (deleted.get(doc)) {
        liveDocs.clear(doc);
      }
    }
    return liveDocs;
  }

  /**
   * Writes every buffered document into the segment described by
   * {@code state}. Fields missing from {@code state.fieldInfos} were removed
   * from the schema since their documents were added and are not written.
   */
  void flush(SegmentWriteState state) throws IOException {
    assert state.segmentInfo.maxDoc() == numDocs;
    final FieldInfos schema = state.fieldInfos;

    final FieldLengths lengths = buildLengths(schema);
    FieldLengthsFormat.write(state, lengths);

    final BlockPostingsWriter postingsWriter = new BlockPostingsWriter(state);
    BlockTermsWriter termsWriter = null;
    boolean success = false;
    try {
      termsWriter = new BlockTermsWriter(state, postingsWriter);
      termsWriter.write(new BufferedFields(schema, fields), lengths);
      success = true;
    } finally {
      if (success) {
        IOUtils.close(termsWriter);
      } else {
        IOUtils.closeWhileHandlingException(termsWriter == null ? postingsWriter : termsWriter);
      }
    }

    try (StoredFieldsWriter storedWriter = new StoredFieldsWriter(state)) {
      for (List<StoredValue> storedDoc : storedDocs) {
        storedWriter.startDocument();
        for (StoredValue value : storedDoc) {
          final FieldInfo current = schema.fieldInfo(value.fieldInfo.number);
          if (current != null && current.isStored()) {
            storedWriter.writeField(current, value.value);
          }
        }
        storedWriter.finishDocument();
      }
      storedWriter.finish(numDocs);
    }

    try (ColumnsWriter columnsWriter = new ColumnsWriter(state)) {
      for (FieldInfo fi : schema) {
        final PerField perField = fields.get(fi.number);
        if (fi.getColumnType() == ColumnType.NUMERIC) {
          final long[] values = new long[numDocs];
          final FixedBitSet docsWithField = new FixedBitSet(numDocs);
          if (perField != null) {
            System.arraycopy(perField.numericValues, 0, values, 0, Math.min(numDocs, perField.numericValues.length));
            copyBits(perField.docsWithValue, docsWithField);
          }
          columnsWriter.addNumericField(fi, values, docsWithField);
        } else if (fi.getColumnType() == ColumnType.BINARY) {
          final BytesRef[] values = new BytesRef[numDocs];
          if (perField != null) {
            System.arraycopy(perField.binaryValues, 0, values, 0, Math.min(numDocs, perField.binaryValues.length));
          }
          columnsWriter.addBinaryField(fi, values);
        }
      }
    }

    if (schema.hasVectors()) {
      try (TermVectorsWriter vectorsWriter = new TermVectorsWriter(state)) {
        final List<PendingVector> live = new ArrayList<>();
        for (List<PendingVector> vectorDoc : vectorDocs) {
          live.clear();
          for (PendingVector vector : vectorDoc) {
            final FieldInfo current = schema.fieldInfo(vector.fieldInfo.number);
            if (current != null && current.hasVectors()) {
              live.add(vector);
            }
          }
          vectorsWriter.startDocument(live.size());
          for (PendingVector vector : live) {
            vectorsWriter.startField(vector.fieldInfo, vector.terms.length);
            for (int i = 0; i < vector.terms.length; i++) {
              vectorsWriter.addTerm(vector.terms[i], vector.weights[i], vector.positions[i], vector.values[i]);
            }
          }
          vectorsWriter.finishDocument();
        }
        vectorsWriter.finish(numDocs);
      }
    }
  }

  private FieldLengths buildLengths(FieldInfos schema) {
    final Map<Integer,byte[]> encoded = new HashMap<>();
    final Map<Integer,Long> totals = new HashMap<>();
    for (FieldInfo fi : schema) {
      if (fi.hasLengths() == false) {
        continue;
      }
      final PerField perField = fields.get(fi.number);
      if (perField == null) {
        encoded.put(fi.number, new byte[numDocs]);
        totals.put(fi.number, 0L);
      } else {
        encoded.put(fi.number, Arrays.copyOf(perField.lengths, numDocs));
        totals.put(fi.number, perField.totalLength);
      }
    }
    return new FieldLengths(numDocs, encoded, totals);
  }

  private static void copyBits(FixedBitSet from, FixedBitSet to) {
    final int length = Math.min(from.length(), to.length());
    for (int doc = 0; doc < length; doc++) {
      if (from.get(doc)) {
        to.set(doc);
      }
    }
  }

  /** Buffered data of one field. */
  static final class PerField {
    final FieldInfo fieldInfo;
    final Map<BytesRef,PostingsList> terms = new HashMap<>();
    byte[] lengths = new byte[0];
    long totalLength;
    long[] numericValues = new long[0];
    BytesRef[] binaryValues = new BytesRef[0];
    FixedBitSet docsWithValue = new FixedBitSet(64);

    PerField(FieldInfo fieldInfo) {
      this.fieldInfo = fieldInfo;
    }
  }

  /** Buffered postings of one term, in doc order. */
  static final class PostingsList {
    int[] docs = new int[1];
    float[] weights = new float[1];
    int[][] positions = new int[1][];
    BytesRef[] values = new BytesRef[1];
    int count;

    void add(int doc, float weight, int[] docPositions, BytesRef value) {
      assert count == 0 || docs[count - 1] < doc;
      docs = ArrayUtil.grow(docs, count + 1);
      weights = ArrayUtil.grow(weights, count + 1);
      positions = ArrayUtil.grow(positions, count + 1);
      values = ArrayUtil.grow(values, count + 1);
      docs[count] = doc;
      weights[count] = weight;
      positions[count] = docPositions;
      values[count] = value;
      count++;
    }
  }

  /** A document that was inverted but not buffered yet. */
  static final class PendingDocument {
    final List<InvertedField> inverted = new ArrayList<>();
    final List<StoredValue> stored = new ArrayList<>();
    final Map<FieldInfo,Object> columns = new LinkedHashMap<>();
    final List<PendingVector> vectors = new ArrayList<>();
    // terms of the unique fields, deleted from older documents before the add
    final List<Term> uniqueTerms = new ArrayList<>();
  }

  private static final class InvertedField {
    final FieldInfo fieldInfo;
    final TreeMap<BytesRef,TermOccurrences> terms = new TreeMap<>();
    int length;
    int lastPosition;
    int lastEndOffset;

    InvertedField(FieldInfo fieldInfo) {
      this.fieldInfo = fieldInfo;
    }

    PendingVector toVector() {
      final int size = terms.size();
      final PendingVector vector = new PendingVector(fieldInfo, size);
      int i = 0;
      for (Map.Entry<BytesRef,TermOccurrences> entry : terms.entrySet()) {
        vector.terms[i] = entry.getKey();
        vector.weights[i] = entry.getValue().weight;
        vector.positions[i] = entry.getValue().positions();
        vector.values[i] = entry.getValue().value();
        i++;
      }
      return vector;
    }
  }

  /** The occurrences of one term in one field of one document. */
  private static final class TermOccurrences {
    private final boolean hasFreqs;
    private final boolean hasPositions;
    private final Occurrences.Builder occurrences;
    float weight;
    int[] positions = new int[1];
    int positionCount;
    BytesRef value;

    TermOccurrences(IndexOptions options) {
      this.hasFreqs = options.hasFreqs();
      this.hasPositions = options.hasPositions();
      this.occurrences = options.hasPayloads() ? new Occurrences.Builder() : null;
      this.weight = hasFreqs ? 0f : 1f;
    }

    void add(int position, float boost, int startOffset, int endOffset, BytesRef payload) {
      if (hasFreqs) {
        weight += boost;
      }
      if (hasPositions) {
        positions = ArrayUtil.grow(positions, positionCount + 1);
        positions[positionCount++] = position;
      }
      if (occurrences != null) {
        occurrences.add(startOffset, endOffset, payload);
      }
    }

    int[] positions() {
      return hasPositions ? ArrayUtil.copyOfSubArray(positions, 0, positionCount) : null;
    }

    BytesRef value() {
      if (occurrences == null) {
        return null;
      }
      if (value == null) {
        value = occurrences.build();
      }
      return value;
    }
  }

  private static final class StoredValue {
    final FieldInfo fieldInfo;
    final Object value;

    StoredValue(FieldInfo fieldInfo, Object value) {
      this.fieldInfo = fieldInfo;
      this.value = value;
    }
  }

  private static final class PendingVector {
    final FieldInfo fieldInfo;
    final BytesRef[] terms;
    final float[] weights;
    final int[][] positions;
    final BytesRef[] values;

    PendingVector(FieldInfo fieldInfo, int size) {
      this.fieldInfo = fieldInfo;
      this.terms = new BytesRef[size];
      this.weights = new float[size];
      this.positions = new int[size][];
      this.values = new BytesRef[size];
    }
  }
}
