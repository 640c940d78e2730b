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
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

import org.fathom.index.CorruptIndexException;
import org.fathom.index.FieldInfo;
import org.fathom.index.FieldInfos;
import org.fathom.index.Fields;
import org.fathom.index.IndexFileNames;
import org.fathom.index.PostingsEnum;
import org.fathom.index.SegmentReadState;
import org.fathom.index.TermInfo;
import org.fathom.index.Terms;
import org.fathom.index.TermsEnum;
import org.fathom.store.IndexInput;
import org.fathom.util.BytesRef;
import org.fathom.util.BytesRefBuilder;
import org.fathom.util.IOUtils;

/**
 * Reads the term vectors written by {@link TermVectorsWriter}. The vectors of
 * a document are decoded entirely into memory; each term's postings hold a
 * single document with id 0.
 *
 * @fathom.experimental
 */
public final class TermVectorsReader implements Closeable {

  private final FieldInfos fieldInfos;
  private final int maxDoc;
  private final IndexInput vectorsStream;
  private final IndexInput indexStream;
  private final long indexStart;

  /** Opens the term vectors of the segment described by {@code state}. */
  public TermVectorsReader(SegmentReadState state) throws IOException {
    this.fieldInfos = state.fieldInfos;
    this.maxDoc = state.segmentInfo.maxDoc();
    final String segment = state.segmentInfo.name;
    boolean success = false;
    IndexInput vectorsStream = null;
    IndexInput indexStream = null;
    try {
      indexStream = state.directory.openInput(IndexFileNames.segmentFileName(segment, "", IndexFileNames.VECTORS_INDEX_EXTENSION));
      CodecUtil.checkIndexHeader(indexStream, TermVectorsWriter.INDEX_CODEC_NAME, TermVectorsWriter.VERSION_START,
          TermVectorsWriter.VERSION_CURRENT, state.segmentInfo.getId(), "");
      this.indexStart = indexStream.getFilePointer();
      final long expectedLength = indexStart + (long) maxDoc * Long.BYTES + CodecUtil.footerLength();
      if (indexStream.length() != expectedLength) {
        throw new CorruptIndexException("term vectors index has length " + indexStream.length()
            + " but " + maxDoc + " docs need " + expectedLength, indexStream);
      }
      CodecUtil.retrieveChecksum(indexStream);

      vectorsStream = state.directory.openInput(IndexFileNames.segmentFileName(segment, "", IndexFileNames.VECTORS_EXTENSION));
      CodecUtil.checkIndexHeader(vectorsStream, TermVectorsWriter.DATA_CODEC_NAME, TermVectorsWriter.VERSION_START,
          TermVectorsWriter.VERSION_CURRENT, state.segmentInfo.getId(), "");
      CodecUtil.retrieveChecksum(vectorsStream);

      this.indexStream = indexStream;
      this.vectorsStream = vectorsStream;
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(indexStream, vectorsStream);
      }
    }
  }

  /**
   * Returns the term vectors of {@code docID}, or null if the document has
   * none for the fields of the current schema.
   *
   * @throws IllegalArgumentException if the document does not exist in this segment
   */
  public Fields get(int docID) throws IOException {
    if (docID < 0 || docID >= maxDoc) {
      throw new IllegalArgumentException("no such document: docID=" + docID + " (maxDoc=" + maxDoc + ")");
    }
    final IndexInput index = indexStream.clone();
    index.seek(indexStart + (long) docID * Long.BYTES);
    final IndexInput in = vectorsStream.clone();
    in.seek(index.readLong());

    final TreeMap<String,VectorTerms> fields = new TreeMap<>();
    final int numFields = in.readVInt();
    for (int i = 0; i < numFields; i++) {
      final int fieldNumber = in.readVInt();
      final int numTerms = in.readVInt();
      final byte flags = in.readByte();
      if ((flags & ~(TermVectorsWriter.HAS_POSITIONS | TermVectorsWriter.HAS_VALUES)) != 0) {
        throw new CorruptIndexException("invalid term vector flags: " + flags, in);
      }
      final VectorTerms terms = readTerms(in, numTerms,
          (flags & TermVectorsWriter.HAS_POSITIONS) != 0, (flags & TermVectorsWriter.HAS_VALUES) != 0);
      final FieldInfo info = fieldInfos.fieldInfo(fieldNumber);
      if (info != null && info.hasVectors()) {
        fields.put(info.name, terms);
      }
    }
    return fields.isEmpty() ? null : new VectorFields(fields);
  }

  private static VectorTerms readTerms(IndexInput in, int numTerms, boolean hasPositions, boolean hasValues) throws IOException {
    final BytesRef[] terms = new BytesRef[numTerms];
    final float[] weights = new float[numTerms];
    final int[][] positions = new int[numTerms][];
    final BytesRef[] values = new BytesRef[numTerms];
    final BytesRefBuilder term = new BytesRefBuilder();
    for (int i = 0; i < numTerms; i++) {
      PrefixCodedTerms.readEntry(in, term);
      terms[i] = term.toBytesRef();
      weights[i] = BlockPostingsReader.readWeight(in);
      if (hasPositions) {
        final int count = in.readVInt();
        final int[] termPositions = new int[count];
        int last = 0;
        for (int j = 0; j < count; j++) {
          last += in.readVInt();
          termPositions[j] = last;
        }
        positions[i] = termPositions;
      } else {
        positions[i] = new int[0];
      }
      if (hasValues) {
        values[i] = in.readBytesRef();
      }
    }
    return new VectorTerms(terms, weights, positions, values, hasPositions, hasValues);
  }

  /** Verifies the checksums of both term vectors files. */
  public void checkIntegrity() throws IOException {
    CodecUtil.checksumEntireFile(indexStream);
    CodecUtil.checksumEntireFile(vectorsStream);
  }

  @Override
  public void close() throws IOException {
    IOUtils.close(vectorsStream, indexStream);
  }

  private static final class VectorFields extends Fields {
    private final Map<String,VectorTerms> fields;

    VectorFields(Map<String,VectorTerms> fields) {
      this.fields = fields;
    }

    @Override
    public Iterator<String> iterator() {
      return fields.keySet().iterator();
    }

    @Override
    public Terms terms(String field) {
      return fields.get(field);
    }

    @Override
    public int size() {
      return fields.size();
    }
  }

  private static final class VectorTerms extends Terms {
    final BytesRef[] terms;
    final float[] weights;
    final int[][] positions;
    final BytesRef[] values;
    final boolean hasPositions;
    final boolean hasValues;

    VectorTerms(BytesRef[] terms, float[] weights, int[][] positions, BytesRef[] values, boolean hasPositions, boolean hasValues) {
      this.terms = terms;
      this.weights = weights;
      this.positions = positions;
      this.values = values;
      this.hasPositions = hasPositions;
      this.hasValues = hasValues;
    }

    @Override
    public TermsEnum iterator() {
      return new VectorTermsEnum(this);
    }

    @Override
    public long size() {
      return terms.length;
    }

    @Override
    public double getSumTotalWeight() {
      double sum = 0;
      for (float weight : weights) {
        sum += weight;
      }
      return sum;
    }

    @Override
    public long getSumDocFreq() {
      return terms.length;
    }

    @Override
    public int getDocCount() {
      return terms.length == 0 ? 0 : 1;
    }

    @Override
    public boolean hasFreqs() {
      return true;
    }

    @Override
    public boolean hasPositions() {
      return hasPositions;
    }

    @Override
    public boolean hasValues() {
      return hasValues;
    }
  }

  private static final class VectorTermsEnum extends TermsEnum {
    private final VectorTerms terms;
    private int ord = -1;

    VectorTermsEnum(VectorTerms terms) {
      this.terms = terms;
    }

    @Override
    public BytesRef next() {
      if (ord + 1 >= terms.terms.length) {
        ord = terms.terms.length;
        return null;
      }
      return terms.terms[++ord];
    }

    @Override
    public SeekStatus seekCeil(BytesRef text) {
      int low = 0;
      int high = terms.terms.length - 1;
      while (low <= high) {
        final int mid = (low + high) >>> 1;
        final int cmp = terms.terms[mid].compareTo(text);
        if (cmp < 0) {
          low = mid + 1;
        } else if (cmp > 0) {
          high = mid - 1;
        } else {
          ord = mid;
          return SeekStatus.FOUND;
        }
      }
      ord = low;
      return low == terms.terms.length ? SeekStatus.END : SeekStatus.NOT_FOUND;
    }

    private void ensurePositioned() {
      if (ord < 0 || ord >= terms.terms.length) {
        throw new IllegalStateException("enum is not positioned on a term");
      }
    }

    @Override
    public BytesRef term() {
      return ord >= 0 && ord < terms.terms.length ? terms.terms[ord] : null;
    }

    @Override
    public TermInfo termInfo() {
      ensurePositioned();
      return TermInfo.singleton(0, terms.weights[ord], terms.positions[ord].length);
    }

    @Override
    public int docFreq() {
      ensurePositioned();
      return 1;
    }

    @Override
    public float totalWeight() {
      ensurePositioned();
      return terms.weights[ord];
    }

    @Override
    public PostingsEnum postings() {
      ensurePositioned();
      return new VectorPostingsEnum(terms.weights[ord], terms.positions[ord], terms.values[ord]);
    }
  }

  private static final class VectorPostingsEnum extends PostingsEnum {
    private final float weight;
    private final int[] positions;
    private final BytesRef value;
    private int doc = -1;

    VectorPostingsEnum(float weight, int[] positions, BytesRef value) {
      this.weight = weight;
      this.positions = positions;
      this.value = value;
    }

    @Override
    public int docID() {
      return doc;
    }

    @Override
    public int nextDoc() {
      doc = doc == -1 ? 0 : NO_MORE_DOCS;
      return doc;
    }

    @Override
    public int advance(int target) {
      while (doc < target) {
        nextDoc();
      }
      return doc;
    }

    @Override
    public long cost() {
      return 1;
    }

    @Override
    public float weight() {
      ensureActive();
      return weight;
    }

    @Override
    public int[] positions() {
      ensureActive();
      return positions.clone();
    }

    @Override
    public BytesRef value() {
      ensureActive();
      return value;
    }
  }
}
