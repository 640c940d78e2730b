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

import org.fathom.index.CorruptIndexException;
import org.fathom.index.FieldInfo;
import org.fathom.index.IndexFileNames;
import org.fathom.index.IndexOptions;
import org.fathom.index.SegmentWriteState;
import org.fathom.index.TermInfo;
import org.fathom.store.ByteBuffersDataOutput;
import org.fathom.store.DataOutput;
import org.fathom.store.IndexOutput;
import org.fathom.util.ArrayUtil;
import org.fathom.util.BytesRef;
import org.fathom.util.IOUtils;

/**
 * Writes the postings lists of a segment into the {@code .pst} file.
 * <p>
 * Postings are pushed term by term: {@link #startTerm()}, then for each
 * document {@link #startDoc}, {@link #addPosition} per occurrence and
 * {@link #finishDoc}, and finally {@link #finishTerm()} which returns the
 * term's {@link TermInfo}.
 * <p>
 * Postings list layout:
 * <ul>
 *   <li>PostingsList --&gt; NumBlocks, SkipEntry<sup>NumBlocks</sup>, Block<sup>NumBlocks</sup>
 *   <li>SkipEntry --&gt; LastDocDelta (VInt), BlockLength (VLong)
 *   <li>Block --&gt; DocDelta<sup>n</sup>, [Weights], [Positions<sup>n</sup>], [Value<sup>n</sup>]
 *   <li>Weights --&gt; AllOnes (Byte 1) | Byte 0, WeightCode<sup>n</sup>
 *   <li>Positions --&gt; Count (VInt), PositionDelta<sup>Count</sup>
 *   <li>Value --&gt; Length (VInt), Bytes
 * </ul>
 * Every block holds {@value #BLOCK_SIZE} postings except the last one.
 * Doc deltas and the skip table's last doc deltas are relative to the last
 * document of the previous block. A term found in a single document of a
 * field without positions writes nothing: its posting is kept in the
 * {@link TermInfo}.
 *
 * @fathom.experimental
 */
public final class BlockPostingsWriter implements Closeable {

  /** Number of postings per block. */
  public static final int BLOCK_SIZE = 128;

  static final String CODEC_NAME = "FathomPostings";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  private final IndexOutput out;

  private final ByteBuffersDataOutput skipBuffer = new ByteBuffersDataOutput();
  private final ByteBuffersDataOutput blockBuffer = new ByteBuffersDataOutput();

  private boolean writeFreqs;
  private boolean writePositions;
  private boolean writeValues;

  // pending postings of the current block
  private final int[] docBuffer = new int[BLOCK_SIZE];
  private final float[] weightBuffer = new float[BLOCK_SIZE];
  private final int[] posCountBuffer = new int[BLOCK_SIZE];
  private final BytesRef[] valueBuffer = new BytesRef[BLOCK_SIZE];
  private int[] posBuffer = new int[BLOCK_SIZE];
  private int bufferUpto;
  private int posBufferUpto;

  // current term
  private int lastBlockDocID;
  private int lastDocID;
  private int docCount;
  private int numBlocks;
  private double totalWeight;
  private int minLength;
  private int maxLength;
  private float minWeight;
  private float maxWeight;
  private int singletonLength;

  // current doc
  private int lastPosition;
  private boolean inDoc;

  /** Creates the postings file of the segment described by {@code state}. */
  public BlockPostingsWriter(SegmentWriteState state) throws IOException {
    final String fileName = IndexFileNames.segmentFileName(state.segmentInfo.name, "", IndexFileNames.POSTINGS_EXTENSION);
    out = state.directory.createOutput(fileName);
    boolean success = false;
    try {
      CodecUtil.writeIndexHeader(out, CODEC_NAME, VERSION_CURRENT, state.segmentInfo.getId(), "");
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(out);
      }
    }
  }

  /** Sets the field whose terms are pushed next. */
  public void setField(FieldInfo fieldInfo) {
    final IndexOptions options = fieldInfo.getIndexOptions();
    writeFreqs = options.hasFreqs();
    writePositions = options.hasPositions();
    writeValues = options.hasPayloads();
  }

  /** Starts a new term. */
  public void startTerm() {
    lastBlockDocID = -1;
    lastDocID = -1;
    docCount = 0;
    numBlocks = 0;
    totalWeight = 0;
    minLength = Integer.MAX_VALUE;
    maxLength = 0;
    minWeight = Float.POSITIVE_INFINITY;
    maxWeight = Float.NEGATIVE_INFINITY;
    bufferUpto = 0;
    posBufferUpto = 0;
    skipBuffer.reset();
    blockBuffer.reset();
  }

  /**
   * Adds a document to the current term.
   *
   * @param docID the document, larger than the previous one of this term
   * @param weight the term's weight in the document; ignored unless the field indexes freqs
   * @param fieldLength the length of the field in the document
   */
  public void startDoc(int docID, float weight, int fieldLength) throws IOException {
    if (docID <= lastDocID || docID < 0) {
      throw new CorruptIndexException("docs out of order (" + docID + " <= " + lastDocID + " )", out);
    }
    if (writeFreqs == false) {
      weight = 1f;
    } else if (weight < 0 || Float.isFinite(weight) == false) {
      throw new IllegalArgumentException("weight must be a finite non-negative number, got " + weight + " for doc " + docID);
    }
    docBuffer[bufferUpto] = docID;
    weightBuffer[bufferUpto] = weight;
    posCountBuffer[bufferUpto] = 0;
    valueBuffer[bufferUpto] = null;

    docCount++;
    totalWeight += weight;
    minWeight = Math.min(minWeight, weight);
    maxWeight = Math.max(maxWeight, weight);
    minLength = Math.min(minLength, fieldLength);
    maxLength = Math.max(maxLength, fieldLength);
    singletonLength = fieldLength;
    lastDocID = docID;
    lastPosition = 0;
    inDoc = true;
  }

  /** Adds one occurrence position to the current document. */
  public void addPosition(int position) {
    assert inDoc;
    if (writePositions == false) {
      return;
    }
    if (position < lastPosition) {
      throw new IllegalArgumentException("position " + position + " is before the previous position " + lastPosition
          + " of doc " + lastDocID);
    }
    posBuffer = ArrayUtil.grow(posBuffer, posBufferUpto + 1);
    posBuffer[posBufferUpto++] = position;
    posCountBuffer[bufferUpto]++;
    lastPosition = position;
  }

  /** Finishes the current document, recording its value when the field keeps one. */
  public void finishDoc(BytesRef value) throws IOException {
    assert inDoc;
    if (writeValues) {
      valueBuffer[bufferUpto] = value == null ? new BytesRef() : BytesRef.deepCopyOf(value);
    }
    inDoc = false;
    bufferUpto++;
    if (bufferUpto == BLOCK_SIZE) {
      flushBlock();
    }
  }

  private void flushBlock() throws IOException {
    final long start = blockBuffer.size();
    int prev = lastBlockDocID;
    for (int i = 0; i < bufferUpto; i++) {
      blockBuffer.writeVInt(docBuffer[i] - prev);
      prev = docBuffer[i];
    }
    if (writeFreqs) {
      boolean allOnes = true;
      for (int i = 0; i < bufferUpto; i++) {
        if (weightBuffer[i] != 1f) {
          allOnes = false;
          break;
        }
      }
      if (allOnes) {
        blockBuffer.writeByte((byte) 1);
      } else {
        blockBuffer.writeByte((byte) 0);
        for (int i = 0; i < bufferUpto; i++) {
          writeWeight(blockBuffer, weightBuffer[i]);
        }
      }
    }
    if (writePositions) {
      int posUpto = 0;
      for (int i = 0; i < bufferUpto; i++) {
        final int count = posCountBuffer[i];
        blockBuffer.writeVInt(count);
        int lastPos = 0;
        for (int j = 0; j < count; j++) {
          final int pos = posBuffer[posUpto++];
          blockBuffer.writeVInt(pos - lastPos);
          lastPos = pos;
        }
      }
    }
    if (writeValues) {
      for (int i = 0; i < bufferUpto; i++) {
        blockBuffer.writeBytesRef(valueBuffer[i]);
        valueBuffer[i] = null;
      }
    }
    skipBuffer.writeVInt(prev - lastBlockDocID);
    skipBuffer.writeVLong(blockBuffer.size() - start);
    lastBlockDocID = prev;
    numBlocks++;
    bufferUpto = 0;
    posBufferUpto = 0;
  }

  /**
   * Finishes the current term.
   *
   * @return the term's info, or null if no document was added
   */
  public TermInfo finishTerm() throws IOException {
    assert inDoc == false;
    if (docCount == 0) {
      return null;
    }
    if (docCount == 1 && writePositions == false) {
      bufferUpto = 0;
      return TermInfo.singleton(docBuffer[0], weightBuffer[0], singletonLength);
    }
    if (bufferUpto > 0) {
      flushBlock();
    }
    final long fp = out.getFilePointer();
    out.writeVInt(numBlocks);
    skipBuffer.copyTo(out);
    blockBuffer.copyTo(out);
    return new TermInfo(docCount, (float) totalWeight, minLength, maxLength, minWeight, maxWeight,
        fp, out.getFilePointer() - fp);
  }

  /**
   * Writes a weight: a non-negative integral weight {@code w} below 2<sup>30</sup>
   * is the vInt {@code w << 1}, anything else the vInt 1 followed by the
   * float's bits.
   */
  static void writeWeight(DataOutput out, float weight) throws IOException {
    final int i = (int) weight;
    if (i == weight && i >= 0 && i < (1 << 30)) {
      out.writeVInt(i << 1);
    } else {
      out.writeVInt(1);
      out.writeInt(Float.floatToIntBits(weight));
    }
  }

  @Override
  public void close() throws IOException {
    boolean success = false;
    try {
      CodecUtil.writeFooter(out);
      success = true;
    } finally {
      if (success) {
        IOUtils.close(out);
      } else {
        IOUtils.closeWhileHandlingException(out);
      }
    }
  }
}
