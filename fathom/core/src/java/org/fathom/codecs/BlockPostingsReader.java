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
import java.util.Arrays;

import org.fathom.index.CorruptIndexException;
import org.fathom.index.FieldInfo;
import org.fathom.index.IndexFileNames;
import org.fathom.index.PostingsEnum;
import org.fathom.index.SegmentReadState;
import org.fathom.index.TermInfo;
import org.fathom.store.IndexInput;
import org.fathom.util.ArrayUtil;
import org.fathom.util.BytesRef;
import org.fathom.util.IOUtils;

import static org.fathom.codecs.BlockPostingsWriter.BLOCK_SIZE;

/**
 * Reads the postings lists written by {@link BlockPostingsWriter}.
 * <p>
 * {@link PostingsEnum#advance(int)} binary searches the skip table of the
 * postings list and only decodes the block holding the target.
 *
 * @fathom.experimental
 */
public final class BlockPostingsReader implements Closeable {

  private final IndexInput postingsIn;

  /** Opens the postings file of the segment described by {@code state}. */
  public BlockPostingsReader(SegmentReadState state) throws IOException {
    final String fileName = IndexFileNames.segmentFileName(state.segmentInfo.name, "", IndexFileNames.POSTINGS_EXTENSION);
    boolean success = false;
    IndexInput in = null;
    try {
      in = state.directory.openInput(fileName);
      CodecUtil.checkIndexHeader(in, BlockPostingsWriter.CODEC_NAME, BlockPostingsWriter.VERSION_START,
          BlockPostingsWriter.VERSION_CURRENT, state.segmentInfo.getId(), "");
      // only the footer structure is checked on open; checkIntegrity reads every byte
      CodecUtil.retrieveChecksum(in);
      this.postingsIn = in;
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(in);
      }
    }
  }

  /** Returns the postings of a term of {@code fieldInfo}. */
  public PostingsEnum postings(FieldInfo fieldInfo, TermInfo termInfo) throws IOException {
    if (termInfo.isSingleton()) {
      return new SingletonPostingsEnum(termInfo.singletonDocID(), termInfo.totalWeight());
    }
    return new BlockPostingsEnum(postingsIn.clone(), fieldInfo, termInfo);
  }

  /** Verifies the checksum of the whole postings file. */
  public void checkIntegrity() throws IOException {
    CodecUtil.checksumEntireFile(postingsIn);
  }

  @Override
  public void close() throws IOException {
    postingsIn.close();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + postingsIn + ")";
  }

  static float readWeight(IndexInput in) throws IOException {
    final int code = in.readVInt();
    if ((code & 1) == 0) {
      return code >>> 1;
    }
    if (code != 1) {
      throw new CorruptIndexException("invalid weight code: " + code, in);
    }
    return Float.intBitsToFloat(in.readInt());
  }

  /** Postings of a term found in a single document, kept inline in its term info. */
  static final class SingletonPostingsEnum extends PostingsEnum {
    private final int singleDoc;
    private final float weight;
    private int doc = -1;

    SingletonPostingsEnum(int singleDoc, float weight) {
      this.singleDoc = singleDoc;
      this.weight = weight;
    }

    @Override
    public int docID() {
      return doc;
    }

    @Override
    public int nextDoc() {
      doc = doc == -1 ? singleDoc : NO_MORE_DOCS;
      return doc;
    }

    @Override
    public int advance(int target) {
      if (doc == NO_MORE_DOCS || doc >= target) {
        return doc;
      }
      doc = doc == -1 && singleDoc >= target ? singleDoc : NO_MORE_DOCS;
      return doc;
    }

    @Override
    public float weight() {
      ensureActive();
      return weight;
    }

    @Override
    public long cost() {
      return 1;
    }
  }

  final class BlockPostingsEnum extends PostingsEnum {
    private final IndexInput in;
    private final boolean indexHasFreqs;
    private final boolean indexHasPositions;
    private final boolean indexHasValues;
    private final int docFreq;
    private final int numBlocks;
    private final int[] blockLastDocs;
    private final long[] blockFPs;

    private final int[] docBuffer = new int[BLOCK_SIZE];
    private final float[] weightBuffer = new float[BLOCK_SIZE];
    private final int[] posStarts = new int[BLOCK_SIZE + 1];
    private final BytesRef[] valueBuffer;
    private int[] posBuffer = new int[0];
    private byte[] valueBytes = new byte[0];

    private int blockIndex = -1;
    private int blockCount;
    private int blockUpto;
    private int doc = -1;

    BlockPostingsEnum(IndexInput in, FieldInfo fieldInfo, TermInfo termInfo) throws IOException {
      this.in = in;
      this.indexHasFreqs = fieldInfo.getIndexOptions().hasFreqs();
      this.indexHasPositions = fieldInfo.getIndexOptions().hasPositions();
      this.indexHasValues = fieldInfo.getIndexOptions().hasPayloads();
      this.docFreq = termInfo.docFreq();
      this.valueBuffer = indexHasValues ? new BytesRef[BLOCK_SIZE] : null;

      in.seek(termInfo.postingsFP());
      numBlocks = in.readVInt();
      if (numBlocks != (docFreq + BLOCK_SIZE - 1) / BLOCK_SIZE) {
        throw new CorruptIndexException("numBlocks=" + numBlocks + " does not match docFreq=" + docFreq, in);
      }
      blockLastDocs = new int[numBlocks];
      blockFPs = new long[numBlocks];
      int lastDoc = -1;
      for (int b = 0; b < numBlocks; b++) {
        final int delta = in.readVInt();
        if (delta <= 0) {
          throw new CorruptIndexException("invalid last doc delta " + delta + " in skip entry " + b, in);
        }
        lastDoc += delta;
        blockLastDocs[b] = lastDoc;
        blockFPs[b] = in.readVLong();
      }
      long fp = in.getFilePointer();
      for (int b = 0; b < numBlocks; b++) {
        final long length = blockFPs[b];
        blockFPs[b] = fp;
        fp += length;
      }
      if (fp != termInfo.postingsFP() + termInfo.postingsLength()) {
        throw new CorruptIndexException("postings list ends at " + fp + ", expected "
            + (termInfo.postingsFP() + termInfo.postingsLength()), in);
      }
    }

    @Override
    public int docID() {
      return doc;
    }

    @Override
    public int nextDoc() throws IOException {
      if (doc == NO_MORE_DOCS) {
        return NO_MORE_DOCS;
      }
      if (blockUpto + 1 >= blockCount) {
        if (blockIndex + 1 >= numBlocks) {
          return doc = NO_MORE_DOCS;
        }
        loadBlock(blockIndex + 1);
      }
      blockUpto++;
      return doc = docBuffer[blockUpto];
    }

    @Override
    public int advance(int target) throws IOException {
      if (doc == NO_MORE_DOCS || doc >= target) {
        return doc;
      }
      if (blockIndex < 0 || target > blockLastDocs[blockIndex]) {
        final int block = findBlock(target, blockIndex + 1);
        if (block == numBlocks) {
          return doc = NO_MORE_DOCS;
        }
        loadBlock(block);
      }
      // the current block ends at a doc >= target
      do {
        blockUpto++;
      } while (docBuffer[blockUpto] < target);
      return doc = docBuffer[blockUpto];
    }

    /** Returns the first block at or after {@code from} whose last doc is &gt;= target, or numBlocks. */
    private int findBlock(int target, int from) {
      int lo = from;
      int hi = numBlocks - 1;
      while (lo <= hi) {
        final int mid = (lo + hi) >>> 1;
        if (blockLastDocs[mid] < target) {
          lo = mid + 1;
        } else {
          hi = mid - 1;
        }
      }
      return lo;
    }

    private void loadBlock(int block) throws IOException {
      in.seek(blockFPs[block]);
      final int count = block == numBlocks - 1 ? docFreq - block * BLOCK_SIZE : BLOCK_SIZE;
      int prev = block == 0 ? -1 : blockLastDocs[block - 1];
      for (int i = 0; i < count; i++) {
        final int delta = in.readVInt();
        if (delta <= 0) {
          throw new CorruptIndexException("invalid doc delta " + delta + " in block " + block, in);
        }
        prev += delta;
        docBuffer[i] = prev;
      }
      if (prev != blockLastDocs[block]) {
        throw new CorruptIndexException("block " + block + " ends at doc " + prev + " but its skip entry says "
            + blockLastDocs[block], in);
      }
      if (indexHasFreqs) {
        final byte allOnes = in.readByte();
        if (allOnes == 1) {
          Arrays.fill(weightBuffer, 0, count, 1f);
        } else if (allOnes == 0) {
          for (int i = 0; i < count; i++) {
            weightBuffer[i] = readWeight(in);
          }
        } else {
          throw new CorruptIndexException("invalid weights flag: " + allOnes, in);
        }
      }
      if (indexHasPositions) {
        int posUpto = 0;
        for (int i = 0; i < count; i++) {
          posStarts[i] = posUpto;
          final int freq = in.readVInt();
          posBuffer = ArrayUtil.grow(posBuffer, posUpto + freq);
          int pos = 0;
          for (int j = 0; j < freq; j++) {
            pos += in.readVInt();
            posBuffer[posUpto++] = pos;
          }
        }
        posStarts[count] = posUpto;
      }
      if (indexHasValues) {
        final int[] lengths = new int[count];
        int total = 0;
        final long start = in.getFilePointer();
        for (int i = 0; i < count; i++) {
          lengths[i] = in.readVInt();
          in.skipBytes(lengths[i]);
          total += lengths[i];
        }
        valueBytes = ArrayUtil.grow(valueBytes, total);
        in.seek(start);
        int upto = 0;
        for (int i = 0; i < count; i++) {
          in.readVInt();
          in.readBytes(valueBytes, upto, lengths[i]);
          valueBuffer[i] = new BytesRef(valueBytes, upto, lengths[i]);
          upto += lengths[i];
        }
      }
      blockIndex = block;
      blockCount = count;
      blockUpto = -1;
    }

    @Override
    public float weight() {
      ensureActive();
      return indexHasFreqs ? weightBuffer[blockUpto] : 1f;
    }

    @Override
    public int[] positions() {
      ensureActive();
      if (indexHasPositions == false) {
        return super.positions();
      }
      return Arrays.copyOfRange(posBuffer, posStarts[blockUpto], posStarts[blockUpto + 1]);
    }

    @Override
    public BytesRef value() {
      ensureActive();
      return indexHasValues ? valueBuffer[blockUpto] : null;
    }

    @Override
    public long cost() {
      return docFreq;
    }
  }
}
