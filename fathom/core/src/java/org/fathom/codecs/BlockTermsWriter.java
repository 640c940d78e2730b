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
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

import org.fathom.index.FieldInfo;
import org.fathom.index.FieldInfos;
import org.fathom.index.Fields;
import org.fathom.index.IndexFileNames;
import org.fathom.index.PostingsEnum;
import org.fathom.index.SegmentWriteState;
import org.fathom.index.TermInfo;
import org.fathom.index.Terms;
import org.fathom.index.TermsEnum;
import org.fathom.store.ByteBuffersDataOutput;
import org.fathom.store.DataOutput;
import org.fathom.store.IndexOutput;
import org.fathom.util.ArrayUtil;
import org.fathom.util.BytesRef;
import org.fathom.util.FixedBitSet;
import org.fathom.util.IOUtils;

/**
 * Writes the term dictionary of a segment: the {@code .tim} file holds the
 * terms of every field cut into blocks of at most {@value #BLOCK_SIZE}
 * entries, the {@code .tip} file a sparse index with the first term and file
 * pointer of every block plus per-field statistics.
 * <p>
 * Term block layout:
 * <ul>
 *   <li>Block --&gt; Count (VInt), Entry<sup>Count</sup>, Checksum (Int32, CRC32 of the preceding block bytes)
 *   <li>Entry --&gt; {@link PrefixCodedTerms} entry, TermInfo
 *   <li>TermInfo --&gt; DocFreq&lt;&lt;1|Singleton (VInt), TotalWeight (Int32 float bits), MinLength (VInt),
 *       MaxLength-MinLength (VInt), then SingletonDoc (VInt) for an inline posting, else
 *       [MinWeight, MaxWeight (Int32 float bits) when DocFreq &gt; 1], PostingsFP (VLong), PostingsLength (VLong)
 * </ul>
 * The prefix coding of entries restarts at every block.
 * <p>
 * Index layout:
 * <ul>
 *   <li>Index --&gt; Header, NumFields (VInt), Field<sup>NumFields</sup>, Footer
 *   <li>Field --&gt; FieldNumber (VInt), NumTerms (VLong), SumDocFreq (VLong), SumTotalWeight (Int64 double bits),
 *       DocCount (VInt), NumBlocks (VInt), EndFP (VLong), BlockEntry<sup>NumBlocks</sup>
 *   <li>BlockEntry --&gt; {@link PrefixCodedTerms} entry of the block's first term, FP delta (VLong)
 * </ul>
 *
 * @fathom.experimental
 */
public final class BlockTermsWriter implements Closeable {

  /** Maximum number of terms per block. */
  public static final int BLOCK_SIZE = 32;

  static final String TERMS_CODEC_NAME = "FathomTermsDict";
  static final String TERMS_INDEX_CODEC_NAME = "FathomTermsIndex";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  private final IndexOutput termsOut;
  private final IndexOutput indexOut;
  private final BlockPostingsWriter postingsWriter;
  private final FieldInfos fieldInfos;
  private final int maxDoc;
  private final List<FieldMetaData> fields = new ArrayList<>();
  private final ByteBuffersDataOutput scratch = new ByteBuffersDataOutput();

  private static final class FieldMetaData {
    final FieldInfo fieldInfo;
    final long numTerms;
    final long sumDocFreq;
    final double sumTotalWeight;
    final int docCount;
    final BytesRef[] blockFirstTerms;
    final long[] blockFPs;
    final long endFP;

    FieldMetaData(FieldInfo fieldInfo, long numTerms, long sumDocFreq, double sumTotalWeight, int docCount,
                  BytesRef[] blockFirstTerms, long[] blockFPs, long endFP) {
      assert numTerms > 0;
      this.fieldInfo = fieldInfo;
      this.numTerms = numTerms;
      this.sumDocFreq = sumDocFreq;
      this.sumTotalWeight = sumTotalWeight;
      this.docCount = docCount;
      this.blockFirstTerms = blockFirstTerms;
      this.blockFPs = blockFPs;
      this.endFP = endFP;
    }
  }

  /** Creates the dictionary files of the segment described by {@code state}. */
  public BlockTermsWriter(SegmentWriteState state, BlockPostingsWriter postingsWriter) throws IOException {
    this.postingsWriter = postingsWriter;
    this.fieldInfos = state.fieldInfos;
    this.maxDoc = state.segmentInfo.maxDoc();
    final String termsName = IndexFileNames.segmentFileName(state.segmentInfo.name, "", IndexFileNames.TERMS_EXTENSION);
    final String indexName = IndexFileNames.segmentFileName(state.segmentInfo.name, "", IndexFileNames.TERMS_INDEX_EXTENSION);
    IndexOutput termsOut = null;
    IndexOutput indexOut = null;
    boolean success = false;
    try {
      termsOut = state.directory.createOutput(termsName);
      CodecUtil.writeIndexHeader(termsOut, TERMS_CODEC_NAME, VERSION_CURRENT, state.segmentInfo.getId(), "");
      indexOut = state.directory.createOutput(indexName);
      CodecUtil.writeIndexHeader(indexOut, TERMS_INDEX_CODEC_NAME, VERSION_CURRENT, state.segmentInfo.getId(), "");
      this.termsOut = termsOut;
      this.indexOut = indexOut;
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(termsOut, indexOut);
      }
    }
  }

  /**
   * Writes the terms and postings of every field of {@code fields}, in the
   * order the fields iterate. {@code lengths} supplies the field length of
   * each posting's document.
   */
  public void write(Fields fields, FieldLengths lengths) throws IOException {
    for (String field : fields) {
      final Terms terms = fields.terms(field);
      if (terms == null) {
        continue;
      }
      final FieldInfo fieldInfo = fieldInfos.fieldInfo(field);
      if (fieldInfo == null || fieldInfo.isIndexed() == false) {
        throw new IllegalStateException("field \"" + field + "\" has terms but is not indexed in " + fieldInfos);
      }
      final TermsWriter termsWriter = new TermsWriter(fieldInfo);
      final TermsEnum termsEnum = terms.iterator();
      BytesRef term;
      while ((term = termsEnum.next()) != null) {
        termsWriter.write(term, termsEnum, lengths);
      }
      termsWriter.finish();
    }
  }

  static void writeTermInfo(DataOutput out, TermInfo info) throws IOException {
    out.writeVInt((info.docFreq() << 1) | (info.isSingleton() ? 1 : 0));
    out.writeInt(Float.floatToIntBits(info.totalWeight()));
    out.writeVInt(info.minLength());
    out.writeVInt(info.maxLength() - info.minLength());
    if (info.isSingleton()) {
      out.writeVInt(info.singletonDocID());
    } else {
      if (info.docFreq() > 1) {
        out.writeInt(Float.floatToIntBits(info.minWeight()));
        out.writeInt(Float.floatToIntBits(info.maxWeight()));
      }
      out.writeVLong(info.postingsFP());
      out.writeVLong(info.postingsLength());
    }
  }

  private final class TermsWriter {
    private final FieldInfo fieldInfo;
    private final boolean hasPositions;
    private final boolean hasValues;
    private final FixedBitSet docsSeen;
    private long numTerms;
    private long sumDocFreq;
    private double sumTotalWeight;

    private final BytesRef[] pendingTerms = new BytesRef[BLOCK_SIZE];
    private final TermInfo[] pendingInfos = new TermInfo[BLOCK_SIZE];
    private int pendingCount;

    private final List<BytesRef> blockFirstTerms = new ArrayList<>();
    private long[] blockFPs = new long[8];

    TermsWriter(FieldInfo fieldInfo) {
      this.fieldInfo = fieldInfo;
      this.hasPositions = fieldInfo.getIndexOptions().hasPositions();
      this.hasValues = fieldInfo.getIndexOptions().hasPayloads();
      this.docsSeen = new FixedBitSet(maxDoc);
      postingsWriter.setField(fieldInfo);
    }

    void write(BytesRef term, TermsEnum termsEnum, FieldLengths lengths) throws IOException {
      postingsWriter.startTerm();
      final PostingsEnum postings = termsEnum.postings();
      int doc;
      while ((doc = postings.nextDoc()) != PostingsEnum.NO_MORE_DOCS) {
        docsSeen.set(doc);
        postingsWriter.startDoc(doc, postings.weight(), lengths.get(fieldInfo.number, doc));
        if (hasPositions) {
          for (int position : postings.positions()) {
            postingsWriter.addPosition(position);
          }
        }
        postingsWriter.finishDoc(hasValues ? postings.value() : null);
      }
      final TermInfo info = postingsWriter.finishTerm();
      if (info == null) {
        // every document of the term was dropped
        return;
      }
      pendingTerms[pendingCount] = BytesRef.deepCopyOf(term);
      pendingInfos[pendingCount] = info;
      pendingCount++;
      numTerms++;
      sumDocFreq += info.docFreq();
      sumTotalWeight += info.totalWeight();
      if (pendingCount == BLOCK_SIZE) {
        flushBlock();
      }
    }

    private void flushBlock() throws IOException {
      assert pendingCount > 0;
      final int block = blockFirstTerms.size();
      blockFPs = ArrayUtil.grow(blockFPs, block + 1);
      blockFPs[block] = termsOut.getFilePointer();
      blockFirstTerms.add(pendingTerms[0]);

      scratch.reset();
      scratch.writeVInt(pendingCount);
      BytesRef previous = new BytesRef();
      for (int i = 0; i < pendingCount; i++) {
        PrefixCodedTerms.writeEntry(scratch, previous, pendingTerms[i]);
        writeTermInfo(scratch, pendingInfos[i]);
        previous = pendingTerms[i];
        pendingTerms[i] = null;
        pendingInfos[i] = null;
      }
      final byte[] bytes = scratch.toArrayCopy();
      final CRC32 crc = new CRC32();
      crc.update(bytes, 0, bytes.length);
      termsOut.writeBytes(bytes, bytes.length);
      termsOut.writeInt((int) crc.getValue());
      pendingCount = 0;
    }

    void finish() throws IOException {
      if (pendingCount > 0) {
        flushBlock();
      }
      if (numTerms > 0) {
        fields.add(new FieldMetaData(fieldInfo, numTerms, sumDocFreq, sumTotalWeight, docsSeen.cardinality(),
            blockFirstTerms.toArray(new BytesRef[0]), ArrayUtil.copyOfSubArray(blockFPs, 0, blockFirstTerms.size()),
            termsOut.getFilePointer()));
      }
    }
  }

  @Override
  public void close() throws IOException {
    boolean success = false;
    try {
      indexOut.writeVInt(fields.size());
      for (FieldMetaData field : fields) {
        indexOut.writeVInt(field.fieldInfo.number);
        indexOut.writeVLong(field.numTerms);
        indexOut.writeVLong(field.sumDocFreq);
        indexOut.writeLong(Double.doubleToLongBits(field.sumTotalWeight));
        indexOut.writeVInt(field.docCount);
        indexOut.writeVInt(field.blockFirstTerms.length);
        indexOut.writeVLong(field.endFP);
        BytesRef previous = new BytesRef();
        long lastFP = 0;
        for (int i = 0; i < field.blockFirstTerms.length; i++) {
          PrefixCodedTerms.writeEntry(indexOut, previous, field.blockFirstTerms[i]);
          indexOut.writeVLong(field.blockFPs[i] - lastFP);
          previous = field.blockFirstTerms[i];
          lastFP = field.blockFPs[i];
        }
      }
      CodecUtil.writeFooter(indexOut);
      CodecUtil.writeFooter(termsOut);
      success = true;
    } finally {
      if (success) {
        IOUtils.close(termsOut, indexOut, postingsWriter);
      } else {
        IOUtils.closeWhileHandlingException(termsOut, indexOut, postingsWriter);
      }
    }
  }
}
