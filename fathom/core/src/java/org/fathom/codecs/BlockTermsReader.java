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
import java.util.Collections;
import java.util.Iterator;
import java.util.TreeMap;

import org.fathom.index.CorruptIndexException;
import org.fathom.index.FieldInfo;
import org.fathom.index.Fields;
import org.fathom.index.IndexFileNames;
import org.fathom.index.SegmentReadState;
import org.fathom.index.TermInfo;
import org.fathom.index.Terms;
import org.fathom.store.ChecksumIndexInput;
import org.fathom.store.DataInput;
import org.fathom.store.IndexInput;
import org.fathom.util.BytesRef;
import org.fathom.util.BytesRefBuilder;
import org.fathom.util.IOUtils;

/**
 * Reads the term dictionary written by {@link BlockTermsWriter}.
 * <p>
 * The sparse index is loaded into memory on open. Looking up a term binary
 * searches the first terms of the blocks and decodes a single block, whose
 * checksum is verified before any entry is used.
 * <p>
 * Fields that are not part of the schema the segment is opened with are
 * skipped.
 *
 * @fathom.experimental
 */
public final class BlockTermsReader extends Fields implements Closeable {

  final IndexInput termsIn;
  final BlockPostingsReader postingsReader;
  private final TreeMap<String,FieldReader> fieldMap = new TreeMap<>();

  /** Opens the dictionary of the segment described by {@code state}. */
  public BlockTermsReader(SegmentReadState state, BlockPostingsReader postingsReader) throws IOException {
    this.postingsReader = postingsReader;
    final String termsName = IndexFileNames.segmentFileName(state.segmentInfo.name, "", IndexFileNames.TERMS_EXTENSION);
    final String indexName = IndexFileNames.segmentFileName(state.segmentInfo.name, "", IndexFileNames.TERMS_INDEX_EXTENSION);
    boolean success = false;
    IndexInput termsIn = null;
    try {
      termsIn = state.directory.openInput(termsName);
      CodecUtil.checkIndexHeader(termsIn, BlockTermsWriter.TERMS_CODEC_NAME, BlockTermsWriter.VERSION_START,
          BlockTermsWriter.VERSION_CURRENT, state.segmentInfo.getId(), "");
      CodecUtil.retrieveChecksum(termsIn);
      this.termsIn = termsIn;

      try (ChecksumIndexInput indexIn = state.directory.openChecksumInput(indexName)) {
        Throwable priorE = null;
        try {
          CodecUtil.checkIndexHeader(indexIn, BlockTermsWriter.TERMS_INDEX_CODEC_NAME, BlockTermsWriter.VERSION_START,
              BlockTermsWriter.VERSION_CURRENT, state.segmentInfo.getId(), "");
          readIndex(indexIn, state);
        } catch (Throwable exception) {
          priorE = exception;
        } finally {
          CodecUtil.checkFooter(indexIn, priorE);
        }
      }
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(termsIn);
      }
    }
  }

  private void readIndex(DataInput indexIn, SegmentReadState state) throws IOException {
    final int maxDoc = state.segmentInfo.maxDoc();
    final int numFields = indexIn.readVInt();
    if (numFields < 0) {
      throw new CorruptIndexException("invalid numFields: " + numFields, indexIn);
    }
    for (int i = 0; i < numFields; i++) {
      final int fieldNumber = indexIn.readVInt();
      final long numTerms = indexIn.readVLong();
      if (numTerms <= 0) {
        throw new CorruptIndexException("Illegal numTerms for field number: " + fieldNumber, indexIn);
      }
      final long sumDocFreq = indexIn.readVLong();
      final double sumTotalWeight = Double.longBitsToDouble(indexIn.readLong());
      final int docCount = indexIn.readVInt();
      if (docCount < 0 || docCount > maxDoc) { // #docs with field must be <= #docs
        throw new CorruptIndexException("invalid docCount: " + docCount + " maxDoc: " + maxDoc, indexIn);
      }
      if (sumDocFreq < docCount) {  // #postings must be >= #docs with field
        throw new CorruptIndexException("invalid sumDocFreq: " + sumDocFreq + " docCount: " + docCount, indexIn);
      }
      final int numBlocks = indexIn.readVInt();
      if (numBlocks <= 0 || numBlocks > numTerms) {
        throw new CorruptIndexException("invalid numBlocks: " + numBlocks + " numTerms: " + numTerms, indexIn);
      }
      final long endFP = indexIn.readVLong();
      final BytesRef[] firstTerms = new BytesRef[numBlocks];
      final long[] blockFPs = new long[numBlocks];
      final BytesRefBuilder term = new BytesRefBuilder();
      long fp = 0;
      for (int b = 0; b < numBlocks; b++) {
        PrefixCodedTerms.readEntry(indexIn, term);
        firstTerms[b] = term.toBytesRef();
        fp += indexIn.readVLong();
        blockFPs[b] = fp;
      }
      if (endFP <= fp) {
        throw new CorruptIndexException("invalid endFP: " + endFP + " last block starts at " + fp, indexIn);
      }

      final FieldInfo fieldInfo = state.fieldInfos.fieldInfo(fieldNumber);
      if (fieldInfo == null || fieldInfo.isIndexed() == false) {
        // removed from the schema
        continue;
      }
      FieldReader previous = fieldMap.put(fieldInfo.name,
          new FieldReader(this, fieldInfo, numTerms, sumDocFreq, sumTotalWeight, docCount, firstTerms, blockFPs, endFP));
      if (previous != null) {
        throw new CorruptIndexException("duplicate field: " + fieldInfo.name, indexIn);
      }
    }
  }

  static TermInfo readTermInfo(DataInput in) throws IOException {
    final int code = in.readVInt();
    final int docFreq = code >>> 1;
    if (docFreq < 1) {
      throw new CorruptIndexException("invalid docFreq: " + docFreq, in);
    }
    final float totalWeight = Float.intBitsToFloat(in.readInt());
    final int minLength = in.readVInt();
    final int maxLength = minLength + in.readVInt();
    if ((code & 1) != 0) {
      if (docFreq != 1) {
        throw new CorruptIndexException("inline posting with docFreq=" + docFreq, in);
      }
      return TermInfo.singleton(in.readVInt(), totalWeight, minLength);
    }
    final float minWeight;
    final float maxWeight;
    if (docFreq > 1) {
      minWeight = Float.intBitsToFloat(in.readInt());
      maxWeight = Float.intBitsToFloat(in.readInt());
    } else {
      minWeight = maxWeight = totalWeight;
    }
    final long postingsFP = in.readVLong();
    final long postingsLength = in.readVLong();
    return new TermInfo(docFreq, totalWeight, minLength, maxLength, minWeight, maxWeight, postingsFP, postingsLength);
  }

  @Override
  public Iterator<String> iterator() {
    return Collections.unmodifiableSet(fieldMap.keySet()).iterator();
  }

  @Override
  public Terms terms(String field) throws IOException {
    assert field != null;
    return fieldMap.get(field);
  }

  @Override
  public int size() {
    return fieldMap.size();
  }

  /** Verifies the checksums of the dictionary and postings files. */
  public void checkIntegrity() throws IOException {
    CodecUtil.checksumEntireFile(termsIn);
    postingsReader.checkIntegrity();
  }

  @Override
  public void close() throws IOException {
    try {
      IOUtils.close(termsIn, postingsReader);
    } finally {
      // Clear so refs to terms index is GCable even if
      // app hangs onto us:
      fieldMap.clear();
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(fields=" + fieldMap.size() + ",postings=" + postingsReader + ")";
  }
}
