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


import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.zip.CRC32;

import org.fathom.index.CorruptIndexException;
import org.fathom.index.FieldInfo;
import org.fathom.index.TermInfo;
import org.fathom.index.Terms;
import org.fathom.index.TermsEnum;
import org.fathom.store.ByteBuffersDataInput;
import org.fathom.store.IndexInput;
import org.fathom.util.BytesRef;
import org.fathom.util.BytesRefBuilder;

/**
 * The terms of one field of a segment, read through the sparse block index.
 * @fathom.internal
 */
public final class FieldReader extends Terms {

  final BlockTermsReader parent;
  final FieldInfo fieldInfo;
  final long numTerms;
  final long sumDocFreq;
  final double sumTotalWeight;
  final int docCount;
  final BytesRef[] blockFirstTerms;
  final long[] blockFPs;
  final long endFP;

  /** Decoded entries of one block. */
  static final class TermBlock {
    final int index;
    final BytesRef[] terms;
    final TermInfo[] infos;

    TermBlock(int index, BytesRef[] terms, TermInfo[] infos) {
      this.index = index;
      this.terms = terms;
      this.infos = infos;
    }

    /** Index of {@code term} in this block, or (-(insertion point) - 1). */
    int find(BytesRef term) {
      return Arrays.binarySearch(terms, term);
    }
  }

  FieldReader(BlockTermsReader parent, FieldInfo fieldInfo, long numTerms, long sumDocFreq, double sumTotalWeight,
              int docCount, BytesRef[] blockFirstTerms, long[] blockFPs, long endFP) {
    this.parent = parent;
    this.fieldInfo = fieldInfo;
    this.numTerms = numTerms;
    this.sumDocFreq = sumDocFreq;
    this.sumTotalWeight = sumTotalWeight;
    this.docCount = docCount;
    this.blockFirstTerms = blockFirstTerms;
    this.blockFPs = blockFPs;
    this.endFP = endFP;
  }

  /** Returns the last block whose first term is &lt;= term, or -1 if term sorts before every block. */
  int findBlock(BytesRef term) {
    final int idx = Arrays.binarySearch(blockFirstTerms, term);
    return idx >= 0 ? idx : -idx - 2;
  }

  int numBlocks() {
    return blockFirstTerms.length;
  }

  TermBlock loadBlock(IndexInput in, int block) throws IOException {
    final long start = blockFPs[block];
    final long end = block + 1 < blockFPs.length ? blockFPs[block + 1] : endFP;
    final long length = end - start - Integer.BYTES;
    if (length <= 0 || length > Integer.MAX_VALUE) {
      throw new CorruptIndexException("invalid length " + length + " of term block " + block + " of field \"" + fieldInfo.name + "\"", in);
    }
    final byte[] bytes = new byte[(int) length];
    in.seek(start);
    in.readBytes(bytes, 0, bytes.length);
    final int expected = in.readInt();
    final CRC32 crc = new CRC32();
    crc.update(bytes, 0, bytes.length);
    if ((int) crc.getValue() != expected) {
      throw new CorruptIndexException("checksum mismatch in term block " + block + " of field \"" + fieldInfo.name
          + "\": expected=" + Integer.toHexString(expected) + " actual=" + Integer.toHexString((int) crc.getValue()), in);
    }

    final ByteBuffersDataInput blockIn = new ByteBuffersDataInput(Collections.singletonList(ByteBuffer.wrap(bytes)));
    final int count = blockIn.readVInt();
    if (count < 1 || count > BlockTermsWriter.BLOCK_SIZE) {
      throw new CorruptIndexException("invalid term count " + count + " in term block " + block, in);
    }
    final BytesRef[] terms = new BytesRef[count];
    final TermInfo[] infos = new TermInfo[count];
    final BytesRefBuilder term = new BytesRefBuilder();
    for (int i = 0; i < count; i++) {
      PrefixCodedTerms.readEntry(blockIn, term);
      terms[i] = term.toBytesRef();
      infos[i] = BlockTermsReader.readTermInfo(blockIn);
    }
    if (blockIn.position() != blockIn.size()) {
      throw new CorruptIndexException("trailing bytes in term block " + block, in);
    }
    if (terms[0].equals(blockFirstTerms[block]) == false) {
      throw new CorruptIndexException("term block " + block + " starts with " + terms[0] + " but the index says "
          + blockFirstTerms[block], in);
    }
    return new TermBlock(block, terms, infos);
  }

  @Override
  public TermInfo get(BytesRef term) throws IOException {
    final int block = findBlock(term);
    if (block < 0) {
      return null;
    }
    final TermBlock termBlock = loadBlock(parent.termsIn.clone(), block);
    final int idx = termBlock.find(term);
    return idx >= 0 ? termBlock.infos[idx] : null;
  }

  @Override
  public TermsEnum iterator() throws IOException {
    return new SegmentTermsEnum(this);
  }

  @Override
  public long size() {
    return numTerms;
  }

  @Override
  public double getSumTotalWeight() {
    return sumTotalWeight;
  }

  @Override
  public long getSumDocFreq() {
    return sumDocFreq;
  }

  @Override
  public int getDocCount() {
    return docCount;
  }

  @Override
  public boolean hasFreqs() {
    return fieldInfo.getIndexOptions().hasFreqs();
  }

  @Override
  public boolean hasPositions() {
    return fieldInfo.getIndexOptions().hasPositions();
  }

  @Override
  public boolean hasValues() {
    return fieldInfo.getIndexOptions().hasPayloads();
  }

  @Override
  public String toString() {
    return "BlockTermsField(field=" + fieldInfo.name + ",terms=" + numTerms + ",blocks=" + blockFirstTerms.length + ")";
  }
}
