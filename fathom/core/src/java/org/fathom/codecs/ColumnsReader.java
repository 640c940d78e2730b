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
import java.util.HashMap;
import java.util.Map;

import org.fathom.index.BinaryColumn;
import org.fathom.index.ColumnType;
import org.fathom.index.CorruptIndexException;
import org.fathom.index.FieldInfo;
import org.fathom.index.IndexFileNames;
import org.fathom.index.NumericColumn;
import org.fathom.index.SegmentReadState;
import org.fathom.store.IndexInput;
import org.fathom.store.RandomAccessInput;
import org.fathom.util.BytesRef;
import org.fathom.util.FixedBitSet;
import org.fathom.util.IOUtils;

import static org.fathom.codecs.ColumnsWriter.ALL_PRESENT;
import static org.fathom.codecs.ColumnsWriter.BINARY;
import static org.fathom.codecs.ColumnsWriter.NUMERIC;
import static org.fathom.codecs.ColumnsWriter.SPARSE;

/**
 * Reads the columns written by {@link ColumnsWriter}. Column metadata and
 * presence bitmaps are loaded on open, values are read in place.
 *
 * @fathom.experimental
 */
public final class ColumnsReader implements Closeable {

  private final IndexInput data;
  private final int maxDoc;
  private final Map<Integer,Packed> numerics = new HashMap<>();
  private final Map<Integer,BinaryEntry> binaries = new HashMap<>();

  private static final class Packed {
    FixedBitSet docsWithField; // null if all documents have a value
    long min;
    int bytesPerValue;
    long valuesOffset;
    long valuesLength;
  }

  private static final class BinaryEntry {
    Packed offsets;
    long bytesOffset;
    long bytesLength;
  }

  /** Opens the columns of the segment described by {@code state}. */
  public ColumnsReader(SegmentReadState state) throws IOException {
    this.maxDoc = state.segmentInfo.maxDoc();
    final String fileName = IndexFileNames.segmentFileName(state.segmentInfo.name, "", IndexFileNames.COLUMNS_EXTENSION);
    boolean success = false;
    final IndexInput data = state.directory.openInput(fileName);
    try {
      CodecUtil.checkIndexHeader(data, ColumnsWriter.CODEC_NAME, ColumnsWriter.VERSION_START, ColumnsWriter.VERSION_CURRENT,
          state.segmentInfo.getId(), "");
      CodecUtil.retrieveChecksum(data);
      final long dirFPPosition = data.length() - CodecUtil.footerLength() - Long.BYTES;
      data.seek(dirFPPosition);
      final long dirFP = data.readLong();
      if (dirFP < 0 || dirFP > dirFPPosition) {
        throw new CorruptIndexException("invalid column directory pointer: " + dirFP, data);
      }
      data.seek(dirFP);
      final int numFields = data.readVInt();
      final long[] offsets = new long[numFields];
      final int[] fieldNumbers = new int[numFields];
      final byte[] types = new byte[numFields];
      for (int i = 0; i < numFields; i++) {
        fieldNumbers[i] = data.readVInt();
        types[i] = data.readByte();
        offsets[i] = data.readVLong();
        if (offsets[i] >= dirFP) {
          throw new CorruptIndexException("invalid column offset " + offsets[i] + " for field number " + fieldNumbers[i], data);
        }
      }
      for (int i = 0; i < numFields; i++) {
        final FieldInfo info = state.fieldInfos.fieldInfo(fieldNumbers[i]);
        if (info == null) {
          continue; // field was removed from the schema
        }
        data.seek(offsets[i]);
        switch (types[i]) {
          case NUMERIC:
            checkType(info, ColumnType.NUMERIC, data);
            final Packed numeric = readPacked(data, readMissing(data), maxDoc);
            numerics.put(info.number, numeric);
            break;
          case BINARY:
            checkType(info, ColumnType.BINARY, data);
            final BinaryEntry binary = new BinaryEntry();
            final FixedBitSet docsWithField = readMissing(data);
            binary.offsets = readPacked(data, docsWithField, maxDoc + 1);
            binary.bytesOffset = data.getFilePointer();
            binary.bytesLength = dirFP - binary.bytesOffset;
            binaries.put(info.number, binary);
            break;
          default:
            throw new CorruptIndexException("invalid column type " + types[i] + " for field " + info.name, data);
        }
      }
      this.data = data;
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(data);
      }
    }
  }

  private static void checkType(FieldInfo info, ColumnType expected, IndexInput in) throws CorruptIndexException {
    if (info.getColumnType() != expected) {
      throw new CorruptIndexException("field \"" + info.name + "\" has column type " + info.getColumnType()
          + " but the segment holds a " + expected + " column", in);
    }
  }

  private FixedBitSet readMissing(IndexInput in) throws IOException {
    final byte flag = in.readByte();
    if (flag == ALL_PRESENT) {
      return null;
    } else if (flag != SPARSE) {
      throw new CorruptIndexException("invalid missing flag: " + flag, in);
    }
    final long[] bits = new long[FixedBitSet.bits2words(maxDoc)];
    for (int i = 0; i < bits.length; i++) {
      bits[i] = in.readLong();
    }
    return new FixedBitSet(bits, maxDoc);
  }

  private static Packed readPacked(IndexInput in, FixedBitSet docsWithField, int count) throws IOException {
    final Packed packed = new Packed();
    packed.docsWithField = docsWithField;
    packed.min = in.readLong();
    packed.bytesPerValue = in.readByte();
    switch (packed.bytesPerValue) {
      case 0:
      case 1:
      case 2:
      case 4:
      case 8:
        break;
      default:
        throw new CorruptIndexException("invalid bytes per value: " + packed.bytesPerValue, in);
    }
    packed.valuesOffset = in.getFilePointer();
    packed.valuesLength = (long) count * packed.bytesPerValue;
    in.seek(packed.valuesOffset + packed.valuesLength);
    return packed;
  }

  private static long readDelta(RandomAccessInput values, int bytesPerValue, long index) throws IOException {
    switch (bytesPerValue) {
      case 0:
        return 0L;
      case 1:
        return Byte.toUnsignedLong(values.readByte(index));
      case 2:
        return Short.toUnsignedLong(values.readShort(index << 1));
      case 4:
        return Integer.toUnsignedLong(values.readInt(index << 2));
      case 8:
        return values.readLong(index << 3);
      default:
        throw new AssertionError();
    }
  }

  private RandomAccessInput values(Packed packed) throws IOException {
    if (packed.valuesLength == 0) {
      return null;
    }
    return data.clone().randomAccessSlice(packed.valuesOffset, packed.valuesLength);
  }

  /** Returns a new accessor for the numeric column of {@code field}, or null if the segment has none. */
  public NumericColumn getNumeric(FieldInfo field) throws IOException {
    final Packed packed = numerics.get(field.number);
    if (packed == null) {
      return null;
    }
    final RandomAccessInput values = values(packed);
    return new NumericColumn() {
      @Override
      public boolean exists(int docID) {
        checkDoc(docID);
        return packed.docsWithField == null || packed.docsWithField.get(docID);
      }

      @Override
      public long get(int docID) throws IOException {
        if (exists(docID) == false) {
          return 0L;
        }
        return packed.min + readDelta(values, packed.bytesPerValue, docID);
      }
    };
  }

  /** Returns a new accessor for the binary column of {@code field}, or null if the segment has none. */
  public BinaryColumn getBinary(FieldInfo field) throws IOException {
    final BinaryEntry entry = binaries.get(field.number);
    if (entry == null) {
      return null;
    }
    final RandomAccessInput offsets = values(entry.offsets);
    final IndexInput bytes = data.clone();
    final BytesRef scratch = new BytesRef();
    return new BinaryColumn() {
      @Override
      public boolean exists(int docID) {
        checkDoc(docID);
        return entry.offsets.docsWithField == null || entry.offsets.docsWithField.get(docID);
      }

      @Override
      public BytesRef get(int docID) throws IOException {
        if (exists(docID) == false) {
          return null;
        }
        final long start = readDelta(offsets, entry.offsets.bytesPerValue, docID);
        final long end = readDelta(offsets, entry.offsets.bytesPerValue, docID + 1L);
        final int length = Math.toIntExact(end - start);
        if (start < 0 || end > entry.bytesLength || length < 0) {
          throw new CorruptIndexException("invalid value bounds [" + start + ", " + end + ") for doc " + docID, bytes);
        }
        if (scratch.bytes.length < length) {
          scratch.bytes = new byte[length];
        }
        bytes.seek(entry.bytesOffset + start);
        bytes.readBytes(scratch.bytes, 0, length);
        scratch.offset = 0;
        scratch.length = length;
        return scratch;
      }
    };
  }

  private void checkDoc(int docID) {
    if (docID < 0 || docID >= maxDoc) {
      throw new IllegalArgumentException("no such document: docID=" + docID + " (maxDoc=" + maxDoc + ")");
    }
  }

  /** Verifies the checksum of the columns file. */
  public void checkIntegrity() throws IOException {
    CodecUtil.checksumEntireFile(data);
  }

  @Override
  public void close() throws IOException {
    data.close();
  }
}
