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

import org.fathom.index.ColumnType;
import org.fathom.index.FieldInfo;
import org.fathom.index.IndexFileNames;
import org.fathom.index.SegmentWriteState;
import org.fathom.store.IndexOutput;
import org.fathom.util.Bits;
import org.fathom.util.BytesRef;
import org.fathom.util.FixedBitSet;
import org.fathom.util.IOUtils;

/**
 * Writes the columns of a segment into its {@code .col} file.
 * <p>
 * File layout:
 * <ul>
 *   <li>Columns --&gt; Header, Column<sup>NumFields</sup>, Directory, DirectoryFP (Int64), Footer
 *   <li>Directory --&gt; NumFields (VInt), &lt;FieldNumber (VInt), Type (Byte), Offset (VLong)&gt;<sup>NumFields</sup>
 *   <li>NumericColumn --&gt; Missing, Packed
 *   <li>BinaryColumn --&gt; Missing, Packed offsets (MaxDoc+1 entries), Bytes
 *   <li>Missing --&gt; 0 (Byte) when every document has a value, else 1 (Byte) and the
 *       presence bitmap as Int64<sup>(MaxDoc+63)/64</sup>
 *   <li>Packed --&gt; MinValue (Int64), BytesPerValue (Byte: 0, 1, 2, 4 or 8), Delta<sup>Count</sup>
 * </ul>
 * A packed value is stored as its delta to the minimum in the smallest width
 * that holds the largest delta, so every value is found at a fixed offset.
 * Documents without a value are stored as the minimum.
 *
 * @fathom.experimental
 */
public final class ColumnsWriter implements Closeable {

  static final String CODEC_NAME = "FathomColumns";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  static final byte NUMERIC = 0;
  static final byte BINARY = 1;

  static final byte ALL_PRESENT = 0;
  static final byte SPARSE = 1;

  private final IndexOutput data;
  private final int maxDoc;
  private final List<ColumnEntry> directory = new ArrayList<>();

  private static final class ColumnEntry {
    final int fieldNumber;
    final byte type;
    final long offset;

    ColumnEntry(int fieldNumber, byte type, long offset) {
      this.fieldNumber = fieldNumber;
      this.type = type;
      this.offset = offset;
    }
  }

  /** Creates the columns file of the segment described by {@code state}. */
  public ColumnsWriter(SegmentWriteState state) throws IOException {
    this.maxDoc = state.segmentInfo.maxDoc();
    final String fileName = IndexFileNames.segmentFileName(state.segmentInfo.name, "", IndexFileNames.COLUMNS_EXTENSION);
    boolean success = false;
    final IndexOutput data = state.directory.createOutput(fileName);
    try {
      CodecUtil.writeIndexHeader(data, CODEC_NAME, VERSION_CURRENT, state.segmentInfo.getId(), "");
      this.data = data;
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(data);
      }
    }
  }

  /**
   * Writes a numeric column. {@code values} holds one value per document,
   * {@code docsWithField} tells which documents have one.
   */
  public void addNumericField(FieldInfo field, long[] values, Bits docsWithField) throws IOException {
    checkField(field, ColumnType.NUMERIC);
    if (values.length != maxDoc || docsWithField.length() != maxDoc) {
      throw new IllegalArgumentException("column of field \"" + field.name + "\" must cover maxDoc=" + maxDoc + " documents");
    }
    directory.add(new ColumnEntry(field.number, NUMERIC, data.getFilePointer()));
    writeMissing(docsWithField);
    long min = Long.MAX_VALUE;
    boolean any = false;
    for (int doc = 0; doc < maxDoc; doc++) {
      if (docsWithField.get(doc)) {
        min = Math.min(min, values[doc]);
        any = true;
      }
    }
    if (any == false) {
      min = 0;
    }
    final long[] deltas = new long[maxDoc];
    for (int doc = 0; doc < maxDoc; doc++) {
      deltas[doc] = docsWithField.get(doc) ? values[doc] - min : 0L;
    }
    writePacked(min, deltas, maxDoc);
  }

  /**
   * Writes a binary column. {@code values} holds one value per document,
   * null for documents without a value.
   */
  public void addBinaryField(FieldInfo field, BytesRef[] values) throws IOException {
    checkField(field, ColumnType.BINARY);
    if (values.length != maxDoc) {
      throw new IllegalArgumentException("column of field \"" + field.name + "\" must cover maxDoc=" + maxDoc + " documents");
    }
    directory.add(new ColumnEntry(field.number, BINARY, data.getFilePointer()));
    final FixedBitSet docsWithField = new FixedBitSet(maxDoc);
    final long[] offsets = new long[maxDoc + 1];
    for (int doc = 0; doc < maxDoc; doc++) {
      final BytesRef value = values[doc];
      if (value != null) {
        docsWithField.set(doc);
        offsets[doc + 1] = offsets[doc] + value.length;
      } else {
        offsets[doc + 1] = offsets[doc];
      }
    }
    writeMissing(docsWithField);
    writePacked(0L, offsets, maxDoc + 1);
    for (BytesRef value : values) {
      if (value != null) {
        data.writeBytes(value.bytes, value.offset, value.length);
      }
    }
  }

  private void checkField(FieldInfo field, ColumnType expected) {
    if (field.getColumnType() != expected) {
      throw new IllegalArgumentException("field \"" + field.name + "\" has column type " + field.getColumnType()
          + ", cannot write a " + expected + " column");
    }
  }

  private void writeMissing(Bits docsWithField) throws IOException {
    int count = 0;
    for (int doc = 0; doc < maxDoc; doc++) {
      if (docsWithField.get(doc)) {
        count++;
      }
    }
    if (count == maxDoc) {
      data.writeByte(ALL_PRESENT);
      return;
    }
    data.writeByte(SPARSE);
    final int longCount = FixedBitSet.bits2words(maxDoc);
    for (int i = 0; i < longCount; ++i) {
      long currentBits = 0;
      for (int j = i << 6, end = Math.min(j + 63, maxDoc - 1); j <= end; ++j) {
        if (docsWithField.get(j)) {
          currentBits |= 1L << j; // mod 64
        }
      }
      data.writeLong(currentBits);
    }
  }

  private void writePacked(long min, long[] deltas, int count) throws IOException {
    long maxDelta = 0;
    for (int i = 0; i < count; i++) {
      if (Long.compareUnsigned(deltas[i], maxDelta) > 0) {
        maxDelta = deltas[i];
      }
    }
    final int bytesPerValue = bytesPerValue(maxDelta);
    data.writeLong(min);
    data.writeByte((byte) bytesPerValue);
    for (int i = 0; i < count; i++) {
      final long delta = deltas[i];
      switch (bytesPerValue) {
        case 0:
          break;
        case 1:
          data.writeByte((byte) delta);
          break;
        case 2:
          data.writeShort((short) delta);
          break;
        case 4:
          data.writeInt((int) delta);
          break;
        case 8:
          data.writeLong(delta);
          break;
        default:
          throw new AssertionError();
      }
    }
  }

  /** Returns the number of bytes needed to store every unsigned value up to {@code maxDelta}. */
  static int bytesPerValue(long maxDelta) {
    if (maxDelta == 0) {
      return 0;
    } else if (Long.compareUnsigned(maxDelta, 0xFFL) <= 0) {
      return 1;
    } else if (Long.compareUnsigned(maxDelta, 0xFFFFL) <= 0) {
      return 2;
    } else if (Long.compareUnsigned(maxDelta, 0xFFFFFFFFL) <= 0) {
      return 4;
    } else {
      return 8;
    }
  }

  @Override
  public void close() throws IOException {
    boolean success = false;
    try {
      final long dirFP = data.getFilePointer();
      data.writeVInt(directory.size());
      for (ColumnEntry entry : directory) {
        data.writeVInt(entry.fieldNumber);
        data.writeByte(entry.type);
        data.writeVLong(entry.offset);
      }
      data.writeLong(dirFP);
      CodecUtil.writeFooter(data);
      success = true;
    } finally {
      if (success) {
        IOUtils.close(data);
      } else {
        IOUtils.closeWhileHandlingException(data);
      }
    }
  }
}
