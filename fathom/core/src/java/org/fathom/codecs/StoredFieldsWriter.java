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
import java.util.function.UnaryOperator;

import org.fathom.index.FieldInfo;
import org.fathom.index.IndexFileNames;
import org.fathom.index.SegmentWriteState;
import org.fathom.index.StoredFieldVisitor;
import org.fathom.store.ByteBuffersDataOutput;
import org.fathom.store.IndexOutput;
import org.fathom.util.BytesRef;
import org.fathom.util.IOUtils;

/**
 * Writes the stored fields of a segment.
 * <p>
 * The {@code .fdt} file holds one record per document, in document order:
 * NumFields (VInt), then per field FieldNumber&lt;&lt;3|Type (VInt) and the
 * value. Strings are written with {@link org.fathom.store.DataOutput#writeString},
 * bytes as VInt length and bytes, ints and longs zig-zag encoded, floats and
 * doubles as their raw bits. The {@code .fdx} file holds the start pointer
 * of every record as a fixed-width long so that a document is found with a
 * single lookup.
 * <p>
 * For every document, {@link #startDocument()} is called,
 * then {@link #writeField} for each stored value, then
 * {@link #finishDocument()}. {@link #finish(int)} checks the document count
 * before the writer is closed.
 *
 * @fathom.experimental
 */
public final class StoredFieldsWriter implements Closeable {

  static final String DATA_CODEC_NAME = "FathomStoredFieldsData";
  static final String INDEX_CODEC_NAME = "FathomStoredFieldsIndex";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  static final int STRING = 0x00;
  static final int BYTE_ARR = 0x01;
  static final int NUMERIC_INT = 0x02;
  static final int NUMERIC_LONG = 0x03;
  static final int NUMERIC_FLOAT = 0x04;
  static final int NUMERIC_DOUBLE = 0x05;

  static final int TYPE_BITS = 3;
  static final int TYPE_MASK = (1 << TYPE_BITS) - 1;

  private final IndexOutput fieldsStream;
  private final IndexOutput indexStream;
  private final ByteBuffersDataOutput bufferedDoc = new ByteBuffersDataOutput();
  private int numStoredFieldsInDoc;
  private int numDocs;

  /** Creates the stored fields files of the segment described by {@code state}. */
  public StoredFieldsWriter(SegmentWriteState state) throws IOException {
    final String segment = state.segmentInfo.name;
    boolean success = false;
    IndexOutput fieldsStream = null;
    IndexOutput indexStream = null;
    try {
      fieldsStream = state.directory.createOutput(IndexFileNames.segmentFileName(segment, "", IndexFileNames.FIELDS_EXTENSION));
      CodecUtil.writeIndexHeader(fieldsStream, DATA_CODEC_NAME, VERSION_CURRENT, state.segmentInfo.getId(), "");
      indexStream = state.directory.createOutput(IndexFileNames.segmentFileName(segment, "", IndexFileNames.FIELDS_INDEX_EXTENSION));
      CodecUtil.writeIndexHeader(indexStream, INDEX_CODEC_NAME, VERSION_CURRENT, state.segmentInfo.getId(), "");
      this.fieldsStream = fieldsStream;
      this.indexStream = indexStream;
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(fieldsStream, indexStream);
      }
    }
  }

  /** Called before writing the stored fields of the document. */
  public void startDocument() {
    bufferedDoc.reset();
    numStoredFieldsInDoc = 0;
  }

  /**
   * Writes a single stored value. Supported values are {@link String},
   * {@link BytesRef}, {@code byte[]}, {@link Integer}, {@link Long},
   * {@link Float} and {@link Double}.
   */
  public void writeField(FieldInfo info, Object value) throws IOException {
    final int bits;
    if (value instanceof String) {
      bits = STRING;
    } else if (value instanceof BytesRef || value instanceof byte[]) {
      bits = BYTE_ARR;
    } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      bits = NUMERIC_INT;
    } else if (value instanceof Long) {
      bits = NUMERIC_LONG;
    } else if (value instanceof Float) {
      bits = NUMERIC_FLOAT;
    } else if (value instanceof Double) {
      bits = NUMERIC_DOUBLE;
    } else {
      throw new IllegalArgumentException("cannot store value of type "
          + (value == null ? "null" : value.getClass().getName()) + " for field \"" + info.name + "\"");
    }

    bufferedDoc.writeVInt((info.number << TYPE_BITS) | bits);
    switch (bits) {
      case STRING:
        bufferedDoc.writeString((String) value);
        break;
      case BYTE_ARR:
        if (value instanceof byte[]) {
          bufferedDoc.writeBytesRef(new BytesRef((byte[]) value));
        } else {
          bufferedDoc.writeBytesRef((BytesRef) value);
        }
        break;
      case NUMERIC_INT:
        bufferedDoc.writeZInt(((Number) value).intValue());
        break;
      case NUMERIC_LONG:
        bufferedDoc.writeZLong((Long) value);
        break;
      case NUMERIC_FLOAT:
        bufferedDoc.writeInt(Float.floatToIntBits((Float) value));
        break;
      case NUMERIC_DOUBLE:
        bufferedDoc.writeLong(Double.doubleToLongBits((Double) value));
        break;
      default:
        throw new AssertionError("Cannot get here");
    }
    numStoredFieldsInDoc++;
  }

  /** Called when a document and all its fields have been added. */
  public void finishDocument() throws IOException {
    indexStream.writeLong(fieldsStream.getFilePointer());
    fieldsStream.writeVInt(numStoredFieldsInDoc);
    bufferedDoc.copyTo(fieldsStream);
    numDocs++;
  }

  /** Called before {@link #close()} with the number of documents
   *  written, which must match the calls to {@link #startDocument()}. */
  public void finish(int numDocs) throws IOException {
    if (this.numDocs != numDocs) {
      throw new IllegalStateException("Wrote " + this.numDocs + " docs, finish called with numDocs=" + numDocs);
    }
    CodecUtil.writeFooter(indexStream);
    CodecUtil.writeFooter(fieldsStream);
  }

  @Override
  public void close() throws IOException {
    IOUtils.close(fieldsStream, indexStream);
  }

  /**
   * A visitor that copies the stored values of another segment into the
   * writer, keeping only the fields the merged schema stores.
   */
  public final class MergeVisitor extends StoredFieldVisitor {
    private final UnaryOperator<FieldInfo> targetOf;

    /** Creates a visitor copying into this writer; {@code targetOf} maps a
     *  source field to the merged schema, null for fields to drop. */
    public MergeVisitor(UnaryOperator<FieldInfo> targetOf) {
      this.targetOf = targetOf;
    }

    private void copy(FieldInfo source, Object value) throws IOException {
      writeField(targetOf.apply(source), value);
    }

    @Override
    public void binaryField(FieldInfo fieldInfo, byte[] value) throws IOException {
      copy(fieldInfo, value);
    }

    @Override
    public void stringField(FieldInfo fieldInfo, String value) throws IOException {
      copy(fieldInfo, value);
    }

    @Override
    public void intField(FieldInfo fieldInfo, int value) throws IOException {
      copy(fieldInfo, value);
    }

    @Override
    public void longField(FieldInfo fieldInfo, long value) throws IOException {
      copy(fieldInfo, value);
    }

    @Override
    public void floatField(FieldInfo fieldInfo, float value) throws IOException {
      copy(fieldInfo, value);
    }

    @Override
    public void doubleField(FieldInfo fieldInfo, double value) throws IOException {
      copy(fieldInfo, value);
    }

    @Override
    public Status needsField(FieldInfo fieldInfo) {
      FieldInfo targetInfo = targetOf.apply(fieldInfo);
      return targetInfo != null && targetInfo.isStored() ? Status.YES : Status.NO;
    }
  }
}
