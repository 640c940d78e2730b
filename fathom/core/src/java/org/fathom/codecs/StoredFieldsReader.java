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
import org.fathom.index.FieldInfos;
import org.fathom.index.IndexFileNames;
import org.fathom.index.SegmentReadState;
import org.fathom.index.StoredFieldVisitor;
import org.fathom.store.IndexInput;
import org.fathom.util.IOUtils;

import static org.fathom.codecs.StoredFieldsWriter.BYTE_ARR;
import static org.fathom.codecs.StoredFieldsWriter.NUMERIC_DOUBLE;
import static org.fathom.codecs.StoredFieldsWriter.NUMERIC_FLOAT;
import static org.fathom.codecs.StoredFieldsWriter.NUMERIC_INT;
import static org.fathom.codecs.StoredFieldsWriter.NUMERIC_LONG;
import static org.fathom.codecs.StoredFieldsWriter.STRING;
import static org.fathom.codecs.StoredFieldsWriter.TYPE_BITS;
import static org.fathom.codecs.StoredFieldsWriter.TYPE_MASK;

/**
 * Reads the stored fields written by {@link StoredFieldsWriter}. Values of
 * fields missing from the schema are skipped. Every visit works on clones of
 * the underlying inputs, so one reader serves concurrent threads.
 *
 * @fathom.experimental
 */
public final class StoredFieldsReader implements Closeable {

  private final FieldInfos fieldInfos;
  private final int maxDoc;
  private final IndexInput fieldsStream;
  private final IndexInput indexStream;
  private final long indexStart;

  /** Opens the stored fields of the segment described by {@code state}. */
  public StoredFieldsReader(SegmentReadState state) throws IOException {
    this.fieldInfos = state.fieldInfos;
    this.maxDoc = state.segmentInfo.maxDoc();
    final String segment = state.segmentInfo.name;
    boolean success = false;
    IndexInput fieldsStream = null;
    IndexInput indexStream = null;
    try {
      indexStream = state.directory.openInput(IndexFileNames.segmentFileName(segment, "", IndexFileNames.FIELDS_INDEX_EXTENSION));
      CodecUtil.checkIndexHeader(indexStream, StoredFieldsWriter.INDEX_CODEC_NAME, StoredFieldsWriter.VERSION_START,
          StoredFieldsWriter.VERSION_CURRENT, state.segmentInfo.getId(), "");
      final long headerLength = indexStream.getFilePointer();
      final long expectedLength = headerLength + (long) maxDoc * Long.BYTES + CodecUtil.footerLength();
      if (indexStream.length() != expectedLength) {
        throw new CorruptIndexException("stored fields index has length " + indexStream.length()
            + " but " + maxDoc + " docs need " + expectedLength, indexStream);
      }
      CodecUtil.retrieveChecksum(indexStream);
      this.indexStart = headerLength;

      fieldsStream = state.directory.openInput(IndexFileNames.segmentFileName(segment, "", IndexFileNames.FIELDS_EXTENSION));
      CodecUtil.checkIndexHeader(fieldsStream, StoredFieldsWriter.DATA_CODEC_NAME, StoredFieldsWriter.VERSION_START,
          StoredFieldsWriter.VERSION_CURRENT, state.segmentInfo.getId(), "");
      CodecUtil.retrieveChecksum(fieldsStream);

      this.indexStream = indexStream;
      this.fieldsStream = fieldsStream;
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(indexStream, fieldsStream);
      }
    }
  }

  /**
   * Visit the stored fields for document <code>docID</code>.
   *
   * @throws IllegalArgumentException if the document does not exist in this segment
   */
  public void visitDocument(int docID, StoredFieldVisitor visitor) throws IOException {
    if (docID < 0 || docID >= maxDoc) {
      throw new IllegalArgumentException("no such document: docID=" + docID + " (maxDoc=" + maxDoc + ")");
    }
    final IndexInput index = indexStream.clone();
    index.seek(indexStart + (long) docID * Long.BYTES);
    final IndexInput in = fieldsStream.clone();
    in.seek(index.readLong());
    final int numFields = in.readVInt();
    for (int i = 0; i < numFields; i++) {
      final int code = in.readVInt();
      final int fieldNumber = code >>> TYPE_BITS;
      final int bits = code & TYPE_MASK;
      final FieldInfo fieldInfo = fieldInfos.fieldInfo(fieldNumber);
      if (fieldInfo == null) {
        skipField(in, bits);
        continue;
      }
      switch (visitor.needsField(fieldInfo)) {
        case YES:
          readField(in, visitor, fieldInfo, bits);
          break;
        case NO:
          skipField(in, bits);
          break;
        case STOP:
          return;
      }
    }
  }

  private static void readField(IndexInput in, StoredFieldVisitor visitor, FieldInfo info, int bits) throws IOException {
    switch (bits) {
      case BYTE_ARR:
        int length = in.readVInt();
        byte[] data = new byte[length];
        in.readBytes(data, 0, length);
        visitor.binaryField(info, data);
        break;
      case STRING:
        visitor.stringField(info, in.readString());
        break;
      case NUMERIC_INT:
        visitor.intField(info, in.readZInt());
        break;
      case NUMERIC_FLOAT:
        visitor.floatField(info, Float.intBitsToFloat(in.readInt()));
        break;
      case NUMERIC_LONG:
        visitor.longField(info, in.readZLong());
        break;
      case NUMERIC_DOUBLE:
        visitor.doubleField(info, Double.longBitsToDouble(in.readLong()));
        break;
      default:
        throw new CorruptIndexException("Unknown type flag: " + Integer.toHexString(bits), in);
    }
  }

  private static void skipField(IndexInput in, int bits) throws IOException {
    switch (bits) {
      case BYTE_ARR:
      case STRING:
        final int length = in.readVInt();
        in.skipBytes(length);
        break;
      case NUMERIC_INT:
        in.readZInt();
        break;
      case NUMERIC_FLOAT:
        in.readInt();
        break;
      case NUMERIC_LONG:
        in.readZLong();
        break;
      case NUMERIC_DOUBLE:
        in.readLong();
        break;
      default:
        throw new CorruptIndexException("Unknown type flag: " + Integer.toHexString(bits), in);
    }
  }

  /** Verifies the checksums of both stored fields files. */
  public void checkIntegrity() throws IOException {
    CodecUtil.checksumEntireFile(indexStream);
    CodecUtil.checksumEntireFile(fieldsStream);
  }

  @Override
  public void close() throws IOException {
    IOUtils.close(fieldsStream, indexStream);
  }
}
