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
import java.util.HashMap;
import java.util.Map;

import org.fathom.index.CorruptIndexException;
import org.fathom.index.FieldInfo;
import org.fathom.index.IndexFileNames;
import org.fathom.index.SegmentReadState;
import org.fathom.index.SegmentWriteState;
import org.fathom.store.ChecksumIndexInput;
import org.fathom.store.IndexOutput;

/**
 * Field lengths format.
 * <p>
 * The {@code .len} file is read entirely into memory when the segment opens.
 * <ul>
 *   <li>Lengths --&gt; Header, NumFields (VInt), Field<sup>NumFields</sup>, Footer
 *   <li>Field --&gt; FieldNumber (VInt), TotalLength (VLong), Length<sup>MaxDoc</sup> (Byte, see {@link FieldLengths#encode})
 * </ul>
 * Lengths of fields that are no longer part of the schema are skipped on read.
 */
public final class FieldLengthsFormat {

  static final String CODEC_NAME = "FathomFieldLengths";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  private FieldLengthsFormat() {}

  /** Writes the lengths of the fields of {@code state} that record lengths. */
  public static void write(SegmentWriteState state, FieldLengths lengths) throws IOException {
    final String fileName = IndexFileNames.segmentFileName(state.segmentInfo.name, "", IndexFileNames.LENGTHS_EXTENSION);
    if (lengths.maxDoc() != state.segmentInfo.maxDoc()) {
      throw new IllegalArgumentException("lengths cover " + lengths.maxDoc() + " docs but segment has maxDoc=" + state.segmentInfo.maxDoc());
    }
    try (IndexOutput out = state.directory.createOutput(fileName)) {
      CodecUtil.writeIndexHeader(out, CODEC_NAME, VERSION_CURRENT, state.segmentInfo.getId(), "");
      out.writeVInt(lengths.size());
      for (int fieldNumber : lengths.fieldNumbers()) {
        out.writeVInt(fieldNumber);
        out.writeVLong(lengths.total(fieldNumber));
        final byte[] encoded = lengths.encoded(fieldNumber);
        out.writeBytes(encoded, 0, encoded.length);
      }
      CodecUtil.writeFooter(out);
    }
  }

  /** Reads the lengths written by {@link #write}. */
  public static FieldLengths read(SegmentReadState state) throws IOException {
    final String fileName = IndexFileNames.segmentFileName(state.segmentInfo.name, "", IndexFileNames.LENGTHS_EXTENSION);
    final int maxDoc = state.segmentInfo.maxDoc();
    try (ChecksumIndexInput in = state.directory.openChecksumInput(fileName)) {
      Throwable priorE = null;
      FieldLengths lengths = null;
      try {
        CodecUtil.checkIndexHeader(in, CODEC_NAME, VERSION_START, VERSION_CURRENT, state.segmentInfo.getId(), "");
        final int numFields = in.readVInt();
        if (numFields < 0) {
          throw new CorruptIndexException("invalid number of fields: " + numFields, in);
        }
        final Map<Integer,byte[]> byField = new HashMap<>();
        final Map<Integer,Long> totals = new HashMap<>();
        for (int i = 0; i < numFields; i++) {
          final int fieldNumber = in.readVInt();
          final long total = in.readVLong();
          final byte[] encoded = new byte[maxDoc];
          in.readBytes(encoded, 0, maxDoc);
          final FieldInfo info = state.fieldInfos.fieldInfo(fieldNumber);
          if (info != null && info.hasLengths()) {
            byField.put(fieldNumber, encoded);
            totals.put(fieldNumber, total);
          }
        }
        lengths = new FieldLengths(maxDoc, byField, totals);
      } catch (Throwable exception) {
        priorE = exception;
      } finally {
        CodecUtil.checkFooter(in, priorE);
      }
      return lengths;
    }
  }
}
