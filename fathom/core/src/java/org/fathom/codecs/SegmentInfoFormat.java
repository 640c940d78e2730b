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
import java.util.Map;
import java.util.Set;

import org.fathom.index.CorruptIndexException;
import org.fathom.index.IndexFileNames;
import org.fathom.index.SegmentInfo;
import org.fathom.store.ChecksumIndexInput;
import org.fathom.store.Directory;
import org.fathom.store.IndexOutput;

/**
 * Reads and writes the {@code .si} file of a segment. After the index
 * header, keyed by the segment id, come the document count as an int, the
 * writer's diagnostics as a map of strings and the segment's file names as
 * a set of strings, the {@code .si} file itself included. A checksum
 * footer closes the file.
 *
 * @fathom.experimental
 */
public final class SegmentInfoFormat {

  static final String CODEC_NAME = "FathomSegmentInfo";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  private SegmentInfoFormat() {}

  static String fileName(String segment) {
    return IndexFileNames.segmentFileName(segment, "", IndexFileNames.SEGMENT_INFO_EXTENSION);
  }

  /**
   * Loads the metadata of {@code segment}.
   *
   * @throws CorruptIndexException if the file fails its checks or belongs
   *         to a segment with another id
   */
  public static SegmentInfo read(Directory dir, String segment, byte[] segmentID) throws IOException {
    try (ChecksumIndexInput in = dir.openChecksumInput(fileName(segment))) {
      SegmentInfo si = null;
      Throwable failure = null;
      try {
        CodecUtil.checkIndexHeader(in, CODEC_NAME, VERSION_START, VERSION_CURRENT, segmentID, "");
        final int maxDoc = in.readInt();
        if (maxDoc < 0) {
          throw new CorruptIndexException("negative document count " + maxDoc, in);
        }
        final Map<String,String> diagnostics = in.readMapOfStrings();
        final Set<String> files = in.readSetOfStrings();
        si = new SegmentInfo(dir, segment, maxDoc, diagnostics, segmentID);
        si.setFiles(files);
      } catch (Throwable t) {
        failure = t;
      } finally {
        CodecUtil.checkFooter(in, failure);
      }
      return si;
    }
  }

  /** Writes the metadata of {@code si}, adding the {@code .si} file to its files first. */
  public static void write(Directory dir, SegmentInfo si) throws IOException {
    final String name = fileName(si.name);
    try (IndexOutput out = dir.createOutput(name)) {
      si.addFile(name);
      CodecUtil.writeIndexHeader(out, CODEC_NAME, VERSION_CURRENT, si.getId(), "");
      out.writeInt(si.maxDoc());
      out.writeMapOfStrings(si.getDiagnostics());
      out.writeSetOfStrings(si.files());
      CodecUtil.writeFooter(out);
    }
  }
}
