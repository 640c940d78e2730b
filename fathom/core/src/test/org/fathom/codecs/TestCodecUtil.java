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


import org.fathom.index.CorruptIndexException;
import org.fathom.index.IndexFormatTooNewException;
import org.fathom.store.CorruptingIndexOutput;
import org.fathom.store.Directory;
import org.fathom.store.IndexInput;
import org.fathom.store.IndexOutput;
import org.fathom.util.FathomTestCase;
import org.fathom.util.StringHelper;

public class TestCodecUtil extends FathomTestCase {

  private static final String CODEC = "FooCodec";

  private static void writeFile(byte[] id, IndexOutput out) throws Exception {
    try (IndexOutput output = out) {
      CodecUtil.writeIndexHeader(output, CODEC, 3, id, "xyz");
      for (int i = 0; i < 100; i++) {
        output.writeVInt(i * 31);
      }
      CodecUtil.writeFooter(output);
    }
  }

  public void testHeaderAndFooter() throws Exception {
    Directory dir = newDirectory();
    byte[] id = StringHelper.randomId();
    writeFile(id, dir.createOutput("foo"));
    try (IndexInput in = dir.openInput("foo")) {
      assertEquals(3, CodecUtil.checkIndexHeader(in, CODEC, 1, 3, id, "xyz"));
      assertEquals(in.getFilePointer(), CodecUtil.indexHeaderLength(CODEC, "xyz"));
      CodecUtil.checksumEntireFile(in);
      assertEquals(CodecUtil.checksumEntireFile(in), CodecUtil.retrieveChecksum(in));
    }
  }

  public void testHeaderMismatch() throws Exception {
    Directory dir = newDirectory();
    byte[] id = StringHelper.randomId();
    writeFile(id, dir.createOutput("foo"));
    try (IndexInput in = dir.openInput("foo")) {
      assertThrows(CorruptIndexException.class, () -> CodecUtil.checkIndexHeader(in, "BarCodec", 1, 3, id, "xyz"));
    }
    try (IndexInput in = dir.openInput("foo")) {
      assertThrows(IndexFormatTooNewException.class, () -> CodecUtil.checkIndexHeader(in, CODEC, 1, 2, id, "xyz"));
    }
    try (IndexInput in = dir.openInput("foo")) {
      assertThrows(CorruptIndexException.class, () -> CodecUtil.checkIndexHeader(in, CODEC, 1, 3, StringHelper.randomId(), "xyz"));
    }
  }

  public void testChecksumDetectsFlippedBit() throws Exception {
    Directory dir = newDirectory();
    byte[] id = StringHelper.randomId();
    long corruptAt = CodecUtil.indexHeaderLength(CODEC, "xyz") + randomIntBetween(0, 50);
    writeFile(id, new CorruptingIndexOutput(dir.createOutput("foo"), corruptAt));
    try (IndexInput in = dir.openInput("foo")) {
      // the header and the stored checksum are intact
      CodecUtil.checkIndexHeader(in, CODEC, 1, 3, id, "xyz");
      CodecUtil.retrieveChecksum(in);
      CorruptIndexException e = assertThrows(CorruptIndexException.class, () -> CodecUtil.checksumEntireFile(in));
      assertTrue(e.getMessage(), e.getMessage().contains("checksum failed"));
    }
  }

  public void testTruncatedFile() throws Exception {
    Directory dir = newDirectory();
    try (IndexOutput out = dir.createOutput("short")) {
      out.writeInt(42);
    }
    try (IndexInput in = dir.openInput("short")) {
      assertThrows(CorruptIndexException.class, () -> CodecUtil.retrieveChecksum(in));
      assertThrows(CorruptIndexException.class, () -> CodecUtil.checksumEntireFile(in));
    }
  }
}
