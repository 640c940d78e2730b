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
package org.fathom.store;


import java.util.Arrays;

import org.fathom.util.FathomTestCase;

public class TestMMapDirectory extends FathomTestCase {

  private static byte[] writeFile(Directory dir, String name, int length) throws Exception {
    final byte[] bytes = new byte[length];
    random().nextBytes(bytes);
    try (IndexOutput out = dir.createOutput(name)) {
      out.writeBytes(bytes, bytes.length);
    }
    return bytes;
  }

  public void testFilesSpanningSeveralChunks() throws Exception {
    try (MMapDirectory dir = new MMapDirectory(createTempDir(), NativeFSLockFactory.INSTANCE, 20)) {
      assertEquals(16, dir.getChunkSize());
      for (int length : new int[] {0, 7, 16, 32, randomIntBetween(33, 300)}) {
        final String name = "_" + length + ".bin";
        final byte[] bytes = writeFile(dir, name, length);
        try (IndexInput in = dir.openInput(name)) {
          assertEquals(length, in.length());
          byte[] read = new byte[length];
          in.readBytes(read, 0, length);
          assertArrayEquals(bytes, read);
          if (length >= 24) {
            in.seek(13);
            IndexInput clone = in.clone();
            assertEquals(13, clone.getFilePointer());
            assertEquals(bytes[13], clone.readByte());

            RandomAccessInput values = in.randomAccessSlice(5, length - 5);
            long expected = 0;
            for (int i = 0; i < 8; i++) {
              expected = (expected << 8) | (bytes[10 + i] & 0xFF);
            }
            assertEquals(expected, values.readLong(5));

            IndexInput slice = in.slice("tail", 16, length - 16);
            byte[] tail = new byte[length - 16];
            slice.readBytes(tail, 0, tail.length);
            assertArrayEquals(Arrays.copyOfRange(bytes, 16, length), tail);
          }
        }
      }
    }
  }

  public void testIllegalChunkSize() {
    assertThrows(IllegalArgumentException.class, () -> new MMapDirectory(createTempDir(), NativeFSLockFactory.INSTANCE, 0));
  }
}
