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


import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

import org.fathom.util.BytesRef;

/**
 * Sequential writer of the primitive values every file format is made of.
 * Fixed-width numbers are big-endian. Variable-length numbers carry 7 bits
 * per byte, least significant group first, with the high bit set on every
 * byte but the last; zig-zag variants map small negative numbers to small
 * codes first. An instance belongs to one thread.
 */
public abstract class DataOutput {

  private static final int COPY_BUFFER_SIZE = 16384;

  private byte[] copyBuffer;

  public abstract void writeByte(byte b) throws IOException;

  public abstract void writeBytes(byte[] b, int offset, int length) throws IOException;

  /** Writes the first {@code length} bytes of {@code b}. */
  public void writeBytes(byte[] b, int length) throws IOException {
    writeBytes(b, 0, length);
  }

  public void writeShort(short s) throws IOException {
    writeByte((byte) (s >> 8));
    writeByte((byte) s);
  }

  public void writeInt(int i) throws IOException {
    for (int shift = 24; shift >= 0; shift -= 8) {
      writeByte((byte) (i >> shift));
    }
  }

  public void writeLong(long l) throws IOException {
    writeInt((int) (l >> 32));
    writeInt((int) l);
  }

  /** One to five bytes; negative values always take five. */
  public final void writeVInt(int i) throws IOException {
    while ((i & ~0x7F) != 0) {
      writeByte((byte) (0x80 | (i & 0x7F)));
      i >>>= 7;
    }
    writeByte((byte) i);
  }

  /** A signed int as a vInt of its zig-zag code. */
  public final void writeZInt(int i) throws IOException {
    writeVInt((i << 1) ^ (i >> 31));
  }

  /**
   * One to nine bytes.
   *
   * @throws IllegalArgumentException if {@code l} is negative
   */
  public final void writeVLong(long l) throws IOException {
    if (l < 0) {
      throw new IllegalArgumentException("vLong cannot be negative: " + l);
    }
    writeVarLong(l);
  }

  /** A signed long as the variable-length zig-zag code, one to ten bytes. */
  public final void writeZLong(long l) throws IOException {
    writeVarLong((l << 1) ^ (l >> 63));
  }

  private void writeVarLong(long l) throws IOException {
    while ((l & ~0x7FL) != 0) {
      writeByte((byte) (0x80 | (l & 0x7F)));
      l >>>= 7;
    }
    writeByte((byte) l);
  }

  /** The UTF-8 byte count as a vInt, then the UTF-8 bytes. */
  public void writeString(String s) throws IOException {
    byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
    writeVInt(utf8.length);
    writeBytes(utf8, 0, utf8.length);
  }

  /** The length as a vInt, then the bytes of {@code ref}. */
  public void writeBytesRef(BytesRef ref) throws IOException {
    writeVInt(ref.length);
    writeBytes(ref.bytes, ref.offset, ref.length);
  }

  /** Copies the next {@code numBytes} bytes of {@code input}. */
  public void copyBytes(DataInput input, long numBytes) throws IOException {
    assert numBytes >= 0 : "numBytes=" + numBytes;
    if (copyBuffer == null) {
      copyBuffer = new byte[COPY_BUFFER_SIZE];
    }
    long left = numBytes;
    while (left > 0) {
      int chunk = (int) Math.min(left, COPY_BUFFER_SIZE);
      input.readBytes(copyBuffer, 0, chunk);
      writeBytes(copyBuffer, 0, chunk);
      left -= chunk;
    }
  }

  /** The entry count as a vInt, then key and value of each entry as strings. */
  public void writeMapOfStrings(Map<String,String> map) throws IOException {
    writeVInt(map.size());
    for (Map.Entry<String,String> entry : map.entrySet()) {
      writeString(entry.getKey());
      writeString(entry.getValue());
    }
  }

  /** The element count as a vInt, then each element as a string. */
  public void writeSetOfStrings(Set<String> set) throws IOException {
    writeVInt(set.size());
    for (String value : set) {
      writeString(value);
    }
  }
}
