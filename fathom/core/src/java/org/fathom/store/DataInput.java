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
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.fathom.util.BytesRef;

/**
 * Sequential reader of the primitive values {@link DataOutput} writes.
 * An instance keeps a read position and belongs to one thread; a
 * {@link #clone()} reads the same data from its own position.
 */
public abstract class DataInput implements Cloneable {

  private static final int SKIP_BUFFER_SIZE = 1024;

  // lazily allocated; per instance since checksumming inputs read skipped bytes through it
  private byte[] skipBuffer;

  public abstract byte readByte() throws IOException;

  /** Reads exactly {@code len} bytes into {@code b} starting at {@code offset}. */
  public abstract void readBytes(byte[] b, int offset, int len) throws IOException;

  /** Two bytes, most significant first. */
  public short readShort() throws IOException {
    int high = readByte() & 0xFF;
    return (short) (high << 8 | (readByte() & 0xFF));
  }

  /** Four bytes, most significant first. */
  public int readInt() throws IOException {
    int value = 0;
    for (int i = 0; i < 4; i++) {
      value = value << 8 | (readByte() & 0xFF);
    }
    return value;
  }

  /** Eight bytes, most significant first. */
  public long readLong() throws IOException {
    long high = readInt();
    return high << 32 | (readInt() & 0xFFFFFFFFL);
  }

  /**
   * An int in one to five bytes.
   *
   * @throws IOException if the encoding carries more than 32 bits
   * @see DataOutput#writeVInt(int)
   */
  public int readVInt() throws IOException {
    int value = 0;
    for (int shift = 0; shift < 28; shift += 7) {
      byte b = readByte();
      value |= (b & 0x7F) << shift;
      if (b >= 0) {
        return value;
      }
    }
    byte last = readByte();
    if ((last & 0xF0) != 0) {
      throw new IOException("vInt longer than 32 bits");
    }
    return value | last << 28;
  }

  /** @see DataOutput#writeZInt(int) */
  public int readZInt() throws IOException {
    return zigZagDecode(readVInt());
  }

  /**
   * A non-negative long in one to nine bytes.
   *
   * @see DataOutput#writeVLong(long)
   */
  public long readVLong() throws IOException {
    return readVLong(false);
  }

  /** @see DataOutput#writeZLong(long) */
  public long readZLong() throws IOException {
    return zigZagDecode(readVLong(true));
  }

  // the tenth byte may only carry the sign bit, and only for zig-zag values
  private long readVLong(boolean signed) throws IOException {
    long value = 0;
    for (int shift = 0; shift < 63; shift += 7) {
      byte b = readByte();
      value |= (b & 0x7FL) << shift;
      if (b >= 0) {
        return value;
      }
    }
    byte last = readByte();
    if ((last & 0xFE) != 0 || (last != 0 && signed == false)) {
      throw new IOException(signed ? "vLong longer than 64 bits" : "negative vLong");
    }
    return value | (long) last << 63;
  }

  private static int zigZagDecode(int i) {
    return (i >>> 1) ^ -(i & 1);
  }

  private static long zigZagDecode(long l) {
    return (l >>> 1) ^ -(l & 1);
  }

  /** A vInt byte count followed by that many UTF-8 bytes. */
  public String readString() throws IOException {
    byte[] utf8 = readLengthPrefixed();
    return new String(utf8, StandardCharsets.UTF_8);
  }

  /** A vInt byte count followed by that many bytes, in a new array. */
  public BytesRef readBytesRef() throws IOException {
    return new BytesRef(readLengthPrefixed());
  }

  private byte[] readLengthPrefixed() throws IOException {
    byte[] bytes = new byte[readVInt()];
    readBytes(bytes, 0, bytes.length);
    return bytes;
  }

  /** @see DataOutput#writeMapOfStrings(Map) */
  public Map<String,String> readMapOfStrings() throws IOException {
    int count = readVInt();
    Map<String,String> map = new TreeMap<>();
    for (int i = 0; i < count; i++) {
      String key = readString();
      map.put(key, readString());
    }
    return Collections.unmodifiableMap(map);
  }

  /** @see DataOutput#writeSetOfStrings(Set) */
  public Set<String> readSetOfStrings() throws IOException {
    int count = readVInt();
    Set<String> set = new TreeSet<>();
    for (int i = 0; i < count; i++) {
      set.add(readString());
    }
    return Collections.unmodifiableSet(set);
  }

  /**
   * Moves forward {@code numBytes} bytes as if reading and dropping them.
   * Subclasses that can seek override this.
   */
  public void skipBytes(long numBytes) throws IOException {
    if (numBytes < 0) {
      throw new IllegalArgumentException("cannot skip a negative number of bytes: " + numBytes);
    }
    if (skipBuffer == null) {
      skipBuffer = new byte[SKIP_BUFFER_SIZE];
    }
    long left = numBytes;
    while (left > 0) {
      int chunk = (int) Math.min(left, SKIP_BUFFER_SIZE);
      readBytes(skipBuffer, 0, chunk);
      left -= chunk;
    }
  }

  /** A reader over the same data, starting at this reader's position. */
  @Override
  public DataInput clone() {
    try {
      return (DataInput) super.clone();
    } catch (CloneNotSupportedException e) {
      throw new AssertionError(e);
    }
  }
}
