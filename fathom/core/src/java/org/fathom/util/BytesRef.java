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
package org.fathom.util;


import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A window {@code [offset, offset + length)} of a byte array. The array is
 * shared, not copied, unless {@link #deepCopyOf} is used. Instances compare
 * by their bytes as unsigned values, the order of every term dictionary.
 */
public final class BytesRef implements Comparable<BytesRef>, Cloneable {

  public static final byte[] EMPTY_BYTES = new byte[0];

  /** Never null. */
  public byte[] bytes;
  public int offset;
  public int length;

  /** An empty window. */
  public BytesRef() {
    this(EMPTY_BYTES);
  }

  /** A window over {@code bytes}, which are not copied. */
  public BytesRef(byte[] bytes, int offset, int length) {
    this.bytes = bytes;
    this.offset = offset;
    this.length = length;
    assert isValid();
  }

  /** A window over all of {@code bytes}, which are not copied. */
  public BytesRef(byte[] bytes) {
    this(bytes, 0, bytes.length);
  }

  /** The UTF-8 encoding of {@code text}, which must not hold unpaired surrogates. */
  public BytesRef(CharSequence text) {
    this(text.toString().getBytes(StandardCharsets.UTF_8));
  }

  /** A new BytesRef over a private copy of {@code other}'s bytes. */
  public static BytesRef deepCopyOf(BytesRef other) {
    return new BytesRef(ArrayUtil.copyOfSubArray(other.bytes, other.offset, other.offset + other.length));
  }

  private int end() {
    return offset + length;
  }

  public boolean bytesEquals(BytesRef other) {
    return Arrays.equals(bytes, offset, end(), other.bytes, other.offset, other.end());
  }

  @Override
  public int compareTo(BytesRef other) {
    return Arrays.compareUnsigned(bytes, offset, end(), other.bytes, other.offset, other.end());
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof BytesRef && bytesEquals((BytesRef) other);
  }

  @Override
  public int hashCode() {
    int h = 1;
    for (int i = offset; i < end(); i++) {
      h = 31 * h + bytes[i];
    }
    return h;
  }

  /** Another window over the same array. */
  @Override
  public BytesRef clone() {
    return new BytesRef(bytes, offset, length);
  }

  public String utf8ToString() {
    return new String(bytes, offset, length, StandardCharsets.UTF_8);
  }

  /** The bytes in hex, for example {@code [66 61 74 68 6f 6d]}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (int i = offset; i < end(); i++) {
      if (i > offset) {
        sb.append(' ');
      }
      sb.append(Integer.toHexString(bytes[i] & 0xFF));
    }
    return sb.append(']').toString();
  }

  /** @throws IllegalStateException if the window does not fit in the array */
  public boolean isValid() {
    if (bytes == null) {
      throw new IllegalStateException("bytes is null");
    }
    if (offset < 0 || length < 0 || (long) offset + length > bytes.length) {
      throw new IllegalStateException("window [" + offset + ", " + ((long) offset + length)
          + ") does not fit in " + bytes.length + " bytes");
    }
    return true;
  }
}
