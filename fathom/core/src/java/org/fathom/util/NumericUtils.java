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


/**
 * Helper APIs to encode numeric values as sortable bytes and vice-versa.
 * The encodings preserve numeric order under unsigned byte comparison, so
 * numeric fields can be indexed as ordinary terms and queried with term
 * ranges.
 *
 * @fathom.internal
 */
public final class NumericUtils {

  private NumericUtils() {} // no instance!

  /**
   * Converts a <code>double</code> value to a sortable signed <code>long</code>.
   * The value is converted by getting their IEEE 754 floating-point &quot;double format&quot;
   * bit layout and then some bits are swapped, to be able to compare the result as long.
   * By this the precision is not reduced, but the value can easily used as a long.
   * The sort order (including {@link Double#NaN}) is defined by
   * {@link Double#compareTo}; {@code NaN} is greater than positive infinity.
   * @see #sortableLongToDouble
   */
  public static long doubleToSortableLong(double value) {
    return sortableDoubleBits(Double.doubleToLongBits(value));
  }

  /**
   * Converts a sortable <code>long</code> back to a <code>double</code>.
   * @see #doubleToSortableLong
   */
  public static double sortableLongToDouble(long encoded) {
    return Double.longBitsToDouble(sortableDoubleBits(encoded));
  }

  /** Converts IEEE 754 representation of a double to sortable order (or back to the original) */
  public static long sortableDoubleBits(long bits) {
    return bits ^ (bits >> 63) & 0x7fffffffffffffffL;
  }

  /**
   * Encodes an long {@code value} such that unsigned byte order comparison
   * is consistent with {@link Long#compare(long, long)}
   * @see #sortableBytesToLong(byte[], int)
   */
  public static void longToSortableBytes(long value, byte[] result, int offset) {
    // Flip the sign bit so negative longs sort before positive longs:
    value ^= 0x8000000000000000L;
    result[offset] =   (byte) (value >> 56);
    result[offset+1] = (byte) (value >> 48);
    result[offset+2] = (byte) (value >> 40);
    result[offset+3] = (byte) (value >> 32);
    result[offset+4] = (byte) (value >> 24);
    result[offset+5] = (byte) (value >> 16);
    result[offset+6] = (byte) (value >> 8);
    result[offset+7] = (byte) value;
  }

  /** Returns a new {@link BytesRef} holding the sortable encoding of {@code value}. */
  public static BytesRef longToSortableBytes(long value) {
    byte[] bytes = new byte[Long.BYTES];
    longToSortableBytes(value, bytes, 0);
    return new BytesRef(bytes);
  }

  /**
   * Decodes a long value previously written with {@link #longToSortableBytes}
   * @see #longToSortableBytes(long, byte[], int)
   */
  public static long sortableBytesToLong(byte[] encoded, int offset) {
    long v = ((encoded[offset] & 0xFFL) << 56)   |
             ((encoded[offset+1] & 0xFFL) << 48) |
             ((encoded[offset+2] & 0xFFL) << 40) |
             ((encoded[offset+3] & 0xFFL) << 32) |
             ((encoded[offset+4] & 0xFFL) << 24) |
             ((encoded[offset+5] & 0xFFL) << 16) |
             ((encoded[offset+6] & 0xFFL) << 8)  |
              (encoded[offset+7] & 0xFFL);
    // Flip the sign bit back
    v ^= 0x8000000000000000L;
    return v;
  }

  /** Decodes the sortable long held by {@code ref}. */
  public static long sortableBytesToLong(BytesRef ref) {
    if (ref.length != Long.BYTES) {
      throw new IllegalArgumentException("expected " + Long.BYTES + " bytes, got " + ref.length);
    }
    return sortableBytesToLong(ref.bytes, ref.offset);
  }
}
