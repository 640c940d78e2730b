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
 * Lossy one-byte encoding of non-negative ints, used for per-document field
 * lengths. Small values are exact; larger ones keep four significant bits.
 * The encoding is monotonic and rounds down.
 *
 * @fathom.internal
 */
public final class SmallFloat {

  private SmallFloat() {}

  /**
   * Encodes a non-negative long as a tiny float: three mantissa bits below
   * an implicit leading one, and an exponent of {@code shift + 1} in the
   * higher bits. Values below 8 are stored as is with exponent 0.
   */
  public static int longToInt4(long value) {
    if (value < 0) {
      throw new IllegalArgumentException("negative value " + value);
    }
    int shift = Math.max(0, 64 - Long.numberOfLeadingZeros(value) - 4);
    if (value < 8) {
      return (int) value;
    }
    int mantissa = (int) (value >>> shift) & 0x07;
    return ((shift + 1) << 3) | mantissa;
  }

  /** Inverse of {@link #longToInt4(long)}, rounding down to the representable value. */
  public static long int4ToLong(int encoded) {
    int exponent = encoded >>> 3;
    long mantissa = encoded & 0x07;
    return exponent == 0 ? mantissa : (mantissa | 0x08) << (exponent - 1);
  }

  // codes below this are spent on exact small values
  private static final int EXACT_LIMIT = 255 - longToInt4(Integer.MAX_VALUE);

  /** Encodes a non-negative int into one byte. */
  public static byte intToByte4(int value) {
    if (value < 0) {
      throw new IllegalArgumentException("negative value " + value);
    }
    if (value < EXACT_LIMIT) {
      return (byte) value;
    }
    return (byte) (EXACT_LIMIT + longToInt4(value - EXACT_LIMIT));
  }

  /** Decodes a byte written by {@link #intToByte4(int)}. */
  public static int byte4ToInt(byte b) {
    int code = b & 0xFF;
    if (code < EXACT_LIMIT) {
      return code;
    }
    return Math.toIntExact(EXACT_LIMIT + int4ToLong(code - EXACT_LIMIT));
  }
}
