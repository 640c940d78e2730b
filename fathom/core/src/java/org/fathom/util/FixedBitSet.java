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


import java.util.Arrays;

/**
 * A bit set of fixed length backed by a {@code long[]}. Bit {@code i}
 * lives in word {@code i >> 6} at position {@code i & 63}; bits past
 * {@link #length()} are always clear.
 */
public final class FixedBitSet implements Bits, Cloneable {

  private final long[] words;
  private final int numBits;

  /** Number of {@code long}s needed to hold {@code numBits} bits. */
  public static int bits2words(int numBits) {
    return ((numBits - 1) >> 6) + 1;
  }

  /** Returns {@code bits} if it holds bit {@code numBits - 1}, else a larger
   *  copy with the same bits set. */
  public static FixedBitSet ensureCapacity(FixedBitSet bits, int numBits) {
    if (numBits <= bits.numBits) {
      return bits;
    }
    final int capacity = Math.max(numBits, bits.numBits + (bits.numBits >> 1));
    return new FixedBitSet(Arrays.copyOf(bits.words, bits2words(capacity)), capacity);
  }

  /** Creates a set of {@code numBits} clear bits. */
  public FixedBitSet(int numBits) {
    this.numBits = numBits;
    this.words = new long[bits2words(numBits)];
  }

  /** Wraps {@code words}, which must be large enough and must not have bits
   *  set past {@code numBits}. The array is not copied. */
  public FixedBitSet(long[] words, int numBits) {
    if (words.length < bits2words(numBits)) {
      throw new IllegalArgumentException(words.length + " words cannot hold " + numBits + " bits");
    }
    this.words = words;
    this.numBits = numBits;
    assert ghostBitsClear();
  }

  private boolean ghostBitsClear() {
    for (int i = bits2words(numBits); i < words.length; i++) {
      if (words[i] != 0) {
        return false;
      }
    }
    return (numBits & 63) == 0 || (words[bits2words(numBits) - 1] & (-1L << numBits)) == 0;
  }

  @Override
  public int length() {
    return numBits;
  }

  /** Number of set bits. */
  public int cardinality() {
    int count = 0;
    for (long word : words) {
      count += Long.bitCount(word);
    }
    return count;
  }

  @Override
  public boolean get(int index) {
    assert index >= 0 && index < numBits : "index=" + index + ", numBits=" + numBits;
    return (words[index >> 6] & (1L << index)) != 0;
  }

  public void set(int index) {
    assert index >= 0 && index < numBits : "index=" + index + ", numBits=" + numBits;
    words[index >> 6] |= 1L << index;
  }

  /** Sets the bit and returns its previous value. */
  public boolean getAndSet(int index) {
    final boolean was = get(index);
    set(index);
    return was;
  }

  public void clear(int index) {
    assert index >= 0 && index < numBits : "index=" + index + ", numBits=" + numBits;
    words[index >> 6] &= ~(1L << index);
  }

  /** Clears the bit and returns its previous value. */
  public boolean getAndClear(int index) {
    final boolean was = get(index);
    clear(index);
    return was;
  }

  /** Sets bits {@code from} (inclusive) to {@code to} (exclusive). */
  public void set(int from, int to) {
    assert from >= 0 && from <= to && to <= numBits : "from=" + from + ", to=" + to + ", numBits=" + numBits;
    for (int i = from; i < to; ) {
      if ((i & 63) == 0 && to - i >= 64) {
        words[i >> 6] = -1L;
        i += 64;
      } else {
        set(i++);
      }
    }
  }

  @Override
  public FixedBitSet clone() {
    return new FixedBitSet(words.clone(), numBits);
  }

  /** A view that cannot be cast back to a mutable set. */
  public Bits asReadOnlyBits() {
    final FixedBitSet in = this;
    return new Bits() {
      @Override
      public boolean get(int index) {
        return in.get(index);
      }

      @Override
      public int length() {
        return in.numBits;
      }
    };
  }

  @Override
  public String toString() {
    return "FixedBitSet(length=" + numBits + ", cardinality=" + cardinality() + ")";
  }
}
