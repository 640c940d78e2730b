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


import java.util.BitSet;

public class TestFixedBitSet extends FathomTestCase {

  public void testAgainstBitSet() {
    final int numBits = randomIntBetween(1, 500);
    final FixedBitSet bits = new FixedBitSet(numBits);
    final BitSet expected = new BitSet(numBits);
    final int iters = atLeast(200);
    for (int iter = 0; iter < iters; iter++) {
      final int index = random().nextInt(numBits);
      if (randomBoolean()) {
        assertEquals(expected.get(index), bits.getAndSet(index));
        expected.set(index);
      } else {
        assertEquals(expected.get(index), bits.getAndClear(index));
        expected.clear(index);
      }
    }
    for (int i = 0; i < numBits; i++) {
      assertEquals(expected.get(i), bits.get(i));
    }
    assertEquals(expected.cardinality(), bits.cardinality());
  }

  public void testSetRange() {
    final FixedBitSet bits = new FixedBitSet(200);
    bits.set(3, 150);
    assertEquals(147, bits.cardinality());
    assertFalse(bits.get(2));
    assertTrue(bits.get(3));
    assertTrue(bits.get(149));
    assertFalse(bits.get(150));

    final FixedBitSet all = new FixedBitSet(128);
    all.set(0, all.length());
    assertEquals(128, all.cardinality());
  }

  public void testEnsureCapacityKeepsBits() {
    FixedBitSet bits = new FixedBitSet(10);
    bits.set(9);
    assertSame(bits, FixedBitSet.ensureCapacity(bits, 10));
    bits = FixedBitSet.ensureCapacity(bits, 100);
    assertTrue(bits.length() >= 100);
    assertTrue(bits.get(9));
    assertEquals(1, bits.cardinality());
  }

  public void testCloneAndReadOnlyView() {
    final FixedBitSet bits = new FixedBitSet(70);
    bits.set(65);
    final FixedBitSet copy = bits.clone();
    copy.clear(65);
    assertTrue(bits.get(65));
    final Bits view = bits.asReadOnlyBits();
    assertFalse(view instanceof FixedBitSet);
    assertEquals(70, view.length());
    assertTrue(view.get(65));
  }

  public void testWrappedWords() {
    assertEquals(0, FixedBitSet.bits2words(0));
    assertEquals(1, FixedBitSet.bits2words(64));
    assertEquals(2, FixedBitSet.bits2words(65));
    final FixedBitSet bits = new FixedBitSet(new long[] {5L}, 3);
    assertTrue(bits.get(0));
    assertFalse(bits.get(1));
    assertTrue(bits.get(2));
    assertThrows(IllegalArgumentException.class, () -> new FixedBitSet(new long[1], 65));
  }
}
