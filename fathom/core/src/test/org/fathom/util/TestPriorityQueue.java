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


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class TestPriorityQueue extends FathomTestCase {

  private static final class IntegerQueue extends PriorityQueue<Integer> {
    IntegerQueue(int maxSize) {
      super(maxSize);
    }

    IntegerQueue(int maxSize, boolean sentinels) {
      super(maxSize, sentinels ? () -> Integer.MIN_VALUE : null);
    }

    @Override
    protected boolean lessThan(Integer a, Integer b) {
      return a < b;
    }
  }

  public void testPopsInOrder() {
    final int count = atLeast(100);
    IntegerQueue queue = new IntegerQueue(count);
    List<Integer> expected = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      int value = random().nextInt(1000) - 500;
      queue.add(value);
      expected.add(value);
    }
    Collections.sort(expected);
    assertEquals(count, queue.size());
    for (int value : expected) {
      assertEquals(Integer.valueOf(value), queue.top());
      assertEquals(Integer.valueOf(value), queue.pop());
    }
    assertEquals(0, queue.size());
    assertNull(queue.pop());
    assertNull(queue.top());
  }

  public void testInsertWithOverflowKeepsLargest() {
    IntegerQueue queue = new IntegerQueue(3);
    assertNull(queue.insertWithOverflow(5));
    assertNull(queue.insertWithOverflow(1));
    assertNull(queue.insertWithOverflow(9));
    // too small to enter
    assertEquals(Integer.valueOf(0), queue.insertWithOverflow(0));
    assertEquals(Integer.valueOf(1), queue.insertWithOverflow(7));
    // equal to the top does not enter either
    assertEquals(Integer.valueOf(5), queue.insertWithOverflow(5));
    assertEquals(Integer.valueOf(5), queue.pop());
    assertEquals(Integer.valueOf(7), queue.pop());
    assertEquals(Integer.valueOf(9), queue.pop());
  }

  public void testSentinelsFillQueue() {
    IntegerQueue queue = new IntegerQueue(4, true);
    assertEquals(4, queue.size());
    assertEquals(Integer.valueOf(Integer.MIN_VALUE), queue.top());
    int seen = 0;
    for (Integer value : queue) {
      assertEquals(Integer.valueOf(Integer.MIN_VALUE), value);
      seen++;
    }
    assertEquals(4, seen);
  }

  public void testClearAndZeroSize() {
    IntegerQueue queue = new IntegerQueue(2);
    queue.add(3);
    queue.add(4);
    queue.clear();
    assertEquals(0, queue.size());
    assertNull(queue.top());
    queue.add(6);
    assertEquals(Integer.valueOf(6), queue.top());

    IntegerQueue empty = new IntegerQueue(0);
    assertEquals(Integer.valueOf(8), empty.insertWithOverflow(8));
    assertThrows(IllegalArgumentException.class, () -> new IntegerQueue(-1));
  }
}
