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


public class TestSmallFloat extends FathomTestCase {

  public void testSmallValuesAreExact() {
    for (int i = 0; i < 40; i++) {
      assertEquals(i, SmallFloat.byte4ToInt(SmallFloat.intToByte4(i)));
    }
  }

  public void testRoundsDownMonotonically() {
    int previous = -1;
    int previousDecoded = -1;
    for (int i = 0; i < 100000; i += randomIntBetween(1, 37)) {
      int decoded = SmallFloat.byte4ToInt(SmallFloat.intToByte4(i));
      assertTrue(decoded <= i);
      assertTrue("decoding " + i + " after " + previous, decoded >= previousDecoded);
      previous = i;
      previousDecoded = decoded;
    }
  }

  public void testCodesAreOrdered() {
    for (int code = 1; code < 256; code++) {
      assertTrue(SmallFloat.byte4ToInt((byte) (code - 1)) < SmallFloat.byte4ToInt((byte) code));
    }
    assertEquals((byte) 255, SmallFloat.intToByte4(Integer.MAX_VALUE));
  }

  public void testInt4KeepsFourSignificantBits() {
    assertEquals(7, SmallFloat.int4ToLong(SmallFloat.longToInt4(7)));
    assertEquals(15, SmallFloat.int4ToLong(SmallFloat.longToInt4(15)));
    assertEquals(16, SmallFloat.int4ToLong(SmallFloat.longToInt4(17)));
    assertEquals(1L << 40, SmallFloat.int4ToLong(SmallFloat.longToInt4((1L << 40) + 12345)));
  }

  public void testNegativeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> SmallFloat.intToByte4(-1));
    assertThrows(IllegalArgumentException.class, () -> SmallFloat.longToInt4(-1L));
  }
}
