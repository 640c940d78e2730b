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


import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.fathom.util.FathomTestCase;

public class TestDataInputOutput extends FathomTestCase {

  public void testVIntLengths() throws Exception {
    assertEquals(1, vIntLength(0));
    assertEquals(1, vIntLength(127));
    assertEquals(2, vIntLength(128));
    assertEquals(3, vIntLength(1 << 14));
    assertEquals(5, vIntLength(Integer.MAX_VALUE));
  }

  private static long vIntLength(int value) throws IOException {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    out.writeVInt(value);
    return out.size();
  }

  public void testRandomVariableLengthValues() throws Exception {
    final int count = atLeast(500);
    final int[] ints = new int[count];
    final long[] longs = new long[count];
    final int[] zints = new int[count];
    final long[] zlongs = new long[count];
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    for (int i = 0; i < count; i++) {
      ints[i] = randomIntBetween(0, Integer.MAX_VALUE);
      longs[i] = random().nextLong() & Long.MAX_VALUE;
      zints[i] = random().nextInt();
      zlongs[i] = random().nextLong();
      out.writeVInt(ints[i]);
      out.writeVLong(longs[i]);
      out.writeZInt(zints[i]);
      out.writeZLong(zlongs[i]);
    }
    ByteBuffersDataInput in = out.toDataInput();
    for (int i = 0; i < count; i++) {
      assertEquals(ints[i], in.readVInt());
      assertEquals(longs[i], in.readVLong());
      assertEquals(zints[i], in.readZInt());
      assertEquals(zlongs[i], in.readZLong());
    }
    assertEquals(out.size(), in.position());
  }

  public void testSmallNegativeZIntIsShort() throws Exception {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    out.writeZInt(-1);
    out.writeZLong(-64);
    assertEquals(2, out.size());
  }

  public void testMalformedVInt() throws Exception {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    for (int i = 0; i < 4; i++) {
      out.writeByte((byte) 0xFF);
    }
    // fifth byte carries more than the 4 remaining bits
    out.writeByte((byte) 0x7F);
    ByteBuffersDataInput in = out.toDataInput();
    IOException expected = assertThrows(IOException.class, in::readVInt);
    assertTrue(expected.getMessage().contains("vInt"));
  }

  public void testMalformedVLong() throws Exception {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    for (int i = 0; i < 9; i++) {
      out.writeByte((byte) 0xFF);
    }
    out.writeByte((byte) 0x01);
    ByteBuffersDataInput in = out.toDataInput();
    assertThrows(IOException.class, in::readVLong);
  }

  public void testStrings() throws Exception {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    out.writeString("");
    out.writeString("café 中文");
    Map<String,String> map = new HashMap<>();
    map.put("source", "flush");
    map.put("os", "linux");
    out.writeMapOfStrings(map);
    out.writeMapOfStrings(Collections.emptyMap());
    Set<String> set = new LinkedHashSet<>();
    set.add("_0.tim");
    set.add("_0.tip");
    out.writeSetOfStrings(set);

    ByteBuffersDataInput in = out.toDataInput();
    assertEquals("", in.readString());
    assertEquals("café 中文", in.readString());
    assertEquals(map, in.readMapOfStrings());
    assertTrue(in.readMapOfStrings().isEmpty());
    assertEquals(set, in.readSetOfStrings());
  }

  public void testFixedWidth() throws Exception {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    out.writeShort((short) -2);
    out.writeInt(0xCAFEBABE);
    out.writeLong(Long.MIN_VALUE + 7);
    assertEquals(14, out.size());
    ByteBuffersDataInput in = out.toDataInput();
    assertEquals((short) -2, in.readShort());
    assertEquals(0xCAFEBABE, in.readInt());
    assertEquals(Long.MIN_VALUE + 7, in.readLong());
  }

  public void testReadsAcrossBlockBoundaries() throws Exception {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput(4);
    final byte[] bytes = new byte[randomIntBetween(40, 200)];
    random().nextBytes(bytes);
    out.writeBytes(bytes, 0, 3);
    out.writeBytes(bytes, 3, bytes.length - 3);
    assertEquals(bytes.length, out.size());
    assertArrayEquals(bytes, out.toArrayCopy());
    assertTrue(out.toBufferList().size() > 1);

    ByteBuffersDataInput in = out.toDataInput();
    for (int pos = 0; pos + 4 <= bytes.length; pos++) {
      final int expected = ((bytes[pos] & 0xFF) << 24) | ((bytes[pos + 1] & 0xFF) << 16)
          | ((bytes[pos + 2] & 0xFF) << 8) | (bytes[pos + 3] & 0xFF);
      assertEquals(expected, in.readInt(pos));
    }

    final int offset = randomIntBetween(0, bytes.length - 1);
    final int length = randomIntBetween(0, bytes.length - offset);
    ByteBuffersDataInput slice = in.slice(offset, length);
    byte[] read = new byte[length];
    slice.readBytes(read, 0, length);
    assertArrayEquals(Arrays.copyOfRange(bytes, offset, offset + length), read);
    assertThrows(EOFException.class, slice::readByte);
    assertThrows(IllegalArgumentException.class, () -> in.slice(offset, bytes.length + 1));
  }

  public void testResetReusesOutput() throws Exception {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput(4);
    for (int i = 0; i < 50; i++) {
      out.writeByte((byte) i);
    }
    out.reset();
    assertEquals(0, out.size());
    out.writeInt(42);
    assertEquals(4, out.size());
    assertEquals(42, out.toDataInput().readInt());

    ByteBuffersDataOutput copy = new ByteBuffersDataOutput();
    out.copyTo(copy);
    assertArrayEquals(out.toArrayCopy(), copy.toArrayCopy());
  }

  public void testEmptyOutput() throws Exception {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    assertEquals(0, out.size());
    ByteBuffersDataInput in = out.toDataInput();
    assertEquals(0, in.size());
    assertThrows(EOFException.class, in::readByte);
  }
}
