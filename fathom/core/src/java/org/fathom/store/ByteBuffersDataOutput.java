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
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * A growable in-memory {@link DataOutput} made of fixed-size blocks. The
 * content can be copied to another output, to an array, or read back
 * through {@link #toDataInput()}.
 */
public final class ByteBuffersDataOutput extends DataOutput {

  /** Default block size, as a power of two. */
  public static final int DEFAULT_BLOCK_BITS = 12;

  private final int blockBits;
  private final int blockSize;
  private final List<byte[]> blocks = new ArrayList<>();
  // write offset in the last block
  private int upto;

  /** Creates an output with blocks of {@code 1 << DEFAULT_BLOCK_BITS} bytes. */
  public ByteBuffersDataOutput() {
    this(DEFAULT_BLOCK_BITS);
  }

  /** Creates an output with blocks of {@code 1 << blockBits} bytes. */
  public ByteBuffersDataOutput(int blockBits) {
    if (blockBits < 4 || blockBits > 30) {
      throw new IllegalArgumentException("blockBits must be in [4, 30], got " + blockBits);
    }
    this.blockBits = blockBits;
    this.blockSize = 1 << blockBits;
    this.upto = blockSize;
  }

  @Override
  public void writeByte(byte b) {
    if (upto == blockSize) {
      nextBlock();
    }
    blocks.get(blocks.size() - 1)[upto++] = b;
  }

  @Override
  public void writeBytes(byte[] b, int offset, int length) {
    while (length > 0) {
      if (upto == blockSize) {
        nextBlock();
      }
      final int chunk = Math.min(length, blockSize - upto);
      System.arraycopy(b, offset, blocks.get(blocks.size() - 1), upto, chunk);
      upto += chunk;
      offset += chunk;
      length -= chunk;
    }
  }

  private void nextBlock() {
    blocks.add(new byte[blockSize]);
    upto = 0;
  }

  /** Number of bytes written since creation or the last {@link #reset()}. */
  public long size() {
    return blocks.isEmpty() ? 0 : ((long) (blocks.size() - 1) << blockBits) + upto;
  }

  /** Drops the content, keeping the first block for reuse. */
  public void reset() {
    if (blocks.size() > 1) {
      blocks.subList(1, blocks.size()).clear();
    }
    upto = blocks.isEmpty() ? blockSize : 0;
  }

  /** Read-only views of the written bytes. They share the blocks, so the
   *  output must not be written or reset while they are in use. */
  public List<ByteBuffer> toBufferList() {
    final List<ByteBuffer> buffers = new ArrayList<>(Math.max(1, blocks.size()));
    for (int i = 0; i < blocks.size(); i++) {
      final int len = i == blocks.size() - 1 ? upto : blockSize;
      buffers.add(ByteBuffer.wrap(blocks.get(i), 0, len).slice().asReadOnlyBuffer());
    }
    if (buffers.isEmpty()) {
      buffers.add(ByteBuffer.allocate(0));
    }
    return buffers;
  }

  /** Returns an input over the written bytes; see {@link #toBufferList()}. */
  public ByteBuffersDataInput toDataInput() {
    return new ByteBuffersDataInput(toBufferList());
  }

  /** Returns a copy of the written bytes. */
  public byte[] toArrayCopy() {
    final byte[] copy = new byte[Math.toIntExact(size())];
    int offset = 0;
    for (int i = 0; i < blocks.size(); i++) {
      final int len = i == blocks.size() - 1 ? upto : blockSize;
      System.arraycopy(blocks.get(i), 0, copy, offset, len);
      offset += len;
    }
    return copy;
  }

  /** Writes the content to {@code out}. */
  public void copyTo(DataOutput out) throws IOException {
    for (int i = 0; i < blocks.size(); i++) {
      out.writeBytes(blocks.get(i), i == blocks.size() - 1 ? upto : blockSize);
    }
  }

  @Override
  public String toString() {
    return "ByteBuffersDataOutput(size=" + size() + ", blocks=" + blocks.size() + ")";
  }
}
