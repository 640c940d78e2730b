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
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Locale;

/**
 * Reads a sequence of {@link ByteBuffer}s as one stream, by position or
 * sequentially. Every buffer but the last must hold the same power-of-two
 * number of bytes; the last may be shorter. Values are big-endian.
 */
public final class ByteBuffersDataInput extends DataInput implements RandomAccessInput {
  private final ByteBuffer[] blocks;
  private final int blockBits;
  private final long blockMask;
  // window of the blocks this input reads
  private final long start;
  private final long length;

  private long pos;

  /** Reads the remaining bytes of the given buffers, which are not modified. */
  public ByteBuffersDataInput(List<ByteBuffer> buffers) {
    if (buffers.isEmpty()) {
      throw new IllegalArgumentException("at least one buffer is required");
    }
    blocks = new ByteBuffer[buffers.size()];
    long total = 0;
    for (int i = 0; i < blocks.length; i++) {
      blocks[i] = buffers.get(i).slice().asReadOnlyBuffer();
      total += blocks[i].capacity();
    }
    if (blocks.length == 1) {
      blockBits = 31;
    } else {
      final int blockSize = blocks[0].capacity();
      if (Integer.bitCount(blockSize) != 1) {
        throw new IllegalArgumentException("block size must be a power of two, got " + blockSize);
      }
      for (int i = 1; i < blocks.length; i++) {
        final int capacity = blocks[i].capacity();
        if (i < blocks.length - 1 ? capacity != blockSize : capacity > blockSize) {
          throw new IllegalArgumentException("buffer " + i + " holds " + capacity + " bytes, block size is " + blockSize);
        }
      }
      blockBits = Integer.numberOfTrailingZeros(blockSize);
    }
    blockMask = (1L << blockBits) - 1;
    start = 0;
    length = total;
  }

  private ByteBuffersDataInput(ByteBuffersDataInput other, long offset, long length) {
    this.blocks = other.blocks;
    this.blockBits = other.blockBits;
    this.blockMask = other.blockMask;
    this.start = other.start + offset;
    this.length = length;
  }

  /** Number of bytes in this input. */
  public long size() {
    return length;
  }

  /** Current read position. */
  public long position() {
    return pos;
  }

  /** Moves the read position; throws {@link EOFException} past the end. */
  public void seek(long position) throws EOFException {
    if (position < 0 || position > length) {
      throw new EOFException("seek to " + position + " past end of " + this);
    }
    pos = position;
  }

  /** Returns an independent input over {@code length} bytes from {@code offset}. */
  public ByteBuffersDataInput slice(long offset, long length) {
    if (offset < 0 || length < 0 || offset + length > this.length) {
      throw new IllegalArgumentException("slice(offset=" + offset + ", length=" + length + ") is out of bounds: " + this);
    }
    return new ByteBuffersDataInput(this, offset, length);
  }

  @Override
  public byte readByte() throws EOFException {
    if (pos >= length) {
      throw new EOFException("read past end of " + this);
    }
    return readByte(pos++);
  }

  @Override
  public void readBytes(byte[] b, int offset, int len) throws EOFException {
    if (pos + len > length) {
      throw new EOFException("read of " + len + " bytes past end of " + this);
    }
    while (len > 0) {
      final long abs = start + pos;
      final ByteBuffer block = blocks[(int) (abs >>> blockBits)].duplicate();
      block.position((int) (abs & blockMask));
      final int chunk = Math.min(len, block.remaining());
      block.get(b, offset, chunk);
      pos += chunk;
      offset += chunk;
      len -= chunk;
    }
  }

  @Override
  public byte readByte(long pos) {
    final long abs = start + pos;
    return blocks[(int) (abs >>> blockBits)].get((int) (abs & blockMask));
  }

  @Override
  public short readShort(long pos) {
    return (short) (((readByte(pos) & 0xFF) << 8) | (readByte(pos + 1) & 0xFF));
  }

  @Override
  public int readInt(long pos) {
    final long abs = start + pos;
    final int inBlock = (int) (abs & blockMask);
    final ByteBuffer block = blocks[(int) (abs >>> blockBits)];
    if (inBlock + Integer.BYTES <= block.limit()) {
      return block.getInt(inBlock);
    }
    return ((readShort(pos) & 0xFFFF) << 16) | (readShort(pos + 2) & 0xFFFF);
  }

  @Override
  public long readLong(long pos) {
    return (((long) readInt(pos)) << 32) | (readInt(pos + 4) & 0xFFFFFFFFL);
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "%d bytes in %d blocks, position %d", length, blocks.length, pos);
  }
}
