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
package org.fathom.index;


import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.Collections;

import org.fathom.store.ByteBuffersDataInput;
import org.fathom.store.ByteBuffersDataOutput;
import org.fathom.util.ArrayUtil;
import org.fathom.util.BytesRef;

/**
 * Offsets and payloads of every occurrence of a term in one document: the
 * per-posting value of fields indexed with
 * {@link IndexOptions#DOCS_AND_FREQS_AND_POSITIONS_AND_PAYLOADS}.
 *
 * <p>Encoding: vInt occurrence count, then per occurrence the start
 * offset as a delta from the previous start offset, the vInt length
 * {@code end - start}, and the vInt payload length followed by the payload
 * bytes.
 */
public final class Occurrences {

  private final int[] startOffsets;
  private final int[] endOffsets;
  private final BytesRef[] payloads;

  private Occurrences(int[] startOffsets, int[] endOffsets, BytesRef[] payloads) {
    this.startOffsets = startOffsets;
    this.endOffsets = endOffsets;
    this.payloads = payloads;
  }

  /** Decodes a value produced by {@link Builder#build()}. */
  public static Occurrences decode(BytesRef value) throws IOException {
    ByteBuffersDataInput in = new ByteBuffersDataInput(
        Collections.singletonList(ByteBuffer.wrap(value.bytes, value.offset, value.length).slice()));
    final int count = in.readVInt();
    int[] starts = new int[count];
    int[] ends = new int[count];
    BytesRef[] payloads = new BytesRef[count];
    int start = 0;
    for (int i = 0; i < count; i++) {
      start += in.readVInt();
      starts[i] = start;
      ends[i] = start + in.readVInt();
      final int length = in.readVInt();
      if (length > in.size() - in.position()) {
        throw new CorruptIndexException("payload length " + length + " exceeds value", in);
      }
      byte[] bytes = new byte[length];
      in.readBytes(bytes, 0, length);
      payloads[i] = new BytesRef(bytes);
    }
    if (in.position() != in.size()) {
      throw new CorruptIndexException("trailing bytes after " + count + " occurrences", in);
    }
    return new Occurrences(starts, ends, payloads);
  }

  /** Number of occurrences. */
  public int size() {
    return startOffsets.length;
  }

  /** Start offset of occurrence {@code i}. */
  public int startOffset(int i) {
    return startOffsets[i];
  }

  /** End offset of occurrence {@code i}. */
  public int endOffset(int i) {
    return endOffsets[i];
  }

  /** Payload of occurrence {@code i}, empty if the token carried none. */
  public BytesRef payload(int i) {
    return payloads[i];
  }

  /** Accumulates the occurrences of one term in one document. */
  public static final class Builder {
    private int[] starts = new int[4];
    private int[] ends = new int[4];
    private BytesRef[] payloads = new BytesRef[4];
    private int count;

    /** Records one occurrence; occurrences must be added in ascending start offset order. */
    public Builder add(int startOffset, int endOffset, BytesRef payload) {
      if (startOffset < 0 || endOffset < startOffset) {
        throw new IllegalArgumentException("startOffset must be non-negative, and endOffset must be >= startOffset; got startOffset="
            + startOffset + ",endOffset=" + endOffset);
      }
      if (count > 0 && startOffset < starts[count - 1]) {
        throw new IllegalArgumentException("offsets must not go backwards startOffset=" + startOffset
            + " is < lastStartOffset=" + starts[count - 1]);
      }
      starts = ArrayUtil.grow(starts, count + 1);
      ends = ArrayUtil.grow(ends, count + 1);
      payloads = ArrayUtil.grow(payloads, count + 1);
      starts[count] = startOffset;
      ends[count] = endOffset;
      payloads[count] = payload == null ? new BytesRef() : BytesRef.deepCopyOf(payload);
      count++;
      return this;
    }

    /** Number of occurrences recorded so far. */
    public int size() {
      return count;
    }

    /** Returns the encoded value. */
    public BytesRef build() {
      ByteBuffersDataOutput out = new ByteBuffersDataOutput();
      try {
        out.writeVInt(count);
        int lastStart = 0;
        for (int i = 0; i < count; i++) {
          out.writeVInt(starts[i] - lastStart);
          lastStart = starts[i];
          out.writeVInt(ends[i] - starts[i]);
          out.writeVInt(payloads[i].length);
          out.writeBytes(payloads[i].bytes, payloads[i].offset, payloads[i].length);
        }
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return new BytesRef(out.toArrayCopy());
    }

    /** Forgets all recorded occurrences. */
    public void clear() {
      count = 0;
    }
  }
}
