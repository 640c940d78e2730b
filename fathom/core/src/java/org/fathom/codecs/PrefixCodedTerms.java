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
package org.fathom.codecs;


import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

import org.fathom.index.CorruptIndexException;
import org.fathom.store.ByteBuffersDataInput;
import org.fathom.store.ByteBuffersDataOutput;
import org.fathom.store.DataInput;
import org.fathom.store.DataOutput;
import org.fathom.util.BytesRef;
import org.fathom.util.BytesRefBuilder;
import org.fathom.util.StringHelper;

/**
 * Prefix codes a sorted sequence of byte strings.
 *
 * <p>Each entry is the length of the prefix it shares with the previous
 * entry as a single unsigned byte (at most {@value #MAX_SHARED_PREFIX}),
 * then the length of the remaining suffix as a vInt, then the suffix bytes.
 * An entry decodes from the previously decoded entry alone, so a reader
 * restarting at a block boundary only has to reset its previous entry.
 */
public class PrefixCodedTerms {

  /** Largest shared prefix a single entry records. */
  public static final int MAX_SHARED_PREFIX = 255;

  private final List<ByteBuffer> content;
  private final long size;

  private PrefixCodedTerms(List<ByteBuffer> content, long size) {
    this.content = Objects.requireNonNull(content);
    this.size = size;
  }

  /**
   * Writes {@code term} relative to {@code previous}. Pass an empty
   * {@link BytesRef} as {@code previous} for the first entry of a run.
   */
  public static void writeEntry(DataOutput out, BytesRef previous, BytesRef term) throws IOException {
    final int prefix = Math.min(MAX_SHARED_PREFIX, StringHelper.bytesDifference(previous, term));
    final int suffix = term.length - prefix;
    out.writeByte((byte) prefix);
    out.writeVInt(suffix);
    out.writeBytes(term.bytes, term.offset + prefix, suffix);
  }

  /**
   * Reads one entry written by {@link #writeEntry}, replacing the content of
   * {@code previous} with the decoded entry.
   */
  public static void readEntry(DataInput in, BytesRefBuilder previous) throws IOException {
    final int prefix = in.readByte() & 0xFF;
    final int suffix = in.readVInt();
    if (prefix > previous.length()) {
      throw new CorruptIndexException("shared prefix " + prefix + " exceeds previous entry length " + previous.length(), in);
    }
    previous.grow(prefix + suffix);
    in.readBytes(previous.bytes(), prefix, suffix);
    previous.setLength(prefix + suffix);
  }

  /** Builds a PrefixCodedTerms: call add repeatedly, then finish. */
  public static class Builder {
    private final ByteBuffersDataOutput output = new ByteBuffersDataOutput();
    private final BytesRefBuilder lastTerm = new BytesRefBuilder();
    private long size;

    /** Sole constructor. */
    public Builder() {}

    /** add a term. This term must sort after the previous one added. */
    public void add(BytesRef term) {
      if (size > 0 && term.compareTo(lastTerm.get()) <= 0) {
        throw new IllegalArgumentException("terms out of order: " + term + " after " + lastTerm.get());
      }
      try {
        writeEntry(output, lastTerm.get(), term);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      lastTerm.copyBytes(term);
      size += 1;
    }

    /** return finalized form */
    public PrefixCodedTerms finish() {
      return new PrefixCodedTerms(output.toBufferList(), size);
    }
  }

  /** An iterator over the list of terms stored in a {@link PrefixCodedTerms}. */
  public static class TermIterator {
    final ByteBuffersDataInput input;
    final BytesRefBuilder builder = new BytesRefBuilder();
    final long end;

    private TermIterator(ByteBuffersDataInput input) {
      this.input = input;
      end = input.size();
    }

    /** Returns the next term, or null once exhausted. The returned bytes are reused by the next call. */
    public BytesRef next() {
      if (input.position() < end) {
        try {
          readEntry(input, builder);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
        return builder.get();
      } else {
        return null;
      }
    }
  }

  /** Return an iterator over the terms stored in this {@link PrefixCodedTerms}. */
  public TermIterator iterator() {
    return new TermIterator(new ByteBuffersDataInput(content));
  }

  /** Return the number of terms stored in this {@link PrefixCodedTerms}. */
  public long size() {
    return size;
  }
}
