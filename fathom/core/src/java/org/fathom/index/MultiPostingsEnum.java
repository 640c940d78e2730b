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
import java.util.Arrays;

import org.fathom.util.BytesRef;

/**
 * Concatenates the postings of one term over several sub-readers. Each
 * sub-reader's documents are shifted by the start of its slice, so doc IDs
 * come out increasing in the composite reader's doc ID space.
 *
 * @fathom.experimental
 */
public final class MultiPostingsEnum extends PostingsEnum {

  private final EnumWithSlice[] subs;
  private int numSubs;
  private int sub;
  private PostingsEnum in;
  private int base;
  private int doc = -1;

  /** Creates an enum able to hold up to {@code subReaderCount} sub-readers. */
  public MultiPostingsEnum(int subReaderCount) {
    subs = new EnumWithSlice[subReaderCount];
    for (int i = 0; i < subReaderCount; i++) {
      subs[i] = new EnumWithSlice();
    }
  }

  /** Copies the first {@code numSubs} entries of {@code from} and rewinds. */
  public MultiPostingsEnum reset(EnumWithSlice[] from, int numSubs) {
    for (int i = 0; i < numSubs; i++) {
      subs[i].postingsEnum = from[i].postingsEnum;
      subs[i].slice = from[i].slice;
    }
    this.numSubs = numSubs;
    sub = -1;
    in = null;
    doc = -1;
    return this;
  }

  /** Number of sub-readers in use; see {@link #getSubs()}. */
  public int getNumSubs() {
    return numSubs;
  }

  /** The sub-reader entries; only the first {@link #getNumSubs()} are in use. */
  public EnumWithSlice[] getSubs() {
    return subs;
  }

  /** Moves to the next sub-reader, returning false once all are consumed. */
  private boolean nextSub() {
    if (sub + 1 >= numSubs) {
      in = null;
      return false;
    }
    sub++;
    in = subs[sub].postingsEnum;
    base = subs[sub].slice.start;
    return true;
  }

  @Override
  public int nextDoc() throws IOException {
    if (doc == NO_MORE_DOCS) {
      return doc;
    }
    while (in != null || nextSub()) {
      int local = in.nextDoc();
      if (local != NO_MORE_DOCS) {
        return doc = base + local;
      }
      in = null;
    }
    return doc = NO_MORE_DOCS;
  }

  @Override
  public int advance(int target) throws IOException {
    if (doc == NO_MORE_DOCS || target <= doc) {
      return doc;
    }
    while (in != null || nextSub()) {
      // a target inside an earlier slice means: first doc of this one
      int local = target < base ? in.nextDoc() : in.advance(target - base);
      if (local != NO_MORE_DOCS) {
        return doc = base + local;
      }
      in = null;
    }
    return doc = NO_MORE_DOCS;
  }

  @Override
  public int docID() {
    return doc;
  }

  @Override
  public float weight() {
    ensureActive();
    return in.weight();
  }

  @Override
  public int[] positions() {
    ensureActive();
    return in.positions();
  }

  @Override
  public BytesRef value() {
    ensureActive();
    return in.value();
  }

  @Override
  public long cost() {
    long cost = 0;
    for (int i = 0; i < numSubs; i++) {
      cost += subs[i].postingsEnum.cost();
    }
    return cost;
  }

  @Override
  public String toString() {
    return "MultiPostingsEnum(" + Arrays.toString(Arrays.copyOf(subs, numSubs)) + ")";
  }

  /** One sub-reader's postings and the slice locating it in the composite reader. */
  public final static class EnumWithSlice {
    /** Postings of the sub-reader. */
    public PostingsEnum postingsEnum;

    /** Where the sub-reader's documents start in the composite reader. */
    public ReaderSlice slice;

    EnumWithSlice() {
    }

    @Override
    public String toString() {
      return slice + ":" + postingsEnum;
    }
  }
}
