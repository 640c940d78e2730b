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
import org.fathom.util.PriorityQueue;

/**
 * Merges the term dictionaries of several sub-readers into one sorted
 * {@link TermsEnum}. A term present in more than one sub-reader is returned
 * once; its statistics are combined over the sub-readers holding it and its
 * postings are concatenated in sub-reader order.
 *
 * @fathom.experimental
 */
public final class MultiTermsEnum extends TermsEnum {

  /** A sub-reader's {@link TermsEnum} and its position among the slices. */
  static class TermsEnumIndex {
    public final static TermsEnumIndex[] EMPTY_ARRAY = new TermsEnumIndex[0];
    final int subIndex;
    final TermsEnum termsEnum;

    public TermsEnumIndex(TermsEnum termsEnum, int subIndex) {
      this.termsEnum = termsEnum;
      this.subIndex = subIndex;
    }
  }

  private final Cursor[] cursors;
  private final Cursor[] live;
  private final Cursor[] matching;
  private final CursorQueue queue;
  private final MultiPostingsEnum.EnumWithSlice[] postingsSlices;

  private int numLive;
  private int numMatching;
  private BytesRef term;
  // set by seekExact: cursors that missed the term are not queued yet
  private boolean queueStale;

  /** Creates an enum over the given sub-reader slices; call
   *  {@link #reset(TermsEnumIndex[])} before use. */
  public MultiTermsEnum(ReaderSlice[] slices) {
    cursors = new Cursor[slices.length];
    postingsSlices = new MultiPostingsEnum.EnumWithSlice[slices.length];
    for (int i = 0; i < slices.length; i++) {
      cursors[i] = new Cursor(i, slices[i]);
      postingsSlices[i] = new MultiPostingsEnum.EnumWithSlice();
    }
    live = new Cursor[slices.length];
    matching = new Cursor[slices.length];
    queue = new CursorQueue(slices.length);
  }

  /**
   * Points this enum at fresh sub-enums, none of which may have been
   * advanced yet. Returns {@link TermsEnum#EMPTY} if none has a term.
   */
  public TermsEnum reset(TermsEnumIndex[] subs) throws IOException {
    assert subs.length <= cursors.length;
    queue.clear();
    numLive = 0;
    numMatching = 0;
    term = null;
    queueStale = false;
    for (TermsEnumIndex sub : subs) {
      BytesRef first = sub.termsEnum.next();
      if (first == null) {
        continue;
      }
      Cursor cursor = cursors[sub.subIndex];
      cursor.terms = sub.termsEnum;
      cursor.term = first;
      live[numLive++] = cursor;
      queue.add(cursor);
    }
    return queue.size() == 0 ? TermsEnum.EMPTY : this;
  }

  /** Number of sub-readers positioned on the current term. */
  public int getMatchCount() {
    return numMatching;
  }

  @Override
  public BytesRef term() {
    return term;
  }

  @Override
  public boolean seekExact(BytesRef target) throws IOException {
    queue.clear();
    numMatching = 0;
    for (int i = 0; i < numLive; i++) {
      Cursor cursor = live[i];
      if (cursor.terms.seekExact(target)) {
        cursor.term = cursor.terms.term();
        matching[numMatching++] = cursor;
      } else {
        cursor.term = null;
      }
    }
    queueStale = true;
    term = numMatching > 0 ? matching[0].term : null;
    return numMatching > 0;
  }

  @Override
  public SeekStatus seekCeil(BytesRef target) throws IOException {
    queue.clear();
    numMatching = 0;
    queueStale = false;
    for (int i = 0; i < numLive; i++) {
      Cursor cursor = live[i];
      SeekStatus status = cursor.terms.seekCeil(target);
      if (status == SeekStatus.END) {
        cursor.term = null;
        continue;
      }
      cursor.term = cursor.terms.term();
      queue.add(cursor);
      if (status == SeekStatus.FOUND) {
        matching[numMatching++] = cursor;
      }
    }
    if (numMatching > 0) {
      term = matching[0].term;
      return SeekStatus.FOUND;
    }
    if (queue.size() == 0) {
      term = null;
      return SeekStatus.END;
    }
    collectMatching();
    return SeekStatus.NOT_FOUND;
  }

  @Override
  public BytesRef next() throws IOException {
    if (queueStale) {
      if (term == null) {
        return null;
      }
      // bring the cursors that missed the exact term to the following term
      SeekStatus status = seekCeil(term);
      assert status == SeekStatus.FOUND;
    }
    for (int i = 0; i < numMatching; i++) {
      Cursor cursor = queue.top();
      cursor.term = cursor.terms.next();
      if (cursor.term == null) {
        queue.pop();
      } else {
        queue.updateTop();
      }
    }
    numMatching = 0;
    if (queue.size() == 0) {
      term = null;
    } else {
      collectMatching();
    }
    return term;
  }

  /** Gathers every queued cursor sitting on the smallest term. */
  private void collectMatching() {
    numMatching = queue.collectTop(matching);
    term = matching[0].term;
  }

  /**
   * Statistics of the current term over the sub-readers holding it. The
   * combined info has no postings pointer; read the postings through
   * {@link #postings()}.
   */
  @Override
  public TermInfo termInfo() throws IOException {
    if (numMatching == 1) {
      return matching[0].terms.termInfo();
    }
    int docFreq = 0;
    double totalWeight = 0;
    int minLength = Integer.MAX_VALUE;
    int maxLength = 0;
    float minWeight = Float.POSITIVE_INFINITY;
    float maxWeight = Float.NEGATIVE_INFINITY;
    for (int i = 0; i < numMatching; i++) {
      TermInfo info = matching[i].terms.termInfo();
      docFreq += info.docFreq();
      totalWeight += info.totalWeight();
      minLength = Math.min(minLength, info.minLength());
      maxLength = Math.max(maxLength, info.maxLength());
      minWeight = Math.min(minWeight, info.minWeight());
      maxWeight = Math.max(maxWeight, info.maxWeight());
    }
    return new TermInfo(docFreq, (float) totalWeight, minLength, maxLength, minWeight, maxWeight, TermInfo.NO_POSTINGS, 0);
  }

  @Override
  public int docFreq() throws IOException {
    int docFreq = 0;
    for (int i = 0; i < numMatching; i++) {
      docFreq += matching[i].terms.docFreq();
    }
    return docFreq;
  }

  @Override
  public float totalWeight() throws IOException {
    double total = 0;
    for (int i = 0; i < numMatching; i++) {
      total += matching[i].terms.totalWeight();
    }
    return (float) total;
  }

  @Override
  public PostingsEnum postings() throws IOException {
    Cursor[] ordered = Arrays.copyOf(matching, numMatching);
    Arrays.sort(ordered, (a, b) -> Integer.compare(a.index, b.index));
    for (int i = 0; i < ordered.length; i++) {
      postingsSlices[i].postingsEnum = ordered[i].terms.postings();
      postingsSlices[i].slice = ordered[i].slice;
    }
    return new MultiPostingsEnum(cursors.length).reset(postingsSlices, ordered.length);
  }

  @Override
  public String toString() {
    return "MultiTermsEnum(" + Arrays.toString(Arrays.copyOf(live, numLive)) + ")";
  }

  private static final class Cursor {
    final int index;
    final ReaderSlice slice;
    TermsEnum terms;
    BytesRef term;

    Cursor(int index, ReaderSlice slice) {
      this.index = index;
      this.slice = slice;
    }

    @Override
    public String toString() {
      return slice + ":" + terms;
    }
  }

  private static final class CursorQueue extends PriorityQueue<Cursor> {
    private final int[] pending;

    CursorQueue(int size) {
      super(size);
      pending = new int[size];
    }

    @Override
    protected boolean lessThan(Cursor a, Cursor b) {
      return a.term.compareTo(b.term) < 0;
    }

    /** Copies the cursors equal to the top into {@code out}, walking only the heap subtrees that can hold them. */
    int collectTop(Cursor[] out) {
      int size = size();
      if (size == 0) {
        return 0;
      }
      Object[] heap = getHeapArray();
      Cursor first = top();
      out[0] = first;
      int count = 1;
      int todo = 0;
      pending[todo++] = 1;
      while (todo > 0) {
        int node = pending[--todo];
        for (int child = node * 2; child <= Math.min(size, node * 2 + 1); child++) {
          Cursor c = (Cursor) heap[child];
          if (c.term.equals(first.term)) {
            out[count++] = c;
            pending[todo++] = child;
          }
        }
      }
      return count;
    }
  }
}
