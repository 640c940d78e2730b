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
import java.util.List;

import static org.fathom.search.DocIdSetIterator.NO_MORE_DOCS;

/**
 * Walks the documents of several sources under their merged ids, skipping
 * deleted ones. Sources must be given in reader order: merged ids of one
 * source all precede those of the next, so the sources are drained one
 * after the other.
 *
 * @fathom.experimental
 */
public final class DocIDMerger<T extends DocIDMerger.Sub> {

  /** One source: its own document iterator and its id mapping. */
  public static abstract class Sub {
    /** Merged id of the current document. */
    public int mappedDocID = -1;

    final MergeState.DocMap docMap;

    public Sub(MergeState.DocMap docMap) {
      this.docMap = docMap;
    }

    /** Next document id in the source's own numbering, or {@code NO_MORE_DOCS}. */
    public abstract int nextDoc() throws IOException;

    /** Advances to the next surviving document; false when the source is exhausted. */
    final boolean advanceLive() throws IOException {
      for (int doc = nextDoc(); doc != NO_MORE_DOCS; doc = nextDoc()) {
        int mapped = docMap.get(doc);
        if (mapped != -1) {
          assert mapped > mappedDocID : "merged ids go backwards: " + mapped + " after " + mappedDocID;
          mappedDocID = mapped;
          return true;
        }
      }
      mappedDocID = NO_MORE_DOCS;
      return false;
    }
  }

  private final List<T> subs;
  private int current;

  public DocIDMerger(List<T> subs) {
    this.subs = subs;
    reset();
  }

  /** Starts over with the current content of the sub list. */
  public void reset() {
    current = 0;
    for (T sub : subs) {
      sub.mappedDocID = -1;
    }
  }

  /** Returns the sub positioned on the next document, or null once all are exhausted. */
  public T next() throws IOException {
    while (current < subs.size()) {
      T sub = subs.get(current);
      if (sub.advanceLive()) {
        return sub;
      }
      current++;
    }
    return null;
  }
}
