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
import java.util.ArrayList;
import java.util.List;

import org.fathom.util.BytesRef;

/**
 * Postings of one term across the segments of a merge, renumbered to the
 * merged segment. Documents deleted in their segment are skipped.
 *
 * @fathom.experimental
 */
final class MappingMultiPostingsEnum extends PostingsEnum {

  private static final class Source extends DocIDMerger.Sub {
    PostingsEnum postings;

    Source(MergeState.DocMap docMap) {
      super(docMap);
    }

    @Override
    public int nextDoc() throws IOException {
      return postings.nextDoc();
    }
  }

  private final String field;
  private final Source[] byReader;
  private final List<Source> active = new ArrayList<>();
  private final DocIDMerger<Source> merger;
  private Source current;
  private int doc = -1;

  MappingMultiPostingsEnum(String field, MergeState mergeState) {
    this.field = field;
    byReader = new Source[mergeState.readers.length];
    for (int i = 0; i < byReader.length; i++) {
      byReader[i] = new Source(mergeState.docMaps[i]);
    }
    merger = new DocIDMerger<>(active);
  }

  /** Repositions on the postings of the next term. */
  MappingMultiPostingsEnum reset(MultiPostingsEnum postings) {
    MultiPostingsEnum.EnumWithSlice[] slices = postings.getSubs();
    active.clear();
    for (int i = 0; i < postings.getNumSubs(); i++) {
      Source source = byReader[slices[i].slice.readerIndex];
      source.postings = slices[i].postingsEnum;
      active.add(source);
    }
    merger.reset();
    current = null;
    doc = -1;
    return this;
  }

  @Override
  public int docID() {
    return doc;
  }

  @Override
  public int nextDoc() throws IOException {
    if (doc != NO_MORE_DOCS) {
      current = merger.next();
      doc = current == null ? NO_MORE_DOCS : current.mappedDocID;
    }
    return doc;
  }

  @Override
  public int advance(int target) {
    throw new UnsupportedOperationException("merge postings are read in order");
  }

  @Override
  public float weight() {
    ensureActive();
    return current.postings.weight();
  }

  @Override
  public int[] positions() {
    ensureActive();
    int[] positions = current.postings.positions();
    for (int position : positions) {
      if (position < 0) {
        throw new IllegalStateException("negative position " + position + " in field \"" + field + "\" of merged doc " + doc);
      }
    }
    return positions;
  }

  @Override
  public BytesRef value() {
    ensureActive();
    return current.postings.value();
  }

  @Override
  public long cost() {
    long cost = 0;
    for (Source source : active) {
      cost += source.postings.cost();
    }
    return cost;
  }

  @Override
  public String toString() {
    return "MappingMultiPostingsEnum(" + field + ")";
  }
}
