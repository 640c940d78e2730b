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


import java.util.List;

import org.fathom.util.Bits;
import org.fathom.util.InfoStream;

/**
 * What a {@link SegmentMerger} works from: the source readers with the
 * deletions they had when the merge started, and where each surviving
 * document lands in the merged segment. Sources are laid out one after
 * the other in reader order, so the mapped ids of reader {@code i} all
 * precede those of reader {@code i + 1}.
 *
 * <p>Sources normally belong to the merging index and share its field
 * numbers. Segments imported from another index are matched to the merged
 * schema by field name instead.
 *
 * @fathom.experimental
 */
public class MergeState {

  /** Old-to-new document id mapping of each source; deleted documents map to -1. */
  public final DocMap[] docMaps;

  public final SegmentInfo segmentInfo;

  /** Schema of the merged segment. */
  public final FieldInfos mergeFieldInfos;

  public final SegmentReader[] readers;

  public final int[] maxDocs;

  /** Deletions of each source frozen at merge start; null entries have none. */
  public final Bits[] liveDocs;

  public final InfoStream infoStream;

  // sources come from other indexes with their own field numbering
  private final boolean imported;

  MergeState(List<SegmentReader> readers, SegmentInfo segmentInfo, FieldInfos mergeFieldInfos, InfoStream infoStream,
             boolean imported) {
    this.imported = imported;
    this.readers = readers.toArray(new SegmentReader[0]);
    this.segmentInfo = segmentInfo;
    this.mergeFieldInfos = mergeFieldInfos;
    this.infoStream = infoStream;
    int n = this.readers.length;
    maxDocs = new int[n];
    liveDocs = new Bits[n];
    docMaps = new DocMap[n];
    int nextBase = 0;
    for (int i = 0; i < n; i++) {
      maxDocs[i] = this.readers[i].maxDoc();
      liveDocs[i] = this.readers[i].getLiveDocs();
      docMaps[i] = docMap(nextBase, maxDocs[i], liveDocs[i]);
      nextBase += liveCount(maxDocs[i], liveDocs[i]);
    }
  }

  private static DocMap docMap(int base, int maxDoc, Bits live) {
    if (live == null) {
      return doc -> base + doc;
    }
    int[] compacted = compact(maxDoc, live);
    return doc -> compacted[doc] == -1 ? -1 : base + compacted[doc];
  }

  private static int liveCount(int maxDoc, Bits live) {
    if (live == null) {
      return maxDoc;
    }
    int count = 0;
    for (int doc = 0; doc < maxDoc; doc++) {
      if (live.get(doc)) {
        count++;
      }
    }
    return count;
  }

  /** Numbers the live documents of a segment 0, 1, 2...; deleted ones get -1. */
  static int[] compact(int maxDoc, Bits live) {
    int[] map = new int[maxDoc];
    int next = 0;
    for (int doc = 0; doc < maxDoc; doc++) {
      map[doc] = live.get(doc) ? next++ : -1;
    }
    return map;
  }

  /** Documents of reader {@code source} that survive the merge. */
  int liveDocCount(int source) {
    return liveCount(maxDocs[source], liveDocs[source]);
  }

  /** Documents the merged segment will hold. */
  int mergedDocCount() {
    int count = 0;
    for (int i = 0; i < readers.length; i++) {
      count += liveDocCount(i);
    }
    return count;
  }

  /** Returns the field of reader {@code i} that holds the data of {@code target},
   *  or null if that segment has none. Within one index a field name that
   *  was removed and added again maps to a new field number and does not match. */
  FieldInfo sourceField(int i, FieldInfo target) {
    FieldInfo source = readers[i].getFieldInfos().fieldInfo(target.name);
    if (source == null || imported) {
      return source;
    }
    return source.number == target.number ? source : null;
  }

  /** Returns the field of the merged schema receiving the data of a source field, or null if it is dropped. */
  public FieldInfo targetField(FieldInfo source) {
    return imported ? mergeFieldInfos.fieldInfo(source.name) : mergeFieldInfos.fieldInfo(source.number);
  }

  /** Maps a source document id to its merged id, or -1 if it was deleted. */
  @FunctionalInterface
  public interface DocMap {
    int get(int docID);
  }
}
