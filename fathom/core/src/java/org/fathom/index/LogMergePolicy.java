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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Size-tiered merging. Each segment gets a level, the logarithm of its
 * {@link #size} in base {@link #getMergeFactor() mergeFactor}. Starting from
 * the largest segment, every segment within {@link #LEVEL_LOG_SPAN} of the
 * current maximum belongs to one tier; as soon as a tier holds
 * {@code mergeFactor} neighbouring segments they are merged.
 *
 * <p>Segments smaller than {@link #getMinMergeSize()} all share the lowest
 * tier. Segments of {@link #getMaxMergeDocs()} documents or more are never
 * merged. A segment whose deleted share exceeds
 * {@link #setDeletesPctAllowed(double) deletesPctAllowed} is rewritten on its own.</p>
 */
public abstract class LogMergePolicy extends MergePolicy {

  /** Width of one tier, in levels. */
  public static final double LEVEL_LOG_SPAN = 0.75;

  /** Default number of segments merged at once. */
  public static final int DEFAULT_MERGE_FACTOR = 10;

  /** Default document count above which segments stay as they are. */
  public static final int DEFAULT_MAX_MERGE_DOCS = Integer.MAX_VALUE;

  /** Default share of deleted documents, in percent, that triggers a rewrite. */
  public static final double DEFAULT_DELETES_PCT_ALLOWED = 50.0;

  private int mergeFactor = DEFAULT_MERGE_FACTOR;
  private long minMergeSize;
  private int maxMergeDocs = DEFAULT_MAX_MERGE_DOCS;
  private boolean calibrateSizeByDeletes = true;
  private double deletesPctAllowed = DEFAULT_DELETES_PCT_ALLOWED;

  /** Size of a segment in the unit of this policy. */
  protected abstract long size(SegmentCommitInfo info, MergeContext mergeContext) throws IOException;

  /** Number of documents in {@code info}, minus its deletions when
   *  {@link #setCalibrateSizeByDeletes} is on. */
  protected long sizeDocs(SegmentCommitInfo info, MergeContext mergeContext) throws IOException {
    if (calibrateSizeByDeletes) {
      return info.info.maxDoc() - mergeContext.numDeletesToMerge(info);
    }
    return info.info.maxDoc();
  }

  /** Segments merged at once, and the number a tier may hold. */
  public int getMergeFactor() {
    return mergeFactor;
  }

  /** Sets the merge factor; must be at least 2. */
  public LogMergePolicy setMergeFactor(int mergeFactor) {
    if (mergeFactor < 2) {
      throw new IllegalArgumentException("mergeFactor cannot be less than 2, got " + mergeFactor);
    }
    this.mergeFactor = mergeFactor;
    return this;
  }

  /** Sizes below this value count as the lowest tier. */
  public long getMinMergeSize() {
    return minMergeSize;
  }

  /** Sets the size below which all segments share the lowest tier. */
  protected void setMinMergeSize(long minMergeSize) {
    if (minMergeSize < 0) {
      throw new IllegalArgumentException("minMergeSize must be >= 0, got " + minMergeSize);
    }
    this.minMergeSize = minMergeSize;
  }

  /** Segments with at least this many documents are left alone. */
  public int getMaxMergeDocs() {
    return maxMergeDocs;
  }

  /** Sets the document count at which a segment stops being merged. */
  public LogMergePolicy setMaxMergeDocs(int maxMergeDocs) {
    if (maxMergeDocs < 1) {
      throw new IllegalArgumentException("maxMergeDocs must be >= 1, got " + maxMergeDocs);
    }
    this.maxMergeDocs = maxMergeDocs;
    return this;
  }

  /** Whether deleted documents are left out of a segment's size. */
  public boolean getCalibrateSizeByDeletes() {
    return calibrateSizeByDeletes;
  }

  /** Sets whether deleted documents are left out of a segment's size. */
  public LogMergePolicy setCalibrateSizeByDeletes(boolean calibrateSizeByDeletes) {
    this.calibrateSizeByDeletes = calibrateSizeByDeletes;
    return this;
  }

  /** Deleted share, in percent, above which a segment is rewritten alone. */
  public double getDeletesPctAllowed() {
    return deletesPctAllowed;
  }

  /** Sets the deleted share, in percent, above which a segment is rewritten
   *  alone. 100 turns singleton rewrites off. */
  public LogMergePolicy setDeletesPctAllowed(double deletesPctAllowed) {
    if (deletesPctAllowed < 0 || deletesPctAllowed > 100) {
      throw new IllegalArgumentException("deletesPctAllowed must be in [0, 100], got " + deletesPctAllowed);
    }
    this.deletesPctAllowed = deletesPctAllowed;
    return this;
  }

  @Override
  public MergeSpecification findMerges(MergeTrigger mergeTrigger, SegmentInfos infos, MergeContext mergeContext) throws IOException {
    final int numSegments = infos.size();
    final Set<SegmentCommitInfo> taken = new HashSet<>(mergeContext.getMergingSegments());
    final double norm = Math.log(mergeFactor);
    final double[] levels = new double[numSegments];
    final MergeSpecification spec = new MergeSpecification();

    for (int i = 0; i < numSegments; i++) {
      final SegmentCommitInfo info = infos.info(i);
      levels[i] = Math.log(Math.max(1L, size(info, mergeContext))) / norm;
      if (taken.contains(info) || info.info.maxDoc() == 0) {
        continue;
      }
      final int delCount = mergeContext.numDeletesToMerge(info);
      final double pctDeletes = 100.0 * delCount / info.info.maxDoc();
      if (delCount > 0 && pctDeletes > deletesPctAllowed) {
        message("rewrite " + info.info.name + " alone: " + String.format(Locale.ROOT, "%.1f", pctDeletes) + "% deleted", mergeContext);
        spec.add(new OneMerge(Collections.singletonList(info)));
        taken.add(info);
      }
    }

    final double levelFloor = minMergeSize <= 0 ? 0.0 : Math.log(minMergeSize) / norm;
    int start = 0;
    while (start < numSegments) {
      double maxLevel = levels[start];
      for (int i = start + 1; i < numSegments; i++) {
        maxLevel = Math.max(maxLevel, levels[i]);
      }
      // small segments all land in the bottom tier
      final double levelBottom = maxLevel <= levelFloor ? -1.0 : Math.max(maxLevel - LEVEL_LOG_SPAN, levelFloor);
      int upto = numSegments - 1;
      while (upto >= start && levels[upto] < levelBottom) {
        upto--;
      }
      if (verbose(mergeContext)) {
        message("tier " + levelBottom + " to " + maxLevel + ": " + (upto + 1 - start) + " segments", mergeContext);
      }

      for (int end = start + mergeFactor; end <= upto + 1; start = end, end += mergeFactor) {
        final List<SegmentCommitInfo> window = new ArrayList<>(mergeFactor);
        boolean mergeable = true;
        for (int i = start; i < end && mergeable; i++) {
          final SegmentCommitInfo info = infos.info(i);
          mergeable = taken.contains(info) == false && info.info.maxDoc() < maxMergeDocs;
          window.add(info);
        }
        if (mergeable) {
          message("merge segments " + start + " to " + (end - 1), mergeContext);
          spec.add(new OneMerge(window));
        }
      }
      start = upto + 1;
    }

    return spec.merges.isEmpty() ? null : spec;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(mergeFactor=" + mergeFactor + ", minMergeSize=" + minMergeSize
        + ", maxMergeDocs=" + maxMergeDocs + ", calibrateSizeByDeletes=" + calibrateSizeByDeletes
        + ", deletesPctAllowed=" + deletesPctAllowed + ")";
  }
}
