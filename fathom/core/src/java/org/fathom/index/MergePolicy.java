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
import java.util.Set;

import org.fathom.util.InfoStream;

/**
 * Chooses which segments {@link IndexWriter} folds together.
 *
 * <p>After each flush or commit the writer asks {@link #findMerges} for
 * work. A policy returns {@code null} when the index is fine as it is,
 * otherwise a {@link MergeSpecification} listing one or more disjoint
 * {@link OneMerge}s. Several merges may run at once under
 * {@link ConcurrentMergeScheduler}.</p>
 *
 * <p>A policy is never asked to optimize: a full merge into one segment
 * is planned by the writer itself. The merged segment replaces the first
 * of its inputs, so merging only neighbouring segments keeps documents
 * in insertion order.</p>
 *
 * @fathom.experimental
 */
public abstract class MergePolicy {

  /** One merge: a run of segments that become a single new segment.
   *
   * @fathom.experimental */
  public static class OneMerge {
    SegmentCommitInfo info;         // the segment being written
    boolean registerDone;           // set while the writer owns this merge
    int maxNumSegments = -1;        // 1 when optimizing
    FieldInfos mergeFieldInfos;     // schema of the merged segment
    List<SegmentReader> readers;    // one per input, carrying its deletions

    /** The input segments, in index order. */
    public final List<SegmentCommitInfo> segments;

    private Throwable error;
    private volatile boolean aborted;

    /** Creates a merge of the given segments, which must not be empty. */
    public OneMerge(List<SegmentCommitInfo> segments) {
      if (segments.isEmpty()) {
        throw new IllegalArgumentException("a merge needs at least one segment");
      }
      this.segments = new ArrayList<>(segments);
    }

    void setMergeInfo(SegmentCommitInfo info) {
      this.info = info;
    }

    synchronized void setException(Throwable error) {
      this.error = error;
    }

    synchronized Throwable getException() {
      return error;
    }

    /** Number of documents in the inputs, deleted ones included. */
    public int totalMaxDoc() {
      int total = 0;
      for (SegmentCommitInfo input : segments) {
        total += input.info.maxDoc();
      }
      return total;
    }

    /** True once the writer has been cancelled under this merge. */
    public boolean isAborted() {
      return aborted;
    }

    /** Asks the merge to stop at its next checkpoint. */
    public void setAborted() {
      aborted = true;
    }

    /** Throws {@link MergeAbortedException} if {@link #setAborted} was called. */
    public void checkAborted() throws MergeAbortedException {
      if (aborted) {
        throw new MergeAbortedException("merge is aborted: " + segString());
      }
    }

    /** Short description for logging. */
    public String segString() {
      final StringBuilder b = new StringBuilder();
      for (SegmentCommitInfo input : segments) {
        if (b.length() > 0) {
          b.append(' ');
        }
        b.append(input);
      }
      if (info != null) {
        b.append(" into ").append(info.info.name);
      }
      if (maxNumSegments != -1) {
        b.append(" [maxNumSegments=").append(maxNumSegments).append(']');
      }
      if (aborted) {
        b.append(" [ABORTED]");
      }
      return b.toString();
    }
  }

  /** The merges a policy asks for in one call. */
  public static class MergeSpecification {

    /** Merges to run; no segment appears in two of them. */
    public final List<OneMerge> merges = new ArrayList<>();

    /** Adds one merge. */
    public void add(OneMerge merge) {
      merges.add(merge);
    }

    /** Short description for logging. */
    public String segString() {
      final StringBuilder b = new StringBuilder("MergeSpec:");
      for (int i = 0; i < merges.size(); i++) {
        b.append("\n  ").append(i + 1).append(": ").append(merges.get(i).segString());
      }
      return b.toString();
    }
  }

  /** Thrown inside a merge when the writer was cancelled. The writer
   *  logs it and discards the partial segment. */
  public static class MergeAbortedException extends IOException {
    /** Creates the exception with a default message. */
    public MergeAbortedException() {
      super("merge is aborted");
    }

    /** Creates the exception with the given message. */
    public MergeAbortedException(String message) {
      super(message);
    }
  }

  /**
   * Returns the merges that should run now, or {@code null}. Called with the
   * writer's monitor held.
   * @param mergeTrigger what happened to the index
   * @param segmentInfos the live segments
   * @param mergeContext deletions and in-flight merges as the writer sees them
   */
  public abstract MergeSpecification findMerges(MergeTrigger mergeTrigger, SegmentInfos segmentInfos, MergeContext mergeContext)
      throws IOException;

  /** Logs to the {@code MP} component when it is enabled. */
  protected final void message(String message, MergeContext mergeContext) {
    if (verbose(mergeContext)) {
      mergeContext.getInfoStream().message("MP", message);
    }
  }

  /** True when the {@code MP} component of the info stream is enabled. */
  protected final boolean verbose(MergeContext mergeContext) {
    return mergeContext.getInfoStream().isEnabled("MP");
  }

  /**
   * What the writer exposes to a policy while it picks merges.
   * @fathom.experimental
   */
  public interface MergeContext {

    /** Deleted documents a merge of {@code info} would drop. */
    int numDeletesToMerge(SegmentCommitInfo info) throws IOException;

    /** Deleted documents in {@code info}, pending ones included. */
    int numDeletedDocs(SegmentCommitInfo info);

    /** Where the policy logs. */
    InfoStream getInfoStream();

    /** Segments already claimed by a registered merge. */
    Set<SegmentCommitInfo> getMergingSegments();
  }
}
