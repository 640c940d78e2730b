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
import java.util.Collection;
import java.util.HashSet;

import org.fathom.codecs.LiveDocsFormat;
import org.fathom.util.StringHelper;

/**
 * A segment as one commit sees it: the immutable {@link SegmentInfo} plus
 * the deletions recorded against it. Deletions are written to live-docs
 * files named by a generation that grows with every write.
 *
 * @fathom.experimental
 */
public class SegmentCommitInfo {

  /** The segment. */
  public final SegmentInfo info;

  private int delCount;
  private long delGen;      // -1 until the first live-docs file
  private long nextWriteDelGen;
  private byte[] id;        // changes with every new deletion generation
  private volatile long sizeInBytes = -1;

  /**
   * @param delCount deleted documents recorded in the live-docs file
   * @param delGen generation of that file, or -1 without deletions
   * @param id 16 byte commit id, see {@link StringHelper#randomId()}, or null
   */
  public SegmentCommitInfo(SegmentInfo info, int delCount, long delGen, byte[] id) {
    if (id != null && id.length != StringHelper.ID_LENGTH) {
      throw new IllegalArgumentException("invalid id: " + StringHelper.idToString(id));
    }
    this.info = info;
    this.delCount = delCount;
    this.delGen = delGen;
    this.nextWriteDelGen = delGen == -1 ? 1 : delGen + 1;
    this.id = id;
  }

  /** Makes the generation just written the current one. */
  void advanceDelGen() {
    delGen = nextWriteDelGen++;
    sizeInBytes = -1;
    id = StringHelper.randomId();
  }

  /** Skips a generation whose write failed, so its file name is never reused. */
  void advanceNextWriteDelGen() {
    nextWriteDelGen++;
  }

  public long getDelGen() {
    return delGen;
  }

  /** Generation the next live-docs file is written under. */
  public long getNextDelGen() {
    return nextWriteDelGen;
  }

  /** True once a live-docs file exists for this segment. */
  public boolean hasDeletions() {
    return delGen != -1;
  }

  /** Deleted documents as of the last written live-docs file. */
  public int getDelCount() {
    return delCount;
  }

  void setDelCount(int delCount) {
    if (delCount < 0 || delCount > info.maxDoc()) {
      throw new IllegalArgumentException("invalid delCount=" + delCount + " (maxDoc=" + info.maxDoc() + ")");
    }
    this.delCount = delCount;
  }

  /** Files of the segment and of its current live-docs generation. */
  public Collection<String> files() {
    final Collection<String> files = new HashSet<>(info.files());
    LiveDocsFormat.files(this, files);
    return files;
  }

  /** Total length of {@link #files()}. */
  public long sizeInBytes() throws IOException {
    long size = sizeInBytes;
    if (size == -1) {
      size = 0;
      for (String file : files()) {
        size += info.dir.fileLength(file);
      }
      sizeInBytes = size;
    }
    return size;
  }

  /** A copy of the commit id, or null. */
  public byte[] getId() {
    return id == null ? null : id.clone();
  }

  @Override
  public SegmentCommitInfo clone() {
    final SegmentCommitInfo copy = new SegmentCommitInfo(info, delCount, delGen, getId());
    copy.nextWriteDelGen = nextWriteDelGen;
    return copy;
  }

  /** Describes the segment, counting {@code pendingDelCount} unwritten deletions. */
  public String toString(int pendingDelCount) {
    final StringBuilder sb = new StringBuilder(info.toString(delCount + pendingDelCount));
    if (delGen != -1) {
      sb.append(":delGen=").append(delGen);
    }
    if (id != null) {
      sb.append(" :id=").append(StringHelper.idToString(id));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return toString(0);
  }
}
