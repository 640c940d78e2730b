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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import org.fathom.codecs.CodecUtil;
import org.fathom.codecs.SegmentInfoFormat;
import org.fathom.store.ChecksumIndexInput;
import org.fathom.store.Directory;
import org.fathom.store.IndexOutput;
import org.fathom.util.IOUtils;
import org.fathom.util.StringHelper;

/**
 * The ordered list of segments making up one generation of an index, with
 * the index schema. Each commit is a {@code segments_N} file, N being the
 * generation in base 36; the file with the highest N is the current commit.
 *
 * <p>A commit is first written as {@code pending_segments_N}, synced, then
 * renamed, so a reader never opens a partial file.
 *
 * <p>File layout: {@link CodecUtil#writeIndexHeader IndexHeader} (suffix N),
 * Version (Int64), NameCounter (VLong), Schema ({@link FieldInfos#write}),
 * SegCount (Int32), then per segment SegName (String), SegID (16 bytes),
 * DelGen (Int64) and DelCount (Int32), then {@link CodecUtil#writeFooter Footer}.
 *
 * @fathom.experimental
 */
public final class SegmentInfos implements Cloneable, Iterable<SegmentCommitInfo> {

  static final String CODEC_NAME = "segments";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  /** Number of the next new segment; segment names are "_" plus this number in base 36. */
  public long counter;

  private long version;
  // generation of the next commit to write
  private long generation = -1;
  // generation last read or written successfully
  private long lastGeneration = -1;
  private boolean pendingCommit;
  private byte[] id;
  private FieldInfos fieldInfos = FieldInfos.EMPTY;
  private List<SegmentCommitInfo> segments = new ArrayList<>();

  public SegmentInfos() {
  }

  /** Generation of the newest {@code segments_N} among {@code files}, or -1 if there is none. */
  public static long getLastCommitGeneration(String[] files) {
    long max = -1;
    for (String file : files) {
      if (file.startsWith(IndexFileNames.SEGMENTS)) {
        max = Math.max(max, generationOf(file));
      }
    }
    return max;
  }

  private static long generationOf(String segmentsFile) {
    if (segmentsFile.equals(IndexFileNames.SEGMENTS)) {
      return 0;
    }
    String prefix = IndexFileNames.SEGMENTS + "_";
    if (segmentsFile.startsWith(prefix) == false) {
      throw new IllegalArgumentException(segmentsFile + " is not a segments file");
    }
    return Long.parseLong(segmentsFile.substring(prefix.length()), Character.MAX_RADIX);
  }

  private static String segmentsFileName(String prefix, long generation) {
    return IndexFileNames.fileNameFromGeneration(prefix, "", generation);
  }

  /** Reads the commit stored in {@code segmentsFile}, verifying its checksum. */
  public static SegmentInfos readCommit(Directory directory, String segmentsFile) throws IOException {
    long generation = generationOf(segmentsFile);
    try (ChecksumIndexInput in = directory.openChecksumInput(segmentsFile)) {
      SegmentInfos infos = null;
      Throwable failure = null;
      try {
        CodecUtil.checkHeader(in, CODEC_NAME, VERSION_START, VERSION_CURRENT);
        byte[] id = new byte[StringHelper.ID_LENGTH];
        in.readBytes(id, 0, id.length);
        CodecUtil.checkIndexHeaderSuffix(in, Long.toString(generation, Character.MAX_RADIX));
        infos = new SegmentInfos();
        infos.id = id;
        infos.generation = generation;
        infos.lastGeneration = generation;
        infos.readBody(directory, in);
      } catch (Throwable t) {
        failure = t;
      } finally {
        // reports a checksum mismatch in preference to the failure it likely caused
        CodecUtil.checkFooter(in, failure);
      }
      return infos;
    }
  }

  private void readBody(Directory directory, ChecksumIndexInput in) throws IOException {
    version = in.readLong();
    counter = in.readVLong();
    fieldInfos = FieldInfos.read(in);
    int count = in.readInt();
    if (count < 0) {
      throw new CorruptIndexException("negative segment count " + count, in);
    }
    for (int i = 0; i < count; i++) {
      String name = in.readString();
      byte[] segmentId = new byte[StringHelper.ID_LENGTH];
      in.readBytes(segmentId, 0, segmentId.length);
      SegmentInfo info = SegmentInfoFormat.read(directory, name, segmentId);
      long delGen = in.readLong();
      int delCount = in.readInt();
      if (delCount < 0 || delCount > info.maxDoc()) {
        throw new CorruptIndexException("segment " + name + " has " + delCount + " deletions but maxDoc=" + info.maxDoc(), in);
      }
      add(new SegmentCommitInfo(info, delCount, delGen, StringHelper.randomId()));
    }
  }

  /** Reads the newest commit in {@code directory}. */
  public static SegmentInfos readLatestCommit(final Directory directory) throws IOException {
    return new FindSegmentsFile<SegmentInfos>(directory) {
      @Override
      protected SegmentInfos doBody(String segmentsFile) throws IOException {
        return readCommit(directory, segmentsFile);
      }
    }.run();
  }

  /**
   * Runs an action against the newest commit of a directory. A concurrent
   * writer may delete that commit while it is being read; the action is then
   * retried on the newer commit. Failing twice on the same generation is
   * treated as a real error and the first failure is thrown.
   */
  public abstract static class FindSegmentsFile<T> {

    final Directory directory;

    public FindSegmentsFile(Directory directory) {
      this.directory = directory;
    }

    public T run() throws IOException {
      IOException firstFailure = null;
      long triedGeneration = -1;
      while (true) {
        String[] files = directory.listAll();
        if (Arrays.equals(files, directory.listAll()) == false) {
          // listing raced with a writer
          continue;
        }
        long generation = getLastCommitGeneration(files);
        if (generation == -1) {
          throw new IndexNotFoundException("no segments* file found in " + directory + ": files: " + Arrays.toString(files));
        }
        if (generation <= triedGeneration) {
          throw firstFailure;
        }
        triedGeneration = generation;
        try {
          return doBody(segmentsFileName(IndexFileNames.SEGMENTS, generation));
        } catch (IOException e) {
          if (firstFailure == null) {
            firstFailure = e;
          }
        }
      }
    }

    /** Works on the given {@code segments_N}; an IOException asks for a retry on a newer commit. */
    protected abstract T doBody(String segmentsFile) throws IOException;
  }

  /** Writes and syncs {@code pending_segments_N}; {@link #finishCommit} publishes it. */
  void prepareCommit(Directory dir) throws IOException {
    if (pendingCommit) {
      throw new IllegalStateException("prepareCommit was already called");
    }
    dir.syncMetaData();
    long nextGeneration = generation == -1 ? 1 : generation + 1;
    String pendingFile = segmentsFileName(IndexFileNames.PENDING_SEGMENTS, nextGeneration);
    generation = nextGeneration;
    IndexOutput out = null;
    boolean success = false;
    try {
      out = dir.createOutput(pendingFile);
      id = StringHelper.randomId();
      CodecUtil.writeIndexHeader(out, CODEC_NAME, VERSION_CURRENT, id, Long.toString(nextGeneration, Character.MAX_RADIX));
      out.writeLong(version);
      out.writeVLong(counter);
      fieldInfos.write(out);
      out.writeInt(segments.size());
      for (SegmentCommitInfo info : segments) {
        int delCount = info.getDelCount();
        if (delCount < 0 || delCount > info.info.maxDoc()) {
          throw new IllegalStateException("segment " + info.info.name + " has " + delCount
              + " deletions but maxDoc=" + info.info.maxDoc());
        }
        out.writeString(info.info.name);
        byte[] segmentId = info.info.getId();
        out.writeBytes(segmentId, segmentId.length);
        out.writeLong(info.getDelGen());
        out.writeInt(delCount);
      }
      CodecUtil.writeFooter(out);
      out.close();
      dir.sync(Collections.singleton(pendingFile));
      success = true;
    } finally {
      if (success) {
        pendingCommit = true;
      } else {
        IOUtils.closeWhileHandlingException(out);
        IOUtils.deleteFilesIgnoringExceptions(dir, pendingFile);
      }
    }
  }

  /** Renames the pending file to {@code segments_N} and returns that name. */
  String finishCommit(Directory dir) throws IOException {
    if (pendingCommit == false) {
      throw new IllegalStateException("prepareCommit was not called");
    }
    String pendingFile = segmentsFileName(IndexFileNames.PENDING_SEGMENTS, generation);
    String segmentsFile = segmentsFileName(IndexFileNames.SEGMENTS, generation);
    pendingCommit = false;
    boolean success = false;
    try {
      dir.rename(pendingFile, segmentsFile);
      dir.syncMetaData();
      success = true;
    } finally {
      if (success) {
        lastGeneration = generation;
      } else {
        IOUtils.deleteFilesIgnoringExceptions(dir, pendingFile);
      }
    }
    return segmentsFile;
  }

  /** Copies generation, version and name counter from {@code other}. */
  void updateGenerationVersionAndCounter(SegmentInfos other) {
    generation = other.generation;
    lastGeneration = other.lastGeneration;
    version = other.version;
    counter = other.counter;
  }

  String newSegmentName() {
    return "_" + Long.toString(counter++, Character.MAX_RADIX);
  }

  /** Advances the version; call once per change to the segments. */
  public void changed() {
    version++;
  }

  public long getVersion() {
    return version;
  }

  /** Generation of the last commit written or of the next one being written. */
  public long getGeneration() {
    return generation;
  }

  /** The {@code segments_N} last read or written, or null before the first commit. */
  public String getSegmentsFileName() {
    return segmentsFileName(IndexFileNames.SEGMENTS, lastGeneration);
  }

  /** Random id written with the last commit, or null. */
  public byte[] getId() {
    return id == null ? null : id.clone();
  }

  public FieldInfos getFieldInfos() {
    return fieldInfos;
  }

  public void setFieldInfos(FieldInfos fieldInfos) {
    this.fieldInfos = fieldInfos;
  }

  /** The files of all segments, plus the {@code segments_N} file if asked and one exists. */
  public Collection<String> files(boolean includeSegmentsFile) throws IOException {
    Set<String> files = new HashSet<>();
    String segmentsFile = getSegmentsFileName();
    if (includeSegmentsFile && segmentsFile != null) {
      files.add(segmentsFile);
    }
    for (SegmentCommitInfo info : segments) {
      files.addAll(info.files());
    }
    return files;
  }

  /** Sum of the segments' maxDoc, deleted documents included. */
  public int totalMaxDoc() {
    long total = 0;
    for (SegmentCommitInfo info : segments) {
      total += info.info.maxDoc();
    }
    return Math.toIntExact(total);
  }

  /**
   * Swaps the merged segments for the merge result, which takes the place
   * of the first merged segment, or drops them all if {@code dropSegment}.
   */
  void applyMergeChanges(MergePolicy.OneMerge merge, boolean dropSegment) {
    Set<SegmentCommitInfo> merged = new HashSet<>(merge.segments);
    List<SegmentCommitInfo> result = new ArrayList<>(segments.size());
    boolean placed = dropSegment;
    for (SegmentCommitInfo info : segments) {
      if (merged.contains(info) == false) {
        result.add(info);
      } else if (placed == false) {
        result.add(merge.info);
        placed = true;
      }
    }
    if (placed == false) {
      result.add(0, merge.info);
    }
    segments = result;
  }

  /** Deep copy of the segment list, to restore with {@link #rollbackSegmentInfos}. */
  List<SegmentCommitInfo> createBackupSegmentInfos() {
    List<SegmentCommitInfo> copy = new ArrayList<>(segments.size());
    for (SegmentCommitInfo info : segments) {
      copy.add(info.clone());
    }
    return copy;
  }

  void rollbackSegmentInfos(List<SegmentCommitInfo> backup) {
    segments.clear();
    for (SegmentCommitInfo info : backup) {
      add(info);
    }
  }

  /** Copy with cloned segments. */
  @Override
  public SegmentInfos clone() {
    try {
      SegmentInfos copy = (SegmentInfos) super.clone();
      copy.segments = createBackupSegmentInfos();
      return copy;
    } catch (CloneNotSupportedException e) {
      throw new AssertionError(e);
    }
  }

  public SegmentCommitInfo info(int i) {
    return segments.get(i);
  }

  public int size() {
    return segments.size();
  }

  /** Read-only view of the segments, in order. */
  public List<SegmentCommitInfo> asList() {
    return Collections.unmodifiableList(segments);
  }

  @Override
  public Iterator<SegmentCommitInfo> iterator() {
    return asList().iterator();
  }

  /** Appends a segment, which must not be present yet. */
  public void add(SegmentCommitInfo info) {
    if (segments.contains(info)) {
      throw new IllegalStateException("segment " + info.info.name + " is already present");
    }
    segments.add(info);
  }

  public boolean remove(SegmentCommitInfo info) {
    return segments.remove(info);
  }

  boolean contains(SegmentCommitInfo info) {
    return segments.contains(info);
  }

  public void clear() {
    segments.clear();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder().append(getSegmentsFileName()).append(':');
    for (SegmentCommitInfo info : segments) {
      sb.append(' ').append(info.toString(0));
    }
    return sb.toString();
  }
}
