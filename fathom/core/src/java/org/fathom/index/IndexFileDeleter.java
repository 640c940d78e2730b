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
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.fathom.store.Directory;
import org.fathom.util.IOUtils;
import org.fathom.util.InfoStream;

/**
 * Reference counts the index files of the writer's current segments and of
 * the last commit, and deletes a file once neither references it.
 *
 * <p>Two holders take references: the last commit, whose files include its
 * {@code segments_N}, and the most recent checkpoint of the writer's
 * in-memory segments. A successful commit releases the files of the commit
 * before it. Readers already open on an older commit keep their open files.
 *
 * <p>All methods are called with the writer's monitor held.
 */
final class IndexFileDeleter {

  private final Map<String, Integer> refCounts = new HashMap<>();
  private final List<String> checkpointFiles = new ArrayList<>();
  private Collection<String> commitFiles;

  private final Directory directory;
  private final InfoStream infoStream;
  private final IndexWriter writer;

  /**
   * Takes references on the files of {@code lastCommit} (null when the
   * directory holds no commit) and deletes the other index files found in
   * {@code files}. The segment counter of {@code segmentInfos} is moved past
   * every segment name seen on disk.
   */
  IndexFileDeleter(String[] files, Directory directory, SegmentInfos lastCommit, SegmentInfos segmentInfos,
                   InfoStream infoStream, IndexWriter writer) throws IOException {
    this.directory = directory;
    this.infoStream = infoStream;
    this.writer = writer;
    message("init: last commit is " + (lastCommit == null ? "none" : lastCommit.getSegmentsFileName()));

    long maxSegment = -1;
    for (String file : files) {
      if (isIndexFile(file) == false) {
        continue;
      }
      if (file.startsWith("_")) {
        long segment = parseSegment(file);
        if (segment < 0) {
          message("leaving foreign file " + file);
          continue;
        }
        maxSegment = Math.max(maxSegment, segment);
      }
      refCounts.putIfAbsent(file, 0);
    }
    if (maxSegment >= segmentInfos.counter) {
      segmentInfos.counter = maxSegment + 1;
    }

    if (lastCommit != null) {
      commitFiles = lastCommit.files(true);
      incRef(commitFiles);
    }
    deleteFiles(unreferenced(refCounts.keySet()));
  }

  /** Base 36 number of a segment file name, or -1 if the name was not written by a writer. */
  private static long parseSegment(String file) {
    String segment = IndexFileNames.parseSegmentName(file);
    try {
      return Long.parseLong(segment.substring(1), Character.MAX_RADIX);
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  private static boolean isIndexFile(String file) {
    return file.equals(IndexFileNames.WRITE_LOCK_NAME) == false
        && (IndexFileNames.CODEC_FILE_PATTERN.matcher(file).matches()
            || file.startsWith(IndexFileNames.SEGMENTS)
            || file.startsWith(IndexFileNames.PENDING_SEGMENTS));
  }

  /**
   * Records a consistent state of the writer's segments: their files gain a
   * reference and the files of the previous checkpoint lose one. For a
   * commit the new {@code segments_N} is referenced as well and the previous
   * commit's files are released.
   */
  void checkpoint(SegmentInfos segmentInfos, boolean isCommit) throws IOException {
    assert Thread.holdsLock(writer);
    if (isCommit) {
      Collection<String> previous = commitFiles;
      commitFiles = segmentInfos.files(true);
      incRef(commitFiles);
      if (previous != null) {
        decRef(previous);
      }
    } else {
      Collection<String> files = segmentInfos.files(false);
      incRef(files);
      List<String> previous = new ArrayList<>(checkpointFiles);
      checkpointFiles.clear();
      checkpointFiles.addAll(files);
      decRef(previous);
    }
  }

  /** Deletes every index file in the directory that nothing references, such as the leftovers of a cancelled session. */
  void refresh() throws IOException {
    assert Thread.holdsLock(writer);
    List<String> orphans = new ArrayList<>();
    for (String file : directory.listAll()) {
      if (isIndexFile(file) && refCounts.getOrDefault(file, 0) == 0) {
        orphans.add(file);
      }
    }
    refCounts.keySet().removeAll(orphans);
    deleteFiles(orphans);
  }

  /** Deletes those of {@code files} that were never referenced, such as the output of a failed merge. */
  void deleteNewFiles(Collection<String> files) throws IOException {
    assert Thread.holdsLock(writer);
    deleteFiles(unreferenced(files));
  }

  private List<String> unreferenced(Collection<String> files) {
    List<String> result = new ArrayList<>();
    for (String file : files) {
      if (refCounts.getOrDefault(file, 0) == 0) {
        result.add(file);
      }
    }
    refCounts.keySet().removeAll(result);
    return result;
  }

  private void incRef(Collection<String> files) {
    for (String file : files) {
      refCounts.merge(file, 1, Integer::sum);
    }
  }

  /** Releases one reference on each file and deletes those left unreferenced. */
  private void decRef(Collection<String> files) throws IOException {
    List<String> released = new ArrayList<>();
    for (String file : files) {
      Integer count = refCounts.get(file);
      assert count != null && count > 0 : "no reference held on " + file;
      if (count == 1) {
        refCounts.remove(file);
        released.add(file);
      } else {
        refCounts.put(file, count - 1);
      }
    }
    deleteFiles(released);
  }

  /**
   * Deletes {@code files}, the {@code segments_N} files first, so that a crash
   * part way leaves no commit pointing at missing files. Tries every file and
   * rethrows the first failure.
   */
  private void deleteFiles(Collection<String> files) throws IOException {
    if (files.isEmpty()) {
      return;
    }
    message("delete " + new TreeSet<>(files));
    Throwable failure = null;
    for (boolean commitsPass : new boolean[] {true, false}) {
      for (String file : files) {
        if (file.startsWith(IndexFileNames.SEGMENTS) != commitsPass) {
          continue;
        }
        try {
          directory.deleteFile(file);
        } catch (Throwable t) {
          failure = IOUtils.useOrSuppress(failure, t);
        }
      }
    }
    if (failure != null) {
      throw IOUtils.rethrowAlways(failure);
    }
  }

  private void message(String message) {
    if (infoStream.isEnabled("IFD")) {
      infoStream.message("IFD", message);
    }
  }
}
