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


import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import org.fathom.store.Directory;
import org.fathom.store.TrackingDirectoryWrapper;
import org.fathom.util.StringHelper;

/**
 * The write-once part of a segment's metadata: its name, document count,
 * files and the diagnostics recorded by the writer that produced it.
 * Deletions live in {@link SegmentCommitInfo}.
 *
 * @fathom.experimental
 */
public final class SegmentInfo {

  /** Name shared by every file of the segment, unique in its directory. */
  public final String name;

  /** Directory holding the segment's files. */
  public final Directory dir;

  private final int maxDoc;
  private final byte[] id;
  private final Map<String,String> diagnostics;
  private Set<String> files;

  public SegmentInfo(Directory dir, String name, int maxDoc, Map<String,String> diagnostics, byte[] id) {
    assert dir instanceof TrackingDirectoryWrapper == false;
    if (id.length != StringHelper.ID_LENGTH) {
      throw new IllegalArgumentException("segment id must have " + StringHelper.ID_LENGTH + " bytes: " + StringHelper.idToString(id));
    }
    this.dir = Objects.requireNonNull(dir);
    this.name = Objects.requireNonNull(name);
    this.maxDoc = maxDoc;
    this.diagnostics = Collections.unmodifiableMap(new TreeMap<>(diagnostics));
    this.id = id;
  }

  /** What wrote the segment ({@link IndexWriter#SOURCE}) and on which platform. */
  public Map<String,String> getDiagnostics() {
    return diagnostics;
  }

  /** Documents in the segment, deleted ones included. */
  public int maxDoc() {
    return maxDoc;
  }

  /** Random id written into every file header of the segment. */
  public byte[] getId() {
    return id.clone();
  }

  /** @throws IllegalStateException before {@link #setFiles} */
  public Set<String> files() {
    if (files == null) {
      throw new IllegalStateException("files of segment " + name + " are not known yet");
    }
    return Collections.unmodifiableSet(files);
  }

  public void setFiles(Collection<String> files) {
    Set<String> checked = new HashSet<>();
    for (String file : files) {
      checked.add(checkOwnFile(file));
    }
    this.files = checked;
  }

  public void addFile(String file) {
    files.add(checkOwnFile(file));
  }

  private String checkOwnFile(String file) {
    if (IndexFileNames.CODEC_FILE_PATTERN.matcher(file).matches() == false) {
      throw new IllegalArgumentException("not a segment file name: '" + file + "'");
    }
    if (IndexFileNames.parseSegmentName(file).equals(name) == false) {
      throw new IllegalArgumentException("file '" + file + "' belongs to another segment than " + name);
    }
    return file;
  }

  /** {@code name(fileCount):maxDoc}, followed by {@code /delCount} when documents are deleted. */
  public String toString(int delCount) {
    String s = name + "(" + (files == null ? "?" : Integer.toString(files.size())) + "):" + maxDoc;
    return delCount == 0 ? s : s + "/" + delCount;
  }

  @Override
  public String toString() {
    return toString(0);
  }

  /** Segments are equal when they share directory instance and name. */
  @Override
  public boolean equals(Object obj) {
    if (obj instanceof SegmentInfo == false) {
      return false;
    }
    SegmentInfo other = (SegmentInfo) obj;
    return dir == other.dir && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(dir) + name.hashCode();
  }
}
