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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.fathom.store.Directory;
import org.fathom.util.IOUtils;

/**
 * An {@link IndexReader} over one commit of an index stored in a
 * {@link Directory}: one {@link SegmentReader} per segment, in commit order.
 *
 * <p>Open one with {@link #open(Directory)}. The reader never sees later
 * commits; {@link #openIfChanged(DirectoryReader)} returns a reader on the
 * latest commit that shares the unchanged segments with this one.
 *
 * <p>Doc IDs run over the segments one after the other and are only stable
 * for the lifetime of the reader, since merges renumber documents.
 * Readers are safe for concurrent use.
 */
public final class DirectoryReader extends IndexReader {

  private final Directory directory;
  private final SegmentInfos segmentInfos;
  private final SegmentReader[] segments;
  private final List<LeafReaderContext> leaves;
  private final int maxDoc;
  private final int numDocs;

  DirectoryReader(Directory directory, SegmentReader[] segments, SegmentInfos segmentInfos) throws IOException {
    this.directory = directory;
    this.segments = segments;
    this.segmentInfos = segmentInfos;
    List<LeafReaderContext> leaves = new ArrayList<>(segments.length);
    long docBase = 0;
    long live = 0;
    for (int ord = 0; ord < segments.length; ord++) {
      leaves.add(new LeafReaderContext(segments[ord], ord, (int) docBase));
      docBase += segments[ord].maxDoc();
      live += segments[ord].numDocs();
    }
    if (docBase > IndexWriter.MAX_DOCS) {
      throw new CorruptIndexException("index holds " + docBase + " documents, more than the limit of "
          + IndexWriter.MAX_DOCS, segmentInfos.getSegmentsFileName());
    }
    this.maxDoc = (int) docBase;
    this.numDocs = (int) live;
    this.leaves = Collections.unmodifiableList(leaves);
  }

  /**
   * Opens the latest commit in {@code directory}.
   *
   * @throws IndexNotFoundException if the directory holds no commit
   */
  public static DirectoryReader open(final Directory directory) throws IOException {
    return new SegmentInfos.FindSegmentsFile<DirectoryReader>(directory) {
      @Override
      protected DirectoryReader doBody(String segmentsFile) throws IOException {
        return open(directory, SegmentInfos.readCommit(directory, segmentsFile), Collections.<SegmentReader>emptyList());
      }
    }.run();
  }

  /**
   * Returns a reader on the latest commit, or null if {@code oldReader}
   * already reads it. Segments present in both commits are shared, not
   * reopened. The old reader stays open and the caller closes both.
   */
  public static DirectoryReader openIfChanged(final DirectoryReader oldReader) throws IOException {
    oldReader.ensureOpen();
    if (oldReader.isCurrent()) {
      return null;
    }
    return new SegmentInfos.FindSegmentsFile<DirectoryReader>(oldReader.directory) {
      @Override
      protected DirectoryReader doBody(String segmentsFile) throws IOException {
        SegmentInfos latest = SegmentInfos.readCommit(oldReader.directory, segmentsFile);
        if (latest.getVersion() == oldReader.getVersion()) {
          return null;
        }
        // segment readers decode fields by number, so a changed schema forbids sharing
        boolean sameSchema = oldReader.segmentInfos.getFieldInfos().sameFields(latest.getFieldInfos());
        List<SegmentReader> reusable = sameSchema
            ? Arrays.asList(oldReader.segments)
            : Collections.<SegmentReader>emptyList();
        return open(oldReader.directory, latest, reusable);
      }
    }.run();
  }

  /** Opens {@code infos}, taking a reference on any reader of {@code reusable} whose segment is unchanged. */
  static DirectoryReader open(Directory directory, SegmentInfos infos, List<SegmentReader> reusable) throws IOException {
    Map<String, SegmentReader> byName = new HashMap<>();
    for (SegmentReader reader : reusable) {
      byName.put(reader.getSegmentName(), reader);
    }
    SegmentReader[] readers = new SegmentReader[infos.size()];
    try {
      for (int i = 0; i < readers.length; i++) {
        readers[i] = openSegment(infos.info(i), infos.getFieldInfos(), byName.get(infos.info(i).info.name));
      }
    } catch (Throwable t) {
      for (SegmentReader reader : readers) {
        if (reader != null) {
          try {
            reader.decRef();
          } catch (Throwable suppressed) {
            t.addSuppressed(suppressed);
          }
        }
      }
      throw t;
    }
    return new DirectoryReader(directory, readers, infos);
  }

  private static SegmentReader openSegment(SegmentCommitInfo info, FieldInfos fieldInfos, SegmentReader previous)
      throws IOException {
    if (previous == null) {
      return new SegmentReader(info, fieldInfos);
    }
    if (Arrays.equals(info.info.getId(), previous.getSegmentInfo().info.getId()) == false) {
      // the files were replaced behind the reader's back
      throw new IllegalStateException("segment " + info.info.name + " was rewritten outside of IndexWriter;"
          + " recreate the index with OpenMode.CREATE instead of replacing its files");
    }
    if (previous.getSegmentInfo().getDelGen() == info.getDelGen()) {
      previous.incRef();
      return previous;
    }
    return SegmentReader.withDeletions(info, previous);
  }

  /** The directory holding the index. Usable after close. */
  public Directory directory() {
    return directory;
  }

  /** Version of the commit this reader opened; every change made by a writer advances it. */
  public long getVersion() {
    ensureOpen();
    return segmentInfos.getVersion();
  }

  /** Generation of the commit this reader opened, the N of its {@code segments_N}. */
  public long getGeneration() {
    ensureOpen();
    return segmentInfos.getGeneration();
  }

  /** True if no commit was made to the directory since this reader's commit. */
  public boolean isCurrent() throws IOException {
    ensureOpen();
    return SegmentInfos.readLatestCommit(directory).getVersion() == segmentInfos.getVersion();
  }

  /** @fathom.internal */
  public SegmentInfos getSegmentInfos() {
    return segmentInfos;
  }

  @Override
  public FieldInfos getFieldInfos() {
    ensureOpen();
    return segmentInfos.getFieldInfos();
  }

  @Override
  public List<LeafReaderContext> leaves() {
    ensureOpen();
    return leaves;
  }

  @Override
  public int numDocs() {
    return numDocs;
  }

  @Override
  public int maxDoc() {
    return maxDoc;
  }

  @Override
  public Terms terms(String field) throws IOException {
    ensureOpen();
    return MultiTerms.getTerms(this, field);
  }

  @Override
  public void document(int docID, StoredFieldVisitor visitor) throws IOException {
    ensureOpen();
    checkDocID(docID);
    LeafReaderContext leaf = leafFor(docID);
    leaf.reader().document(docID - leaf.docBase, visitor);
  }

  @Override
  public Fields getTermVectors(int docID) throws IOException {
    ensureOpen();
    checkDocID(docID);
    LeafReaderContext leaf = leafFor(docID);
    return leaf.reader().getTermVectors(docID - leaf.docBase);
  }

  private LeafReaderContext leafFor(int docID) {
    return leaves.get(ReaderUtil.subIndex(docID, leaves));
  }

  @Override
  protected void doClose() throws IOException {
    Throwable failure = null;
    for (SegmentReader reader : segments) {
      try {
        reader.decRef();
      } catch (Throwable t) {
        failure = IOUtils.useOrSuppress(failure, t);
      }
    }
    if (failure != null) {
      throw IOUtils.rethrowAlways(failure);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("DirectoryReader(");
    if (segmentInfos.getSegmentsFileName() != null) {
      sb.append(segmentInfos.getSegmentsFileName()).append(':').append(segmentInfos.getVersion());
    }
    for (SegmentReader reader : segments) {
      sb.append(' ').append(reader);
    }
    return sb.append(')').toString();
  }
}
