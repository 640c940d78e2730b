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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.fathom.codecs.BlockPostingsWriter;
import org.fathom.codecs.BlockTermsWriter;
import org.fathom.codecs.ColumnsWriter;
import org.fathom.codecs.FieldLengths;
import org.fathom.codecs.FieldLengthsFormat;
import org.fathom.codecs.StoredFieldsWriter;
import org.fathom.codecs.TermVectorsWriter;
import org.fathom.store.Directory;
import org.fathom.util.BytesRef;
import org.fathom.util.FixedBitSet;
import org.fathom.util.IOUtils;
import org.fathom.util.InfoStream;

/**
 * Writes one new segment holding the live documents of several source
 * segments, in source order. Used both for merges and for importing
 * segments of another index.
 *
 * @see #merge
 */
final class SegmentMerger {

  private static final String COMPONENT = "SM";
  private static final int DOCS_BETWEEN_ABORT_CHECKS = 1024;

  private final Directory directory;
  private final MergePolicy.OneMerge merge;

  final MergeState mergeState;
  private FieldLengths mergedLengths;

  /** {@code dir} receives the new files; it usually tracks them on top of
   *  the directory of {@code segmentInfo}. {@code imported} is set when the
   *  readers belong to other indexes. */
  SegmentMerger(List<SegmentReader> readers, SegmentInfo segmentInfo, FieldInfos mergeFieldInfos, InfoStream infoStream,
                Directory dir, MergePolicy.OneMerge merge, boolean imported) {
    mergeState = new MergeState(readers, segmentInfo, mergeFieldInfos, infoStream, imported);
    directory = dir;
    this.merge = merge;
    int live = mergeState.mergedDocCount();
    if (live != segmentInfo.maxDoc()) {
      throw new IllegalArgumentException("segment " + segmentInfo.name + " has maxDoc=" + segmentInfo.maxDoc()
          + " but the readers hold " + live + " live documents");
    }
  }

  /** Receives the live documents of one source, with their merged position. */
  private interface LiveDocVisitor {
    void visit(int source, int docID, int mergedDoc) throws IOException;
  }

  private interface Step {
    int run() throws IOException;
  }

  /**
   * Writes stored fields, lengths, postings, columns and, if the schema
   * has any, term vectors of the merged segment.
   *
   * @throws IllegalStateException if no document survives
   */
  MergeState merge() throws IOException {
    int maxDoc = mergeState.segmentInfo.maxDoc();
    if (maxDoc == 0) {
      throw new IllegalStateException("nothing to merge: every document is deleted");
    }
    SegmentWriteState state = new SegmentWriteState(mergeState.infoStream, directory, mergeState.segmentInfo,
                                                    mergeState.mergeFieldInfos);
    int stored = timed("stored fields", () -> mergeStoredFields(state));
    assert stored == maxDoc : stored + " stored documents for maxDoc=" + maxDoc;
    timed("lengths", () -> {
      mergedLengths = mergeLengths();
      FieldLengthsFormat.write(state, mergedLengths);
      return maxDoc;
    });
    timed("postings", () -> {
      mergeTerms(state, mergedLengths);
      return maxDoc;
    });
    timed("columns", () -> {
      mergeColumns(state);
      return maxDoc;
    });
    if (mergeState.mergeFieldInfos.hasVectors()) {
      int vectors = timed("vectors", () -> mergeVectors(state));
      assert vectors == maxDoc;
    }
    return mergeState;
  }

  private int timed(String what, Step step) throws IOException {
    merge.checkAborted();
    InfoStream infoStream = mergeState.infoStream;
    long start = System.nanoTime();
    int docs = step.run();
    if (infoStream.isEnabled(COMPONENT)) {
      infoStream.message(COMPONENT, (System.nanoTime() - start) / 1000000 + " msec to merge " + what + " [" + docs + " docs]");
    }
    return docs;
  }

  /** Calls {@code visitor} for every live document of every source and returns how many there were. */
  private int forEachLiveDoc(LiveDocVisitor visitor) throws IOException {
    int mergedDoc = 0;
    for (int source = 0; source < mergeState.readers.length; source++) {
      for (int docID = 0; docID < mergeState.maxDocs[source]; docID++) {
        if (mergeState.liveDocs[source] == null || mergeState.liveDocs[source].get(docID)) {
          visitor.visit(source, docID, mergedDoc++);
          if (mergedDoc % DOCS_BETWEEN_ABORT_CHECKS == 0) {
            merge.checkAborted();
          }
        }
      }
    }
    return mergedDoc;
  }

  private int mergeStoredFields(SegmentWriteState state) throws IOException {
    try (StoredFieldsWriter writer = new StoredFieldsWriter(state)) {
      StoredFieldsWriter.MergeVisitor copier = writer.new MergeVisitor(mergeState::targetField);
      int count = forEachLiveDoc((source, docID, mergedDoc) -> {
        writer.startDocument();
        mergeState.readers[source].document(docID, copier);
        writer.finishDocument();
      });
      writer.finish(count);
      return count;
    }
  }

  /** Copies the length bytes of the live documents. A field's total loses
   *  what the deleted documents contributed, as far as their quantized
   *  lengths tell. */
  private FieldLengths mergeLengths() {
    int maxDoc = mergeState.segmentInfo.maxDoc();
    Map<Integer,byte[]> encoded = new HashMap<>();
    Map<Integer,Long> totals = new HashMap<>();
    for (FieldInfo target : mergeState.mergeFieldInfos) {
      if (target.hasLengths() == false) {
        continue;
      }
      byte[] merged = new byte[maxDoc];
      long total = 0;
      int next = 0;
      for (int source = 0; source < mergeState.readers.length; source++) {
        FieldLengths lengths = mergeState.readers[source].core.lengths;
        FieldInfo sourceInfo = mergeState.sourceField(source, target);
        if (sourceInfo == null || lengths.hasField(sourceInfo.number) == false) {
          // documents of this source have no length for the field
          next += mergeState.liveDocCount(source);
          continue;
        }
        long deleted = 0;
        for (int docID = 0; docID < mergeState.maxDocs[source]; docID++) {
          int length = lengths.get(sourceInfo.number, docID);
          if (mergeState.liveDocs[source] == null || mergeState.liveDocs[source].get(docID)) {
            merged[next++] = FieldLengths.encode(length);
          } else {
            deleted += length;
          }
        }
        total += Math.max(0L, lengths.total(sourceInfo.number) - deleted);
      }
      assert next == maxDoc;
      encoded.put(target.number, merged);
      totals.put(target.number, total);
    }
    return new FieldLengths(maxDoc, encoded, totals);
  }

  private void mergeTerms(SegmentWriteState state, FieldLengths lengths) throws IOException {
    BlockPostingsWriter postingsWriter = new BlockPostingsWriter(state);
    BlockTermsWriter termsWriter = null;
    try {
      termsWriter = new BlockTermsWriter(state, postingsWriter);
      termsWriter.write(new MappedMultiFields(mergeState), lengths);
    } catch (Throwable t) {
      IOUtils.closeWhileHandlingException(termsWriter == null ? postingsWriter : termsWriter);
      throw t;
    }
    termsWriter.close();
  }

  private void mergeColumns(SegmentWriteState state) throws IOException {
    int maxDoc = mergeState.segmentInfo.maxDoc();
    try (ColumnsWriter writer = new ColumnsWriter(state)) {
      for (FieldInfo target : mergeState.mergeFieldInfos) {
        if (target.getColumnType() == ColumnType.NUMERIC) {
          long[] values = new long[maxDoc];
          FixedBitSet present = new FixedBitSet(maxDoc);
          NumericColumn[] columns = new NumericColumn[mergeState.readers.length];
          for (int source = 0; source < columns.length; source++) {
            columns[source] = mergeState.sourceField(source, target) == null
                ? null : mergeState.readers[source].getNumericColumn(target.name);
          }
          forEachLiveDoc((source, docID, mergedDoc) -> {
            NumericColumn column = columns[source];
            if (column != null && column.exists(docID)) {
              values[mergedDoc] = column.get(docID);
              present.set(mergedDoc);
            }
          });
          writer.addNumericField(target, values, present);
        } else if (target.getColumnType() == ColumnType.BINARY) {
          BytesRef[] values = new BytesRef[maxDoc];
          BinaryColumn[] columns = new BinaryColumn[mergeState.readers.length];
          for (int source = 0; source < columns.length; source++) {
            columns[source] = mergeState.sourceField(source, target) == null
                ? null : mergeState.readers[source].getBinaryColumn(target.name);
          }
          forEachLiveDoc((source, docID, mergedDoc) -> {
            BinaryColumn column = columns[source];
            if (column != null && column.exists(docID)) {
              values[mergedDoc] = BytesRef.deepCopyOf(column.get(docID));
            }
          });
          writer.addBinaryField(target, values);
        }
      }
    }
  }

  private int mergeVectors(SegmentWriteState state) throws IOException {
    try (TermVectorsWriter writer = new TermVectorsWriter(state)) {
      // the merged schema decides which vector fields survive
      int count = forEachLiveDoc((source, docID, mergedDoc) ->
          writer.addAllDocVectors(mergeState.readers[source].getTermVectors(docID), mergeState.mergeFieldInfos));
      writer.finish(count);
      return count;
    }
  }
}
