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


import java.io.EOFException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.atomic.AtomicInteger;

import org.fathom.codecs.BlockPostingsReader;
import org.fathom.codecs.BlockTermsReader;
import org.fathom.codecs.ColumnsReader;
import org.fathom.codecs.FieldLengths;
import org.fathom.codecs.FieldLengthsFormat;
import org.fathom.codecs.StoredFieldsReader;
import org.fathom.codecs.TermVectorsReader;
import org.fathom.store.AlreadyClosedException;
import org.fathom.store.Directory;
import org.fathom.util.IOUtils;

/** Holds core readers that are shared (unchanged) when
 * SegmentReader is cloned or reopened */
final class SegmentCoreReaders {

  // Counts how many SegmentReaders share the core objects; when it drops
  // to 0 the codec readers are closed. A SegmentReader may be closed even
  // though other SegmentReaders still share its core.
  private final AtomicInteger ref = new AtomicInteger(1);

  final BlockPostingsReader postingsReader;
  final BlockTermsReader fields;
  final StoredFieldsReader fieldsReader;
  final ColumnsReader columnsReader;
  final FieldLengths lengths;
  final TermVectorsReader termVectorsReader;

  final String segment;
  /** The schema the core was opened under. */
  final FieldInfos coreFieldInfos;

  SegmentCoreReaders(Directory dir, SegmentCommitInfo si, FieldInfos fieldInfos) throws IOException {
    segment = si.info.name;
    coreFieldInfos = fieldInfos;
    final SegmentReadState segmentReadState = new SegmentReadState(dir, si.info, fieldInfos);

    BlockPostingsReader postingsReader = null;
    BlockTermsReader fields = null;
    StoredFieldsReader fieldsReader = null;
    ColumnsReader columnsReader = null;
    TermVectorsReader termVectorsReader = null;
    FieldLengths lengths = null;
    boolean success = false;
    try {
      postingsReader = new BlockPostingsReader(segmentReadState);
      fields = new BlockTermsReader(segmentReadState, postingsReader);
      fieldsReader = new StoredFieldsReader(segmentReadState);
      columnsReader = new ColumnsReader(segmentReadState);
      lengths = FieldLengthsFormat.read(segmentReadState);
      // vectors are only written when the schema had vector fields
      if (si.info.files().contains(IndexFileNames.segmentFileName(segment, "", IndexFileNames.VECTORS_EXTENSION))) {
        termVectorsReader = new TermVectorsReader(segmentReadState);
      }
      success = true;
    } catch (EOFException | FileNotFoundException e) {
      throw new CorruptIndexException("Problem reading index from " + dir, dir.toString(), e);
    } catch (NoSuchFileException e) {
      throw new CorruptIndexException("Problem reading index.", e.getFile(), e);
    } finally {
      if (!success) {
        // the terms reader owns the postings reader once opened
        IOUtils.closeWhileHandlingException(termVectorsReader, columnsReader, fieldsReader, fields == null ? postingsReader : fields);
      }
    }
    this.postingsReader = postingsReader;
    this.fields = fields;
    this.fieldsReader = fieldsReader;
    this.columnsReader = columnsReader;
    this.termVectorsReader = termVectorsReader;
    this.lengths = lengths;
  }

  int getRefCount() {
    return ref.get();
  }

  void incRef() {
    int count;
    while ((count = ref.get()) > 0) {
      if (ref.compareAndSet(count, count+1)) {
        return;
      }
    }
    throw new AlreadyClosedException("SegmentCoreReaders is already closed");
  }

  void decRef() throws IOException {
    if (ref.decrementAndGet() == 0) {
      IOUtils.close(termVectorsReader, columnsReader, fieldsReader, fields);
    }
  }

  @Override
  public String toString() {
    return "SegmentCoreReader(" + segment + ")";
  }
}
