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
import java.util.Iterator;
import java.util.List;

import org.fathom.util.BytesRef;

/**
 * The inverted index a merge writes: for each indexed field of the merged
 * schema, the union of the source terms with postings renumbered by
 * {@link MergeState#docMaps}. Only term iteration and postings are
 * available; term statistics depend on which postings survive and are
 * recomputed by the terms writer.
 *
 * @fathom.experimental
 */
final class MappedMultiFields extends Fields {

  private final MergeState mergeState;
  private final List<String> fields = new ArrayList<>();

  MappedMultiFields(MergeState mergeState) throws IOException {
    this.mergeState = mergeState;
    for (FieldInfo info : mergeState.mergeFieldInfos) {
      if (info.isIndexed() && union(info) != null) {
        fields.add(info.name);
      }
    }
  }

  /** Union of the terms of {@code target} over the sources still carrying the field, or null if none does. */
  private MultiTerms union(FieldInfo target) throws IOException {
    List<Terms> subs = new ArrayList<>();
    List<ReaderSlice> slices = new ArrayList<>();
    int docBase = 0;
    for (int i = 0; i < mergeState.readers.length; i++) {
      SegmentReader reader = mergeState.readers[i];
      Terms terms = mergeState.sourceField(i, target) == null ? null : reader.terms(target.name);
      if (terms != null) {
        subs.add(terms);
        slices.add(new ReaderSlice(docBase, reader.maxDoc(), i));
      }
      docBase += reader.maxDoc();
    }
    return subs.isEmpty() ? null : new MultiTerms(subs.toArray(Terms.EMPTY_ARRAY), slices.toArray(ReaderSlice.EMPTY_ARRAY));
  }

  @Override
  public Iterator<String> iterator() {
    return fields.iterator();
  }

  @Override
  public int size() {
    return fields.size();
  }

  @Override
  public Terms terms(String field) throws IOException {
    return fields.contains(field) ? new MergedTerms(field, union(mergeState.mergeFieldInfos.fieldInfo(field))) : null;
  }

  private final class MergedTerms extends Terms {
    private final String field;
    private final MultiTerms union;

    MergedTerms(String field, MultiTerms union) {
      this.field = field;
      this.union = union;
    }

    @Override
    public TermsEnum iterator() throws IOException {
      TermsEnum terms = union.iterator();
      return terms == TermsEnum.EMPTY ? terms : new MergedTermsEnum(field, (MultiTermsEnum) terms);
    }

    @Override
    public long size() {
      throw new UnsupportedOperationException("not known before the merge");
    }

    @Override
    public double getSumTotalWeight() {
      throw new UnsupportedOperationException("not known before the merge");
    }

    @Override
    public long getSumDocFreq() {
      throw new UnsupportedOperationException("not known before the merge");
    }

    @Override
    public int getDocCount() {
      throw new UnsupportedOperationException("not known before the merge");
    }

    @Override
    public boolean hasFreqs() {
      return union.hasFreqs();
    }

    @Override
    public boolean hasPositions() {
      return union.hasPositions();
    }

    @Override
    public boolean hasValues() {
      return union.hasValues();
    }
  }

  private final class MergedTermsEnum extends TermsEnum {
    private final String field;
    private final MultiTermsEnum union;

    MergedTermsEnum(String field, MultiTermsEnum union) {
      this.field = field;
      this.union = union;
    }

    @Override
    public BytesRef next() throws IOException {
      return union.next();
    }

    @Override
    public SeekStatus seekCeil(BytesRef text) throws IOException {
      return union.seekCeil(text);
    }

    @Override
    public BytesRef term() throws IOException {
      return union.term();
    }

    @Override
    public TermInfo termInfo() {
      throw new UnsupportedOperationException("statistics are recomputed from the surviving postings");
    }

    @Override
    public int docFreq() {
      throw new UnsupportedOperationException("statistics are recomputed from the surviving postings");
    }

    @Override
    public float totalWeight() {
      throw new UnsupportedOperationException("statistics are recomputed from the surviving postings");
    }

    @Override
    public PostingsEnum postings() throws IOException {
      return new MappingMultiPostingsEnum(field, mergeState).reset((MultiPostingsEnum) union.postings());
    }
  }
}
