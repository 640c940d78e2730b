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


import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.fathom.index.IndexingChain.PerField;
import org.fathom.index.IndexingChain.PostingsList;
import org.fathom.util.BytesRef;
import org.fathom.util.FixedBitSet;

/** Implements limited (iterators only) {@link
 *  Fields} interface over the in-RAM buffered
 *  fields/terms/postings, to flush postings through the
 *  {@link org.fathom.codecs.BlockTermsWriter}. Deleted buffered documents
 *  are kept: they are dropped through the segment's live docs. */
final class BufferedFields extends Fields {
  private final Map<String,PerField> fields = new LinkedHashMap<>();

  /** Exposes the indexed fields of {@code schema} that have buffered terms, in schema order. */
  BufferedFields(FieldInfos schema, Map<Integer,PerField> perFields) {
    for (FieldInfo fi : schema) {
      final PerField perField = perFields.get(fi.number);
      if (fi.isIndexed() && perField != null && perField.terms.isEmpty() == false) {
        fields.put(fi.name, perField);
      }
    }
  }

  @Override
  public Iterator<String> iterator() {
    return fields.keySet().iterator();
  }

  @Override
  public Terms terms(String field) {
    final PerField perField = fields.get(field);
    return perField == null ? null : new BufferedTerms(perField);
  }

  @Override
  public int size() {
    return fields.size();
  }

  private static final class BufferedTerms extends Terms {
    final PerField perField;
    final BytesRef[] sortedTerms;

    BufferedTerms(PerField perField) {
      this.perField = perField;
      this.sortedTerms = perField.terms.keySet().toArray(new BytesRef[0]);
      Arrays.sort(sortedTerms);
    }

    @Override
    public TermsEnum iterator() {
      return new BufferedTermsEnum(this);
    }

    @Override
    public long size() {
      return sortedTerms.length;
    }

    @Override
    public double getSumTotalWeight() {
      double sum = 0;
      for (PostingsList postings : perField.terms.values()) {
        for (int i = 0; i < postings.count; i++) {
          sum += postings.weights[i];
        }
      }
      return sum;
    }

    @Override
    public long getSumDocFreq() {
      long sum = 0;
      for (PostingsList postings : perField.terms.values()) {
        sum += postings.count;
      }
      return sum;
    }

    @Override
    public int getDocCount() {
      int maxDoc = 0;
      for (PostingsList postings : perField.terms.values()) {
        maxDoc = Math.max(maxDoc, postings.docs[postings.count - 1] + 1);
      }
      final FixedBitSet docs = new FixedBitSet(maxDoc);
      for (PostingsList postings : perField.terms.values()) {
        for (int i = 0; i < postings.count; i++) {
          docs.set(postings.docs[i]);
        }
      }
      return docs.cardinality();
    }

    @Override
    public boolean hasFreqs() {
      return perField.fieldInfo.getIndexOptions().hasFreqs();
    }

    @Override
    public boolean hasPositions() {
      return perField.fieldInfo.getIndexOptions().hasPositions();
    }

    @Override
    public boolean hasValues() {
      return perField.fieldInfo.getIndexOptions().hasPayloads();
    }
  }

  private static final class BufferedTermsEnum extends TermsEnum {
    final BufferedTerms terms;
    int ord = -1;

    BufferedTermsEnum(BufferedTerms terms) {
      this.terms = terms;
    }

    @Override
    public BytesRef next() {
      if (ord + 1 >= terms.sortedTerms.length) {
        ord = terms.sortedTerms.length;
        return null;
      }
      return terms.sortedTerms[++ord];
    }

    @Override
    public SeekStatus seekCeil(BytesRef text) {
      final int index = Arrays.binarySearch(terms.sortedTerms, text);
      if (index >= 0) {
        ord = index;
        return SeekStatus.FOUND;
      }
      ord = -index - 1;
      return ord == terms.sortedTerms.length ? SeekStatus.END : SeekStatus.NOT_FOUND;
    }

    @Override
    public BytesRef term() {
      return ord >= 0 && ord < terms.sortedTerms.length ? terms.sortedTerms[ord] : null;
    }

    @Override
    public TermInfo termInfo() {
      // the dictionary writer computes term infos while it writes postings
      throw new UnsupportedOperationException();
    }

    @Override
    public int docFreq() {
      return current().count;
    }

    @Override
    public float totalWeight() {
      final PostingsList postings = current();
      float sum = 0;
      for (int i = 0; i < postings.count; i++) {
        sum += postings.weights[i];
      }
      return sum;
    }

    @Override
    public PostingsEnum postings() {
      return new BufferedPostingsEnum(current());
    }

    private PostingsList current() {
      final BytesRef term = term();
      if (term == null) {
        throw new IllegalStateException("enum is not positioned on a term");
      }
      return terms.perField.terms.get(term);
    }
  }

  private static final class BufferedPostingsEnum extends PostingsEnum {
    final PostingsList postings;
    int upto = -1;
    int doc = -1;

    BufferedPostingsEnum(PostingsList postings) {
      this.postings = postings;
    }

    @Override
    public int docID() {
      return doc;
    }

    @Override
    public int nextDoc() {
      if (doc == NO_MORE_DOCS) {
        return NO_MORE_DOCS;
      }
      upto++;
      doc = upto < postings.count ? postings.docs[upto] : NO_MORE_DOCS;
      return doc;
    }

    @Override
    public int advance(int target) {
      while (doc < target) {
        nextDoc();
      }
      return doc;
    }

    @Override
    public long cost() {
      return postings.count;
    }

    @Override
    public float weight() {
      ensureActive();
      return postings.weights[upto];
    }

    @Override
    public int[] positions() {
      ensureActive();
      final int[] positions = postings.positions[upto];
      return positions == null ? super.positions() : positions;
    }

    @Override
    public BytesRef value() {
      ensureActive();
      return postings.values[upto];
    }
  }
}
