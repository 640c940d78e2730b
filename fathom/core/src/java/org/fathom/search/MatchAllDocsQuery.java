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
package org.fathom.search;


import java.io.IOException;
import java.util.Objects;

import org.fathom.index.LeafReader;
import org.fathom.index.LeafReaderContext;
import org.fathom.index.PostingsEnum;
import org.fathom.index.Terms;
import org.fathom.index.TermsEnum;
import org.fathom.util.FixedBitSet;

/**
 * A query that matches all documents, each with a score equal to the boost.
 * <p>
 * Given a field, only the documents holding at least one term in that field
 * match.
 */
public final class MatchAllDocsQuery extends Query {

  private final String field;

  /** Matches every document. */
  public MatchAllDocsQuery() {
    this(null);
  }

  /** Matches the documents with at least one term in {@code field}, or every
   *  document when {@code field} is null. */
  public MatchAllDocsQuery(String field) {
    this.field = field;
  }

  /** The field restricting the matches, or null. */
  public String getField() {
    return field;
  }

  @Override
  public Weight createWeight(IndexSearcher searcher, boolean needsScores, float boost) {
    return new Weight(this) {
      @Override
      public String toString() {
        return "weight(" + MatchAllDocsQuery.this + ")";
      }

      @Override
      public Matcher matcher(LeafReaderContext context) throws IOException {
        final LeafReader reader = context.reader();
        if (field == null) {
          return new EveryMatcher(this, boost, reader.maxDoc(), null);
        }
        final Terms terms = reader.terms(field);
        if (terms == null) {
          return null;
        }
        return new EveryMatcher(this, boost, reader.maxDoc(), docsWithTerms(terms, reader.maxDoc()));
      }
    };
  }

  private static FixedBitSet docsWithTerms(Terms terms, int maxDoc) throws IOException {
    final FixedBitSet docs = new FixedBitSet(maxDoc);
    final TermsEnum termsEnum = terms.iterator();
    while (termsEnum.next() != null) {
      final PostingsEnum postings = termsEnum.postings();
      for (int doc = postings.nextDoc(); doc != PostingsEnum.NO_MORE_DOCS; doc = postings.nextDoc()) {
        docs.set(doc);
      }
    }
    return docs;
  }

  @Override
  public String toString(String field) {
    return this.field == null ? "*:*" : this.field + ":*";
  }

  @Override
  public boolean equals(Object o) {
    return sameClassAs(o) && Objects.equals(field, ((MatchAllDocsQuery) o).field);
  }

  @Override
  public int hashCode() {
    return 31 * classHash() + Objects.hashCode(field);
  }
}
