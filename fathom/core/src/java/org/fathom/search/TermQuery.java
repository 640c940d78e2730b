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

import org.fathom.index.IndexReader;
import org.fathom.index.LeafReaderContext;
import org.fathom.index.Term;
import org.fathom.index.Terms;
import org.fathom.index.TermsEnum;
import org.fathom.search.similarities.Similarity;

/**
 * Matches the documents containing one term; the building block of most
 * parsed queries.
 */
public class TermQuery extends Query {

  private final Term term;

  public TermQuery(Term term) {
    this.term = Objects.requireNonNull(term);
  }

  public Term getTerm() {
    return term;
  }

  @Override
  public Weight createWeight(IndexSearcher searcher, boolean needsScores, float boost) throws IOException {
    return new TermWeight(searcher, needsScores, boost);
  }

  /** {@code field:text}, or just {@code text} when the field is the default one. */
  @Override
  public String toString(String field) {
    return term.field().equals(field) ? term.text() : term.field() + ":" + term.text();
  }

  @Override
  public boolean equals(Object other) {
    return sameClassAs(other) && term.equals(((TermQuery) other).term);
  }

  @Override
  public int hashCode() {
    return 31 * classHash() + term.hashCode();
  }

  final class TermWeight extends Weight {
    private final boolean present;
    private final Similarity.SimScorer scorer;

    TermWeight(IndexSearcher searcher, boolean needsScores, float boost) throws IOException {
      super(TermQuery.this);
      IndexReader reader = searcher.getIndexReader();
      int docFreq = reader.docFreq(term);
      present = docFreq > 0;
      String field = term.field();
      if (needsScores && present) {
        scorer = searcher.getSimilarity().scorer(boost, searcher.collectionStatistics(field),
            searcher.termStatistics(term, docFreq, reader.totalWeight(term)));
      } else {
        // placeholder statistics: scores are not used or nothing matches
        scorer = searcher.getSimilarity().scorer(boost, new CollectionStatistics(field, 1, 1, 1, 1, 1),
            new TermStatistics(term.bytes(), 1, 1));
      }
    }

    @Override
    public Matcher matcher(LeafReaderContext context) throws IOException {
      Terms terms = present ? context.reader().terms(term.field()) : null;
      if (terms == null) {
        return null;
      }
      TermsEnum termsEnum = terms.iterator();
      if (termsEnum.seekExact(term.bytes()) == false) {
        return null;
      }
      return new TermMatcher(this, termsEnum.postings(), scorer, context.reader(), term.field());
    }

    @Override
    public String toString() {
      return "weight(" + TermQuery.this + ")";
    }
  }
}
