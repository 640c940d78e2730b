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
import org.fathom.index.Term;
import org.fathom.index.Terms;
import org.fathom.index.TermsEnum;
import org.fathom.util.BytesRef;

/**
 * An abstract {@link Query} that matches documents
 * containing a subset of terms provided by a {@link
 * TermsEnum} enumeration.
 *
 * <p>This query cannot be used directly; you must subclass
 * it and define {@link #getTermsEnum} to provide a {@link
 * TermsEnum} that iterates through the terms to be
 * matched.
 *
 * <p>The query is rewritten into a {@link BooleanQuery} holding one
 * {@link BooleanClause.Occur#SHOULD} {@link TermQuery} per matching term of
 * the reader, so a document scores the sum of its matching terms' scores.
 * A query matching no term rewrites to {@link MatchNoDocsQuery}.
 */
public abstract class MultiTermQuery extends Query {
  protected final String field;

  /**
   * Constructs a query matching terms that cannot be represented with a single
   * Term.
   */
  public MultiTermQuery(final String field) {
    this.field = Objects.requireNonNull(field, "field must not be null");
  }

  /** Returns the field name for this query */
  public final String getField() { return field; }

  /** Construct the enumeration to be used, expanding the
   *  pattern term. */
  protected abstract TermsEnum getTermsEnum(Terms terms) throws IOException;

  @Override
  public final Query rewrite(IndexReader reader) throws IOException {
    final Terms terms = reader.terms(field);
    if (terms == null) {
      return new MatchNoDocsQuery("field \"" + field + "\" has no terms");
    }
    final BooleanQuery.Builder builder = new BooleanQuery.Builder();
    int count = 0;
    final TermsEnum termsEnum = getTermsEnum(terms);
    for (BytesRef term = termsEnum.next(); term != null; term = termsEnum.next()) {
      builder.add(new TermQuery(new Term(field, term)), BooleanClause.Occur.SHOULD);
      count++;
    }
    if (count == 0) {
      return new MatchNoDocsQuery("no terms of \"" + field + "\" match " + this);
    }
    return builder.build();
  }

  @Override
  public int hashCode() {
    return 31 * classHash() + field.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    return sameClassAs(other) &&
           field.equals(((MultiTermQuery) other).field);
  }
}
