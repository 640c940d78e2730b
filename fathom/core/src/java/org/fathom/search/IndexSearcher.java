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
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.fathom.document.Document;
import org.fathom.index.IndexReader;
import org.fathom.index.LeafReaderContext;
import org.fathom.index.Term;
import org.fathom.index.Terms;
import org.fathom.search.similarities.BM25Similarity;
import org.fathom.search.similarities.Similarity;
import org.fathom.util.Bits;

/**
 * Runs queries against one {@link IndexReader}.
 *
 * <p>A searcher sees the reader's point-in-time view: to search documents
 * committed later, reopen the reader with
 * {@link org.fathom.index.DirectoryReader#openIfChanged(org.fathom.index.DirectoryReader)}
 * and build a new searcher on it. Deleted documents are never collected.
 *
 * <p>Searchers hold no per-search state and may be shared by threads.
 */
public class IndexSearcher {

  private static final Similarity DEFAULT_SIMILARITY = new BM25Similarity();

  private final IndexReader reader;
  private final List<LeafReaderContext> leaves;
  private Similarity similarity = DEFAULT_SIMILARITY;

  /** The similarity searchers use unless told otherwise: BM25 with default parameters. */
  public static Similarity getDefaultSimilarity() {
    return DEFAULT_SIMILARITY;
  }

  public IndexSearcher(IndexReader reader) {
    this.reader = Objects.requireNonNull(reader);
    this.leaves = reader.leaves();
  }

  public IndexReader getIndexReader() {
    return reader;
  }

  /** Loads the stored fields of a document. */
  public Document doc(int docID) throws IOException {
    return reader.document(docID);
  }

  /** Loads the named stored fields of a document. */
  public Document doc(int docID, Set<String> fieldsToLoad) throws IOException {
    return reader.document(docID, fieldsToLoad);
  }

  public void setSimilarity(Similarity similarity) {
    this.similarity = Objects.requireNonNull(similarity);
  }

  public Similarity getSimilarity() {
    return similarity;
  }

  /**
   * Number of live documents matching {@code query}. Match-all queries and
   * single terms on an index without deletions are answered from statistics.
   */
  public int count(Query query) throws IOException {
    query = rewrite(query);
    while (query instanceof BoostQuery) {
      query = ((BoostQuery) query).getQuery();
    }
    if (query instanceof MatchAllDocsQuery && ((MatchAllDocsQuery) query).getField() == null) {
      return reader.numDocs();
    }
    if (query instanceof TermQuery && reader.hasDeletions() == false) {
      return reader.docFreq(((TermQuery) query).getTerm());
    }
    TotalHitCountCollector counter = new TotalHitCountCollector();
    search(query, counter);
    return counter.getTotalHits();
  }

  /** The {@code n} best scoring hits. */
  public TopDocs search(Query query, int n) throws IOException {
    return searchAfter(null, query, n);
  }

  /**
   * The {@code n} best scoring hits among the documents also matching
   * {@code filter}, which does not contribute to scores. A null filter
   * matches everything.
   */
  public TopDocs search(Query query, Query filter, int n) throws IOException {
    if (filter != null) {
      query = new BooleanQuery.Builder()
          .add(query, BooleanClause.Occur.MUST)
          .add(filter, BooleanClause.Occur.FILTER)
          .build();
    }
    return search(query, n);
  }

  /**
   * The {@code numHits} best scoring hits ranking after {@code after}, the
   * last hit of the previous page, or from the top if it is null.
   */
  public TopDocs searchAfter(ScoreDoc after, Query query, int numHits) throws IOException {
    checkNumHits(numHits);
    TopScoreDocCollector collector = TopScoreDocCollector.create(cappedNumHits(numHits), after);
    boolean complete = search(query, collector);
    return withCompleteness(collector.topDocs(), complete);
  }

  /**
   * The first {@code n} hits in {@code sort} order. Hits are {@link FieldDoc}s
   * whose score is NaN unless the sort uses scores.
   */
  public TopDocs search(Query query, int n, Sort sort) throws IOException {
    return searchAfter(null, query, n, sort);
  }

  /** Sorted paging: {@code after} must be a {@link FieldDoc} from the previous page, or null. */
  public TopDocs searchAfter(ScoreDoc after, Query query, int numHits, Sort sort) throws IOException {
    if (after != null && (after instanceof FieldDoc) == false) {
      throw new IllegalArgumentException("after must be a FieldDoc, got " + after);
    }
    checkNumHits(numHits);
    TopFieldCollector collector = TopFieldCollector.create(sort, cappedNumHits(numHits), (FieldDoc) after);
    boolean complete = search(query, collector);
    return withCompleteness(collector.topDocs(), complete);
  }

  /**
   * Page {@code pageNum}, counting from 1, of the scored hits with
   * {@code pageLen} hits per page. Asking past the end yields the last page.
   */
  public ResultsPage searchPage(Query query, int pageNum, int pageLen) throws IOException {
    if (pageNum < 1) {
      throw new IllegalArgumentException("pageNum must be >= 1, got " + pageNum);
    }
    if (pageLen < 1) {
      throw new IllegalArgumentException("pageLen must be >= 1, got " + pageLen);
    }
    int numHits = (int) Math.min((long) pageNum * pageLen, Math.max(1, reader.maxDoc()));
    TopScoreDocCollector collector = TopScoreDocCollector.create(numHits);
    boolean complete = search(query, collector);
    return new ResultsPage(withCompleteness(collector.topDocs(), complete), pageNum, pageLen);
  }

  /**
   * Feeds every live document matching {@code query} to {@code collector}.
   *
   * @return false if the collector ended the search early by throwing
   *         {@link EarlyTerminationException}
   */
  public boolean search(Query query, Collector collector) throws IOException {
    Weight weight = createWeight(rewrite(query), collector.needsScores(), 1f);
    return search(leaves, weight, collector);
  }

  /** Collects the matches of {@code weight} in the given leaves, in order. */
  protected boolean search(List<LeafReaderContext> leaves, Weight weight, Collector collector) throws IOException {
    try {
      for (LeafReaderContext leaf : leaves) {
        LeafCollector leafCollector = collector.getLeafCollector(leaf);
        Matcher matcher = weight.matcher(leaf);
        if (matcher == null) {
          continue;
        }
        leafCollector.setScorer(new ScoreCachingWrappingScorer(matcher));
        Bits live = leaf.reader().getLiveDocs();
        for (int doc = matcher.nextDoc(); doc != DocIdSetIterator.NO_MORE_DOCS; doc = matcher.nextDoc()) {
          if (live == null || live.get(doc)) {
            leafCollector.collect(doc);
          }
        }
      }
    } catch (EarlyTerminationException e) {
      return false;
    }
    return true;
  }

  /** Rewrites {@code query} until it no longer changes. */
  public Query rewrite(Query query) throws IOException {
    Query rewritten = query.rewrite(reader);
    while (rewritten != query) {
      query = rewritten;
      rewritten = query.rewrite(reader);
    }
    return query;
  }

  public Weight createWeight(Query query, boolean needsScores, float boost) throws IOException {
    return query.createWeight(this, needsScores, boost);
  }

  /** Statistics of one term for scoring; {@code docFreq} is at least 1. */
  public TermStatistics termStatistics(Term term, int docFreq, double totalWeight) {
    return new TermStatistics(term.bytes(), docFreq, totalWeight);
  }

  /** Field-wide statistics for scoring, or null if no document has terms in {@code field}. */
  public CollectionStatistics collectionStatistics(String field) throws IOException {
    assert field != null;
    long docCount = 0;
    long sumDocFreq = 0;
    long sumFieldLength = 0;
    double sumTotalWeight = 0;
    for (LeafReaderContext leaf : leaves) {
      Terms terms = leaf.reader().terms(field);
      if (terms != null) {
        docCount += terms.getDocCount();
        sumDocFreq += terms.getSumDocFreq();
        sumTotalWeight += terms.getSumTotalWeight();
        sumFieldLength += leaf.reader().totalFieldLength(field);
      }
    }
    return docCount == 0
        ? null
        : new CollectionStatistics(field, reader.maxDoc(), docCount, sumTotalWeight, sumDocFreq, sumFieldLength);
  }

  @Override
  public String toString() {
    return "IndexSearcher(" + reader + ")";
  }

  private static void checkNumHits(int numHits) {
    if (numHits <= 0) {
      throw new IllegalArgumentException("numHits must be > 0, got " + numHits);
    }
  }

  // queues never need more entries than the index has documents
  private int cappedNumHits(int numHits) {
    return Math.min(numHits, Math.max(1, reader.maxDoc()));
  }

  private static TopDocs withCompleteness(TopDocs topDocs, boolean complete) {
    return complete ? topDocs : new TopDocs(topDocs.totalHits, topDocs.scoreDocs, true);
  }
}
