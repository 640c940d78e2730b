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

import org.fathom.index.LeafReaderContext;

/**
 * Keeps the {@code numHits} best scoring documents, best score first and
 * lower doc ID first among equal scores. Given the last hit of a previous
 * page, only hits ranking after it are kept, which is how
 * {@link IndexSearcher#searchAfter} pages through results.
 *
 * <p>Scores must be non-negative numbers; NaN is not supported.
 */
public final class TopScoreDocCollector extends TopDocsCollector<ScoreDoc> {

  /** Creates a collector keeping the top {@code numHits} hits. */
  public static TopScoreDocCollector create(int numHits) {
    return create(numHits, null);
  }

  /**
   * Creates a collector keeping the top {@code numHits} hits that rank
   * after {@code after}, or from the first hit if {@code after} is null.
   * The queue is pre-filled with {@code numHits} sentinel entries.
   */
  public static TopScoreDocCollector create(int numHits, ScoreDoc after) {
    if (numHits <= 0) {
      throw new IllegalArgumentException("numHits must be > 0, got " + numHits
          + "; use TotalHitCountCollector to only count hits");
    }
    return new TopScoreDocCollector(numHits, after);
  }

  private final ScoreDoc after;
  private ScoreDoc bottom;
  // hits that entered the queue; less than totalHits when paging
  private int queued;

  private TopScoreDocCollector(int numHits, ScoreDoc after) {
    super(new HitQueue(numHits, true));
    this.after = after;
    bottom = pq.top();
  }

  @Override
  public LeafCollector getLeafCollector(LeafReaderContext context) throws IOException {
    final int docBase = context.docBase;
    return new LeafCollector() {
      private Scorable scorer;

      @Override
      public void setScorer(Scorable scorer) {
        this.scorer = scorer;
      }

      @Override
      public void collect(int doc) throws IOException {
        float score = scorer.score();
        assert score >= 0 : "score=" + score;
        totalHits++;
        int globalDoc = docBase + doc;
        if (after != null && (score > after.score || (score == after.score && globalDoc <= after.doc))) {
          // already returned on an earlier page
          return;
        }
        // docs arrive in increasing order, so a tie with the bottom loses
        if (score <= bottom.score) {
          return;
        }
        queued++;
        bottom.doc = globalDoc;
        bottom.score = score;
        bottom = pq.updateTop();
      }
    };
  }

  @Override
  protected int topDocsSize() {
    return Math.min(queued, pq.size());
  }

  @Override
  protected TopDocs newTopDocs(ScoreDoc[] results, int start) {
    return new TopDocs(totalHits, results == null ? new ScoreDoc[0] : results);
  }

  @Override
  public boolean needsScores() {
    return true;
  }
}
