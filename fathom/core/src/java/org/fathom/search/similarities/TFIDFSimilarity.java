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
package org.fathom.search.similarities;


import org.fathom.search.CollectionStatistics;
import org.fathom.search.TermStatistics;

/**
 * Scores a document by the weight of the term in it times the inverse
 * document frequency of the term. Field lengths are ignored.
 */
public class TFIDFSimilarity extends Similarity {

  /** Implemented as <code>log(maxDoc/(docFreq+1)) + 1</code>. */
  protected float idf(long docFreq, long maxDoc) {
    return (float) (Math.log(maxDoc / (double) (docFreq + 1)) + 1.0);
  }

  @Override
  public SimScorer scorer(float boost, CollectionStatistics collectionStats, TermStatistics... termStats) {
    float idf = 0;
    for (TermStatistics stat : termStats) {
      idf += idf(stat.docFreq(), collectionStats.maxDoc());
    }
    final float weightedIdf = boost * idf;
    return new SimScorer() {
      @Override
      public float score(float weight, long fieldLength) {
        return weightedIdf * weight;
      }
    };
  }

  @Override
  public String toString() {
    return "TFIDF";
  }
}
