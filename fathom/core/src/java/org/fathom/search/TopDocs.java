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


/** Represents hits returned by {@link
 * IndexSearcher#search(Query,int)}. */
public class TopDocs {

  /** The total number of hits for the query. */
  public long totalHits;

  /** The top hits for the query. */
  public ScoreDoc[] scoreDocs;

  private final boolean partial;

  /** Constructs a TopDocs of a search that ran to completion. */
  public TopDocs(long totalHits, ScoreDoc[] scoreDocs) {
    this(totalHits, scoreDocs, false);
  }

  /** Constructs a TopDocs.
   * @param partial true if the search was terminated early */
  public TopDocs(long totalHits, ScoreDoc[] scoreDocs, boolean partial) {
    this.totalHits = totalHits;
    this.scoreDocs = scoreDocs;
    this.partial = partial;
  }

  /** True if the search stopped before collecting every matching document,
   *  for example because a time limit expired. {@link #totalHits} then only
   *  counts the documents seen. */
  public boolean isPartial() {
    return partial;
  }

  @Override
  public String toString() {
    return "TopDocs(totalHits=" + totalHits + ", hits=" + scoreDocs.length + (partial ? ", partial" : "") + ")";
  }
}
