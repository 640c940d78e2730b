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

/**
 * A {@link Scorable} which wraps a {@link Matcher} and caches the score of the
 * current document. Successive calls to {@link #score()} will return the same
 * result and will not invoke the matcher's score() method, unless the
 * current document has changed.<br>
 * Collectors receive this wrapper from {@link IndexSearcher}: a collector
 * chain may ask for the score of one document in several places.
 */
public final class ScoreCachingWrappingScorer extends Scorable {

  private int curDoc = -1;
  private float curScore;
  private final Matcher in;

  /** Creates a new instance by wrapping the given matcher. */
  public ScoreCachingWrappingScorer(Matcher matcher) {
    this.in = matcher;
  }

  @Override
  public float score() throws IOException {
    int doc = in.docID();
    if (doc != curDoc) {
      curScore = in.score();
      curDoc = doc;
    }

    return curScore;
  }

  @Override
  public int docID() {
    return in.docID();
  }
}
