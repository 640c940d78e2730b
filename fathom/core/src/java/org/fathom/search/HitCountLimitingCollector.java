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
 * Wraps a {@link Collector} and stops the search once it has passed
 * {@code limit} hits to it. The search only counts as terminated early when
 * a hit beyond the limit exists: an {@link EarlyTerminationException} is
 * thrown on the first such hit.
 */
public class HitCountLimitingCollector implements Collector {

  private final Collector collector;
  private final int limit;
  private int count;

  /**
   * @param collector the wrapped collector
   * @param limit the number of hits to collect, at least 1
   */
  public HitCountLimitingCollector(Collector collector, int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1, got " + limit);
    }
    this.collector = collector;
    this.limit = limit;
  }

  /** Number of hits passed to the wrapped collector. */
  public int getCount() {
    return count;
  }

  @Override
  public LeafCollector getLeafCollector(LeafReaderContext context) throws IOException {
    final LeafCollector in = collector.getLeafCollector(context);
    return new LeafCollector() {
      @Override
      public void setScorer(Scorable scorer) throws IOException {
        in.setScorer(scorer);
      }

      @Override
      public void collect(int doc) throws IOException {
        if (count >= limit) {
          throw new EarlyTerminationException("hit count limit of " + limit + " reached");
        }
        count++;
        in.collect(doc);
      }
    };
  }

  @Override
  public boolean needsScores() {
    return collector.needsScores();
  }
}
