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

import org.fathom.index.IndexReader;
import org.fathom.index.LeafReaderContext;

/**
 * Expert: Calculate query weights and build query matchers.
 * <p>
 * The purpose of {@link Weight} is to ensure searching does not modify a
 * {@link Query}, so that a {@link Query} instance can be reused.
 * <p>
 * {@link IndexSearcher} dependent state of the query should reside in the
 * {@link Weight}: term statistics and the similarity scorer are computed
 * once, when the weight is created.
 * <p>
 * {@link LeafReader} dependent state should reside in the {@link Matcher}.
 * <p>
 * Since {@link Weight} creates {@link Matcher} instances for a given
 * {@link LeafReaderContext} ({@link #matcher(LeafReaderContext)})
 * callers must maintain the relationship between the searcher's top-level
 * {@link IndexReader} and the context used to create a {@link Matcher}.
 */
public abstract class Weight {

  protected final Query parentQuery;

  /** Sole constructor, typically invoked by sub-classes.
   * @param query         the parent query
   */
  protected Weight(Query query) {
    this.parentQuery = query;
  }

  /** The query that this concerns. */
  public final Query getQuery() {
    return parentQuery;
  }

  /**
   * Returns a {@link Matcher} which iterates over the matching documents of
   * the leaf, or null if no document of the leaf can match. Deleted
   * documents are not filtered out: the searcher does that.
   *
   * @param context
   *          the {@link LeafReaderContext} for which to return the {@link Matcher}.
   *
   * @return a {@link Matcher} which scores documents in/out-of order.
   * @throws IOException if there is a low-level I/O error
   */
  public abstract Matcher matcher(LeafReaderContext context) throws IOException;
}
