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
package org.fathom.search.grouping;

import java.io.IOException;
import java.util.Collection;

import org.fathom.index.LeafReaderContext;
import org.fathom.search.Scorable;

/**
 * Assigns each hit of a search to a group. Collectors call
 * {@link #setNextReader(LeafReaderContext)} once per segment and then
 * {@link #advanceTo(int)} for every hit of that segment, in increasing
 * doc id order.
 *
 * @param <T> the type of the group value
 */
public abstract class GroupSelector<T> {

  /** Whether the current document is grouped or left out. */
  public enum State { SKIP, ACCEPT }

  public abstract void setNextReader(LeafReaderContext readerContext) throws IOException;

  public abstract void setScorer(Scorable scorer) throws IOException;

  /** Moves to {@code doc} of the current segment. */
  public abstract State advanceTo(int doc) throws IOException;

  /**
   * Group of the current document, or null if it has none. The returned
   * object may be reused by the next {@link #advanceTo(int)}; keep
   * {@link #copyValue()} instead.
   */
  public abstract T currentValue() throws IOException;

  /** A copy of {@link #currentValue()} that stays valid. */
  public abstract T copyValue() throws IOException;

  /**
   * Limits grouping to the given values: documents in any other group
   * make {@link #advanceTo(int)} return {@link State#SKIP}. Null lifts
   * the limit.
   */
  public abstract void setGroups(Collection<T> groups);
}
