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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.fathom.index.LeafReaderContext;
import org.fathom.search.Scorable;
import org.fathom.search.SimpleCollector;

/**
 * Sorts every hit into a bucket per group value. Within a bucket the
 * global doc ids are kept in the order they were collected; buckets are
 * ordered by their first hit. Hits without a value go to the {@code null}
 * bucket unless {@code includeMissing} is false.
 *
 * @param <T> the type of the group value
 */
public class FacetCollector<T> extends SimpleCollector {

  private final GroupSelector<T> groupSelector;
  private final boolean includeMissing;
  private final Map<T, List<Integer>> groups = new LinkedHashMap<>();

  private int docBase;
  private long totalHits;

  public FacetCollector(GroupSelector<T> groupSelector) {
    this(groupSelector, true);
  }

  public FacetCollector(GroupSelector<T> groupSelector, boolean includeMissing) {
    this.groupSelector = Objects.requireNonNull(groupSelector);
    this.includeMissing = includeMissing;
  }

  @Override
  public boolean needsScores() {
    return false;
  }

  @Override
  protected void doSetNextReader(LeafReaderContext context) throws IOException {
    docBase = context.docBase;
    groupSelector.setNextReader(context);
  }

  @Override
  public void setScorer(Scorable scorer) throws IOException {
    groupSelector.setScorer(scorer);
  }

  @Override
  public void collect(int doc) throws IOException {
    if (groupSelector.advanceTo(doc) == GroupSelector.State.SKIP) {
      return;
    }
    final T value = groupSelector.currentValue();
    if (value == null && includeMissing == false) {
      return;
    }
    totalHits++;
    List<Integer> docs = groups.get(value);
    if (docs == null) {
      docs = new ArrayList<>();
      groups.put(groupSelector.copyValue(), docs);
    }
    docs.add(docBase + doc);
  }

  /** Group value to the global ids of its hits. */
  public Map<T, List<Integer>> getGroups() {
    return Collections.unmodifiableMap(groups);
  }

  /** Group value to its number of hits. */
  public Map<T, Integer> getGroupCounts() {
    final Map<T, Integer> counts = new LinkedHashMap<>();
    for (Map.Entry<T, List<Integer>> e : groups.entrySet()) {
      counts.put(e.getKey(), e.getValue().size());
    }
    return counts;
  }

  /** Number of hits put in a bucket. */
  public long getTotalHits() {
    return totalHits;
  }

  public GroupSelector<T> getGroupSelector() {
    return groupSelector;
  }
}
