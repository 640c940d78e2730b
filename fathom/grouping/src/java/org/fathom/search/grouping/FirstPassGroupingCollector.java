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
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

import org.fathom.index.LeafReaderContext;
import org.fathom.search.Scorable;
import org.fathom.search.SimpleCollector;

/**
 * Keeps the best {@code topNGroups} groups of a search. A group ranks by
 * the highest score among its hits; between equal scores the group whose
 * best hit comes first in the index wins.
 *
 * @param <T> group value type, as produced by the {@link GroupSelector}
 */
public class FirstPassGroupingCollector<T> extends SimpleCollector {

  private static final Comparator<SearchGroup<?>> BY_RANK =
      Comparator.<SearchGroup<?>>comparingDouble(g -> -g.score).thenComparingInt(g -> g.topDoc);

  private final GroupSelector<T> groupSelector;
  private final int topNGroups;
  private final Map<T, SearchGroup<T>> byValue;
  private final TreeSet<SearchGroup<T>> ranked = new TreeSet<>(BY_RANK);

  private Scorable scorer;
  private int docBase;

  public FirstPassGroupingCollector(GroupSelector<T> groupSelector, int topNGroups) {
    this.groupSelector = Objects.requireNonNull(groupSelector);
    if (topNGroups < 1) {
      throw new IllegalArgumentException("topNGroups must be >= 1 (got " + topNGroups + ")");
    }
    this.topNGroups = topNGroups;
    this.byValue = new HashMap<>(topNGroups);
  }

  @Override
  public boolean needsScores() {
    return true;
  }

  /**
   * Copies of the kept groups in rank order, skipping the first
   * {@code groupOffset}; null when no group is left after the offset.
   */
  public Collection<SearchGroup<T>> getTopGroups(int groupOffset) {
    if (groupOffset < 0) {
      throw new IllegalArgumentException("groupOffset must be >= 0 (got " + groupOffset + ")");
    }
    if (ranked.size() <= groupOffset) {
      return null;
    }
    final List<SearchGroup<T>> result = new ArrayList<>(ranked.size() - groupOffset);
    ranked.stream().skip(groupOffset).forEach(g -> result.add(new SearchGroup<>(g.groupValue, g.score, g.topDoc)));
    return result;
  }

  @Override
  public void setScorer(Scorable scorer) throws IOException {
    this.scorer = scorer;
    groupSelector.setScorer(scorer);
  }

  @Override
  public void collect(int doc) throws IOException {
    if (groupSelector.advanceTo(doc) == GroupSelector.State.SKIP) {
      return;
    }
    final float score = scorer.score();
    final SearchGroup<T> existing = byValue.get(groupSelector.currentValue());
    if (existing != null) {
      if (score > existing.score) {
        rerank(existing, score, docBase + doc);
      }
    } else if (byValue.size() < topNGroups) {
      final SearchGroup<T> added = new SearchGroup<>(groupSelector.copyValue(), score, docBase + doc);
      byValue.put(added.groupValue, added);
      ranked.add(added);
    } else if (score > ranked.last().score) {
      // a tie never evicts: the later doc id would rank below the bottom anyway
      final SearchGroup<T> reused = ranked.pollLast();
      byValue.remove(reused.groupValue);
      reused.groupValue = groupSelector.copyValue();
      reused.score = score;
      reused.topDoc = docBase + doc;
      byValue.put(reused.groupValue, reused);
      ranked.add(reused);
    }
  }

  /** Moves {@code group} to its new place in the ranking. */
  private void rerank(SearchGroup<T> group, float score, int topDoc) {
    // the set locates entries by rank, so take it out before changing it
    ranked.remove(group);
    group.score = score;
    group.topDoc = topDoc;
    ranked.add(group);
  }

  @Override
  protected void doSetNextReader(LeafReaderContext readerContext) throws IOException {
    docBase = readerContext.docBase;
    groupSelector.setNextReader(readerContext);
  }

  public GroupSelector<T> getGroupSelector() {
    return groupSelector;
  }
}
