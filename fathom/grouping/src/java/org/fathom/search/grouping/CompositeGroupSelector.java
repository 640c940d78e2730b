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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.fathom.index.LeafReaderContext;
import org.fathom.search.Scorable;

/**
 * Groups by the combination of several selectors. The group value lists
 * the value of each selector in order, {@code null} for a selector that
 * has none, so the value itself is never null. A document skipped by any
 * selector is skipped.
 */
public class CompositeGroupSelector extends GroupSelector<List<Object>> {

  private final GroupSelector<?>[] selectors;
  private final Object[] values;
  private final List<Object> current;
  private Set<List<Object>> groups;

  public CompositeGroupSelector(GroupSelector<?>... selectors) {
    if (selectors.length == 0) {
      throw new IllegalArgumentException("at least one selector is required");
    }
    this.selectors = selectors.clone();
    this.values = new Object[selectors.length];
    this.current = Collections.unmodifiableList(Arrays.asList(values));
  }

  @Override
  public void setNextReader(LeafReaderContext readerContext) throws IOException {
    for (GroupSelector<?> selector : selectors) {
      selector.setNextReader(readerContext);
    }
  }

  @Override
  public void setScorer(Scorable scorer) throws IOException {
    for (GroupSelector<?> selector : selectors) {
      selector.setScorer(scorer);
    }
  }

  @Override
  public State advanceTo(int doc) throws IOException {
    State state = State.ACCEPT;
    for (int i = 0; i < selectors.length; i++) {
      if (selectors[i].advanceTo(doc) == State.SKIP) {
        state = State.SKIP;
      }
      values[i] = selectors[i].currentValue();
    }
    if (state == State.ACCEPT && groups != null && groups.contains(current) == false) {
      return State.SKIP;
    }
    return state;
  }

  @Override
  public List<Object> currentValue() {
    return current;
  }

  @Override
  public List<Object> copyValue() throws IOException {
    List<Object> copy = new ArrayList<>(selectors.length);
    for (GroupSelector<?> selector : selectors) {
      copy.add(selector.copyValue());
    }
    return Collections.unmodifiableList(copy);
  }

  @Override
  public void setGroups(Collection<List<Object>> groups) {
    this.groups = groups == null ? null : new HashSet<>(groups);
  }
}
