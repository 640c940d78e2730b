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
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import org.fathom.index.LeafReaderContext;
import org.fathom.index.NumericColumn;
import org.fathom.search.Scorable;

/**
 * A GroupSelector implementation that groups via the values of a numeric
 * column. Documents without a value fall into the {@code null} group.
 */
public class NumericColumnGroupSelector extends GroupSelector<Long> {

  private final String field;

  private NumericColumn column;
  private Long current;
  private Set<Long> groups;

  public NumericColumnGroupSelector(String field) {
    this.field = Objects.requireNonNull(field);
  }

  public String getField() {
    return field;
  }

  @Override
  public void setNextReader(LeafReaderContext readerContext) throws IOException {
    column = readerContext.reader().getNumericColumn(field);
  }

  @Override
  public void setScorer(Scorable scorer) throws IOException { }

  @Override
  public State advanceTo(int doc) throws IOException {
    current = column != null && column.exists(doc) ? column.get(doc) : null;
    if (groups != null && groups.contains(current) == false) {
      return State.SKIP;
    }
    return State.ACCEPT;
  }

  @Override
  public Long currentValue() {
    return current;
  }

  @Override
  public Long copyValue() {
    // Long is immutable
    return current;
  }

  @Override
  public void setGroups(Collection<Long> groups) {
    this.groups = groups == null ? null : new HashSet<>(groups);
  }
}
