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

import org.fathom.index.BinaryColumn;
import org.fathom.index.LeafReaderContext;
import org.fathom.search.Scorable;
import org.fathom.util.BytesRef;

/**
 * A GroupSelector implementation that groups via the values of a binary
 * column. Documents without a value fall into the {@code null} group.
 */
public class ColumnGroupSelector extends GroupSelector<BytesRef> {

  private final String field;

  private BinaryColumn column;
  private BytesRef current;
  private Set<BytesRef> groups;

  /**
   * Create a new ColumnGroupSelector
   * @param field the binary column to group by
   */
  public ColumnGroupSelector(String field) {
    this.field = Objects.requireNonNull(field);
  }

  public String getField() {
    return field;
  }

  @Override
  public void setNextReader(LeafReaderContext readerContext) throws IOException {
    column = readerContext.reader().getBinaryColumn(field);
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
  public BytesRef currentValue() {
    return current;
  }

  @Override
  public BytesRef copyValue() {
    return current == null ? null : BytesRef.deepCopyOf(current);
  }

  @Override
  public void setGroups(Collection<BytesRef> groups) {
    this.groups = groups == null ? null : new HashSet<>(groups);
  }
}
