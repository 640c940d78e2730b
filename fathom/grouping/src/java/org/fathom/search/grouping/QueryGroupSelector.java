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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.fathom.index.LeafReaderContext;
import org.fathom.search.DocIdSetIterator;
import org.fathom.search.IndexSearcher;
import org.fathom.search.Matcher;
import org.fathom.search.Query;
import org.fathom.search.Scorable;
import org.fathom.search.Weight;

/**
 * Groups by named queries: a document belongs to the first query, in the
 * order given, that matches it. Documents matched by none fall into the
 * {@code null} group.
 */
public class QueryGroupSelector extends GroupSelector<String> {

  private final String[] names;
  private final Weight[] weights;
  private final Matcher[] matchers;

  private String current;
  private Set<String> groups;

  /**
   * @param searcher the searcher whose leaves will be grouped
   * @param queries group name to query, in matching order
   */
  public QueryGroupSelector(IndexSearcher searcher, Map<String, ? extends Query> queries) throws IOException {
    names = new String[queries.size()];
    weights = new Weight[queries.size()];
    matchers = new Matcher[queries.size()];
    int i = 0;
    for (Map.Entry<String, ? extends Query> e : new LinkedHashMap<>(queries).entrySet()) {
      names[i] = e.getKey();
      weights[i] = searcher.createWeight(searcher.rewrite(e.getValue()), false, 1f);
      i++;
    }
  }

  /** Group names in matching order. */
  public List<String> getNames() {
    List<String> list = new ArrayList<>(names.length);
    for (String name : names) {
      list.add(name);
    }
    return list;
  }

  @Override
  public void setNextReader(LeafReaderContext readerContext) throws IOException {
    for (int i = 0; i < weights.length; i++) {
      matchers[i] = weights[i].matcher(readerContext);
    }
  }

  @Override
  public void setScorer(Scorable scorer) throws IOException { }

  @Override
  public State advanceTo(int doc) throws IOException {
    current = null;
    for (int i = 0; i < matchers.length; i++) {
      Matcher matcher = matchers[i];
      if (matcher == null) {
        continue;
      }
      if (matcher.docID() < doc) {
        matcher.advance(doc);
      }
      if (matcher.docID() == doc) {
        current = names[i];
        break;
      }
      if (matcher.docID() == DocIdSetIterator.NO_MORE_DOCS) {
        matchers[i] = null;
      }
    }
    if (groups != null && groups.contains(current) == false) {
      return State.SKIP;
    }
    return State.ACCEPT;
  }

  @Override
  public String currentValue() {
    return current;
  }

  @Override
  public String copyValue() {
    return current;
  }

  @Override
  public void setGroups(Collection<String> groups) {
    this.groups = groups == null ? null : new HashSet<>(groups);
  }
}
