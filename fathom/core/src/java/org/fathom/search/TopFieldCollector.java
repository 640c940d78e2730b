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
import java.util.Comparator;

import org.fathom.index.BinaryColumn;
import org.fathom.index.LeafReader;
import org.fathom.index.LeafReaderContext;
import org.fathom.index.NumericColumn;
import org.fathom.util.BytesRef;
import org.fathom.util.PriorityQueue;

/**
 * A {@link Collector} that sorts by {@link SortField} using the values of
 * columns. Hits come back as {@link FieldDoc}s holding their sort values.
 *
 * @see IndexSearcher#search(Query,int,Sort)
 */
public final class TopFieldCollector extends TopDocsCollector<FieldDoc> {

  private final Sort sort;
  private final SortField[] fields;
  private final Comparator<FieldDoc> comparator;
  private final FieldDoc after;
  private final boolean needsScores;
  private int collectedHits;

  private TopFieldCollector(Sort sort, int numHits, FieldDoc after) {
    super(new FieldValueHitQueue(numHits, hitComparator(sort.getSort())));
    this.sort = sort;
    this.fields = sort.getSort();
    this.comparator = hitComparator(fields);
    this.after = after;
    this.needsScores = sort.needsScores();
    if (after != null && (after.fields == null || after.fields.length != fields.length)) {
      throw new IllegalArgumentException("after.fields has " + (after.fields == null ? 0 : after.fields.length)
          + " values but sort has " + fields.length);
    }
  }

  /**
   * Creates a new {@link TopFieldCollector} from the given
   * arguments.
   *
   * @param sort
   *          the sort criteria (SortFields).
   * @param numHits
   *          the number of results to collect.
   * @return a {@link TopFieldCollector} instance which will sort the results by
   *         the sort criteria.
   */
  public static TopFieldCollector create(Sort sort, int numHits) {
    return create(sort, numHits, null);
  }

  /**
   * Creates a new {@link TopFieldCollector} from the given
   * arguments.
   *
   * @param sort
   *          the sort criteria (SortFields).
   * @param numHits
   *          the number of results to collect.
   * @param after
   *          only hits after this FieldDoc will be collected
   * @return a {@link TopFieldCollector} instance which will sort the results by
   *         the sort criteria.
   */
  public static TopFieldCollector create(Sort sort, int numHits, FieldDoc after) {
    if (sort.getSort().length == 0) {
      throw new IllegalArgumentException("Sort must contain at least one field");
    }
    if (numHits <= 0) {
      throw new IllegalArgumentException("numHits must be > 0; please use TotalHitCountCollector if you just need the total hit count");
    }
    return new TopFieldCollector(sort, numHits, after);
  }

  @Override
  public LeafCollector getLeafCollector(LeafReaderContext context) throws IOException {
    final int docBase = context.docBase;
    final LeafReader reader = context.reader();
    final NumericColumn[] numericColumns = new NumericColumn[fields.length];
    final BinaryColumn[] binaryColumns = new BinaryColumn[fields.length];
    for (int i = 0; i < fields.length; i++) {
      if (fields[i].getType() == SortField.Type.LONG) {
        numericColumns[i] = reader.getNumericColumn(fields[i].getField());
      } else if (fields[i].getType() == SortField.Type.BINARY) {
        binaryColumns[i] = reader.getBinaryColumn(fields[i].getField());
      }
    }

    return new LeafCollector() {
      Scorable scorer;

      @Override
      public void setScorer(Scorable scorer) {
        this.scorer = scorer;
      }

      @Override
      public void collect(int doc) throws IOException {
        totalHits++;
        final float score = needsScores ? scorer.score() : Float.NaN;
        final Object[] values = new Object[fields.length];
        for (int i = 0; i < fields.length; i++) {
          switch (fields[i].getType()) {
            case SCORE:
              values[i] = score;
              break;
            case DOC:
              values[i] = docBase + doc;
              break;
            case LONG:
              values[i] = numericColumns[i] != null && numericColumns[i].exists(doc) ? numericColumns[i].get(doc) : null;
              break;
            case BINARY:
              values[i] = binaryColumns[i] != null && binaryColumns[i].exists(doc) ? BytesRef.deepCopyOf(binaryColumns[i].get(doc)) : null;
              break;
            default:
              throw new AssertionError();
          }
        }
        final FieldDoc hit = new FieldDoc(docBase + doc, score, values);
        if (after != null && comparator.compare(hit, after) <= 0) {
          // hit was collected on a previous page
          return;
        }
        collectedHits++;
        pq.insertWithOverflow(hit);
      }
    };
  }

  @Override
  protected int topDocsSize() {
    return Math.min(collectedHits, pq.size());
  }

  @Override
  protected TopDocs newTopDocs(ScoreDoc[] results, int start) {
    if (results == null) {
      results = new ScoreDoc[0];
    }
    return new TopDocs(totalHits, results);
  }

  @Override
  public boolean needsScores() {
    return needsScores;
  }

  /** The sort of this collector. */
  public Sort getSort() {
    return sort;
  }

  /** Orders hits by the sort fields, best first, then by ascending doc id. */
  static Comparator<FieldDoc> hitComparator(SortField[] fields) {
    return (a, b) -> {
      for (int i = 0; i < fields.length; i++) {
        final int cmp = compareValues(fields[i], a.fields[i], b.fields[i]);
        if (cmp != 0) {
          return cmp;
        }
      }
      return Integer.compare(a.doc, b.doc);
    };
  }

  private static int compareValues(SortField field, Object a, Object b) {
    if (a == null || b == null) {
      if (a == b) {
        return 0;
      }
      // missing values are placed regardless of the direction
      final int missing = field.getMissingLast() ? 1 : -1;
      return a == null ? missing : -missing;
    }
    final int cmp;
    switch (field.getType()) {
      case SCORE:
        // higher scores first
        cmp = Float.compare((Float) b, (Float) a);
        break;
      case DOC:
        cmp = Integer.compare((Integer) a, (Integer) b);
        break;
      case LONG:
        cmp = Long.compare((Long) a, (Long) b);
        break;
      case BINARY:
        cmp = ((BytesRef) a).compareTo((BytesRef) b);
        break;
      default:
        throw new AssertionError();
    }
    return field.getReverse() ? -cmp : cmp;
  }

  /** Keeps the best hits; the top of the queue is the least competitive one. */
  private static final class FieldValueHitQueue extends PriorityQueue<FieldDoc> {
    private final Comparator<FieldDoc> comparator;

    FieldValueHitQueue(int size, Comparator<FieldDoc> comparator) {
      super(size);
      this.comparator = comparator;
    }

    @Override
    protected boolean lessThan(FieldDoc a, FieldDoc b) {
      return comparator.compare(a, b) > 0;
    }
  }
}
