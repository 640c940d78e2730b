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


import java.util.Objects;

/**
 * Contains statistics for a collection (field).
 * <p>
 * This class holds statistics across all documents for scoring purposes:
 * <ul>
 *   <li> {@link #maxDoc()}: number of documents.
 *   <li> {@link #docCount()}: number of documents that contain this field.
 *   <li> {@link #sumTotalWeight()}: number of tokens in the field, as the sum of the term weights.
 *   <li> {@link #sumDocFreq()}: number of postings-list entries.
 *   <li> {@link #sumFieldLength()}: sum of the lengths of the field over all documents.
 * </ul>
 * <p>
 * The statistics count deleted documents until they are merged away.
 *
 * @fathom.experimental
 */
public class CollectionStatistics {
  private final String field;
  private final long maxDoc;
  private final long docCount;
  private final double sumTotalWeight;
  private final long sumDocFreq;
  private final long sumFieldLength;

  /**
   * Creates statistics instance for a collection (field).
   * @param field Field's name
   * @param maxDoc total number of documents.
   * @param docCount number of documents containing the field.
   * @param sumTotalWeight sum of the weights of all terms of the field.
   * @param sumDocFreq number of postings list entries.
   * @param sumFieldLength sum of the field's lengths.
   * @throws IllegalArgumentException if {@code maxDoc} is negative or
   *         {@code docCount} is not within {@code [0, maxDoc]}.
   */
  public CollectionStatistics(String field, long maxDoc, long docCount, double sumTotalWeight, long sumDocFreq, long sumFieldLength) {
    Objects.requireNonNull(field);
    if (maxDoc < 0) {
      throw new IllegalArgumentException("maxDoc must be positive, maxDoc: " + maxDoc);
    }
    if (docCount < 0 || docCount > maxDoc) {
      throw new IllegalArgumentException("docCount must be in [0, maxDoc], docCount: " + docCount + ", maxDoc: " + maxDoc);
    }
    if (sumDocFreq < docCount) {
      throw new IllegalArgumentException("sumDocFreq must be at least docCount, sumDocFreq: " + sumDocFreq + ", docCount: " + docCount);
    }
    this.field = field;
    this.maxDoc = maxDoc;
    this.docCount = docCount;
    this.sumTotalWeight = sumTotalWeight;
    this.sumDocFreq = sumDocFreq;
    this.sumFieldLength = sumFieldLength;
  }

  /** The field's name. */
  public final String field() {
    return field;
  }

  /** The total number of documents, regardless of whether they all contain values for this field. */
  public final long maxDoc() {
    return maxDoc;
  }

  /** The total number of documents that have at least one term for this field. */
  public final long docCount() {
    return docCount;
  }

  /** The sum of the weights of all terms of this field. */
  public final double sumTotalWeight() {
    return sumTotalWeight;
  }

  /** The total number of posting list entries for this field. */
  public final long sumDocFreq() {
    return sumDocFreq;
  }

  /** The sum of the lengths of this field over all documents. */
  public final long sumFieldLength() {
    return sumFieldLength;
  }

  @Override
  public String toString() {
    return "field=\"" + field() + "\",maxDoc=" + maxDoc() + ",docCount=" + docCount()
        + ",sumTotalWeight=" + sumTotalWeight() + ",sumDocFreq=" + sumDocFreq() + ",sumFieldLength=" + sumFieldLength;
  }
}
