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

import org.fathom.util.BytesRef;

/**
 * Contains statistics for a specific term.
 * <p>
 * This class holds statistics for this term across all documents for scoring purposes:
 * <ul>
 *   <li> {@link #docFreq()}: number of documents this term occurs in.
 *   <li> {@link #totalWeight()}: sum of the weights of the term over those documents.
 * </ul>
 *
 * @fathom.experimental
 */
public class TermStatistics {
  private final BytesRef term;
  private final long docFreq;
  private final double totalWeight;

  /**
   * Creates statistics instance for a term.
   * @param term Term bytes
   * @param docFreq number of documents containing the term in the collection.
   * @param totalWeight sum of the weights of the term in the collection.
   * @throws IllegalArgumentException if {@code docFreq} is not positive.
   */
  public TermStatistics(BytesRef term, long docFreq, double totalWeight) {
    Objects.requireNonNull(term);
    if (docFreq <= 0) {
      throw new IllegalArgumentException("docFreq must be positive, docFreq: " + docFreq);
    }
    this.term = term;
    this.docFreq = docFreq;
    this.totalWeight = totalWeight;
  }

  /** The term text. */
  public final BytesRef term() {
    return term;
  }

  /** The number of documents this term occurs in. */
  public final long docFreq() {
    return docFreq;
  }

  /** The sum of the weights of this term over the documents it occurs in. */
  public final double totalWeight() {
    return totalWeight;
  }

  @Override
  public String toString() {
    return "term=\"" + term.utf8ToString() + "\",docFreq=" + docFreq() + ",totalWeight=" + totalWeight();
  }
}
