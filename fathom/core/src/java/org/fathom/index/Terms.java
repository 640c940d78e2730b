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
package org.fathom.index;


import java.io.IOException;

import org.fathom.util.BytesRef;

/**
 * Access to the terms in a specific field.  See {@link Fields}.
 * @fathom.experimental
 */
public abstract class Terms {

  /** Sole constructor. (For invocation by subclass
   *  constructors, typically implicit.) */
  protected Terms() {
  }

  /** Returns an iterator that will step through all
   *  terms. This method will not return null. */
  public abstract TermsEnum iterator() throws IOException;

  /**
   * Returns the info of {@code term}, or null if the field does not
   * contain it. Terms read from a single segment override this with a
   * lookup that loads one dictionary block.
   */
  public TermInfo get(BytesRef term) throws IOException {
    TermsEnum termsEnum = iterator();
    if (termsEnum.seekExact(term)) {
      return termsEnum.termInfo();
    }
    return null;
  }

  /**
   * Returns a lazy enum over the terms between {@code lowerTerm} and
   * {@code upperTerm}. A null bound is open. The enum is empty when no
   * term falls in the range.
   */
  public TermsEnum range(BytesRef lowerTerm, BytesRef upperTerm, boolean includeLower, boolean includeUpper) throws IOException {
    return new TermRangeTermsEnum(iterator(), lowerTerm, upperTerm, includeLower, includeUpper);
  }

  /** Returns a lazy enum over the terms starting with {@code prefix}. */
  public TermsEnum prefix(BytesRef prefix) throws IOException {
    if (prefix.length == 0) {
      return iterator();
    }
    return new PrefixTermsEnum(iterator(), prefix);
  }

  /** Returns the number of terms for this field. */
  public abstract long size() throws IOException;

  /** Returns the sum of {@link TermsEnum#totalWeight} for
   *  all terms in this field. */
  public abstract double getSumTotalWeight() throws IOException;

  /** Returns the sum of {@link TermsEnum#docFreq()} for
   *  all terms in this field. Note that, just like other term
   *  measures, this measure does not take deleted documents
   *  into account. */
  public abstract long getSumDocFreq() throws IOException;

  /** Returns the number of documents that have at least one
   *  term for this field. Note that, just like other term
   *  measures, this measure does not take deleted documents
   *  into account. */
  public abstract int getDocCount() throws IOException;

  /** Returns true if documents in this field store
   *  per-document weights. */
  public abstract boolean hasFreqs();

  /** Returns true if documents in this field store positions. */
  public abstract boolean hasPositions();

  /** Returns true if documents in this field store a value per posting. */
  public abstract boolean hasValues();

  /** Zero-length array of {@link Terms}. */
  public final static Terms[] EMPTY_ARRAY = new Terms[0];
}
