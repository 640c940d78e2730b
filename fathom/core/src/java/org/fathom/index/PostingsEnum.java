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


import org.fathom.search.DocIdSetIterator;
import org.fathom.util.BytesRef;

/** Iterates through the postings of one term.
 *  NOTE: you must first call {@link #nextDoc} before using
 *  any of the per-doc methods. */
public abstract class PostingsEnum extends DocIdSetIterator {

  private static final int[] NO_POSITIONS = new int[0];

  /** Sole constructor. (For invocation by subclass
   *  constructors, typically implicit.) */
  protected PostingsEnum() {
  }

  /**
   * Returns the weight of the term in the current document: the sum of the
   * boosts of its occurrences, or 1 when the field records existence only.
   *
   * @throws IllegalStateException if this enum is not positioned on a document
   */
  public abstract float weight();

  /**
   * Returns the positions of the term in the current document, ascending.
   * Empty when the field records no positions.
   *
   * @throws IllegalStateException if this enum is not positioned on a document
   */
  public int[] positions() {
    ensureActive();
    return NO_POSITIONS;
  }

  /**
   * Returns the per-posting value of the current document, or null when
   * the field records none. For fields indexed with payloads the value
   * is an {@link Occurrences} encoding.
   *
   * @throws IllegalStateException if this enum is not positioned on a document
   */
  public BytesRef value() {
    ensureActive();
    return null;
  }
}
